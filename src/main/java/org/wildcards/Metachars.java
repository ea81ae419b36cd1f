package org.wildcards;

import com.google.common.base.CharMatcher;

/**
 * Character classes shared by the conversion passes.
 */
final class Metachars
{
	private Metachars() {}
	
	// Unicode \w: alphabetic, marks, decimal digits, connector punctuation and join controls
	static final CharMatcher WORD = CharMatcher.forPredicate(Metachars::isWordChar)
		.or(CharMatcher.anyOf("\u200C\u200D"))
		.precomputed();
	
	static final CharMatcher WHITESPACE = CharMatcher.whitespace();
	
	static final CharMatcher BACKSLASH = CharMatcher.is('\\');
	
	// halves of supplementary code points, never split by an inserted backslash
	static final CharMatcher SURROGATE = CharMatcher.inRange(Character.MIN_SURROGATE, Character.MAX_SURROGATE);
	
	static final CharMatcher BRACKET_DELIMITERS = CharMatcher.anyOf("{},");
	
	static final CharMatcher COMMA = CharMatcher.is(',');
	
	private static boolean isWordChar(char c)
	{
		if (Character.isAlphabetic(c) || Character.isDigit(c))
			return true;
		
		switch (Character.getType(c))
		{
			case Character.NON_SPACING_MARK:
			case Character.ENCLOSING_MARK:
			case Character.COMBINING_SPACING_MARK:
			case Character.CONNECTOR_PUNCTUATION:
				return true;
			default:
				return false;
		}
	}
}
