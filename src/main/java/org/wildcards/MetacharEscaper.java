package org.wildcards;

import java.util.BitSet;

import org.wildcards.utils.EscapeScanner;

import com.google.common.base.CharMatcher;

/**
 * First conversion pass: protects everything the host regex engine could
 * interpret but the active wildcard grammar does not.
 *
 * Every unescaped character that is neither a word character, whitespace, a
 * backslash nor one of the configuration's exemptions gets a backslash in
 * front of it. Escape runs that protect nothing (an odd backslash run before a
 * word character, whitespace or the end of the string) are doubled so that
 * they stand for literal backslashes.
 */
public final class MetacharEscaper
{
	private MetacharEscaper() {}

	public static String escape(String wildcard, WildcardsConfig config)
	{
		CharMatcher kept = Metachars.WORD
			.or(Metachars.WHITESPACE)
			.or(Metachars.BACKSLASH)
			.or(Metachars.SURROGATE)
			.or(config.getExempted());

		BitSet special = EscapeScanner.unescaped(wildcard, kept.negate());
		BitSet dangling = EscapeScanner.danglingEscapes(wildcard, inert(TokenSubstituter.Grammar.of(config)));

		if (special.isEmpty() && dangling.isEmpty())
			return wildcard;

		StringBuilder sb = new StringBuilder(wildcard.length() + special.cardinality() + dangling.cardinality());
		for (int i = 0; i < wildcard.length(); i++)
		{
			if (special.get(i) || dangling.get(i))
				sb.append(EscapeScanner.BACKSLASH);
			sb.append(wildcard.charAt(i));
		}

		return sb.toString();
	}

	/**
	 * Characters an escape run cannot meaningfully protect. Under the SQL
	 * grammar {@code _} is a token, so {@code \_} is a real escape.
	 */
	static CharMatcher inert(TokenSubstituter.Grammar grammar)
	{
		CharMatcher word = Metachars.WORD;
		if (grammar != null)
			word = word.and(CharMatcher.noneOf(grammar.getTokens()));

		return word.or(Metachars.WHITESPACE).or(Metachars.SURROGATE);
	}
}
