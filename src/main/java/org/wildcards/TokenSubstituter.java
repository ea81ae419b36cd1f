package org.wildcards;

import java.util.BitSet;

import org.wildcards.utils.EscapeScanner;

import com.google.common.base.CharMatcher;

/**
 * Second conversion pass: rewrites unescaped wildcard tokens into regex atoms.
 *
 * A token preceded by an even number of backslashes is replaced, the
 * backslashes in front of it are kept as they are. A run of "any" tokens
 * collapses into a single any-atom. Escaped tokens are copied unchanged.
 */
public final class TokenSubstituter
{
	/**
	 * Token grammars. At most one of them applies to a conversion.
	 */
	public enum Grammar
	{
		JOKERS('?', '*'),
		SQL('_', '%');

		private final char single;
		private final char any;

		Grammar(char single, char any)
		{
			this.single = single;
			this.any = any;
		}

		String getTokens()
		{
			return new String(new char[] {single, any});
		}

		/**
		 * Grammar enabled by a configuration, jokers winning over SQL, or null
		 * when neither is enabled.
		 */
		public static Grammar of(WildcardsConfig config)
		{
			if (config.has(Feature.JOKERS))
				return JOKERS;
			if (config.has(Feature.SQL))
				return SQL;
			return null;
		}
	}

	private TokenSubstituter() {}

	public static String substitute(String wildcard, Grammar grammar, CapturePolicy policy)
	{
		BitSet singles = EscapeScanner.unescaped(wildcard, CharMatcher.is(grammar.single));
		BitSet anys = EscapeScanner.unescaped(wildcard, CharMatcher.is(grammar.any));

		if (singles.isEmpty() && anys.isEmpty())
			return wildcard;

		StringBuilder sb = new StringBuilder(wildcard.length() + 8);
		int i = 0;
		while (i < wildcard.length())
		{
			if (singles.get(i))
			{
				sb.append(policy.getSingleAtom());
				i++;
			}
			else if (anys.get(i))
			{
				sb.append(policy.getAnyAtom());
				// the rest of the run follows a token, never a backslash
				while (i < wildcard.length() && wildcard.charAt(i) == grammar.any)
					i++;
			}
			else
			{
				sb.append(wildcard.charAt(i));
				i++;
			}
		}

		return sb.toString();
	}
}
