package org.wildcards.utils;

import java.util.BitSet;

import com.google.common.base.CharMatcher;

/**
 * Backslash parity classifier shared by every conversion pass.
 *
 * A character is escaped iff it is immediately preceded by an odd number of
 * consecutive backslashes. A run of 2n backslashes stands for n literal
 * backslashes and leaves the following character unescaped.
 *
 * All methods make one forward pass over the input and report positions as a
 * {@link BitSet}, so callers can rewrite the text in a second forward pass
 * without ever looking at their own output.
 */
public final class EscapeScanner
{
	public static final char BACKSLASH = '\\';

	private EscapeScanner() {}

	/**
	 * Finds every position holding a character matched by {@code target} that
	 * is not escaped. A backslash itself is reported when it opens a new
	 * escape run, i.e. when the run before it has even length.
	 */
	public static BitSet unescaped(CharSequence s, CharMatcher target)
	{
		return unescaped(s, 0, s.length(), target);
	}

	/**
	 * Same as {@link #unescaped(CharSequence, CharMatcher)} restricted to
	 * {@code [from, to)}. Position {@code from} must not be inside a backslash
	 * run, otherwise parity is counted from the wrong place.
	 */
	public static BitSet unescaped(CharSequence s, int from, int to, CharMatcher target)
	{
		BitSet result = new BitSet(to);
		int run = 0;

		for (int i = from; i < to; i++)
		{
			char c = s.charAt(i);
			if (run % 2 == 0 && target.matches(c))
				result.set(i);

			run = (c == BACKSLASH) ? run + 1 : 0;
		}

		return result;
	}

	/**
	 * Finds escape runs that protect nothing: an odd run of backslashes
	 * followed by a character matched by {@code inert} or by the end of the
	 * string. The position reported is the first backslash of the run; one
	 * more backslash inserted there turns the whole run into literal
	 * backslashes.
	 */
	public static BitSet danglingEscapes(CharSequence s, CharMatcher inert)
	{
		BitSet result = new BitSet(s.length());
		int run = 0;

		for (int i = 0; i < s.length(); i++)
		{
			char c = s.charAt(i);
			if (c == BACKSLASH)
			{
				run++;
				continue;
			}

			if (run % 2 == 1 && inert.matches(c))
				result.set(i - run);
			run = 0;
		}

		if (run % 2 == 1)
			result.set(s.length() - run);

		return result;
	}

	/**
	 * Returns true when {@code s} contains at least one unescaped character
	 * matched by {@code target}.
	 */
	public static boolean containsUnescaped(CharSequence s, CharMatcher target)
	{
		int run = 0;

		for (int i = 0; i < s.length(); i++)
		{
			char c = s.charAt(i);
			if (run % 2 == 0 && target.matches(c))
				return true;

			run = (c == BACKSLASH) ? run + 1 : 0;
		}

		return false;
	}
}
