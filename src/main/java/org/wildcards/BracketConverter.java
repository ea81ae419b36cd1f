package org.wildcards;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import org.wildcards.BracketExtractor.BracketSpan;
import org.wildcards.utils.EscapeScanner;

/**
 * Turns {@code {a,b}} blocks and comma lists into regex alternations.
 */
public final class BracketConverter
{
	private static final String CLOSE = ")";
	private static final char ALTERNATION = '|';

	private BracketConverter() {}

	/**
	 * Converts every balanced top-level span of {@code s}, from the outside in
	 * and left to right, and copies the text between spans unchanged. Once no
	 * more span can be extracted, every unescaped {@code {}, {@code }} or
	 * {@code ,} left in the result is escaped: those are the delimiters that
	 * never took part in a balanced span.
	 */
	public static String convertBracketed(String s, CapturePolicy policy)
	{
		StringBuilder re = new StringBuilder(s.length() + 16);
		int cursor = 0;

		BracketSpan span;
		while ((span = BracketExtractor.extract(s, cursor)) != null)
		{
			re.append(s, cursor, span.getOpen());
			convertBracket(s, span, policy, re);
			cursor = span.getEnd();
		}
		re.append(s, cursor, s.length());

		return escapeDelimiters(re.toString());
	}

	/**
	 * Appends the alternation group of one balanced span to {@code re}.
	 * Nested spans become nested groups and unescaped commas become
	 * {@code |}. Nesting is tracked on an explicit stack, one buffer per open
	 * group, so the depth of the input never reaches the call stack.
	 */
	static void convertBracket(String s, BracketSpan span, CapturePolicy policy, StringBuilder re)
	{
		int from = span.getOpen() + 1;
		int to = span.getClose();
		BitSet delimiters = EscapeScanner.unescaped(s, from, to, Metachars.BRACKET_DELIMITERS);

		Deque<StringBuilder> groups = new ArrayDeque<>();
		groups.push(new StringBuilder());

		for (int i = from; i < to; i++)
		{
			char c = s.charAt(i);
			if (!delimiters.get(i))
			{
				groups.peek().append(c);
				continue;
			}

			switch (c)
			{
				case '{':
					groups.push(new StringBuilder());
					break;
				case '}':
					StringBuilder inner = groups.pop();
					groups.peek().append(policy.getBracketOpen()).append(inner).append(CLOSE);
					break;
				default:
					groups.peek().append(ALTERNATION);
			}
		}

		// spans are balanced, only the outermost group is left
		re.append(policy.getBracketOpen()).append(groups.pop()).append(CLOSE);
	}

	/**
	 * Replaces every unescaped comma of {@code s} with {@code |}.
	 */
	public static String convertCommas(String s)
	{
		BitSet commas = EscapeScanner.unescaped(s, Metachars.COMMA);
		if (commas.isEmpty())
			return s;

		StringBuilder sb = new StringBuilder(s);
		for (int i = commas.nextSetBit(0); i >= 0; i = commas.nextSetBit(i + 1))
			sb.setCharAt(i, ALTERNATION);

		return sb.toString();
	}

	/**
	 * Wraps the whole of {@code s} in one alternation group when it holds at
	 * least one unescaped comma, otherwise returns it unchanged.
	 */
	public static String convertCommaList(String s, CapturePolicy policy)
	{
		if (!EscapeScanner.containsUnescaped(s, Metachars.COMMA))
			return s;

		return policy.getBracketOpen() + convertCommas(s) + CLOSE;
	}

	private static String escapeDelimiters(String s)
	{
		BitSet strays = EscapeScanner.unescaped(s, Metachars.BRACKET_DELIMITERS);
		if (strays.isEmpty())
			return s;

		StringBuilder sb = new StringBuilder(s.length() + strays.cardinality());
		for (int i = 0; i < s.length(); i++)
		{
			if (strays.get(i))
				sb.append(EscapeScanner.BACKSLASH);
			sb.append(s.charAt(i));
		}

		return sb.toString();
	}
}
