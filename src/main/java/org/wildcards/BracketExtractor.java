package org.wildcards;

import org.wildcards.utils.EscapeScanner;

/**
 * Locates balanced {@code {...}} spans, honouring backslash parity on both
 * delimiters.
 */
public final class BracketExtractor
{
	private BracketExtractor() {}

	/**
	 * A balanced span of a string: the prefix before the opening brace, the
	 * content between the braces and the remainder after the closing brace.
	 * Indices refer to the scanned string.
	 */
	public static final class BracketSpan
	{
		private final String source;
		private final int from;
		private final int open;
		private final int close;

		BracketSpan(String source, int from, int open, int close)
		{
			this.source = source;
			this.from = from;
			this.open = open;
			this.close = close;
		}

		/**
		 * Index of the opening brace.
		 */
		public int getOpen()
		{
			return open;
		}

		/**
		 * Index of the matching closing brace.
		 */
		public int getClose()
		{
			return close;
		}

		/**
		 * Index right after the closing brace, where the next search resumes.
		 */
		public int getEnd()
		{
			return close + 1;
		}

		public String getPrefix()
		{
			return source.substring(from, open);
		}

		public String getContent()
		{
			return source.substring(open + 1, close);
		}

		public String getRemainder()
		{
			return source.substring(close + 1);
		}
	}

	public static BracketSpan extract(String s)
	{
		return extract(s, 0);
	}

	/**
	 * Finds the first unescaped {@code {} at or after {@code from} and its
	 * matching unescaped {@code }}. Returns null when there is no opening
	 * brace or when it is never closed; later opening braces are not tried in
	 * that case. {@code from} must be 0 or follow a character other than a
	 * backslash.
	 */
	public static BracketSpan extract(String s, int from)
	{
		int open = -1;
		int depth = 0;
		int run = 0;

		for (int i = from; i < s.length(); i++)
		{
			char c = s.charAt(i);
			if (c == EscapeScanner.BACKSLASH)
			{
				run++;
				continue;
			}

			boolean escaped = run % 2 == 1;
			run = 0;
			if (escaped)
				continue;

			if (c == '{')
			{
				if (open < 0)
					open = i;
				depth++;
			}
			else if (c == '}' && open >= 0)
			{
				depth--;
				if (depth == 0)
					return new BracketSpan(s, from, open, i);
			}
		}

		return null;
	}
}
