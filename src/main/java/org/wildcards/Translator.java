package org.wildcards;

/**
 * Conversion engine. Runs the passes in order:
 * <ol>
 * <li>metachar escaping, exempting the characters of the enabled features;</li>
 * <li>joker or SQL token substitution;</li>
 * <li>bracket conversion, or comma-list wrapping when brackets are off.</li>
 * </ol>
 * The engine is stateless and total: any string converts to some regex
 * source, unbalanced or malformed input included.
 */
public final class Translator
{
	private Translator() {}

	/**
	 * Converts {@code wildcard} to regex source. Returns null for a null
	 * wildcard.
	 */
	public static String convert(String wildcard, WildcardsConfig config)
	{
		if (wildcard == null)
			return null;

		CapturePolicy policy = config.getCapturePolicy();
		String re = MetacharEscaper.escape(wildcard, config);

		TokenSubstituter.Grammar grammar = TokenSubstituter.Grammar.of(config);
		if (grammar != null)
			re = TokenSubstituter.substitute(re, grammar, policy);

		if (config.has(Feature.BRACKETS))
			re = BracketConverter.convertBracketed(re, policy);
		else if (config.has(Feature.COMMAS))
			re = BracketConverter.convertCommaList(re, policy);

		return re;
	}
}
