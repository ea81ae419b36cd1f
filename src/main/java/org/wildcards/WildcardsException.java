package org.wildcards;

import org.apache.commons.lang3.StringUtils;

/**
 * Signals a misuse of the configuration API. Conversions themselves never
 * throw it.
 */
public class WildcardsException extends RuntimeException
{
	private static final long serialVersionUID = 4126985163402217870L;
	
	private final String message;
	
	public WildcardsException(String message)
	{
		this.message = StringUtils.defaultString(message);
	}
	
	@Override
	public String getMessage()
	{
		return message;
	}
}
