package org.wildcards;

/**
 * Atoms that a conversion may turn into capturing groups.
 */
public enum Capture
{
	/**
	 * Captures every "exactly one" token, {@code ?} or {@code _}.
	 */
	SINGLE("single"),
	
	/**
	 * Captures every run of "any" tokens, {@code *} or {@code %}.
	 */
	ANY("any"),
	
	/**
	 * Makes {@link #ANY} captures greedy. Does nothing on its own.
	 */
	GREEDY("greedy"),
	
	/**
	 * Captures the alternations built from brackets or commas.
	 */
	BRACKETS("brackets");
	
	private final String value;
	
	Capture(String value)
	{
		this.value = value;
	}
	
	/**
	 * Looks a capture up by its lower-case name.
	 * 
	 * @throws WildcardsException if the name is null or unknown
	 */
	public static Capture fromName(String name)
	{
		for (Capture c : values())
		{
			if (c.value.equals(name))
				return c;
		}
		
		throw new WildcardsException("Wrong option set: '" + name + "'");
	}
	
	@Override
	public String toString()
	{
		return value;
	}
}
