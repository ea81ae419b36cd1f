package org.wildcards;

/**
 * Classes of wildcard metacharacters that a conversion can translate instead
 * of escaping.
 */
public enum Feature
{
	/**
	 * Converts {@code ?} to a single-atom and runs of {@code *} to an any-atom.
	 */
	JOKERS("jokers", "?*"),
	
	/**
	 * Converts {@code _} to a single-atom and runs of {@code %} to an any-atom.
	 */
	SQL("sql", "_%"),
	
	/**
	 * Converts every {@code ,} to {@code |} and wraps the whole result in one
	 * alternation group.
	 */
	COMMAS("commas", ","),
	
	/**
	 * Converts balanced {@code {...,...}} blocks to alternation groups and
	 * escapes the delimiters left unmatched.
	 */
	BRACKETS("brackets", "{},"),
	
	/**
	 * Keeps the parenthesis of the original string as regex groups. Nothing
	 * checks that they match.
	 */
	GROUPS("groups", "()");
	
	private final String value;
	private final String metachars;
	
	Feature(String value, String metachars)
	{
		this.value = value;
		this.metachars = metachars;
	}
	
	/**
	 * Characters this feature gives a meaning to, and that must therefore
	 * survive metachar escaping.
	 */
	public String getMetachars()
	{
		return metachars;
	}
	
	/**
	 * Looks a feature up by its lower-case name.
	 * 
	 * @throws WildcardsException if the name is null or unknown
	 */
	public static Feature fromName(String name)
	{
		for (Feature f : values())
		{
			if (f.value.equals(name))
				return f;
		}
		
		throw new WildcardsException("Wrong option set: '" + name + "'");
	}
	
	@Override
	public String toString()
	{
		return value;
	}
}
