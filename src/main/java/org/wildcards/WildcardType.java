package org.wildcards;

import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

/**
 * Predefined feature sets. {@link #UNIX} and {@link #WIN32} mimic the
 * respective shells, the others enable a single feature.
 */
public enum WildcardType
{
	UNIX("unix", Feature.JOKERS, Feature.BRACKETS),
	WIN32("win32", Feature.JOKERS, Feature.COMMAS),
	JOKERS("jokers", Feature.JOKERS),
	SQL("sql", Feature.SQL),
	COMMAS("commas", Feature.COMMAS),
	BRACKETS("brackets", Feature.BRACKETS);
	
	// host names that behave like a windows shell
	private static final ImmutableMap<String, WildcardType> ALIASES = ImmutableMap.of(
		"dos", WIN32,
		"os2", WIN32,
		"MSWin32", WIN32,
		"cygwin", WIN32
	);
	
	private final String value;
	private final Set<Feature> features;
	
	WildcardType(String value, Feature first, Feature... rest)
	{
		this.value = value;
		this.features = Sets.immutableEnumSet(first, rest);
	}
	
	public Set<Feature> getFeatures()
	{
		return features;
	}
	
	/**
	 * Looks a type up by name. Besides the type names, the host aliases
	 * {@code dos}, {@code os2}, {@code MSWin32} and {@code cygwin} select
	 * {@link #WIN32}. A null name selects {@link #UNIX}.
	 * 
	 * @throws WildcardsException if the name is unknown
	 */
	public static WildcardType fromName(String name)
	{
		if (name == null)
			return UNIX;
		
		for (WildcardType t : values())
		{
			if (t.value.equals(name))
				return t;
		}
		
		WildcardType alias = ALIASES.get(name);
		if (alias == null)
			throw new WildcardsException("Wrong type: '" + name + "'");
		
		return alias;
	}
	
	/**
	 * Picks the shell-like type of a host operating system. Accepts the host
	 * aliases known to {@link #fromName(String)} as well as values of the
	 * {@code os.name} system property. Anything unrecognised is {@link #UNIX}.
	 */
	public static WildcardType forOs(String osName)
	{
		if (osName == null)
			return UNIX;
		
		if (ALIASES.containsKey(osName))
			return WIN32;
		
		if (StringUtils.startsWithIgnoreCase(osName, "windows") || StringUtils.startsWithIgnoreCase(osName, "os/2"))
			return WIN32;
		
		return UNIX;
	}
	
	@Override
	public String toString()
	{
		return value;
	}
}
