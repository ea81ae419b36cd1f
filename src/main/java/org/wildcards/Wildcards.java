package org.wildcards;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Converts wildcard expressions to regular expressions.
 *
 * <pre>
 * Wildcards wc = new Wildcards(WildcardType.UNIX);
 * wc.convert("a{b?,c}*");                     // a(?:b.|c).*
 * wc.convert("a?,b*", WildcardType.WIN32);    // (?:a.|b.*)
 *
 * wc = new Wildcards(Feature.JOKERS, Feature.BRACKETS)
 *     .captures(Capture.ANY, Capture.GREEDY);
 * wc.addFeatures(Feature.GROUPS);
 * wc.removeCaptures(Capture.GREEDY);
 * wc.convert("*a{,(b)?}?c*");                 // (.*?)a(?:|(b).).c(.*?)
 * </pre>
 *
 * An instance is a mutable builder: every configuration method changes it and
 * returns it. Conversions use an immutable snapshot ({@link #config()}), so a
 * {@link WildcardsConfig} taken once can be used from any number of threads.
 */
public class Wildcards
{
	private WildcardType type;
	private Set<Feature> features = EnumSet.noneOf(Feature.class);
	private Set<Capture> captures = EnumSet.noneOf(Capture.class);

	/**
	 * Unix shell behaviour, nothing captured.
	 */
	public Wildcards()
	{
		this(WildcardType.UNIX);
	}

	public Wildcards(WildcardType type)
	{
		type(type);
	}

	/**
	 * Enables exactly the given features, nothing captured.
	 */
	public Wildcards(Feature... features)
	{
		features(features);
	}

	// TYPES

	/**
	 * Replaces the enabled features with those of a predefined type. A null
	 * type stands for {@link WildcardType#UNIX}.
	 */
	public Wildcards type(WildcardType type)
	{
		WildcardType t = type == null ? WildcardType.UNIX : type;
		this.features = EnumSet.copyOf(t.getFeatures());
		this.type = t;
		return this;
	}

	/**
	 * Same as {@link #type(WildcardType)} with a type looked up by name, see
	 * {@link WildcardType#fromName(String)}.
	 *
	 * @throws WildcardsException if the name is unknown
	 */
	public Wildcards type(String name)
	{
		return type(WildcardType.fromName(name));
	}

	/**
	 * The type last selected, or null once features were set explicitly.
	 */
	public WildcardType getType()
	{
		return type;
	}

	// FEATURES

	/**
	 * Enables exactly the given features. No argument disables everything.
	 */
	public Wildcards features(Feature... features)
	{
		Set<Feature> checked = checked(Feature.class, features);
		this.features = checked;
		this.type = null;
		return this;
	}

	public Wildcards features(Iterable<String> names)
	{
		return features(lookup(names, Feature::fromName).toArray(new Feature[0]));
	}

	public Wildcards addFeatures(Feature... features)
	{
		Set<Feature> checked = checked(Feature.class, features);
		this.features.addAll(checked);
		this.type = null;
		return this;
	}

	public Wildcards addFeatures(Iterable<String> names)
	{
		return addFeatures(lookup(names, Feature::fromName).toArray(new Feature[0]));
	}

	public Wildcards removeFeatures(Feature... features)
	{
		Set<Feature> checked = checked(Feature.class, features);
		this.features.removeAll(checked);
		this.type = null;
		return this;
	}

	public Wildcards removeFeatures(Iterable<String> names)
	{
		return removeFeatures(lookup(names, Feature::fromName).toArray(new Feature[0]));
	}

	public Set<Feature> getFeatures()
	{
		return Collections.unmodifiableSet(features);
	}

	// CAPTURES

	/**
	 * Captures exactly the given atoms. No argument captures nothing.
	 */
	public Wildcards captures(Capture... captures)
	{
		this.captures = checked(Capture.class, captures);
		return this;
	}

	public Wildcards captures(Iterable<String> names)
	{
		return captures(lookup(names, Capture::fromName).toArray(new Capture[0]));
	}

	public Wildcards addCaptures(Capture... captures)
	{
		this.captures.addAll(checked(Capture.class, captures));
		return this;
	}

	public Wildcards addCaptures(Iterable<String> names)
	{
		return addCaptures(lookup(names, Capture::fromName).toArray(new Capture[0]));
	}

	public Wildcards removeCaptures(Capture... captures)
	{
		this.captures.removeAll(checked(Capture.class, captures));
		return this;
	}

	public Wildcards removeCaptures(Iterable<String> names)
	{
		return removeCaptures(lookup(names, Capture::fromName).toArray(new Capture[0]));
	}

	public Set<Capture> getCaptures()
	{
		return Collections.unmodifiableSet(captures);
	}

	// CONVERSION

	/**
	 * Snapshot of the current configuration.
	 */
	public WildcardsConfig config()
	{
		return new WildcardsConfig(features, CapturePolicy.of(captures));
	}

	/**
	 * Converts a wildcard expression with the current configuration. Returns
	 * null for a null wildcard.
	 */
	public String convert(String wildcard)
	{
		return Translator.convert(wildcard, config());
	}

	/**
	 * Converts a wildcard expression with the features of {@code type} and the
	 * current captures. The instance itself is left untouched.
	 */
	public String convert(String wildcard, WildcardType type)
	{
		WildcardType t = type == null ? WildcardType.UNIX : type;
		return Translator.convert(wildcard, new WildcardsConfig(t.getFeatures(), CapturePolicy.of(captures)));
	}

	@Override
	public String toString()
	{
		return "Wildcards[type=" + type + ", features=" + features + ", captures=" + captures + "]";
	}

	private static <E extends Enum<E>> Set<E> checked(Class<E> cls, E[] values)
	{
		Set<E> result = EnumSet.noneOf(cls);
		if (values == null)
			return result;

		List<E> list = Arrays.asList(values);
		if (list.contains(null))
			throw new WildcardsException("Wrong option set: null");

		result.addAll(list);
		return result;
	}

	private static <E> List<E> lookup(Iterable<String> names, Function<String, E> fromName)
	{
		List<E> result = new ArrayList<>();
		if (names == null)
			return result;

		for (String name : names)
		{
			result.add(fromName.apply(name));
		}
		return result;
	}
}
