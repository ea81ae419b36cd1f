package org.wildcards;

import java.util.Collection;
import java.util.Set;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import com.google.common.base.CharMatcher;
import com.google.common.collect.Sets;

/**
 * Immutable snapshot of everything a conversion depends on: the enabled
 * features, the characters they exempt from escaping and the capture policy.
 * Instances can be shared freely between threads.
 */
public final class WildcardsConfig
{
	private final Set<Feature> features;
	private final String exemptions;
	private final CharMatcher exempted;
	private final CapturePolicy capturePolicy;
	
	public WildcardsConfig(Collection<Feature> features, CapturePolicy capturePolicy)
	{
		this.features = Sets.immutableEnumSet(features);
		this.capturePolicy = capturePolicy == null ? CapturePolicy.NONE : capturePolicy;
		
		StringBuilder sb = new StringBuilder();
		for (Feature f : this.features)
		{
			for (char c : f.getMetachars().toCharArray())
			{
				if (sb.indexOf(String.valueOf(c)) < 0)
					sb.append(c);
			}
		}
		this.exemptions = sb.toString();
		this.exempted = CharMatcher.anyOf(exemptions).precomputed();
	}
	
	public static WildcardsConfig of(WildcardType type)
	{
		return new WildcardsConfig(type.getFeatures(), CapturePolicy.NONE);
	}
	
	public Set<Feature> getFeatures()
	{
		return features;
	}
	
	public boolean has(Feature feature)
	{
		return features.contains(feature);
	}
	
	/**
	 * Literal characters that keep their wildcard meaning and are therefore
	 * never escaped, e.g. {@code ?*{},} for {@link WildcardType#UNIX}.
	 */
	public String getExemptions()
	{
		return exemptions;
	}
	
	CharMatcher getExempted()
	{
		return exempted;
	}
	
	public CapturePolicy getCapturePolicy()
	{
		return capturePolicy;
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if (this == obj) return true;
		if (!(obj instanceof WildcardsConfig)) return false;
		
		WildcardsConfig other = (WildcardsConfig) obj;
		return new EqualsBuilder()
			.append(features, other.features)
			.append(capturePolicy, other.capturePolicy)
			.isEquals();
	}
	
	@Override
	public int hashCode()
	{
		return new HashCodeBuilder()
			.append(features)
			.append(capturePolicy)
			.toHashCode();
	}
	
	@Override
	public String toString()
	{
		return "WildcardsConfig[features=" + features + ", " + capturePolicy + "]";
	}
}
