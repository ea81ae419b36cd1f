package org.wildcards;

import java.util.Set;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Decides which atoms of a converted wildcard are capturing groups. The regex
 * fragments are resolved once, when the policy is built.
 */
public final class CapturePolicy
{
	public static final CapturePolicy NONE = new CapturePolicy(false, AnyCapture.OFF, false);
	
	public enum AnyCapture
	{
		OFF(".*"),
		NON_GREEDY("(.*?)"),
		GREEDY("(.*)");
		
		private final String atom;
		
		AnyCapture(String atom)
		{
			this.atom = atom;
		}
		
		public String getAtom()
		{
			return atom;
		}
	}
	
	private final boolean single;
	private final AnyCapture any;
	private final boolean brackets;
	
	private final String singleAtom;
	private final String bracketOpen;
	
	public CapturePolicy(boolean single, AnyCapture any, boolean brackets)
	{
		this.single = single;
		this.any = any == null ? AnyCapture.OFF : any;
		this.brackets = brackets;
		
		this.singleAtom = single ? "(.)" : ".";
		this.bracketOpen = brackets ? "(" : "(?:";
	}
	
	/**
	 * Builds the policy matching a set of capture names. {@link Capture#GREEDY}
	 * only matters together with {@link Capture#ANY}.
	 */
	public static CapturePolicy of(Set<Capture> captures)
	{
		AnyCapture any = AnyCapture.OFF;
		if (captures.contains(Capture.ANY))
			any = captures.contains(Capture.GREEDY) ? AnyCapture.GREEDY : AnyCapture.NON_GREEDY;
		
		return new CapturePolicy(captures.contains(Capture.SINGLE), any, captures.contains(Capture.BRACKETS));
	}
	
	public boolean isSingle()
	{
		return single;
	}
	
	public AnyCapture getAny()
	{
		return any;
	}
	
	public boolean isBrackets()
	{
		return brackets;
	}
	
	/**
	 * Replacement for one "exactly one" token: {@code .} or {@code (.)}.
	 */
	public String getSingleAtom()
	{
		return singleAtom;
	}
	
	/**
	 * Replacement for a run of "any" tokens: {@code .*}, {@code (.*?)} or
	 * {@code (.*)}.
	 */
	public String getAnyAtom()
	{
		return any.getAtom();
	}
	
	/**
	 * Opening delimiter of an alternation group, closed by {@code )}.
	 */
	public String getBracketOpen()
	{
		return bracketOpen;
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if (this == obj) return true;
		if (!(obj instanceof CapturePolicy)) return false;
		
		CapturePolicy other = (CapturePolicy) obj;
		return new EqualsBuilder()
			.append(single, other.single)
			.append(any, other.any)
			.append(brackets, other.brackets)
			.isEquals();
	}
	
	@Override
	public int hashCode()
	{
		return new HashCodeBuilder()
			.append(single)
			.append(any)
			.append(brackets)
			.toHashCode();
	}
	
	@Override
	public String toString()
	{
		return "CapturePolicy[single=" + single + ", any=" + any + ", brackets=" + brackets + "]";
	}
}
