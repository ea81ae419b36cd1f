package org.wildcards.test.unit;

import java.util.BitSet;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.wildcards.utils.EscapeScanner;

import com.google.common.base.CharMatcher;

public class TestEscapeScanner extends Assert
{
	private static BitSet bits(int... positions)
	{
		BitSet result = new BitSet();
		for (int p : positions) result.set(p);
		return result;
	}
	
	@Test
	public void testUnescaped()
	{
		CharMatcher star = CharMatcher.is('*');
		
		assertEquals(EscapeScanner.unescaped("a*b*", star), bits(1, 3));
		assertEquals(EscapeScanner.unescaped("\\*", star), bits());
		assertEquals(EscapeScanner.unescaped("\\\\*", star), bits(2));
		assertEquals(EscapeScanner.unescaped("\\\\\\*", star), bits());
		assertEquals(EscapeScanner.unescaped("\\**", star), bits(2));
		assertEquals(EscapeScanner.unescaped("", star), bits());
	}
	
	@Test
	public void testUnescapedBackslashes()
	{
		// a backslash is unescaped when it opens a run of its own
		assertEquals(EscapeScanner.unescaped("\\\\\\a", CharMatcher.is('\\')), bits(0, 2));
	}
	
	@Test
	public void testUnescapedRange()
	{
		CharMatcher comma = CharMatcher.is(',');
		String s = "{a,\\,b},c";
		
		assertEquals(EscapeScanner.unescaped(s, 1, 7, comma), bits(2));
		assertEquals(EscapeScanner.unescaped(s, comma), bits(2, 7));
	}
	
	@Test
	public void testDanglingEscapes()
	{
		CharMatcher word = CharMatcher.inRange('a', 'z');
		
		assertEquals(EscapeScanner.danglingEscapes("\\a", word), bits(0));
		assertEquals(EscapeScanner.danglingEscapes("x\\\\\\a", word), bits(1));
		assertEquals(EscapeScanner.danglingEscapes("\\\\a", word), bits());
		assertEquals(EscapeScanner.danglingEscapes("\\.", word), bits());
		assertEquals(EscapeScanner.danglingEscapes("ab\\", word), bits(2));
		assertEquals(EscapeScanner.danglingEscapes("ab\\\\", word), bits());
		assertEquals(EscapeScanner.danglingEscapes("\\\\\\", word), bits(0));
	}
	
	@Test
	public void testContainsUnescaped()
	{
		CharMatcher comma = CharMatcher.is(',');
		
		assertTrue(EscapeScanner.containsUnescaped("a,b", comma));
		assertTrue(EscapeScanner.containsUnescaped("a\\\\,b", comma));
		assertFalse(EscapeScanner.containsUnescaped("a\\,b", comma));
		assertFalse(EscapeScanner.containsUnescaped("ab", comma));
	}
}
