package org.wildcards.test.unit;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.wildcards.BracketExtractor;
import org.wildcards.BracketExtractor.BracketSpan;

public class TestBracketExtractor extends Assert
{
	private static void assertSpan(BracketSpan span, String prefix, String content, String remainder)
	{
		assertNotNull(span);
		assertEquals(span.getPrefix(), prefix);
		assertEquals(span.getContent(), content);
		assertEquals(span.getRemainder(), remainder);
	}
	
	@Test
	public void testSimpleSpan()
	{
		BracketSpan span = BracketExtractor.extract("a{b,c}d");
		assertSpan(span, "a", "b,c", "d");
		assertEquals(span.getOpen(), 1);
		assertEquals(span.getClose(), 5);
		assertEquals(span.getEnd(), 6);
	}
	
	@Test
	public void testNestedSpan()
	{
		assertSpan(BracketExtractor.extract("x{a{b}c}y{z}"), "x", "a{b}c", "y{z}");
		assertSpan(BracketExtractor.extract("{}"), "", "", "");
	}
	
	@Test
	public void testNoSpan()
	{
		assertNull(BracketExtractor.extract("abc"));
		assertNull(BracketExtractor.extract(""));
		assertNull(BracketExtractor.extract("a}b"));
	}
	
	@Test
	public void testUnbalanced()
	{
		assertNull(BracketExtractor.extract("{a{b}"));
		// later opening braces are not tried once the first one fails
		assertNull(BracketExtractor.extract("{a{b}c"));
		assertNull(BracketExtractor.extract("{a{b,c\\}d,e}"));
	}
	
	@Test
	public void testEscapedDelimiters()
	{
		assertNull(BracketExtractor.extract("\\{a}"));
		assertSpan(BracketExtractor.extract("\\\\{a}"), "\\\\", "a", "");
		assertSpan(BracketExtractor.extract("{a\\{b,c}d,e}"), "", "a\\{b,c", "d,e}");
		assertSpan(BracketExtractor.extract("{a\\}b}"), "", "a\\}b", "");
	}
	
	@Test
	public void testStrayClosingBraceBeforeSpan()
	{
		assertSpan(BracketExtractor.extract("}{a}"), "}", "a", "");
	}
	
	@Test
	public void testExtractFrom()
	{
		String s = "{a}b{c}";
		BracketSpan first = BracketExtractor.extract(s, 0);
		assertSpan(first, "", "a", "b{c}");
		
		BracketSpan second = BracketExtractor.extract(s, first.getEnd());
		assertSpan(second, "b", "c", "");
		
		assertNull(BracketExtractor.extract(s, second.getEnd()));
	}
}
