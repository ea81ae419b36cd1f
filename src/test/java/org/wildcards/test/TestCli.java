package org.wildcards.test;

import java.util.Arrays;
import java.util.Collections;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.wildcards.Cli;
import org.wildcards.Cli.RunOptions;
import org.wildcards.Feature;
import org.wildcards.Wildcards;
import org.wildcards.test.helpers.CliWrapper;

public class TestCli extends Assert
{
	public CliWrapper setUpUnixCli()
	{
		CliWrapper cli = new CliWrapper();
		cli.stubOs("Linux");
		return cli;
	}
	
	public CliWrapper setUpWindowsCli()
	{
		CliWrapper cli = new CliWrapper();
		cli.stubOs("Windows 10");
		return cli;
	}
	
	@Test
	public void testPatternsFromArguments()
	{
		CliWrapper cli = setUpUnixCli();
		
		int code = cli.interpret("a{b,c}", "*.txt");
		
		assertEquals(code, Cli.EXIT_OK);
		assertEquals(cli.getOutput(), Arrays.asList(
			"a{b,c} => a(b|c)",
			"*.txt => (.*?)\\.txt"
		));
		assertTrue(cli.getErrorMessages().isEmpty());
	}
	
	@Test
	public void testTypeGuessedFromHost()
	{
		CliWrapper cli = setUpWindowsCli();
		
		cli.interpret("--verbose", "a,b");
		
		assertEquals(cli.getOutput(), Arrays.asList(
			"For this system, type is win32",
			"a,b => (a|b)"
		));
		
		cli = setUpUnixCli();
		cli.interpret("-v", "a,b");
		
		assertEquals(cli.getOutput(), Arrays.asList(
			"For this system, type is unix",
			"a,b => a\\,b"
		));
	}
	
	@Test
	public void testExplicitOptions()
	{
		CliWrapper cli = setUpWindowsCli();
		cli.interpret("--type", "sql", "--capture", "single", "a_%");
		assertEquals(cli.getOutput(), Collections.singletonList("a_% => a(.).*"));
		
		cli = setUpUnixCli();
		cli.interpret("-d", "jokers, groups", "-c", "any,greedy", "-v", "(a)*{b}");
		assertEquals(cli.getOutput(), Arrays.asList(
			"Features are jokers, groups",
			"(a)*{b} => (a)(.*)\\{b\\}"
		));
	}
	
	@Test
	public void testPatternsFromStdin()
	{
		CliWrapper cli = setUpUnixCli();
		cli.stdinSend("x*", "", "y?");
		
		int code = cli.interpret("-c", "brackets");
		
		assertEquals(code, Cli.EXIT_OK);
		assertEquals(cli.getOutput(), Arrays.asList(
			"x* => x.*",
			"y? => y."
		));
	}
	
	@Test
	public void testBrokenStdin()
	{
		CliWrapper cli = setUpUnixCli();
		cli.stubBrokenStdin();
		
		assertEquals(cli.interpret(), Cli.EXIT_IO);
		assertEquals(cli.getErrorMessages(), Collections.singletonList("Can't read from standard input: Stream closed"));
		assertTrue(cli.getOutput().isEmpty());
	}
	
	@Test
	public void testWrongArguments()
	{
		CliWrapper cli = setUpUnixCli();
		assertEquals(cli.interpret("--type", "bash", "a"), Cli.EXIT_USAGE);
		assertEquals(cli.getErrorMessages(), Collections.singletonList("Wrong type: 'bash'"));
		
		cli = setUpUnixCli();
		assertEquals(cli.interpret("--do", "jokers,stars", "a"), Cli.EXIT_USAGE);
		assertEquals(cli.getErrorMessages(), Collections.singletonList("Wrong option set: 'stars'"));
		
		cli = setUpUnixCli();
		assertEquals(cli.interpret("--bogus", "a"), Cli.EXIT_USAGE);
		assertEquals(cli.getErrorMessages().size(), 1);
		assertTrue(cli.getOutput().isEmpty());
	}
	
	@Test
	public void testHelp()
	{
		CliWrapper cli = setUpUnixCli();
		
		assertEquals(cli.interpret("--help"), Cli.EXIT_OK);
		assertEquals(cli.getOutput().size(), 1);
		assertTrue(cli.getOutput().get(0).startsWith("usage: wc2re [options] [pattern...]"));
		assertTrue(cli.getOutput().get(0).contains("--capture <captures>"));
	}
	
	@Test
	public void testRun()
	{
		CliWrapper cli = setUpUnixCli();
		
		RunOptions opts = new RunOptions();
		opts.setWildcards(new Wildcards(Feature.SQL));
		opts.setPatterns("%a", "b_");
		cli.run(opts);
		
		assertEquals(cli.getOutput(), Arrays.asList("%a => .*a", "b_ => b."));
	}
	
	@Test
	public void testExit()
	{
		CliWrapper cli = setUpUnixCli();
		
		cli.exit(cli.interpret("a"));
		
		assertEquals(cli.getExitCode(), Cli.EXIT_OK);
		assertEquals(cli.getOutput(), Collections.singletonList("a => a"));
	}
}
