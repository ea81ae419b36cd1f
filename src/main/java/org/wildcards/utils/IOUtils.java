package org.wildcards.utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

public class IOUtils
{
	private static CliUtils cli = new CliUtils();
	
	private static final CommandLineParser parser = new DefaultParser();
	
	private IOUtils() {}
	
	public static CliUtils getCliUtils()
	{
		return cli;
	}
	
	/**
	 * Console access of the command line tool. Tests override it to feed
	 * standard input and collect what is printed.
	 */
	public static class CliUtils
	{
		public CommandLine parse(Options options, String... args) throws ParseException
		{
			return parser.parse(options, args);
		}
		
		public String readFromStdin() throws IOException
		{
			StringBuilder result = new StringBuilder();
			
			BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
			String line;
			while ((line = in.readLine()) != null)
			{
				result.append(line).append('\n');
			}
			return result.toString();
		}
		
		public void out(String message)
		{
			System.out.println(message);
		}
		
		public void error(String message)
		{
			System.err.println(message);
		}
	}
}
