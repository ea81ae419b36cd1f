package org.wildcards;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.wildcards.utils.IOUtils;

import com.google.common.base.Splitter;

/**
 * Sample command line tool: prints {@code pattern => regex} for every pattern
 * given as argument, or read line by line from standard input.
 */
public class Cli
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_IO = 2;

	// the sample captures alternations and non-greedy "any" runs
	static final String DEFAULT_CAPTURES = "brackets,any";

	private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
	private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n").omitEmptyStrings();

	private static final Options OPTIONS = new Options()
		.addOption(Option.builder("t").longOpt("type").hasArg().argName("type")
			.desc("predefined type: unix, win32, jokers, sql, commas or brackets (default: guessed from the host)").build())
		.addOption(Option.builder("d").longOpt("do").hasArg().argName("features")
			.desc("comma-separated features to enable, overrides --type").build())
		.addOption(Option.builder("c").longOpt("capture").hasArg().argName("captures")
			.desc("comma-separated atoms to capture (default: " + DEFAULT_CAPTURES + ")").build())
		.addOption(Option.builder("v").longOpt("verbose").desc("print the selected type first").build())
		.addOption(Option.builder("h").longOpt("help").desc("display this help").build());

	private IOUtils.CliUtils cli = IOUtils.getCliUtils();
	private String osName = System.getProperty("os.name");

	public static void main(String[] args)
	{
		Cli cli = new Cli();
		cli.exit(cli.interpret(args));
	}

	/**
	 * Parses the arguments and runs the conversions. Returns the exit code.
	 */
	public int interpret(String... args)
	{
		CommandLine cmd;
		try
		{
			cmd = cli.parse(OPTIONS, args);
		}
		catch (ParseException e)
		{
			cli.error(e.getMessage());
			return EXIT_USAGE;
		}

		if (cmd.hasOption("help"))
		{
			help();
			return EXIT_OK;
		}

		RunOptions opts = new RunOptions();
		try
		{
			Wildcards wildcards = new Wildcards(cmd.hasOption("type")
				? WildcardType.fromName(cmd.getOptionValue("type"))
				: WildcardType.forOs(osName));

			if (cmd.hasOption("do"))
				wildcards.features(LIST_SPLITTER.split(cmd.getOptionValue("do")));

			wildcards.captures(LIST_SPLITTER.split(cmd.getOptionValue("capture", DEFAULT_CAPTURES)));

			opts.setWildcards(wildcards);
		}
		catch (WildcardsException e)
		{
			cli.error(e.getMessage());
			return EXIT_USAGE;
		}

		opts.setVerbose(cmd.hasOption("verbose"));

		List<String> patterns = new ArrayList<>(cmd.getArgList());
		if (patterns.isEmpty())
		{
			try
			{
				LINE_SPLITTER.split(StringUtils.defaultString(cli.readFromStdin())).forEach(patterns::add);
			}
			catch (IOException e)
			{
				cli.error("Can't read from standard input: " + e.getMessage());
				return EXIT_IO;
			}
		}
		opts.setPatterns(patterns);

		run(opts);
		return EXIT_OK;
	}

	/**
	 * Converts every pattern of {@code opts} with a single configuration
	 * snapshot and prints the results.
	 */
	public void run(RunOptions opts)
	{
		Wildcards wildcards = opts.getWildcards();

		if (opts.isVerbose())
		{
			if (wildcards.getType() != null)
				cli.out("For this system, type is " + wildcards.getType());
			else
				cli.out("Features are " + StringUtils.join(wildcards.getFeatures(), ", "));
		}

		WildcardsConfig config = wildcards.config();
		for (String pattern : opts.getPatterns())
		{
			cli.out(pattern + " => " + Translator.convert(pattern, config));
		}
	}

	public void exit(int code)
	{
		System.exit(code);
	}

	private void help()
	{
		StringWriter sw = new StringWriter();
		PrintWriter pw = new PrintWriter(sw);
		new HelpFormatter().printHelp(pw, HelpFormatter.DEFAULT_WIDTH,
			"wc2re [options] [pattern...]", "Converts wildcard patterns to regular expressions.", OPTIONS,
			HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "With no pattern, reads them from standard input.");
		pw.flush();
		cli.out(StringUtils.stripEnd(sw.toString(), null));
	}

	protected void setCliUtils(IOUtils.CliUtils cli)
	{
		this.cli = cli;
	}

	protected void setOsName(String osName)
	{
		this.osName = osName;
	}

	public static class RunOptions
	{
		private Wildcards wildcards = new Wildcards();
		private List<String> patterns = new ArrayList<>();
		private boolean verbose = false;

		public Wildcards getWildcards()
		{
			return wildcards;
		}

		public void setWildcards(Wildcards wildcards)
		{
			this.wildcards = wildcards;
		}

		public List<String> getPatterns()
		{
			return patterns;
		}

		public void setPatterns(List<String> patterns)
		{
			this.patterns = patterns;
		}

		public void setPatterns(String... patterns)
		{
			this.patterns = new ArrayList<>(Arrays.asList(patterns));
		}

		public boolean isVerbose()
		{
			return verbose;
		}

		public void setVerbose(boolean verbose)
		{
			this.verbose = verbose;
		}
	}
}
