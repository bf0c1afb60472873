package org.vyrn.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds all command-line arguments of the translator.
 */
public class CompilerArguments
{
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
	public static final String DEFAULT_COMPILER = "g++";

	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean invalid = false;
	private boolean checkOnly = false;
	private boolean run = false;
	private boolean ignoreFileExtensions = false;
	private Path outputPath = null;
	private Path reportPath = null;
	private String compiler = DEFAULT_COMPILER;
	private Duration timeout = DEFAULT_TIMEOUT;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("-r") || arg.equals("--run"))
				{
					parsedArgs.run = true;
					continue;
				}
				if (arg.equals("--ignore-file-extensions"))
				{
					parsedArgs.ignoreFileExtensions = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--report"))
				{
					parsedArgs.reportPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--compiler"))
				{
					parsedArgs.compiler = getNextArg(args, ++i, arg);
					continue;
				}
				if (arg.equals("--timeout"))
				{
					String value = getNextArg(args, ++i, arg);
					parsedArgs.timeout = parseTimeout(value);
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}

			if (parsedArgs.checkOnly && parsedArgs.run)
			{
				throw new IllegalArgumentException("--check and --run cannot be combined");
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.invalid = true;
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static Duration parseTimeout(String value)
	{
		try
		{
			long seconds = Long.parseLong(value);
			if (seconds <= 0)
			{
				throw new IllegalArgumentException("--timeout must be positive: " + value);
			}
			return Duration.ofSeconds(seconds);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid value for --timeout: " + value);
		}
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Translator from the Vyrn language to C++.");
		System.out.println("\nUSAGE: vyrnc [options] file...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show translator version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <file>       Specify the generated .cpp file name.");
		System.out.println("  -k, --check               Translate and report diagnostics only; write nothing.");
		System.out.println("  -r, --run                 Compile the generated program and run it.");
		System.out.println("  --compiler <exe>          C++ compiler used by --run (default: g++).");
		System.out.println("  --timeout <seconds>       Limit for compiling and for running (default: 10).");
		System.out.println("  --report <file>           Write a JSON report of the translation.");
		System.out.println("\nFLAGS:");
		System.out.println("  --ignore-file-extensions  Accept input files that do not end in .vy.");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	/**
	 * @return {@code true} if help is shown because the arguments could not be parsed.
	 */
	public boolean isInvalid()
	{
		return invalid;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isRun()
	{
		return run;
	}

	public boolean isIgnoreFileExtensions()
	{
		return ignoreFileExtensions;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getReportPath()
	{
		return reportPath;
	}

	public String getCompiler()
	{
		return compiler;
	}

	public Duration getTimeout()
	{
		return timeout;
	}
}
