package org.vyrn;

import org.vyrn.codegen.CodeGenerator;
import org.vyrn.dto.TranslationReportDTO;
import org.vyrn.translate.TranslationResult;
import org.vyrn.translate.Translator;
import org.vyrn.util.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point: translates each .vy input into a .cpp program and
 * optionally compiles and runs it.
 */
public class Main
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return arguments.isInvalid() ? EXIT_USAGE : EXIT_OK;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("vyrnc (Vyrn Translator) version 0.1.0-alpha");
				return EXIT_OK;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return EXIT_USAGE;
			}

			boolean success = true;
			for (Path file : arguments.getInputFiles())
			{
				success &= translateFile(arguments, file);
			}
			return success ? EXIT_OK : EXIT_FAILURE;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Translator initialization failed: " + e.getMessage());
			return EXIT_USAGE;
		}
		catch (IOException e)
		{
			Debug.logError("I/O error: " + e.getMessage());
			return EXIT_FAILURE;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			Debug.logError("Interrupted while waiting for the C++ compiler.");
			return EXIT_FAILURE;
		}
	}

	/**
	 * Translates one file, writes the program and the optional report, then
	 * compiles and runs it when asked.
	 *
	 * @return {@code false} if any statement was rejected or the native step failed.
	 */
	private static boolean translateFile(CompilerArguments args, Path file) throws IOException, InterruptedException
	{
		Debug.logDebug("\nTranslating " + file + "...");
		TranslationResult result = new Translator().translate(FileUtils.load(file));

		Debug.logDebug("Translation produced " + result.getDiagnostics().size() + " diagnostic(s) and "
				+ result.getSymbols().size() + " symbol(s).");

		// --- Check Only? ---
		if (args.isCheckOnly())
		{
			if (!result.hasErrors())
			{
				Debug.logInfo("Check passed for " + file + ". No output generated (-k flag).");
			}
			writeReportIfRequested(args, ReportConverter.toReport(result, file, null));
			return !result.hasErrors();
		}

		Path cppPath = getOutputPath(args, file);
		new CodeGenerator(result.getCode(), cppPath).generate();
		Debug.logInfo("C++ program written to: " + cppPath);

		TranslationReportDTO report = ReportConverter.toReport(result, file, cppPath);
		boolean success = !result.hasErrors();

		if (args.isRun())
		{
			success &= compileAndRun(args, cppPath, report);
		}

		writeReportIfRequested(args, report);
		return success;
	}

	private static boolean compileAndRun(CompilerArguments args, Path cppPath, TranslationReportDTO report) throws IOException, InterruptedException
	{
		NativeCompiler compiler = new NativeCompiler(args.getCompiler(), args.getTimeout());
		Path executable = FileUtils.withExtension(cppPath, isWindows() ? ".exe" : "");

		ProcessResult compiled = compiler.compile(cppPath, executable);
		if (!compiled.isSuccess())
		{
			System.err.print(compiled.getStderr());
			report.execution = ReportConverter.executionToDTO("compile", compiled);
			return false;
		}

		ProcessResult ran = compiler.run(executable);
		System.out.print(ran.getStdout());
		System.err.print(ran.getStderr());
		report.execution = ReportConverter.executionToDTO("run", ran);
		return ran.isSuccess();
	}

	private static void writeReportIfRequested(CompilerArguments args, TranslationReportDTO report) throws IOException
	{
		if (args.getReportPath() != null)
		{
			ReportConverter.writeReport(report, args.getReportPath());
		}
	}

	private static Path getOutputPath(CompilerArguments args, Path input)
	{
		if (args.getOutputPath() != null)
		{
			return args.getOutputPath();
		}
		return FileUtils.withExtension(input, ".cpp");
	}

	private static boolean validatePaths(CompilerArguments args)
	{
		boolean allValid = true;

		if (args.getOutputPath() != null && args.getInputFiles().size() > 1)
		{
			Debug.logError("-o cannot be used with more than one input file.");
			allValid = false;
		}
		if (args.getReportPath() != null && args.getInputFiles().size() > 1)
		{
			Debug.logError("--report cannot be used with more than one input file.");
			allValid = false;
		}

		for (Path p : args.getInputFiles())
		{
			if (!Files.exists(p))
			{
				Debug.logError("Input file does not exist: " + p);
				allValid = false;
				continue;
			}
			if (!Files.isRegularFile(p))
			{
				Debug.logError("Input is not a regular file: " + p);
				allValid = false;
				continue;
			}
			if (!args.isIgnoreFileExtensions() && !FileUtils.isSourceFile(p))
			{
				Debug.logError("Invalid input file type: " + p + " (expected " + FileUtils.SOURCE_EXTENSION
						+ ", use --ignore-file-extensions to override)");
				allValid = false;
			}
		}

		return allValid;
	}

	private static boolean isWindows()
	{
		return System.getProperty("os.name").toLowerCase().contains("win");
	}
}
