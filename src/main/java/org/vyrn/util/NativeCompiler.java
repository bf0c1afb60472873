package org.vyrn.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Compiles a generated C++ program with an external compiler and runs the
 * resulting executable.
 */
public class NativeCompiler
{
	private final String compiler;
	private final Duration timeout;

	public NativeCompiler(String compiler, Duration timeout)
	{
		this.compiler = compiler;
		this.timeout = timeout;
	}

	/**
	 * @param sourceFile The .cpp file to compile.
	 * @param executable Where to place the executable.
	 * @return The compiler's result; its stderr holds the compile errors, if any.
	 */
	public ProcessResult compile(Path sourceFile, Path executable) throws IOException, InterruptedException
	{
		Path parent = executable.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}

		Debug.logDebug("Compiling " + sourceFile + " with " + compiler);
		ProcessBuilder compile = new ProcessBuilder(
				compiler,
				"-std=c++17",
				"-O0",
				sourceFile.toAbsolutePath().toString(),
				"-o",
				executable.toAbsolutePath().toString()
		);
		ProcessResult result = ProcessUtils.executeCommand(compile, timeout);
		if (!result.isSuccess())
		{
			Debug.logError("Compilation of " + sourceFile + " failed" + (result.isTimedOut() ? " (timed out)" : ""));
		}
		return result;
	}

	public ProcessResult run(Path executable) throws IOException, InterruptedException
	{
		ProcessBuilder run = new ProcessBuilder(executable.toAbsolutePath().toString());
		ProcessResult result = ProcessUtils.executeCommand(run, timeout);
		if (result.isTimedOut())
		{
			Debug.logError("Program " + executable + " was stopped after " + timeout.toSeconds() + "s");
		}
		return result;
	}

	/**
	 * Compiles and, if that succeeded, runs. The compiler's result is returned
	 * when compilation fails.
	 */
	public ProcessResult compileAndRun(Path sourceFile, Path executable) throws IOException, InterruptedException
	{
		ProcessResult compiled = compile(sourceFile, executable);
		if (!compiled.isSuccess())
		{
			return compiled;
		}
		return run(executable);
	}
}
