package org.vyrn.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

public class ProcessUtils
{
	/**
	 * Runs a command to completion, capturing both output streams.
	 * A process still alive after {@code timeout} is killed and reported as timed out.
	 */
	public static ProcessResult executeCommand(ProcessBuilder pb, Duration timeout) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", pb.command()));
		Process process = pb.start();
		process.getOutputStream().close();

		// Both streams are drained concurrently so a full pipe cannot block the child.
		CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
		CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

		boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
		if (!finished)
		{
			process.destroyForcibly();
			process.waitFor();
		}

		ProcessResult result = new ProcessResult(process.exitValue(), join(stdout), join(stderr), !finished);
		Debug.logDebug("Exit code " + result.getExitCode() + (finished ? "" : " (timed out)") + " for: " + String.join(" ", pb.command()));
		return result;
	}

	public static boolean isCommandAvailable(String command)
	{
		try
		{
			ProcessResult result = executeCommand(new ProcessBuilder(command, "--version"), Duration.ofSeconds(5));
			return result.isSuccess();
		}
		catch (IOException e)
		{
			return false;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private static String readAll(InputStream stream)
	{
		try (stream)
		{
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	private static String join(CompletableFuture<String> future) throws IOException, InterruptedException
	{
		try
		{
			return future.get();
		}
		catch (ExecutionException e)
		{
			if (e.getCause() instanceof UncheckedIOException io)
			{
				throw io.getCause();
			}
			throw new IOException("Failed to read process output", e.getCause());
		}
	}
}
