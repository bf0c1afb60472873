package org.vyrn.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ProcessUtilsTest
{
	@Test
	void capturesBothStreams() throws IOException, InterruptedException
	{
		ProcessResult result = ProcessUtils.executeCommand(
				new ProcessBuilder("sh", "-c", "echo out; echo err 1>&2; exit 3"), Duration.ofSeconds(10));

		assertEquals("out\n", result.getStdout());
		assertEquals("err\n", result.getStderr());
		assertEquals(3, result.getExitCode());
		assertFalse(result.isTimedOut());
		assertFalse(result.isSuccess());
	}

	@Test
	void killsProcessAfterTimeout() throws IOException, InterruptedException
	{
		ProcessResult result = ProcessUtils.executeCommand(new ProcessBuilder("sleep", "30"), Duration.ofMillis(200));

		assertTrue(result.isTimedOut());
		assertFalse(result.isSuccess());
	}

	@Test
	void missingCommandIsUnavailable()
	{
		assertFalse(ProcessUtils.isCommandAvailable("vyrn-no-such-command"));
	}
}
