package org.vyrn.util;

/**
 * Console logging for the translator. Every level writes to stderr, so the
 * output of a program started with {@code --run} stays alone on stdout.
 */
public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Switched on by -v / --verbose.
	public static boolean ENABLE_DEBUG = false;

	// No colours when the output is piped or NO_COLOR is set.
	private static final boolean USE_COLOR = System.console() != null && System.getenv("NO_COLOR") == null;

	public static void logInfo(String log)
	{
		System.err.println(colored(ANSI_GREEN, log));
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			System.err.println("[debug] " + log);
		}
	}

	public static void logWarning(String log)
	{
		System.err.println(colored(ANSI_YELLOW, log));
	}

	public static void logError(String log)
	{
		System.err.println(colored(ANSI_RED, log));
	}

	private static String colored(String color, String log)
	{
		return USE_COLOR ? color + log + ANSI_RESET : log;
	}
}
