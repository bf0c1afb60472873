package org.vyrn.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilerArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		CompilerArguments args = CompilerArguments.parse(new String[0]);

		assertTrue(args.isHelpFlag());
		assertFalse(args.isInvalid());
	}

	@Test
	void defaults()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"main.vy"});

		assertEquals(List.of(Paths.get("main.vy")), args.getInputFiles());
		assertEquals("g++", args.getCompiler());
		assertEquals(Duration.ofSeconds(10), args.getTimeout());
		assertNull(args.getOutputPath());
		assertNull(args.getReportPath());
		assertFalse(args.isRun());
		assertFalse(args.isCheckOnly());
	}

	@Test
	void parsesAllOptions()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{
				"-v", "-r", "-o", "out/prog.cpp", "--compiler", "clang++",
				"--timeout", "3", "--report", "report.json", "--ignore-file-extensions", "prog.txt"});

		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertTrue(args.isRun());
		assertTrue(args.isIgnoreFileExtensions());
		assertEquals(Paths.get("out/prog.cpp"), args.getOutputPath());
		assertEquals(Paths.get("report.json"), args.getReportPath());
		assertEquals("clang++", args.getCompiler());
		assertEquals(Duration.ofSeconds(3), args.getTimeout());
		assertEquals(List.of(Paths.get("prog.txt")), args.getInputFiles());
		assertFalse(args.isHelpFlag());
	}

	@Test
	void helpAndVersionStopParsing()
	{
		assertTrue(CompilerArguments.parse(new String[]{"a.vy", "--help", "--bogus"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"--version", "--bogus"}).isVersionFlag());
	}

	@Test
	void badArgumentsAreInvalid()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--bogus"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"a.vy", "-o"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"a.vy", "-o", "-r"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"a.vy", "--timeout", "soon"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"a.vy", "--timeout", "0"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"a.vy", "-k", "-r"}).isInvalid());
	}
}
