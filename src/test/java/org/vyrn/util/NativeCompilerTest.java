package org.vyrn.util;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vyrn.codegen.CodeGenerator;
import org.vyrn.translate.Translator;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Compiles and runs translated programs. Skipped when no g++ is on the PATH.
 */
class NativeCompilerTest
{
	@TempDir
	Path tempDir;

	private final NativeCompiler compiler = new NativeCompiler("g++", Duration.ofSeconds(60));

	@BeforeAll
	static void requireCompiler()
	{
		assumeTrue(ProcessUtils.isCommandAvailable("g++"), "g++ is not available");
	}

	private ProcessResult run(String source) throws IOException, InterruptedException
	{
		Path cpp = new CodeGenerator(new Translator().translate(source).getCode(), tempDir.resolve("prog.cpp")).generate();
		return compiler.compileAndRun(cpp, tempDir.resolve("prog"));
	}

	@Test
	void printsDeclaredValues() throws IOException, InterruptedException
	{
		ProcessResult result = run("let int x = 42; log(x);"
				+ "let float f = 3,14; log(f);"
				+ "let bool b = true; log(b);"
				+ "let string s = \"hi there\"; log(s);");

		assertTrue(result.isSuccess(), result.getStderr());
		assertEquals("42\n3.14\ntrue\nhi there\n", result.getStdout());
	}

	@Test
	void printedValuesMatchDeclaredLiterals() throws IOException, InterruptedException
	{
		ProcessResult result = run("let int a = 0; log(a); let int b = -7; log(b); let int c = 2147483647; log(c);"
				+ "let float f1 = 0,5; log(f1); let float f2 = -2.75; log(f2); let float f3 = 123456; log(f3);"
				+ "let float f4 = 0.001; log(f4); let float f5 = 3.14159; log(f5); let float f6 = 1e-3; log(f6);"
				+ "let bool t = false; log(t); let string e = \"\"; log(e);");

		assertTrue(result.isSuccess(), result.getStderr());
		assertEquals("0\n-7\n2147483647\n0.5\n-2.75\n123456\n0.001\n3.14159\n0.001\nfalse\n\n", result.getStdout());
	}

	@Test
	void floatsBeyondSixDigitsAreRounded() throws IOException, InterruptedException
	{
		ProcessResult result = run("let float f = 3.14159265; log(f); let float g = 2.5e10; log(g);");

		assertEquals("3.14159\n2.5e+10\n", result.getStdout());
	}

	@Test
	void foldedBooleansAgreeWithTheProgram() throws IOException, InterruptedException
	{
		ProcessResult result = run("let int x = 1; let int y = x; x = 10; let bool b = y > 5; log(y); log(b);"
				+ "let int a = 7 / 2; let bool c = a > 3; log(a); log(c);"
				+ "let int n = 1; let int m = - -n; log(n); log(m);");

		assertTrue(result.isSuccess(), result.getStderr());
		assertEquals("1\nfalse\n3\nfalse\n1\n1\n", result.getStdout());
	}

	@Test
	void arithmeticIsEvaluatedByTheProgram() throws IOException, InterruptedException
	{
		ProcessResult result = run("let int x = 2 + 3 * 4; x = x - 4; log(x); let float r = sqrt(16); log(r);");

		assertEquals("10\n4\n", result.getStdout());
	}

	@Test
	void rejectedStatementsDoNotBreakTheProgram() throws IOException, InterruptedException
	{
		ProcessResult result = run("const int c = 1; c = 2; y = 3; log(c); log(y);");

		assertTrue(result.isSuccess(), result.getStderr());
		assertEquals("1\n[Undefined variable: y]\n", result.getStdout());
	}

	@Test
	void reportsCompileErrors() throws IOException, InterruptedException
	{
		Path cpp = new CodeGenerator("int x = ;\n", tempDir.resolve("broken.cpp")).generate();

		ProcessResult result = compiler.compile(cpp, tempDir.resolve("broken"));

		assertFalse(result.isSuccess());
		assertFalse(result.getStderr().isEmpty());
	}
}
