package org.vyrn.codegen;

import org.vyrn.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Wraps translated statements into a complete C++ program and writes it out.
 */
public class CodeGenerator
{
	// Floats print with float's decimal precision (6 significant digits), so
	// any float literal of up to 6 significant digits prints back as the same
	// value. Magnitudes outside [1e-4, 1e6) print in exponent form (2.5e+10).
	static final String PROLOGUE = "#include <iostream>\n"
			+ "#include <iomanip>\n"
			+ "#include <limits>\n"
			+ "#include <string>\n"
			+ "#include <cmath>\n"
			+ "\n"
			+ "int main()\n"
			+ "{\n"
			+ "std::cout << std::boolalpha << std::setprecision(std::numeric_limits<float>::digits10);\n";

	static final String EPILOGUE = "return 0;\n}\n";

	private final String body;
	private final Path outputPath;

	public CodeGenerator(String body, Path outputPath)
	{
		this.body = body;
		this.outputPath = outputPath;
	}

	public static String wrapProgram(String body)
	{
		return PROLOGUE + body + EPILOGUE;
	}

	public Path generate() throws IOException
	{
		// Ensure parent directory exists before writing
		if (outputPath.getParent() != null)
		{
			Files.createDirectories(outputPath.getParent());
		}

		Files.writeString(outputPath, wrapProgram(body));
		Debug.logDebug("C++ program written to " + outputPath);
		return outputPath;
	}
}
