package org.vyrn.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	public static final String SOURCE_EXTENSION = ".vy";

	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath, StandardCharsets.UTF_8);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * Replaces the extension of {@code file} (if any) with {@code newExtension}.
	 */
	public static Path withExtension(Path file, String newExtension)
	{
		String baseName = file.getFileName().toString().replaceFirst("[.][^.]+$", "");
		return file.resolveSibling(baseName + newExtension);
	}

	public static boolean isSourceFile(Path path)
	{
		return SOURCE_EXTENSION.equals(getFileExtension(path));
	}
}
