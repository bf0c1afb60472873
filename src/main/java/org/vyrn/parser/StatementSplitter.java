package org.vyrn.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts raw source into {@code ;}-terminated statements and removes comments.
 * <p>
 * Comment characters are blanked out rather than deleted so every remaining
 * character keeps its line and column. A {@code ;} or comment marker inside a
 * double-quoted string is part of the string.
 */
public final class StatementSplitter
{
	private StatementSplitter()
	{
	}

	public static List<Statement> split(String source)
	{
		String cleaned = blankComments(source);
		List<Statement> statements = new ArrayList<>();
		Cursor cursor = new Cursor(cleaned);

		int start = 0;
		boolean inString = false;
		for (int i = 0; i < cleaned.length(); i++)
		{
			char c = cleaned.charAt(i);
			if (c == '"')
			{
				inString = !inString;
			}
			else if (c == ';' && !inString)
			{
				addStatement(cleaned, start, i, cursor, statements);
				start = i + 1;
			}
		}
		addStatement(cleaned, start, cleaned.length(), cursor, statements);
		return statements;
	}

	static String blankComments(String source)
	{
		StringBuilder out = new StringBuilder(source.length());
		boolean inString = false;
		int i = 0;
		while (i < source.length())
		{
			char c = source.charAt(i);
			char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';

			if (inString)
			{
				inString = c != '"';
				out.append(c);
				i++;
			}
			else if (c == '"')
			{
				inString = true;
				out.append(c);
				i++;
			}
			else if (c == '/' && next == '/')
			{
				while (i < source.length() && source.charAt(i) != '\n')
				{
					out.append(' ');
					i++;
				}
			}
			else if (c == '/' && next == '*')
			{
				int end = source.indexOf("*/", i + 2);
				int stop = end < 0 ? source.length() : end + 2;
				for (; i < stop; i++)
				{
					out.append(source.charAt(i) == '\n' ? '\n' : ' ');
				}
			}
			else
			{
				out.append(c);
				i++;
			}
		}
		return out.toString();
	}

	private static void addStatement(String text, int from, int to, Cursor cursor, List<Statement> statements)
	{
		int begin = from;
		int end = to;
		while (begin < end && Character.isWhitespace(text.charAt(begin)))
		{
			begin++;
		}
		while (end > begin && Character.isWhitespace(text.charAt(end - 1)))
		{
			end--;
		}
		if (begin == end)
		{
			return;
		}

		cursor.moveTo(begin);
		statements.add(new Statement(text.substring(begin, end), cursor.line, cursor.column, statements.size()));
	}

	/**
	 * Line and column of a position that only moves forward, so the whole
	 * source is scanned once.
	 */
	private static final class Cursor
	{
		private final String text;
		private int index = 0;
		private int line = 1;
		private int column = 1;

		Cursor(String text)
		{
			this.text = text;
		}

		void moveTo(int target)
		{
			for (; index < target; index++)
			{
				if (text.charAt(index) == '\n')
				{
					line++;
					column = 1;
				}
				else
				{
					column++;
				}
			}
		}
	}
}
