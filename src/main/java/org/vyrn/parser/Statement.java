package org.vyrn.parser;

/**
 * One comment-free statement cut out of the source, with the position of its
 * first character.
 */
public final class Statement
{
	private final String text;
	private final int line;
	private final int column;
	private final int index;

	public Statement(String text, int line, int column, int index)
	{
		this.text = text;
		this.line = line;
		this.column = column;
		this.index = index;
	}

	public String getText()
	{
		return text;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public int getIndex()
	{
		return index;
	}

	@Override
	public String toString()
	{
		return "#" + index + " " + line + ":" + column + " " + text;
	}
}
