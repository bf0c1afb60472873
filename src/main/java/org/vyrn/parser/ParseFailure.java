package org.vyrn.parser;

/**
 * Grammar mismatch pinned to the offending token. Aborts the current
 * statement only.
 */
public class ParseFailure extends RuntimeException
{
	private final int line;
	private final int column;

	public ParseFailure(String message, int line, int column)
	{
		super(message);
		this.line = line;
		this.column = column;
	}

	public ParseFailure(String message, Token token)
	{
		this(message, token.getLine(), token.getColumn());
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
