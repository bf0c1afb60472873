package org.vyrn.parser;

import java.util.Objects;

/**
 * A single lexical unit. Line and column are 1-based and point at the first
 * character of the token in the whole source.
 */
public final class Token
{
	private final TokenType type;
	private final String text;
	private final int line;
	private final int column;

	public Token(TokenType type, String text, int line, int column)
	{
		this.type = type;
		this.text = text;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
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

	public boolean is(TokenType type, String text)
	{
		return this.type == type && this.text.equals(text);
	}

	public boolean isSymbol(String text)
	{
		return is(TokenType.SYMBOL, text);
	}

	public boolean isOperator(String text)
	{
		return is(TokenType.BOOLEAN_OPERATOR, text);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Token other))
		{
			return false;
		}
		return line == other.line && column == other.column && type == other.type && text.equals(other.text);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, text, line, column);
	}

	@Override
	public String toString()
	{
		return type + "('" + text + "') at " + line + ":" + column;
	}
}
