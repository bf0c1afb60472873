package org.vyrn.ast;

/**
 * {@code log(<name-or-literal>)}
 */
public final class LogCall implements AstNode
{
	private final String variableName;
	private final Literal literal;
	private final int line;
	private final int column;

	private LogCall(String variableName, Literal literal, int line, int column)
	{
		this.variableName = variableName;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public static LogCall ofVariable(String name, int line, int column)
	{
		return new LogCall(name, null, line, column);
	}

	public static LogCall ofLiteral(Literal literal, int line, int column)
	{
		return new LogCall(null, literal, line, column);
	}

	public boolean isVariable()
	{
		return variableName != null;
	}

	public String getVariableName()
	{
		return variableName;
	}

	public Literal getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitLogCall(this);
	}
}
