package org.vyrn.ast;

/**
 * {@code <target> = <source>}. Exactly one of the source accessors is
 * meaningful, selected by {@link #getSourceKind()}.
 */
public final class Assignment implements AstNode
{
	public enum SourceKind
	{
		IDENTIFIER,
		LITERAL,
		BOOLEAN_EXPR
	}

	private final String targetName;
	private final SourceKind sourceKind;
	private final String sourceName;
	private final Literal sourceLiteral;
	private final BooleanOpTree sourceExpression;
	private final int line;
	private final int column;

	private Assignment(String targetName, SourceKind sourceKind, String sourceName, Literal sourceLiteral,
	                   BooleanOpTree sourceExpression, int line, int column)
	{
		this.targetName = targetName;
		this.sourceKind = sourceKind;
		this.sourceName = sourceName;
		this.sourceLiteral = sourceLiteral;
		this.sourceExpression = sourceExpression;
		this.line = line;
		this.column = column;
	}

	/**
	 * By-reference assignment: the target receives the current value of another variable.
	 */
	public static Assignment fromIdentifier(String target, String source, int line, int column)
	{
		return new Assignment(target, SourceKind.IDENTIFIER, source, null, null, line, column);
	}

	public static Assignment fromLiteral(String target, Literal source, int line, int column)
	{
		return new Assignment(target, SourceKind.LITERAL, null, source, null, line, column);
	}

	public static Assignment fromBooleanExpression(String target, BooleanOpTree source, int line, int column)
	{
		return new Assignment(target, SourceKind.BOOLEAN_EXPR, null, null, source, line, column);
	}

	public String getTargetName()
	{
		return targetName;
	}

	public SourceKind getSourceKind()
	{
		return sourceKind;
	}

	public boolean isReference()
	{
		return sourceKind == SourceKind.IDENTIFIER;
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public Literal getSourceLiteral()
	{
		return sourceLiteral;
	}

	public BooleanOpTree getSourceExpression()
	{
		return sourceExpression;
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
		return visitor.visitAssignment(this);
	}
}
