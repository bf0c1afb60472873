package org.vyrn.ast;

import org.vyrn.semantic.type.PrimitiveType;

/**
 * {@code let|const <type> <name> = <value>}
 */
public final class Declaration implements AstNode
{
	private final boolean constant;
	private final PrimitiveType declaredType;
	private final String name;
	private final Literal value;
	private final int line;
	private final int column;

	public Declaration(boolean constant, PrimitiveType declaredType, String name, Literal value, int line, int column)
	{
		this.constant = constant;
		this.declaredType = declaredType;
		this.name = name;
		this.value = value;
		this.line = line;
		this.column = column;
	}

	public boolean isConst()
	{
		return constant;
	}

	public PrimitiveType getDeclaredType()
	{
		return declaredType;
	}

	public String getName()
	{
		return name;
	}

	public Literal getValue()
	{
		return value;
	}

	public boolean isReference()
	{
		return value.isReference();
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
		return visitor.visitDeclaration(this);
	}
}
