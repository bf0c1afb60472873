package org.vyrn.ast;

import java.util.List;

/**
 * Unfolded boolean expression at one precedence level.
 * <p>
 * Infix form: {@code operands.size() == operators.size() + 1}, combined left
 * to right. Prefix form (logical NOT): one operand and the single operator
 * {@code "!"}. Operands are bool {@link Literal}s or nested trees.
 */
public final class BooleanOpTree implements AstNode
{
	public static final String NOT = "!";

	private final List<AstNode> operands;
	private final List<String> operators;

	public BooleanOpTree(List<AstNode> operands, List<String> operators)
	{
		boolean prefix = operands.size() == 1 && operators.size() == 1 && NOT.equals(operators.get(0));
		if (!prefix && operands.size() != operators.size() + 1)
		{
			throw new IllegalArgumentException("Malformed boolean tree: " + operands.size() + " operand(s), " + operators.size() + " operator(s)");
		}
		this.operands = List.copyOf(operands);
		this.operators = List.copyOf(operators);
	}

	public static BooleanOpTree not(AstNode operand)
	{
		return new BooleanOpTree(List.of(operand), List.of(NOT));
	}

	public List<AstNode> getOperands()
	{
		return operands;
	}

	public List<String> getOperators()
	{
		return operators;
	}

	public boolean isNegation()
	{
		return operands.size() == 1 && operators.size() == 1;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitBooleanOpTree(this);
	}
}
