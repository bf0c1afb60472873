package org.vyrn.parser;

import org.vyrn.ast.Assignment;
import org.vyrn.ast.AstNode;
import org.vyrn.ast.AstVisitor;
import org.vyrn.ast.BooleanOpTree;
import org.vyrn.ast.Declaration;
import org.vyrn.ast.Literal;
import org.vyrn.ast.LiteralKind;
import org.vyrn.ast.LogCall;

import java.util.List;

/**
 * Reduces a {@link BooleanOpTree} to a single bool {@link Literal}.
 * <p>
 * Operators of one tree are combined left to right. The relational spellings
 * act here as combinators over two boolean values, for example {@code <} is
 * {@code !L && R}.
 */
public final class BooleanFolder implements AstVisitor<Boolean>
{
	private static final BooleanFolder INSTANCE = new BooleanFolder();

	private BooleanFolder()
	{
	}

	public static Literal foldToLiteral(BooleanOpTree tree)
	{
		return Literal.ofBool(fold(tree));
	}

	public static boolean fold(AstNode node)
	{
		return node.accept(INSTANCE);
	}

	public static boolean apply(String op, boolean l, boolean r)
	{
		return switch (op)
		{
			case "&&" -> l && r;
			case "!&&" -> !(l && r);
			case "||" -> l || r;
			case "!||" -> !(l || r);
			case "xor", "!=" -> l != r;
			case "nxor", "==" -> l == r;
			case "=>", "<=" -> !l || r;
			case "!=>", ">" -> l && !r;
			case "<" -> !l && r;
			case ">=" -> l || !r;
			default -> throw new IllegalArgumentException("Unknown boolean operator '" + op + "'");
		};
	}

	@Override
	public Boolean visitLiteral(Literal literal)
	{
		if (literal.getKind() != LiteralKind.BOOL)
		{
			throw new IllegalArgumentException("Not a boolean operand: " + literal.getRawText());
		}
		return literal.asBoolean();
	}

	@Override
	public Boolean visitBooleanOpTree(BooleanOpTree tree)
	{
		List<AstNode> operands = tree.getOperands();
		if (tree.isNegation())
		{
			return !fold(operands.get(0));
		}

		boolean value = fold(operands.get(0));
		for (int i = 0; i < tree.getOperators().size(); i++)
		{
			value = apply(tree.getOperators().get(i), value, fold(operands.get(i + 1)));
		}
		return value;
	}

	@Override
	public Boolean visitDeclaration(Declaration declaration)
	{
		throw new IllegalArgumentException("A declaration is not a boolean operand");
	}

	@Override
	public Boolean visitAssignment(Assignment assignment)
	{
		throw new IllegalArgumentException("An assignment is not a boolean operand");
	}

	@Override
	public Boolean visitLogCall(LogCall logCall)
	{
		throw new IllegalArgumentException("A log call is not a boolean operand");
	}
}
