package org.vyrn.codegen;

import org.vyrn.ast.Assignment;
import org.vyrn.ast.AstNode;
import org.vyrn.ast.AstVisitor;
import org.vyrn.ast.BooleanOpTree;
import org.vyrn.ast.Declaration;
import org.vyrn.ast.Literal;
import org.vyrn.ast.LogCall;
import org.vyrn.parser.BooleanFolder;
import org.vyrn.semantic.SemanticChecker;
import org.vyrn.semantic.symbol.SymbolEntry;
import org.vyrn.semantic.type.PrimitiveType;
import org.vyrn.translate.TranslationContext;
import org.vyrn.util.Debug;

/**
 * Lowers one statement to C++ and appends it to the output buffer of the
 * {@link TranslationContext}.
 * <p>
 * Each call to {@link #emit(AstNode)} appends one terminated statement. A
 * redeclaration is preceded by a warning comment and still emitted; an
 * assignment rejected by the {@link SemanticChecker} is replaced by an error
 * comment.
 */
public class CodeEmitter implements AstVisitor<Void>
{
	private final StringBuilder out;
	private final SemanticChecker checker;

	public CodeEmitter(TranslationContext context)
	{
		this.out = context.getOutput();
		this.checker = new SemanticChecker(context.getSymbols(), context.getErrorHandler());
	}

	public void emit(AstNode root)
	{
		int before = out.length();
		root.accept(this);
		Debug.logDebug("Emitted: " + out.substring(before).stripTrailing());
	}

	@Override
	public Void visitDeclaration(Declaration declaration)
	{
		SemanticChecker.DeclarationOutcome outcome = checker.declare(declaration);
		String kind = declaration.isConst() ? "constant" : "variable";
		switch (outcome)
		{
			case REDECLARED -> out.append("// Warning: ").append(kind).append(" '")
					.append(declaration.getName()).append("' already declared\n");
			case KIND_CONFLICT -> out.append("// Warning: '").append(declaration.getName())
					.append("' already declared with a different kind\n");
		}

		if (declaration.isConst())
		{
			out.append("const ");
		}
		out.append(TypeConverter.toTargetType(declaration.getDeclaredType()))
				.append(' ')
				.append(declaration.getName())
				.append(" = ")
				.append(TypeConverter.formatLiteral(declaration.getValue()))
				.append(";\n");
		return null;
	}

	@Override
	public Void visitAssignment(Assignment assignment)
	{
		String target = assignment.getTargetName();
		PrimitiveType targetType = checker.resolve(target).map(SymbolEntry::getType).orElse(null);

		String code;
		String trackedValue;
		Double constant = null;
		switch (assignment.getSourceKind())
		{
			case IDENTIFIER ->
			{
				code = assignment.getSourceName();
				trackedValue = checker.currentValueOf(assignment.getSourceName());
				if (targetType != null)
				{
					constant = targetType.coerce(checker.resolve(assignment.getSourceName())
							.map(SymbolEntry::getConstantValue)
							.orElse(null));
				}
			}
			case LITERAL ->
			{
				code = TypeConverter.formatAssignedLiteral(assignment.getSourceLiteral(), targetType);
				trackedValue = assignment.getSourceLiteral().getRawText();
				constant = assignment.getSourceLiteral().getConstantValue();
			}
			default ->
			{
				Literal folded = BooleanFolder.foldToLiteral(assignment.getSourceExpression());
				code = TypeConverter.formatLiteral(folded);
				trackedValue = folded.getRawText();
			}
		}

		switch (checker.assign(assignment, trackedValue, constant))
		{
			case UNDECLARED -> out.append("// Error: variable '").append(target).append("' is not declared\n");
			case CONSTANT -> out.append("// Error: cannot assign to constant '").append(target).append("'\n");
			case ALLOWED -> out.append(target).append(" = ").append(code).append(";\n");
		}
		return null;
	}

	@Override
	public Void visitLogCall(LogCall logCall)
	{
		out.append("std::cout << ");
		if (logCall.isVariable())
		{
			String name = logCall.getVariableName();
			if (checker.checkLogTarget(name, logCall.getLine(), logCall.getColumn()))
			{
				out.append(name);
			}
			else
			{
				out.append("\"[Undefined variable: ").append(name).append("]\"");
			}
		}
		else
		{
			out.append(TypeConverter.formatLiteral(logCall.getLiteral()));
		}
		out.append(" << std::endl;\n");
		return null;
	}

	// A bare value is emitted as an expression statement.
	@Override
	public Void visitLiteral(Literal literal)
	{
		out.append(TypeConverter.formatLiteral(literal)).append(";\n");
		return null;
	}

	@Override
	public Void visitBooleanOpTree(BooleanOpTree tree)
	{
		return visitLiteral(BooleanFolder.foldToLiteral(tree));
	}
}
