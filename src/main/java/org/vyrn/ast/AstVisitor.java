package org.vyrn.ast;

public interface AstVisitor<R>
{
	R visitLiteral(Literal literal);

	R visitDeclaration(Declaration declaration);

	R visitAssignment(Assignment assignment);

	R visitLogCall(LogCall logCall);

	R visitBooleanOpTree(BooleanOpTree tree);
}
