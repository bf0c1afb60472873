package org.vyrn.ast;

/**
 * Root of the closed node hierarchy. Every node kind has a matching method on
 * {@link AstVisitor}, so a visitor handles all kinds or does not compile.
 */
public interface AstNode
{
	<R> R accept(AstVisitor<R> visitor);
}
