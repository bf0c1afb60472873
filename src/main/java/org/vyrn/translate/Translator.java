package org.vyrn.translate;

import org.vyrn.ast.AstNode;
import org.vyrn.codegen.CodeEmitter;
import org.vyrn.parser.Lexer;
import org.vyrn.parser.ParseFailure;
import org.vyrn.parser.Parser;
import org.vyrn.parser.Statement;
import org.vyrn.parser.StatementSplitter;
import org.vyrn.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs split, tokenize, parse and emit over a whole source, one statement at
 * a time. A bad statement is reported and skipped; the run always completes
 * with a best-effort buffer.
 */
public class Translator
{
	public TranslationResult translate(String source)
	{
		return translateStatements(StatementSplitter.split(source));
	}

	/**
	 * Translates statements that were already split and stripped of comments.
	 * Positions are numbered as if each statement started a new line.
	 */
	public TranslationResult translateTexts(List<String> statements)
	{
		List<Statement> numbered = new ArrayList<>();
		for (int i = 0; i < statements.size(); i++)
		{
			numbered.add(new Statement(statements.get(i), i + 1, 1, i));
		}
		return translateStatements(numbered);
	}

	public TranslationResult translateStatements(List<Statement> statements)
	{
		Debug.logDebug("Translating " + statements.size() + " statement(s)...");
		TranslationContext context = new TranslationContext();
		CodeEmitter emitter = new CodeEmitter(context);

		for (Statement statement : statements)
		{
			translateStatement(statement, context, emitter);
		}

		return new TranslationResult(
				context.getOutput().toString(),
				context.getErrorHandler().getDiagnostics(),
				context.getSymbols().snapshot());
	}

	private void translateStatement(Statement statement, TranslationContext context, CodeEmitter emitter)
	{
		context.getErrorHandler().setStatementIndex(statement.getIndex());
		try
		{
			Parser parser = new Parser(new Lexer(statement.getText(), statement.getLine(), statement.getColumn()), context);
			AstNode root = parser.parseStatement();
			emitter.emit(root);
		}
		catch (ParseFailure failure)
		{
			context.getErrorHandler().logParseFailure(failure);
		}
	}
}
