// File: src/main/java/org/vyrn/util/ErrorHandler.java
package org.vyrn.util;

import org.vyrn.parser.ParseFailure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one translation request and echoes each of them
 * through {@link Debug}. Nothing here aborts the run.
 */
public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private int statementIndex = -1;
	private boolean hasErrors = false;

	public void setStatementIndex(int statementIndex)
	{
		this.statementIndex = statementIndex;
	}

	public void logParseFailure(ParseFailure failure)
	{
		record(new Diagnostic(Diagnostic.Kind.PARSE_FAILURE, failure.getMessage(), failure.getLine(), failure.getColumn(), statementIndex));
	}

	public void logWarning(int line, int column, String msg)
	{
		record(new Diagnostic(Diagnostic.Kind.SEMANTIC_WARNING, msg, line, column, statementIndex));
	}

	public void logError(int line, int column, String msg)
	{
		record(new Diagnostic(Diagnostic.Kind.SEMANTIC_ERROR, msg, line, column, statementIndex));
	}

	private void record(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		if (diagnostic.isFatal())
		{
			hasErrors = true;
			Debug.logError(diagnostic.toString());
		}
		else
		{
			Debug.logWarning(diagnostic.toString());
		}
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public long count(Diagnostic.Kind kind)
	{
		return diagnostics.stream().filter(d -> d.getKind() == kind).count();
	}
}
