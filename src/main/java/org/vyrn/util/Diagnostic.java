package org.vyrn.util;

/**
 * One problem found while translating a statement. Positions are 1-based and
 * refer to the whole source, not to the statement.
 */
public final class Diagnostic
{
	public enum Kind
	{
		PARSE_FAILURE("Syntax Error"),
		SEMANTIC_WARNING("Semantic Warning"),
		SEMANTIC_ERROR("Semantic Error");

		private final String label;

		Kind(String label)
		{
			this.label = label;
		}

		public String getLabel()
		{
			return label;
		}
	}

	private final Kind kind;
	private final String message;
	private final int line;
	private final int column;
	private final int statementIndex;

	public Diagnostic(Kind kind, String message, int line, int column, int statementIndex)
	{
		this.kind = kind;
		this.message = message;
		this.line = line;
		this.column = column;
		this.statementIndex = statementIndex;
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getMessage()
	{
		return message;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public int getStatementIndex()
	{
		return statementIndex;
	}

	public boolean isFatal()
	{
		return kind != Kind.SEMANTIC_WARNING;
	}

	@Override
	public String toString()
	{
		return String.format("[%s] line %d:%d - %s", kind.getLabel(), line, column, message);
	}
}
