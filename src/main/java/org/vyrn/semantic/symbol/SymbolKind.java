package org.vyrn.semantic.symbol;

public enum SymbolKind
{
	VARIABLE("variable"),
	CONSTANT("constant");

	private final String description;

	SymbolKind(String description)
	{
		this.description = description;
	}

	public String getDescription()
	{
		return description;
	}
}
