// File: src/main/java/org/vyrn/semantic/symbol/SymbolEntry.java
package org.vyrn.semantic.symbol;

import org.vyrn.semantic.type.PrimitiveType;

public class SymbolEntry
{
	private final String name;
	private final PrimitiveType type;
	private final boolean isReference;
	private final SymbolKind kind;
	private String value;
	private Double constantValue;

	public SymbolEntry(String name, PrimitiveType type, String value, boolean isReference, SymbolKind kind)
	{
		this(name, type, value, null, isReference, kind);
	}

	public SymbolEntry(String name, PrimitiveType type, String value, Double constantValue, boolean isReference, SymbolKind kind)
	{
		this.name = name;
		this.type = type;
		this.value = value;
		this.constantValue = constantValue;
		this.isReference = isReference;
		this.kind = kind;
	}

	public String getName()
	{
		return name;
	}

	public PrimitiveType getType()
	{
		return type;
	}

	/**
	 * @return The last value text tracked for this name, as written in the source.
	 */
	public String getValue()
	{
		return value;
	}

	public void setValue(String value)
	{
		this.value = value;
	}

	/**
	 * @return What an int or float variable held when it was last written,
	 * evaluated at that point; {@code null} if that was not a constant.
	 */
	public Double getConstantValue()
	{
		return constantValue;
	}

	public void setConstantValue(Double constantValue)
	{
		this.constantValue = constantValue;
	}

	public boolean isReference()
	{
		return isReference;
	}

	public SymbolKind getKind()
	{
		return kind;
	}

	public boolean isConst()
	{
		return kind == SymbolKind.CONSTANT;
	}

	public SymbolEntry copy()
	{
		return new SymbolEntry(name, type, value, constantValue, isReference, kind);
	}
}
