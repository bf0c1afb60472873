package org.vyrn.ast;

import org.vyrn.semantic.type.PrimitiveType;

public enum LiteralKind
{
	INT,
	FLOAT,
	BOOL,
	STRING;

	public static LiteralKind of(PrimitiveType type)
	{
		if (type == PrimitiveType.INT)
		{
			return INT;
		}
		if (type == PrimitiveType.FLOAT)
		{
			return FLOAT;
		}
		if (type == PrimitiveType.BOOL)
		{
			return BOOL;
		}
		return STRING;
	}
}
