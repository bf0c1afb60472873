package org.vyrn.codegen;

import org.vyrn.ast.Literal;
import org.vyrn.semantic.type.PrimitiveType;

/**
 * Spelling of types and literal values in the emitted C++.
 */
public final class TypeConverter
{
	private TypeConverter()
	{
	}

	public static String toTargetType(PrimitiveType type)
	{
		return type.getTargetName();
	}

	/**
	 * Strings are quoted, booleans become {@code true}/{@code false}, a comma
	 * decimal separator in floats becomes a period, ints and rendered
	 * arithmetic pass through. A reference literal is emitted as the name it
	 * refers to.
	 */
	public static String formatLiteral(Literal literal)
	{
		if (literal.isReference())
		{
			return literal.getRawText();
		}
		return switch (literal.getKind())
		{
			case STRING -> "\"" + literal.getRawText() + "\"";
			case BOOL -> literal.asBoolean() ? "true" : "false";
			case FLOAT -> literal.getRawText().replace(',', '.');
			case INT -> literal.getRawText();
		};
	}

	/**
	 * Formats the right-hand side literal of an assignment to a variable of
	 * type {@code targetType}. A bare value assigned to a string is quoted
	 * unless it already contains a quote character.
	 */
	public static String formatAssignedLiteral(Literal literal, PrimitiveType targetType)
	{
		if (targetType != null && targetType.isString() && !literal.getRawText().contains("\""))
		{
			return "\"" + literal.getRawText() + "\"";
		}
		return formatLiteral(literal);
	}
}
