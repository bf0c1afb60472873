// File: src/main/java/org/vyrn/semantic/type/PrimitiveType.java
package org.vyrn.semantic.type;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public final class PrimitiveType
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType INT = new PrimitiveType("int", "int");
	public static final PrimitiveType FLOAT = new PrimitiveType("float", "float");
	public static final PrimitiveType BOOL = new PrimitiveType("bool", "bool");
	public static final PrimitiveType STRING = new PrimitiveType("string", "std::string");

	// --- The Single Source of Truth for all type keywords ---
	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new HashMap<>();
		map.put("int", INT);
		map.put("float", FLOAT);
		map.put("bool", BOOL);
		map.put("string", STRING);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	private final String name;
	private final String targetName;

	private PrimitiveType(String name, String targetName)
	{
		this.name = name;
		this.targetName = targetName;
	}

	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return The spelling of this type in the emitted C++ code.
	 */
	public String getTargetName()
	{
		return targetName;
	}

	public boolean isNumeric()
	{
		return this == INT || this == FLOAT;
	}

	public boolean isBoolean()
	{
		return this == BOOL;
	}

	public boolean isString()
	{
		return this == STRING;
	}

	/**
	 * Converts a constant the way a C++ initialisation of this type would:
	 * int truncates toward zero, float rounds to single precision.
	 *
	 * @return The stored value, or {@code null} when it is unknown, does not
	 * fit an int, or this type is not numeric.
	 */
	public Double coerce(Double value)
	{
		if (value == null || value.isNaN() || value.isInfinite())
		{
			return null;
		}
		if (this == INT)
		{
			if (value >= (double) Integer.MAX_VALUE + 1 || value <= (double) Integer.MIN_VALUE - 1)
			{
				return null;
			}
			return (double) value.longValue();
		}
		if (this == FLOAT)
		{
			return (double) value.floatValue();
		}
		return null;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
