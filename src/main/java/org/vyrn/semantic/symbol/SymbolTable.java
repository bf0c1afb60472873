// File: src/main/java/org/vyrn/semantic/symbol/SymbolTable.java
package org.vyrn.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One flat namespace per translation request. There are no nested scopes.
 */
public class SymbolTable
{
	private final Map<String, SymbolEntry> symbols = new LinkedHashMap<>();

	/**
	 * Adds the entry unless its name is already taken.
	 *
	 * @return {@code true} if the entry was added.
	 */
	public boolean define(SymbolEntry entry)
	{
		return symbols.putIfAbsent(entry.getName(), entry) == null;
	}

	public Optional<SymbolEntry> resolve(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public boolean isDeclared(String name)
	{
		return symbols.containsKey(name);
	}

	public Map<String, SymbolEntry> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	/**
	 * @return A deep copy, detached from further updates to this table.
	 */
	public Map<String, SymbolEntry> snapshot()
	{
		Map<String, SymbolEntry> copy = new LinkedHashMap<>();
		symbols.forEach((name, entry) -> copy.put(name, entry.copy()));
		return Collections.unmodifiableMap(copy);
	}

	public int size()
	{
		return symbols.size();
	}
}
