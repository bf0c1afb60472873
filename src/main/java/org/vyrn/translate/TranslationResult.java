package org.vyrn.translate;

import org.vyrn.semantic.symbol.SymbolEntry;
import org.vyrn.util.Diagnostic;

import java.util.List;
import java.util.Map;

public class TranslationResult
{
	private final String code;
	private final List<Diagnostic> diagnostics;
	private final Map<String, SymbolEntry> symbols;

	public TranslationResult(String code, List<Diagnostic> diagnostics, Map<String, SymbolEntry> symbols)
	{
		this.code = code;
		this.diagnostics = List.copyOf(diagnostics);
		this.symbols = symbols;
	}

	/**
	 * @return The translated statements, without program boilerplate.
	 */
	public String getCode()
	{
		return code;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public List<Diagnostic> getDiagnostics(Diagnostic.Kind kind)
	{
		return diagnostics.stream().filter(d -> d.getKind() == kind).toList();
	}

	/**
	 * @return The symbol table as it was at the end of the run.
	 */
	public Map<String, SymbolEntry> getSymbols()
	{
		return symbols;
	}

	/**
	 * @return {@code true} if any statement failed to parse or was rejected.
	 */
	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(Diagnostic::isFatal);
	}
}
