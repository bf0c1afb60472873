package org.vyrn.translate;

import org.vyrn.semantic.symbol.SymbolTable;
import org.vyrn.util.ErrorHandler;

/**
 * State shared by the statements of one translation request: the symbol
 * table, the output buffer and the diagnostics. A new context is built for
 * every request and never shared between threads.
 */
public class TranslationContext
{
	private final SymbolTable symbols = new SymbolTable();
	private final StringBuilder output = new StringBuilder();
	private final ErrorHandler errorHandler = new ErrorHandler();

	public SymbolTable getSymbols()
	{
		return symbols;
	}

	public StringBuilder getOutput()
	{
		return output;
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}
}
