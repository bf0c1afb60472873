package org.vyrn.semantic;

import org.vyrn.ast.Assignment;
import org.vyrn.ast.Declaration;
import org.vyrn.semantic.symbol.SymbolEntry;
import org.vyrn.semantic.symbol.SymbolKind;
import org.vyrn.semantic.symbol.SymbolTable;
import org.vyrn.util.Debug;
import org.vyrn.util.ErrorHandler;

import java.util.Optional;

/**
 * Declaration and mutability rules over the flat {@link SymbolTable}.
 * Every problem is reported to the {@link ErrorHandler}; none of them stop
 * the translation.
 */
public class SemanticChecker
{
	public enum DeclarationOutcome
	{
		/** First declaration of the name; an entry was added. */
		DEFINED,
		/** Same name, same kind. The first entry is kept. */
		REDECLARED,
		/** Same name, opposite kind. The first entry is kept. */
		KIND_CONFLICT
	}

	public enum AssignmentOutcome
	{
		ALLOWED,
		UNDECLARED,
		CONSTANT
	}

	private final SymbolTable symbols;
	private final ErrorHandler errorHandler;

	public SemanticChecker(SymbolTable symbols, ErrorHandler errorHandler)
	{
		this.symbols = symbols;
		this.errorHandler = errorHandler;
	}

	public DeclarationOutcome declare(Declaration declaration)
	{
		SymbolKind kind = declaration.isConst() ? SymbolKind.CONSTANT : SymbolKind.VARIABLE;
		Optional<SymbolEntry> existing = symbols.resolve(declaration.getName());

		if (existing.isPresent())
		{
			SymbolEntry previous = existing.get();
			if (previous.getKind() == kind)
			{
				errorHandler.logWarning(declaration.getLine(), declaration.getColumn(),
						capitalize(kind.getDescription()) + " '" + declaration.getName() + "' is already declared");
				return DeclarationOutcome.REDECLARED;
			}

			errorHandler.logWarning(declaration.getLine(), declaration.getColumn(),
					"'" + declaration.getName() + "' is declared as a " + kind.getDescription()
							+ " but was already declared as a " + previous.getKind().getDescription());
			return DeclarationOutcome.KIND_CONFLICT;
		}

		String value = declaration.getValue().getRawText();
		if (declaration.isReference())
		{
			value = currentValueOf(value);
		}
		Double constant = declaration.getValue().getConstantValue();
		symbols.define(new SymbolEntry(declaration.getName(), declaration.getDeclaredType(), value, constant, declaration.isReference(), kind));
		Debug.logDebug("Defined " + kind.getDescription() + " '" + declaration.getName() + "' = " + value
				+ (constant != null ? " (" + constant + ")" : ""));
		return DeclarationOutcome.DEFINED;
	}

	/**
	 * Checks the target of an assignment and, when it may be written, records
	 * {@code newValue} as its tracked value and {@code newConstant} as what
	 * that value evaluated to.
	 */
	public AssignmentOutcome assign(Assignment assignment, String newValue, Double newConstant)
	{
		Optional<SymbolEntry> target = symbols.resolve(assignment.getTargetName());
		if (target.isEmpty())
		{
			errorHandler.logError(assignment.getLine(), assignment.getColumn(),
					"Variable '" + assignment.getTargetName() + "' is not declared");
			return AssignmentOutcome.UNDECLARED;
		}
		if (target.get().isConst())
		{
			errorHandler.logError(assignment.getLine(), assignment.getColumn(),
					"Cannot assign to constant '" + assignment.getTargetName() + "'");
			return AssignmentOutcome.CONSTANT;
		}

		target.get().setValue(newValue);
		target.get().setConstantValue(newConstant);
		return AssignmentOutcome.ALLOWED;
	}

	public boolean checkLogTarget(String name, int line, int column)
	{
		if (symbols.isDeclared(name))
		{
			return true;
		}
		errorHandler.logWarning(line, column, "Logging undeclared variable '" + name + "'");
		return false;
	}

	/**
	 * Value text a by-reference copy of {@code name} receives: its tracked
	 * value when known, otherwise the name itself.
	 */
	public String currentValueOf(String name)
	{
		return symbols.resolve(name).map(SymbolEntry::getValue).orElse(name);
	}

	public Optional<SymbolEntry> resolve(String name)
	{
		return symbols.resolve(name);
	}

	private static String capitalize(String text)
	{
		return Character.toUpperCase(text.charAt(0)) + text.substring(1);
	}
}
