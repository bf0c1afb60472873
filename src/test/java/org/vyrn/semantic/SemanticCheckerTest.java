package org.vyrn.semantic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.vyrn.ast.Assignment;
import org.vyrn.ast.Declaration;
import org.vyrn.ast.Literal;
import org.vyrn.ast.LiteralKind;
import org.vyrn.semantic.symbol.SymbolEntry;
import org.vyrn.semantic.symbol.SymbolKind;
import org.vyrn.semantic.symbol.SymbolTable;
import org.vyrn.semantic.type.PrimitiveType;
import org.vyrn.util.Diagnostic;
import org.vyrn.util.ErrorHandler;

import static org.junit.jupiter.api.Assertions.*;

class SemanticCheckerTest
{
	private SymbolTable symbols;
	private ErrorHandler errors;
	private SemanticChecker checker;

	@BeforeEach
	void setUp()
	{
		symbols = new SymbolTable();
		errors = new ErrorHandler();
		checker = new SemanticChecker(symbols, errors);
	}

	private static Declaration let(String name, String value)
	{
		return new Declaration(false, PrimitiveType.INT, name, Literal.numeric(LiteralKind.INT, value, Double.valueOf(value)), 1, 1);
	}

	private static Declaration constant(String name, String value)
	{
		return new Declaration(true, PrimitiveType.INT, name, Literal.numeric(LiteralKind.INT, value, Double.valueOf(value)), 1, 1);
	}

	private static Assignment assign(String name, String value)
	{
		return Assignment.fromLiteral(name, Literal.numeric(LiteralKind.INT, value, Double.valueOf(value)), 2, 1);
	}

	@Test
	void definesNewName()
	{
		assertEquals(SemanticChecker.DeclarationOutcome.DEFINED, checker.declare(let("x", "1")));

		SymbolEntry entry = symbols.resolve("x").orElseThrow();
		assertEquals(PrimitiveType.INT, entry.getType());
		assertEquals("1", entry.getValue());
		assertEquals(1.0, entry.getConstantValue());
		assertEquals(SymbolKind.VARIABLE, entry.getKind());
		assertTrue(errors.getDiagnostics().isEmpty());
	}

	@Test
	void redeclarationWarnsAndKeepsFirstEntry()
	{
		checker.declare(let("x", "1"));

		assertEquals(SemanticChecker.DeclarationOutcome.REDECLARED, checker.declare(let("x", "2")));
		assertEquals("1", symbols.resolve("x").orElseThrow().getValue());
		assertEquals(1.0, symbols.resolve("x").orElseThrow().getConstantValue());
		assertEquals(1, errors.count(Diagnostic.Kind.SEMANTIC_WARNING));
		assertEquals("Variable 'x' is already declared", errors.getDiagnostics().get(0).getMessage());
		assertFalse(errors.hasErrors());
	}

	@Test
	void oppositeKindRedeclarationIsFlagged()
	{
		checker.declare(let("x", "1"));

		assertEquals(SemanticChecker.DeclarationOutcome.KIND_CONFLICT, checker.declare(constant("x", "2")));
		assertEquals(SymbolKind.VARIABLE, symbols.resolve("x").orElseThrow().getKind());
		assertEquals("'x' is declared as a constant but was already declared as a variable",
				errors.getDiagnostics().get(0).getMessage());
		assertEquals(Diagnostic.Kind.SEMANTIC_WARNING, errors.getDiagnostics().get(0).getKind());
	}

	@Test
	void assignmentUpdatesTrackedValue()
	{
		checker.declare(let("x", "1"));

		assertEquals(SemanticChecker.AssignmentOutcome.ALLOWED, checker.assign(assign("x", "5"), "5", 5.0));
		assertEquals("5", symbols.resolve("x").orElseThrow().getValue());
		assertEquals(5.0, symbols.resolve("x").orElseThrow().getConstantValue());
	}

	@Test
	void assignmentToUndeclaredIsAnError()
	{
		assertEquals(SemanticChecker.AssignmentOutcome.UNDECLARED, checker.assign(assign("y", "5"), "5", 5.0));
		assertTrue(errors.hasErrors());
		assertEquals("Variable 'y' is not declared", errors.getDiagnostics().get(0).getMessage());
		assertEquals(2, errors.getDiagnostics().get(0).getLine());
	}

	@Test
	void assignmentToConstantIsAnError()
	{
		checker.declare(constant("c", "1"));

		assertEquals(SemanticChecker.AssignmentOutcome.CONSTANT, checker.assign(assign("c", "2"), "2", 2.0));
		assertEquals("1", symbols.resolve("c").orElseThrow().getValue());
		assertEquals(1.0, symbols.resolve("c").orElseThrow().getConstantValue());
		assertEquals(1, errors.count(Diagnostic.Kind.SEMANTIC_ERROR));
	}

	@Test
	void referenceDeclarationCopiesCurrentValue()
	{
		Declaration source = new Declaration(false, PrimitiveType.STRING, "s", new Literal(LiteralKind.STRING, "hi"), 1, 1);
		Declaration copy = new Declaration(false, PrimitiveType.STRING, "t", new Literal(LiteralKind.STRING, "s", true), 1, 1);
		Declaration dangling = new Declaration(false, PrimitiveType.STRING, "u", new Literal(LiteralKind.STRING, "nope", true), 1, 1);

		checker.declare(source);
		checker.declare(copy);
		checker.declare(dangling);

		assertEquals("hi", symbols.resolve("t").orElseThrow().getValue());
		assertTrue(symbols.resolve("t").orElseThrow().isReference());
		assertEquals("nope", symbols.resolve("u").orElseThrow().getValue());
	}

	@Test
	void loggingUndeclaredNameWarns()
	{
		checker.declare(let("x", "1"));

		assertTrue(checker.checkLogTarget("x", 1, 5));
		assertFalse(checker.checkLogTarget("z", 3, 5));
		assertEquals(1, errors.count(Diagnostic.Kind.SEMANTIC_WARNING));
		assertEquals("Logging undeclared variable 'z'", errors.getDiagnostics().get(0).getMessage());
	}
}
