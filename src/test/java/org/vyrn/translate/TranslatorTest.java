package org.vyrn.translate;

import org.junit.jupiter.api.Test;
import org.vyrn.parser.Statement;
import org.vyrn.semantic.symbol.SymbolKind;
import org.vyrn.util.Diagnostic;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranslatorTest
{
	private final Translator translator = new Translator();

	@Test
	void translatesWholeSource()
	{
		TranslationResult result = translator.translate("let bool b = true;\nlog(b);");

		assertEquals("bool b = true;\nstd::cout << b << std::endl;\n", result.getCode());
		assertTrue(result.getDiagnostics().isEmpty());
		assertFalse(result.hasErrors());
	}

	@Test
	void redeclarationKeepsTrackedValueButEmitsNewOne()
	{
		TranslationResult result = translator.translate("let int x = 1; let int x = 2; log(x);");

		assertEquals(1, result.getDiagnostics(Diagnostic.Kind.SEMANTIC_WARNING).size());
		assertEquals(1, result.getDiagnostics().size());
		assertEquals("1", result.getSymbols().get("x").getValue());
		assertTrue(result.getCode().contains("int x = 2;\n"));
		assertFalse(result.hasErrors());
	}

	@Test
	void undeclaredAssignmentEmitsNoStatement()
	{
		TranslationResult result = translator.translate("y = 5;");

		assertEquals(1, result.getDiagnostics(Diagnostic.Kind.SEMANTIC_ERROR).size());
		assertFalse(result.getCode().contains("y ="));
		assertTrue(result.hasErrors());
	}

	@Test
	void constantIsNeverMutated()
	{
		TranslationResult result = translator.translate("const int c = 1; c = 2; c = c;");

		assertEquals(2, result.getDiagnostics(Diagnostic.Kind.SEMANTIC_ERROR).size());
		assertFalse(result.getCode().contains("c = 2"));
		assertFalse(result.getCode().contains("c = c"));
		assertEquals("1", result.getSymbols().get("c").getValue());
	}

	@Test
	void floatCommaIsNormalised()
	{
		assertEquals("float f = 3.14;\n", translator.translate("let float f = 3,14;").getCode());
	}

	@Test
	void oppositeKindRedeclarationIsAmbiguousButNonFatal()
	{
		TranslationResult letThenConst = translator.translate("let int x = 1; const int x = 2;");
		TranslationResult constThenLet = translator.translate("const int x = 1; let int x = 2;");

		assertEquals(1, letThenConst.getDiagnostics(Diagnostic.Kind.SEMANTIC_WARNING).size());
		assertEquals(SymbolKind.VARIABLE, letThenConst.getSymbols().get("x").getKind());
		assertEquals(SymbolKind.CONSTANT, constThenLet.getSymbols().get("x").getKind());
		assertFalse(letThenConst.hasErrors());
		assertFalse(constThenLet.hasErrors());
	}

	@Test
	void badStatementDoesNotStopTheRun()
	{
		TranslationResult result = translator.translate("let int a = 1;\nlet int b = \"x\";\nlog(a);");

		assertEquals("int a = 1;\nstd::cout << a << std::endl;\n", result.getCode());
		List<Diagnostic> failures = result.getDiagnostics(Diagnostic.Kind.PARSE_FAILURE);
		assertEquals(1, failures.size());
		assertEquals(2, failures.get(0).getLine());
		assertEquals(13, failures.get(0).getColumn());
		assertEquals(1, failures.get(0).getStatementIndex());
		assertTrue(result.hasErrors());
		assertFalse(result.getSymbols().containsKey("b"));
	}

	@Test
	void diagnosticsAreInSourceOrder()
	{
		TranslationResult result = translator.translate("let int x = 1; let int x = 2; y = 1; let = 3; log(z);");

		List<Diagnostic> diagnostics = result.getDiagnostics();
		assertEquals(4, diagnostics.size());
		assertEquals(Diagnostic.Kind.SEMANTIC_WARNING, diagnostics.get(0).getKind());
		assertEquals(Diagnostic.Kind.SEMANTIC_ERROR, diagnostics.get(1).getKind());
		assertEquals(Diagnostic.Kind.PARSE_FAILURE, diagnostics.get(2).getKind());
		assertEquals(Diagnostic.Kind.SEMANTIC_WARNING, diagnostics.get(3).getKind());
	}

	@Test
	void booleansFoldAgainstEarlierStatements()
	{
		TranslationResult result = translator.translate("let int limit = 10; let int n = limit / 2; let bool ok = n < limit;");

		assertTrue(result.getCode().endsWith("bool ok = true;\n"));
	}

	@Test
	void foldUsesValueAtTimeOfCopy()
	{
		TranslationResult result = translator.translate("let int x = 1; let int y = x; x = 10; let bool b = y > 5; let bool c = x > 5;");

		assertTrue(result.getCode().contains("bool b = false;\n"));
		assertTrue(result.getCode().contains("bool c = true;\n"));
		assertEquals(1.0, result.getSymbols().get("y").getConstantValue());
		assertEquals(10.0, result.getSymbols().get("x").getConstantValue());
	}

	@Test
	void foldUsesValueAtTimeOfAssignment()
	{
		TranslationResult result = translator.translate("let int a = 2; let int b = 0; b = a * 3; a = 100; let bool ok = b == 6;"
				+ "let int c = 0; c = a; a = 1; let bool big = c > 50;");

		assertTrue(result.getCode().contains("bool ok = true;\n"));
		assertTrue(result.getCode().contains("bool big = true;\n"));
	}

	@Test
	void foldFollowsIntArithmetic()
	{
		TranslationResult result = translator.translate("let int a = 7 / 2; let bool b = a > 3; let float f = 7 / 2.0; let bool g = f > 3;"
				+ "let int z = 5 / 0; let bool h = z > 0;");

		assertEquals(3.0, result.getSymbols().get("a").getConstantValue());
		assertTrue(result.getCode().contains("bool b = false;\n"));
		assertTrue(result.getCode().contains("bool g = true;\n"));
		assertTrue(result.getCode().contains("int z = (5 / 0);\n"));
		List<Diagnostic> failures = result.getDiagnostics(Diagnostic.Kind.PARSE_FAILURE);
		assertEquals(1, failures.size());
		assertEquals("Cannot fold 'z': it is not a numeric constant", failures.get(0).getMessage());
	}

	@Test
	void doubleNegationIsNotDecrement()
	{
		TranslationResult result = translator.translate("let int a = 1; let int b = - -a; let bool same = a == b;");

		assertTrue(result.getCode().contains("int b = (-(-a));\n"));
		assertFalse(result.getCode().contains("--"));
		assertTrue(result.getCode().contains("bool same = true;\n"));
	}

	@Test
	void eachRunStartsWithEmptyState()
	{
		translator.translate("let int x = 1;");

		TranslationResult second = translator.translate("x = 2;");

		assertTrue(second.hasErrors());
		assertTrue(second.getSymbols().isEmpty());
	}

	@Test
	void translatesPreSplitStatements()
	{
		TranslationResult result = translator.translateTexts(List.of("let int x = 1", "log(x)"));

		assertEquals("int x = 1;\nstd::cout << x << std::endl;\n", result.getCode());
	}

	@Test
	void keepsPositionsOfGivenStatements()
	{
		TranslationResult result = translator.translateStatements(List.of(new Statement("let int = 1", 7, 3, 0)));

		Diagnostic failure = result.getDiagnostics().get(0);
		assertEquals(7, failure.getLine());
		assertEquals(11, failure.getColumn());
		assertEquals("[Syntax Error] line 7:11 - Expected identifier", failure.toString());
	}
}
