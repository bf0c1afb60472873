package org.vyrn.parser;

import org.vyrn.ast.Assignment;
import org.vyrn.ast.AstNode;
import org.vyrn.ast.BooleanOpTree;
import org.vyrn.ast.Declaration;
import org.vyrn.ast.Literal;
import org.vyrn.ast.LiteralKind;
import org.vyrn.ast.LogCall;
import org.vyrn.semantic.symbol.SymbolEntry;
import org.vyrn.semantic.type.PrimitiveType;
import org.vyrn.translate.TranslationContext;
import org.vyrn.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for one statement.
 * <p>
 * Two independent expression grammars live here. Arithmetic values (int and
 * float) are syntax-checked and rendered as fully parenthesised text; they are
 * evaluated later by the program the emitted code is compiled into. Boolean
 * values are constant-folded: the boolean grammar builds a
 * {@link BooleanOpTree} which {@link BooleanFolder} reduces to a literal.
 * <p>
 * The symbol table of the {@link TranslationContext} is only read, to fold
 * identifiers that appear inside boolean expressions. Such identifiers fold
 * to the constant stored when the variable was last written.
 */
public class Parser
{
	private static final Set<String> RELATIONAL_OPERATORS = Set.of("<", ">", "<=", ">=", "==", "!=");
	private static final Set<String> AND_OPERATORS = Set.of("&&", "!&&");
	private static final Set<String> OR_LEVEL_OPERATORS = Set.of(
			"||", "!||", "xor", "nxor", "=>", "!=>",
			"<", ">", "<=", ">=", "==", "!=");

	private final List<Token> tokens;
	private final TranslationContext context;
	private int pos = 0;

	public Parser(Lexer lexer, TranslationContext context)
	{
		this.tokens = lexer.tokenize();
		this.context = context;
	}

	// --- Statements ---

	/**
	 * Parses exactly one statement. An optional trailing {@code ;} is accepted;
	 * anything else left over is a failure.
	 *
	 * @throws ParseFailure on the first token that does not fit the grammar.
	 */
	public AstNode parseStatement()
	{
		Token first = current();
		AstNode root;

		if (first.getType() == TokenType.KEYWORD)
		{
			root = parseDeclaration();
		}
		else if (first.is(TokenType.IDENTIFIER, "log") && peek(1).isSymbol("("))
		{
			root = parseLogCall();
		}
		else if (first.getType() == TokenType.IDENTIFIER)
		{
			root = parseAssignment();
		}
		else if (first.getType() == TokenType.END_OF_FILE)
		{
			throw new ParseFailure("Empty statement", first);
		}
		else
		{
			throw new ParseFailure("Unknown statement starting with '" + first.getText() + "'", first);
		}

		if (current().isSymbol(";"))
		{
			advance();
		}
		if (current().getType() != TokenType.END_OF_FILE)
		{
			throw unexpected(current());
		}
		return root;
	}

	/**
	 * {@code (let|const) <type> <identifier> = <value>}
	 */
	public Declaration parseDeclaration()
	{
		Token keyword = current();
		if (keyword.getType() != TokenType.KEYWORD)
		{
			throw new ParseFailure("Expected 'let' or 'const'", keyword);
		}
		advance();
		boolean isConst = keyword.getText().equals("const");

		Token typeToken = current();
		if (typeToken.getType() != TokenType.TYPE_NAME)
		{
			throw new ParseFailure("Expected type", typeToken);
		}
		PrimitiveType type = PrimitiveType.fromKeyword(typeToken.getText())
				.orElseThrow(() -> new ParseFailure("Unknown type '" + typeToken.getText() + "'", typeToken));
		advance();

		Token nameToken = current();
		if (nameToken.getType() != TokenType.IDENTIFIER)
		{
			throw new ParseFailure("Expected identifier", nameToken);
		}
		advance();

		expectSymbol("=");
		Literal value = parseValue(type);

		Debug.logDebug("Parsed declaration of " + type + " '" + nameToken.getText() + "' = " + value.getRawText());
		return new Declaration(isConst, type, nameToken.getText(), value, nameToken.getLine(), nameToken.getColumn());
	}

	/**
	 * Parses the value of a declaration, choosing the grammar by the declared type.
	 */
	public Literal parseValue(PrimitiveType type)
	{
		Token start = current();

		if (type.isNumeric())
		{
			if (start.getType() == TokenType.NUMBER || start.getType() == TokenType.IDENTIFIER
					|| start.isSymbol("-") || start.isSymbol("("))
			{
				return numericLiteral(type, parseArithmeticExpression());
			}
			throw new ParseFailure("Expected a numeric value for type '" + type + "'", start);
		}

		if (type.isBoolean())
		{
			if (start.getType() == TokenType.BOOL_LIT && isStatementEnd(1))
			{
				advance();
				return new Literal(LiteralKind.BOOL, start.getText());
			}
			return BooleanFolder.foldToLiteral(parseBooleanExpression());
		}

		if (start.getType() == TokenType.STRING_LIT)
		{
			advance();
			return new Literal(LiteralKind.STRING, start.getText());
		}
		if (start.getType() == TokenType.IDENTIFIER)
		{
			advance();
			return new Literal(LiteralKind.STRING, start.getText(), true);
		}
		throw new ParseFailure("Expected a string literal or identifier", start);
	}

	/**
	 * {@code <identifier> = (identifier | literal | expression)}
	 */
	public Assignment parseAssignment()
	{
		Token target = current();
		if (target.getType() != TokenType.IDENTIFIER)
		{
			throw new ParseFailure("Expected target variable", target);
		}
		advance();
		expectSymbol("=");

		Token source = current();
		Optional<PrimitiveType> targetType = context.getSymbols().resolve(target.getText()).map(SymbolEntry::getType);

		if (source.getType() == TokenType.IDENTIFIER && isStatementEnd(1))
		{
			advance();
			return Assignment.fromIdentifier(target.getText(), source.getText(), target.getLine(), target.getColumn());
		}

		if (isLiteralToken(source) && isStatementEnd(1))
		{
			advance();
			Literal literal;
			if (source.getType() == TokenType.NUMBER && targetType.isPresent() && targetType.get().isNumeric())
			{
				literal = numericLiteral(targetType.get(), numberOperand(source.getText()));
			}
			else
			{
				literal = new Literal(literalKindFor(source, targetType.orElse(null)), source.getText());
			}
			return Assignment.fromLiteral(target.getText(), literal, target.getLine(), target.getColumn());
		}

		if (targetType.isPresent() && targetType.get().isNumeric())
		{
			Literal literal = numericLiteral(targetType.get(), parseArithmeticExpression());
			return Assignment.fromLiteral(target.getText(), literal, target.getLine(), target.getColumn());
		}
		if (targetType.isPresent() && targetType.get().isString())
		{
			throw new ParseFailure("Expected a string literal or identifier", source);
		}

		return Assignment.fromBooleanExpression(target.getText(), parseBooleanExpression(), target.getLine(), target.getColumn());
	}

	/**
	 * {@code log(<identifier-or-literal>)}
	 */
	public LogCall parseLogCall()
	{
		Token logToken = current();
		if (!logToken.is(TokenType.IDENTIFIER, "log"))
		{
			throw new ParseFailure("Expected 'log'", logToken);
		}
		advance();
		expectSymbol("(");

		Token arg = current();
		LogCall call;
		switch (arg.getType())
		{
			case IDENTIFIER -> call = LogCall.ofVariable(arg.getText(), arg.getLine(), arg.getColumn());
			case STRING_LIT -> call = LogCall.ofLiteral(new Literal(LiteralKind.STRING, arg.getText()), arg.getLine(), arg.getColumn());
			case BOOL_LIT -> call = LogCall.ofLiteral(new Literal(LiteralKind.BOOL, arg.getText()), arg.getLine(), arg.getColumn());
			case NUMBER -> call = LogCall.ofLiteral(new Literal(numberKind(arg.getText()), arg.getText()), arg.getLine(), arg.getColumn());
			default ->
			{
				if (arg.isSymbol("-") && peek(1).getType() == TokenType.NUMBER)
				{
					advance();
					String text = "-" + current().getText();
					call = LogCall.ofLiteral(new Literal(numberKind(text), text), arg.getLine(), arg.getColumn());
				}
				else
				{
					throw new ParseFailure("Invalid value for log", arg);
				}
			}
		}
		advance();
		expectSymbol(")");
		return call;
	}

	// --- Arithmetic grammar (rendered, not evaluated) ---

	/**
	 * expression := factor (('+' | '-') factor)*
	 */
	ArithmeticResult parseArithmeticExpression()
	{
		ArithmeticResult left = parseArithmeticFactor();
		while (current().isSymbol("+") || current().isSymbol("-"))
		{
			String op = advance().getText();
			ArithmeticResult right = parseArithmeticFactor();
			left = ArithmeticResult.binary(left, op, right);
		}
		return left;
	}

	/**
	 * factor := primary (('*' | '/' | '%') primary)*
	 */
	private ArithmeticResult parseArithmeticFactor()
	{
		ArithmeticResult left = parseArithmeticPrimary();
		while (current().isSymbol("*") || current().isSymbol("/") || current().isSymbol("%"))
		{
			String op = advance().getText();
			ArithmeticResult right = parseArithmeticPrimary();
			left = ArithmeticResult.binary(left, op, right);
		}
		return left;
	}

	/**
	 * primary := number | identifier | '(' expression ')' | '-' primary | 'sqrt(' expression ')'
	 */
	private ArithmeticResult parseArithmeticPrimary()
	{
		Token token = current();

		if (token.isSymbol("("))
		{
			advance();
			ArithmeticResult inner = parseArithmeticExpression();
			expectSymbol(")");
			return new ArithmeticResult("(" + inner.text + ")", inner.value, inner.integral);
		}
		if (token.getType() == TokenType.NUMBER)
		{
			advance();
			return numberOperand(token.getText());
		}
		if (token.is(TokenType.IDENTIFIER, "sqrt") && peek(1).isSymbol("("))
		{
			advance();
			advance();
			ArithmeticResult inner = parseArithmeticExpression();
			expectSymbol(")");
			return new ArithmeticResult("sqrt(" + inner.text + ")", inner.value == null ? null : Math.sqrt(inner.value), false);
		}
		if (token.getType() == TokenType.IDENTIFIER)
		{
			advance();
			return identifierOperand(token.getText());
		}
		if (token.isSymbol("-"))
		{
			// Parenthesised so that "- -a" cannot come out as "--a".
			advance();
			return ArithmeticResult.negate(parseArithmeticPrimary());
		}
		throw new ParseFailure("Expected number, variable, parenthesis or sqrt", token);
	}

	// --- Boolean grammar (folded) ---

	/**
	 * Parses a boolean expression into its unfolded tree.
	 */
	public BooleanOpTree parseBooleanExpression()
	{
		return parseOrLevel();
	}

	/**
	 * Level 3: OR, NOR, XOR, NXOR, implication, non-implication and the
	 * relational combinators, all left to right at one precedence.
	 */
	private BooleanOpTree parseOrLevel()
	{
		List<AstNode> operands = new ArrayList<>();
		List<String> operators = new ArrayList<>();
		operands.add(parseAndLevel());
		while (current().getType() == TokenType.BOOLEAN_OPERATOR && OR_LEVEL_OPERATORS.contains(current().getText()))
		{
			operators.add(advance().getText());
			operands.add(parseAndLevel());
		}
		return new BooleanOpTree(operands, operators);
	}

	/**
	 * Level 2: AND, NAND.
	 */
	private AstNode parseAndLevel()
	{
		List<AstNode> operands = new ArrayList<>();
		List<String> operators = new ArrayList<>();
		operands.add(parseNotLevel());
		while (current().getType() == TokenType.BOOLEAN_OPERATOR && AND_OPERATORS.contains(current().getText()))
		{
			operators.add(advance().getText());
			operands.add(parseNotLevel());
		}
		return operators.isEmpty() ? operands.get(0) : new BooleanOpTree(operands, operators);
	}

	/**
	 * Level 1: NOT, right associative.
	 */
	private AstNode parseNotLevel()
	{
		if (current().isOperator(BooleanOpTree.NOT))
		{
			advance();
			return BooleanOpTree.not(parseNotLevel());
		}
		return parseBooleanPrimary();
	}

	private AstNode parseBooleanPrimary()
	{
		Token token = current();

		if (token.isSymbol("("))
		{
			// A parenthesised group is read as a boolean group first, and re-read
			// as the left side of a numeric comparison when that fails: (1 + 2) < 5
			int mark = pos;
			try
			{
				advance();
				BooleanOpTree inner = parseOrLevel();
				expectSymbol(")");
				return inner;
			}
			catch (ParseFailure booleanFailure)
			{
				int booleanFailurePos = pos;
				pos = mark;
				try
				{
					return Literal.ofBool(parseComparison());
				}
				catch (ParseFailure comparisonFailure)
				{
					throw pos >= booleanFailurePos ? comparisonFailure : booleanFailure;
				}
			}
		}

		if (token.getType() == TokenType.BOOL_LIT)
		{
			advance();
			return new Literal(LiteralKind.BOOL, token.getText());
		}

		if (token.getType() == TokenType.IDENTIFIER)
		{
			Optional<SymbolEntry> entry = context.getSymbols().resolve(token.getText());
			if (entry.isPresent() && entry.get().getType().isBoolean())
			{
				String value = entry.get().getValue();
				if (!value.equals("true") && !value.equals("false"))
				{
					throw new ParseFailure("Cannot fold '" + token.getText() + "': its value is not a boolean constant", token);
				}
				advance();
				return new Literal(LiteralKind.BOOL, value);
			}
		}

		if (token.getType() == TokenType.NUMBER || token.getType() == TokenType.IDENTIFIER || token.isSymbol("-"))
		{
			return Literal.ofBool(parseComparison());
		}

		throw new ParseFailure("Expected boolean, variable or parenthesis", token);
	}

	/**
	 * {@code <arith> <relop> <arith>}, compared as floating point values.
	 */
	private boolean parseComparison()
	{
		Token leftStart = current();
		ArithmeticResult left = parseArithmeticExpression();

		Token op = current();
		if (op.getType() != TokenType.BOOLEAN_OPERATOR || !RELATIONAL_OPERATORS.contains(op.getText()))
		{
			throw new ParseFailure("Expected a comparison operator after '" + left.text + "'", op);
		}
		advance();

		Token rightStart = current();
		ArithmeticResult right = parseArithmeticExpression();

		double l = requireValue(left, leftStart);
		double r = requireValue(right, rightStart);
		return switch (op.getText())
		{
			case "<" -> l < r;
			case ">" -> l > r;
			case "<=" -> l <= r;
			case ">=" -> l >= r;
			case "==" -> l == r;
			case "!=" -> l != r;
			default -> throw new ParseFailure("Unsupported comparison operator '" + op.getText() + "'", op);
		};
	}

	private double requireValue(ArithmeticResult result, Token start)
	{
		if (result.value == null)
		{
			throw new ParseFailure("Cannot fold '" + result.text + "': it is not a numeric constant", start);
		}
		return result.value;
	}

	/**
	 * An int or float variable stands for the constant stored when it was last
	 * written. Any other name has no value here.
	 */
	private ArithmeticResult identifierOperand(String name)
	{
		Optional<SymbolEntry> entry = context.getSymbols().resolve(name);
		if (entry.isEmpty() || !entry.get().getType().isNumeric())
		{
			return new ArithmeticResult(name, null, false);
		}
		return new ArithmeticResult(name, entry.get().getConstantValue(), entry.get().getType() == PrimitiveType.INT);
	}

	private static Literal numericLiteral(PrimitiveType type, ArithmeticResult result)
	{
		return Literal.numeric(LiteralKind.of(type), result.text, type.coerce(result.value));
	}

	// --- Token helpers ---

	private Token current()
	{
		return peek(0);
	}

	private Token peek(int offset)
	{
		int index = Math.min(pos + offset, tokens.size() - 1);
		return tokens.get(index);
	}

	private Token advance()
	{
		Token token = current();
		if (token.getType() != TokenType.END_OF_FILE)
		{
			pos++;
		}
		return token;
	}

	private void expectSymbol(String text)
	{
		Token token = current();
		if (!token.isSymbol(text))
		{
			throw new ParseFailure(describe(token) + ", expected '" + text + "'", token);
		}
		advance();
	}

	/**
	 * @return {@code true} if only an optional {@code ;} remains at {@code offset}.
	 */
	private boolean isStatementEnd(int offset)
	{
		Token token = peek(offset);
		if (token.isSymbol(";"))
		{
			token = peek(offset + 1);
		}
		return token.getType() == TokenType.END_OF_FILE;
	}

	private static ParseFailure unexpected(Token token)
	{
		return new ParseFailure(describe(token), token);
	}

	private static String describe(Token token)
	{
		if (token.getType() == TokenType.END_OF_FILE)
		{
			return "Unexpected end of statement";
		}
		return "Unexpected token: '" + token.getText() + "'";
	}

	private static boolean isLiteralToken(Token token)
	{
		return token.getType() == TokenType.NUMBER
				|| token.getType() == TokenType.STRING_LIT
				|| token.getType() == TokenType.BOOL_LIT;
	}

	private static LiteralKind literalKindFor(Token token, PrimitiveType targetType)
	{
		return switch (token.getType())
		{
			case STRING_LIT -> LiteralKind.STRING;
			case BOOL_LIT -> LiteralKind.BOOL;
			default -> targetType != null && targetType.isNumeric() ? LiteralKind.of(targetType) : numberKind(token.getText());
		};
	}

	private static LiteralKind numberKind(String text)
	{
		return text.contains(".") || text.contains(",") ? LiteralKind.FLOAT : LiteralKind.INT;
	}

	/**
	 * A number without separator or exponent is an int literal, as in C++.
	 */
	private static ArithmeticResult numberOperand(String text)
	{
		boolean integral = numberKind(text) == LiteralKind.INT && !text.contains("e") && !text.contains("E");
		Double value;
		try
		{
			value = Double.parseDouble(text.replace(',', '.'));
		}
		catch (NumberFormatException e)
		{
			value = null;
		}
		if (integral && value != null && !ArithmeticResult.fitsInt(value))
		{
			value = null;
		}
		return new ArithmeticResult(text, value, integral);
	}

	/**
	 * Rendered text of an arithmetic expression, plus its value when every
	 * operand is a known constant. Integral results follow C++ int arithmetic:
	 * division and remainder truncate, and dividing by zero or leaving the int
	 * range leaves the value unknown.
	 */
	static final class ArithmeticResult
	{
		final String text;
		final Double value;
		final boolean integral;

		ArithmeticResult(String text, Double value, boolean integral)
		{
			this.text = text;
			this.value = value;
			this.integral = integral;
		}

		static ArithmeticResult negate(ArithmeticResult operand)
		{
			String text = "(-" + operand.text + ")";
			if (operand.value == null)
			{
				return new ArithmeticResult(text, null, operand.integral);
			}
			double value = -operand.value;
			if (operand.integral && !fitsInt(value))
			{
				return new ArithmeticResult(text, null, true);
			}
			return new ArithmeticResult(text, value, operand.integral);
		}

		static ArithmeticResult binary(ArithmeticResult left, String op, ArithmeticResult right)
		{
			String text = "(" + left.text + " " + op + " " + right.text + ")";
			boolean integral = left.integral && right.integral;
			if (left.value == null || right.value == null)
			{
				return new ArithmeticResult(text, null, integral);
			}
			Double value = integral
					? integerOp(op, left.value.longValue(), right.value.longValue())
					: floatingOp(op, left.value, right.value);
			return new ArithmeticResult(text, value, integral);
		}

		private static Double integerOp(String op, long l, long r)
		{
			if ((op.equals("/") || op.equals("%")) && r == 0)
			{
				return null;
			}
			long value = switch (op)
			{
				case "+" -> l + r;
				case "-" -> l - r;
				case "*" -> l * r;
				case "/" -> l / r;
				default -> l % r;
			};
			return fitsInt(value) ? (double) value : null;
		}

		// C++ has no % for floating operands.
		private static Double floatingOp(String op, double l, double r)
		{
			return switch (op)
			{
				case "+" -> l + r;
				case "-" -> l - r;
				case "*" -> l * r;
				case "/" -> l / r;
				default -> null;
			};
		}

		static boolean fitsInt(double value)
		{
			return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
		}
	}
}
