package org.vyrn.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pull-based tokenizer for a single statement.
 * <p>
 * The lexer never fails: characters it does not recognise come out as
 * {@link TokenType#SYMBOL} tokens and are left for the parser to reject.
 */
public class Lexer
{
	public static final Set<String> KEYWORDS = Set.of("let", "const");
	public static final Set<String> TYPE_NAMES = Set.of("int", "float", "bool", "string");
	public static final Set<String> WORD_OPERATORS = Set.of("xor", "nxor");

	// Longest first
	private static final List<String> THREE_CHAR_OPERATORS = List.of("!&&", "!||", "!=>");
	private static final List<String> TWO_CHAR_OPERATORS = List.of("&&", "||", "==", "!=", "<=", ">=", "=>");

	private final String input;
	private int pos = 0;
	private int line;
	private int column;

	public Lexer(String input)
	{
		this(input, 1, 1);
	}

	/**
	 * @param input       The statement text.
	 * @param startLine   Line of the first character of {@code input} in the whole source.
	 * @param startColumn Column of the first character of {@code input} in the whole source.
	 */
	public Lexer(String input, int startLine, int startColumn)
	{
		this.input = input;
		this.line = startLine;
		this.column = startColumn;
	}

	public Token nextToken()
	{
		skipWhitespaceAndComments();
		if (isAtEnd())
		{
			return new Token(TokenType.END_OF_FILE, "", line, column);
		}

		int tokLine = line;
		int tokColumn = column;
		char c = peek();

		String op = matchOperator();
		if (op != null)
		{
			for (int i = 0; i < op.length(); i++)
			{
				advance();
			}
			return new Token(TokenType.BOOLEAN_OPERATOR, op, tokLine, tokColumn);
		}

		if (Character.isLetter(c) || c == '_')
		{
			return word(tokLine, tokColumn);
		}

		if (Character.isDigit(c))
		{
			return number(tokLine, tokColumn);
		}

		if (c == '"')
		{
			return stringLiteral(tokLine, tokColumn);
		}

		advance();
		if (c == '<' || c == '>' || c == '!')
		{
			return new Token(TokenType.BOOLEAN_OPERATOR, String.valueOf(c), tokLine, tokColumn);
		}
		return new Token(TokenType.SYMBOL, String.valueOf(c), tokLine, tokColumn);
	}

	/**
	 * Drains the lexer. The returned list always ends with an END_OF_FILE token.
	 */
	public List<Token> tokenize()
	{
		List<Token> tokens = new ArrayList<>();
		Token token;
		do
		{
			token = nextToken();
			tokens.add(token);
		}
		while (token.getType() != TokenType.END_OF_FILE);
		return tokens;
	}

	private String matchOperator()
	{
		for (String op : THREE_CHAR_OPERATORS)
		{
			if (input.startsWith(op, pos))
			{
				return op;
			}
		}
		for (String op : TWO_CHAR_OPERATORS)
		{
			if (input.startsWith(op, pos))
			{
				return op;
			}
		}
		return null;
	}

	private Token word(int tokLine, int tokColumn)
	{
		int start = pos;
		while (!isAtEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_'))
		{
			advance();
		}
		String text = input.substring(start, pos);

		TokenType type;
		if (KEYWORDS.contains(text))
		{
			type = TokenType.KEYWORD;
		}
		else if (TYPE_NAMES.contains(text))
		{
			type = TokenType.TYPE_NAME;
		}
		else if (text.equals("true") || text.equals("false"))
		{
			type = TokenType.BOOL_LIT;
		}
		else if (WORD_OPERATORS.contains(text))
		{
			type = TokenType.BOOLEAN_OPERATOR;
		}
		else
		{
			type = TokenType.IDENTIFIER;
		}
		return new Token(type, text, tokLine, tokColumn);
	}

	private Token number(int tokLine, int tokColumn)
	{
		int start = pos;
		consumeDigits();

		// Either '.' or ',' separates the fraction; the text is kept as written.
		if ((peek() == '.' || peek() == ',') && Character.isDigit(peekAhead(1)))
		{
			advance();
			consumeDigits();
		}

		if (peek() == 'e' || peek() == 'E')
		{
			int signLength = (peekAhead(1) == '+' || peekAhead(1) == '-') ? 1 : 0;
			if (Character.isDigit(peekAhead(1 + signLength)))
			{
				for (int i = 0; i <= signLength; i++)
				{
					advance();
				}
				consumeDigits();
			}
		}

		return new Token(TokenType.NUMBER, input.substring(start, pos), tokLine, tokColumn);
	}

	// No escape sequences: the literal ends at the next double quote.
	private Token stringLiteral(int tokLine, int tokColumn)
	{
		advance();
		int start = pos;
		while (!isAtEnd() && peek() != '"')
		{
			advance();
		}
		String text = input.substring(start, pos);
		if (!isAtEnd())
		{
			advance();
		}
		return new Token(TokenType.STRING_LIT, text, tokLine, tokColumn);
	}

	private void skipWhitespaceAndComments()
	{
		while (!isAtEnd())
		{
			char c = peek();
			if (Character.isWhitespace(c))
			{
				advance();
			}
			else if (c == '/' && peekAhead(1) == '/')
			{
				while (!isAtEnd() && peek() != '\n')
				{
					advance();
				}
			}
			else if (c == '/' && peekAhead(1) == '*')
			{
				advance();
				advance();
				while (!isAtEnd() && !(peek() == '*' && peekAhead(1) == '/'))
				{
					advance();
				}
				if (!isAtEnd())
				{
					advance();
					advance();
				}
			}
			else
			{
				break;
			}
		}
	}

	private void consumeDigits()
	{
		while (Character.isDigit(peek()))
		{
			advance();
		}
	}

	private boolean isAtEnd()
	{
		return pos >= input.length();
	}

	private char peek()
	{
		return peekAhead(0);
	}

	private char peekAhead(int offset)
	{
		int index = pos + offset;
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private void advance()
	{
		char c = input.charAt(pos++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
	}
}
