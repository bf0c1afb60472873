package org.vyrn.parser;

public enum TokenType
{
	IDENTIFIER,
	KEYWORD,
	TYPE_NAME,
	NUMBER,
	STRING_LIT,
	BOOL_LIT,
	BOOLEAN_OPERATOR,
	SYMBOL,
	END_OF_FILE
}
