package org.metricshub.plcflow.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * PLC Flow
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

/**
 * Tags of the tokens produced by {@link StructuredTextLexer}.
 * Keyword tags carry their (upper case) spelling; operator and punctuation
 * tags carry their symbol.
 */
public enum TokenType {
	// POU and declaration keywords
	KW_PROGRAM(Category.KEYWORD, "PROGRAM"),
	KW_END_PROGRAM(Category.KEYWORD, "END_PROGRAM"),
	KW_FUNCTION(Category.KEYWORD, "FUNCTION"),
	KW_END_FUNCTION(Category.KEYWORD, "END_FUNCTION"),
	KW_FUNCTION_BLOCK(Category.KEYWORD, "FUNCTION_BLOCK"),
	KW_END_FUNCTION_BLOCK(Category.KEYWORD, "END_FUNCTION_BLOCK"),
	KW_VAR(Category.KEYWORD, "VAR"),
	KW_VAR_INPUT(Category.KEYWORD, "VAR_INPUT"),
	KW_VAR_OUTPUT(Category.KEYWORD, "VAR_OUTPUT"),
	KW_VAR_IN_OUT(Category.KEYWORD, "VAR_IN_OUT"),
	KW_VAR_TEMP(Category.KEYWORD, "VAR_TEMP"),
	KW_VAR_GLOBAL(Category.KEYWORD, "VAR_GLOBAL"),
	KW_VAR_EXTERNAL(Category.KEYWORD, "VAR_EXTERNAL"),
	KW_END_VAR(Category.KEYWORD, "END_VAR"),
	KW_CONSTANT(Category.KEYWORD, "CONSTANT"),
	KW_RETAIN(Category.KEYWORD, "RETAIN"),
	KW_NON_RETAIN(Category.KEYWORD, "NON_RETAIN"),
	KW_AT(Category.KEYWORD, "AT"),
	KW_TYPE(Category.KEYWORD, "TYPE"),
	KW_END_TYPE(Category.KEYWORD, "END_TYPE"),
	KW_STRUCT(Category.KEYWORD, "STRUCT"),
	KW_END_STRUCT(Category.KEYWORD, "END_STRUCT"),
	KW_ARRAY(Category.KEYWORD, "ARRAY"),
	KW_OF(Category.KEYWORD, "OF"),
	KW_STRING(Category.KEYWORD, "STRING"),
	KW_WSTRING(Category.KEYWORD, "WSTRING"),

	// statement keywords
	KW_IF(Category.KEYWORD, "IF"),
	KW_THEN(Category.KEYWORD, "THEN"),
	KW_ELSIF(Category.KEYWORD, "ELSIF"),
	KW_ELSE(Category.KEYWORD, "ELSE"),
	KW_END_IF(Category.KEYWORD, "END_IF"),
	KW_CASE(Category.KEYWORD, "CASE"),
	KW_END_CASE(Category.KEYWORD, "END_CASE"),
	KW_FOR(Category.KEYWORD, "FOR"),
	KW_TO(Category.KEYWORD, "TO"),
	KW_BY(Category.KEYWORD, "BY"),
	KW_DO(Category.KEYWORD, "DO"),
	KW_END_FOR(Category.KEYWORD, "END_FOR"),
	KW_WHILE(Category.KEYWORD, "WHILE"),
	KW_END_WHILE(Category.KEYWORD, "END_WHILE"),
	KW_REPEAT(Category.KEYWORD, "REPEAT"),
	KW_UNTIL(Category.KEYWORD, "UNTIL"),
	KW_END_REPEAT(Category.KEYWORD, "END_REPEAT"),
	KW_EXIT(Category.KEYWORD, "EXIT"),
	KW_CONTINUE(Category.KEYWORD, "CONTINUE"),
	KW_RETURN(Category.KEYWORD, "RETURN"),
	KW_GOTO(Category.KEYWORD, "GOTO"),

	// word operators and boolean literals
	KW_AND(Category.KEYWORD, "AND"),
	KW_OR(Category.KEYWORD, "OR"),
	KW_XOR(Category.KEYWORD, "XOR"),
	KW_NOT(Category.KEYWORD, "NOT"),
	KW_MOD(Category.KEYWORD, "MOD"),
	KW_TRUE(Category.KEYWORD, "TRUE"),
	KW_FALSE(Category.KEYWORD, "FALSE"),

	IDENTIFIER(Category.IDENTIFIER, null),

	INTEGER_LITERAL(Category.LITERAL, null),
	REAL_LITERAL(Category.LITERAL, null),
	STRING_LITERAL(Category.LITERAL, null),
	WSTRING_LITERAL(Category.LITERAL, null),
	TIME_LITERAL(Category.LITERAL, null),
	DATE_LITERAL(Category.LITERAL, null),
	TIME_OF_DAY_LITERAL(Category.LITERAL, null),
	DATE_AND_TIME_LITERAL(Category.LITERAL, null),

	ASSIGN(Category.OPERATOR, ":="),
	OUTPUT_ASSIGN(Category.OPERATOR, "=>"),
	PLUS_ASSIGN(Category.OPERATOR, "+="),
	MINUS_ASSIGN(Category.OPERATOR, "-="),
	MULT_ASSIGN(Category.OPERATOR, "*="),
	DIV_ASSIGN(Category.OPERATOR, "/="),
	EQ(Category.OPERATOR, "="),
	NE(Category.OPERATOR, "<>"),
	LT(Category.OPERATOR, "<"),
	LE(Category.OPERATOR, "<="),
	GT(Category.OPERATOR, ">"),
	GE(Category.OPERATOR, ">="),
	PLUS(Category.OPERATOR, "+"),
	MINUS(Category.OPERATOR, "-"),
	MULT(Category.OPERATOR, "*"),
	DIVIDE(Category.OPERATOR, "/"),
	POWER(Category.OPERATOR, "**"),
	AMPERSAND(Category.OPERATOR, "&"),

	OPEN_PAREN(Category.PUNCTUATION, "("),
	CLOSE_PAREN(Category.PUNCTUATION, ")"),
	OPEN_BRACKET(Category.PUNCTUATION, "["),
	CLOSE_BRACKET(Category.PUNCTUATION, "]"),
	COMMA(Category.PUNCTUATION, ","),
	SEMICOLON(Category.PUNCTUATION, ";"),
	COLON(Category.PUNCTUATION, ":"),
	DOT(Category.PUNCTUATION, "."),
	RANGE(Category.PUNCTUATION, ".."),

	DIRECT_ADDRESS(Category.SPECIAL, null),
	PRAGMA(Category.SPECIAL, null),
	EOF(Category.SPECIAL, null);

	/**
	 * Coarse grouping of the token tags.
	 */
	public enum Category {
		KEYWORD,
		IDENTIFIER,
		OPERATOR,
		LITERAL,
		PUNCTUATION,
		SPECIAL
	}

	private final Category category;
	private final String symbol;

	TokenType(Category category, String symbol) {
		this.category = category;
		this.symbol = symbol;
	}

	public Category getCategory() {
		return category;
	}

	/**
	 * @return the fixed spelling of this token, or {@code null} for tokens
	 *         whose text varies (identifiers, literals, ...)
	 */
	public String getSymbol() {
		return symbol;
	}

	/**
	 * @return a description suitable for error messages
	 */
	public String describe() {
		return symbol != null ? "'" + symbol + "'" : name();
	}
}
