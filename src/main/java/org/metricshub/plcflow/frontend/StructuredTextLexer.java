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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.limits.ResourceState;
import org.metricshub.plcflow.limits.SecurityLimitException;

/**
 * Converts Structured Text into a lazy, finite, non-restartable sequence of
 * {@link Token}s, ending with a single {@link TokenType#EOF} token.
 * <p>
 * Whitespace and comments ({@code // ...}, nested {@code (* ... *)},
 * {@code /* ... *}{@code /}) are consumed and never emitted. Keywords are
 * matched case-insensitively; identifiers keep their case.
 * <p>
 * The input size is checked against the {@link ResourceState} ceiling when
 * the lexer is created, before any character is examined.
 */
public class StructuredTextLexer implements Iterator<Token> {

	private static final Map<String, TokenType> KEYWORDS = new HashMap<String, TokenType>();
	private static final Map<String, TokenType> TYPED_LITERALS = new HashMap<String, TokenType>();

	static {
		for (TokenType type : TokenType.values()) {
			if (type.getCategory() == TokenType.Category.KEYWORD) {
				KEYWORDS.put(type.getSymbol(), type);
			}
		}

		TYPED_LITERALS.put("T", TokenType.TIME_LITERAL);
		TYPED_LITERALS.put("TIME", TokenType.TIME_LITERAL);
		TYPED_LITERALS.put("LT", TokenType.TIME_LITERAL);
		TYPED_LITERALS.put("LTIME", TokenType.TIME_LITERAL);
		TYPED_LITERALS.put("D", TokenType.DATE_LITERAL);
		TYPED_LITERALS.put("DATE", TokenType.DATE_LITERAL);
		TYPED_LITERALS.put("TOD", TokenType.TIME_OF_DAY_LITERAL);
		TYPED_LITERALS.put("TIME_OF_DAY", TokenType.TIME_OF_DAY_LITERAL);
		TYPED_LITERALS.put("DT", TokenType.DATE_AND_TIME_LITERAL);
		TYPED_LITERALS.put("DATE_AND_TIME", TokenType.DATE_AND_TIME_LITERAL);
	}

	private final String source;
	private final Dialect dialect;
	private final ResourceState state;

	/** Current character, -1 at the end of the input */
	private int c;
	private int offset;
	private int line = 1;
	private int column = 1;

	private int tokenOffset;
	private int tokenLine;
	private int tokenColumn;

	/** Raw text of the token being read */
	private StringBuffer text = new StringBuffer();
	/** Decoded content of string literals and pragmas */
	private StringBuffer string = new StringBuffer();

	private boolean eofEmitted;

	/**
	 * Creates a lexer over {@code source}.
	 *
	 * @param source the Structured Text to read
	 * @param dialect the dialect to recognize
	 * @param state the resource counters of the current parse
	 * @throws SecurityLimitException if {@code source} is larger than the
	 *         input ceiling
	 */
	public StructuredTextLexer(String source, Dialect dialect, ResourceState state) {
		state.checkInputSize(source);
		this.source = source;
		this.dialect = dialect;
		this.state = state;
		this.c = source.isEmpty() ? -1 : source.charAt(0);
	}

	/**
	 * Reads the remaining tokens, EOF included.
	 *
	 * @return the tokens, in input order
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		while (hasNext()) {
			tokens.add(next());
		}
		return tokens;
	}

	@Override
	public boolean hasNext() {
		return !eofEmitted;
	}

	@Override
	public Token next() {
		if (eofEmitted) {
			throw new NoSuchElementException("No token after end of input");
		}
		Token token = nextToken();
		if (token.is(TokenType.EOF)) {
			eofEmitted = true;
		}
		return token;
	}

	/**
	 * Appends the current character to {@link #text} and moves to the next one.
	 */
	private void read() {
		text.append((char) c);
		skip();
	}

	/**
	 * Moves to the next character without recording the current one.
	 */
	private void skip() {
		if (c < 0) {
			return;
		}
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		offset++;
		c = offset < source.length() ? source.charAt(offset) : -1;
	}

	private int peek() {
		return offset + 1 < source.length() ? source.charAt(offset + 1) : -1;
	}

	private void markStart() {
		tokenOffset = offset;
		tokenLine = line;
		tokenColumn = column;
		text.setLength(0);
	}

	private SourceSpan currentSpan() {
		return new SourceSpan(tokenLine, tokenColumn, line, column, tokenOffset, offset);
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, currentSpan());
	}

	private Token token(TokenType type, Object value) {
		return new Token(type, text.toString(), value, currentSpan());
	}

	private void checkLength(StringBuffer buffer) {
		if (buffer.length() > state.getLimits().getMaxStringLength()) {
			state.checkStringLength(buffer.length(), currentSpan());
		}
	}

	/**
	 * Skip all whitespaces and comments (and pragmas, in the standard dialect).
	 */
	private void skipWhitespacesAndComments() {
		while (c >= 0) {
			if (Character.isWhitespace(c)) {
				skip();
			} else if (c == '/' && peek() == '/') {
				while (c >= 0 && c != '\n') {
					skip();
				}
			} else if (c == '(' && peek() == '*') {
				skipNestedComment();
			} else if (c == '/' && peek() == '*') {
				skipBlockComment();
			} else if (c == '{' && dialect != Dialect.VENDOR) {
				// pragmas are opaque text in the standard dialect
				markStart();
				readPragmaBody();
			} else {
				return;
			}
		}
	}

	private void skipNestedComment() {
		markStart();
		int nesting = 0;
		do {
			if (c < 0) {
				throw lexerException("Unterminated comment");
			}
			if (c == '(' && peek() == '*') {
				skip();
				skip();
				nesting++;
			} else if (c == '*' && peek() == ')') {
				skip();
				skip();
				nesting--;
			} else {
				skip();
			}
		} while (nesting > 0);
	}

	private void skipBlockComment() {
		markStart();
		skip();
		skip();
		while (!(c == '*' && peek() == '/')) {
			if (c < 0) {
				throw lexerException("Unterminated comment");
			}
			skip();
		}
		skip();
		skip();
	}

	/**
	 * Reads <code>{ ... }</code>, leaving its content in {@link #string}.
	 */
	private void readPragmaBody() {
		string.setLength(0);
		read();
		while (c != '}') {
			if (c < 0) {
				throw lexerException("Unterminated pragma");
			}
			string.append((char) c);
			checkLength(string);
			read();
		}
		read();
	}

	/**
	 * Reads the next token.
	 *
	 * @return the token, {@link TokenType#EOF} at the end of the input
	 */
	private Token nextToken() {
		skipWhitespacesAndComments();
		markStart();

		if (c < 0) {
			return token(TokenType.EOF, null);
		}

		if (c == '{') {
			readPragmaBody();
			return token(TokenType.PRAGMA, string.toString().trim());
		}

		if (Character.isLetter(c) || c == '_') {
			return readWord();
		}

		if (c >= '0' && c <= '9') {
			return readNumber();
		}

		if (c == '\'' || c == '"') {
			return readString();
		}

		if (c == '%') {
			return readDirectAddress();
		}

		if (c == ':') {
			read();
			if (c == '=') {
				read();
				return token(TokenType.ASSIGN, null);
			}
			return token(TokenType.COLON, null);
		}
		if (c == '=') {
			read();
			if (c == '>') {
				read();
				return token(TokenType.OUTPUT_ASSIGN, null);
			}
			return token(TokenType.EQ, null);
		}
		if (c == '<') {
			read();
			if (c == '>') {
				read();
				return token(TokenType.NE, null);
			} else if (c == '=') {
				read();
				return token(TokenType.LE, null);
			}
			return token(TokenType.LT, null);
		}
		if (c == '>') {
			read();
			if (c == '=') {
				read();
				return token(TokenType.GE, null);
			}
			return token(TokenType.GT, null);
		}
		if (c == '+') {
			read();
			if (c == '=' && dialect == Dialect.VENDOR) {
				read();
				return token(TokenType.PLUS_ASSIGN, null);
			}
			return token(TokenType.PLUS, null);
		}
		if (c == '-') {
			read();
			if (c == '=' && dialect == Dialect.VENDOR) {
				read();
				return token(TokenType.MINUS_ASSIGN, null);
			}
			return token(TokenType.MINUS, null);
		}
		if (c == '*') {
			read();
			if (c == '*') {
				read();
				return token(TokenType.POWER, null);
			} else if (c == '=' && dialect == Dialect.VENDOR) {
				read();
				return token(TokenType.MULT_ASSIGN, null);
			}
			return token(TokenType.MULT, null);
		}
		if (c == '/') {
			read();
			if (c == '=' && dialect == Dialect.VENDOR) {
				read();
				return token(TokenType.DIV_ASSIGN, null);
			}
			return token(TokenType.DIVIDE, null);
		}
		if (c == '.') {
			read();
			if (c == '.') {
				read();
				return token(TokenType.RANGE, null);
			}
			return token(TokenType.DOT, null);
		}
		if (c == '&') {
			read();
			return token(TokenType.AMPERSAND, null);
		}
		if (c == '(') {
			read();
			return token(TokenType.OPEN_PAREN, null);
		}
		if (c == ')') {
			read();
			return token(TokenType.CLOSE_PAREN, null);
		}
		if (c == '[') {
			read();
			return token(TokenType.OPEN_BRACKET, null);
		}
		if (c == ']') {
			read();
			return token(TokenType.CLOSE_BRACKET, null);
		}
		if (c == ',') {
			read();
			return token(TokenType.COMMA, null);
		}
		if (c == ';') {
			read();
			return token(TokenType.SEMICOLON, null);
		}

		read();
		throw lexerException("Invalid character (" + (int) text.charAt(0) + "): " + text);
	}

	/**
	 * Keyword, identifier, typed literal ({@code T#5s}, {@code INT#16#FF})
	 * or qualified enumerated value ({@code Color#Red}).
	 */
	private Token readWord() {
		readIdentifierChars();
		String upper = text.toString().toUpperCase(Locale.ROOT);
		if (c == '#') {
			TokenType typedLiteral = TYPED_LITERALS.get(upper);
			if (typedLiteral != null) {
				return readTypedLiteral(typedLiteral);
			}
			read();
			if (c >= '0' && c <= '9') {
				Token number = readNumber();
				return new Token(number.getType(), text.toString(), number.getValue(), currentSpan());
			}
			if (Character.isLetter(c) || c == '_') {
				readIdentifierChars();
				return token(TokenType.IDENTIFIER, null);
			}
			throw lexerException("Malformed typed literal: " + text);
		}
		TokenType keyword = KEYWORDS.get(upper);
		if (keyword == TokenType.KW_TRUE) {
			return token(keyword, Boolean.TRUE);
		}
		if (keyword == TokenType.KW_FALSE) {
			return token(keyword, Boolean.FALSE);
		}
		if (keyword != null) {
			return token(keyword, null);
		}
		return token(TokenType.IDENTIFIER, null);
	}

	private void readIdentifierChars() {
		while (Character.isLetterOrDigit(c) || c == '_') {
			read();
			checkLength(text);
		}
	}

	/**
	 * Reads the part after {@code T#}, {@code D#}, {@code TOD#} or {@code DT#}.
	 */
	private Token readTypedLiteral(TokenType type) {
		read();
		int bodyStart = text.length();
		switch (type) {
		case TIME_LITERAL:
			if (c == '-' || c == '+') {
				read();
			}
			while (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
				read();
				checkLength(text);
			}
			break;
		case DATE_LITERAL:
			while ((c >= '0' && c <= '9') || c == '-' || c == '_') {
				read();
				checkLength(text);
			}
			break;
		case TIME_OF_DAY_LITERAL:
			while ((c >= '0' && c <= '9') || c == ':' || c == '.' || c == '_') {
				read();
				checkLength(text);
			}
			break;
		default:
			while ((c >= '0' && c <= '9') || c == ':' || c == '.' || c == '-' || c == '_') {
				read();
				checkLength(text);
			}
			break;
		}
		String body = text.substring(bodyStart);
		if (body.isEmpty() || "-".equals(body) || "+".equals(body)) {
			throw lexerException("Malformed typed literal: " + text);
		}
		return token(type, body);
	}

	/**
	 * Decimal or based integer, or real with optional exponent.
	 * Underscores between digits are ignored.
	 */
	private Token readNumber() {
		int numberStart = text.length();
		readDigits(10);
		if (c == '#') {
			String baseText = text.substring(numberStart).replace("_", "");
			int base;
			try {
				base = Integer.parseInt(baseText);
			} catch (NumberFormatException e) {
				base = -1;
			}
			if (base != 2 && base != 8 && base != 16) {
				read();
				throw lexerException("Unsupported integer base: " + baseText);
			}
			read();
			int digitsStart = text.length();
			readDigits(base);
			String digits = text.substring(digitsStart).replace("_", "");
			if (digits.isEmpty() || Character.isLetterOrDigit(c)) {
				if (c >= 0) {
					read();
				}
				throw lexerException("Malformed base " + base + " literal: " + text);
			}
			try {
				return token(TokenType.INTEGER_LITERAL, Long.valueOf(Long.parseLong(digits, base)));
			} catch (NumberFormatException e) {
				throw lexerException("Integer literal out of range: " + text);
			}
		}

		boolean real = false;
		if (c == '.' && peek() >= '0' && peek() <= '9') {
			real = true;
			read();
			readDigits(10);
		}
		if (c == 'e' || c == 'E') {
			int next = peek();
			boolean signed = next == '+' || next == '-';
			int afterSign = signed && offset + 2 < source.length() ? source.charAt(offset + 2) : next;
			if (afterSign >= '0' && afterSign <= '9') {
				real = true;
				read();
				if (signed) {
					read();
				}
				readDigits(10);
			}
		}

		String clean = text.substring(numberStart).replace("_", "");
		if (real) {
			return token(TokenType.REAL_LITERAL, Double.valueOf(Double.parseDouble(clean)));
		}
		try {
			return token(TokenType.INTEGER_LITERAL, Long.valueOf(Long.parseLong(clean)));
		} catch (NumberFormatException e) {
			throw lexerException("Integer literal out of range: " + text);
		}
	}

	private void readDigits(int base) {
		while (c == '_' || Character.digit(c, base) >= 0) {
			read();
			checkLength(text);
		}
	}

	/**
	 * Reads a STRING ({@code '...'}) or WSTRING ({@code "..."}) literal and
	 * handle all <code>$</code> escape codes and doubled quotes.
	 */
	private Token readString() {
		final int quote = c;
		final boolean wide = quote == '"';
		string.setLength(0);
		read();
		while (true) {
			if (c < 0) {
				throw lexerException("Unterminated string: " + text);
			}
			if (c == quote) {
				read();
				if (c == quote) {
					string.append((char) quote);
					read();
					continue;
				}
				break;
			}
			if (c == '$') {
				read();
				readEscape(wide);
			} else {
				string.append((char) c);
				read();
			}
			checkLength(string);
		}
		return token(wide ? TokenType.WSTRING_LITERAL : TokenType.STRING_LITERAL, string.toString());
	}

	private void readEscape(boolean wide) {
		switch (c) {
		case '$':
		case '\'':
		case '"':
			string.append((char) c);
			read();
			return;
		case 'L':
		case 'l':
		case 'N':
		case 'n':
			string.append('\n');
			read();
			return;
		case 'P':
		case 'p':
			string.append('\f');
			read();
			return;
		case 'R':
		case 'r':
			string.append('\r');
			read();
			return;
		case 'T':
		case 't':
			string.append('\t');
			read();
			return;
		default:
			break;
		}
		if (c < 0) {
			throw lexerException("Unterminated string: " + text);
		}
		// $hh in STRING, $hhhh in WSTRING
		int hexDigits = wide ? 4 : 2;
		int code = 0;
		for (int i = 0; i < hexDigits; i++) {
			int digit = Character.digit(c, 16);
			if (digit < 0) {
				if (c >= 0) {
					read();
				}
				throw lexerException("Invalid escape sequence in string: " + text);
			}
			code = (code << 4) + digit;
			read();
		}
		string.append((char) code);
	}

	/**
	 * {@code %} followed by a location (I, Q, M), an optional size
	 * (X, B, W, D, L) and a dotted sequence of numbers.
	 */
	private Token readDirectAddress() {
		read();
		char location = Character.toUpperCase((char) c);
		if (location != 'I' && location != 'Q' && location != 'M') {
			if (c >= 0) {
				read();
			}
			throw lexerException("Malformed direct address: " + text);
		}
		read();
		char size = Character.toUpperCase((char) c);
		if (size == 'X' || size == 'B' || size == 'W' || size == 'D' || size == 'L') {
			read();
		}
		if (!(c >= '0' && c <= '9')) {
			if (c >= 0) {
				read();
			}
			throw lexerException("Malformed direct address: " + text);
		}
		long component = 0;
		while ((c >= '0' && c <= '9') || (c == '.' && peek() >= '0' && peek() <= '9')) {
			component = c == '.' ? 0 : component * 10 + (c - '0');
			read();
			checkLength(text);
			if (component > Integer.MAX_VALUE) {
				throw lexerException("Direct address component out of range: " + text);
			}
		}
		return token(TokenType.DIRECT_ADDRESS, text.toString().toUpperCase(Locale.ROOT));
	}
}
