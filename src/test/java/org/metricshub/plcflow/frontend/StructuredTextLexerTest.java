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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.Test;
import org.metricshub.plcflow.ErrorKind;
import org.metricshub.plcflow.limits.LimitKind;
import org.metricshub.plcflow.limits.ResourceLimits;
import org.metricshub.plcflow.limits.ResourceState;
import org.metricshub.plcflow.limits.SecurityLimitException;

public class StructuredTextLexerTest {

	private static List<Token> tokens(String source) {
		return tokens(source, Dialect.IEC_61131_3);
	}

	private static List<Token> tokens(String source, Dialect dialect) {
		return new StructuredTextLexer(source, dialect, new ResourceState(ResourceLimits.balanced())).tokenize();
	}

	private static List<TokenType> types(String source, Dialect dialect) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : tokens(source, dialect)) {
			types.add(token.getType());
		}
		return types;
	}

	private static Token single(String source) {
		List<Token> tokens = tokens(source);
		assertEquals("One token plus EOF expected for " + source + ": " + tokens, 2, tokens.size());
		return tokens.get(0);
	}

	@Test
	public void testEmptyInput() {
		List<Token> tokens = tokens("  // nothing\n (* at *) /* all */ ");
		assertEquals(1, tokens.size());
		assertTrue(tokens.get(0).is(TokenType.EOF));
	}

	@Test
	public void testIteratorEndsAfterEof() {
		StructuredTextLexer lexer = new StructuredTextLexer("x", Dialect.IEC_61131_3, new ResourceState(ResourceLimits.strict()));
		assertEquals(TokenType.IDENTIFIER, lexer.next().getType());
		assertTrue(lexer.hasNext());
		assertEquals(TokenType.EOF, lexer.next().getType());
		assertFalse(lexer.hasNext());
		assertThrows(NoSuchElementException.class, lexer::next);
	}

	@Test
	public void testKeywordsAreCaseInsensitive() {
		assertEquals(TokenType.KW_END_IF, single("end_if").getType());
		assertEquals(TokenType.KW_WHILE, single("While").getType());
		Token identifier = single("MyVar_1");
		assertEquals(TokenType.IDENTIFIER, identifier.getType());
		assertEquals("MyVar_1", identifier.getText());
		assertEquals(Boolean.TRUE, single("true").getValue());
		assertEquals(Boolean.FALSE, single("FALSE").getValue());
	}

	@Test
	public void testComments() {
		List<TokenType> types = types("a (* outer (* inner *) still comment *) b // line\n c /* block */ d", Dialect.IEC_61131_3);
		assertEquals(5, types.size());
		assertEquals(TokenType.IDENTIFIER, types.get(3));
		LexerException e = assertThrows(LexerException.class, () -> tokens("a (* never (* closed *)"));
		assertEquals(ErrorKind.LEXICAL, e.getKind());
		assertThrows(LexerException.class, () -> tokens("a /* never closed"));
	}

	@Test
	public void testNumbers() {
		assertEquals(Long.valueOf(1000000L), single("1_000_000").getValue());
		assertEquals(Long.valueOf(255L), single("16#FF").getValue());
		assertEquals(Long.valueOf(5L), single("2#101").getValue());
		assertEquals(Long.valueOf(63L), single("8#77").getValue());
		assertEquals(Double.valueOf(3.25), single("3.25").getValue());
		assertEquals(Double.valueOf(1500.0), single("1.5E3").getValue());
		assertEquals(Double.valueOf(0.02), single("2e-2").getValue());
		assertEquals(TokenType.REAL_LITERAL, single("2e-2").getType());
		Token typed = single("INT#16#FF");
		assertEquals(TokenType.INTEGER_LITERAL, typed.getType());
		assertEquals(Long.valueOf(255L), typed.getValue());
		assertEquals("INT#16#FF", typed.getText());

		assertThrows(LexerException.class, () -> tokens("3#12"));
		assertThrows(LexerException.class, () -> tokens("16#"));
		assertThrows(LexerException.class, () -> tokens("2#102"));
		assertThrows(LexerException.class, () -> tokens("99999999999999999999"));
		assertEquals(Long.valueOf(Long.MAX_VALUE), single("16#7FFF_FFFF_FFFF_FFFF").getValue());
		assertThrows(LexerException.class, () -> tokens("16#FFFFFFFFFFFFFFFF"));
	}

	@Test
	public void testRangeIsNotAReal() {
		List<Token> tokens = tokens("1..10");
		assertEquals(TokenType.INTEGER_LITERAL, tokens.get(0).getType());
		assertEquals(TokenType.RANGE, tokens.get(1).getType());
		assertEquals(TokenType.INTEGER_LITERAL, tokens.get(2).getType());
	}

	@Test
	public void testTypedLiterals() {
		Token time = single("T#1h2m3s");
		assertEquals(TokenType.TIME_LITERAL, time.getType());
		assertEquals("1h2m3s", time.getValue());
		assertEquals(TokenType.TIME_LITERAL, single("TIME#-5ms").getType());
		assertEquals(TokenType.DATE_LITERAL, single("D#2024-01-31").getType());
		assertEquals(TokenType.TIME_OF_DAY_LITERAL, single("TOD#12:30:15.5").getType());
		assertEquals(TokenType.DATE_AND_TIME_LITERAL, single("DT#2024-01-31-12:30:00").getType());
		Token qualified = single("Color#Red");
		assertEquals(TokenType.IDENTIFIER, qualified.getType());
		assertEquals("Color#Red", qualified.getText());
		assertThrows(LexerException.class, () -> tokens("T#"));
	}

	@Test
	public void testStrings() {
		Token string = single("'it''s $'quoted$' $N$$ $41'");
		assertEquals(TokenType.STRING_LITERAL, string.getType());
		assertEquals("it's 'quoted' \n$ A", string.getValue());
		Token wide = single("\"wide $0041 \"\"x\"\"\"");
		assertEquals(TokenType.WSTRING_LITERAL, wide.getType());
		assertEquals("wide A \"x\"", wide.getValue());

		LexerException e = assertThrows(LexerException.class, () -> tokens("x := 'unterminated"));
		assertEquals(1, e.getSpan().getStartLine());
		assertEquals(6, e.getSpan().getStartColumn());
		assertThrows(LexerException.class, () -> tokens("'bad $Z escape'"));
	}

	@Test
	public void testDirectAddresses() {
		Token address = single("%ix0.7");
		assertEquals(TokenType.DIRECT_ADDRESS, address.getType());
		assertEquals("%IX0.7", address.getValue());
		assertEquals(TokenType.DIRECT_ADDRESS, single("%QW5").getType());
		assertEquals(TokenType.DIRECT_ADDRESS, single("%MD10").getType());
		assertThrows(LexerException.class, () -> tokens("%Z1"));
		assertThrows(LexerException.class, () -> tokens("%IX"));
		assertEquals("%IX2147483647.0", single("%IX2147483647.0").getValue());
		assertThrows(LexerException.class, () -> tokens("%IX99999999999"));
		assertThrows(LexerException.class, () -> tokens("%QW1.2147483648"));
	}

	@Test
	public void testOperators() {
		List<TokenType> types = types(":= => <> <= >= < > = + - * / ** & ( ) [ ] , ; : . ..", Dialect.IEC_61131_3);
		assertEquals(TokenType.ASSIGN, types.get(0));
		assertEquals(TokenType.OUTPUT_ASSIGN, types.get(1));
		assertEquals(TokenType.NE, types.get(2));
		assertEquals(TokenType.LE, types.get(3));
		assertEquals(TokenType.GE, types.get(4));
		assertEquals(TokenType.POWER, types.get(12));
		assertEquals(TokenType.AMPERSAND, types.get(13));
		assertEquals(TokenType.RANGE, types.get(22));
		assertEquals(TokenType.EOF, types.get(23));
		assertThrows(LexerException.class, () -> tokens("x := 1 ? 2"));
	}

	@Test
	public void testVendorTokens() {
		List<TokenType> vendor = types("{attribute 'hide'} x += 1", Dialect.VENDOR);
		assertEquals(TokenType.PRAGMA, vendor.get(0));
		assertEquals(TokenType.PLUS_ASSIGN, vendor.get(2));
		assertEquals("attribute 'hide'", tokens("{ attribute 'hide' }", Dialect.VENDOR).get(0).getValue());

		// the standard dialect skips pragmas and has no compound assignment
		List<TokenType> standard = types("{attribute 'hide'} x += 1", Dialect.IEC_61131_3);
		assertEquals(TokenType.IDENTIFIER, standard.get(0));
		assertEquals(TokenType.PLUS, standard.get(1));
		assertEquals(TokenType.EQ, standard.get(2));
		assertThrows(LexerException.class, () -> tokens("{ never closed", Dialect.VENDOR));
	}

	@Test
	public void testPositions() {
		List<Token> tokens = tokens("IF a\n  THEN");
		assertEquals(1, tokens.get(1).getSpan().getStartLine());
		assertEquals(4, tokens.get(1).getSpan().getStartColumn());
		assertEquals(2, tokens.get(2).getSpan().getStartLine());
		assertEquals(3, tokens.get(2).getSpan().getStartColumn());
		assertEquals(7, tokens.get(2).getSpan().getStartOffset());
		assertEquals(11, tokens.get(2).getSpan().getEndOffset());
	}

	@Test
	public void testLimits() {
		ResourceLimits tiny = ResourceLimits.builder().maxInputSize(10).maxStringLength(4).build();
		SecurityLimitException tooLarge = assertThrows(
				SecurityLimitException.class,
				() -> new StructuredTextLexer("x := 1234567;", Dialect.IEC_61131_3, new ResourceState(tiny)));
		assertEquals(LimitKind.INPUT_TOO_LARGE, tooLarge.getLimitKind());

		SecurityLimitException tooLong = assertThrows(
				SecurityLimitException.class,
				() -> new StructuredTextLexer("abcde", Dialect.IEC_61131_3, new ResourceState(tiny)).tokenize());
		assertEquals(LimitKind.STRING_TOO_LONG, tooLong.getLimitKind());

		assertThrows(
				SecurityLimitException.class,
				() -> new StructuredTextLexer("'abcde'", Dialect.IEC_61131_3, new ResourceState(tiny)).tokenize());
		new StructuredTextLexer("'abcd'", Dialect.IEC_61131_3, new ResourceState(tiny)).tokenize();
	}
}
