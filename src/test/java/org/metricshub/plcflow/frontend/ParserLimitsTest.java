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
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.plcflow.ErrorKind;
import org.metricshub.plcflow.frontend.ast.Expression;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.limits.LimitKind;
import org.metricshub.plcflow.limits.ResourceLimits;
import org.metricshub.plcflow.limits.SecurityLimitException;
import org.metricshub.plcflow.util.ParserSettings;

public class ParserLimitsTest {

	private static StructuredTextParser parser(ResourceLimits limits) {
		return parser(limits, false);
	}

	private static StructuredTextParser parser(ResourceLimits limits, boolean permissive) {
		ParserSettings settings = new ParserSettings();
		settings.setLimits(limits);
		settings.setPermissive(permissive);
		return new StructuredTextParser(settings);
	}

	private static String repeat(String text, int count) {
		StringBuilder builder = new StringBuilder(text.length() * count);
		for (int i = 0; i < count; i++) {
			builder.append(text);
		}
		return builder.toString();
	}

	private static String nestedIfs(int depth) {
		return repeat("IF a THEN\n", depth) + "x := 1;\n" + repeat("END_IF;\n", depth);
	}

	private static void assertLimit(LimitKind expected, ParseResult<?> result) {
		assertFalse("Expected " + expected + " but the parse succeeded", result.isSuccess());
		assertEquals(ErrorKind.SECURITY, result.getError().getKind());
		assertTrue(result.getError() instanceof SecurityLimitException);
		assertEquals(expected, ((SecurityLimitException) result.getError()).getLimitKind());
	}

	@Test
	public void testNestedIfsUpToTheDepthCeiling() {
		StructuredTextParser parser = parser(ResourceLimits.strict());
		ParseResult<List<Statement>> result = parser.parseStatements(nestedIfs(64));
		assertTrue(result.isSuccess());
		assertEquals(65, parser.getResourceState().getStatements());
		assertEquals("Depth is released on the way out", 0, parser.getResourceState().getDepth());
	}

	@Test
	public void testNestedIfsBeyondTheDepthCeiling() {
		ParseResult<List<Statement>> result = parser(ResourceLimits.strict()).parseStatements(nestedIfs(65));
		assertLimit(LimitKind.DEPTH_EXCEEDED, result);
		SecurityLimitException e = (SecurityLimitException) result.getError();
		assertEquals(64, e.getLimit());
		assertEquals(65, e.getAttempted());
		assertEquals("The 65th IF is on line 65", 65, e.getSpan().getStartLine());

		assertTrue(parser(ResourceLimits.relaxed()).parseStatements(nestedIfs(65)).isSuccess());
	}

	@Test
	public void testLoopsAndCaseConsumeDepth() {
		ResourceLimits two = ResourceLimits.builder().maxDepth(2).build();
		assertTrue(parser(two).parseStatements("WHILE a DO FOR i := 1 TO 2 DO x := i; END_FOR; END_WHILE;").isSuccess());
		assertLimit(
				LimitKind.DEPTH_EXCEEDED,
				parser(two).parseStatements("REPEAT CASE s OF 1: IF a THEN x := 1; END_IF; END_CASE; UNTIL b END_REPEAT;"));
	}

	@Test
	public void testExpressionNestingHasItsOwnCeiling() {
		ResourceLimits strict = ResourceLimits.strict();
		assertTrue(parser(strict).parseExpression(repeat("(", 64) + "1" + repeat(")", 64)).isSuccess());
		assertLimit(LimitKind.DEPTH_EXCEEDED, parser(strict).parseExpression(repeat("(", 65) + "1" + repeat(")", 65)));

		assertTrue(parser(strict).parseExpression(repeat("NOT ", 64) + "a").isSuccess());
		assertLimit(LimitKind.DEPTH_EXCEEDED, parser(strict).parseExpression(repeat("- ", 65) + "a"));

		// ** is right-associative: each right operand is one level deeper
		assertTrue(parser(strict).parseExpression("2" + repeat(" ** 2", 64)).isSuccess());
		assertLimit(LimitKind.DEPTH_EXCEEDED, parser(strict).parseExpression("2" + repeat(" ** 2", 65)));

		assertLimit(LimitKind.DEPTH_EXCEEDED, parser(strict).parseExpression(repeat("f(", 65) + "1" + repeat(")", 65)));
		assertLimit(LimitKind.DEPTH_EXCEEDED, parser(strict).parseExpression("a" + repeat("[b", 65) + repeat("]", 65)));
	}

	@Test
	public void testExpressionsDoNotCountAsStatementNesting() {
		String innermost = "IF NOT b THEN x := f((1), a[i]); END_IF;\n";
		String source = repeat("IF a THEN\n", 63) + innermost + repeat("END_IF;\n", 63);
		StructuredTextParser parser = parser(ResourceLimits.strict());
		assertTrue(parser.parseStatements(source).isSuccess());
		assertEquals(0, parser.getResourceState().getDepth());
		assertEquals(0, parser.getResourceState().getExpressionDepth());

		String deepest = repeat("IF a THEN\n", 64) + "x := " + repeat("(", 64) + "1" + repeat(")", 64) + ";\n"
				+ repeat("END_IF;\n", 64);
		assertTrue(parser(ResourceLimits.strict()).parseStatements(deepest).isSuccess());
	}

	@Test
	public void testLeftAssociativeChainsDoNotConsumeDepth() {
		ResourceLimits shallow = ResourceLimits.builder().maxDepth(1).build();
		StructuredTextParser parser = parser(shallow);
		ParseResult<Expression> result = parser.parseExpression("1" + repeat(" + 1", 10_000));
		assertTrue(result.isSuccess());
		assertEquals(10_000, parser.getResourceState().getIterations());
		assertTrue(parser(shallow).parseExpression("a" + repeat(" AND b OR c", 1000)).isSuccess());
	}

	@Test
	public void testIterationCeiling() {
		ResourceLimits ten = ResourceLimits.builder().maxIterations(10).build();
		assertTrue(parser(ten).parseStatements(repeat(";", 10)).isSuccess());
		assertLimit(LimitKind.ITERATION_EXCEEDED, parser(ten).parseStatements(repeat(";", 11)));
	}

	@Test
	public void testStatementCeiling() {
		ResourceLimits five = ResourceLimits.builder().maxStatements(5).build();
		assertTrue(parser(five).parseStatements("x := 1; y := 2; IF a THEN z := 3; w := 4; END_IF;").isSuccess());
		ParseResult<List<Statement>> result = parser(five).parseStatements("WHILE a DO x := 1; y := 2; z := 3; w := 4; v := 5; END_WHILE;");
		assertLimit(LimitKind.STATEMENT_LIMIT_EXCEEDED, result);
		assertEquals(1, result.getError().getSpan().getStartLine());
	}

	@Test
	public void testCaseSelectorNamesAreNotStatements() {
		String source = "CASE m OF A: x := 1; B: x := 2; C, D: x := 3; END_CASE;";
		StructuredTextParser parser = parser(ResourceLimits.strict());
		assertTrue(parser.parseStatements(source).isSuccess());
		assertEquals(4L, parser.getResourceState().getStatements());

		ResourceLimits four = ResourceLimits.builder().maxStatements(4).build();
		assertTrue(parser(four).parseStatements(source).isSuccess());
	}

	@Test
	public void testCollectionCeiling() {
		ResourceLimits three = ResourceLimits.builder().maxCollectionElements(3).build();
		assertTrue(parser(three).parseStatements("f(1, 2, 3);").isSuccess());
		assertLimit(LimitKind.COLLECTION_TOO_LARGE, parser(three).parseStatements("f(1, 2, 3, 4);"));
		assertLimit(
				LimitKind.COLLECTION_TOO_LARGE,
				parser(three).parsePou("PROGRAM P VAR a, b, c, d : INT; END_VAR END_PROGRAM"));
		assertLimit(
				LimitKind.COLLECTION_TOO_LARGE,
				parser(three).parseTypeBlock("TYPE Color : (Red, Green, Blue, Black); END_TYPE"));
		assertLimit(
				LimitKind.COLLECTION_TOO_LARGE,
				parser(three).parseStatements("CASE s OF 1, 2: x := 1; 3, 4: x := 2; END_CASE;"));
	}

	@Test
	public void testStringAndInputCeilings() {
		ResourceLimits eight = ResourceLimits.builder().maxStringLength(8).build();
		assertTrue(parser(eight).parseStatements("abcdefgh := 'abcdefgh';").isSuccess());
		assertLimit(LimitKind.STRING_TOO_LONG, parser(eight).parseStatements("abcdefghi := 1;"));
		assertLimit(LimitKind.STRING_TOO_LONG, parser(eight).parseStatements("x := 'abcdefghi';"));

		ResourceLimits small = ResourceLimits.builder().maxInputSize(16).build();
		assertTrue(parser(small).parseStatements("x := 1;").isSuccess());
		ParseResult<List<Statement>> result = parser(small).parseStatements("x := 1; y := 2; z := 3;");
		assertLimit(LimitKind.INPUT_TOO_LARGE, result);
		assertEquals("Nothing is parsed from an input that is too large", 0, result.getDiagnostics().size());
	}

	@Test
	public void testSecurityErrorsStayFatalInPermissiveMode() {
		ResourceLimits two = ResourceLimits.builder().maxDepth(2).build();
		ParseResult<List<Statement>> result = parser(two, true)
				.parseStatements("x := ; IF a THEN IF b THEN IF c THEN y := 1; END_IF; END_IF; END_IF;");
		assertLimit(LimitKind.DEPTH_EXCEEDED, result);
		assertEquals("The recovered error before the fatal one is kept", 1, result.getDiagnostics().size());
		assertEquals(ErrorKind.SYNTAX, result.getDiagnostics().get(0).getKind());
	}

	@Test
	public void testLexicalErrorsStayFatalInPermissiveMode() {
		ParseResult<List<Statement>> result = parser(ResourceLimits.balanced(), true).parseStatements("x := 1; y := 'open");
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.LEXICAL, result.getError().getKind());
	}

	@Test
	public void testEachParseStartsFromZero() {
		ResourceLimits five = ResourceLimits.builder().maxStatements(5).build();
		for (int i = 0; i < 3; i++) {
			StructuredTextParser parser = parser(five);
			assertTrue(parser.parseStatements(repeat("x := 1;", 5)).isSuccess());
			assertEquals(5, parser.getResourceState().getStatements());
		}
	}
}
