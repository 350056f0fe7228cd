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
import org.metricshub.plcflow.frontend.ast.AssignmentStatement;
import org.metricshub.plcflow.frontend.ast.CaseStatement;
import org.metricshub.plcflow.frontend.ast.EmptyStatement;
import org.metricshub.plcflow.frontend.ast.IfStatement;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.TypeDeclaration;
import org.metricshub.plcflow.util.ParserSettings;

public class PermissiveParsingTest {

	private static StructuredTextParser permissive() {
		ParserSettings settings = new ParserSettings();
		settings.setPermissive(true);
		return new StructuredTextParser(settings);
	}

	private static ParseResult<List<Statement>> statements(String source) {
		ParseResult<List<Statement>> result = permissive().parseStatements(source);
		assertTrue("Permissive parse failed: " + result, result.isSuccess());
		return result;
	}

	@Test
	public void testSkipsToTheNextSemicolon() {
		ParseResult<List<Statement>> result = statements("x := ; y := 2; z := (1 + ; w := 3;");
		List<Statement> body = result.getValue();
		assertEquals(2, body.size());
		assertEquals("y := 2", body.get(0).toString());
		assertEquals("w := 3", body.get(1).toString());

		List<Diagnostic> diagnostics = result.getDiagnostics();
		assertEquals(2, diagnostics.size());
		assertEquals(ErrorKind.SYNTAX, diagnostics.get(0).getKind());
		assertTrue(diagnostics.get(0).getMessage().startsWith("Expecting an expression"));
		assertEquals(6, diagnostics.get(0).getSpan().getStartColumn());
		assertTrue(
				"Diagnostics are in source order",
				diagnostics.get(0).getSpan().compareTo(diagnostics.get(1).getSpan()) < 0);
	}

	@Test
	public void testStopsAtBlockKeywords() {
		ParseResult<List<Statement>> result = statements("IF a THEN x := 1 + END_IF; y := 1;");
		List<Statement> body = result.getValue();
		assertEquals(2, body.size());
		IfStatement ifStatement = (IfStatement) body.get(0);
		assertTrue("The broken statement is dropped", ifStatement.getBranches().get(0).getBody().isEmpty());
		assertTrue(body.get(1) instanceof AssignmentStatement);
		assertEquals(1, result.getDiagnostics().size());
	}

	@Test
	public void testUnexpectedBlockKeywordIsSkipped() {
		ParseResult<List<Statement>> result = statements("x := 1; END_IF y := 2;");
		assertEquals(2, result.getValue().size());
		assertEquals("y := 2", result.getValue().get(1).toString());
		assertEquals(1, result.getDiagnostics().size());
		assertTrue(result.getDiagnostics().get(0).getMessage().startsWith("Not a valid statement"));
	}

	@Test
	public void testRecoveryInsideCaseArms() {
		ParseResult<List<Statement>> result = statements("CASE s OF 1: x := ; 2: y := 1; END_CASE;");
		CaseStatement caseStatement = (CaseStatement) result.getValue().get(0);
		assertEquals(2, caseStatement.getArms().size());
		assertTrue(caseStatement.getArms().get(0).getBody().isEmpty());
		assertEquals(1, caseStatement.getArms().get(1).getBody().size());
		assertEquals(1, result.getDiagnostics().size());
	}

	@Test
	public void testCascadingRecovery() {
		// the broken IF is skipped up to the first ';', then END_IF is reported on its own
		ParseResult<List<Statement>> result = statements("IF THEN x := 1; END_IF; y := 2;");
		List<Statement> body = result.getValue();
		assertEquals(2, body.size());
		assertTrue(body.get(0) instanceof EmptyStatement);
		assertEquals("y := 2", body.get(1).toString());
		assertEquals(2, result.getDiagnostics().size());
	}

	@Test
	public void testRecoveryInDeclarations() {
		ParseResult<Pou> result = permissive()
				.parsePou("PROGRAM P\nVAR\n  a : ;\n  b : INT;\nEND_VAR\nx := 1;\nEND_PROGRAM");
		assertTrue(result.isSuccess());
		Pou pou = result.getValue();
		assertEquals(1, pou.getDeclarations().size());
		assertEquals("b", pou.getDeclarations().get(0).getNames().get(0));
		assertEquals(1, pou.getBody().size());
		assertEquals(1, result.getDiagnostics().size());
		assertEquals(3, result.getDiagnostics().get(0).getSpan().getStartLine());
	}

	@Test
	public void testRecoveryInTypeBlocks() {
		ParseResult<List<TypeDeclaration>> result = permissive()
				.parseTypeBlock("TYPE\n  Broken : ;\n  Level : INT (0..100);\nEND_TYPE");
		assertTrue(result.isSuccess());
		assertEquals(1, result.getValue().size());
		assertEquals("Level", result.getValue().get(0).getName());
		assertEquals(1, result.getDiagnostics().size());
	}

	@Test
	public void testStrictModeStopsAtTheFirstError() {
		ParseResult<List<Statement>> result = new StructuredTextParser().parseStatements("x := ; y := 2; z := (1 + ;");
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.SYNTAX, result.getError().getKind());
		assertEquals(6, result.getError().getSpan().getStartColumn());
		assertTrue(result.getDiagnostics().isEmpty());
	}

	@Test
	public void testUnclosedBlockIsDropped() {
		// the missing END_WHILE is reported by the enclosing list, which drops the loop
		ParseResult<List<Statement>> result = statements("WHILE a DO x := ;");
		assertTrue(result.getValue().isEmpty());
		assertEquals(2, result.getDiagnostics().size());
		assertTrue(result.getDiagnostics().get(1).getMessage().startsWith("Expecting 'END_WHILE'"));
	}
}
