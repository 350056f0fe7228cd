package org.metricshub.plcflow;

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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.plcflow.PlcFlowTestSupport.analysisTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.Test;
import org.metricshub.plcflow.analysis.symbols.SymbolFinding;
import org.metricshub.plcflow.frontend.Dialect;
import org.metricshub.plcflow.frontend.ParseResult;
import org.metricshub.plcflow.frontend.ast.CompilationUnit;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.PouKind;
import org.metricshub.plcflow.limits.LimitKind;
import org.metricshub.plcflow.limits.ResourceLimits;
import org.metricshub.plcflow.util.ParserSettings;

public class PlcFlowTest {

	@Test
	public void testBodyIsWrappedInAProgram() {
		PlcFlowTestSupport.TestResult result = analysisTest("bare body")
				.name("Conveyor")
				.source("IF run THEN speed := 10; ELSE speed := 0; END_IF;")
				.expectPous(1)
				.expectComplexity(2)
				.run();
		result.assertExpected();
		Pou pou = result.analysis().getPou();
		assertEquals(PouKind.PROGRAM, pou.getKind());
		assertEquals("Conveyor", pou.getName());
		assertEquals(1, pou.getBody().size());
		assertEquals(1, pou.getSpan().getStartLine());
	}

	@Test
	public void testEmptySource() {
		analysisTest("empty source")
				.source("  (* nothing yet *)  ")
				.expectPous(1)
				.expectComplexity(1)
				.expectNesting(0)
				.expectUnreachable(0)
				.runAndAssert();
	}

	@Test
	public void testSeveralPous() {
		String source = String
				.join(
						"\n",
						"FUNCTION Limit : INT",
						"VAR_INPUT value : INT; END_VAR",
						"IF value > 100 THEN Limit := 100; ELSE Limit := value; END_IF;",
						"END_FUNCTION",
						"",
						"PROGRAM Main",
						"VAR speed : INT; END_VAR",
						"WHILE speed < 10 DO speed := Limit(speed + 1); END_WHILE;",
						"END_PROGRAM");
		ParseResult<List<PouAnalysis>> result = new PlcFlow().analyze(new PouSource("unit", source));
		assertTrue(result.isSuccess());
		List<PouAnalysis> analyses = result.getValue();
		assertEquals(2, analyses.size());
		assertEquals("Limit", analyses.get(0).getPou().getName());
		assertEquals(PouKind.FUNCTION, analyses.get(0).getPou().getKind());
		assertEquals("Main", analyses.get(1).getPou().getName());
		assertEquals(2, analyses.get(1).getMetrics().getCyclomaticComplexity());

		CompilationUnit unit = new PlcFlow().parse(new PouSource("unit", source)).getValueOrThrow();
		assertNotNull(unit.findPou("main"));
	}

	@Test
	public void testTypeOnlySource() {
		ParseResult<List<PouAnalysis>> result = new PlcFlow()
				.analyze(new PouSource("types", "TYPE Mode : (Off, On); END_TYPE"));
		assertTrue(result.isSuccess());
		assertTrue(result.getValue().isEmpty());
	}

	@Test
	public void testSymbolFindingsAreSeparateFromDiagnostics() {
		String source = String
				.join(
						"\n",
						"TYPE Mode : (Off, On); END_TYPE",
						"PROGRAM Main",
						"VAR m : Mode; spare : INT; END_VAR",
						"m := On;",
						"x := m;",
						"END_PROGRAM");
		ParseResult<List<PouAnalysis>> result = new PlcFlow().analyze(new PouSource("unit", source));
		assertTrue(result.isSuccess());
		assertTrue(result.getDiagnostics().isEmpty());
		List<SymbolFinding> findings = result.getValue().get(0).getSymbolFindings();
		assertEquals(2, findings.size());
		assertEquals(SymbolFinding.Kind.UNUSED_VARIABLE, findings.get(0).getKind());
		assertEquals("spare", findings.get(0).getName());
		assertEquals(SymbolFinding.Kind.UNDEFINED_IDENTIFIER, findings.get(1).getKind());
		assertEquals("x", findings.get(1).getName());
		assertEquals(5, findings.get(1).getSpan().getStartLine());

		analysisTest("bare body declares nothing")
				.source("x := y;")
				.expectSymbolFindings(0)
				.runAndAssert();
	}

	@Test
	public void testPragmasBeforeAPou() {
		String source = "{attribute 'qualified_only'}\nPROGRAM P\nx := 1;\nEND_PROGRAM";
		CompilationUnit vendor = new PlcFlow().parse(new PouSource("P", source, "VENDOR")).getValueOrThrow();
		assertEquals(1, vendor.getPous().get(0).getPragmas().size());

		// in the standard dialect, the pragma is a comment
		CompilationUnit standard = new PlcFlow().parse(new PouSource("P", source)).getValueOrThrow();
		assertEquals(0, standard.getPous().get(0).getPragmas().size());
		assertEquals(1, standard.getPous().get(0).getBody().size());
	}

	@Test
	public void testSources() {
		assertThrows(IllegalArgumentException.class, () -> new PouSource("P", "x := 1;", "LD"));
		assertThrows(IllegalArgumentException.class, () -> new PouSource(" ", "x := 1;"));
		assertThrows(IllegalArgumentException.class, () -> new PouSource("P", null));
		PouSource source = new PouSource("P", "x := 1;", "extended_st");
		assertEquals(Dialect.VENDOR, source.getDialect());
		assertEquals("P (extended_st, 7 characters)", source.toString());
		assertEquals(Dialect.IEC_61131_3, new PouSource("P", "").getDialect());
	}

	@Test
	public void testFailures() {
		analysisTest("unterminated string").source("x := 'open").expectError(ErrorKind.LEXICAL).runAndAssert();
		analysisTest("bad first character").source("? PROGRAM").expectError(ErrorKind.LEXICAL).runAndAssert();
		analysisTest("missing expression").source("x := ;").expectError(ErrorKind.SYNTAX).runAndAssert();
		analysisTest("unfinished POU")
				.source("PROGRAM P x := 1;")
				.expectError(ErrorKind.SYNTAX)
				.runAndAssert();
		analysisTest("too deep")
				.source("IF a THEN IF b THEN x := 1; END_IF; END_IF;")
				.limits(ResourceLimits.builder().maxDepth(1).build())
				.expectLimit(LimitKind.DEPTH_EXCEEDED)
				.runAndAssert();
	}

	@Test
	public void testPermissiveDiagnosticsAreReported() {
		PlcFlowTestSupport.TestResult result = analysisTest("permissive body")
				.source("x := ;\ny := 1;")
				.permissive()
				.expectDiagnostics(1)
				.expectComplexity(1)
				.run();
		result.assertExpected();
		assertEquals(1, result.parseResult().getDiagnostics().get(0).getSpan().getStartLine());
		assertEquals(1, result.analysis().getPou().getBody().size());
	}

	@Test
	public void testSettingsAreCopied() {
		ParserSettings settings = new ParserSettings();
		settings.setPermissive(true);
		PlcFlow plcFlow = new PlcFlow(settings);
		settings.setPermissive(false);
		assertTrue(plcFlow.getSettings().isPermissive());

		plcFlow.getSettings().setPermissive(false);
		assertTrue(plcFlow.getSettings().isPermissive());
		assertTrue(plcFlow.analyze(new PouSource("P", "x := ; y := 1;")).isSuccess());
		assertFalse(new PlcFlow().analyze(new PouSource("P", "x := ; y := 1;")).isSuccess());
	}

	@Test
	public void testAnalyzeAllMatchesSequentialAnalysis() throws InterruptedException {
		List<PouSource> sources = new ArrayList<PouSource>();
		for (int i = 0; i < 40; i++) {
			StringBuilder text = new StringBuilder();
			for (int j = 0; j <= i % 5; j++) {
				text.append("IF a").append(j).append(" AND b THEN x := ").append(j).append("; END_IF;\n");
			}
			if (i % 7 == 3) {
				text.append("x := ;");
			}
			sources.add(new PouSource("P" + i, text.toString()));
		}

		PlcFlow plcFlow = new PlcFlow();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		List<ParseResult<List<PouAnalysis>>> results;
		try {
			results = plcFlow.analyzeAll(sources, executor);
		} finally {
			executor.shutdownNow();
		}

		assertEquals(sources.size(), results.size());
		for (int i = 0; i < sources.size(); i++) {
			ParseResult<List<PouAnalysis>> expected = plcFlow.analyze(sources.get(i));
			ParseResult<List<PouAnalysis>> actual = results.get(i);
			assertEquals("Result of P" + i, expected.isSuccess(), actual.isSuccess());
			if (expected.isSuccess()) {
				PouAnalysis analysis = actual.getValue().get(0);
				assertEquals("P" + i, analysis.getPou().getName());
				assertEquals(expected.getValue().get(0).getMetrics(), analysis.getMetrics());
				assertEquals(i % 5 + 2, analysis.getMetrics().getCyclomaticComplexity());
			} else {
				assertEquals(ErrorKind.SYNTAX, actual.getError().getKind());
			}
		}
	}
}
