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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.plcflow.ErrorKind;
import org.metricshub.plcflow.StructuredTextException;
import org.metricshub.plcflow.frontend.ast.ArgumentKind;
import org.metricshub.plcflow.frontend.ast.AssignmentOperator;
import org.metricshub.plcflow.frontend.ast.AssignmentStatement;
import org.metricshub.plcflow.frontend.ast.BinaryExpression;
import org.metricshub.plcflow.frontend.ast.BinaryOperator;
import org.metricshub.plcflow.frontend.ast.CallExpression;
import org.metricshub.plcflow.frontend.ast.CaseStatement;
import org.metricshub.plcflow.frontend.ast.CompilationUnit;
import org.metricshub.plcflow.frontend.ast.DirectAddress;
import org.metricshub.plcflow.frontend.ast.DirectAddressExpression;
import org.metricshub.plcflow.frontend.ast.Expression;
import org.metricshub.plcflow.frontend.ast.ForStatement;
import org.metricshub.plcflow.frontend.ast.GotoStatement;
import org.metricshub.plcflow.frontend.ast.IfStatement;
import org.metricshub.plcflow.frontend.ast.IndexExpression;
import org.metricshub.plcflow.frontend.ast.InvocationStatement;
import org.metricshub.plcflow.frontend.ast.LabelStatement;
import org.metricshub.plcflow.frontend.ast.LiteralExpression;
import org.metricshub.plcflow.frontend.ast.LiteralKind;
import org.metricshub.plcflow.frontend.ast.MemberAccessExpression;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.PouKind;
import org.metricshub.plcflow.frontend.ast.PragmaStatement;
import org.metricshub.plcflow.frontend.ast.RepeatStatement;
import org.metricshub.plcflow.frontend.ast.RetainKind;
import org.metricshub.plcflow.frontend.ast.ReturnStatement;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.TypeDeclaration;
import org.metricshub.plcflow.frontend.ast.TypeReference;
import org.metricshub.plcflow.frontend.ast.VariableBlock;
import org.metricshub.plcflow.frontend.ast.VariableClass;
import org.metricshub.plcflow.frontend.ast.VariableDeclaration;
import org.metricshub.plcflow.frontend.ast.WhileStatement;
import org.metricshub.plcflow.util.ParserSettings;

public class StructuredTextParserTest {

	private static StructuredTextParser parser(Dialect dialect) {
		ParserSettings settings = new ParserSettings();
		settings.setDialect(dialect);
		return new StructuredTextParser(settings);
	}

	private static Expression expression(String source) {
		return new StructuredTextParser().parseExpression(source).getValueOrThrow();
	}

	private static List<Statement> statements(String source) {
		return new StructuredTextParser().parseStatements(source).getValueOrThrow();
	}

	private static StructuredTextException error(String source) {
		ParseResult<List<Statement>> result = new StructuredTextParser().parseStatements(source);
		assertFalse("Parse of " + source + " should fail", result.isSuccess());
		return result.getError();
	}

	@Test
	public void testPrecedence() {
		assertEquals("(2 + (3 * 4))", expression("2 + 3 * 4").toString());
		assertEquals("((2 + 3) * 4)", expression("(2 + 3) * 4").toString());
		assertEquals("((a - b) - c)", expression("a - b - c").toString());
		assertEquals("(2 ** (3 ** 2))", expression("2 ** 3 ** 2").toString());
		assertEquals("((NOT a) AND b)", expression("NOT a AND b").toString());
		assertEquals("(a OR (b XOR (c AND d)))", expression("a OR b XOR c AND d").toString());
		assertEquals("((x = 1) OR (y < (2 + 3)))", expression("x = 1 OR y < 2 + 3").toString());
		assertEquals("((a MOD 2) = 0)", expression("a MOD 2 = 0").toString());
		assertEquals("((-x) ** 2)", expression("-x ** 2").toString());
		assertEquals("(a AND b)", expression("a & b").toString());
		assertEquals("5", expression("+5").toString());

		BinaryExpression power = (BinaryExpression) expression("2 ** 3 ** 2");
		assertEquals(BinaryOperator.POWER, power.getOperator());
		assertTrue(power.getRight() instanceof BinaryExpression);
	}

	@Test
	public void testLiteralsAndPostfix() {
		LiteralExpression time = (LiteralExpression) expression("T#5s");
		assertEquals(LiteralKind.TIME, time.getKind());
		assertEquals("5s", time.getValue());
		assertEquals(LiteralKind.BOOLEAN, ((LiteralExpression) expression("TRUE")).getKind());
		assertEquals(Long.valueOf(255L), ((LiteralExpression) expression("16#FF")).getValue());

		MemberAccessExpression member = (MemberAccessExpression) expression("motor.status.3");
		assertEquals("3", member.getMember());
		assertEquals("motor.status", member.getTarget().toString());

		IndexExpression index = (IndexExpression) expression("grid[i + 1, 2]");
		assertEquals(2, index.getIndices().size());

		CallExpression call = (CallExpression) expression("fbs[1].run(x, IN := TRUE, Q => done)");
		assertTrue(call.getCallee() instanceof MemberAccessExpression);
		assertEquals(3, call.getArguments().size());
		assertEquals(ArgumentKind.POSITIONAL, call.getArguments().get(0).getKind());
		assertEquals(ArgumentKind.INPUT, call.getArguments().get(1).getKind());
		assertEquals("IN", call.getArguments().get(1).getName());
		assertEquals(ArgumentKind.OUTPUT, call.getArguments().get(2).getKind());
		assertEquals(0, ((CallExpression) expression("now()")).getArguments().size());
	}

	@Test
	public void testIfStatement() {
		List<Statement> list = statements(
				"IF a THEN x := 1; ELSIF b THEN x := 2; y := 3; ELSIF c THEN ; ELSE x := 4; END_IF;");
		assertEquals(1, list.size());
		IfStatement statement = (IfStatement) list.get(0);
		assertEquals(3, statement.getBranches().size());
		assertEquals(2, statement.getBranches().get(1).getBody().size());
		assertEquals(1, statement.getBranches().get(2).getBody().size());
		assertTrue(statement.hasElse());
		assertEquals(1, statement.getElseBody().size());

		IfStatement noElse = (IfStatement) statements("if a then end_if;").get(0);
		assertFalse(noElse.hasElse());
		assertTrue(noElse.getBranches().get(0).getBody().isEmpty());
	}

	@Test
	public void testCaseStatement() {
		CaseStatement statement = (CaseStatement) statements(
				"CASE x OF 1: a := 1; b := 1; 2, 3: a := 2; 4..6, -1: a := 3; ELSE a := 0; END_CASE;").get(0);
		assertEquals(3, statement.getArms().size());
		assertEquals(2, statement.getArms().get(0).getBody().size());
		assertEquals(2, statement.getArms().get(1).getLabels().size());
		assertTrue(statement.getArms().get(2).getLabels().get(0).isRange());
		assertEquals("(-1)", statement.getArms().get(2).getLabels().get(1).toString());
		assertTrue(statement.hasElse());

		CaseStatement enumerated = (CaseStatement) statements(
				"CASE state OF Idle: x := 1; Running, Paused: x := 2; y := 3; Color#Red: ; END_CASE;").get(0);
		assertEquals(3, enumerated.getArms().size());
		assertEquals("Idle", enumerated.getArms().get(0).getLabels().get(0).toString());
		assertEquals("Running", enumerated.getArms().get(1).getLabels().get(0).toString());
		assertEquals("Paused", enumerated.getArms().get(1).getLabels().get(1).toString());
		assertEquals(2, enumerated.getArms().get(1).getBody().size());
		assertEquals("Color#Red", enumerated.getArms().get(2).getLabels().get(0).toString());
		assertFalse(enumerated.hasElse());

		CaseStatement onlyElse = (CaseStatement) statements("CASE x OF ELSE y := 1; END_CASE;").get(0);
		assertTrue(onlyElse.getArms().isEmpty());
	}

	@Test
	public void testLoops() {
		List<Statement> list = statements(
				"FOR i := 1 TO 10 BY 2 DO x := x + i; END_FOR;\n"
						+ "WHILE x < 10 DO x := x + 1; IF x = 5 THEN EXIT; END_IF; END_WHILE;\n"
						+ "REPEAT x := x - 1; CONTINUE; UNTIL x <= 0 END_REPEAT;\n"
						+ "REPEAT x := x - 1; UNTIL x <= 0;");
		assertEquals(4, list.size());
		ForStatement loop = (ForStatement) list.get(0);
		assertEquals("i", loop.getVariable());
		assertEquals("2", loop.getStep().toString());
		assertNull(((ForStatement) statements("FOR i := 1 TO 3 DO END_FOR;").get(0)).getStep());
		assertEquals(2, ((WhileStatement) list.get(1)).getBody().size());
		assertEquals("(x <= 0)", ((RepeatStatement) list.get(2)).getCondition().toString());
		assertEquals(1, ((RepeatStatement) list.get(3)).getBody().size());
	}

	@Test
	public void testSimpleStatements() {
		List<Statement> list = statements(
				"start: x := 1; fb(IN := TRUE, PT := T#5s, Q => done); RETURN; RETURN x + 1; GOTO start; ;");
		assertEquals(7, list.size());
		assertEquals("start", ((LabelStatement) list.get(0)).getName());
		AssignmentStatement assignment = (AssignmentStatement) list.get(1);
		assertEquals(AssignmentOperator.ASSIGN, assignment.getOperator());
		InvocationStatement invocation = (InvocationStatement) list.get(2);
		assertEquals(3, invocation.getCall().getArguments().size());
		assertNull(((ReturnStatement) list.get(3)).getValue());
		assertEquals("(x + 1)", ((ReturnStatement) list.get(4)).getValue().toString());
		assertEquals("start", ((GotoStatement) list.get(5)).getLabel());
		assertEquals(";", list.get(6).toString());
	}

	@Test
	public void testSpans() {
		List<Statement> list = statements("x := 1;\n  IF a THEN\n    y := 2;\n  END_IF;");
		IfStatement statement = (IfStatement) list.get(1);
		assertEquals(2, statement.getSpan().getStartLine());
		assertEquals(3, statement.getSpan().getStartColumn());
		assertEquals(4, statement.getSpan().getEndLine());
		Statement inner = statement.getBranches().get(0).getBody().get(0);
		assertEquals(3, inner.getSpan().getStartLine());
		assertEquals(5, inner.getSpan().getStartColumn());
	}

	@Test
	public void testPou() {
		String source = "FUNCTION Add : INT\n"
				+ "VAR_INPUT a, b : INT; END_VAR\n"
				+ "VAR CONSTANT LIMIT : INT := 100; END_VAR\n"
				+ "VAR RETAIN counter : DINT; END_VAR\n"
				+ "VAR_OUTPUT lamp AT %QX0.1 : BOOL; END_VAR\n"
				+ "VAR_TEMP arr : ARRAY[1..10, 0..2] OF ARRAY[0..1] OF REAL; name : STRING[20]; wide : WSTRING(10); pct : INT(0..100); END_VAR\n"
				+ "Add := a + b;\n"
				+ "END_FUNCTION";
		Pou pou = new StructuredTextParser().parsePou(source).getValueOrThrow();
		assertEquals(PouKind.FUNCTION, pou.getKind());
		assertEquals("Add", pou.getName());
		assertEquals("INT", pou.getReturnType().getName());
		assertEquals(5, pou.getVariableBlocks().size());
		assertEquals(1, pou.getBody().size());

		List<VariableDeclaration> declarations = pou.getDeclarations();
		assertEquals(8, declarations.size());
		assertEquals(Arrays.asList("a", "b"), declarations.get(0).getNames());
		assertEquals("a, b : INT", declarations.get(0).toString());
		assertEquals(VariableClass.INPUT, declarations.get(0).getVariableClass());

		VariableDeclaration limit = declarations.get(1);
		assertTrue(limit.isConstant());
		assertEquals("100", limit.getInitialValue().toString());

		VariableBlock retained = pou.getVariableBlocks().get(2);
		assertEquals(RetainKind.RETAIN, retained.getRetain());

		VariableDeclaration lamp = declarations.get(3);
		assertEquals(VariableClass.OUTPUT, lamp.getVariableClass());
		assertEquals(DirectAddress.Location.OUTPUT, lamp.getLocation().getLocation());
		assertEquals(DirectAddress.Size.BIT, lamp.getLocation().getSize());

		TypeReference array = declarations.get(4).getType();
		assertEquals(TypeReference.Kind.ARRAY, array.getKind());
		assertEquals(2, array.getDimensions().size());
		assertEquals(TypeReference.Kind.ARRAY, array.getElementType().getKind());
		assertEquals(TypeReference.Kind.STRING, declarations.get(5).getType().getKind());
		assertEquals("20", declarations.get(5).getType().getLength().toString());
		assertEquals(TypeReference.Kind.WSTRING, declarations.get(6).getType().getKind());
		assertEquals(TypeReference.Kind.SUBRANGE, declarations.get(7).getType().getKind());
		assertEquals(VariableClass.TEMP, declarations.get(7).getVariableClass());
	}

	@Test
	public void testSeveralNamesShareOneDeclaration() {
		Pou pou = new StructuredTextParser()
				.parsePou("PROGRAM P VAR a, b, c : INT := 5; END_VAR x := a; END_PROGRAM")
				.getValueOrThrow();
		assertEquals(1, pou.getDeclarations().size());
		VariableDeclaration declaration = pou.getDeclarations().get(0);
		assertEquals(Arrays.asList("a", "b", "c"), declaration.getNames());
		assertEquals("5", declaration.getInitialValue().toString());
		assertThrows(UnsupportedOperationException.class, () -> declaration.getNames().add("d"));
	}

	@Test
	public void testOversizedDirectAddressIsALexicalError() {
		ParseResult<CompilationUnit> result = new StructuredTextParser()
				.parseCompilationUnit("PROGRAM P VAR x AT %IX99999999999 : BOOL; END_VAR x := TRUE; END_PROGRAM");
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.LEXICAL, result.getError().getKind());
		assertEquals(1, result.getError().getSpan().getStartLine());
		assertEquals(20, result.getError().getSpan().getStartColumn());

		ParseResult<Expression> operand = parser(Dialect.VENDOR).parseExpression("%QW1.4294967296 + 1");
		assertEquals(ErrorKind.LEXICAL, operand.getError().getKind());
	}

	@Test
	public void testCompilationUnit() {
		String source = "TYPE Mode : (Off, Manual, Auto := 10); END_TYPE\n"
				+ "PROGRAM Main x := 1; END_PROGRAM;\n"
				+ "FUNCTION_BLOCK Fb VAR_IN_OUT v : INT; END_VAR v := v + 1; END_FUNCTION_BLOCK";
		CompilationUnit unit = new StructuredTextParser().parseCompilationUnit(source).getValueOrThrow();
		assertEquals(2, unit.getPous().size());
		assertEquals(1, unit.getTypes().size());
		assertEquals(PouKind.FUNCTION_BLOCK, unit.findPou("FB").getKind());
		assertNull(unit.findPou("Other"));
	}

	@Test
	public void testTypeBlock() {
		String source = "TYPE\n"
				+ "  Color : (Red, Green := 5, Blue) INT;\n"
				+ "  Point : STRUCT x : REAL; y : REAL := 1.0; END_STRUCT;\n"
				+ "  Percent : INT(0..100) := 50;\n"
				+ "  Buffer : ARRAY[0..9] OF BYTE;\n"
				+ "  Name : STRING[32];\n"
				+ "END_TYPE";
		List<TypeDeclaration> types = new StructuredTextParser().parseTypeBlock(source).getValueOrThrow();
		assertEquals(5, types.size());
		TypeDeclaration color = types.get(0);
		assertEquals(TypeDeclaration.Kind.ENUM, color.getKind());
		assertEquals(3, color.getEnumValues().size());
		assertEquals("5", color.getEnumValues().get(1).getValue().toString());
		assertEquals("INT", color.getType().getName());
		assertEquals(TypeDeclaration.Kind.STRUCT, types.get(1).getKind());
		assertEquals(2, types.get(1).getFields().size());
		assertEquals(TypeDeclaration.Kind.SUBRANGE, types.get(2).getKind());
		assertEquals("50", types.get(2).getInitialValue().toString());
		assertEquals(TypeDeclaration.Kind.ARRAY, types.get(3).getKind());
		assertEquals(TypeDeclaration.Kind.ALIAS, types.get(4).getKind());
	}

	@Test
	public void testVendorDialect() {
		String source = "{attribute 'qualified_only'}\n"
				+ "PROGRAM Motor\n"
				+ "VAR {attribute 'hide'} speed : REAL; END_VAR\n"
				+ "{region \"control\"}\n"
				+ "speed += 1.5;\n"
				+ "IF %IX0.1 THEN speed := 0.0; END_IF;\n"
				+ "log(speed, , 3);\n"
				+ "{endregion}\n"
				+ "END_PROGRAM";
		Pou pou = parser(Dialect.VENDOR).parsePou(source).getValueOrThrow();
		assertEquals(1, pou.getPragmas().size());
		assertEquals("attribute 'qualified_only'", pou.getPragmas().get(0).getText());
		assertEquals(1, pou.getDeclarations().get(0).getPragmas().size());

		List<Statement> body = pou.getBody();
		assertEquals(5, body.size());
		assertEquals("region \"control\"", ((PragmaStatement) body.get(0)).getPragma().getText());
		assertEquals(AssignmentOperator.ADD_ASSIGN, ((AssignmentStatement) body.get(1)).getOperator());
		Expression condition = ((IfStatement) body.get(2)).getBranches().get(0).getCondition();
		assertTrue(condition instanceof DirectAddressExpression);
		assertEquals(DirectAddress.Location.INPUT, ((DirectAddressExpression) condition).getAddress().getLocation());
		CallExpression log = ((InvocationStatement) body.get(3)).getCall();
		assertTrue(log.getArguments().get(1).isEmpty());
		assertTrue(body.get(4) instanceof PragmaStatement);

		assertEquals(
				AssignmentOperator.SUBTRACT_ASSIGN,
				((AssignmentStatement) parser(Dialect.VENDOR).parseStatements("%QW2 -= 1;").getValueOrThrow().get(0))
						.getOperator());
	}

	@Test
	public void testVendorFeaturesAreRejectedInStandardDialect() {
		assertEquals(ErrorKind.SYNTAX, error("speed += 1.5;").getKind());
		StructuredTextException address = error("x := %IX0.1;");
		assertEquals(ErrorKind.SYNTAX, address.getKind());
		assertTrue(address.getMessage().startsWith("Direct addresses are only allowed in AT locations"));
		assertEquals(ErrorKind.SYNTAX, error("log(a, , b);").getKind());
		assertEquals(ErrorKind.SYNTAX, error("%QX0.0 := TRUE;").getKind());
		// pragmas are comments in the standard dialect
		assertEquals(1, statements("{attribute 'x'} x := 1;").size());
	}

	@Test
	public void testSyntaxErrors() {
		StructuredTextException missing = error("IF x THEN y := 1; END_IF");
		assertEquals(ErrorKind.SYNTAX, missing.getKind());
		assertEquals("Expecting statement terminator ';'. Got end of input", missing.getDetail());

		StructuredTextException unexpected = error("x := 1\ny := 2;");
		assertEquals(2, unexpected.getSpan().getStartLine());
		assertEquals(1, unexpected.getSpan().getStartColumn());

		assertTrue(error("fb;").getDetail().startsWith("Expecting ':=' or a call"));
		assertTrue(error("IF x y := 1; END_IF;").getDetail().startsWith("Expecting 'THEN'"));
		assertEquals(ErrorKind.SYNTAX, error("f() := 1;").getKind());
		assertEquals(ErrorKind.SYNTAX, error("x := (1 + 2;").getKind());
		assertEquals(ErrorKind.SYNTAX, error("END_IF;").getKind());
		assertEquals(ErrorKind.SYNTAX, error("FOR i = 1 TO 2 DO END_FOR;").getKind());
		assertEquals(ErrorKind.LEXICAL, error("x := 1 ? 2;").getKind());

		ParseResult<Pou> noPou = new StructuredTextParser().parsePou("x := 1;");
		assertTrue(noPou.getError().getDetail().startsWith("Expecting PROGRAM, FUNCTION, FUNCTION_BLOCK or TYPE"));
		assertFalse(new StructuredTextParser().parsePou("PROGRAM P END_PROGRAM x").isSuccess());
		assertFalse(new StructuredTextParser().parseExpression("1 +").isSuccess());
	}

	@Test
	public void testParseResult() {
		ParseResult<List<Statement>> failure = new StructuredTextParser().parseStatements("x := ;");
		assertFalse(failure.isSuccess());
		assertThrows(IllegalStateException.class, failure::getValue);
		StructuredTextException thrown = assertThrows(StructuredTextException.class, failure::getValueOrThrow);
		assertSame(failure.getError(), thrown);
		assertTrue(failure.getDiagnostics().isEmpty());

		ParseResult<List<Statement>> success = new StructuredTextParser().parseStatements("x := 1;");
		assertTrue(success.isSuccess());
		assertNull(success.getError());
	}

	@Test
	public void testParserIsSingleUse() {
		StructuredTextParser parser = new StructuredTextParser();
		parser.parseStatements("x := 1;");
		assertEquals(1L, parser.getResourceState().getStatements());
		assertEquals(0, parser.getResourceState().getDepth());
		assertThrows(IllegalStateException.class, () -> parser.parseStatements("x := 1;"));
	}
}
