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
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.StructuredTextException;
import org.metricshub.plcflow.frontend.ast.Argument;
import org.metricshub.plcflow.frontend.ast.ArgumentKind;
import org.metricshub.plcflow.frontend.ast.AssignmentOperator;
import org.metricshub.plcflow.frontend.ast.AssignmentStatement;
import org.metricshub.plcflow.frontend.ast.BinaryExpression;
import org.metricshub.plcflow.frontend.ast.BinaryOperator;
import org.metricshub.plcflow.frontend.ast.CallExpression;
import org.metricshub.plcflow.frontend.ast.CaseArm;
import org.metricshub.plcflow.frontend.ast.CaseLabel;
import org.metricshub.plcflow.frontend.ast.CaseStatement;
import org.metricshub.plcflow.frontend.ast.CompilationUnit;
import org.metricshub.plcflow.frontend.ast.ConditionalBlock;
import org.metricshub.plcflow.frontend.ast.ContinueStatement;
import org.metricshub.plcflow.frontend.ast.DirectAddress;
import org.metricshub.plcflow.frontend.ast.DirectAddressExpression;
import org.metricshub.plcflow.frontend.ast.EmptyStatement;
import org.metricshub.plcflow.frontend.ast.EnumValue;
import org.metricshub.plcflow.frontend.ast.ExitStatement;
import org.metricshub.plcflow.frontend.ast.Expression;
import org.metricshub.plcflow.frontend.ast.ForStatement;
import org.metricshub.plcflow.frontend.ast.GotoStatement;
import org.metricshub.plcflow.frontend.ast.IdentifierExpression;
import org.metricshub.plcflow.frontend.ast.IfStatement;
import org.metricshub.plcflow.frontend.ast.IndexExpression;
import org.metricshub.plcflow.frontend.ast.InvocationStatement;
import org.metricshub.plcflow.frontend.ast.LabelStatement;
import org.metricshub.plcflow.frontend.ast.LiteralExpression;
import org.metricshub.plcflow.frontend.ast.LiteralKind;
import org.metricshub.plcflow.frontend.ast.MemberAccessExpression;
import org.metricshub.plcflow.frontend.ast.ParenthesizedExpression;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.PouKind;
import org.metricshub.plcflow.frontend.ast.Pragma;
import org.metricshub.plcflow.frontend.ast.PragmaStatement;
import org.metricshub.plcflow.frontend.ast.RepeatStatement;
import org.metricshub.plcflow.frontend.ast.RetainKind;
import org.metricshub.plcflow.frontend.ast.ReturnStatement;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.Subrange;
import org.metricshub.plcflow.frontend.ast.TypeDeclaration;
import org.metricshub.plcflow.frontend.ast.TypeReference;
import org.metricshub.plcflow.frontend.ast.UnaryExpression;
import org.metricshub.plcflow.frontend.ast.UnaryOperator;
import org.metricshub.plcflow.frontend.ast.VariableBlock;
import org.metricshub.plcflow.frontend.ast.VariableClass;
import org.metricshub.plcflow.frontend.ast.VariableDeclaration;
import org.metricshub.plcflow.frontend.ast.WhileStatement;
import org.metricshub.plcflow.limits.ResourceLimits;
import org.metricshub.plcflow.limits.ResourceState;
import org.metricshub.plcflow.util.ParserSettings;
import org.metricshub.plcflow.util.PlcLogger;
import org.slf4j.Logger;

/**
 * Converts Structured Text into a syntax tree.
 * <p>
 * The parser is a hand-written recursive descent parser: each grammar rule
 * is one method, named after the rule in upper case, and documented with
 * the rule it implements. Binary expressions are parsed by precedence
 * climbing over {@link BinaryOperator}.
 * <p>
 * Every rule that nests (statement blocks, parenthesized expressions,
 * unary operands, argument and index lists, right operands of
 * {@code **}) acquires one level of depth from the {@link ResourceState}
 * before recursing, and releases it in a {@code finally} block. Every list
 * repetition records an iteration, every declared name, argument, index,
 * array dimension, case value and enumerated value records a collection
 * element, and every statement is counted.
 * <p>
 * In permissive mode, a syntax error inside a statement list or a
 * declaration list is recorded as a {@link Diagnostic} and the parser skips
 * to the next <code>;</code> (consumed) or block-closing keyword (not
 * consumed). Lexical and security errors are always fatal.
 * <p>
 * One instance parses a single source text and is not thread-safe;
 * concurrent parses use distinct instances.
 */
public class StructuredTextParser {

	private static final Logger LOG = PlcLogger.getLogger(StructuredTextParser.class);

	/** Keywords at which error recovery stops, without consuming them */
	private static final EnumSet<TokenType> RECOVERY_KEYWORDS = EnumSet
			.of(
					TokenType.KW_END_IF,
					TokenType.KW_ELSIF,
					TokenType.KW_ELSE,
					TokenType.KW_END_CASE,
					TokenType.KW_END_FOR,
					TokenType.KW_END_WHILE,
					TokenType.KW_UNTIL,
					TokenType.KW_END_REPEAT,
					TokenType.KW_END_PROGRAM,
					TokenType.KW_END_FUNCTION,
					TokenType.KW_END_FUNCTION_BLOCK,
					TokenType.KW_END_VAR,
					TokenType.KW_END_TYPE,
					TokenType.KW_END_STRUCT);

	/** Tokens that start a CASE selector value but never a statement */
	private static final EnumSet<TokenType> CASE_LABEL_START = EnumSet
			.of(
					TokenType.INTEGER_LITERAL,
					TokenType.MINUS,
					TokenType.PLUS,
					TokenType.KW_TRUE,
					TokenType.KW_FALSE);

	private static final Map<TokenType, BinaryOperator> BINARY_OPERATORS = new EnumMap<TokenType, BinaryOperator>(
			TokenType.class);
	private static final Map<TokenType, AssignmentOperator> ASSIGNMENT_OPERATORS = new EnumMap<TokenType, AssignmentOperator>(
			TokenType.class);
	private static final Map<TokenType, VariableClass> VARIABLE_CLASSES = new EnumMap<TokenType, VariableClass>(
			TokenType.class);
	private static final Map<TokenType, LiteralKind> LITERAL_KINDS = new EnumMap<TokenType, LiteralKind>(
			TokenType.class);

	static {
		BINARY_OPERATORS.put(TokenType.KW_OR, BinaryOperator.OR);
		BINARY_OPERATORS.put(TokenType.KW_XOR, BinaryOperator.XOR);
		BINARY_OPERATORS.put(TokenType.KW_AND, BinaryOperator.AND);
		BINARY_OPERATORS.put(TokenType.AMPERSAND, BinaryOperator.AND);
		BINARY_OPERATORS.put(TokenType.EQ, BinaryOperator.EQUAL);
		BINARY_OPERATORS.put(TokenType.NE, BinaryOperator.NOT_EQUAL);
		BINARY_OPERATORS.put(TokenType.LT, BinaryOperator.LESS);
		BINARY_OPERATORS.put(TokenType.LE, BinaryOperator.LESS_EQUAL);
		BINARY_OPERATORS.put(TokenType.GT, BinaryOperator.GREATER);
		BINARY_OPERATORS.put(TokenType.GE, BinaryOperator.GREATER_EQUAL);
		BINARY_OPERATORS.put(TokenType.PLUS, BinaryOperator.ADD);
		BINARY_OPERATORS.put(TokenType.MINUS, BinaryOperator.SUBTRACT);
		BINARY_OPERATORS.put(TokenType.MULT, BinaryOperator.MULTIPLY);
		BINARY_OPERATORS.put(TokenType.DIVIDE, BinaryOperator.DIVIDE);
		BINARY_OPERATORS.put(TokenType.KW_MOD, BinaryOperator.MODULO);
		BINARY_OPERATORS.put(TokenType.POWER, BinaryOperator.POWER);

		ASSIGNMENT_OPERATORS.put(TokenType.ASSIGN, AssignmentOperator.ASSIGN);
		ASSIGNMENT_OPERATORS.put(TokenType.PLUS_ASSIGN, AssignmentOperator.ADD_ASSIGN);
		ASSIGNMENT_OPERATORS.put(TokenType.MINUS_ASSIGN, AssignmentOperator.SUBTRACT_ASSIGN);
		ASSIGNMENT_OPERATORS.put(TokenType.MULT_ASSIGN, AssignmentOperator.MULTIPLY_ASSIGN);
		ASSIGNMENT_OPERATORS.put(TokenType.DIV_ASSIGN, AssignmentOperator.DIVIDE_ASSIGN);

		VARIABLE_CLASSES.put(TokenType.KW_VAR, VariableClass.LOCAL);
		VARIABLE_CLASSES.put(TokenType.KW_VAR_INPUT, VariableClass.INPUT);
		VARIABLE_CLASSES.put(TokenType.KW_VAR_OUTPUT, VariableClass.OUTPUT);
		VARIABLE_CLASSES.put(TokenType.KW_VAR_IN_OUT, VariableClass.IN_OUT);
		VARIABLE_CLASSES.put(TokenType.KW_VAR_TEMP, VariableClass.TEMP);
		VARIABLE_CLASSES.put(TokenType.KW_VAR_GLOBAL, VariableClass.GLOBAL);
		VARIABLE_CLASSES.put(TokenType.KW_VAR_EXTERNAL, VariableClass.EXTERNAL);

		LITERAL_KINDS.put(TokenType.INTEGER_LITERAL, LiteralKind.INTEGER);
		LITERAL_KINDS.put(TokenType.REAL_LITERAL, LiteralKind.REAL);
		LITERAL_KINDS.put(TokenType.STRING_LITERAL, LiteralKind.STRING);
		LITERAL_KINDS.put(TokenType.WSTRING_LITERAL, LiteralKind.WSTRING);
		LITERAL_KINDS.put(TokenType.KW_TRUE, LiteralKind.BOOLEAN);
		LITERAL_KINDS.put(TokenType.KW_FALSE, LiteralKind.BOOLEAN);
		LITERAL_KINDS.put(TokenType.TIME_LITERAL, LiteralKind.TIME);
		LITERAL_KINDS.put(TokenType.DATE_LITERAL, LiteralKind.DATE);
		LITERAL_KINDS.put(TokenType.TIME_OF_DAY_LITERAL, LiteralKind.TIME_OF_DAY);
		LITERAL_KINDS.put(TokenType.DATE_AND_TIME_LITERAL, LiteralKind.DATE_AND_TIME);
	}

	/**
	 * A grammar rule, used to run an entry point or a recoverable rule.
	 */
	private interface Rule<T> {
		T parse();
	}

	private final ResourceLimits limits;
	private final boolean permissive;
	private final Dialect dialect;

	private boolean used;
	private ResourceState state;
	private StructuredTextLexer tokens;
	private Token token;
	private Token previous;
	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

	/**
	 * Selector value read by a statement rule while looking for the start
	 * of the next statement of a CASE arm
	 */
	private Expression pendingCaseLabel;

	/**
	 * Creates a strict parser for IEC 61131-3 Structured Text, with the
	 * balanced resource profile.
	 */
	public StructuredTextParser() {
		this(new ParserSettings());
	}

	/**
	 * @param settings limits, recovery mode and dialect of the parse
	 */
	public StructuredTextParser(ParserSettings settings) {
		this.limits = settings.getLimits();
		this.permissive = settings.isPermissive();
		this.dialect = settings.getDialect();
	}

	/**
	 * Parses a sequence of POUs and TYPE blocks.
	 *
	 * @param source the Structured Text
	 * @return the compilation unit, or the first fatal error
	 */
	public ParseResult<CompilationUnit> parseCompilationUnit(String source) {
		return parse(source, new Rule<CompilationUnit>() {
			@Override
			public CompilationUnit parse() {
				return COMPILATION_UNIT();
			}
		});
	}

	/**
	 * Parses exactly one POU, optionally preceded by pragmas.
	 *
	 * @param source the Structured Text
	 * @return the POU, or the first fatal error
	 */
	public ParseResult<Pou> parsePou(String source) {
		return parse(source, new Rule<Pou>() {
			@Override
			public Pou parse() {
				return POU(OPT_PRAGMAS());
			}
		});
	}

	/**
	 * Parses a bare statement list, as found in the body of a POU.
	 *
	 * @param source the Structured Text
	 * @return the statements, or the first fatal error
	 */
	public ParseResult<List<Statement>> parseStatements(String source) {
		return parse(source, new Rule<List<Statement>>() {
			@Override
			public List<Statement> parse() {
				return STATEMENT_LIST(EnumSet.noneOf(TokenType.class));
			}
		});
	}

	/**
	 * Parses a single expression.
	 *
	 * @param source the expression (not a statement, just an expression)
	 * @return the expression, or the first fatal error
	 */
	public ParseResult<Expression> parseExpression(String source) {
		return parse(source, new Rule<Expression>() {
			@Override
			public Expression parse() {
				return EXPRESSION();
			}
		});
	}

	/**
	 * Parses one {@code TYPE ... END_TYPE} block.
	 *
	 * @param source the Structured Text
	 * @return the type declarations, or the first fatal error
	 */
	public ParseResult<List<TypeDeclaration>> parseTypeBlock(String source) {
		return parse(source, new Rule<List<TypeDeclaration>>() {
			@Override
			public List<TypeDeclaration> parse() {
				return TYPE_BLOCK();
			}
		});
	}

	/**
	 * @return the counters of the parse, {@code null} before the parse
	 */
	public ResourceState getResourceState() {
		return state;
	}

	private <T> ParseResult<T> parse(String source, Rule<T> rule) {
		if (used) {
			throw new IllegalStateException("A parser parses a single source; create a new parser");
		}
		if (source == null) {
			throw new IllegalArgumentException("No source supplied");
		}
		used = true;
		state = new ResourceState(limits);
		try {
			tokens = new StructuredTextLexer(source, dialect, state);
			lexer();
			T value = rule.parse();
			lexer(TokenType.EOF);
			LOG
					.debug(
							"Parsed {} characters: {} statements, {} diagnostics",
							source.length(),
							state.getStatements(),
							diagnostics.size());
			return ParseResult.success(value, diagnostics);
		} catch (StructuredTextException e) {
			LOG.debug("Parse failed: {}", e.getMessage());
			return ParseResult.failure(e, diagnostics);
		}
	}

	// SUPPORTING FUNCTIONS/METHODS

	/**
	 * Moves to the next token.
	 *
	 * @return the token that was current before the call
	 */
	private Token lexer() {
		previous = token;
		if (token == null || !token.is(TokenType.EOF)) {
			token = tokens.next();
		}
		return previous;
	}

	private Token lexer(TokenType expectedToken) {
		if (!token.is(expectedToken)) {
			throw parserException("Expecting " + expectedToken.describe() + ". Got " + token);
		}
		return lexer();
	}

	private boolean optional(TokenType type) {
		if (token.is(type)) {
			lexer();
			return true;
		}
		return false;
	}

	private void terminator() {
		if (!token.is(TokenType.SEMICOLON)) {
			throw parserException("Expecting statement terminator ';'. Got " + token);
		}
		lexer();
	}

	private String identifier(String what) {
		if (!token.is(TokenType.IDENTIFIER)) {
			throw parserException("Expecting " + what + ". Got " + token);
		}
		return lexer().getText();
	}

	private SourceSpan spanFrom(SourceSpan start) {
		return previous == null ? start : start.to(previous.getSpan());
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, token.getSpan());
	}

	/**
	 * Runs {@code rule}; in permissive mode, a syntax error is recorded and
	 * the tokens up to the next recovery point are skipped.
	 *
	 * @return the rule's result, {@code null} if the parser recovered
	 */
	private <T> T recoverable(Rule<T> rule) {
		if (!permissive) {
			return rule.parse();
		}
		int startOffset = token.getSpan().getStartOffset();
		try {
			return rule.parse();
		} catch (ParserException e) {
			LOG.debug("Recovering from syntax error: {}", e.getMessage());
			diagnostics.add(Diagnostic.of(e));
			pendingCaseLabel = null;
			recover(startOffset);
			return null;
		}
	}

	private void recover(int startOffset) {
		while (!token.is(TokenType.EOF)) {
			if (token.is(TokenType.SEMICOLON)) {
				lexer();
				return;
			}
			if (RECOVERY_KEYWORDS.contains(token.getType())) {
				break;
			}
			state.recordIteration(token.getSpan());
			lexer();
		}
		if (!token.is(TokenType.EOF) && token.getSpan().getStartOffset() == startOffset) {
			// nothing consumed since the failing rule started: skip the offending token
			lexer();
		}
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// COMPILATION_UNIT : { [PRAGMAS] ( TYPE_BLOCK | POU ) }
	CompilationUnit COMPILATION_UNIT() {
		SourceSpan start = token.getSpan();
		List<Pou> pous = new ArrayList<Pou>();
		List<TypeDeclaration> types = new ArrayList<TypeDeclaration>();
		while (!token.is(TokenType.EOF)) {
			state.recordIteration(token.getSpan());
			List<Pragma> pragmas = OPT_PRAGMAS();
			if (token.is(TokenType.KW_TYPE)) {
				types.addAll(TYPE_BLOCK());
			} else if (!token.is(TokenType.EOF)) {
				pous.add(POU(pragmas));
			}
		}
		return new CompilationUnit(pous, types, spanFrom(start));
	}

	// PRAGMAS : { PRAGMA }
	List<Pragma> OPT_PRAGMAS() {
		List<Pragma> pragmas = new ArrayList<Pragma>();
		while (token.is(TokenType.PRAGMA)) {
			state.recordIteration(token.getSpan());
			Token pragma = lexer();
			pragmas.add(new Pragma((String) pragma.getValue(), pragma.getSpan()));
		}
		return pragmas;
	}

	// POU : ( PROGRAM name | FUNCTION name [: TYPE_SPEC] | FUNCTION_BLOCK name )
	// ....... { VAR_BLOCK } STATEMENT_LIST ( END_PROGRAM | END_FUNCTION | END_FUNCTION_BLOCK ) [;]
	Pou POU(List<Pragma> pragmas) {
		SourceSpan start = pragmas.isEmpty() ? token.getSpan() : pragmas.get(0).getSpan();
		PouKind kind;
		TokenType end;
		switch (token.getType()) {
		case KW_PROGRAM:
			kind = PouKind.PROGRAM;
			end = TokenType.KW_END_PROGRAM;
			break;
		case KW_FUNCTION:
			kind = PouKind.FUNCTION;
			end = TokenType.KW_END_FUNCTION;
			break;
		case KW_FUNCTION_BLOCK:
			kind = PouKind.FUNCTION_BLOCK;
			end = TokenType.KW_END_FUNCTION_BLOCK;
			break;
		default:
			throw parserException("Expecting PROGRAM, FUNCTION, FUNCTION_BLOCK or TYPE. Got " + token);
		}
		lexer();
		String name = identifier("POU name");
		TypeReference returnType = null;
		if (kind == PouKind.FUNCTION && optional(TokenType.COLON)) {
			returnType = TYPE_SPEC();
		}

		List<VariableBlock> blocks = new ArrayList<VariableBlock>();
		List<Pragma> blockPragmas = OPT_PRAGMAS();
		while (VARIABLE_CLASSES.containsKey(token.getType())) {
			state.recordIteration(token.getSpan());
			blocks.add(VAR_BLOCK(blockPragmas));
			blockPragmas = OPT_PRAGMAS();
		}

		List<Statement> body = new ArrayList<Statement>();
		// pragmas between the declarations and the first statement belong to the body
		for (Pragma pragma : blockPragmas) {
			body.add(new PragmaStatement(pragma));
		}
		body.addAll(STATEMENT_LIST(EnumSet.of(end)));
		lexer(end);
		optional(TokenType.SEMICOLON);
		return new Pou(kind, name, returnType, blocks, body, pragmas, spanFrom(start));
	}

	// VAR_BLOCK : VAR_KEYWORD [CONSTANT] [RETAIN | NON_RETAIN] { VAR_DECLARATION } END_VAR
	VariableBlock VAR_BLOCK(List<Pragma> pragmas) {
		SourceSpan start = token.getSpan();
		final VariableClass variableClass = VARIABLE_CLASSES.get(lexer().getType());
		boolean constant = false;
		RetainKind retain = RetainKind.NONE;
		while (true) {
			if (optional(TokenType.KW_CONSTANT)) {
				constant = true;
			} else if (optional(TokenType.KW_RETAIN)) {
				retain = RetainKind.RETAIN;
			} else if (optional(TokenType.KW_NON_RETAIN)) {
				retain = RetainKind.NON_RETAIN;
			} else {
				break;
			}
		}
		final boolean constantBlock = constant;
		List<VariableDeclaration> declarations = new ArrayList<VariableDeclaration>();
		while (!token.is(TokenType.KW_END_VAR) && !token.is(TokenType.EOF)) {
			state.recordIteration(token.getSpan());
			VariableDeclaration parsed = recoverable(new Rule<VariableDeclaration>() {
				@Override
				public VariableDeclaration parse() {
					return VAR_DECLARATION(variableClass, constantBlock);
				}
			});
			if (parsed != null) {
				declarations.add(parsed);
			}
		}
		lexer(TokenType.KW_END_VAR);
		return new VariableBlock(variableClass, constant, retain, declarations, pragmas, spanFrom(start));
	}

	// VAR_DECLARATION : [PRAGMAS] name { , name } [AT DIRECT_ADDRESS] : TYPE_SPEC [:= EXPRESSION] ;
	VariableDeclaration VAR_DECLARATION(VariableClass variableClass, boolean constant) {
		List<Pragma> pragmas = OPT_PRAGMAS();
		SourceSpan start = token.getSpan();
		List<String> names = new ArrayList<String>();
		state.recordCollectionElement(token.getSpan());
		names.add(identifier("variable name"));
		while (optional(TokenType.COMMA)) {
			state.recordIteration(token.getSpan());
			state.recordCollectionElement(token.getSpan());
			names.add(identifier("variable name"));
		}

		DirectAddress location = null;
		if (optional(TokenType.KW_AT)) {
			location = DirectAddress.parse(lexer(TokenType.DIRECT_ADDRESS).getText());
		}
		lexer(TokenType.COLON);
		TypeReference type = TYPE_SPEC();
		Expression initialValue = null;
		if (optional(TokenType.ASSIGN)) {
			initialValue = EXPRESSION();
		}
		terminator();

		return new VariableDeclaration(
				names,
				variableClass,
				constant,
				type,
				initialValue,
				location,
				pragmas,
				spanFrom(start));
	}

	// TYPE_SPEC : ARRAY '[' SUBRANGE { , SUBRANGE } ']' OF TYPE_SPEC
	// ........... | ( STRING | WSTRING ) [ '[' EXPRESSION ']' | '(' EXPRESSION ')' ]
	// ........... | name [ '(' SUBRANGE ')' ]
	TypeReference TYPE_SPEC() {
		SourceSpan start = token.getSpan();
		if (optional(TokenType.KW_ARRAY)) {
			lexer(TokenType.OPEN_BRACKET);
			List<Subrange> dimensions = new ArrayList<Subrange>();
			do {
				state.recordIteration(token.getSpan());
				state.recordCollectionElement(token.getSpan());
				dimensions.add(SUBRANGE());
			} while (optional(TokenType.COMMA));
			lexer(TokenType.CLOSE_BRACKET);
			lexer(TokenType.KW_OF);
			TypeReference elementType;
			state.enterExpressionDepth(start);
			try {
				elementType = TYPE_SPEC();
			} finally {
				state.exitExpressionDepth();
			}
			return TypeReference.array(dimensions, elementType, spanFrom(start));
		}
		if (token.is(TokenType.KW_STRING) || token.is(TokenType.KW_WSTRING)) {
			boolean wide = lexer().is(TokenType.KW_WSTRING);
			Expression length = null;
			if (optional(TokenType.OPEN_BRACKET)) {
				length = EXPRESSION();
				lexer(TokenType.CLOSE_BRACKET);
			} else if (optional(TokenType.OPEN_PAREN)) {
				length = EXPRESSION();
				lexer(TokenType.CLOSE_PAREN);
			}
			return TypeReference.string(wide, length, spanFrom(start));
		}
		String name = identifier("type name");
		if (optional(TokenType.OPEN_PAREN)) {
			Subrange range = SUBRANGE();
			lexer(TokenType.CLOSE_PAREN);
			return TypeReference.subrange(name, range, spanFrom(start));
		}
		return TypeReference.named(name, spanFrom(start));
	}

	// SUBRANGE : EXPRESSION .. EXPRESSION
	Subrange SUBRANGE() {
		SourceSpan start = token.getSpan();
		Expression low = EXPRESSION();
		lexer(TokenType.RANGE);
		Expression high = EXPRESSION();
		return new Subrange(low, high, spanFrom(start));
	}

	// TYPE_BLOCK : TYPE TYPE_DECLARATION { TYPE_DECLARATION } END_TYPE [;]
	List<TypeDeclaration> TYPE_BLOCK() {
		lexer(TokenType.KW_TYPE);
		List<TypeDeclaration> types = new ArrayList<TypeDeclaration>();
		do {
			state.recordIteration(token.getSpan());
			TypeDeclaration type = recoverable(new Rule<TypeDeclaration>() {
				@Override
				public TypeDeclaration parse() {
					return TYPE_DECLARATION();
				}
			});
			if (type != null) {
				types.add(type);
			}
		} while (!token.is(TokenType.KW_END_TYPE) && !token.is(TokenType.EOF));
		lexer(TokenType.KW_END_TYPE);
		optional(TokenType.SEMICOLON);
		return types;
	}

	// TYPE_DECLARATION : name : ( STRUCT { VAR_DECLARATION } END_STRUCT
	// ................... | '(' name [:= EXPRESSION] { , name [:= EXPRESSION] } ')'
	// ................... | TYPE_SPEC ) [:= EXPRESSION] ;
	TypeDeclaration TYPE_DECLARATION() {
		SourceSpan start = token.getSpan();
		String name = identifier("type name");
		lexer(TokenType.COLON);

		TypeDeclaration.Kind kind;
		TypeReference type = null;
		List<VariableDeclaration> fields = new ArrayList<VariableDeclaration>();
		List<EnumValue> values = new ArrayList<EnumValue>();
		if (optional(TokenType.KW_STRUCT)) {
			kind = TypeDeclaration.Kind.STRUCT;
			while (!token.is(TokenType.KW_END_STRUCT) && !token.is(TokenType.EOF)) {
				state.recordIteration(token.getSpan());
				fields.add(VAR_DECLARATION(VariableClass.LOCAL, false));
			}
			lexer(TokenType.KW_END_STRUCT);
		} else if (optional(TokenType.OPEN_PAREN)) {
			kind = TypeDeclaration.Kind.ENUM;
			do {
				state.recordIteration(token.getSpan());
				state.recordCollectionElement(token.getSpan());
				SourceSpan valueStart = token.getSpan();
				String valueName = identifier("enumerated value");
				Expression value = null;
				if (optional(TokenType.ASSIGN)) {
					value = EXPRESSION();
				}
				values.add(new EnumValue(valueName, value, spanFrom(valueStart)));
			} while (optional(TokenType.COMMA));
			lexer(TokenType.CLOSE_PAREN);
			if (token.is(TokenType.IDENTIFIER)) {
				// base type of the enumeration, as in (A, B) INT
				type = TypeReference.named(lexer().getText(), previous.getSpan());
			}
		} else {
			type = TYPE_SPEC();
			if (type.getKind() == TypeReference.Kind.ARRAY) {
				kind = TypeDeclaration.Kind.ARRAY;
			} else if (type.getKind() == TypeReference.Kind.SUBRANGE) {
				kind = TypeDeclaration.Kind.SUBRANGE;
			} else {
				kind = TypeDeclaration.Kind.ALIAS;
			}
		}

		Expression initialValue = null;
		if (optional(TokenType.ASSIGN)) {
			initialValue = EXPRESSION();
		}
		terminator();
		return new TypeDeclaration(name, kind, type, fields, values, initialValue, spanFrom(start));
	}

	// STATEMENT_LIST : { STATEMENT }
	List<Statement> STATEMENT_LIST(EnumSet<TokenType> terminators) {
		return STATEMENT_LIST(terminators, false);
	}

	// In a CASE arm, the list also ends where the next selector value starts.
	List<Statement> STATEMENT_LIST(EnumSet<TokenType> terminators, final boolean caseArm) {
		List<Statement> statements = new ArrayList<Statement>();
		while (!terminators.contains(token.getType()) && !token.is(TokenType.EOF)) {
			if (caseArm && (pendingCaseLabel != null || CASE_LABEL_START.contains(token.getType()))) {
				break;
			}
			state.recordIteration(token.getSpan());
			Statement statement = recoverable(new Rule<Statement>() {
				@Override
				public Statement parse() {
					return STATEMENT(caseArm);
				}
			});
			if (statement != null) {
				statements.add(statement);
			}
		}
		return statements;
	}

	// STATEMENT : IF_STATEMENT ; | CASE_STATEMENT ; | FOR_STATEMENT ; | WHILE_STATEMENT ; | REPEAT_STATEMENT ;
	// ............ | EXIT ; | CONTINUE ; | RETURN [EXPRESSION] ; | GOTO name ; | name : | PRAGMA | ;
	// ............ | VARIABLE ( ASSIGNMENT_OPERATOR EXPRESSION | ARGUMENTS ) ;
	// Returns null when, in a CASE arm, the statement turns out to be the next selector value.
	Statement STATEMENT(boolean caseArm) {
		SourceSpan start = token.getSpan();
		// in a CASE arm a leading name may still be the next selector value, counted once it is not
		boolean mayBeCaseLabel = caseArm && (token.is(TokenType.IDENTIFIER) || token.is(TokenType.DIRECT_ADDRESS));
		if (!mayBeCaseLabel) {
			state.recordStatement(start);
		}
		Statement statement;
		switch (token.getType()) {
		case SEMICOLON:
			lexer();
			return new EmptyStatement(start);
		case PRAGMA:
			Token pragma = lexer();
			return new PragmaStatement(new Pragma((String) pragma.getValue(), pragma.getSpan()));
		case KW_IF:
			statement = IF_STATEMENT();
			break;
		case KW_CASE:
			statement = CASE_STATEMENT();
			break;
		case KW_FOR:
			statement = FOR_STATEMENT();
			break;
		case KW_WHILE:
			statement = WHILE_STATEMENT();
			break;
		case KW_REPEAT:
			statement = REPEAT_STATEMENT();
			break;
		case KW_EXIT:
			lexer();
			statement = new ExitStatement(start);
			break;
		case KW_CONTINUE:
			lexer();
			statement = new ContinueStatement(start);
			break;
		case KW_RETURN:
			lexer();
			Expression value = token.is(TokenType.SEMICOLON) ? null : EXPRESSION();
			statement = new ReturnStatement(value, spanFrom(start));
			break;
		case KW_GOTO:
			lexer();
			statement = new GotoStatement(identifier("label name"), spanFrom(start));
			break;
		default:
			Expression target = VARIABLE();
			if (mayBeCaseLabel) {
				if (token.is(TokenType.COLON) || token.is(TokenType.COMMA) || token.is(TokenType.RANGE)) {
					pendingCaseLabel = target;
					return null;
				}
				state.recordStatement(start);
			}
			if (token.is(TokenType.COLON) && target instanceof IdentifierExpression) {
				lexer();
				return new LabelStatement(((IdentifierExpression) target).getName(), spanFrom(start));
			}
			statement = ASSIGNMENT_OR_INVOCATION(target, start);
			break;
		}
		terminator();
		return statement;
	}

	// VARIABLE : ( name | DIRECT_ADDRESS ) { POSTFIX }
	Expression VARIABLE() {
		if (!token.is(TokenType.IDENTIFIER) && !(token.is(TokenType.DIRECT_ADDRESS) && dialect == Dialect.VENDOR)) {
			throw parserException("Not a valid statement. Got " + token);
		}
		return POSTFIX_EXPRESSION();
	}

	// ASSIGNMENT_OR_INVOCATION : VARIABLE ( := | += | -= | *= | /= ) EXPRESSION | CALL
	Statement ASSIGNMENT_OR_INVOCATION(Expression target, SourceSpan start) {
		AssignmentOperator operator = ASSIGNMENT_OPERATORS.get(token.getType());
		if (operator != null) {
			if (target instanceof CallExpression) {
				throw parserException("Cannot assign to the result of a call");
			}
			lexer();
			Expression value = EXPRESSION();
			return new AssignmentStatement(target, operator, value, spanFrom(start));
		}
		if (target instanceof CallExpression) {
			return new InvocationStatement((CallExpression) target, spanFrom(start));
		}
		throw parserException("Expecting ':=' or a call after " + target + ". Got " + token);
	}

	// IF_STATEMENT : IF CONDITIONAL_BLOCK { ELSIF CONDITIONAL_BLOCK } [ELSE STATEMENT_LIST] END_IF
	Statement IF_STATEMENT() {
		SourceSpan start = token.getSpan();
		state.enterDepth(start);
		try {
			lexer(TokenType.KW_IF);
			List<ConditionalBlock> branches = new ArrayList<ConditionalBlock>();
			branches.add(CONDITIONAL_BLOCK());
			while (token.is(TokenType.KW_ELSIF)) {
				state.recordIteration(token.getSpan());
				lexer();
				branches.add(CONDITIONAL_BLOCK());
			}
			List<Statement> elseBody = null;
			if (optional(TokenType.KW_ELSE)) {
				elseBody = STATEMENT_LIST(EnumSet.of(TokenType.KW_END_IF));
			}
			lexer(TokenType.KW_END_IF);
			return new IfStatement(branches, elseBody, spanFrom(start));
		} finally {
			state.exitDepth();
		}
	}

	// CONDITIONAL_BLOCK : EXPRESSION THEN STATEMENT_LIST
	ConditionalBlock CONDITIONAL_BLOCK() {
		SourceSpan start = token.getSpan();
		Expression condition = EXPRESSION();
		lexer(TokenType.KW_THEN);
		List<Statement> body = STATEMENT_LIST(
				EnumSet.of(TokenType.KW_ELSIF, TokenType.KW_ELSE, TokenType.KW_END_IF));
		return new ConditionalBlock(condition, body, spanFrom(start));
	}

	// CASE_STATEMENT : CASE EXPRESSION OF { CASE_ARM } [ELSE STATEMENT_LIST] END_CASE
	Statement CASE_STATEMENT() {
		SourceSpan start = token.getSpan();
		state.enterDepth(start);
		try {
			lexer(TokenType.KW_CASE);
			Expression selector = EXPRESSION();
			lexer(TokenType.KW_OF);
			List<CaseArm> arms = new ArrayList<CaseArm>();
			while (!token.is(TokenType.KW_ELSE) && !token.is(TokenType.KW_END_CASE) && !token.is(TokenType.EOF)) {
				state.recordIteration(token.getSpan());
				CaseArm arm = recoverable(new Rule<CaseArm>() {
					@Override
					public CaseArm parse() {
						return CASE_ARM();
					}
				});
				if (arm != null) {
					arms.add(arm);
				}
			}
			List<Statement> elseBody = null;
			if (optional(TokenType.KW_ELSE)) {
				elseBody = STATEMENT_LIST(EnumSet.of(TokenType.KW_END_CASE));
			}
			lexer(TokenType.KW_END_CASE);
			return new CaseStatement(selector, arms, elseBody, spanFrom(start));
		} finally {
			pendingCaseLabel = null;
			state.exitDepth();
		}
	}

	// CASE_ARM : CASE_LABEL { , CASE_LABEL } : STATEMENT_LIST
	CaseArm CASE_ARM() {
		SourceSpan start = pendingCaseLabel != null ? pendingCaseLabel.getSpan() : token.getSpan();
		List<CaseLabel> labels = new ArrayList<CaseLabel>();
		labels.add(CASE_LABEL());
		while (optional(TokenType.COMMA)) {
			state.recordIteration(token.getSpan());
			labels.add(CASE_LABEL());
		}
		lexer(TokenType.COLON);
		List<Statement> body = STATEMENT_LIST(EnumSet.of(TokenType.KW_ELSE, TokenType.KW_END_CASE), true);
		return new CaseArm(labels, body, spanFrom(start));
	}

	// CASE_LABEL : EXPRESSION [ .. EXPRESSION ]
	CaseLabel CASE_LABEL() {
		SourceSpan start = pendingCaseLabel != null ? pendingCaseLabel.getSpan() : token.getSpan();
		state.recordCollectionElement(start);
		Expression low;
		if (pendingCaseLabel != null) {
			low = pendingCaseLabel;
			pendingCaseLabel = null;
		} else {
			low = EXPRESSION();
		}
		Expression high = null;
		if (optional(TokenType.RANGE)) {
			high = EXPRESSION();
		}
		return new CaseLabel(low, high, spanFrom(start));
	}

	// FOR_STATEMENT : FOR name := EXPRESSION TO EXPRESSION [BY EXPRESSION] DO STATEMENT_LIST END_FOR
	Statement FOR_STATEMENT() {
		SourceSpan start = token.getSpan();
		state.enterDepth(start);
		try {
			lexer(TokenType.KW_FOR);
			String variable = identifier("control variable");
			lexer(TokenType.ASSIGN);
			Expression from = EXPRESSION();
			lexer(TokenType.KW_TO);
			Expression to = EXPRESSION();
			Expression step = null;
			if (optional(TokenType.KW_BY)) {
				step = EXPRESSION();
			}
			lexer(TokenType.KW_DO);
			List<Statement> body = STATEMENT_LIST(EnumSet.of(TokenType.KW_END_FOR));
			lexer(TokenType.KW_END_FOR);
			return new ForStatement(variable, from, to, step, body, spanFrom(start));
		} finally {
			state.exitDepth();
		}
	}

	// WHILE_STATEMENT : WHILE EXPRESSION DO STATEMENT_LIST END_WHILE
	Statement WHILE_STATEMENT() {
		SourceSpan start = token.getSpan();
		state.enterDepth(start);
		try {
			lexer(TokenType.KW_WHILE);
			Expression condition = EXPRESSION();
			lexer(TokenType.KW_DO);
			List<Statement> body = STATEMENT_LIST(EnumSet.of(TokenType.KW_END_WHILE));
			lexer(TokenType.KW_END_WHILE);
			return new WhileStatement(condition, body, spanFrom(start));
		} finally {
			state.exitDepth();
		}
	}

	// REPEAT_STATEMENT : REPEAT STATEMENT_LIST UNTIL EXPRESSION [END_REPEAT]
	Statement REPEAT_STATEMENT() {
		SourceSpan start = token.getSpan();
		state.enterDepth(start);
		try {
			lexer(TokenType.KW_REPEAT);
			List<Statement> body = STATEMENT_LIST(EnumSet.of(TokenType.KW_UNTIL));
			lexer(TokenType.KW_UNTIL);
			Expression condition = EXPRESSION();
			optional(TokenType.KW_END_REPEAT);
			return new RepeatStatement(body, condition, spanFrom(start));
		} finally {
			state.exitDepth();
		}
	}

	// EXPRESSION : BINARY_EXPRESSION(lowest precedence)
	Expression EXPRESSION() {
		return BINARY_EXPRESSION(BinaryOperator.LOWEST_PRECEDENCE);
	}

	// BINARY_EXPRESSION(p) : UNARY_EXPRESSION { op BINARY_EXPRESSION(q) } where precedence(op) >= p,
	// q = precedence(op) + 1 for left-associative operators, precedence(op) for right-associative ones
	Expression BINARY_EXPRESSION(int minPrecedence) {
		Expression left = UNARY_EXPRESSION();
		while (true) {
			BinaryOperator operator = BINARY_OPERATORS.get(token.getType());
			if (operator == null || operator.getPrecedence() < minPrecedence) {
				return left;
			}
			state.recordIteration(token.getSpan());
			Token operatorToken = lexer();
			Expression right;
			if (operator.isRightAssociative()) {
				state.enterExpressionDepth(operatorToken.getSpan());
				try {
					right = BINARY_EXPRESSION(operator.getPrecedence());
				} finally {
					state.exitExpressionDepth();
				}
			} else {
				right = BINARY_EXPRESSION(operator.getPrecedence() + 1);
			}
			left = new BinaryExpression(operator, left, right, left.getSpan().to(right.getSpan()));
		}
	}

	// UNARY_EXPRESSION : ( - | + | NOT ) UNARY_EXPRESSION | POSTFIX_EXPRESSION
	Expression UNARY_EXPRESSION() {
		if (token.is(TokenType.MINUS) || token.is(TokenType.PLUS) || token.is(TokenType.KW_NOT)) {
			Token operatorToken = lexer();
			Expression operand;
			state.enterExpressionDepth(operatorToken.getSpan());
			try {
				operand = UNARY_EXPRESSION();
			} finally {
				state.exitExpressionDepth();
			}
			if (operatorToken.is(TokenType.PLUS)) {
				return operand;
			}
			UnaryOperator operator = operatorToken.is(TokenType.MINUS) ? UnaryOperator.NEGATE : UnaryOperator.NOT;
			return new UnaryExpression(operator, operand, operatorToken.getSpan().to(operand.getSpan()));
		}
		return POSTFIX_EXPRESSION();
	}

	// POSTFIX_EXPRESSION : PRIMARY { . name | '[' EXPRESSION { , EXPRESSION } ']' | ARGUMENTS }
	Expression POSTFIX_EXPRESSION() {
		SourceSpan start = token.getSpan();
		Expression expression = PRIMARY();
		while (true) {
			if (token.is(TokenType.DOT)) {
				lexer();
				if (!token.is(TokenType.IDENTIFIER) && !token.is(TokenType.INTEGER_LITERAL)) {
					throw parserException("Expecting a member name. Got " + token);
				}
				// an integer member is a bit access, as in word.3
				String member = lexer().getText();
				expression = new MemberAccessExpression(expression, member, spanFrom(start));
			} else if (token.is(TokenType.OPEN_BRACKET)) {
				expression = new IndexExpression(expression, INDEX_LIST(), spanFrom(start));
			} else if (token.is(TokenType.OPEN_PAREN)) {
				expression = new CallExpression(expression, ARGUMENTS(), spanFrom(start));
			} else {
				return expression;
			}
			state.recordIteration(previous.getSpan());
		}
	}

	// INDEX_LIST : '[' EXPRESSION { , EXPRESSION } ']'
	List<Expression> INDEX_LIST() {
		state.enterExpressionDepth(token.getSpan());
		try {
			lexer(TokenType.OPEN_BRACKET);
			List<Expression> indices = new ArrayList<Expression>();
			do {
				state.recordIteration(token.getSpan());
				state.recordCollectionElement(token.getSpan());
				indices.add(EXPRESSION());
			} while (optional(TokenType.COMMA));
			lexer(TokenType.CLOSE_BRACKET);
			return indices;
		} finally {
			state.exitExpressionDepth();
		}
	}

	// ARGUMENTS : '(' [ ARGUMENT { , ARGUMENT } ] ')'
	List<Argument> ARGUMENTS() {
		state.enterExpressionDepth(token.getSpan());
		try {
			lexer(TokenType.OPEN_PAREN);
			List<Argument> arguments = new ArrayList<Argument>();
			if (!token.is(TokenType.CLOSE_PAREN)) {
				do {
					state.recordIteration(token.getSpan());
					state.recordCollectionElement(token.getSpan());
					arguments.add(ARGUMENT());
				} while (optional(TokenType.COMMA));
			}
			lexer(TokenType.CLOSE_PAREN);
			return arguments;
		} finally {
			state.exitExpressionDepth();
		}
	}

	// ARGUMENT : name := EXPRESSION | name => VARIABLE | EXPRESSION | <empty, vendor dialect>
	Argument ARGUMENT() {
		SourceSpan start = token.getSpan();
		if (dialect == Dialect.VENDOR && (token.is(TokenType.COMMA) || token.is(TokenType.CLOSE_PAREN))) {
			return new Argument(null, ArgumentKind.POSITIONAL, null, start);
		}
		Expression expression = EXPRESSION();
		if (expression instanceof IdentifierExpression
				&& (token.is(TokenType.ASSIGN) || token.is(TokenType.OUTPUT_ASSIGN))) {
			String name = ((IdentifierExpression) expression).getName();
			ArgumentKind kind = lexer().is(TokenType.ASSIGN) ? ArgumentKind.INPUT : ArgumentKind.OUTPUT;
			Expression value = null;
			if (!(dialect == Dialect.VENDOR && (token.is(TokenType.COMMA) || token.is(TokenType.CLOSE_PAREN)))) {
				value = EXPRESSION();
			}
			return new Argument(name, kind, value, spanFrom(start));
		}
		return new Argument(null, ArgumentKind.POSITIONAL, expression, spanFrom(start));
	}

	// PRIMARY : literal | name | DIRECT_ADDRESS | '(' EXPRESSION ')'
	Expression PRIMARY() {
		LiteralKind literalKind = LITERAL_KINDS.get(token.getType());
		if (literalKind != null) {
			Token literal = lexer();
			return new LiteralExpression(literalKind, literal.getText(), literal.getValue(), literal.getSpan());
		}
		switch (token.getType()) {
		case IDENTIFIER:
			Token name = lexer();
			return new IdentifierExpression(name.getText(), name.getSpan());
		case DIRECT_ADDRESS:
			if (dialect != Dialect.VENDOR) {
				throw parserException("Direct addresses are only allowed in AT locations. Got " + token);
			}
			Token address = lexer();
			return new DirectAddressExpression(DirectAddress.parse(address.getText()), address.getSpan());
		case OPEN_PAREN:
			SourceSpan start = token.getSpan();
			state.enterExpressionDepth(start);
			try {
				lexer();
				Expression inner = EXPRESSION();
				lexer(TokenType.CLOSE_PAREN);
				return new ParenthesizedExpression(inner, spanFrom(start));
			} finally {
				state.exitExpressionDepth();
			}
		default:
			throw parserException("Expecting an expression. Got " + token);
		}
	}
	// CHECKSTYLE.ON: MethodName
}
