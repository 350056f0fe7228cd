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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.metricshub.plcflow.analysis.ComplexityAnalyzer;
import org.metricshub.plcflow.analysis.ControlFlowMetrics;
import org.metricshub.plcflow.analysis.cfg.CfgBuilder;
import org.metricshub.plcflow.analysis.cfg.ControlFlowGraph;
import org.metricshub.plcflow.analysis.symbols.SymbolAnalyzer;
import org.metricshub.plcflow.frontend.ParseResult;
import org.metricshub.plcflow.frontend.StructuredTextLexer;
import org.metricshub.plcflow.frontend.StructuredTextParser;
import org.metricshub.plcflow.frontend.Token;
import org.metricshub.plcflow.frontend.TokenType;
import org.metricshub.plcflow.frontend.ast.CompilationUnit;
import org.metricshub.plcflow.frontend.ast.Pou;
import org.metricshub.plcflow.frontend.ast.PouKind;
import org.metricshub.plcflow.frontend.ast.Pragma;
import org.metricshub.plcflow.frontend.ast.Statement;
import org.metricshub.plcflow.frontend.ast.TypeDeclaration;
import org.metricshub.plcflow.frontend.ast.VariableBlock;
import org.metricshub.plcflow.limits.ResourceState;
import org.metricshub.plcflow.util.ParserSettings;
import org.metricshub.plcflow.util.PlcLogger;
import org.slf4j.Logger;

/**
 * Entry point of PLC Flow: parses Structured Text and analyzes the control
 * flow of each POU.
 * <p>
 * Example:
 *
 * <pre>
 * PlcFlow plcFlow = new PlcFlow();
 * ParseResult&lt;List&lt;PouAnalysis&gt;&gt; result = plcFlow.analyze(new PouSource("Main", "x := 1;"));
 * int complexity = result.getValue().get(0).getMetrics().getCyclomaticComplexity();
 * </pre>
 * <p>
 * A source that starts with <code>PROGRAM</code>, <code>FUNCTION</code>,
 * <code>FUNCTION_BLOCK</code> or <code>TYPE</code> (pragmas aside) is parsed
 * as a compilation unit. Any other source is parsed as the body of a POU
 * and wrapped in a <code>PROGRAM</code> named after the source.
 * <p>
 * Instances are immutable and may be shared between threads: each parse
 * uses its own parser and its own resource counters.
 */
public class PlcFlow {

	private static final Logger LOG = PlcLogger.getLogger(PlcFlow.class);

	private static final EnumSet<TokenType> UNIT_KEYWORDS = EnumSet
			.of(TokenType.KW_PROGRAM, TokenType.KW_FUNCTION, TokenType.KW_FUNCTION_BLOCK, TokenType.KW_TYPE);

	private final ParserSettings settings;
	private final CfgBuilder builder = new CfgBuilder();
	private final ComplexityAnalyzer analyzer = new ComplexityAnalyzer(builder);
	private final SymbolAnalyzer symbolAnalyzer = new SymbolAnalyzer();

	/**
	 * Creates an instance with the default settings: strict parsing and the
	 * balanced resource profile.
	 */
	public PlcFlow() {
		this(new ParserSettings());
	}

	/**
	 * @param settings parse settings; they are copied, and the dialect is
	 *        replaced by the one of each {@link PouSource}
	 */
	public PlcFlow(ParserSettings settings) {
		this.settings = new ParserSettings(settings);
	}

	/**
	 * @return a copy of the settings of this instance
	 */
	public ParserSettings getSettings() {
		return new ParserSettings(settings);
	}

	/**
	 * Parses a source.
	 *
	 * @param source the source and its language tag
	 * @return the compilation unit, or the first fatal error
	 */
	public ParseResult<CompilationUnit> parse(PouSource source) {
		ParserSettings parseSettings = new ParserSettings(settings);
		parseSettings.setDialect(source.getDialect());
		StructuredTextParser parser = new StructuredTextParser(parseSettings);

		if (isCompilationUnit(source, parseSettings)) {
			return parser.parseCompilationUnit(source.getText());
		}

		ParseResult<List<Statement>> body = parser.parseStatements(source.getText());
		if (!body.isSuccess()) {
			return ParseResult.failure(body.getError(), body.getDiagnostics());
		}
		List<Statement> statements = body.getValue();
		SourceSpan span = statements.isEmpty()
				? SourceSpan.NONE
				: statements.get(0).getSpan().to(statements.get(statements.size() - 1).getSpan());
		Pou program = new Pou(
				PouKind.PROGRAM,
				source.getName(),
				null,
				Collections.<VariableBlock>emptyList(),
				statements,
				Collections.<Pragma>emptyList(),
				span);
		CompilationUnit unit = new CompilationUnit(
				Collections.singletonList(program),
				Collections.<TypeDeclaration>emptyList(),
				span);
		return ParseResult.success(unit, body.getDiagnostics());
	}

	/**
	 * Looks at the first significant token of the source, without parsing it.
	 * Lexical errors are left to the actual parse.
	 */
	private static boolean isCompilationUnit(PouSource source, ParserSettings parseSettings) {
		try {
			StructuredTextLexer lexer = new StructuredTextLexer(
					source.getText(),
					source.getDialect(),
					new ResourceState(parseSettings.getLimits()));
			Token token = lexer.next();
			while (token.is(TokenType.PRAGMA)) {
				token = lexer.next();
			}
			return UNIT_KEYWORDS.contains(token.getType());
		} catch (StructuredTextException e) {
			LOG.debug("Cannot tell the kind of {}: {}", source.getName(), e.getMessage());
			return false;
		}
	}

	/**
	 * Builds the graph and metrics of a POU and resolves its names.
	 *
	 * @param pou a parsed POU
	 * @return its analysis
	 */
	public PouAnalysis analyze(Pou pou) {
		return analyze(pou, Collections.<TypeDeclaration>emptyList());
	}

	/**
	 * @param pou a parsed POU
	 * @param types the type declarations of its source, whose enumerated
	 *        values the POU may use
	 * @return its analysis
	 */
	public PouAnalysis analyze(Pou pou, List<TypeDeclaration> types) {
		ControlFlowGraph graph = builder.build(pou);
		ControlFlowMetrics metrics = analyzer.analyze(graph, pou.getBody());
		return new PouAnalysis(pou, graph, metrics, symbolAnalyzer.analyze(pou, types));
	}

	/**
	 * Parses a source and analyzes each of its POUs.
	 *
	 * @param source the source and its language tag
	 * @return one analysis per POU, in source order, or the first fatal error
	 */
	public ParseResult<List<PouAnalysis>> analyze(PouSource source) {
		ParseResult<CompilationUnit> parsed = parse(source);
		if (!parsed.isSuccess()) {
			LOG.debug("{} could not be parsed: {}", source.getName(), parsed.getError().getMessage());
			return ParseResult.failure(parsed.getError(), parsed.getDiagnostics());
		}
		List<PouAnalysis> analyses = new ArrayList<PouAnalysis>();
		for (Pou pou : parsed.getValue().getPous()) {
			analyses.add(analyze(pou, parsed.getValue().getTypes()));
		}
		return ParseResult.success(Collections.unmodifiableList(analyses), parsed.getDiagnostics());
	}

	/**
	 * Analyzes several sources on the given executor.
	 *
	 * @param sources the sources
	 * @param executor runs one task per source; it is not shut down
	 * @return the results, in the order of {@code sources}
	 * @throws InterruptedException if interrupted while waiting for a result
	 */
	public List<ParseResult<List<PouAnalysis>>> analyzeAll(List<PouSource> sources, ExecutorService executor)
			throws InterruptedException {
		List<Future<ParseResult<List<PouAnalysis>>>> futures = new ArrayList<Future<ParseResult<List<PouAnalysis>>>>();
		for (final PouSource source : sources) {
			futures.add(executor.submit(new Callable<ParseResult<List<PouAnalysis>>>() {
				@Override
				public ParseResult<List<PouAnalysis>> call() {
					return analyze(source);
				}
			}));
		}

		List<ParseResult<List<PouAnalysis>>> results = new ArrayList<ParseResult<List<PouAnalysis>>>();
		try {
			for (Future<ParseResult<List<PouAnalysis>>> future : futures) {
				results.add(future.get());
			}
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException("Analysis failed", cause);
		} finally {
			for (Future<ParseResult<List<PouAnalysis>>> future : futures) {
				future.cancel(true);
			}
		}
		return results;
	}
}
