package org.metricshub.plcflow.limits;

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

import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.util.PlcLogger;
import org.slf4j.Logger;

/**
 * Counters of one parse session, bounded by a {@link ResourceLimits}.
 * <p>
 * Every check runs before the counted operation: a check that would push a
 * counter past its ceiling throws {@link SecurityLimitException} and leaves
 * the counter untouched, so a counter never exceeds its ceiling.
 * <p>
 * Instances are created at parse start and discarded at parse end. They are
 * not thread-safe and must never be shared between parses.
 */
public final class ResourceState {

	private static final Logger LOG = PlcLogger.getLogger(ResourceState.class);

	private final ResourceLimits limits;

	private int depth;
	private int expressionDepth;
	private long iterations;
	private long collectionElements;
	private long statements;

	/**
	 * @param limits the ceilings enforced by this state
	 */
	public ResourceState(ResourceLimits limits) {
		if (limits == null) {
			throw new IllegalArgumentException("Resource limits are required");
		}
		this.limits = limits;
	}

	public ResourceLimits getLimits() {
		return limits;
	}

	/**
	 * Rejects a text whose UTF-8 encoding is larger than the input ceiling.
	 * The text is scanned at most once and no token is produced; a text
	 * that is obviously too short or too long is decided from its length
	 * alone.
	 *
	 * @param text the whole source text
	 * @throws SecurityLimitException if the text is too large
	 */
	public void checkInputSize(CharSequence text) {
		long max = limits.getMaxInputSize();
		long chars = text.length();
		// every char encodes to 1..3 bytes (surrogate pairs: 4 bytes for 2 chars)
		if (chars > max) {
			throw failure(LimitKind.INPUT_TOO_LARGE, max, chars, SourceSpan.NONE);
		}
		if (chars * 3 <= max) {
			return;
		}
		long bytes = 0;
		for (int i = 0; i < chars; i++) {
			char ch = text.charAt(i);
			if (ch < 0x80) {
				bytes++;
			} else if (ch < 0x800) {
				bytes += 2;
			} else if (Character.isHighSurrogate(ch) && i + 1 < chars && Character.isLowSurrogate(text.charAt(i + 1))) {
				bytes += 4;
				i++;
			} else {
				bytes += 3;
			}
			if (bytes > max) {
				throw failure(LimitKind.INPUT_TOO_LARGE, max, bytes, SourceSpan.NONE);
			}
		}
	}

	/**
	 * Opens one level of statement nesting (IF, CASE, FOR, WHILE, REPEAT).
	 * Must be paired with {@link #exitDepth()} in a {@code finally} block.
	 *
	 * @param at where the nested construct starts
	 */
	public void enterDepth(SourceSpan at) {
		if (depth + 1 > limits.getMaxDepth()) {
			throw failure(LimitKind.DEPTH_EXCEEDED, limits.getMaxDepth(), depth + 1L, at);
		}
		depth++;
	}

	/**
	 * Closes one level of nesting opened by {@link #enterDepth(SourceSpan)}.
	 */
	public void exitDepth() {
		if (depth == 0) {
			throw new IllegalStateException("exitDepth() without matching enterDepth()");
		}
		depth--;
	}

	/**
	 * Opens one level of expression or type nesting (parentheses, unary
	 * operands, argument and index lists, the right operand of {@code **},
	 * ARRAY element types). Counted apart from statement nesting, against
	 * the same ceiling.
	 *
	 * @param at where the nested construct starts
	 */
	public void enterExpressionDepth(SourceSpan at) {
		if (expressionDepth + 1 > limits.getMaxDepth()) {
			throw failure(LimitKind.DEPTH_EXCEEDED, limits.getMaxDepth(), expressionDepth + 1L, at);
		}
		expressionDepth++;
	}

	/**
	 * Closes one level opened by {@link #enterExpressionDepth(SourceSpan)}.
	 */
	public void exitExpressionDepth() {
		if (expressionDepth == 0) {
			throw new IllegalStateException("exitExpressionDepth() without matching enterExpressionDepth()");
		}
		expressionDepth--;
	}

	/**
	 * Records one repetition of a list or loop.
	 *
	 * @param at where the parse stands
	 */
	public void recordIteration(SourceSpan at) {
		if (iterations + 1 > limits.getMaxIterations()) {
			throw failure(LimitKind.ITERATION_EXCEEDED, limits.getMaxIterations(), iterations + 1, at);
		}
		iterations++;
	}

	/**
	 * Records one more element of a collection (declared name, argument,
	 * array dimension, index, case value, enumerated value).
	 *
	 * @param at the element being added
	 */
	public void recordCollectionElement(SourceSpan at) {
		if (collectionElements + 1 > limits.getMaxCollectionElements()) {
			throw failure(
					LimitKind.COLLECTION_TOO_LARGE,
					limits.getMaxCollectionElements(),
					collectionElements + 1,
					at);
		}
		collectionElements++;
	}

	/**
	 * Records one more statement.
	 *
	 * @param at the statement being parsed
	 */
	public void recordStatement(SourceSpan at) {
		if (statements + 1 > limits.getMaxStatements()) {
			throw failure(LimitKind.STATEMENT_LIMIT_EXCEEDED, limits.getMaxStatements(), statements + 1, at);
		}
		statements++;
	}

	/**
	 * Checks the length of an identifier or string literal.
	 *
	 * @param length the length in characters
	 * @param at the literal being read
	 */
	public void checkStringLength(int length, SourceSpan at) {
		if (length > limits.getMaxStringLength()) {
			throw failure(LimitKind.STRING_TOO_LONG, limits.getMaxStringLength(), length, at);
		}
	}

	public int getDepth() {
		return depth;
	}

	public int getExpressionDepth() {
		return expressionDepth;
	}

	public long getIterations() {
		return iterations;
	}

	public long getCollectionElements() {
		return collectionElements;
	}

	public long getStatements() {
		return statements;
	}

	private SecurityLimitException failure(LimitKind kind, long limit, long attempted, SourceSpan at) {
		LOG.debug("{} reached ({} {}): attempted {} at {}", kind, kind.getCeilingName(), limit, attempted, at);
		return new SecurityLimitException(kind, limit, attempted, at);
	}
}
