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
import java.util.Collections;
import java.util.List;
import org.metricshub.plcflow.StructuredTextException;

/**
 * Outcome of one parse: either a value with zero or more non-fatal
 * diagnostics (in source order), or the first fatal error.
 *
 * @param <T> type of the parsed value
 */
public final class ParseResult<T> {

	private final T value;
	private final List<Diagnostic> diagnostics;
	private final StructuredTextException error;

	private ParseResult(T value, List<Diagnostic> diagnostics, StructuredTextException error) {
		this.value = value;
		List<Diagnostic> sorted = new ArrayList<Diagnostic>(diagnostics);
		Collections.sort(sorted);
		this.diagnostics = Collections.unmodifiableList(sorted);
		this.error = error;
	}

	/**
	 * @param <T> type of the parsed value
	 * @param value the parsed value
	 * @param diagnostics the recovered problems
	 * @return a successful result
	 */
	public static <T> ParseResult<T> success(T value, List<Diagnostic> diagnostics) {
		return new ParseResult<T>(value, diagnostics, null);
	}

	/**
	 * @param <T> type of the value that could not be parsed
	 * @param error the fatal error
	 * @param diagnostics the problems recovered before the fatal error
	 * @return a failed result
	 */
	public static <T> ParseResult<T> failure(StructuredTextException error, List<Diagnostic> diagnostics) {
		if (error == null) {
			throw new IllegalArgumentException("A failed result requires an error");
		}
		return new ParseResult<T>(null, diagnostics, error);
	}

	public boolean isSuccess() {
		return error == null;
	}

	/**
	 * @return the parsed value
	 * @throws IllegalStateException if the parse failed
	 */
	public T getValue() {
		if (error != null) {
			throw new IllegalStateException("Parse failed: " + error.getMessage(), error);
		}
		return value;
	}

	/**
	 * @return the parsed value
	 * @throws StructuredTextException the fatal error, if the parse failed
	 */
	public T getValueOrThrow() {
		if (error != null) {
			throw error;
		}
		return value;
	}

	/**
	 * @return the non-fatal diagnostics, in source order
	 */
	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	/**
	 * @return the fatal error, {@code null} on success
	 */
	public StructuredTextException getError() {
		return error;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		if (error != null) {
			return "ParseResult[error=" + error.getMessage() + "]";
		}
		return "ParseResult[diagnostics=" + diagnostics.size() + "]";
	}
}
