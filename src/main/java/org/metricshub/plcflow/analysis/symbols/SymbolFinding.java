package org.metricshub.plcflow.analysis.symbols;

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

/**
 * A name resolution problem found in a POU. Findings never stop the
 * analysis and are kept apart from the parse diagnostics.
 */
public final class SymbolFinding implements Comparable<SymbolFinding> {

	/**
	 * Kinds of name resolution problems.
	 */
	public enum Kind {
		/** A name used in the body that no declaration defines */
		UNDEFINED_IDENTIFIER(true, "undefined identifier '%s'"),
		/** A name declared twice in the same POU */
		DUPLICATE_DEFINITION(true, "duplicate definition of '%s'"),
		/** An assignment, or a FOR loop, writing a CONSTANT variable */
		ASSIGNMENT_TO_CONSTANT(true, "cannot assign to constant '%s'"),
		/** An input, local or temporary variable that nothing refers to */
		UNUSED_VARIABLE(false, "unused variable '%s'");

		private final boolean error;
		private final String format;

		Kind(boolean error, String format) {
			this.error = error;
			this.format = format;
		}

		/**
		 * @return {@code true} for errors, {@code false} for warnings
		 */
		public boolean isError() {
			return error;
		}
	}

	private final Kind kind;
	private final String name;
	private final SourceSpan span;

	public SymbolFinding(Kind kind, String name, SourceSpan span) {
		this.kind = kind;
		this.name = name;
		this.span = span;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the name the finding is about, as written in the source
	 */
	public String getName() {
		return name;
	}

	public SourceSpan getSpan() {
		return span;
	}

	public String getMessage() {
		return String.format(kind.format, name);
	}

	@Override
	public int compareTo(SymbolFinding other) {
		return span.compareTo(other.span);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return (kind.isError() ? "error " : "warning ") + span + ": " + getMessage();
	}
}
