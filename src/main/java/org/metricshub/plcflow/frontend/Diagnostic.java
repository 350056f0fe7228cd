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

import org.metricshub.plcflow.ErrorKind;
import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.StructuredTextException;

/**
 * A non-fatal problem recorded while parsing in permissive mode.
 */
public final class Diagnostic implements Comparable<Diagnostic> {

	private final ErrorKind kind;
	private final String message;
	private final SourceSpan span;

	/**
	 * @param kind kind of the problem
	 * @param message description of the problem
	 * @param span where the problem was detected
	 */
	public Diagnostic(ErrorKind kind, String message, SourceSpan span) {
		this.kind = kind;
		this.message = message;
		this.span = span;
	}

	/**
	 * Records a recovered exception.
	 *
	 * @param e the exception the parser recovered from
	 * @return the matching diagnostic
	 */
	public static Diagnostic of(StructuredTextException e) {
		return new Diagnostic(e.getKind(), e.getDetail(), e.getSpan());
	}

	public ErrorKind getKind() {
		return kind;
	}

	public String getMessage() {
		return message;
	}

	public SourceSpan getSpan() {
		return span;
	}

	@Override
	public int compareTo(Diagnostic other) {
		return span.compareTo(other.span);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return kind + " " + span + ": " + message;
	}
}
