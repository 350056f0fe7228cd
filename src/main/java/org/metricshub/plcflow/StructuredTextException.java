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

/**
 * Base class of every error reported while reading Structured Text. It is
 * provided to conveniently distinguish input errors (which carry a kind and
 * the span they originated at) from other runtime exceptions.
 */
public abstract class StructuredTextException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private final String detail;

	private final SourceSpan span;

	/**
	 * @param kind the error kind
	 * @param message description of the problem
	 * @param span where the problem was detected
	 */
	protected StructuredTextException(ErrorKind kind, String message, SourceSpan span) {
		super(message + " (" + span + ")");
		this.kind = kind;
		this.detail = message;
		this.span = span;
	}

	/**
	 * @return the kind of this error
	 */
	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * @return the description of the problem, without its location
	 */
	public String getDetail() {
		return detail;
	}

	/**
	 * @return the source span this error originated at
	 */
	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * Returns the line number associated with this exception.
	 *
	 * @return the offending line number
	 */
	public int getLineNumber() {
		return span.getStartLine();
	}
}
