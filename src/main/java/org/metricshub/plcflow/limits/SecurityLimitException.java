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

import org.metricshub.plcflow.ErrorKind;
import org.metricshub.plcflow.SourceSpan;
import org.metricshub.plcflow.StructuredTextException;

/**
 * Exception thrown when a parse reaches one of its configured resource
 * ceilings. It is never downgraded to a syntax error.
 */
public class SecurityLimitException extends StructuredTextException {

	private static final long serialVersionUID = 1L;

	private final LimitKind limitKind;
	private final long limit;
	private final long attempted;

	/**
	 * Creates a new security exception.
	 *
	 * @param limitKind the ceiling that was reached
	 * @param limit the configured value of the ceiling
	 * @param attempted the value the operation would have reached
	 * @param span where the parse stood when the ceiling was reached
	 */
	public SecurityLimitException(LimitKind limitKind, long limit, long attempted, SourceSpan span) {
		super(
				ErrorKind.SECURITY,
				"Security limit exceeded: " + limitKind.getCeilingName() + " is " + limit + ", attempted " + attempted,
				span);
		this.limitKind = limitKind;
		this.limit = limit;
		this.attempted = attempted;
	}

	/**
	 * @return the ceiling that was reached
	 */
	public LimitKind getLimitKind() {
		return limitKind;
	}

	/**
	 * @return the name of the ceiling that was reached
	 */
	public String getCeilingName() {
		return limitKind.getCeilingName();
	}

	/**
	 * @return the configured value of the ceiling
	 */
	public long getLimit() {
		return limit;
	}

	/**
	 * @return the value the rejected operation would have reached
	 */
	public long getAttempted() {
		return attempted;
	}
}
