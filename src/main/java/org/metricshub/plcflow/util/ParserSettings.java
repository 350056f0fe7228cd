package org.metricshub.plcflow.util;

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

import org.metricshub.plcflow.frontend.Dialect;
import org.metricshub.plcflow.limits.ResourceLimits;

/**
 * A simple container for the parameters of a parse.
 * These values have defaults, which may be changed when invoking the
 * parser programmatically. Nothing is read from the environment.
 */
public class ParserSettings {

	/**
	 * Ceilings applied to each parse;
	 * the balanced profile by default.
	 */
	private ResourceLimits limits = ResourceLimits.balanced();

	/**
	 * Whether syntax errors are recorded and skipped instead of aborting
	 * the parse; <code>false</code> (strict) by default.
	 * Lexical and security errors are always fatal.
	 */
	private boolean permissive = false;

	/**
	 * Structured Text flavor;
	 * IEC 61131-3 by default.
	 */
	private Dialect dialect = Dialect.IEC_61131_3;

	/**
	 * Creates settings with the default values.
	 */
	public ParserSettings() {}

	/**
	 * Copy constructor.
	 *
	 * @param other the settings to copy
	 */
	public ParserSettings(ParserSettings other) {
		this.limits = other.limits;
		this.permissive = other.permissive;
		this.dialect = other.dialect;
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("limits = ").append(getLimits()).append(newLine);
		desc.append("permissive = ").append(isPermissive()).append(newLine);
		desc.append("dialect = ").append(getDialect()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the ceilings applied to each parse
	 */
	public ResourceLimits getLimits() {
		return limits;
	}

	/**
	 * @param limits the ceilings applied to each parse
	 */
	public void setLimits(ResourceLimits limits) {
		if (limits == null) {
			throw new IllegalArgumentException("Resource limits are required");
		}
		this.limits = limits;
	}

	/**
	 * @return whether syntax errors are recovered from
	 */
	public boolean isPermissive() {
		return permissive;
	}

	/**
	 * @param permissive whether syntax errors are recovered from
	 */
	public void setPermissive(boolean permissive) {
		this.permissive = permissive;
	}

	/**
	 * @return the Structured Text flavor
	 */
	public Dialect getDialect() {
		return dialect;
	}

	/**
	 * @param dialect the Structured Text flavor
	 */
	public void setDialect(Dialect dialect) {
		if (dialect == null) {
			throw new IllegalArgumentException("Dialect is required");
		}
		this.dialect = dialect;
	}
}
