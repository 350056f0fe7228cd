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
import org.metricshub.plcflow.frontend.ast.VariableClass;

/**
 * One entry of a {@link SymbolTable}. Only the reference flag changes once
 * the symbol is defined.
 */
public final class Symbol {

	private final String name;
	private final SymbolKind kind;
	private final VariableClass variableClass;
	private final boolean constant;
	private final SourceSpan span;
	private boolean referenced;

	/**
	 * @param name the name, as written in the declaration
	 * @param kind what the name stands for
	 * @param variableClass the variable block, {@code null} unless {@code kind} is {@link SymbolKind#VARIABLE}
	 * @param constant whether the variable is declared in a CONSTANT block
	 * @param span the declaration
	 */
	public Symbol(String name, SymbolKind kind, VariableClass variableClass, boolean constant, SourceSpan span) {
		this.name = name;
		this.kind = kind;
		this.variableClass = variableClass;
		this.constant = constant;
		this.span = span;
	}

	public String getName() {
		return name;
	}

	public SymbolKind getKind() {
		return kind;
	}

	public VariableClass getVariableClass() {
		return variableClass;
	}

	public boolean isConstant() {
		return constant;
	}

	public SourceSpan getSpan() {
		return span;
	}

	/**
	 * @return whether the body or another declaration refers to this symbol
	 */
	public boolean isReferenced() {
		return referenced;
	}

	void markReferenced() {
		referenced = true;
	}

	/**
	 * Inputs, locals and temporaries are expected to be read by the POU
	 * itself. Outputs, in-outs, globals and externals are shared with the
	 * caller or with other POUs.
	 *
	 * @return whether an unreferenced declaration of this symbol is worth reporting
	 */
	public boolean isExpectedToBeReferenced() {
		if (kind != SymbolKind.VARIABLE) {
			return false;
		}
		switch (variableClass) {
		case INPUT:
		case LOCAL:
		case TEMP:
			return true;
		default:
			return false;
		}
	}

	@Override
	public String toString() {
		return kind == SymbolKind.VARIABLE ? variableClass + " " + name : kind + " " + name;
	}
}
