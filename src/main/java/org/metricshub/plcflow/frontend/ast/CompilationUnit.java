package org.metricshub.plcflow.frontend.ast;

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

import java.util.Collections;
import java.util.List;
import org.metricshub.plcflow.SourceSpan;

/**
 * A whole source text: POUs and type declarations, in source order.
 */
public final class CompilationUnit extends AstNode {

	private final List<Pou> pous;
	private final List<TypeDeclaration> types;

	public CompilationUnit(List<Pou> pous, List<TypeDeclaration> types, SourceSpan span) {
		super(span);
		this.pous = Collections.unmodifiableList(pous);
		this.types = Collections.unmodifiableList(types);
	}

	public List<Pou> getPous() {
		return pous;
	}

	public List<TypeDeclaration> getTypes() {
		return types;
	}

	/**
	 * @param name POU name, compared ignoring case
	 * @return the matching POU, {@code null} if none
	 */
	public Pou findPou(String name) {
		for (Pou pou : pous) {
			if (pou.getName().equalsIgnoreCase(name)) {
				return pou;
			}
		}
		return null;
	}
}
