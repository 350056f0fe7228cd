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
 * One declaration of a {@code TYPE ... END_TYPE} block.
 */
public final class TypeDeclaration extends AstNode {

	/**
	 * Shapes of user-defined types.
	 */
	public enum Kind {
		/** {@code T : INT;} */
		ALIAS,
		/** {@code T : STRUCT ... END_STRUCT;} */
		STRUCT,
		/** {@code T : (A, B := 5, C);} */
		ENUM,
		/** {@code T : INT(0..100);} */
		SUBRANGE,
		/** {@code T : ARRAY[1..10] OF INT;} */
		ARRAY
	}

	private final String name;
	private final Kind kind;
	private final TypeReference type;
	private final List<VariableDeclaration> fields;
	private final List<EnumValue> enumValues;
	private final Expression initialValue;

	public TypeDeclaration(
			String name,
			Kind kind,
			TypeReference type,
			List<VariableDeclaration> fields,
			List<EnumValue> enumValues,
			Expression initialValue,
			SourceSpan span) {
		super(span);
		this.name = name;
		this.kind = kind;
		this.type = type;
		this.fields = Collections.unmodifiableList(fields);
		this.enumValues = Collections.unmodifiableList(enumValues);
		this.initialValue = initialValue;
	}

	public String getName() {
		return name;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the defining type of aliases, subranges and arrays,
	 *         {@code null} for structures and enumerations
	 */
	public TypeReference getType() {
		return type;
	}

	public List<VariableDeclaration> getFields() {
		return fields;
	}

	public List<EnumValue> getEnumValues() {
		return enumValues;
	}

	/**
	 * @return the default value, {@code null} if none
	 */
	public Expression getInitialValue() {
		return initialValue;
	}

	@Override
	public String toString() {
		return "TYPE " + name + " (" + kind + ")";
	}
}
