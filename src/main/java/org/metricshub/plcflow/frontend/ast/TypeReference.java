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
 * The data type of a variable, a function result or a type declaration.
 * Named types are referred to by name only.
 */
public final class TypeReference extends AstNode {

	/**
	 * Shapes of type references.
	 */
	public enum Kind {
		/** {@code INT}, {@code MyStruct}, {@code TON} */
		NAMED,
		/** {@code ARRAY[1..10, 0..3] OF REAL} */
		ARRAY,
		/** {@code STRING} or {@code STRING[80]} */
		STRING,
		/** {@code WSTRING} or {@code WSTRING[80]} */
		WSTRING,
		/** {@code INT(0..100)} */
		SUBRANGE
	}

	private final Kind kind;
	private final String name;
	private final List<Subrange> dimensions;
	private final TypeReference elementType;
	private final Expression length;
	private final Subrange range;

	private TypeReference(
			Kind kind,
			String name,
			List<Subrange> dimensions,
			TypeReference elementType,
			Expression length,
			Subrange range,
			SourceSpan span) {
		super(span);
		this.kind = kind;
		this.name = name;
		this.dimensions = Collections.unmodifiableList(dimensions);
		this.elementType = elementType;
		this.length = length;
		this.range = range;
	}

	public static TypeReference named(String name, SourceSpan span) {
		return new TypeReference(Kind.NAMED, name, Collections.<Subrange>emptyList(), null, null, null, span);
	}

	public static TypeReference array(List<Subrange> dimensions, TypeReference elementType, SourceSpan span) {
		return new TypeReference(Kind.ARRAY, "ARRAY", dimensions, elementType, null, null, span);
	}

	/**
	 * @param wide {@code true} for WSTRING
	 * @param length the maximum length, {@code null} for the default one
	 * @param span source of the reference
	 * @return a string type reference
	 */
	public static TypeReference string(boolean wide, Expression length, SourceSpan span) {
		return new TypeReference(
				wide ? Kind.WSTRING : Kind.STRING,
				wide ? "WSTRING" : "STRING",
				Collections.<Subrange>emptyList(),
				null,
				length,
				null,
				span);
	}

	public static TypeReference subrange(String baseType, Subrange range, SourceSpan span) {
		return new TypeReference(Kind.SUBRANGE, baseType, Collections.<Subrange>emptyList(), null, null, range, span);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the type name (the base type name for subranges)
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the array dimensions, empty for other kinds
	 */
	public List<Subrange> getDimensions() {
		return dimensions;
	}

	public TypeReference getElementType() {
		return elementType;
	}

	public Expression getLength() {
		return length;
	}

	public Subrange getRange() {
		return range;
	}

	@Override
	public String toString() {
		switch (kind) {
		case ARRAY:
			StringBuilder sb = new StringBuilder("ARRAY[");
			for (int i = 0; i < dimensions.size(); i++) {
				if (i > 0) {
					sb.append(", ");
				}
				sb.append(dimensions.get(i));
			}
			return sb.append("] OF ").append(elementType).toString();
		case STRING:
		case WSTRING:
			return length == null ? name : name + "[" + length + "]";
		case SUBRANGE:
			return name + "(" + range + ")";
		default:
			return name;
		}
	}
}
