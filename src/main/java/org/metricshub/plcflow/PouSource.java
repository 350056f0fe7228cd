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

import org.metricshub.plcflow.frontend.Dialect;

/**
 * One piece of Structured Text handed over by a document layer: the name of
 * the POU it belongs to, its text, and the language tag that selects the
 * {@link Dialect}.
 */
public class PouSource {

	private final String name;
	private final String text;
	private final String languageTag;
	private final Dialect dialect;

	/**
	 * Creates a new source.
	 *
	 * @param name name of the POU, used for a body without a POU header
	 * @param text the Structured Text
	 * @param languageTag {@code ST}, {@code IEC}, {@code IEC_ST},
	 *        {@code VENDOR}, {@code VENDOR_ST} or {@code EXTENDED_ST}
	 * @throws IllegalArgumentException if an argument is missing or the
	 *         language tag is unknown
	 */
	public PouSource(String name, String text, String languageTag) {
		if (name == null || name.trim().isEmpty()) {
			throw new IllegalArgumentException("A POU name is required");
		}
		if (text == null) {
			throw new IllegalArgumentException("No source text supplied for " + name);
		}
		this.name = name;
		this.text = text;
		this.languageTag = languageTag;
		this.dialect = Dialect.forLanguageTag(languageTag);
	}

	/**
	 * Creates a standard IEC 61131-3 source.
	 *
	 * @param name name of the POU
	 * @param text the Structured Text
	 */
	public PouSource(String name, String text) {
		this(name, text, "ST");
	}

	public final String getName() {
		return name;
	}

	public final String getText() {
		return text;
	}

	public final String getLanguageTag() {
		return languageTag;
	}

	/**
	 * @return the dialect selected by the language tag
	 */
	public final Dialect getDialect() {
		return dialect;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return name + " (" + languageTag + ", " + text.length() + " characters)";
	}
}
