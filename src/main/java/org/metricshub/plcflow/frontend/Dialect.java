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

import java.util.Locale;

/**
 * The Structured Text flavors understood by the parser.
 */
public enum Dialect {

	/**
	 * IEC 61131-3 Structured Text. Pragmas are skipped like comments and
	 * direct addresses only appear in {@code AT} locations.
	 */
	IEC_61131_3,

	/**
	 * Vendor extension: pragma/attribute blocks, direct addresses as
	 * operands, compound assignments ({@code +=}, {@code -=}, {@code *=},
	 * {@code /=}) and empty call arguments are grammar productions.
	 */
	VENDOR;

	/**
	 * Maps the language tag supplied with a POU to a dialect.
	 *
	 * @param languageTag {@code ST}, {@code IEC}, {@code IEC_ST} for the
	 *        standard, {@code VENDOR}, {@code VENDOR_ST} or
	 *        {@code EXTENDED_ST} for the vendor dialect (case-insensitive)
	 * @return the matching dialect
	 * @throws IllegalArgumentException for any other tag
	 */
	public static Dialect forLanguageTag(String languageTag) {
		if (languageTag == null) {
			throw new IllegalArgumentException("Language tag is required");
		}
		String tag = languageTag.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		switch (tag) {
		case "ST":
		case "IEC":
		case "IEC_ST":
			return IEC_61131_3;
		case "VENDOR":
		case "VENDOR_ST":
		case "EXTENDED_ST":
			return VENDOR;
		default:
			throw new IllegalArgumentException("Unsupported language tag: " + languageTag);
		}
	}
}
