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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A located variable address such as {@code %IX0.0}, {@code %QW5} or
 * {@code %MD100}.
 */
public final class DirectAddress {

	/**
	 * Memory area of a direct address.
	 */
	public enum Location {
		INPUT('I'),
		OUTPUT('Q'),
		MEMORY('M');

		private final char prefix;

		Location(char prefix) {
			this.prefix = prefix;
		}

		public char getPrefix() {
			return prefix;
		}
	}

	/**
	 * Width of a direct address. A missing size prefix means {@link #BIT}.
	 */
	public enum Size {
		BIT('X'),
		BYTE('B'),
		WORD('W'),
		DOUBLE_WORD('D'),
		LONG_WORD('L');

		private final char prefix;

		Size(char prefix) {
			this.prefix = prefix;
		}

		public char getPrefix() {
			return prefix;
		}
	}

	private final String text;
	private final Location location;
	private final Size size;
	private final List<Integer> path;

	private DirectAddress(String text, Location location, Size size, List<Integer> path) {
		this.text = text;
		this.location = location;
		this.size = size;
		this.path = Collections.unmodifiableList(path);
	}

	/**
	 * Decodes the text of a {@code DIRECT_ADDRESS} token.
	 *
	 * @param text address text, starting with {@code %}
	 * @return the decoded address
	 * @throws IllegalArgumentException if {@code text} is not a direct address
	 */
	public static DirectAddress parse(String text) {
		String upper = text.toUpperCase(Locale.ROOT);
		if (upper.length() < 3 || upper.charAt(0) != '%') {
			throw new IllegalArgumentException("Not a direct address: " + text);
		}
		Location location = null;
		for (Location candidate : Location.values()) {
			if (candidate.prefix == upper.charAt(1)) {
				location = candidate;
			}
		}
		if (location == null) {
			throw new IllegalArgumentException("Unknown direct address location: " + text);
		}
		int index = 2;
		Size size = Size.BIT;
		for (Size candidate : Size.values()) {
			if (candidate.prefix == upper.charAt(2)) {
				size = candidate;
				index = 3;
			}
		}
		List<Integer> path = new ArrayList<Integer>();
		try {
			for (String part : upper.substring(index).split("\\.")) {
				path.add(Integer.valueOf(part));
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Malformed direct address: " + text, e);
		}
		return new DirectAddress(upper, location, size, path);
	}

	public Location getLocation() {
		return location;
	}

	public Size getSize() {
		return size;
	}

	/**
	 * @return the numeric components ({@code [0, 0]} for {@code %IX0.0})
	 */
	public List<Integer> getPath() {
		return path;
	}

	@Override
	public String toString() {
		return text;
	}
}
