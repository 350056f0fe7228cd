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

import java.util.Locale;

/**
 * The ceilings applied to one parse. Three built-in profiles are provided
 * ({@link #strict()}, {@link #balanced()} and {@link #relaxed()}); custom
 * limits are assembled with {@link #builder()}.
 * <p>
 * Every ceiling is at least 1. Instances are immutable and may be shared
 * between concurrent parses: the mutable counters live in
 * {@link ResourceState}.
 */
public final class ResourceLimits {

	/**
	 * Names the origin of a {@link ResourceLimits} value.
	 */
	public enum Profile {
		STRICT,
		BALANCED,
		RELAXED,
		CUSTOM
	}

	private static final int MIB = 1024 * 1024;

	private static final ResourceLimits STRICT = new ResourceLimits(
			Profile.STRICT,
			10L * MIB,
			64,
			100_000,
			10_000,
			1_000_000,
			64 * 1024);

	private static final ResourceLimits BALANCED = new ResourceLimits(
			Profile.BALANCED,
			100L * MIB,
			256,
			1_000_000,
			100_000,
			10_000_000,
			MIB);

	private static final ResourceLimits RELAXED = new ResourceLimits(
			Profile.RELAXED,
			500L * MIB,
			512,
			10_000_000,
			1_000_000,
			100_000_000,
			10 * MIB);

	private final Profile profile;
	private final long maxInputSize;
	private final int maxDepth;
	private final long maxIterations;
	private final long maxCollectionElements;
	private final long maxStatements;
	private final int maxStringLength;

	private ResourceLimits(
			Profile profile,
			long maxInputSize,
			int maxDepth,
			long maxIterations,
			long maxCollectionElements,
			long maxStatements,
			int maxStringLength) {
		this.profile = profile;
		this.maxInputSize = requirePositive("maxInputSize", maxInputSize);
		this.maxDepth = (int) requirePositive("maxDepth", maxDepth);
		this.maxIterations = requirePositive("maxIterations", maxIterations);
		this.maxCollectionElements = requirePositive("maxCollectionElements", maxCollectionElements);
		this.maxStatements = requirePositive("maxStatements", maxStatements);
		this.maxStringLength = (int) requirePositive("maxStringLength", maxStringLength);
	}

	private static long requirePositive(String name, long value) {
		if (value < 1) {
			throw new IllegalArgumentException(name + " must be at least 1, got " + value);
		}
		return value;
	}

	/**
	 * Tight ceilings, for untrusted input.
	 *
	 * @return the strict profile
	 */
	public static ResourceLimits strict() {
		return STRICT;
	}

	/**
	 * The default profile.
	 *
	 * @return the balanced profile
	 */
	public static ResourceLimits balanced() {
		return BALANCED;
	}

	/**
	 * Generous ceilings, for large trusted projects.
	 *
	 * @return the relaxed profile
	 */
	public static ResourceLimits relaxed() {
		return RELAXED;
	}

	/**
	 * Looks a built-in profile up by name, ignoring case.
	 *
	 * @param name {@code strict}, {@code balanced} or {@code relaxed}
	 * @return the matching profile
	 * @throws IllegalArgumentException if no built-in profile has this name
	 */
	public static ResourceLimits forProfile(String name) {
		if (name == null) {
			throw new IllegalArgumentException("Profile name is required");
		}
		String key = name.trim().toUpperCase(Locale.ROOT);
		if (Profile.STRICT.name().equals(key)) {
			return STRICT;
		}
		if (Profile.BALANCED.name().equals(key)) {
			return BALANCED;
		}
		if (Profile.RELAXED.name().equals(key)) {
			return RELAXED;
		}
		throw new IllegalArgumentException("Unknown resource profile: " + name);
	}

	/**
	 * @return a builder seeded with the balanced profile
	 */
	public static Builder builder() {
		return new Builder(BALANCED);
	}

	/**
	 * @param base the limits to start from
	 * @return a builder seeded with {@code base}
	 */
	public static Builder builder(ResourceLimits base) {
		return new Builder(base);
	}

	/**
	 * Whether every ceiling of this instance is lower than or equal to the
	 * matching ceiling of {@code other}.
	 *
	 * @param other the limits to compare with
	 * @return {@code true} if {@code this} is at least as strict as {@code other}
	 */
	public boolean isWithin(ResourceLimits other) {
		return maxInputSize <= other.maxInputSize
				&& maxDepth <= other.maxDepth
				&& maxIterations <= other.maxIterations
				&& maxCollectionElements <= other.maxCollectionElements
				&& maxStatements <= other.maxStatements
				&& maxStringLength <= other.maxStringLength;
	}

	public Profile getProfile() {
		return profile;
	}

	/**
	 * @return the maximum input size, in UTF-8 bytes
	 */
	public long getMaxInputSize() {
		return maxInputSize;
	}

	/**
	 * @return the maximum number of simultaneously open nested constructs
	 */
	public int getMaxDepth() {
		return maxDepth;
	}

	/**
	 * @return the maximum cumulative number of list repetitions
	 */
	public long getMaxIterations() {
		return maxIterations;
	}

	/**
	 * @return the maximum cumulative number of collection elements
	 */
	public long getMaxCollectionElements() {
		return maxCollectionElements;
	}

	/**
	 * @return the maximum cumulative number of statements
	 */
	public long getMaxStatements() {
		return maxStatements;
	}

	/**
	 * @return the maximum length of an identifier or string literal, in characters
	 */
	public int getMaxStringLength() {
		return maxStringLength;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return profile.name().toLowerCase(Locale.ROOT)
				+ " [maxInputSize=" + maxInputSize
				+ ", maxDepth=" + maxDepth
				+ ", maxIterations=" + maxIterations
				+ ", maxCollectionElements=" + maxCollectionElements
				+ ", maxStatements=" + maxStatements
				+ ", maxStringLength=" + maxStringLength + "]";
	}

	/**
	 * Assembles custom limits. Ceilings are validated by {@link #build()}.
	 */
	public static final class Builder {

		private long maxInputSize;
		private int maxDepth;
		private long maxIterations;
		private long maxCollectionElements;
		private long maxStatements;
		private int maxStringLength;

		private Builder(ResourceLimits base) {
			maxInputSize = base.maxInputSize;
			maxDepth = base.maxDepth;
			maxIterations = base.maxIterations;
			maxCollectionElements = base.maxCollectionElements;
			maxStatements = base.maxStatements;
			maxStringLength = base.maxStringLength;
		}

		public Builder maxInputSize(long value) {
			maxInputSize = value;
			return this;
		}

		public Builder maxDepth(int value) {
			maxDepth = value;
			return this;
		}

		public Builder maxIterations(long value) {
			maxIterations = value;
			return this;
		}

		public Builder maxCollectionElements(long value) {
			maxCollectionElements = value;
			return this;
		}

		public Builder maxStatements(long value) {
			maxStatements = value;
			return this;
		}

		public Builder maxStringLength(int value) {
			maxStringLength = value;
			return this;
		}

		/**
		 * @return the custom limits
		 * @throws IllegalArgumentException if a ceiling is lower than 1
		 */
		public ResourceLimits build() {
			return new ResourceLimits(
					Profile.CUSTOM,
					maxInputSize,
					maxDepth,
					maxIterations,
					maxCollectionElements,
					maxStatements,
					maxStringLength);
		}
	}
}
