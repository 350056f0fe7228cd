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

import java.io.Serializable;

/**
 * A region of source text, delimited by 1-based line/column positions and
 * 0-based character offsets. The end position is exclusive.
 */
public final class SourceSpan implements Comparable<SourceSpan>, Serializable {

	private static final long serialVersionUID = 1L;

	/** Span used for synthetic constructs that have no source text. */
	public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0, 0, 0);

	private final int startLine;
	private final int startColumn;
	private final int endLine;
	private final int endColumn;
	private final int startOffset;
	private final int endOffset;

	/**
	 * Creates a new span.
	 *
	 * @param startLine line of the first character (1-based)
	 * @param startColumn column of the first character (1-based)
	 * @param endLine line after the last character
	 * @param endColumn column after the last character
	 * @param startOffset offset of the first character
	 * @param endOffset offset after the last character
	 */
	public SourceSpan(int startLine, int startColumn, int endLine, int endColumn, int startOffset, int endOffset) {
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
	}

	/**
	 * Returns the smallest span covering both {@code this} and {@code other}.
	 *
	 * @param other the other span
	 * @return the merged span
	 */
	public SourceSpan to(SourceSpan other) {
		if (this == NONE) {
			return other;
		}
		if (other == NONE) {
			return this;
		}
		SourceSpan first = startOffset <= other.startOffset ? this : other;
		SourceSpan last = endOffset >= other.endOffset ? this : other;
		return new SourceSpan(
				first.startLine,
				first.startColumn,
				last.endLine,
				last.endColumn,
				first.startOffset,
				last.endOffset);
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	/**
	 * Number of characters covered by this span.
	 *
	 * @return the length in characters
	 */
	public int length() {
		return endOffset - startOffset;
	}

	@Override
	public int compareTo(SourceSpan other) {
		if (startOffset != other.startOffset) {
			return Integer.compare(startOffset, other.startOffset);
		}
		return Integer.compare(endOffset, other.endOffset);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SourceSpan)) {
			return false;
		}
		SourceSpan other = (SourceSpan) obj;
		return startOffset == other.startOffset
				&& endOffset == other.endOffset
				&& startLine == other.startLine
				&& startColumn == other.startColumn
				&& endLine == other.endLine
				&& endColumn == other.endColumn;
	}

	@Override
	public int hashCode() {
		return 31 * startOffset + endOffset;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "line " + startLine + ", column " + startColumn;
	}
}
