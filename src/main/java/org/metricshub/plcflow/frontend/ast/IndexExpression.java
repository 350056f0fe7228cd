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
 * {@code target[i, j, ...]}.
 */
public final class IndexExpression extends Expression {

	private final Expression target;
	private final List<Expression> indices;

	public IndexExpression(Expression target, List<Expression> indices, SourceSpan span) {
		super(span);
		this.target = target;
		this.indices = Collections.unmodifiableList(indices);
	}

	public Expression getTarget() {
		return target;
	}

	public List<Expression> getIndices() {
		return indices;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitIndex(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder().append(target).append('[');
		for (int i = 0; i < indices.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(indices.get(i));
		}
		return sb.append(']').toString();
	}
}
