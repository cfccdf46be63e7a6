package org.metricshub.dtl.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DTL Compiler
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.util.Objects;

/**
 * {@code sort by COLUMN [asc|desc]}.
 */
public final class SortAst extends CommandAst {

	private final String column;
	private final SortOrder order;

	public SortAst(String column, SortOrder order) {
		this(column, order, -1);
	}

	/**
	 * @param column column to sort by
	 * @param order sort direction; {@code null} is kept and reported by semantic analysis
	 * @param lineNumber source line
	 */
	public SortAst(String column, SortOrder order, int lineNumber) {
		super(lineNumber);
		this.column = Objects.requireNonNull(column, "column");
		this.order = order;
	}

	public String getColumn() {
		return column;
	}

	public SortOrder getOrder() {
		return order;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.SORT;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitSort(this);
	}

	@Override
	public String toSource() {
		return order == null ? "sort by " + column : "sort by " + column + " " + order.getKeyword();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof SortAst)) {
			return false;
		}
		SortAst other = (SortAst) o;
		return column.equals(other.column) && order == other.order;
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.SORT, column, order);
	}

	@Override
	public String toString() {
		return "SortAst(column=" + column + ", order=" + (order == null ? null : order.getKeyword()) + ")";
	}
}
