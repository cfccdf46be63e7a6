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
 * {@code group by BY_COLUMN FUNCTION AGG_COLUMN}.
 * The resulting table has two columns: the grouping column and
 * {@link AggregateFunction#resultColumn(String)}.
 */
public final class GroupByAst extends CommandAst {

	private final String byColumn;
	private final String aggregateColumn;
	private final AggregateFunction function;

	public GroupByAst(String byColumn, AggregateFunction function, String aggregateColumn) {
		this(byColumn, function, aggregateColumn, -1);
	}

	/**
	 * @param byColumn grouping column
	 * @param function aggregate function; {@code null} is kept and reported by semantic analysis
	 * @param aggregateColumn aggregated column
	 * @param lineNumber source line
	 */
	public GroupByAst(String byColumn, AggregateFunction function, String aggregateColumn, int lineNumber) {
		super(lineNumber);
		this.byColumn = Objects.requireNonNull(byColumn, "byColumn");
		this.function = function;
		this.aggregateColumn = Objects.requireNonNull(aggregateColumn, "aggregateColumn");
	}

	public String getByColumn() {
		return byColumn;
	}

	public String getAggregateColumn() {
		return aggregateColumn;
	}

	public AggregateFunction getFunction() {
		return function;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.GROUP_BY;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitGroupBy(this);
	}

	@Override
	public String toSource() {
		return "group by " + byColumn + " " + (function == null ? "?" : function.getKeyword()) + " " + aggregateColumn;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof GroupByAst)) {
			return false;
		}
		GroupByAst other = (GroupByAst) o;
		return byColumn.equals(other.byColumn)
				&& aggregateColumn.equals(other.aggregateColumn)
				&& function == other.function;
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.GROUP_BY, byColumn, aggregateColumn, function);
	}

	@Override
	public String toString() {
		return "GroupByAst(by=" + byColumn
				+ ", target=" + aggregateColumn
				+ ", func=" + (function == null ? null : function.getKeyword()) + ")";
	}
}
