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
 * {@code filter COLUMN OP VALUE}: keeps the rows satisfying the comparison.
 */
public final class FilterAst extends CommandAst {

	private final String column;
	private final ComparisonOperator operator;
	private final Literal value;

	public FilterAst(String column, ComparisonOperator operator, Literal value) {
		this(column, operator, value, -1);
	}

	/**
	 * @param column compared column
	 * @param operator comparison; {@code null} is kept and reported by semantic analysis
	 * @param value right-hand side
	 * @param lineNumber source line
	 */
	public FilterAst(String column, ComparisonOperator operator, Literal value, int lineNumber) {
		super(lineNumber);
		this.column = Objects.requireNonNull(column, "column");
		this.operator = operator;
		this.value = Objects.requireNonNull(value, "value");
	}

	public String getColumn() {
		return column;
	}

	public ComparisonOperator getOperator() {
		return operator;
	}

	public Literal getValue() {
		return value;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.FILTER;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitFilter(this);
	}

	@Override
	public String toSource() {
		return "filter " + column + " " + (operator == null ? "?" : operator.getSymbol()) + " " + value.toSource();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FilterAst)) {
			return false;
		}
		FilterAst other = (FilterAst) o;
		return column.equals(other.column) && operator == other.operator && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.FILTER, column, operator, value);
	}

	@Override
	public String toString() {
		return "FilterAst(column=" + column
				+ ", op=" + (operator == null ? null : operator.getSymbol())
				+ ", value=" + value + ")";
	}
}
