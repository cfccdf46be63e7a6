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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code select COL[, COL...]}: narrows the current table to the listed columns, in order.
 */
public final class SelectAst extends CommandAst {

	private final List<String> columns;

	public SelectAst(List<String> columns) {
		this(columns, -1);
	}

	/**
	 * @param columns selected columns, at least one
	 * @param lineNumber source line
	 */
	public SelectAst(List<String> columns, int lineNumber) {
		super(lineNumber);
		if (columns == null || columns.isEmpty()) {
			throw new IllegalArgumentException("select requires at least one column");
		}
		this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
	}

	/**
	 * @return the selected columns in the order written
	 */
	public List<String> getColumns() {
		return columns;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.SELECT;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitSelect(this);
	}

	@Override
	public String toSource() {
		return "select " + String.join(", ", columns);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof SelectAst && columns.equals(((SelectAst) o).columns);
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.SELECT, columns);
	}

	@Override
	public String toString() {
		return "SelectAst(columns=" + columns + ")";
	}
}
