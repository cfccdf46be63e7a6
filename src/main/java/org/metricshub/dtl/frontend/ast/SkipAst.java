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

/**
 * {@code skip N}: drops the first N rows of the file.
 */
public final class SkipAst extends CommandAst {

	private final int rowCount;

	public SkipAst(int rowCount) {
		this(rowCount, -1);
	}

	/**
	 * @param rowCount number of rows to skip, never negative
	 * @param lineNumber source line
	 */
	public SkipAst(int rowCount, int lineNumber) {
		super(lineNumber);
		if (rowCount < 0) {
			throw new IllegalArgumentException("Row count must not be negative: " + rowCount);
		}
		this.rowCount = rowCount;
	}

	public int getRowCount() {
		return rowCount;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.SKIP;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitSkip(this);
	}

	@Override
	public String toSource() {
		return "skip " + rowCount;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof SkipAst && rowCount == ((SkipAst) o).rowCount;
	}

	@Override
	public int hashCode() {
		return 31 * CommandKind.SKIP.hashCode() + rowCount;
	}

	@Override
	public String toString() {
		return "SkipAst(rows=" + rowCount + ")";
	}
}
