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
 * {@code trim}: strips surrounding whitespace from every text column.
 */
public final class TrimAst extends CommandAst {

	public TrimAst() {
		this(-1);
	}

	public TrimAst(int lineNumber) {
		super(lineNumber);
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.TRIM;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitTrim(this);
	}

	@Override
	public String toSource() {
		return "trim";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof TrimAst;
	}

	@Override
	public int hashCode() {
		return CommandKind.TRIM.hashCode();
	}

	@Override
	public String toString() {
		return "TrimAst()";
	}
}
