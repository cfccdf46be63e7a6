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
 * {@code load "file"}: reads a delimited file into the current table.
 */
public final class LoadAst extends CommandAst {

	private final String filename;

	public LoadAst(String filename) {
		this(filename, -1);
	}

	public LoadAst(String filename, int lineNumber) {
		super(lineNumber);
		this.filename = Objects.requireNonNull(filename, "filename");
	}

	public String getFilename() {
		return filename;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.LOAD;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitLoad(this);
	}

	@Override
	public String toSource() {
		return "load " + quote(filename);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof LoadAst && filename.equals(((LoadAst) o).filename);
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.LOAD, filename);
	}

	@Override
	public String toString() {
		return "LoadAst(filename=" + filename + ")";
	}
}
