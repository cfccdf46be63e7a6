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
 * {@code rename OLD to NEW}.
 */
public final class RenameAst extends CommandAst {

	private final String oldName;
	private final String newName;

	public RenameAst(String oldName, String newName) {
		this(oldName, newName, -1);
	}

	public RenameAst(String oldName, String newName, int lineNumber) {
		super(lineNumber);
		this.oldName = Objects.requireNonNull(oldName, "oldName");
		this.newName = Objects.requireNonNull(newName, "newName");
	}

	public String getOldName() {
		return oldName;
	}

	public String getNewName() {
		return newName;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.RENAME;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitRename(this);
	}

	@Override
	public String toSource() {
		return "rename " + oldName + " to " + newName;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof RenameAst)) {
			return false;
		}
		RenameAst other = (RenameAst) o;
		return oldName.equals(other.oldName) && newName.equals(other.newName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.RENAME, oldName, newName);
	}

	@Override
	public String toString() {
		return "RenameAst(" + oldName + " -> " + newName + ")";
	}
}
