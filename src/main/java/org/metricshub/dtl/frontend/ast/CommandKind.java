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
 * The ten kinds of DTL commands. Every {@link CommandAst} reports exactly one of them.
 */
public enum CommandKind {
	LOAD("load"),
	SAVE("save"),
	SKIP("skip"),
	TRIM("trim"),
	CLEAN("clean"),
	FILTER("filter"),
	SELECT("select"),
	SORT("sort"),
	RENAME("rename"),
	GROUP_BY("group");

	private final String keyword;

	CommandKind(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * @return the keyword used in diagnostics for this kind of command
	 */
	public String getKeyword() {
		return keyword;
	}
}
