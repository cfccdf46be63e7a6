package org.metricshub.dtl.util;

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

import java.util.List;

/**
 * Settings used during compilation of DTL scripts.
 */
public interface CompileSettings {

	/**
	 * Script sources meta info.
	 *
	 * @return the script sources to compile
	 */
	List<ScriptSource> getScriptSources();

	/**
	 * @return {@code true} to report files referenced by {@code load} that do not exist,
	 *         and output directories of {@code save} that do not exist
	 */
	boolean isValidateFiles();

	/**
	 * @return {@code true} to read the header row of loaded files and check
	 *         every column reference against it
	 */
	boolean isValidateColumns();

	/**
	 * @return {@code true} to reject string literals that are not closed on their line,
	 *         {@code false} to read them to the end of the line
	 */
	boolean isStrictStrings();

	/**
	 * @return {@code true} to print the token stream
	 */
	boolean isDumpTokens();

	/**
	 * @return {@code true} to dump the syntax tree
	 */
	boolean isDumpSyntaxTree();

	/**
	 * @return {@code true} to print the generated program
	 */
	boolean isShowCode();

	/**
	 * @param defaultFileName default file name to use
	 * @return the output file name
	 */
	String getOutputFilename(String defaultFileName);
}
