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
 * Root of the ten DTL command nodes.
 * <p>
 * Nodes are immutable values: two nodes are equal when their kind and fields
 * are equal, regardless of the source line they were parsed from.
 * The set of subclasses is closed; dispatch goes through {@link CommandAstVisitor}.
 */
public abstract class CommandAst {

	private final int lineNumber;

	/**
	 * @param lineNumber 1-based source line, or {@code -1} for nodes built in code
	 */
	CommandAst(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the 1-based line this command was parsed from, or {@code -1}
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the kind of this command
	 */
	public abstract CommandKind getKind();

	/**
	 * Double dispatch into the visitor method matching this node.
	 *
	 * @param visitor the visitor
	 * @param <R> result type
	 * @return the visitor's result
	 */
	public abstract <R> R accept(CommandAstVisitor<R> visitor);

	/**
	 * Renders this command as minimal DTL source, keywords in lower case.
	 *
	 * @return one line of DTL, without line terminator
	 */
	public abstract String toSource();

	/**
	 * Quotes a file name or string value for DTL source. Double quotes are used
	 * unless the text contains one, since DTL strings have no escapes.
	 */
	static String quote(String text) {
		return text.indexOf('"') >= 0 ? "'" + text + "'" : "\"" + text + "\"";
	}
}
