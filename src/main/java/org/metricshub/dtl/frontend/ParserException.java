package org.metricshub.dtl.frontend;

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

import org.metricshub.dtl.DtlException;

/**
 * Thrown when the token sequence does not match the grammar of any DTL command.
 * Parsing stops at the first such error.
 */
public class ParserException extends DtlException {

	private static final long serialVersionUID = 1L;

	private final TokenType foundType;

	/**
	 * @param msg description of what was expected and what was found
	 * @param sourceDescription description of the script
	 * @param found the offending token
	 */
	public ParserException(String msg, String sourceDescription, Token found) {
		super(msg + " at line " + found.getLine(), sourceDescription, found.getLine());
		this.foundType = found.getType();
	}

	/**
	 * @return the kind of the token that could not be parsed
	 */
	public TokenType getFoundType() {
		return foundType;
	}
}
