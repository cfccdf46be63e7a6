package org.metricshub.dtl;

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
 * A runtime exception thrown by the DTL compiler. It is provided
 * to conveniently distinguish between compilation failures
 * and other runtime exceptions.
 */
public class DtlException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;

	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for DtlException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 * @param sourceDescription description of the script being compiled, may be {@code null}
	 * @param lineno 1-based line number, or {@code -1}
	 */
	public DtlException(String msg, String sourceDescription, int lineno) {
		super(msg);
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineno;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the description of the script in which the error occurred, or {@code null}
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}
}
