package org.metricshub.dtl.semantic;

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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of semantic analysis: errors and warnings in the order they were found.
 * The program is valid when there is no error; warnings never block compilation.
 */
public final class AnalysisReport {

	private final List<String> errors;
	private final List<String> warnings;

	public AnalysisReport(List<String> errors, List<String> warnings) {
		this.errors = Collections.unmodifiableList(new ArrayList<String>(errors));
		this.warnings = Collections.unmodifiableList(new ArrayList<String>(warnings));
	}

	public boolean isValid() {
		return errors.isEmpty();
	}

	public List<String> getErrors() {
		return errors;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	/**
	 * Prints every error and warning to the stream.
	 *
	 * @param out where the report is printed
	 */
	public void print(PrintStream out) {
		out.println();
		out.println("=== SEMANTIC ANALYSIS REPORT ===");
		if (!errors.isEmpty()) {
			out.println();
			out.println("ERRORS (" + errors.size() + "):");
			for (String error : errors) {
				out.println("  - " + error);
			}
		}
		if (!warnings.isEmpty()) {
			out.println();
			out.println("WARNINGS (" + warnings.size() + "):");
			for (String warning : warnings) {
				out.println("  - " + warning);
			}
		}
		if (errors.isEmpty() && warnings.isEmpty()) {
			out.println();
			out.println("No errors or warnings - program is semantically correct!");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof AnalysisReport)) {
			return false;
		}
		AnalysisReport other = (AnalysisReport) o;
		return errors.equals(other.errors) && warnings.equals(other.warnings);
	}

	@Override
	public int hashCode() {
		return 31 * errors.hashCode() + warnings.hashCode();
	}

	@Override
	public String toString() {
		return "AnalysisReport(errors=" + errors + ", warnings=" + warnings + ")";
	}
}
