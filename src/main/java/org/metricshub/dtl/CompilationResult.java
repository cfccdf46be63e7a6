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

import java.util.List;
import org.metricshub.dtl.frontend.Token;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.semantic.AnalysisReport;

/**
 * What a compilation produced: the output of every phase that ran.
 * The generated code is {@code null} when semantic analysis found errors.
 */
public final class CompilationResult {

	private final List<Token> tokens;
	private final Program program;
	private final AnalysisReport report;
	private final String code;

	CompilationResult(List<Token> tokens, Program program, AnalysisReport report, String code) {
		this.tokens = tokens;
		this.program = program;
		this.report = report;
		this.code = code;
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public Program getProgram() {
		return program;
	}

	public AnalysisReport getReport() {
		return report;
	}

	/**
	 * @return the generated pandas script, or {@code null} if the program is invalid
	 */
	public String getCode() {
		return code;
	}

	public boolean isSuccessful() {
		return code != null;
	}
}
