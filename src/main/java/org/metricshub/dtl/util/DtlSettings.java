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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A simple container for the parameters of a single DTL compilation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the compiler programmatically, from within Java code.
 */
public class DtlSettings implements CompileSettings {

	/** Constant <code>DEFAULT_OUTPUT_FILENAME="generated_output.py"</code> */
	public static final String DEFAULT_OUTPUT_FILENAME = "generated_output.py";

	/**
	 * Scripts to compile, in order.
	 */
	private final List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();

	/**
	 * Where the generated program is written;
	 * <code>null</code> means {@link #DEFAULT_OUTPUT_FILENAME}.
	 */
	private String outputFilename = null;

	/**
	 * Whether loaded files and save directories are checked on disk;
	 * <code>true</code> by default.
	 */
	private boolean validateFiles = true;

	/**
	 * Whether column references are checked against the header row
	 * of the loaded file; <code>false</code> by default.
	 */
	private boolean validateColumns = false;

	/**
	 * Whether an unterminated string literal is a lexical error;
	 * <code>false</code> by default.
	 */
	private boolean strictStrings = false;

	/**
	 * Whether the compiler reports everything it does:
	 * settings, tokens, syntax tree and generated code.
	 */
	private boolean verbose = false;

	private boolean dumpTokens = false;

	private boolean dumpSyntaxTree = false;

	private boolean showCode = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("scriptSources = ").append(getScriptSources()).append(newLine);
		desc.append("outputFilename = ").append(getOutputFilename(DEFAULT_OUTPUT_FILENAME)).append(newLine);
		desc.append("validateFiles = ").append(isValidateFiles()).append(newLine);
		desc.append("validateColumns = ").append(isValidateColumns()).append(newLine);
		desc.append("strictStrings = ").append(isStrictStrings()).append(newLine);
		desc.append("verbose = ").append(isVerbose()).append(newLine);

		return desc.toString();
	}

	/** {@inheritDoc} */
	@Override
	public List<ScriptSource> getScriptSources() {
		return Collections.unmodifiableList(scriptSources);
	}

	/**
	 * Appends a script to compile.
	 *
	 * @param scriptSource the script source to add
	 */
	public void addScriptSource(ScriptSource scriptSource) {
		scriptSources.add(scriptSource);
	}

	/** {@inheritDoc} */
	@Override
	public String getOutputFilename(String defaultFileName) {
		return outputFilename != null ? outputFilename : defaultFileName;
	}

	/**
	 * @param outputFilename where the generated program is written
	 */
	public void setOutputFilename(String outputFilename) {
		this.outputFilename = outputFilename;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isValidateFiles() {
		return validateFiles;
	}

	/**
	 * @param validateFiles whether loaded files and save directories are checked on disk
	 */
	public void setValidateFiles(boolean validateFiles) {
		this.validateFiles = validateFiles;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isValidateColumns() {
		return validateColumns;
	}

	/**
	 * @param validateColumns whether column references are checked against real data
	 */
	public void setValidateColumns(boolean validateColumns) {
		this.validateColumns = validateColumns;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isStrictStrings() {
		return strictStrings;
	}

	/**
	 * @param strictStrings whether an unterminated string literal is a lexical error
	 */
	public void setStrictStrings(boolean strictStrings) {
		this.strictStrings = strictStrings;
	}

	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * @param verbose whether settings, tokens, syntax tree and generated code are all printed
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpTokens() {
		return dumpTokens || verbose;
	}

	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree || verbose;
	}

	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}

	/** {@inheritDoc} */
	@Override
	public boolean isShowCode() {
		return showCode || verbose;
	}

	public void setShowCode(boolean showCode) {
		this.showCode = showCode;
	}
}
