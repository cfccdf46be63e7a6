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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.metricshub.dtl.backend.CodeGenerator;
import org.metricshub.dtl.frontend.DtlLexer;
import org.metricshub.dtl.frontend.DtlParser;
import org.metricshub.dtl.frontend.Token;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.semantic.AnalysisReport;
import org.metricshub.dtl.semantic.SemanticAnalyzer;
import org.metricshub.dtl.util.CompileSettings;
import org.metricshub.dtl.util.DtlLogger;
import org.metricshub.dtl.util.DtlSettings;
import org.metricshub.dtl.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the compilation of a DTL script into a pandas program.
 * This entry point is used both when the compiler is embedded as a library
 * and when it is invoked from the command line.
 * <p>
 * Compilation runs four phases:
 * <ul>
 * <li>Lexical analysis, producing a list of tokens.
 * <li>Syntax analysis, producing a {@link Program}.
 * <li>Semantic analysis, producing an {@link AnalysisReport}.
 * <li>Code generation, producing the text of the pandas program,
 * only when the report has no error.
 * </ul>
 * The first two phases fail with a {@link DtlException} on the first problem;
 * semantic analysis reports every problem it finds.
 * <p>
 * A {@code Dtl} instance only holds its settings. Every call creates its own
 * lexer, parser, analyzer and generator, so calls are independent of each other.
 *
 * @see org.metricshub.dtl.Cli
 */
public class Dtl {

	private static final Logger LOG = DtlLogger.getLogger(Dtl.class);

	private final CompileSettings settings;

	/**
	 * Create a compiler with the default settings.
	 */
	public Dtl() {
		this(new DtlSettings());
	}

	/**
	 * @param settings validation and lexing switches
	 */
	public Dtl(CompileSettings settings) {
		this.settings = settings;
	}

	/**
	 * @param script script to read
	 * @return the tokens of the script, ending with an EOF token
	 * @throws IOException if the script cannot be read
	 */
	public List<Token> tokenize(ScriptSource script) throws IOException {
		return new DtlLexer(script.getDescription(), settings.isStrictStrings()).tokenize(script.readFully());
	}

	public List<Token> tokenize(String script) {
		return new DtlLexer(ScriptSource.DESCRIPTION_INLINE_SCRIPT, settings.isStrictStrings()).tokenize(script);
	}

	/**
	 * @param script script to read
	 * @return the parsed program
	 * @throws IOException if the script cannot be read
	 */
	public Program parse(ScriptSource script) throws IOException {
		return new DtlParser(script.getDescription()).parse(tokenize(script));
	}

	public Program parse(String script) {
		return new DtlParser(ScriptSource.DESCRIPTION_INLINE_SCRIPT).parse(tokenize(script));
	}

	/**
	 * @param program parsed program
	 * @return semantic errors and warnings
	 */
	public AnalysisReport analyze(Program program) {
		return new SemanticAnalyzer(settings).analyze(program);
	}

	/**
	 * Generate the pandas program, whether or not the program passed semantic analysis.
	 *
	 * @param program parsed program
	 * @return the text of the generated program
	 */
	public String generate(Program program) {
		return new CodeGenerator().generate(program);
	}

	/**
	 * Run all four phases.
	 *
	 * @param script script to compile
	 * @return the output of every phase; the code is {@code null} if semantic analysis found errors
	 * @throws IOException if the script cannot be read
	 * @throws DtlException on a lexical or syntax error
	 */
	public CompilationResult compile(ScriptSource script) throws IOException {
		return compile(script.getDescription(), script.readFully());
	}

	public CompilationResult compile(String script) {
		return compile(ScriptSource.DESCRIPTION_INLINE_SCRIPT, script);
	}

	private CompilationResult compile(String description, String text) {
		List<Token> tokens = new DtlLexer(description, settings.isStrictStrings()).tokenize(text);
		Program program = new DtlParser(description).parse(tokens);
		AnalysisReport report = analyze(program);
		String code = null;
		if (report.isValid()) {
			code = generate(program);
		} else {
			LOG.debug("{}: {} semantic errors, no code generated", description, report.getErrors().size());
		}
		return new CompilationResult(tokens, program, report, code);
	}

	/**
	 * Compile the script and, if it is valid, write the generated program.
	 *
	 * @param script script to compile
	 * @param output where the generated program is written; missing parent directories are created
	 * @return the output of every phase
	 * @throws IOException if the script cannot be read or the output cannot be written
	 * @throws DtlException on a lexical or syntax error
	 */
	public CompilationResult compileToFile(ScriptSource script, Path output) throws IOException {
		CompilationResult result = compile(script);
		if (result.isSuccessful()) {
			writeCode(result.getCode(), output);
		}
		return result;
	}

	/**
	 * Write generated code in UTF-8, creating missing parent directories.
	 *
	 * @param code the generated program
	 * @param output the target file
	 * @throws IOException if the file cannot be written
	 */
	public void writeCode(String code, Path output) throws IOException {
		Path parent = output.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(output, code.getBytes(StandardCharsets.UTF_8));
		LOG.debug("Generated code written to {}", output);
	}
}
