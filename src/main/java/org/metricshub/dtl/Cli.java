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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.dtl.frontend.DtlParser;
import org.metricshub.dtl.frontend.Token;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.semantic.AnalysisReport;
import org.metricshub.dtl.util.DtlSettings;
import org.metricshub.dtl.util.ScriptFileSource;
import org.metricshub.dtl.util.ScriptSource;

/**
 * Command-line interface for the DTL compiler.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "dtl-compiler.jar";
		}
		JAR_NAME = myName;
	}

	private final DtlSettings settings = new DtlSettings();
	private final PrintStream out;

	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance printing its progress and reports to the supplied stream.
	 *
	 * @param out stream where compilation progress is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link DtlSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public DtlSettings getSettings() {
		return settings;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// the script to compile
				if (!settings.getScriptSources().isEmpty()) {
					throw new IllegalArgumentException("Only one input file is accepted, found: " + arg);
				}
				settings.addScriptSource(new ScriptFileSource(arg));
			} else if (arg.equals("-o") || arg.equals("--output")) {
				// -o/--output filename : where the generated program is written
				checkParameterHasArgument(args, argIdx);
				settings.setOutputFilename(args[++argIdx]);
			} else if (arg.equals("--no-file-check")) {
				settings.setValidateFiles(false);
			} else if (arg.equals("--validate-columns")) {
				settings.setValidateColumns(true);
			} else if (arg.equals("--strict-strings")) {
				settings.setStrictStrings(true);
			} else if (arg.equals("--dump-tokens")) {
				settings.setDumpTokens(true);
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--show-code")) {
				settings.setShowCode(true);
			} else if (arg.equals("--verbose")) {
				settings.setVerbose(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (settings.getScriptSources().isEmpty()) {
			throw new IllegalArgumentException("DTL input file not provided.");
		}
		for (ScriptSource scriptSource : settings.getScriptSources()) {
			try {
				scriptSource.getReader();
			} catch (IOException | UncheckedIOException ex) {
				throw new IllegalArgumentException(
						"Failed to read script '" + scriptSource.getDescription() + "': " + ex.getMessage(),
						ex);
			}
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Compiles the script named on the command line, printing the progress of each phase.
	 *
	 * @return the exit status: 0 if the program was generated, 1 if semantic analysis failed
	 * @throws IOException if the script cannot be read or the output cannot be written
	 * @throws DtlException on a lexical or syntax error
	 */
	public int run() throws IOException {
		if (printUsage) {
			usage(out);
			return 0;
		}

		ScriptSource script = settings.getScriptSources().get(0);
		Path output = Paths.get(settings.getOutputFilename(DtlSettings.DEFAULT_OUTPUT_FILENAME));
		Dtl dtl = new Dtl(settings);

		out.println("DTL Compiler - compiling " + script.getDescription());
		if (settings.isVerbose()) {
			out.print(settings.toDescriptionString());
		}

		out.println();
		out.println("[Phase 1] Lexical Analysis...");
		List<Token> tokens = dtl.tokenize(script);
		out.println("  " + tokens.size() + " tokens");
		if (settings.isDumpTokens()) {
			for (Token token : tokens) {
				out.println("    " + token);
			}
		}

		out.println();
		out.println("[Phase 2] Syntax Analysis...");
		Program program = new DtlParser(script.getDescription()).parse(tokens);
		out.println("  " + program.size() + " commands");
		if (settings.isDumpSyntaxTree()) {
			program.dump(out);
		}

		out.println();
		out.println("[Phase 3] Semantic Analysis...");
		AnalysisReport report = dtl.analyze(program);
		report.print(out);
		if (!report.isValid()) {
			out.println();
			out.println("COMPILATION FAILED: " + report.getErrors().size() + " semantic error(s)");
			return 1;
		}

		out.println();
		out.println("[Phase 4] Code Generation...");
		String code = dtl.generate(program);
		dtl.writeCode(code, output);
		out.println("  Generated code written to " + output);
		if (settings.isShowCode()) {
			out.println();
			out.println(code);
		}

		out.println();
		out.println("COMPILATION SUCCESSFUL");
		return 0;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" <input.dtl>" +
								" [-o|--output output-filename]" +
								" [--no-file-check]" +
								" [--validate-columns]" +
								" [--strict-strings]" +
								" [--dump-tokens]" +
								" [--dump-syntax]" +
								" [--show-code]" +
								" [--verbose]");
		dest.println();
		dest.println(" -o, --output filename = Write the generated program to filename (default "
				+ DtlSettings.DEFAULT_OUTPUT_FILENAME + ").");
		dest.println(" --no-file-check = Do not check that loaded files and output directories exist.");
		dest.println(" --validate-columns = Check column names against the header of the loaded file.");
		dest.println(" --strict-strings = Reject string literals that are not closed on their line.");
		dest.println(" --dump-tokens = Print the tokens.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --show-code = Print the generated program.");
		dest.println(" --verbose = Print settings, tokens, syntax tree and generated program.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments, compiles, and returns the exit status.
	 *
	 * @param args command-line arguments
	 * @param os output stream for compilation progress
	 * @return the exit status of {@link #run()}
	 * @throws IOException if the script cannot be read or the output cannot be written
	 */
	public static int create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		return cli.run();
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			System.exit(cli.run());
		} catch (DtlException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.println(e.getMessage());
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
