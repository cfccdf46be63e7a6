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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.metricshub.dtl.frontend.ast.CleanAst;
import org.metricshub.dtl.frontend.ast.CleanKind;
import org.metricshub.dtl.frontend.ast.CommandAst;
import org.metricshub.dtl.frontend.ast.CommandAstVisitor;
import org.metricshub.dtl.frontend.ast.FilterAst;
import org.metricshub.dtl.frontend.ast.GroupByAst;
import org.metricshub.dtl.frontend.ast.LoadAst;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.frontend.ast.RenameAst;
import org.metricshub.dtl.frontend.ast.SaveAst;
import org.metricshub.dtl.frontend.ast.SelectAst;
import org.metricshub.dtl.frontend.ast.SkipAst;
import org.metricshub.dtl.frontend.ast.SortAst;
import org.metricshub.dtl.frontend.ast.TrimAst;
import org.metricshub.dtl.util.CompileSettings;
import org.metricshub.dtl.util.DtlLogger;
import org.slf4j.Logger;

/**
 * Checks a {@link Program} before code generation.
 * <p>
 * The analyzer walks the commands in order, carrying an {@link AnalysisState}
 * from one command to the next: whether a table is loaded, whether it has been
 * saved, and which columns exist at that point. Column checks only run when
 * column validation is enabled and the columns are known, which requires the
 * header row of the loaded file to be readable at compile time.
 * <p>
 * The analyzer never throws on a bad program; every problem is collected
 * in the returned {@link AnalysisReport}.
 */
public class SemanticAnalyzer {

	private static final Logger LOG = DtlLogger.getLogger(SemanticAnalyzer.class);

	private final boolean validateFiles;
	private final boolean validateColumns;
	private final CsvHeaderReader headerReader;

	/**
	 * <p>
	 * Constructor for SemanticAnalyzer.
	 * </p>
	 *
	 * @param validateFiles check that loaded files exist and save directories are present
	 * @param validateColumns check column references against the header of the loaded file
	 */
	public SemanticAnalyzer(boolean validateFiles, boolean validateColumns) {
		this(validateFiles, validateColumns, new CsvHeaderReader());
	}

	/**
	 * @param settings where the validation switches are read from
	 */
	public SemanticAnalyzer(CompileSettings settings) {
		this(settings.isValidateFiles(), settings.isValidateColumns());
	}

	SemanticAnalyzer(boolean validateFiles, boolean validateColumns, CsvHeaderReader headerReader) {
		this.validateFiles = validateFiles;
		this.validateColumns = validateColumns;
		this.headerReader = headerReader;
	}

	/**
	 * Analyze the program.
	 *
	 * @param program the parsed program
	 * @return errors and warnings, in the order they were found
	 */
	public AnalysisReport analyze(Program program) {
		List<String> errors = new ArrayList<String>();
		List<String> warnings = new ArrayList<String>();

		if (program.isEmpty()) {
			warnings.add("Empty program - no commands found");
		}
		checkFilterAfterSelect(program, warnings);

		boolean hasLoad = false;
		for (CommandAst command : program.getCommands()) {
			hasLoad |= command instanceof LoadAst;
		}

		AnalysisState state = AnalysisState.initial();
		for (int i = 0; i < program.size(); i++) {
			state = program.get(i).accept(new CommandChecker(program, i, hasLoad, state, errors, warnings));
		}

		if (!state.isLoaded()) {
			errors.add("Program requires a 'load' command");
		}
		if (!state.isSaved()) {
			warnings.add("Program has no 'save' command - results won't be saved");
		}
		LOG.debug("Semantic analysis: {} errors, {} warnings", errors.size(), warnings.size());
		return new AnalysisReport(errors, warnings);
	}

	/**
	 * Warns about a {@code filter} on a column that an earlier {@code select} dropped.
	 */
	private static void checkFilterAfterSelect(Program program, List<String> warnings) {
		SelectAst lastSelect = null;
		int lastSelectIndex = -1;
		for (int i = 0; i < program.size(); i++) {
			CommandAst command = program.get(i);
			if (command instanceof SelectAst) {
				lastSelect = (SelectAst) command;
				lastSelectIndex = i;
			} else if (command instanceof FilterAst && lastSelect != null) {
				String column = ((FilterAst) command).getColumn();
				if (!lastSelect.getColumns().contains(column)) {
					warnings.add("Command at position " + (i + 1) + ": Filter on '" + column
							+ "' may fail because 'select' at position " + (lastSelectIndex + 1)
							+ " doesn't include this column. Consider filtering before selecting columns, or include '"
							+ column + "' in select.");
				}
			}
		}
	}

	/**
	 * Rows skipped before the header of the file loaded at {@code loadIndex}:
	 * the count of a {@code skip} that follows it, with only {@code trim} and
	 * {@code clean} commands in between.
	 */
	static int skipRowsAfter(Program program, int loadIndex) {
		for (int j = loadIndex + 1; j < program.size(); j++) {
			CommandAst command = program.get(j);
			if (command instanceof SkipAst) {
				return ((SkipAst) command).getRowCount();
			}
			if (!(command instanceof TrimAst) && !(command instanceof CleanAst)) {
				break;
			}
		}
		return 0;
	}

	private static String describe(Set<String> columns) {
		return String.join(", ", new TreeSet<String>(columns));
	}

	/**
	 * Checks one command against the state left by the commands before it,
	 * and returns the state after it.
	 */
	private class CommandChecker implements CommandAstVisitor<AnalysisState> {

		private final Program program;
		private final int index;
		private final boolean hasLoad;
		private final AnalysisState state;
		private final List<String> errors;
		private final List<String> warnings;

		CommandChecker(Program program, int index, boolean hasLoad, AnalysisState state, List<String> errors, List<String> warnings) {
			this.program = program;
			this.index = index;
			this.hasLoad = hasLoad;
			this.state = state;
			this.errors = errors;
			this.warnings = warnings;
		}

		private int position() {
			return index + 1;
		}

		/**
		 * Reports a command that runs before any table is loaded. A program without
		 * any {@code load} only gets the error of the final check.
		 */
		private boolean requireLoad(CommandAst command) {
			if (!state.isLoaded()) {
				if (!hasLoad) {
					return false;
				}
				errors.add("'" + command.getKind().getKeyword() + "' at position " + position() + " used before 'load'");
				return false;
			}
			return true;
		}

		/**
		 * @return the columns to check references against, or {@code null} if no check applies
		 */
		private Set<String> checkedColumns() {
			return validateColumns ? state.getAvailableColumns() : null;
		}

		private Path toPath(String filename) {
			try {
				return Paths.get(filename);
			} catch (InvalidPathException e) {
				errors.add("Invalid path '" + filename + "': " + e.getReason());
				return null;
			}
		}

		@Override
		public AnalysisState visitLoad(LoadAst load) {
			if (index != 0) {
				warnings.add("'load' should be the first command (found at position " + position() + ")");
			}
			if (!validateFiles && !validateColumns) {
				return state.load(null);
			}
			Path file = toPath(load.getFilename());
			if (file == null) {
				return state.load(null);
			}
			if (validateFiles && !Files.exists(file)) {
				errors.add("File not found: " + load.getFilename());
				return state.load(null);
			}
			if (!validateColumns) {
				return state.load(null);
			}
			int skipRows = skipRowsAfter(program, index);
			try {
				List<String> header = headerReader.readHeader(file, skipRows);
				LOG.debug("Columns of {} (skipping {} rows): {}", load.getFilename(), skipRows, header);
				return state.load(header);
			} catch (IOException e) {
				errors.add("Cannot read headers from " + load.getFilename() + ": " + e.getMessage());
				return state.load(null);
			}
		}

		@Override
		public AnalysisState visitSave(SaveAst save) {
			requireLoad(save);
			if (validateFiles) {
				Path file = toPath(save.getFilename());
				Path parent = file == null ? null : file.getParent();
				if (parent != null && !Files.isDirectory(parent)) {
					warnings.add("Output directory may not exist: " + parent);
				}
			}
			return state.save();
		}

		@Override
		public AnalysisState visitSkip(SkipAst skip) {
			requireLoad(skip);
			return state;
		}

		@Override
		public AnalysisState visitTrim(TrimAst trim) {
			requireLoad(trim);
			return state;
		}

		@Override
		public AnalysisState visitClean(CleanAst clean) {
			requireLoad(clean);
			if (clean.getCleanKind() == CleanKind.MISSING && clean.getStrategy() == null) {
				errors.add("Invalid strategy for 'clean missing' at position " + position() + " - must be drop, ffill or bfill");
			} else if (clean.getCleanKind() == CleanKind.FILL_NA) {
				Set<String> columns = checkedColumns();
				if (columns != null && !columns.contains(clean.getColumn())) {
					warnings.add("'fillna' for column '" + clean.getColumn() + "' - column may not exist at this point");
				}
			}
			return state;
		}

		@Override
		public AnalysisState visitFilter(FilterAst filter) {
			if (!requireLoad(filter)) {
				return state;
			}
			Set<String> columns = checkedColumns();
			if (columns != null && !columns.contains(filter.getColumn())) {
				errors.add("Column '" + filter.getColumn() + "' not available at filter position " + position()
						+ ". Available columns: " + describe(columns));
			}
			if (filter.getOperator() == null) {
				errors.add("Invalid operator in filter at position " + position());
			}
			return state;
		}

		@Override
		public AnalysisState visitSelect(SelectAst select) {
			requireLoad(select);
			Set<String> known = validateColumns ? state.getKnownColumns() : null;
			if (known != null) {
				for (String column : select.getColumns()) {
					if (!known.contains(column)) {
						errors.add("Column '" + column + "' does not exist in loaded data");
					}
				}
			}
			return state.select(select.getColumns());
		}

		@Override
		public AnalysisState visitSort(SortAst sort) {
			requireLoad(sort);
			Set<String> columns = checkedColumns();
			if (columns != null && !columns.contains(sort.getColumn())) {
				errors.add("Cannot sort by '" + sort.getColumn() + "' - column not available at this point. Available columns: "
						+ describe(columns));
			}
			if (sort.getOrder() == null) {
				errors.add("Invalid sort order at position " + position() + " - must be 'asc' or 'desc'");
			}
			return state;
		}

		@Override
		public AnalysisState visitRename(RenameAst rename) {
			requireLoad(rename);
			Set<String> columns = checkedColumns();
			if (columns == null) {
				return state;
			}
			if (!columns.contains(rename.getOldName())) {
				errors.add("Cannot rename '" + rename.getOldName() + "' - column does not exist");
				return state;
			}
			return state.rename(rename.getOldName(), rename.getNewName());
		}

		@Override
		public AnalysisState visitGroupBy(GroupByAst groupBy) {
			requireLoad(groupBy);
			Set<String> columns = checkedColumns();
			if (columns != null) {
				if (!columns.contains(groupBy.getByColumn())) {
					errors.add("Cannot group by '" + groupBy.getByColumn() + "' - column not available. Available columns: "
							+ describe(columns));
				}
				if (!columns.contains(groupBy.getAggregateColumn())) {
					errors.add("Cannot aggregate '" + groupBy.getAggregateColumn() + "' - column not available. Available columns: "
							+ describe(columns));
				}
			}
			if (groupBy.getFunction() == null) {
				errors.add("Invalid aggregate function at position " + position() + " - must be one of sum, avg, count, max, min");
				return state;
			}
			if (columns == null) {
				return state;
			}
			List<String> result = new ArrayList<String>(2);
			result.add(groupBy.getByColumn());
			result.add(groupBy.getFunction().resultColumn(groupBy.getAggregateColumn()));
			return state.reshape(result);
		}
	}
}
