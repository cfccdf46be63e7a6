package org.metricshub.dtl.backend;

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

import static org.metricshub.dtl.backend.PythonLiterals.quote;
import static org.metricshub.dtl.backend.PythonLiterals.unquote;

import java.util.ArrayList;
import java.util.List;
import org.metricshub.dtl.frontend.ast.AggregateFunction;
import org.metricshub.dtl.frontend.ast.CleanAst;
import org.metricshub.dtl.frontend.ast.CommandAstVisitor;
import org.metricshub.dtl.frontend.ast.ComparisonOperator;
import org.metricshub.dtl.frontend.ast.FilterAst;
import org.metricshub.dtl.frontend.ast.GroupByAst;
import org.metricshub.dtl.frontend.ast.Literal;
import org.metricshub.dtl.frontend.ast.LoadAst;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.frontend.ast.RenameAst;
import org.metricshub.dtl.frontend.ast.SaveAst;
import org.metricshub.dtl.frontend.ast.SelectAst;
import org.metricshub.dtl.frontend.ast.SkipAst;
import org.metricshub.dtl.frontend.ast.SortAst;
import org.metricshub.dtl.frontend.ast.SortOrder;
import org.metricshub.dtl.frontend.ast.TrimAst;
import org.metricshub.dtl.util.DtlLogger;
import org.slf4j.Logger;

/**
 * Translates a {@link Program} into a standalone pandas script.
 * <p>
 * The script keeps the current table in a variable named {@code df}. Each
 * command becomes a comment, its statements, a progress message and a blank
 * line. A {@code skip} that directly follows the first {@code load} is
 * applied while reading the file, as {@code skiprows}; any other
 * {@code skip} is only commented.
 * <p>
 * The generator does not require a valid program: a program rejected by the
 * semantic analyzer still yields a script, which may fail when run.
 * The output depends on the program only.
 */
public class CodeGenerator {

	private static final Logger LOG = DtlLogger.getLogger(CodeGenerator.class);

	static final String DF = "df";

	/**
	 * Generate the script.
	 *
	 * @param program the program to translate
	 * @return the script text, lines separated by {@code \n}
	 */
	public String generate(Program program) {
		Emitter emitter = new Emitter(foldedSkipIndex(program), foldedSkipRows(program));
		emitter.header();
		for (int i = 0; i < program.size(); i++) {
			emitter.index = i;
			program.get(i).accept(emitter);
		}
		LOG.debug("Generated {} lines for {} commands", emitter.lines.size(), program.size());
		return String.join("\n", emitter.lines);
	}

	/**
	 * @return the position of the {@code skip} folded into the first {@code load}, or -1
	 */
	static int foldedSkipIndex(Program program) {
		for (int i = 0; i < program.size(); i++) {
			if (program.get(i) instanceof LoadAst) {
				return i + 1 < program.size() && program.get(i + 1) instanceof SkipAst ? i + 1 : -1;
			}
		}
		return -1;
	}

	private static int foldedSkipRows(Program program) {
		int index = foldedSkipIndex(program);
		return index < 0 ? 0 : ((SkipAst) program.get(index)).getRowCount();
	}

	/**
	 * Accumulates the lines of one generation.
	 */
	private static final class Emitter implements CommandAstVisitor<Void> {

		private final List<String> lines = new ArrayList<String>();
		private final int foldedSkipIndex;
		private final int skipRows;
		private int index;
		private boolean firstLoadDone;

		Emitter(int foldedSkipIndex, int skipRows) {
			this.foldedSkipIndex = foldedSkipIndex;
			this.skipRows = skipRows;
		}

		private void line(String text) {
			lines.add(text);
		}

		private void comment(String text) {
			lines.add("# " + PythonLiterals.comment(text));
		}

		private void progress(String fString) {
			lines.add("print(f'" + fString + "')");
		}

		private void message(String text) {
			lines.add("print(" + quote(text) + ")");
		}

		private void end() {
			lines.add("");
		}

		private static String column(String name) {
			return DF + "[" + quote(unquote(name)) + "]";
		}

		void header() {
			line("import pandas as pd");
			line("import numpy as np");
			line("import warnings");
			line("warnings.filterwarnings('ignore')");
			end();
		}

		@Override
		public Void visitLoad(LoadAst load) {
			String file = quote(unquote(load.getFilename()));
			comment("Load data from " + unquote(load.getFilename()));
			if (!firstLoadDone && skipRows > 0) {
				line(DF + " = pd.read_csv(" + file + ", skiprows=" + skipRows + ", on_bad_lines='skip', engine='python')");
				progress("Loaded {len(" + DF + ")} rows (skipped first " + skipRows + " rows)");
			} else {
				line(DF + " = pd.read_csv(" + file + ", on_bad_lines='skip', engine='python')");
				progress("Loaded {len(" + DF + ")} rows");
			}
			firstLoadDone = true;
			end();
			return null;
		}

		@Override
		public Void visitSave(SaveAst save) {
			String file = unquote(save.getFilename());
			comment("Save results to " + file);
			line(DF + ".to_csv(" + quote(file) + ", index=False)");
			message("Data saved to " + file);
			end();
			return null;
		}

		@Override
		public Void visitSkip(SkipAst skip) {
			if (index == foldedSkipIndex) {
				comment("Skip handled in load (skiprows=" + skipRows + ")");
			} else {
				comment("skip " + skip.getRowCount() + " has no effect here: only a skip directly after the first load is applied");
			}
			end();
			return null;
		}

		@Override
		public Void visitTrim(TrimAst trim) {
			comment("Trim whitespace from all string columns");
			line("for col in " + DF + ".select_dtypes(include=['object', 'string']).columns:");
			line("    if " + DF + "[col].dtype == 'object':");
			line("        " + DF + "[col] = " + DF + "[col].astype(str).str.strip()");
			line("print('Trimmed whitespace from string columns')");
			end();
			return null;
		}

		@Override
		public Void visitClean(CleanAst clean) {
			switch (clean.getCleanKind()) {
			case MISSING:
				missing(clean);
				break;
			case DUPLICATES:
				comment("Remove duplicate rows");
				line(DF + " = " + DF + ".drop_duplicates()");
				progress("After removing duplicates: {len(" + DF + ")} rows");
				break;
			case FILL_NA:
				fillNa(clean);
				break;
			default:
				throw new IllegalStateException("Unknown clean kind " + clean.getCleanKind());
			}
			end();
			return null;
		}

		private void missing(CleanAst clean) {
			if (clean.getStrategy() == null) {
				comment("No missing-value strategy given, rows are kept");
			} else {
				switch (clean.getStrategy()) {
				case DROP:
					comment("Drop rows with any missing values");
					line(DF + " = " + DF + ".dropna()");
					break;
				case FORWARD_FILL:
					comment("Forward fill missing values");
					line(DF + " = " + DF + ".ffill()");
					break;
				case BACKWARD_FILL:
					comment("Backward fill missing values");
					line(DF + " = " + DF + ".bfill()");
					break;
				default:
					throw new IllegalStateException("Unknown strategy " + clean.getStrategy());
				}
			}
			progress("After cleaning: {len(" + DF + ")} rows");
		}

		private void fillNa(CleanAst clean) {
			String name = unquote(clean.getColumn());
			comment("Fill missing values in '" + name + "'");
			line("if " + quote(name) + " in " + DF + ".columns:");
			line("    " + column(name) + " = " + column(name) + ".fillna(" + fillValue(clean.getValue()) + ")");
			line("else:");
			line("    print(" + quote("Warning: Column '" + name + "' not found in dataframe") + ")");
		}

		private static String fillValue(Literal value) {
			if (value.getKind() == Literal.Kind.MISSING) {
				return "np.nan";
			}
			String text = unquote(value.getText());
			return PythonLiterals.isNumber(text) ? PythonLiterals.number(text) : quote(text);
		}

		@Override
		public Void visitFilter(FilterAst filter) {
			String name = unquote(filter.getColumn());
			ComparisonOperator operator = filter.getOperator() == null ? ComparisonOperator.EQ : filter.getOperator();
			Literal value = filter.getValue();
			comment("Filter: " + name + " " + operator.getSymbol() + " " + value.toSource());
			if (value.getKind() == Literal.Kind.MISSING && operator == ComparisonOperator.EQ) {
				line(DF + " = " + DF + "[" + column(name) + ".isna()]");
			} else if (value.getKind() == Literal.Kind.MISSING && operator == ComparisonOperator.NE) {
				line(DF + " = " + DF + "[" + column(name) + ".notna()]");
			} else {
				line(DF + " = " + DF + "[" + column(name) + " " + operator.getSymbol() + " " + filterValue(value) + "]");
			}
			progress("After filter: {len(" + DF + ")} rows");
			end();
			return null;
		}

		private static String filterValue(Literal value) {
			switch (value.getKind()) {
			case NUMBER:
				return PythonLiterals.number(value.getText());
			case MISSING:
				return "np.nan";
			default:
				return quote(unquote(value.getText()));
			}
		}

		@Override
		public Void visitSelect(SelectAst select) {
			List<String> columns = new ArrayList<String>(select.getColumns().size());
			for (String name : select.getColumns()) {
				columns.add(quote(unquote(name)));
			}
			comment("Select columns");
			line(DF + " = " + DF + "[[" + String.join(", ", columns) + "]]");
			progress("Selected {len(" + DF + ".columns)} columns");
			end();
			return null;
		}

		@Override
		public Void visitSort(SortAst sort) {
			String name = unquote(sort.getColumn());
			SortOrder order = sort.getOrder() == null ? SortOrder.ASC : sort.getOrder();
			comment("Sort by " + name + " (" + order.getKeyword() + ")");
			line(DF + " = " + DF + ".sort_values(by=" + quote(name) + ", ascending=" + (order == SortOrder.ASC ? "True" : "False") + ")");
			line(DF + " = " + DF + ".reset_index(drop=True)");
			message("Sorted by " + name);
			end();
			return null;
		}

		@Override
		public Void visitRename(RenameAst rename) {
			String oldName = unquote(rename.getOldName());
			String newName = unquote(rename.getNewName());
			comment("Rename column '" + oldName + "' to '" + newName + "'");
			line("if " + quote(oldName) + " in " + DF + ".columns:");
			line("    " + DF + " = " + DF + ".rename(columns={" + quote(oldName) + ": " + quote(newName) + "})");
			line("else:");
			line("    print(" + quote("Warning: Column '" + oldName + "' not found") + ")");
			end();
			return null;
		}

		@Override
		public Void visitGroupBy(GroupByAst groupBy) {
			String by = unquote(groupBy.getByColumn());
			String aggregate = unquote(groupBy.getAggregateColumn());
			AggregateFunction function = groupBy.getFunction() == null ? AggregateFunction.SUM : groupBy.getFunction();
			comment("Group by " + by + " and " + function.getKeyword() + " " + aggregate);
			line(DF + " = " + DF + ".groupby(" + quote(by) + ")[" + quote(aggregate) + "]." + function.getEngineFunction() + "().reset_index()");
			line(DF + ".columns = [" + quote(by) + ", " + quote(function.resultColumn(aggregate)) + "]");
			message("Grouped by " + by);
			end();
			return null;
		}
	}
}
