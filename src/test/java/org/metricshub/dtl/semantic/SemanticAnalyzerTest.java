package org.metricshub.dtl.semantic;

import static org.junit.Assert.*;
import static org.metricshub.dtl.DtlTestSupport.dtlTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.dtl.frontend.DtlLexer;
import org.metricshub.dtl.frontend.DtlParser;
import org.metricshub.dtl.frontend.ast.CleanAst;
import org.metricshub.dtl.frontend.ast.FilterAst;
import org.metricshub.dtl.frontend.ast.GroupByAst;
import org.metricshub.dtl.frontend.ast.Literal;
import org.metricshub.dtl.frontend.ast.LoadAst;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.frontend.ast.SaveAst;
import org.metricshub.dtl.frontend.ast.SortAst;

public class SemanticAnalyzerTest {

	private static final String NO_SAVE = "Program has no 'save' command - results won't be saved";

	private static final String[] EMPLOYEES = { "name,age,salary,dept", "Alice,30,85000,IT", "Bob,45,62000,Sales" };

	private static Program parse(String source) {
		return new DtlParser("test").parse(new DtlLexer("test").tokenize(source));
	}

	private static AnalysisReport analyze(String source) {
		return new SemanticAnalyzer(false, false).analyze(parse(source));
	}

	@Test
	public void testExampleScriptIsValid() {
		AnalysisReport report = analyze(
				"load \"t.csv\"\nskip 2\ntrim\nclean missing drop\nfillna age 0\n"
						+ "select name, age, salary\nfilter salary > 70000\nsort by salary desc\nsave \"out.csv\"\n");
		assertTrue(report.getErrors().toString(), report.isValid());
		assertEquals(Collections.emptyList(), report.getWarnings());
	}

	@Test
	public void testMissingLoadIsASingleError() {
		AnalysisReport report = analyze("trim\nfilter a == 1\nselect a\nsort by a\nsave \"o.csv\"");
		assertEquals(Arrays.asList("Program requires a 'load' command"), report.getErrors());
		assertFalse(report.isValid());
	}

	@Test
	public void testEmptyProgram() {
		AnalysisReport report = analyze("");
		assertEquals(Arrays.asList("Program requires a 'load' command"), report.getErrors());
		assertEquals(Arrays.asList("Empty program - no commands found", NO_SAVE), report.getWarnings());
	}

	@Test
	public void testCommandsBeforeLoad() {
		AnalysisReport report = analyze("skip 1\nfilter a == 1\nload \"x.csv\"\nsave \"o.csv\"");
		assertEquals(
				Arrays.asList("'skip' at position 1 used before 'load'", "'filter' at position 2 used before 'load'"),
				report.getErrors());
		assertEquals(Arrays.asList("'load' should be the first command (found at position 3)"), report.getWarnings());
	}

	@Test
	public void testLaterLoadIsOnlyAWarning() {
		AnalysisReport report = analyze("load \"a.csv\"\nsave \"a2.csv\"\nload \"b.csv\"\nsave \"b2.csv\"");
		assertTrue(report.isValid());
		assertEquals(Arrays.asList("'load' should be the first command (found at position 3)"), report.getWarnings());
	}

	@Test
	public void testMissingSaveIsAWarning() {
		AnalysisReport report = analyze("load \"a.csv\"\ntrim");
		assertTrue(report.isValid());
		assertEquals(Arrays.asList(NO_SAVE), report.getWarnings());
	}

	@Test
	public void testFilterAfterSelectWarning() {
		AnalysisReport report = analyze("load \"a.csv\"\nselect a, b\nfilter c == 1\nsave \"o.csv\"");
		assertTrue("without column validation this is only a warning", report.isValid());
		assertEquals(
				Arrays.asList(
						"Command at position 3: Filter on 'c' may fail because 'select' at position 2 doesn't include this column. "
								+ "Consider filtering before selecting columns, or include 'c' in select."),
				report.getWarnings());
	}

	@Test
	public void testOnlyTheLatestSelectCounts() {
		AnalysisReport report = analyze("load \"a.csv\"\nselect a\nselect a, c\nfilter c == 1\nsave \"o.csv\"");
		assertEquals(Collections.emptyList(), report.getWarnings());
	}

	@Test
	public void testInvalidEnumeratedFields() {
		Program program = new Program(
				Arrays.asList(
						new LoadAst("a.csv"),
						CleanAst.missing(null),
						new FilterAst("a", null, Literal.number("1")),
						new SortAst("a", null),
						new GroupByAst("a", null, "b"),
						new SaveAst("o.csv")));
		AnalysisReport report = new SemanticAnalyzer(false, false).analyze(program);
		assertEquals(
				Arrays.asList(
						"Invalid strategy for 'clean missing' at position 2 - must be drop, ffill or bfill",
						"Invalid operator in filter at position 3",
						"Invalid sort order at position 4 - must be 'asc' or 'desc'",
						"Invalid aggregate function at position 5 - must be one of sum, avg, count, max, min"),
				report.getErrors());
	}

	@Test
	public void testAnalysisIsIdempotent() {
		Program program = parse("select a\nfilter b > 1\nload \"nowhere.csv\"");
		SemanticAnalyzer analyzer = new SemanticAnalyzer(true, true);
		assertEquals(analyzer.analyze(program), analyzer.analyze(program));
	}

	@Test
	public void testSkipLookahead() {
		Program program = parse("load \"a.csv\"\ntrim\nclean duplicates\nskip 3\nselect a");
		assertEquals(3, SemanticAnalyzer.skipRowsAfter(program, 0));
		program = parse("load \"a.csv\"\nrename a to b\nskip 3");
		assertEquals(0, SemanticAnalyzer.skipRowsAfter(program, 0));
		program = parse("load \"a.csv\"");
		assertEquals(0, SemanticAnalyzer.skipRowsAfter(program, 0));
	}

	@Test
	public void testFileNotFound() throws Exception {
		dtlTest("missing input file")
				.validateColumns()
				.script("load \"{{DIR}}/missing.csv\"", "filter anything > 1", "save \"{{DIR}}/out.csv\"")
				.expectErrors("File not found: {{DIR}}/missing.csv")
				.expectWarnings()
				.runAndAssert();
	}

	@Test
	public void testMissingOutputDirectory() throws Exception {
		dtlTest("missing output directory")
				.file("emp.csv", EMPLOYEES)
				.script("load \"{{DIR}}/emp.csv\"", "save \"{{DIR}}/nope/out.csv\"")
				.expectErrors()
				.expectWarnings("Output directory may not exist: {{DIR}}/nope")
				.runAndAssert();
	}

	@Test
	public void testNoFileCheck() throws Exception {
		dtlTest("file checks disabled")
				.noFileCheck()
				.script("load \"{{DIR}}/missing.csv\"", "save \"{{DIR}}/nope/out.csv\"")
				.expectErrors()
				.expectWarnings()
				.runAndAssert();
	}

	@Test
	public void testColumnNotAvailableAfterSelect() throws Exception {
		dtlTest("filter on a column dropped by select")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script("load \"{{DIR}}/emp.csv\"", "select name, salary", "filter age > 30", "save \"{{DIR}}/out.csv\"")
				.expectErrors("Column 'age' not available at filter position 3. Available columns: name, salary")
				.expectWarnings(
						"Command at position 3: Filter on 'age' may fail because 'select' at position 2 doesn't include this column. "
								+ "Consider filtering before selecting columns, or include 'age' in select.")
				.runAndAssert();
	}

	@Test
	public void testHeaderWithQuotedLineBreak() throws Exception {
		dtlTest("header name spanning two lines")
				.validateColumns()
				.file("multi.csv", "\"first", "line\",b", "1,2")
				.script("load \"{{DIR}}/multi.csv\"", "select b", "save \"{{DIR}}/out.csv\"")
				.expectErrors()
				.runAndAssert();
	}

	@Test
	public void testUnusablePathWithoutFileChecks() {
		String script = "load \"a\0b.csv\"\nsave \"o.csv\"";
		AnalysisReport report = analyze(script);
		assertTrue(report.getErrors().toString(), report.isValid());

		report = new SemanticAnalyzer(true, false).analyze(parse(script));
		assertEquals(1, report.getErrors().size());
		assertTrue(report.getErrors().get(0), report.getErrors().get(0).startsWith("Invalid path 'a"));
	}

	@Test
	public void testSelectUnknownColumn() throws Exception {
		dtlTest("select of a column absent from the file")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script("load \"{{DIR}}/emp.csv\"", "select name, bonus", "save \"{{DIR}}/out.csv\"")
				.expectErrors("Column 'bonus' does not exist in loaded data")
				.runAndAssert();
	}

	@Test
	public void testRenameIsSeenByLaterCommands() throws Exception {
		dtlTest("rename then sort")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script(
						"load \"{{DIR}}/emp.csv\"",
						"rename salary to pay",
						"sort by pay desc",
						"sort by salary",
						"rename bonus to extra",
						"save \"{{DIR}}/out.csv\"")
				.expectErrors(
						"Cannot sort by 'salary' - column not available at this point. Available columns: age, dept, name, pay",
						"Cannot rename 'bonus' - column does not exist")
				.runAndAssert();
	}

	@Test
	public void testRenameInsideSelection() throws Exception {
		dtlTest("rename of a selected column")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script("load \"{{DIR}}/emp.csv\"", "select name, salary", "rename salary to pay", "sort by pay", "save \"{{DIR}}/out.csv\"")
				.expectErrors()
				.expectWarnings()
				.runAndAssert();
	}

	@Test
	public void testGroupByReplacesColumns() throws Exception {
		dtlTest("group by result columns")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script(
						"load \"{{DIR}}/emp.csv\"",
						"group by dept avg salary",
						"sort by salary_mean desc",
						"filter salary > 3",
						"save \"{{DIR}}/out.csv\"")
				.expectErrors("Column 'salary' not available at filter position 4. Available columns: dept, salary_mean")
				.runAndAssert();
	}

	@Test
	public void testGroupByUnknownColumns() throws Exception {
		dtlTest("group by absent columns")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script("load \"{{DIR}}/emp.csv\"", "group by region sum bonus", "save \"{{DIR}}/out.csv\"")
				.expectErrors(
						"Cannot group by 'region' - column not available. Available columns: age, dept, name, salary",
						"Cannot aggregate 'bonus' - column not available. Available columns: age, dept, name, salary")
				.runAndAssert();
	}

	@Test
	public void testFillnaOnUnknownColumnIsAWarning() throws Exception {
		dtlTest("fillna on an absent column")
				.validateColumns()
				.file("emp.csv", EMPLOYEES)
				.script("load \"{{DIR}}/emp.csv\"", "fillna bonus 0", "save \"{{DIR}}/out.csv\"")
				.expectErrors()
				.expectWarnings("'fillna' for column 'bonus' - column may not exist at this point")
				.runAndAssert();
	}

	@Test
	public void testHeaderAfterSkip() throws Exception {
		dtlTest("header read after the skipped rows")
				.validateColumns()
				.file("report.csv", "Sales report", "generated 2024-05-01", "id,amount", "1,10")
				.script("load \"{{DIR}}/report.csv\"", "trim", "skip 2", "filter amount > 5", "save \"{{DIR}}/out.csv\"")
				.expectErrors()
				.expectWarnings()
				.runAndAssert();
	}

	@Test
	public void testRenameStopsSkipLookahead() throws Exception {
		dtlTest("rename between load and skip")
				.validateColumns()
				.file("report.csv", "Sales report", "generated 2024-05-01", "id,amount", "1,10")
				.script("load \"{{DIR}}/report.csv\"", "rename amount to total", "skip 2", "save \"{{DIR}}/out.csv\"")
				.expectErrors("Cannot rename 'amount' - column does not exist")
				.runAndAssert();
	}

	@Test
	public void testUnreadableHeader() throws Exception {
		dtlTest("empty data file")
				.validateColumns()
				.file("empty.csv", "")
				.script("load \"{{DIR}}/empty.csv\"", "filter a > 1", "save \"{{DIR}}/out.csv\"")
				.expectErrors("Cannot read headers from {{DIR}}/empty.csv: No columns to parse from file")
				.runAndAssert();
	}

	@Test
	public void testReportPrint() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		analyze("trim").print(new PrintStream(bytes, true));
		String printed = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(printed, printed.contains("ERRORS (1):"));
		assertTrue(printed, printed.contains("  - Program requires a 'load' command"));
		assertTrue(printed, printed.contains("WARNINGS (1):"));
	}
}
