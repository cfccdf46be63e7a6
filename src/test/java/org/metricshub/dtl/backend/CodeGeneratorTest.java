package org.metricshub.dtl.backend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.dtl.frontend.DtlLexer;
import org.metricshub.dtl.frontend.DtlParser;
import org.metricshub.dtl.frontend.ast.CleanAst;
import org.metricshub.dtl.frontend.ast.FilterAst;
import org.metricshub.dtl.frontend.ast.GroupByAst;
import org.metricshub.dtl.frontend.ast.Literal;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.frontend.ast.SortAst;

public class CodeGeneratorTest {

	private static final String HEADER = "import pandas as pd\n"
			+ "import numpy as np\n"
			+ "import warnings\n"
			+ "warnings.filterwarnings('ignore')\n";

	private static Program parse(String source) {
		return new DtlParser("test").parse(new DtlLexer("test").tokenize(source));
	}

	private static String generate(String source) {
		return new CodeGenerator().generate(parse(source));
	}

	private static List<String> lines(String source) {
		return Arrays.asList(generate(source).split("\n", -1));
	}

	private static void assertLine(String expected, List<String> lines) {
		assertTrue("Missing <" + expected + "> in:\n" + String.join("\n", lines), lines.contains(expected));
	}

	@Test
	public void testEmptyProgramIsJustTheHeader() {
		assertEquals(HEADER, generate(""));
	}

	@Test
	public void testExampleScript() {
		String code = generate(
				"load \"t.csv\"\nskip 2\ntrim\nclean missing drop\nfillna age 0\n"
						+ "select name, age, salary\nfilter salary > 70000\nsort by salary desc\nsave \"out.csv\"\n");
		List<String> lines = Arrays.asList(code.split("\n", -1));
		assertTrue(code.startsWith(HEADER));
		assertLine("df = pd.read_csv('t.csv', skiprows=2, on_bad_lines='skip', engine='python')", lines);
		assertLine("# Skip handled in load (skiprows=2)", lines);
		assertLine("df = df.dropna()", lines);
		assertLine("    df['age'] = df['age'].fillna(0)", lines);
		assertLine("df = df[['name', 'age', 'salary']]", lines);
		assertLine("df = df[df['salary'] > 70000]", lines);
		assertLine("df = df.sort_values(by='salary', ascending=False)", lines);
		assertLine("df.to_csv('out.csv', index=False)", lines);
		assertFalse("skip is never a row slice", code.contains("iloc"));
		assertTrue("commands appear in order", code.indexOf("dropna") < code.indexOf("sort_values"));
	}

	@Test
	public void testEachCommandIsCommentedAndSeparated() {
		List<String> lines = lines("load \"a.csv\"\ntrim");
		assertEquals(
				Arrays.asList(
						"import pandas as pd",
						"import numpy as np",
						"import warnings",
						"warnings.filterwarnings('ignore')",
						"",
						"# Load data from a.csv",
						"df = pd.read_csv('a.csv', on_bad_lines='skip', engine='python')",
						"print(f'Loaded {len(df)} rows')",
						"",
						"# Trim whitespace from all string columns",
						"for col in df.select_dtypes(include=['object', 'string']).columns:",
						"    if df[col].dtype == 'object':",
						"        df[col] = df[col].astype(str).str.strip()",
						"print('Trimmed whitespace from string columns')",
						""),
				lines);
	}

	@Test
	public void testSkipIsOnlyFoldedDirectlyAfterFirstLoad() {
		List<String> lines = lines("load \"a.csv\"\ntrim\nskip 2");
		assertLine("df = pd.read_csv('a.csv', on_bad_lines='skip', engine='python')", lines);
		assertLine("# skip 2 has no effect here: only a skip directly after the first load is applied", lines);

		lines = lines("load \"a.csv\"\nskip 1\nskip 4\nload \"b.csv\"\nskip 3");
		assertLine("df = pd.read_csv('a.csv', skiprows=1, on_bad_lines='skip', engine='python')", lines);
		assertLine("# Skip handled in load (skiprows=1)", lines);
		assertLine("# skip 4 has no effect here: only a skip directly after the first load is applied", lines);
		assertLine("df = pd.read_csv('b.csv', on_bad_lines='skip', engine='python')", lines);
		assertLine("# skip 3 has no effect here: only a skip directly after the first load is applied", lines);
	}

	@Test
	public void testSkipZeroIsNotAReadOption() {
		List<String> lines = lines("load \"a.csv\"\nskip 0");
		assertLine("df = pd.read_csv('a.csv', on_bad_lines='skip', engine='python')", lines);
	}

	@Test
	public void testFilterOperatorsAreKept() {
		assertLine("df = df[df['col'] > 5]", lines("filter col > 5"));
		assertLine("df = df[df['col'] >= -2.5]", lines("filter col >= -2.5"));
		assertLine("df = df[df['col'] != 0]", lines("filter col != 0"));
		assertLine("df = df[df['dept'] == 'Sales']", lines("filter dept == Sales"));
		assertLine("df = df[df['dept'] == 'Sales']", lines("filter dept == \"Sales\""));
		assertLine("df = df[df['name'] == 'O\\'Brien']", lines("filter name == \"O'Brien\""));
		assertLine("# Filter: col > 5", lines("filter col > 5"));
	}

	@Test
	public void testFilterOnMissingValue() {
		assertLine("df = df[df['age'].isna()]", lines("filter age == NaN"));
		assertLine("df = df[df['age'].notna()]", lines("filter age != NaN"));
		assertLine("df = df[df['age'] > np.nan]", lines("filter age > NaN"));
	}

	@Test
	public void testCleanStrategiesAreDistinct() {
		assertLine("df = df.dropna()", lines("clean missing drop"));
		assertLine("df = df.ffill()", lines("clean missing ffill"));
		assertLine("df = df.bfill()", lines("clean missing bfill"));
		assertLine("df = df.drop_duplicates()", lines("clean duplicates"));
	}

	@Test
	public void testFillnaValues() {
		assertLine("    df['age'] = df['age'].fillna(0)", lines("fillna age 0"));
		assertLine("    df['age'] = df['age'].fillna(7)", lines("fillna age 007"));
		assertLine("    df['age'] = df['age'].fillna(np.nan)", lines("fillna age NaN"));
		assertLine("    df['city'] = df['city'].fillna('unknown')", lines("fillna city unknown"));
		assertLine("    df['city'] = df['city'].fillna('New York')", lines("fillna city \"New York\""));
		assertLine("    df['zip'] = df['zip'].fillna(12345)", lines("fillna zip '12345'"));
	}

	@Test
	public void testFillnaIsGuarded() {
		List<String> lines = lines("fillna age 0");
		assertLine("if 'age' in df.columns:", lines);
		assertLine("else:", lines);
		assertLine("    print('Warning: Column \\'age\\' not found in dataframe')", lines);
	}

	@Test
	public void testRenameIsGuarded() {
		List<String> lines = lines("rename old to new");
		assertLine("if 'old' in df.columns:", lines);
		assertLine("    df = df.rename(columns={'old': 'new'})", lines);
		assertLine("    print('Warning: Column \\'old\\' not found')", lines);
	}

	@Test
	public void testGroupBy() {
		List<String> lines = lines("group by dept avg salary");
		assertLine("df = df.groupby('dept')['salary'].mean().reset_index()", lines);
		assertLine("df.columns = ['dept', 'salary_mean']", lines);
		lines = lines("group by dept count id");
		assertLine("df = df.groupby('dept')['id'].count().reset_index()", lines);
		assertLine("df.columns = ['dept', 'id_count']", lines);
	}

	@Test
	public void testSort() {
		List<String> lines = lines("sort by age");
		assertLine("df = df.sort_values(by='age', ascending=True)", lines);
		assertLine("df = df.reset_index(drop=True)", lines);
	}

	@Test
	public void testSaveMessageIsNotAnFString() {
		List<String> lines = lines("save \"out/{year}.csv\"");
		assertLine("df.to_csv('out/{year}.csv', index=False)", lines);
		assertLine("print('Data saved to out/{year}.csv')", lines);
	}

	@Test
	public void testInvalidProgramsStillGenerate() {
		Program program = new Program(
				Arrays.asList(
						CleanAst.missing(null),
						new FilterAst("a", null, Literal.number("1")),
						new SortAst("a", null),
						new GroupByAst("a", null, "b")));
		List<String> lines = Arrays.asList(new CodeGenerator().generate(program).split("\n", -1));
		assertLine("df = df[df['a'] == 1]", lines);
		assertLine("df = df.sort_values(by='a', ascending=True)", lines);
		assertLine("df = df.groupby('a')['b'].sum().reset_index()", lines);
	}

	@Test
	public void testGenerationIsDeterministic() {
		String source = "load \"a.csv\"\nskip 1\nfillna x 1\nselect x, y\ngroup by x max y\nsave \"b.csv\"";
		Program program = parse(source);
		CodeGenerator generator = new CodeGenerator();
		assertEquals(generator.generate(program), generator.generate(program));
		assertEquals(generator.generate(program), new CodeGenerator().generate(parse(source)));
	}
}
