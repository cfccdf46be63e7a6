package org.metricshub.dtl;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.dtl.frontend.LexerException;
import org.metricshub.dtl.frontend.ParserException;
import org.metricshub.dtl.frontend.TokenType;
import org.metricshub.dtl.frontend.ast.Program;
import org.metricshub.dtl.util.DtlSettings;
import org.metricshub.dtl.util.ScriptFileSource;
import org.metricshub.dtl.util.ScriptSource;

public class DtlTest {

	private static final String EXAMPLE = "load \"t.csv\"\n"
			+ "skip 2\n"
			+ "trim\n"
			+ "clean missing drop\n"
			+ "fillna age 0\n"
			+ "select name, age, salary\n"
			+ "filter salary > 70000\n"
			+ "sort by salary desc\n"
			+ "save \"out.csv\"\n";

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static Dtl withoutFileCheck() {
		DtlSettings settings = new DtlSettings();
		settings.setValidateFiles(false);
		return new Dtl(settings);
	}

	private static String resource(String name) throws IOException {
		try (InputStream in = DtlTest.class.getResourceAsStream(name)) {
			if (in == null) {
				throw new IOException("Resource not found: " + name);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	/**
	 * Copies the employees data file into the temporary folder and points the script at it.
	 */
	private ScriptSource scriptOnCopiedData(String script) throws IOException {
		Path data = folder.getRoot().toPath().resolve("employees.csv");
		Files.write(data, resource("/data/employees.csv").getBytes(StandardCharsets.UTF_8));
		String text = resource(script)
				.replace("\"employees.csv\"", "\"" + data + "\"")
				.replace("\"output/", "\"" + folder.getRoot().toPath().resolve("output") + "/");
		Files.createDirectories(folder.getRoot().toPath().resolve("output"));
		return new ScriptSource(script, new StringReader(text));
	}

	@Test
	public void testCompileExample() {
		CompilationResult result = withoutFileCheck().compile(EXAMPLE);
		assertTrue(result.getReport().getErrors().toString(), result.isSuccessful());
		assertEquals(9, result.getProgram().size());
		assertEquals(TokenType.EOF, result.getTokens().get(result.getTokens().size() - 1).getType());
		String code = result.getCode();
		assertTrue(code, code.contains("pd.read_csv('t.csv', skiprows=2,"));
		assertTrue(code, code.contains("df = df[['name', 'age', 'salary']]"));
		assertTrue(code, code.contains("df = df.sort_values(by='salary', ascending=False)"));
	}

	@Test
	public void testDefaultSettingsCheckFiles() {
		CompilationResult result = new Dtl().compile(EXAMPLE);
		assertFalse(result.isSuccessful());
		assertNull(result.getCode());
		assertEquals("File not found: t.csv", result.getReport().getErrors().get(0));
		assertEquals(9, result.getProgram().size());
	}

	@Test
	public void testLexicalAndSyntaxErrorsAbort() {
		Dtl dtl = withoutFileCheck();
		assertThrows(LexerException.class, () -> dtl.compile("load \"a.csv\"\nfilter a ~ 1"));
		assertThrows(ParserException.class, () -> dtl.compile("load \"a.csv\"\nselect"));
		DtlException e = assertThrows(DtlException.class, () -> dtl.compile("load \"a.csv\"\n\nsort a"));
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testStrictStringsSetting() {
		assertTrue(withoutFileCheck().compile("load \"a.csv\nsave \"b.csv\"").isSuccessful());
		DtlSettings settings = new DtlSettings();
		settings.setStrictStrings(true);
		assertThrows(LexerException.class, () -> new Dtl(settings).compile("load \"a.csv\nsave \"b.csv\""));
	}

	@Test
	public void testPhasesCanRunSeparately() {
		Dtl dtl = withoutFileCheck();
		Program program = dtl.parse(EXAMPLE);
		assertEquals(program, dtl.parse(program.toSource()));
		assertTrue(dtl.analyze(program).isValid());
		assertEquals(dtl.compile(EXAMPLE).getCode(), dtl.generate(program));
		assertFalse("generation does not need a valid program", dtl.generate(dtl.parse("trim")).isEmpty());
	}

	@Test
	public void testCompileScriptFromResources() throws Exception {
		String script = resource("/scripts/employees.dtl");
		CompilationResult result = withoutFileCheck().compile(new ScriptSource("employees.dtl", new StringReader(script)));
		assertTrue(result.isSuccessful());
		assertTrue(result.getCode().contains("df.to_csv('output/high_earners.csv', index=False)"));
	}

	@Test
	public void testColumnValidationOnRealData() throws Exception {
		DtlSettings settings = new DtlSettings();
		settings.setValidateColumns(true);
		Dtl dtl = new Dtl(settings);
		CompilationResult result = dtl.compile(scriptOnCopiedData("/scripts/employees.dtl"));
		assertEquals(0, result.getReport().getErrors().size());
		assertEquals(0, result.getReport().getWarnings().size());
		result = dtl.compile(scriptOnCopiedData("/scripts/department_totals.dtl"));
		assertTrue(result.getReport().getErrors().toString(), result.isSuccessful());
		assertTrue(result.getCode().contains("df.columns = ['department', 'salary_mean']"));
	}

	@Test
	public void testCompileToFileCreatesDirectories() throws Exception {
		Path script = folder.newFile("job.dtl").toPath();
		Files.write(script, EXAMPLE.getBytes(StandardCharsets.UTF_8));
		Path output = folder.getRoot().toPath().resolve("gen").resolve("nested").resolve("job.py");
		CompilationResult result = withoutFileCheck().compileToFile(new ScriptFileSource(script), output);
		assertTrue(Files.exists(output));
		assertEquals(result.getCode(), new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
	}

	@Test
	public void testInvalidProgramIsNotWritten() throws Exception {
		Path output = folder.getRoot().toPath().resolve("never.py");
		CompilationResult result = withoutFileCheck().compileToFile(ScriptSource.of("trim"), output);
		assertFalse(result.isSuccessful());
		assertFalse(Files.exists(output));
	}

	@Test
	public void testMissingScriptFile() {
		Path missing = folder.getRoot().toPath().resolve("missing.dtl");
		IOException e = assertThrows(IOException.class, () -> new Dtl().compile(new ScriptFileSource(missing)));
		assertTrue(e.getMessage(), e.getMessage().contains(missing.toString()));
		assertThrows(IOException.class, () -> new Dtl().compile(new ScriptFileSource(missing.toString())));
	}

	@Test
	public void testScriptSourceReadFully() throws Exception {
		ScriptSource source = new ScriptSource("crlf", new InputStreamReader(
				new ByteArrayInputStream("trim\r\nclean duplicates".getBytes(StandardCharsets.UTF_8)),
				StandardCharsets.UTF_8));
		assertEquals("trim\nclean duplicates\n", source.readFully());
	}
}
