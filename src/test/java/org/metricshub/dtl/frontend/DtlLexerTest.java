package org.metricshub.dtl.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class DtlLexerTest {

	private static List<Token> tokenize(String source) {
		return new DtlLexer("test").tokenize(source);
	}

	private static List<TokenType> types(String source) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : tokenize(source)) {
			types.add(token.getType());
		}
		return types;
	}

	@Test
	public void testLoadCommand() {
		List<Token> tokens = tokenize("load \"data.csv\"");
		assertEquals(
				Arrays.asList(
						new Token(TokenType.KW_LOAD, "load", 1),
						new Token(TokenType.STRING, "data.csv", 1),
						new Token(TokenType.EOF, "", 1)),
				tokens);
	}

	@Test
	public void testKeywordsAreCaseInsensitive() {
		List<Token> tokens = tokenize("LOAD 'x.csv'\nSort By Age DESC");
		assertEquals(TokenType.KW_LOAD, tokens.get(0).getType());
		assertEquals("LOAD keeps its spelling", "LOAD", tokens.get(0).getText());
		assertEquals(TokenType.KW_SORT, tokens.get(2).getType());
		assertEquals(TokenType.KW_BY, tokens.get(3).getType());
		assertEquals(TokenType.ID, tokens.get(4).getType());
		assertEquals(TokenType.KW_DESC, tokens.get(5).getType());
	}

	@Test
	public void testNanIsCaseSensitive() {
		assertEquals(Arrays.asList(TokenType.NAN, TokenType.EOF), types("NaN"));
		assertEquals(Arrays.asList(TokenType.ID, TokenType.EOF), types("nan"));
		assertEquals(Arrays.asList(TokenType.ID, TokenType.EOF), types("NAN"));
	}

	@Test
	public void testNonAsciiDigitIsNotANumber() {
		// ARABIC-INDIC DIGIT THREE
		LexerException e = assertThrows(LexerException.class, () -> tokenize("filter a > \u0663"));
		assertTrue(e.getMessage(), e.getMessage().contains("Unknown character"));
		assertThrows(LexerException.class, () -> tokenize("skip 1\u0663"));
		assertEquals(
				"a digit inside a name stays part of the name",
				Arrays.asList(TokenType.ID, TokenType.EOF),
				types("col\u0663"));
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = tokenize("10 -5 3.14 -0.5");
		assertEquals("10", tokens.get(0).getText());
		assertEquals("-5", tokens.get(1).getText());
		assertEquals("3.14", tokens.get(2).getText());
		assertEquals("-0.5", tokens.get(3).getText());
		for (int i = 0; i < 4; i++) {
			assertEquals(TokenType.NUMBER, tokens.get(i).getType());
		}
	}

	@Test
	public void testOperators() {
		assertEquals(
				Arrays.asList(
						TokenType.GE,
						TokenType.LE,
						TokenType.EQ,
						TokenType.NE,
						TokenType.GT,
						TokenType.LT,
						TokenType.COMMA,
						TokenType.EOF),
				types(">= <= == != > < ,"));
	}

	@Test
	public void testOperatorsWithoutSpaces() {
		assertEquals(
				Arrays.asList(TokenType.KW_FILTER, TokenType.ID, TokenType.GE, TokenType.NUMBER, TokenType.EOF),
				types("filter age>=30"));
	}

	@Test
	public void testCommentsAndBlankLinesKeepLineNumbers() {
		List<Token> tokens = tokenize("# header comment\n\n   \n  trim  \n# done\n");
		assertEquals(2, tokens.size());
		assertEquals(new Token(TokenType.KW_TRIM, "trim", 4), tokens.get(0));
		assertEquals("EOF takes the line of the last token", 4, tokens.get(1).getLine());
	}

	@Test
	public void testEmptySource() {
		assertEquals(Arrays.asList(new Token(TokenType.EOF, "", 1)), tokenize(""));
		assertEquals(Arrays.asList(new Token(TokenType.EOF, "", 1)), tokenize("# only a comment"));
	}

	@Test
	public void testIdentifiers() {
		List<Token> tokens = tokenize("select col_1, _hidden, Total2");
		assertEquals(TokenType.KW_SELECT, tokens.get(0).getType());
		assertEquals(new Token(TokenType.ID, "col_1", 1), tokens.get(1));
		assertEquals(new Token(TokenType.ID, "_hidden", 1), tokens.get(3));
		assertEquals(new Token(TokenType.ID, "Total2", 1), tokens.get(5));
	}

	@Test
	public void testFillnaAndGroupKeywords() {
		assertEquals(
				Arrays.asList(TokenType.KW_FILLNA, TokenType.ID, TokenType.NUMBER, TokenType.EOF),
				types("fillna age 0"));
		assertEquals(
				Arrays.asList(TokenType.KW_GROUP, TokenType.KW_BY, TokenType.ID, TokenType.KW_AVG, TokenType.ID, TokenType.EOF),
				types("group by dept avg salary"));
	}

	@Test
	public void testStringsHaveNoEscapes() {
		List<Token> tokens = tokenize("save 'C:\\out\\result.csv'");
		assertEquals("C:\\out\\result.csv", tokens.get(1).getText());
		tokens = tokenize("load \"it's.csv\"");
		assertEquals("it's.csv", tokens.get(1).getText());
	}

	@Test
	public void testUnterminatedStringIsLenientByDefault() {
		List<Token> tokens = tokenize("load \"data.csv\ntrim");
		assertEquals(new Token(TokenType.STRING, "data.csv", 1), tokens.get(1));
		assertEquals(new Token(TokenType.KW_TRIM, "trim", 2), tokens.get(2));
	}

	@Test
	public void testUnterminatedStringInStrictMode() {
		LexerException e = assertThrows(LexerException.class, () -> new DtlLexer("test", true).tokenize("trim\nload \"data.csv"));
		assertEquals(2, e.getLineNumber());
		assertTrue(e.getMessage(), e.getMessage().startsWith("Unterminated string"));
	}

	@Test
	public void testUnknownCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> tokenize("load \"a.csv\"\nfilter a == 1 @"));
		assertEquals(2, e.getLineNumber());
		assertEquals("test", e.getSourceDescription());
		assertTrue(e.getMessage(), e.getMessage().contains("'@'"));
	}

	@Test
	public void testLoneMinusIsRejected() {
		assertThrows(LexerException.class, () -> tokenize("filter a > - 5"));
	}

	@Test
	public void testSingleEqualsIsRejected() {
		assertThrows(LexerException.class, () -> tokenize("filter a = 5"));
	}

	@Test
	public void testSecondDecimalPointIsRejected() {
		assertThrows(LexerException.class, () -> tokenize("skip 1.2.3"));
	}

	@Test
	public void testTokenToString() {
		assertEquals("Token(NUMBER, '42', line=3)", new Token(TokenType.NUMBER, "42", 3).toString());
	}

	@Test
	public void testKeywordLookup() {
		assertEquals(TokenType.KW_DUPLICATES, TokenType.keyword("Duplicates"));
		assertNull(TokenType.keyword("salary"));
		assertTrue(TokenType.KW_TO.isKeyword());
		assertFalse(TokenType.ID.isKeyword());
		assertNull(TokenType.KW_BY.getCommand());
	}
}
