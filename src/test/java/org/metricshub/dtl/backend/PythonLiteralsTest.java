package org.metricshub.dtl.backend;

import static org.junit.Assert.*;

import org.junit.Test;

public class PythonLiteralsTest {

	@Test
	public void testUnquoteRemovesOneMatchingPair() {
		assertEquals("a.csv", PythonLiterals.unquote("\"a.csv\""));
		assertEquals("a.csv", PythonLiterals.unquote("'a.csv'"));
		assertEquals("'a.csv'", PythonLiterals.unquote("\"'a.csv'\""));
		assertEquals("\"a.csv'", PythonLiterals.unquote("\"a.csv'"));
		assertEquals("\"", PythonLiterals.unquote("\""));
		assertEquals("", PythonLiterals.unquote("''"));
		assertEquals("plain", PythonLiterals.unquote("plain"));
	}

	@Test
	public void testQuote() {
		assertEquals("'Sales'", PythonLiterals.quote("Sales"));
		assertEquals("'O\\'Brien'", PythonLiterals.quote("O'Brien"));
		assertEquals("'C:\\\\data\\\\in.csv'", PythonLiterals.quote("C:\\data\\in.csv"));
		assertEquals("'say \"hi\"'", PythonLiterals.quote("say \"hi\""));
		assertEquals("'a\\nb'", PythonLiterals.quote("a\nb"));
	}

	@Test
	public void testNumbers() {
		assertTrue(PythonLiterals.isNumber("0"));
		assertTrue(PythonLiterals.isNumber("-12.5"));
		assertTrue(PythonLiterals.isNumber("1e3"));
		assertTrue(PythonLiterals.isNumber(".5"));
		assertFalse(PythonLiterals.isNumber("inf"));
		assertFalse(PythonLiterals.isNumber("nan"));
		assertFalse(PythonLiterals.isNumber("12abc"));
		assertFalse(PythonLiterals.isNumber(""));
		assertEquals("7", PythonLiterals.number("007"));
		assertEquals("-0.5", PythonLiterals.number("-00.5"));
		assertEquals("0", PythonLiterals.number("0"));
		assertEquals("100", PythonLiterals.number("100"));
	}

	@Test
	public void testCommentStaysOnOneLine() {
		assertEquals("a b", PythonLiterals.comment("a\nb"));
	}
}
