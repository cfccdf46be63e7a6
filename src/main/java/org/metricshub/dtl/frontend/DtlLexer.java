package org.metricshub.dtl.frontend;

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
import org.metricshub.dtl.util.DtlLogger;
import org.metricshub.dtl.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts DTL script text into a flat list of {@link Token}s, terminated by
 * a single {@link TokenType#EOF} token.
 * <p>
 * The script is processed line by line. Blank lines and lines whose first
 * non-blank character is {@code #} are ignored, and no token spans two lines.
 * The first unrecognized character aborts tokenization with a
 * {@link LexerException}.
 * <p>
 * A lexer instance holds the state of one tokenization and must not be shared.
 */
public class DtlLexer {

	private static final Logger LOG = DtlLogger.getLogger(DtlLexer.class);

	private final String sourceDescription;
	private final boolean strictStrings;

	private final List<Token> tokens = new ArrayList<Token>();
	private String line;
	private int lineNumber;
	private int pos;

	/**
	 * Creates a lenient lexer: an unterminated string literal extends to the end of its line.
	 *
	 * @param sourceDescription description of the script, used in error messages
	 */
	public DtlLexer(String sourceDescription) {
		this(sourceDescription, false);
	}

	/**
	 * <p>
	 * Constructor for DtlLexer.
	 * </p>
	 *
	 * @param sourceDescription description of the script, used in error messages
	 * @param strictStrings {@code true} to reject string literals not closed on their line
	 */
	public DtlLexer(String sourceDescription, boolean strictStrings) {
		this.sourceDescription = sourceDescription == null ? ScriptSource.DESCRIPTION_INLINE_SCRIPT : sourceDescription;
		this.strictStrings = strictStrings;
	}

	/**
	 * Tokenize the whole script.
	 *
	 * @param source the script text
	 * @return the tokens, ending with one {@link TokenType#EOF} token
	 * @throws LexerException on the first character that starts no token
	 */
	public List<Token> tokenize(String source) {
		tokens.clear();
		String[] lines = source.split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			lineNumber = i + 1;
			line = lines[i].strip();
			if (line.isEmpty() || line.charAt(0) == '#') {
				continue;
			}
			tokenizeLine();
		}
		int eofLine = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).getLine();
		tokens.add(new Token(TokenType.EOF, "", eofLine));
		LOG.debug("{}: {} tokens", sourceDescription, tokens.size());
		return Collections.unmodifiableList(new ArrayList<Token>(tokens));
	}

	private void tokenizeLine() {
		pos = 0;
		while (pos < line.length()) {
			char c = line.charAt(pos);
			if (Character.isWhitespace(c)) {
				pos++;
			} else if (c == '"' || c == '\'') {
				readString(c);
			} else if (isDigit(c) || (c == '-' && pos + 1 < line.length() && isDigit(line.charAt(pos + 1)))) {
				readNumber();
			} else if (Character.isLetter(c) || c == '_') {
				readWord();
			} else {
				readOperator(c);
			}
		}
	}

	/**
	 * Reads a string literal. There are no escape sequences: the literal is
	 * everything up to the next occurrence of the opening quote character.
	 */
	private void readString(char quote) {
		int start = pos + 1;
		int end = line.indexOf(quote, start);
		if (end < 0) {
			if (strictStrings) {
				throw lexerException("Unterminated string: " + line.substring(pos));
			}
			LOG.warn("{}: unterminated string at line {}, reading to end of line", sourceDescription, lineNumber);
			add(TokenType.STRING, line.substring(start));
			pos = line.length();
			return;
		}
		add(TokenType.STRING, line.substring(start, end));
		pos = end + 1;
	}

	/**
	 * Reads an optional minus sign, digits, and at most one decimal point followed by digits.
	 */
	private void readNumber() {
		int start = pos;
		if (line.charAt(pos) == '-') {
			pos++;
		}
		while (pos < line.length() && isDigit(line.charAt(pos))) {
			pos++;
		}
		if (pos < line.length() && line.charAt(pos) == '.') {
			pos++;
			while (pos < line.length() && isDigit(line.charAt(pos))) {
				pos++;
			}
		}
		add(TokenType.NUMBER, line.substring(start, pos));
	}

	/**
	 * Only ASCII digits start or continue a number; other Unicode digits are rejected.
	 */
	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private void readWord() {
		int start = pos;
		while (pos < line.length() && (Character.isLetterOrDigit(line.charAt(pos)) || line.charAt(pos) == '_')) {
			pos++;
		}
		String word = line.substring(start, pos);
		if ("NaN".equals(word)) {
			add(TokenType.NAN, word);
			return;
		}
		TokenType kwToken = TokenType.keyword(word);
		add(kwToken != null ? kwToken : TokenType.ID, word);
	}

	private void readOperator(char c) {
		char next = pos + 1 < line.length() ? line.charAt(pos + 1) : '\0';
		if (next == '=') {
			switch (c) {
			case '>':
				addOperator(TokenType.GE, 2);
				return;
			case '<':
				addOperator(TokenType.LE, 2);
				return;
			case '=':
				addOperator(TokenType.EQ, 2);
				return;
			case '!':
				addOperator(TokenType.NE, 2);
				return;
			default:
				break;
			}
		}
		switch (c) {
		case '>':
			addOperator(TokenType.GT, 1);
			break;
		case '<':
			addOperator(TokenType.LT, 1);
			break;
		case ',':
			addOperator(TokenType.COMMA, 1);
			break;
		default:
			throw lexerException("Unknown character '" + c + "'");
		}
	}

	private void addOperator(TokenType type, int length) {
		add(type, line.substring(pos, pos + length));
		pos += length;
	}

	private void add(TokenType type, String text) {
		tokens.add(new Token(type, text, lineNumber));
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, lineNumber);
	}
}
