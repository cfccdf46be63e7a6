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

import java.util.Objects;

/**
 * A token produced by {@link DtlLexer}.
 * <p>
 * The text is the lexeme as written, except for string literals where it is
 * the content between the quotes.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final int line;

	/**
	 * @param type token value
	 * @param text lexeme, never {@code null}
	 * @param line 1-based source line
	 */
	public Token(TokenType type, String text, int line) {
		this.type = Objects.requireNonNull(type, "type");
		this.text = Objects.requireNonNull(text, "text");
		this.line = line;
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return type == other.type && text.equals(other.text) && line == other.line;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, text, line);
	}

	@Override
	public String toString() {
		return "Token(" + type.name() + ", '" + text + "', line=" + line + ")";
	}
}
