package org.metricshub.dtl.frontend.ast;

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
 * A value written in a {@code filter} or {@code fillna} command.
 * <p>
 * String literals keep the text exactly as written between the quotes.
 * Bare identifiers used as values become string literals too.
 */
public final class Literal {

	/**
	 * Lexical category of a literal.
	 */
	public enum Kind {
		NUMBER,
		STRING,
		/** The {@code NaN} literal */
		MISSING
	}

	private static final Literal MISSING_VALUE = new Literal(Kind.MISSING, "NaN");

	private final Kind kind;
	private final String text;

	private Literal(Kind kind, String text) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
	}

	/**
	 * @param text the number as written, e.g. {@code -12.5}
	 * @return a numeric literal
	 */
	public static Literal number(String text) {
		return new Literal(Kind.NUMBER, text);
	}

	/**
	 * @param text the string contents, without the enclosing quotes
	 * @return a string literal
	 */
	public static Literal string(String text) {
		return new Literal(Kind.STRING, text);
	}

	/**
	 * @return the {@code NaN} literal
	 */
	public static Literal missing() {
		return MISSING_VALUE;
	}

	public Kind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return this literal as DTL source text
	 */
	public String toSource() {
		switch (kind) {
		case STRING:
			return CommandAst.quote(text);
		case MISSING:
			return "NaN";
		default:
			return text;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Literal)) {
			return false;
		}
		Literal other = (Literal) o;
		return kind == other.kind && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text);
	}

	@Override
	public String toString() {
		return toSource();
	}
}
