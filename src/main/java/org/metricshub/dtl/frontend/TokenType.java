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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.metricshub.dtl.frontend.ast.CommandKind;

/**
 * Lexer token values.
 * <p>
 * Keyword constants carry their canonical spelling, and those that start a
 * command also carry the {@link CommandKind} they introduce. The lexer uses
 * the spelling to recognize keywords and the parser uses the command kind to
 * dispatch, so both phases read the same table.
 */
public enum TokenType {
	// command keywords
	KW_LOAD("load", CommandKind.LOAD),
	KW_SAVE("save", CommandKind.SAVE),
	KW_SKIP("skip", CommandKind.SKIP),
	KW_TRIM("trim", CommandKind.TRIM),
	KW_CLEAN("clean", CommandKind.CLEAN),
	KW_FILLNA("fillna", CommandKind.CLEAN),
	KW_RENAME("rename", CommandKind.RENAME),
	KW_FILTER("filter", CommandKind.FILTER),
	KW_SELECT("select", CommandKind.SELECT),
	KW_SORT("sort", CommandKind.SORT),
	KW_GROUP("group", CommandKind.GROUP_BY),

	// other keywords
	KW_BY("by"),
	KW_TO("to"),
	KW_MISSING("missing"),
	KW_DUPLICATES("duplicates"),
	KW_DROP("drop"),
	KW_FFILL("ffill"),
	KW_BFILL("bfill"),
	KW_ASC("asc"),
	KW_DESC("desc"),
	KW_SUM("sum"),
	KW_AVG("avg"),
	KW_COUNT("count"),
	KW_MAX("max"),
	KW_MIN("min"),

	// literals
	STRING,
	NUMBER,
	/** The case-sensitive {@code NaN} literal */
	NAN,
	ID,

	// operators
	EQ,
	NE,
	GT,
	LT,
	GE,
	LE,

	COMMA,
	EOF;

	/**
	 * Keyword spelling (lower case) to token value.
	 */
	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		for (TokenType type : values()) {
			if (type.keyword != null) {
				keywords.put(type.keyword, type);
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String keyword;
	private final CommandKind command;

	TokenType() {
		this(null, null);
	}

	TokenType(String keyword) {
		this(keyword, null);
	}

	TokenType(String keyword, CommandKind command) {
		this.keyword = keyword;
		this.command = command;
	}

	/**
	 * Looks up a word in the keyword table, ignoring case.
	 *
	 * @param word a word as written in the script
	 * @return the keyword token value, or {@code null} if the word is not a keyword
	 */
	public static TokenType keyword(String word) {
		return KEYWORDS.get(word.toLowerCase(Locale.ROOT));
	}

	/**
	 * @return the canonical keyword spelling, or {@code null} for non-keyword tokens
	 */
	public String getKeyword() {
		return keyword;
	}

	/**
	 * @return the kind of command this keyword starts, or {@code null}
	 */
	public CommandKind getCommand() {
		return command;
	}

	public boolean isKeyword() {
		return keyword != null;
	}
}
