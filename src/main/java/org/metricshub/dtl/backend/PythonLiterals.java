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

import java.util.regex.Pattern;

/**
 * Rendering of DTL values as Python source text.
 */
public final class PythonLiterals {

	private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
	private static final Pattern LEADING_ZEROS = Pattern.compile("^([+-]?)0+(?=\\d)");

	private PythonLiterals() {}

	/**
	 * Removes one layer of matching quotes, {@code "..."} or {@code '...'}, if present.
	 *
	 * @param text the text to unquote
	 * @return the text without its enclosing quotes
	 */
	public static String unquote(String text) {
		if (text.length() >= 2) {
			char first = text.charAt(0);
			if ((first == '"' || first == '\'') && text.charAt(text.length() - 1) == first) {
				return text.substring(1, text.length() - 1);
			}
		}
		return text;
	}

	/**
	 * Renders the text as a single-quoted Python string literal.
	 *
	 * @param text the raw text
	 * @return a literal that evaluates to exactly {@code text}
	 */
	public static String quote(String text) {
		StringBuilder sb = new StringBuilder(text.length() + 2);
		sb.append('\'');
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
			case '\\':
				sb.append("\\\\");
				break;
			case '\'':
				sb.append("\\'");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\r':
				sb.append("\\r");
				break;
			case '\t':
				sb.append("\\t");
				break;
			default:
				sb.append(c);
			}
		}
		return sb.append('\'').toString();
	}

	/**
	 * @param text candidate value
	 * @return {@code true} if the text is a decimal number Python can read as a literal
	 */
	public static boolean isNumber(String text) {
		return NUMBER.matcher(text).matches();
	}

	/**
	 * Renders a decimal number; leading zeros, which Python rejects, are dropped.
	 *
	 * @param text a decimal number
	 * @return the Python literal
	 */
	public static String number(String text) {
		return LEADING_ZEROS.matcher(text).replaceFirst("$1");
	}

	/**
	 * Makes text safe to place after a {@code #}.
	 *
	 * @param text comment text
	 * @return the text on a single line
	 */
	public static String comment(String text) {
		return text.replace("\r", " ").replace("\n", " ");
	}
}
