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
 * The cleaning commands: {@code clean missing drop|ffill|bfill},
 * {@code clean duplicates} and {@code fillna COLUMN VALUE}.
 * <p>
 * Only the fields of the matching {@link CleanKind} are set; the others are {@code null}.
 */
public final class CleanAst extends CommandAst {

	private final CleanKind cleanKind;
	private final MissingStrategy strategy;
	private final String column;
	private final Literal value;

	private CleanAst(CleanKind cleanKind, MissingStrategy strategy, String column, Literal value, int lineNumber) {
		super(lineNumber);
		this.cleanKind = Objects.requireNonNull(cleanKind, "cleanKind");
		this.strategy = strategy;
		this.column = column;
		this.value = value;
	}

	/**
	 * @param strategy how missing values are handled; {@code null} is kept and reported by semantic analysis
	 * @param lineNumber source line
	 * @return a {@code clean missing} command
	 */
	public static CleanAst missing(MissingStrategy strategy, int lineNumber) {
		return new CleanAst(CleanKind.MISSING, strategy, null, null, lineNumber);
	}

	public static CleanAst missing(MissingStrategy strategy) {
		return missing(strategy, -1);
	}

	public static CleanAst duplicates(int lineNumber) {
		return new CleanAst(CleanKind.DUPLICATES, null, null, null, lineNumber);
	}

	public static CleanAst duplicates() {
		return duplicates(-1);
	}

	/**
	 * @param column column whose missing values are replaced
	 * @param value replacement value
	 * @param lineNumber source line
	 * @return a {@code fillna} command
	 */
	public static CleanAst fillNa(String column, Literal value, int lineNumber) {
		return new CleanAst(
				CleanKind.FILL_NA,
				null,
				Objects.requireNonNull(column, "column"),
				Objects.requireNonNull(value, "value"),
				lineNumber);
	}

	public static CleanAst fillNa(String column, Literal value) {
		return fillNa(column, value, -1);
	}

	public CleanKind getCleanKind() {
		return cleanKind;
	}

	public MissingStrategy getStrategy() {
		return strategy;
	}

	public String getColumn() {
		return column;
	}

	public Literal getValue() {
		return value;
	}

	@Override
	public CommandKind getKind() {
		return CommandKind.CLEAN;
	}

	@Override
	public <R> R accept(CommandAstVisitor<R> visitor) {
		return visitor.visitClean(this);
	}

	@Override
	public String toSource() {
		switch (cleanKind) {
		case MISSING:
			return strategy == null ? "clean missing" : "clean missing " + strategy.getKeyword();
		case DUPLICATES:
			return "clean duplicates";
		default:
			return "fillna " + column + " " + value.toSource();
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof CleanAst)) {
			return false;
		}
		CleanAst other = (CleanAst) o;
		return cleanKind == other.cleanKind
				&& strategy == other.strategy
				&& Objects.equals(column, other.column)
				&& Objects.equals(value, other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(CommandKind.CLEAN, cleanKind, strategy, column, value);
	}

	@Override
	public String toString() {
		return "CleanAst(type=" + cleanKind
				+ ", strategy=" + (strategy == null ? null : strategy.getKeyword())
				+ ", col=" + column
				+ ", val=" + value + ")";
	}
}
