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

/**
 * Aggregate functions of {@code group by}, with the name of the
 * matching function in the generated program.
 */
public enum AggregateFunction {
	SUM("sum", "sum"),
	AVG("avg", "mean"),
	COUNT("count", "count"),
	MAX("max", "max"),
	MIN("min", "min");

	private final String keyword;
	private final String engineFunction;

	AggregateFunction(String keyword, String engineFunction) {
		this.keyword = keyword;
		this.engineFunction = engineFunction;
	}

	public String getKeyword() {
		return keyword;
	}

	/**
	 * @return the name of the aggregation in the generated program, e.g. {@code mean} for {@code avg}
	 */
	public String getEngineFunction() {
		return engineFunction;
	}

	/**
	 * Name of the column holding the aggregate once the group step has run.
	 *
	 * @param aggregateColumn the aggregated column
	 * @return {@code <aggregateColumn>_<engineFunction>}
	 */
	public String resultColumn(String aggregateColumn) {
		return aggregateColumn + "_" + engineFunction;
	}
}
