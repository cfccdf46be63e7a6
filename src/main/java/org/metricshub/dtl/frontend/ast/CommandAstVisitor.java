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
 * Visitor over the closed set of DTL commands. Adding a command kind adds a
 * method here, so every phase that dispatches on commands fails to compile
 * until it handles the new kind.
 *
 * @param <R> result type of the visit
 */
public interface CommandAstVisitor<R> {

	R visitLoad(LoadAst load);

	R visitSave(SaveAst save);

	R visitSkip(SkipAst skip);

	R visitTrim(TrimAst trim);

	R visitClean(CleanAst clean);

	R visitFilter(FilterAst filter);

	R visitSelect(SelectAst select);

	R visitSort(SortAst sort);

	R visitRename(RenameAst rename);

	R visitGroupBy(GroupByAst groupBy);
}
