package org.metricshub.dtl.semantic;

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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What the analyzer knows about the current table after a prefix of the program.
 * <p>
 * Instances are immutable; every transition returns a new state. A {@code null}
 * column set means the columns are unknown and no column check applies.
 */
public final class AnalysisState {

	private static final AnalysisState INITIAL = new AnalysisState(false, false, null, null);

	private final boolean loaded;
	private final boolean saved;
	private final Set<String> knownColumns;
	private final Set<String> selectedColumns;

	private AnalysisState(boolean loaded, boolean saved, Set<String> knownColumns, Set<String> selectedColumns) {
		this.loaded = loaded;
		this.saved = saved;
		this.knownColumns = knownColumns;
		this.selectedColumns = selectedColumns;
	}

	/**
	 * @return the state before the first command: nothing loaded, nothing saved, columns unknown
	 */
	public static AnalysisState initial() {
		return INITIAL;
	}

	private static Set<String> copyOf(Collection<String> columns) {
		return columns == null ? null : Collections.unmodifiableSet(new LinkedHashSet<String>(columns));
	}

	public boolean isLoaded() {
		return loaded;
	}

	public boolean isSaved() {
		return saved;
	}

	/**
	 * @return the columns of the current table, in file order, or {@code null} if unknown
	 */
	public Set<String> getKnownColumns() {
		return knownColumns;
	}

	/**
	 * @return the columns kept by the last {@code select}, or {@code null} if none ran since the last load
	 */
	public Set<String> getSelectedColumns() {
		return selectedColumns;
	}

	/**
	 * @return the selected columns if a {@code select} ran, the known columns otherwise; may be {@code null}
	 */
	public Set<String> getAvailableColumns() {
		return selectedColumns != null ? selectedColumns : knownColumns;
	}

	/**
	 * A new table has been loaded.
	 *
	 * @param columns its columns, or {@code null} if they could not be determined
	 * @return the new state, with no selection
	 */
	public AnalysisState load(Collection<String> columns) {
		return new AnalysisState(true, saved, copyOf(columns), null);
	}

	public AnalysisState save() {
		return new AnalysisState(loaded, true, knownColumns, selectedColumns);
	}

	/**
	 * @param columns the columns kept by a {@code select}
	 * @return the new state, narrowed to these columns
	 */
	public AnalysisState select(Collection<String> columns) {
		return new AnalysisState(loaded, saved, knownColumns, copyOf(columns));
	}

	/**
	 * Substitutes a column name in both the known and the selected columns, keeping positions.
	 *
	 * @param oldName column being renamed
	 * @param newName its new name
	 * @return the new state
	 */
	public AnalysisState rename(String oldName, String newName) {
		return new AnalysisState(loaded, saved, rename(knownColumns, oldName, newName), rename(selectedColumns, oldName, newName));
	}

	private static Set<String> rename(Set<String> columns, String oldName, String newName) {
		if (columns == null) {
			return null;
		}
		List<String> renamed = new ArrayList<String>(columns.size());
		for (String column : columns) {
			renamed.add(column.equals(oldName) ? newName : column);
		}
		return copyOf(renamed);
	}

	/**
	 * The table has been replaced by one with the given columns, as {@code group by} does.
	 *
	 * @param columns the columns of the new table
	 * @return the new state, with no selection
	 */
	public AnalysisState reshape(Collection<String> columns) {
		return new AnalysisState(loaded, saved, copyOf(columns), null);
	}

	@Override
	public String toString() {
		return "AnalysisState(loaded=" + loaded
				+ ", saved=" + saved
				+ ", known=" + knownColumns
				+ ", selected=" + selectedColumns + ")";
	}
}
