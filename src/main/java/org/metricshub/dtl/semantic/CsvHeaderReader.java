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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the header row of a comma-separated file the way the generated
 * program will see it: after skipping a number of leading lines, the first
 * non-blank line gives the column names. A quoted name may span several lines.
 * <p>
 * Names are split on commas outside double quotes, with {@code ""} standing
 * for a quote inside a quoted name. An empty name becomes {@code Unnamed: i}
 * and a repeated name gets a {@code .1}, {@code .2}... suffix.
 */
public class CsvHeaderReader {

	private static final char BOM = '\uFEFF';

	/**
	 * Read the column names of the file.
	 *
	 * @param file the CSV file
	 * @param skipRows number of physical lines to drop before looking for the header
	 * @return the column names, in file order
	 * @throws IOException if the file cannot be read or has no header row
	 */
	@SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "the path is named by the script being compiled")
	public List<String> readHeader(Path file, int skipRows) throws IOException {
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			for (int i = 0; i < skipRows; i++) {
				if (reader.readLine() == null) {
					break;
				}
			}
			String line = reader.readLine();
			while (line != null && line.isBlank()) {
				line = reader.readLine();
			}
			if (line == null) {
				throw new IOException("No columns to parse from file");
			}
			if (!line.isEmpty() && line.charAt(0) == BOM) {
				line = line.substring(1);
			}
			StringBuilder record = new StringBuilder(line);
			while (hasOpenQuote(record)) {
				String next = reader.readLine();
				if (next == null) {
					break;
				}
				record.append('\n').append(next);
			}
			return normalize(split(record.toString()));
		}
	}

	/**
	 * Tells whether the record ends inside a quoted field. A doubled quote
	 * toggles twice, so counting quotes is enough.
	 */
	static boolean hasOpenQuote(CharSequence record) {
		boolean open = false;
		for (int i = 0; i < record.length(); i++) {
			if (record.charAt(i) == '"') {
				open = !open;
			}
		}
		return open;
	}

	/**
	 * Splits one CSV record into its fields.
	 *
	 * @param line the record, without its final line terminator
	 * @return the raw fields
	 */
	static List<String> split(String line) {
		List<String> fields = new ArrayList<String>();
		StringBuilder field = new StringBuilder();
		boolean quoted = false;
		int i = 0;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (quoted) {
				if (c == '"') {
					if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
						field.append('"');
						i++;
					} else {
						quoted = false;
					}
				} else {
					field.append(c);
				}
			} else if (c == '"') {
				quoted = true;
			} else if (c == ',') {
				fields.add(field.toString());
				field.setLength(0);
			} else {
				field.append(c);
			}
			i++;
		}
		fields.add(field.toString());
		return fields;
	}

	/**
	 * Names unnamed columns and de-duplicates repeated ones.
	 *
	 * @param raw the fields of the header row
	 * @return the column names
	 */
	static List<String> normalize(List<String> raw) {
		List<String> names = new ArrayList<String>(raw.size());
		Set<String> seen = new HashSet<String>();
		for (int i = 0; i < raw.size(); i++) {
			String name = raw.get(i);
			if (name.isEmpty()) {
				name = "Unnamed: " + i;
			}
			if (seen.contains(name)) {
				int suffix = 1;
				while (seen.contains(name + "." + suffix)) {
					suffix++;
				}
				name = name + "." + suffix;
			}
			seen.add(name);
			names.add(name);
		}
		return names;
	}
}
