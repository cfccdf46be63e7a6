package org.metricshub.dtl.util;

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
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A DTL script stored in a UTF-8 file.
 * <p>
 * The file is opened on the first call to {@link #getReader()}, and the same
 * reader is returned afterwards, so a source can be probed before compiling it.
 */
public class ScriptFileSource extends ScriptSource {

	private final Path scriptPath;
	private Reader fileReader;

	/**
	 * @param filePath path of the script, as given on the command line
	 */
	public ScriptFileSource(String filePath) {
		this(Paths.get(filePath), filePath);
	}

	/**
	 * @param scriptPath path of the script
	 */
	public ScriptFileSource(Path scriptPath) {
		this(scriptPath, scriptPath.toString());
	}

	private ScriptFileSource(Path scriptPath, String description) {
		super(description, null);
		this.scriptPath = scriptPath;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @throws UncheckedIOException if the file cannot be opened
	 */
	@Override
	@SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "the script path is supplied by the user")
	public Reader getReader() {
		if (fileReader == null) {
			try {
				fileReader = Files.newBufferedReader(scriptPath, StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new UncheckedIOException("Cannot open script " + getDescription(), ex);
			}
		}
		return fileReader;
	}
}
