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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed DTL script: the commands in the order they appear.
 * A syntactically complete program is not necessarily semantically valid.
 */
public final class Program {

	private final List<CommandAst> commands;

	public Program(List<? extends CommandAst> commands) {
		this.commands = Collections.unmodifiableList(new ArrayList<CommandAst>(commands));
	}

	/**
	 * @return the commands, in source order
	 */
	public List<CommandAst> getCommands() {
		return commands;
	}

	public int size() {
		return commands.size();
	}

	public boolean isEmpty() {
		return commands.isEmpty();
	}

	public CommandAst get(int index) {
		return commands.get(index);
	}

	/**
	 * Dump a numbered listing of the commands to the print stream.
	 *
	 * @param ps The print stream to dump the listing to.
	 */
	public void dump(PrintStream ps) {
		for (int i = 0; i < commands.size(); i++) {
			ps.println((i + 1) + ". " + commands.get(i));
		}
	}

	/**
	 * Renders the program as canonical DTL, one command per line.
	 *
	 * @return DTL source that parses back into an equal program
	 */
	public String toSource() {
		StringBuilder source = new StringBuilder();
		for (CommandAst command : commands) {
			source.append(command.toSource()).append('\n');
		}
		return source.toString();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Program && commands.equals(((Program) o).commands);
	}

	@Override
	public int hashCode() {
		return commands.hashCode();
	}

	@Override
	public String toString() {
		return "Program(commands=" + commands.size() + ")";
	}
}
