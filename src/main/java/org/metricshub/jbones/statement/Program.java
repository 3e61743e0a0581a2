package org.metricshub.jbones.statement;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jbones
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
import org.metricshub.jbones.intermediate.CodeGenerator;
import org.metricshub.jbones.intermediate.VariableTable;

/**
 * A parsed bare bones program: its statements in source order, ending with
 * an {@link EofStatement}, and the table of the variables they reference.
 */
public class Program {

	private final String sourceDescription;
	private final List<Statement> statements;
	private final VariableTable variables;

	/**
	 * <p>
	 * Constructor for Program.
	 * </p>
	 *
	 * @param sourceDescription description of the source the statements come from
	 * @param statements statements in source order
	 */
	public Program(String sourceDescription, List<Statement> statements) {
		this.sourceDescription = sourceDescription;
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
		List<String> references = new ArrayList<String>();
		for (Statement statement : statements) {
			references.addAll(statement.referencedVariables());
		}
		this.variables = VariableTable.of(references);
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public VariableTable getVariables() {
		return variables;
	}

	/**
	 * Replays every statement into {@code generator}.
	 */
	public void emit(CodeGenerator generator) {
		for (Statement statement : statements) {
			generator.setLineNumber(statement.getLineNumber());
			statement.emit(generator);
		}
	}

	/**
	 * Prints the statements, one per line.
	 *
	 * @param ps destination of the listing
	 */
	public void dump(PrintStream ps) {
		for (Statement statement : statements) {
			ps.println(statement.getLineNumber() + "\t" + statement);
		}
	}
}
