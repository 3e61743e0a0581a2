package org.metricshub.jbones.frontend;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jbones.statement.EofStatement;
import org.metricshub.jbones.statement.Program;
import org.metricshub.jbones.statement.Statement;
import org.metricshub.jbones.statement.Statements;
import org.metricshub.jbones.util.JbonesLogger;
import org.metricshub.jbones.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts a bare bones source into a {@link Program}.
 * <p>
 * Tokens are pulled from a {@link Lexer} until end of input and turned into
 * statements one to one. The resulting statement list always ends with an
 * {@link EofStatement}.
 */
public class JbonesParser {

	private static final Logger LOG = JbonesLogger.getLogger(JbonesParser.class);

	/**
	 * Parse the provided source.
	 *
	 * @param source the program to parse
	 * @return the parsed program
	 * @throws IOException upon an error reading the source
	 * @throws ParserException upon a malformed program
	 */
	public Program parse(ScriptSource source) throws IOException {
		Lexer lexer = new Lexer(source);
		List<Statement> statements = new ArrayList<Statement>();
		Statement statement;
		do {
			statement = Statements.fromToken(lexer.nextToken(), source.getDescription());
			statements.add(statement);
		} while (!(statement instanceof EofStatement));
		Program program = new Program(source.getDescription(), statements);
		LOG.debug(
				"Parsed {} statements referencing {} variables {} from {}",
				statements.size(),
				program.getVariables().size(),
				program.getVariables(),
				source.getDescription());
		return program;
	}
}
