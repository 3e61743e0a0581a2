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

import org.metricshub.jbones.frontend.ParserException;
import org.metricshub.jbones.frontend.Token;

/**
 * Converts tokens into statements.
 */
public final class Statements {

	private Statements() {}

	/**
	 * Narrows a token to the statement it stands for.
	 *
	 * @param token token produced by the lexer
	 * @param sourceDescription description of the source, for error messages
	 * @return the matching statement
	 * @throws ParserException if {@code token} is a bare number or identifier
	 */
	public static Statement fromToken(Token token, String sourceDescription) {
		int line = token.getLineNumber();
		switch (token.getType()) {
		case NUMBER:
		case IDENTIFIER:
			throw new ParserException(token + " is not a statement", sourceDescription, line);
		case WHILE:
			return new WhileStatement(line, token.getName(), token.getNumber());
		case TWO_PARAM:
			return new TwoParamStatement(line, token.getTwoParamKind(), token.getName(), token.getSecondName());
		case ONE_PARAM:
			return new OneParamStatement(line, token.getOneParamKind(), token.getName());
		case FLUFF:
			return new FluffStatement(line);
		case END:
			return new EndStatement(line);
		case EOF:
			return new EofStatement(line);
		default:
			throw new Error("Unknown token type: " + token.getType());
		}
	}
}
