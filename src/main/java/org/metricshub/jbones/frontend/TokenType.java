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

/** Lexer token kinds. */
public enum TokenType {
	/** Integer literal, only valid as the bound of a {@code while}. */
	NUMBER,
	/** Variable name, only valid as an operand. */
	IDENTIFIER,
	/** {@code while var bound}, operands already collected. */
	WHILE,
	/** Keyword taking two identifiers ({@code copy}). */
	TWO_PARAM,
	/** Keyword taking one identifier ({@code clear}, {@code decr}, {@code incr}). */
	ONE_PARAM,
	/** Semantically empty keyword ({@code do}, {@code not}, {@code to}). */
	FLUFF,
	/** Closes the innermost open {@code while}. */
	END,
	EOF
}
