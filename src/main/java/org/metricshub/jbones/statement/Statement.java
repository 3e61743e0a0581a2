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

import java.util.Collections;
import java.util.List;
import org.metricshub.jbones.intermediate.CodeGenerator;

/**
 * One statement of a bare bones program.
 * <p>
 * Statements are produced one-to-one from tokens by
 * {@link Statements#fromToken(org.metricshub.jbones.frontend.Token, String)}
 * and replayed, in source order, into a {@link CodeGenerator}.
 */
public abstract class Statement {

	private final int lineNumber;

	protected Statement(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the line the statement starts on, 1-based
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Names of the variables this statement touches, in operand order.
	 *
	 * @return variable names, possibly empty, possibly with duplicates
	 */
	public List<String> referencedVariables() {
		return Collections.emptyList();
	}

	/**
	 * Emits the code of this statement.
	 *
	 * @param generator generator positioned after the previous statement
	 */
	public abstract void emit(CodeGenerator generator);
}
