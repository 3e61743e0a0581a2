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

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import org.metricshub.jbones.intermediate.CodeGenerator;

/**
 * {@code while var bound do}: repeats the statements up to the matching
 * {@code end} until {@code var} equals {@code bound}.
 */
public final class WhileStatement extends Statement {

	private final String variable;
	private final BigInteger bound;

	public WhileStatement(int lineNumber, String variable, BigInteger bound) {
		super(lineNumber);
		this.variable = variable;
		this.bound = bound;
	}

	public String getVariable() {
		return variable;
	}

	public BigInteger getBound() {
		return bound;
	}

	@Override
	public List<String> referencedVariables() {
		return Collections.singletonList(variable);
	}

	@Override
	public void emit(CodeGenerator generator) {
		generator.openWhile(variable, bound);
	}

	@Override
	public String toString() {
		return "while " + variable + " not " + bound + " do";
	}
}
