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
import org.metricshub.jbones.frontend.OneParamKind;
import org.metricshub.jbones.intermediate.CodeGenerator;

/**
 * {@code clear var}, {@code decr var} or {@code incr var}.
 */
public final class OneParamStatement extends Statement {

	private final OneParamKind kind;
	private final String variable;

	public OneParamStatement(int lineNumber, OneParamKind kind, String variable) {
		super(lineNumber);
		this.kind = kind;
		this.variable = variable;
	}

	public OneParamKind getKind() {
		return kind;
	}

	public String getVariable() {
		return variable;
	}

	@Override
	public List<String> referencedVariables() {
		return Collections.singletonList(variable);
	}

	@Override
	public void emit(CodeGenerator generator) {
		switch (kind) {
		case CLEAR:
			generator.clear(variable);
			break;
		case DECR:
			generator.decrement(variable);
			break;
		case INCR:
			generator.increment(variable);
			break;
		default:
			throw new Error("Unknown statement kind: " + kind);
		}
	}

	@Override
	public String toString() {
		return kind.keyword() + " " + variable;
	}
}
