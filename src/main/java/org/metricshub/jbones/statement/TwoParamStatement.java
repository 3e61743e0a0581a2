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

import java.util.Arrays;
import java.util.List;
import org.metricshub.jbones.frontend.TwoParamKind;
import org.metricshub.jbones.intermediate.CodeGenerator;

/**
 * {@code copy from to to}.
 */
public final class TwoParamStatement extends Statement {

	private final TwoParamKind kind;
	private final String from;
	private final String to;

	public TwoParamStatement(int lineNumber, TwoParamKind kind, String from, String to) {
		super(lineNumber);
		this.kind = kind;
		this.from = from;
		this.to = to;
	}

	public TwoParamKind getKind() {
		return kind;
	}

	public String getFrom() {
		return from;
	}

	public String getTo() {
		return to;
	}

	@Override
	public List<String> referencedVariables() {
		return Arrays.asList(from, to);
	}

	@Override
	public void emit(CodeGenerator generator) {
		switch (kind) {
		case COPY:
			generator.copy(from, to);
			break;
		default:
			throw new Error("Unknown statement kind: " + kind);
		}
	}

	@Override
	public String toString() {
		return kind.keyword() + " " + from + " to " + to;
	}
}
