package org.metricshub.jbones.intermediate;

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

import org.metricshub.jbones.jrt.JbonesRuntimeException;

/**
 * Structural error found while generating SSA code, like an unmatched
 * {@code end} or a {@code while} left open.
 */
public class CodeGenerationException extends JbonesRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;

	/**
	 * @param msg what went wrong
	 * @param sourceDescription description of the offending source
	 * @param lineNumber offending line, 1-based
	 */
	public CodeGenerationException(String msg, String sourceDescription, int lineNumber) {
		super(lineNumber, msg + " (" + sourceDescription + ":" + lineNumber + ")");
		this.sourceDescription = sourceDescription;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}
}
