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

import java.util.Collections;
import java.util.List;

/**
 * State of an open {@code while} loop: the header phis, one per variable, and
 * the header and exit blocks.
 */
final class LoopContext {

	private final List<PhiInstruction> phis;
	private final BasicBlock header;
	private final BasicBlock exit;
	private final int lineNumber;

	LoopContext(List<PhiInstruction> phis, BasicBlock header, BasicBlock exit, int lineNumber) {
		this.phis = Collections.unmodifiableList(phis);
		this.header = header;
		this.exit = exit;
		this.lineNumber = lineNumber;
	}

	List<PhiInstruction> getPhis() {
		return phis;
	}

	BasicBlock getHeader() {
		return header;
	}

	BasicBlock getExit() {
		return exit;
	}

	/**
	 * @return line of the {@code while} that opened the loop
	 */
	int getLineNumber() {
		return lineNumber;
	}
}
