package org.metricshub.jbones.backend;

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
 * An external tool (the C compiler or the compiled program) could not be
 * started or exited with a non-zero status.
 */
public class ToolchainException extends JbonesRuntimeException {

	private static final long serialVersionUID = 1L;

	private final int exitCode;
	private final String toolOutput;

	/**
	 * @param msg what went wrong
	 * @param exitCode exit status of the tool, -1 if it did not run
	 * @param toolOutput what the tool printed on its error stream
	 */
	public ToolchainException(String msg, int exitCode, String toolOutput) {
		super(toolOutput == null || toolOutput.isEmpty() ? msg : msg + "\n" + toolOutput);
		this.exitCode = exitCode;
		this.toolOutput = toolOutput;
	}

	public ToolchainException(String msg, Throwable cause) {
		super(msg, cause);
		this.exitCode = -1;
		this.toolOutput = "";
	}

	public int getExitCode() {
		return exitCode;
	}

	public String getToolOutput() {
		return toolOutput;
	}
}
