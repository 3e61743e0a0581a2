package org.metricshub.jbones.jrt;

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

/**
 * Root of every fatal condition raised while lexing, translating, verifying
 * or running a bare bones program.
 * <p>
 * When the failure can be traced to a statement, the exception carries the
 * 1-based source line of that statement, and {@code Cli.execute} reports it
 * as {@code Name (line N): message} before exiting with status 1. Failures
 * with no source position (a missing input value, a toolchain error) carry
 * {@code -1}.
 * <p>
 * None of these failures is recoverable: whoever catches one
 * discards the whole build.
 *
 * @author Danny Daglas
 */
public class JbonesRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for JbonesRuntimeException.
	 * </p>
	 *
	 * @param msg what went wrong, with no source position
	 */
	public JbonesRuntimeException(String msg) {
		super(msg);
		this.lineNumber = -1;
	}

	public JbonesRuntimeException(String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = -1;
	}

	/**
	 * <p>
	 * Constructor for JbonesRuntimeException.
	 * </p>
	 *
	 * @param lineno 1-based line of the offending statement
	 * @param msg what went wrong
	 */
	public JbonesRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	public JbonesRuntimeException(int lineno, String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = lineno;
	}

	/**
	 * Returns the source line of the statement that failed, as printed by the
	 * command line driver, or {@code -1} when the failure has no position.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
