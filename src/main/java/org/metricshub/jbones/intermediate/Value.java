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

/**
 * Anything an instruction can take as an operand: a constant, a parameter of
 * the function, or the result of another instruction.
 */
public abstract class Value {

	private final int id;

	/**
	 * @param id dense per-function identifier, {@code -1} for constants
	 */
	protected Value(int id) {
		this.id = id;
	}

	/**
	 * Register slot of this value within its function.
	 *
	 * @return the identifier, or {@code -1} for constants
	 */
	public final int getId() {
		return id;
	}

	public abstract ValueType getType();

	/**
	 * @return how operands referring to this value are printed
	 */
	public abstract String reference();

	@Override
	public String toString() {
		return reference();
	}
}
