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
 * A wide integer parameter of the function, bound to a runtime input.
 */
public final class Parameter extends Value {

	private final int index;
	private final String name;

	Parameter(int id, int index, String name) {
		super(id);
		this.index = index;
		this.name = name;
	}

	/**
	 * @return position of the parameter, 0-based
	 */
	public int getIndex() {
		return index;
	}

	/**
	 * @return name of the variable the parameter initializes
	 */
	public String getName() {
		return name;
	}

	@Override
	public ValueType getType() {
		return ValueType.WIDE_INT;
	}

	@Override
	public String reference() {
		return "%" + name;
	}
}
