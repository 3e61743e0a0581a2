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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of the current SSA value of every variable, indexed as in
 * the {@link VariableTable}.
 */
public final class ValueFrame {

	private final Value[] values;

	private ValueFrame(Value[] values) {
		this.values = values;
	}

	/**
	 * @param values one value per variable
	 */
	public static ValueFrame of(List<? extends Value> values) {
		return new ValueFrame(values.toArray(new Value[0]));
	}

	public Value get(int index) {
		return values[index];
	}

	/**
	 * @return a copy of this frame where variable {@code index} holds {@code value}
	 */
	public ValueFrame with(int index, Value value) {
		Value[] copy = values.clone();
		copy[index] = value;
		return new ValueFrame(copy);
	}

	public int size() {
		return values.length;
	}

	public List<Value> values() {
		return Collections.unmodifiableList(new ArrayList<Value>(Arrays.asList(values)));
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < values.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(values[i].reference());
		}
		return sb.append(']').toString();
	}
}
