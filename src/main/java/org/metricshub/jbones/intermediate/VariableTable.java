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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bijection between variable names and dense indices {@code 0..N-1}, in the
 * order names were first seen.
 */
public final class VariableTable {

	private final List<String> names;
	private final Map<String, Integer> indices;

	private VariableTable(List<String> names) {
		this.names = Collections.unmodifiableList(names);
		this.indices = new HashMap<String, Integer>();
		for (int i = 0; i < names.size(); i++) {
			indices.put(names.get(i), i);
		}
	}

	/**
	 * @param references variable names in source order, duplicates allowed
	 * @return the table, first occurrence defining the index
	 */
	public static VariableTable of(Collection<String> references) {
		List<String> names = new ArrayList<String>();
		for (String name : references) {
			if (!names.contains(name)) {
				names.add(name);
			}
		}
		return new VariableTable(names);
	}

	/**
	 * @return the index of {@code name}, or -1 when absent
	 */
	public int indexOf(String name) {
		Integer index = indices.get(name);
		return index == null ? -1 : index;
	}

	public String nameOf(int index) {
		return names.get(index);
	}

	public int size() {
		return names.size();
	}

	public List<String> names() {
		return names;
	}

	@Override
	public String toString() {
		return names.toString();
	}
}
