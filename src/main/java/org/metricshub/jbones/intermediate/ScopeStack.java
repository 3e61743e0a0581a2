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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of {@link ValueFrame}s. The top frame holds the values visible at the
 * current insertion point; each open loop adds one frame.
 */
public final class ScopeStack {

	private final Deque<ValueFrame> frames = new ArrayDeque<ValueFrame>();

	public void push(ValueFrame frame) {
		frames.push(frame);
	}

	public ValueFrame pop() {
		if (frames.isEmpty()) {
			throw new IllegalStateException("Scope stack is empty");
		}
		return frames.pop();
	}

	public ValueFrame top() {
		if (frames.isEmpty()) {
			throw new IllegalStateException("Scope stack is empty");
		}
		return frames.peek();
	}

	/**
	 * Replaces the top frame, typically after a variable update.
	 */
	public void replaceTop(ValueFrame frame) {
		pop();
		push(frame);
	}

	public int depth() {
		return frames.size();
	}
}
