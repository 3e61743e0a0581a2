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
import java.util.Collections;
import java.util.List;

/**
 * A merge point: takes, on entry to its block, the incoming value attached to
 * the predecessor control arrived from.
 * <p>
 * Incoming edges are added incrementally. Loop headers get their first edge
 * when the loop opens and their back-edge when it closes.
 */
public final class PhiInstruction extends Instruction {

	private final List<Value> incomingValues = new ArrayList<Value>();
	private final List<BasicBlock> incomingBlocks = new ArrayList<BasicBlock>();

	PhiInstruction(int id, String label) {
		super(id, Opcode.PHI, label, null);
	}

	/**
	 * Adds an incoming edge.
	 *
	 * @param value value flowing in along the edge
	 * @param predecessor block the edge leaves from
	 */
	public void addIncoming(Value value, BasicBlock predecessor) {
		if (incomingBlocks.contains(predecessor)) {
			throw new IllegalStateException(reference() + " already has an incoming edge from " + predecessor.getName());
		}
		incomingValues.add(value);
		incomingBlocks.add(predecessor);
	}

	public List<Value> getIncomingValues() {
		return Collections.unmodifiableList(incomingValues);
	}

	public List<BasicBlock> getIncomingBlocks() {
		return Collections.unmodifiableList(incomingBlocks);
	}

	/**
	 * @param predecessor a predecessor of this phi's block
	 * @return the value flowing in from {@code predecessor}, or {@code null}
	 */
	public Value incomingFrom(BasicBlock predecessor) {
		int index = incomingBlocks.indexOf(predecessor);
		return index < 0 ? null : incomingValues.get(index);
	}

	/** The incoming values stand for the operands of a phi. */
	@Override
	public List<Value> getOperands() {
		return getIncomingValues();
	}

	@Override
	boolean replaceOperand(Value from, Value to) {
		boolean replaced = false;
		for (int i = 0; i < incomingValues.size(); i++) {
			if (incomingValues.get(i) == from) {
				incomingValues.set(i, to);
				replaced = true;
			}
		}
		return replaced;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(reference()).append(" = PHI");
		for (int i = 0; i < incomingValues.size(); i++) {
			sb.append(i == 0 ? " " : ", ");
			sb.append('[').append(incomingValues.get(i).reference()).append(", ").append(incomingBlocks.get(i).getName()).append(']');
		}
		if (getLabel() != null) {
			sb.append("   ; ").append(getLabel());
		}
		return sb.toString();
	}
}
