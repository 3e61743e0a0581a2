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
 * A straight-line sequence of instructions: phis first, then ordinary
 * instructions, then exactly one terminator.
 */
public final class BasicBlock {

	private final String name;
	private final List<Instruction> instructions = new ArrayList<Instruction>();

	BasicBlock(String name) {
		this.name = name;
	}

	/**
	 * @return the unique name of the block within its function
	 */
	public String getName() {
		return name;
	}

	public List<Instruction> getInstructions() {
		return Collections.unmodifiableList(instructions);
	}

	/**
	 * @return the leading phis of this block
	 */
	public List<PhiInstruction> getPhis() {
		List<PhiInstruction> phis = new ArrayList<PhiInstruction>();
		for (Instruction instruction : instructions) {
			if (!(instruction instanceof PhiInstruction)) {
				break;
			}
			phis.add((PhiInstruction) instruction);
		}
		return phis;
	}

	/**
	 * @return the terminator, or {@code null} while the block is still open
	 */
	public Instruction getTerminator() {
		if (instructions.isEmpty()) {
			return null;
		}
		Instruction last = instructions.get(instructions.size() - 1);
		return last.getOpcode().isTerminator() ? last : null;
	}

	public boolean isTerminated() {
		return getTerminator() != null;
	}

	/**
	 * @return the blocks control may flow to from this one
	 */
	public List<BasicBlock> getSuccessors() {
		Instruction terminator = getTerminator();
		return terminator == null ? Collections.<BasicBlock>emptyList() : terminator.getTargets();
	}

	void append(Instruction instruction) {
		instructions.add(instruction);
	}

	void insertPhi(PhiInstruction phi) {
		int index = 0;
		while (index < instructions.size() && instructions.get(index) instanceof PhiInstruction) {
			index++;
		}
		instructions.add(index, phi);
	}

	void remove(Instruction instruction) {
		instructions.remove(instruction);
	}

	@Override
	public String toString() {
		return name;
	}
}
