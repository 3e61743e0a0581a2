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
import java.util.List;
import java.util.Map;
import org.metricshub.jbones.util.JbonesLogger;
import org.slf4j.Logger;

/**
 * Whole-function simplification: trivial phi elimination followed by removal
 * of unused pure instructions.
 */
class SsaOptimizer {

	private static final Logger LOG = JbonesLogger.getLogger(SsaOptimizer.class);

	private final SsaFunction function;

	SsaOptimizer(SsaFunction function) {
		this.function = function;
	}

	void optimize() {
		int before = function.getInstructionCount();
		int phis = removeTrivialPhis();
		int dead = removeDeadInstructions();
		LOG.debug(
				"Optimized {}: {} trivial phis and {} dead instructions removed ({} -> {} instructions)",
				function.getName(),
				phis,
				dead,
				before,
				function.getInstructionCount());
	}

	/**
	 * A phi is trivial when all its incoming values, ignoring the phi itself,
	 * are the same value. Replacing one may make others trivial, hence the loop.
	 */
	private int removeTrivialPhis() {
		int removed = 0;
		boolean changed = true;
		while (changed) {
			changed = false;
			for (BasicBlock block : function.getBlocks()) {
				for (PhiInstruction phi : block.getPhis()) {
					Value same = trivialValue(phi);
					if (same != null) {
						function.replaceAllUses(phi, same);
						block.remove(phi);
						removed++;
						changed = true;
					}
				}
			}
		}
		return removed;
	}

	private static Value trivialValue(PhiInstruction phi) {
		Value same = null;
		for (Value incoming : phi.getIncomingValues()) {
			if (incoming == phi || incoming == same) {
				continue;
			}
			if (same != null) {
				return null;
			}
			same = incoming;
		}
		return same;
	}

	private int removeDeadInstructions() {
		int removed = 0;
		boolean changed = true;
		while (changed) {
			changed = false;
			Map<Value, Integer> uses = function.useCounts();
			for (BasicBlock block : function.getBlocks()) {
				List<Instruction> dead = new ArrayList<Instruction>();
				for (Instruction instruction : block.getInstructions()) {
					if (instruction.getOpcode().isPure() && isUnused(instruction, uses)) {
						dead.add(instruction);
					}
				}
				for (Instruction instruction : dead) {
					block.remove(instruction);
					removed++;
					changed = true;
				}
			}
		}
		return removed;
	}

	/**
	 * A phi only used by itself is unused.
	 */
	private static boolean isUnused(Instruction instruction, Map<Value, Integer> uses) {
		Integer count = uses.get(instruction);
		if (count == null) {
			return true;
		}
		if (instruction instanceof PhiInstruction) {
			int selfUses = 0;
			for (Value incoming : ((PhiInstruction) instruction).getIncomingValues()) {
				if (incoming == instruction) {
					selfUses++;
				}
			}
			return selfUses == count;
		}
		return false;
	}
}
