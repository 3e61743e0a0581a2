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

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that an {@link SsaFunction} is well formed.
 */
class SsaVerifier {

	private final SsaFunction function;

	SsaVerifier(SsaFunction function) {
		this.function = function;
	}

	void verify() {
		List<BasicBlock> blocks = function.getBlocks();
		if (blocks.isEmpty()) {
			throw new SsaVerificationException("Function " + function.getName() + " has no block");
		}
		Set<BasicBlock> ownBlocks = new HashSet<BasicBlock>(blocks);
		Set<Value> definitions = new HashSet<Value>(function.getParameters());
		for (BasicBlock block : blocks) {
			definitions.addAll(block.getInstructions());
		}

		Map<BasicBlock, List<BasicBlock>> predecessors = function.predecessors();
		if (!predecessors.get(function.getEntryBlock()).isEmpty()) {
			throw new SsaVerificationException("Entry block " + function.getEntryBlock().getName() + " has predecessors");
		}

		for (BasicBlock block : blocks) {
			verifyBlock(block, ownBlocks, definitions, predecessors.get(block));
		}
	}

	private void verifyBlock(BasicBlock block, Set<BasicBlock> ownBlocks, Set<Value> definitions, List<BasicBlock> predecessors) {
		List<Instruction> instructions = block.getInstructions();
		if (instructions.isEmpty() || !block.isTerminated()) {
			throw new SsaVerificationException("Block " + block.getName() + " does not end with a terminator");
		}
		boolean phisAllowed = true;
		for (int i = 0; i < instructions.size(); i++) {
			Instruction instruction = instructions.get(i);
			if (instruction.getOpcode().isTerminator() && i != instructions.size() - 1) {
				throw new SsaVerificationException("Terminator " + instruction + " is not the last instruction of " + block.getName());
			}
			if (instruction instanceof PhiInstruction) {
				if (!phisAllowed) {
					throw new SsaVerificationException("Phi " + instruction.reference() + " is not at the start of " + block.getName());
				}
				verifyPhi((PhiInstruction) instruction, block, predecessors);
			} else {
				phisAllowed = false;
			}
			for (Value operand : instruction.getOperands()) {
				verifyOperand(operand, instruction, definitions);
			}
			for (BasicBlock target : instruction.getTargets()) {
				if (!ownBlocks.contains(target)) {
					throw new SsaVerificationException(instruction + " jumps to a block outside of " + function.getName());
				}
			}
		}
		verifyTypes(block);
	}

	private void verifyPhi(PhiInstruction phi, BasicBlock block, List<BasicBlock> predecessors) {
		List<BasicBlock> incoming = phi.getIncomingBlocks();
		if (incoming.size() != predecessors.size() || !incoming.containsAll(predecessors)) {
			throw new SsaVerificationException(
					"Phi " + phi.reference() + " in " + block.getName() + " has incoming edges " + incoming
							+ " but the predecessors are " + predecessors);
		}
	}

	private void verifyOperand(Value operand, Instruction user, Set<Value> definitions) {
		if (operand instanceof Constant) {
			return;
		}
		if (!definitions.contains(operand)) {
			throw new SsaVerificationException(user + " uses " + operand.reference() + " which is not defined in " + function.getName());
		}
	}

	private void verifyTypes(BasicBlock block) {
		for (Instruction instruction : block.getInstructions()) {
			switch (instruction.getOpcode()) {
			case ADD_ONE:
			case SUB_ONE:
			case CMP_EQ:
			case PHI:
			case REPORT:
				for (Value operand : instruction.getOperands()) {
					expectType(instruction, operand, ValueType.WIDE_INT);
				}
				break;
			case COND_BRANCH:
				expectType(instruction, instruction.getOperand(0), ValueType.BOOLEAN);
				break;
			case BRANCH:
			case RETURN:
				break;
			default:
				throw new SsaVerificationException("Unknown opcode " + instruction.getOpcode());
			}
		}
	}

	private static void expectType(Instruction instruction, Value operand, ValueType expected) {
		if (operand.getType() != expected) {
			throw new SsaVerificationException(instruction + ": " + operand.reference() + " is not of type " + expected);
		}
	}
}
