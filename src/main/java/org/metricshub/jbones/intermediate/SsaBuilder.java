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

import java.math.BigInteger;

/**
 * Appends instructions to the blocks of an {@link SsaFunction}.
 * <p>
 * The builder is positioned at one block at a time. Appending to a block that
 * already ends with a terminator, or to a sealed function, is an
 * {@link IllegalStateException}.
 */
public class SsaBuilder {

	private final SsaFunction function;
	private BasicBlock insertBlock;

	/**
	 * <p>
	 * Constructor for SsaBuilder.
	 * </p>
	 *
	 * @param function the function to fill
	 */
	public SsaBuilder(SsaFunction function) {
		this.function = function;
	}

	public SsaFunction getFunction() {
		return function;
	}

	/**
	 * Creates a new block in the function. The insertion point is unchanged.
	 *
	 * @param label readable label of the block
	 * @return the new block
	 */
	public BasicBlock createBlock(String label) {
		return function.createBlock(label);
	}

	/**
	 * Moves the insertion point to the end of {@code block}.
	 */
	public void positionAtEnd(BasicBlock block) {
		this.insertBlock = block;
	}

	public BasicBlock getInsertBlock() {
		return insertBlock;
	}

	public Constant constant(BigInteger value) {
		return function.constant(value);
	}

	public Constant constant(long value) {
		return function.constant(BigInteger.valueOf(value));
	}

	/**
	 * @param value a wide integer
	 * @param name name of the variable being computed, kept for listings
	 * @return {@code value + 1}, wrapping on overflow
	 */
	public Instruction addOne(Value value, String name) {
		return append(Opcode.ADD_ONE, name, null, checkWide(value));
	}

	/**
	 * The caller guarantees that {@code value} is not the minimum value.
	 *
	 * @param value a wide integer
	 * @param name name of the variable being computed, kept for listings
	 * @return {@code value - 1}
	 */
	public Instruction subtractOne(Value value, String name) {
		return append(Opcode.SUB_ONE, name, null, checkWide(value));
	}

	/**
	 * @return a boolean value, true when both wide integers are equal
	 */
	public Instruction compareEqual(Value left, Value right) {
		return append(Opcode.CMP_EQ, null, null, checkWide(left), checkWide(right));
	}

	/**
	 * Ends the current block with an unconditional jump.
	 */
	public Instruction branch(BasicBlock target) {
		return append(Opcode.BRANCH, null, new BasicBlock[] { target });
	}

	/**
	 * Ends the current block with a two-way jump.
	 *
	 * @param condition a boolean value
	 * @param ifTrue block executed when {@code condition} holds
	 * @param ifFalse block executed otherwise
	 */
	public Instruction conditionalBranch(Value condition, BasicBlock ifTrue, BasicBlock ifFalse) {
		if (condition.getType() != ValueType.BOOLEAN) {
			throw new IllegalArgumentException("Branch condition " + condition.reference() + " is not a boolean");
		}
		return append(Opcode.COND_BRANCH, null, new BasicBlock[] { ifTrue, ifFalse }, condition);
	}

	/**
	 * Adds a phi node at the start of the current block, after the phis already
	 * there. Incoming edges are added later through
	 * {@link PhiInstruction#addIncoming(Value, BasicBlock)}.
	 *
	 * @param name name of the variable merged by the phi
	 * @return the phi
	 */
	public PhiInstruction phi(String name) {
		checkInsertable();
		PhiInstruction phi = new PhiInstruction(function.nextValueId(), name);
		insertBlock.insertPhi(phi);
		return phi;
	}

	/**
	 * Emits the side effect printing {@code name: value}.
	 */
	public Instruction report(String name, Value value) {
		return append(Opcode.REPORT, name, null, checkWide(value));
	}

	/**
	 * Ends the current block by leaving the function.
	 */
	public Instruction returnVoid() {
		return append(Opcode.RETURN, null, null);
	}

	private Instruction append(Opcode opcode, String label, BasicBlock[] targets, Value... operands) {
		checkInsertable();
		Instruction instruction = new Instruction(function.nextValueId(), opcode, label, targets, operands);
		insertBlock.append(instruction);
		return instruction;
	}

	private void checkInsertable() {
		function.checkNotSealed();
		if (insertBlock == null) {
			throw new IllegalStateException("The builder is not positioned at a block");
		}
		if (insertBlock.isTerminated()) {
			throw new IllegalStateException("Block " + insertBlock.getName() + " is already terminated");
		}
	}

	private static Value checkWide(Value value) {
		if (value.getType() != ValueType.WIDE_INT) {
			throw new IllegalArgumentException(value.reference() + " is not a wide integer");
		}
		return value;
	}
}
