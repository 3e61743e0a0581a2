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
 * Instruction set of an {@link SsaFunction}.
 */
public enum Opcode {
	/**
	 * Adds one to a wide integer, wrapping on overflow.
	 * <p>
	 * Operands: value
	 */
	ADD_ONE(ValueType.WIDE_INT, false),
	/**
	 * Subtracts one from a wide integer. The operand is known not to be zero,
	 * because the instruction only executes behind an equality test.
	 * <p>
	 * Operands: value
	 */
	SUB_ONE(ValueType.WIDE_INT, false),
	/**
	 * Compares two wide integers for equality.
	 * <p>
	 * Operands: left, right
	 */
	CMP_EQ(ValueType.BOOLEAN, false),
	/**
	 * Selects the incoming value of the predecessor control came from.
	 * Phis are grouped at the start of their block.
	 */
	PHI(ValueType.WIDE_INT, false),
	/**
	 * Jumps to its single target.
	 */
	BRANCH(ValueType.VOID, true),
	/**
	 * Jumps to its first target when the condition holds, to its second
	 * otherwise.
	 * <p>
	 * Operands: condition
	 */
	COND_BRANCH(ValueType.VOID, true),
	/**
	 * Reports the final value of a variable as {@code name: value}.
	 * <p>
	 * Operands: value
	 */
	REPORT(ValueType.VOID, false),
	/**
	 * Leaves the function.
	 */
	RETURN(ValueType.VOID, true);

	private final ValueType resultType;
	private final boolean terminator;

	Opcode(ValueType resultType, boolean terminator) {
		this.resultType = resultType;
		this.terminator = terminator;
	}

	public ValueType getResultType() {
		return resultType;
	}

	/**
	 * @return {@code true} if the instruction ends its block
	 */
	public boolean isTerminator() {
		return terminator;
	}

	/**
	 * @return {@code true} if the instruction is only worth keeping when its
	 *         result is used
	 */
	public boolean isPure() {
		return resultType != ValueType.VOID;
	}
}
