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
 * One instruction of an {@link SsaFunction}, and the value it produces.
 * <p>
 * Models one {@link Opcode} with its operands, the blocks it may jump to,
 * and an optional label (the variable name for reports, a hint otherwise).
 *
 * @see SsaBuilder
 */
public class Instruction extends Value {

	private final Opcode opcode;
	private final List<Value> operands;
	private final BasicBlock[] targets;
	private final String label;

	Instruction(int id, Opcode opcode, String label, BasicBlock[] targets, Value... operands) {
		super(id);
		this.opcode = opcode;
		this.label = label;
		this.targets = targets == null ? new BasicBlock[0] : targets.clone();
		this.operands = new ArrayList<Value>(Arrays.asList(operands));
	}

	public Opcode getOpcode() {
		return opcode;
	}

	@Override
	public ValueType getType() {
		return opcode.getResultType();
	}

	/**
	 * @return the operands, in order
	 */
	public List<Value> getOperands() {
		return Collections.unmodifiableList(operands);
	}

	public Value getOperand(int index) {
		return operands.get(index);
	}

	/**
	 * @return the blocks this instruction may transfer control to
	 */
	public List<BasicBlock> getTargets() {
		return Collections.unmodifiableList(Arrays.asList(targets));
	}

	/**
	 * @return the reported variable name, a readability hint, or {@code null}
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Rewrites every operand equal to {@code from} into {@code to}.
	 *
	 * @return {@code true} if an operand was rewritten
	 */
	boolean replaceOperand(Value from, Value to) {
		boolean replaced = false;
		for (int i = 0; i < operands.size(); i++) {
			if (operands.get(i) == from) {
				operands.set(i, to);
				replaced = true;
			}
		}
		return replaced;
	}

	@Override
	public String reference() {
		return "%" + getId();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		if (opcode.getResultType() != ValueType.VOID) {
			sb.append(reference()).append(" = ");
		}
		sb.append(opcode.name());
		if (opcode == Opcode.REPORT) {
			sb.append(" \"").append(label).append('"');
		}
		for (Value operand : operands) {
			sb.append(' ').append(operand.reference());
		}
		for (BasicBlock target : targets) {
			sb.append(' ').append(target.getName());
		}
		if (label != null && opcode != Opcode.REPORT) {
			sb.append("   ; ").append(label);
		}
		return sb.toString();
	}
}
