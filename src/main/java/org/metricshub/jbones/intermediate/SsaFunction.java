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

import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jbones.jrt.WideInteger;

/**
 * A single function in static single assignment form: wide integer
 * parameters, basic blocks, and no return value.
 * <p>
 * The function is filled through an {@link SsaBuilder}. Once sealed, it can
 * be verified, optimized, dumped, interpreted, or lowered to native code.
 *
 * @see SsaBuilder
 */
public class SsaFunction {

	private final String name;
	private final List<Parameter> parameters = new ArrayList<Parameter>();
	private final List<BasicBlock> blocks = new ArrayList<BasicBlock>();
	private final Map<BigInteger, Constant> constants = new HashMap<BigInteger, Constant>();
	private final Map<String, Integer> blockLabelCounts = new HashMap<String, Integer>();
	private int nextValueId;
	private boolean sealed;
	private boolean optimized;

	/**
	 * @param name name of the function
	 */
	public SsaFunction(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	/**
	 * Appends a parameter. Parameters must be declared before any block.
	 *
	 * @param parameterName name of the variable the parameter initializes
	 * @return the new parameter
	 */
	public Parameter addParameter(String parameterName) {
		checkNotSealed();
		if (!blocks.isEmpty()) {
			throw new IllegalStateException("Parameters must be declared before the first block");
		}
		Parameter parameter = new Parameter(nextValueId++, parameters.size(), parameterName);
		parameters.add(parameter);
		return parameter;
	}

	public List<Parameter> getParameters() {
		return Collections.unmodifiableList(parameters);
	}

	/**
	 * Creates a new block named after {@code label} and a per-label counter,
	 * like {@code loop_0}, {@code loop_1}. The first block created is the entry.
	 *
	 * @param label a readable label
	 * @return the new, empty block
	 */
	public BasicBlock createBlock(String label) {
		checkNotSealed();
		Integer count = blockLabelCounts.get(label);
		if (count == null) {
			count = 0;
		} else {
			count = count + 1;
		}
		blockLabelCounts.put(label, count);
		BasicBlock block = new BasicBlock(label + "_" + count);
		blocks.add(block);
		return block;
	}

	public List<BasicBlock> getBlocks() {
		return Collections.unmodifiableList(blocks);
	}

	/**
	 * @return the block executed first
	 */
	public BasicBlock getEntryBlock() {
		if (blocks.isEmpty()) {
			throw new IllegalStateException("Function " + name + " has no block");
		}
		return blocks.get(0);
	}

	/**
	 * Returns the interned constant for {@code value}.
	 *
	 * @param value a value fitting in 128 signed bits
	 * @return the constant
	 */
	public Constant constant(BigInteger value) {
		if (!WideInteger.fits(value)) {
			throw new IllegalArgumentException(value + " does not fit in a " + WideInteger.BITS + "-bit signed integer");
		}
		Constant constant = constants.get(value);
		if (constant == null) {
			constant = new Constant(value);
			constants.put(value, constant);
		}
		return constant;
	}

	int nextValueId() {
		return nextValueId++;
	}

	/**
	 * @return the number of register slots needed to execute this function
	 */
	public int getValueCount() {
		return nextValueId;
	}

	/**
	 * Computes the predecessors of every block, in block order.
	 *
	 * @return for each block, the blocks whose terminator targets it
	 */
	public Map<BasicBlock, List<BasicBlock>> predecessors() {
		Map<BasicBlock, List<BasicBlock>> predecessors = new LinkedHashMap<BasicBlock, List<BasicBlock>>();
		for (BasicBlock block : blocks) {
			predecessors.put(block, new ArrayList<BasicBlock>());
		}
		for (BasicBlock block : blocks) {
			for (BasicBlock successor : block.getSuccessors()) {
				List<BasicBlock> list = predecessors.get(successor);
				if (list != null && !list.contains(block)) {
					list.add(block);
				}
			}
		}
		return predecessors;
	}

	/**
	 * Counts, for every value, the instructions using it.
	 *
	 * @return number of uses per value, absent when unused
	 */
	Map<Value, Integer> useCounts() {
		Map<Value, Integer> counts = new IdentityHashMap<Value, Integer>();
		for (BasicBlock block : blocks) {
			for (Instruction instruction : block.getInstructions()) {
				for (Value operand : instruction.getOperands()) {
					Integer count = counts.get(operand);
					counts.put(operand, count == null ? 1 : count + 1);
				}
			}
		}
		return counts;
	}

	/**
	 * Rewrites every use of {@code from} into a use of {@code to}.
	 */
	void replaceAllUses(Value from, Value to) {
		for (BasicBlock block : blocks) {
			for (Instruction instruction : block.getInstructions()) {
				instruction.replaceOperand(from, to);
			}
		}
	}

	/**
	 * @return the number of instructions over all blocks
	 */
	public int getInstructionCount() {
		int count = 0;
		for (BasicBlock block : blocks) {
			count += block.getInstructions().size();
		}
		return count;
	}

	/**
	 * Marks the function as complete. No block, parameter or instruction can be
	 * added afterwards.
	 */
	public void seal() {
		sealed = true;
	}

	public boolean isSealed() {
		return sealed;
	}

	void checkNotSealed() {
		if (sealed) {
			throw new IllegalStateException("Function " + name + " is sealed");
		}
	}

	/**
	 * Checks the structural and typing rules of SSA form.
	 *
	 * @throws SsaVerificationException describing the first violation found
	 */
	public void verify() {
		new SsaVerifier(this).verify();
	}

	/**
	 * Simplifies the sealed function: trivial phis are replaced by their single
	 * incoming value, then unused pure instructions are removed.
	 * <p>
	 * This method is idempotent.
	 */
	public void optimize() {
		if (!sealed) {
			throw new IllegalStateException("Function " + name + " must be sealed before optimization");
		}
		if (optimized) {
			return;
		}
		new SsaOptimizer(this).optimize();
		optimized = true;
	}

	public boolean isOptimized() {
		return optimized;
	}

	/**
	 * Dumps the function to the provided {@link PrintStream}.
	 *
	 * @param ps destination stream for the listing
	 */
	public void dump(PrintStream ps) {
		StringBuilder signature = new StringBuilder();
		signature.append("function ").append(name).append('(');
		for (int i = 0; i < parameters.size(); i++) {
			if (i > 0) {
				signature.append(", ");
			}
			signature.append(parameters.get(i).reference());
		}
		signature.append(')');
		ps.println(signature);
		Map<BasicBlock, List<BasicBlock>> predecessors = predecessors();
		for (BasicBlock block : blocks) {
			ps.print(block.getName() + ":");
			List<BasicBlock> preds = predecessors.get(block);
			if (!preds.isEmpty()) {
				ps.print("   ; preds = " + preds);
			}
			ps.println();
			for (Instruction instruction : block.getInstructions()) {
				ps.println("    " + instruction);
			}
		}
	}
}
