package org.metricshub.jbones.backend;

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
import java.util.List;
import org.metricshub.jbones.intermediate.BasicBlock;
import org.metricshub.jbones.intermediate.Constant;
import org.metricshub.jbones.intermediate.Instruction;
import org.metricshub.jbones.intermediate.Parameter;
import org.metricshub.jbones.intermediate.PhiInstruction;
import org.metricshub.jbones.intermediate.SsaFunction;
import org.metricshub.jbones.intermediate.Value;
import org.metricshub.jbones.jrt.JbonesRuntimeException;
import org.metricshub.jbones.jrt.WideInteger;
import org.metricshub.jbones.util.JbonesLogger;
import org.slf4j.Logger;

/**
 * Executes an {@link SsaFunction} in process.
 * <p>
 * Every value of the function owns one register, indexed by its id. On entry
 * into a block, its phis are evaluated all at once from the block just left,
 * then the remaining instructions run in order until the terminator selects
 * the next block.
 */
public class SsaInterpreter implements ProgramRunner {

	private static final Logger LOG = JbonesLogger.getLogger(SsaInterpreter.class);

	private final PrintStream output;

	/**
	 * <p>
	 * Constructor for SsaInterpreter.
	 * </p>
	 *
	 * @param output where reported values are printed
	 */
	public SsaInterpreter(PrintStream output) {
		this.output = output;
	}

	/** {@inheritDoc} */
	@Override
	public long run(SsaFunction function, List<BigInteger> arguments) {
		if (!function.isSealed()) {
			throw new IllegalStateException("Function " + function.getName() + " is not finished");
		}
		List<Parameter> parameters = function.getParameters();
		if (arguments.size() != parameters.size()) {
			throw new JbonesRuntimeException(
					"Function " + function.getName() + " expects " + parameters.size() + " arguments but got " + arguments.size());
		}

		BigInteger[] registers = new BigInteger[function.getValueCount()];
		boolean[] conditions = new boolean[function.getValueCount()];
		for (Parameter parameter : parameters) {
			BigInteger argument = arguments.get(parameter.getIndex());
			if (!WideInteger.fits(argument)) {
				throw new JbonesRuntimeException(
						"Value " + argument + " of " + parameter.getName() + " does not fit in a " + WideInteger.BITS + "-bit signed integer");
			}
			registers[parameter.getId()] = argument;
		}

		long start = System.nanoTime();
		long steps = 0;
		BasicBlock previous = null;
		BasicBlock block = function.getEntryBlock();

		while (true) {
			List<PhiInstruction> phis = block.getPhis();
			BigInteger[] incoming = new BigInteger[phis.size()];
			for (int i = 0; i < incoming.length; i++) {
				PhiInstruction phi = phis.get(i);
				Value value = phi.incomingFrom(previous);
				if (value == null) {
					throw new JbonesRuntimeException(
							"Phi " + phi.reference() + " of " + block.getName() + " has no incoming value from " + previous);
				}
				incoming[i] = read(registers, value);
			}
			for (int i = 0; i < incoming.length; i++) {
				registers[phis.get(i).getId()] = incoming[i];
			}

			List<Instruction> instructions = block.getInstructions();
			BasicBlock next = null;
			for (int pc = phis.size(); pc < instructions.size() && next == null; pc++) {
				Instruction instruction = instructions.get(pc);
				steps++;
				switch (instruction.getOpcode()) {
				case ADD_ONE:
					registers[instruction.getId()] = WideInteger.addOne(read(registers, instruction.getOperand(0)));
					break;
				case SUB_ONE:
					registers[instruction.getId()] = WideInteger.subtractOne(read(registers, instruction.getOperand(0)));
					break;
				case CMP_EQ:
					conditions[instruction.getId()] = read(registers, instruction.getOperand(0))
							.equals(read(registers, instruction.getOperand(1)));
					break;
				case REPORT:
					output.println(instruction.getLabel() + ": " + read(registers, instruction.getOperand(0)));
					break;
				case BRANCH:
					next = instruction.getTargets().get(0);
					break;
				case COND_BRANCH:
					next = conditions[instruction.getOperand(0).getId()] ? instruction.getTargets().get(0) : instruction.getTargets().get(1);
					break;
				case RETURN:
					output.flush();
					long elapsed = System.nanoTime() - start;
					LOG.debug("{} returned after {} instructions", function.getName(), steps);
					return elapsed;
				default:
					throw new JbonesRuntimeException("Unexpected " + instruction.getOpcode() + " in " + block.getName());
				}
			}
			if (next == null) {
				throw new JbonesRuntimeException("Block " + block.getName() + " ends without a terminator");
			}
			previous = block;
			block = next;
		}
	}

	private static BigInteger read(BigInteger[] registers, Value value) {
		if (value instanceof Constant) {
			return ((Constant) value).getValue();
		}
		BigInteger content = registers[value.getId()];
		if (content == null) {
			throw new JbonesRuntimeException("Use of " + value.reference() + " before its definition");
		}
		return content;
	}
}
