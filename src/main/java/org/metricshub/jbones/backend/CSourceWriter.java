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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jbones.intermediate.BasicBlock;
import org.metricshub.jbones.intermediate.Constant;
import org.metricshub.jbones.intermediate.Instruction;
import org.metricshub.jbones.intermediate.Parameter;
import org.metricshub.jbones.intermediate.PhiInstruction;
import org.metricshub.jbones.intermediate.SsaFunction;
import org.metricshub.jbones.intermediate.Value;
import org.metricshub.jbones.intermediate.ValueType;

/**
 * Lowers an {@link SsaFunction} to a C translation unit.
 * <p>
 * Wide integers become {@code __int128}. Every value is a local variable, every
 * block a label. Phis are eliminated by copying the incoming values on each
 * edge into the phi variables, through temporaries so that the copies of one
 * edge happen simultaneously. Parameters are read from the command line and
 * reports are printed as {@code name: value} lines.
 */
public class CSourceWriter {

	private static final String PRELUDE = "prelude.c";
	private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
	private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
	private static final BigInteger MASK_64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

	private final SsaFunction function;

	/**
	 * <p>
	 * Constructor for CSourceWriter.
	 * </p>
	 *
	 * @param function a sealed function
	 */
	public CSourceWriter(SsaFunction function) {
		if (!function.isSealed()) {
			throw new IllegalStateException("Function " + function.getName() + " is not finished");
		}
		this.function = function;
	}

	/**
	 * Writes the complete translation unit.
	 *
	 * @param writer destination, left open
	 * @throws IOException upon a write error or a missing prelude resource
	 */
	public void write(Writer writer) throws IOException {
		writePrelude(writer);
		PrintWriter out = new PrintWriter(writer);
		List<Parameter> parameters = function.getParameters();

		out.println("int main(int argc, char **argv) {");
		out.println("\tif (argc != " + (parameters.size() + 1) + ") {");
		out.println("\t\tfprintf(stderr, \"usage: %s" + usageArguments(parameters) + "\\n\", argv[0]);");
		out.println("\t\treturn 2;");
		out.println("\t}");
		for (Parameter parameter : parameters) {
			out.println("\tjb_int " + name(parameter) + " = jb_parse(argv[" + (parameter.getIndex() + 1) + "]);");
		}
		for (BasicBlock block : function.getBlocks()) {
			for (Instruction instruction : block.getInstructions()) {
				if (instruction.getType() == ValueType.WIDE_INT) {
					out.println("\tjb_int " + name(instruction) + ";");
				} else if (instruction.getType() == ValueType.BOOLEAN) {
					out.println("\tint " + name(instruction) + ";");
				}
			}
		}
		for (BasicBlock block : function.getBlocks()) {
			out.println(block.getName() + ":");
			for (Instruction instruction : block.getInstructions()) {
				writeInstruction(out, block, instruction);
			}
		}
		out.println("}");
		out.flush();
	}

	/**
	 * Convenience method returning the translation unit as a string.
	 */
	public String writeToString() {
		StringWriter writer = new StringWriter();
		try {
			write(writer);
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
		return writer.toString();
	}

	private void writeInstruction(PrintWriter out, BasicBlock block, Instruction instruction) {
		switch (instruction.getOpcode()) {
		case PHI:
			// assigned on the incoming edges
			break;
		case ADD_ONE:
			out.println("\t" + name(instruction) + " = JB_ADD_ONE(" + operand(instruction, 0) + ");");
			break;
		case SUB_ONE:
			out.println("\t" + name(instruction) + " = JB_SUB_ONE(" + operand(instruction, 0) + ");");
			break;
		case CMP_EQ:
			out.println("\t" + name(instruction) + " = " + operand(instruction, 0) + " == " + operand(instruction, 1) + ";");
			break;
		case REPORT:
			out.println("\tjb_report(\"" + instruction.getLabel() + "\", " + operand(instruction, 0) + ");");
			break;
		case BRANCH:
			out.println("\t" + jump(block, instruction.getTargets().get(0)));
			break;
		case COND_BRANCH:
			out.println("\tif (" + operand(instruction, 0) + ") {");
			out.println("\t\t" + jump(block, instruction.getTargets().get(0)));
			out.println("\t} else {");
			out.println("\t\t" + jump(block, instruction.getTargets().get(1)));
			out.println("\t}");
			break;
		case RETURN:
			out.println("\treturn 0;");
			break;
		default:
			throw new IllegalStateException("Unexpected opcode " + instruction.getOpcode());
		}
	}

	/**
	 * Jump from {@code from} to {@code to}, assigning the phis of {@code to}.
	 */
	private String jump(BasicBlock from, BasicBlock to) {
		List<PhiInstruction> phis = to.getPhis();
		if (phis.isEmpty()) {
			return "goto " + to.getName() + ";";
		}
		List<String> assignments = new ArrayList<String>();
		StringBuilder sb = new StringBuilder("{ ");
		for (int i = 0; i < phis.size(); i++) {
			Value incoming = phis.get(i).incomingFrom(from);
			if (incoming == null) {
				throw new IllegalStateException("Phi " + phis.get(i).reference() + " has no value for the edge from " + from.getName());
			}
			sb.append("jb_int t").append(i).append(" = ").append(reference(incoming)).append("; ");
			assignments.add(name(phis.get(i)) + " = t" + i + "; ");
		}
		for (String assignment : assignments) {
			sb.append(assignment);
		}
		return sb.append("goto ").append(to.getName()).append("; }").toString();
	}

	private static String operand(Instruction instruction, int index) {
		return reference(instruction.getOperand(index));
	}

	private static String reference(Value value) {
		if (value instanceof Constant) {
			return literal(((Constant) value).getValue());
		}
		return name(value);
	}

	private static String name(Value value) {
		return "v" + value.getId();
	}

	/**
	 * C has no 128-bit literals: large constants are assembled from two 64-bit
	 * halves.
	 */
	static String literal(BigInteger value) {
		if (value.compareTo(INT_MIN) > 0 && value.compareTo(INT_MAX) <= 0) {
			return "((jb_int) " + value + ")";
		}
		BigInteger high = value.shiftRight(64).and(MASK_64);
		BigInteger low = value.and(MASK_64);
		return "JB_CONST(0x" + high.toString(16) + "ULL, 0x" + low.toString(16) + "ULL)";
	}

	private static String usageArguments(List<Parameter> parameters) {
		StringBuilder sb = new StringBuilder();
		for (Parameter parameter : parameters) {
			sb.append(' ').append(parameter.getName());
		}
		return sb.toString();
	}

	private static void writePrelude(Writer writer) throws IOException {
		InputStream in = CSourceWriter.class.getResourceAsStream(PRELUDE);
		if (in == null) {
			throw new IOException("Missing resource " + PRELUDE);
		}
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			char[] buffer = new char[4096];
			int count;
			while ((count = reader.read(buffer)) != -1) {
				writer.write(buffer, 0, count);
			}
		}
	}
}
