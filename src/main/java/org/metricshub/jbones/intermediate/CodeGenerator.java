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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.metricshub.jbones.jrt.JbonesRuntimeException;
import org.metricshub.jbones.util.JbonesLogger;
import org.slf4j.Logger;

/**
 * Translates the statements of a program, replayed one by one in source order,
 * into a single {@link SsaFunction}.
 * <p>
 * The current value of every variable is kept in the top {@link ValueFrame}
 * of a {@link ScopeStack}. Opening a loop pushes a frame made of the loop
 * header phis; closing it wires the back edge into those phis and continues
 * in the exit block, where the phis are the values of the variables.
 * <p>
 * Once {@link #finish()} has run, the function is sealed and every further
 * operation throws an {@link IllegalStateException}.
 */
public class CodeGenerator {

	private static final Logger LOG = JbonesLogger.getLogger(CodeGenerator.class);

	/** Name of the generated function. */
	public static final String FUNCTION_NAME = "main";

	private final VariableTable variables;
	private final String sourceDescription;
	private final SsaFunction function;
	private final SsaBuilder builder;
	private final ScopeStack scopes = new ScopeStack();
	private final Deque<LoopContext> loops = new ArrayDeque<LoopContext>();
	private int lineNumber;
	private boolean finished;

	/**
	 * <p>
	 * Constructor for CodeGenerator.
	 * </p>
	 *
	 * @param variables every variable referenced by the program
	 * @param inputNames variables initialized from the function parameters, in
	 *        parameter order; all other variables start at zero
	 * @param sourceDescription description of the program source, for messages
	 */
	public CodeGenerator(VariableTable variables, List<String> inputNames, String sourceDescription) {
		this.variables = variables;
		this.sourceDescription = sourceDescription;
		this.function = new SsaFunction(FUNCTION_NAME);
		this.builder = new SsaBuilder(function);

		List<Value> initial = new ArrayList<Value>(Collections.nCopies(variables.size(), (Value) function.constant(BigInteger.ZERO)));
		for (String inputName : inputNames) {
			int index = variables.indexOf(inputName);
			if (index < 0) {
				throw new JbonesRuntimeException("Input variable '" + inputName + "' does not appear in " + sourceDescription);
			}
			initial.set(index, function.addParameter(inputName));
		}
		builder.positionAtEnd(function.createBlock("entry"));
		scopes.push(ValueFrame.of(initial));
	}

	/**
	 * Sets the source line of the statement being translated, used in error
	 * messages.
	 */
	public void setLineNumber(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * {@code var = var + 1}
	 */
	public void increment(String var) {
		checkNotFinished();
		int index = indexOf(var);
		Value current = scopes.top().get(index);
		update(index, builder.addOne(current, var));
	}

	/**
	 * {@code var = var - 1}, unless {@code var} is already zero.
	 */
	public void decrement(String var) {
		checkNotFinished();
		int index = indexOf(var);
		Value current = scopes.top().get(index);

		BasicBlock origin = builder.getInsertBlock();
		BasicBlock compute = builder.createBlock("not_zero");
		BasicBlock merge = builder.createBlock("decremented");
		Value isZero = builder.compareEqual(current, builder.constant(BigInteger.ZERO));
		builder.conditionalBranch(isZero, merge, compute);

		builder.positionAtEnd(compute);
		Value decremented = builder.subtractOne(current, var);
		builder.branch(merge);

		builder.positionAtEnd(merge);
		PhiInstruction phi = builder.phi(var);
		phi.addIncoming(current, origin);
		phi.addIncoming(decremented, compute);
		update(index, phi);
	}

	/**
	 * {@code var = 0}
	 */
	public void clear(String var) {
		checkNotFinished();
		update(indexOf(var), builder.constant(BigInteger.ZERO));
	}

	/**
	 * {@code to = from}
	 */
	public void copy(String from, String to) {
		checkNotFinished();
		int fromIndex = indexOf(from);
		int toIndex = indexOf(to);
		if (fromIndex == toIndex) {
			return;
		}
		update(toIndex, scopes.top().get(fromIndex));
	}

	/**
	 * Opens a loop that runs as long as {@code var} differs from {@code bound}.
	 * The test happens before each iteration, so the body may run zero times.
	 */
	public void openWhile(String var, BigInteger bound) {
		checkNotFinished();
		int index = indexOf(var);
		ValueFrame entering = scopes.top();
		BasicBlock from = builder.getInsertBlock();

		BasicBlock header = builder.createBlock("loop");
		BasicBlock body = builder.createBlock("body");
		BasicBlock exit = builder.createBlock("exit");
		builder.branch(header);

		builder.positionAtEnd(header);
		List<PhiInstruction> phis = new ArrayList<PhiInstruction>(variables.size());
		for (int i = 0; i < variables.size(); i++) {
			PhiInstruction phi = builder.phi(variables.nameOf(i));
			phi.addIncoming(entering.get(i), from);
			phis.add(phi);
		}
		Value done = builder.compareEqual(phis.get(index), builder.constant(bound));
		builder.conditionalBranch(done, exit, body);

		builder.positionAtEnd(body);
		scopes.push(ValueFrame.of(phis));
		loops.push(new LoopContext(phis, header, exit, lineNumber));
		LOG.trace("Opened loop {} on {} != {} at line {}", header, var, bound, lineNumber);
	}

	/**
	 * Closes the innermost open loop and continues after it.
	 *
	 * @throws CodeGenerationException when no loop is open
	 */
	public void closeWhile() {
		checkNotFinished();
		if (loops.isEmpty()) {
			throw new CodeGenerationException("Unmatched 'end': no 'while' loop is open", sourceDescription, lineNumber);
		}
		LoopContext loop = loops.pop();
		ValueFrame last = scopes.pop();
		BasicBlock latch = builder.getInsertBlock();
		builder.branch(loop.getHeader());

		List<PhiInstruction> phis = loop.getPhis();
		for (int i = 0; i < phis.size(); i++) {
			phis.get(i).addIncoming(last.get(i), latch);
		}

		builder.positionAtEnd(loop.getExit());
		// the frame in effect before the loop is superseded by the header phis
		scopes.replaceTop(ValueFrame.of(phis));
		LOG.trace("Closed loop {} at line {}", loop.getHeader(), lineNumber);
	}

	/**
	 * Reports every variable in table order, returns, and seals the function.
	 *
	 * @throws CodeGenerationException when a loop is still open
	 */
	public void finish() {
		checkNotFinished();
		if (!loops.isEmpty()) {
			throw new CodeGenerationException(
					"Too many opens: the 'while' loop opened at line " + loops.peek().getLineNumber() + " is never closed",
					sourceDescription,
					lineNumber);
		}
		if (scopes.depth() != 1) {
			throw new CodeGenerationException("Stack frame not empty: " + scopes.depth() + " frames left", sourceDescription, lineNumber);
		}
		ValueFrame last = scopes.top();
		for (int i = 0; i < variables.size(); i++) {
			builder.report(variables.nameOf(i), last.get(i));
		}
		builder.returnVoid();
		function.seal();
		finished = true;
		LOG.debug(
				"Generated {} blocks and {} values for {} variables from {}",
				function.getBlocks().size(),
				function.getValueCount(),
				variables.size(),
				sourceDescription);
	}

	public SsaFunction getFunction() {
		return function;
	}

	public VariableTable getVariableTable() {
		return variables;
	}

	public boolean isFinished() {
		return finished;
	}

	/**
	 * @return number of frames on the scope stack, one more than the loop nesting
	 */
	public int getScopeDepth() {
		return scopes.depth();
	}

	/**
	 * @return number of loops currently open
	 */
	public int getLoopDepth() {
		return loops.size();
	}

	/**
	 * @return current value of every variable
	 */
	public ValueFrame getCurrentFrame() {
		return scopes.top();
	}

	private void update(int index, Value value) {
		scopes.replaceTop(scopes.top().with(index, value));
	}

	private int indexOf(String var) {
		int index = variables.indexOf(var);
		if (index < 0) {
			throw new CodeGenerationException("Unknown variable '" + var + "'", sourceDescription, lineNumber);
		}
		return index;
	}

	private void checkNotFinished() {
		if (finished) {
			throw new IllegalStateException("Code generation of " + sourceDescription + " is already finished");
		}
	}
}
