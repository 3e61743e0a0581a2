package org.metricshub.jbones;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.metricshub.jbones.backend.NativeCompiler;
import org.metricshub.jbones.backend.ProgramRunner;
import org.metricshub.jbones.backend.SsaInterpreter;
import org.metricshub.jbones.frontend.JbonesParser;
import org.metricshub.jbones.intermediate.CodeGenerator;
import org.metricshub.jbones.intermediate.Parameter;
import org.metricshub.jbones.intermediate.SsaFunction;
import org.metricshub.jbones.jrt.JbonesRuntimeException;
import org.metricshub.jbones.jrt.WideInteger;
import org.metricshub.jbones.statement.Program;
import org.metricshub.jbones.util.JbonesLogger;
import org.metricshub.jbones.util.JbonesSettings;
import org.metricshub.jbones.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing, compilation and execution of bare bones
 * programs.
 * <p>
 * A program goes through the following stages:
 * <ul>
 * <li>the {@link JbonesParser} turns the source into a {@link Program}</li>
 * <li>the {@link CodeGenerator} translates the program into an
 * {@link SsaFunction}, which is verified and optionally optimized</li>
 * <li>the function is executed in process by the {@link SsaInterpreter}, or
 * compiled to a native executable and run by the {@link NativeCompiler}</li>
 * </ul>
 * Each program reports the final value of all its variables, one
 * {@code name: value} line per variable.
 */
public class Jbones {

	private static final Logger LOG = JbonesLogger.getLogger(Jbones.class);

	private Program lastProgram;

	/**
	 * Returns the program parsed by the last call to a compile method.
	 *
	 * @return the last parsed program, or null
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getLastProgram() {
		return lastProgram;
	}

	/**
	 * Compiles the specified program, with default settings.
	 *
	 * @param script bare bones source
	 * @return the verified and optimized function
	 * @throws IOException upon a read error
	 */
	public SsaFunction compile(String script) throws IOException {
		return compile(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(script)), new JbonesSettings());
	}

	/**
	 * Compiles the specified program into a verified {@link SsaFunction}.
	 * <p>
	 * The function takes one parameter per input declared in
	 * {@code settings}, and is optimized unless
	 * {@link JbonesSettings#isOptimize()} is false.
	 *
	 * @param source the program
	 * @param settings input declarations and optimization flag
	 * @return the function, sealed
	 * @throws IOException upon a read error
	 */
	public SsaFunction compile(ScriptSource source, JbonesSettings settings) throws IOException {
		long start = System.nanoTime();
		lastProgram = null;

		Program program = new JbonesParser().parse(source);
		lastProgram = program;

		CodeGenerator generator = new CodeGenerator(program.getVariables(), settings.getInputNames(), source.getDescription());
		program.emit(generator);
		SsaFunction function = generator.getFunction();
		function.verify();
		if (settings.isOptimize()) {
			function.optimize();
			function.verify();
		}

		long elapsed = System.nanoTime() - start;
		LOG.info("Compilation of {} took {} nanoseconds ({} milliseconds)", source.getDescription(), elapsed, TimeUnit.NANOSECONDS.toMillis(elapsed));
		return function;
	}

	/**
	 * Compiles and executes the specified program.
	 *
	 * @param source the program
	 * @param settings inputs, execution mode and output stream
	 * @throws IOException upon an I/O error
	 */
	public void invoke(ScriptSource source, JbonesSettings settings) throws IOException {
		invoke(compile(source, settings), settings);
	}

	/**
	 * Executes a compiled function, in process or natively depending on
	 * {@link JbonesSettings#isNativeCompilation()}. Input values missing from
	 * the settings are prompted for on the input stream.
	 *
	 * @param function a function returned by a compile method
	 * @param settings inputs, execution mode and output stream
	 * @throws IOException upon an I/O error
	 */
	public void invoke(SsaFunction function, JbonesSettings settings) throws IOException {
		List<BigInteger> arguments = resolveInputs(function, settings);
		ProgramRunner runner;
		if (settings.isNativeCompilation()) {
			runner = new NativeCompiler(settings);
		} else {
			runner = new SsaInterpreter(settings.getOutputStream());
		}
		long elapsed = runner.run(function, arguments);
		LOG.info("Execution took {} nanoseconds ({} milliseconds)", elapsed, TimeUnit.NANOSECONDS.toMillis(elapsed));
	}

	/**
	 * Runs the specified program in process and returns what it reported.
	 *
	 * @param script bare bones source
	 * @return the reported lines
	 * @throws IOException upon an I/O error
	 */
	public String run(String script) throws IOException {
		return run(script, Collections.<String, BigInteger>emptyMap());
	}

	/**
	 * Runs the specified program in process, with the specified variables
	 * initialized from the inputs instead of zero.
	 *
	 * @param script bare bones source
	 * @param inputs initial values, by variable name
	 * @return the reported lines
	 * @throws IOException upon an I/O error
	 */
	public String run(String script, Map<String, BigInteger> inputs) throws IOException {
		JbonesSettings settings = new JbonesSettings();
		for (Map.Entry<String, BigInteger> input : inputs.entrySet()) {
			settings.addInputName(input.getKey());
			settings.putInputValue(input.getKey(), input.getValue());
		}
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		settings.setOutputStream(new PrintStream(out, false, StandardCharsets.UTF_8.name()));
		invoke(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(script)), settings);
		settings.getOutputStream().flush();
		return out.toString(StandardCharsets.UTF_8.name());
	}

	private static List<BigInteger> resolveInputs(SsaFunction function, JbonesSettings settings) throws IOException {
		List<BigInteger> arguments = new ArrayList<BigInteger>();
		BufferedReader prompt = null;
		for (Parameter parameter : function.getParameters()) {
			BigInteger value = settings.getInputValues().get(parameter.getName());
			if (value == null) {
				if (prompt == null) {
					prompt = new BufferedReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
				}
				value = promptInput(parameter.getName(), prompt, settings.getOutputStream());
			} else if (!WideInteger.fits(value)) {
				throw new JbonesRuntimeException("Value " + value + " of input '" + parameter.getName() + "' does not fit in a " + WideInteger.BITS + "-bit signed integer");
			}
			arguments.add(value);
		}
		return arguments;
	}

	private static BigInteger promptInput(String name, BufferedReader reader, PrintStream out) throws IOException {
		out.print(name + ": ");
		out.flush();
		String line = reader.readLine();
		if (line == null) {
			throw new JbonesRuntimeException("No value provided for input '" + name + "'");
		}
		try {
			return WideInteger.parse(line);
		} catch (NumberFormatException e) {
			throw new JbonesRuntimeException("Invalid value for input '" + name + "': " + line, e);
		}
	}
}
