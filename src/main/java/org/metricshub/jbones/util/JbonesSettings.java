package org.metricshub.jbones.util;

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
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A simple container for the parameters of a single Jbones invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jbones programmatically, from within Java code.
 *
 * @author Danny Daglas
 */
public class JbonesSettings {

	/**
	 * Where values of runtime inputs are prompted from, when they were not
	 * supplied up front.
	 * By default, this is {@link System#in}.
	 */
	private InputStream input = System.in;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means the reported values go to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Variables bound to parameters of the generated function, in parameter
	 * order.
	 */
	private List<String> inputNames = new ArrayList<String>();

	/**
	 * Values of runtime inputs supplied before execution (-v assignments).
	 */
	private Map<String, BigInteger> inputValues = new LinkedHashMap<String, BigInteger>();

	/**
	 * Whether to run the optimization pass over the generated function;
	 * <code>true</code> by default.
	 */
	private boolean optimize = true;

	/**
	 * Whether to compile to a native executable instead of executing
	 * the function within this JVM;
	 * <code>false</code> by default.
	 */
	private boolean nativeCompilation = false;

	/**
	 * C compiler invoked in native mode.
	 */
	private String compilerCommand = "cc";

	/**
	 * Directory receiving the native artifacts.
	 * <code>null</code> means a fresh temporary directory.
	 */
	private File workDirectory = null;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("inputNames = ").append(getInputNames()).append(newLine);
		desc.append("inputValues = ").append(getInputValues()).append(newLine);
		desc.append("optimize = ").append(isOptimize()).append(newLine);
		desc.append("nativeCompilation = ").append(isNativeCompilation()).append(newLine);
		desc.append("compilerCommand = ").append(getCompilerCommand()).append(newLine);
		desc.append("workDirectory = ").append(getWorkDirectory()).append(newLine);

		return desc.toString();
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InputStream getInput() {
		return input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setInput(InputStream input) {
		this.input = input;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	/**
	 * @return the declared runtime inputs, in parameter order
	 */
	public List<String> getInputNames() {
		return Collections.unmodifiableList(inputNames);
	}

	/**
	 * Declares a variable as a runtime input. The generated function receives
	 * one parameter per declared input, in declaration order.
	 *
	 * @param name variable name
	 */
	public void addInputName(String name) {
		if (inputNames.contains(name)) {
			throw new IllegalArgumentException("Input '" + name + "' declared more than once");
		}
		inputNames.add(name);
	}

	/**
	 * @return the supplied input values, keyed by variable name
	 */
	public Map<String, BigInteger> getInputValues() {
		return Collections.unmodifiableMap(inputValues);
	}

	/**
	 * Supplies the value of a runtime input so it will not be prompted for.
	 *
	 * @param name variable name
	 * @param value initial value
	 */
	public void putInputValue(String name, BigInteger value) {
		inputValues.put(name, value);
	}

	public boolean isOptimize() {
		return optimize;
	}

	public void setOptimize(boolean optimize) {
		this.optimize = optimize;
	}

	public boolean isNativeCompilation() {
		return nativeCompilation;
	}

	public void setNativeCompilation(boolean nativeCompilation) {
		this.nativeCompilation = nativeCompilation;
	}

	public String getCompilerCommand() {
		return compilerCommand;
	}

	public void setCompilerCommand(String compilerCommand) {
		this.compilerCommand = compilerCommand;
	}

	public File getWorkDirectory() {
		return workDirectory;
	}

	public void setWorkDirectory(File workDirectory) {
		this.workDirectory = workDirectory;
	}
}
