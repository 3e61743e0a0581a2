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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.metricshub.jbones.intermediate.SsaFunction;
import org.metricshub.jbones.util.JbonesLogger;
import org.metricshub.jbones.util.JbonesSettings;
import org.slf4j.Logger;

/**
 * Compiles an {@link SsaFunction} to a native executable with an external C
 * compiler, then runs it as a child process whose standard output is
 * forwarded to the configured output stream.
 */
public class NativeCompiler implements ProgramRunner {

	private static final Logger LOG = JbonesLogger.getLogger(NativeCompiler.class);

	private static final boolean IS_WINDOWS = System.getProperty("os.name").indexOf("Windows") >= 0;

	private final JbonesSettings settings;
	private File executable;
	private File temporaryDirectory;

	/**
	 * <p>
	 * Constructor for NativeCompiler.
	 * </p>
	 *
	 * @param settings compiler command, work directory and output stream
	 */
	public NativeCompiler(JbonesSettings settings) {
		this.settings = settings;
	}

	/**
	 * Writes the C source of {@code function} and compiles it.
	 *
	 * @param function a sealed function
	 * @return the executable
	 * @throws IOException upon a problem writing the source
	 * @throws ToolchainException if the compiler fails
	 */
	public File compile(SsaFunction function) throws IOException {
		File workDirectory = settings.getWorkDirectory();
		if (workDirectory == null) {
			workDirectory = Files.createTempDirectory("jbones").toFile();
			temporaryDirectory = workDirectory;
		} else if (!workDirectory.isDirectory() && !workDirectory.mkdirs()) {
			throw new IOException("Cannot create directory " + workDirectory);
		}
		File source = new File(workDirectory, function.getName() + ".c");
		try (Writer writer = new OutputStreamWriter(new FileOutputStream(source), StandardCharsets.UTF_8)) {
			new CSourceWriter(function).write(writer);
		}
		File target = new File(workDirectory, function.getName() + (IS_WINDOWS ? ".exe" : ""));

		List<String> command = new ArrayList<String>(Arrays.asList(settings.getCompilerCommand().trim().split("\\s+")));
		command.add("-O2");
		command.add("-o");
		command.add(target.getAbsolutePath());
		command.add(source.getAbsolutePath());
		LOG.debug("Compiling {}", command);
		execute(command, new ByteArrayOutputStream());
		executable = target;
		return target;
	}

	/**
	 * Compiles {@code function}, then runs the executable with the arguments on
	 * its command line.
	 * <p>
	 * The returned time covers the execution of the program only. Without a
	 * configured work directory, the temporary directory holding the source
	 * and the executable is deleted afterwards.
	 */
	@Override
	public long run(SsaFunction function, List<BigInteger> arguments) throws IOException {
		try {
			File program = compile(function);
			List<String> command = new ArrayList<String>();
			command.add(program.getAbsolutePath());
			for (BigInteger argument : arguments) {
				command.add(argument.toString());
			}
			long start = System.nanoTime();
			execute(command, settings.getOutputStream());
			return System.nanoTime() - start;
		} finally {
			deleteTemporaryDirectory();
		}
	}

	private void deleteTemporaryDirectory() throws IOException {
		if (temporaryDirectory == null) {
			return;
		}
		Path root = temporaryDirectory.toPath();
		temporaryDirectory = null;
		try (Stream<Path> paths = Files.walk(root)) {
			List<Path> entries = new ArrayList<Path>();
			paths.sorted(Comparator.reverseOrder()).forEach(entries::add);
			for (Path entry : entries) {
				Files.deleteIfExists(entry);
			}
		}
		LOG.debug("Deleted {}", root);
	}

	/**
	 * @return the executable built by the last compilation, or null; after
	 *         {@link #run} without a work directory, the file no longer exists
	 */
	public File getExecutable() {
		return executable;
	}

	/**
	 * Runs {@code command} to completion, relaying its standard output to
	 * {@code output}.
	 */
	private static void execute(List<String> command, OutputStream output) throws IOException {
		String tool = command.get(0);
		Process process;
		try {
			process = new ProcessBuilder(command).start();
		} catch (IOException e) {
			throw new ToolchainException("Cannot run " + tool + ": " + e.getMessage(), e);
		}
		// no input to this process!
		process.getOutputStream().close();
		ByteArrayOutputStream errors = new ByteArrayOutputStream();
		DataPump errorPump = DataPump.dump(tool, process.getErrorStream(), errors);
		DataPump outputPump = DataPump.dump(tool, process.getInputStream(), output);
		int exitCode;
		try {
			exitCode = process.waitFor();
			errorPump.join();
			outputPump.join();
		} catch (InterruptedException e) {
			process.destroy();
			Thread.currentThread().interrupt();
			throw new ToolchainException("Interrupted while waiting for " + tool, e);
		}
		String errorText = new String(errors.toByteArray(), StandardCharsets.UTF_8).trim();
		if (exitCode != 0) {
			throw new ToolchainException(tool + " exited with status " + exitCode, exitCode, errorText);
		}
		if (!errorText.isEmpty()) {
			LOG.warn("{}: {}", tool, errorText);
		}
	}
}
