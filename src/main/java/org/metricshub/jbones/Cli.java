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
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jbones.intermediate.SsaFunction;
import org.metricshub.jbones.jrt.JbonesRuntimeException;
import org.metricshub.jbones.jrt.WideInteger;
import org.metricshub.jbones.util.JbonesLogger;
import org.metricshub.jbones.util.JbonesSettings;
import org.metricshub.jbones.util.ScriptFileSource;
import org.metricshub.jbones.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jbones.
 *
 * @author Danny Daglas
 */
public final class Cli {

	private static final Logger LOG = JbonesLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jbones.jar";
		}
		JAR_NAME = myName;
	}

	/** Exit status upon a bad command line. */
	public static final int EXIT_BAD_ARGUMENTS = 2;

	/** Exit status upon any failure of the program. */
	public static final int EXIT_FAILURE = 1;

	private static final Pattern INPUT_VALUE_PATTERN = Pattern.compile("([a-zA-Z]\\w*)=(.*)");

	private final JbonesSettings settings = new JbonesSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean dumpIntermediateCode;
	private boolean printUsage;

	/**
	 * Create a CLI bound to the standard streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Create a CLI bound to the provided streams.
	 *
	 * @param in input stream, where input values are prompted from
	 * @param out output stream, where reports and listings go
	 * @param err error stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		this.out = out;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JbonesSettings getSettings() {
		return settings;
	}

	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isDumpIntermediateCode() {
		return dumpIntermediateCode;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parse the command line arguments.
	 *
	 * @param args command line arguments
	 * @throws IllegalArgumentException upon a bad command line
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the input file
				break;
			} else if (arg.equals("-c") || arg.equals("--compile")) {
				settings.setNativeCompilation(true);
			} else if (arg.equals("-i") || arg.equals("--input")) {
				checkParameterHasArgument(args, argIdx);
				declareInput(args[++argIdx]);
			} else if (arg.equals("-v")) {
				// -v name=val : value of a runtime input
				checkParameterHasArgument(args, argIdx);
				addInputValue(args[++argIdx]);
			} else if (arg.equals("-s") || arg.equals("--no-optimize")) {
				settings.setOptimize(false);
			} else if (arg.equals("--dump-intermediate")) {
				dumpIntermediateCode = true;
			} else if (arg.equals("--cc")) {
				checkParameterHasArgument(args, argIdx);
				settings.setCompilerCommand(args[++argIdx]);
			} else if (arg.equals("-o")) {
				checkParameterHasArgument(args, argIdx);
				settings.setWorkDirectory(new File(args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("Input file not provided.");
		}
		if (argIdx != args.length - 1) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx + 1]);
		}
		if (settings.isNativeCompilation() && dumpIntermediateCode) {
			throw new IllegalArgumentException("--dump-intermediate cannot be combined with -c");
		}
		scriptSource = new ScriptFileSource(args[argIdx]);
		if (!new File(args[argIdx]).isFile()) {
			throw new IllegalArgumentException("Input file not found: " + args[argIdx]);
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private void declareInput(String name) {
		if (!name.matches("[a-zA-Z]\\w*")) {
			throw new IllegalArgumentException("Invalid input name: " + name);
		}
		settings.addInputName(name);
	}

	/**
	 * A value given for a variable that was not declared with -i declares it.
	 */
	private void addInputValue(String keyValue) {
		Matcher m = INPUT_VALUE_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException("keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		String name = m.group(1);
		BigInteger value;
		try {
			value = WideInteger.parse(m.group(2));
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Invalid value for " + name + ": " + m.group(2), nfe);
		}
		if (!settings.getInputNames().contains(name)) {
			settings.addInputName(name);
		}
		settings.putInputValue(name, value);
	}

	/**
	 * Compile, then run or dump, the program given on the command line.
	 *
	 * @throws IOException upon an I/O error
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("Running {} with settings:\n{}", scriptSource.getDescription(), settings.toDescriptionString());
		}
		Jbones jbones = new Jbones();
		SsaFunction function = jbones.compile(scriptSource, settings);
		if (dumpIntermediateCode) {
			function.dump(out);
			return;
		}
		jbones.invoke(function, settings);
	}

	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-c|--compile]" +
								" [-i|--input name]..." +
								" [-v name=val]..." +
								" [-s|--no-optimize]" +
								" [--dump-intermediate]" +
								" [--cc command]" +
								" [-o directory]" +
								" input-file");
		dest.println();
		dest.println(" -c, --compile = Compile to a native executable with a C compiler and run it.");
		dest.println(" -i, --input name = Initialize variable name from a runtime input instead of zero.");
		dest.println(" -v name=val = Value of a runtime input. Inputs without a value are prompted for.");
		dest.println(" -s, --no-optimize = Disable the optimization of the intermediate code.");
		dest.println(" --dump-intermediate = Print the intermediate code and halt.");
		dest.println(" --cc command = C compiler used with -c (default: cc).");
		dest.println(" -o directory = Where -c writes the C source and the executable (default: a temporary directory).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parse the arguments, then run.
	 *
	 * @param args command line arguments
	 * @param is input stream
	 * @param os output stream
	 * @param es error stream
	 * @return the CLI, after the run
	 * @throws IOException upon an I/O error
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Runs the command line, returning the exit status instead of exiting.
	 *
	 * @param args command line arguments
	 * @param is input stream
	 * @param os output stream
	 * @param es error stream, receives the diagnostics
	 * @return 0 upon success, {@link #EXIT_FAILURE} or {@link #EXIT_BAD_ARGUMENTS}
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, InputStream is, PrintStream os, PrintStream es) {
		try {
			create(args, is, os, es);
			return 0;
		} catch (JbonesRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				es.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			return EXIT_FAILURE;
		} catch (IllegalArgumentException e) {
			es.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			es.println(e.getMessage());
			return EXIT_BAD_ARGUMENTS;
		} catch (IOException | RuntimeException e) {
			es.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return EXIT_FAILURE;
		}
	}

	public static void main(String[] args) {
		System.exit(execute(args, System.in, System.out, System.err));
	}
}
