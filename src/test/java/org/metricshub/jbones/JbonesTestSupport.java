package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assume.assumeTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jbones.util.JbonesSettings;
import org.metricshub.jbones.util.ScriptSource;

/**
 * Fluent helpers to describe a bare bones program, its inputs and the output
 * it must report, then run it through {@link Jbones} or {@link Cli}.
 */
public final class JbonesTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("jbones-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private JbonesTestSupport() {}

	/**
	 * Creates a builder for a test that exercises the {@link Jbones} API
	 * directly.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static JbonesTestBuilder jbonesTest(String description) {
		return new JbonesTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that exercises the {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * @return true when a C compiler answers on the path
	 */
	public static boolean isCompilerAvailable() {
		try {
			Process process = new ProcessBuilder("cc", "--version").redirectErrorStream(true).start();
			process.getOutputStream().close();
			while (process.getInputStream().read() != -1) {
				// drain
			}
			return process.waitFor() == 0;
		} catch (IOException e) {
			return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/**
	 * Outcome of a configured test: captured output, exit code and thrown
	 * exception, with the expectations to compare them to.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final int exitCode;
		private final String expectedOutput;
		private final List<String> expectedLines;
		private final Integer expectedExitCode;
		private final Class<? extends Throwable> expectedException;
		private final Throwable thrownException;

		TestResult(
				String description,
				String output,
				int exitCode,
				String expectedOutput,
				List<String> expectedLines,
				Integer expectedExitCode,
				Class<? extends Throwable> expectedException,
				Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.exitCode = exitCode;
			this.expectedOutput = expectedOutput;
			this.expectedLines = expectedLines;
			this.expectedExitCode = expectedExitCode;
			this.expectedException = expectedException;
			this.thrownException = thrownException;
		}

		public String output() {
			return output;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * @return the output split into lines, without the trailing newline
		 */
		public String[] lines() {
			return normalizeOutputLines(output).toArray(new String[0]);
		}

		/**
		 * Verifies that the captured output, exit code, or thrown exception match
		 * the expectations defined in the builder.
		 */
		public void assertExpected() {
			if (expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but execution completed successfully");
				}
				if (!expectedException.isInstance(thrownException)) {
					throw new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName()
									+ ": "
									+ thrownException.getMessage());
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			if (expectedLines != null) {
				assertEquals("Unexpected output for " + description, expectedLines, normalizeOutputLines(output));
			} else if (expectedOutput != null) {
				assertEquals("Unexpected output for " + description, expectedOutput, output);
			}
			int expectedCode = expectedExitCode != null ? expectedExitCode.intValue() : 0;
			assertEquals("Unexpected exit code for " + description, expectedCode, exitCode);
		}

		private static List<String> normalizeOutputLines(String output) {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n").replace("\r", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/**
	 * Common configuration of both builders.
	 *
	 * @param <B> concrete builder type
	 */
	abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected String script;
		protected String stdin = "";
		protected String expectedOutput;
		protected List<String> expectedLines;
		protected Integer expectedExitCode;
		protected Class<? extends Throwable> expectedException;
		protected boolean requiresCompiler;

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		protected B self() {
			return (B) this;
		}

		public B script(String scriptParam) {
			this.script = scriptParam;
			return self();
		}

		/**
		 * Lines typed on the input stream, answering the input prompts.
		 */
		public B stdin(String stdinParam) {
			this.stdin = stdinParam;
			return self();
		}

		public B expect(String expected) {
			this.expectedOutput = expected;
			return self();
		}

		public B expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return self();
		}

		public B expectExit(int code) {
			this.expectedExitCode = code;
			return self();
		}

		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			this.expectedException = exceptionClass;
			return self();
		}

		/**
		 * Skips the test when no C compiler is available.
		 */
		public B requiresCompiler() {
			this.requiresCompiler = true;
			return self();
		}

		/**
		 * Executes the test and returns the captured result without asserting it.
		 */
		public TestResult run() throws Exception {
			if (script == null) {
				throw new IllegalStateException("No script for " + description);
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			PrintStream printStream = new PrintStream(out, true, StandardCharsets.UTF_8.name());
			int exitCode = 0;
			Throwable thrown = null;
			try {
				exitCode = execute(printStream);
			} catch (Exception e) {
				thrown = e;
			}
			printStream.flush();
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8.name()),
					exitCode,
					expectedOutput,
					expectedLines,
					expectedExitCode,
					expectedException,
					thrown);
		}

		public void runAndAssert() throws Exception {
			if (requiresCompiler) {
				assumeTrue("No C compiler available", isCompilerAvailable());
			}
			run().assertExpected();
		}

		protected abstract int execute(PrintStream out) throws Exception;
	}

	/**
	 * Builder for tests calling {@link Jbones#invoke(ScriptSource, JbonesSettings)}.
	 */
	public static final class JbonesTestBuilder extends BaseTestBuilder<JbonesTestBuilder> {
		private final Map<String, BigInteger> inputValues = new LinkedHashMap<String, BigInteger>();
		private final List<String> promptedInputs = new ArrayList<String>();
		private boolean optimize = true;
		private boolean nativeCompilation;

		private JbonesTestBuilder(String description) {
			super(description);
		}

		/**
		 * Declares {@code name} as a runtime input with the given value.
		 */
		public JbonesTestBuilder input(String name, long value) {
			return input(name, BigInteger.valueOf(value));
		}

		public JbonesTestBuilder input(String name, BigInteger value) {
			inputValues.put(name, value);
			return this;
		}

		/**
		 * Declares {@code name} as a runtime input read from {@link #stdin(String)}.
		 */
		public JbonesTestBuilder promptedInput(String name) {
			promptedInputs.add(name);
			return this;
		}

		public JbonesTestBuilder noOptimize() {
			this.optimize = false;
			return this;
		}

		public JbonesTestBuilder nativeCompilation() {
			this.nativeCompilation = true;
			return requiresCompiler();
		}

		@Override
		protected int execute(PrintStream out) throws Exception {
			JbonesSettings settings = new JbonesSettings();
			settings.setOutputStream(out);
			settings.setInput(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
			settings.setOptimize(optimize);
			settings.setNativeCompilation(nativeCompilation);
			if (nativeCompilation) {
				settings.setWorkDirectory(Files.createTempDirectory(SHARED_TEMP_DIR, "native").toFile());
			}
			for (Map.Entry<String, BigInteger> input : inputValues.entrySet()) {
				settings.addInputName(input.getKey());
				settings.putInputValue(input.getKey(), input.getValue());
			}
			for (String name : promptedInputs) {
				settings.addInputName(name);
			}
			new Jbones().invoke(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(script)), settings);
			return 0;
		}
	}

	/**
	 * Builder for tests running {@link Cli#execute(String[], java.io.InputStream, PrintStream, PrintStream)}
	 * on the script written to a temporary file.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<String>();
		private final ByteArrayOutputStream errors = new ByteArrayOutputStream();

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * Options placed before the script file name.
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * @return what the CLI printed on its error stream
		 */
		public String errors() {
			return new String(errors.toByteArray(), StandardCharsets.UTF_8);
		}

		@Override
		protected int execute(PrintStream out) throws Exception {
			File scriptFile = Files.createTempFile(SHARED_TEMP_DIR, "script", ".bb").toFile();
			scriptFile.deleteOnExit();
			Files.write(scriptFile.toPath(), script.getBytes(StandardCharsets.UTF_8));
			List<String> args = new ArrayList<String>(arguments);
			args.add(scriptFile.getPath());
			PrintStream err = new PrintStream(errors, true, StandardCharsets.UTF_8.name());
			return Cli.execute(
					args.toArray(new String[0]),
					new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
					out,
					err);
		}
	}
}
