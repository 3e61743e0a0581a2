package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jbones.frontend.LexerException;
import org.metricshub.jbones.frontend.ParserException;
import org.metricshub.jbones.intermediate.CodeGenerationException;
import org.metricshub.jbones.jrt.JbonesRuntimeException;
import org.metricshub.jbones.jrt.WideInteger;

public class JbonesTest {

	private static final String MULTIPLY = "clear z;\n"
			+ "while x not 0 do;\n"
			+ "  clear w;\n"
			+ "  while y not 0 do;\n"
			+ "    incr z;\n"
			+ "    incr w;\n"
			+ "    decr y;\n"
			+ "  end;\n"
			+ "  while w not 0 do;\n"
			+ "    incr y;\n"
			+ "    decr w;\n"
			+ "  end;\n"
			+ "  decr x;\n"
			+ "end;\n";

	@Test
	public void twoIncrementsReportTwo() throws Exception {
		JbonesTestSupport
				.jbonesTest("clear then two increments")
				.script("clear x; incr x; incr x;")
				.expect("x: 2\n")
				.runAndAssert();
	}

	@Test
	public void decrementLoopThenCopy() throws Exception {
		JbonesTestSupport
				.jbonesTest("decrement loop then copy")
				.script("incr x; incr x; decr x; clear y; while x 0 do decr x end; copy x to y")
				.expectLines("x: 0", "y: 0")
				.runAndAssert();
	}

	@Test
	public void decrementSaturatesAtZero() throws Exception {
		JbonesTestSupport
				.jbonesTest("decrement of zero")
				.script("decr x; decr x; incr y; decr y; decr y")
				.expectLines("x: 0", "y: 0")
				.runAndAssert();
	}

	@Test
	public void straightLineOperationsApplyInOrder() throws Exception {
		JbonesTestSupport
				.jbonesTest("straight line program")
				.script("incr a; incr a; copy a to b; incr a; decr b; clear c; incr c")
				.expectLines("a: 3", "b: 1", "c: 1")
				.runAndAssert();
	}

	@Test
	public void copyOntoItselfKeepsValue() throws Exception {
		JbonesTestSupport
				.jbonesTest("copy x to x")
				.script("incr x; copy x to x")
				.expect("x: 1\n")
				.runAndAssert();
	}

	@Test
	public void loopBodyIsSkippedWhenBoundAlreadyReached() throws Exception {
		JbonesTestSupport
				.jbonesTest("zero iterations")
				.script("incr y; while x not 0 do incr y; end")
				.expectLines("y: 1", "x: 0")
				.runAndAssert();
	}

	@Test
	public void loopRunsUntilVariableEqualsBound() throws Exception {
		JbonesTestSupport
				.jbonesTest("count up to five")
				.script("while x not 5 do incr x; incr y; end")
				.expectLines("x: 5", "y: 5")
				.runAndAssert();
	}

	@Test
	public void nestedLoopsMultiply() throws Exception {
		JbonesTestSupport
				.jbonesTest("multiplication")
				.script(MULTIPLY)
				.input("x", 3)
				.input("y", 4)
				.expectLines("z: 12", "x: 0", "w: 0", "y: 4")
				.runAndAssert();
	}

	@Test
	public void nestedLoopsMultiplyWithoutOptimization() throws Exception {
		JbonesTestSupport
				.jbonesTest("multiplication, not optimized")
				.script(MULTIPLY)
				.input("x", 6)
				.input("y", 7)
				.noOptimize()
				.expectLines("z: 42", "x: 0", "w: 0", "y: 7")
				.runAndAssert();
	}

	@Test
	public void innerLoopSeesEnclosingBodyValues() throws Exception {
		// b is cleared in the outer body, so the inner loop runs twice per outer iteration
		JbonesTestSupport
				.jbonesTest("inner loop initial frame")
				.script("while a not 3 do incr a; clear b; while b not 2 do incr b; incr t; end; end")
				.expectLines("a: 3", "b: 2", "t: 6")
				.runAndAssert();
	}

	@Test
	public void incrementWrapsAround() throws Exception {
		JbonesTestSupport
				.jbonesTest("128-bit overflow")
				.script("incr x")
				.input("x", WideInteger.MAX_VALUE)
				.expect("x: " + WideInteger.MIN_VALUE + "\n")
				.runAndAssert();
	}

	@Test
	public void largeLoopBound() throws Exception {
		BigInteger bound = BigInteger.ONE.shiftLeft(100);
		JbonesTestSupport
				.jbonesTest("bound beyond 64 bits")
				.script("while x not " + bound + " do incr x end")
				.input("x", bound.subtract(BigInteger.valueOf(3)))
				.expect("x: " + bound + "\n")
				.runAndAssert();
	}

	@Test
	public void missingInputIsPrompted() throws Exception {
		JbonesTestSupport
				.jbonesTest("prompted input")
				.script("decr x")
				.promptedInput("x")
				.stdin("7\n")
				.expect("x: x: 6\n")
				.runAndAssert();
	}

	@Test
	public void reportOrderIsFirstSeenOrder() throws Exception {
		JbonesTestSupport
				.jbonesTest("report order")
				.script("incr zeta; copy alpha to mu; clear zeta; while beta 0 do end")
				.expectLines("zeta: 0", "alpha: 0", "mu: 0", "beta: 0")
				.runAndAssert();
	}

	@Test
	public void keywordsAreCaseInsensitive() throws Exception {
		JbonesTestSupport
				.jbonesTest("mixed case keywords")
				.script("INCR x; Incr x; WHILE x NOT 0 DO DECR x; incr X END")
				.expectLines("x: 0", "X: 2")
				.runAndAssert();
	}

	@Test
	public void commentsAndFluffAreInert() throws Exception {
		JbonesTestSupport
				.jbonesTest("comments and fluff")
				.script("# a comment line\nincr x # counts\ndo not to ; ;\nincr x\n")
				.expect("x: 2\n")
				.runAndAssert();
	}

	@Test
	public void commentWithoutNewlineEndsInput() throws Exception {
		JbonesTestSupport
				.jbonesTest("trailing comment")
				.script("incr x # no newline, incr y")
				.expect("x: 1\n")
				.runAndAssert();
	}

	@Test
	public void unknownWordEndsInput() throws Exception {
		JbonesTestSupport
				.jbonesTest("unknown word")
				.script("incr x; ??? incr y")
				.expect("x: 1\n")
				.runAndAssert();
	}

	@Test
	public void emptyProgramReportsNothing() throws Exception {
		JbonesTestSupport.jbonesTest("empty program").script("  \n# nothing\n").expect("").runAndAssert();
	}

	@Test
	public void whileWithoutBoundFails() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> new Jbones().run("while x"));
		assertTrue(e.getMessage(), e.getMessage().contains("expected number"));
	}

	@Test
	public void copyWithNumberOperandFails() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> new Jbones().run("copy x to 3"));
		assertTrue(e.getMessage(), e.getMessage().contains("expected identifier but found Number(3)"));
	}

	@Test
	public void unmatchedEndFailsWhereItAppears() throws Exception {
		CodeGenerationException e = assertThrows(CodeGenerationException.class, () -> new Jbones().run("incr x\nend\nincr x\n"));
		assertTrue(e.getMessage(), e.getMessage().contains("Unmatched 'end'"));
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void unclosedWhileFails() throws Exception {
		CodeGenerationException e = assertThrows(
				CodeGenerationException.class,
				() -> new Jbones().run("while x not 0 do\n  while y not 0 do\n    decr y\n  end\n"));
		assertTrue(e.getMessage(), e.getMessage().contains("Too many opens"));
		assertTrue(e.getMessage(), e.getMessage().contains("line 1"));
	}

	@Test
	public void bareNumberIsNotAStatement() throws Exception {
		JbonesTestSupport.jbonesTest("bare number").script("incr x; 42").expectThrow(ParserException.class).runAndAssert();
	}

	@Test
	public void bareIdentifierIsNotAStatement() throws Exception {
		ParserException e = assertThrows(ParserException.class, () -> new Jbones().run("incr x\nx"));
		assertTrue(e.getMessage(), e.getMessage().contains("is not a statement"));
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void numberBeyond128BitsFails() throws Exception {
		JbonesTestSupport
				.jbonesTest("bound too large")
				.script("while x not 170141183460469231731687303715884105728 do end")
				.expectThrow(LexerException.class)
				.runAndAssert();
	}

	@Test
	public void inputMustBeAProgramVariable() throws Exception {
		JbonesRuntimeException e = assertThrows(
				JbonesRuntimeException.class,
				() -> new Jbones().run("incr x", Collections.singletonMap("q", BigInteger.ONE)));
		assertTrue(e.getMessage(), e.getMessage().contains("'q'"));
	}

	@Test
	public void runWithInputs() throws Exception {
		assertEquals("x: 11\n", new Jbones().run("incr x", Collections.singletonMap("x", BigInteger.TEN)));
	}

	@Test
	public void lastProgramKeepsTheParsedStatements() throws Exception {
		Jbones jbones = new Jbones();
		jbones.compile("copy a to b; incr b");
		assertEquals(3, jbones.getLastProgram().getStatements().size());
		assertEquals(Arrays.asList("a", "b"), jbones.getLastProgram().getVariables().names());

		assertThrows(ParserException.class, () -> jbones.compile("incr a; 12"));
		assertNull(jbones.getLastProgram());
	}
}
