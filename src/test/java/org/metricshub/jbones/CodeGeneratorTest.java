package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbones.intermediate.BasicBlock;
import org.metricshub.jbones.intermediate.CodeGenerationException;
import org.metricshub.jbones.intermediate.CodeGenerator;
import org.metricshub.jbones.intermediate.Constant;
import org.metricshub.jbones.intermediate.Instruction;
import org.metricshub.jbones.intermediate.Opcode;
import org.metricshub.jbones.intermediate.Parameter;
import org.metricshub.jbones.intermediate.PhiInstruction;
import org.metricshub.jbones.intermediate.SsaFunction;
import org.metricshub.jbones.intermediate.Value;
import org.metricshub.jbones.intermediate.VariableTable;
import org.metricshub.jbones.jrt.JbonesRuntimeException;

public class CodeGeneratorTest {

	private static CodeGenerator generator(String... names) {
		return new CodeGenerator(VariableTable.of(Arrays.asList(names)), Collections.<String>emptyList(), "test.bb");
	}

	private static List<Opcode> opcodes(BasicBlock block) {
		List<Opcode> opcodes = new ArrayList<Opcode>();
		for (Instruction instruction : block.getInstructions()) {
			opcodes.add(instruction.getOpcode());
		}
		return opcodes;
	}

	@Test
	public void variablesStartAtZero() {
		CodeGenerator generator = generator("x", "y");
		assertEquals(1, generator.getScopeDepth());
		for (Value value : generator.getCurrentFrame().values()) {
			assertEquals(BigInteger.ZERO, ((Constant) value).getValue());
		}
	}

	@Test
	public void inputsStartFromParameters() {
		CodeGenerator generator = new CodeGenerator(VariableTable.of(Arrays.asList("x", "y")), Collections.singletonList("y"), "test.bb");
		List<Parameter> parameters = generator.getFunction().getParameters();
		assertEquals(1, parameters.size());
		assertSame(parameters.get(0), generator.getCurrentFrame().get(1));
		assertTrue(generator.getCurrentFrame().get(0) instanceof Constant);
	}

	@Test
	public void unknownInputIsRejected() {
		assertThrows(
				JbonesRuntimeException.class,
				() -> new CodeGenerator(VariableTable.of(Arrays.asList("x")), Collections.singletonList("y"), "test.bb"));
	}

	@Test
	public void incrementDoesNotBranch() {
		CodeGenerator generator = generator("x");
		generator.increment("x");
		generator.increment("x");
		generator.finish();
		SsaFunction function = generator.getFunction();
		assertEquals(1, function.getBlocks().size());
		assertEquals(
				Arrays.asList(Opcode.ADD_ONE, Opcode.ADD_ONE, Opcode.REPORT, Opcode.RETURN),
				opcodes(function.getEntryBlock()));
		function.verify();
	}

	@Test
	public void decrementMergesBothEdges() {
		CodeGenerator generator = generator("x");
		generator.decrement("x");
		Value merged = generator.getCurrentFrame().get(0);
		assertTrue(merged instanceof PhiInstruction);
		PhiInstruction phi = (PhiInstruction) merged;
		assertEquals(2, phi.getIncomingValues().size());
		assertTrue(phi.getIncomingValues().get(0) instanceof Constant);
		assertEquals(Opcode.SUB_ONE, ((Instruction) phi.getIncomingValues().get(1)).getOpcode());
		assertEquals(Arrays.asList(Opcode.CMP_EQ, Opcode.COND_BRANCH), opcodes(generator.getFunction().getEntryBlock()));
		generator.finish();
		generator.getFunction().verify();
	}

	@Test
	public void clearAndCopyOnlyRebindValues() {
		CodeGenerator generator = generator("x", "y");
		generator.increment("x");
		Value incremented = generator.getCurrentFrame().get(0);
		generator.copy("x", "y");
		assertSame(incremented, generator.getCurrentFrame().get(1));
		generator.clear("x");
		assertEquals(BigInteger.ZERO, ((Constant) generator.getCurrentFrame().get(0)).getValue());
		assertSame(incremented, generator.getCurrentFrame().get(1));
		assertEquals(1, generator.getFunction().getEntryBlock().getInstructions().size());
	}

	@Test
	public void copyOntoItselfIsANoOp() {
		CodeGenerator generator = generator("x");
		generator.increment("x");
		Value before = generator.getCurrentFrame().get(0);
		generator.copy("x", "x");
		assertSame(before, generator.getCurrentFrame().get(0));
	}

	@Test
	public void whileOpensAFrameOfHeaderPhis() {
		CodeGenerator generator = generator("x", "y");
		generator.openWhile("x", BigInteger.valueOf(3));
		assertEquals(2, generator.getScopeDepth());
		assertEquals(1, generator.getLoopDepth());
		for (Value value : generator.getCurrentFrame().values()) {
			assertTrue(value instanceof PhiInstruction);
			assertEquals(1, ((PhiInstruction) value).getIncomingValues().size());
		}
		generator.increment("x");
		generator.closeWhile();
		assertEquals(1, generator.getScopeDepth());
		assertEquals(0, generator.getLoopDepth());
		for (Value value : generator.getCurrentFrame().values()) {
			assertEquals(2, ((PhiInstruction) value).getIncomingValues().size());
		}
		generator.finish();
		generator.getFunction().verify();
	}

	@Test
	public void innerLoopIsSeededFromOuterBody() {
		CodeGenerator generator = generator("x", "y");
		generator.openWhile("x", BigInteger.ZERO);
		generator.increment("y");
		Value outerBodyY = generator.getCurrentFrame().get(1);
		generator.openWhile("y", BigInteger.TEN);
		assertEquals(3, generator.getScopeDepth());
		PhiInstruction innerY = (PhiInstruction) generator.getCurrentFrame().get(1);
		assertSame(outerBodyY, innerY.getIncomingValues().get(0));

		generator.decrement("y");
		generator.closeWhile();
		assertEquals(2, generator.getScopeDepth());
		assertSame(innerY, generator.getCurrentFrame().get(1));
		generator.decrement("x");
		generator.closeWhile();
		assertEquals(1, generator.getScopeDepth());
		generator.finish();
		generator.getFunction().verify();
	}

	@Test
	public void nonTerminatingLoopStillBuilds() {
		CodeGenerator generator = generator("x");
		generator.increment("x");
		generator.openWhile("x", BigInteger.ZERO);
		generator.increment("x");
		generator.closeWhile();
		generator.finish();
		assertTrue(generator.isFinished());
		generator.getFunction().verify();
	}

	@Test
	public void unmatchedEndFailsImmediately() {
		CodeGenerator generator = generator("x");
		generator.setLineNumber(7);
		CodeGenerationException e = assertThrows(CodeGenerationException.class, generator::closeWhile);
		assertEquals(7, e.getLineNumber());
		assertEquals("test.bb", e.getSourceDescription());
	}

	@Test
	public void openLoopAtFinishFails() {
		CodeGenerator generator = generator("x");
		generator.setLineNumber(2);
		generator.openWhile("x", BigInteger.ONE);
		generator.setLineNumber(5);
		CodeGenerationException e = assertThrows(CodeGenerationException.class, generator::finish);
		assertTrue(e.getMessage(), e.getMessage().startsWith("Too many opens"));
		assertTrue(e.getMessage(), e.getMessage().contains("line 2"));
		assertFalse(generator.isFinished());
	}

	@Test
	public void unknownVariableFails() {
		CodeGenerator generator = generator("x");
		assertThrows(CodeGenerationException.class, () -> generator.increment("y"));
		assertThrows(CodeGenerationException.class, () -> generator.copy("x", "y"));
		assertThrows(CodeGenerationException.class, () -> generator.openWhile("y", BigInteger.ZERO));
	}

	@Test
	public void finishReportsInTableOrderThenSeals() {
		CodeGenerator generator = generator("b", "a", "c");
		generator.finish();
		BasicBlock entry = generator.getFunction().getEntryBlock();
		List<String> reported = new ArrayList<String>();
		for (Instruction instruction : entry.getInstructions()) {
			if (instruction.getOpcode() == Opcode.REPORT) {
				reported.add(instruction.getLabel());
			}
		}
		assertEquals(Arrays.asList("b", "a", "c"), reported);
		assertEquals(Opcode.RETURN, entry.getTerminator().getOpcode());
		assertTrue(generator.getFunction().isSealed());
		assertThrows(IllegalStateException.class, () -> generator.increment("a"));
		assertThrows(IllegalStateException.class, generator::finish);
	}
}
