package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbones.frontend.JbonesParser;
import org.metricshub.jbones.frontend.OneParamKind;
import org.metricshub.jbones.frontend.ParserException;
import org.metricshub.jbones.frontend.Token;
import org.metricshub.jbones.frontend.TwoParamKind;
import org.metricshub.jbones.intermediate.VariableTable;
import org.metricshub.jbones.statement.EndStatement;
import org.metricshub.jbones.statement.EofStatement;
import org.metricshub.jbones.statement.FluffStatement;
import org.metricshub.jbones.statement.OneParamStatement;
import org.metricshub.jbones.statement.Program;
import org.metricshub.jbones.statement.Statement;
import org.metricshub.jbones.statement.Statements;
import org.metricshub.jbones.statement.TwoParamStatement;
import org.metricshub.jbones.statement.WhileStatement;
import org.metricshub.jbones.util.ScriptSource;

public class JbonesParserTest {

	private static Program parse(String script) throws IOException {
		return new JbonesParser().parse(new ScriptSource("test.bb", new StringReader(script)));
	}

	@Test
	public void statementsFollowSourceOrderAndEndWithEof() throws Exception {
		List<Statement> statements = parse("incr x\nwhile x not 0 do\ndecr x\nend").getStatements();
		assertEquals(6, statements.size());
		assertTrue(statements.get(0) instanceof OneParamStatement);
		assertTrue(statements.get(1) instanceof WhileStatement);
		assertTrue(statements.get(2) instanceof FluffStatement);
		assertTrue(statements.get(3) instanceof OneParamStatement);
		assertTrue(statements.get(4) instanceof EndStatement);
		assertTrue(statements.get(5) instanceof EofStatement);
		assertEquals(3, statements.get(3).getLineNumber());
	}

	@Test
	public void variableTableKeepsFirstSeenOrder() throws Exception {
		VariableTable variables = parse("copy b to a; incr c; while a 1 do clear d; incr b end; decr e").getVariables();
		assertEquals(Arrays.asList("b", "a", "c", "d", "e"), variables.names());
		assertEquals(0, variables.indexOf("b"));
		assertEquals(4, variables.indexOf("e"));
		assertEquals(-1, variables.indexOf("z"));
		assertEquals("c", variables.nameOf(2));
	}

	@Test
	public void emptySourceIsJustEof() throws Exception {
		Program program = parse("");
		assertEquals(1, program.getStatements().size());
		assertEquals(0, program.getVariables().size());
	}

	@Test
	public void referencedVariables() {
		assertEquals(Collections.singletonList("x"), new WhileStatement(1, "x", BigInteger.ONE).referencedVariables());
		assertEquals(Arrays.asList("a", "b"), new TwoParamStatement(1, TwoParamKind.COPY, "a", "b").referencedVariables());
		assertEquals(Collections.singletonList("v"), new OneParamStatement(1, OneParamKind.CLEAR, "v").referencedVariables());
		assertTrue(new FluffStatement(1).referencedVariables().isEmpty());
		assertTrue(new EndStatement(1).referencedVariables().isEmpty());
		assertTrue(new EofStatement(1).referencedVariables().isEmpty());
	}

	@Test
	public void tokensMapOneToOne() {
		Statement statement = Statements.fromToken(Token.twoParam(4, TwoParamKind.COPY, "a", "b"), "test.bb");
		assertTrue(statement instanceof TwoParamStatement);
		assertEquals("a", ((TwoParamStatement) statement).getFrom());
		assertEquals("b", ((TwoParamStatement) statement).getTo());
		assertEquals(4, statement.getLineNumber());

		statement = Statements.fromToken(Token.whileLoop(2, "n", BigInteger.valueOf(7)), "test.bb");
		assertEquals(BigInteger.valueOf(7), ((WhileStatement) statement).getBound());
		assertTrue(Statements.fromToken(Token.eof(9), "test.bb") instanceof EofStatement);
	}

	@Test
	public void numbersAndIdentifiersAreNotStatements() {
		ParserException e = assertThrows(
				ParserException.class,
				() -> Statements.fromToken(Token.number(3, BigInteger.ONE), "test.bb"));
		assertEquals("Number(1) is not a statement (test.bb:3)", e.getMessage());
		assertEquals("test.bb", e.getSourceDescription());
		assertThrows(ParserException.class, () -> Statements.fromToken(Token.identifier(1, "x"), "test.bb"));
	}

	@Test
	public void dumpListsStatements() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		parse("incr x\ncopy x to y").dump(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		assertEquals(
				Arrays.asList("1\tincr x", "2\tcopy x to y", "2\t<eof>"),
				Arrays.asList(out.toString(StandardCharsets.UTF_8.name()).split("\\R")));
	}
}
