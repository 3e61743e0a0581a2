package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbones.frontend.Lexer;
import org.metricshub.jbones.frontend.LexerException;
import org.metricshub.jbones.frontend.OneParamKind;
import org.metricshub.jbones.frontend.Token;
import org.metricshub.jbones.frontend.TokenType;
import org.metricshub.jbones.frontend.TwoParamKind;
import org.metricshub.jbones.util.ScriptSource;

public class LexerTest {

	private static Lexer lexer(String script) throws IOException {
		return new Lexer(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(script)));
	}

	private static List<Token> tokenize(String script) throws IOException {
		Lexer lexer = lexer(script);
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = lexer.nextToken();
			tokens.add(token);
		} while (token.getType() != TokenType.EOF);
		return tokens;
	}

	@Test
	public void keywordsCollectTheirOperands() throws Exception {
		assertEquals(
				Arrays
						.asList(
								Token.oneParam(1, OneParamKind.INCR, "x"),
								Token.twoParam(1, TwoParamKind.COPY, "x", "y"),
								Token.whileLoop(1, "y", BigInteger.valueOf(3)),
								Token.fluff(1),
								Token.oneParam(1, OneParamKind.DECR, "y"),
								Token.end(1),
								Token.oneParam(1, OneParamKind.CLEAR, "x"),
								Token.eof(1)),
				tokenize("incr x; copy x to y; while y not 3 do; decr y; end; clear x;"));
	}

	@Test
	public void fluffWordsOutsideOperandsAreTokens() throws Exception {
		assertEquals(
				Arrays.asList(Token.fluff(1), Token.fluff(1), Token.fluff(1), Token.eof(1)),
				tokenize("do NOT To"));
	}

	@Test
	public void bareWordsAreIdentifiersAndNumbers() throws Exception {
		assertEquals(
				Arrays.asList(Token.identifier(1, "abc_1"), Token.number(1, BigInteger.valueOf(42)), Token.eof(1)),
				tokenize("abc_1 42"));
	}

	@Test
	public void keywordMatchingIgnoresCaseButNamesKeepIt() throws Exception {
		assertEquals(Arrays.asList(Token.oneParam(1, OneParamKind.INCR, "Foo"), Token.eof(1)), tokenize("InCr Foo"));
	}

	@Test
	public void lineNumbersFollowNewlines() throws Exception {
		List<Token> tokens = tokenize("incr x\r\n\n# comment\ndecr x\n  end");
		assertEquals(1, tokens.get(0).getLineNumber());
		assertEquals(4, tokens.get(1).getLineNumber());
		assertEquals(5, tokens.get(2).getLineNumber());
	}

	@Test
	public void operandsMaySpanLines() throws Exception {
		assertEquals(
				Arrays.asList(Token.whileLoop(1, "x", BigInteger.TEN), Token.eof(3)),
				tokenize("while\nx not\n10"));
	}

	@Test
	public void lastWordWithoutSeparatorIsRead() throws Exception {
		assertEquals(Arrays.asList(Token.oneParam(1, OneParamKind.CLEAR, "last"), Token.eof(1)), tokenize("clear last"));
	}

	@Test
	public void eofIsSticky() throws Exception {
		Lexer lexer = lexer("incr x $ incr y");
		assertEquals(TokenType.ONE_PARAM, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
		assertEquals(TokenType.EOF, lexer.nextToken().getType());
	}

	@Test
	public void missingIdentifierNamesTheKeyword() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> tokenize("decr end"));
		assertTrue(e.getMessage(), e.getMessage().contains("'decr' expected identifier but found End"));
	}

	@Test
	public void missingBoundNamesTheToken() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> tokenize("while x do y"));
		assertTrue(e.getMessage(), e.getMessage().contains("'while' expected number but found Identifier(y)"));
	}

	@Test
	public void missingOperandAtEndOfInput() throws Exception {
		LexerException e = assertThrows(LexerException.class, () -> tokenize("copy a"));
		assertTrue(e.getMessage(), e.getMessage().contains("expected identifier but found EOF"));
	}

	@Test
	public void outOfRangeNumberIsRejected() throws Exception {
		assertThrows(LexerException.class, () -> tokenize("999999999999999999999999999999999999999999"));
	}
}
