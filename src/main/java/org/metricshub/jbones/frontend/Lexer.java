package org.metricshub.jbones.frontend;

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

import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;
import org.metricshub.jbones.jrt.WideInteger;
import org.metricshub.jbones.util.ScriptSource;

/**
 * Pulls tokens out of a bare bones source, one per {@link #nextToken()} call.
 * <p>
 * Keywords collect their own operands: {@code copy} reads two identifiers,
 * {@code clear}, {@code decr} and {@code incr} read one, {@code while} reads
 * an identifier then a number. Fluff words ({@code do}, {@code not},
 * {@code to}) are skipped while collecting operands, so
 * {@code copy x to y} and {@code while x not 0 do} both read naturally.
 * <p>
 * Words are separated by whitespace and {@code ;}. A word starting with
 * {@code #} opens a comment that runs through the next newline.
 * <p>
 * The lexer is stateful and not restartable. Once {@link TokenType#EOF} has
 * been returned, every further call returns it again.
 */
public class Lexer {

	private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z]\\w*");
	private static final Pattern NUMBER = Pattern.compile("\\d+");

	private static final char COMMENT = '#';
	private static final char TERMINATOR = ';';

	private final String sourceDescription;
	private final Reader reader;

	private int c;
	private int lineNumber = 1;
	private boolean exhausted;

	private final StringBuilder text = new StringBuilder();

	/**
	 * @param source the program to tokenize
	 * @throws IOException when the source cannot be read
	 */
	public Lexer(ScriptSource source) throws IOException {
		this.sourceDescription = source.getDescription();
		this.reader = source.getReader();
		if (reader == null) {
			throw new IOException("No reader for " + sourceDescription);
		}
		c = reader.read();
	}

	private void read() throws IOException {
		if (c == '\n') {
			lineNumber++;
		}
		c = reader.read();
		// completely bypass \r's
		while (c == '\r') {
			c = reader.read();
		}
	}

	private boolean isSeparator(int ch) {
		return ch == TERMINATOR || Character.isWhitespace(ch);
	}

	private void skipSeparators() throws IOException {
		while (c >= 0 && isSeparator(c)) {
			read();
		}
	}

	private void skipComment() throws IOException {
		while (c >= 0 && c != '\n') {
			read();
		}
		if (c == '\n') {
			read();
		}
	}

	private String readWord() throws IOException {
		text.setLength(0);
		while (c >= 0 && !isSeparator(c)) {
			text.append((char) c);
			read();
		}
		return text.toString();
	}

	/**
	 * @return the current line, 1-based
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Reads the next token, collecting the operands of keywords.
	 *
	 * @return the next token, {@link TokenType#EOF} when input is exhausted
	 *         or the next word is not part of the language
	 * @throws IOException upon an IO error
	 * @throws LexerException when a keyword is not followed by the operands it
	 *         requires
	 */
	public Token nextToken() throws IOException {
		if (exhausted) {
			return Token.eof(lineNumber);
		}

		String word = null;
		while (word == null) {
			skipSeparators();
			if (c < 0) {
				return endOfInput();
			}
			if (c == COMMENT) {
				skipComment();
			} else {
				word = readWord();
			}
		}

		int line = lineNumber;
		String lowerCaseWord = word.toLowerCase(Locale.ROOT);

		TwoParamKind twoParamKind = TwoParamKind.fromKeyword(lowerCaseWord);
		if (twoParamKind != null) {
			Token from = expect(lowerCaseWord, TokenType.IDENTIFIER);
			Token to = expect(lowerCaseWord, TokenType.IDENTIFIER);
			return Token.twoParam(line, twoParamKind, from.getName(), to.getName());
		}
		OneParamKind oneParamKind = OneParamKind.fromKeyword(lowerCaseWord);
		if (oneParamKind != null) {
			Token variable = expect(lowerCaseWord, TokenType.IDENTIFIER);
			return Token.oneParam(line, oneParamKind, variable.getName());
		}
		switch (lowerCaseWord) {
		case "while": {
			Token variable = expect(lowerCaseWord, TokenType.IDENTIFIER);
			Token bound = expect(lowerCaseWord, TokenType.NUMBER);
			return Token.whileLoop(line, variable.getName(), bound.getNumber());
		}
		case "do":
		case "not":
		case "to":
			return Token.fluff(line);
		case "end":
			return Token.end(line);
		default:
			break;
		}
		if (IDENTIFIER.matcher(word).matches()) {
			return Token.identifier(line, word);
		}
		if (NUMBER.matcher(word).matches()) {
			BigInteger value = new BigInteger(word);
			if (!WideInteger.fits(value)) {
				throw lexerException(
						"Number " + word + " does not fit in a " + WideInteger.BITS + "-bit signed integer",
						line);
			}
			return Token.number(line, value);
		}
		return endOfInput();
	}

	private Token endOfInput() {
		exhausted = true;
		return Token.eof(lineNumber);
	}

	/**
	 * Collects one keyword operand, skipping fluff.
	 */
	private Token expect(String keyword, TokenType expectedType) throws IOException {
		Token token = nextToken();
		while (token.getType() == TokenType.FLUFF) {
			token = nextToken();
		}
		if (token.getType() != expectedType) {
			throw lexerException(
					"Keyword '" + keyword + "' expected " + expectedType.name().toLowerCase(Locale.ROOT)
							+ " but found " + token,
					token.getLineNumber());
		}
		return token;
	}

	private LexerException lexerException(String msg, int line) {
		return new LexerException(msg, sourceDescription, line);
	}
}
