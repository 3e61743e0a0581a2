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

import java.math.BigInteger;
import java.util.Objects;

/**
 * One token produced by the {@link Lexer}.
 * <p>
 * Keyword tokens already carry their operands: a {@code while} token holds
 * the watched variable and its bound, a {@code copy} token its two
 * variables, and so on. Tokens are immutable.
 */
public final class Token {

	private final TokenType type;
	private final int lineNumber;
	private final String first;
	private final String second;
	private final BigInteger number;
	private final OneParamKind oneParamKind;
	private final TwoParamKind twoParamKind;

	private Token(
			TokenType type,
			int lineNumber,
			String first,
			String second,
			BigInteger number,
			OneParamKind oneParamKind,
			TwoParamKind twoParamKind) {
		this.type = type;
		this.lineNumber = lineNumber;
		this.first = first;
		this.second = second;
		this.number = number;
		this.oneParamKind = oneParamKind;
		this.twoParamKind = twoParamKind;
	}

	public static Token number(int lineNumber, BigInteger value) {
		return new Token(TokenType.NUMBER, lineNumber, null, null, value, null, null);
	}

	public static Token identifier(int lineNumber, String name) {
		return new Token(TokenType.IDENTIFIER, lineNumber, name, null, null, null, null);
	}

	public static Token whileLoop(int lineNumber, String variable, BigInteger bound) {
		return new Token(TokenType.WHILE, lineNumber, variable, null, bound, null, null);
	}

	public static Token twoParam(int lineNumber, TwoParamKind kind, String from, String to) {
		return new Token(TokenType.TWO_PARAM, lineNumber, from, to, null, null, kind);
	}

	public static Token oneParam(int lineNumber, OneParamKind kind, String variable) {
		return new Token(TokenType.ONE_PARAM, lineNumber, variable, null, null, kind, null);
	}

	public static Token fluff(int lineNumber) {
		return new Token(TokenType.FLUFF, lineNumber, null, null, null, null, null);
	}

	public static Token end(int lineNumber) {
		return new Token(TokenType.END, lineNumber, null, null, null, null, null);
	}

	public static Token eof(int lineNumber) {
		return new Token(TokenType.EOF, lineNumber, null, null, null, null, null);
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return the line the token starts on, 1-based
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * The identifier of an {@link TokenType#IDENTIFIER}, the watched variable of a
	 * {@link TokenType#WHILE}, the variable of a {@link TokenType#ONE_PARAM} or the
	 * source of a {@link TokenType#TWO_PARAM}.
	 *
	 * @return the first name carried by this token, or {@code null}
	 */
	public String getName() {
		return first;
	}

	/**
	 * @return the destination of a {@link TokenType#TWO_PARAM}, or {@code null}
	 */
	public String getSecondName() {
		return second;
	}

	/**
	 * @return the value of a {@link TokenType#NUMBER} or the bound of a
	 *         {@link TokenType#WHILE}, or {@code null}
	 */
	public BigInteger getNumber() {
		return number;
	}

	public OneParamKind getOneParamKind() {
		return oneParamKind;
	}

	public TwoParamKind getTwoParamKind() {
		return twoParamKind;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return type == other.type
				&& Objects.equals(first, other.first)
				&& Objects.equals(second, other.second)
				&& Objects.equals(number, other.number)
				&& oneParamKind == other.oneParamKind
				&& twoParamKind == other.twoParamKind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, first, second, number, oneParamKind, twoParamKind);
	}

	@Override
	public String toString() {
		switch (type) {
		case NUMBER:
			return "Number(" + number + ")";
		case IDENTIFIER:
			return "Identifier(" + first + ")";
		case WHILE:
			return "While(" + first + ", " + number + ")";
		case TWO_PARAM:
			return "TwoParam(" + twoParamKind + ", " + first + ", " + second + ")";
		case ONE_PARAM:
			return "OneParam(" + oneParamKind + ", " + first + ")";
		case FLUFF:
			return "Fluff";
		case END:
			return "End";
		default:
			return "EOF";
		}
	}
}
