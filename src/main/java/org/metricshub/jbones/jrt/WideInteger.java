package org.metricshub.jbones.jrt;

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

/**
 * Arithmetic on the single integer type of the language: a signed
 * 128-bit two's complement integer.
 * <p>
 * Values are carried as {@link BigInteger} instances that always lie
 * within [{@link #MIN_VALUE}, {@link #MAX_VALUE}].
 */
public final class WideInteger {

	/** Width of every variable, in bits. */
	public static final int BITS = 128;

	/** Largest representable value, 2^127 - 1. */
	public static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(BITS - 1).subtract(BigInteger.ONE);

	/** Smallest representable value, -2^127. */
	public static final BigInteger MIN_VALUE = BigInteger.ONE.shiftLeft(BITS - 1).negate();

	private static final BigInteger MODULUS = BigInteger.ONE.shiftLeft(BITS);

	private WideInteger() {}

	/**
	 * @param value any integer
	 * @return {@code true} if {@code value} is representable without wrapping
	 */
	public static boolean fits(BigInteger value) {
		return value.bitLength() < BITS;
	}

	/**
	 * Reduces an arbitrary integer to its 128-bit two's complement value.
	 *
	 * @param value any integer
	 * @return the wrapped value
	 */
	public static BigInteger wrap(BigInteger value) {
		if (fits(value)) {
			return value;
		}
		BigInteger reduced = value.mod(MODULUS);
		if (reduced.compareTo(MAX_VALUE) > 0) {
			reduced = reduced.subtract(MODULUS);
		}
		return reduced;
	}

	/**
	 * @param value a wide integer
	 * @return {@code value + 1}, wrapping from {@link #MAX_VALUE} to {@link #MIN_VALUE}
	 */
	public static BigInteger addOne(BigInteger value) {
		return wrap(value.add(BigInteger.ONE));
	}

	/**
	 * @param value a wide integer
	 * @return {@code value - 1}, wrapping from {@link #MIN_VALUE} to {@link #MAX_VALUE}
	 */
	public static BigInteger subtractOne(BigInteger value) {
		return wrap(value.subtract(BigInteger.ONE));
	}

	/**
	 * Parses a decimal integer, accepting an optional leading minus sign.
	 *
	 * @param text decimal representation
	 * @return the parsed value
	 * @throws NumberFormatException if {@code text} is not a decimal integer or
	 *         does not fit in 128 bits
	 */
	public static BigInteger parse(String text) {
		BigInteger value = new BigInteger(text.trim());
		if (!fits(value)) {
			throw new NumberFormatException(text + " does not fit in a " + BITS + "-bit signed integer");
		}
		return value;
	}
}
