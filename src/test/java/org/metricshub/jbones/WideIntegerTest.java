package org.metricshub.jbones;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import org.junit.Test;
import org.metricshub.jbones.jrt.WideInteger;

public class WideIntegerTest {

	@Test
	public void bounds() {
		assertEquals(new BigInteger("170141183460469231731687303715884105727"), WideInteger.MAX_VALUE);
		assertEquals(new BigInteger("-170141183460469231731687303715884105728"), WideInteger.MIN_VALUE);
		assertTrue(WideInteger.fits(WideInteger.MAX_VALUE));
		assertTrue(WideInteger.fits(WideInteger.MIN_VALUE));
		assertFalse(WideInteger.fits(WideInteger.MAX_VALUE.add(BigInteger.ONE)));
		assertFalse(WideInteger.fits(WideInteger.MIN_VALUE.subtract(BigInteger.ONE)));
	}

	@Test
	public void addOneWrapsAtTheTop() {
		assertEquals(BigInteger.valueOf(42), WideInteger.addOne(BigInteger.valueOf(41)));
		assertEquals(WideInteger.MIN_VALUE, WideInteger.addOne(WideInteger.MAX_VALUE));
	}

	@Test
	public void subtractOneWrapsAtTheBottom() {
		assertEquals(BigInteger.ZERO, WideInteger.subtractOne(BigInteger.ONE));
		assertEquals(WideInteger.MAX_VALUE, WideInteger.subtractOne(WideInteger.MIN_VALUE));
	}

	@Test
	public void wrapReducesModulo128Bits() {
		BigInteger modulus = BigInteger.ONE.shiftLeft(128);
		assertEquals(BigInteger.valueOf(5), WideInteger.wrap(modulus.add(BigInteger.valueOf(5))));
		assertEquals(BigInteger.valueOf(-1), WideInteger.wrap(modulus.subtract(BigInteger.ONE)));
	}

	@Test
	public void parse() {
		assertEquals(BigInteger.valueOf(-7), WideInteger.parse(" -7 "));
		assertEquals(WideInteger.MAX_VALUE, WideInteger.parse(WideInteger.MAX_VALUE.toString()));
		assertThrows(NumberFormatException.class, () -> WideInteger.parse("170141183460469231731687303715884105728"));
		assertThrows(NumberFormatException.class, () -> WideInteger.parse("twelve"));
	}
}
