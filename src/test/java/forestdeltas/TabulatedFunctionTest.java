/**
 * Forest Deltas Fit
 * TabulatedFunctionTest.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TabulatedFunctionTest {

	private static final double[] KNOTS = { 1.0, 2.0, 4.0 };
	private static final double[] VALUES = { 10.0, 20.0, 0.0 };

	@Test
	void testLinear() {
		final TabulatedFunction f = TabulatedFunction.linear(KNOTS, VALUES);
		Assertions.assertEquals(15.0, f.value(1.5), 1e-12);
		Assertions.assertEquals(10.0, f.value(3.0), 1e-12);
		Assertions.assertEquals(10.0, f.value(0.0), 0.0);
		Assertions.assertEquals(0.0, f.value(5.0), 0.0);

		final TabulatedFunction g = TabulatedFunction.linearOrZero(KNOTS, VALUES);
		Assertions.assertEquals(15.0, g.value(1.5), 1e-12);
		Assertions.assertEquals(0.0, g.value(0.5), 0.0);
	}

	@Test
	void testNearest() {
		final TabulatedFunction f = TabulatedFunction.nearest(KNOTS, VALUES);
		Assertions.assertEquals(10.0, f.value(1.5), 0.0);
		Assertions.assertEquals(20.0, f.value(2.9), 0.0);
		Assertions.assertEquals(0.0, f.value(3.1), 0.0);
		Assertions.assertEquals(10.0, f.value(-3.0), 0.0);

		final TabulatedFunction g = TabulatedFunction.nearestOrZero(KNOTS, VALUES);
		Assertions.assertEquals(20.0, g.value(2.0), 0.0);
		Assertions.assertEquals(0.0, g.value(0.9), 0.0);
	}

	@Test
	void testSingleKnot() {
		final TabulatedFunction f = TabulatedFunction.linear(new double[] { 1.0 },
			new double[] { 3.0 });
		Assertions.assertEquals(3.0, f.value(1.0), 0.0);
		Assertions.assertEquals(3.0, f.value(7.0), 0.0);
	}

	@Test
	void testScale() {
		final TabulatedFunction f = TabulatedFunction.linear(KNOTS, VALUES).scale(
			0.5);
		Assertions.assertEquals(7.5, f.value(1.5), 1e-12);
		Assertions.assertArrayEquals(new double[] { 5.0, 10.0, 0.0 }, f.value(KNOTS),
			1e-12);
		Assertions.assertArrayEquals(KNOTS, f.getKnots());
	}

	@Test
	void testInvalid() {
		Assertions.assertThrows(NoDataException.class, () -> TabulatedFunction
			.nearest(new double[0], new double[0]));
		Assertions.assertThrows(DimensionMismatchException.class,
			() -> TabulatedFunction.linear(KNOTS, new double[] { 1.0 }));
	}
}
