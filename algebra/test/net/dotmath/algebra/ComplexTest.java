/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.dotmath.algebra;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.util.FastMath;
import org.junit.Test;

import net.dotmath.common.DotMathTest;

public final class ComplexTest extends DotMathTest {

  private static final double FUNCTION_EPSILON = 1.0e-5;

  private static void assertComplexEquals(Complex expected, Complex actual, double epsilon) {
    assertTrue("Expected " + expected + " but got " + actual, expected.equalsEpsilon(actual, epsilon));
  }

  @Test
  public void testArithmetic() {
    Complex a = new Complex(2.0, 3.0);
    Complex b = new Complex(7.0, -13.0);
    assertEquals(new Complex(9.0, -10.0), a.plus(b));
    assertEquals(new Complex(-5.0, 16.0), a.minus(b));
    assertEquals(new Complex(53.0, -5.0), a.times(b));
    assertComplexEquals(new Complex(-25.0 / 218.0, 47.0 / 218.0), a.dividedBy(b), 1.0e-15);
    assertEquals(new Complex(-2.0, -3.0), a.negated());
    assertEquals(new Complex(2.0, -3.0), a.conjugated());
    assertEquals(new Complex(-5.0, 12.0), a.squared());
    // Immutable operations leave operands alone
    assertEquals(new Complex(2.0, 3.0), a);
  }

  @Test
  public void testMutableArithmetic() {
    Complex a = new Complex(2.0, 3.0);
    Complex result = a.multiply(new Complex(7.0, -13.0));
    assertSame(a, result);
    assertEquals(new Complex(53.0, -5.0), a);
    a.add(Complex.ONE).subtract(Complex.I).negate();
    assertEquals(new Complex(-54.0, 6.0), a);
    a.conjugate();
    assertEquals(new Complex(-54.0, -6.0), a);
    a.divide(new Complex(0.0, 2.0));
    assertEquals(new Complex(-3.0, 27.0), a);
    a.setReal(1.0).setImaginary(1.0).square();
    assertEquals(new Complex(0.0, 2.0), a);
    a.set(Complex.ONE);
    assertEquals(Complex.ONE, a);
  }

  @Test
  public void testMagnitudeAndPhase() {
    Complex c = new Complex(3.0, -4.0);
    assertEquals(5.0, c.getMagnitude());
    assertEquals(25.0, c.getMagnitudeSquared());
    assertEquals(FastMath.atan2(-4.0, 3.0), c.phase());
    assertEquals(c.phase(), c.getArgument());
    assertComplexEquals(new Complex(0.0, 2.0), Complex.createPolar(2.0, FastMath.PI / 2.0), 1.0e-15);
    assertComplexEquals(new Complex(-1.0, 0.0), new Complex(5.0, 5.0).setPolar(1.0, FastMath.PI), 1.0e-15);
  }

  @Test
  public void testFunctions() {
    assertEquals(new Complex(2.0, 1.0), new Complex(3.0, 4.0).sqrtOf());
    assertEquals(new Complex(2.0, -1.0), new Complex(3.0, -4.0).sqrtOf());
    assertEquals(new Complex(0.0, 2.0), Complex.real(-4.0).sqrtOf());
    assertComplexEquals(new Complex(-7.31511, -1.04274), new Complex(2.0, -3.0).exponentiated(), FUNCTION_EPSILON);
    assertComplexEquals(new Complex(0.83373, -0.98890), new Complex(1.0, 1.0).cosOf(), FUNCTION_EPSILON);
    assertComplexEquals(new Complex(1.29846, 0.63496), new Complex(1.0, 1.0).sinOf(), FUNCTION_EPSILON);
    assertComplexEquals(new Complex(0.0, -8.0), new Complex(0.0, 2.0).powerByReal(3.0), 1.0e-12);

    Complex c = new Complex(2.0, -3.0);
    assertSame(c, c.exponentiate());
    assertComplexEquals(new Complex(-7.31511, -1.04274), c, FUNCTION_EPSILON);
  }

  @Test
  public void testCubeRoots() {
    List<Complex> roots = Complex.real(8.0).getCubeRoots();
    assertEquals(3, roots.size());
    assertComplexEquals(Complex.real(2.0), roots.get(0), 1.0e-12);
    assertComplexEquals(new Complex(-1.0, FastMath.sqrt(3.0)), roots.get(1), 1.0e-12);
    assertComplexEquals(new Complex(-1.0, -FastMath.sqrt(3.0)), roots.get(2), 1.0e-12);
    for (Complex root : roots) {
      assertComplexEquals(Complex.real(8.0), root.times(root).times(root), 1.0e-12);
    }
  }

  @Test
  public void testLinearRoots() {
    assertNull(Complex.solveLinearRoots(Complex.ZERO, Complex.ZERO));
    assertTrue(Complex.solveLinearRoots(Complex.ZERO, Complex.ONE).isEmpty());
    List<Complex> roots = Complex.solveLinearRoots(Complex.real(2.0), Complex.real(-6.0));
    assertEquals(1, roots.size());
    assertEquals(Complex.real(3.0), roots.get(0));
  }

  @Test
  public void testQuadraticRoots() {
    List<Complex> roots = Complex.solveQuadraticRoots(Complex.ONE, Complex.ZERO, Complex.ONE);
    assertEquals(2, roots.size());
    assertEquals(Complex.I, roots.get(0));
    assertEquals(new Complex(0.0, -1.0), roots.get(1));

    roots = Complex.solveQuadraticRoots(Complex.real(2.0), Complex.real(6.0), Complex.real(4.0));
    assertEquals(Complex.real(-1.0), roots.get(0));
    assertEquals(Complex.real(-2.0), roots.get(1));

    // Degenerates to linear
    roots = Complex.solveQuadraticRoots(Complex.ZERO, Complex.real(2.0), Complex.real(-6.0));
    assertEquals(1, roots.size());
  }

  @Test
  public void testCubicTripleRoot() {
    // (x - 2)^3
    List<Complex> roots = Complex.solveCubicRoots(Complex.ONE, Complex.real(-6.0), Complex.real(12.0), Complex.real(-8.0));
    assertEquals(3, roots.size());
    for (Complex root : roots) {
      assertEquals(Complex.real(2.0), root);
    }
    assertNotSame(roots.get(0), roots.get(1));
  }

  @Test
  public void testCubicDoubleRoot() {
    // (x - 1)^2 (x + 2)
    List<Complex> roots = Complex.solveCubicRoots(Complex.ONE, Complex.ZERO, Complex.real(-3.0), Complex.real(2.0));
    assertEquals(3, roots.size());
    assertEquals(Complex.real(-2.0), roots.get(0));
    assertEquals(Complex.real(1.0), roots.get(1));
    assertEquals(Complex.real(1.0), roots.get(2));
  }

  @Test
  public void testCubicDistinctRoots() {
    // x^3 + 10x^2 + 169x - 180 = (x - 1)(x^2 + 11x + 180)
    Complex a = Complex.ONE;
    Complex b = Complex.real(10.0);
    Complex c = Complex.real(169.0);
    Complex d = Complex.real(-180.0);
    List<Complex> roots = Complex.solveCubicRoots(a, b, c, d);
    assertEquals(3, roots.size());
    for (Complex root : roots) {
      Complex value = a.times(root).add(b).multiply(root).add(c).multiply(root).add(d);
      assertComplexEquals(Complex.ZERO, value, 1.0e-7);
    }
    boolean foundOne = false;
    for (Complex root : roots) {
      foundOne |= Complex.ONE.equalsEpsilon(root, 1.0e-8);
    }
    assertTrue(foundOne);
  }

  @Test
  public void testCubicWithNearlyCancellingDelta() {
    // x^3 + 1e-10 x - 1; one root is very close to 1
    List<Complex> roots =
        Complex.solveCubicRoots(Complex.ONE, Complex.ZERO, Complex.real(1.0e-10), Complex.real(-1.0));
    assertEquals(3, roots.size());
    boolean foundOne = false;
    for (Complex root : roots) {
      assertFalse(Double.isNaN(root.getReal()));
      assertFalse(Double.isNaN(root.getImaginary()));
      Complex value = root.times(root).multiply(root).add(root.times(Complex.real(1.0e-10))).subtract(Complex.ONE);
      assertComplexEquals(Complex.ZERO, value, 1.0e-8);
      foundOne |= Complex.ONE.equalsEpsilon(root, 1.0e-8);
    }
    assertTrue(foundOne);
  }

  @Test
  public void testSolversReturnModifiableLists() {
    List<List<Complex>> results = new ArrayList<List<Complex>>();
    results.add(Complex.solveLinearRoots(Complex.ZERO, Complex.ONE));
    results.add(Complex.solveLinearRoots(Complex.real(2.0), Complex.real(-6.0)));
    results.add(Complex.solveQuadraticRoots(Complex.ONE, Complex.ZERO, Complex.ONE));
    results.add(Complex.solveCubicRoots(Complex.ONE, Complex.real(-6.0), Complex.real(12.0), Complex.real(-8.0)));
    results.add(Complex.solveCubicRoots(Complex.ONE, Complex.ZERO, Complex.real(-3.0), Complex.real(2.0)));
    results.add(Complex.solveCubicRoots(Complex.ONE, Complex.real(10.0), Complex.real(169.0), Complex.real(-180.0)));
    results.add(Complex.real(8.0).getCubeRoots());
    for (List<Complex> roots : results) {
      roots.add(Complex.ONE);
      roots.remove(0);
      roots.clear();
      assertTrue(roots.isEmpty());
    }
  }

  @Test
  public void testConstantsAreImmutable() {
    try {
      Complex.ONE.add(Complex.I);
      fail();
    } catch (UnsupportedOperationException uoe) {
      // good
    }
    try {
      Complex.ZERO.negate();
      fail();
    } catch (UnsupportedOperationException uoe) {
      // good
    }
    Complex copy = Complex.I.copy();
    copy.multiply(Complex.I);
    assertEquals(Complex.real(-1.0), copy);
    assertEquals(new Complex(0.0, 1.0), Complex.I);
  }

  @Test
  public void testEqualsHashCode() {
    Complex a = new Complex(0.0, -0.0);
    Complex b = new Complex(-0.0, 0.0);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(Complex.ZERO, a);
    assertFalse(Complex.ONE.equals(Complex.I));
    assertFalse(Complex.ONE.equals("1"));
    assertEquals("Complex(1.0, 2.0)", new Complex(1.0, 2.0).toString());
    assertEquals(Complex.imaginary(3.0), new Complex(0.0, 3.0));
  }

}
