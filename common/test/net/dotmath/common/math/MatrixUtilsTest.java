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

package net.dotmath.common.math;

import org.junit.Test;

import net.dotmath.common.DotMathTest;

/**
 * Tests {@link MatrixUtils}.
 */
public final class MatrixUtilsTest extends DotMathTest {

  @Test
  public void testHypot() {
    assertEquals(5.0, MatrixUtils.hypot(3.0, 4.0));
    assertEquals(5.0, MatrixUtils.hypot(-4.0, 3.0));
    assertEquals(0.0, MatrixUtils.hypot(0.0, 0.0));
    // Squares would overflow
    assertEquals(5.0e300, MatrixUtils.hypot(3.0e300, 4.0e300), 1.0e288);
  }

  @Test
  public void testMaxAbsDifference() {
    Matrix a = new Matrix(new double[][] {{1.0, 2.0}, {3.0, 4.0}});
    Matrix b = new Matrix(new double[][] {{1.0, 2.5}, {2.0, 4.0}});
    assertEquals(1.0, MatrixUtils.maxAbsDifference(a, b));
    assertEquals(0.0, MatrixUtils.maxAbsDifference(a, a));
  }

  @Test(expected = DimensionMismatchException.class)
  public void testMaxAbsDifferenceMismatch() {
    MatrixUtils.maxAbsDifference(new Matrix(2, 2), new Matrix(2, 3));
  }

  @Test
  public void testMaxAbsBelowDiagonal() {
    Matrix M = new Matrix(new double[][] {{9.0, 9.0, 9.0}, {-3.0, 9.0, 9.0}, {1.0, 2.0, 9.0}});
    assertEquals(3.0, MatrixUtils.maxAbsBelowDiagonal(M));
    assertEquals(0.0, MatrixUtils.maxAbsBelowDiagonal(Matrix.identity(4, 4)));
  }

  @Test
  public void testToString() {
    Matrix M = new Matrix(new double[][] {{1.0, -0.5}, {0.123456789012345, 2.0}});
    String s = MatrixUtils.matrixToString(M);
    String[] lines = s.split("\n");
    assertEquals(3, lines.length);
    assertEquals("dim: 2x2", lines[0]);
    String[] columns = lines[2].split("\t");
    assertEquals(2, columns.length);
    assertEquals(12, columns[0].length());
    assertEquals(12, columns[1].length());
    assertEquals("     0.12346", columns[0]);
    assertEquals("      2.0000", columns[1]);
    assertEquals("    -0.50000", lines[1].split("\t")[1]);
  }

  @Test
  public void testToStringKeepsExponent() {
    Matrix M = new Matrix(new double[][] {{1.2345678901234567e-20, -9.87654321e-200, 3.0e45}});
    String[] columns = MatrixUtils.matrixToString(M).split("\n")[1].split("\t");
    assertEquals("  1.2346e-20", columns[0]);
    assertEquals("-9.8765e-200", columns[1]);
    assertEquals("  3.0000e+45", columns[2]);
  }

}
