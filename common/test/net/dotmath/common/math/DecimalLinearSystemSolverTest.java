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

import java.math.MathContext;

import org.junit.Test;

import net.dotmath.common.DotMathTest;

public final class DecimalLinearSystemSolverTest extends DotMathTest {

  @Test
  public void testSolve() {
    LinearSystemSolver solver = new DecimalLinearSystemSolver();
    Matrix A = new Matrix(new double[][] {{2.0, 1.0}, {4.0, 3.0}});
    Solver s = solver.getSolver(A);
    assertTrue(s instanceof LUDecompositionDecimal);
    assertArrayEquals(new double[] {1.0, 1.0}, s.solve(new double[] {3.0, 7.0}));
  }

  @Test
  public void testExactlySingular() {
    // Singular in exact arithmetic
    Matrix A = new Matrix(new double[][] {{1.0, 3.0}, {0.5, 1.5}});
    LinearSystemSolver solver = new DecimalLinearSystemSolver(MathContext.DECIMAL128);
    assertFalse(solver.isNonSingular(A));
    try {
      solver.getSolver(A);
      fail();
    } catch (SingularMatrixSolverException smse) {
      assertEquals(1, smse.getApparentRank());
    }
  }

  @Test
  public void testAgreesWithDense() {
    Matrix A = new Matrix(new double[][] {{3.0, 1.0, -1.0}, {1.0, 5.0, 2.0}, {-1.0, 2.0, 6.0}});
    double[] b = {1.0, 2.0, 3.0};
    double[] dense = DenseLinearSystemSolver.INSTANCE.getSolver(A).solve(b);
    double[] decimal = new DecimalLinearSystemSolver().getSolver(A).solve(b);
    assertArrayEquals(dense, decimal, LOOSE_EPSILON);
  }

  @Test(expected = DimensionMismatchException.class)
  public void testNotSquare() {
    new DecimalLinearSystemSolver().getSolver(new Matrix(3, 2, 1.0));
  }

  @Test(expected = DimensionMismatchException.class)
  public void testNotSquareNonSingular() {
    new DecimalLinearSystemSolver().isNonSingular(new Matrix(3, 2, 1.0));
  }

}
