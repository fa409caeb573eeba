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
import net.dotmath.common.random.RandomManager;

public final class MatrixTest extends DotMathTest {

  private static Matrix sample() {
    return new Matrix(new double[][] {
        {1.0, 2.0, 3.0},
        {4.0, 5.0, 6.0},
    });
  }

  @Test
  public void testConstruction() {
    Matrix M = sample();
    assertEquals(2, M.getRowDimension());
    assertEquals(3, M.getColumnDimension());
    assertEquals(6.0, M.get(1, 2));
    assertEquals(M, new Matrix(2, 3, new double[] {1.0, 2.0, 3.0, 4.0, 5.0, 6.0}));
    assertArrayEquals(new double[] {4.0, 5.0, 6.0}, M.getRow(1));
    assertArrayEquals(new double[] {2.0, 5.0}, M.getColumn(1));
    assertEquals(5, M.index(1, 2));
    assertMatrixEquals(new Matrix(2, 2, 7.0), new Matrix(new double[][] {{7.0, 7.0}, {7.0, 7.0}}));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRagged() {
    new Matrix(new double[][] {{1.0, 2.0}, {3.0}});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongDataLength() {
    new Matrix(2, 2, new double[3]);
  }

  @Test
  public void testCopyIsIndependent() {
    Matrix M = sample();
    Matrix copy = M.copy();
    copy.set(0, 0, -1.0);
    assertEquals(1.0, M.get(0, 0));
    double[] entries = M.getArrayCopy();
    entries[1] = 100.0;
    assertEquals(2.0, M.get(0, 1));
  }

  @Test
  public void testTranspose() {
    Matrix T = sample().transpose();
    assertEquals(3, T.getRowDimension());
    assertEquals(2, T.getColumnDimension());
    assertEquals(4.0, T.get(0, 1));
    assertEquals(sample(), T.transpose());
  }

  @Test
  public void testSubmatrix() {
    Matrix M = sample();
    assertEquals(new Matrix(new double[][] {{5.0, 6.0}}), M.getMatrix(1, 1, 1, 2));
    assertEquals(new Matrix(new double[][] {{4.0, 5.0}, {1.0, 2.0}}), M.getRowsMatrix(new int[] {1, 0}, 0, 1));
  }

  @Test
  public void testNorms() {
    Matrix M = sample();
    assertEquals(9.0, M.norm1());
    assertEquals(15.0, M.normInf());
    assertEquals(Math.sqrt(91.0), M.normF());
    // Singular values of this matrix are 9.508032..., 0.772869...
    assertEquals(9.508032000695724, M.norm2(), LOOSE_EPSILON);
  }

  @Test
  public void testArithmetic() {
    Matrix M = sample();
    assertEquals(new Matrix(2, 3, 0.0), M.minus(M));
    assertEquals(M.times(2.0), M.plus(M));
    assertEquals(M.uminus(), M.times(-1.0));
    assertEquals(new Matrix(new double[][] {{1.0, 4.0, 9.0}, {16.0, 25.0, 36.0}}), M.arrayTimes(M));
    assertEquals(new Matrix(2, 3, 1.0), M.arrayRightDivide(M));
    assertEquals(new Matrix(2, 3, 1.0), M.arrayLeftDivide(M));
    Matrix blended = M.copy().blendEquals(new Matrix(2, 3, 0.0), 0.5);
    assertEquals(M.times(0.5), blended);
  }

  @Test
  public void testInPlaceReturnsThis() {
    Matrix M = sample();
    assertSame(M, M.plusEquals(sample()));
    assertSame(M, M.minusEquals(sample()));
    assertSame(M, M.timesEquals(3.0));
    assertEquals(sample().times(3.0), M);
  }

  @Test
  public void testProduct() {
    Matrix M = sample();
    Matrix product = M.times(M.transpose());
    assertEquals(new Matrix(new double[][] {{14.0, 32.0}, {32.0, 77.0}}), product);
    assertArrayEquals(new double[] {6.0, 15.0}, M.operate(new double[] {1.0, 1.0, 1.0}));
  }

  @Test(expected = DimensionMismatchException.class)
  public void testProductMismatch() {
    sample().times(sample());
  }

  @Test(expected = DimensionMismatchException.class)
  public void testPlusMismatch() {
    sample().plus(sample().transpose());
  }

  @Test
  public void testFactories() {
    Matrix I = Matrix.identity(2, 3);
    assertEquals(1.0, I.get(1, 1));
    assertEquals(0.0, I.get(1, 2));
    assertEquals(2.0, I.trace());
    Matrix D = Matrix.diagonal(1.0, 2.0, 3.0);
    assertEquals(6.0, D.trace());
    assertEquals(6.0, D.det());
    assertEquals(1, Matrix.rowVector(1.0, 2.0).getRowDimension());
    assertEquals(2, Matrix.columnVector(1.0, 2.0).getRowDimension());
  }

  @Test
  public void testRandom() {
    Matrix R = Matrix.random(4, 5, RandomManager.getRandom());
    for (int i = 0; i < 4; i++) {
      for (int j = 0; j < 5; j++) {
        double value = R.get(i, j);
        assertTrue(value >= -1.0 && value < 1.0);
      }
    }
  }

  @Test
  public void testSolveAndInverse() {
    Matrix A = new Matrix(new double[][] {{4.0, -2.0, 1.0}, {-2.0, 4.0, -2.0}, {1.0, -2.0, 4.0}});
    Matrix B = new Matrix(new double[][] {{11.0}, {-16.0}, {17.0}});
    Matrix X = A.solve(B);
    assertMatrixEquals(new Matrix(new double[][] {{1.0}, {-2.0}, {3.0}}), X, LOOSE_EPSILON);
    assertMatrixEquals(Matrix.identity(3, 3), A.times(A.inverse()), LOOSE_EPSILON);
    Matrix Y = A.solveTranspose(B.transpose());
    assertMatrixEquals(B.transpose(), Y.times(A), LOOSE_EPSILON);
  }

  @Test
  public void testLeastSquaresSolve() {
    // Fit y = a + b*x through (0,1), (1,3), (2,5), exactly on a line
    Matrix A = new Matrix(new double[][] {{1.0, 0.0}, {1.0, 1.0}, {1.0, 2.0}});
    Matrix X = A.solve(Matrix.columnVector(1.0, 3.0, 5.0));
    assertMatrixEquals(Matrix.columnVector(1.0, 2.0), X, LOOSE_EPSILON);
  }

  @Test(expected = SingularMatrixSolverException.class)
  public void testSolveSingular() {
    new Matrix(new double[][] {{1.0, 2.0}, {2.0, 4.0}}).solve(Matrix.columnVector(1.0, 1.0));
  }

  @Test
  public void testRankAndCond() {
    assertEquals(2, sample().rank());
    assertEquals(1, new Matrix(new double[][] {{1.0, 2.0}, {2.0, 4.0}}).rank());
    assertEquals(0, new Matrix(3, 3).rank());
    assertEquals(1.0, Matrix.identity(3, 3).cond(), LOOSE_EPSILON);
    assertEquals(3.0, Matrix.diagonal(3.0, 1.0, 2.0).cond(), LOOSE_EPSILON);
  }

  @Test
  public void testSymmetric() {
    assertTrue(Matrix.identity(3, 3).isSymmetric());
    assertFalse(sample().isSymmetric());
    assertFalse(new Matrix(new double[][] {{1.0, 2.0}, {2.000001, 1.0}}).isSymmetric());
  }

  @Test
  public void testToString() {
    String s = new Matrix(new double[][] {{1.0, -2.0}}).toString();
    assertTrue(s.startsWith("dim: 1x2\n"));
    assertTrue(s.contains("-2.0"));
  }

}
