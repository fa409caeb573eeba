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
import net.dotmath.common.log.RecordingHandler;
import net.dotmath.common.random.RandomManager;

public final class QRDecompositionTest extends DotMathTest {

  @Test
  public void testFactorsSquare() {
    Matrix A = new Matrix(new double[][] {{12.0, -51.0, 4.0}, {6.0, 167.0, -68.0}, {-4.0, 24.0, -41.0}});
    QRDecomposition qr = new QRDecomposition(A);
    assertTrue(qr.isFullRank());
    Matrix Q = qr.getQ();
    Matrix R = qr.getR();
    assertOrthonormalColumns(Q);
    assertMatrixEquals(A, Q.times(R), LOOSE_EPSILON);
    assertEquals(0.0, MatrixUtils.maxAbsBelowDiagonal(R));
    // Classic example; R's diagonal is 14, 175, 35 up to sign
    assertEquals(14.0, Math.abs(R.get(0, 0)), LOOSE_EPSILON);
    assertEquals(175.0, Math.abs(R.get(1, 1)), LOOSE_EPSILON);
    assertEquals(35.0, Math.abs(R.get(2, 2)), LOOSE_EPSILON);
    assertArrayEquals(new double[] {R.get(0, 0), R.get(1, 1), R.get(2, 2)}, qr.getRDiagonal());
  }

  @Test
  public void testFactorsTall() {
    Matrix A = Matrix.random(7, 4, RandomManager.getRandom());
    QRDecomposition qr = new QRDecomposition(A);
    Matrix Q = qr.getQ();
    assertEquals(7, Q.getRowDimension());
    assertEquals(4, Q.getColumnDimension());
    assertOrthonormalColumns(Q);
    assertMatrixEquals(A, Q.times(qr.getR()), LOOSE_EPSILON);
    Matrix H = qr.getH();
    for (int i = 0; i < 4; i++) {
      for (int j = i + 1; j < 4; j++) {
        assertEquals(0.0, H.get(i, j));
      }
    }
  }

  @Test
  public void testLeastSquares() {
    Matrix A = Matrix.random(8, 3, RandomManager.getRandom());
    Matrix b = Matrix.random(8, 1, RandomManager.getRandom());
    Matrix x = new QRDecomposition(A).solve(b);
    assertEquals(3, x.getRowDimension());
    // Residual is orthogonal to the column space of A
    Matrix residual = A.times(x).minus(b);
    assertMatrixEquals(new Matrix(3, 1), A.transpose().times(residual), LOOSE_EPSILON);
  }

  @Test
  public void testSolveVector() {
    Matrix A = new Matrix(new double[][] {{3.0, 1.0}, {1.0, 2.0}});
    assertArrayEquals(new double[] {1.0, 3.0}, new QRDecomposition(A).solve(new double[] {6.0, 7.0}), LOOSE_EPSILON);
  }

  @Test
  public void testRankDeficient() {
    Matrix A = new Matrix(new double[][] {{1.0, 0.0}, {1.0, 0.0}, {1.0, 0.0}});
    QRDecomposition qr = new QRDecomposition(A);
    assertFalse(qr.isFullRank());
    assertFalse(qr.isNonSingular());
    assertEquals(1, qr.getApparentRank());
    RecordingHandler handler = RecordingHandler.attachTo(QRDecomposition.class);
    try {
      qr.solve(Matrix.columnVector(1.0, 2.0, 3.0));
      fail();
    } catch (RankDeficientSolverException rdse) {
      assertEquals(1, rdse.getApparentRank());
      assertTrue(handler.hasLineContaining("rank deficient"));
    } finally {
      handler.detachFrom(QRDecomposition.class);
    }
  }

  @Test
  public void testZeroMatrix() {
    QRDecomposition qr = new QRDecomposition(new Matrix(3, 3));
    assertFalse(qr.isFullRank());
    assertEquals(0, qr.getApparentRank());
    assertMatrixEquals(Matrix.identity(3, 3), qr.getQ());
  }

  @Test(expected = DimensionMismatchException.class)
  public void testMismatch() {
    new QRDecomposition(Matrix.identity(3, 3)).solve(new Matrix(2, 2));
  }

  @Test
  public void testOneByOne() {
    Matrix A = new Matrix(new double[][] {{3.0}});
    QRDecomposition qr = new QRDecomposition(A);
    assertTrue(qr.isFullRank());
    assertEquals(1, qr.getApparentRank());
    Matrix Q = qr.getQ();
    Matrix R = qr.getR();
    assertEquals(3.0, Math.abs(R.get(0, 0)));
    // Householder reflection of a positive scalar flips its sign
    assertEquals(-3.0, R.get(0, 0));
    assertEquals(-1.0, Q.get(0, 0));
    assertMatrixEquals(A, Q.times(R), DOUBLE_EPSILON);
    assertArrayEquals(new double[] {2.0}, qr.solve(new double[] {6.0}));
  }

  @Test
  public void testOneByOneNegative() {
    QRDecomposition qr = new QRDecomposition(new Matrix(new double[][] {{-0.5}}));
    assertTrue(qr.isFullRank());
    assertEquals(0.5, Math.abs(qr.getR().get(0, 0)));
    assertMatrixEquals(new Matrix(new double[][] {{-0.5}}), qr.getQ().times(qr.getR()), DOUBLE_EPSILON);
    assertArrayEquals(new double[] {-4.0}, qr.solve(new double[] {2.0}));
  }

}
