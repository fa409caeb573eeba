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

import java.io.Serializable;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>Dense, arbitrary-dimensional matrix of {@code double}, stored row-major in one contiguous
 * buffer. Entry (i,j) lives at offset {@code i * columns + j}; see {@link #index(int, int)}.</p>
 *
 * <p>Methods come in two families: those like {@link #plus(Matrix)} return a new matrix, and
 * those like {@link #plusEquals(Matrix)} modify this matrix in place and return it. Copies never
 * share a buffer.</p>
 *
 * <p>Row and column indices start at zero. Indices outside the matrix are a programming error;
 * they are not checked beyond what array access itself checks.</p>
 */
public final class Matrix implements Serializable {

  private static final long serialVersionUID = 1L;

  private final int m;
  private final int n;
  private final double[] entries;

  /**
   * Creates an m x n matrix of zeroes.
   */
  public Matrix(int m, int n) {
    Preconditions.checkArgument(m >= 0 && n >= 0, "Bad dimensions: %s x %s", m, n);
    this.m = m;
    this.n = n;
    this.entries = new double[m * n];
  }

  /**
   * Creates an m x n matrix with every entry equal to {@code fill}.
   */
  public Matrix(int m, int n, double fill) {
    this(m, n);
    Arrays.fill(entries, fill);
  }

  /**
   * Creates an m x n matrix from row-major data, which is copied.
   *
   * @throws IllegalArgumentException if {@code data.length != m * n}
   */
  public Matrix(int m, int n, double[] data) {
    Preconditions.checkArgument(m >= 0 && n >= 0, "Bad dimensions: %s x %s", m, n);
    Preconditions.checkArgument(data.length == m * n, "Expected %s entries but got %s", m * n, data.length);
    this.m = m;
    this.n = n;
    this.entries = data.clone();
  }

  /**
   * Creates a matrix from an array of rows, which must all have the same length.
   */
  public Matrix(double[][] rows) {
    Preconditions.checkNotNull(rows);
    this.m = rows.length;
    this.n = m == 0 ? 0 : rows[0].length;
    this.entries = new double[m * n];
    for (int i = 0; i < m; i++) {
      Preconditions.checkArgument(rows[i].length == n, "Row %s has length %s, not %s", i, rows[i].length, n);
      System.arraycopy(rows[i], 0, entries, i * n, n);
    }
  }

  /**
   * Wraps a buffer without copying it; the caller hands over ownership.
   */
  private Matrix(double[] entries, int m, int n) {
    this.m = m;
    this.n = n;
    this.entries = entries;
  }

  static Matrix wrap(int m, int n, double[] entries) {
    return new Matrix(entries, m, n);
  }

  /**
   * @return an m x n matrix with ones on its main diagonal and zeroes elsewhere
   */
  public static Matrix identity(int m, int n) {
    Matrix result = new Matrix(m, n);
    int diagonal = FastMath.min(m, n);
    for (int i = 0; i < diagonal; i++) {
      result.entries[result.index(i, i)] = 1.0;
    }
    return result;
  }

  /**
   * @return a square matrix with the given values along the diagonal and zeroes elsewhere
   */
  public static Matrix diagonal(double... diagonalValues) {
    int n = diagonalValues.length;
    Matrix result = new Matrix(n, n);
    for (int i = 0; i < n; i++) {
      result.entries[result.index(i, i)] = diagonalValues[i];
    }
    return result;
  }

  /**
   * @return a 1 x n matrix holding the values
   */
  public static Matrix rowVector(double... values) {
    return new Matrix(1, values.length, values);
  }

  /**
   * @return an n x 1 matrix holding the values
   */
  public static Matrix columnVector(double... values) {
    return new Matrix(values.length, 1, values);
  }

  /**
   * @return an m x n matrix whose entries are drawn uniformly from [-1,1)
   */
  public static Matrix random(int m, int n, RandomGenerator random) {
    Matrix result = new Matrix(m, n);
    for (int i = 0; i < result.entries.length; i++) {
      result.entries[i] = 2.0 * random.nextDouble() - 1.0;
    }
    return result;
  }

  public Matrix copy() {
    return new Matrix(entries.clone(), m, n);
  }

  /**
   * @return the live row-major buffer backing this matrix
   */
  double[] getArray() {
    return entries;
  }

  /**
   * @return an independent copy of the row-major buffer
   */
  public double[] getArrayCopy() {
    return entries.clone();
  }

  /**
   * @return a copy of the entries as an array of rows
   */
  public double[][] getArray2D() {
    double[][] result = new double[m][n];
    for (int i = 0; i < m; i++) {
      System.arraycopy(entries, i * n, result[i], 0, n);
    }
    return result;
  }

  /**
   * @return copy of column {@code j}
   */
  public double[] getColumn(int j) {
    double[] result = new double[m];
    for (int i = 0; i < m; i++) {
      result[i] = entries[index(i, j)];
    }
    return result;
  }

  /**
   * @return copy of row {@code i}
   */
  public double[] getRow(int i) {
    double[] result = new double[n];
    System.arraycopy(entries, i * n, result, 0, n);
    return result;
  }

  public int getRowDimension() {
    return m;
  }

  public int getColumnDimension() {
    return n;
  }

  /**
   * @return the offset of entry (i,j) in the row-major buffer
   */
  public int index(int i, int j) {
    return i * n + j;
  }

  public double get(int i, int j) {
    return entries[index(i, j)];
  }

  public void set(int i, int j, double s) {
    entries[index(i, j)] = s;
  }

  /**
   * @param i0 first row, inclusive
   * @param i1 last row, inclusive
   * @param j0 first column, inclusive
   * @param j1 last column, inclusive
   * @return copy of the submatrix A(i0:i1, j0:j1)
   */
  public Matrix getMatrix(int i0, int i1, int j0, int j1) {
    Matrix result = new Matrix(i1 - i0 + 1, j1 - j0 + 1);
    for (int i = i0; i <= i1; i++) {
      for (int j = j0; j <= j1; j++) {
        result.entries[result.index(i - i0, j - j0)] = entries[index(i, j)];
      }
    }
    return result;
  }

  /**
   * @param rows row indices, in the order they should appear in the result
   * @param j0 first column, inclusive
   * @param j1 last column, inclusive
   * @return copy of the submatrix A(rows(:), j0:j1)
   */
  public Matrix getRowsMatrix(int[] rows, int j0, int j1) {
    Matrix result = new Matrix(rows.length, j1 - j0 + 1);
    for (int i = 0; i < rows.length; i++) {
      for (int j = j0; j <= j1; j++) {
        result.entries[result.index(i, j - j0)] = entries[index(rows[i], j)];
      }
    }
    return result;
  }

  public Matrix transpose() {
    Matrix result = new Matrix(n, m);
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < n; j++) {
        result.entries[result.index(j, i)] = entries[index(i, j)];
      }
    }
    return result;
  }

  /**
   * @return maximum column sum of absolute values
   */
  public double norm1() {
    double f = 0.0;
    for (int j = 0; j < n; j++) {
      double s = 0.0;
      for (int i = 0; i < m; i++) {
        s += FastMath.abs(entries[index(i, j)]);
      }
      f = FastMath.max(f, s);
    }
    return f;
  }

  /**
   * @return largest singular value
   */
  public double norm2() {
    return new SingularValueDecomposition(this).norm2();
  }

  /**
   * @return maximum row sum of absolute values
   */
  public double normInf() {
    double f = 0.0;
    for (int i = 0; i < m; i++) {
      double s = 0.0;
      for (int j = 0; j < n; j++) {
        s += FastMath.abs(entries[index(i, j)]);
      }
      f = FastMath.max(f, s);
    }
    return f;
  }

  /**
   * @return Frobenius norm, accumulated without under/overflow
   */
  public double normF() {
    double f = 0.0;
    for (double entry : entries) {
      f = MatrixUtils.hypot(f, entry);
    }
    return f;
  }

  public Matrix uminus() {
    Matrix result = new Matrix(m, n);
    for (int i = 0; i < entries.length; i++) {
      result.entries[i] = -entries[i];
    }
    return result;
  }

  public Matrix plus(Matrix matrix) {
    return copy().plusEquals(matrix);
  }

  public Matrix plusEquals(Matrix matrix) {
    checkMatrixDimensions(matrix);
    for (int i = 0; i < entries.length; i++) {
      entries[i] += matrix.entries[i];
    }
    return this;
  }

  public Matrix minus(Matrix matrix) {
    return copy().minusEquals(matrix);
  }

  public Matrix minusEquals(Matrix matrix) {
    checkMatrixDimensions(matrix);
    for (int i = 0; i < entries.length; i++) {
      entries[i] -= matrix.entries[i];
    }
    return this;
  }

  /**
   * Linear interpolation between this matrix (ratio=0) and another (ratio=1), in place.
   * The ratio is not constrained to [0,1].
   */
  public Matrix blendEquals(Matrix matrix, double ratio) {
    checkMatrixDimensions(matrix);
    for (int i = 0; i < entries.length; i++) {
      double a = entries[i];
      entries[i] = a + (matrix.entries[i] - a) * ratio;
    }
    return this;
  }

  /**
   * @return element-by-element product
   */
  public Matrix arrayTimes(Matrix matrix) {
    return copy().arrayTimesEquals(matrix);
  }

  public Matrix arrayTimesEquals(Matrix matrix) {
    checkMatrixDimensions(matrix);
    for (int i = 0; i < entries.length; i++) {
      entries[i] *= matrix.entries[i];
    }
    return this;
  }

  /**
   * @return element-by-element quotient this ./ matrix
   */
  public Matrix arrayRightDivide(Matrix matrix) {
    return copy().arrayRightDivideEquals(matrix);
  }

  public Matrix arrayRightDivideEquals(Matrix matrix) {
    checkMatrixDimensions(matrix);
    for (int i = 0; i < entries.length; i++) {
      entries[i] /= matrix.entries[i];
    }
    return this;
  }

  /**
   * @return element-by-element quotient matrix ./ this
   */
  public Matrix arrayLeftDivide(Matrix matrix) {
    return copy().arrayLeftDivideEquals(matrix);
  }

  public Matrix arrayLeftDivideEquals(Matrix matrix) {
    checkMatrixDimensions(matrix);
    for (int i = 0; i < entries.length; i++) {
      entries[i] = matrix.entries[i] / entries[i];
    }
    return this;
  }

  /**
   * @return the matrix product this * matrix
   * @throws DimensionMismatchException if inner dimensions differ
   */
  public Matrix times(Matrix matrix) {
    if (matrix.m != n) {
      throw new DimensionMismatchException("Matrix inner dimensions must agree", n, matrix.n, matrix.m, matrix.n);
    }
    Matrix result = new Matrix(m, matrix.n);
    double[] matrixColumn = new double[n];
    for (int j = 0; j < matrix.n; j++) {
      for (int k = 0; k < n; k++) {
        matrixColumn[k] = matrix.entries[matrix.index(k, j)];
      }
      for (int i = 0; i < m; i++) {
        double s = 0.0;
        int rowOffset = i * n;
        for (int k = 0; k < n; k++) {
          s += entries[rowOffset + k] * matrixColumn[k];
        }
        result.entries[result.index(i, j)] = s;
      }
    }
    return result;
  }

  /**
   * @return the matrix-vector product this * v
   */
  public double[] operate(double[] v) {
    if (v.length != n) {
      throw new DimensionMismatchException("Vector length must match columns", n, 1, v.length, 1);
    }
    double[] result = new double[m];
    for (int i = 0; i < m; i++) {
      double s = 0.0;
      int rowOffset = i * n;
      for (int k = 0; k < n; k++) {
        s += entries[rowOffset + k] * v[k];
      }
      result[i] = s;
    }
    return result;
  }

  public Matrix times(double s) {
    return copy().timesEquals(s);
  }

  public Matrix timesEquals(double s) {
    for (int i = 0; i < entries.length; i++) {
      entries[i] *= s;
    }
    return this;
  }

  /**
   * Solves this * X = B: exactly via LU decomposition when square, in the least-squares
   * sense via QR decomposition when there are more rows than columns.
   *
   * @see DenseLinearSystemSolver
   */
  public Matrix solve(Matrix B) {
    return DenseLinearSystemSolver.INSTANCE.getSolver(this).solve(B);
  }

  /**
   * Solves X * this = B.
   */
  public Matrix solveTranspose(Matrix B) {
    return transpose().solve(B.transpose()).transpose();
  }

  /**
   * @return inverse if square, pseudo-inverse by least squares otherwise
   */
  public Matrix inverse() {
    return solve(identity(m, m));
  }

  /**
   * @return Moore-Penrose pseudo-inverse, from the singular value decomposition
   */
  public Matrix pseudoinverse() {
    return SingularValueDecomposition.pseudoinverse(this);
  }

  public double det() {
    return new LUDecomposition(this).det();
  }

  /**
   * @return effective numerical rank, from the singular value decomposition
   */
  public int rank() {
    return new SingularValueDecomposition(this).rank();
  }

  /**
   * @return ratio of largest to smallest singular value
   */
  public double cond() {
    return new SingularValueDecomposition(this).cond();
  }

  /**
   * @return sum of the diagonal entries
   */
  public double trace() {
    double t = 0.0;
    int diagonal = FastMath.min(m, n);
    for (int i = 0; i < diagonal; i++) {
      t += entries[index(i, i)];
    }
    return t;
  }

  /**
   * @return true iff square and exactly equal to its transpose
   */
  public boolean isSymmetric() {
    if (m != n) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < i; j++) {
        if (entries[index(i, j)] != entries[index(j, i)]) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * @throws DimensionMismatchException unless {@code matrix} has the same shape as this
   */
  public void checkMatrixDimensions(Matrix matrix) {
    if (matrix.m != m || matrix.n != n) {
      throw new DimensionMismatchException("Matrix dimensions must agree", m, n, matrix.m, matrix.n);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Matrix)) {
      return false;
    }
    Matrix other = (Matrix) o;
    return m == other.m && n == other.n && Arrays.equals(entries, other.entries);
  }

  @Override
  public int hashCode() {
    return (31 * m + n) * 31 + Arrays.hashCode(entries);
  }

  @Override
  public String toString() {
    return MatrixUtils.matrixToString(this);
  }

}
