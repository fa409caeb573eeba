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

import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>LU decomposition with partial pivoting, following Jama. For an m x n matrix A with m >= n,
 * produces an m x n unit lower triangular L, an n x n upper triangular U and a permutation
 * vector piv of length m such that A(piv,:) = L*U.</p>
 *
 * <p>The decomposition always completes, even for a singular matrix; {@link #isNonsingular()}
 * reports whether it can be used to {@link #solve(Matrix)}. Elimination proceeds column by
 * column (the "left-looking" dot-product form), so the entries of A are read once into this
 * object's own buffer and never again.</p>
 */
public final class LUDecomposition implements Solver {

  private static final Logger log = LoggerFactory.getLogger(LUDecomposition.class);

  private final int m;
  private final int n;
  /** Row-major m x n; strictly lower part is L without its unit diagonal, the rest is U. */
  private final double[] LU;
  private final int[] piv;
  private final int pivsign;

  /**
   * @param matrix m x n with m >= n
   * @throws DimensionMismatchException if the matrix has fewer rows than columns
   */
  public LUDecomposition(Matrix matrix) {
    m = matrix.getRowDimension();
    n = matrix.getColumnDimension();
    if (m < n) {
      throw new DimensionMismatchException("LU decomposition needs at least as many rows as columns", n, n, m, n);
    }
    LU = matrix.getArrayCopy();
    piv = new int[m];
    for (int i = 0; i < m; i++) {
      piv[i] = i;
    }
    int sign = 1;
    double[] LUcolj = new double[m];

    for (int j = 0; j < n; j++) {

      // Copy the j-th column to localize references
      for (int i = 0; i < m; i++) {
        LUcolj[i] = LU[i * n + j];
      }

      // Apply previous transformations
      for (int i = 0; i < m; i++) {
        int rowOffset = i * n;
        int kmax = FastMath.min(i, j);
        double s = 0.0;
        for (int k = 0; k < kmax; k++) {
          s += LU[rowOffset + k] * LUcolj[k];
        }
        LUcolj[i] -= s;
        LU[rowOffset + j] = LUcolj[i];
      }

      // Find pivot and exchange if necessary
      int p = j;
      for (int i = j + 1; i < m; i++) {
        if (FastMath.abs(LUcolj[i]) > FastMath.abs(LUcolj[p])) {
          p = i;
        }
      }
      if (p != j) {
        for (int k = 0; k < n; k++) {
          double t = LU[p * n + k];
          LU[p * n + k] = LU[j * n + k];
          LU[j * n + k] = t;
        }
        int k = piv[p];
        piv[p] = piv[j];
        piv[j] = k;
        sign = -sign;
      }

      // Compute multipliers
      if (j < m && LU[j * n + j] != 0.0) {
        double pivot = LU[j * n + j];
        for (int i = j + 1; i < m; i++) {
          LU[i * n + j] /= pivot;
        }
      }
    }
    pivsign = sign;
  }

  /**
   * @return true iff no diagonal entry of U is exactly zero
   */
  public boolean isNonsingular() {
    for (int j = 0; j < n; j++) {
      if (LU[j * n + j] == 0.0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean isNonSingular() {
    return isNonsingular();
  }

  /**
   * @return number of nonzero pivots, a lower bound hint at the rank of A
   */
  public int getApparentRank() {
    int rank = 0;
    int diagonal = FastMath.min(m, n);
    for (int j = 0; j < diagonal; j++) {
      if (LU[j * n + j] != 0.0) {
        rank++;
      }
    }
    return rank;
  }

  /**
   * @return unit lower triangular factor L, m x n
   */
  public Matrix getL() {
    Matrix result = new Matrix(m, n);
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < n; j++) {
        if (i > j) {
          result.set(i, j, LU[i * n + j]);
        } else if (i == j) {
          result.set(i, j, 1.0);
        }
      }
    }
    return result;
  }

  /**
   * @return upper triangular factor U, n x n
   */
  public Matrix getU() {
    Matrix result = new Matrix(n, n);
    for (int i = 0; i < n; i++) {
      for (int j = i; j < n; j++) {
        result.set(i, j, LU[i * n + j]);
      }
    }
    return result;
  }

  /**
   * @return copy of the pivot permutation vector
   */
  public int[] getPivot() {
    return piv.clone();
  }

  /**
   * @return pivot permutation vector as {@code double}s
   */
  public double[] getDoublePivot() {
    double[] values = new double[m];
    for (int i = 0; i < m; i++) {
      values[i] = piv[i];
    }
    return values;
  }

  /**
   * @return +1 or -1, the sign of the pivot permutation
   */
  public int getPivotSign() {
    return pivsign;
  }

  /**
   * @return determinant of A
   * @throws DimensionMismatchException if A is not square
   */
  public double det() {
    if (m != n) {
      throw new DimensionMismatchException("Matrix must be square", n, n, m, n);
    }
    double d = pivsign;
    for (int j = 0; j < n; j++) {
      d *= LU[j * n + j];
    }
    return d;
  }

  /**
   * Solves A*X = B.
   *
   * @param B a matrix with as many rows as A and any number of columns
   * @return X so that L*U*X = B(piv,:)
   * @throws DimensionMismatchException if B's row count doesn't match A's
   * @throws SingularMatrixSolverException if A is singular
   */
  @Override
  public Matrix solve(Matrix B) {
    if (B.getRowDimension() != m) {
      throw new DimensionMismatchException("Matrix row dimensions must agree",
                                           m, B.getColumnDimension(),
                                           B.getRowDimension(), B.getColumnDimension());
    }
    if (!isNonsingular()) {
      int apparentRank = getApparentRank();
      log.warn("{} x {} matrix is singular; apparent rank {}", m, n, apparentRank);
      throw new SingularMatrixSolverException(apparentRank, "Matrix is singular; apparent rank " + apparentRank);
    }

    // Copy right hand side with pivoting
    int nx = B.getColumnDimension();
    Matrix Xmat = B.getRowsMatrix(piv, 0, nx - 1);
    double[] X = Xmat.getArray();

    // Solve L*Y = B(piv,:)
    for (int k = 0; k < n; k++) {
      for (int i = k + 1; i < n; i++) {
        double lik = LU[i * n + k];
        for (int j = 0; j < nx; j++) {
          X[i * nx + j] -= X[k * nx + j] * lik;
        }
      }
    }

    // Solve U*X = Y
    for (int k = n - 1; k >= 0; k--) {
      double ukk = LU[k * n + k];
      for (int j = 0; j < nx; j++) {
        X[k * nx + j] /= ukk;
      }
      for (int i = 0; i < k; i++) {
        double uik = LU[i * n + k];
        for (int j = 0; j < nx; j++) {
          X[i * nx + j] -= X[k * nx + j] * uik;
        }
      }
    }
    return Xmat;
  }

  @Override
  public double[] solve(double[] b) {
    return solve(Matrix.columnVector(b)).getColumn(0);
  }

}
