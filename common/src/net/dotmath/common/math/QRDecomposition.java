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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>QR decomposition by Householder reflections, following Jama. For an m x n matrix A with
 * m >= n, produces an m x n orthogonal Q and an n x n upper triangular R so that A = Q*R.</p>
 *
 * <p>The Householder vectors are kept in place below the diagonal of this object's copy of A;
 * the diagonal of R is kept separately in {@code Rdiag}. Q is only formed on request.</p>
 */
public final class QRDecomposition implements Solver {

  private static final Logger log = LoggerFactory.getLogger(QRDecomposition.class);

  private final int m;
  private final int n;
  private final double[] QR;
  private final double[] Rdiag;

  public QRDecomposition(Matrix matrix) {
    m = matrix.getRowDimension();
    n = matrix.getColumnDimension();
    QR = matrix.getArrayCopy();
    Rdiag = new double[n];

    for (int k = 0; k < n; k++) {
      // 2-norm of k-th column without under/overflow
      double nrm = 0.0;
      for (int i = k; i < m; i++) {
        nrm = MatrixUtils.hypot(nrm, QR[i * n + k]);
      }

      if (nrm != 0.0) {
        // Form k-th Householder vector, with the sign that avoids cancellation
        if (QR[k * n + k] < 0.0) {
          nrm = -nrm;
        }
        for (int i = k; i < m; i++) {
          QR[i * n + k] /= nrm;
        }
        QR[k * n + k] += 1.0;

        // Apply transformation to remaining columns
        for (int j = k + 1; j < n; j++) {
          double s = 0.0;
          for (int i = k; i < m; i++) {
            s += QR[i * n + k] * QR[i * n + j];
          }
          s = -s / QR[k * n + k];
          for (int i = k; i < m; i++) {
            QR[i * n + j] += s * QR[i * n + k];
          }
        }
      }
      Rdiag[k] = -nrm;
    }
  }

  /**
   * @return true iff every diagonal entry of R is nonzero
   */
  public boolean isFullRank() {
    for (double d : Rdiag) {
      if (d == 0.0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean isNonSingular() {
    return isFullRank();
  }

  /**
   * @return number of nonzero diagonal entries of R
   */
  public int getApparentRank() {
    int rank = 0;
    for (double d : Rdiag) {
      if (d != 0.0) {
        rank++;
      }
    }
    return rank;
  }

  /**
   * @return copy of the diagonal of R
   */
  public double[] getRDiagonal() {
    return Rdiag.clone();
  }

  /**
   * @return lower trapezoidal m x n matrix whose columns are the Householder vectors
   */
  public Matrix getH() {
    Matrix result = new Matrix(m, n);
    for (int i = 0; i < m; i++) {
      for (int j = 0; j <= i && j < n; j++) {
        result.set(i, j, QR[i * n + j]);
      }
    }
    return result;
  }

  /**
   * @return upper triangular factor R, n x n
   */
  public Matrix getR() {
    Matrix result = new Matrix(n, n);
    for (int i = 0; i < n; i++) {
      result.set(i, i, Rdiag[i]);
      for (int j = i + 1; j < n; j++) {
        result.set(i, j, QR[i * n + j]);
      }
    }
    return result;
  }

  /**
   * @return the explicit orthogonal factor Q, m x n
   */
  public Matrix getQ() {
    Matrix result = new Matrix(m, n);
    double[] Q = result.getArray();
    for (int k = n - 1; k >= 0; k--) {
      if (k < m) {
        Q[k * n + k] = 1.0;
      }
      for (int j = k; j < n; j++) {
        if (k < m && QR[k * n + k] != 0.0) {
          double s = 0.0;
          for (int i = k; i < m; i++) {
            s += QR[i * n + k] * Q[i * n + j];
          }
          s = -s / QR[k * n + k];
          for (int i = k; i < m; i++) {
            Q[i * n + j] += s * QR[i * n + k];
          }
        }
      }
    }
    return result;
  }

  /**
   * Least squares solution of A*X = B.
   *
   * @param B a matrix with as many rows as A and any number of columns
   * @return X, n x nx, minimizing the two norm of Q*R*X - B
   * @throws DimensionMismatchException if B's row count doesn't match A's
   * @throws RankDeficientSolverException if A does not have full column rank
   */
  @Override
  public Matrix solve(Matrix B) {
    if (B.getRowDimension() != m) {
      throw new DimensionMismatchException("Matrix row dimensions must agree",
                                           m, B.getColumnDimension(),
                                           B.getRowDimension(), B.getColumnDimension());
    }
    if (!isFullRank()) {
      int apparentRank = getApparentRank();
      log.warn("{} x {} matrix is rank deficient; apparent rank {}", m, n, apparentRank);
      throw new RankDeficientSolverException(apparentRank, "Matrix is rank deficient; apparent rank " + apparentRank);
    }

    int nx = B.getColumnDimension();
    double[] X = B.getArrayCopy();

    // Compute Y = transpose(Q)*B
    for (int k = 0; k < n; k++) {
      for (int j = 0; j < nx; j++) {
        double s = 0.0;
        for (int i = k; i < m; i++) {
          s += QR[i * n + k] * X[i * nx + j];
        }
        s = -s / QR[k * n + k];
        for (int i = k; i < m; i++) {
          X[i * nx + j] += s * QR[i * n + k];
        }
      }
    }

    // Solve R*X = Y
    for (int k = n - 1; k >= 0; k--) {
      for (int j = 0; j < nx; j++) {
        X[k * nx + j] /= Rdiag[k];
      }
      for (int i = 0; i < k; i++) {
        for (int j = 0; j < nx; j++) {
          X[i * nx + j] -= X[k * nx + j] * QR[i * n + k];
        }
      }
    }
    return Matrix.wrap(m, nx, X).getMatrix(0, n - 1, 0, nx - 1);
  }

  @Override
  public double[] solve(double[] b) {
    return solve(Matrix.columnVector(b)).getColumn(0);
  }

}
