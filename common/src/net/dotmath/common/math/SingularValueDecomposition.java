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
 * <p>Singular value decomposition, derived from the LINPACK routine by way of Jama. For an
 * m x n matrix A and k = min(m, n), produces an m x k U with orthonormal columns, a k x k
 * diagonal S of non-negative singular values in descending order, and an n x k V with
 * orthonormal columns, so that A = U*S*V'.</p>
 *
 * <p>The underlying routine only handles m >= n; a wide matrix is decomposed through its
 * transpose, with U and V exchanged.</p>
 */
public final class SingularValueDecomposition {

  private static final Logger log = LoggerFactory.getLogger(SingularValueDecomposition.class);

  private static final int MAX_ITERATIONS = 500;
  private static final double EPS = FastMath.pow(2.0, -52.0);
  private static final double TINY = FastMath.pow(2.0, -966.0);
  private static final double PSEUDOINVERSE_THRESHOLD = 1.0e-300;

  private final int m;
  private final int n;
  private final int minDimension;
  /** m x k, row-major */
  private final double[] U;
  /** n x k, row-major */
  private final double[] V;
  private final double[] s;
  private boolean converged;

  public SingularValueDecomposition(Matrix matrix) {
    m = matrix.getRowDimension();
    n = matrix.getColumnDimension();
    minDimension = FastMath.min(m, n);
    converged = true;
    if (m >= n) {
      U = new double[m * n];
      V = new double[n * n];
      s = new double[n];
      decompose(matrix.getArrayCopy(), m, n, U, V, s);
    } else {
      log.debug("Decomposing transpose of wide {} x {} matrix", m, n);
      U = new double[m * m];
      V = new double[n * m];
      s = new double[m];
      decompose(matrix.transpose().getArray(), n, m, V, U, s);
    }
  }

  // LINPACK dsvdc on a rows x cols buffer A, rows >= cols; fills u (rows x cols), v (cols x cols), s
  private void decompose(double[] A, int rows, int cols, double[] u, double[] v, double[] s) {
    if (cols == 0) {
      return;
    }
    int nu = cols;
    double[] e = new double[cols];
    double[] work = new double[rows];

    // Reduce A to bidiagonal form, storing the diagonal elements
    // in s and the super-diagonal elements in e.
    int nct = FastMath.min(rows - 1, cols);
    int nrt = FastMath.max(0, FastMath.min(cols - 2, rows));
    for (int k = 0; k < FastMath.max(nct, nrt); k++) {
      if (k < nct) {

        // Compute the transformation for the k-th column and place the k-th diagonal in s[k]
        s[k] = 0;
        for (int i = k; i < rows; i++) {
          s[k] = MatrixUtils.hypot(s[k], A[i * cols + k]);
        }
        if (s[k] != 0.0) {
          if (A[k * cols + k] < 0.0) {
            s[k] = -s[k];
          }
          for (int i = k; i < rows; i++) {
            A[i * cols + k] /= s[k];
          }
          A[k * cols + k] += 1.0;
        }
        s[k] = -s[k];
      }
      for (int j = k + 1; j < cols; j++) {
        if (k < nct && s[k] != 0.0) {

          // Apply the transformation
          double t = 0;
          for (int i = k; i < rows; i++) {
            t += A[i * cols + k] * A[i * cols + j];
          }
          t = -t / A[k * cols + k];
          for (int i = k; i < rows; i++) {
            A[i * cols + j] += t * A[i * cols + k];
          }
        }

        // Place the k-th row of A into e for the subsequent calculation of the row transformation
        e[j] = A[k * cols + j];
      }
      if (k < nct) {
        for (int i = k; i < rows; i++) {
          u[i * nu + k] = A[i * cols + k];
        }
      }
      if (k < nrt) {

        // Compute the k-th row transformation and place the k-th super-diagonal in e[k]
        e[k] = 0;
        for (int i = k + 1; i < cols; i++) {
          e[k] = MatrixUtils.hypot(e[k], e[i]);
        }
        if (e[k] != 0.0) {
          if (e[k + 1] < 0.0) {
            e[k] = -e[k];
          }
          for (int i = k + 1; i < cols; i++) {
            e[i] /= e[k];
          }
          e[k + 1] += 1.0;
        }
        e[k] = -e[k];
        if (k + 1 < rows && e[k] != 0.0) {

          // Apply the transformation
          for (int i = k + 1; i < rows; i++) {
            work[i] = 0.0;
          }
          for (int j = k + 1; j < cols; j++) {
            for (int i = k + 1; i < rows; i++) {
              work[i] += e[j] * A[i * cols + j];
            }
          }
          for (int j = k + 1; j < cols; j++) {
            double t = -e[j] / e[k + 1];
            for (int i = k + 1; i < rows; i++) {
              A[i * cols + j] += t * work[i];
            }
          }
        }

        for (int i = k + 1; i < cols; i++) {
          v[i * cols + k] = e[i];
        }
      }
    }

    // Set up the final bidiagonal matrix of order p
    int p = cols;
    if (nct < cols) {
      s[nct] = A[nct * cols + nct];
    }
    if (rows < p) {
      s[p - 1] = 0.0;
    }
    if (nrt + 1 < p) {
      e[nrt] = A[nrt * cols + p - 1];
    }
    e[p - 1] = 0.0;

    // Generate U
    for (int j = nct; j < nu; j++) {
      for (int i = 0; i < rows; i++) {
        u[i * nu + j] = 0.0;
      }
      u[j * nu + j] = 1.0;
    }
    for (int k = nct - 1; k >= 0; k--) {
      if (s[k] != 0.0) {
        for (int j = k + 1; j < nu; j++) {
          double t = 0;
          for (int i = k; i < rows; i++) {
            t += u[i * nu + k] * u[i * nu + j];
          }
          t = -t / u[k * nu + k];
          for (int i = k; i < rows; i++) {
            u[i * nu + j] += t * u[i * nu + k];
          }
        }
        for (int i = k; i < rows; i++) {
          u[i * nu + k] = -u[i * nu + k];
        }
        u[k * nu + k] = 1.0 + u[k * nu + k];
        for (int i = 0; i < k - 1; i++) {
          u[i * nu + k] = 0.0;
        }
      } else {
        for (int i = 0; i < rows; i++) {
          u[i * nu + k] = 0.0;
        }
        u[k * nu + k] = 1.0;
      }
    }

    // Generate V
    for (int k = cols - 1; k >= 0; k--) {
      if (k < nrt && e[k] != 0.0) {
        for (int j = k + 1; j < nu; j++) {
          double t = 0;
          for (int i = k + 1; i < cols; i++) {
            t += v[i * cols + k] * v[i * cols + j];
          }
          t = -t / v[(k + 1) * cols + k];
          for (int i = k + 1; i < cols; i++) {
            v[i * cols + j] += t * v[i * cols + k];
          }
        }
      }
      for (int i = 0; i < cols; i++) {
        v[i * cols + k] = 0.0;
      }
      v[k * cols + k] = 1.0;
    }

    // Main iteration loop for the singular values
    int pp = p - 1;
    int iter = 0;
    while (p > 0) {
      if (iter > MAX_ITERATIONS) {
        log.warn("No convergence for singular value {} of {} x {} matrix after {} iterations; results are approximate",
                 p - 1, m, n, MAX_ITERATIONS);
        converged = false;
        break;
      }

      // kase = 1 if s(p) and e[k-1] are negligible and k<p
      // kase = 2 if s(k) is negligible and k<p
      // kase = 3 if e[k-1] is negligible, k<p, and s(k), ..., s(p) are not negligible (qr step)
      // kase = 4 if e(p-1) is negligible (convergence)
      int kase;
      int k;
      for (k = p - 2; k >= 0; k--) {
        if (FastMath.abs(e[k]) <= TINY + EPS * (FastMath.abs(s[k]) + FastMath.abs(s[k + 1]))) {
          e[k] = 0.0;
          break;
        }
      }
      if (k == p - 2) {
        kase = 4;
      } else {
        int ks;
        for (ks = p - 1; ks > k; ks--) {
          double t = (ks != p ? FastMath.abs(e[ks]) : 0.0) + (ks != k + 1 ? FastMath.abs(e[ks - 1]) : 0.0);
          if (FastMath.abs(s[ks]) <= TINY + EPS * t) {
            s[ks] = 0.0;
            break;
          }
        }
        if (ks == k) {
          kase = 3;
        } else if (ks == p - 1) {
          kase = 1;
        } else {
          kase = 2;
          k = ks;
        }
      }
      k++;

      switch (kase) {

        // Deflate negligible s(p)
        case 1: {
          double f = e[p - 2];
          e[p - 2] = 0.0;
          for (int j = p - 2; j >= k; j--) {
            double t = MatrixUtils.hypot(s[j], f);
            double cs = s[j] / t;
            double sn = f / t;
            s[j] = t;
            if (j != k) {
              f = -sn * e[j - 1];
              e[j - 1] = cs * e[j - 1];
            }
            for (int i = 0; i < cols; i++) {
              t = cs * v[i * cols + j] + sn * v[i * cols + p - 1];
              v[i * cols + p - 1] = -sn * v[i * cols + j] + cs * v[i * cols + p - 1];
              v[i * cols + j] = t;
            }
          }
        }
        break;

        // Split at negligible s(k)
        case 2: {
          double f = e[k - 1];
          e[k - 1] = 0.0;
          for (int j = k; j < p; j++) {
            double t = MatrixUtils.hypot(s[j], f);
            double cs = s[j] / t;
            double sn = f / t;
            s[j] = t;
            f = -sn * e[j];
            e[j] = cs * e[j];
            for (int i = 0; i < rows; i++) {
              t = cs * u[i * nu + j] + sn * u[i * nu + k - 1];
              u[i * nu + k - 1] = -sn * u[i * nu + j] + cs * u[i * nu + k - 1];
              u[i * nu + j] = t;
            }
          }
        }
        break;

        // Perform one qr step
        case 3: {

          // Calculate the shift
          double scale = FastMath.max(FastMath.max(FastMath.max(FastMath.max(
              FastMath.abs(s[p - 1]), FastMath.abs(s[p - 2])), FastMath.abs(e[p - 2])),
              FastMath.abs(s[k])), FastMath.abs(e[k]));
          double sp = s[p - 1] / scale;
          double spm1 = s[p - 2] / scale;
          double epm1 = e[p - 2] / scale;
          double sk = s[k] / scale;
          double ek = e[k] / scale;
          double b = ((spm1 + sp) * (spm1 - sp) + epm1 * epm1) / 2.0;
          double c = (sp * epm1) * (sp * epm1);
          double shift = 0.0;
          if (b != 0.0 || c != 0.0) {
            shift = FastMath.sqrt(b * b + c);
            if (b < 0.0) {
              shift = -shift;
            }
            shift = c / (b + shift);
          }
          double f = (sk + sp) * (sk - sp) + shift;
          double g = sk * ek;

          // Chase zeros
          for (int j = k; j < p - 1; j++) {
            double t = MatrixUtils.hypot(f, g);
            double cs = f / t;
            double sn = g / t;
            if (j != k) {
              e[j - 1] = t;
            }
            f = cs * s[j] + sn * e[j];
            e[j] = cs * e[j] - sn * s[j];
            g = sn * s[j + 1];
            s[j + 1] = cs * s[j + 1];
            for (int i = 0; i < cols; i++) {
              t = cs * v[i * cols + j] + sn * v[i * cols + j + 1];
              v[i * cols + j + 1] = -sn * v[i * cols + j] + cs * v[i * cols + j + 1];
              v[i * cols + j] = t;
            }
            t = MatrixUtils.hypot(f, g);
            cs = f / t;
            sn = g / t;
            s[j] = t;
            f = cs * e[j] + sn * s[j + 1];
            s[j + 1] = -sn * e[j] + cs * s[j + 1];
            g = sn * e[j + 1];
            e[j + 1] = cs * e[j + 1];
            if (j < rows - 1) {
              for (int i = 0; i < rows; i++) {
                t = cs * u[i * nu + j] + sn * u[i * nu + j + 1];
                u[i * nu + j + 1] = -sn * u[i * nu + j] + cs * u[i * nu + j + 1];
                u[i * nu + j] = t;
              }
            }
          }
          e[p - 2] = f;
          iter++;
        }
        break;

        // Convergence
        case 4: {

          // Make the singular values positive
          if (s[k] <= 0.0) {
            s[k] = s[k] < 0.0 ? -s[k] : 0.0;
            for (int i = 0; i <= pp; i++) {
              v[i * cols + k] = -v[i * cols + k];
            }
          }

          // Order the singular values
          while (k < pp) {
            if (s[k] >= s[k + 1]) {
              break;
            }
            double t = s[k];
            s[k] = s[k + 1];
            s[k + 1] = t;
            if (k < cols - 1) {
              for (int i = 0; i < cols; i++) {
                t = v[i * cols + k + 1];
                v[i * cols + k + 1] = v[i * cols + k];
                v[i * cols + k] = t;
              }
            }
            if (k < rows - 1) {
              for (int i = 0; i < rows; i++) {
                t = u[i * nu + k + 1];
                u[i * nu + k + 1] = u[i * nu + k];
                u[i * nu + k] = t;
              }
            }
            k++;
          }
          iter = 0;
          p--;
        }
        break;

        default:
          throw new IllegalStateException("Bad case: " + kase);
      }
    }
  }

  /**
   * @return false if the iteration gave up on some singular value
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * @return left singular vectors, m x min(m,n)
   */
  public Matrix getU() {
    return Matrix.wrap(m, minDimension, U.clone());
  }

  /**
   * @return right singular vectors, n x min(m,n)
   */
  public Matrix getV() {
    return Matrix.wrap(n, minDimension, V.clone());
  }

  /**
   * @return copy of the singular values, descending
   */
  public double[] getSingularValues() {
    return s.clone();
  }

  /**
   * @return diagonal matrix of singular values
   */
  public Matrix getS() {
    return Matrix.diagonal(s);
  }

  /**
   * @return two norm, the largest singular value
   */
  public double norm2() {
    return minDimension == 0 ? 0.0 : s[0];
  }

  /**
   * @return two norm condition number, the ratio of largest to smallest singular value
   */
  public double cond() {
    return s[0] / s[minDimension - 1];
  }

  /**
   * @return effective numerical rank: singular values above max(m,n) * s[0] * 2^-52
   */
  public int rank() {
    if (minDimension == 0) {
      return 0;
    }
    double tol = FastMath.max(m, n) * s[0] * EPS;
    int r = 0;
    for (double value : s) {
      if (value > tol) {
        r++;
      }
    }
    return r;
  }

  /**
   * Moore-Penrose pseudoinverse V * S+ * U', where S+ inverts singular values that are not
   * negligible and zeroes the rest.
   *
   * @param matrix m x n matrix
   * @return n x m pseudoinverse
   */
  public static Matrix pseudoinverse(Matrix matrix) {
    SingularValueDecomposition svd = new SingularValueDecomposition(matrix);
    double[] inverted = svd.getSingularValues();
    for (int i = 0; i < inverted.length; i++) {
      inverted[i] = FastMath.abs(inverted[i]) < PSEUDOINVERSE_THRESHOLD ? 0.0 : 1.0 / inverted[i];
    }
    return svd.getV().times(Matrix.diagonal(inverted)).times(svd.getU().transpose());
  }

}
