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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dotmath.common.LangUtils;

/**
 * <p>Eigenvalues and eigenvectors of a real square matrix, following Jama and the EISPACK
 * routines it is derived from.</p>
 *
 * <p>If A is symmetric, A = V*D*V' where D is diagonal and V is orthogonal; eigenvalues come out
 * in ascending order. Otherwise D is block diagonal, with real eigenvalues in 1 x 1 blocks and
 * each complex pair lambda +/- i*mu in a 2 x 2 block [lambda, mu; -mu, lambda], and A*V = V*D.
 * V may then be badly conditioned or even singular.</p>
 *
 * <p>Each eigenvalue gets at most {@link #MAX_ITERATIONS} QL or QR sweeps. When that runs out the
 * remaining eigenvalues are read off the current diagonal, a warning is logged, and
 * {@link #isConverged()} returns false.</p>
 */
public final class EigenvalueDecomposition {

  private static final Logger log = LoggerFactory.getLogger(EigenvalueDecomposition.class);

  /**
   * Sweeps allowed per eigenvalue, from system property {@code dotmath.eigen.maxIterations}.
   */
  public static final int MAX_ITERATIONS = LangUtils.getPositiveIntProperty("dotmath.eigen.maxIterations", 1000);

  private static final double EPS = FastMath.pow(2.0, -52.0);

  /**
   * Which algorithm the decomposition used, fixed by an exact symmetry test on the input.
   */
  public enum Path {
    /** Householder tridiagonalization, then implicit QL. */
    SYMMETRIC,
    /** Householder reduction to Hessenberg form, then shifted QR to real Schur form. */
    NONSYMMETRIC,
  }

  private final int size;
  private final Path path;
  private final int maxIterations;
  private final double[] V;
  private final double[] d;
  private final double[] e;
  private double[] H;
  private double[] ort;
  private boolean converged;

  private double cdivr;
  private double cdivi;

  /**
   * @param matrix square matrix to decompose; not modified
   * @throws DimensionMismatchException if the matrix isn't square
   */
  public EigenvalueDecomposition(Matrix matrix) {
    this(matrix, MAX_ITERATIONS);
  }

  /**
   * @param matrix square matrix to decompose; not modified
   * @param maxIterations sweeps allowed per eigenvalue before giving up
   * @throws DimensionMismatchException if the matrix isn't square
   */
  public EigenvalueDecomposition(Matrix matrix, int maxIterations) {
    if (matrix.getRowDimension() != matrix.getColumnDimension()) {
      throw new DimensionMismatchException("Matrix must be square",
                                           matrix.getColumnDimension(), matrix.getColumnDimension(),
                                           matrix.getRowDimension(), matrix.getColumnDimension());
    }
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
    this.maxIterations = maxIterations;
    size = matrix.getColumnDimension();
    V = new double[size * size];
    d = new double[size];
    e = new double[size];
    converged = true;

    path = matrix.isSymmetric() ? Path.SYMMETRIC : Path.NONSYMMETRIC;
    log.debug("Decomposing {} x {} matrix along {} path", size, size, path);

    if (size == 0) {
      return;
    }
    if (path == Path.SYMMETRIC) {
      System.arraycopy(matrix.getArray(), 0, V, 0, V.length);
      tred2();
      tql2();
    } else {
      H = matrix.getArrayCopy();
      ort = new double[size];
      orthes();
      hqr2();
      H = null;
      ort = null;
    }
  }

  public Path getPath() {
    return path;
  }

  /**
   * @return false if some eigenvalue ran out of iterations, in which case the results are only
   *  the best available approximation
   */
  public boolean isConverged() {
    return converged;
  }

  /**
   * @return copy of the eigenvector matrix, eigenvectors in columns
   */
  public Matrix getV() {
    return Matrix.wrap(size, size, V.clone());
  }

  /**
   * @return copy of the real parts of the eigenvalues
   */
  public double[] getRealEigenvalues() {
    return d.clone();
  }

  /**
   * @return copy of the imaginary parts of the eigenvalues
   */
  public double[] getImagEigenvalues() {
    return e.clone();
  }

  /**
   * @return block diagonal eigenvalue matrix
   */
  public Matrix getD() {
    Matrix X = new Matrix(size, size);
    for (int i = 0; i < size; i++) {
      X.set(i, i, d[i]);
      if (e[i] > 0) {
        X.set(i, i + 1, e[i]);
      } else if (e[i] < 0) {
        X.set(i, i - 1, e[i]);
      }
    }
    return X;
  }

  // Symmetric Householder reduction to tridiagonal form (EISPACK tred2)
  private void tred2() {
    int n = size;

    for (int j = 0; j < n; j++) {
      d[j] = V[(n - 1) * n + j];
    }

    for (int i = n - 1; i > 0; i--) {

      // Scale to avoid under/overflow
      double scale = 0.0;
      double h = 0.0;
      for (int k = 0; k < i; k++) {
        scale += FastMath.abs(d[k]);
      }
      if (scale == 0.0) {
        e[i] = d[i - 1];
        for (int j = 0; j < i; j++) {
          d[j] = V[(i - 1) * n + j];
          V[i * n + j] = 0.0;
          V[j * n + i] = 0.0;
        }
      } else {

        // Generate Householder vector
        for (int k = 0; k < i; k++) {
          d[k] /= scale;
          h += d[k] * d[k];
        }
        double f = d[i - 1];
        double g = FastMath.sqrt(h);
        if (f > 0) {
          g = -g;
        }
        e[i] = scale * g;
        h -= f * g;
        d[i - 1] = f - g;
        for (int j = 0; j < i; j++) {
          e[j] = 0.0;
        }

        // Apply similarity transformation to remaining columns
        for (int j = 0; j < i; j++) {
          f = d[j];
          V[j * n + i] = f;
          g = e[j] + V[j * n + j] * f;
          for (int k = j + 1; k <= i - 1; k++) {
            g += V[k * n + j] * d[k];
            e[k] += V[k * n + j] * f;
          }
          e[j] = g;
        }
        f = 0.0;
        for (int j = 0; j < i; j++) {
          e[j] /= h;
          f += e[j] * d[j];
        }
        double hh = f / (h + h);
        for (int j = 0; j < i; j++) {
          e[j] -= hh * d[j];
        }
        for (int j = 0; j < i; j++) {
          f = d[j];
          g = e[j];
          for (int k = j; k <= i - 1; k++) {
            V[k * n + j] -= f * e[k] + g * d[k];
          }
          d[j] = V[(i - 1) * n + j];
          V[i * n + j] = 0.0;
        }
      }
      d[i] = h;
    }

    // Accumulate transformations
    for (int i = 0; i < n - 1; i++) {
      V[(n - 1) * n + i] = V[i * n + i];
      V[i * n + i] = 1.0;
      double h = d[i + 1];
      if (h != 0.0) {
        for (int k = 0; k <= i; k++) {
          d[k] = V[k * n + i + 1] / h;
        }
        for (int j = 0; j <= i; j++) {
          double g = 0.0;
          for (int k = 0; k <= i; k++) {
            g += V[k * n + i + 1] * V[k * n + j];
          }
          for (int k = 0; k <= i; k++) {
            V[k * n + j] -= g * d[k];
          }
        }
      }
      for (int k = 0; k <= i; k++) {
        V[k * n + i + 1] = 0.0;
      }
    }
    for (int j = 0; j < n; j++) {
      d[j] = V[(n - 1) * n + j];
      V[(n - 1) * n + j] = 0.0;
    }
    V[(n - 1) * n + n - 1] = 1.0;
    e[0] = 0.0;
  }

  // Symmetric tridiagonal QL algorithm (EISPACK tql2)
  private void tql2() {
    int n = size;

    for (int i = 1; i < n; i++) {
      e[i - 1] = e[i];
    }
    e[n - 1] = 0.0;

    double f = 0.0;
    double tst1 = 0.0;
    for (int l = 0; l < n; l++) {

      // Find small subdiagonal element
      tst1 = FastMath.max(tst1, FastMath.abs(d[l]) + FastMath.abs(e[l]));
      int m = l;
      while (m < n) {
        if (FastMath.abs(e[m]) <= EPS * tst1) {
          break;
        }
        m++;
      }

      // If m == l, d[l] is an eigenvalue, otherwise iterate
      if (m > l) {
        int iter = 0;
        do {
          if (iter == maxIterations) {
            warnNotConverged(l);
            break;
          }
          iter++;

          // Compute implicit shift
          double g = d[l];
          double p = (d[l + 1] - g) / (2.0 * e[l]);
          double r = MatrixUtils.hypot(p, 1.0);
          if (p < 0) {
            r = -r;
          }
          d[l] = e[l] / (p + r);
          d[l + 1] = e[l] * (p + r);
          double dl1 = d[l + 1];
          double h = g - d[l];
          for (int i = l + 2; i < n; i++) {
            d[i] -= h;
          }
          f += h;

          // Implicit QL transformation
          p = d[m];
          double c = 1.0;
          double c2 = c;
          double c3 = c;
          double el1 = e[l + 1];
          double s = 0.0;
          double s2 = 0.0;
          for (int i = m - 1; i >= l; i--) {
            c3 = c2;
            c2 = c;
            s2 = s;
            g = c * e[i];
            h = c * p;
            r = MatrixUtils.hypot(p, e[i]);
            e[i + 1] = s * r;
            s = e[i] / r;
            c = p / r;
            p = c * d[i] - s * g;
            d[i + 1] = h + s * (c * g + s * d[i]);

            // Accumulate transformation
            for (int k = 0; k < n; k++) {
              h = V[k * n + i + 1];
              V[k * n + i + 1] = s * V[k * n + i] + c * h;
              V[k * n + i] = c * V[k * n + i] - s * h;
            }
          }
          p = -s * s2 * c3 * el1 * e[l] / dl1;
          e[l] = s * p;
          d[l] = c * p;

        } while (FastMath.abs(e[l]) > EPS * tst1);
      }
      d[l] += f;
      e[l] = 0.0;
    }

    // Sort eigenvalues and corresponding vectors
    for (int i = 0; i < n - 1; i++) {
      int k = i;
      double p = d[i];
      for (int j = i + 1; j < n; j++) {
        if (d[j] < p) {
          k = j;
          p = d[j];
        }
      }
      if (k != i) {
        d[k] = d[i];
        d[i] = p;
        for (int j = 0; j < n; j++) {
          p = V[j * n + i];
          V[j * n + i] = V[j * n + k];
          V[j * n + k] = p;
        }
      }
    }
  }

  // Nonsymmetric reduction to Hessenberg form (EISPACK orthes and ortran)
  private void orthes() {
    int n = size;
    int low = 0;
    int high = n - 1;

    for (int m = low + 1; m <= high - 1; m++) {

      // Scale column
      double scale = 0.0;
      for (int i = m; i <= high; i++) {
        scale += FastMath.abs(H[i * n + m - 1]);
      }
      if (scale != 0.0) {

        // Compute Householder transformation
        double h = 0.0;
        for (int i = high; i >= m; i--) {
          ort[i] = H[i * n + m - 1] / scale;
          h += ort[i] * ort[i];
        }
        double g = FastMath.sqrt(h);
        if (ort[m] > 0) {
          g = -g;
        }
        h -= ort[m] * g;
        ort[m] -= g;

        // Apply Householder similarity transformation H = (I-u*u'/h)*H*(I-u*u'/h)
        for (int j = m; j < n; j++) {
          double f = 0.0;
          for (int i = high; i >= m; i--) {
            f += ort[i] * H[i * n + j];
          }
          f /= h;
          for (int i = m; i <= high; i++) {
            H[i * n + j] -= f * ort[i];
          }
        }

        for (int i = 0; i <= high; i++) {
          double f = 0.0;
          for (int j = high; j >= m; j--) {
            f += ort[j] * H[i * n + j];
          }
          f /= h;
          for (int j = m; j <= high; j++) {
            H[i * n + j] -= f * ort[j];
          }
        }
        ort[m] = scale * ort[m];
        H[m * n + m - 1] = scale * g;
      }
    }

    // Accumulate transformations
    for (int i = 0; i < n; i++) {
      V[i * n + i] = 1.0;
    }

    for (int m = high - 1; m >= low + 1; m--) {
      if (H[m * n + m - 1] != 0.0) {
        for (int i = m + 1; i <= high; i++) {
          ort[i] = H[i * n + m - 1];
        }
        for (int j = m; j <= high; j++) {
          double g = 0.0;
          for (int i = m; i <= high; i++) {
            g += ort[i] * V[i * n + j];
          }
          // Double division avoids possible underflow
          g = (g / ort[m]) / H[m * n + m - 1];
          for (int i = m; i <= high; i++) {
            V[i * n + j] += g * ort[i];
          }
        }
      }
    }
  }

  // Complex scalar division, result in cdivr and cdivi
  private void cdiv(double xr, double xi, double yr, double yi) {
    if (FastMath.abs(yr) > FastMath.abs(yi)) {
      double r = yi / yr;
      double den = yr + r * yi;
      cdivr = (xr + r * xi) / den;
      cdivi = (xi - r * xr) / den;
    } else {
      double r = yr / yi;
      double den = yi + r * yr;
      cdivr = (r * xr + xi) / den;
      cdivi = (r * xi - xr) / den;
    }
  }

  // Nonsymmetric reduction from Hessenberg to real Schur form (EISPACK hqr2)
  private void hqr2() {
    int nn = size;
    int n = nn - 1;
    int low = 0;
    int high = nn - 1;
    double exshift = 0.0;
    double p = 0;
    double q = 0;
    double r = 0;
    double s = 0;
    double z = 0;
    double t;
    double w;
    double x;
    double y;

    // Compute matrix norm
    double norm = 0.0;
    for (int i = 0; i < nn; i++) {
      for (int j = FastMath.max(i - 1, 0); j < nn; j++) {
        norm += FastMath.abs(H[i * nn + j]);
      }
    }

    // Outer loop over eigenvalue index
    int iter = 0;
    while (n >= low) {

      // Look for single small sub-diagonal element
      int l = n;
      while (l > low) {
        s = FastMath.abs(H[(l - 1) * nn + l - 1]) + FastMath.abs(H[l * nn + l]);
        if (s == 0.0) {
          s = norm;
        }
        if (FastMath.abs(H[l * nn + l - 1]) < EPS * s) {
          break;
        }
        l--;
      }

      if (l == n) {

        // One root found
        H[n * nn + n] += exshift;
        d[n] = H[n * nn + n];
        e[n] = 0.0;
        n--;
        iter = 0;

      } else if (l == n - 1) {

        // Two roots found
        w = H[n * nn + n - 1] * H[(n - 1) * nn + n];
        p = (H[(n - 1) * nn + n - 1] - H[n * nn + n]) / 2.0;
        q = p * p + w;
        z = FastMath.sqrt(FastMath.abs(q));
        H[n * nn + n] += exshift;
        H[(n - 1) * nn + n - 1] += exshift;
        x = H[n * nn + n];

        if (q >= 0) {

          // Real pair
          z = p >= 0 ? p + z : p - z;
          d[n - 1] = x + z;
          d[n] = d[n - 1];
          if (z != 0.0) {
            d[n] = x - w / z;
          }
          e[n - 1] = 0.0;
          e[n] = 0.0;
          x = H[n * nn + n - 1];
          s = FastMath.abs(x) + FastMath.abs(z);
          p = x / s;
          q = z / s;
          r = FastMath.sqrt(p * p + q * q);
          p /= r;
          q /= r;

          // Row modification
          for (int j = n - 1; j < nn; j++) {
            z = H[(n - 1) * nn + j];
            H[(n - 1) * nn + j] = q * z + p * H[n * nn + j];
            H[n * nn + j] = q * H[n * nn + j] - p * z;
          }

          // Column modification
          for (int i = 0; i <= n; i++) {
            z = H[i * nn + n - 1];
            H[i * nn + n - 1] = q * z + p * H[i * nn + n];
            H[i * nn + n] = q * H[i * nn + n] - p * z;
          }

          // Accumulate transformations
          for (int i = low; i <= high; i++) {
            z = V[i * nn + n - 1];
            V[i * nn + n - 1] = q * z + p * V[i * nn + n];
            V[i * nn + n] = q * V[i * nn + n] - p * z;
          }

        } else {

          // Complex pair
          d[n - 1] = x + p;
          d[n] = x + p;
          e[n - 1] = z;
          e[n] = -z;
        }
        n -= 2;
        iter = 0;

      } else {

        // No convergence yet
        if (iter == maxIterations) {
          warnNotConverged(n);
          for (int i = n; i >= low; i--) {
            d[i] = H[i * nn + i] + exshift;
            e[i] = 0.0;
          }
          break;
        }

        // Form shift
        x = H[n * nn + n];
        y = 0.0;
        w = 0.0;
        if (l < n) {
          y = H[(n - 1) * nn + n - 1];
          w = H[n * nn + n - 1] * H[(n - 1) * nn + n];
        }

        // Wilkinson's original ad hoc shift
        if (iter == 10) {
          exshift += x;
          for (int i = low; i <= n; i++) {
            H[i * nn + i] -= x;
          }
          s = FastMath.abs(H[n * nn + n - 1]) + FastMath.abs(H[(n - 1) * nn + n - 2]);
          x = y = 0.75 * s;
          w = -0.4375 * s * s;
        }

        // MATLAB's new ad hoc shift
        if (iter == 30) {
          s = (y - x) / 2.0;
          s = s * s + w;
          if (s > 0) {
            s = FastMath.sqrt(s);
            if (y < x) {
              s = -s;
            }
            s = x - w / ((y - x) / 2.0 + s);
            for (int i = low; i <= n; i++) {
              H[i * nn + i] -= s;
            }
            exshift += s;
            x = y = w = 0.964;
          }
        }

        iter++;

        // Look for two consecutive small sub-diagonal elements
        int m = n - 2;
        while (m >= l) {
          z = H[m * nn + m];
          r = x - z;
          s = y - z;
          p = (r * s - w) / H[(m + 1) * nn + m] + H[m * nn + m + 1];
          q = H[(m + 1) * nn + m + 1] - z - r - s;
          r = H[(m + 2) * nn + m + 1];
          s = FastMath.abs(p) + FastMath.abs(q) + FastMath.abs(r);
          p /= s;
          q /= s;
          r /= s;
          if (m == l) {
            break;
          }
          if (FastMath.abs(H[m * nn + m - 1]) * (FastMath.abs(q) + FastMath.abs(r)) <
              EPS * (FastMath.abs(p) * (FastMath.abs(H[(m - 1) * nn + m - 1]) + FastMath.abs(z) +
                                        FastMath.abs(H[(m + 1) * nn + m + 1])))) {
            break;
          }
          m--;
        }

        for (int i = m + 2; i <= n; i++) {
          H[i * nn + i - 2] = 0.0;
          if (i > m + 2) {
            H[i * nn + i - 3] = 0.0;
          }
        }

        // Double QR step involving rows l:n and columns m:n
        for (int k = m; k <= n - 1; k++) {
          boolean notlast = k != n - 1;
          if (k != m) {
            p = H[k * nn + k - 1];
            q = H[(k + 1) * nn + k - 1];
            r = notlast ? H[(k + 2) * nn + k - 1] : 0.0;
            x = FastMath.abs(p) + FastMath.abs(q) + FastMath.abs(r);
            if (x == 0.0) {
              continue;
            }
            p /= x;
            q /= x;
            r /= x;
          }
          s = FastMath.sqrt(p * p + q * q + r * r);
          if (p < 0) {
            s = -s;
          }
          if (s != 0) {
            if (k != m) {
              H[k * nn + k - 1] = -s * x;
            } else if (l != m) {
              H[k * nn + k - 1] = -H[k * nn + k - 1];
            }
            p += s;
            x = p / s;
            y = q / s;
            z = r / s;
            q /= p;
            r /= p;

            // Row modification
            for (int j = k; j < nn; j++) {
              p = H[k * nn + j] + q * H[(k + 1) * nn + j];
              if (notlast) {
                p += r * H[(k + 2) * nn + j];
                H[(k + 2) * nn + j] -= p * z;
              }
              H[k * nn + j] -= p * x;
              H[(k + 1) * nn + j] -= p * y;
            }

            // Column modification
            for (int i = 0; i <= FastMath.min(n, k + 3); i++) {
              p = x * H[i * nn + k] + y * H[i * nn + k + 1];
              if (notlast) {
                p += z * H[i * nn + k + 2];
                H[i * nn + k + 2] -= p * r;
              }
              H[i * nn + k] -= p;
              H[i * nn + k + 1] -= p * q;
            }

            // Accumulate transformations
            for (int i = low; i <= high; i++) {
              p = x * V[i * nn + k] + y * V[i * nn + k + 1];
              if (notlast) {
                p += z * V[i * nn + k + 2];
                V[i * nn + k + 2] -= p * r;
              }
              V[i * nn + k] -= p;
              V[i * nn + k + 1] -= p * q;
            }
          }
        }
      }
    }

    // Backsubstitute to find vectors of upper triangular form
    if (norm == 0.0) {
      return;
    }

    for (n = nn - 1; n >= 0; n--) {
      p = d[n];
      q = e[n];

      if (q == 0) {

        // Real vector
        int l = n;
        H[n * nn + n] = 1.0;
        for (int i = n - 1; i >= 0; i--) {
          w = H[i * nn + i] - p;
          r = 0.0;
          for (int j = l; j <= n; j++) {
            r += H[i * nn + j] * H[j * nn + n];
          }
          if (e[i] < 0.0) {
            z = w;
            s = r;
          } else {
            l = i;
            if (e[i] == 0.0) {
              if (w != 0.0) {
                H[i * nn + n] = -r / w;
              } else {
                H[i * nn + n] = -r / (EPS * norm);
              }
            } else {

              // Solve real equations
              x = H[i * nn + i + 1];
              y = H[(i + 1) * nn + i];
              q = (d[i] - p) * (d[i] - p) + e[i] * e[i];
              t = (x * s - z * r) / q;
              H[i * nn + n] = t;
              if (FastMath.abs(x) > FastMath.abs(z)) {
                H[(i + 1) * nn + n] = (-r - w * t) / x;
              } else {
                H[(i + 1) * nn + n] = (-s - y * t) / z;
              }
            }

            // Overflow control
            t = FastMath.abs(H[i * nn + n]);
            if ((EPS * t) * t > 1) {
              for (int j = i; j <= n; j++) {
                H[j * nn + n] /= t;
              }
            }
          }
        }

      } else if (q < 0) {

        // Complex vector
        int l = n - 1;

        // Last vector component imaginary so matrix is triangular
        if (FastMath.abs(H[n * nn + n - 1]) > FastMath.abs(H[(n - 1) * nn + n])) {
          H[(n - 1) * nn + n - 1] = q / H[n * nn + n - 1];
          H[(n - 1) * nn + n] = -(H[n * nn + n] - p) / H[n * nn + n - 1];
        } else {
          cdiv(0.0, -H[(n - 1) * nn + n], H[(n - 1) * nn + n - 1] - p, q);
          H[(n - 1) * nn + n - 1] = cdivr;
          H[(n - 1) * nn + n] = cdivi;
        }
        H[n * nn + n - 1] = 0.0;
        H[n * nn + n] = 1.0;
        for (int i = n - 2; i >= 0; i--) {
          double ra = 0.0;
          double sa = 0.0;
          for (int j = l; j <= n; j++) {
            ra += H[i * nn + j] * H[j * nn + n - 1];
            sa += H[i * nn + j] * H[j * nn + n];
          }
          w = H[i * nn + i] - p;

          if (e[i] < 0.0) {
            z = w;
            r = ra;
            s = sa;
          } else {
            l = i;
            if (e[i] == 0) {
              cdiv(-ra, -sa, w, q);
              H[i * nn + n - 1] = cdivr;
              H[i * nn + n] = cdivi;
            } else {

              // Solve complex equations
              x = H[i * nn + i + 1];
              y = H[(i + 1) * nn + i];
              double vr = (d[i] - p) * (d[i] - p) + e[i] * e[i] - q * q;
              double vi = (d[i] - p) * 2.0 * q;
              if (vr == 0.0 && vi == 0.0) {
                vr = EPS * norm * (FastMath.abs(w) + FastMath.abs(q) +
                                   FastMath.abs(x) + FastMath.abs(y) + FastMath.abs(z));
              }
              cdiv(x * r - z * ra + q * sa, x * s - z * sa - q * ra, vr, vi);
              H[i * nn + n - 1] = cdivr;
              H[i * nn + n] = cdivi;
              if (FastMath.abs(x) > FastMath.abs(z) + FastMath.abs(q)) {
                H[(i + 1) * nn + n - 1] = (-ra - w * H[i * nn + n - 1] + q * H[i * nn + n]) / x;
                H[(i + 1) * nn + n] = (-sa - w * H[i * nn + n] - q * H[i * nn + n - 1]) / x;
              } else {
                cdiv(-r - y * H[i * nn + n - 1], -s - y * H[i * nn + n], z, q);
                H[(i + 1) * nn + n - 1] = cdivr;
                H[(i + 1) * nn + n] = cdivi;
              }
            }

            // Overflow control
            t = FastMath.max(FastMath.abs(H[i * nn + n - 1]), FastMath.abs(H[i * nn + n]));
            if ((EPS * t) * t > 1) {
              for (int j = i; j <= n; j++) {
                H[j * nn + n - 1] /= t;
                H[j * nn + n] /= t;
              }
            }
          }
        }
      }
    }

    // Back transformation to get eigenvectors of original matrix
    for (int j = nn - 1; j >= low; j--) {
      for (int i = low; i <= high; i++) {
        z = 0.0;
        for (int k = low; k <= FastMath.min(j, high); k++) {
          z += V[i * nn + k] * H[k * nn + j];
        }
        V[i * nn + j] = z;
      }
    }
  }

  private void warnNotConverged(int index) {
    if (converged) {
      log.warn("No convergence for eigenvalue {} of {} x {} matrix after {} iterations; results are approximate",
               index, size, size, maxIterations);
    }
    converged = false;
  }

}
