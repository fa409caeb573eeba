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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dotmath.common.LangUtils;

/**
 * <p>The same partial-pivoted LU decomposition as {@link LUDecomposition}, with identical control
 * flow, carried out in {@link BigDecimal} arithmetic. Use it when the answer must not depend on
 * floating-point rounding, for example to decide whether a nearly singular system is exactly
 * singular.</p>
 *
 * <p>Every operation of the LU factors is rounded to the {@link MathContext} given at construction,
 * by default {@link #DEFAULT_PRECISION} significant digits, and {@link #solve(Matrix)} works from
 * those factors. Rank, singularity and the determinant instead come from a separate fraction-free
 * (Bareiss) elimination with unrounded arithmetic, so they are exact for any input.</p>
 */
public final class LUDecompositionDecimal implements Solver {

  private static final Logger log = LoggerFactory.getLogger(LUDecompositionDecimal.class);

  /**
   * Significant digits kept by each operation, from system property {@code dotmath.decimal.precision}.
   */
  public static final int DEFAULT_PRECISION = LangUtils.getPositiveIntProperty("dotmath.decimal.precision", 50);

  private final int m;
  private final int n;
  private final MathContext context;
  private final BigDecimal[] LU;
  private final int[] piv;
  private final int exactRank;
  private final BigDecimal exactDeterminant;

  public LUDecompositionDecimal(Matrix matrix) {
    this(toDecimal(matrix), new MathContext(DEFAULT_PRECISION, RoundingMode.HALF_EVEN));
  }

  public LUDecompositionDecimal(Matrix matrix, MathContext context) {
    this(toDecimal(matrix), context);
  }

  /**
   * @param rows rectangular array of m rows of length n, with m >= n; entries are copied
   * @param context precision and rounding for every operation of the LU factors
   * @throws DimensionMismatchException if there are fewer rows than columns
   */
  public LUDecompositionDecimal(BigDecimal[][] rows, MathContext context) {
    Preconditions.checkNotNull(rows);
    Preconditions.checkNotNull(context);
    this.context = context;
    m = rows.length;
    n = m == 0 ? 0 : rows[0].length;
    LU = new BigDecimal[m * n];
    for (int i = 0; i < m; i++) {
      Preconditions.checkArgument(rows[i].length == n, "Row %s has length %s, not %s", i, rows[i].length, n);
      for (int j = 0; j < n; j++) {
        LU[i * n + j] = Preconditions.checkNotNull(rows[i][j]);
      }
    }
    if (m < n) {
      throw new DimensionMismatchException("LU decomposition needs at least as many rows as columns", n, n, m, n);
    }

    BigDecimal[] echelon = LU.clone();
    int rank = 0;
    int echelonSign = 1;
    BigDecimal previousPivot = BigDecimal.ONE;
    for (int col = 0; col < n && rank < m; col++) {
      int p = rank;
      while (p < m && echelon[p * n + col].signum() == 0) {
        p++;
      }
      if (p == m) {
        // No pivot in this column
        continue;
      }
      if (p != rank) {
        swapRows(echelon, n, p, rank);
        echelonSign = -echelonSign;
      }
      BigDecimal pivot = echelon[rank * n + col];
      for (int i = rank + 1; i < m; i++) {
        BigDecimal factor = echelon[i * n + col];
        for (int j = col + 1; j < n; j++) {
          // Entries stay minors of A, so the division is exact
          echelon[i * n + j] = pivot.multiply(echelon[i * n + j])
              .subtract(factor.multiply(echelon[rank * n + j]))
              .divide(previousPivot);
        }
        echelon[i * n + col] = BigDecimal.ZERO;
      }
      previousPivot = pivot;
      rank++;
    }
    exactRank = rank;
    if (m == n && rank == n) {
      exactDeterminant = n == 0 ? BigDecimal.ONE : previousPivot.multiply(BigDecimal.valueOf(echelonSign));
    } else {
      exactDeterminant = BigDecimal.ZERO;
    }

    piv = new int[m];
    for (int i = 0; i < m; i++) {
      piv[i] = i;
    }
    BigDecimal[] LUcolj = new BigDecimal[m];

    for (int j = 0; j < n; j++) {

      for (int i = 0; i < m; i++) {
        LUcolj[i] = LU[i * n + j];
      }

      for (int i = 0; i < m; i++) {
        int kmax = FastMath.min(i, j);
        BigDecimal s = BigDecimal.ZERO;
        for (int k = 0; k < kmax; k++) {
          s = s.add(LU[i * n + k].multiply(LUcolj[k], context), context);
        }
        LUcolj[i] = LUcolj[i].subtract(s, context);
        LU[i * n + j] = LUcolj[i];
      }

      int p = j;
      for (int i = j + 1; i < m; i++) {
        if (LUcolj[i].abs().compareTo(LUcolj[p].abs()) > 0) {
          p = i;
        }
      }
      if (p != j) {
        swapRows(LU, n, p, j);
        int k = piv[p];
        piv[p] = piv[j];
        piv[j] = k;
      }

      if (j < m && LU[j * n + j].signum() != 0) {
        BigDecimal pivot = LU[j * n + j];
        for (int i = j + 1; i < m; i++) {
          LU[i * n + j] = LU[i * n + j].divide(pivot, context);
        }
      }
    }
  }

  private static void swapRows(BigDecimal[] values, int columns, int a, int b) {
    for (int k = 0; k < columns; k++) {
      BigDecimal t = values[a * columns + k];
      values[a * columns + k] = values[b * columns + k];
      values[b * columns + k] = t;
    }
  }

  private static BigDecimal[][] toDecimal(Matrix matrix) {
    int rows = matrix.getRowDimension();
    int columns = matrix.getColumnDimension();
    BigDecimal[][] result = new BigDecimal[rows][columns];
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns; j++) {
        double value = matrix.get(i, j);
        Preconditions.checkArgument(LangUtils.isFinite(value), "Bad value at (%s,%s): %s", i, j, value);
        // Exact binary expansion of the double
        result[i][j] = new BigDecimal(value);
      }
    }
    return result;
  }

  /**
   * @return true iff A is square and has full rank, decided exactly
   */
  public boolean isNonsingular() {
    return m == n && exactRank == n;
  }

  @Override
  public boolean isNonSingular() {
    return isNonsingular();
  }

  /**
   * @return exact rank of A
   */
  public int getApparentRank() {
    return exactRank;
  }

  public int[] getPivot() {
    return piv.clone();
  }

  /**
   * @return determinant of A, computed exactly and then rounded to this decomposition's context
   * @throws DimensionMismatchException if A is not square
   */
  public BigDecimal det() {
    if (m != n) {
      throw new DimensionMismatchException("Matrix must be square", n, n, m, n);
    }
    return exactDeterminant.round(context);
  }

  /**
   * Solves A*X = B in decimal arithmetic, then rounds X to {@code double}.
   *
   * @see #solveExact(BigDecimal[][])
   */
  @Override
  public Matrix solve(Matrix B) {
    BigDecimal[][] X = solveExact(toDecimal(B));
    int nx = B.getColumnDimension();
    Matrix result = new Matrix(X.length, nx);
    for (int i = 0; i < X.length; i++) {
      for (int j = 0; j < nx; j++) {
        result.set(i, j, X[i][j].doubleValue());
      }
    }
    return result;
  }

  @Override
  public double[] solve(double[] b) {
    return solve(Matrix.columnVector(b)).getColumn(0);
  }

  /**
   * Solves A*X = B in decimal arithmetic.
   *
   * @param B rows of the right-hand side; as many as A has rows
   * @return rows of X
   * @throws DimensionMismatchException if B's row count doesn't match A's
   * @throws SingularMatrixSolverException if A is singular
   */
  public BigDecimal[][] solveExact(BigDecimal[][] B) {
    if (B.length != m) {
      int bColumns = B.length == 0 ? 0 : B[0].length;
      throw new DimensionMismatchException("Matrix row dimensions must agree", m, bColumns, B.length, bColumns);
    }
    if (!isNonsingular()) {
      int apparentRank = getApparentRank();
      log.warn("{} x {} matrix is exactly singular; apparent rank {}", m, n, apparentRank);
      throw new SingularMatrixSolverException(apparentRank, "Matrix is singular; apparent rank " + apparentRank);
    }
    for (int j = 0; j < n; j++) {
      if (LU[j * n + j].signum() == 0) {
        log.warn("Pivot {} of nonsingular {} x {} matrix rounds to zero at precision {}",
                 j, m, n, context.getPrecision());
        throw new SingularMatrixSolverException(j, "Pivot " + j + " rounds to zero at precision " +
                                                   context.getPrecision());
      }
    }

    int nx = m == 0 ? 0 : B[0].length;
    BigDecimal[][] X = new BigDecimal[m][];
    for (int i = 0; i < m; i++) {
      Preconditions.checkArgument(B[piv[i]].length == nx, "Ragged right-hand side");
      X[i] = B[piv[i]].clone();
    }

    // Solve L*Y = B(piv,:)
    for (int k = 0; k < n; k++) {
      for (int i = k + 1; i < n; i++) {
        BigDecimal lik = LU[i * n + k];
        for (int j = 0; j < nx; j++) {
          X[i][j] = X[i][j].subtract(X[k][j].multiply(lik, context), context);
        }
      }
    }

    // Solve U*X = Y
    for (int k = n - 1; k >= 0; k--) {
      BigDecimal ukk = LU[k * n + k];
      for (int j = 0; j < nx; j++) {
        X[k][j] = X[k][j].divide(ukk, context);
      }
      for (int i = 0; i < k; i++) {
        BigDecimal uik = LU[i * n + k];
        for (int j = 0; j < nx; j++) {
          X[i][j] = X[i][j].subtract(X[k][j].multiply(uik, context), context);
        }
      }
    }
    return X;
  }

}
