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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link LinearSystemSolver}: {@link LUDecomposition} for a square matrix, and
 * {@link QRDecomposition}, giving least-squares solutions, for a tall one.
 */
public final class DenseLinearSystemSolver implements LinearSystemSolver {

  private static final Logger log = LoggerFactory.getLogger(DenseLinearSystemSolver.class);

  public static final DenseLinearSystemSolver INSTANCE = new DenseLinearSystemSolver();

  private DenseLinearSystemSolver() {
  }

  @Override
  public Solver getSolver(Matrix A) {
    Preconditions.checkNotNull(A);
    int m = A.getRowDimension();
    int n = A.getColumnDimension();
    if (m == n) {
      LUDecomposition lu = new LUDecomposition(A);
      if (lu.isNonsingular()) {
        return lu;
      }
      int apparentRank = lu.getApparentRank();
      log.warn("{} x {} matrix is singular; apparent rank {}", m, n, apparentRank);
      throw new SingularMatrixSolverException(apparentRank, "Apparent rank: " + apparentRank);
    }
    if (m < n) {
      throw new DimensionMismatchException("Least squares needs at least as many rows as columns; got " +
                                           m + " x " + n);
    }
    QRDecomposition qr = new QRDecomposition(A);
    if (qr.isFullRank()) {
      return qr;
    }
    int apparentRank = qr.getApparentRank();
    log.warn("{} x {} matrix is rank deficient; apparent rank {}", m, n, apparentRank);
    throw new RankDeficientSolverException(apparentRank, "Apparent rank: " + apparentRank);
  }

  @Override
  public boolean isNonSingular(Matrix A) {
    if (A.getRowDimension() == A.getColumnDimension()) {
      return new LUDecomposition(A).isNonsingular();
    }
    return A.getRowDimension() > A.getColumnDimension() && new QRDecomposition(A).isFullRank();
  }

}
