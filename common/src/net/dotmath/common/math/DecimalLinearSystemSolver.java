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
import java.math.RoundingMode;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link LinearSystemSolver} for square systems backed by {@link LUDecompositionDecimal}, so
 * singularity is decided without floating-point rounding.
 */
public final class DecimalLinearSystemSolver implements LinearSystemSolver {

  private static final Logger log = LoggerFactory.getLogger(DecimalLinearSystemSolver.class);

  private final MathContext context;

  public DecimalLinearSystemSolver() {
    this(new MathContext(LUDecompositionDecimal.DEFAULT_PRECISION, RoundingMode.HALF_EVEN));
  }

  public DecimalLinearSystemSolver(MathContext context) {
    this.context = Preconditions.checkNotNull(context);
  }

  @Override
  public Solver getSolver(Matrix A) {
    checkSquare(A);
    LUDecompositionDecimal lu = new LUDecompositionDecimal(A, context);
    if (lu.isNonsingular()) {
      return lu;
    }
    int apparentRank = lu.getApparentRank();
    log.warn("{} x {} matrix is exactly singular; apparent rank {}",
             A.getRowDimension(), A.getColumnDimension(), apparentRank);
    throw new SingularMatrixSolverException(apparentRank, "Apparent rank: " + apparentRank);
  }

  @Override
  public boolean isNonSingular(Matrix A) {
    checkSquare(A);
    return new LUDecompositionDecimal(A, context).isNonsingular();
  }

  private static void checkSquare(Matrix A) {
    Preconditions.checkNotNull(A);
    if (A.getRowDimension() != A.getColumnDimension()) {
      throw new DimensionMismatchException("Matrix must be square",
                                           A.getColumnDimension(), A.getColumnDimension(),
                                           A.getRowDimension(), A.getColumnDimension());
    }
  }

}
