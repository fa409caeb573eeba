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

/**
 * A solver for the system AX = B, where A is an m x n matrix and X and B have as many columns
 * as each other. An implementation encapsulates a factorization which implicitly contains A.
 */
public interface Solver {

  /**
   * Solves AX = B, where {@code A} is implicit in this instance.
   *
   * @param B right-hand side, with as many rows as A
   * @return X, with as many rows as A has columns
   * @throws DimensionMismatchException if B's row count doesn't match A's
   * @throws SolverException if A can't be used to solve the system
   */
  Matrix solve(Matrix B);

  /**
   * Like {@link #solve(Matrix)} for a single right-hand side vector.
   */
  double[] solve(double[] b);

  /**
   * @return true if {@link #solve(Matrix)} can succeed for a right-hand side of the right shape
   */
  boolean isNonSingular();

}
