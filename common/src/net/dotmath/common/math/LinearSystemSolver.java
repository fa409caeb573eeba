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
 * Encapsulates a strategy for obtaining a {@link Solver} for a linear system Ax = b.
 * This allows for swapping in other strategies, such as exact decimal arithmetic.
 */
public interface LinearSystemSolver {

  /**
   * @return a {@link Solver} for A, which can solve Ax = b for x, given b
   * @throws SolverException if A is singular or rank-deficient
   */
  Solver getSolver(Matrix A);

  /**
   * @return true if A appears to be usable ({@link #getSolver(Matrix)} would succeed)
   */
  boolean isNonSingular(Matrix A);

}
