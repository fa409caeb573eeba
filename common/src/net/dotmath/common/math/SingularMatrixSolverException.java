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
 * Thrown when an LU-based solve is attempted on a matrix with an exactly zero pivot.
 * Reports the apparent rank: the number of nonzero pivots found during elimination.
 */
public final class SingularMatrixSolverException extends SolverException {

  private final int apparentRank;

  public SingularMatrixSolverException(int apparentRank, String message) {
    super(message);
    this.apparentRank = apparentRank;
  }

  public int getApparentRank() {
    return apparentRank;
  }

}
