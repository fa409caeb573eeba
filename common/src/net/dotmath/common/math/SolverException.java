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
 * Superclass of the failures raised when a linear system or decomposition can't be solved
 * as asked: incompatible shapes, a singular matrix, a rank-deficient matrix.
 */
public class SolverException extends RuntimeException {

  public SolverException() {
  }

  public SolverException(String message) {
    super(message);
  }

  public SolverException(Throwable cause) {
    super(cause);
  }

  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }

}
