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

package net.dotmath.algebra;

/**
 * How {@link UnivariatePolynomial#getRoots()} extracts roots of degree 4 and higher from the
 * polynomial's companion matrix.
 */
public enum RootStrategy {

  /**
   * Full {@link net.dotmath.common.math.EigenvalueDecomposition} of the companion matrix.
   * Finds complex conjugate pairs.
   */
  EIGENVALUE_DECOMPOSITION,

  /**
   * Unshifted QR iteration A = R*Q on the companion matrix, reading roots off its diagonal.
   * Only finds real roots; complex pairs show up as unconverged 2 x 2 blocks.
   */
  QR_ITERATION,

}
