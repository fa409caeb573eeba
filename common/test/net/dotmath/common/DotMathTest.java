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

package net.dotmath.common;

import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;

import net.dotmath.common.log.RecordingHandler;
import net.dotmath.common.math.Matrix;
import net.dotmath.common.math.MatrixUtils;
import net.dotmath.common.random.RandomManager;

public abstract class DotMathTest extends Assert {

  protected static final double DOUBLE_EPSILON = 1.0e-12;
  /** Tolerance for results of iterative or multi-step decompositions. */
  protected static final double LOOSE_EPSILON = 1.0e-9;

  public static void assertEquals(double expected, double actual) {
    Assert.assertEquals(expected, actual, DOUBLE_EPSILON);
  }

  public static void assertEquals(String message, double expected, double actual) {
    Assert.assertEquals(message, expected, actual, DOUBLE_EPSILON);
  }

  public static void assertArrayEquals(double[] expecteds, double[] actuals) {
    Assert.assertArrayEquals(expecteds, actuals, DOUBLE_EPSILON);
  }

  public static void assertMatrixEquals(Matrix expected, Matrix actual) {
    assertMatrixEquals(expected, actual, DOUBLE_EPSILON);
  }

  public static void assertMatrixEquals(Matrix expected, Matrix actual, double epsilon) {
    Assert.assertEquals(expected.getRowDimension(), actual.getRowDimension());
    Assert.assertEquals(expected.getColumnDimension(), actual.getColumnDimension());
    double difference = MatrixUtils.maxAbsDifference(expected, actual);
    assertTrue("Max difference " + difference + " between\n" + expected + "and\n" + actual,
               difference <= epsilon);
  }

  /**
   * Asserts that the columns of M are orthonormal.
   */
  public static void assertOrthonormalColumns(Matrix M) {
    int columns = M.getColumnDimension();
    assertMatrixEquals(Matrix.identity(columns, columns), M.transpose().times(M), LOOSE_EPSILON);
  }

  @BeforeClass
  public static void setUpClass() {
    RecordingHandler.setSensibleLogFormat();
  }

  @Before
  public void setUp() throws Exception {
    RandomManager.useTestSeed();
  }

}
