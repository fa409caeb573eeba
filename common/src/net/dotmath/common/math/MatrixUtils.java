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

import java.util.Locale;

import org.apache.commons.math3.util.FastMath;

/**
 * Contains utility methods for dealing with {@link Matrix} and the raw buffers that the
 * decompositions work on.
 */
public final class MatrixUtils {

  private static final int PRINT_COLUMN_WIDTH = 12;
  /** Five significant digits; widest case is -1.2346e-100 */
  private static final String CELL_FORMAT = "%" + PRINT_COLUMN_WIDTH + ".5g";

  private MatrixUtils() {
  }

  /**
   * @return sqrt(a^2 + b^2) without under/overflow
   */
  public static double hypot(double a, double b) {
    double absA = FastMath.abs(a);
    double absB = FastMath.abs(b);
    if (absA > absB) {
      double r = b / a;
      return absA * FastMath.sqrt(1.0 + r * r);
    }
    if (b != 0.0) {
      double r = a / b;
      return absB * FastMath.sqrt(1.0 + r * r);
    }
    return 0.0;
  }

  /**
   * @return largest absolute difference between corresponding entries of two same-shaped matrices
   * @throws DimensionMismatchException if the shapes differ
   */
  public static double maxAbsDifference(Matrix a, Matrix b) {
    a.checkMatrixDimensions(b);
    double[] aEntries = a.getArray();
    double[] bEntries = b.getArray();
    double max = 0.0;
    for (int i = 0; i < aEntries.length; i++) {
      max = FastMath.max(max, FastMath.abs(aEntries[i] - bEntries[i]));
    }
    return max;
  }

  /**
   * @param M matrix
   * @return largest absolute value of any entry strictly below the main diagonal
   */
  public static double maxAbsBelowDiagonal(Matrix M) {
    double max = 0.0;
    int rows = M.getRowDimension();
    int columns = M.getColumnDimension();
    for (int i = 1; i < rows; i++) {
      int limit = FastMath.min(i, columns);
      for (int j = 0; j < limit; j++) {
        max = FastMath.max(max, FastMath.abs(M.get(i, j)));
      }
    }
    return max;
  }

  /**
   * @param M matrix to print
   * @return a print-friendly rendering of a matrix, one row per line, with a dimension header.
   *  Not useful for wide matrices.
   */
  public static String matrixToString(Matrix M) {
    int rows = M.getRowDimension();
    int columns = M.getColumnDimension();
    StringBuilder result = new StringBuilder();
    result.append("dim: ").append(rows).append('x').append(columns).append('\n');
    for (int i = 0; i < rows; i++) {
      for (int j = 0; j < columns; j++) {
        if (j > 0) {
          result.append('\t');
        }
        appendPadded(M.get(i, j), result);
      }
      result.append('\n');
    }
    return result.toString();
  }

  /**
   * Appends {@code value} right-aligned in a fixed-width column, switching to scientific notation
   * for very small or large magnitudes so the exponent is never lost.
   */
  private static void appendPadded(double value, StringBuilder to) {
    to.append(String.format(Locale.ROOT, CELL_FORMAT, value));
  }

}
