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
 * Thrown when operand shapes are incompatible, such as solving against a right-hand side with
 * the wrong number of rows, or multiplying matrices whose inner dimensions differ.
 */
public final class DimensionMismatchException extends SolverException {

  private final int expectedRows;
  private final int expectedColumns;
  private final int actualRows;
  private final int actualColumns;

  public DimensionMismatchException(String message,
                                    int expectedRows,
                                    int expectedColumns,
                                    int actualRows,
                                    int actualColumns) {
    super(message + ": expected " + expectedRows + " x " + expectedColumns +
          " but was " + actualRows + " x " + actualColumns);
    this.expectedRows = expectedRows;
    this.expectedColumns = expectedColumns;
    this.actualRows = actualRows;
    this.actualColumns = actualColumns;
  }

  public DimensionMismatchException(String message) {
    super(message);
    this.expectedRows = -1;
    this.expectedColumns = -1;
    this.actualRows = -1;
    this.actualColumns = -1;
  }

  /**
   * @return rows the operation required, or -1 if not applicable
   */
  public int getExpectedRows() {
    return expectedRows;
  }

  public int getExpectedColumns() {
    return expectedColumns;
  }

  public int getActualRows() {
    return actualRows;
  }

  public int getActualColumns() {
    return actualColumns;
  }

}
