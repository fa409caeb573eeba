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

import com.google.common.base.Preconditions;

/**
 * General utility methods related to the language, primitives, and the system properties
 * that configure this library.
 */
public final class LangUtils {

  private LangUtils() {
  }

  /**
   * Parses a {@code double} from a {@link String} as if by {@link Double#valueOf(String)}, but disallows special
   * values like {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} and {@link Double#NEGATIVE_INFINITY}.
   *
   * @param s {@link String} to parse
   * @return floating-point value in the {@link String}
   * @throws NumberFormatException if input does not parse as a floating-point value
   * @throws IllegalArgumentException if input is infinite or {@link Double#NaN}
   */
  public static double parseDouble(String s) {
    double value = Double.parseDouble(s);
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * @param values values to check
   * @return true iff every value is finite
   * @see #isFinite(double)
   */
  public static boolean allFinite(double... values) {
    for (double value : values) {
      if (!isFinite(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Reads a positive {@code int} system property.
   *
   * @param name property name, like {@code dotmath.eigen.maxIterations}
   * @param defaultValue value to use if the property is not set
   * @return the property's value, or {@code defaultValue}
   * @throws IllegalArgumentException if the property is set but is not a positive integer
   */
  public static int getPositiveIntProperty(String name, int defaultValue) {
    String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    int parsed = Integer.parseInt(value.trim());
    Preconditions.checkArgument(parsed > 0, "%s must be positive: %s", name, parsed);
    return parsed;
  }

  /**
   * Reads an {@code enum} system property, by constant name.
   *
   * @param name property name
   * @param enumClass type of the enum
   * @param defaultValue value to use if the property is not set
   * @return the named constant, or {@code defaultValue}
   * @throws IllegalArgumentException if the property doesn't name a constant of {@code enumClass}
   */
  public static <E extends Enum<E>> E getEnumProperty(String name, Class<E> enumClass, E defaultValue) {
    String value = System.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    return Enum.valueOf(enumClass, value.trim());
  }

}
