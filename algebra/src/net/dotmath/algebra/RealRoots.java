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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>Real-valued root finding. The closed-form solvers return only real roots, repeated by
 * multiplicity, as a {@code double[]}; {@code null} means every value is a root. When the
 * leading coefficient is many orders of magnitude below the others they fall back to the
 * lower-degree equation, which is what the caller usually wants in floating point.</p>
 *
 * @see Complex#solveCubicRoots(Complex, Complex, Complex, Complex)
 */
public final class RealRoots {

  /** Ratio beyond which a leading coefficient is treated as negligible. */
  private static final double DEGENERATE_RATIO = 1.0e7;
  private static final double DEFAULT_DISCRIMINANT_THRESHOLD = 1.0e-7;

  private RealRoots() {
  }

  /**
   * Roots of a*x + b = 0.
   */
  public static double[] solveLinearRootsReal(double a, double b) {
    if (a == 0.0) {
      return b == 0.0 ? null : new double[0];
    }
    return new double[] { -b / a };
  }

  /**
   * Real roots of a*x^2 + b*x + c = 0, with (-b - sqrt(D)) / 2a first.
   * A double root is returned twice.
   */
  public static double[] solveQuadraticRootsReal(double a, double b, double c) {
    if (a == 0.0 || FastMath.abs(b / a) > DEGENERATE_RATIO || FastMath.abs(c / a) > DEGENERATE_RATIO) {
      return solveLinearRootsReal(b, c);
    }
    double discriminant = b * b - 4.0 * a * c;
    if (discriminant < 0.0) {
      return new double[0];
    }
    double sqrt = FastMath.sqrt(discriminant);
    return new double[] { (-b - sqrt) / (2.0 * a), (-b + sqrt) / (2.0 * a) };
  }

  public static double[] solveCubicRootsReal(double a, double b, double c, double d) {
    return solveCubicRootsReal(a, b, c, d, DEFAULT_DISCRIMINANT_THRESHOLD);
  }

  /**
   * Real roots of a*x^3 + b*x^2 + c*x + d = 0.
   *
   * @param discriminantThreshold discriminants within this distance of 0 are treated as 0,
   *  giving a double root
   */
  public static double[] solveCubicRootsReal(double a, double b, double c, double d, double discriminantThreshold) {
    if (a == 0.0 ||
        FastMath.abs(b / a) > DEGENERATE_RATIO ||
        FastMath.abs(c / a) > DEGENERATE_RATIO ||
        FastMath.abs(d / a) > DEGENERATE_RATIO) {
      return solveQuadraticRootsReal(b, c, d);
    }

    if (d == 0.0 ||
        FastMath.abs(a / d) > DEGENERATE_RATIO ||
        FastMath.abs(b / d) > DEGENERATE_RATIO ||
        FastMath.abs(c / d) > DEGENERATE_RATIO) {
      // x is a factor
      double[] quadraticRoots = solveQuadraticRootsReal(a, b, c);
      double[] roots = new double[quadraticRoots.length + 1];
      System.arraycopy(quadraticRoots, 0, roots, 1, quadraticRoots.length);
      return roots;
    }

    double bn = b / a;
    double cn = c / a;
    double dn = d / a;

    double q = (3.0 * cn - bn * bn) / 9.0;
    double r = (-27.0 * dn + bn * (9.0 * cn - 2.0 * bn * bn)) / 54.0;
    double discriminant = q * q * q + r * r;
    double b3 = bn / 3.0;

    if (discriminant > discriminantThreshold) {
      // One real root
      double dsqrt = FastMath.sqrt(discriminant);
      return new double[] { cubeRoot(r + dsqrt) + cubeRoot(r - dsqrt) - b3 };
    }
    if (discriminant > -discriminantThreshold) {
      // Double root
      double rsqrt = cubeRoot(r);
      double doubleRoot = -b3 - rsqrt;
      return new double[] { -b3 + 2.0 * rsqrt, doubleRoot, doubleRoot };
    }
    // Three distinct roots
    double theta = FastMath.acos(r / FastMath.sqrt(-q * q * q));
    double rr = 2.0 * FastMath.sqrt(-q);
    return new double[] {
        -b3 + rr * FastMath.cos(theta / 3.0),
        -b3 + rr * FastMath.cos((theta + 2.0 * FastMath.PI) / 3.0),
        -b3 + rr * FastMath.cos((theta + 4.0 * FastMath.PI) / 3.0),
    };
  }

  /**
   * @return the real y with y^3 = x
   */
  public static double cubeRoot(double x) {
    return x >= 0.0 ? FastMath.pow(x, 1.0 / 3.0) : -FastMath.pow(-x, 1.0 / 3.0);
  }

  /**
   * Finds a root of an increasing function on [minX, maxX] by Newton's method, falling back to
   * bisection whenever a Newton step leaves the current bracket.
   *
   * @param minX lower end of an interval where the function is negative
   * @param maxX upper end of an interval where the function is positive
   * @param tolerance stop once |f(x)| is at most this
   * @param value f
   * @param derivative f'
   * @return x with |f(x)| within tolerance, or the best x found once the bracket can't shrink
   */
  public static double findRoot(double minX,
                                double maxX,
                                double tolerance,
                                UnivariateFunction value,
                                UnivariateFunction derivative) {
    Preconditions.checkArgument(minX <= maxX, "Bad interval [%s,%s]", minX, maxX);
    Preconditions.checkArgument(tolerance >= 0.0, "Bad tolerance: %s", tolerance);
    Preconditions.checkNotNull(value);
    Preconditions.checkNotNull(derivative);

    double low = minX;
    double high = maxX;
    double x = (low + high) / 2.0;
    double y;
    while (FastMath.abs(y = value.value(x)) > tolerance) {
      double dy = derivative.value(x);
      if (y < 0.0) {
        low = x;
      } else {
        high = x;
      }

      x -= y / dy;

      if (!(x > low && x < high)) {
        x = (low + high) / 2.0;
        if (x == low || x == high) {
          break;
        }
      }
    }
    return x;
  }

}
