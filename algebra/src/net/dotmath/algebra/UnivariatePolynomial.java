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

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dotmath.common.LangUtils;
import net.dotmath.common.math.EigenvalueDecomposition;
import net.dotmath.common.math.Matrix;
import net.dotmath.common.math.MatrixUtils;
import net.dotmath.common.math.QRDecomposition;

/**
 * <p>An immutable polynomial in one variable with real coefficients, indexed by degree: 2x^2 + 6x + 4
 * is {@code new UnivariatePolynomial(4, 6, 2)}. Trailing zero coefficients are dropped, so the zero
 * polynomial has no coefficients and degree -1.</p>
 */
public final class UnivariatePolynomial implements Serializable {

  private static final long serialVersionUID = 1L;

  private static final Logger log = LoggerFactory.getLogger(UnivariatePolynomial.class);

  /**
   * Root strategy used by {@link #getRoots()}, from system property
   * {@code dotmath.polynomial.rootStrategy}.
   */
  public static final RootStrategy DEFAULT_ROOT_STRATEGY =
      LangUtils.getEnumProperty("dotmath.polynomial.rootStrategy",
                                RootStrategy.class,
                                RootStrategy.EIGENVALUE_DECOMPOSITION);

  private static final int QR_MAX_STEPS = 500;
  private static final int QR_CHECK_INTERVAL = 10;
  private static final double QR_EPSILON = 1.0e-13;

  public static final UnivariatePolynomial ZERO = new UnivariatePolynomial();

  private final double[] coefficients;

  /**
   * @param coefficients coefficient of x^i at index i
   */
  public UnivariatePolynomial(double... coefficients) {
    Preconditions.checkNotNull(coefficients);
    int length = coefficients.length;
    while (length > 0 && coefficients[length - 1] == 0.0) {
      length--;
    }
    this.coefficients = Arrays.copyOf(coefficients, length);
  }

  /**
   * @return coefficient * x^degree
   */
  public static UnivariatePolynomial singleCoefficient(double coefficient, int degree) {
    Preconditions.checkArgument(degree >= 0, "Negative degree: %s", degree);
    double[] coefficients = new double[degree + 1];
    coefficients[degree] = coefficient;
    return new UnivariatePolynomial(coefficients);
  }

  /**
   * @return coefficient of x^degree, 0 beyond the highest degree
   */
  public double getCoefficient(int degree) {
    return degree < coefficients.length ? coefficients[degree] : 0.0;
  }

  /**
   * @return copy of the coefficients, lowest degree first, without trailing zeroes
   */
  public double[] getCoefficients() {
    return coefficients.clone();
  }

  /**
   * @return degree, or -1 for the zero polynomial
   */
  public int getDegree() {
    return coefficients.length - 1;
  }

  public boolean isZero() {
    return coefficients.length == 0;
  }

  public UnivariatePolynomial plus(UnivariatePolynomial polynomial) {
    double[] sum = new double[FastMath.max(coefficients.length, polynomial.coefficients.length)];
    for (int i = 0; i < sum.length; i++) {
      sum[i] = getCoefficient(i) + polynomial.getCoefficient(i);
    }
    return new UnivariatePolynomial(sum);
  }

  public UnivariatePolynomial minus(UnivariatePolynomial polynomial) {
    double[] difference = new double[FastMath.max(coefficients.length, polynomial.coefficients.length)];
    for (int i = 0; i < difference.length; i++) {
      difference[i] = getCoefficient(i) - polynomial.getCoefficient(i);
    }
    return new UnivariatePolynomial(difference);
  }

  public UnivariatePolynomial times(UnivariatePolynomial polynomial) {
    if (isZero() || polynomial.isZero()) {
      return ZERO;
    }
    double[] product = new double[coefficients.length + polynomial.coefficients.length - 1];
    for (int i = 0; i < coefficients.length; i++) {
      for (int j = 0; j < polynomial.coefficients.length; j++) {
        product[i + j] += coefficients[i] * polynomial.coefficients[j];
      }
    }
    return new UnivariatePolynomial(product);
  }

  /**
   * Polynomial long division.
   *
   * @return quotient and remainder, with the remainder's degree below the divisor's
   * @throws ArithmeticException if {@code polynomial} is zero
   */
  public Division dividedBy(UnivariatePolynomial polynomial) {
    if (polynomial.isZero()) {
      throw new ArithmeticException("Division by zero polynomial");
    }
    int divisorDegree = polynomial.getDegree();
    double leading = polynomial.coefficients[divisorDegree];
    UnivariatePolynomial quotient = ZERO;
    UnivariatePolynomial remainder = this;
    while (remainder.getDegree() >= divisorDegree) {
      int remainderDegree = remainder.getDegree();
      UnivariatePolynomial term =
          singleCoefficient(remainder.coefficients[remainderDegree] / leading, remainderDegree - divisorDegree);
      quotient = quotient.plus(term);
      UnivariatePolynomial next = remainder.minus(term.times(polynomial));
      // Rounding can leave the leading term behind; it is zero by construction
      if (next.getDegree() >= remainderDegree) {
        double[] truncated = Arrays.copyOf(next.coefficients, remainderDegree);
        next = new UnivariatePolynomial(truncated);
      }
      remainder = next;
    }
    return new Division(quotient, remainder);
  }

  /**
   * @return greatest common divisor by Euclid's algorithm; not normalized to be monic
   */
  public UnivariatePolynomial gcd(UnivariatePolynomial polynomial) {
    UnivariatePolynomial a = this;
    UnivariatePolynomial b = polynomial;
    while (!b.isZero()) {
      UnivariatePolynomial t = b;
      b = a.dividedBy(b).getRemainder();
      a = t;
    }
    return a;
  }

  /**
   * @return this polynomial divided by its leading coefficient; the zero polynomial for zero
   */
  public UnivariatePolynomial getMonicPolynomial() {
    if (isZero()) {
      return this;
    }
    double leading = coefficients[coefficients.length - 1];
    double[] monic = new double[coefficients.length];
    for (int i = 0; i < monic.length; i++) {
      monic[i] = coefficients[i] / leading;
    }
    return new UnivariatePolynomial(monic);
  }

  /**
   * @return value at x, by Horner's method
   */
  public double evaluate(double x) {
    double result = 0.0;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      result = result * x + coefficients[i];
    }
    return result;
  }

  /**
   * @return value at a complex x, by Horner's method
   */
  public Complex evaluateComplex(Complex x) {
    Complex result = Complex.real(0.0);
    for (int i = coefficients.length - 1; i >= 0; i--) {
      result.multiply(x);
      result.setReal(result.getReal() + coefficients[i]);
    }
    return result;
  }

  /**
   * @return roots found with {@link #DEFAULT_ROOT_STRATEGY}
   * @see #getRoots(RootStrategy)
   */
  public List<Complex> getRoots() {
    return getRoots(DEFAULT_ROOT_STRATEGY);
  }

  /**
   * Finds the roots of this polynomial, repeated by multiplicity. Degrees 1 through 3 are solved
   * in closed form; higher degrees go through the eigenvalues of the companion matrix.
   *
   * @param strategy how to find eigenvalues of the companion matrix, for degree 4 and up
   * @return roots; empty for the zero polynomial and for nonzero constants
   */
  public List<Complex> getRoots(RootStrategy strategy) {
    Preconditions.checkNotNull(strategy);
    int degree = getDegree();
    if (degree <= 0) {
      return Lists.newArrayList();
    }
    if (degree == 1) {
      return Lists.newArrayList(Complex.real(-coefficients[0] / coefficients[1]));
    }
    if (coefficients[0] == 0.0) {
      // x is a factor
      List<Complex> roots =
          new UnivariatePolynomial(Arrays.copyOfRange(coefficients, 1, coefficients.length)).getRoots(strategy);
      roots.add(Complex.real(0.0));
      return roots;
    }
    if (degree == 2) {
      return Complex.solveQuadraticRoots(Complex.real(coefficients[2]),
                                         Complex.real(coefficients[1]),
                                         Complex.real(coefficients[0]));
    }
    if (degree == 3) {
      return Complex.solveCubicRoots(Complex.real(coefficients[3]),
                                     Complex.real(coefficients[2]),
                                     Complex.real(coefficients[1]),
                                     Complex.real(coefficients[0]));
    }
    log.debug("Finding roots of degree {} polynomial with {}", degree, strategy);
    Matrix companion = getCompanionMatrix();
    switch (strategy) {
      case EIGENVALUE_DECOMPOSITION:
        return eigenvalueRoots(companion);
      case QR_ITERATION:
        return qrIterationRoots(companion);
      default:
        throw new IllegalStateException("Unknown strategy " + strategy);
    }
  }

  /**
   * @return matrix whose characteristic polynomial is this one made monic: ones on the
   *  sub-diagonal, negated normalized coefficients in the last column
   */
  Matrix getCompanionMatrix() {
    int degree = getDegree();
    double leading = coefficients[degree];
    Matrix companion = new Matrix(degree, degree);
    for (int i = 0; i < degree; i++) {
      if (i < degree - 1) {
        companion.set(i + 1, i, 1.0);
      }
      companion.set(i, degree - 1, -coefficients[i] / leading);
    }
    return companion;
  }

  private static List<Complex> eigenvalueRoots(Matrix companion) {
    EigenvalueDecomposition decomposition = new EigenvalueDecomposition(companion);
    double[] realValues = decomposition.getRealEigenvalues();
    double[] imaginaryValues = decomposition.getImagEigenvalues();
    List<Complex> roots = Lists.newArrayListWithCapacity(realValues.length);
    for (int i = 0; i < realValues.length; i++) {
      roots.add(new Complex(realValues[i], imaginaryValues[i]));
    }
    return roots;
  }

  private static List<Complex> qrIterationRoots(Matrix companion) {
    Matrix matrix = companion;
    boolean converged = false;
    for (int step = 0; step < QR_MAX_STEPS && !converged; step++) {
      QRDecomposition qr = new QRDecomposition(matrix);
      matrix = qr.getR().times(qr.getQ());
      if (step % QR_CHECK_INTERVAL == 0) {
        converged = MatrixUtils.maxAbsBelowDiagonal(matrix) < QR_EPSILON;
      }
    }
    if (!converged) {
      log.warn("QR iteration did not converge after {} steps; largest sub-diagonal entry is {}",
               QR_MAX_STEPS, MatrixUtils.maxAbsBelowDiagonal(matrix));
    }
    int size = matrix.getRowDimension();
    List<Complex> roots = Lists.newArrayListWithCapacity(size);
    for (int i = 0; i < size; i++) {
      roots.add(Complex.real(matrix.get(i, i)));
    }
    return roots;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UnivariatePolynomial)) {
      return false;
    }
    return Arrays.equals(coefficients, ((UnivariatePolynomial) o).coefficients);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coefficients);
  }

  @Override
  public String toString() {
    if (isZero()) {
      return "0";
    }
    StringBuilder result = new StringBuilder();
    for (int i = coefficients.length - 1; i >= 0; i--) {
      double coefficient = coefficients[i];
      if (coefficient == 0.0) {
        continue;
      }
      if (result.length() > 0) {
        result.append(coefficient < 0.0 ? " - " : " + ");
        coefficient = FastMath.abs(coefficient);
      }
      result.append(coefficient);
      if (i > 0) {
        result.append(i == 1 ? "x" : "x^" + i);
      }
    }
    return result.toString();
  }

  /**
   * Result of {@link UnivariatePolynomial#dividedBy(UnivariatePolynomial)}.
   */
  public static final class Division {

    private final UnivariatePolynomial quotient;
    private final UnivariatePolynomial remainder;

    Division(UnivariatePolynomial quotient, UnivariatePolynomial remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }

    public UnivariatePolynomial getQuotient() {
      return quotient;
    }

    public UnivariatePolynomial getRemainder() {
      return remainder;
    }

    @Override
    public String toString() {
      return "(" + quotient + ", " + remainder + ')';
    }

  }

}
