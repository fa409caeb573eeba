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
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>A complex number real + i * imaginary.</p>
 *
 * <p>Operations come in two families. Methods named like {@code plus}, {@code times} or
 * {@code sqrtOf} leave this instance alone and return a new one. Their mutable twins, like
 * {@code add}, {@code multiply} or {@code sqrt}, overwrite this instance and return it for
 * chaining. The shared constants {@link #ZERO}, {@link #ONE} and {@link #I} reject mutation.</p>
 */
public class Complex implements Serializable {

  private static final long serialVersionUID = 1L;

  /** 0, immutable */
  public static final Complex ZERO = new ConstantComplex(0.0, 0.0);
  /** 1, immutable */
  public static final Complex ONE = new ConstantComplex(1.0, 0.0);
  /** The imaginary unit i, immutable */
  public static final Complex I = new ConstantComplex(0.0, 1.0);

  private double real;
  private double imaginary;

  public Complex(double real, double imaginary) {
    this.real = real;
    this.imaginary = imaginary;
  }

  public static Complex real(double real) {
    return new Complex(real, 0.0);
  }

  public static Complex imaginary(double imaginary) {
    return new Complex(0.0, imaginary);
  }

  /**
   * @param magnitude distance from the origin
   * @param phase angle in radians
   */
  public static Complex createPolar(double magnitude, double phase) {
    return new Complex(magnitude * FastMath.cos(phase), magnitude * FastMath.sin(phase));
  }

  public Complex copy() {
    return new Complex(real, imaginary);
  }

  public final double getReal() {
    return real;
  }

  public final double getImaginary() {
    return imaginary;
  }

  /**
   * @return argument in radians, in (-pi, pi]
   */
  public double phase() {
    return FastMath.atan2(imaginary, real);
  }

  public double getArgument() {
    return phase();
  }

  public double getMagnitude() {
    return FastMath.sqrt(getMagnitudeSquared());
  }

  public double getMagnitudeSquared() {
    return real * real + imaginary * imaginary;
  }

  /**
   * @return true if neither component differs from {@code other}'s by more than {@code epsilon}
   */
  public boolean equalsEpsilon(Complex other, double epsilon) {
    return FastMath.max(FastMath.abs(real - other.real), FastMath.abs(imaginary - other.imaginary)) <= epsilon;
  }

  // Immutable operations

  public Complex plus(Complex c) {
    return new Complex(real + c.real, imaginary + c.imaginary);
  }

  public Complex minus(Complex c) {
    return new Complex(real - c.real, imaginary - c.imaginary);
  }

  public Complex times(Complex c) {
    return new Complex(real * c.real - imaginary * c.imaginary, real * c.imaginary + imaginary * c.real);
  }

  public Complex dividedBy(Complex c) {
    double cMag = c.getMagnitudeSquared();
    return new Complex((real * c.real + imaginary * c.imaginary) / cMag,
                       (imaginary * c.real - real * c.imaginary) / cMag);
  }

  public Complex negated() {
    return new Complex(-real, -imaginary);
  }

  /**
   * @return principal square root; its imaginary part takes the sign of this one's
   */
  public Complex sqrtOf() {
    return copy().sqrt();
  }

  /**
   * @return this raised to a real power, through the polar form
   */
  public Complex powerByReal(double realPower) {
    return createPolar(FastMath.pow(getMagnitude(), realPower), realPower * phase());
  }

  public Complex sinOf() {
    return copy().sin();
  }

  public Complex cosOf() {
    return copy().cos();
  }

  public Complex squared() {
    return times(this);
  }

  public Complex conjugated() {
    return new Complex(real, -imaginary);
  }

  /**
   * @return e raised to this, e^a * (cos b + i sin b)
   */
  public Complex exponentiated() {
    return createPolar(FastMath.exp(real), imaginary);
  }

  // Mutable operations

  /**
   * Every mutation goes through this method.
   *
   * @return this
   */
  public Complex setRealImaginary(double real, double imaginary) {
    this.real = real;
    this.imaginary = imaginary;
    return this;
  }

  public Complex setReal(double real) {
    return setRealImaginary(real, imaginary);
  }

  public Complex setImaginary(double imaginary) {
    return setRealImaginary(real, imaginary);
  }

  public Complex set(Complex c) {
    return setRealImaginary(c.real, c.imaginary);
  }

  public Complex setPolar(double magnitude, double phase) {
    return setRealImaginary(magnitude * FastMath.cos(phase), magnitude * FastMath.sin(phase));
  }

  public Complex add(Complex c) {
    return setRealImaginary(real + c.real, imaginary + c.imaginary);
  }

  public Complex subtract(Complex c) {
    return setRealImaginary(real - c.real, imaginary - c.imaginary);
  }

  public Complex multiply(Complex c) {
    return setRealImaginary(real * c.real - imaginary * c.imaginary, real * c.imaginary + imaginary * c.real);
  }

  public Complex divide(Complex c) {
    double cMag = c.getMagnitudeSquared();
    return setRealImaginary((real * c.real + imaginary * c.imaginary) / cMag,
                            (imaginary * c.real - real * c.imaginary) / cMag);
  }

  public Complex negate() {
    return setRealImaginary(-real, -imaginary);
  }

  public Complex exponentiate() {
    return setPolar(FastMath.exp(real), imaginary);
  }

  public Complex square() {
    return multiply(this);
  }

  public Complex sqrt() {
    double mag = getMagnitude();
    return setRealImaginary(FastMath.sqrt((mag + real) / 2.0),
                            (imaginary >= 0.0 ? 1.0 : -1.0) * FastMath.sqrt((mag - real) / 2.0));
  }

  public Complex sin() {
    return setRealImaginary(FastMath.sin(real) * FastMath.cosh(imaginary),
                            FastMath.cos(real) * FastMath.sinh(imaginary));
  }

  public Complex cos() {
    return setRealImaginary(FastMath.cos(real) * FastMath.cosh(imaginary),
                            -FastMath.sin(real) * FastMath.sinh(imaginary));
  }

  public Complex conjugate() {
    return setRealImaginary(real, -imaginary);
  }

  /**
   * @return the three cube roots, principal root first, then the roots at +120 and -120 degrees
   *  from it
   */
  public List<Complex> getCubeRoots() {
    double arg3 = getArgument() / 3.0;
    Complex radius = real(FastMath.cbrt(getMagnitude()));
    return Lists.newArrayList(radius.times(createPolar(1.0, arg3)),
                              radius.times(createPolar(1.0, arg3 + 2.0 * FastMath.PI / 3.0)),
                              radius.times(createPolar(1.0, arg3 - 2.0 * FastMath.PI / 3.0)));
  }

  // Equation solvers; each returns a new modifiable list

  /**
   * Roots of a*x + b = 0.
   *
   * @return the single root, an empty list if there is none, or {@code null} if every value is a root
   */
  public static List<Complex> solveLinearRoots(Complex a, Complex b) {
    Preconditions.checkNotNull(a);
    Preconditions.checkNotNull(b);
    if (a.equals(ZERO)) {
      return b.equals(ZERO) ? null : Lists.<Complex>newArrayList();
    }
    return Lists.newArrayList(b.dividedBy(a).negate());
  }

  /**
   * Roots of a*x^2 + b*x + c = 0, repeated by multiplicity, in the order
   * (-b + sqrt(b^2 - 4ac)) / 2a, (-b - sqrt(b^2 - 4ac)) / 2a.
   *
   * @return roots, or {@code null} if every value is a root
   */
  public static List<Complex> solveQuadraticRoots(Complex a, Complex b, Complex c) {
    Preconditions.checkNotNull(a);
    if (a.equals(ZERO)) {
      return solveLinearRoots(b, c);
    }
    Complex denom = real(2.0).multiply(a);
    Complex discriminant = b.times(b).subtract(real(4.0).multiply(a).multiply(c)).sqrt();
    return Lists.newArrayList(discriminant.minus(b).divide(denom),
                              discriminant.negated().subtract(b).divide(denom));
  }

  /**
   * Roots of a*x^3 + b*x^2 + c*x + d = 0, repeated by multiplicity.
   *
   * @return roots, or {@code null} if every value is a root
   */
  public static List<Complex> solveCubicRoots(Complex a, Complex b, Complex c, Complex d) {
    Preconditions.checkNotNull(a);
    if (a.equals(ZERO)) {
      return solveQuadraticRoots(b, c, d);
    }

    Complex denom = a.times(real(-3.0));
    Complex a2 = a.times(a);
    Complex b2 = b.times(b);
    Complex b3 = b2.times(b);
    Complex c2 = c.times(c);
    Complex c3 = c2.times(c);
    Complex abc = a.times(b).times(c);

    // Delta0 = b^2 - 3ac, Delta1 = 2b^3 + 27a^2d - 9abc
    Complex delta0First = b2;
    Complex delta0Second = a.times(c).multiply(real(3.0));
    Complex delta1First = b3.times(real(2.0)).add(a2.times(d).multiply(real(27.0)));
    Complex delta1Second = abc.times(real(9.0));

    if (delta0First.equals(delta0Second) && delta1First.equals(delta1Second)) {
      Complex tripleRoot = b.dividedBy(denom);
      return Lists.newArrayList(tripleRoot, tripleRoot.copy(), tripleRoot.copy());
    }

    Complex delta0 = delta0First.minus(delta0Second);
    Complex delta1 = delta1First.minus(delta1Second);

    // Discriminant vanishes when 18abcd + b^2c^2 == 4b^3d + 4ac^3 + 27a^2d^2
    Complex discriminantFirst = abc.times(d).multiply(real(18.0)).add(b2.times(c2));
    Complex discriminantSecond = b3.times(d).multiply(real(4.0))
        .add(c3.times(a).multiply(real(4.0)))
        .add(a2.times(d).multiply(d).multiply(real(27.0)));

    if (discriminantFirst.equals(discriminantSecond)) {
      Complex simpleRoot = abc.times(real(4.0))
          .subtract(b3.plus(a2.times(d).multiply(real(9.0))))
          .divide(a.times(delta0));
      Complex doubleRoot = a.times(d).multiply(real(9.0)).subtract(b.times(c))
          .divide(delta0.times(real(2.0)));
      return Lists.newArrayList(simpleRoot, doubleRoot, doubleRoot.copy());
    }

    Complex cCubed;
    if (delta0First.equals(delta0Second)) {
      cCubed = delta1;
    } else {
      Complex root = delta1.times(delta1).subtract(delta0.times(delta0).multiply(delta0).multiply(real(4.0))).sqrt();
      // Sign of the square root is chosen so that it doesn't cancel against delta1
      Complex sum = delta1.plus(root);
      Complex difference = delta1.minus(root);
      cCubed = sum.getMagnitudeSquared() >= difference.getMagnitudeSquared() ? sum : difference;
      cCubed.divide(real(2.0));
    }
    if (cCubed.equals(ZERO)) {
      // delta0 and delta1 both vanish to within rounding
      Complex tripleRoot = b.dividedBy(denom);
      return Lists.newArrayList(tripleRoot, tripleRoot.copy(), tripleRoot.copy());
    }
    List<Complex> roots = Lists.newArrayListWithCapacity(3);
    for (Complex cubeRoot : cCubed.getCubeRoots()) {
      roots.add(b.plus(cubeRoot).add(delta0.dividedBy(cubeRoot)).divide(denom));
    }
    return roots;
  }

  /**
   * Exact comparison of both components.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Complex)) {
      return false;
    }
    Complex other = (Complex) o;
    return real == other.real && imaginary == other.imaginary;
  }

  @Override
  public int hashCode() {
    long bits = Double.doubleToLongBits(real + 0.0) * 31 + Double.doubleToLongBits(imaginary + 0.0);
    return (int) (bits ^ (bits >>> 32));
  }

  @Override
  public String toString() {
    return "Complex(" + real + ", " + imaginary + ')';
  }

  private static final class ConstantComplex extends Complex {

    private static final long serialVersionUID = 1L;

    ConstantComplex(double real, double imaginary) {
      super(real, imaginary);
    }

    @Override
    public Complex setRealImaginary(double real, double imaginary) {
      throw new UnsupportedOperationException("Constant can't be modified");
    }

  }

}
