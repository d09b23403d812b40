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

package net.matrixn.common.math;

/**
 * {@link Arithmetic} over {@code double} values, following IEEE 754 rules. In particular
 * division by zero gives an infinity or {@link Double#NaN} rather than an exception.
 */
public final class DoubleArithmetic implements Arithmetic<Double> {

  private static final DoubleArithmetic INSTANCE = new DoubleArithmetic();

  private static final Double ZERO = 0.0;
  private static final Double ONE = 1.0;

  private DoubleArithmetic() {
  }

  public static DoubleArithmetic getInstance() {
    return INSTANCE;
  }

  @Override
  public Double zero() {
    return ZERO;
  }

  @Override
  public Double one() {
    return ONE;
  }

  @Override
  public Double add(Double a, Double b) {
    return a + b;
  }

  @Override
  public Double subtract(Double a, Double b) {
    return a - b;
  }

  @Override
  public Double multiply(Double a, Double b) {
    return a * b;
  }

  @Override
  public Double divide(Double a, Double b) {
    return a / b;
  }

  /**
   * Compares numerically, so that {@code -0.0} counts as zero, unlike {@link Double#equals(Object)}.
   */
  @Override
  public boolean isZero(Double a) {
    return a == 0.0;
  }

  /**
   * Numerically equal values are equal, so {@code -0.0} equals {@code 0.0}. Unlike {@code ==}, NaN
   * equals NaN.
   */
  @Override
  public boolean equal(Double a, Double b) {
    double x = a;
    double y = b;
    return x == y || (Double.isNaN(x) && Double.isNaN(y));
  }

  @Override
  public int hash(Double a) {
    // -0.0 hashes as 0.0
    return a == 0.0 ? Double.hashCode(0.0) : a.hashCode();
  }

  @Override
  public Class<Double> getElementType() {
    return Double.class;
  }

  @Override
  public String toString() {
    return "DoubleArithmetic";
  }

}
