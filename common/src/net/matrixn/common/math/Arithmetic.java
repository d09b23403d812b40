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
 * The operations a {@link Matrix} needs from its element type. Implementations exist for
 * {@code double}, {@code long} and {@code int} values, and for any Commons Math
 * {@link org.apache.commons.math3.Field} through {@link FieldArithmetic}.
 *
 * <p>Implementations must be stateless and thread-safe, since matrix operations call them from
 * several threads at once.</p>
 *
 * @param <T> element type; values are never {@code null}
 */
public interface Arithmetic<T> {

  /**
   * @return additive identity
   */
  T zero();

  /**
   * @return multiplicative identity
   */
  T one();

  T add(T a, T b);

  T subtract(T a, T b);

  T multiply(T a, T b);

  /**
   * @return {@code a / b}; behavior when {@code b} is zero is up to the implementation
   */
  T divide(T a, T b);

  /**
   * @return true iff {@code a} is exactly equal to {@link #zero()}; no tolerance is applied
   */
  boolean isZero(T a);

  /**
   * @return true iff {@code a} and {@code b} are the same value; matrix equality compares elements
   *  with this
   */
  boolean equal(T a, T b);

  /**
   * @return hash of {@code a}, consistent with {@link #equal(Object, Object)}
   */
  int hash(T a);

  /**
   * @return class of values handled by this instance
   */
  Class<T> getElementType();

}
