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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.Field;
import org.apache.commons.math3.FieldElement;

/**
 * Adapts a Commons Math {@link Field} to {@link Arithmetic}. With an exact field such as
 * {@link org.apache.commons.math3.fraction.BigFractionField}, determinants and inverses are exact.
 *
 * @param <T> field element type
 */
public final class FieldArithmetic<T extends FieldElement<T>> implements Arithmetic<T> {

  private final Field<T> field;

  public FieldArithmetic(Field<T> field) {
    Preconditions.checkNotNull(field);
    this.field = field;
  }

  public Field<T> getField() {
    return field;
  }

  @Override
  public T zero() {
    return field.getZero();
  }

  @Override
  public T one() {
    return field.getOne();
  }

  @Override
  public T add(T a, T b) {
    return a.add(b);
  }

  @Override
  public T subtract(T a, T b) {
    return a.subtract(b);
  }

  @Override
  public T multiply(T a, T b) {
    return a.multiply(b);
  }

  /**
   * @throws org.apache.commons.math3.exception.MathArithmeticException if {@code b} is zero and the
   *  field doesn't define division by zero
   */
  @Override
  public T divide(T a, T b) {
    return a.divide(b);
  }

  @Override
  public boolean isZero(T a) {
    return field.getZero().equals(a);
  }

  @Override
  public boolean equal(T a, T b) {
    return a.equals(b);
  }

  @Override
  public int hash(T a) {
    return a.hashCode();
  }

  @SuppressWarnings("unchecked")
  @Override
  public Class<T> getElementType() {
    return (Class<T>) field.getRuntimeClass();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldArithmetic && field.equals(((FieldArithmetic<?>) o).field);
  }

  @Override
  public int hashCode() {
    return field.hashCode();
  }

  @Override
  public String toString() {
    return "FieldArithmetic[" + field.getRuntimeClass().getSimpleName() + ']';
  }

}
