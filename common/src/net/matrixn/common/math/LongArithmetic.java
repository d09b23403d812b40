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
 * {@link Arithmetic} over {@code long} values with Java's usual semantics: results wrap on overflow
 * and division truncates toward zero. An inverse computed over this type is therefore only exact
 * when the determinant is 1 or -1.
 */
public final class LongArithmetic implements Arithmetic<Long> {

  private static final LongArithmetic INSTANCE = new LongArithmetic();

  private static final Long ZERO = 0L;
  private static final Long ONE = 1L;

  private LongArithmetic() {
  }

  public static LongArithmetic getInstance() {
    return INSTANCE;
  }

  @Override
  public Long zero() {
    return ZERO;
  }

  @Override
  public Long one() {
    return ONE;
  }

  @Override
  public Long add(Long a, Long b) {
    return a + b;
  }

  @Override
  public Long subtract(Long a, Long b) {
    return a - b;
  }

  @Override
  public Long multiply(Long a, Long b) {
    return a * b;
  }

  /**
   * @throws ArithmeticException if {@code b} is 0
   */
  @Override
  public Long divide(Long a, Long b) {
    return a / b;
  }

  @Override
  public boolean isZero(Long a) {
    return a == 0L;
  }

  @Override
  public boolean equal(Long a, Long b) {
    return a.equals(b);
  }

  @Override
  public int hash(Long a) {
    return a.hashCode();
  }

  @Override
  public Class<Long> getElementType() {
    return Long.class;
  }

  @Override
  public String toString() {
    return "LongArithmetic";
  }

}
