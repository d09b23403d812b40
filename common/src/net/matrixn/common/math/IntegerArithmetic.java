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
 * {@link Arithmetic} over {@code int} values. Same caveats as {@link LongArithmetic}.
 */
public final class IntegerArithmetic implements Arithmetic<Integer> {

  private static final IntegerArithmetic INSTANCE = new IntegerArithmetic();

  private static final Integer ZERO = 0;
  private static final Integer ONE = 1;

  private IntegerArithmetic() {
  }

  public static IntegerArithmetic getInstance() {
    return INSTANCE;
  }

  @Override
  public Integer zero() {
    return ZERO;
  }

  @Override
  public Integer one() {
    return ONE;
  }

  @Override
  public Integer add(Integer a, Integer b) {
    return a + b;
  }

  @Override
  public Integer subtract(Integer a, Integer b) {
    return a - b;
  }

  @Override
  public Integer multiply(Integer a, Integer b) {
    return a * b;
  }

  @Override
  public Integer divide(Integer a, Integer b) {
    return a / b;
  }

  @Override
  public boolean isZero(Integer a) {
    return a == 0;
  }

  @Override
  public boolean equal(Integer a, Integer b) {
    return a.equals(b);
  }

  @Override
  public int hash(Integer a) {
    return a.hashCode();
  }

  @Override
  public Class<Integer> getElementType() {
    return Integer.class;
  }

  @Override
  public String toString() {
    return "IntegerArithmetic";
  }

}
