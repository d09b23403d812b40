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

import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;

/**
 * <p>Outcome of a matrix operation that can fail for expected reasons, such as asking for the
 * inverse of a singular matrix. Either the operation succeeded and {@link #getValue()} is its result,
 * or it failed for the reason given by {@link #getFailure()}.</p>
 *
 * <p>A failed attempt still has a value: the placeholder that the operation defines for failure, such as
 * the additive identity for a determinant, or {@code null} for an inverse. Always check
 * {@link #isSuccess()} before trusting {@link #getValue()}.</p>
 *
 * @param <V> type of result
 */
public final class Attempt<V> {

  /**
   * Reasons an operation can fail.
   */
  public enum Failure {
    /** Operands don't have the shape the operation needs, such as a non-square matrix. */
    DIMENSION_MISMATCH,
    /** The matrix is square but not invertible. */
    SINGULAR,
  }

  private final V value;
  private final Failure failure;

  private Attempt(V value, Failure failure) {
    this.value = value;
    this.failure = failure;
  }

  /**
   * @param value result of the operation; not {@code null}
   */
  public static <V> Attempt<V> success(V value) {
    Preconditions.checkNotNull(value);
    return new Attempt<V>(value, null);
  }

  /**
   * @param failure why the operation failed
   * @param placeholder value to report for the failed operation, which may be {@code null}
   */
  public static <V> Attempt<V> failure(Failure failure, V placeholder) {
    Preconditions.checkNotNull(failure);
    return new Attempt<V>(placeholder, failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * @return reason for failure, or {@code null} if the operation succeeded
   */
  public Failure getFailure() {
    return failure;
  }

  /**
   * @return result if {@link #isSuccess()}, or else the operation's placeholder for failure
   */
  public V getValue() {
    return value;
  }

  /**
   * @return result if {@link #isSuccess()}, or else {@link Optional#absent()}
   */
  public Optional<V> toOptional() {
    return isSuccess() ? Optional.of(value) : Optional.<V>absent();
  }

  /**
   * @return result of the operation
   * @throws IllegalStateException if the operation failed
   */
  public V getOrThrow() {
    Preconditions.checkState(isSuccess(), "Operation failed: %s", failure);
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Attempt)) {
      return false;
    }
    Attempt<?> other = (Attempt<?>) o;
    return failure == other.failure && Objects.equal(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, failure);
  }

  @Override
  public String toString() {
    return isSuccess() ? "Success[" + value + ']' : "Failure[" + failure + ']';
  }

}
