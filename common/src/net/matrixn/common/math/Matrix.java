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

import java.util.Arrays;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * <p>A dense, rectangular matrix of {@code rows x columns} elements of type {@code T}, stored in
 * row-major order. Arithmetic on elements is delegated to an {@link Arithmetic}.</p>
 *
 * <p>Dimensions are fixed at construction. Operations in this class, {@link MatrixArithmetic} and
 * {@link CofactorExpansion} never modify their arguments and always return newly allocated matrices;
 * only {@link #set(int, int, Object)} and {@link #trySet(int, int, Object)} change an instance.</p>
 *
 * <p>A matrix may have zero rows or columns. By convention the {@code 0 x 0} matrix has determinant 1
 * and is its own inverse.</p>
 *
 * @param <T> element type
 * @see MatrixFactory
 */
public final class Matrix<T> {

  private static final int PRINT_COLUMN_WIDTH = 10;

  private final Arithmetic<T> arithmetic;
  private final int rows;
  private final int columns;
  private final Object[] elements;

  /**
   * Creates a matrix whose elements are all {@link Arithmetic#zero()}.
   *
   * @param arithmetic operations on elements
   * @param rows number of rows, at least 0
   * @param columns number of columns, at least 0
   * @throws IllegalArgumentException if either dimension is negative, or the matrix would be too large
   */
  public Matrix(Arithmetic<T> arithmetic, int rows, int columns) {
    Preconditions.checkNotNull(arithmetic);
    Preconditions.checkArgument(rows >= 0 && columns >= 0, "Bad dimensions: %s x %s", rows, columns);
    Preconditions.checkArgument((long) rows * columns <= Integer.MAX_VALUE,
                                "Too many elements: %s x %s", rows, columns);
    this.arithmetic = arithmetic;
    this.rows = rows;
    this.columns = columns;
    this.elements = new Object[rows * columns];
    Arrays.fill(elements, arithmetic.zero());
  }

  /**
   * Takes ownership of {@code elements}, which must not be shared with any other instance.
   */
  Matrix(Arithmetic<T> arithmetic, int rows, int columns, Object[] elements) {
    this.arithmetic = arithmetic;
    this.rows = rows;
    this.columns = columns;
    this.elements = elements;
  }

  public Arithmetic<T> getArithmetic() {
    return arithmetic;
  }

  public int getRows() {
    return rows;
  }

  public int getColumns() {
    return columns;
  }

  public boolean isSquare() {
    return rows == columns;
  }

  /**
   * @return element at the given position
   * @throws IndexOutOfBoundsException if the position is outside the matrix
   */
  public T get(int row, int column) {
    checkIndices(row, column);
    return elementAt(indexOf(row, column));
  }

  /**
   * @throws IndexOutOfBoundsException if the position is outside the matrix
   */
  public void set(int row, int column, T value) {
    Preconditions.checkNotNull(value);
    checkIndices(row, column);
    elements[indexOf(row, column)] = value;
  }

  /**
   * @return element at the given position, or {@link Optional#absent()} if the position is outside
   *  the matrix
   */
  public Optional<T> tryGet(int row, int column) {
    if (!isInBounds(row, column)) {
      return Optional.absent();
    }
    return Optional.of(elementAt(indexOf(row, column)));
  }

  /**
   * @return true if the element was set, or false if the position is outside the matrix
   */
  public boolean trySet(int row, int column, T value) {
    Preconditions.checkNotNull(value);
    if (!isInBounds(row, column)) {
      return false;
    }
    elements[indexOf(row, column)] = value;
    return true;
  }

  /**
   * @return sum of the diagonal elements; zero for the {@code 0 x 0} matrix. Fails with
   *  {@link Attempt.Failure#DIMENSION_MISMATCH} and a zero placeholder if the matrix is not square.
   */
  public Attempt<T> tryGetTrace() {
    if (!isSquare()) {
      return Attempt.failure(Attempt.Failure.DIMENSION_MISMATCH, arithmetic.zero());
    }
    T trace = arithmetic.zero();
    for (int i = 0; i < rows; i++) {
      trace = arithmetic.add(trace, elementAt(indexOf(i, i)));
    }
    return Attempt.success(trace);
  }

  /**
   * @see CofactorExpansion#tryGetDeterminant(Matrix)
   */
  public Attempt<T> tryGetDeterminant() {
    return CofactorExpansion.tryGetDeterminant(this);
  }

  /**
   * @see CofactorExpansion#tryGetInverse(Matrix)
   */
  public Attempt<Matrix<T>> tryGetInverse() {
    return CofactorExpansion.tryGetInverse(this);
  }

  int indexOf(int row, int column) {
    return row * columns + column;
  }

  @SuppressWarnings("unchecked")
  T elementAt(int index) {
    return (T) elements[index];
  }

  void setElementAt(int index, T value) {
    elements[index] = value;
  }

  int size() {
    return elements.length;
  }

  private boolean isInBounds(int row, int column) {
    return row >= 0 && row < rows && column >= 0 && column < columns;
  }

  private void checkIndices(int row, int column) {
    Preconditions.checkElementIndex(row, rows, "row");
    Preconditions.checkElementIndex(column, columns, "column");
  }

  /**
   * Two matrices are equal if they have the same dimensions and element type, and elements in each
   * position are equal according to {@link Arithmetic#equal(Object, Object)}.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Matrix)) {
      return false;
    }
    Matrix<?> other = (Matrix<?>) o;
    if (rows != other.rows || columns != other.columns ||
        !arithmetic.getElementType().equals(other.arithmetic.getElementType())) {
      return false;
    }
    @SuppressWarnings("unchecked")
    Matrix<T> same = (Matrix<T>) other;
    for (int i = 0; i < elements.length; i++) {
      if (!arithmetic.equal(elementAt(i), same.elementAt(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 31 * rows + columns;
    for (int i = 0; i < elements.length; i++) {
      result = 31 * result + arithmetic.hash(elementAt(i));
    }
    return result;
  }

  /**
   * @return a rendering like {@code "2x2 Matrix<Double>:"} followed by one line per row, with each
   *  element right-aligned in a column
   */
  @Override
  public String toString() {
    StringBuilder result = new StringBuilder();
    result.append(rows).append('x').append(columns);
    result.append(" Matrix<").append(arithmetic.getElementType().getSimpleName()).append(">:\n");
    for (int row = 0; row < rows; row++) {
      if (row > 0) {
        result.append('\n');
      }
      for (int col = 0; col < columns; col++) {
        if (col > 0) {
          result.append(' ');
        }
        result.append(Strings.padStart(String.valueOf(elements[indexOf(row, col)]), PRINT_COLUMN_WIDTH, ' '));
      }
    }
    return result.toString();
  }

}
