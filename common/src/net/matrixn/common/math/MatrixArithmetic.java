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

import net.matrixn.common.parallel.Processor;

/**
 * <p>Arithmetic on whole {@link Matrix} instances. Every method returns a newly allocated matrix and
 * leaves its arguments unchanged.</p>
 *
 * <p>The plain methods throw {@link IllegalArgumentException} when the shapes of their arguments are
 * incompatible. The {@code try} variants report {@link Attempt.Failure#DIMENSION_MISMATCH} instead.</p>
 */
public final class MatrixArithmetic {

  private MatrixArithmetic() {
  }

  /**
   * @return {@code left + right}, elementwise
   */
  public static <T> Matrix<T> add(Matrix<T> left, Matrix<T> right) {
    checkSameShape(left, right);
    Arithmetic<T> arithmetic = left.getArithmetic();
    Object[] sum = new Object[left.size()];
    for (int i = 0; i < sum.length; i++) {
      sum[i] = arithmetic.add(left.elementAt(i), right.elementAt(i));
    }
    return new Matrix<T>(arithmetic, left.getRows(), left.getColumns(), sum);
  }

  /**
   * @return {@code left - right}, elementwise
   */
  public static <T> Matrix<T> subtract(Matrix<T> left, Matrix<T> right) {
    checkSameShape(left, right);
    Arithmetic<T> arithmetic = left.getArithmetic();
    Object[] difference = new Object[left.size()];
    for (int i = 0; i < difference.length; i++) {
      difference[i] = arithmetic.subtract(left.elementAt(i), right.elementAt(i));
    }
    return new Matrix<T>(arithmetic, left.getRows(), left.getColumns(), difference);
  }

  /**
   * @return each element of {@code matrix} multiplied by {@code scalar}
   */
  public static <T> Matrix<T> scalarMultiply(Matrix<T> matrix, T scalar) {
    Preconditions.checkNotNull(scalar);
    Arithmetic<T> arithmetic = matrix.getArithmetic();
    Object[] product = new Object[matrix.size()];
    for (int i = 0; i < product.length; i++) {
      product[i] = arithmetic.multiply(matrix.elementAt(i), scalar);
    }
    return new Matrix<T>(arithmetic, matrix.getRows(), matrix.getColumns(), product);
  }

  /**
   * Matrix product. Rows of the result are computed in parallel for large enough matrices.
   *
   * @return {@code left * right}, a {@code left.rows x right.columns} matrix
   * @throws IllegalArgumentException if {@code left.columns != right.rows}
   */
  public static <T> Matrix<T> multiply(final Matrix<T> left, final Matrix<T> right) {
    Preconditions.checkArgument(left.getColumns() == right.getRows(),
                                "Can't multiply %s x %s by %s x %s",
                                left.getRows(), left.getColumns(), right.getRows(), right.getColumns());
    final Arithmetic<T> arithmetic = left.getArithmetic();
    final int commonDimension = left.getColumns();
    final int resultColumns = right.getColumns();
    final Object[] product = new Object[left.getRows() * resultColumns];
    RowFanOut.forEachRow(left.getRows(), "Multiply", new Processor<Integer>() {
      @Override
      public void process(Integer row, long count) {
        for (int col = 0; col < resultColumns; col++) {
          T sum = arithmetic.zero();
          for (int k = 0; k < commonDimension; k++) {
            sum = arithmetic.add(sum, arithmetic.multiply(left.get(row, k), right.get(k, col)));
          }
          product[row * resultColumns + col] = sum;
        }
      }
    });
    return new Matrix<T>(arithmetic, left.getRows(), resultColumns, product);
  }

  /**
   * @return transpose of {@code matrix}, a {@code columns x rows} matrix
   */
  public static <T> Matrix<T> transpose(Matrix<T> matrix) {
    int rows = matrix.getRows();
    int columns = matrix.getColumns();
    Object[] transposed = new Object[matrix.size()];
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < columns; col++) {
        transposed[col * rows + row] = matrix.elementAt(matrix.indexOf(row, col));
      }
    }
    return new Matrix<T>(matrix.getArithmetic(), columns, rows, transposed);
  }

  public static <T> Attempt<Matrix<T>> tryAdd(Matrix<T> left, Matrix<T> right) {
    if (!hasSameShape(left, right)) {
      return Attempt.failure(Attempt.Failure.DIMENSION_MISMATCH, null);
    }
    return Attempt.success(add(left, right));
  }

  public static <T> Attempt<Matrix<T>> trySubtract(Matrix<T> left, Matrix<T> right) {
    if (!hasSameShape(left, right)) {
      return Attempt.failure(Attempt.Failure.DIMENSION_MISMATCH, null);
    }
    return Attempt.success(subtract(left, right));
  }

  public static <T> Attempt<Matrix<T>> tryMultiply(Matrix<T> left, Matrix<T> right) {
    if (left.getColumns() != right.getRows()) {
      return Attempt.failure(Attempt.Failure.DIMENSION_MISMATCH, null);
    }
    return Attempt.success(multiply(left, right));
  }

  private static boolean hasSameShape(Matrix<?> left, Matrix<?> right) {
    return left.getRows() == right.getRows() && left.getColumns() == right.getColumns();
  }

  private static void checkSameShape(Matrix<?> left, Matrix<?> right) {
    Preconditions.checkArgument(hasSameShape(left, right),
                                "Shapes differ: %s x %s vs %s x %s",
                                left.getRows(), left.getColumns(), right.getRows(), right.getColumns());
  }

}
