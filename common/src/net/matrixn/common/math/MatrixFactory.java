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
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Creates common kinds of {@link Matrix}.
 */
public final class MatrixFactory {

  private MatrixFactory() {
  }

  /**
   * @return {@code rows x columns} matrix of zeroes
   */
  public static <T> Matrix<T> zero(Arithmetic<T> arithmetic, int rows, int columns) {
    return new Matrix<T>(arithmetic, rows, columns);
  }

  /**
   * @return {@code size x size} identity matrix
   */
  public static <T> Matrix<T> identity(Arithmetic<T> arithmetic, int size) {
    Matrix<T> identity = new Matrix<T>(arithmetic, size, size);
    T one = arithmetic.one();
    for (int i = 0; i < size; i++) {
      identity.setElementAt(identity.indexOf(i, i), one);
    }
    return identity;
  }

  /**
   * @param arithmetic operations on elements
   * @param rows elements by row; all rows must have the same length. Values are copied.
   * @return matrix with the given elements. With no rows, this is a {@code 0 x 0} matrix.
   * @throws IllegalArgumentException if rows have different lengths
   */
  public static <T> Matrix<T> fromRows(Arithmetic<T> arithmetic, T[][] rows) {
    int numRows = rows.length;
    int numColumns = numRows == 0 ? 0 : rows[0].length;
    Object[] elements = new Object[numRows * numColumns];
    for (int row = 0; row < numRows; row++) {
      T[] values = rows[row];
      checkRowLength(values.length, numColumns, row);
      for (int col = 0; col < numColumns; col++) {
        elements[row * numColumns + col] = Preconditions.checkNotNull(values[col]);
      }
    }
    return new Matrix<T>(arithmetic, numRows, numColumns, elements);
  }

  /**
   * @see #fromRows(Arithmetic, Object[][])
   */
  public static Matrix<Double> fromRows(double[][] rows) {
    int numRows = rows.length;
    int numColumns = numRows == 0 ? 0 : rows[0].length;
    Object[] elements = new Object[numRows * numColumns];
    for (int row = 0; row < numRows; row++) {
      double[] values = rows[row];
      checkRowLength(values.length, numColumns, row);
      for (int col = 0; col < numColumns; col++) {
        elements[row * numColumns + col] = values[col];
      }
    }
    return new Matrix<Double>(DoubleArithmetic.getInstance(), numRows, numColumns, elements);
  }

  /**
   * @see #fromRows(Arithmetic, Object[][])
   */
  public static Matrix<Long> fromRows(long[][] rows) {
    int numRows = rows.length;
    int numColumns = numRows == 0 ? 0 : rows[0].length;
    Object[] elements = new Object[numRows * numColumns];
    for (int row = 0; row < numRows; row++) {
      long[] values = rows[row];
      checkRowLength(values.length, numColumns, row);
      for (int col = 0; col < numColumns; col++) {
        elements[row * numColumns + col] = values[col];
      }
    }
    return new Matrix<Long>(LongArithmetic.getInstance(), numRows, numColumns, elements);
  }

  /**
   * @see #fromRows(Arithmetic, Object[][])
   */
  public static Matrix<Integer> fromRows(int[][] rows) {
    int numRows = rows.length;
    int numColumns = numRows == 0 ? 0 : rows[0].length;
    Object[] elements = new Object[numRows * numColumns];
    for (int row = 0; row < numRows; row++) {
      int[] values = rows[row];
      checkRowLength(values.length, numColumns, row);
      for (int col = 0; col < numColumns; col++) {
        elements[row * numColumns + col] = values[col];
      }
    }
    return new Matrix<Integer>(IntegerArithmetic.getInstance(), numRows, numColumns, elements);
  }

  /**
   * @param random source of randomness
   * @param rows number of rows
   * @param columns number of columns
   * @param min smallest possible value
   * @param max values are less than this
   * @return matrix of values drawn uniformly from {@code [min, max)}
   */
  public static Matrix<Double> random(RandomGenerator random, int rows, int columns, double min, double max) {
    Preconditions.checkArgument(min < max, "min must be less than max: %s, %s", min, max);
    Matrix<Double> matrix = new Matrix<Double>(DoubleArithmetic.getInstance(), rows, columns);
    double range = max - min;
    for (int i = 0; i < matrix.size(); i++) {
      matrix.setElementAt(i, min + random.nextDouble() * range);
    }
    return matrix;
  }

  private static void checkRowLength(int length, int expected, int row) {
    Preconditions.checkArgument(length == expected,
                                "Row %s has %s elements, but row 0 has %s", row, length, expected);
  }

}
