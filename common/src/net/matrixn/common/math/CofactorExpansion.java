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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.matrixn.common.parallel.Processor;

/**
 * <p>Determinant and inverse of a square {@link Matrix} by cofactor (Laplace) expansion.</p>
 *
 * <p>The determinant is expanded recursively along the first row, so the work is O(n!) in the size of
 * the matrix; this is meant for small matrices. The inverse is the adjugate (transposed cofactor
 * matrix) divided by the determinant. Cofactors of different cells are independent, and rows of the
 * cofactor matrix are computed in parallel for large enough matrices.</p>
 *
 * <p>Conventions for degenerate sizes: the {@code 0 x 0} matrix has determinant 1 and is its own inverse.
 * A matrix is singular when its determinant is exactly equal to zero according to
 * {@link Arithmetic#isZero(Object)}. No tolerance is applied, so a floating-point matrix that is only
 * nearly singular will still be "inverted", with very large elements.</p>
 */
public final class CofactorExpansion {

  private static final Logger log = LoggerFactory.getLogger(CofactorExpansion.class);

  private CofactorExpansion() {
  }

  /**
   * @param matrix matrix whose determinant is wanted
   * @return the determinant on success. Fails with {@link Attempt.Failure#DIMENSION_MISMATCH}, and zero as
   *  placeholder value, if the matrix is not square.
   */
  public static <T> Attempt<T> tryGetDeterminant(Matrix<T> matrix) {
    Arithmetic<T> arithmetic = matrix.getArithmetic();
    if (!matrix.isSquare()) {
      log.debug("No determinant for non-square {} x {} matrix", matrix.getRows(), matrix.getColumns());
      return Attempt.failure(Attempt.Failure.DIMENSION_MISMATCH, arithmetic.zero());
    }
    if (matrix.getRows() == 0) {
      return Attempt.success(arithmetic.one());
    }
    return Attempt.success(determinant(matrix));
  }

  /**
   * @param matrix matrix to invert
   * @return the inverse, a new matrix, on success. Fails with {@link Attempt.Failure#DIMENSION_MISMATCH}
   *  if the matrix is not square, or {@link Attempt.Failure#SINGULAR} if its determinant is zero. The
   *  placeholder value of a failure is {@code null}.
   */
  public static <T> Attempt<Matrix<T>> tryGetInverse(Matrix<T> matrix) {
    Arithmetic<T> arithmetic = matrix.getArithmetic();
    int n = matrix.getRows();
    if (!matrix.isSquare()) {
      log.debug("No inverse for non-square {} x {} matrix", n, matrix.getColumns());
      return Attempt.failure(Attempt.Failure.DIMENSION_MISMATCH, null);
    }
    if (n == 0) {
      return Attempt.success(new Matrix<T>(arithmetic, 0, 0));
    }

    Attempt<T> determinantAttempt = tryGetDeterminant(matrix);
    if (!determinantAttempt.isSuccess()) {
      return Attempt.failure(determinantAttempt.getFailure(), null);
    }
    T determinant = determinantAttempt.getValue();
    if (arithmetic.isZero(determinant)) {
      log.debug("{} x {} matrix is singular", n, n);
      return Attempt.failure(Attempt.Failure.SINGULAR, null);
    }

    if (n == 1) {
      T value = matrix.elementAt(0);
      if (arithmetic.isZero(value)) {
        return Attempt.failure(Attempt.Failure.SINGULAR, null);
      }
      Matrix<T> inverse = new Matrix<T>(arithmetic, 1, 1);
      inverse.setElementAt(0, arithmetic.divide(arithmetic.one(), value));
      return Attempt.success(inverse);
    }

    T inverseDeterminant = arithmetic.divide(arithmetic.one(), determinant);
    return Attempt.success(MatrixArithmetic.scalarMultiply(adjugate(matrix), inverseDeterminant));
  }

  /**
   * @return the {@code (rows-1) x (columns-1)} matrix left after deleting row {@code excludeRow} and
   *  column {@code excludeColumn}; other elements keep their relative order
   */
  static <T> Matrix<T> submatrix(Matrix<T> matrix, int excludeRow, int excludeColumn) {
    int rows = matrix.getRows();
    int columns = matrix.getColumns();
    Object[] minor = new Object[(rows - 1) * (columns - 1)];
    int next = 0;
    for (int row = 0; row < rows; row++) {
      if (row == excludeRow) {
        continue;
      }
      for (int col = 0; col < columns; col++) {
        if (col != excludeColumn) {
          minor[next++] = matrix.elementAt(matrix.indexOf(row, col));
        }
      }
    }
    return new Matrix<T>(matrix.getArithmetic(), rows - 1, columns - 1, minor);
  }

  /**
   * Expands along the first row. Assumes {@code matrix} is square.
   */
  static <T> T determinant(Matrix<T> matrix) {
    Arithmetic<T> arithmetic = matrix.getArithmetic();
    int n = matrix.getRows();
    switch (n) {
      case 0:
        return arithmetic.one();
      case 1:
        return matrix.elementAt(0);
      case 2:
        // ad - bc
        return arithmetic.subtract(arithmetic.multiply(matrix.elementAt(0), matrix.elementAt(3)),
                                   arithmetic.multiply(matrix.elementAt(1), matrix.elementAt(2)));
      default:
        // Ascending column order
        T determinant = arithmetic.zero();
        for (int col = 0; col < n; col++) {
          T term = arithmetic.multiply(matrix.elementAt(col), determinant(submatrix(matrix, 0, col)));
          if (col % 2 == 1) {
            term = arithmetic.subtract(arithmetic.zero(), term);
          }
          determinant = arithmetic.add(determinant, term);
        }
        return determinant;
    }
  }

  /**
   * @return determinant of the minor at {@code (row, column)}, negated if {@code row + column} is odd
   */
  static <T> T cofactor(Matrix<T> matrix, int row, int column) {
    Arithmetic<T> arithmetic = matrix.getArithmetic();
    T minorDeterminant = tryGetDeterminant(submatrix(matrix, row, column)).getValue();
    if ((row + column) % 2 == 1) {
      return arithmetic.subtract(arithmetic.zero(), minorDeterminant);
    }
    return minorDeterminant;
  }

  /**
   * @return matrix of the same shape as {@code matrix} whose element {@code (i,j)} is
   *  {@code cofactor(matrix, i, j)}
   */
  static <T> Matrix<T> cofactorMatrix(Matrix<T> matrix) {
    return cofactorMatrix(matrix, RowFanOut.PARALLEL && matrix.getRows() >= RowFanOut.PARALLEL_THRESHOLD);
  }

  static <T> Matrix<T> cofactorMatrix(final Matrix<T> matrix, boolean parallel) {
    final Matrix<T> cofactors = new Matrix<T>(matrix.getArithmetic(), matrix.getRows(), matrix.getColumns());
    final int columns = matrix.getColumns();
    // Each row writes only its own cells of cofactors
    RowFanOut.forEachRow(matrix.getRows(), "Cofactors", new Processor<Integer>() {
      @Override
      public void process(Integer row, long count) {
        for (int col = 0; col < columns; col++) {
          cofactors.setElementAt(cofactors.indexOf(row, col), cofactor(matrix, row, col));
        }
      }
    }, parallel);
    return cofactors;
  }

  /**
   * @return transpose of the cofactor matrix
   */
  static <T> Matrix<T> adjugate(Matrix<T> matrix) {
    return MatrixArithmetic.transpose(cofactorMatrix(matrix));
  }

}
