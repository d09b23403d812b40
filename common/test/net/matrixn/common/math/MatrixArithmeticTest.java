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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.matrixn.common.MatrixNTest;

/**
 * Tests {@link MatrixArithmetic}.
 */
public final class MatrixArithmeticTest extends MatrixNTest {

  private static final double EPSILON = 1.0e-9;

  @Test
  public void testAdd() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, 2}, {3, 4}});
    Matrix<Integer> b = MatrixFactory.fromRows(new int[][] {{5, 6}, {7, 8}});
    Attempt<Matrix<Integer>> sum = MatrixArithmetic.tryAdd(a, b);
    assertTrue(sum.isSuccess());
    assertEquals(MatrixFactory.fromRows(new int[][] {{6, 8}, {10, 12}}), sum.getValue());
    // Arguments unchanged
    assertEquals(MatrixFactory.fromRows(new int[][] {{1, 2}, {3, 4}}), a);
  }

  @Test
  public void testAddMismatch() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, 2}, {3, 4}});
    Matrix<Integer> b = MatrixFactory.fromRows(new int[][] {{1, 2, 3}, {4, 5, 6}});
    Attempt<Matrix<Integer>> sum = MatrixArithmetic.tryAdd(a, b);
    assertFalse(sum.isSuccess());
    assertSame(Attempt.Failure.DIMENSION_MISMATCH, sum.getFailure());
    assertNull(sum.getValue());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAddMismatchThrows() {
    MatrixArithmetic.add(MatrixFactory.fromRows(new int[][] {{1}}), MatrixFactory.fromRows(new int[][] {{1, 2}}));
  }

  @Test
  public void testSubtract() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{5, 6}, {7, 8}});
    Matrix<Integer> b = MatrixFactory.fromRows(new int[][] {{1, 2}, {3, 4}});
    assertEquals(MatrixFactory.fromRows(new int[][] {{4, 4}, {4, 4}}), MatrixArithmetic.trySubtract(a, b).getValue());
    assertSame(Attempt.Failure.DIMENSION_MISMATCH,
               MatrixArithmetic.trySubtract(a, MatrixFactory.fromRows(new int[][] {{1, 2}})).getFailure());
  }

  @Test
  public void testAddThenSubtractGivesOriginal() {
    Matrix<Double> a = MatrixFactory.random(getRandom(), 4, 3, -10.0, 10.0);
    Matrix<Double> b = MatrixFactory.random(getRandom(), 4, 3, -10.0, 10.0);
    Matrix<Double> roundTrip = MatrixArithmetic.subtract(MatrixArithmetic.add(a, b), b);
    for (int row = 0; row < 4; row++) {
      for (int col = 0; col < 3; col++) {
        assertEquals(a.get(row, col), roundTrip.get(row, col), EPSILON);
      }
    }
  }

  @Test
  public void testLongAdditionNearLimit() {
    Matrix<Long> a = MatrixFactory.fromRows(new long[][] {{Long.MAX_VALUE - 10L}});
    Matrix<Long> b = MatrixFactory.fromRows(new long[][] {{10L}});
    assertEquals(Long.MAX_VALUE, MatrixArithmetic.add(a, b).get(0, 0).longValue());
  }

  @Test
  public void testScalarMultiply() {
    Matrix<Double> matrix = MatrixFactory.fromRows(new double[][] {{1.0, -2.0}, {0.5, 4.0}});
    assertMatrixEquals(new double[][] {{2.5, -5.0}, {1.25, 10.0}},
                       MatrixArithmetic.scalarMultiply(matrix, 2.5), EPSILON);
  }

  @Test
  public void testMultiply() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, 2, 3}, {4, 5, 6}});
    Matrix<Integer> b = MatrixFactory.fromRows(new int[][] {{7, 8}, {9, 10}, {11, 12}});
    Attempt<Matrix<Integer>> product = MatrixArithmetic.tryMultiply(a, b);
    assertTrue(product.isSuccess());
    assertEquals(MatrixFactory.fromRows(new int[][] {{58, 64}, {139, 154}}), product.getValue());
  }

  @Test
  public void testMultiplyMismatch() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, 2, 3}, {4, 5, 6}});
    Attempt<Matrix<Integer>> product = MatrixArithmetic.tryMultiply(a, a);
    assertFalse(product.isSuccess());
    assertSame(Attempt.Failure.DIMENSION_MISMATCH, product.getFailure());
    assertNull(product.getValue());
  }

  @Test
  public void testMultiplyByColumnVector() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, 2}, {3, 4}});
    Matrix<Integer> v = MatrixFactory.fromRows(new int[][] {{5}, {6}});
    assertEquals(MatrixFactory.fromRows(new int[][] {{17}, {39}}), MatrixArithmetic.multiply(a, v));
  }

  @Test
  public void testMultiplyRowVector() {
    Matrix<Integer> v = MatrixFactory.fromRows(new int[][] {{5, 6}});
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, 2}, {3, 4}});
    assertEquals(MatrixFactory.fromRows(new int[][] {{23, 34}}), MatrixArithmetic.multiply(v, a));
  }

  @Test
  public void testMultiplyEmpty() {
    Matrix<Integer> a = MatrixFactory.zero(IntegerArithmetic.getInstance(), 2, 0);
    Matrix<Integer> b = MatrixFactory.zero(IntegerArithmetic.getInstance(), 0, 3);
    assertEquals(MatrixFactory.zero(IntegerArithmetic.getInstance(), 2, 3), MatrixArithmetic.multiply(a, b));
    Matrix<Integer> c = MatrixFactory.zero(IntegerArithmetic.getInstance(), 0, 2);
    assertEquals(MatrixFactory.zero(IntegerArithmetic.getInstance(), 0, 0), MatrixArithmetic.multiply(c, a));
  }

  @Test
  public void testMultiplyIsAssociative() {
    Matrix<Integer> a = MatrixFactory.fromRows(new int[][] {{1, -2, 3}, {0, 4, -1}, {2, 2, 5}});
    Matrix<Integer> b = MatrixFactory.fromRows(new int[][] {{3, 1, 0}, {-1, 2, 4}, {6, 0, 1}});
    Matrix<Integer> c = MatrixFactory.fromRows(new int[][] {{2, 0, -3}, {1, 1, 1}, {0, 5, 2}});
    assertEquals(MatrixArithmetic.multiply(MatrixArithmetic.multiply(a, b), c),
                 MatrixArithmetic.multiply(a, MatrixArithmetic.multiply(b, c)));
  }

  @Test
  public void testMultiplyDistributesOverAddition() {
    Matrix<Double> a = MatrixFactory.random(getRandom(), 5, 4, -1.0, 1.0);
    Matrix<Double> b = MatrixFactory.random(getRandom(), 4, 6, -1.0, 1.0);
    Matrix<Double> c = MatrixFactory.random(getRandom(), 4, 6, -1.0, 1.0);
    Matrix<Double> left = MatrixArithmetic.multiply(a, MatrixArithmetic.add(b, c));
    Matrix<Double> right = MatrixArithmetic.add(MatrixArithmetic.multiply(a, b), MatrixArithmetic.multiply(a, c));
    for (int row = 0; row < 5; row++) {
      for (int col = 0; col < 6; col++) {
        assertEquals(left.get(row, col), right.get(row, col), EPSILON);
      }
    }
  }

  @Test
  public void testScalarMultiplyDistributesOverAddition() {
    Matrix<Double> a = MatrixFactory.random(getRandom(), 3, 3, -5.0, 5.0);
    Matrix<Double> b = MatrixFactory.random(getRandom(), 3, 3, -5.0, 5.0);
    Matrix<Double> left = MatrixArithmetic.scalarMultiply(MatrixArithmetic.add(a, b), 3.0);
    Matrix<Double> right = MatrixArithmetic.add(MatrixArithmetic.scalarMultiply(a, 3.0),
                                                MatrixArithmetic.scalarMultiply(b, 3.0));
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 3; col++) {
        assertEquals(left.get(row, col), right.get(row, col), EPSILON);
      }
    }
  }

  @Test
  public void testLargeMultiplyMatchesCommonsMath() {
    // Big enough to be computed in parallel
    Matrix<Double> a = MatrixFactory.random(getRandom(), 40, 30, -1.0, 1.0);
    Matrix<Double> b = MatrixFactory.random(getRandom(), 30, 20, -1.0, 1.0);
    Matrix<Double> product = MatrixArithmetic.multiply(a, b);
    RealMatrix expected = toRealMatrix(a).multiply(toRealMatrix(b));
    assertMatrixEquals(expected.getData(), product, EPSILON);
  }

  @Test
  public void testTranspose() {
    Matrix<Integer> matrix = MatrixFactory.fromRows(new int[][] {{1, 2, 3}, {4, 5, 6}});
    Matrix<Integer> transposed = MatrixArithmetic.transpose(matrix);
    assertEquals(MatrixFactory.fromRows(new int[][] {{1, 4}, {2, 5}, {3, 6}}), transposed);
    assertEquals(matrix, MatrixArithmetic.transpose(transposed));
  }

  @Test
  public void testTransposeSingleElement() {
    Matrix<Integer> matrix = MatrixFactory.fromRows(new int[][] {{9}});
    Matrix<Integer> transposed = MatrixArithmetic.transpose(matrix);
    assertEquals(matrix, transposed);
    assertNotSame(matrix, transposed);
  }

  @Test
  public void testEmptyOperations() {
    Matrix<Double> empty = MatrixFactory.zero(DoubleArithmetic.getInstance(), 0, 0);
    assertEquals(empty, MatrixArithmetic.add(empty, empty));
    assertEquals(empty, MatrixArithmetic.subtract(empty, empty));
    assertEquals(empty, MatrixArithmetic.scalarMultiply(empty, 2.0));
    assertEquals(empty, MatrixArithmetic.multiply(empty, empty));
    assertEquals(empty, MatrixArithmetic.transpose(empty));
  }

  private static RealMatrix toRealMatrix(Matrix<Double> matrix) {
    RealMatrix result = new Array2DRowRealMatrix(matrix.getRows(), matrix.getColumns());
    for (int row = 0; row < matrix.getRows(); row++) {
      for (int col = 0; col < matrix.getColumns(); col++) {
        result.setEntry(row, col, matrix.get(row, col));
      }
    }
    return result;
  }

}
