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

import java.util.Iterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.matrixn.common.parallel.ExecutorUtils;
import net.matrixn.common.parallel.Paralleler;
import net.matrixn.common.parallel.Processor;

/**
 * Runs a {@link Processor} over each row index of a matrix, in parallel when the matrix is large enough.
 * Returns only when all rows are done. Parallel work runs on one pool of daemon threads shared by all
 * matrix operations, created on first use.
 */
final class RowFanOut {

  private static final Logger log = LoggerFactory.getLogger(RowFanOut.class);

  static final boolean PARALLEL =
      Boolean.parseBoolean(System.getProperty("common.matrix.parallel", "true"));
  static final int PARALLEL_THRESHOLD =
      Integer.parseInt(System.getProperty("common.matrix.parallelThreshold", "4"));

  private RowFanOut() {
  }

  private static final class PoolHolder {
    private static final int PARALLELISM = ExecutorUtils.getParallelism();
    private static final ExecutorService POOL = ExecutorUtils.newFixedDaemonPool(PARALLELISM, "RowFanOut");
  }

  static ExecutorService getExecutor() {
    return PoolHolder.POOL;
  }

  static int getParallelism() {
    return PoolHolder.PARALLELISM;
  }

  /**
   * @param rows number of rows; the processor sees each of {@code 0 .. rows-1} once
   * @param name name of the work, used in log messages
   * @param processor work to do per row
   */
  static void forEachRow(int rows, String name, Processor<Integer> processor) {
    forEachRow(rows, name, processor, PARALLEL && rows >= PARALLEL_THRESHOLD);
  }

  static void forEachRow(int rows, String name, Processor<Integer> processor, boolean parallel) {
    Iterator<Integer> rowIndices =
        ContiguousSet.create(Range.closedOpen(0, rows), DiscreteDomain.integers()).iterator();
    Paralleler<Integer> paralleler = new Paralleler<Integer>(rowIndices, processor, name);
    try {
      if (parallel) {
        int parallelism = Math.max(1, Math.min(rows, getParallelism()));
        log.debug("{}: processing {} rows in {} workers", name, rows, parallelism);
        paralleler.runInParallel(getExecutor(), parallelism);
      } else {
        paralleler.runInSerial();
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ie);
    } catch (ExecutionException ee) {
      throw new IllegalStateException(ee.getCause());
    }
  }

}
