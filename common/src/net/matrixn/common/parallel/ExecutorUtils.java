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

package net.matrixn.common.parallel;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility methods related to {@link ExecutorService} and the size of worker pools.
 */
public final class ExecutorUtils {

  private static final Logger log = LoggerFactory.getLogger(ExecutorUtils.class);

  private static final String THREADS_PROPERTY = "common.parallel.threads";

  private ExecutorUtils() {
  }

  /**
   * @return number of worker threads to use, from system property {@code common.parallel.threads}
   *  if set, or else the number of available cores
   */
  public static int getParallelism() {
    String threadsString = System.getProperty(THREADS_PROPERTY);
    int numThreads =
        threadsString == null ? Runtime.getRuntime().availableProcessors() : Integer.parseInt(threadsString);
    if (numThreads < 1) {
      log.warn("Ignoring bad value of {}: {}", THREADS_PROPERTY, numThreads);
      numThreads = 1;
    }
    return numThreads;
  }

  /**
   * @param numThreads pool size
   * @param name thread name prefix, or {@code null} for default names
   * @return a fixed-size pool of daemon threads
   */
  public static ExecutorService newFixedDaemonPool(int numThreads, String name) {
    ThreadFactoryBuilder builder = new ThreadFactoryBuilder().setDaemon(true);
    if (name != null) {
      builder.setNameFormat(name + "-%d");
    }
    return Executors.newFixedThreadPool(numThreads, builder.build());
  }

  /**
   * Immediately shuts down its argument and waits a short time for it to terminate.
   */
  public static void shutdownNowAndAwait(ExecutorService executor) {
    if (!executor.isTerminated()) {
      if (!executor.isShutdown()) {
        executor.shutdownNow();
      }
      try {
        executor.awaitTermination(5L, TimeUnit.SECONDS);
      } catch (InterruptedException ignored) {
        log.warn("Interrupted while shutting down executor");
        Thread.currentThread().interrupt();
      }
    }
  }

}
