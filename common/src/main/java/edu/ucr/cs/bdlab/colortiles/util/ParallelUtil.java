/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.ucr.cs.bdlab.colortiles.util;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Helper functions to run independent pieces of work on an executor service and wait for all of them.
 * Each call is a barrier, i.e., it returns only after all the submitted tasks are complete.
 */
public final class ParallelUtil {

  private ParallelUtil() {}

  /**A task that processes a contiguous range of rows [row1, row2)*/
  @FunctionalInterface
  public interface RowBlockTask {
    void process(int row1, int row2);
  }

  /**
   * Splits the rows [0, numRows) into blocks of at most {@code rowsPerBlock} rows and processes all blocks.
   * If the executor is null, all blocks are processed in the calling thread.
   * @param executor the executor to run the blocks on or {@code null} to run sequentially
   * @param numRows the total number of rows
   * @param rowsPerBlock the maximum number of rows in one block
   * @param task the task that processes one block
   * @throws IOException if the calling thread is interrupted while waiting for the blocks
   */
  public static void forEachRowBlock(ExecutorService executor, int numRows, int rowsPerBlock, RowBlockTask task)
      throws IOException {
    if (rowsPerBlock <= 0)
      throw new IllegalArgumentException("Number of rows per block must be positive but was " + rowsPerBlock);
    List<Callable<Void>> blocks = new ArrayList<>();
    for (int row1 = 0; row1 < numRows; row1 += rowsPerBlock) {
      final int r1 = row1;
      final int r2 = Math.min(numRows, row1 + rowsPerBlock);
      blocks.add(() -> {
        task.process(r1, r2);
        return null;
      });
    }
    invokeAll(executor, blocks);
  }

  /**
   * Runs all the given tasks and returns their results in the same order.
   * If any task fails, the first failure (in task order) is rethrown as is if it is an {@link IOException},
   * a {@link RuntimeException}, or an {@link Error}. Other checked exceptions are wrapped in an IOException.
   * @param executor the executor to run the tasks on or {@code null} to run sequentially
   * @param tasks the tasks to run
   * @param <T> the type of the results
   * @return the results of all tasks in the order of the tasks
   * @throws IOException if any of the tasks fails with an IOException or the wait is interrupted
   */
  public static <T> List<T> invokeAll(ExecutorService executor, List<? extends Callable<T>> tasks)
      throws IOException {
    List<T> results = new ArrayList<>(tasks.size());
    if (executor == null) {
      for (Callable<T> task : tasks) {
        try {
          results.add(task.call());
        } catch (Exception e) {
          throw rethrow(e);
        }
      }
      return results;
    }
    try {
      List<Future<T>> futures = executor.invokeAll(tasks);
      for (Future<T> future : futures) {
        try {
          results.add(future.get());
        } catch (ExecutionException e) {
          throw rethrow(e.getCause());
        }
      }
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException iioe = new InterruptedIOException("Interrupted while waiting for parallel tasks");
      iioe.initCause(e);
      throw iioe;
    }
  }

  private static IOException rethrow(Throwable t) {
    if (t instanceof IOException)
      return (IOException) t;
    if (t instanceof RuntimeException)
      throw (RuntimeException) t;
    if (t instanceof Error)
      throw (Error) t;
    return new IOException("Parallel task failed", t);
  }
}
