/***********************************************************************
* Copyright (c) 2015 by Regents of the University of Minnesota.
* All rights reserved. This program and the accompanying materials
* are made available under the terms of the Apache License, Version 2.0 which
* accompanies this distribution and is available at
* http://www.opensource.org/licenses/apache2.0.php.
*
*************************************************************************/
package cn.edu.pku.asic.h3columnar.common.utils;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Some primitives to provide parallel processing over arrays and lists.
 * <p>
 * An index range is split into contiguous sub-ranges which run on a bounded pool of daemon threads sized
 * to the number of available cores. Results are returned in range order so that a caller that concatenates
 * them gets the same output regardless of how many ranges were used. A call made from inside a worker runs
 * inline to keep the pool free of nested waits.
 * @author Ahmed Eldawy
 *
 */
public class Parallel {

  static final Log LOG = LogFactory.getLog(Parallel.class);

  /**Number of threads in the shared worker pool*/
  public static final int PoolSize = Runtime.getRuntime().availableProcessors();

  private static volatile ExecutorService pool;

  private Parallel() { /* Enforce static use only */ }

  /**
   * A thread of the shared pool. Used to detect nested calls.
   */
  static class WorkerThread extends Thread {
    WorkerThread(Runnable r, String name) {
      super(r, name);
      setDaemon(true);
    }
  }

  private static ExecutorService getPool() {
    if (pool == null) {
      synchronized (Parallel.class) {
        if (pool == null) {
          final AtomicInteger threadCount = new AtomicInteger();
          ThreadFactory factory = r -> new WorkerThread(r, "h3columnar-worker-" + threadCount.incrementAndGet());
          pool = Executors.newFixedThreadPool(PoolSize, factory);
        }
      }
    }
    return pool;
  }

  public static <T> List<T> forEach(int size, BiFunction<Integer, Integer, T> r) {
    return forEach(0, size, 1, 1, r, PoolSize);
  }

  public static <T> List<T> forEach(int size, BiFunction<Integer, Integer, T> r, int parallelism) {
    return forEach(0, size, 1, 1, r, parallelism);
  }

  /**
   * Computes the boundaries of the ranges that {@link #forEach(int, int, int, int, BiFunction, int)} would
   * run. All boundaries except the last one are multiples of {@code alignment} away from {@code start}.
   * @param start the first index (inclusive)
   * @param end the last index (exclusive)
   * @param alignment every range except the last has a length that is a multiple of this value
   * @param minRangeSize the minimum number of elements in a range
   * @param parallelism the maximum number of ranges
   * @return an array of {@code numRanges + 1} boundaries
   */
  public static int[] partition(int start, int end, int alignment, int minRangeSize, int parallelism) {
    int length = end - start;
    if (length <= 0)
      return new int[] {start};
    parallelism = Math.max(1, parallelism);
    int rangeSize = Math.max(Math.max(1, minRangeSize), (length + parallelism - 1) / parallelism);
    rangeSize = MathUtil.roundUp(rangeSize, Math.max(1, alignment));
    int numRanges = (length + rangeSize - 1) / rangeSize;
    final int[] partitions = new int[numRanges + 1];
    for (int i_range = 0; i_range < numRanges; i_range++)
      partitions[i_range] = start + i_range * rangeSize;
    partitions[numRanges] = end;
    return partitions;
  }

  /**
   * Runs the given function over contiguous sub-ranges of [start, end).
   * @param start the first index (inclusive)
   * @param end the last index (exclusive)
   * @param alignment range lengths (except the last) are multiples of this value
   * @param minRangeSize the minimum number of elements that justify a separate range
   * @param r the function to run on each range. Takes the range start (inclusive) and end (exclusive).
   * @param parallelism the maximum number of ranges to create
   * @param <T> the type of the partial result produced by each range
   * @return the partial results in range order
   */
  public static <T> List<T> forEach(int start, int end, int alignment, int minRangeSize,
                                    BiFunction<Integer, Integer, T> r, int parallelism) {
    List<T> results = new ArrayList<T>();
    if (end <= start)
      return results;
    final int[] partitions = partition(start, end, alignment, minRangeSize, parallelism);
    int numRanges = partitions.length - 1;
    if (numRanges == 1 || Thread.currentThread() instanceof WorkerThread) {
      // Avoid handing off to the pool
      for (int i_range = 0; i_range < numRanges; i_range++)
        results.add(r.apply(partitions[i_range], partitions[i_range + 1]));
      return results;
    }
    if (LOG.isDebugEnabled())
      LOG.debug("Running " + numRanges + " ranges over [" + start + "," + end + ") on " + PoolSize + " threads");
    List<Future<T>> futures = new ArrayList<Future<T>>(numRanges);
    for (int i_range = 0; i_range < numRanges; i_range++) {
      final int i1 = partitions[i_range];
      final int i2 = partitions[i_range + 1];
      futures.add(getPool().submit(() -> r.apply(i1, i2)));
    }
    Throwable firstFailure = null;
    int numFailures = 0;
    for (Future<T> future : futures) {
      try {
        results.add(future.get());
      } catch (ExecutionException e) {
        numFailures++;
        if (firstFailure == null)
          firstFailure = e.getCause();
        results.add(null);
      } catch (InterruptedException e) {
        for (Future<T> f : futures)
          f.cancel(true);
        Thread.currentThread().interrupt();
        throw new RuntimeException("Interrupted while waiting for " + numRanges + " ranges", e);
      }
    }
    if (firstFailure != null) {
      if (numFailures > 1)
        LOG.debug(numFailures + " ranges failed, rethrowing the first failure");
      if (firstFailure instanceof RuntimeException)
        throw (RuntimeException) firstFailure;
      if (firstFailure instanceof Error)
        throw (Error) firstFailure;
      throw new RuntimeException(numFailures + " unhandled exceptions", firstFailure);
    }
    return results;
  }
}
