// ******************************************************************************
//
// Title:       FFD.
// Description: FFD - Free-Form Deformation Models for Image Registration.
// Copyright:   Copyright (c) The FFD Developers 2024.
//
// This file is part of FFD.
//
// FFD is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// FFD is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// FFD; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package ffd.transform;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import ffd.utilities.FFDProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The PointBatchExecutor evaluates a batch of points by splitting it into contiguous portions.
 * Small batches, or an executor with a single thread, run on the calling thread.
 * <p>
 * Each portion must write only to the output rows of its own points.
 *
 * @since 1.0
 */
public class PointBatchExecutor implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(PointBatchExecutor.class.getName());

  /** Default minimum batch size for parallel evaluation. */
  public static final int DEFAULT_PARALLEL_THRESHOLD = 4096;

  /** Portions per thread, to balance uneven point costs near the grid boundary. */
  private static final int PORTIONS_PER_THREAD = 4;

  private static final AtomicInteger poolNumber = new AtomicInteger();

  /** Evaluates the points start (inclusive) to end (exclusive) of a batch. */
  @FunctionalInterface
  public interface PointRange {

    /**
     * Evaluate a contiguous range of points.
     *
     * @param start first point.
     * @param end one past the last point.
     */
    void evaluate(int start, int end);
  }

  private final int nThreads;
  private final int parallelThreshold;
  private final ExecutorService executorService;

  /** A serial executor that evaluates every batch on the calling thread. */
  public PointBatchExecutor() {
    this(1, DEFAULT_PARALLEL_THRESHOLD);
  }

  /**
   * Constructor for PointBatchExecutor.
   *
   * @param nThreads number of worker threads (at least 1).
   * @param parallelThreshold batches with fewer points are evaluated on the calling thread.
   */
  public PointBatchExecutor(int nThreads, int parallelThreshold) {
    if (nThreads < 1) {
      throw new IllegalArgumentException(format(" Thread count %d must be positive.", nThreads));
    }
    this.nThreads = nThreads;
    this.parallelThreshold = max(1, parallelThreshold);
    if (nThreads > 1) {
      int pool = poolNumber.incrementAndGet();
      AtomicInteger threadNumber = new AtomicInteger();
      executorService = Executors.newFixedThreadPool(nThreads, r -> {
        Thread thread = new Thread(r,
            format("ffd-batch-%d-%d", pool, threadNumber.incrementAndGet()));
        thread.setDaemon(true);
        return thread;
      });
    } else {
      executorService = null;
    }
  }

  /**
   * Create a PointBatchExecutor from the ffd-threads and ffd-parallel-threshold properties.
   *
   * @param properties the configuration (may be null).
   * @return a new PointBatchExecutor.
   */
  public static PointBatchExecutor fromProperties(CompositeConfiguration properties) {
    int defaultThreads = Runtime.getRuntime().availableProcessors();
    int threads = FFDProperties.getInt(properties, FFDProperties.THREADS, defaultThreads);
    if (threads < 1) {
      logger.warning(format(" %s must be positive (found %d); using %d.",
          FFDProperties.THREADS, threads, defaultThreads));
      threads = defaultThreads;
    }
    int threshold = FFDProperties.getInt(properties, FFDProperties.PARALLEL_THRESHOLD,
        DEFAULT_PARALLEL_THRESHOLD);
    return new PointBatchExecutor(threads, threshold);
  }

  /**
   * Number of worker threads.
   *
   * @return the thread count.
   */
  public int getThreadCount() {
    return nThreads;
  }

  /**
   * Minimum batch size for parallel evaluation.
   *
   * @return the threshold.
   */
  public int getParallelThreshold() {
    return parallelThreshold;
  }

  /**
   * Evaluate all points of a batch. Returns when every portion is complete.
   *
   * @param nPoints number of points in the batch.
   * @param range evaluates one portion.
   */
  public void execute(int nPoints, PointRange range) {
    if (nPoints <= 0) {
      return;
    }
    if (executorService == null || nPoints < parallelThreshold) {
      range.evaluate(0, nPoints);
      return;
    }

    int nPortions = min(nPoints, nThreads * PORTIONS_PER_THREAD);
    int portionSize = (nPoints + nPortions - 1) / nPortions;
    List<Callable<Void>> tasks = new ArrayList<>(nPortions);
    for (int start = 0; start < nPoints; start += portionSize) {
      final int first = start;
      final int last = min(nPoints, start + portionSize);
      tasks.add(() -> {
        range.evaluate(first, last);
        return null;
      });
    }

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Evaluating %d points in %d portions on %d threads.",
          nPoints, tasks.size(), nThreads));
    }

    try {
      // invokeAll() returns when all tasks are complete
      List<Future<Void>> futures = executorService.invokeAll(tasks);
      for (Future<Void> future : futures) {
        future.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(" Batch evaluation was interrupted.", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException(" Batch evaluation failed.", cause);
    }
  }

  /** Shut down the worker threads. */
  @Override
  public void close() {
    if (executorService != null) {
      executorService.shutdown();
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Point batch executor with %d threads (parallel threshold %d points)",
        nThreads, parallelThreshold);
  }
}
