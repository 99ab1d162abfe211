/*
 * Copyright 2025 The Papercut Authors
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

package org.papercut.verify;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A fixed number of worker threads draining an unbounded queue of proof tasks, so that no more
 * than {@link #maxConcurrency} external provers run at once. The pool counts the tasks currently
 * executing and the largest number ever executing at the same time.
 */
public final class ProverPool implements AutoCloseable {
  public static final int DEFAULT_MAX_CONCURRENCY = 32;

  private final int maxConcurrency;
  private final ExecutorService executor;
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger peak = new AtomicInteger();

  public ProverPool() {
    this(DEFAULT_MAX_CONCURRENCY);
  }

  public ProverPool(int maxConcurrency) {
    checkArgument(maxConcurrency > 0, "maxConcurrency must be positive");
    this.maxConcurrency = maxConcurrency;
    this.executor =
        Executors.newFixedThreadPool(
            maxConcurrency,
            new ThreadFactoryBuilder().setNameFormat("prover-%d").setDaemon(true).build());
  }

  public int maxConcurrency() {
    return maxConcurrency;
  }

  /** The number of tasks executing now. */
  public int activeCount() {
    return active.get();
  }

  /** The largest number of tasks that have executed at the same time. */
  public int peakCount() {
    return peak.get();
  }

  /** Queues {@code task}; it starts as soon as a worker is free. */
  public <T> Future<T> submit(Callable<T> task) {
    return executor.submit(
        () -> {
          peak.accumulateAndGet(active.incrementAndGet(), Math::max);
          try {
            return task.call();
          } finally {
            active.decrementAndGet();
          }
        });
  }

  /** Stops accepting tasks; tasks already queued still run. */
  @Override
  public void close() {
    executor.shutdown();
  }
}
