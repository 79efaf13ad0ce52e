/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.realdata.async;

import com.realdata.ContextConfiguration;
import com.realdata.DatasetStore;
import com.realdata.GlobalConfiguration;
import com.realdata.dataset.PaginationResult;
import com.realdata.dataset.ProgressListener;
import com.realdata.dataset.ProjectMetadata;
import com.realdata.dataset.Row;
import com.realdata.exception.StoreTimeoutException;
import com.realdata.log.LogManager;
import com.realdata.query.AggregationConfig;
import com.realdata.query.AggregationResult;
import com.realdata.query.EqualityFilter;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Runs the operations on a fixed pool of daemon threads. With a single worker (the default) the operations execute in submission
 * order.
 */
public class DatasetAsyncExecutorImpl implements DatasetAsyncExecutor {
  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

  private final DatasetStore              store;
  private final ExecutorService           executor;
  private final long                      timeout;
  private final Set<CompletableFuture<?>> pending = ConcurrentHashMap.newKeySet();

  public DatasetAsyncExecutorImpl(final DatasetStore store) {
    this(store, store.getConfiguration());
  }

  public DatasetAsyncExecutorImpl(final DatasetStore store, final ContextConfiguration configuration) {
    this.store = store;
    this.timeout = configuration.getValueAsLong(GlobalConfiguration.STORE_OPERATION_TIMEOUT);

    final int workers = Math.max(1, configuration.getValueAsInteger(GlobalConfiguration.ASYNC_WORKER_THREADS));
    this.executor = Executors.newFixedThreadPool(workers, r -> {
      final Thread t = new Thread(r, "RealData-Async-" + THREAD_COUNTER.getAndIncrement());
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public <T> CompletableFuture<T> submit(final Function<DatasetStore, T> operation) {
    final CompletableFuture<T> execution = CompletableFuture.supplyAsync(() -> operation.apply(store), executor);

    final CompletableFuture<T> result = new CompletableFuture<>();
    pending.add(result);
    result.whenComplete((value, error) -> pending.remove(result));

    (timeout > 0 ? execution.orTimeout(timeout, TimeUnit.MILLISECONDS) : execution).whenComplete((value, error) -> {
      if (error == null) {
        result.complete(value);
        return;
      }

      final Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
      if (cause instanceof TimeoutException) {
        LogManager.instance().log(this, Level.WARNING, "Store operation did not complete within %dms", timeout);
        result.completeExceptionally(new StoreTimeoutException("Store operation did not complete within " + timeout + "ms", cause));
      } else
        result.completeExceptionally(cause);
    });
    return result;
  }

  @Override
  public CompletableFuture<ProjectMetadata> getProjectMetadata(final String datasetId) {
    return submit(s -> s.getProjectMetadata(datasetId));
  }

  @Override
  public CompletableFuture<Void> batchInsert(final String datasetId, final List<Row> rows, final ProgressListener listener) {
    return submit(s -> {
      s.batchInsert(datasetId, rows, listener);
      return null;
    });
  }

  @Override
  public CompletableFuture<Long> append(final String datasetId, final List<Row> rows) {
    return submit(s -> s.append(datasetId, rows));
  }

  @Override
  public CompletableFuture<PaginationResult> getPage(final String datasetId, final int page, final int pageSize) {
    return submit(s -> s.getPage(datasetId, page, pageSize));
  }

  @Override
  public CompletableFuture<Integer> deleteAll(final String datasetId) {
    return submit(s -> s.deleteAll(datasetId));
  }

  @Override
  public CompletableFuture<AggregationResult> aggregateData(final String datasetId, final AggregationConfig config) {
    return submit(s -> s.aggregateData(datasetId, config));
  }

  @Override
  public CompletableFuture<List<String>> getUniqueValues(final String datasetId, final String column, final int limit) {
    return submit(s -> s.getUniqueValues(datasetId, column, limit));
  }

  @Override
  public CompletableFuture<List<Row>> getFilteredData(final String datasetId, final List<EqualityFilter> filters, final int limit) {
    return submit(s -> s.getFilteredData(datasetId, filters, limit));
  }

  @Override
  public boolean waitCompletion(final long timeout) {
    final CompletableFuture<?>[] futures = pending.toArray(new CompletableFuture<?>[0]);
    try {
      CompletableFuture.allOf(futures).get(timeout, TimeUnit.MILLISECONDS);
      return true;
    } catch (final ExecutionException e) {
      // ALL COMPLETED, SOME EXCEPTIONALLY
      return true;
    } catch (final TimeoutException e) {
      return false;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      final long wait = timeout > 0 ? timeout : 30_000L;
      if (!executor.awaitTermination(wait, TimeUnit.MILLISECONDS)) {
        LogManager.instance().log(this, Level.WARNING, "Pending store operations did not complete in %dms, interrupting them", wait);
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
