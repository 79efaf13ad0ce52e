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

import com.realdata.DatasetStore;
import com.realdata.dataset.PaginationResult;
import com.realdata.dataset.ProgressListener;
import com.realdata.dataset.ProjectMetadata;
import com.realdata.dataset.Row;
import com.realdata.query.AggregationConfig;
import com.realdata.query.AggregationResult;
import com.realdata.query.EqualityFilter;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Asynchronous access to a {@link DatasetStore}. Every operation runs on the executor's worker threads and returns a future that fails
 * with {@link com.realdata.exception.StoreTimeoutException} when the operation does not complete within the configured deadline. An
 * operation that missed its deadline is not interrupted: its writes still complete.
 **/
public interface DatasetAsyncExecutor extends AutoCloseable {
  /**
   * Schedules a custom operation against the store.
   */
  <T> CompletableFuture<T> submit(Function<DatasetStore, T> operation);

  CompletableFuture<ProjectMetadata> getProjectMetadata(String datasetId);

  CompletableFuture<Void> batchInsert(String datasetId, List<Row> rows, ProgressListener listener);

  CompletableFuture<Long> append(String datasetId, List<Row> rows);

  CompletableFuture<PaginationResult> getPage(String datasetId, int page, int pageSize);

  CompletableFuture<Integer> deleteAll(String datasetId);

  CompletableFuture<AggregationResult> aggregateData(String datasetId, AggregationConfig config);

  CompletableFuture<List<String>> getUniqueValues(String datasetId, String column, int limit);

  CompletableFuture<List<Row>> getFilteredData(String datasetId, List<EqualityFilter> filters, int limit);

  /**
   * Waits for the completion of all the pending operations.
   *
   * @param timeout timeout in milliseconds
   *
   * @return true if all the operations completed before the timeout expired, otherwise false
   */
  boolean waitCompletion(long timeout);

  /**
   * Stops accepting operations and waits for the pending ones up to the operation deadline.
   */
  @Override
  void close();
}
