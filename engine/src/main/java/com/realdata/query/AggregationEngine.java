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
package com.realdata.query;

import com.realdata.cache.QueryCache;
import com.realdata.dataset.ChunkManager;
import com.realdata.dataset.DatasetScope;
import com.realdata.dataset.MetadataStore;
import com.realdata.dataset.ProjectMetadata;
import com.realdata.dataset.Row;
import com.realdata.dataset.Value;
import com.realdata.exception.DatasetNotFoundException;
import com.realdata.exception.QueryException;
import com.realdata.log.LogManager;
import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;

/**
 * Computes group-by aggregations, distinct values and filtered row lists by streaming the chunks of a dataset, so that only one chunk
 * is in memory at a time. Results of aggregations and distinct values are cached per dataset until the next write.
 * <p>
 * The scan is optimistic: the metadata generation is read before and after the scan and, if a write happened in between, the scan is
 * repeated up to {@code maxRetries} times. When the retries are exhausted the last result is returned without caching it.
 */
public class AggregationEngine {
  public static final String EMPTY_GROUP = "N/A";

  private final ChunkManager  chunkManager;
  private final MetadataStore metadataStore;
  private final QueryCache    cache;
  private final int           maxRetries;

  public AggregationEngine(final ChunkManager chunkManager, final MetadataStore metadataStore, final QueryCache cache,
      final int maxRetries) {
    this.chunkManager = chunkManager;
    this.metadataStore = metadataStore;
    this.cache = cache;
    this.maxRetries = Math.max(0, maxRetries);
  }

  public AggregationResult aggregateData(final String datasetId, final AggregationConfig config) {
    return aggregateData(DatasetScope.of(datasetId), config);
  }

  /**
   * Groups the rows matching the filters by the dimension column (and by the stack column if set), applies the measure, sorts the groups
   * by descending total keeping the first-seen order between ties, and truncates to the limit. Null and empty values are grouped under
   * {@value #EMPTY_GROUP}.
   *
   * @throws DatasetNotFoundException if the dataset does not exist
   */
  public AggregationResult aggregateData(final DatasetScope scope, final AggregationConfig config) {
    final String cacheKey = cacheKey(scope, new JSONObject().put("aggregate", config.toJSON()));

    final Object cached = cache.get(scope.datasetId(), cacheKey);
    if (cached instanceof JSONObject)
      return AggregationResult.fromJSON((JSONObject) cached);

    AggregationResult result = null;
    for (int attempt = 0; attempt <= maxRetries; attempt++) {
      final ProjectMetadata metadata = metadataStore.get(scope.datasetId());
      if (metadata == null)
        throw new DatasetNotFoundException(scope.datasetId());

      result = aggregate(scope, metadata, config);

      if (isUnchanged(metadata)) {
        cache.set(scope.datasetId(), cacheKey, result.toJSON());
        return result;
      }

      LogManager.instance().log(this, Level.WARNING, "Dataset '%s' changed during aggregation, retrying (%d/%d)", scope, attempt + 1,
          maxRetries);
    }

    LogManager.instance().log(this, Level.WARNING,
        "Dataset '%s' kept changing during aggregation, returning the last result without caching it", scope);
    return result;
  }

  public List<String> getUniqueValues(final String datasetId, final String column, final int limit) {
    return getUniqueValues(DatasetScope.of(datasetId), column, limit);
  }

  /**
   * Returns the distinct non-empty text values of the column in order of first appearance, at most {@code limit}. The scan stops at the
   * end of the chunk where {@code 2 * limit} distinct values are collected. A missing dataset returns an empty list.
   */
  public List<String> getUniqueValues(final DatasetScope scope, final String column, final int limit) {
    if (column == null || column.isEmpty())
      throw new QueryException("Column is empty");
    if (limit < 1)
      throw new QueryException("Limit must be greater than 0, found " + limit);

    final String cacheKey = cacheKey(scope, new JSONObject().put("unique", column).put("limit", limit));
    final Object cached = cache.get(scope.datasetId(), cacheKey);
    if (cached instanceof JSONArray) {
      final List<String> values = new ArrayList<>();
      for (final Object value : (JSONArray) cached)
        values.add((String) value);
      return values;
    }

    final ProjectMetadata metadata = metadataStore.get(scope.datasetId());
    if (metadata == null)
      return new ArrayList<>();

    final Set<String> unique = new LinkedHashSet<>();
    final long threshold = 2L * limit;
    chunkManager.forEachChunk(scope, metadata, (index, rows) -> {
      for (final Row row : rows) {
        final Value value = row.get(column);
        if (!value.isEmpty())
          unique.add(value.asText());
      }
      return unique.size() < threshold;
    });

    final List<String> result = new ArrayList<>(limit);
    for (final String value : unique) {
      if (result.size() >= limit)
        break;
      result.add(value);
    }

    if (isUnchanged(metadata))
      cache.set(scope.datasetId(), cacheKey, new JSONArray(result));
    return result;
  }

  public List<Row> getFilteredData(final String datasetId, final List<EqualityFilter> filters, final int limit) {
    return getFilteredData(DatasetScope.of(datasetId), filters, limit);
  }

  /**
   * Returns the rows matching every filter, in dataset order, at most {@code limit}. The scan stops at the end of the chunk where
   * {@code limit} rows are collected. A missing dataset returns an empty list. Results are not cached.
   */
  public List<Row> getFilteredData(final DatasetScope scope, final List<EqualityFilter> filters, final int limit) {
    if (limit < 1)
      throw new QueryException("Limit must be greater than 0, found " + limit);

    final ProjectMetadata metadata = metadataStore.get(scope.datasetId());
    if (metadata == null)
      return new ArrayList<>();

    final List<Row> matching = new ArrayList<>();
    chunkManager.forEachChunk(scope, metadata, (index, rows) -> {
      for (final Row row : rows)
        if (EqualityFilter.matchesAll(row, filters))
          matching.add(row);
      return matching.size() < limit;
    });

    return matching.size() > limit ? new ArrayList<>(matching.subList(0, limit)) : matching;
  }

  private AggregationResult aggregate(final DatasetScope scope, final ProjectMetadata metadata, final AggregationConfig config) {
    final String dimension = config.getDimension();
    final String stackBy = config.getStackBy();
    final String measureColumn = config.getMeasureColumn();
    final MeasureKind measure = config.getMeasure();

    // GROUP -> STACK KEY (NULL WHEN NOT STACKED) -> {SUM, COUNT}
    final Map<String, Map<String, double[]>> groups = new LinkedHashMap<>();

    chunkManager.forEachChunk(scope, metadata, (index, rows) -> {
      for (final Row row : rows) {
        if (!EqualityFilter.matchesAll(row, config.getFilters()))
          continue;

        final String group = groupKey(row.get(dimension));
        final String stack = stackBy != null ? groupKey(row.get(stackBy)) : null;
        final double[] accumulator = groups.computeIfAbsent(group, k -> new LinkedHashMap<>())
            .computeIfAbsent(stack, k -> new double[2]);

        accumulator[0] += measure == MeasureKind.COUNT ? 1 : row.get(measureColumn).toNumber();
        accumulator[1] += 1;
      }
      return true;
    });

    final List<Map.Entry<String, Map<String, Double>>> finalized = new ArrayList<>(groups.size());
    for (final Map.Entry<String, Map<String, double[]>> group : groups.entrySet()) {
      final Map<String, Double> values = new LinkedHashMap<>();
      for (final Map.Entry<String, double[]> stack : group.getValue().entrySet())
        values.put(stack.getKey(), finalizeValue(measure, stack.getValue()));
      finalized.add(Map.entry(group.getKey(), values));
    }

    // STABLE SORT: TIES KEEP THE FIRST-SEEN ORDER
    finalized.sort((a, b) -> Double.compare(total(b.getValue()), total(a.getValue())));

    final int limit = config.getLimit();
    final List<Map.Entry<String, Map<String, Double>>> kept =
        limit > 0 && finalized.size() > limit ? finalized.subList(0, limit) : finalized;

    final AggregationResult result = new AggregationResult(stackBy != null);
    for (final Map.Entry<String, Map<String, Double>> entry : kept) {
      if (stackBy != null)
        result.putStack(entry.getKey(), entry.getValue());
      else
        result.putValue(entry.getKey(), entry.getValue().get(null));
    }

    LogManager.instance().log(this, Level.FINE, "Aggregated '%s' by '%s': %d groups (kept %d)", scope, dimension, finalized.size(),
        result.size());
    return result;
  }

  private boolean isUnchanged(final ProjectMetadata before) {
    final ProjectMetadata after = metadataStore.get(before.getId());
    return after != null && after.getGeneration() == before.getGeneration();
  }

  private static double finalizeValue(final MeasureKind measure, final double[] accumulator) {
    if (measure == MeasureKind.AVG)
      return accumulator[1] > 0 ? accumulator[0] / accumulator[1] : 0;
    return accumulator[0];
  }

  private static double total(final Map<String, Double> values) {
    double total = 0;
    for (final double value : values.values())
      total += value;
    return total;
  }

  static String groupKey(final Value value) {
    return value.isEmpty() ? EMPTY_GROUP : value.asText();
  }

  private static String cacheKey(final DatasetScope scope, final JSONObject key) {
    if (scope.isSource())
      key.put("source", scope.sourceId());
    return key.toCanonicalString();
  }
}
