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
package com.realdata;

import com.realdata.cache.QueryCache;
import com.realdata.dataset.ChunkManager;
import com.realdata.dataset.ColumnConfig;
import com.realdata.dataset.DatasetScope;
import com.realdata.dataset.MetadataStore;
import com.realdata.dataset.PaginationResult;
import com.realdata.dataset.ProgressListener;
import com.realdata.dataset.ProjectMetadata;
import com.realdata.dataset.Row;
import com.realdata.engine.InMemoryStoreDriver;
import com.realdata.engine.LocalStoreDriver;
import com.realdata.engine.StoreDriver;
import com.realdata.exception.ConfigurationException;
import com.realdata.log.LogManager;
import com.realdata.query.AggregationConfig;
import com.realdata.query.AggregationEngine;
import com.realdata.query.AggregationResult;
import com.realdata.query.EqualityFilter;
import com.realdata.schema.StoreSchemaManager;

import java.time.Clock;
import java.util.List;
import java.util.logging.Level;

/**
 * Entry point of the library: stores datasets as chunks and answers paginated reads, aggregations, distinct values and filtered scans
 * without loading a whole dataset in memory.
 * <p>
 * The store driver is opened on the first operation and released by {@link #close()}. Example:
 * <pre>
 * try (DatasetStore store = DatasetStore.local("/data/realdata")) {
 *   store.createProject("sales", "Sales 2024", columns);
 *   store.batchInsert("sales", rows);
 *   AggregationResult byRegion = store.aggregateData("sales", AggregationConfig.builder("region").sum("amount").build());
 * }
 * </pre>
 * Instances are thread safe, but writes of the same dataset must not run concurrently: use a
 * {@link com.realdata.async.DatasetAsyncExecutor} with one worker to serialize them.
 */
public class DatasetStore implements AutoCloseable {
  private final ContextConfiguration configuration;
  private final StoreSchemaManager   schema;
  private final MetadataStore        metadataStore;
  private final QueryCache           cache;
  private final ChunkManager         chunkManager;
  private final AggregationEngine    aggregationEngine;

  public DatasetStore(final StoreDriver driver) {
    this(driver, new ContextConfiguration(), Clock.systemUTC());
  }

  public DatasetStore(final StoreDriver driver, final ContextConfiguration configuration, final Clock clock) {
    this.configuration = configuration;
    this.schema = new StoreSchemaManager(driver);
    this.metadataStore = new MetadataStore(schema, clock);
    this.cache = new QueryCache(schema, configuration.getValueAsLong(GlobalConfiguration.CACHE_TTL), clock);
    this.chunkManager = new ChunkManager(schema, metadataStore, cache, configuration.getValueAsInteger(GlobalConfiguration.CHUNK_SIZE));
    this.aggregationEngine = new AggregationEngine(chunkManager, metadataStore, cache,
        configuration.getValueAsInteger(GlobalConfiguration.AGGREGATION_MAX_RETRIES));
  }

  /**
   * Creates a store persisted under the directory, with the global configuration.
   */
  public static DatasetStore local(final String path) {
    return new DatasetStore(new LocalStoreDriver(path));
  }

  public static DatasetStore inMemory() {
    return new DatasetStore(new InMemoryStoreDriver());
  }

  /**
   * Creates the metadata of a new, empty dataset.
   *
   * @throws ConfigurationException if a dataset with the same id exists
   */
  public ProjectMetadata createProject(final String datasetId, final String name, final List<ColumnConfig> columns) {
    if (metadataStore.exists(datasetId))
      throw new ConfigurationException("Dataset '" + datasetId + "' already exists");

    final ProjectMetadata metadata = new ProjectMetadata(datasetId, name);
    if (columns != null)
      metadata.setColumns(columns);
    final ProjectMetadata saved = metadataStore.save(metadata);
    LogManager.instance().log(this, Level.FINE, "Created dataset '%s'", datasetId);
    return saved;
  }

  /**
   * Saves the descriptive fields of the metadata (name, description, columns, data sources, active data source). Row and chunk counters
   * and the generation keep their stored values.
   */
  public ProjectMetadata saveProjectMetadata(final ProjectMetadata metadata) {
    return metadataStore.save(metadata);
  }

  /**
   * @return the metadata or null if the dataset does not exist
   */
  public ProjectMetadata getProjectMetadata(final String datasetId) {
    return metadataStore.get(datasetId);
  }

  /**
   * @return all the datasets, the most recently modified first
   */
  public List<ProjectMetadata> listProjects() {
    return metadataStore.list();
  }

  /**
   * Deletes the dataset with its chunks, the chunks of its data sources and its cached results.
   *
   * @return true if the dataset existed
   */
  public boolean deleteProject(final String datasetId) {
    final boolean existed = metadataStore.delete(datasetId);
    final int chunks = chunkManager.deleteDataset(datasetId);
    LogManager.instance().log(this, Level.FINE, "Deleted dataset '%s' (%d chunks)", datasetId, chunks);
    return existed;
  }

  public void batchInsert(final String datasetId, final List<Row> rows) {
    chunkManager.batchInsert(DatasetScope.of(datasetId), rows, null);
  }

  public void batchInsert(final String datasetId, final List<Row> rows, final ProgressListener listener) {
    chunkManager.batchInsert(DatasetScope.of(datasetId), rows, listener);
  }

  public void batchInsert(final DatasetScope scope, final List<Row> rows, final ProgressListener listener) {
    chunkManager.batchInsert(scope, rows, listener);
  }

  public long append(final String datasetId, final List<Row> rows) {
    return chunkManager.append(DatasetScope.of(datasetId), rows);
  }

  public long append(final DatasetScope scope, final List<Row> rows) {
    return chunkManager.append(scope, rows);
  }

  public List<Row> getChunk(final String datasetId, final int chunkIndex) {
    return chunkManager.getChunk(DatasetScope.of(datasetId), chunkIndex);
  }

  public List<Row> getChunk(final DatasetScope scope, final int chunkIndex) {
    return chunkManager.getChunk(scope, chunkIndex);
  }

  public List<Row> getAllChunks(final String datasetId) {
    return chunkManager.getAllChunks(DatasetScope.of(datasetId));
  }

  public List<Row> getAllChunks(final DatasetScope scope) {
    return chunkManager.getAllChunks(scope);
  }

  public PaginationResult getPage(final String datasetId, final int page) {
    return getPage(DatasetScope.of(datasetId), page, configuration.getValueAsInteger(GlobalConfiguration.PAGE_SIZE));
  }

  public PaginationResult getPage(final String datasetId, final int page, final int pageSize) {
    return chunkManager.getPage(DatasetScope.of(datasetId), page, pageSize);
  }

  public PaginationResult getPage(final DatasetScope scope, final int page, final int pageSize) {
    return chunkManager.getPage(scope, page, pageSize);
  }

  /**
   * Deletes the primary chunks of the dataset. Data source chunks and metadata are kept.
   */
  public int deleteAll(final String datasetId) {
    return chunkManager.deleteAll(DatasetScope.of(datasetId));
  }

  /**
   * Deletes the chunks of one data source of the dataset.
   */
  public int deleteAll(final String datasetId, final String sourceId) {
    return chunkManager.deleteAll(DatasetScope.of(datasetId, sourceId));
  }

  public AggregationResult aggregateData(final String datasetId, final AggregationConfig config) {
    return aggregationEngine.aggregateData(DatasetScope.of(datasetId), config);
  }

  public AggregationResult aggregateData(final DatasetScope scope, final AggregationConfig config) {
    return aggregationEngine.aggregateData(scope, config);
  }

  public List<String> getUniqueValues(final String datasetId, final String column) {
    return getUniqueValues(datasetId, column, configuration.getValueAsInteger(GlobalConfiguration.UNIQUE_VALUES_LIMIT));
  }

  public List<String> getUniqueValues(final String datasetId, final String column, final int limit) {
    return aggregationEngine.getUniqueValues(DatasetScope.of(datasetId), column, limit);
  }

  public List<String> getUniqueValues(final DatasetScope scope, final String column, final int limit) {
    return aggregationEngine.getUniqueValues(scope, column, limit);
  }

  public List<Row> getFilteredData(final String datasetId, final List<EqualityFilter> filters) {
    return getFilteredData(datasetId, filters, configuration.getValueAsInteger(GlobalConfiguration.FILTERED_DATA_LIMIT));
  }

  public List<Row> getFilteredData(final String datasetId, final List<EqualityFilter> filters, final int limit) {
    return aggregationEngine.getFilteredData(DatasetScope.of(datasetId), filters, limit);
  }

  public List<Row> getFilteredData(final DatasetScope scope, final List<EqualityFilter> filters, final int limit) {
    return aggregationEngine.getFilteredData(scope, filters, limit);
  }

  /**
   * Removes the cached results of the dataset.
   *
   * @return the number of removed entries
   */
  public int clearCache(final String datasetId) {
    return cache.clear(datasetId);
  }

  /**
   * Removes the expired cache entries of all the datasets.
   *
   * @return the number of removed entries
   */
  public int evictExpiredCache() {
    return cache.evictExpired();
  }

  public StorageStats getStorageStats() {
    long rows = 0;
    long chunks = 0;
    final List<ProjectMetadata> projects = metadataStore.list();
    for (final ProjectMetadata project : projects) {
      rows += project.getRowCount();
      chunks += project.getChunkCount();
    }
    return new StorageStats(projects.size(), rows, chunks, cache.size());
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  public StoreSchemaManager getSchemaManager() {
    return schema;
  }

  public ChunkManager getChunkManager() {
    return chunkManager;
  }

  public AggregationEngine getAggregationEngine() {
    return aggregationEngine;
  }

  public QueryCache getQueryCache() {
    return cache;
  }

  /**
   * Releases the store driver. The next operation opens it again.
   */
  @Override
  public void close() {
    schema.close();
  }
}
