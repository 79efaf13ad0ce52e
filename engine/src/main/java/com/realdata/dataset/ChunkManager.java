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
package com.realdata.dataset;

import com.realdata.cache.QueryCache;
import com.realdata.engine.CompoundKey;
import com.realdata.engine.KeyRange;
import com.realdata.engine.ObjectStore;
import com.realdata.exception.ConfigurationException;
import com.realdata.exception.DatasetNotFoundException;
import com.realdata.exception.PartialWriteException;
import com.realdata.log.LogManager;
import com.realdata.schema.StoreSchemaManager;
import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;

/**
 * Splits the rows of a dataset in chunks of {@code chunkSize} rows and streams them back. After every successful write the invariant
 * {@code chunkCount == ceil(rowCount / chunkSize)} holds for the written scope.
 * <p>
 * The chunk size is recorded in the scope's metadata at every write. A full replacement with {@code batchInsert} uses the configured
 * size, while appends and reads keep addressing the stored chunks with the recorded size, so changing the setting on an existing
 * database only affects the next full replacement.
 * <p>
 * Writes first store all the chunks and only at the end update the metadata counters, raise the generation and clear the dataset's
 * cached results. If a chunk write fails, a {@link PartialWriteException} is thrown and the metadata is left as it was. Reads never go
 * past the row count of the metadata, so rows left by an aborted write stay invisible and the same write can be retried.
 */
public class ChunkManager {
  private final StoreSchemaManager schema;
  private final MetadataStore      metadataStore;
  private final QueryCache         cache;
  private final int                chunkSize;
  private final ChunkStats         stats = new ChunkStats();

  public ChunkManager(final StoreSchemaManager schema, final MetadataStore metadataStore, final QueryCache cache, final int chunkSize) {
    if (chunkSize < 1)
      throw new ConfigurationException("Chunk size must be greater than 0, found " + chunkSize);
    this.schema = schema;
    this.metadataStore = metadataStore;
    this.cache = cache;
    this.chunkSize = chunkSize;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public ChunkStats getStats() {
    return stats;
  }

  public void batchInsert(final String datasetId, final List<Row> rows) {
    batchInsert(DatasetScope.of(datasetId), rows, null);
  }

  /**
   * Replaces all the rows of the scope. Existing chunks are deleted, then the new chunks are written in index order, notifying the
   * listener after each one.
   *
   * @throws DatasetNotFoundException if the dataset metadata does not exist
   * @throws PartialWriteException    if a chunk cannot be written
   */
  public void batchInsert(final DatasetScope scope, final List<Row> rows, final ProgressListener listener) {
    requireMetadata(scope.datasetId());
    stats.batchInserts.incrementAndGet();

    final int deleted = deleteChunks(scope);

    final int totalChunks = chunksFor(rows.size(), chunkSize);
    for (int i = 0; i < totalChunks; i++) {
      final int from = i * chunkSize;
      writeChunk(scope, i, rows.subList(from, Math.min(from + chunkSize, rows.size())), totalChunks);
      if (listener != null)
        listener.onProgress((int) Math.round((i + 1) * 100.0 / totalChunks));
    }

    commit(scope, rows.size(), totalChunks, chunkSize);

    LogManager.instance().log(this, Level.FINE, "Inserted %d rows in %d chunks into '%s' (replaced %d chunks)", rows.size(), totalChunks,
        scope, deleted);
  }

  public long append(final String datasetId, final List<Row> rows) {
    return append(DatasetScope.of(datasetId), rows);
  }

  /**
   * Appends the rows after the existing ones. A partially filled last chunk is completed first, by rewriting it whole with its current
   * rows followed by the first new rows; the remaining rows go into new chunks after it. The new chunks are written before the last chunk
   * is rewritten, then the counters are updated with a single metadata write.
   *
   * @return the row count after the append
   *
   * @throws DatasetNotFoundException if the dataset metadata does not exist
   * @throws PartialWriteException    if a chunk cannot be written
   */
  public long append(final DatasetScope scope, final List<Row> rows) {
    final ProjectMetadata metadata = requireMetadata(scope.datasetId());
    final long rowCount = getRowCount(metadata, scope);
    if (rows.isEmpty())
      return rowCount;

    stats.appends.incrementAndGet();

    final int chunkCount = getChunkCount(metadata, scope);
    final int size = chunkSizeOf(metadata, scope);
    final int tailIndex = chunkCount - 1;
    final int tailFill = chunkCount > 0 ? (int) (rowCount - (long) tailIndex * size) : size;
    final int tailFree = Math.max(0, size - tailFill);

    final List<Row> toTail = rows.subList(0, Math.min(tailFree, rows.size()));
    final List<Row> rest = rows.subList(toTail.size(), rows.size());
    final int newChunks = chunksFor(rest.size(), size);
    final int totalChunks = newChunks + (toTail.isEmpty() ? 0 : 1);

    final List<Row> tailRows = toTail.isEmpty() ? null : new ArrayList<>(readChunk(scope, tailIndex));

    for (int i = 0; i < newChunks; i++) {
      final int from = i * size;
      writeChunk(scope, chunkCount + i, rest.subList(from, Math.min(from + size, rest.size())), totalChunks);
    }

    if (tailRows != null) {
      final List<Row> merged = new ArrayList<>(tailRows.subList(0, Math.min(tailFill, tailRows.size())));
      merged.addAll(toTail);
      writeChunk(scope, tailIndex, merged, totalChunks);
    }

    final long newRowCount = rowCount + rows.size();
    commit(scope, newRowCount, chunkCount + newChunks, size);

    LogManager.instance().log(this, Level.FINE, "Appended %d rows to '%s' (rows=%d chunks=%d)", rows.size(), scope, newRowCount,
        chunkCount + newChunks);
    return newRowCount;
  }

  /**
   * Returns the rows of one chunk or an empty list if the chunk does not exist.
   */
  public List<Row> getChunk(final DatasetScope scope, final int chunkIndex) {
    return Collections.unmodifiableList(readChunk(scope, chunkIndex));
  }

  /**
   * Concatenates all the chunks of the scope, up to the row count of the metadata. This materializes the whole dataset: prefer
   * {@link #forEachChunk(DatasetScope, ProjectMetadata, ChunkVisitor)} for large datasets.
   */
  public List<Row> getAllChunks(final DatasetScope scope) {
    final ProjectMetadata metadata = metadataStore.get(scope.datasetId());
    if (metadata == null)
      return Collections.emptyList();

    final List<Row> result = new ArrayList<>();
    forEachChunk(scope, metadata, (index, rows) -> {
      result.addAll(rows);
      return true;
    });
    return result;
  }

  /**
   * Streams the chunks of the scope in index order, keeping one chunk in memory at a time. The rows are bounded by the row count of the
   * given metadata.
   */
  public void forEachChunk(final DatasetScope scope, final ProjectMetadata metadata, final ChunkVisitor visitor) {
    final int chunkCount = getChunkCount(metadata, scope);
    long remaining = getRowCount(metadata, scope);

    for (int i = 0; i < chunkCount && remaining > 0; i++) {
      List<Row> rows = readChunk(scope, i);
      if (rows.size() > remaining)
        rows = rows.subList(0, (int) remaining);
      remaining -= rows.size();

      if (!visitor.visit(i, Collections.unmodifiableList(rows)))
        break;
    }
  }

  /**
   * Reads one page, loading only the chunks that cover it. A missing dataset returns an empty page.
   *
   * @throws ConfigurationException if page is negative or pageSize is not positive
   */
  public PaginationResult getPage(final DatasetScope scope, final int page, final int pageSize) {
    if (page < 0)
      throw new ConfigurationException("Page must be greater or equal to 0, found " + page);
    if (pageSize < 1)
      throw new ConfigurationException("Page size must be greater than 0, found " + pageSize);

    final ProjectMetadata metadata = metadataStore.get(scope.datasetId());
    if (metadata == null)
      return PaginationResult.empty(page, pageSize);

    final long total = getRowCount(metadata, scope);
    final long startRow = (long) page * pageSize;
    if (startRow >= total)
      return new PaginationResult(List.of(), total, page, pageSize, false);

    final int size = chunkSizeOf(metadata, scope);
    final long endRow = Math.min(startRow + pageSize, total);
    final int startChunk = (int) (startRow / size);
    final int endChunk = (int) ((endRow - 1) / size);

    final List<Row> rows = new ArrayList<>((int) (endRow - startRow));
    for (int i = startChunk; i <= endChunk; i++) {
      final List<Row> chunk = readChunk(scope, i);
      final long chunkStart = (long) i * size;
      final int from = (int) Math.max(0, startRow - chunkStart);
      final int to = (int) Math.min(chunk.size(), endRow - chunkStart);
      if (from < to)
        rows.addAll(chunk.subList(from, to));
    }

    return new PaginationResult(Collections.unmodifiableList(rows), total, page, pageSize, startRow + pageSize < total);
  }

  public int deleteAll(final String datasetId) {
    return deleteAll(DatasetScope.of(datasetId));
  }

  /**
   * Deletes all the chunks of the scope and clears the dataset's cached results. If the dataset metadata exists, the scope counters are
   * reset to 0.
   *
   * @return the number of deleted chunks
   */
  public int deleteAll(final DatasetScope scope) {
    final int deleted = deleteChunks(scope);

    final ProjectMetadata metadata = metadataStore.get(scope.datasetId());
    if (metadata != null && (getRowCount(metadata, scope) > 0 || getChunkCount(metadata, scope) > 0)) {
      setCounters(metadata, scope, 0, 0, 0);
      metadata.incrementGeneration();
      metadataStore.put(metadata);
    }

    cache.clear(scope.datasetId());
    LogManager.instance().log(this, Level.FINE, "Deleted %d chunks of '%s'", deleted, scope);
    return deleted;
  }

  /**
   * Deletes the primary chunks and the chunks of all the data sources of the dataset, without touching the metadata.
   *
   * @return the number of deleted chunks
   */
  public int deleteDataset(final String datasetId) {
    int deleted = store(false).deleteAll(StoreSchemaManager.INDEX_PROJECT_ID, KeyRange.only(datasetId));
    deleted += store(true).deleteAll(StoreSchemaManager.INDEX_PROJECT_ID, KeyRange.only(datasetId));
    stats.chunkDeletes.addAndGet(deleted);
    cache.clear(datasetId);
    return deleted;
  }

  private int deleteChunks(final DatasetScope scope) {
    final int deleted;
    if (scope.isSource())
      deleted = store(true).deleteAll(StoreSchemaManager.INDEX_PROJECT_SOURCE_ID, KeyRange.only(scope.datasetId(), scope.sourceId()));
    else
      deleted = store(false).deleteAll(StoreSchemaManager.INDEX_PROJECT_ID, KeyRange.only(scope.datasetId()));
    stats.chunkDeletes.addAndGet(deleted);
    return deleted;
  }

  private List<Row> readChunk(final DatasetScope scope, final int chunkIndex) {
    final JSONObject record = store(scope.isSource()).get(chunkKey(scope, chunkIndex));
    stats.chunkReads.incrementAndGet();
    if (record == null)
      return new ArrayList<>();
    return new ArrayList<>(DataChunk.fromRecord(record).getRows());
  }

  private void writeChunk(final DatasetScope scope, final int chunkIndex, final List<Row> rows, final int totalChunks) {
    try {
      store(scope.isSource()).put(new DataChunk(scope, chunkIndex, rows).toRecord());
      stats.chunkWrites.incrementAndGet();
    } catch (final RuntimeException e) {
      stats.failedWrites.incrementAndGet();
      LogManager.instance().log(this, Level.WARNING, "Error writing chunk %d of '%s', metadata left unchanged", e, chunkIndex, scope);
      throw new PartialWriteException(scope.datasetId(), chunkIndex, totalChunks, e);
    }
  }

  /**
   * Stores the new counters on the latest metadata, raises the generation and invalidates the cached results.
   */
  private void commit(final DatasetScope scope, final long rowCount, final int chunkCount, final int size) {
    final ProjectMetadata metadata = requireMetadata(scope.datasetId());
    setCounters(metadata, scope, rowCount, chunkCount, size);
    metadata.incrementGeneration();
    metadataStore.put(metadata);
    cache.clear(scope.datasetId());
  }

  private ProjectMetadata requireMetadata(final String datasetId) {
    final ProjectMetadata metadata = metadataStore.get(datasetId);
    if (metadata == null)
      throw new DatasetNotFoundException(datasetId);
    return metadata;
  }

  private void setCounters(final ProjectMetadata metadata, final DatasetScope scope, final long rowCount, final int chunkCount,
      final int size) {
    if (!scope.isSource()) {
      metadata.setCounters(rowCount, chunkCount, size);
      return;
    }

    final long now = metadataStore.getClock().millis();
    DataSourceMetadata source = metadata.getDataSource(scope.sourceId());
    if (source == null) {
      source = new DataSourceMetadata(scope.sourceId(), scope.sourceId(), DataSourceMetadata.Kind.INGESTION, now);
      metadata.putDataSource(source);
      LogManager.instance().log(this, Level.FINE, "Registered data source '%s'", scope);
    }
    source.setCounters(rowCount, chunkCount, size, now);
  }

  /**
   * Returns the chunk size the scope's stored chunks were written with. A scope without chunks, or metadata written before the size was
   * recorded, uses the configured size.
   */
  int chunkSizeOf(final ProjectMetadata metadata, final DatasetScope scope) {
    if (getChunkCount(metadata, scope) == 0)
      return chunkSize;
    final int stored;
    if (!scope.isSource())
      stored = metadata.getChunkSize();
    else
      stored = metadata.getDataSource(scope.sourceId()).getChunkSize();
    return stored > 0 ? stored : chunkSize;
  }

  private static int chunksFor(final long rows, final int size) {
    return (int) ((rows + size - 1) / size);
  }

  static long getRowCount(final ProjectMetadata metadata, final DatasetScope scope) {
    if (!scope.isSource())
      return metadata.getRowCount();
    final DataSourceMetadata source = metadata.getDataSource(scope.sourceId());
    return source != null ? source.getRowCount() : 0;
  }

  static int getChunkCount(final ProjectMetadata metadata, final DatasetScope scope) {
    if (!scope.isSource())
      return metadata.getChunkCount();
    final DataSourceMetadata source = metadata.getDataSource(scope.sourceId());
    return source != null ? source.getChunkCount() : 0;
  }

  private static CompoundKey chunkKey(final DatasetScope scope, final int chunkIndex) {
    return scope.isSource() ? CompoundKey.of(scope.datasetId(), scope.sourceId(), chunkIndex) : CompoundKey.of(scope.datasetId(), chunkIndex);
  }

  private ObjectStore store(final boolean source) {
    return schema.getStore(source ? StoreSchemaManager.STORE_DATA_SOURCE_CHUNKS : StoreSchemaManager.STORE_DATA_CHUNKS);
  }
}
