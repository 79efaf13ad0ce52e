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

import com.realdata.exception.ConfigurationException;
import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Metadata of a dataset (project). The row and chunk counters, the per-source counters and the generation are owned by the
 * {@link ChunkManager}: saving the metadata through the {@link com.realdata.DatasetStore} keeps the stored values of those fields.
 * <p>
 * The generation is raised by every successful write of the dataset's rows. Readers compare it before and after a scan to detect a
 * concurrent write.
 */
public class ProjectMetadata {
  public static final int STORAGE_VERSION = 2;

  private final String                   id;
  private       String                   name;
  private       String                   description;
  private       long                     lastModified;
  private       long                     rowCount;
  private       int                      chunkCount;
  private       int                      chunkSize;
  private       List<ColumnConfig>       columns     = new ArrayList<>();
  private       List<DataSourceMetadata> dataSources = new ArrayList<>();
  private       String                   activeDataSourceId;
  private       long                     generation;
  private       int                      storageVersion = STORAGE_VERSION;

  public ProjectMetadata(final String id, final String name) {
    if (id == null || id.isEmpty())
      throw new ConfigurationException("Dataset id is empty");
    this.id = id;
    this.name = name != null ? name : id;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public ProjectMetadata setName(final String name) {
    this.name = name;
    return this;
  }

  public String getDescription() {
    return description;
  }

  public ProjectMetadata setDescription(final String description) {
    this.description = description;
    return this;
  }

  public long getLastModified() {
    return lastModified;
  }

  public void setLastModified(final long lastModified) {
    this.lastModified = lastModified;
  }

  public long getRowCount() {
    return rowCount;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  /**
   * Returns the number of rows per chunk the stored chunks were written with, or 0 if no chunk was written yet.
   */
  public int getChunkSize() {
    return chunkSize;
  }

  public List<ColumnConfig> getColumns() {
    return Collections.unmodifiableList(columns);
  }

  public ProjectMetadata setColumns(final List<ColumnConfig> columns) {
    this.columns = new ArrayList<>(columns);
    return this;
  }

  public List<DataSourceMetadata> getDataSources() {
    return Collections.unmodifiableList(dataSources);
  }

  public DataSourceMetadata getDataSource(final String sourceId) {
    for (final DataSourceMetadata source : dataSources)
      if (source.getId().equals(sourceId))
        return source;
    return null;
  }

  /**
   * Adds the data source or replaces the one with the same id.
   */
  public ProjectMetadata putDataSource(final DataSourceMetadata source) {
    for (int i = 0; i < dataSources.size(); i++)
      if (dataSources.get(i).getId().equals(source.getId())) {
        dataSources.set(i, source);
        return this;
      }
    dataSources.add(source);
    return this;
  }

  public boolean removeDataSource(final String sourceId) {
    return dataSources.removeIf(s -> s.getId().equals(sourceId));
  }

  public String getActiveDataSourceId() {
    return activeDataSourceId;
  }

  public ProjectMetadata setActiveDataSourceId(final String activeDataSourceId) {
    this.activeDataSourceId = activeDataSourceId;
    return this;
  }

  public long getGeneration() {
    return generation;
  }

  public int getStorageVersion() {
    return storageVersion;
  }

  void setCounters(final long rowCount, final int chunkCount, final int chunkSize) {
    this.rowCount = rowCount;
    this.chunkCount = chunkCount;
    this.chunkSize = chunkSize;
  }

  void incrementGeneration() {
    ++generation;
  }

  /**
   * Copies the fields owned by the chunk manager from the stored version of the metadata.
   */
  void copyCountersFrom(final ProjectMetadata stored) {
    this.rowCount = stored.rowCount;
    this.chunkCount = stored.chunkCount;
    this.chunkSize = stored.chunkSize;
    this.generation = stored.generation;
    for (final DataSourceMetadata source : dataSources) {
      final DataSourceMetadata storedSource = stored.getDataSource(source.getId());
      if (storedSource != null)
        source.setCounters(storedSource.getRowCount(), storedSource.getChunkCount(), storedSource.getChunkSize(),
            storedSource.getUpdatedAt());
      else
        source.setCounters(0, 0, 0, source.getUpdatedAt());
    }
  }

  public ProjectMetadata copy() {
    return fromJSON(toJSON());
  }

  public JSONObject toJSON() {
    final JSONArray columnsJson = new JSONArray();
    for (final ColumnConfig column : columns)
      columnsJson.put(column.toJSON());
    final JSONArray sourcesJson = new JSONArray();
    for (final DataSourceMetadata source : dataSources)
      sourcesJson.put(source.toJSON());

    return new JSONObject().put("id", id).put("name", name).put("description", description).put("lastModified", lastModified)
        .put("rowCount", rowCount).put("chunkCount", chunkCount).put("chunkSize", chunkSize).put("columns", columnsJson)
        .put("dataSources", sourcesJson).put("activeDataSourceId", activeDataSourceId).put("generation", generation).put("storageVersion", storageVersion);
  }

  public static ProjectMetadata fromJSON(final JSONObject json) {
    final ProjectMetadata metadata = new ProjectMetadata(json.getString("id"), json.optString("name", null));
    metadata.description = json.optString("description", null);
    metadata.lastModified = json.optLong("lastModified", 0);
    metadata.rowCount = json.optLong("rowCount", 0);
    metadata.chunkCount = json.optInt("chunkCount", 0);
    metadata.chunkSize = json.optInt("chunkSize", 0);
    metadata.activeDataSourceId = json.optString("activeDataSourceId", null);
    metadata.generation = json.optLong("generation", 0);
    metadata.storageVersion = json.optInt("storageVersion", STORAGE_VERSION);

    final JSONArray columnsJson = json.optJSONArray("columns");
    if (columnsJson != null)
      for (int i = 0; i < columnsJson.length(); i++)
        metadata.columns.add(ColumnConfig.fromJSON(columnsJson.getJSONObject(i)));

    final JSONArray sourcesJson = json.optJSONArray("dataSources");
    if (sourcesJson != null)
      for (int i = 0; i < sourcesJson.length(); i++)
        metadata.dataSources.add(DataSourceMetadata.fromJSON(sourcesJson.getJSONObject(i)));
    return metadata;
  }

  @Override
  public String toString() {
    return "ProjectMetadata{id=" + id + ", rows=" + rowCount + ", chunks=" + chunkCount + ", generation=" + generation + "}";
  }
}
