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
import java.util.Locale;

/**
 * Bookkeeping of a sub-dataset of a project. The row and chunk counters are maintained by the {@link ChunkManager}.
 */
public class DataSourceMetadata {
  public enum Kind {
    INGESTION, PREPARED;

    public String getName() {
      return name().toLowerCase(Locale.ENGLISH);
    }

    public static Kind fromName(final String name) {
      try {
        return valueOf(name.toUpperCase(Locale.ENGLISH));
      } catch (final IllegalArgumentException e) {
        throw new ConfigurationException("Unknown data source kind '" + name + "'", e);
      }
    }
  }

  private final String             id;
  private       String             name;
  private final Kind               kind;
  private       long               rowCount;
  private       int                chunkCount;
  private       int                chunkSize;
  private       List<ColumnConfig> columns = new ArrayList<>();
  private final long               createdAt;
  private       long               updatedAt;

  public DataSourceMetadata(final String id, final String name, final Kind kind) {
    this(id, name, kind, System.currentTimeMillis());
  }

  DataSourceMetadata(final String id, final String name, final Kind kind, final long createdAt) {
    if (id == null || id.isEmpty())
      throw new ConfigurationException("Data source id is empty");
    this.id = id;
    this.name = name != null ? name : id;
    this.kind = kind;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public DataSourceMetadata setName(final String name) {
    this.name = name;
    return this;
  }

  public Kind getKind() {
    return kind;
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

  public DataSourceMetadata setColumns(final List<ColumnConfig> columns) {
    this.columns = new ArrayList<>(columns);
    return this;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  public long getUpdatedAt() {
    return updatedAt;
  }

  void setCounters(final long rowCount, final int chunkCount, final int chunkSize, final long updatedAt) {
    this.rowCount = rowCount;
    this.chunkCount = chunkCount;
    this.chunkSize = chunkSize;
    this.updatedAt = updatedAt;
  }

  public JSONObject toJSON() {
    final JSONArray columnsJson = new JSONArray();
    for (final ColumnConfig column : columns)
      columnsJson.put(column.toJSON());
    return new JSONObject().put("id", id).put("name", name).put("kind", kind.getName()).put("rowCount", rowCount)
        .put("chunkCount", chunkCount).put("chunkSize", chunkSize).put("columns", columnsJson).put("createdAt", createdAt)
        .put("updatedAt", updatedAt);
  }

  public static DataSourceMetadata fromJSON(final JSONObject json) {
    final DataSourceMetadata source = new DataSourceMetadata(json.getString("id"), json.optString("name", null),
        Kind.fromName(json.optString("kind", Kind.INGESTION.getName())), json.optLong("createdAt", 0));
    source.rowCount = json.optLong("rowCount", 0);
    source.chunkCount = json.optInt("chunkCount", 0);
    source.chunkSize = json.optInt("chunkSize", 0);
    source.updatedAt = json.optLong("updatedAt", source.createdAt);
    final JSONArray columnsJson = json.optJSONArray("columns");
    if (columnsJson != null)
      for (int i = 0; i < columnsJson.length(); i++)
        source.columns.add(ColumnConfig.fromJSON(columnsJson.getJSONObject(i)));
    return source;
  }

  @Override
  public String toString() {
    return id + "(" + kind.getName() + ", rows=" + rowCount + ", chunks=" + chunkCount + ")";
  }
}
