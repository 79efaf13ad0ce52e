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

import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity slice of a dataset's rows, the unit of storage and of streaming.
 */
public class DataChunk {
  private final DatasetScope scope;
  private final int          chunkIndex;
  private final List<Row>    rows;

  public DataChunk(final DatasetScope scope, final int chunkIndex, final List<Row> rows) {
    this.scope = scope;
    this.chunkIndex = chunkIndex;
    this.rows = Collections.unmodifiableList(rows);
  }

  public DatasetScope getScope() {
    return scope;
  }

  public int getChunkIndex() {
    return chunkIndex;
  }

  public List<Row> getRows() {
    return rows;
  }

  /**
   * Record stored in {@code data_chunks} or, for data sources, in {@code data_source_chunks}.
   */
  public JSONObject toRecord() {
    final JSONArray data = new JSONArray();
    for (final Row row : rows)
      data.put(row.toJSON());

    final JSONObject record = new JSONObject().put("projectId", scope.datasetId());
    if (scope.isSource())
      record.put("sourceId", scope.sourceId());
    return record.put("chunkIndex", chunkIndex).put("data", data);
  }

  public static DataChunk fromRecord(final JSONObject record) {
    final JSONArray data = record.getJSONArray("data");
    final List<Row> rows = new ArrayList<>(data.length());
    for (int i = 0; i < data.length(); i++)
      rows.add(Row.fromJSON(data.getJSONObject(i)));
    return new DataChunk(DatasetScope.of(record.getString("projectId"), record.optString("sourceId", null)), record.getInt("chunkIndex"),
        rows);
  }

  @Override
  public String toString() {
    return "DataChunk{" + scope + "#" + chunkIndex + ", rows=" + rows.size() + "}";
  }
}
