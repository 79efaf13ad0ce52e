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
package com.realdata.engine;

import com.realdata.serializer.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * A logical store of JSON records, ordered by the primary key declared in its {@link StoreDefinition}. Operations on one store are
 * serialized, operations on different stores are not coordinated.
 */
public interface ObjectStore {
  String getName();

  StoreDefinition getDefinition();

  /**
   * @return a copy of the record with the given primary key or null if not found
   */
  JSONObject get(CompoundKey key);

  /**
   * Inserts or replaces the record. The primary key is extracted from the record through the key path.
   */
  void put(JSONObject record);

  /**
   * @return true if the record existed
   */
  boolean delete(CompoundKey key);

  long count();

  StoreCursor openCursor(KeyRange range);

  StoreCursor openCursor(String indexName, KeyRange range);

  default List<JSONObject> getAll(final String indexName, final KeyRange range) {
    final List<JSONObject> result = new ArrayList<>();
    try (final StoreCursor cursor = indexName != null ? openCursor(indexName, range) : openCursor(range)) {
      while (cursor.next())
        result.add(cursor.getValue());
    }
    return result;
  }

  /**
   * Deletes every record in the range, draining the cursor to the end.
   *
   * @return the number of deleted records, 0 included
   */
  default int deleteAll(final String indexName, final KeyRange range) {
    int deleted = 0;
    try (final StoreCursor cursor = indexName != null ? openCursor(indexName, range) : openCursor(range)) {
      while (cursor.next()) {
        cursor.delete();
        ++deleted;
      }
    }
    return deleted;
  }
}
