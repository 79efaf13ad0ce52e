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

/**
 * Iterates the records of a store in key order, either on the primary key or on a secondary index. The cursor starts before the first
 * record: call {@link #next()} to move on the first one.
 */
public interface StoreCursor extends AutoCloseable {
  /**
   * Moves to the next record of the range.
   *
   * @return false when the range is exhausted
   */
  boolean next();

  /**
   * Key of the current position: the index key for index cursors, otherwise the primary key.
   */
  CompoundKey getKey();

  CompoundKey getPrimaryKey();

  /**
   * Loads the current record. The returned object is a copy, changing it does not change the store.
   */
  JSONObject getValue();

  /**
   * Deletes the current record. The cursor stays valid and {@link #next()} continues with the following record.
   */
  void delete();

  @Override
  void close();
}
