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

import java.util.concurrent.ConcurrentHashMap;

/**
 * Store keeping the records on heap. Records are copied on the way in and on the way out.
 */
public class InMemoryObjectStore extends AbstractObjectStore {
  private final ConcurrentHashMap<CompoundKey, JSONObject> records = new ConcurrentHashMap<>();

  public InMemoryObjectStore(final StoreDefinition definition) {
    super(definition);
  }

  @Override
  protected JSONObject loadRecord(final CompoundKey primaryKey) {
    final JSONObject record = records.get(primaryKey);
    return record != null ? record.copy() : null;
  }

  @Override
  protected void saveRecord(final CompoundKey primaryKey, final CompoundKey[] indexKeys, final JSONObject record) {
    records.put(primaryKey, record.copy());
  }

  @Override
  protected void removeRecord(final CompoundKey primaryKey) {
    records.remove(primaryKey);
  }
}
