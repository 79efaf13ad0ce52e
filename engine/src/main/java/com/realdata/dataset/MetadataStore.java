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

import com.realdata.engine.CompoundKey;
import com.realdata.engine.KeyRange;
import com.realdata.engine.ObjectStore;
import com.realdata.engine.StoreCursor;
import com.realdata.schema.StoreSchemaManager;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads and writes the {@link ProjectMetadata} records of the {@code projects} store.
 */
public class MetadataStore {
  private final StoreSchemaManager schema;
  private final Clock              clock;

  public MetadataStore(final StoreSchemaManager schema, final Clock clock) {
    this.schema = schema;
    this.clock = clock;
  }

  /**
   * @return the metadata or null if the dataset does not exist
   */
  public ProjectMetadata get(final String datasetId) {
    final var record = store().get(CompoundKey.of(datasetId));
    return record != null ? ProjectMetadata.fromJSON(record) : null;
  }

  public boolean exists(final String datasetId) {
    return get(datasetId) != null;
  }

  /**
   * Returns all the datasets, the most recently modified first.
   */
  public List<ProjectMetadata> list() {
    final List<ProjectMetadata> result = new ArrayList<>();
    try (final StoreCursor cursor = store().openCursor(StoreSchemaManager.INDEX_LAST_MODIFIED, KeyRange.all())) {
      while (cursor.next()) {
        final var record = cursor.getValue();
        if (record != null)
          result.add(ProjectMetadata.fromJSON(record));
      }
    }
    Collections.reverse(result);
    return result;
  }

  Clock getClock() {
    return clock;
  }

  public long count() {
    return store().count();
  }

  /**
   * Saves the metadata as is, stamping the modification time. Used by the chunk manager that owns the counters.
   */
  void put(final ProjectMetadata metadata) {
    metadata.setLastModified(clock.millis());
    store().put(metadata.toJSON());
  }

  /**
   * Saves the descriptive fields of the metadata, keeping the row and chunk counters and the generation currently stored.
   *
   * @return the saved metadata
   */
  public ProjectMetadata save(final ProjectMetadata metadata) {
    final ProjectMetadata toSave = metadata.copy();
    final ProjectMetadata stored = get(metadata.getId());
    toSave.copyCountersFrom(stored != null ? stored : new ProjectMetadata(metadata.getId(), metadata.getName()));
    put(toSave);
    return toSave;
  }

  public boolean delete(final String datasetId) {
    return store().delete(CompoundKey.of(datasetId));
  }

  private ObjectStore store() {
    return schema.getStore(StoreSchemaManager.STORE_PROJECTS);
  }
}
