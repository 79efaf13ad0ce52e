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
package com.realdata.cache;

import com.realdata.engine.CompoundKey;
import com.realdata.engine.KeyRange;
import com.realdata.engine.ObjectStore;
import com.realdata.log.LogManager;
import com.realdata.schema.StoreSchemaManager;
import com.realdata.serializer.json.JSONObject;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

/**
 * Persistent cache of query results, scoped per dataset. Entries expire {@code ttl} milliseconds after they are written: an expired
 * entry is a miss and stays on disk until {@link #evictExpired()} or {@link #clear(String)} removes it.
 * <p>
 * Values are JSON objects, arrays or scalars.
 */
public class QueryCache {
  private final StoreSchemaManager schema;
  private final long               ttl;
  private final Clock              clock;
  private final AtomicLong         hits   = new AtomicLong();
  private final AtomicLong         misses = new AtomicLong();

  public QueryCache(final StoreSchemaManager schema, final long ttl, final Clock clock) {
    this.schema = schema;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * @return the cached value or null if absent or expired
   */
  public Object get(final String datasetId, final String cacheKey) {
    final JSONObject entry = store().get(CompoundKey.of(datasetId, cacheKey));
    if (entry != null && clock.millis() < entry.getLong("expiry")) {
      hits.incrementAndGet();
      LogManager.instance().log(this, Level.FINE, "Cache hit for dataset '%s'", datasetId);
      return entry.opt("result");
    }

    misses.incrementAndGet();
    LogManager.instance().log(this, Level.FINE, "Cache miss for dataset '%s'%s", datasetId, entry != null ? " (expired)" : "");
    return null;
  }

  public void set(final String datasetId, final String cacheKey, final Object value) {
    final long expiry = clock.millis() + ttl;
    store().put(new JSONObject().put("projectId", datasetId).put("cacheKey", cacheKey).put("result", value).put("expiry", expiry));
  }

  /**
   * Removes all the entries of the dataset.
   *
   * @return the number of removed entries
   */
  public int clear(final String datasetId) {
    final int removed = store().deleteAll(null, KeyRange.prefix(datasetId));
    if (removed > 0)
      LogManager.instance().log(this, Level.FINE, "Cleared %d cache entries of dataset '%s'", removed, datasetId);
    return removed;
  }

  /**
   * Removes the expired entries of all the datasets.
   *
   * @return the number of removed entries
   */
  public int evictExpired() {
    final int removed = store().deleteAll(StoreSchemaManager.INDEX_EXPIRY, KeyRange.upperBound(CompoundKey.of(clock.millis()), false));
    if (removed > 0)
      LogManager.instance().log(this, Level.FINE, "Evicted %d expired cache entries", removed);
    return removed;
  }

  public long size() {
    return store().count();
  }

  public long getTTL() {
    return ttl;
  }

  public long getHits() {
    return hits.get();
  }

  public long getMisses() {
    return misses.get();
  }

  private ObjectStore store() {
    return schema.getStore(StoreSchemaManager.STORE_CACHE);
  }
}
