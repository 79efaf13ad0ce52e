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

import com.realdata.exception.StorageException;
import com.realdata.serializer.json.JSONObject;
import com.realdata.utility.RWLockContext;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Base store keeping the primary key and the secondary indexes in memory, while the records are loaded and saved by the subclass.
 * Reads run in the shared lock, writes in the exclusive lock, so the operations on one store are serialized. Cursors are weakly
 * consistent: they acquire the lock on every step and tolerate deletions during the scan.
 */
public abstract class AbstractObjectStore extends RWLockContext implements ObjectStore {
  protected final StoreDefinition                                                                  definition;
  // PRIMARY KEY -> INDEX KEYS IN THE ORDER OF THE DEFINITION'S INDEXES, NULL WHEN THE RECORD IS NOT INDEXED
  protected final ConcurrentSkipListMap<CompoundKey, CompoundKey[]>                               primaryIndex = new ConcurrentSkipListMap<>();
  protected final Map<String, ConcurrentSkipListMap<CompoundKey, ConcurrentSkipListSet<CompoundKey>>> secondaryIndexes;
  private final   List<String>                                                                     indexNames;

  protected AbstractObjectStore(final StoreDefinition definition) {
    this.definition = definition;
    this.indexNames = definition.getIndexNames();
    final Map<String, ConcurrentSkipListMap<CompoundKey, ConcurrentSkipListSet<CompoundKey>>> indexes = new LinkedHashMap<>();
    for (final String indexName : indexNames)
      indexes.put(indexName, new ConcurrentSkipListMap<>());
    this.secondaryIndexes = Collections.unmodifiableMap(indexes);
  }

  protected abstract JSONObject loadRecord(CompoundKey primaryKey);

  protected abstract void saveRecord(CompoundKey primaryKey, CompoundKey[] indexKeys, JSONObject record);

  protected abstract void removeRecord(CompoundKey primaryKey);

  @Override
  public String getName() {
    return definition.getName();
  }

  @Override
  public StoreDefinition getDefinition() {
    return definition;
  }

  @Override
  public JSONObject get(final CompoundKey key) {
    return executeInReadLock(() -> primaryIndex.containsKey(key) ? loadRecord(key) : null);
  }

  @Override
  public void put(final JSONObject record) {
    if (record == null)
      throw new StorageException("Cannot store a null record in store '" + getName() + "'");

    final CompoundKey primaryKey = definition.extractKey(record);
    final CompoundKey[] indexKeys = extractIndexKeys(record);

    executeInWriteLock(() -> {
      saveRecord(primaryKey, indexKeys, record);
      final CompoundKey[] previous = primaryIndex.put(primaryKey, indexKeys);
      if (previous != null)
        unindex(primaryKey, previous);
      index(primaryKey, indexKeys);
      return null;
    });
  }

  @Override
  public boolean delete(final CompoundKey key) {
    return executeInWriteLock(() -> {
      final CompoundKey[] previous = primaryIndex.get(key);
      if (previous == null)
        return false;
      removeRecord(key);
      primaryIndex.remove(key);
      unindex(key, previous);
      return true;
    });
  }

  @Override
  public long count() {
    return primaryIndex.size();
  }

  @Override
  public StoreCursor openCursor(final KeyRange range) {
    final Iterator<CompoundKey> keys = subMap(primaryIndex, range).keySet().iterator();
    return new IndexedCursor(range) {
      @Override
      protected boolean advance() {
        while (keys.hasNext()) {
          final CompoundKey key = keys.next();
          if (range.isPast(key))
            return false;
          if (range.includes(key) && primaryIndex.containsKey(key)) {
            currentKey = key;
            currentPrimaryKey = key;
            return true;
          }
        }
        return false;
      }
    };
  }

  @Override
  public StoreCursor openCursor(final String indexName, final KeyRange range) {
    final ConcurrentSkipListMap<CompoundKey, ConcurrentSkipListSet<CompoundKey>> index = secondaryIndexes.get(indexName);
    if (index == null)
      throw new StorageException("Index '" + indexName + "' not found in store '" + getName() + "'");

    final Iterator<Map.Entry<CompoundKey, ConcurrentSkipListSet<CompoundKey>>> entries = subMap(index, range).entrySet().iterator();
    return new IndexedCursor(range) {
      private Iterator<CompoundKey> primaryKeys = Collections.emptyIterator();

      @Override
      protected boolean advance() {
        while (true) {
          while (primaryKeys.hasNext()) {
            final CompoundKey primaryKey = primaryKeys.next();
            if (primaryIndex.containsKey(primaryKey)) {
              currentPrimaryKey = primaryKey;
              return true;
            }
          }

          if (!entries.hasNext())
            return false;

          final Map.Entry<CompoundKey, ConcurrentSkipListSet<CompoundKey>> entry = entries.next();
          if (range.isPast(entry.getKey()))
            return false;
          if (range.includes(entry.getKey())) {
            currentKey = entry.getKey();
            primaryKeys = entry.getValue().iterator();
          }
        }
      }
    };
  }

  protected CompoundKey[] extractIndexKeys(final JSONObject record) {
    final CompoundKey[] keys = new CompoundKey[indexNames.size()];
    for (int i = 0; i < keys.length; i++)
      keys[i] = definition.extractIndexKey(indexNames.get(i), record);
    return keys;
  }

  /**
   * Registers an existing record without saving it, used by subclasses when rebuilding the indexes at open.
   */
  protected void register(final CompoundKey primaryKey, final CompoundKey[] indexKeys) {
    primaryIndex.put(primaryKey, indexKeys);
    index(primaryKey, indexKeys);
  }

  protected void clearIndexes() {
    primaryIndex.clear();
    for (final ConcurrentSkipListMap<CompoundKey, ConcurrentSkipListSet<CompoundKey>> index : secondaryIndexes.values())
      index.clear();
  }

  private void index(final CompoundKey primaryKey, final CompoundKey[] indexKeys) {
    for (int i = 0; i < indexKeys.length; i++)
      if (indexKeys[i] != null)
        secondaryIndexes.get(indexNames.get(i)).computeIfAbsent(indexKeys[i], k -> new ConcurrentSkipListSet<>()).add(primaryKey);
  }

  private void unindex(final CompoundKey primaryKey, final CompoundKey[] indexKeys) {
    for (int i = 0; i < indexKeys.length; i++) {
      if (indexKeys[i] == null)
        continue;
      final ConcurrentSkipListMap<CompoundKey, ConcurrentSkipListSet<CompoundKey>> index = secondaryIndexes.get(indexNames.get(i));
      final ConcurrentSkipListSet<CompoundKey> primaryKeys = index.get(indexKeys[i]);
      if (primaryKeys != null) {
        primaryKeys.remove(primaryKey);
        if (primaryKeys.isEmpty())
          index.remove(indexKeys[i], primaryKeys);
      }
    }
  }

  private static <V> NavigableMap<CompoundKey, V> subMap(final ConcurrentSkipListMap<CompoundKey, V> map, final KeyRange range) {
    final CompoundKey lower = range.getLower();
    return lower == null ? map : map.tailMap(lower, !range.isLowerOpen());
  }

  private abstract class IndexedCursor implements StoreCursor {
    protected final KeyRange    range;
    protected       CompoundKey currentKey;
    protected       CompoundKey currentPrimaryKey;
    private         boolean     closed;

    protected IndexedCursor(final KeyRange range) {
      this.range = range;
    }

    protected abstract boolean advance();

    @Override
    public boolean next() {
      if (closed)
        return false;
      final boolean found = executeInReadLock(this::advance);
      if (!found) {
        currentKey = null;
        currentPrimaryKey = null;
      }
      return found;
    }

    @Override
    public CompoundKey getKey() {
      checkPosition();
      return currentKey;
    }

    @Override
    public CompoundKey getPrimaryKey() {
      checkPosition();
      return currentPrimaryKey;
    }

    @Override
    public JSONObject getValue() {
      checkPosition();
      return AbstractObjectStore.this.get(currentPrimaryKey);
    }

    @Override
    public void delete() {
      checkPosition();
      AbstractObjectStore.this.delete(currentPrimaryKey);
    }

    @Override
    public void close() {
      closed = true;
    }

    private void checkPosition() {
      if (currentPrimaryKey == null)
        throw new NoSuchElementException("Cursor on store '" + getName() + "' is not positioned on a record");
    }
  }
}
