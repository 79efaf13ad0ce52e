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
package com.realdata;

import com.realdata.engine.CompoundKey;
import com.realdata.engine.InMemoryStoreDriver;
import com.realdata.engine.KeyRange;
import com.realdata.engine.ObjectStore;
import com.realdata.engine.StoreCursor;
import com.realdata.engine.StoreDefinition;
import com.realdata.engine.StoreDriver;
import com.realdata.exception.StorageException;
import com.realdata.serializer.json.JSONObject;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory driver that injects failures and hooks on a chosen store, to test what happens when a write aborts or when a write runs
 * during a scan.
 */
public class FaultyStoreDriver implements StoreDriver {
  private final    InMemoryStoreDriver delegate          = new InMemoryStoreDriver();
  private final    AtomicInteger       putsBeforeFailure = new AtomicInteger(-1);
  private volatile String              faultyStore;
  private volatile Runnable            onGet;
  private volatile boolean             inHook;

  /**
   * Makes the puts on the store fail after {@code successfulPuts} more puts succeeded. A negative number disables the failure.
   */
  public void failPutsAfter(final String storeName, final int successfulPuts) {
    this.faultyStore = storeName;
    this.putsBeforeFailure.set(successfulPuts);
  }

  public void heal() {
    putsBeforeFailure.set(-1);
  }

  /**
   * Runs the hook on every get of the store. The hook is not re-entered by the gets it executes itself.
   */
  public void onGet(final String storeName, final Runnable hook) {
    this.faultyStore = storeName;
    this.onGet = hook;
  }

  @Override
  public void open() {
    delegate.open();
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public int getVersion() {
    return delegate.getVersion();
  }

  @Override
  public void setVersion(final int version) {
    delegate.setVersion(version);
  }

  @Override
  public boolean hasStore(final String name) {
    return delegate.hasStore(name);
  }

  @Override
  public Set<String> getStoreNames() {
    return delegate.getStoreNames();
  }

  @Override
  public ObjectStore createStore(final StoreDefinition definition) {
    return delegate.createStore(definition);
  }

  @Override
  public ObjectStore getStore(final String name) {
    final ObjectStore store = delegate.getStore(name);
    return name.equals(faultyStore) ? new FaultyObjectStore(store) : store;
  }

  @Override
  public void close() {
    delegate.close();
  }

  @Override
  public void drop() {
    delegate.drop();
  }

  private class FaultyObjectStore implements ObjectStore {
    private final ObjectStore store;

    private FaultyObjectStore(final ObjectStore store) {
      this.store = store;
    }

    @Override
    public String getName() {
      return store.getName();
    }

    @Override
    public StoreDefinition getDefinition() {
      return store.getDefinition();
    }

    @Override
    public JSONObject get(final CompoundKey key) {
      final Runnable hook = onGet;
      if (hook != null && !inHook) {
        inHook = true;
        try {
          hook.run();
        } finally {
          inHook = false;
        }
      }
      return store.get(key);
    }

    @Override
    public void put(final JSONObject record) {
      if (putsBeforeFailure.get() == 0)
        throw new StorageException("Simulated write failure on store '" + getName() + "'");
      if (putsBeforeFailure.get() > 0)
        putsBeforeFailure.decrementAndGet();
      store.put(record);
    }

    @Override
    public boolean delete(final CompoundKey key) {
      return store.delete(key);
    }

    @Override
    public long count() {
      return store.count();
    }

    @Override
    public StoreCursor openCursor(final KeyRange range) {
      return store.openCursor(range);
    }

    @Override
    public StoreCursor openCursor(final String indexName, final KeyRange range) {
      return store.openCursor(indexName, range);
    }
  }
}
