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
import com.realdata.exception.StoreUnavailableException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Volatile driver, content is lost when the driver is dropped. Closing and reopening keeps the content, like a local driver does.
 */
public class InMemoryStoreDriver implements StoreDriver {
  private final    Map<String, InMemoryObjectStore> stores = Collections.synchronizedMap(new LinkedHashMap<>());
  private volatile int                              version;
  private volatile boolean                          open;

  @Override
  public void open() {
    open = true;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public int getVersion() {
    return version;
  }

  @Override
  public void setVersion(final int version) {
    checkOpen();
    this.version = version;
  }

  @Override
  public boolean hasStore(final String name) {
    return stores.containsKey(name);
  }

  @Override
  public Set<String> getStoreNames() {
    synchronized (stores) {
      return new LinkedHashSet<>(stores.keySet());
    }
  }

  @Override
  public ObjectStore createStore(final StoreDefinition definition) {
    checkOpen();
    synchronized (stores) {
      if (stores.containsKey(definition.getName()))
        throw new StorageException("Store '" + definition.getName() + "' already exists");
      final InMemoryObjectStore store = new InMemoryObjectStore(definition);
      stores.put(definition.getName(), store);
      return store;
    }
  }

  @Override
  public ObjectStore getStore(final String name) {
    checkOpen();
    final ObjectStore store = stores.get(name);
    if (store == null)
      throw new StorageException("Store '" + name + "' not found");
    return store;
  }

  @Override
  public void close() {
    open = false;
  }

  @Override
  public void drop() {
    close();
    stores.clear();
    version = 0;
  }

  private void checkOpen() {
    if (!open)
      throw new StoreUnavailableException("Store driver is not open");
  }
}
