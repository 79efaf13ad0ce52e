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

import java.util.Set;

/**
 * Embedded, key-ordered persistence substrate hosting the logical stores. A driver is opened once, then stores are created or retrieved
 * by name. The schema version is kept by the driver and only ever raised by the schema manager.
 */
public interface StoreDriver extends AutoCloseable {
  /**
   * @throws com.realdata.exception.StoreUnavailableException if the substrate cannot be opened
   */
  void open();

  boolean isOpen();

  int getVersion();

  void setVersion(int version);

  boolean hasStore(String name);

  Set<String> getStoreNames();

  /**
   * Creates a new store. The caller checks {@link #hasStore(String)} first: creating a store that exists is an error.
   */
  ObjectStore createStore(StoreDefinition definition);

  /**
   * @throws com.realdata.exception.StorageException if the store does not exist
   */
  ObjectStore getStore(String name);

  @Override
  void close();

  /**
   * Closes the driver and removes all of its content.
   */
  void drop();
}
