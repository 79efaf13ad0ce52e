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
package com.realdata.schema;

import com.realdata.engine.ObjectStore;
import com.realdata.engine.StoreDefinition;
import com.realdata.engine.StoreDriver;
import com.realdata.exception.StoreUnavailableException;
import com.realdata.log.LogManager;

import java.util.List;
import java.util.logging.Level;

/**
 * Owns the store driver: opens it lazily on first use, creates the missing stores and raises the schema version. Upgrades are additive
 * and idempotent, existing stores and their content are never touched.
 * <p>
 * Stores of schema version {@value #SCHEMA_VERSION}:
 * <ul>
 *   <li>{@value #STORE_PROJECTS}: project metadata keyed by id, indexed by last modification</li>
 *   <li>{@value #STORE_DATA_CHUNKS}: primary dataset chunks keyed by (projectId, chunkIndex)</li>
 *   <li>{@value #STORE_DATA_SOURCE_CHUNKS}: sub-dataset chunks keyed by (projectId, sourceId, chunkIndex)</li>
 *   <li>{@value #STORE_CACHE}: cached query results keyed by (projectId, cacheKey), indexed by expiry</li>
 * </ul>
 */
public class StoreSchemaManager implements AutoCloseable {
  public static final int SCHEMA_VERSION = 3;

  public static final String STORE_PROJECTS           = "projects";
  public static final String STORE_DATA_CHUNKS        = "data_chunks";
  public static final String STORE_DATA_SOURCE_CHUNKS = "data_source_chunks";
  public static final String STORE_CACHE              = "cache";

  public static final String INDEX_PROJECT_ID        = "projectId";
  public static final String INDEX_PROJECT_SOURCE_ID = "projectId_sourceId";
  public static final String INDEX_LAST_MODIFIED     = "lastModified";
  public static final String INDEX_EXPIRY            = "expiry";

  private static final List<StoreDefinition> STORES = List.of(//
      StoreDefinition.builder(STORE_PROJECTS).keyPath("id")//
          .index(INDEX_LAST_MODIFIED, "lastModified").build(),//
      StoreDefinition.builder(STORE_DATA_CHUNKS).keyPath("projectId", "chunkIndex")//
          .index(INDEX_PROJECT_ID, "projectId").build(),//
      StoreDefinition.builder(STORE_CACHE).keyPath("projectId", "cacheKey")//
          .index(INDEX_EXPIRY, "expiry").build(),//
      StoreDefinition.builder(STORE_DATA_SOURCE_CHUNKS).keyPath("projectId", "sourceId", "chunkIndex")//
          .index(INDEX_PROJECT_ID, "projectId")//
          .index(INDEX_PROJECT_SOURCE_ID, "projectId", "sourceId").build());

  private final    StoreDriver driver;
  private volatile boolean     initialized;

  public StoreSchemaManager(final StoreDriver driver) {
    this.driver = driver;
  }

  public static List<StoreDefinition> getStoreDefinitions() {
    return STORES;
  }

  /**
   * Returns the open driver, opening and upgrading it on first call.
   *
   * @throws StoreUnavailableException if the driver cannot be opened or the stored schema is newer than this version supports
   */
  public StoreDriver getDriver() {
    if (!initialized)
      initialize();
    return driver;
  }

  public ObjectStore getStore(final String name) {
    return getDriver().getStore(name);
  }

  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public synchronized void close() {
    if (initialized) {
      initialized = false;
      driver.close();
    }
  }

  private synchronized void initialize() {
    if (initialized)
      return;

    try {
      driver.open();
    } catch (final StoreUnavailableException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new StoreUnavailableException("Cannot open the persistence substrate", e);
    }

    try {
      upgrade();
    } catch (final RuntimeException e) {
      driver.close();
      if (e instanceof StoreUnavailableException)
        throw e;
      throw new StoreUnavailableException("Cannot upgrade the store schema to version " + SCHEMA_VERSION, e);
    }

    initialized = true;
  }

  private void upgrade() {
    final int current = driver.getVersion();
    if (current > SCHEMA_VERSION)
      throw new StoreUnavailableException(
          "Stored schema version " + current + " is newer than the supported version " + SCHEMA_VERSION + ", upgrade the library");

    for (final StoreDefinition definition : STORES)
      if (!driver.hasStore(definition.getName())) {
        driver.createStore(definition);
        LogManager.instance().log(this, Level.INFO, "Created store '%s'", definition.getName());
      }

    if (current < SCHEMA_VERSION) {
      driver.setVersion(SCHEMA_VERSION);
      if (current > 0)
        LogManager.instance().log(this, Level.INFO, "Upgraded store schema from version %d to %d", current, SCHEMA_VERSION);
    }
  }
}
