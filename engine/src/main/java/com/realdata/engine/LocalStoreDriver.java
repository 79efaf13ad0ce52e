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

import com.realdata.GlobalConfiguration;
import com.realdata.compression.CompressionFactory;
import com.realdata.exception.ErrorCode;
import com.realdata.exception.StorageException;
import com.realdata.exception.StoreUnavailableException;
import com.realdata.log.LogManager;
import com.realdata.serializer.json.JSONArray;
import com.realdata.serializer.json.JSONObject;
import com.realdata.utility.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;

/**
 * Driver persisting the stores under a local directory. Each store has its own sub directory, the store definitions and the schema
 * version are kept in the {@value #MANIFEST_FILE} manifest. The directory is locked exclusively while the driver is open: a second
 * driver on the same directory, in this or another process, fails with {@link StoreUnavailableException}.
 */
public class LocalStoreDriver implements StoreDriver {
  public static final String MANIFEST_FILE = "schema.json";
  public static final String LOCK_FILE     = "store.lck";

  private final    Path                          path;
  private final    byte                          codecId;
  private final    Map<String, LocalObjectStore> stores = new LinkedHashMap<>();
  private volatile int                           version;
  private          FileChannel                   lockChannel;
  private          FileLock                      lock;
  private volatile boolean                       open;

  public LocalStoreDriver(final String path) {
    this(path, GlobalConfiguration.STORE_COMPRESSION.getValueAsString());
  }

  public LocalStoreDriver(final String path, final String compression) {
    this.path = Paths.get(path).toAbsolutePath().normalize();
    this.codecId = CompressionFactory.getId(compression);
  }

  @Override
  public synchronized void open() {
    if (open)
      return;

    try {
      Files.createDirectories(path);
    } catch (final IOException e) {
      throw new StoreUnavailableException("Cannot create the store directory '" + path + "'", e);
    }

    lockDirectory();

    try {
      readManifest();
      for (final LocalObjectStore store : stores.values())
        store.load();
    } catch (final IOException | RuntimeException e) {
      stores.clear();
      releaseLock();
      if (e instanceof StoreUnavailableException)
        throw (StoreUnavailableException) e;
      throw new StoreUnavailableException("Cannot open the stores under '" + path + "'", e);
    }

    open = true;
    LogManager.instance().log(this, Level.FINE, "Opened store directory '%s' (version=%d stores=%s)", path, version, stores.keySet());
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  public Path getPath() {
    return path;
  }

  @Override
  public int getVersion() {
    return version;
  }

  @Override
  public synchronized void setVersion(final int version) {
    checkOpen();
    this.version = version;
    writeManifest();
  }

  @Override
  public synchronized boolean hasStore(final String name) {
    return stores.containsKey(name);
  }

  @Override
  public synchronized Set<String> getStoreNames() {
    return new LinkedHashSet<>(stores.keySet());
  }

  @Override
  public synchronized ObjectStore createStore(final StoreDefinition definition) {
    checkOpen();
    if (stores.containsKey(definition.getName()))
      throw new StorageException("Store '" + definition.getName() + "' already exists");

    final LocalObjectStore store = new LocalObjectStore(path.resolve(definition.getName()), definition, codecId);
    try {
      store.load();
    } catch (final IOException e) {
      throw new StorageException(ErrorCode.IO_ERROR, "Cannot create store '" + definition.getName() + "'", e);
    }
    stores.put(definition.getName(), store);
    writeManifest();
    return store;
  }

  @Override
  public synchronized ObjectStore getStore(final String name) {
    checkOpen();
    final ObjectStore store = stores.get(name);
    if (store == null)
      throw new StorageException("Store '" + name + "' not found");
    return store;
  }

  @Override
  public synchronized void close() {
    if (!open)
      return;
    open = false;
    stores.clear();
    releaseLock();
    LogManager.instance().log(this, Level.FINE, "Closed store directory '%s'", path);
  }

  @Override
  public synchronized void drop() {
    close();
    FileUtils.deleteRecursively(path.toFile());
    version = 0;
  }

  private void lockDirectory() {
    try {
      lockChannel = FileChannel.open(path.resolve(LOCK_FILE), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      lock = lockChannel.tryLock();
    } catch (final OverlappingFileLockException e) {
      lock = null;
    } catch (final IOException e) {
      releaseLock();
      throw new StoreUnavailableException("Cannot lock the store directory '" + path + "'", e);
    }

    if (lock == null) {
      releaseLock();
      throw new StoreUnavailableException("Store directory '" + path + "' is in use by another process or instance");
    }
  }

  private void releaseLock() {
    try {
      if (lock != null)
        lock.release();
      if (lockChannel != null)
        lockChannel.close();
    } catch (final IOException e) {
      LogManager.instance().log(this, Level.WARNING, "Error releasing the lock of store directory '%s'", e, path);
    } finally {
      lock = null;
      lockChannel = null;
    }
  }

  private void readManifest() throws IOException {
    stores.clear();
    version = 0;

    final File manifest = path.resolve(MANIFEST_FILE).toFile();
    if (!manifest.exists())
      return;

    final JSONObject json = new JSONObject(Files.readString(manifest.toPath(), StandardCharsets.UTF_8));
    version = json.getInt("version");
    final JSONArray definitions = json.getJSONArray("stores");
    for (int i = 0; i < definitions.length(); i++) {
      final StoreDefinition definition = StoreDefinition.fromJSON(definitions.getJSONObject(i));
      stores.put(definition.getName(), new LocalObjectStore(path.resolve(definition.getName()), definition, codecId));
    }
  }

  private void writeManifest() {
    final JSONArray definitions = new JSONArray();
    for (final LocalObjectStore store : stores.values())
      definitions.put(store.getDefinition().toJSON());

    final JSONObject manifest = new JSONObject().put("version", version).put("stores", definitions);
    try {
      FileUtils.writeContentAtomically(path.resolve(MANIFEST_FILE), manifest.toString(2).getBytes(StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new StorageException(ErrorCode.IO_ERROR, "Cannot write the manifest of store directory '" + path + "'", e);
    }
  }

  private void checkOpen() {
    if (!open)
      throw new StoreUnavailableException("Store directory '" + path + "' is not open");
  }
}
