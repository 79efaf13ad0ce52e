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

import com.realdata.dataset.ColumnConfig;
import com.realdata.dataset.Row;
import com.realdata.engine.LocalStoreDriver;
import com.realdata.utility.FileUtils;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.io.File;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class of the tests that need a store: every test starts with an empty store under {@code target/databases/<test class>} and the
 * directory is removed at the end.
 */
public abstract class TestHelper {
  protected static final String   DATASET  = "sales";
  protected static final String[] REGIONS  = { "EU", "US", "APAC", "LATAM" };
  protected static final String[] CHANNELS = { "web", "store" };

  protected DatasetStore store;

  protected void beginTest() {
    // SUB CLASS CAN EXTEND THIS
  }

  protected void endTest() {
    // SUB CLASS CAN EXTEND THIS
  }

  @BeforeEach
  public void beforeTest() {
    FileUtils.deleteRecursively(new File(getDatabasePath()));
    store = createStore();
    beginTest();
  }

  @AfterEach
  public void afterTest() {
    endTest();
    if (store != null) {
      store.close();
      store = null;
    }
    FileUtils.deleteRecursively(new File(getDatabasePath()));
  }

  @AfterAll
  public static void endAllTests() {
    GlobalConfiguration.resetAll();
  }

  protected DatasetStore createStore() {
    return new DatasetStore(new LocalStoreDriver(getDatabasePath()), getConfiguration(), getClock());
  }

  protected ContextConfiguration getConfiguration() {
    return new ContextConfiguration();
  }

  protected Clock getClock() {
    return Clock.systemUTC();
  }

  protected void reopenStore() {
    store.close();
    store = createStore();
  }

  protected String getDatabasePath() {
    return "target/databases/" + getClass().getSimpleName();
  }

  protected void createDataset(final String datasetId) {
    store.createProject(datasetId, datasetId, List.of(//
        new ColumnConfig("id", ColumnConfig.Type.NUMBER),//
        new ColumnConfig("region", ColumnConfig.Type.STRING),//
        new ColumnConfig("channel", ColumnConfig.Type.CHANNEL),//
        new ColumnConfig("amount", ColumnConfig.Type.NUMBER)));
  }

  /**
   * Rows with a sequential id starting from {@code firstId}, region cycling on {@link #REGIONS}, channel on {@link #CHANNELS} and amount
   * equal to {@code id % 10}.
   */
  public static List<Row> createRows(final int firstId, final int count) {
    final List<Row> rows = new ArrayList<>(count);
    for (int i = firstId; i < firstId + count; i++)
      rows.add(Row.of("id", i, "region", REGIONS[i % REGIONS.length], "channel", CHANNELS[i % CHANNELS.length], "amount", i % 10));
    return rows;
  }

  public static List<Row> createRows(final int count) {
    return createRows(0, count);
  }
}
