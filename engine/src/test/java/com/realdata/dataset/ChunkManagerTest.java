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

import com.realdata.ContextConfiguration;
import com.realdata.DatasetStore;
import com.realdata.FaultyStoreDriver;
import com.realdata.GlobalConfiguration;
import com.realdata.TestHelper;
import com.realdata.exception.ConfigurationException;
import com.realdata.exception.DatasetNotFoundException;
import com.realdata.exception.PartialWriteException;
import com.realdata.schema.StoreSchemaManager;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkManagerTest extends TestHelper {
  private static final int CHUNK_SIZE = 1000;

  private int configuredChunkSize = CHUNK_SIZE;

  @Override
  protected void beginTest() {
    createDataset(DATASET);
  }

  @Override
  protected ContextConfiguration getConfiguration() {
    return new ContextConfiguration().setValue(GlobalConfiguration.CHUNK_SIZE, configuredChunkSize);
  }

  @Test
  void batchInsertSplitsInChunks() {
    store.batchInsert(DATASET, createRows(2500));

    final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getRowCount()).isEqualTo(2500);
    assertThat(metadata.getChunkCount()).isEqualTo(3);
    assertThat(store.getChunk(DATASET, 0)).hasSize(CHUNK_SIZE);
    assertThat(store.getChunk(DATASET, 2)).hasSize(500);
    assertThat(store.getChunk(DATASET, 3)).isEmpty();
  }

  @Test
  void allChunksReturnTheRowsInOrder() {
    final List<Row> rows = createRows(2500);
    store.batchInsert(DATASET, rows);

    assertThat(store.getAllChunks(DATASET)).isEqualTo(rows);
  }

  @Test
  void batchInsertReplacesThePreviousRows() {
    store.batchInsert(DATASET, createRows(3500));
    store.batchInsert(DATASET, createRows(100, 1200));

    final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getRowCount()).isEqualTo(1200);
    assertThat(metadata.getChunkCount()).isEqualTo(2);
    assertThat(store.getChunk(DATASET, 2)).isEmpty();
    assertThat(store.getChunk(DATASET, 3)).isEmpty();
    assertThat(store.getAllChunks(DATASET)).isEqualTo(createRows(100, 1200));
  }

  @Test
  void emptyBatchLeavesAnEmptyDataset() {
    store.batchInsert(DATASET, createRows(10));
    store.batchInsert(DATASET, List.of());

    final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getRowCount()).isZero();
    assertThat(metadata.getChunkCount()).isZero();
    assertThat(store.getAllChunks(DATASET)).isEmpty();
  }

  @Test
  void batchInsertReportsProgress() {
    final List<Integer> progress = new ArrayList<>();
    store.batchInsert(DATASET, createRows(3000), progress::add);
    assertThat(progress).containsExactly(33, 67, 100);
  }

  @Test
  void batchInsertRequiresTheDataset() {
    assertThatThrownBy(() -> store.batchInsert("missing", createRows(10))).isInstanceOf(DatasetNotFoundException.class);
    assertThatThrownBy(() -> store.append("missing", createRows(10))).isInstanceOf(DatasetNotFoundException.class);
  }

  @Test
  void appendFillsThePartialLastChunk() {
    store.batchInsert(DATASET, createRows(2500));
    final long rowCount = store.append(DATASET, createRows(2500, 500));

    final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(rowCount).isEqualTo(3000);
    assertThat(metadata.getRowCount()).isEqualTo(3000);
    assertThat(metadata.getChunkCount()).isEqualTo(3);
    assertThat(store.getChunk(DATASET, 2)).hasSize(CHUNK_SIZE);
    assertThat(store.getAllChunks(DATASET)).isEqualTo(createRows(3000));
  }

  @Test
  void appendAddsNewChunksAfterTheLastOne() {
    store.batchInsert(DATASET, createRows(1700));
    store.append(DATASET, createRows(1700, 2800));

    final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getRowCount()).isEqualTo(4500);
    assertThat(metadata.getChunkCount()).isEqualTo(5);
    assertThat(store.getChunk(DATASET, 4)).hasSize(500);
    assertThat(store.getAllChunks(DATASET)).isEqualTo(createRows(4500));
  }

  @Test
  void appendToEmptyDataset() {
    assertThat(store.append(DATASET, createRows(1000))).isEqualTo(1000);
    assertThat(store.getProjectMetadata(DATASET).getChunkCount()).isEqualTo(1);

    assertThat(store.append(DATASET, createRows(1000, 1))).isEqualTo(1001);
    assertThat(store.getProjectMetadata(DATASET).getChunkCount()).isEqualTo(2);
  }

  @Test
  void appendingNothingChangesNothing() {
    store.batchInsert(DATASET, createRows(10));
    final long generation = store.getProjectMetadata(DATASET).getGeneration();

    assertThat(store.append(DATASET, List.of())).isEqualTo(10);
    assertThat(store.getProjectMetadata(DATASET).getGeneration()).isEqualTo(generation);
  }

  @Test
  void chunkInvariantHoldsAfterEveryWrite() {
    final int[] batches = { 1, 999, 1, 1000, 2345, 7, 0, 3000 };
    int expected = 0;
    for (final int batch : batches) {
      store.append(DATASET, createRows(expected, batch));
      expected += batch;

      final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
      assertThat(metadata.getRowCount()).isEqualTo(expected);
      assertThat(metadata.getChunkCount()).isEqualTo((expected + CHUNK_SIZE - 1) / CHUNK_SIZE);
    }
    assertThat(store.getAllChunks(DATASET)).isEqualTo(createRows(expected));
  }

  @Test
  void everyWriteRaisesTheGeneration() {
    final long initial = store.getProjectMetadata(DATASET).getGeneration();
    store.batchInsert(DATASET, createRows(10));
    store.append(DATASET, createRows(10, 5));
    store.deleteAll(DATASET);
    assertThat(store.getProjectMetadata(DATASET).getGeneration()).isEqualTo(initial + 3);
  }

  @Test
  void pagesAreExact() {
    store.batchInsert(DATASET, createRows(2500));

    final PaginationResult page = store.getPage(DATASET, 1, 700);
    assertThat(page.total()).isEqualTo(2500);
    assertThat(page.page()).isEqualTo(1);
    assertThat(page.pageSize()).isEqualTo(700);
    assertThat(page.hasMore()).isTrue();
    assertThat(page.rows()).isEqualTo(createRows(700, 700));

    final PaginationResult last = store.getPage(DATASET, 3, 700);
    assertThat(last.rows()).isEqualTo(createRows(2100, 400));
    assertThat(last.hasMore()).isFalse();

    final PaginationResult beyond = store.getPage(DATASET, 4, 700);
    assertThat(beyond.rows()).isEmpty();
    assertThat(beyond.total()).isEqualTo(2500);
    assertThat(beyond.hasMore()).isFalse();
  }

  @Test
  void pageReadsOnlyTheCoveringChunks() {
    store.batchInsert(DATASET, createRows(5000));
    final ChunkStats stats = store.getChunkManager().getStats();
    stats.reset();

    store.getPage(DATASET, 2, 500);
    assertThat(stats.chunkReads.get()).isEqualTo(1);

    stats.reset();
    store.getPage(DATASET, 1, 1500);
    assertThat(stats.chunkReads.get()).isEqualTo(2);
  }

  @Test
  void pageParametersAreValidated() {
    assertThatThrownBy(() -> store.getPage(DATASET, -1, 10)).isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> store.getPage(DATASET, 0, 0)).isInstanceOf(ConfigurationException.class);
  }

  @Test
  void pageOfMissingDatasetIsEmpty() {
    final PaginationResult page = store.getPage("missing", 0, 10);
    assertThat(page.rows()).isEmpty();
    assertThat(page.total()).isZero();
    assertThat(page.hasMore()).isFalse();
  }

  @Test
  void deleteAllRemovesEveryChunk() {
    store.batchInsert(DATASET, createRows(3500));
    createDataset("other");
    store.batchInsert("other", createRows(10));

    assertThat(store.deleteAll(DATASET)).isEqualTo(4);

    for (int i = 0; i < 4; i++)
      assertThat(store.getChunk(DATASET, i)).isEmpty();
    assertThat(store.getProjectMetadata(DATASET).getRowCount()).isZero();
    assertThat(store.getProjectMetadata(DATASET).getChunkCount()).isZero();
    assertThat(store.getAllChunks("other")).hasSize(10);

    // NOTHING LEFT TO DELETE
    assertThat(store.deleteAll(DATASET)).isZero();
  }

  @Test
  void dataSourcesAreIndependentFromThePrimaryRows() {
    store.batchInsert(DATASET, createRows(1500));
    final DatasetScope source = DatasetScope.of(DATASET, "survey");
    store.batchInsert(source, createRows(5000, 2200), null);

    final ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getRowCount()).isEqualTo(1500);
    assertThat(metadata.getDataSource("survey").getRowCount()).isEqualTo(2200);
    assertThat(metadata.getDataSource("survey").getChunkCount()).isEqualTo(3);

    assertThat(store.getAllChunks(source)).isEqualTo(createRows(5000, 2200));
    assertThat(store.getPage(source, 0, 10).rows()).isEqualTo(createRows(5000, 10));

    assertThat(store.append(source, createRows(7200, 800))).isEqualTo(3000);
    assertThat(store.getProjectMetadata(DATASET).getDataSource("survey").getChunkCount()).isEqualTo(3);

    assertThat(store.deleteAll(DATASET, "survey")).isEqualTo(3);
    assertThat(store.getAllChunks(source)).isEmpty();
    assertThat(store.getAllChunks(DATASET)).hasSize(1500);
  }

  @Test
  void scansStopAtTheRowCount() {
    store.batchInsert(DATASET, createRows(1500));
    // A STRAY CHUNK BEYOND THE COUNTERS, AS LEFT BY AN ABORTED WRITE
    store.getSchemaManager().getStore(StoreSchemaManager.STORE_DATA_CHUNKS)
        .put(new DataChunk(DatasetScope.of(DATASET), 2, createRows(9000, 10)).toRecord());

    assertThat(store.getAllChunks(DATASET)).isEqualTo(createRows(1500));
    assertThat(store.getPage(DATASET, 1, 1000).rows()).hasSize(500);
  }

  @Test
  void failedBatchInsertLeavesMetadataAndCanBeRetried() {
    final FaultyStoreDriver driver = new FaultyStoreDriver();
    try (final DatasetStore faulty = new DatasetStore(driver, new ContextConfiguration(), Clock.systemUTC())) {
      faulty.createProject(DATASET, DATASET, null);
      faulty.batchInsert(DATASET, createRows(1500));
      final ProjectMetadata before = faulty.getProjectMetadata(DATASET);

      driver.failPutsAfter(StoreSchemaManager.STORE_DATA_CHUNKS, 2);
      assertThatThrownBy(() -> faulty.batchInsert(DATASET, createRows(5000)))//
          .isInstanceOf(PartialWriteException.class)//
          .satisfies(e -> assertThat(((PartialWriteException) e).getFailedChunkIndex()).isEqualTo(2));

      final ProjectMetadata after = faulty.getProjectMetadata(DATASET);
      assertThat(after.getRowCount()).isEqualTo(before.getRowCount());
      assertThat(after.getChunkCount()).isEqualTo(before.getChunkCount());
      assertThat(after.getGeneration()).isEqualTo(before.getGeneration());

      driver.heal();
      faulty.batchInsert(DATASET, createRows(5000));
      assertThat(faulty.getProjectMetadata(DATASET).getRowCount()).isEqualTo(5000);
      assertThat(faulty.getAllChunks(DATASET)).isEqualTo(createRows(5000));
    }
  }

  @Test
  void failedAppendIsInvisibleAndCanBeRetried() {
    final FaultyStoreDriver driver = new FaultyStoreDriver();
    try (final DatasetStore faulty = new DatasetStore(driver, new ContextConfiguration(), Clock.systemUTC())) {
      faulty.createProject(DATASET, DATASET, null);
      faulty.batchInsert(DATASET, createRows(2500));

      // NEW CHUNKS 3 AND 4 ARE WRITTEN, THE REWRITE OF THE TAIL CHUNK 2 FAILS
      driver.failPutsAfter(StoreSchemaManager.STORE_DATA_CHUNKS, 2);
      assertThatThrownBy(() -> faulty.append(DATASET, createRows(2500, 2000))).isInstanceOf(PartialWriteException.class);

      assertThat(faulty.getProjectMetadata(DATASET).getRowCount()).isEqualTo(2500);
      assertThat(faulty.getAllChunks(DATASET)).isEqualTo(createRows(2500));

      driver.heal();
      assertThat(faulty.append(DATASET, createRows(2500, 2000))).isEqualTo(4500);
      assertThat(faulty.getAllChunks(DATASET)).isEqualTo(createRows(4500));
    }
  }

  @Test
  void chunkSizeIsConfigurable() {
    final ContextConfiguration configuration = new ContextConfiguration().setValue(GlobalConfiguration.CHUNK_SIZE, 10);
    try (final DatasetStore small = new DatasetStore(new FaultyStoreDriver(), configuration, Clock.systemUTC())) {
      small.createProject(DATASET, DATASET, null);
      small.batchInsert(DATASET, createRows(95));
      assertThat(small.getProjectMetadata(DATASET).getChunkCount()).isEqualTo(10);
      assertThat(small.getChunk(DATASET, 9)).hasSize(5);
    }
  }

  @Test
  void reopeningWithAnotherChunkSizeKeepsAddressingTheStoredChunks() {
    store.batchInsert(DATASET, createRows(2500));

    configuredChunkSize = 500;
    reopenStore();

    assertThat(store.getProjectMetadata(DATASET).getChunkSize()).isEqualTo(CHUNK_SIZE);
    assertThat(store.getPage(DATASET, 1, 500).rows()).isEqualTo(createRows(500, 500));
    assertThat(store.getPage(DATASET, 4, 500).rows()).isEqualTo(createRows(2000, 500));

    // THE TAIL CHUNK IS FILLED UP TO THE RECORDED SIZE
    assertThat(store.append(DATASET, createRows(2500, 700))).isEqualTo(3200);
    ProjectMetadata metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getChunkCount()).isEqualTo(4);
    assertThat(metadata.getChunkSize()).isEqualTo(CHUNK_SIZE);
    assertThat(store.getChunk(DATASET, 2)).hasSize(CHUNK_SIZE);
    assertThat(store.getChunk(DATASET, 3)).hasSize(200);
    assertThat(store.getAllChunks(DATASET)).isEqualTo(createRows(3200));

    // A FULL REPLACEMENT SWITCHES TO THE CONFIGURED SIZE
    store.batchInsert(DATASET, createRows(1200));
    metadata = store.getProjectMetadata(DATASET);
    assertThat(metadata.getChunkSize()).isEqualTo(500);
    assertThat(metadata.getChunkCount()).isEqualTo(3);
    assertThat(store.getChunk(DATASET, 3)).isEmpty();
    assertThat(store.getPage(DATASET, 1, 500).rows()).isEqualTo(createRows(500, 500));
  }

  @Test
  void dataSourceKeepsItsOwnChunkSize() {
    final DatasetScope source = DatasetScope.of(DATASET, "survey");
    store.batchInsert(source, createRows(5000, 1500), null);

    configuredChunkSize = 500;
    reopenStore();

    assertThat(store.getProjectMetadata(DATASET).getDataSource("survey").getChunkSize()).isEqualTo(CHUNK_SIZE);
    assertThat(store.append(source, createRows(6500, 300))).isEqualTo(1800);
    assertThat(store.getChunk(source, 1)).hasSize(800);
    assertThat(store.getAllChunks(source)).isEqualTo(createRows(5000, 1800));

    // THE PRIMARY ROWS ARE WRITTEN WITH THE NEW SIZE
    store.batchInsert(DATASET, createRows(1200));
    assertThat(store.getProjectMetadata(DATASET).getChunkSize()).isEqualTo(500);
    assertThat(store.getProjectMetadata(DATASET).getDataSource("survey").getChunkSize()).isEqualTo(CHUNK_SIZE);
  }
}
