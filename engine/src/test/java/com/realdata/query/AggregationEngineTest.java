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
package com.realdata.query;

import com.realdata.ContextConfiguration;
import com.realdata.DatasetStore;
import com.realdata.FaultyStoreDriver;
import com.realdata.GlobalConfiguration;
import com.realdata.TestHelper;
import com.realdata.dataset.ChunkStats;
import com.realdata.dataset.DatasetScope;
import com.realdata.dataset.Row;
import com.realdata.exception.DatasetNotFoundException;
import com.realdata.exception.QueryException;
import com.realdata.schema.StoreSchemaManager;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AggregationEngineTest extends TestHelper {
  private static final int CHUNK_SIZE = 100;

  @Override
  protected ContextConfiguration getConfiguration() {
    return new ContextConfiguration().setValue(GlobalConfiguration.CHUNK_SIZE, CHUNK_SIZE);
  }

  @Override
  protected void beginTest() {
    createDataset(DATASET);
  }

  @Test
  void countKeepsFirstSeenOrderBetweenTies() {
    store.batchInsert(DATASET, createRows(1000));

    final AggregationResult result = store.aggregateData(DATASET, AggregationConfig.builder("region").build());
    assertThat(result.isStacked()).isFalse();
    assertThat(result.getGroups()).containsExactly("EU", "US", "APAC", "LATAM");
    assertThat(result.getValue("EU")).isEqualTo(250);
    assertThat(result.getGrandTotal()).isEqualTo(1000);
  }

  @Test
  void sumSortsByDescendingValue() {
    store.batchInsert(DATASET, createRows(1000));

    final AggregationResult result = store.aggregateData(DATASET, AggregationConfig.builder("region").sum("amount").build());
    assertThat(result.getGroups()).containsExactly("US", "LATAM", "EU", "APAC");
    assertThat(result.getValue("US")).isEqualTo(1250);
    assertThat(result.getValue("EU")).isEqualTo(1000);
  }

  @Test
  void averageDividesByTheRowsOfTheGroup() {
    store.batchInsert(DATASET, createRows(1000));

    final AggregationResult result = store.aggregateData(DATASET, AggregationConfig.builder("region").avg("amount").build());
    assertThat(result.getValue("US")).isEqualTo(5);
    assertThat(result.getValue("EU")).isEqualTo(4);
  }

  @Test
  void stackedAverageIsComputedPerStack() {
    store.batchInsert(DATASET, List.of(//
        Row.of("id", 0, "region", "A", "channel", "web", "amount", 10),//
        Row.of("id", 1, "region", "A", "channel", "web", "amount", 20),//
        Row.of("id", 2, "region", "A", "channel", "store", "amount", 1),//
        Row.of("id", 3, "region", "B", "channel", "web", "amount", 6),//
        Row.of("id", 4, "region", "B", "channel", "store", "amount", 8),//
        Row.of("id", 5, "region", "B", "channel", "store", "amount", 14),//
        Row.of("id", 6, "region", "C", "channel", "web", "amount", 30)));

    final AggregationResult result = store.aggregateData(DATASET,
        AggregationConfig.builder("region").avg("amount").stackBy("channel").build());
    assertThat(result.isStacked()).isTrue();
    assertThat(result.getStack("A")).containsOnly(Map.entry("web", 15D), Map.entry("store", 1D));
    assertThat(result.getStack("B")).containsOnly(Map.entry("web", 6D), Map.entry("store", 11D));
    assertThat(result.getStack("C")).containsOnly(Map.entry("web", 30D));

    // ORDERED BY THE SUM OF THE STACK AVERAGES: 30, 17, 16
    assertThat(result.getGroups()).containsExactly("C", "B", "A");
    assertThat(result.getTotal("B")).isEqualTo(17);
    assertThat(result.getTotal("A")).isEqualTo(16);
  }

  @Test
  void nullAndEmptyValuesAreGroupedTogether() {
    final List<Row> rows = new ArrayList<>(createRows(10));
    rows.add(Row.of("id", 10, "region", null));
    rows.add(Row.of("id", 11, "region", ""));
    rows.add(Row.of("id", 12));
    rows.add(Row.of("id", 13, "region", 0));
    store.batchInsert(DATASET, rows);

    final AggregationResult result = store.aggregateData(DATASET, AggregationConfig.builder("region").build());
    assertThat(result.getValue(AggregationEngine.EMPTY_GROUP)).isEqualTo(3);
    assertThat(result.getValue("0")).isEqualTo(1);
  }

  @Test
  void stackedResultsSplitEachGroup() {
    store.batchInsert(DATASET, createRows(1000));

    final AggregationResult result = store.aggregateData(DATASET,
        AggregationConfig.builder("amount").stackBy("channel").build());
    assertThat(result.isStacked()).isTrue();
    assertThat(result.size()).isEqualTo(10);
    // EVEN AMOUNTS COME FROM EVEN IDS
    assertThat(result.getStack("4")).containsExactly(Map.entry("web", 100D));
    assertThat(result.getStack("5")).containsExactly(Map.entry("store", 100D));
    assertThat(result.getTotal("5")).isEqualTo(100);
  }

  @Test
  void limitKeepsTheLargestGroups() {
    store.batchInsert(DATASET, createRows(1000));

    final AggregationResult result = store.aggregateData(DATASET,
        AggregationConfig.builder("region").sum("amount").limit(2).build());
    assertThat(result.getGroups()).containsExactly("US", "LATAM");
  }

  @Test
  void filtersAreCaseInsensitiveAndCombined() {
    store.batchInsert(DATASET, createRows(1000));

    AggregationResult result = store.aggregateData(DATASET, AggregationConfig.builder("region").filter("channel", "WEB").build());
    assertThat(result.getGroups()).containsExactly("EU", "APAC");

    result = store.aggregateData(DATASET,
        AggregationConfig.builder("region").filter("channel", "web").filter("region", "apac").build());
    assertThat(result.getGroups()).containsExactly("APAC");
    assertThat(result.getValue("APAC")).isEqualTo(250);

    result = store.aggregateData(DATASET, AggregationConfig.builder("region").filter("missing", "").build());
    assertThat(result.isEmpty()).isTrue();
  }

  @Test
  void aggregationMatchesANaiveScan() {
    final Random random = new Random(42);
    final String[] categories = { "a", "B", "c", "", null };
    final List<Row> rows = new ArrayList<>();
    for (int i = 0; i < 777; i++)
      rows.add(Row.of("id", i, "category", categories[random.nextInt(categories.length)], "amount", random.nextInt(1000) / 10.0,
          "channel", CHANNELS[random.nextInt(2)]));
    store.batchInsert(DATASET, rows);

    final Map<String, Double> expected = new LinkedHashMap<>();
    for (final Row row : rows) {
      if (!row.get("channel").asText().equals("store"))
        continue;
      final String group = row.get("category").isEmpty() ? AggregationEngine.EMPTY_GROUP : row.get("category").asText();
      expected.merge(group, row.get("amount").toNumber(), Double::sum);
    }

    final AggregationResult result = store.aggregateData(DATASET,
        AggregationConfig.builder("category").sum("amount").filter("channel", "Store").build());
    assertThat(result.getGroups()).containsExactlyInAnyOrderElementsOf(expected.keySet());
    for (final Map.Entry<String, Double> entry : expected.entrySet())
      assertThat(result.getValue(entry.getKey())).isCloseTo(entry.getValue(), within(1e-6));

    final List<String> groups = result.getGroups();
    for (int i = 1; i < groups.size(); i++)
      assertThat(result.getValue(groups.get(i - 1))).isGreaterThanOrEqualTo(result.getValue(groups.get(i)));
  }

  @Test
  void cachedResultIgnoresTheFilterOrder() {
    store.batchInsert(DATASET, createRows(1000));
    final ChunkStats stats = store.getChunkManager().getStats();

    final AggregationResult first = store.aggregateData(DATASET,
        AggregationConfig.builder("region").filter("channel", "web").filter("region", "EU").build());
    final long reads = stats.chunkReads.get();
    assertThat(reads).isEqualTo(10);

    final AggregationResult second = store.aggregateData(DATASET,
        AggregationConfig.builder("region").filter("region", "EU").filter("channel", "web").build());
    assertThat(second).isEqualTo(first);
    assertThat(stats.chunkReads.get()).isEqualTo(reads);
    assertThat(store.getQueryCache().getHits()).isEqualTo(1);
  }

  @Test
  void missingDatasetFailsAggregation() {
    assertThatThrownBy(() -> store.aggregateData("missing", AggregationConfig.builder("region").build()))//
        .isInstanceOf(DatasetNotFoundException.class);
  }

  @Test
  void emptyDatasetGivesAnEmptyResult() {
    assertThat(store.aggregateData(DATASET, AggregationConfig.builder("region").build()).isEmpty()).isTrue();
  }

  @Test
  void uniqueValuesStopAtTheChunkWithEnoughValues() {
    store.batchInsert(DATASET, createRows(1000));
    final ChunkStats stats = store.getChunkManager().getStats();

    assertThat(store.getUniqueValues(DATASET, "id", 5)).containsExactly("0", "1", "2", "3", "4");
    assertThat(stats.chunkReads.get()).isEqualTo(1);

    assertThat(store.getUniqueValues(DATASET, "region", 100)).containsExactly("EU", "US", "APAC", "LATAM");
    assertThat(stats.chunkReads.get()).isEqualTo(11);

    // SECOND CALL COMES FROM THE CACHE
    assertThat(store.getUniqueValues(DATASET, "region", 100)).containsExactly("EU", "US", "APAC", "LATAM");
    assertThat(stats.chunkReads.get()).isEqualTo(11);
  }

  @Test
  void uniqueValuesSkipEmptyValues() {
    store.batchInsert(DATASET, List.of(Row.of("region", ""), Row.of("region", null), Row.of("region", "EU"), Row.of("id", 1)));

    assertThat(store.getUniqueValues(DATASET, "region")).containsExactly("EU");
    assertThat(store.getUniqueValues(DATASET, "unknown")).isEmpty();
    assertThat(store.getUniqueValues("missing", "region")).isEmpty();
  }

  @Test
  void uniqueValuesRejectAnInvalidLimit() {
    assertThatThrownBy(() -> store.getUniqueValues(DATASET, "region", 0)).isInstanceOf(QueryException.class);
    assertThatThrownBy(() -> store.getUniqueValues(DATASET, "", 10)).isInstanceOf(QueryException.class);
  }

  @Test
  void filteredDataStopsAtTheLimit() {
    store.batchInsert(DATASET, createRows(1000));
    final ChunkStats stats = store.getChunkManager().getStats();

    final List<Row> rows = store.getFilteredData(DATASET, List.of(EqualityFilter.of("region", "eu")), 5);
    assertThat(rows).extracting(row -> row.get("id").asText()).containsExactly("0", "4", "8", "12", "16");
    assertThat(stats.chunkReads.get()).isEqualTo(1);

    assertThat(store.getFilteredData(DATASET, List.of(EqualityFilter.of("region", "EU"), EqualityFilter.of("channel", "store"))))
        .isEmpty();
    assertThat(store.getFilteredData(DATASET, List.of())).hasSize(1000);
    assertThat(store.getFilteredData("missing", List.of())).isEmpty();
    assertThatThrownBy(() -> store.getFilteredData(DATASET, List.of(), 0)).isInstanceOf(QueryException.class);
  }

  @Test
  void dataSourcesAreAggregatedSeparately() {
    store.batchInsert(DATASET, createRows(100));
    store.batchInsert(DatasetScope.of(DATASET, "crm"), createRows(8), null);

    final AggregationConfig config = AggregationConfig.builder("region").build();
    assertThat(store.aggregateData(DATASET, config).getValue("EU")).isEqualTo(25);
    assertThat(store.aggregateData(DatasetScope.of(DATASET, "crm"), config).getValue("EU")).isEqualTo(2);
    assertThat(store.getUniqueValues(DatasetScope.of(DATASET, "crm"), "id", 3)).containsExactly("0", "1", "2");
    assertThat(store.getQueryCache().size()).isEqualTo(3);
  }

  @Test
  void aggregationIsRepeatedWhenTheDatasetChanges() {
    final FaultyStoreDriver driver = new FaultyStoreDriver();
    try (final DatasetStore faulty = new DatasetStore(driver, new ContextConfiguration(), Clock.systemUTC())) {
      faulty.createProject(DATASET, DATASET, null);
      faulty.batchInsert(DATASET, createRows(1500));

      final AtomicInteger calls = new AtomicInteger();
      driver.onGet(StoreSchemaManager.STORE_DATA_CHUNKS, () -> {
        if (calls.getAndIncrement() == 0)
          faulty.append(DATASET, createRows(1500, 4));
      });

      final AggregationResult result = faulty.aggregateData(DATASET, AggregationConfig.builder("region").build());
      assertThat(result.getValue("EU")).isEqualTo(376);
      assertThat(result.getGrandTotal()).isEqualTo(1504);
      assertThat(faulty.getQueryCache().size()).isEqualTo(1);
    }
  }

  @Test
  void resultIsNotCachedWhenTheDatasetKeepsChanging() {
    final FaultyStoreDriver driver = new FaultyStoreDriver();
    final ContextConfiguration configuration = new ContextConfiguration().setValue(GlobalConfiguration.AGGREGATION_MAX_RETRIES, 2);
    try (final DatasetStore faulty = new DatasetStore(driver, configuration, Clock.systemUTC())) {
      faulty.createProject(DATASET, DATASET, null);
      faulty.batchInsert(DATASET, createRows(1500));

      final AtomicInteger appended = new AtomicInteger();
      driver.onGet(StoreSchemaManager.STORE_DATA_CHUNKS, () -> faulty.append(DATASET, createRows(1500 + appended.getAndIncrement(), 1)));

      final AggregationResult result = faulty.aggregateData(DATASET, AggregationConfig.builder("region").build());
      driver.onGet(StoreSchemaManager.STORE_DATA_CHUNKS, null);

      // EVERY ATTEMPT SEES THE ROWS COMMITTED BEFORE IT STARTED
      assertThat(result.getGrandTotal()).isGreaterThan(1500);
      assertThat(appended.get()).isGreaterThanOrEqualTo(3);
      assertThat(faulty.getQueryCache().size()).isZero();
    }
  }
}
