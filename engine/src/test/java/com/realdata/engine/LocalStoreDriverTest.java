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

import com.realdata.exception.StoreUnavailableException;
import com.realdata.serializer.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStoreDriverTest extends AbstractObjectStoreTest {
  private static final String PATH = "target/databases/LocalStoreDriverTest";

  @Override
  protected StoreDriver createDriver() {
    return new LocalStoreDriver(PATH, "lz4");
  }

  @Test
  void contentSurvivesReopen() {
    for (int i = 0; i < 10; i++)
      store.put(chunk("a", i));
    driver.setVersion(2);
    driver.close();

    driver = createDriver();
    driver.open();

    assertThat(driver.getVersion()).isEqualTo(2);
    final ObjectStore reopened = driver.getStore("chunks");
    assertThat(reopened.count()).isEqualTo(10);
    assertThat(reopened.get(CompoundKey.of("a", 7)).getJSONArray("data").getString(0)).isEqualTo("row-7");
    assertThat(reopened.getAll("projectId", KeyRange.only("a"))).hasSize(10);
  }

  @Test
  void secondOpenerIsRejected() {
    final LocalStoreDriver second = new LocalStoreDriver(PATH, "lz4");
    assertThatThrownBy(second::open).isInstanceOf(StoreUnavailableException.class);
    assertThat(second.isOpen()).isFalse();

    // THE FIRST DRIVER IS STILL USABLE
    store.put(chunk("a", 0));
    assertThat(store.count()).isEqualTo(1);
  }

  @Test
  void lockIsReleasedOnClose() {
    driver.close();
    final LocalStoreDriver second = new LocalStoreDriver(PATH, "lz4");
    second.open();
    assertThat(second.isOpen()).isTrue();
    second.close();
  }

  @Test
  void recordsWrittenWithAnotherCodecStayReadable() {
    final JSONObject big = chunk("a", 0).put("data", List.of("x".repeat(10_000)));
    store.put(big);
    driver.close();

    driver = new LocalStoreDriver(PATH, "none");
    driver.open();
    final ObjectStore uncompressed = driver.getStore("chunks");
    assertThat(uncompressed.get(CompoundKey.of("a", 0))).isEqualTo(big);

    uncompressed.put(chunk("a", 1));
    driver.close();

    driver = createDriver();
    driver.open();
    assertThat(driver.getStore("chunks").get(CompoundKey.of("a", 1))).isEqualTo(chunk("a", 1));
  }

  @Test
  void compressionShrinksRepetitiveRecords() throws IOException {
    store.put(chunk("a", 0).put("data", List.of("x".repeat(100_000))));
    final Path directory = ((LocalObjectStore) store).getDirectory();
    try (final var files = Files.list(directory)) {
      final Path file = files.filter(f -> f.toString().endsWith(LocalObjectStore.FILE_EXT)).findFirst().orElseThrow();
      assertThat(Files.size(file)).isLessThan(10_000);
    }
  }

  @Test
  void incompleteWritesAreRemovedAtOpen() throws IOException {
    store.put(chunk("a", 0));
    final Path directory = ((LocalObjectStore) store).getDirectory();
    driver.close();

    final Path leftover = directory.resolve("deadbeef.rec.tmp");
    Files.write(leftover, "partial".getBytes(StandardCharsets.UTF_8));

    driver = createDriver();
    driver.open();
    assertThat(Files.exists(leftover)).isFalse();
    assertThat(driver.getStore("chunks").count()).isEqualTo(1);
  }

  @Test
  void corruptedManifestMakesTheStoreUnavailable() throws IOException {
    driver.close();
    Files.write(Path.of(PATH, LocalStoreDriver.MANIFEST_FILE), "{not json".getBytes(StandardCharsets.UTF_8));

    final LocalStoreDriver broken = new LocalStoreDriver(PATH, "lz4");
    assertThatThrownBy(broken::open).isInstanceOf(StoreUnavailableException.class);
    assertThat(broken.isOpen()).isFalse();
  }
}
