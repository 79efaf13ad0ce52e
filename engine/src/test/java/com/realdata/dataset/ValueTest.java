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

import com.realdata.serializer.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ValueTest {

  @Test
  void textForm() {
    assertThat(Value.of(3).asText()).isEqualTo("3");
    assertThat(Value.of(3.0).asText()).isEqualTo("3");
    assertThat(Value.of(2.5).asText()).isEqualTo("2.5");
    assertThat(Value.of(Double.NaN).asText()).isEqualTo("NaN");
    assertThat(Value.of(true).asText()).isEqualTo("true");
    assertThat(Value.of(null).asText()).isEmpty();
    assertThat(Value.of(LocalDate.of(2024, 3, 1)).asText()).isEqualTo("2024-03-01T00:00:00Z");
  }

  @Test
  void numericFormNeverFails() {
    assertThat(Value.of("12.5kg").toNumber()).isEqualTo(12.5);
    assertThat(Value.of("  -3e2 ").toNumber()).isEqualTo(-300);
    assertThat(Value.of("abc").toNumber()).isZero();
    assertThat(Value.of("").toNumber()).isZero();
    assertThat(Value.of("NaN").toNumber()).isZero();
    assertThat(Value.of(Double.NaN).toNumber()).isZero();
    assertThat(Value.of("Infinity").toNumber()).isEqualTo(Double.POSITIVE_INFINITY);
    assertThat(Value.of(true).toNumber()).isZero();
    assertThat(Value.NULL.toNumber()).isZero();
    assertThat(Value.of(Instant.ofEpochMilli(1234)).toNumber()).isEqualTo(1234);
  }

  @Test
  void onlyNullAndEmptyTextAreEmpty() {
    assertThat(Value.NULL.isEmpty()).isTrue();
    assertThat(Value.of("").isEmpty()).isTrue();
    assertThat(Value.of(0).isEmpty()).isFalse();
    assertThat(Value.of(false).isEmpty()).isFalse();
    assertThat(Value.of(" ").isEmpty()).isFalse();
  }

  @Test
  void jsonKeepsTheKind() {
    final Row row = Row.of("n", 1.5, "t", "x", "d", Instant.parse("2024-01-02T03:04:05Z"), "b", false, "z", null, "inf",
        Double.NEGATIVE_INFINITY, "nan", Double.NaN);
    final Row copy = Row.fromJSON(new JSONObject(row.toJSON().toString()));

    assertThat(copy).isEqualTo(row);
    assertThat(copy.get("d").getKind()).isEqualTo(Value.Kind.DATE);
    assertThat(copy.get("z").isNull()).isTrue();
    assertThat(copy.get("missing").isNull()).isTrue();
    assertThat(copy.getColumns()).containsExactly("n", "t", "d", "b", "z", "inf", "nan");
  }
}
