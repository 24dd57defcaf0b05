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
package com.basaltdb.database;

import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentComparatorTest {
  private final DocumentComparator comparator = DocumentComparator.INSTANCE;

  @Test
  void valuesOfDifferentTypesSortByType() {
    final List<Object> values = new ArrayList<>(List.of(Bound.MAX, new Date(0), true, UUID.randomUUID(), new ObjectId(), new byte[] { 1 },
        List.of(1), new Document().set("a", 1), "abc", 10));
    values.add(null);
    values.add(Bound.MIN);

    values.sort(comparator);

    assertThat(values.get(0)).isEqualTo(Bound.MIN);
    assertThat(values.get(1)).isNull();
    assertThat(values.get(2)).isEqualTo(10);
    assertThat(values.get(3)).isEqualTo("abc");
    assertThat(values.get(4)).isInstanceOf(Document.class);
    assertThat(values.get(5)).isInstanceOf(List.class);
    assertThat(values.get(6)).isInstanceOf(byte[].class);
    assertThat(values.get(7)).isInstanceOf(ObjectId.class);
    assertThat(values.get(8)).isInstanceOf(UUID.class);
    assertThat(values.get(9)).isEqualTo(true);
    assertThat(values.get(10)).isInstanceOf(Date.class);
    assertThat(values.get(11)).isEqualTo(Bound.MAX);
  }

  @Test
  void numbersCompareByValueAcrossTypes() {
    assertThat(comparator.compare(1, 1L)).isZero();
    assertThat(comparator.compare((short) 2, 1L)).isPositive();
    assertThat(comparator.compare(1.5d, 2)).isNegative();
    assertThat(comparator.compare(new BigDecimal("10.00"), 10)).isZero();
    assertThat(comparator.compare(Long.MAX_VALUE, Long.MAX_VALUE - 1)).isPositive();
  }

  @Test
  void documentsAndListsCompareElementWise() {
    assertThat(comparator.compare(List.of(1, 2), List.of(1, 3))).isNegative();
    assertThat(comparator.compare(List.of(1, 2), List.of(1, 2, 0))).isNegative();
    assertThat(DocumentComparator.equals(new Document().set("a", 1, "b", "x"), new Document().set("a", 1L, "b", "x"))).isTrue();
    assertThat(comparator.compare(new Document().set("a", 1), new Document().set("b", 0))).isNegative();
  }

  @Test
  void unsupportedTypesAreRejected() {
    assertThat(DocumentComparator.isSupported(new Object())).isFalse();
    assertThat(DocumentComparator.isSupported("text")).isTrue();
    assertThatThrownBy(() -> comparator.compare(new Object(), new Object())).isInstanceOf(IllegalArgumentException.class);
  }
}
