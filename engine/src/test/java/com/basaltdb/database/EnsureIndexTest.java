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

import com.basaltdb.TestHelper;
import com.basaltdb.engine.CollectionPage;
import com.basaltdb.exception.DuplicatedKeyException;
import com.basaltdb.exception.IndexException;
import com.basaltdb.exception.InvalidFormatException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnsureIndexTest extends TestHelper {

  @Test
  void existingDocumentsAreIndexed() {
    engine.insert("users", List.of(newDocument("name", "Jay", "city", "Rome"), newDocument("name", "Ann", "city", "Oslo"),
        newDocument("name", "Bob", "city", "Rome")), AutoId.INT32);

    assertThat(engine.ensureIndex("users", "byCity", "$.city", false)).isTrue();

    assertThat(engine.find("users", "byCity", "Rome")).extracting(d -> d.get("name")).containsExactly("Jay", "Bob");
    assertThat(engine.find("users", "byCity", "Paris")).isEmpty();
    checkCollectionIntegrity("users");
  }

  @Test
  void ensureIndexIsIdempotent() {
    assertThat(engine.ensureIndex("users", "byCity", "$.city", false)).isTrue();
    assertThat(engine.ensureIndex("users", "BYCITY", "$.city", false)).isFalse();
    assertThat(engine.ensureIndex("users", "_id", "$._id", true)).isFalse();

    assertThatThrownBy(() -> engine.ensureIndex("users", "byCity", "$.town", false)).isInstanceOf(IndexException.class);

    final CollectionPage collection = engine.getCollection("users");
    assertThat(collection.getIndexes(false)).hasSize(1);
    assertThat(collection.getIndex("byCity").getSlot()).isEqualTo(1);
  }

  @Test
  void invalidDefinitionsAreRejected() {
    assertThatThrownBy(() -> engine.ensureIndex("users", "by city", "$.city", false)).isInstanceOf(InvalidFormatException.class);
    assertThatThrownBy(() -> engine.ensureIndex("users", "byCity", "city", false)).isInstanceOf(InvalidFormatException.class);
    assertThat(engine.existsCollection("users")).isFalse();
  }

  @Test
  void uniqueViolationOnExistingDocumentsRollsBack() {
    engine.insert("users", newDocument("_id", 1, "email", "a@b.c"), newDocument("_id", 2, "email", "a@b.c"));

    assertThatThrownBy(() -> engine.ensureIndex("users", "byEmail", "$.email", true)).isInstanceOf(DuplicatedKeyException.class);
    assertThat(engine.getCollection("users").getIndex("byEmail")).isNull();
  }

  @Test
  void newDocumentsAreIndexedInEverySlot() {
    engine.ensureIndex("users", "byName", "$.name", false);
    engine.ensureIndex("users", "byCity", "$.address.city", false);
    engine.ensureIndex("users", "byTag", "$.tags[*]", false);

    engine.insert("users", newDocument("_id", 1, "name", "Jay", "address", newDocument("city", "Rome"), "tags", List.of("x", "y")));

    assertThat(engine.find("users", "byName", "Jay")).hasSize(1);
    assertThat(engine.find("users", "byCity", "Rome")).hasSize(1);
    assertThat(engine.find("users", "byTag", "y")).hasSize(1);
    assertThatThrownBy(() -> engine.find("users", "byAge", 3)).isInstanceOf(IndexException.class);
    checkCollectionIntegrity("users");
  }
}
