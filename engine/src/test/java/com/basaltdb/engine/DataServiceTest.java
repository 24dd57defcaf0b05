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
package com.basaltdb.engine;

import com.basaltdb.TestHelper;
import com.basaltdb.database.Document;
import com.basaltdb.exception.StorageException;
import com.basaltdb.transaction.TransactionContext;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataServiceTest extends TestHelper {

  @Test
  void smallPayloadsShareTheDataPage() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getCollectionService().add("items");
      final DataService data = tx.getDataService();

      final DataBlock first = data.insert(collection, payload(100, (byte) 1));
      final DataBlock second = data.insert(collection, payload(200, (byte) 2));

      assertThat(first.hasExtendPage()).isFalse();
      assertThat(second.getPosition().getPageId()).isEqualTo(first.getPosition().getPageId());
      assertThat(collection.getFreeDataPageId()).isEqualTo(first.getPosition().getPageId());
      assertThat(data.read(second.getPosition())).isEqualTo(payload(200, (byte) 2));
    }
  }

  @Test
  void fullDataPageIsReplaced() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getCollectionService().add("items");
      final DataService data = tx.getDataService();

      final DataBlock first = data.insert(collection, payload(3000, (byte) 1));
      final DataBlock second = data.insert(collection, payload(3000, (byte) 2));

      assertThat(second.getPosition().getPageId()).isNotEqualTo(first.getPosition().getPageId());
      assertThat(collection.getFreeDataPageId()).isEqualTo(second.getPosition().getPageId());
    }
  }

  @Test
  void largePayloadIsChainedOnExtendPages() {
    final int size = data().getExtendPageCapacity() * 2 + 100;
    final byte[] content = payload(size, (byte) 7);

    final PageAddress address;
    final int firstExtendPage;
    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getCollectionService().add("items");
      final DataBlock block = tx.getDataService().insert(collection, content);
      address = block.getPosition();
      firstExtendPage = block.getExtendPageId();

      assertThat(block.hasExtendPage()).isTrue();
      assertThat(block.getData()).isEmpty();
      tx.commit();
    }

    try (final TransactionContext tx = engine.beginReadOnlyTransaction()) {
      assertThat(tx.getDataService().read(address)).isEqualTo(content);

      int chainLength = 0;
      for (int pageId = firstExtendPage; pageId != BasePage.NO_PAGE; pageId = tx.getPage(pageId, ExtendPage.class).getNextPageId())
        ++chainLength;
      assertThat(chainLength).isEqualTo(3);
    }
  }

  @Test
  void updateReleasesThePreviousChain() {
    final byte[] large = payload(10_000, (byte) 3);

    final PageAddress address;
    final int firstExtendPage;
    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getCollectionService().add("items");
      final DataBlock block = tx.getDataService().insert(collection, large);
      address = block.getPosition();
      firstExtendPage = block.getExtendPageId();
      tx.commit();
    }
    assertThat(engine.getPageManager().isAllocated(firstExtendPage)).isTrue();

    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getPageToModify(tx.getCollectionService().get("items").getPageId(), CollectionPage.class);
      final DataBlock block = tx.getDataService().update(collection, address, payload(50, (byte) 4));
      assertThat(block.hasExtendPage()).isFalse();
      tx.commit();
    }

    assertThat(engine.getPageManager().isAllocated(firstExtendPage)).isFalse();
    try (final TransactionContext tx = engine.beginReadOnlyTransaction()) {
      assertThat(tx.getDataService().read(address)).isEqualTo(payload(50, (byte) 4));
    }
  }

  @Test
  void missingBlockIsReported() {
    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = tx.getCollectionService().add("items");
      final DataBlock block = tx.getDataService().insert(collection, payload(10, (byte) 1));

      final PageAddress missing = new PageAddress(block.getPosition().getPageId(), block.getPosition().getIndex() + 1);

      assertThatThrownBy(() -> tx.getDataService().getBlock(missing)).isInstanceOf(StorageException.class);
      assertThatThrownBy(() -> tx.getDataService().update(collection, missing, payload(5, (byte) 2)))
          .isInstanceOf(StorageException.class);
    }
  }

  @Test
  void largeDocumentRoundTripAndDrop() {
    final char[] text = new char[20_000];
    Arrays.fill(text, 'x');
    final Document document = newDocument("_id", 1, "text", new String(text));

    engine.insert("docs", document);
    assertThat(engine.findById("docs", 1).get("text")).isEqualTo(new String(text));

    assertThat(engine.dropCollection("docs")).isTrue();
    assertThat(engine.getPageManager().getAllocatedPages()).isEqualTo(Set.of(HeaderPage.HEADER_PAGE_ID));
  }

  private DataService data() {
    try (final TransactionContext tx = engine.beginReadOnlyTransaction()) {
      return tx.getDataService();
    }
  }

  private static byte[] payload(final int size, final byte value) {
    final byte[] content = new byte[size];
    Arrays.fill(content, value);
    return content;
  }
}
