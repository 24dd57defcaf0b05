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
package com.basaltdb;

import com.basaltdb.database.Document;
import com.basaltdb.database.DocumentEngine;
import com.basaltdb.engine.CollectionPage;
import com.basaltdb.engine.PageAddress;
import com.basaltdb.index.IndexDescriptor;
import com.basaltdb.index.IndexNode;
import com.basaltdb.index.IndexService;
import com.basaltdb.index.KeyExpression;
import com.basaltdb.serializer.DocumentSerializer;
import com.basaltdb.transaction.TransactionContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public abstract class TestHelper {
  protected DocumentEngine engine;

  @BeforeEach
  public void beginTest() {
    engine = new DocumentEngine(getConfiguration());
  }

  @AfterEach
  public void endTest() {
    if (engine != null)
      engine.close();
  }

  protected ContextConfiguration getConfiguration() {
    return new ContextConfiguration();
  }

  protected static Document newDocument(final Object... nameValuePairs) {
    return new Document().set(nameValuePairs);
  }

  /**
   * Checks the primary key index matches the stored documents and every secondary entry points to the data block of a primary entry.
   */
  protected void checkCollectionIntegrity(final String collectionName) {
    final DocumentSerializer serializer = new DocumentSerializer();

    try (final TransactionContext tx = engine.beginReadOnlyTransaction()) {
      final CollectionPage collection = tx.getCollectionService().get(collectionName);
      assertThat(collection).isNotNull();

      final IndexService indexer = tx.getIndexService();

      final Map<PageAddress, IndexNode> primaryByBlock = new HashMap<>();
      final Map<PageAddress, Document> documents = new HashMap<>();
      for (final IndexNode pk : indexer.findAll(collection.getPK(), IndexService.ORDER.ASCENDING)) {
        final Document document = serializer.deserialize(tx.getDataService().read(pk.getDataBlock()));
        assertThat(document.getIdentity()).isEqualTo(pk.getKey());
        assertThat(primaryByBlock.put(pk.getDataBlock(), pk)).isNull();
        documents.put(pk.getDataBlock(), document);
      }
      assertThat((long) primaryByBlock.size()).isEqualTo(collection.getDocumentCount());

      for (final IndexDescriptor index : collection.getIndexes(false)) {
        int expectedEntries = 0;
        for (final Document document : documents.values())
          expectedEntries += KeyExpression.parse(index.getExpression()).execute(document, index.isUnique()).size();

        int entries = 0;
        for (final IndexNode node : indexer.findAll(index, IndexService.ORDER.ASCENDING)) {
          final IndexNode pk = primaryByBlock.get(node.getDataBlock());
          assertThat(pk).as("Entry %s of index %s has no primary entry", node, index.getName()).isNotNull();
          assertThat(node.getPrimaryNode()).isEqualTo(pk.getPosition());
          ++entries;
        }
        assertThat(entries).as("Entries of index %s", index.getName()).isEqualTo(expectedEntries);
      }
    }
  }
}
