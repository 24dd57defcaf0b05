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

import com.basaltdb.ContextConfiguration;
import com.basaltdb.GlobalConfiguration;
import com.basaltdb.engine.CollectionPage;
import com.basaltdb.engine.PageManager;
import com.basaltdb.exception.IndexException;
import com.basaltdb.exception.TransactionException;
import com.basaltdb.index.IndexDescriptor;
import com.basaltdb.index.IndexNode;
import com.basaltdb.index.IndexService;
import com.basaltdb.log.LogManager;
import com.basaltdb.schema.CollectionService;
import com.basaltdb.serializer.DocumentSerializer;
import com.basaltdb.transaction.TransactionContext;
import com.basaltdb.utility.LockManager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;

/**
 * Entry point of the document store. Write operations run in their own transaction with exclusive locks, read operations run on
 * the snapshot of the committed pages taken when they start and never block.
 */
public class DocumentEngine implements AutoCloseable {
  private final ContextConfiguration                    configuration;
  private final PageManager                             pageManager;
  private final LockManager<String, TransactionContext> lockManager = new LockManager<>();
  private final DocumentSerializer                      serializer  = new DocumentSerializer();
  private final DocumentWriter                          writer;
  private volatile boolean                              open        = true;

  public DocumentEngine() {
    this(new ContextConfiguration());
  }

  public DocumentEngine(final ContextConfiguration configuration) {
    this(configuration, DefaultIdentityGenerator.INSTANCE);
  }

  public DocumentEngine(final ContextConfiguration configuration, final IdentityGenerator identityGenerator) {
    if (configuration == null)
      throw new IllegalArgumentException("Configuration is null");
    if (identityGenerator == null)
      throw new IllegalArgumentException("Identity generator is null");

    this.configuration = configuration;
    this.pageManager = new PageManager();
    this.writer = new DocumentWriter(this, serializer, identityGenerator);

    LogManager.instance().log(this, Level.FINE, "Opened document engine (pageSize=%d maxIndexes=%d)",
        configuration.getValueAsInteger(GlobalConfiguration.PAGE_SIZE), configuration.getValueAsInteger(GlobalConfiguration.MAX_INDEXES));
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  public PageManager getPageManager() {
    return pageManager;
  }

  public boolean isOpen() {
    return open;
  }

  /**
   * Begins a read-write transaction. The caller must commit it or close it.
   */
  public TransactionContext beginTransaction() {
    checkOpen();
    return new TransactionContext(pageManager, lockManager, configuration, false);
  }

  /**
   * Begins a read-only transaction working on the current committed snapshot.
   */
  public TransactionContext beginReadOnlyTransaction() {
    checkOpen();
    return new TransactionContext(pageManager, lockManager, configuration, true);
  }

  public int insert(final String collection, final Document... documents) {
    return insert(collection, documents != null ? Arrays.asList(documents) : null, getDefaultAutoId());
  }

  public int insert(final String collection, final Iterable<Document> documents) {
    return insert(collection, documents, getDefaultAutoId());
  }

  public int insert(final String collection, final Iterable<Document> documents, final AutoId autoId) {
    return writer.insert(collection, documents, autoId);
  }

  public int upsert(final String collection, final Iterable<Document> documents) {
    return upsert(collection, documents, getDefaultAutoId());
  }

  public int upsert(final String collection, final Iterable<Document> documents, final AutoId autoId) {
    return writer.upsert(collection, documents, autoId);
  }

  public int update(final String collection, final Iterable<Document> documents) {
    return writer.update(collection, documents);
  }

  public boolean ensureIndex(final String collection, final String indexName, final String expression, final boolean unique) {
    return writer.ensureIndex(collection, indexName, expression, unique);
  }

  public Document findById(final String collection, final Object id) {
    try (final TransactionContext tx = beginReadOnlyTransaction()) {
      final CollectionPage col = tx.getCollectionService().get(collection);
      if (col == null)
        return null;

      final IndexNode node = tx.getIndexService().find(col.getPK(), id);
      return node != null ? serializer.deserialize(tx.getDataService().read(node.getDataBlock())) : null;
    }
  }

  /**
   * Returns all the documents of the collection ordered by `_id`.
   */
  public List<Document> findAll(final String collection) {
    try (final TransactionContext tx = beginReadOnlyTransaction()) {
      final List<Document> result = new ArrayList<>();

      final CollectionPage col = tx.getCollectionService().get(collection);
      if (col != null)
        for (final IndexNode node : tx.getIndexService().findAll(col.getPK(), IndexService.ORDER.ASCENDING))
          result.add(serializer.deserialize(tx.getDataService().read(node.getDataBlock())));

      return result;
    }
  }

  /**
   * Returns the documents with the key in the index, each document once.
   */
  public List<Document> find(final String collection, final String indexName, final Object key) {
    try (final TransactionContext tx = beginReadOnlyTransaction()) {
      final List<Document> result = new ArrayList<>();

      final CollectionPage col = tx.getCollectionService().get(collection);
      if (col == null)
        return result;

      final IndexDescriptor index = col.getIndex(indexName);
      if (index == null)
        throw new IndexException("Index '" + indexName + "' not found on collection '" + col.getName() + "'");

      final Set<Object> visited = new LinkedHashSet<>();
      for (final IndexNode node : tx.getIndexService().findEquals(index, key))
        if (visited.add(node.getDataBlock()))
          result.add(serializer.deserialize(tx.getDataService().read(node.getDataBlock())));

      return result;
    }
  }

  public long count(final String collection) {
    final CollectionPage col = getCollection(collection);
    return col != null ? col.getDocumentCount() : 0L;
  }

  public boolean existsCollection(final String collection) {
    return getCollection(collection) != null;
  }

  /**
   * Returns a copy of the collection page, or null if the collection does not exist.
   */
  public CollectionPage getCollection(final String collection) {
    try (final TransactionContext tx = beginReadOnlyTransaction()) {
      final CollectionPage col = tx.getCollectionService().get(collection);
      return col != null ? col.copy() : null;
    }
  }

  public List<String> getCollectionNames() {
    try (final TransactionContext tx = beginReadOnlyTransaction()) {
      final List<String> names = new ArrayList<>();
      for (final CollectionPage col : tx.getCollectionService().getAll())
        names.add(col.getName());
      return names;
    }
  }

  /**
   * Renames a collection.
   *
   * @return false if the collection does not exist
   */
  public boolean renameCollection(final String collection, final String newName) {
    if (newName == null || newName.isBlank())
      throw new IllegalArgumentException("New collection name is null or empty");

    try (final TransactionContext tx = beginTransaction()) {
      final CollectionService collections = tx.getCollectionService();

      tx.lockHeader();
      if (collections.get(collection) == null)
        return false;

      tx.writeLock(collection);

      // READ AGAIN: WRITERS HOLDING THE COLLECTION LOCK MAY HAVE COMMITTED WHILE WAITING
      collections.rename(collections.get(collection), newName);

      tx.commit();
      return true;
    }
  }

  /**
   * Drops a collection with all its documents and indexes.
   *
   * @return false if the collection does not exist
   */
  public boolean dropCollection(final String collection) {
    try (final TransactionContext tx = beginTransaction()) {
      final CollectionService collections = tx.getCollectionService();

      tx.lockHeader();
      if (collections.get(collection) == null)
        return false;

      tx.writeLock(collection);
      collections.drop(collections.get(collection));

      tx.commit();
      return true;
    }
  }

  @Override
  public void close() {
    if (!open)
      return;
    open = false;
    lockManager.close();
    LogManager.instance().log(this, Level.FINE, "Closed document engine");
  }

  private AutoId getDefaultAutoId() {
    return configuration.getValueAsEnum(GlobalConfiguration.DEFAULT_AUTO_ID, AutoId.class);
  }

  private void checkOpen() {
    if (!open)
      throw new TransactionException("Document engine is closed");
  }
}
