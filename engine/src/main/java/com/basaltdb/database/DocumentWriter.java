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

import com.basaltdb.engine.CollectionPage;
import com.basaltdb.engine.DataBlock;
import com.basaltdb.engine.PageAddress;
import com.basaltdb.exception.IndexException;
import com.basaltdb.exception.InvalidDataTypeException;
import com.basaltdb.exception.InvalidFormatException;
import com.basaltdb.exception.TransactionException;
import com.basaltdb.index.IndexDescriptor;
import com.basaltdb.index.IndexNode;
import com.basaltdb.index.IndexService;
import com.basaltdb.index.KeyExpression;
import com.basaltdb.schema.CollectionService;
import com.basaltdb.serializer.DocumentSerializer;
import com.basaltdb.transaction.TransactionContext;

import java.util.List;

/**
 * Writes documents in collections keeping the data blocks, the primary key index and the secondary indexes aligned. Each public
 * operation runs in its own transaction and commits once: a failure on any document rolls back the whole batch.
 */
public class DocumentWriter {
  private final DocumentEngine     engine;
  private final DocumentSerializer serializer;
  private final IdentityGenerator  identityGenerator;

  public DocumentWriter(final DocumentEngine engine, final DocumentSerializer serializer, final IdentityGenerator identityGenerator) {
    this.engine = engine;
    this.serializer = serializer;
    this.identityGenerator = identityGenerator;
  }

  /**
   * Inserts the documents in the collection, creating the collection if needed. Documents without `_id` receive an identity
   * generated with the {@code autoId} policy; the identity is set on the passed document.
   *
   * @return the number of inserted documents
   */
  public int insert(final String collectionName, final Iterable<Document> documents, final AutoId autoId) {
    checkArguments(collectionName, documents);
    if (autoId == null)
      throw new IllegalArgumentException("AutoId policy is null");

    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = lockCollection(tx, collectionName, true);

      int count = 0;
      for (final Document document : documents) {
        insertDocument(tx, collection, document, autoId);
        ++count;
      }

      tx.commit();
      return count;
    }
  }

  public int insertOne(final String collectionName, final Document document, final AutoId autoId) {
    if (document == null)
      throw new IllegalArgumentException("Document is null");
    return insert(collectionName, List.of(document), autoId);
  }

  /**
   * Replaces the documents with the same `_id`, inserting the ones not found or without `_id`.
   *
   * @return the number of inserted documents, updated ones are not counted
   */
  public int upsert(final String collectionName, final Iterable<Document> documents, final AutoId autoId) {
    checkArguments(collectionName, documents);
    if (autoId == null)
      throw new IllegalArgumentException("AutoId policy is null");

    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = lockCollection(tx, collectionName, true);

      int count = 0;
      for (final Document document : documents) {
        if (document == null)
          throw new IllegalArgumentException("Document is null");

        if (document.getIdentity() == null || !updateDocument(tx, collection, document)) {
          insertDocument(tx, collection, document, autoId);
          ++count;
        }
      }

      tx.commit();
      return count;
    }
  }

  /**
   * Replaces the documents with the same `_id`. The collection is not created if missing.
   *
   * @return the number of updated documents
   */
  public int update(final String collectionName, final Iterable<Document> documents) {
    checkArguments(collectionName, documents);

    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = lockCollection(tx, collectionName, false);
      if (collection == null)
        return 0;

      int count = 0;
      for (final Document document : documents) {
        if (document == null)
          throw new IllegalArgumentException("Document is null");
        if (updateDocument(tx, collection, document))
          ++count;
      }

      tx.commit();
      return count;
    }
  }

  /**
   * Creates a secondary index and indexes the documents already in the collection.
   *
   * @return false if an index with the same name and definition already exists
   *
   * @throws IndexException if an index with the same name but a different definition exists, or the collection has no free index
   *                        slot
   */
  public boolean ensureIndex(final String collectionName, final String indexName, final String expression, final boolean unique) {
    if (collectionName == null || collectionName.isBlank())
      throw new IllegalArgumentException("Collection name is null or empty");
    if (!CollectionPage.isValidName(indexName))
      throw new InvalidFormatException(indexName);
    if (CollectionService.PK_INDEX_NAME.equals(indexName))
      return false;

    final KeyExpression keyExpression = KeyExpression.parse(expression);

    try (final TransactionContext tx = engine.beginTransaction()) {
      final CollectionPage collection = lockCollection(tx, collectionName, true);

      final IndexDescriptor existent = collection.getIndex(indexName);
      if (existent != null) {
        if (existent.getExpression().equals(keyExpression.getSource()) && existent.isUnique() == unique)
          return false;
        throw new IndexException(
            "Index '" + indexName + "' already exists on collection '" + collection.getName() + "' with a different definition");
      }

      final IndexService indexer = tx.getIndexService();
      final IndexDescriptor index = indexer.createIndex(collection, indexName, keyExpression.getSource(), unique);

      for (final IndexNode pk : indexer.findAll(collection.getPK(), IndexService.ORDER.ASCENDING)) {
        final Document document = serializer.deserialize(tx.getDataService().read(pk.getDataBlock()));
        for (final Object key : keyExpression.execute(document, unique))
          indexer.addNode(collection, index, key, pk.getDataBlock(), pk);
      }

      tx.commit();
      return true;
    }
  }

  /**
   * Inserts one document in a collection page owned by the transaction.
   */
  public void insertDocument(final TransactionContext tx, final CollectionPage collection, final Document document, final AutoId autoId) {
    if (document == null)
      throw new IllegalArgumentException("Document is null");

    collection.setSequence(collection.getSequence() + 1);
    tx.setDirty(collection);

    final Object id;
    if (!document.hasIdentity()) {
      id = switch (autoId) {
        case OBJECT_ID -> identityGenerator.objectId();
        case GUID -> identityGenerator.guid();
        case DATE_TIME -> identityGenerator.timestamp();
        case INT32 -> (int) collection.getSequence();
        case INT64 -> collection.getSequence();
      };
      document.setIdentity(id);

    } else {
      id = document.getIdentity();

      if (autoId.isSequential()) {
        // JUMP THE SEQUENCE FORWARD TO A GREATER IDENTITY, OTHERWISE GIVE BACK THE INCREMENT
        final long current = id instanceof Number n ? n.longValue() : 0L;
        collection.setSequence(current >= collection.getSequence() ? current : collection.getSequence() - 1);
      }
    }

    if (id == null || id instanceof Bound)
      throw new InvalidDataTypeException(Document.ID_PROPERTY, id);

    final byte[] payload = serializer.serialize(document);

    final DataBlock dataBlock = tx.getDataService().insert(collection, payload);

    final IndexService indexer = tx.getIndexService();
    final IndexNode pk = indexer.addNode(collection, collection.getPK(), id, dataBlock.getPosition(), null);

    for (final IndexDescriptor index : collection.getIndexes(false))
      for (final Object key : KeyExpression.parse(index.getExpression()).execute(document, index.isUnique()))
        indexer.addNode(collection, index, key, dataBlock.getPosition(), pk);

    collection.setDocumentCount(collection.getDocumentCount() + 1);
  }

  /**
   * Replaces the document with the same `_id` in a collection page owned by the transaction.
   *
   * @return false if no document has the same `_id`
   */
  public boolean updateDocument(final TransactionContext tx, final CollectionPage collection, final Document document) {
    final Object id = document.getIdentity();
    if (id == null || id instanceof Bound)
      throw new InvalidDataTypeException(Document.ID_PROPERTY, id);

    final IndexService indexer = tx.getIndexService();

    final IndexNode pk = indexer.find(collection.getPK(), id);
    if (pk == null)
      return false;

    final PageAddress dataBlock = pk.getDataBlock();
    final Document previous = serializer.deserialize(tx.getDataService().read(dataBlock));

    tx.getDataService().update(collection, dataBlock, serializer.serialize(document));

    for (final IndexDescriptor index : collection.getIndexes(false)) {
      final KeyExpression expression = KeyExpression.parse(index.getExpression());

      for (final Object oldKey : expression.execute(previous, index.isUnique()))
        indexer.deleteNode(index, oldKey, dataBlock);

      for (final Object newKey : expression.execute(document, index.isUnique()))
        indexer.addNode(collection, index, newKey, dataBlock, pk);
    }
    return true;
  }

  /**
   * Resolves the collection, creating it if requested, then acquires its write lock and returns the private copy of the
   * collection page. Fails if the collection was dropped or renamed while waiting for the lock.
   */
  private CollectionPage lockCollection(final TransactionContext tx, final String collectionName, final boolean create) {
    final CollectionService collections = tx.getCollectionService();

    final CollectionPage collection = create ? collections.getOrAdd(collectionName) : collections.get(collectionName);
    if (collection == null)
      return null;

    tx.writeLock(collectionName);

    final CollectionPage current = collections.get(collectionName);
    if (current == null || current.getPageId() != collection.getPageId())
      throw new TransactionException("Collection '" + collectionName + "' was dropped or renamed by another transaction");

    return tx.getPageToModify(current.getPageId(), CollectionPage.class);
  }

  private static void checkArguments(final String collectionName, final Iterable<Document> documents) {
    if (collectionName == null || collectionName.isBlank())
      throw new IllegalArgumentException("Collection name is null or empty");
    if (documents == null)
      throw new IllegalArgumentException("Documents are null");
  }
}
