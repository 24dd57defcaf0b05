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
package com.basaltdb.index;

import com.basaltdb.GlobalConfiguration;
import com.basaltdb.database.Bound;
import com.basaltdb.database.DocumentComparator;
import com.basaltdb.engine.BasePage;
import com.basaltdb.engine.CollectionPage;
import com.basaltdb.engine.IndexPage;
import com.basaltdb.engine.PageAddress;
import com.basaltdb.engine.PageService;
import com.basaltdb.exception.DuplicatedKeyException;
import com.basaltdb.exception.ErrorCode;
import com.basaltdb.exception.IndexException;
import com.basaltdb.transaction.TransactionContext;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Maintains the indexes of the collections. Each index is a doubly linked list of {@link IndexNode}s sorted by key, delimited by a
 * head node with key {@link Bound#MIN} and a tail node with key {@link Bound#MAX}. Nodes with the same key keep the insertion order.
 */
public class IndexService {
  public enum ORDER {ASCENDING, DESCENDING}

  private final TransactionContext tx;
  private final PageService        pager;
  private final int                nodesPerPage;

  public IndexService(final TransactionContext tx, final PageService pager) {
    this.tx = tx;
    this.pager = pager;
    this.nodesPerPage = tx.getConfiguration().getValueAsInteger(GlobalConfiguration.INDEX_NODES_PER_PAGE);
  }

  /**
   * Creates an index in the first free slot of the collection, together with its head and tail sentinels. The collection must be a
   * private copy of the transaction.
   *
   * @throws IndexException with {@link ErrorCode#INDEX_LIMIT_EXCEEDED} if every slot is taken
   */
  public IndexDescriptor createIndex(final CollectionPage collection, final String name, final String expression, final boolean unique) {
    final int slot = collection.getFreeIndexSlot();
    if (slot < 0)
      throw new IndexException(ErrorCode.INDEX_LIMIT_EXCEEDED,
          "Collection '" + collection.getName() + "' already has the maximum number of indexes (" + collection.getMaxIndexes() + ")");

    final IndexDescriptor index = new IndexDescriptor(slot);
    index.setName(name);
    index.setExpression(expression);
    index.setUnique(unique);

    final IndexPage page = pager.newPage(IndexPage::new);
    index.setFreeIndexPageId(page.getPageId());

    final IndexNode head = page.addNode(slot, Bound.MIN, null, null);
    final IndexNode tail = page.addNode(slot, Bound.MAX, null, null);
    head.setNext(tail.getPosition());
    tail.setPrev(head.getPosition());

    index.setHead(head.getPosition());
    index.setTail(tail.getPosition());

    collection.setIndex(index);
    tx.setDirty(collection);
    return index;
  }

  /**
   * Inserts a node in key order, after any node with an equal key.
   *
   * @param collection  private copy of the collection that owns the index
   * @param dataBlock   address of the document data block
   * @param primaryNode primary node of the document, null when adding to the primary key index
   *
   * @throws DuplicatedKeyException if the index is unique and the key is already present
   */
  public IndexNode addNode(final CollectionPage collection, final IndexDescriptor index, final Object key, final PageAddress dataBlock,
      final IndexNode primaryNode) {
    if (key instanceof Bound)
      throw new IndexException("Value '" + key + "' is reserved for index sentinels and cannot be used as key");

    final DocumentComparator comparator = DocumentComparator.INSTANCE;

    // FIND THE FIRST NODE WITH A GREATER KEY. THE TAIL ALWAYS STOPS THE SCAN
    IndexNode current = getNode(getNode(index.getHead()).getNext());
    int cmp;
    while ((cmp = comparator.compare(current.getKey(), key)) <= 0) {
      if (cmp == 0 && index.isUnique())
        throw new DuplicatedKeyException(index.getName(), key, current.getDataBlock());
      current = getNode(current.getNext());
    }

    final IndexPage page = getFreeIndexPage(collection, index);
    final IndexNode node = page.addNode(index.getSlot(), key, dataBlock, primaryNode != null ? primaryNode.getPosition() : null);

    final IndexNode prev = getNodeToModify(current.getPrev());
    final IndexNode next = getNodeToModify(current.getPosition());

    node.setPrev(prev.getPosition());
    node.setNext(next.getPosition());
    prev.setNext(node.getPosition());
    next.setPrev(node.getPosition());

    return node;
  }

  /**
   * Returns the nodes of an index, sentinels excluded. Nodes are read lazily while iterating, each new iteration restarts from the
   * head (or tail).
   */
  public Iterable<IndexNode> findAll(final IndexDescriptor index, final ORDER order) {
    final boolean ascending = order == ORDER.ASCENDING;
    final PageAddress start = ascending ? index.getHead() : index.getTail();
    final PageAddress end = ascending ? index.getTail() : index.getHead();

    return () -> new Iterator<>() {
      private PageAddress cursor = step(getNode(start));

      @Override
      public boolean hasNext() {
        return !cursor.equals(end);
      }

      @Override
      public IndexNode next() {
        if (!hasNext())
          throw new NoSuchElementException();
        final IndexNode node = getNode(cursor);
        cursor = step(node);
        return node;
      }

      private PageAddress step(final IndexNode node) {
        return ascending ? node.getNext() : node.getPrev();
      }
    };
  }

  /**
   * Returns the first node with the key, or null if not found.
   */
  public IndexNode find(final IndexDescriptor index, final Object key) {
    for (final IndexNode node : findAll(index, ORDER.ASCENDING)) {
      final int cmp = DocumentComparator.INSTANCE.compare(node.getKey(), key);
      if (cmp == 0)
        return node;
      if (cmp > 0)
        break;
    }
    return null;
  }

  /**
   * Returns every node with the key, in insertion order.
   */
  public List<IndexNode> findEquals(final IndexDescriptor index, final Object key) {
    final List<IndexNode> result = new ArrayList<>();
    for (final IndexNode node : findAll(index, ORDER.ASCENDING)) {
      final int cmp = DocumentComparator.INSTANCE.compare(node.getKey(), key);
      if (cmp == 0)
        result.add(node);
      else if (cmp > 0)
        break;
    }
    return result;
  }

  /**
   * Removes the node with the key that points to the data block.
   *
   * @return false if no such node exists
   */
  public boolean deleteNode(final IndexDescriptor index, final Object key, final PageAddress dataBlock) {
    IndexNode found = null;
    for (final IndexNode node : findAll(index, ORDER.ASCENDING)) {
      final int cmp = DocumentComparator.INSTANCE.compare(node.getKey(), key);
      if (cmp == 0 && node.getDataBlock().equals(dataBlock)) {
        found = node;
        break;
      }
      if (cmp > 0)
        break;
    }

    if (found == null)
      return false;

    final IndexNode prev = getNodeToModify(found.getPrev());
    final IndexNode next = getNodeToModify(found.getNext());
    prev.setNext(next.getPosition());
    next.setPrev(prev.getPosition());

    final IndexPage page = tx.getPageToModify(found.getPosition().getPageId(), IndexPage.class);
    page.removeNode(found.getPosition().getIndex());
    tx.setDirty(page);

    if (page.getNodeCount() == 0 && page.getPageId() != index.getFreeIndexPageId())
      pager.deletePage(page.getPageId());

    return true;
  }

  public IndexNode getNode(final PageAddress address) {
    final IndexNode node = tx.getPage(address.getPageId(), IndexPage.class).getNode(address.getIndex());
    if (node == null)
      throw new IndexException("Index node " + address + " not found");
    return node;
  }

  private IndexNode getNodeToModify(final PageAddress address) {
    final IndexPage page = tx.getPageToModify(address.getPageId(), IndexPage.class);
    final IndexNode node = page.getNode(address.getIndex());
    if (node == null)
      throw new IndexException("Index node " + address + " not found");
    tx.setDirty(page);
    return node;
  }

  private IndexPage getFreeIndexPage(final CollectionPage collection, final IndexDescriptor index) {
    if (index.getFreeIndexPageId() != BasePage.NO_PAGE) {
      final IndexPage current = tx.getPage(index.getFreeIndexPageId(), IndexPage.class);
      if (current.getNodeCount() < nodesPerPage) {
        final IndexPage page = tx.getPageToModify(current.getPageId(), IndexPage.class);
        tx.setDirty(page);
        return page;
      }
    }

    final IndexPage page = pager.newPage(IndexPage::new);
    index.setFreeIndexPageId(page.getPageId());
    tx.setDirty(collection);
    return page;
  }
}
