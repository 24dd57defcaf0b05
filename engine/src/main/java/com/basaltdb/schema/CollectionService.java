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
package com.basaltdb.schema;

import com.basaltdb.GlobalConfiguration;
import com.basaltdb.engine.BasePage;
import com.basaltdb.engine.CollectionPage;
import com.basaltdb.engine.DataBlock;
import com.basaltdb.engine.DataService;
import com.basaltdb.engine.HeaderPage;
import com.basaltdb.engine.PageService;
import com.basaltdb.exception.CollectionAlreadyExistsException;
import com.basaltdb.exception.CollectionLimitExceededException;
import com.basaltdb.exception.InvalidFormatException;
import com.basaltdb.index.IndexDescriptor;
import com.basaltdb.index.IndexNode;
import com.basaltdb.index.IndexService;
import com.basaltdb.log.LogManager;
import com.basaltdb.transaction.TransactionContext;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.logging.Level;

/**
 * Directory of the collections registered in the header page. Every change to the directory is done under the header lock of the
 * current transaction.
 */
public class CollectionService {
  public static final String PK_INDEX_NAME       = "_id";
  public static final String PK_INDEX_EXPRESSION = "$._id";

  private final TransactionContext tx;
  private final PageService        pager;
  private final IndexService       indexer;
  private final DataService        data;

  public CollectionService(final TransactionContext tx, final PageService pager, final IndexService indexer, final DataService data) {
    this.tx = tx;
    this.pager = pager;
    this.indexer = indexer;
    this.data = data;
  }

  /**
   * Returns the collection page, or null if the collection does not exist.
   */
  public CollectionPage get(final String name) {
    if (name == null || name.isBlank())
      throw new IllegalArgumentException("Collection name is null or empty");

    final Integer pageId = tx.getPage(HeaderPage.HEADER_PAGE_ID, HeaderPage.class).getCollectionPageId(name);
    return pageId != null ? tx.getPage(pageId, CollectionPage.class) : null;
  }

  /**
   * Returns the collection page, creating the collection if it does not exist. Creation acquires the header lock and checks again
   * because another transaction could have created the collection while this one was waiting.
   */
  public CollectionPage getOrAdd(final String name) {
    CollectionPage collection = get(name);
    if (collection == null) {
      tx.lockHeader();

      collection = get(name);
      if (collection == null)
        collection = add(name);
    }
    return collection;
  }

  /**
   * Creates a new collection with its primary key index.
   *
   * @throws InvalidFormatException            if the name is not a valid identifier
   * @throws CollectionAlreadyExistsException  if a collection with the same name, ignoring case, exists
   * @throws CollectionLimitExceededException  if the collection directory would exceed its size limit
   */
  public CollectionPage add(final String name) {
    if (!CollectionPage.isValidName(name))
      throw new InvalidFormatException(name);

    tx.lockHeader();

    final HeaderPage header = tx.getPageToModify(HeaderPage.HEADER_PAGE_ID, HeaderPage.class);
    if (header.containsCollection(name))
      throw new CollectionAlreadyExistsException(name);

    final int limit = tx.getConfiguration().getValueAsInteger(GlobalConfiguration.MAX_COLLECTIONS_SIZE);
    final int projectedSize = header.getCollectionsSize() + name.length() + HeaderPage.ENTRY_OVERHEAD;
    if (projectedSize >= limit)
      throw new CollectionLimitExceededException(name, projectedSize, limit);

    final int maxIndexes = tx.getConfiguration().getValueAsInteger(GlobalConfiguration.MAX_INDEXES);
    final CollectionPage collection = pager.newPage(pageId -> new CollectionPage(pageId, maxIndexes));
    collection.setName(name);

    header.putCollection(name, collection.getPageId());
    tx.setDirty(header);

    indexer.createIndex(collection, PK_INDEX_NAME, PK_INDEX_EXPRESSION, true);

    LogManager.instance().log(this, Level.FINE, "Created collection '%s' (page=%d)", name, collection.getPageId());
    return collection;
  }

  /**
   * Returns all the collections. The header is read again every time a new iteration starts.
   */
  public Iterable<CollectionPage> getAll() {
    return () -> {
      final List<Integer> pageIds = new ArrayList<>(tx.getPage(HeaderPage.HEADER_PAGE_ID, HeaderPage.class).getCollections().values());
      final Iterator<Integer> ids = pageIds.iterator();
      return new Iterator<>() {
        @Override
        public boolean hasNext() {
          return ids.hasNext();
        }

        @Override
        public CollectionPage next() {
          if (!ids.hasNext())
            throw new NoSuchElementException();
          return tx.getPage(ids.next(), CollectionPage.class);
        }
      };
    };
  }

  /**
   * Renames a collection. The new name must be valid and not used by any collection, ignoring case.
   *
   * @throws CollectionLimitExceededException if the longer name would make the collection directory exceed its size limit
   */
  public void rename(final CollectionPage collection, final String newName) {
    if (!CollectionPage.isValidName(newName))
      throw new InvalidFormatException(newName);

    tx.lockHeader();

    for (final CollectionPage c : getAll())
      if (c.getName().equalsIgnoreCase(newName))
        throw new CollectionAlreadyExistsException(newName);

    final String oldName = collection.getName();

    final HeaderPage header = tx.getPageToModify(HeaderPage.HEADER_PAGE_ID, HeaderPage.class);

    final int limit = tx.getConfiguration().getValueAsInteger(GlobalConfiguration.MAX_COLLECTIONS_SIZE);
    final int projectedSize = header.getCollectionsSize() - oldName.length() + newName.length();
    if (projectedSize >= limit)
      throw new CollectionLimitExceededException(newName, projectedSize, limit);

    final CollectionPage toModify = tx.getPageToModify(collection.getPageId(), CollectionPage.class);
    toModify.setName(newName);
    tx.setDirty(toModify);

    header.removeCollection(oldName);
    header.putCollection(newName, toModify.getPageId());
    tx.setDirty(header);

    LogManager.instance().log(this, Level.FINE, "Renamed collection '%s' to '%s'", oldName, newName);
  }

  /**
   * Drops a collection, releasing every page it owns: index nodes, sentinels, data pages with their overflow chains and the
   * collection page.
   */
  public void drop(final CollectionPage collection) {
    tx.lockHeader();

    final Set<Integer> pages = new LinkedHashSet<>();

    for (final IndexDescriptor index : collection.getIndexes(true)) {
      for (final IndexNode node : indexer.findAll(index, IndexService.ORDER.ASCENDING)) {
        if (index.isPrimaryKey()) {
          pages.add(node.getDataBlock().getPageId());

          final DataBlock block = data.getBlock(node.getDataBlock());
          if (block.hasExtendPage())
            pager.deletePage(block.getExtendPageId(), true);
        }
        pages.add(node.getPosition().getPageId());
      }

      pages.add(index.getHead().getPageId());
      pages.add(index.getTail().getPageId());
      if (index.getFreeIndexPageId() != BasePage.NO_PAGE)
        pages.add(index.getFreeIndexPageId());
    }

    if (collection.getFreeDataPageId() != BasePage.NO_PAGE)
      pages.add(collection.getFreeDataPageId());

    for (final Integer pageId : pages)
      pager.deletePage(pageId);

    final HeaderPage header = tx.getPageToModify(HeaderPage.HEADER_PAGE_ID, HeaderPage.class);
    header.removeCollection(collection.getName());
    tx.setDirty(header);

    pager.deletePage(collection.getPageId());

    LogManager.instance().log(this, Level.FINE, "Dropped collection '%s' (released %d pages)", collection.getName(), pages.size() + 1);
  }
}
