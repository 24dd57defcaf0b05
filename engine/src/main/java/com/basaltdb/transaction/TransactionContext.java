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
package com.basaltdb.transaction;

import com.basaltdb.ContextConfiguration;
import com.basaltdb.GlobalConfiguration;
import com.basaltdb.engine.BasePage;
import com.basaltdb.engine.DataService;
import com.basaltdb.engine.HeaderPage;
import com.basaltdb.engine.PageManager;
import com.basaltdb.engine.PageService;
import com.basaltdb.exception.ErrorCode;
import com.basaltdb.exception.StorageException;
import com.basaltdb.exception.TransactionException;
import com.basaltdb.index.IndexService;
import com.basaltdb.log.LogManager;
import com.basaltdb.schema.CollectionService;
import com.basaltdb.utility.LockManager;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntFunction;
import java.util.logging.Level;

/**
 * Manages the pages and the locks of a transaction. Pages are read from the committed storage until the transaction asks to modify
 * them: at that point a private copy is created and every later read returns the copy. Only the copies marked dirty with
 * {@link #setDirty(BasePage)} and the pages created in the transaction are published at commit. Locks are acquired on demand and
 * released at commit or rollback.
 * <p>
 * A read-only transaction reads from the snapshot taken at begin and cannot modify pages nor acquire locks.
 * <p>
 * The instance is not thread safe: use one transaction per thread.
 */
public class TransactionContext implements AutoCloseable {
  public static final  String     HEADER_RESOURCE            = "header";
  public static final  String     COLLECTION_RESOURCE_PREFIX = "collection:";
  private static final AtomicLong TX_COUNTER                 = new AtomicLong();

  public enum STATUS {BEGUN, COMMITTED, ROLLED_BACK}

  private final long                                      txId;
  private final PageManager                               pageManager;
  private final LockManager<String, TransactionContext>   lockManager;
  private final ContextConfiguration                      configuration;
  private final Map<Integer, BasePage>                    snapshot;
  private final long                                      lockTimeout;
  private final Map<Integer, BasePage>                    workingPages     = new HashMap<>();
  private final Set<Integer>                              dirtyPageIds     = new LinkedHashSet<>();
  private final Set<Integer>                              newPageIds       = new HashSet<>();
  private final Set<Integer>                              deletedPageIds   = new LinkedHashSet<>();
  private final Set<Integer>                              releasedNewPages = new HashSet<>();
  private final List<String>                              lockedResources  = new ArrayList<>();
  private final PageService                               pageService;
  private final DataService                               dataService;
  private final IndexService                              indexService;
  private final CollectionService                         collectionService;
  private       STATUS                                    status           = STATUS.BEGUN;

  public TransactionContext(final PageManager pageManager, final LockManager<String, TransactionContext> lockManager,
      final ContextConfiguration configuration, final boolean readOnly) {
    this.txId = TX_COUNTER.incrementAndGet();
    this.pageManager = pageManager;
    this.lockManager = lockManager;
    this.configuration = configuration;
    this.snapshot = readOnly ? pageManager.getSnapshot() : null;
    this.lockTimeout = configuration.getValueAsLong(GlobalConfiguration.TX_LOCK_TIMEOUT);

    this.pageService = new PageService(this);
    this.dataService = new DataService(this, pageService);
    this.indexService = new IndexService(this, pageService);
    this.collectionService = new CollectionService(this, pageService, indexService, dataService);
  }

  public long getId() {
    return txId;
  }

  public STATUS getStatus() {
    return status;
  }

  public boolean isActive() {
    return status == STATUS.BEGUN;
  }

  public boolean isReadOnly() {
    return snapshot != null;
  }

  public ContextConfiguration getConfiguration() {
    return configuration;
  }

  public PageService getPageService() {
    return pageService;
  }

  public DataService getDataService() {
    return dataService;
  }

  public IndexService getIndexService() {
    return indexService;
  }

  public CollectionService getCollectionService() {
    return collectionService;
  }

  /**
   * Returns the page as seen by this transaction: the private copy if the transaction already modified it, otherwise the committed
   * version. The returned committed page must not be modified.
   *
   * @throws StorageException if the page does not exist or it was deleted in this transaction
   */
  public <T extends BasePage> T getPage(final int pageId, final Class<T> type) {
    checkActive();

    BasePage page = workingPages.get(pageId);
    if (page == null) {
      if (deletedPageIds.contains(pageId) || releasedNewPages.contains(pageId))
        throw new StorageException(ErrorCode.PAGE_NOT_FOUND, "Page #" + pageId + " was deleted in transaction " + txId).addContext("pageId",
            pageId);

      page = snapshot != null ? snapshot.get(pageId) : pageManager.getSnapshot().get(pageId);
      if (page == null)
        throw new StorageException(ErrorCode.PAGE_NOT_FOUND, "Page #" + pageId + " not found").addContext("pageId", pageId);
    }
    return cast(page, type);
  }

  /**
   * Returns the private copy of the page, creating it on the first call. Changes become visible to other transactions only if the
   * page is marked dirty and the transaction commits.
   */
  public <T extends BasePage> T getPageToModify(final int pageId, final Class<T> type) {
    checkWritable();

    final BasePage working = workingPages.get(pageId);
    if (working != null)
      return cast(working, type);

    final BasePage copy = getPage(pageId, type).copy();
    workingPages.put(pageId, copy);
    return cast(copy, type);
  }

  public void setDirty(final BasePage page) {
    checkWritable();
    if (workingPages.get(page.getPageId()) != page)
      throw new TransactionException("Page " + page + " is not a private copy of transaction " + txId);
    dirtyPageIds.add(page.getPageId());
  }

  public boolean isDirty(final int pageId) {
    return dirtyPageIds.contains(pageId);
  }

  /**
   * Creates a new page. New pages are always dirty.
   */
  public <T extends BasePage> T newPage(final IntFunction<T> factory) {
    checkWritable();

    final int pageId = pageManager.allocatePageId();
    newPageIds.add(pageId);

    final T page = factory.apply(pageId);
    workingPages.put(pageId, page);
    dirtyPageIds.add(pageId);
    return page;
  }

  public void deletePage(final int pageId) {
    checkWritable();
    if (pageId == HeaderPage.HEADER_PAGE_ID)
      throw new StorageException(ErrorCode.INTERNAL_ERROR, "Cannot delete the header page");

    // FAILS IF THE PAGE DOES NOT EXIST OR WAS ALREADY DELETED
    getPage(pageId, BasePage.class);

    workingPages.remove(pageId);
    dirtyPageIds.remove(pageId);
    if (newPageIds.remove(pageId))
      releasedNewPages.add(pageId);
    else
      deletedPageIds.add(pageId);
  }

  /**
   * Acquires the exclusive lock on the collection directory. Re-entrant.
   */
  public void lockHeader() {
    lock(HEADER_RESOURCE);
  }

  /**
   * Acquires the exclusive write lock on a collection. Names are locked ignoring case. Re-entrant.
   */
  public void writeLock(final String collectionName) {
    lock(COLLECTION_RESOURCE_PREFIX + collectionName.toLowerCase(Locale.ENGLISH));
  }

  public boolean isLocked(final String resource) {
    return lockedResources.contains(resource);
  }

  public void commit() {
    checkWritable();

    final List<BasePage> modified = new ArrayList<>(dirtyPageIds.size());
    for (final Integer pageId : dirtyPageIds)
      modified.add(workingPages.get(pageId));

    try {
      pageManager.commit(modified, deletedPageIds);
    } catch (final RuntimeException e) {
      rollback();
      throw e;
    }

    // IDS OF PAGES CREATED AND DELETED IN THIS TRANSACTION WERE NEVER PUBLISHED
    pageManager.releasePageIds(releasedNewPages);

    LogManager.instance()
        .log(this, Level.FINEST, "Transaction %d committed (modified=%d new=%d deleted=%d)", txId, modified.size(), newPageIds.size(),
            deletedPageIds.size());

    status = STATUS.COMMITTED;
    reset();
  }

  public void rollback() {
    checkActive();

    if (snapshot == null) {
      final Set<Integer> toRelease = new HashSet<>(newPageIds);
      toRelease.addAll(releasedNewPages);
      pageManager.releasePageIds(toRelease);

      if (!dirtyPageIds.isEmpty() || !deletedPageIds.isEmpty())
        LogManager.instance()
            .log(this, Level.FINE, "Transaction %d rolled back (discarded modified=%d deleted=%d)", txId, dirtyPageIds.size(),
                deletedPageIds.size());
    }

    status = STATUS.ROLLED_BACK;
    reset();
  }

  /**
   * Rolls back the transaction if it was not committed.
   */
  @Override
  public void close() {
    if (status == STATUS.BEGUN)
      rollback();
  }

  @Override
  public String toString() {
    return "Tx#" + txId;
  }

  private void lock(final String resource) {
    checkWritable();

    final LockManager.LOCK_STATUS result = lockManager.tryLock(resource, this, lockTimeout);
    switch (result) {
    case YES -> lockedResources.add(resource);
    case ALREADY_ACQUIRED -> {
      // ALREADY OWNED BY THIS TRANSACTION
    }
    case NO -> throw new TransactionException("Cannot acquire lock on resource '" + resource + "' for transaction " + txId);
    }
  }

  private void reset() {
    workingPages.clear();
    dirtyPageIds.clear();
    newPageIds.clear();
    deletedPageIds.clear();
    releasedNewPages.clear();

    for (int i = lockedResources.size() - 1; i >= 0; --i)
      lockManager.unlock(lockedResources.get(i), this);
    lockedResources.clear();
  }

  private void checkActive() {
    if (status != STATUS.BEGUN)
      throw new TransactionException("Transaction " + txId + " is not active (status=" + status + ")");
  }

  private void checkWritable() {
    checkActive();
    if (snapshot != null)
      throw new TransactionException("Transaction " + txId + " is read-only");
  }

  private <T extends BasePage> T cast(final BasePage page, final Class<T> type) {
    if (!type.isInstance(page))
      throw new StorageException(ErrorCode.PAGE_NOT_FOUND,
          "Page #" + page.getPageId() + " is a " + page.getPageType() + " page, expected " + type.getSimpleName()).addContext("pageId",
          page.getPageId());
    return type.cast(page);
  }
}
