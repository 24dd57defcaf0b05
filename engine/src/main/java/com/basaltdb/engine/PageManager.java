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

import com.basaltdb.exception.ErrorCode;
import com.basaltdb.exception.StorageException;
import com.basaltdb.log.LogManager;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.logging.*;

/**
 * Holds the committed pages. The committed set is an immutable snapshot replaced as a whole at every commit, so readers always see
 * the pages of one transaction all together or none of them. Page ids are allocated from the free list first, then from the
 * counter.
 */
public class PageManager {
  private volatile Map<Integer, BasePage> pages;
  private final    Deque<Integer>         freePageIds             = new ArrayDeque<>();
  private          int                    nextPageId              = HeaderPage.HEADER_PAGE_ID + 1;
  private final    AtomicLong             totalCommits            = new AtomicLong();
  private final    AtomicLong             totalPagesWritten       = new AtomicLong();
  private final    AtomicLong             totalPagesDeleted       = new AtomicLong();
  private final    AtomicLong             totalPagesAllocated     = new AtomicLong();

  public static class PPageManagerStats {
    public int  allocatedPages;
    public int  freePages;
    public long commits;
    public long pagesWritten;
    public long pagesDeleted;
    public long pagesAllocated;
  }

  public PageManager() {
    final Map<Integer, BasePage> initial = new HashMap<>();
    initial.put(HeaderPage.HEADER_PAGE_ID, new HeaderPage());
    this.pages = Collections.unmodifiableMap(initial);
  }

  /**
   * Returns the current committed view. The returned map never changes.
   */
  public Map<Integer, BasePage> getSnapshot() {
    return pages;
  }

  public BasePage getPage(final int pageId) {
    final BasePage page = pages.get(pageId);
    if (page == null)
      throw new StorageException(ErrorCode.PAGE_NOT_FOUND, "Page #" + pageId + " not found").addContext("pageId", pageId);
    return page;
  }

  public boolean isAllocated(final int pageId) {
    return pages.containsKey(pageId);
  }

  public Set<Integer> getAllocatedPages() {
    return Collections.unmodifiableSet(new TreeSet<>(pages.keySet()));
  }

  public synchronized int allocatePageId() {
    totalPagesAllocated.incrementAndGet();
    final Integer reused = freePageIds.pollFirst();
    return reused != null ? reused : nextPageId++;
  }

  /**
   * Gives back ids allocated by a transaction that never published them.
   */
  public synchronized void releasePageIds(final Collection<Integer> pageIds) {
    for (final Integer pageId : pageIds)
      if (!pages.containsKey(pageId))
        freePageIds.addLast(pageId);
  }

  /**
   * Publishes the pages of a transaction atomically.
   *
   * @param modifiedPages new versions of the pages, including pages created by the transaction
   * @param deletedPages  ids of the pages to remove, returned to the free list
   */
  public synchronized void commit(final Collection<BasePage> modifiedPages, final Collection<Integer> deletedPages) {
    if (modifiedPages.isEmpty() && deletedPages.isEmpty())
      return;

    final Map<Integer, BasePage> newPages = new HashMap<>(pages);
    for (final BasePage page : modifiedPages)
      newPages.put(page.getPageId(), page);

    for (final Integer pageId : deletedPages) {
      if (pageId == HeaderPage.HEADER_PAGE_ID)
        throw new StorageException(ErrorCode.INTERNAL_ERROR, "Cannot delete the header page");
      newPages.remove(pageId);
      freePageIds.addLast(pageId);
    }

    pages = Collections.unmodifiableMap(newPages);

    totalCommits.incrementAndGet();
    totalPagesWritten.addAndGet(modifiedPages.size());
    totalPagesDeleted.addAndGet(deletedPages.size());

    LogManager.instance()
        .log(this, Level.FINEST, "Committed %d pages, deleted %d pages (allocated=%d free=%d)", modifiedPages.size(), deletedPages.size(),
            newPages.size(), freePageIds.size());
  }

  public synchronized PPageManagerStats getStats() {
    final PPageManagerStats stats = new PPageManagerStats();
    stats.allocatedPages = pages.size();
    stats.freePages = freePageIds.size();
    stats.commits = totalCommits.get();
    stats.pagesWritten = totalPagesWritten.get();
    stats.pagesDeleted = totalPagesDeleted.get();
    stats.pagesAllocated = totalPagesAllocated.get();
    return stats;
  }
}
