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

import com.basaltdb.transaction.TransactionContext;

import java.util.function.IntFunction;

/**
 * Allocates and releases pages inside a transaction.
 */
public class PageService {
  private final TransactionContext tx;

  public PageService(final TransactionContext tx) {
    this.tx = tx;
  }

  public <T extends BasePage> T newPage(final IntFunction<T> factory) {
    return tx.newPage(factory);
  }

  public void deletePage(final int pageId) {
    deletePage(pageId, false);
  }

  /**
   * Releases a page.
   *
   * @param cascadeOverflow if true and the page is an {@link ExtendPage}, releases the whole chain that starts from it
   */
  public void deletePage(final int pageId, final boolean cascadeOverflow) {
    if (!cascadeOverflow) {
      tx.deletePage(pageId);
      return;
    }

    int current = pageId;
    while (current != BasePage.NO_PAGE) {
      final BasePage page = tx.getPage(current, BasePage.class);
      final int next = page instanceof ExtendPage extend ? extend.getNextPageId() : BasePage.NO_PAGE;
      tx.deletePage(current);
      current = next;
    }
  }
}
