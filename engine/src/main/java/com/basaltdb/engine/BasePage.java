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

/**
 * Base page. Committed pages are shared between transactions and never modified: a transaction that needs to change a page works on
 * the copy returned by {@link #copy()}, which is published at commit.
 */
public abstract class BasePage {
  public static final int NO_PAGE = -1;

  public enum PAGE_TYPE {HEADER, COLLECTION, INDEX, DATA, EXTEND}

  protected final int pageId;

  protected BasePage(final int pageId) {
    this.pageId = pageId;
  }

  public int getPageId() {
    return pageId;
  }

  public abstract PAGE_TYPE getPageType();

  /**
   * Returns a deep copy of the page, so changes do not affect the committed version.
   */
  public abstract BasePage copy();

  @Override
  public String toString() {
    return getPageType() + "#" + pageId;
  }
}
