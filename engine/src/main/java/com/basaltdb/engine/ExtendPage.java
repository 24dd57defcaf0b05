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
 * Overflow page. A payload that does not fit in a data page is split over a chain of extend pages linked by
 * {@link #getNextPageId()}.
 */
public class ExtendPage extends BasePage {
  private byte[] data       = new byte[0];
  private int    nextPageId = NO_PAGE;

  public ExtendPage(final int pageId) {
    super(pageId);
  }

  @Override
  public PAGE_TYPE getPageType() {
    return PAGE_TYPE.EXTEND;
  }

  public byte[] getData() {
    return data;
  }

  public void setData(final byte[] data) {
    this.data = data;
  }

  public int getNextPageId() {
    return nextPageId;
  }

  public void setNextPageId(final int nextPageId) {
    this.nextPageId = nextPageId;
  }

  @Override
  public ExtendPage copy() {
    final ExtendPage copy = new ExtendPage(pageId);
    copy.data = data;
    copy.nextPageId = nextPageId;
    return copy;
  }
}
