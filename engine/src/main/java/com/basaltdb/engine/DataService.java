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

import com.basaltdb.GlobalConfiguration;
import com.basaltdb.exception.ErrorCode;
import com.basaltdb.exception.StorageException;
import com.basaltdb.transaction.TransactionContext;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Stores document payloads in the data pages of a collection. A payload larger than {@link #getMaxInlineSize()} is written to a chain
 * of {@link ExtendPage}s and the data block keeps only the first page id of the chain.
 */
public class DataService {
  /** Space of a data page not available for block payloads. */
  public static final int DATA_PAGE_RESERVED   = 64;
  /** Space of an extend page not available for payload. */
  public static final int EXTEND_PAGE_RESERVED = 16;

  private final TransactionContext tx;
  private final PageService        pager;
  private final int                pageSize;

  public DataService(final TransactionContext tx, final PageService pager) {
    this.tx = tx;
    this.pager = pager;
    this.pageSize = tx.getConfiguration().getValueAsInteger(GlobalConfiguration.PAGE_SIZE);
  }

  public int getMaxInlineSize() {
    return pageSize - DATA_PAGE_RESERVED;
  }

  public int getExtendPageCapacity() {
    return pageSize - EXTEND_PAGE_RESERVED;
  }

  /**
   * Stores a payload for the collection and returns the new block. The collection must be a private copy of the transaction: it is
   * marked dirty when a new data page is assigned to it.
   */
  public DataBlock insert(final CollectionPage collection, final byte[] payload) {
    final boolean overflow = payload.length > getMaxInlineSize();

    final DataPage page = getFreeDataPage(collection, overflow ? 0 : payload.length);

    final DataBlock block;
    if (overflow)
      block = page.addBlock(null, writeExtendChain(payload));
    else
      block = page.addBlock(payload, BasePage.NO_PAGE);

    tx.setDirty(page);
    return block;
  }

  public DataBlock getBlock(final PageAddress address) {
    final DataBlock block = tx.getPage(address.getPageId(), DataPage.class).getBlock(address.getIndex());
    if (block == null)
      throw new StorageException(ErrorCode.DATA_BLOCK_NOT_FOUND, "Data block " + address + " not found").addContext("address", address);
    return block;
  }

  /**
   * Reads the full payload of a block, following the overflow chain if present.
   */
  public byte[] read(final PageAddress address) {
    final DataBlock block = getBlock(address);
    if (!block.hasExtendPage())
      return block.getData();

    final ByteArrayOutputStream buffer = new ByteArrayOutputStream(getExtendPageCapacity() * 2);
    int current = block.getExtendPageId();
    while (current != BasePage.NO_PAGE) {
      final ExtendPage extend = tx.getPage(current, ExtendPage.class);
      buffer.writeBytes(extend.getData());
      current = extend.getNextPageId();
    }
    return buffer.toByteArray();
  }

  /**
   * Replaces the payload of a block in place. The previous overflow chain, if any, is released.
   */
  public DataBlock update(final CollectionPage collection, final PageAddress address, final byte[] payload) {
    final DataPage page = tx.getPageToModify(address.getPageId(), DataPage.class);
    final DataBlock block = page.getBlock(address.getIndex());
    if (block == null)
      throw new StorageException(ErrorCode.DATA_BLOCK_NOT_FOUND, "Data block " + address + " not found in collection '" + collection.getName() + "'")
          .addContext("address", address);

    if (block.hasExtendPage())
      pager.deletePage(block.getExtendPageId(), true);

    final int freeBytes = pageSize - page.getUsedBytes() + block.getData().length;
    if (payload.length <= getMaxInlineSize() && payload.length <= freeBytes)
      page.updateBlock(block, payload, BasePage.NO_PAGE);
    else
      page.updateBlock(block, null, writeExtendChain(payload));

    tx.setDirty(page);
    return block;
  }

  private DataPage getFreeDataPage(final CollectionPage collection, final int payloadSize) {
    final int needed = payloadSize + DataPage.BLOCK_OVERHEAD;

    if (collection.getFreeDataPageId() != BasePage.NO_PAGE) {
      final DataPage current = tx.getPage(collection.getFreeDataPageId(), DataPage.class);
      if (pageSize - current.getUsedBytes() >= needed)
        return tx.getPageToModify(current.getPageId(), DataPage.class);
    }

    final DataPage page = pager.newPage(DataPage::new);
    collection.setFreeDataPageId(page.getPageId());
    tx.setDirty(collection);
    return page;
  }

  private int writeExtendChain(final byte[] payload) {
    final int capacity = getExtendPageCapacity();

    int firstPageId = BasePage.NO_PAGE;
    ExtendPage previous = null;
    for (int offset = 0; offset < payload.length; offset += capacity) {
      final ExtendPage page = pager.newPage(ExtendPage::new);
      page.setData(Arrays.copyOfRange(payload, offset, Math.min(payload.length, offset + capacity)));

      if (previous == null)
        firstPageId = page.getPageId();
      else
        previous.setNextPageId(page.getPageId());
      previous = page;
    }
    return firstPageId;
  }
}
