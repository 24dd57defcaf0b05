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

import java.util.TreeMap;

/**
 * Page holding the data blocks of one collection.
 */
public class DataPage extends BasePage {
  /** Bytes accounted for each block besides its payload. */
  public static final int BLOCK_OVERHEAD = 16;

  private final TreeMap<Integer, DataBlock> blocks    = new TreeMap<>();
  private       int                         nextIndex = 0;
  private       int                         usedBytes = 0;

  public DataPage(final int pageId) {
    super(pageId);
  }

  @Override
  public PAGE_TYPE getPageType() {
    return PAGE_TYPE.DATA;
  }

  public DataBlock getBlock(final int index) {
    return blocks.get(index);
  }

  public int getUsedBytes() {
    return usedBytes;
  }

  public DataBlock addBlock(final byte[] data, final int extendPageId) {
    final DataBlock block = new DataBlock(new PageAddress(pageId, nextIndex++), data, extendPageId);
    blocks.put(block.getPosition().getIndex(), block);
    usedBytes += block.getData().length + BLOCK_OVERHEAD;
    return block;
  }

  public void updateBlock(final DataBlock block, final byte[] data, final int extendPageId) {
    usedBytes -= block.getData().length;
    block.setContent(data, extendPageId);
    usedBytes += block.getData().length;
  }

  @Override
  public DataPage copy() {
    final DataPage copy = new DataPage(pageId);
    for (final DataBlock block : blocks.values())
      copy.blocks.put(block.getPosition().getIndex(), block.copy());
    copy.nextIndex = nextIndex;
    copy.usedBytes = usedBytes;
    return copy;
  }
}
