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
 * Encoded document stored in a {@link DataPage}. Payloads too large for a data page live in a chain of {@link ExtendPage}s and the
 * block keeps only the id of the first page of the chain.
 */
public class DataBlock {
  private static final byte[] EMPTY = new byte[0];

  private final PageAddress position;
  private       byte[]      data;
  private       int         extendPageId;

  public DataBlock(final PageAddress position, final byte[] data, final int extendPageId) {
    this.position = position;
    this.data = data != null ? data : EMPTY;
    this.extendPageId = extendPageId;
  }

  public PageAddress getPosition() {
    return position;
  }

  public byte[] getData() {
    return data;
  }

  public int getExtendPageId() {
    return extendPageId;
  }

  public boolean hasExtendPage() {
    return extendPageId != BasePage.NO_PAGE;
  }

  void setContent(final byte[] data, final int extendPageId) {
    this.data = data != null ? data : EMPTY;
    this.extendPageId = extendPageId;
  }

  DataBlock copy() {
    return new DataBlock(position, data, extendPageId);
  }

  @Override
  public String toString() {
    return "DataBlock" + position + " size=" + data.length + (hasExtendPage() ? " extend=" + extendPageId : "");
  }
}
