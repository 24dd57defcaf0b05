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
package com.basaltdb.database;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Binary data type. It is backed by a Java Byte Buffer that grows in chunks while writing.
 * <br>
 * NOTE: This class is not thread safe.
 */
public class Binary {
  public static final int BYTE_SERIALIZED_SIZE = 1;
  public static final int INT_SERIALIZED_SIZE  = 4;
  public static final int LONG_SERIALIZED_SIZE = 8;

  private static final int DEFAULT_ALLOCATION_CHUNK = 512;

  private byte[]     content;
  private ByteBuffer buffer;
  private int        size;

  public Binary() {
    this(DEFAULT_ALLOCATION_CHUNK);
  }

  public Binary(final int initialSize) {
    this.content = new byte[Math.max(initialSize, 1)];
    this.buffer = ByteBuffer.wrap(content);
    this.size = 0;
  }

  public Binary(final byte[] buffer) {
    this.content = buffer;
    this.buffer = ByteBuffer.wrap(content);
    this.size = buffer.length;
  }

  public int position() {
    return buffer.position();
  }

  public void rewind() {
    buffer.position(0);
  }

  public int size() {
    return size;
  }

  public boolean hasRemaining() {
    return buffer.position() < size;
  }

  public void putByte(final byte value) {
    checkForAllocation(buffer.position(), BYTE_SERIALIZED_SIZE);
    buffer.put(value);
  }

  /**
   * Writes a signed number with zig-zag + variable length encoding.
   */
  public int putNumber(long value) {
    value = (value << 1) ^ (value >> 63);
    return putUnsignedNumber(value);
  }

  public int putUnsignedNumber(final long value) {
    int bytesUsed = 0;
    long v = value;
    while ((v & 0xFFFFFFFFFFFFFF80L) != 0L) {
      checkForAllocation(buffer.position(), BYTE_SERIALIZED_SIZE);
      buffer.put((byte) (v & 0x7F | 0x80));
      bytesUsed++;
      v >>>= 7;
    }
    checkForAllocation(buffer.position(), BYTE_SERIALIZED_SIZE);
    buffer.put((byte) (v & 0x7F));
    bytesUsed++;

    return bytesUsed;
  }

  public void putInt(final int value) {
    checkForAllocation(buffer.position(), INT_SERIALIZED_SIZE);
    buffer.putInt(value);
  }

  public void putLong(final long value) {
    checkForAllocation(buffer.position(), LONG_SERIALIZED_SIZE);
    buffer.putLong(value);
  }

  /**
   * Writes the length as unsigned number followed by the bytes.
   */
  public int putBytes(final byte[] value) {
    final int lengthSize = putUnsignedNumber(value.length);
    checkForAllocation(buffer.position(), value.length);
    buffer.put(value);
    return lengthSize + value.length;
  }

  public int putString(final String value) {
    return putBytes(value.getBytes(StandardCharsets.UTF_8));
  }

  public byte getByte() {
    checkForReading(BYTE_SERIALIZED_SIZE);
    return buffer.get();
  }

  public long getNumber() {
    final long raw = getUnsignedNumber();
    final long temp = (((raw << 63) >> 63) ^ raw) >> 1;
    // RE-FLIP THE TOP BIT IF THE ORIGINAL READ VALUE HAD IT SET
    return temp ^ (raw & (1L << 63));
  }

  public long getUnsignedNumber() {
    long value = 0L;
    int i = 0;
    long b;
    while (((b = getByte()) & 0x80L) != 0) {
      value |= (b & 0x7F) << i;
      i += 7;
      if (i > 63)
        throw new IllegalArgumentException("Variable length quantity is too long (must be <= 63)");
    }
    return value | (b << i);
  }

  public int getInt() {
    checkForReading(INT_SERIALIZED_SIZE);
    return buffer.getInt();
  }

  public long getLong() {
    checkForReading(LONG_SERIALIZED_SIZE);
    return buffer.getLong();
  }

  public byte[] getBytes() {
    final long length = getUnsignedNumber();
    if (length < 0 || length > size - buffer.position())
      throw new IllegalArgumentException("Invalid length " + length + " at position " + buffer.position() + " (size=" + size + ")");

    final byte[] result = new byte[(int) length];
    buffer.get(result);
    return result;
  }

  public String getString() {
    return new String(getBytes(), StandardCharsets.UTF_8);
  }

  public byte[] toByteArray() {
    final byte[] result = new byte[size];
    System.arraycopy(content, 0, result, 0, size);
    return result;
  }

  @Override
  public String toString() {
    return "Binary size=" + size + " pos=" + buffer.position();
  }

  private void checkForReading(final int bytesToRead) {
    if (buffer.position() + bytesToRead > size)
      throw new IllegalArgumentException("Cannot read " + bytesToRead + " bytes at position " + buffer.position() + " (size=" + size + ")");
  }

  /**
   * Allocates enough space and updates the size according to the bytes to write.
   */
  private void checkForAllocation(final int offset, final int bytesToWrite) {
    if (offset + bytesToWrite > content.length) {
      final int newSize = (((offset + bytesToWrite) / DEFAULT_ALLOCATION_CHUNK) + 1) * DEFAULT_ALLOCATION_CHUNK;

      final byte[] newContent = new byte[newSize];
      System.arraycopy(content, 0, newContent, 0, content.length);
      this.content = newContent;

      final int oldPosition = this.buffer.position();
      this.buffer = ByteBuffer.wrap(this.content);
      this.buffer.position(oldPosition);
    }

    if (offset + bytesToWrite > size)
      size = offset + bytesToWrite;
  }
}
