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
package com.basaltdb.serializer;

import com.basaltdb.database.Binary;
import com.basaltdb.database.Document;
import com.basaltdb.exception.ErrorCode;
import com.basaltdb.exception.StorageException;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.basaltdb.serializer.BinaryTypes.*;

/**
 * Encodes documents in a compact typed binary format: number of fields, then for each field its name, a type marker from
 * {@link BinaryTypes} and the value. Integers use zig-zag variable length encoding.
 */
public class DocumentSerializer {
  public byte[] serialize(final Document document) {
    if (document == null)
      throw new IllegalArgumentException("Document is null");

    final Binary buffer = new Binary();
    serializeDocument(buffer, document);
    return buffer.toByteArray();
  }

  public Document deserialize(final byte[] content) {
    if (content == null)
      throw new IllegalArgumentException("Content is null");

    try {
      final Binary buffer = new Binary(content);
      final Document document = deserializeDocument(buffer);
      if (buffer.hasRemaining())
        throw new StorageException(ErrorCode.SERIALIZATION_ERROR,
            "Unexpected " + (buffer.size() - buffer.position()) + " trailing bytes after document");
      return document;
    } catch (final IllegalArgumentException e) {
      throw new StorageException(ErrorCode.SERIALIZATION_ERROR, "Error on deserializing document", e);
    }
  }

  private void serializeDocument(final Binary buffer, final Document document) {
    buffer.putUnsignedNumber(document.size());
    for (final Map.Entry<String, Object> entry : document.toMap().entrySet()) {
      buffer.putString(entry.getKey());
      serializeValue(buffer, entry.getKey(), entry.getValue());
    }
  }

  private void serializeValue(final Binary buffer, final String fieldName, final Object value) {
    if (value == null) {
      buffer.putByte(TYPE_NULL);
    } else if (value instanceof Boolean b) {
      buffer.putByte(TYPE_BOOLEAN);
      buffer.putByte((byte) (b ? 1 : 0));
    } else if (value instanceof Integer i) {
      buffer.putByte(TYPE_INT);
      buffer.putNumber(i);
    } else if (value instanceof Long l) {
      buffer.putByte(TYPE_LONG);
      buffer.putNumber(l);
    } else if (value instanceof Short s) {
      buffer.putByte(TYPE_SHORT);
      buffer.putNumber(s);
    } else if (value instanceof Byte b) {
      buffer.putByte(TYPE_BYTE);
      buffer.putByte(b);
    } else if (value instanceof Double d) {
      buffer.putByte(TYPE_DOUBLE);
      buffer.putLong(Double.doubleToLongBits(d));
    } else if (value instanceof Float f) {
      buffer.putByte(TYPE_FLOAT);
      buffer.putInt(Float.floatToIntBits(f));
    } else if (value instanceof BigDecimal d) {
      buffer.putByte(TYPE_DECIMAL);
      buffer.putString(d.toPlainString());
    } else if (value instanceof String s) {
      buffer.putByte(TYPE_STRING);
      buffer.putString(s);
    } else if (value instanceof byte[] bytes) {
      buffer.putByte(TYPE_BINARY);
      buffer.putBytes(bytes);
    } else if (value instanceof Date date) {
      buffer.putByte(TYPE_DATE);
      buffer.putNumber(date.getTime());
    } else if (value instanceof UUID uuid) {
      buffer.putByte(TYPE_UUID);
      buffer.putLong(uuid.getMostSignificantBits());
      buffer.putLong(uuid.getLeastSignificantBits());
    } else if (value instanceof ObjectId oid) {
      buffer.putByte(TYPE_OBJECTID);
      buffer.putBytes(oid.toByteArray());
    } else if (value instanceof Document embedded) {
      buffer.putByte(TYPE_DOCUMENT);
      serializeDocument(buffer, embedded);
    } else if (value instanceof List<?> list) {
      buffer.putByte(TYPE_LIST);
      buffer.putUnsignedNumber(list.size());
      for (final Object item : list)
        serializeValue(buffer, fieldName, item);
    } else
      throw new StorageException(ErrorCode.SERIALIZATION_ERROR,
          "Cannot serialize field '" + fieldName + "' of type " + value.getClass().getName());
  }

  private Document deserializeDocument(final Binary buffer) {
    final int fields = (int) buffer.getUnsignedNumber();
    final Document document = new Document();
    for (int i = 0; i < fields; i++) {
      final String name = buffer.getString();
      document.set(name, deserializeValue(buffer));
    }
    return document;
  }

  private Object deserializeValue(final Binary buffer) {
    final byte type = buffer.getByte();
    return switch (type) {
      case TYPE_NULL -> null;
      case TYPE_BOOLEAN -> buffer.getByte() == 1;
      case TYPE_INT -> (int) buffer.getNumber();
      case TYPE_LONG -> buffer.getNumber();
      case TYPE_SHORT -> (short) buffer.getNumber();
      case TYPE_BYTE -> buffer.getByte();
      case TYPE_DOUBLE -> Double.longBitsToDouble(buffer.getLong());
      case TYPE_FLOAT -> Float.intBitsToFloat(buffer.getInt());
      case TYPE_DECIMAL -> new BigDecimal(buffer.getString());
      case TYPE_STRING -> buffer.getString();
      case TYPE_BINARY -> buffer.getBytes();
      case TYPE_DATE -> new Date(buffer.getNumber());
      case TYPE_UUID -> new UUID(buffer.getLong(), buffer.getLong());
      case TYPE_OBJECTID -> new ObjectId(buffer.getBytes());
      case TYPE_DOCUMENT -> deserializeDocument(buffer);
      case TYPE_LIST -> {
        final int size = (int) buffer.getUnsignedNumber();
        final List<Object> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++)
          list.add(deserializeValue(buffer));
        yield list;
      }
      default -> throw new StorageException(ErrorCode.SERIALIZATION_ERROR, "Unknown type " + type + " at position " + (buffer.position() - 1));
    };
  }
}
