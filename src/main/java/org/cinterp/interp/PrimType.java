/*
 * Copyright 2025 The Retrospect Authors
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
 */

package org.cinterp.interp;

import org.cinterp.ast.APValue;
import org.cinterp.util.ArrayUtil;
import org.cinterp.util.SizeOf;

/**
 * The primitive value representations the interpreter stores in Block memory. Every builtin scalar
 * type of the evaluated language is classified as one of these (see {@link Context#classify}).
 *
 * <p>Java values are exchanged as {@link Long} for integral types (sign- or zero-extended on load,
 * truncated on store), {@link Boolean} for BOOL, {@link Float} and {@link Double} for the floating
 * types, and {@link Pointer} for PTR.
 */
public enum PrimType {
  SINT8(1),
  UINT8(1),
  SINT16(SizeOf.SHORT),
  UINT16(SizeOf.SHORT),
  SINT32(SizeOf.INT),
  UINT32(SizeOf.INT),
  SINT64(SizeOf.LONG),
  UINT64(SizeOf.LONG),
  BOOL(SizeOf.BOOLEAN),
  FLOAT(SizeOf.FLOAT),
  DOUBLE(SizeOf.DOUBLE),
  PTR(SizeOf.PTR);

  private final int size;

  PrimType(int size) {
    this.size = size;
  }

  /** The number of bytes a value of this type occupies in a Block. */
  public int size() {
    return size;
  }

  public boolean isIntegral() {
    return ordinal() <= UINT64.ordinal();
  }

  public boolean isSigned() {
    return this == SINT8 || this == SINT16 || this == SINT32 || this == SINT64;
  }

  public boolean isFloatingPoint() {
    return this == FLOAT || this == DOUBLE;
  }

  /**
   * Reads a value of this type from {@code data} at {@code pos}. Not valid for PTR, whose values
   * are held by the Block rather than in its bytes.
   */
  Object read(byte[] data, int pos) {
    return switch (this) {
      case SINT8 -> (long) data[pos];
      case UINT8 -> (long) (data[pos] & 0xff);
      case SINT16 -> (long) ArrayUtil.bytesGetS(data, pos);
      case UINT16 -> (long) (ArrayUtil.bytesGetS(data, pos) & 0xffff);
      case SINT32 -> (long) ArrayUtil.bytesGetI(data, pos);
      case UINT32 -> Integer.toUnsignedLong(ArrayUtil.bytesGetI(data, pos));
      case SINT64, UINT64 -> ArrayUtil.bytesGetL(data, pos);
      case BOOL -> data[pos] != 0;
      case FLOAT -> ArrayUtil.bytesGetF(data, pos);
      case DOUBLE -> ArrayUtil.bytesGetD(data, pos);
      case PTR -> throw new IllegalStateException("pointer values are not stored as bytes");
    };
  }

  /**
   * Writes {@code value} as this type into {@code data} at {@code pos}. Integral types accept any
   * {@link Number} and keep its low-order bits; BOOL requires a {@link Boolean}.
   */
  void write(byte[] data, int pos, Object value) {
    switch (this) {
      case SINT8, UINT8 -> data[pos] = (byte) asLong(value);
      case SINT16, UINT16 -> ArrayUtil.bytesSetS(data, pos, (short) asLong(value));
      case SINT32, UINT32 -> ArrayUtil.bytesSetI(data, pos, (int) asLong(value));
      case SINT64, UINT64 -> ArrayUtil.bytesSetL(data, pos, asLong(value));
      case BOOL -> data[pos] = (byte) (((Boolean) value) ? 1 : 0);
      case FLOAT -> ArrayUtil.bytesSetF(data, pos, ((Number) value).floatValue());
      case DOUBLE -> ArrayUtil.bytesSetD(data, pos, ((Number) value).doubleValue());
      case PTR -> throw new IllegalStateException("pointer values are not stored as bytes");
    }
  }

  private static long asLong(Object value) {
    if (value instanceof Boolean b) {
      return b ? 1 : 0;
    }
    return ((Number) value).longValue();
  }

  /** Converts a value previously returned by {@link #read} to an APValue. */
  APValue toAPValue(Object value) {
    if (isIntegral()) {
      return new APValue.Int((Long) value, !isSigned());
    } else if (this == BOOL) {
      return new APValue.Int(((Boolean) value) ? 1 : 0, true);
    } else if (isFloatingPoint()) {
      return new APValue.Float(((Number) value).doubleValue());
    }
    throw new IllegalArgumentException("no scalar APValue for " + this);
  }
}
