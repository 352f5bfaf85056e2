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

package org.cinterp.util;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;

/**
 * A static-only class that provides typed access to the raw bytes of a Block. All multi-byte values
 * are stored little-endian, independent of the host, so that the bytes of an evaluated object do
 * not depend on where the interpreter runs.
 */
public class ArrayUtil {

  private ArrayUtil() {}

  private static final VarHandle BYTES_AS_SHORTS =
      MethodHandles.byteArrayViewVarHandle(short[].class, ByteOrder.LITTLE_ENDIAN);

  private static final VarHandle BYTES_AS_INTS =
      MethodHandles.byteArrayViewVarHandle(int[].class, ByteOrder.LITTLE_ENDIAN);

  private static final VarHandle BYTES_AS_LONGS =
      MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.LITTLE_ENDIAN);

  private static final VarHandle BYTES_AS_FLOATS =
      MethodHandles.byteArrayViewVarHandle(float[].class, ByteOrder.LITTLE_ENDIAN);

  private static final VarHandle BYTES_AS_DOUBLES =
      MethodHandles.byteArrayViewVarHandle(double[].class, ByteOrder.LITTLE_ENDIAN);

  /** Interprets the bytes beginning at the specified offset as a short. */
  public static short bytesGetS(byte[] array, int pos) {
    return (short) BYTES_AS_SHORTS.get(array, pos);
  }

  /** Interprets the bytes beginning at the specified offset as an int. */
  public static int bytesGetI(byte[] array, int pos) {
    return (int) BYTES_AS_INTS.get(array, pos);
  }

  /** Interprets the bytes beginning at the specified offset as a long. */
  public static long bytesGetL(byte[] array, int pos) {
    return (long) BYTES_AS_LONGS.get(array, pos);
  }

  /** Interprets the bytes beginning at the specified offset as a float. */
  public static float bytesGetF(byte[] array, int pos) {
    return (float) BYTES_AS_FLOATS.get(array, pos);
  }

  /** Interprets the bytes beginning at the specified offset as a double. */
  public static double bytesGetD(byte[] array, int pos) {
    return (double) BYTES_AS_DOUBLES.get(array, pos);
  }

  /** Stores a short beginning at the specified offset. */
  public static void bytesSetS(byte[] array, int pos, short value) {
    BYTES_AS_SHORTS.set(array, pos, value);
  }

  /** Stores an int beginning at the specified offset. */
  public static void bytesSetI(byte[] array, int pos, int value) {
    BYTES_AS_INTS.set(array, pos, value);
  }

  /** Stores a long beginning at the specified offset. */
  public static void bytesSetL(byte[] array, int pos, long value) {
    BYTES_AS_LONGS.set(array, pos, value);
  }

  /** Stores a float beginning at the specified offset. */
  public static void bytesSetF(byte[] array, int pos, float value) {
    BYTES_AS_FLOATS.set(array, pos, value);
  }

  /** Stores a double beginning at the specified offset. */
  public static void bytesSetD(byte[] array, int pos, double value) {
    BYTES_AS_DOUBLES.set(array, pos, value);
  }

  /**
   * Sets a single bit in a long[] bitmap. Returns true if the bit was previously clear.
   *
   * <p>{@code bit} must be non-negative and less than {@code 64 * bits.length}.
   */
  public static boolean setBit(int bit, long[] bits) {
    int word = bit / Long.SIZE;
    long mask = 1L << bit;
    long prev = bits[word];
    bits[word] = prev | mask;
    return (prev & mask) == 0;
  }

  /** Returns true if the given bit is set in a long[] bitmap. */
  public static boolean testBit(int bit, long[] bits) {
    int word = bit / Long.SIZE;
    return word < bits.length && (bits[word] & (1L << bit)) != 0;
  }
}
