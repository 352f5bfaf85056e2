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

/**
 * Static-only class with constants and methods describing the byte layout the interpreter uses for
 * evaluated objects. These sizes model the evaluated program's objects, not Java objects.
 */
public class SizeOf {

  // Statics only
  private SizeOf() {}

  /** The alignment of every subobject placed in a Block. */
  public static final int ALIGNMENT = 8;

  /** The number of bytes reserved for a pointer-typed slot. */
  public static final int PTR = 8;

  /** The number of bytes required for a bool. */
  public static final int BOOLEAN = 1;

  /** The number of bytes required for a 16-bit integer. */
  public static final int SHORT = 2;

  /** The number of bytes required for a 32-bit integer. */
  public static final int INT = 4;

  /** The number of bytes required for a 64-bit integer. */
  public static final int LONG = 8;

  /** The number of bytes required for a float. */
  public static final int FLOAT = 4;

  /** The number of bytes required for a double. */
  public static final int DOUBLE = 8;

  /**
   * The number of bytes occupied by an InlineDescriptor, which immediately precedes each field of
   * a record and each element of a composite array.
   */
  public static final int INLINE_DESCRIPTOR = 16;

  /**
   * The number of bytes occupied by the InitMap header that precedes the data of a primitive array.
   */
  public static final int INIT_MAP_PTR = 8;

  /** Rounds up to the nearest multiple of {@link #ALIGNMENT}. */
  public static int align(int size) {
    return (size + ALIGNMENT - 1) & -ALIGNMENT;
  }

  /** Returns true if {@code offset} is a multiple of {@link #ALIGNMENT}. */
  public static boolean isAligned(int offset) {
    return (offset & (ALIGNMENT - 1)) == 0;
  }
}
