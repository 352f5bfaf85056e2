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

import com.google.common.base.Preconditions;
import org.cinterp.util.ArrayUtil;

/**
 * Tracks which elements of a primitive array have been initialized, one bit per element.
 *
 * <p>Composite arrays track initialization in the InlineDescriptor of each element; primitive
 * arrays have no per-element metadata, so they share a single InitMap stored with the array. Once
 * every element has been initialized the Block drops the bitmap and records the array as fully
 * initialized instead.
 */
final class InitMap {

  /** One bit per element; a set bit means the element has been initialized. */
  private final long[] data;

  /** The number of elements whose bit is still clear. */
  private int uninitFields;

  InitMap(int numElems) {
    Preconditions.checkArgument(numElems >= 0);
    this.data = new long[(numElems + Long.SIZE - 1) / Long.SIZE];
    this.uninitFields = numElems;
  }

  /**
   * Marks element {@code i} as initialized. Returns true if every element is now initialized.
   */
  boolean initializeElement(int i) {
    if (ArrayUtil.setBit(i, data)) {
      --uninitFields;
    }
    return uninitFields == 0;
  }

  /** Returns true if element {@code i} has been initialized. */
  boolean isElementInitialized(int i) {
    return i >= 0 && ArrayUtil.testBit(i, data);
  }

  /** Returns true if every element has been initialized. */
  boolean isAllInitialized() {
    return uninitFields == 0;
  }

  int uninitializedCount() {
    return uninitFields;
  }

  /** Returns an independent copy, for use when a Block's contents are moved. */
  InitMap copy() {
    return new InitMap(this);
  }

  private InitMap(InitMap src) {
    this.data = src.data.clone();
    this.uninitFields = src.uninitFields;
  }
}
