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

import java.util.Arrays;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/**
 * The set of Pointers currently linked to a Block.
 *
 * <p>Pointers are kept in an arena of slots; linking a Pointer returns a handle that combines its
 * slot index with the slot's generation, and unlinking requires that same handle. Each time a slot
 * is freed its generation is incremented, so a handle that has already been used to unlink (or that
 * belongs to another chain) is rejected rather than silently removing some other Pointer.
 *
 * <p>Not thread-safe; a PointerChain is only used by the single evaluation thread that owns its
 * Block.
 */
final class PointerChain {

  /** The handle of a Pointer that is not linked to any chain. */
  static final long NO_HANDLE = -1;

  private static final Pointer[] EMPTY_SLOTS = new Pointer[0];
  private static final int[] EMPTY_INTS = new int[0];

  /** The linked Pointers; a null entry is a free slot. */
  private @Nullable Pointer[] slots = EMPTY_SLOTS;

  /** The current generation of each slot. */
  private int[] generations = EMPTY_INTS;

  /** If {@code slots[i]} is free, the index of the next free slot (or -1). */
  private int[] nextFree = EMPTY_INTS;

  private int firstFree = -1;

  /** The number of slots that have ever been used; slots at or above this index are unused. */
  private int highWater;

  private int size;

  int size() {
    return size;
  }

  boolean isEmpty() {
    return size == 0;
  }

  /** Links {@code ptr} into this chain and returns the handle needed to unlink it. */
  long add(Pointer ptr) {
    int slot;
    if (firstFree >= 0) {
      slot = firstFree;
      firstFree = nextFree[slot];
    } else {
      if (highWater == slots.length) {
        int newLength = Math.max(4, slots.length * 2);
        slots = Arrays.copyOf(slots, newLength);
        generations = Arrays.copyOf(generations, newLength);
        nextFree = Arrays.copyOf(nextFree, newLength);
      }
      slot = highWater++;
    }
    assert slots[slot] == null;
    slots[slot] = ptr;
    size++;
    return ((long) generations[slot] << 32) | slot;
  }

  /**
   * Unlinks the Pointer identified by {@code handle}, which must have been returned by {@link #add}
   * for {@code ptr} and not used since.
   */
  void remove(long handle, Pointer ptr) {
    int slot = (int) handle;
    int generation = (int) (handle >>> 32);
    if (handle == NO_HANDLE
        || slot < 0
        || slot >= highWater
        || generations[slot] != generation
        || slots[slot] != ptr) {
      throw new IllegalStateException("Pointer is not linked to this Block");
    }
    slots[slot] = null;
    generations[slot]++;
    nextFree[slot] = firstFree;
    firstFree = slot;
    size--;
  }

  /** Calls {@code action} with each linked Pointer. */
  void forEach(Consumer<Pointer> action) {
    for (int i = 0; i < highWater; i++) {
      Pointer ptr = slots[i];
      if (ptr != null) {
        action.accept(ptr);
      }
    }
  }
}
