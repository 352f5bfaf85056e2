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

import com.google.errorprone.annotations.FormatMethod;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Used by a debug InterpState to save information about each Block it allocates and check that
 * each is reclaimed exactly once. This is too expensive to do during regular evaluation, but helps
 * when looking for Pointers that are never released (and so keep DeadBlocks alive).
 */
final class BlockTracker {

  /** Maps each tracked Block that has not yet been reclaimed to a record of its allocation. */
  private final IdentityHashMap<Block, AllocationInfo> live = new IdentityHashMap<>();

  /** The total number of Blocks allocated so far. */
  private int counter;

  /** True if any of our checks have failed. */
  private boolean errored;

  private static class AllocationInfo {

    /** A simple identifier for this Block. */
    final int id;

    /** The allocation size, including metadata. */
    final int size;

    /** The stack captured at the time of allocation. */
    final Throwable throwable;

    AllocationInfo(int counter, int size) {
      this.id = counter;
      this.size = size;
      this.throwable = new Throwable();
    }

    @Override
    public String toString() {
      // Make it easier to interpret these in the debugger
      StringWriter writer = new StringWriter();
      PrintWriter printer = new PrintWriter(writer);
      printer.format("#%d (%d bytes): ", id, size);
      throwable.printStackTrace(printer);
      return writer.toString();
    }
  }

  @FormatMethod
  private void logError(String fmt, Object... args) {
    System.err.print("\n** " + String.format(fmt, args) + "\n");
    errored = true;
  }

  /** Records the allocation of a new Block. */
  void recordAlloc(Block block) {
    assert block != null;
    AllocationInfo prev = live.putIfAbsent(block, new AllocationInfo(counter, block.getSize()));
    if (prev == null) {
      counter++;
    } else {
      logError("duplicate alloc for #%s: %s", prev.id, block);
    }
  }

  /** Records that a previously-allocated Block's storage has been reclaimed. */
  void recordRelease(Block block) {
    assert block != null;
    AllocationInfo info = live.remove(block);
    if (info == null) {
      logError("release without alloc: %s", block);
    } else if (info.size != block.getSize()) {
      logError(
          "released #%s with size %s, allocated as %s: %s",
          info.id,
          block.getSize(),
          info.size,
          block);
    }
  }

  /**
   * Records that the contents of {@code from} have been moved to {@code to} (the storage of a
   * DeadBlock); {@code to} is now tracked in its place.
   */
  void recordMove(Block from, Block to) {
    AllocationInfo info = live.remove(from);
    if (info == null) {
      logError("move without alloc: %s", from);
    } else if (live.putIfAbsent(to, info) != null) {
      logError("move to a tracked block: %s", to);
    }
  }

  /** The number of tracked Blocks that have not been reclaimed. */
  int numLive() {
    return live.size();
  }

  /** Returns true if any errors have been detected by this BlockTracker. */
  boolean errored() {
    return errored;
  }

  /**
   * Returns true if all allocated Blocks have been reclaimed. Any that have not are reported as
   * errors.
   */
  boolean allReleased() {
    if (live.isEmpty()) {
      return true;
    }
    for (Map.Entry<Block, AllocationInfo> entry : live.entrySet()) {
      logError("no release for #%s (%s)", entry.getValue().id, entry.getKey());
      entry.getValue().throwable.printStackTrace();
    }
    return false;
  }
}
