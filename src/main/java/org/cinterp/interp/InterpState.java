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
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The evaluator-side state that owns the Blocks of local variables and temporaries: allocates
 * them, and on deallocation either reclaims them or (if Pointers to them remain) turns them into
 * {@link DeadBlock}s.
 *
 * <p>An InterpState created with {@code debug == true} tracks every Block it allocates, logs
 * bookkeeping errors to System.err, and on {@link #close} reports Blocks that were never
 * reclaimed.
 */
public final class InterpState implements AutoCloseable {

  private final Context ctx;

  /** Non-null if this InterpState was created with debug enabled. */
  private final @Nullable BlockTracker tracker;

  /** The head of the list of DeadBlocks that are still referenced. */
  private @Nullable DeadBlock deadBlocks;

  private int numDeadBlocks;

  private boolean closed;

  public InterpState(Context ctx, boolean debug) {
    this.ctx = ctx;
    this.tracker = debug ? new BlockTracker() : null;
  }

  public Context getContext() {
    return ctx;
  }

  /** Returns a new Block for an object of the given type, with its constructor already run. */
  public Block allocate(Descriptor desc) {
    return allocate(desc, null);
  }

  /**
   * Returns a new Block for an object of the given type created for the declaration with the given
   * id, with its constructor already run.
   */
  public Block allocate(Descriptor desc, @Nullable Integer declId) {
    Preconditions.checkState(!closed, "InterpState is closed");
    Preconditions.checkArgument(
        desc.program() == ctx.program(), "Descriptor belongs to another program");
    Block block = new Block(desc, declId, /* isStatic= */ false, /* isExtern= */ false);
    block.setAddress(ctx.program().assignAddress(block.getSize()));
    block.invokeCtor();
    if (tracker != null) {
      tracker.recordAlloc(block);
    }
    return block;
  }

  /**
   * Ends the lifetime of a Block allocated by this InterpState. If no Pointers to it remain it is
   * reclaimed immediately; otherwise its contents move to a DeadBlock that lives until they are
   * released.
   */
  public void deallocate(Block block) {
    Preconditions.checkState(!block.isDead(), "Block already deallocated");
    Preconditions.checkArgument(!block.isStatic(), "cannot deallocate a global");
    if (block.hasPointers()) {
      DeadBlock dead = new DeadBlock(this, block);
      dead.next = deadBlocks;
      if (deadBlocks != null) {
        deadBlocks.prev = dead;
      }
      deadBlocks = dead;
      ++numDeadBlocks;
      if (tracker != null) {
        tracker.recordMove(block, dead.getBlock());
      }
    } else {
      block.reclaim();
      if (tracker != null) {
        tracker.recordRelease(block);
      }
    }
  }

  /** Unlinks a DeadBlock that is about to be freed. */
  void removeDeadBlock(DeadBlock dead) {
    if (dead.prev != null) {
      dead.prev.next = dead.next;
    } else {
      assert deadBlocks == dead;
      deadBlocks = dead.next;
    }
    if (dead.next != null) {
      dead.next.prev = dead.prev;
    }
    dead.prev = null;
    dead.next = null;
    --numDeadBlocks;
    if (tracker != null) {
      tracker.recordRelease(dead.getBlock());
    }
  }

  /** Returns a new scope; Blocks allocated through it are deallocated when it is closed. */
  public LocalScope enterScope() {
    Preconditions.checkState(!closed, "InterpState is closed");
    return new LocalScope(this);
  }

  /** The number of DeadBlocks that are still referenced by Pointers. */
  public int numDeadBlocks() {
    return numDeadBlocks;
  }

  /** Returns true if this InterpState was created with debug enabled and has detected an error. */
  public boolean errored() {
    return tracker != null && tracker.errored();
  }

  /** The BlockTracker, if debug is enabled. */
  @Nullable BlockTracker tracker() {
    return tracker;
  }

  /**
   * Releases the Pointers stored in any remaining DeadBlocks, which may allow them to be freed. If
   * debug is enabled, reports any Block that was never reclaimed.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    // Releasing the Pointers stored in one DeadBlock may free it or others, so take a snapshot.
    List<Block> remaining = new ArrayList<>();
    for (DeadBlock dead = deadBlocks; dead != null; dead = dead.next) {
      remaining.add(dead.getBlock());
    }
    for (Block block : remaining) {
      if (!block.isReclaimed()) {
        block.releaseStoredPointers();
      }
    }
    if (tracker != null) {
      tracker.allReleased();
    }
  }
}
