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

import org.jspecify.annotations.Nullable;

/**
 * Keeps the storage of a Block whose scope has ended while Pointers to it still exist.
 *
 * <p>When such a Block is deallocated, its contents, metadata and Pointers are moved to a new dead
 * Block held here, and the original Block is reclaimed. The dead Block stays readable (so the
 * Pointers can still report what they point to, and that it is no longer live) until the last of
 * its Pointers is released, at which point the DeadBlock frees itself.
 *
 * <p>The DeadBlocks of an InterpState form a doubly-linked list rooted in the InterpState.
 */
public final class DeadBlock {

  private final InterpState state;
  private final Block block;

  @Nullable DeadBlock prev;
  @Nullable DeadBlock next;

  /** Moves the contents of {@code original}, which must have Pointers, into a new DeadBlock. */
  DeadBlock(InterpState state, Block original) {
    assert original.hasPointers();
    this.state = state;
    this.block = original.newDeadStorage();
    original.moveTo(block, this);
  }

  /** The dead Block holding the moved contents. */
  public Block getBlock() {
    return block;
  }

  /** Called when the last Pointer to this DeadBlock has been released. */
  void free() {
    state.removeDeadBlock(this);
    block.reclaim();
  }
}
