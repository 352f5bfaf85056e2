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
 * A lexical scope of the evaluated program. Blocks allocated through a LocalScope are deallocated,
 * in the reverse of the order they were allocated, when it is closed.
 */
public final class LocalScope implements AutoCloseable {

  private final InterpState state;
  private final List<Block> blocks = new ArrayList<>();
  private boolean closed;

  LocalScope(InterpState state) {
    this.state = state;
  }

  public Block allocate(Descriptor desc) {
    return allocate(desc, null);
  }

  public Block allocate(Descriptor desc, @Nullable Integer declId) {
    Preconditions.checkState(!closed, "scope has ended");
    Block block = state.allocate(desc, declId);
    blocks.add(block);
    return block;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (int i = blocks.size() - 1; i >= 0; i--) {
      state.deallocate(blocks.get(i));
    }
    blocks.clear();
  }
}
