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

import com.google.common.base.MoreObjects;
import org.cinterp.util.ArrayUtil;
import org.cinterp.util.SizeOf;

/**
 * A view of the per-instance metadata stored in a Block immediately before the data of each record
 * field, base class subobject, and composite array element.
 *
 * <p>The metadata occupies {@link SizeOf#INLINE_DESCRIPTOR} bytes:
 *
 * <ul>
 *   <li>bytes 0-3: the offset of the subobject from the start of its enclosing object (so
 *       subtracting it from the subobject's position yields the enclosing object's position);
 *   <li>bytes 4-7: the {@link Descriptor#id} of the subobject's Descriptor;
 *   <li>bytes 8-11: flag bits (const, initialized, base, active, mutable);
 *   <li>bytes 12-15: unused.
 * </ul>
 *
 * <p>InlineDescriptor instances are cheap, transient views; the state lives in the Block.
 */
final class InlineDescriptor {

  private static final int OFFSET_POS = 0;
  private static final int DESC_POS = 4;
  private static final int FLAGS_POS = 8;

  private static final int IS_CONST = 1;
  private static final int IS_INITIALIZED = 2;
  private static final int IS_BASE = 4;
  private static final int IS_ACTIVE = 8;
  private static final int IS_FIELD_MUTABLE = 16;

  private final Block block;

  /** The position of the described subobject's data; the metadata is just before it. */
  private final int dataPos;

  InlineDescriptor(Block block, int dataPos) {
    assert dataPos >= SizeOf.INLINE_DESCRIPTOR;
    this.block = block;
    this.dataPos = dataPos;
  }

  /** Writes a complete InlineDescriptor for the subobject whose data begins at {@code dataPos}. */
  static void write(
      Block block,
      int dataPos,
      int offset,
      Descriptor desc,
      boolean isInitialized,
      boolean isBase,
      boolean isActive,
      boolean isConst,
      boolean isFieldMutable) {
    byte[] data = block.rawData();
    int start = dataPos - SizeOf.INLINE_DESCRIPTOR;
    ArrayUtil.bytesSetI(data, start + OFFSET_POS, offset);
    ArrayUtil.bytesSetI(data, start + DESC_POS, desc.id());
    int flags =
        (isConst ? IS_CONST : 0)
            | (isInitialized ? IS_INITIALIZED : 0)
            | (isBase ? IS_BASE : 0)
            | (isActive ? IS_ACTIVE : 0)
            | (isFieldMutable ? IS_FIELD_MUTABLE : 0);
    ArrayUtil.bytesSetI(data, start + FLAGS_POS, flags);
  }

  private int start() {
    return dataPos - SizeOf.INLINE_DESCRIPTOR;
  }

  private int flags() {
    return ArrayUtil.bytesGetI(block.rawData(), start() + FLAGS_POS);
  }

  private void setFlag(int flag, boolean value) {
    int flags = flags();
    int updated = value ? (flags | flag) : (flags & ~flag);
    ArrayUtil.bytesSetI(block.rawData(), start() + FLAGS_POS, updated);
  }

  /** The position of the subobject's data within the Block. */
  int dataPos() {
    return dataPos;
  }

  /** The offset of the subobject from the start of the object containing it. */
  int offset() {
    return ArrayUtil.bytesGetI(block.rawData(), start() + OFFSET_POS);
  }

  /** The Descriptor of the subobject. */
  Descriptor desc() {
    int id = ArrayUtil.bytesGetI(block.rawData(), start() + DESC_POS);
    return block.getDescriptor().program().descriptor(id);
  }

  boolean isConst() {
    return (flags() & IS_CONST) != 0;
  }

  boolean isInitialized() {
    return (flags() & IS_INITIALIZED) != 0;
  }

  void setInitialized(boolean value) {
    setFlag(IS_INITIALIZED, value);
  }

  boolean isBase() {
    return (flags() & IS_BASE) != 0;
  }

  boolean isActive() {
    return (flags() & IS_ACTIVE) != 0;
  }

  void setActive(boolean value) {
    setFlag(IS_ACTIVE, value);
  }

  boolean isFieldMutable() {
    return (flags() & IS_FIELD_MUTABLE) != 0;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("pos", dataPos)
        .add("offset", offset())
        .add("desc", desc().id())
        .add("const", isConst())
        .add("initialized", isInitialized())
        .add("base", isBase())
        .add("active", isActive())
        .add("mutable", isFieldMutable())
        .toString();
  }
}
