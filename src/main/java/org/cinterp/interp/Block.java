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
import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A Block is the storage for one evaluated object: a byte[] laid out as described by its {@link
 * Descriptor}, in which each field and composite array element is preceded by an {@link
 * InlineDescriptor} and each primitive array by an InitMap header.
 *
 * <p>A Block also keeps the chain of Pointers currently linked to it. When the scope that owns a
 * Block ends (see {@link InterpState#deallocate}), a Block with an empty chain is reclaimed
 * immediately; otherwise its contents move to a {@link DeadBlock}, which keeps them readable (but
 * not live) until the last Pointer is released.
 *
 * <p>Each Block moves through the states LIVE, DEAD (only for the Block inside a DeadBlock) and
 * RECLAIMED. Once reclaimed a Block's storage may not be read and no Pointer may be linked to it.
 */
public final class Block {

  enum State {
    LIVE,
    DEAD,
    RECLAIMED
  }

  /** Values of the byte stored at the start of each primitive array's InitMap header. */
  private static final byte NONE_INITIALIZED = 0;

  private static final byte SOME_INITIALIZED = 1;
  private static final byte ALL_INITIALIZED = 2;

  private final Descriptor desc;
  private final @Nullable Integer declId;
  private final boolean isStatic;
  private final boolean isExtern;

  private State state;

  /** True if the Descriptor's constructor has been run and the destructor has not. */
  private boolean isInitialized;

  private final byte[] data;

  /**
   * The InitMaps of primitive arrays that are partially initialized, keyed by the position of the
   * array's InitMap header.
   */
  private final Map<Integer, InitMap> initMaps = new HashMap<>();

  /** The Pointer values stored in PTR-typed slots, keyed by position. */
  private final Map<Integer, Pointer> storedPointers = new HashMap<>();

  private PointerChain pointers = new PointerChain();

  /** If this Block is the storage of a DeadBlock, that DeadBlock. */
  private @Nullable DeadBlock deadBlock;

  /** A simulated address, used only for {@link Pointer#getIntegerRepresentation}. */
  private long address;

  /** Creates a Block for a declaration without an id; its contents must still be constructed. */
  public Block(Descriptor desc) {
    this(desc, null, false, false);
  }

  /**
   * Creates a Block with the given Descriptor. The contents are zero and no metadata has been
   * written; call {@link #invokeCtor} before navigating into it.
   */
  public Block(Descriptor desc, @Nullable Integer declId, boolean isStatic, boolean isExtern) {
    this(desc, declId, isStatic, isExtern, State.LIVE);
  }

  private Block(
      Descriptor desc,
      @Nullable Integer declId,
      boolean isStatic,
      boolean isExtern,
      State state) {
    this.desc = desc;
    this.declId = declId;
    this.isStatic = isStatic;
    this.isExtern = isExtern;
    this.state = state;
    this.data = new byte[desc.getAllocSize()];
  }

  public Descriptor getDescriptor() {
    return desc;
  }

  /** The id of the declaration this Block was allocated for, or null if it has none. */
  public @Nullable Integer getDeclId() {
    return declId;
  }

  public boolean isStatic() {
    return isStatic;
  }

  public boolean isExtern() {
    return isExtern;
  }

  public boolean isTemporary() {
    return desc.isTemporary();
  }

  /** True if this Block's scope has ended, whether or not its storage has been reclaimed yet. */
  public boolean isDead() {
    return state != State.LIVE;
  }

  /** True once this Block's storage has been released; nothing may use it after that. */
  public boolean isReclaimed() {
    return state == State.RECLAIMED;
  }

  public boolean isInitialized() {
    return isInitialized;
  }

  /** The number of bytes of storage, including all metadata. */
  public int getSize() {
    return data.length;
  }

  public boolean hasPointers() {
    return !pointers.isEmpty();
  }

  /** The number of Pointers currently linked to this Block. */
  public int numPointers() {
    return pointers.size();
  }

  long getAddress() {
    return address;
  }

  void setAddress(long address) {
    this.address = address;
  }

  /** Returns the raw storage; throws if it has been reclaimed. */
  byte[] rawData() {
    Preconditions.checkState(state != State.RECLAIMED, "Block has been reclaimed");
    return data;
  }

  /**
   * Zeroes the storage and writes the metadata for every field and element, leaving all subobjects
   * active and all primitive arrays uninitialized.
   */
  public void invokeCtor() {
    Arrays.fill(rawData(), (byte) 0);
    initMaps.clear();
    desc.construct(this, 0, desc.isConst(), desc.isMutable(), true);
    isInitialized = true;
  }

  /** Releases any Pointers stored in this Block and forgets its initialization state. */
  public void invokeDtor() {
    releaseStoredPointers();
    byte[] data = rawData();
    for (int pos : initMaps.keySet()) {
      data[pos] = NONE_INITIALIZED;
    }
    initMaps.clear();
    isInitialized = false;
  }

  /**
   * Releases the Pointers held in this Block's pointer-typed slots, leaving them null. The rest of
   * the contents are unchanged.
   */
  void releaseStoredPointers() {
    if (!storedPointers.isEmpty()) {
      Pointer[] stored = storedPointers.values().toArray(new Pointer[0]);
      storedPointers.clear();
      for (Pointer p : stored) {
        p.release();
      }
    }
  }

  /** Links {@code ptr} into this Block's chain and returns its handle. */
  long addPointer(Pointer ptr) {
    Preconditions.checkState(state != State.RECLAIMED, "cannot point into a reclaimed Block");
    return pointers.add(ptr);
  }

  /** Unlinks {@code ptr}, which was linked with the given handle. */
  void removePointer(Pointer ptr, long handle) {
    pointers.remove(handle, ptr);
  }

  /** Frees this Block's DeadBlock if this was the storage of one and its last Pointer is gone. */
  void cleanup() {
    if (state == State.DEAD && pointers.isEmpty()) {
      deadBlock.free();
    }
  }

  /**
   * Moves this Block's contents and Pointers to {@code dead}, which becomes the storage of a
   * DeadBlock; this Block is reclaimed.
   */
  void moveTo(Block dead, DeadBlock owner) {
    assert state == State.LIVE && dead.state == State.LIVE && dead.desc == desc;
    System.arraycopy(data, 0, dead.data, 0, data.length);
    initMaps.forEach((pos, map) -> dead.initMaps.put(pos, map.copy()));
    dead.storedPointers.putAll(storedPointers);
    dead.isInitialized = isInitialized;
    dead.address = address;
    dead.pointers = pointers;
    dead.deadBlock = owner;
    dead.state = State.DEAD;
    pointers.forEach(p -> p.retarget(dead));
    pointers = new PointerChain();
    initMaps.clear();
    storedPointers.clear();
    isInitialized = false;
    state = State.RECLAIMED;
  }

  /** Creates an empty Block with the same shape, to receive this Block's contents. */
  Block newDeadStorage() {
    return new Block(desc, declId, isStatic, isExtern, State.LIVE);
  }

  /** Runs the destructor and releases the storage; only valid once no Pointers remain. */
  void reclaim() {
    Preconditions.checkState(pointers.isEmpty(), "Block is still referenced");
    Preconditions.checkState(state != State.RECLAIMED, "Block already reclaimed");
    invokeDtor();
    state = State.RECLAIMED;
  }

  // Primitive array initialization.

  /** Returns true if element {@code index} of the primitive array whose header is at {@code pos}
   * has been initialized. */
  boolean isElementInitialized(int pos, int index) {
    switch (rawData()[pos]) {
      case ALL_INITIALIZED:
        return true;
      case SOME_INITIALIZED:
        InitMap map = initMaps.get(pos);
        assert map != null : "missing InitMap";
        return map.isElementInitialized(index);
      default:
        return false;
    }
  }

  /**
   * Marks element {@code index} of the primitive array whose header is at {@code pos} (and which
   * has {@code numElems} elements) as initialized.
   */
  void initializeElement(int pos, int index, int numElems) {
    byte[] data = rawData();
    if (data[pos] == ALL_INITIALIZED) {
      return;
    }
    InitMap map = initMaps.get(pos);
    if (map == null) {
      assert data[pos] == NONE_INITIALIZED;
      map = new InitMap(numElems);
      initMaps.put(pos, map);
      data[pos] = SOME_INITIALIZED;
    }
    if (map.initializeElement(index)) {
      initMaps.remove(pos);
      data[pos] = ALL_INITIALIZED;
    }
  }

  // Pointer-typed slots.

  /** Returns the Pointer stored at {@code pos}, or null if none has been stored. */
  @Linked.Borrowed
  @Nullable Pointer loadPointer(int pos) {
    rawData();
    return storedPointers.get(pos);
  }

  /** Stores {@code ptr} at {@code pos}, releasing any Pointer previously stored there. */
  void storePointer(int pos, @Linked.In Pointer ptr) {
    rawData();
    Pointer prev = storedPointers.put(pos, ptr);
    if (prev != null) {
      prev.release();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("desc", desc.id())
        .add("size", data.length)
        .add("state", state)
        .add("pointers", pointers.size())
        .omitNullValues()
        .add("declId", declId)
        .toString();
  }
}
