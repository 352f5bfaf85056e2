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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.cinterp.ast.Decl;
import org.cinterp.ast.Type;
import org.cinterp.util.SizeOf;
import org.jspecify.annotations.Nullable;

/**
 * Lays out the types and global variables of one translation unit.
 *
 * <p>A Program owns every {@link Descriptor} and {@link Record} it creates. Descriptors are
 * interned by (source declaration, type, qualifiers), so asking twice for the same layout returns
 * the same Descriptor, and each is assigned a dense id by which InlineDescriptors in Block memory
 * refer to it.
 */
public final class Program {

  /** The key under which a Descriptor is interned. */
  private record DescriptorKey(Decl source, Type type, Descriptor.Flags flags) {}

  /** The first simulated address; keeps {@link Pointer#getIntegerRepresentation} nonzero. */
  private static final long FIRST_ADDRESS = 0x1000;

  private final Context ctx;

  /** Every Descriptor created by this Program, indexed by id. */
  private final List<Descriptor> descriptors = new ArrayList<>();

  private final Map<DescriptorKey, Descriptor> interned = new HashMap<>();
  private final Map<Decl, Descriptor> dummies = new HashMap<>();
  private final Map<Type.Struct, Record> records = new HashMap<>();

  /** The Blocks of global variables, indexed by global id. */
  private final List<Block> globals = new ArrayList<>();

  private final Map<Decl, Integer> globalIds = new HashMap<>();

  private long nextAddress = FIRST_ADDRESS;

  Program(Context ctx) {
    this.ctx = ctx;
  }

  /** Returns the Descriptor with the given id. */
  public Descriptor descriptor(int id) {
    return descriptors.get(id);
  }

  /** The number of Descriptors this Program has created. */
  public int numDescriptors() {
    return descriptors.size();
  }

  /** Returns a Descriptor for the declared type of {@code decl}. */
  public Descriptor createDescriptor(Decl decl) {
    return createDescriptor(
        decl, decl.type(), false, decl.kind() == Decl.Kind.TEMPORARY, decl.isMutable());
  }

  /**
   * Returns a Descriptor for an object of type {@code type} created for {@code source}, creating
   * it (and the Descriptors and Records of any element or member types) if necessary.
   */
  public Descriptor createDescriptor(
      Decl source, Type type, boolean isConst, boolean isTemporary, boolean isMutable) {
    Descriptor.Flags flags = new Descriptor.Flags(isConst, isTemporary, isMutable);
    DescriptorKey key = new DescriptorKey(source, type, flags);
    Descriptor result = interned.get(key);
    if (result == null) {
      result = newDescriptor(source, type, flags);
      interned.put(key, result);
    }
    return result;
  }

  private Descriptor newDescriptor(Decl source, Type type, Descriptor.Flags flags) {
    PrimType primType = ctx.classify(type);
    if (primType != null) {
      return register(Descriptor.primitive(this, nextId(), source, type, primType, flags));
    } else if (type instanceof Type.Array array) {
      PrimType elemPrimType = ctx.classify(array.element());
      if (elemPrimType != null) {
        if (array.isUnknownLength()) {
          return register(
              Descriptor.unknownSizePrimitiveArray(
                  this, nextId(), source, type, elemPrimType, flags));
        }
        Descriptor.checkValidElemCount(array.length());
        return register(
            Descriptor.primitiveArray(
                this, nextId(), source, type, elemPrimType, array.length(), flags));
      }
      // Element Descriptors must be created (and numbered) before the array's.
      Descriptor elem =
          createDescriptor(
              source, array.element(), flags.isConst(), flags.isTemporary(), flags.isMutable());
      if (array.isUnknownLength()) {
        return register(
            Descriptor.unknownSizeCompositeArray(this, nextId(), source, type, elem, flags));
      }
      Descriptor.checkValidElemCount(array.length());
      return register(
          Descriptor.compositeArray(this, nextId(), source, type, elem, array.length(), flags));
    } else if (type instanceof Type.Struct struct) {
      Record record = getOrCreateRecord(struct);
      return register(Descriptor.record(this, nextId(), source, type, record, flags));
    }
    throw new IllegalArgumentException("no layout for type " + type);
  }

  /** Returns a Descriptor for storage we can't track, e.g. an unknown extern object. */
  public Descriptor createDummy(Decl decl) {
    return dummies.computeIfAbsent(
        decl, d -> register(Descriptor.dummy(this, nextId(), d)));
  }

  private int nextId() {
    return descriptors.size();
  }

  private Descriptor register(Descriptor desc) {
    assert desc.id() == descriptors.size();
    descriptors.add(desc);
    return desc;
  }

  /**
   * Returns the layout of the given struct or union. Each base and then each field is preceded by
   * an InlineDescriptor and starts on an aligned boundary; union members are laid out the same
   * way, one after another.
   */
  public Record getOrCreateRecord(Type.Struct struct) {
    Record result = records.get(struct);
    if (result != null) {
      return result;
    }
    int size = 0;
    ImmutableList.Builder<Record.Base> bases = ImmutableList.builder();
    for (Type.Struct base : struct.bases()) {
      size += SizeOf.INLINE_DESCRIPTOR;
      Descriptor desc = createDescriptor(Decl.base(base), base, false, false, false);
      bases.add(new Record.Base(base, size, desc, getOrCreateRecord(base)));
      size += SizeOf.align(desc.getAllocSize());
    }
    ImmutableList.Builder<Record.Field> fields = ImmutableList.builder();
    for (Decl field : struct.fields()) {
      size += SizeOf.INLINE_DESCRIPTOR;
      Descriptor desc = createDescriptor(field, field.type(), false, false, field.isMutable());
      fields.add(new Record.Field(field, size, desc));
      size += SizeOf.align(desc.getAllocSize());
    }
    result = new Record(struct, bases.build(), fields.build(), size);
    records.put(struct, result);
    return result;
  }

  /**
   * Creates the Block for a global variable and runs its constructor; returns the global's id.
   */
  public int createGlobal(Decl decl, Descriptor desc, boolean isExtern) {
    Preconditions.checkArgument(desc.program() == this, "Descriptor belongs to another program");
    Preconditions.checkArgument(!globalIds.containsKey(decl), "%s already has a global", decl);
    int id = globals.size();
    Block block = new Block(desc, id, /* isStatic= */ true, isExtern);
    block.setAddress(assignAddress(block.getSize()));
    block.invokeCtor();
    globals.add(block);
    globalIds.put(decl, id);
    return id;
  }

  /** Returns the id of the global created for {@code decl}, if there is one. */
  public Optional<Integer> getGlobal(Decl decl) {
    return Optional.ofNullable(globalIds.get(decl));
  }

  /** Returns the Block of the global with the given id. */
  public Block getGlobalBlock(int id) {
    return globals.get(id);
  }

  /** Returns a Pointer to the global with the given id. */
  @Linked.Out
  public Pointer getPtrGlobal(int id) {
    return new Pointer(globals.get(id));
  }

  /** Returns a Pointer to the global created for {@code decl}, or null if there is none. */
  @Linked.Out
  public @Nullable Pointer getPtrGlobal(Decl decl) {
    Integer id = globalIds.get(decl);
    return (id == null) ? null : getPtrGlobal(id);
  }

  /** Reserves a range of simulated addresses for a Block of the given size. */
  long assignAddress(int size) {
    long result = nextAddress;
    // Leave a gap so that one-past-end addresses never coincide with the next Block.
    nextAddress += SizeOf.align(size) + SizeOf.ALIGNMENT;
    return result;
  }
}
