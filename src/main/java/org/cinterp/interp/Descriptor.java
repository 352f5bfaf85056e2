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
import org.cinterp.ast.Decl;
import org.cinterp.ast.SourceLocation;
import org.cinterp.ast.Type;
import org.cinterp.util.SizeOf;
import org.jspecify.annotations.Nullable;

/**
 * Describes the memory layout of one declared type: its size, its element size and shape if it is
 * an array, and its Record if it is a struct or union.
 *
 * <p>Descriptors are immutable and are created (and interned) by a {@link Program}; every Block of
 * the same declared type shares one. Each Descriptor has a dense {@link #id} within its Program,
 * which is how InlineDescriptors stored in Block memory refer to it.
 */
public final class Descriptor {

  /** The size reported for arrays of unknown bound. */
  public static final int UNKNOWN_SIZE = -1;

  /** The basic layouts a Descriptor can have. */
  enum Shape {
    /** A single value of a {@link PrimType}. */
    PRIMITIVE,
    /** An array of PrimType values, preceded by an InitMap header. */
    PRIMITIVE_ARRAY,
    /** An array of records or arrays, each element preceded by an InlineDescriptor. */
    COMPOSITE_ARRAY,
    /** A struct or union, laid out as described by its Record. */
    RECORD,
    /** Opaque storage we can't track; never dereferenceable. */
    DUMMY
  }

  private final Program program;
  private final int id;
  private final Shape shape;
  private final Decl source;
  private final Type type;

  /** Non-null for PRIMITIVE and PRIMITIVE_ARRAY. */
  private final @Nullable PrimType primType;

  /** Non-null for COMPOSITE_ARRAY. */
  private final @Nullable Descriptor elemDesc;

  /** Non-null for RECORD. */
  private final @Nullable Record elemRecord;

  private final int elemSize;
  private final int size;
  private final int allocSize;

  private final boolean isConst;
  private final boolean isMutable;
  private final boolean isTemporary;

  private Descriptor(
      Program program,
      int id,
      Shape shape,
      Decl source,
      Type type,
      @Nullable PrimType primType,
      @Nullable Descriptor elemDesc,
      @Nullable Record elemRecord,
      int elemSize,
      int size,
      int allocSize,
      Flags flags) {
    this.program = program;
    this.id = id;
    this.shape = shape;
    this.source = source;
    this.type = type;
    this.primType = primType;
    this.elemDesc = elemDesc;
    this.elemRecord = elemRecord;
    this.elemSize = elemSize;
    this.size = size;
    this.allocSize = allocSize;
    this.isConst = flags.isConst();
    this.isMutable = flags.isMutable();
    this.isTemporary = flags.isTemporary();
  }

  /** The qualifiers and storage properties that distinguish otherwise-identical Descriptors. */
  record Flags(boolean isConst, boolean isTemporary, boolean isMutable) {
    static final Flags NONE = new Flags(false, false, false);
  }

  static Descriptor primitive(
      Program program, int id, Decl source, Type type, PrimType primType, Flags flags) {
    int size = primType.size();
    return new Descriptor(
        program, id, Shape.PRIMITIVE, source, type, primType, null, null, size, size,
        SizeOf.align(size), flags);
  }

  static Descriptor primitiveArray(
      Program program,
      int id,
      Decl source,
      Type type,
      PrimType primType,
      int numElems,
      Flags flags) {
    int elemSize = primType.size();
    int size = elemSize * numElems;
    return new Descriptor(
        program, id, Shape.PRIMITIVE_ARRAY, source, type, primType, null, null, elemSize, size,
        SizeOf.align(size) + SizeOf.INIT_MAP_PTR, flags);
  }

  static Descriptor unknownSizePrimitiveArray(
      Program program, int id, Decl source, Type type, PrimType primType, Flags flags) {
    return new Descriptor(
        program, id, Shape.PRIMITIVE_ARRAY, source, type, primType, null, null, primType.size(),
        UNKNOWN_SIZE, SizeOf.ALIGNMENT + SizeOf.INIT_MAP_PTR, flags);
  }

  static Descriptor compositeArray(
      Program program, int id, Decl source, Type type, Descriptor elem, int numElems, Flags flags) {
    int elemSize = elem.getAllocSize() + SizeOf.INLINE_DESCRIPTOR;
    int size = elemSize * numElems;
    return new Descriptor(
        program, id, Shape.COMPOSITE_ARRAY, source, type, null, elem, null, elemSize, size,
        Math.max(SizeOf.ALIGNMENT, size), flags);
  }

  static Descriptor unknownSizeCompositeArray(
      Program program, int id, Decl source, Type type, Descriptor elem, Flags flags) {
    return new Descriptor(
        program, id, Shape.COMPOSITE_ARRAY, source, type, null, elem, null,
        elem.getAllocSize() + SizeOf.INLINE_DESCRIPTOR, UNKNOWN_SIZE, SizeOf.ALIGNMENT, flags);
  }

  static Descriptor record(
      Program program, int id, Decl source, Type type, Record record, Flags flags) {
    int size = Math.max(SizeOf.ALIGNMENT, record.getSize());
    return new Descriptor(
        program, id, Shape.RECORD, source, type, null, null, record, size, size, size, flags);
  }

  static Descriptor dummy(Program program, int id, Decl source) {
    return new Descriptor(
        program, id, Shape.DUMMY, source, source.type(), null, null, null, 1, 1, 0, Flags.NONE);
  }

  /** The Program that created this Descriptor and resolves the ids stored in InlineDescriptors. */
  Program program() {
    return program;
  }

  /** This Descriptor's index in its Program. */
  public int id() {
    return id;
  }

  Shape shape() {
    return shape;
  }

  /** The declaration or expression this Descriptor was created for. */
  public Decl getSource() {
    return source;
  }

  /** Returns the source as a declaration, or null if it is an expression. */
  public @Nullable Decl asValueDecl() {
    return source.isValueDecl() ? source : null;
  }

  /** Returns the source as a field declaration, or null if it is not a field. */
  public @Nullable Decl asFieldDecl() {
    return source.kind() == Decl.Kind.FIELD ? source : null;
  }

  /** Returns the source if it is an expression (a temporary), otherwise null. */
  public @Nullable Decl asExpr() {
    return source.isExpr() ? source : null;
  }

  public SourceLocation getLocation() {
    return source.location();
  }

  /** The type of the object this Descriptor lays out. */
  public Type getType() {
    return type;
  }

  /** The type of an element, if this is an array type. */
  public @Nullable Type getElemType() {
    return (type instanceof Type.Array array) ? array.element() : null;
  }

  /** The size of the object, or {@link #UNKNOWN_SIZE} for arrays of unknown bound. */
  public int getSize() {
    return size;
  }

  /**
   * The size of one element; for composite arrays this includes the InlineDescriptor preceding
   * each element.
   */
  public int getElemSize() {
    return elemSize;
  }

  /** The number of bytes a Block allocated with this Descriptor holds, including all metadata. */
  public int getAllocSize() {
    return allocSize;
  }

  /** The number of elements, or 0 for arrays of unknown bound. */
  public int getNumElems() {
    return (size == UNKNOWN_SIZE || elemSize == 0) ? 0 : size / elemSize;
  }

  public @Nullable PrimType getPrimType() {
    return primType;
  }

  /** The element Descriptor of a composite array, otherwise null. */
  public @Nullable Descriptor getElemDesc() {
    return elemDesc;
  }

  /** The Record of a struct or union type, otherwise null. */
  public @Nullable Record getElemRecord() {
    return elemRecord;
  }

  public boolean isConst() {
    return isConst;
  }

  public boolean isMutable() {
    return isMutable;
  }

  public boolean isTemporary() {
    return isTemporary;
  }

  public boolean isDummy() {
    return shape == Shape.DUMMY;
  }

  public boolean isPrimitive() {
    return shape == Shape.PRIMITIVE;
  }

  public boolean isArray() {
    return shape == Shape.PRIMITIVE_ARRAY || shape == Shape.COMPOSITE_ARRAY;
  }

  public boolean isPrimitiveArray() {
    return shape == Shape.PRIMITIVE_ARRAY;
  }

  public boolean isCompositeArray() {
    return shape == Shape.COMPOSITE_ARRAY;
  }

  public boolean isRecord() {
    return shape == Shape.RECORD;
  }

  public boolean isUnknownSizeArray() {
    return size == UNKNOWN_SIZE;
  }

  /**
   * Writes the metadata for an object of this type into {@code block}, whose data for the object
   * begins at {@code pos}. The bytes are assumed to already be zero.
   */
  void construct(Block block, int pos, boolean isConst, boolean isMutable, boolean isActive) {
    switch (shape) {
      case PRIMITIVE, DUMMY, PRIMITIVE_ARRAY -> {
        // Primitive arrays start with an all-zero InitMap header, i.e. nothing initialized.
      }
      case COMPOSITE_ARRAY -> {
        Descriptor elem = elemDesc;
        boolean elemConst = isConst || this.isConst;
        boolean elemMutable = isMutable || this.isMutable;
        for (int i = 0, n = getNumElems(); i < n; i++) {
          int elemOffset = i * elemSize + SizeOf.INLINE_DESCRIPTOR;
          InlineDescriptor.write(
              block, pos + elemOffset, elemOffset, elem, /* isInitialized= */ true,
              /* isBase= */ false, isActive, elemConst, elemMutable);
          elem.construct(block, pos + elemOffset, elemConst, elemMutable, isActive);
        }
      }
      case RECORD -> {
        Record record = elemRecord;
        for (Record.Base base : record.bases()) {
          constructSub(block, pos, base.offset(), base.desc(), true, isConst, isMutable, isActive);
        }
        for (Record.Field field : record.fields()) {
          constructSub(
              block, pos, field.offset(), field.desc(), false, isConst, isMutable, isActive);
        }
      }
    }
  }

  private void constructSub(
      Block block,
      int pos,
      int subOffset,
      Descriptor sub,
      boolean isBase,
      boolean isConst,
      boolean isMutable,
      boolean isActive) {
    boolean subConst = isConst || sub.isConst;
    boolean subMutable = isMutable || sub.isMutable;
    boolean subActive = isActive && !elemRecord.isUnion();
    InlineDescriptor.write(
        block, pos + subOffset, subOffset, sub, sub.isArray() && !isBase, isBase, subActive,
        subConst, subMutable);
    sub.construct(block, pos + subOffset, subConst, subMutable, subActive);
  }

  /** The argument to {@link #forEachSubobject}. */
  interface SubobjectVisitor {
    void visit(InlineDescriptor inline);
  }

  /**
   * Calls {@code visitor} with the InlineDescriptor of each immediate subobject (base, field or
   * composite array element) of the object of this type whose data begins at {@code pos}.
   */
  void forEachSubobject(Block block, int pos, SubobjectVisitor visitor) {
    if (shape == Shape.COMPOSITE_ARRAY) {
      for (int i = 0, n = getNumElems(); i < n; i++) {
        visitor.visit(new InlineDescriptor(block, pos + i * elemSize + SizeOf.INLINE_DESCRIPTOR));
      }
    } else if (shape == Shape.RECORD) {
      for (Record.Base base : elemRecord.bases()) {
        visitor.visit(new InlineDescriptor(block, pos + base.offset()));
      }
      for (Record.Field field : elemRecord.fields()) {
        visitor.visit(new InlineDescriptor(block, pos + field.offset()));
      }
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("shape", shape)
        .add("type", type)
        .add("size", size == UNKNOWN_SIZE ? "unknown" : size)
        .add("elemSize", elemSize)
        .add("allocSize", allocSize)
        .omitNullValues()
        .add("source", source.isExpr() ? null : source.name())
        .toString();
  }

  static void checkValidElemCount(int numElems) {
    Preconditions.checkArgument(numElems >= 0, "negative array length %s", numElems);
  }
}
