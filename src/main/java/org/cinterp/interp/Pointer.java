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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.cinterp.ast.APValue;
import org.cinterp.ast.Decl;
import org.cinterp.ast.SourceLocation;
import org.cinterp.ast.Type;
import org.cinterp.util.SizeOf;
import org.jspecify.annotations.Nullable;

/**
 * A Pointer addresses an object, a subobject (field or base class), or an array element within a
 * {@link Block}.
 *
 * <p>A non-null Pointer is described by two byte positions within its Block:
 *
 * <ul>
 *   <li>the <i>base</i> is the position of the subobject the Pointer navigates within; 0 for the
 *       Block's root object, otherwise the position of a field or element whose {@link
 *       InlineDescriptor} immediately precedes it.
 *   <li>the <i>offset</i> is the position actually addressed. If it equals the base the Pointer
 *       addresses the whole subobject; if it is larger the Pointer addresses an element of the
 *       array at base.
 * </ul>
 *
 * <p>Two further states are tagged explicitly rather than stored as reserved positions:
 *
 * <ul>
 *   <li>a <i>root-mode</i> base means the Pointer treats the whole Block as an array of one
 *       element; the offset is then either 0 (the object) or the object's size (one past it).
 *   <li>a <i>past-end</i> offset means the Pointer is one past the last element of the array at
 *       base, and may be compared but not dereferenced.
 * </ul>
 *
 * <p>Every non-null Pointer is linked into its Block's chain for as long as it exists, which is
 * what keeps the storage of a Block whose scope has ended readable. Pointers must therefore be
 * {@link #release released} (or closed) when no longer needed; each method that returns a new
 * Pointer is annotated {@link Linked.Out}.
 *
 * <p>Calling a method whose precondition does not hold (e.g. {@link #getBase} on a Pointer that is
 * not a field, or {@link #deref} on a Pointer that is not live) is an error in the caller and
 * throws an unchecked exception. Conditions that reflect errors in the program being evaluated
 * are reported through query results instead; see {@link AccessError}.
 */
public final class Pointer implements AutoCloseable {

  /** The addressing modes a Pointer can be in; see {@link #mode}. */
  public enum Mode {
    /** The null pointer. */
    NULL,
    /** The whole Block, treated as an array of one element. */
    ROOT,
    /** A (sub)object: the Block's root object, a field, a base, or a narrowed array element. */
    FIELD,
    /** An element of the array at base. */
    ARRAY_ELEMENT,
    /** One past the last element of the array at base. */
    PAST_END
  }

  private @Nullable Block pointee;
  private int base;
  private boolean baseIsRoot;
  private int offset;
  private boolean offsetIsPastEnd;

  /** This Pointer's handle in its Block's chain, or {@link PointerChain#NO_HANDLE}. */
  private long handle = PointerChain.NO_HANDLE;

  private boolean released;

  /** Creates a null Pointer. */
  public Pointer() {}

  /** Creates a Pointer to the root object of {@code pointee}. */
  @Linked.Out
  public Pointer(Block pointee) {
    this(pointee, 0, false, 0, false);
  }

  /** Creates a Pointer to the subobject of {@code pointee} at the given position. */
  @Linked.Out
  public Pointer(Block pointee, int baseAndOffset) {
    this(pointee, baseAndOffset, false, baseAndOffset, false);
  }

  @Linked.Out
  private Pointer(
      @Nullable Block pointee, int base, boolean baseIsRoot, int offset, boolean offsetIsPastEnd) {
    assert baseIsRoot || SizeOf.isAligned(base) : "wrong base";
    this.pointee = pointee;
    this.base = base;
    this.baseIsRoot = baseIsRoot;
    this.offset = offset;
    this.offsetIsPastEnd = offsetIsPastEnd;
    if (pointee != null) {
      handle = pointee.addPointer(this);
    }
  }

  @Linked.Out
  private Pointer withBaseAndOffset(int base, int offset) {
    return new Pointer(pointee, base, false, offset, false);
  }

  @Linked.Out
  private Pointer withField(int baseAndOffset) {
    return new Pointer(pointee, baseAndOffset, false, baseAndOffset, false);
  }

  /** Returns a new Pointer to the same position. */
  @Linked.Out
  public Pointer copy() {
    return new Pointer(pointee, base, baseIsRoot, offset, offsetIsPastEnd);
  }

  /**
   * Unlinks this Pointer from its Block. If the Block's scope has already ended and this was the
   * last Pointer to it, its storage is reclaimed. This Pointer must not be used afterwards.
   */
  public void release() {
    Preconditions.checkState(!released, "Pointer already released");
    released = true;
    Block block = pointee;
    if (block != null) {
      pointee = null;
      block.removePointer(this, handle);
      handle = PointerChain.NO_HANDLE;
      block.cleanup();
    }
  }

  @Override
  public void close() {
    release();
  }

  /** Called when the contents of this Pointer's Block are moved to a DeadBlock. */
  void retarget(Block newPointee) {
    assert pointee != null && newPointee.getDescriptor() == pointee.getDescriptor();
    pointee = newPointee;
  }

  // Navigation.

  /** True if base and offset refer to the same position (including both being tagged). */
  private boolean baseEqualsOffset() {
    return baseIsRoot ? offsetIsPastEnd : (!offsetIsPastEnd && base == offset);
  }

  /**
   * Returns a Pointer to element {@code index} of the array this Pointer is at. No bounds check is
   * made; an index equal to the number of elements yields a one-past-end Pointer.
   */
  @Linked.Out
  public Pointer atIndex(int index) {
    checkNotNull();
    if (baseIsRoot) {
      return new Pointer(pointee, 0, true, getDeclDesc().getSize(), false);
    }
    int off = index * elemSize();
    off += (getFieldDesc().getElemDesc() != null) ? SizeOf.INLINE_DESCRIPTOR : SizeOf.INIT_MAP_PTR;
    return withBaseAndOffset(base, base + off);
  }

  /** Returns a Pointer to the field or base whose data is {@code off} bytes past this position. */
  @Linked.Out
  public Pointer atField(int off) {
    checkNotNull();
    Preconditions.checkState(!offsetIsPastEnd, "cannot select a field of a past-end pointer");
    return withField(rawOffset() + off);
  }

  /** The inverse of {@link #atField}. */
  @Linked.Out
  public Pointer atFieldSub(int off) {
    checkNotNull();
    Preconditions.checkState(
        !offsetIsPastEnd && rawOffset() >= off, "offset %s is before the start of the block", off);
    return withField(rawOffset() - off);
  }

  /**
   * Steps into element storage: a Pointer to an array becomes a Pointer to its first element, a
   * Pointer to an array element becomes a Pointer to that element as an object, and a one-past-end
   * Pointer is marked as past the end of its array. Null Pointers and Pointers to arrays of
   * unknown size are returned unchanged, as are Pointers already at an object that is not an
   * array.
   */
  @Linked.Out
  public Pointer narrow() {
    if (isZero() || isUnknownSizeArray()) {
      return copy();
    }
    // A Pointer to the whole Block enters it.
    if (baseIsRoot) {
      return (offset == 0)
          ? new Pointer(pointee, 0, false, 0, false)
          : new Pointer(pointee, 0, false, 0, true);
    }
    if (isOnePastEnd()) {
      return new Pointer(pointee, base, false, 0, true);
    }
    // Elements of primitive arrays have no InlineDescriptor, so the best we can do is move to the
    // first element.
    if (inPrimitiveArray()) {
      return baseEqualsOffset() ? withBaseAndOffset(base, offset + SizeOf.INIT_MAP_PTR) : copy();
    }
    if (!baseEqualsOffset()) {
      return withField(offset);
    }
    if (!getFieldDesc().isArray()) {
      return copy();
    }
    return withField(base + SizeOf.INLINE_DESCRIPTOR);
  }

  /** The inverse of {@link #narrow}. */
  @Linked.Out
  public Pointer expand() {
    checkNotNull();
    if (isElementPastEnd()) {
      // Revert to an outer one-past-end pointer.
      int adjust = inPrimitiveArray() ? SizeOf.INIT_MAP_PTR : SizeOf.INLINE_DESCRIPTOR;
      return withBaseAndOffset(base, base + getSize() + adjust);
    }
    if (baseIsRoot || !baseEqualsOffset()) {
      return copy();
    }
    if (base == 0) {
      return new Pointer(pointee, 0, true, 0, false);
    }
    // Step out to the containing array, if there is one.
    int next = base - inlineDesc().offset();
    Descriptor desc = (next == 0) ? getDeclDesc() : inlineDescAt(next).desc();
    if (!desc.isArray()) {
      return copy();
    }
    return withBaseAndOffset(next, offset);
  }

  /** Returns a Pointer to the object containing the field or base this Pointer addresses. */
  @Linked.Out
  public Pointer getBase() {
    checkNotNull();
    if (baseIsRoot) {
      Preconditions.checkState(offsetIsPastEnd, "cannot get base of a block");
      return new Pointer(pointee, 0, true, 0, false);
    }
    Preconditions.checkState(base != 0 && baseEqualsOffset(), "not an inner field");
    return withField(base - inlineDesc().offset());
  }

  /** Returns a Pointer to the array containing the element this Pointer addresses. */
  @Linked.Out
  public Pointer getArray() {
    checkNotNull();
    if (baseIsRoot) {
      Preconditions.checkState(!offsetIsPastEnd && offset != 0, "not an array element");
      return new Pointer(pointee, 0, true, 0, false);
    }
    Preconditions.checkState(!baseEqualsOffset(), "not an array element");
    return withField(base);
  }

  /** Returns a Pointer to the root object of this Pointer's Block. */
  @Linked.Out
  public Pointer getDeclPtr() {
    checkNotNull();
    return new Pointer(pointee);
  }

  // Introspection.

  /** Returns this Pointer's addressing mode. */
  public Mode mode() {
    if (pointee == null) {
      return Mode.NULL;
    } else if (offsetIsPastEnd) {
      return Mode.PAST_END;
    } else if (baseIsRoot) {
      return Mode.ROOT;
    } else if (base == offset) {
      return Mode.FIELD;
    }
    return Mode.ARRAY_ELEMENT;
  }

  public boolean isZero() {
    return pointee == null;
  }

  /** True if this Pointer's Block exists and its scope has not ended. */
  public boolean isLive() {
    return pointee != null && !pointee.isDead();
  }

  /** True if this Pointer is at (or within) a field, base or element rather than the root. */
  public boolean isField() {
    return base != 0 && !baseIsRoot;
  }

  /** The Block this Pointer addresses, or null for the null Pointer. */
  public @Nullable Block block() {
    return pointee;
  }

  public Descriptor getDeclDesc() {
    checkNotNull();
    return pointee.getDescriptor();
  }

  public SourceLocation getDeclLoc() {
    return getDeclDesc().getLocation();
  }

  /** The Descriptor of the subobject at base. */
  public Descriptor getFieldDesc() {
    if (base == 0 || baseIsRoot) {
      return getDeclDesc();
    }
    return inlineDesc().desc();
  }

  /** The type of the addressed object: the element type for elements of primitive arrays. */
  public Type getType() {
    Descriptor desc = getFieldDesc();
    if (desc.isPrimitiveArray() && !baseEqualsOffset()) {
      return desc.getElemType();
    }
    return desc.getType();
  }

  public int elemSize() {
    if (baseIsRoot) {
      return getDeclDesc().getSize();
    }
    return getFieldDesc().getElemSize();
  }

  public int getSize() {
    return getFieldDesc().getSize();
  }

  /** The offset of the addressed element from the start of the array's element data. */
  public int getOffset() {
    Preconditions.checkState(!offsetIsPastEnd, "invalid offset");
    if (baseIsRoot) {
      return offset;
    }
    int adjust = 0;
    if (offset != base) {
      adjust =
          (getFieldDesc().getElemDesc() != null) ? SizeOf.INLINE_DESCRIPTOR : SizeOf.INIT_MAP_PTR;
    }
    return offset - base - adjust;
  }

  /** The position of the addressed object within its Block's storage. */
  public int getByteOffset() {
    if (offsetIsPastEnd) {
      int adjust = inPrimitiveArray() ? SizeOf.INIT_MAP_PTR : SizeOf.INLINE_DESCRIPTOR;
      return rawBase() + adjust + getSize();
    }
    return offset;
  }

  public boolean isArrayRoot() {
    return inArray() && baseEqualsOffset();
  }

  public boolean inArray() {
    return getFieldDesc().isArray();
  }

  public boolean inPrimitiveArray() {
    return getFieldDesc().isPrimitiveArray();
  }

  public boolean isUnknownSizeArray() {
    return getFieldDesc().isUnknownSizeArray();
  }

  public boolean isArrayElement() {
    return inArray() && !baseEqualsOffset();
  }

  public boolean isRoot() {
    return (base == 0 || baseIsRoot) && !offsetIsPastEnd && offset == 0;
  }

  /** The Record of the addressed struct or union, or null if it is not one. */
  public @Nullable Record getRecord() {
    return getFieldDesc().getElemRecord();
  }

  /** The Record of the elements of the addressed array, or null if they are not records. */
  public @Nullable Record getElemRecord() {
    Descriptor elemDesc = getFieldDesc().getElemDesc();
    return (elemDesc != null) ? elemDesc.getElemRecord() : null;
  }

  /** The declaration of the field at base, or null if base is not a field. */
  public @Nullable Decl getField() {
    return getFieldDesc().asFieldDecl();
  }

  public boolean isUnion() {
    Record record = getRecord();
    return record != null && record.isUnion();
  }

  public boolean isExtern() {
    return pointee != null && pointee.isExtern();
  }

  public boolean isStatic() {
    checkNotNull();
    return pointee.isStatic();
  }

  public boolean isTemporary() {
    checkNotNull();
    return pointee.isTemporary();
  }

  public boolean isStaticTemporary() {
    return isStatic() && isTemporary();
  }

  /** True if the field at base is declared {@code mutable}. */
  public boolean isMutable() {
    return isField() && inlineDesc().isFieldMutable();
  }

  /**
   * True if the addressed object has been initialized. For elements of primitive arrays this
   * consults the array's InitMap; for fields and composite array elements, their InlineDescriptor.
   * A Block's root object is always considered initialized, as are the elements of a static
   * primitive array at its root.
   */
  public boolean isInitialized() {
    checkNotNull();
    Descriptor desc = getFieldDesc();
    if (desc.isPrimitiveArray()) {
      if (isStatic() && rawBase() == 0) {
        return true;
      }
      return pointee.isElementInitialized(rawBase(), (int) getIndex());
    }
    return !isField() || inlineDesc().isInitialized();
  }

  /** True unless the addressed subobject is (or is within) an inactive union member. */
  public boolean isActive() {
    return !isField() || inlineDesc().isActive();
  }

  public boolean isBaseClass() {
    return isField() && inlineDesc().isBase();
  }

  public boolean isDummy() {
    return getDeclDesc().isDummy();
  }

  public boolean isConst() {
    return isField() ? inlineDesc().isConst() : getDeclDesc().isConst();
  }

  /** The id of the declaration of this Pointer's Block, if it has one. */
  public Optional<Integer> getDeclId() {
    checkNotNull();
    return Optional.ofNullable(pointee.getDeclId());
  }

  /** The number of elements of the array at base, or 0 if its size is unknown. */
  public int getNumElems() {
    int size = getSize();
    int elemSize = elemSize();
    return (size == Descriptor.UNKNOWN_SIZE || elemSize == 0) ? 0 : size / elemSize;
  }

  /**
   * The index of the addressed element in its array. A narrowed composite array element reports
   * 0, and an element-past-end Pointer reports 1 (i.e. one past a single narrowed element).
   */
  public long getIndex() {
    if (isElementPastEnd()) {
      return 1;
    }
    // narrow()ed element in a composite array.
    if (isField() && base == offset) {
      return 0;
    }
    int elemSize = elemSize();
    return (elemSize != 0) ? getOffset() / elemSize : 0;
  }

  public boolean isOnePastEnd() {
    if (pointee == null) {
      return false;
    }
    return isElementPastEnd() || getSize() == getOffset();
  }

  /** True if this Pointer was narrowed from a one-past-end Pointer. */
  public boolean isElementPastEnd() {
    return offsetIsPastEnd;
  }

  // Access.

  /**
   * Returns the value of the given type at this position: a {@link Long} for integral types, a
   * {@link Boolean}, {@link Float} or {@link Double}, or a newly-linked {@link Pointer} for PTR.
   *
   * <p>This Pointer must be live and not past the end of its array.
   */
  public Object deref(PrimType type) {
    int pos = dataPos(type);
    return (type == PrimType.PTR) ? loadPointer(pos) : type.read(pointee.rawData(), pos);
  }

  /**
   * Stores {@code value} at this position; see {@link #deref} for the representation of each type.
   * A Pointer value is copied, so the caller keeps responsibility for releasing it.
   */
  public void assign(PrimType type, Object value) {
    int pos = dataPos(type);
    if (type == PrimType.PTR) {
      pointee.storePointer(pos, ((Pointer) value).copy());
    } else {
      type.write(pointee.rawData(), pos, value);
    }
  }

  private int dataPos(PrimType type) {
    Preconditions.checkState(isLive(), "Invalid pointer");
    Preconditions.checkState(
        !offsetIsPastEnd && !isOnePastEnd(), "cannot dereference a past-end pointer");
    int pos = isArrayRoot() ? rawBase() + SizeOf.INIT_MAP_PTR : rawOffset();
    int limit = Math.min(accessLimit(), getDeclDesc().getAllocSize());
    Preconditions.checkState(
        pos + type.size() <= limit,
        "access at %s of %s bytes is outside the addressed object",
        pos,
        type.size());
    return pos;
  }

  /** The position just past the storage of the object (or array) this Pointer addresses. */
  private int accessLimit() {
    Descriptor desc = getFieldDesc();
    int size = desc.getSize();
    if (size == Descriptor.UNKNOWN_SIZE) {
      return getDeclDesc().getAllocSize();
    } else if (baseIsRoot || base == offset) {
      int start = isArrayRoot() ? rawBase() + SizeOf.INIT_MAP_PTR : rawOffset();
      return start + size;
    }
    // An element of the array at base.
    int adjust = (desc.getElemDesc() != null) ? SizeOf.INLINE_DESCRIPTOR : SizeOf.INIT_MAP_PTR;
    return rawBase() + adjust + size;
  }

  /** Reads element {@code i} of the primitive array at base. */
  public Object elem(PrimType type, int i) {
    int pos = elemPos(type, i);
    return (type == PrimType.PTR) ? loadPointer(pos) : type.read(pointee.rawData(), pos);
  }

  /** Writes element {@code i} of the primitive array at base. */
  public void setElem(PrimType type, int i, Object value) {
    int pos = elemPos(type, i);
    if (type == PrimType.PTR) {
      pointee.storePointer(pos, ((Pointer) value).copy());
    } else {
      type.write(pointee.rawData(), pos, value);
    }
  }

  @Linked.Out
  private Pointer loadPointer(int pos) {
    Pointer stored = pointee.loadPointer(pos);
    return (stored != null) ? stored.copy() : new Pointer();
  }

  private int elemPos(PrimType type, int i) {
    checkNotNull();
    Preconditions.checkState(inPrimitiveArray(), "not a primitive array");
    Preconditions.checkArgument(i >= 0 && i < getNumElems(), "index %s out of range", i);
    return rawBase() + SizeOf.INIT_MAP_PTR + i * type.size();
  }

  // Mutation of metadata.

  /** Records that the addressed object has been initialized. */
  public void initialize() {
    checkNotNull();
    Descriptor desc = getFieldDesc();
    if (desc.isPrimitiveArray()) {
      // Primitive global arrays don't have an InitMap.
      if (isStatic() && rawBase() == 0) {
        return;
      }
      int index = (int) getIndex();
      Preconditions.checkState(
          index < desc.getNumElems(), "cannot initialize element %s of %s", index, desc);
      pointee.initializeElement(rawBase(), index, desc.getNumElems());
      return;
    }
    Preconditions.checkState(isField(), "only composite fields can be initialized");
    inlineDesc().setInitialized(true);
  }

  /**
   * Makes the addressed subobject the active member of its union: every other member of that
   * union (and everything nested within them) becomes inactive, the subobject and its nested
   * subobjects become active (except the members of nested unions, which have no active member
   * yet), and the same is done for each enclosing subobject in turn.
   */
  public void activate() {
    checkNotNull();
    Preconditions.checkState(isField(), "only fields can be activated");
    Block block = pointee;
    InlineDescriptor member = inlineDesc();
    member.setActive(true);
    activateNested(block, member.dataPos(), member.desc());
    int current = base;
    while (current != 0) {
      int enclosing = current - inlineDescAt(current).offset();
      Descriptor enclosingDesc = (enclosing == 0) ? getDeclDesc() : inlineDescAt(enclosing).desc();
      if (isUnion(enclosingDesc)) {
        int activeMember = current;
        enclosingDesc.forEachSubobject(
            block,
            enclosing,
            sibling -> {
              if (sibling.dataPos() != activeMember && sibling.isActive()) {
                sibling.setActive(false);
                deactivateNested(block, sibling.dataPos(), sibling.desc());
              }
            });
      }
      if (enclosing != 0) {
        InlineDescriptor enclosingInline = inlineDescAt(enclosing);
        if (!enclosingInline.isActive()) {
          enclosingInline.setActive(true);
          activateNested(block, enclosing, enclosingDesc);
        }
      }
      current = enclosing;
    }
  }

  /**
   * Makes the addressed subobject and every subobject nested within it inactive, e.g. when
   * another member of the union containing it becomes active.
   */
  public void deactivate() {
    checkNotNull();
    Preconditions.checkState(isField(), "only fields can be deactivated");
    InlineDescriptor member = inlineDesc();
    member.setActive(false);
    deactivateNested(pointee, member.dataPos(), member.desc());
  }

  private static boolean isUnion(Descriptor desc) {
    return desc.isRecord() && desc.getElemRecord().isUnion();
  }

  private static void activateNested(Block block, int pos, Descriptor desc) {
    if (isUnion(desc)) {
      return;
    }
    desc.forEachSubobject(
        block,
        pos,
        sub -> {
          sub.setActive(true);
          activateNested(block, sub.dataPos(), sub.desc());
        });
  }

  private static void deactivateNested(Block block, int pos, Descriptor desc) {
    desc.forEachSubobject(
        block,
        pos,
        sub -> {
          sub.setActive(false);
          deactivateNested(block, sub.dataPos(), sub.desc());
        });
  }

  // Comparison.

  /**
   * Compares the positions of two Pointers. Returns {@link ComparisonResult#UNORDERED} unless they
   * point into the same object (see {@link #hasSameBase}); a past-end Pointer orders after every
   * element.
   */
  public ComparisonResult compare(Pointer other) {
    if (!hasSameBase(this, other)) {
      return ComparisonResult.UNORDERED;
    }
    return ComparisonResult.of(Long.compare(comparableOffset(), other.comparableOffset()));
  }

  private long comparableOffset() {
    return offsetIsPastEnd ? 0xFFFF_FFFFL : offset;
  }

  /** True if both Pointers point into the same object. */
  public static boolean hasSameBase(Pointer a, Pointer b) {
    return a.pointee == b.pointee;
  }

  /** True if both Pointers point into the same array. */
  public static boolean hasSameArray(Pointer a, Pointer b) {
    return hasSameBase(a, b)
        && a.base == b.base
        && a.baseIsRoot == b.baseIsRoot
        && a.pointee != null
        && a.getFieldDesc().isArray();
  }

  // Conversion.

  /**
   * Returns this Pointer as an lvalue: the declaration (or temporary) of its Block plus the path
   * of member and array-index steps from the root to the addressed subobject.
   */
  public APValue.LValue toAPValue() {
    if (isZero()) {
      return APValue.LValue.NULL;
    }
    Descriptor desc = getDeclDesc();
    Decl lvalueBase = desc.getSource();
    if (isUnknownSizeArray() || desc.asExpr() != null) {
      return new APValue.LValue(lvalueBase, 0, ImmutableList.of(), false, false);
    }
    List<APValue.PathEntry> path = new ArrayList<>();
    Pointer ptr = copy();
    try {
      while (!ptr.baseIsRoot && (ptr.isField() || ptr.isArrayElement())) {
        Pointer next;
        if (ptr.isArrayElement()) {
          path.add(new APValue.ArrayIndex(ptr.getIndex()));
          next = ptr.getArray();
        } else {
          // A narrowed array element is reported by its index, not as a member.
          Pointer expanded = ptr.expand();
          if (!expanded.equals(ptr)) {
            ptr.release();
            ptr = expanded;
            continue;
          }
          expanded.release();
          Decl member = ptr.getFieldDesc().getSource();
          // Virtual bases are not laid out, so no member step is virtual.
          path.add(new APValue.Member(member, false));
          next = ptr.getBase();
        }
        ptr.release();
        ptr = next;
      }
    } finally {
      ptr.release();
    }
    Collections.reverse(path);
    return new APValue.LValue(lvalueBase, 0, ImmutableList.copyOf(path), isOnePastEnd(), false);
  }

  /** Returns this Pointer in the form used by diagnostics, e.g. {@code &s.a[2]}. */
  public String toDiagnosticString(Context ctx) {
    if (isZero()) {
      return "nullptr";
    }
    Preconditions.checkArgument(
        ctx.program() == getDeclDesc().program(), "Pointer belongs to another program");
    return toAPValue().getAsString();
  }

  /**
   * Performs the load implied by an lvalue-to-rvalue conversion of the addressed object. Returns
   * empty if any part of it can't be read: the Block is dead or a dummy, the Pointer is past the
   * end, or a primitive value has not been initialized.
   */
  public Optional<APValue> toRValue(Context ctx) {
    if (isZero()) {
      return Optional.of(APValue.LValue.NULL);
    }
    if (isDummy() || !isLive()) {
      return Optional.empty();
    }
    if (isArrayElement() && !inPrimitiveArray() && !isOnePastEnd()) {
      try (Pointer element = narrow()) {
        return Optional.ofNullable(composite(ctx, element.getType(), element));
      }
    }
    return Optional.ofNullable(composite(ctx, getType(), this));
  }

  /** Returns the value of the object at {@code ptr}, or null if it can't be read. */
  private static @Nullable APValue composite(Context ctx, Type type, Pointer ptr) {
    if (ptr.isDummy() || !ptr.isLive() || (!ptr.isUnknownSizeArray() && ptr.isOnePastEnd())) {
      return null;
    }
    PrimType primType = ctx.classify(type);
    if (primType != null) {
      return primitive(primType, ptr);
    }
    if (type instanceof Type.Struct struct) {
      Record record = ptr.getRecord();
      assert record != null : "Missing record descriptor";
      return struct.isUnion() ? union(ctx, record, ptr) : struct(ctx, record, ptr);
    }
    if (type instanceof Type.Array array) {
      if (array.isUnknownLength()) {
        return new APValue.Array(ImmutableList.of());
      }
      PrimType elemType = ctx.classify(array.element());
      ImmutableList.Builder<APValue> elements = ImmutableList.builder();
      for (int i = 0, n = ptr.getNumElems(); i < n; i++) {
        APValue value;
        try (Pointer elem = ptr.atIndex(i)) {
          if (elemType != null) {
            value = primitive(elemType, elem);
          } else {
            try (Pointer narrowed = elem.narrow()) {
              value = composite(ctx, array.element(), narrowed);
            }
          }
        }
        if (value == null) {
          return null;
        }
        elements.add(value);
      }
      return new APValue.Array(elements.build());
    }
    throw new IllegalArgumentException("invalid value to return: " + type);
  }

  private static @Nullable APValue struct(Context ctx, Record record, Pointer ptr) {
    ImmutableList.Builder<APValue> bases = ImmutableList.builder();
    for (Record.Base b : record.bases()) {
      try (Pointer basePtr = ptr.atField(b.offset())) {
        APValue value = composite(ctx, b.decl(), basePtr);
        if (value == null) {
          return null;
        }
        bases.add(value);
      }
    }
    ImmutableList.Builder<APValue> fields = ImmutableList.builder();
    for (Record.Field f : record.fields()) {
      try (Pointer fieldPtr = ptr.atField(f.offset())) {
        APValue value = fieldValue(ctx, f, fieldPtr);
        if (value == null) {
          return null;
        }
        fields.add(value);
      }
    }
    return new APValue.Struct(bases.build(), fields.build());
  }

  private static @Nullable APValue union(Context ctx, Record record, Pointer ptr) {
    for (Record.Field f : record.fields()) {
      try (Pointer fieldPtr = ptr.atField(f.offset())) {
        if (fieldPtr.isActive()) {
          APValue value = fieldValue(ctx, f, fieldPtr);
          return (value == null) ? null : new APValue.Union(f.decl(), value);
        }
      }
    }
    return new APValue.Union(null, null);
  }

  private static @Nullable APValue fieldValue(Context ctx, Record.Field field, Pointer fieldPtr) {
    PrimType primType = ctx.classify(field.decl().type());
    if (primType != null) {
      return primitive(primType, fieldPtr);
    }
    return composite(ctx, field.decl().type(), fieldPtr);
  }

  private static @Nullable APValue primitive(PrimType type, Pointer ptr) {
    if (!ptr.isLive() || ptr.isOnePastEnd() || !ptr.isInitialized()) {
      return null;
    }
    if (type == PrimType.PTR) {
      try (Pointer value = (Pointer) ptr.deref(type)) {
        return value.toAPValue();
      }
    }
    return type.toAPValue(ptr.deref(type));
  }

  // Presentation.

  /** The address of this Pointer's Block plus its byte offset, or 0 for the null Pointer. */
  public long getIntegerRepresentation() {
    if (pointee == null) {
      return 0;
    }
    return pointee.getAddress() + getByteOffset();
  }

  /** Appends a debugging representation of this Pointer to {@code out}. */
  @CanIgnoreReturnValue
  public StringBuilder print(StringBuilder out) {
    out.append(
            (pointee == null)
                ? "null"
                : "Block@" + Integer.toHexString(System.identityHashCode(pointee)))
        .append(" {");
    if (baseIsRoot) {
      out.append("rootptr, ");
    } else {
      out.append(base).append(", ");
    }
    if (offsetIsPastEnd) {
      out.append("pastend, ");
    } else {
      out.append(offset).append(", ");
    }
    if (pointee != null) {
      out.append(pointee.getSize());
    } else {
      out.append("nullptr");
    }
    return out.append("}");
  }

  @Override
  public String toString() {
    return print(new StringBuilder()).toString();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Pointer other
        && pointee == other.pointee
        && base == other.base
        && baseIsRoot == other.baseIsRoot
        && offset == other.offset
        && offsetIsPastEnd == other.offsetIsPastEnd;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        System.identityHashCode(pointee), base, baseIsRoot, offset, offsetIsPastEnd);
  }

  // Internals.

  private void checkNotNull() {
    Preconditions.checkState(pointee != null, "null pointer");
  }

  /** The base as a position in the Block; root mode starts at the Block's root object. */
  private int rawBase() {
    return baseIsRoot ? 0 : base;
  }

  private int rawOffset() {
    assert !offsetIsPastEnd;
    return offset;
  }

  private InlineDescriptor inlineDesc() {
    return inlineDescAt(base);
  }

  private InlineDescriptor inlineDescAt(int pos) {
    assert pos != 0 && !baseIsRoot : "Not a nested pointer";
    checkNotNull();
    return new InlineDescriptor(pointee, pos);
  }
}
