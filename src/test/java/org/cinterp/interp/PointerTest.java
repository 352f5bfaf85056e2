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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.cinterp.ast.Decl;
import org.cinterp.ast.Type;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PointerTest {

  private static final Type.Struct S =
      Type.struct("S").field("a", Type.INT).field("b", Type.FLOAT).build();

  private static final Type.Struct P =
      Type.struct("P").field("x", Type.INT).field("y", Type.INT).build();

  /** A struct containing an array field. */
  private static final Type.Struct HOLDER =
      Type.struct("Holder").field("n", Type.INT).field("vals", Type.INT.arrayOf(3)).build();

  private Context ctx;
  private Program program;
  private InterpState state;
  private LocalScope scope;

  @Before
  public void setUp() {
    ctx = new Context();
    program = ctx.program();
    state = new InterpState(ctx, /* debug= */ true);
    scope = state.enterScope();
  }

  @After
  public void tearDown() {
    scope.close();
    state.close();
    assertThat(state.numDeadBlocks()).isEqualTo(0);
    assertThat(state.errored()).isFalse();
  }

  private Block allocate(String name, Type type) {
    return scope.allocate(program.createDescriptor(Decl.var(name, type)));
  }

  @Test
  public void nullPointer() {
    Pointer p = new Pointer();
    assertThat(p.isZero()).isTrue();
    assertThat(p.isLive()).isFalse();
    assertThat(p.mode()).isEqualTo(Pointer.Mode.NULL);
    assertThat(p.isOnePastEnd()).isFalse();
    assertThat(p.toString()).isEqualTo("null {0, 0, nullptr}");
    assertThat(p.getIntegerRepresentation()).isEqualTo(0);
    assertThrows(IllegalStateException.class, p::getDeclDesc);
    p.release();
  }

  @Test
  public void releaseTwice() {
    Pointer p = new Pointer(allocate("x", Type.INT));
    p.release();
    assertThrows(IllegalStateException.class, p::release);
  }

  @Test
  public void rootOfPrimitive() {
    Block block = allocate("x", Type.INT);
    assertThat(block.numPointers()).isEqualTo(0);
    try (Pointer p = new Pointer(block)) {
      assertThat(block.numPointers()).isEqualTo(1);
      assertThat(p.isRoot()).isTrue();
      assertThat(p.isField()).isFalse();
      assertThat(p.isLive()).isTrue();
      assertThat(p.inArray()).isFalse();
      assertThat(p.getType()).isEqualTo(Type.INT);
      assertThat(p.getSize()).isEqualTo(4);
      assertThat(p.isInitialized()).isTrue();
      assertThat(p.isActive()).isTrue();
      assertThat(p.isOnePastEnd()).isFalse();
      p.assign(PrimType.SINT32, -7);
      assertThat(p.deref(PrimType.SINT32)).isEqualTo(-7L);
    }
    assertThat(block.numPointers()).isEqualTo(0);
  }

  @Test
  public void structFields() {
    Block block = allocate("s", S);
    Record record = program.getOrCreateRecord(S);
    int offsetOfB = record.getField("b").offset();
    try (Pointer root = new Pointer(block);
        Pointer b = root.atField(offsetOfB);
        Pointer base = b.getBase()) {
      assertThat(b.getField()).isEqualTo(S.field("b"));
      assertThat(b.isField()).isTrue();
      assertThat(b.getType()).isEqualTo(Type.FLOAT);
      assertThat(b.mode()).isEqualTo(Pointer.Mode.FIELD);
      assertThat(base).isEqualTo(root);
      assertThat(root.getRecord()).isSameInstanceAs(record);
      assertThat(b.getRecord()).isNull();
      // Fields start out uninitialized.
      assertThat(b.isInitialized()).isFalse();
      b.assign(PrimType.FLOAT, 2.5f);
      b.initialize();
      assertThat(b.isInitialized()).isTrue();
      assertThat(b.deref(PrimType.FLOAT)).isEqualTo(2.5f);
      try (Pointer a = b.atFieldSub(offsetOfB - record.getField("a").offset())) {
        assertThat(a.getField()).isEqualTo(S.field("a"));
        assertThat(a.isInitialized()).isFalse();
      }
    }
  }

  @Test
  public void atFieldThenGetBaseIsIdentity() {
    Block block = allocate("h", HOLDER);
    Record record = program.getOrCreateRecord(HOLDER);
    try (Pointer root = new Pointer(block)) {
      for (Record.Field field : record.fields()) {
        try (Pointer f = root.atField(field.offset());
            Pointer back = f.getBase()) {
          assertThat(back).isEqualTo(root);
        }
      }
    }
  }

  @Test
  public void getBaseRequiresField() {
    try (Pointer root = new Pointer(allocate("s", S))) {
      assertThrows(IllegalStateException.class, root::getBase);
      assertThrows(IllegalStateException.class, () -> root.atFieldSub(8));
    }
  }

  @Test
  public void primitiveArrayEndToEnd() {
    Block block = allocate("a", Type.INT.arrayOf(4));
    try (Pointer root = new Pointer(block);
        Pointer two = root.atIndex(2);
        Pointer end = root.atIndex(4)) {
      assertThat(root.isArrayRoot()).isTrue();
      assertThat(root.getNumElems()).isEqualTo(4);
      assertThat(two.getIndex()).isEqualTo(2L);
      assertThat(two.isArrayElement()).isTrue();
      assertThat(two.mode()).isEqualTo(Pointer.Mode.ARRAY_ELEMENT);
      assertThat(two.getType()).isEqualTo(Type.INT);
      assertThat(two.isInitialized()).isFalse();
      two.assign(PrimType.SINT32, 42);
      two.initialize();
      assertThat(two.isInitialized()).isTrue();
      assertThat(two.deref(PrimType.SINT32)).isEqualTo(42L);
      assertThat(root.elem(PrimType.SINT32, 2)).isEqualTo(42L);
      // Other elements are unaffected.
      try (Pointer one = root.atIndex(1)) {
        assertThat(one.isInitialized()).isFalse();
      }
      assertThat(end.isOnePastEnd()).isTrue();
      assertThrows(IllegalStateException.class, () -> end.deref(PrimType.SINT32));
      assertThrows(IllegalArgumentException.class, () -> root.elem(PrimType.SINT32, 4));
    }
  }

  @Test
  public void onePastEndInPadding() {
    // int[3] is padded to an aligned size, so its end position is still inside the Block.
    Block block = allocate("a", Type.INT.arrayOf(3));
    try (Pointer root = new Pointer(block);
        Pointer end = root.atIndex(3)) {
      assertThat(end.isOnePastEnd()).isTrue();
      assertThrows(IllegalStateException.class, () -> end.assign(PrimType.SINT32, 42L));
      assertThrows(IllegalStateException.class, () -> end.deref(PrimType.SINT32));
    }
  }

  @Test
  public void onePastEndBeforeNextField() {
    Type.Struct struct =
        Type.struct("T").field("a", Type.INT.arrayOf(4)).field("b", Type.INT).build();
    Record record = program.getOrCreateRecord(struct);
    Block block = allocate("t", struct);
    try (Pointer root = new Pointer(block);
        Pointer a = root.atField(record.getField("a").offset());
        Pointer end = a.atIndex(4);
        Pointer b = root.atField(record.getField("b").offset())) {
      assertThat(end.isOnePastEnd()).isTrue();
      assertThrows(IllegalStateException.class, () -> end.assign(PrimType.SINT32, -1L));
      assertThrows(IllegalStateException.class, () -> end.deref(PrimType.SINT32));
      // Accesses through an element can't reach past the array either.
      try (Pointer last = a.atIndex(3)) {
        assertThrows(IllegalStateException.class, () -> last.assign(PrimType.SINT64, -1L));
        last.assign(PrimType.SINT32, 5L);
        assertThat(last.deref(PrimType.SINT32)).isEqualTo(5L);
      }
      // The next field is untouched.
      assertThat(b.getFieldDesc().getType()).isEqualTo(Type.INT);
      assertThat(b.isActive()).isTrue();
      b.assign(PrimType.SINT32, 7L);
      assertThat(b.deref(PrimType.SINT32)).isEqualTo(7L);
    }
  }

  @Test
  public void initializingEveryElement() {
    Block block = allocate("a", Type.INT.arrayOf(3));
    try (Pointer root = new Pointer(block)) {
      for (int i = 0; i < 3; i++) {
        try (Pointer elem = root.atIndex(i)) {
          elem.initialize();
          // Initializing twice is harmless.
          elem.initialize();
        }
      }
      for (int i = 0; i < 3; i++) {
        try (Pointer elem = root.atIndex(i)) {
          assertThat(elem.isInitialized()).isTrue();
        }
      }
    }
  }

  @Test
  public void compositeArrayNavigation() {
    Block block = allocate("ps", P.arrayOf(3));
    int offsetOfY = program.getOrCreateRecord(P).getField("y").offset();
    try (Pointer root = new Pointer(block);
        Pointer first = root.narrow();
        Pointer elem = root.atIndex(1);
        Pointer narrowed = elem.narrow();
        Pointer expanded = narrowed.expand();
        Pointer y = narrowed.atField(offsetOfY);
        Pointer yBase = y.getBase()) {
      assertThat(root.getElemRecord()).isSameInstanceAs(program.getOrCreateRecord(P));
      assertThat(first.getIndex()).isEqualTo(0L);
      assertThat(first.getRecord()).isNotNull();
      assertThat(elem.getIndex()).isEqualTo(1L);
      assertThat(elem.isArrayElement()).isTrue();
      assertThat(narrowed.getIndex()).isEqualTo(0L);
      assertThat(narrowed.isArrayElement()).isFalse();
      assertThat(narrowed.getRecord()).isNotNull();
      assertThat(expanded).isEqualTo(elem);
      assertThat(yBase).isEqualTo(narrowed);
      // Composite array elements are initialized when the array is constructed.
      assertThat(narrowed.isInitialized()).isTrue();
      try (Pointer array = elem.getArray()) {
        assertThat(array).isEqualTo(root);
      }
    }
  }

  @Test
  public void narrowThenExpand() {
    Block block = allocate("ps", P.arrayOf(2));
    try (Pointer root = new Pointer(block)) {
      for (int i = 0; i < 2; i++) {
        try (Pointer elem = root.atIndex(i);
            Pointer narrowed = elem.narrow();
            Pointer back = narrowed.expand();
            Pointer again = back.narrow()) {
          assertThat(back).isEqualTo(elem);
          assertThat(again).isEqualTo(narrowed);
        }
      }
    }
  }

  @Test
  public void rootModeSaturates() {
    Block block = allocate("x", Type.INT);
    try (Pointer root = new Pointer(block);
        Pointer whole = root.expand();
        Pointer outer = whole.expand();
        Pointer inner = whole.narrow()) {
      assertThat(whole.mode()).isEqualTo(Pointer.Mode.ROOT);
      assertThat(whole.isRoot()).isTrue();
      assertThat(outer).isEqualTo(whole);
      assertThat(inner).isEqualTo(root);
      try (Pointer past = whole.atIndex(1)) {
        assertThat(past.isOnePastEnd()).isTrue();
        try (Pointer narrowedPast = past.narrow()) {
          assertThat(narrowedPast.isElementPastEnd()).isTrue();
          assertThat(narrowedPast.mode()).isEqualTo(Pointer.Mode.PAST_END);
          assertThat(narrowedPast.getIndex()).isEqualTo(1L);
        }
      }
    }
  }

  @Test
  public void pastEndOfNestedArray() {
    Block block = allocate("ps", P.arrayOf(2));
    try (Pointer root = new Pointer(block);
        Pointer end = root.atIndex(2);
        Pointer narrowed = end.narrow();
        Pointer expanded = narrowed.expand()) {
      assertThat(end.isOnePastEnd()).isTrue();
      assertThat(narrowed.isElementPastEnd()).isTrue();
      assertThat(narrowed.getByteOffset()).isEqualTo(end.getByteOffset());
      assertThat(expanded).isEqualTo(end);
      assertThat(root.compare(end)).isEqualTo(ComparisonResult.LESS);
      assertThat(narrowed.compare(end)).isEqualTo(ComparisonResult.GREATER);
      assertThrows(IllegalStateException.class, () -> narrowed.deref(PrimType.SINT32));
    }
  }

  @Test
  public void arrayInsideStruct() {
    Block block = allocate("h", HOLDER);
    int offsetOfVals = program.getOrCreateRecord(HOLDER).getField("vals").offset();
    try (Pointer root = new Pointer(block);
        Pointer vals = root.atField(offsetOfVals);
        Pointer elem = vals.atIndex(2)) {
      assertThat(vals.isArrayRoot()).isTrue();
      // Array fields are initialized as a whole by construction; their elements are not.
      assertThat(vals.getNumElems()).isEqualTo(3);
      assertThat(elem.getIndex()).isEqualTo(2L);
      assertThat(elem.isInitialized()).isFalse();
      elem.initialize();
      assertThat(elem.isInitialized()).isTrue();
      vals.setElem(PrimType.SINT32, 2, 9);
      assertThat(elem.deref(PrimType.SINT32)).isEqualTo(9L);
      try (Pointer array = elem.getArray()) {
        assertThat(array).isEqualTo(vals);
      }
    }
  }

  @Test
  public void compare() {
    Block block = allocate("a", Type.INT.arrayOf(4));
    Block other = allocate("b", Type.INT.arrayOf(4));
    try (Pointer a = new Pointer(block);
        Pointer b = new Pointer(other);
        Pointer a1 = a.atIndex(1);
        Pointer a3 = a.atIndex(3);
        Pointer b1 = b.atIndex(1)) {
      assertThat(a1.compare(a3)).isEqualTo(ComparisonResult.LESS);
      assertThat(a3.compare(a1)).isEqualTo(ComparisonResult.GREATER);
      assertThat(a1.compare(a1)).isEqualTo(ComparisonResult.EQUAL);
      // Same position, different objects.
      assertThat(a1.compare(b1)).isEqualTo(ComparisonResult.UNORDERED);
      assertThat(Pointer.hasSameBase(a1, a1)).isTrue();
      assertThat(Pointer.hasSameBase(a1, a3)).isTrue();
      assertThat(Pointer.hasSameBase(a3, a1)).isTrue();
      assertThat(Pointer.hasSameBase(a1, b1)).isFalse();
      assertThat(Pointer.hasSameBase(b1, a1)).isFalse();
      assertThat(Pointer.hasSameArray(a1, a3)).isTrue();
      assertThat(Pointer.hasSameArray(a1, b1)).isFalse();
    }
  }

  @Test
  public void pointerValues() {
    Block target = allocate("x", Type.INT);
    Block holder = allocate("p", Type.INT.pointer());
    try (Pointer x = new Pointer(target);
        Pointer p = new Pointer(holder)) {
      try (Pointer empty = (Pointer) p.deref(PrimType.PTR)) {
        assertThat(empty.isZero()).isTrue();
      }
      p.assign(PrimType.PTR, x);
      // One for x, one stored in holder.
      assertThat(target.numPointers()).isEqualTo(2);
      try (Pointer loaded = (Pointer) p.deref(PrimType.PTR)) {
        assertThat(loaded).isEqualTo(x);
        assertThat(target.numPointers()).isEqualTo(3);
      }
      p.assign(PrimType.PTR, new Pointer());
      assertThat(target.numPointers()).isEqualTo(1);
    }
  }

  @Test
  public void derefRequiresLive() {
    Descriptor desc = program.createDescriptor(Decl.var("x", Type.INT));
    Pointer p;
    try (LocalScope inner = state.enterScope()) {
      p = new Pointer(inner.allocate(desc));
    }
    assertThat(p.isLive()).isFalse();
    assertThrows(IllegalStateException.class, () -> p.deref(PrimType.SINT32));
    assertThrows(IllegalStateException.class, () -> p.assign(PrimType.SINT32, 1));
    p.release();
  }

  @Test
  public void integerRepresentation() {
    Block block = allocate("a", Type.INT.arrayOf(4));
    try (Pointer root = new Pointer(block);
        Pointer two = root.atIndex(2)) {
      assertThat(two.getByteOffset()).isEqualTo(16);
      assertThat(two.getIntegerRepresentation() - root.getIntegerRepresentation())
          .isEqualTo(16L);
      assertThat(root.getIntegerRepresentation()).isNotEqualTo(0L);
    }
  }

  @Test
  public void print() {
    Block block = allocate("a", Type.INT.arrayOf(4));
    try (Pointer root = new Pointer(block);
        Pointer whole = root.expand();
        Pointer end = root.atIndex(4);
        Pointer narrowedEnd = end.narrow()) {
      String blockName = "Block@" + Integer.toHexString(System.identityHashCode(block));
      assertThat(root.toString()).isEqualTo(blockName + " {0, 0, 24}");
      assertThat(whole.toString()).isEqualTo(blockName + " {rootptr, 0, 24}");
      assertThat(narrowedEnd.toString()).isEqualTo(blockName + " {0, pastend, 24}");
    }
  }
}
