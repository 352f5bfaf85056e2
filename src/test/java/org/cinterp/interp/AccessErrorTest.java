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
public class AccessErrorTest {

  private static final Type.Struct COUNTER =
      Type.struct("Counter").field("limit", Type.INT).mutableField("hits", Type.INT).build();

  private static final Type.Struct U =
      Type.union("U").field("i", Type.INT).field("f", Type.FLOAT).build();

  private Context ctx;
  private Program program;
  private InterpState state;

  @Before
  public void setUp() {
    ctx = new Context();
    program = ctx.program();
    state = new InterpState(ctx, /* debug= */ true);
  }

  @After
  public void tearDown() {
    state.close();
    assertThat(state.errored()).isFalse();
  }

  private int offset(Type.Struct type, String field) {
    return program.getOrCreateRecord(type).getField(field).offset();
  }

  @Test
  public void nullPointer() {
    Pointer p = new Pointer();
    assertThat(AccessError.checkLoad(p)).hasValue(AccessError.NULL_POINTER);
    assertThat(AccessError.checkStore(p)).hasValue(AccessError.NULL_POINTER);
  }

  @Test
  public void deadObject() {
    Block block = state.allocate(program.createDescriptor(Decl.var("x", Type.INT)));
    try (Pointer p = new Pointer(block)) {
      assertThat(AccessError.checkLoad(p)).isEmpty();
      assertThat(AccessError.checkStore(p)).isEmpty();
      state.deallocate(block);
      assertThat(AccessError.checkLoad(p)).hasValue(AccessError.DEAD_OBJECT);
      assertThat(AccessError.checkStore(p)).hasValue(AccessError.DEAD_OBJECT);
    }
  }

  @Test
  public void pastEndAndUninitialized() {
    Block block = state.allocate(program.createDescriptor(Decl.var("a", Type.INT.arrayOf(2))));
    try (Pointer root = new Pointer(block);
        Pointer first = root.atIndex(0);
        Pointer end = root.atIndex(2)) {
      assertThat(AccessError.checkLoad(first)).hasValue(AccessError.UNINITIALIZED);
      assertThat(AccessError.checkStore(first)).isEmpty();
      first.initialize();
      assertThat(AccessError.checkLoad(first)).isEmpty();
      assertThat(AccessError.checkLoad(end)).hasValue(AccessError.PAST_END);
      assertThat(AccessError.checkStore(end)).hasValue(AccessError.PAST_END);
    }
    state.deallocate(block);
  }

  @Test
  public void inactiveMember() {
    Block block = state.allocate(program.createDescriptor(Decl.var("u", U)));
    try (Pointer root = new Pointer(block);
        Pointer i = root.atField(offset(U, "i"))) {
      assertThat(AccessError.checkLoad(i)).hasValue(AccessError.INACTIVE_MEMBER);
      i.activate();
      assertThat(AccessError.checkLoad(i)).hasValue(AccessError.UNINITIALIZED);
    }
    state.deallocate(block);
  }

  @Test
  public void constGlobal() {
    Decl c = Decl.var("c", COUNTER);
    Descriptor desc = program.createDescriptor(c, COUNTER, /* isConst= */ true, false, false);
    int id = program.createGlobal(c, desc, /* isExtern= */ false);
    try (Pointer root = program.getPtrGlobal(id);
        Pointer limit = root.atField(offset(COUNTER, "limit"));
        Pointer hits = root.atField(offset(COUNTER, "hits"))) {
      assertThat(root.isConst()).isTrue();
      assertThat(limit.isConst()).isTrue();
      assertThat(AccessError.checkStore(root)).hasValue(AccessError.CONST_MODIFIED);
      assertThat(AccessError.checkStore(limit)).hasValue(AccessError.CONST_MODIFIED);
      // Mutable members may be modified, but their value can't be relied on.
      assertThat(hits.isMutable()).isTrue();
      assertThat(AccessError.checkStore(hits)).isEmpty();
      hits.initialize();
      assertThat(AccessError.checkLoad(hits)).hasValue(AccessError.MUTABLE_READ);
    }
  }

  @Test
  public void mutableMemberOfLocal() {
    Block block = state.allocate(program.createDescriptor(Decl.var("c", COUNTER)));
    try (Pointer root = new Pointer(block);
        Pointer hits = root.atField(offset(COUNTER, "hits"))) {
      hits.initialize();
      assertThat(AccessError.checkLoad(hits)).isEmpty();
    }
    state.deallocate(block);
  }

  @Test
  public void externAndDummy() {
    Decl e = Decl.var("e", Type.INT);
    int externId = program.createGlobal(e, program.createDescriptor(e), /* isExtern= */ true);
    Decl d = Decl.var("d", Type.INT);
    int dummyId = program.createGlobal(d, program.createDummy(d), /* isExtern= */ false);
    try (Pointer extern = program.getPtrGlobal(externId);
        Pointer dummy = program.getPtrGlobal(dummyId)) {
      assertThat(extern.isExtern()).isTrue();
      assertThat(AccessError.checkLoad(extern)).hasValue(AccessError.EXTERN);
      assertThat(AccessError.checkLoad(dummy)).hasValue(AccessError.DUMMY);
      assertThat(AccessError.checkStore(dummy)).hasValue(AccessError.DUMMY);
    }
  }

  @Test
  public void comparison() {
    Descriptor desc = program.createDescriptor(Decl.var("a", Type.INT.arrayOf(2)));
    Block a = state.allocate(desc);
    Block b = state.allocate(desc);
    try (Pointer pa = new Pointer(a);
        Pointer pa1 = pa.atIndex(1);
        Pointer pb = new Pointer(b)) {
      assertThat(AccessError.checkComparable(pa, pa1)).isEmpty();
      assertThat(AccessError.checkComparable(pa, pb)).hasValue(AccessError.UNRELATED_COMPARISON);
      assertThat(AccessError.checkComparable(new Pointer(), new Pointer())).isEmpty();
    }
    state.deallocate(a);
    state.deallocate(b);
  }

  @Test
  public void exceptions() throws Exception {
    AccessError.UNINITIALIZED.when(false);
    AccessError.UNINITIALIZED.unless(true);
    AccessError.AccessException e =
        assertThrows(AccessError.AccessException.class, () -> AccessError.PAST_END.when(true));
    assertThat(e.error()).isSameInstanceAs(AccessError.PAST_END);
    assertThat(e).hasMessageThat().isEqualTo(AccessError.PAST_END.message());
    e = assertThrows(
        AccessError.AccessException.class, () -> AccessError.DEAD_OBJECT.unless(false));
    assertThat(e.error()).isSameInstanceAs(AccessError.DEAD_OBJECT);
    e = assertThrows(
        AccessError.AccessException.class, () -> AccessError.requireLoadable(new Pointer()));
    assertThat(e.error()).isSameInstanceAs(AccessError.NULL_POINTER);
    e = assertThrows(
        AccessError.AccessException.class, () -> AccessError.requireStorable(new Pointer()));
    assertThat(e.error()).isSameInstanceAs(AccessError.NULL_POINTER);
  }
}
