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

package org.cinterp.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.stream.Collectors;

/**
 * The static type of an evaluated object, as far as the memory model needs to know it: builtin
 * scalars, pointers, arrays (of known or unknown length) and structs/unions.
 *
 * <p>Types are values; two structurally identical types are equal.
 */
public interface Type {

  /** The builtin scalar types. */
  enum BuiltinKind {
    BOOL("bool"),
    CHAR("char"),
    UCHAR("unsigned char"),
    SHORT("short"),
    USHORT("unsigned short"),
    INT("int"),
    UINT("unsigned int"),
    LONG("long"),
    ULONG("unsigned long"),
    FLOAT("float"),
    DOUBLE("double");

    final String spelling;

    BuiltinKind(String spelling) {
      this.spelling = spelling;
    }
  }

  Builtin BOOL = new Builtin(BuiltinKind.BOOL);
  Builtin CHAR = new Builtin(BuiltinKind.CHAR);
  Builtin INT = new Builtin(BuiltinKind.INT);
  Builtin UINT = new Builtin(BuiltinKind.UINT);
  Builtin LONG = new Builtin(BuiltinKind.LONG);
  Builtin FLOAT = new Builtin(BuiltinKind.FLOAT);
  Builtin DOUBLE = new Builtin(BuiltinKind.DOUBLE);

  /** Returns the array type with elements of this type. */
  default Array arrayOf(int length) {
    return new Array(this, length);
  }

  /** Returns the pointer type pointing to this type. */
  default PointerTo pointer() {
    return new PointerTo(this);
  }

  /** A builtin scalar type. */
  record Builtin(BuiltinKind kind) implements Type {
    @Override
    public String toString() {
      return kind.spelling;
    }
  }

  /** A pointer type. */
  record PointerTo(Type pointee) implements Type {
    @Override
    public String toString() {
      return pointee + " *";
    }
  }

  /** A fixed-size array type, or one of unknown size if {@code length} is UNKNOWN_LENGTH. */
  record Array(Type element, int length) implements Type {
    public static final int UNKNOWN_LENGTH = -1;

    public Array {
      Preconditions.checkArgument(length >= 0 || length == UNKNOWN_LENGTH);
    }

    public boolean isUnknownLength() {
      return length == UNKNOWN_LENGTH;
    }

    @Override
    public String toString() {
      return element + (isUnknownLength() ? "[]" : "[" + length + "]");
    }
  }

  /**
   * A struct, class or union. Bases are laid out before fields, in declaration order; each field is
   * a {@link Decl.Kind#FIELD} Decl.
   */
  record Struct(
      String name, boolean isUnion, ImmutableList<Struct> bases, ImmutableList<Decl> fields)
      implements Type {

    public Struct {
      assert fields.stream().allMatch(f -> f.kind() == Decl.Kind.FIELD);
      Preconditions.checkArgument(!isUnion || bases.isEmpty(), "unions cannot have bases");
    }

    /** Returns the field with the given name, or throws IllegalArgumentException. */
    public Decl field(String fieldName) {
      return fields.stream()
          .filter(f -> f.name().equals(fieldName))
          .findFirst()
          .orElseThrow(() -> new IllegalArgumentException("no field " + fieldName + " in " + name));
    }

    @Override
    public String toString() {
      return (isUnion ? "union " : "struct ") + name;
    }

    /** Returns a string listing the members, for debugging. */
    public String describe() {
      return fields.stream()
          .map(f -> f.type() + " " + f.name() + ";")
          .collect(Collectors.joining(" ", this + " { ", " }"));
    }
  }

  /** Starts building a struct type. */
  static StructBuilder struct(String name) {
    return new StructBuilder(name, false);
  }

  /** Starts building a union type. */
  static StructBuilder union(String name) {
    return new StructBuilder(name, true);
  }

  /** Accumulates the bases and fields of a {@link Struct}. */
  final class StructBuilder {
    private final String name;
    private final boolean isUnion;
    private final ImmutableList.Builder<Struct> bases = ImmutableList.builder();
    private final ImmutableList.Builder<Decl> fields = ImmutableList.builder();

    private StructBuilder(String name, boolean isUnion) {
      this.name = name;
      this.isUnion = isUnion;
    }

    @CanIgnoreReturnValue
    public StructBuilder base(Struct base) {
      bases.add(base);
      return this;
    }

    @CanIgnoreReturnValue
    public StructBuilder field(String fieldName, Type type) {
      fields.add(Decl.field(fieldName, type));
      return this;
    }

    @CanIgnoreReturnValue
    public StructBuilder mutableField(String fieldName, Type type) {
      fields.add(Decl.mutableField(fieldName, type));
      return this;
    }

    public Struct build() {
      return new Struct(name, isUnion, bases.build(), fields.build());
    }
  }
}
