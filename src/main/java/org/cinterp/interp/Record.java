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

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.cinterp.ast.Decl;
import org.cinterp.ast.Type;
import org.jspecify.annotations.Nullable;

/**
 * The layout of a struct or union: the offset and Descriptor of each base class subobject and each
 * field. Offsets are relative to the start of the record's data and point at the subobject's own
 * data; the subobject's InlineDescriptor occupies the bytes just before it.
 *
 * <p>Records are created by {@link Program#getOrCreateRecord} and are immutable.
 */
public final class Record {

  /** A field of the record. */
  public record Field(Decl decl, int offset, Descriptor desc) {}

  /** A base class subobject of the record. */
  public record Base(Type.Struct decl, int offset, Descriptor desc, Record record) {}

  private final Type.Struct decl;
  private final ImmutableList<Base> bases;
  private final ImmutableList<Field> fields;
  private final int size;

  Record(Type.Struct decl, ImmutableList<Base> bases, ImmutableList<Field> fields, int size) {
    this.decl = decl;
    this.bases = bases;
    this.fields = fields;
    this.size = size;
  }

  public Type.Struct getDecl() {
    return decl;
  }

  public String getName() {
    return decl.name();
  }

  public boolean isUnion() {
    return decl.isUnion();
  }

  /** The number of bytes the record's bases and fields occupy, including their metadata. */
  public int getSize() {
    return size;
  }

  public ImmutableList<Field> fields() {
    return fields;
  }

  public ImmutableList<Base> bases() {
    return bases;
  }

  public int getNumFields() {
    return fields.size();
  }

  public int getNumBases() {
    return bases.size();
  }

  public Field getField(int i) {
    return fields.get(i);
  }

  public Base getBase(int i) {
    return bases.get(i);
  }

  /** Returns the layout of the given field, or null if it is not a field of this record. */
  public @Nullable Field getField(Decl field) {
    return fields.stream().filter(f -> f.decl().equals(field)).findFirst().orElse(null);
  }

  /** Returns the layout of the field with the given name, or null if there is none. */
  public @Nullable Field getField(String name) {
    return fields.stream().filter(f -> f.decl().name().equals(name)).findFirst().orElse(null);
  }

  /** Returns the layout of the given direct base, or null if it is not a base of this record. */
  public @Nullable Base getBase(Type.Struct base) {
    return bases.stream().filter(b -> b.decl().equals(base)).findFirst().orElse(null);
  }

  @Override
  public String toString() {
    return Stream.concat(
            bases.stream().map(b -> b.offset() + ":" + b.decl().name()),
            fields.stream().map(f -> f.offset() + ":" + f.decl().name()))
        .collect(Collectors.joining(", ", decl + " {", "}"));
  }
}
