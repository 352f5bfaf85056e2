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

/**
 * The declaration (or expression, for temporaries) that gives an evaluated object its identity.
 * Descriptors and Records refer to Decls; the interpreter compares them but never inspects their
 * contents beyond name, type and kind.
 */
public record Decl(
    Kind kind, String name, Type type, SourceLocation location, boolean isMutable) {

  /** What sort of source construct produced an object. */
  public enum Kind {
    /** A variable (local, static or global). */
    VAR,
    /** A function parameter. */
    PARAM,
    /** A non-static data member. */
    FIELD,
    /** A base class subobject; {@link #type} is the base's {@link Type.Struct}. */
    BASE,
    /** A materialized temporary; the "declaration" is really the expression that created it. */
    TEMPORARY
  }

  public Decl {
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(type);
    Preconditions.checkNotNull(location);
    Preconditions.checkArgument(!isMutable || kind == Kind.FIELD, "only fields can be mutable");
  }

  public static Decl var(String name, Type type) {
    return new Decl(Kind.VAR, name, type, SourceLocation.INVALID, false);
  }

  public static Decl var(String name, Type type, SourceLocation location) {
    return new Decl(Kind.VAR, name, type, location, false);
  }

  public static Decl field(String name, Type type) {
    return new Decl(Kind.FIELD, name, type, SourceLocation.INVALID, false);
  }

  /** Returns a field declared {@code mutable}, which stays writable in const objects. */
  public static Decl mutableField(String name, Type type) {
    return new Decl(Kind.FIELD, name, type, SourceLocation.INVALID, true);
  }

  public static Decl base(Type.Struct base) {
    return new Decl(Kind.BASE, base.name(), base, SourceLocation.INVALID, false);
  }

  public static Decl temporary(Type type, SourceLocation location) {
    return new Decl(Kind.TEMPORARY, "", type, location, false);
  }

  /** True if this names a variable, parameter, field or base, i.e. something with a value decl. */
  public boolean isValueDecl() {
    return kind != Kind.TEMPORARY;
  }

  /** True if this Decl stands for an expression rather than a declaration. */
  public boolean isExpr() {
    return kind == Kind.TEMPORARY;
  }

  @Override
  public String toString() {
    return isExpr() ? "(temporary " + type + ")" : name;
  }
}
