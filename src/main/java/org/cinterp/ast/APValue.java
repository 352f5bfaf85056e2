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

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * The compiler's general-purpose constant-value representation. The interpreter's memory model
 * produces these from Pointers (see {@code Pointer.toAPValue} and {@code Pointer.toRValue}); what
 * is done with them afterwards is up to the consumer.
 */
public interface APValue {

  /** An integer (or bool) value. */
  record Int(long value, boolean isUnsigned) implements APValue {
    @Override
    public String toString() {
      return isUnsigned ? Long.toUnsignedString(value) : Long.toString(value);
    }
  }

  /** A floating-point value. */
  record Float(double value) implements APValue {
    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  /** One step of an lvalue path: either an array index or a (base or member) declaration. */
  interface PathEntry {}

  /** An lvalue path step selecting an array element. */
  record ArrayIndex(long index) implements PathEntry {}

  /** An lvalue path step selecting a member or a base class subobject. */
  record Member(Decl decl, boolean isVirtual) implements PathEntry {}

  /**
   * An lvalue: a base declaration (or expression, for temporaries), a byte offset, and the path of
   * member and array-index steps from the base to the designated subobject.
   */
  record LValue(
      @Nullable Decl base,
      long offset,
      ImmutableList<PathEntry> path,
      boolean isOnePastEnd,
      boolean isNullPtr)
      implements APValue {

    public static final LValue NULL =
        new LValue(null, 0, ImmutableList.of(), /* isOnePastEnd= */ false, /* isNullPtr= */ true);

    /** Returns this lvalue in the form used by diagnostics, e.g. {@code &s.a[2]}. */
    public String getAsString() {
      if (isNullPtr) {
        return "nullptr";
      }
      StringBuilder sb = new StringBuilder("&");
      sb.append(base == null ? "<unknown>" : base.toString());
      for (PathEntry entry : path) {
        if (entry instanceof ArrayIndex index) {
          sb.append('[').append(index.index()).append(']');
        } else if (entry instanceof Member member) {
          sb.append('.').append(member.decl().name());
        }
      }
      // A one-past-end element is already named by its index.
      if (isOnePastEnd && path.isEmpty()) {
        sb.append(" + 1");
      }
      return sb.toString();
    }

    @Override
    public String toString() {
      return getAsString();
    }
  }

  /** A struct or class value, with one value per base followed by one per field. */
  record Struct(ImmutableList<APValue> bases, ImmutableList<APValue> fields) implements APValue {
    @Override
    public String toString() {
      return ImmutableList.<APValue>builder().addAll(bases).addAll(fields).build().stream()
          .map(APValue::toString)
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }

  /** A union value; {@code activeField} is null if no member is active. */
  record Union(@Nullable Decl activeField, @Nullable APValue value) implements APValue {
    @Override
    public String toString() {
      return (activeField == null) ? "{}" : "{." + activeField.name() + " = " + value + "}";
    }
  }

  /** An array value. */
  record Array(ImmutableList<APValue> elements) implements APValue {
    @Override
    public String toString() {
      return elements.stream().map(APValue::toString).collect(Collectors.joining(", ", "{", "}"));
    }
  }
}
