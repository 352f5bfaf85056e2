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

import org.cinterp.ast.Type;
import org.jspecify.annotations.Nullable;

/**
 * Holds the state shared by everything evaluated within one translation unit: currently just the
 * {@link Program}, plus the mapping from source types to the PrimTypes used to store them.
 */
public final class Context {

  private final Program program;

  public Context() {
    this.program = new Program(this);
  }

  public Program program() {
    return program;
  }

  /**
   * Returns the PrimType used to store values of the given type, or null if it is not a scalar
   * (i.e. it is an array or a struct or union).
   */
  public @Nullable PrimType classify(Type type) {
    if (type instanceof Type.Builtin builtin) {
      return switch (builtin.kind()) {
        case BOOL -> PrimType.BOOL;
        case CHAR -> PrimType.SINT8;
        case UCHAR -> PrimType.UINT8;
        case SHORT -> PrimType.SINT16;
        case USHORT -> PrimType.UINT16;
        case INT -> PrimType.SINT32;
        case UINT -> PrimType.UINT32;
        case LONG -> PrimType.SINT64;
        case ULONG -> PrimType.UINT64;
        case FLOAT -> PrimType.FLOAT;
        case DOUBLE -> PrimType.DOUBLE;
      };
    } else if (type instanceof Type.PointerTo) {
      return PrimType.PTR;
    }
    return null;
  }
}
