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

/**
 * A position in the evaluated program's source. The interpreter only carries locations through to
 * diagnostics; it never interprets them.
 */
public record SourceLocation(String file, int line, int column) {

  /** The location used for declarations that have no source position (e.g. synthesized ones). */
  public static final SourceLocation INVALID = new SourceLocation("", 0, 0);

  public boolean isValid() {
    return line > 0;
  }

  @Override
  public String toString() {
    return isValid() ? String.format("%s:%d:%d", file, line, column) : "<invalid loc>";
  }
}
