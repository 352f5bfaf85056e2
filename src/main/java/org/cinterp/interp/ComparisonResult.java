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

/** The result of {@link Pointer#compare}. */
public enum ComparisonResult {
  LESS,
  EQUAL,
  GREATER,
  /** The Pointers are into different objects, so their relative order is unspecified. */
  UNORDERED;

  /** Converts the result of a {@link Comparable#compareTo}-style comparison. */
  static ComparisonResult of(int cmp) {
    return (cmp < 0) ? LESS : (cmp > 0) ? GREATER : EQUAL;
  }
}
