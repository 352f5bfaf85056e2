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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The annotations in this class document who is responsible for unlinking a {@link Pointer} from
 * its Block's chain. A Block whose scope has ended is only reclaimed once every Pointer linked to
 * it has been released, so a Pointer that is never released keeps its storage alive.
 */
public class Linked {
  // statics only
  private Linked() {}

  /**
   * Indicates that the method returns a newly-linked Pointer, and the caller is responsible for
   * eventually calling {@link Pointer#release} on it.
   */
  @Target({ElementType.METHOD, ElementType.CONSTRUCTOR})
  @Retention(RetentionPolicy.RUNTIME)
  public @interface Out {}

  /**
   * Indicates that the method takes over responsibility for releasing this argument; the caller
   * should not use it after the call.
   *
   * <p>When applied to a method, refers to the "this" argument.
   */
  @Target({ElementType.METHOD, ElementType.PARAMETER})
  @Retention(RetentionPolicy.RUNTIME)
  public @interface In {}

  /**
   * Indicates that the returned Pointer is still owned by the callee (e.g. it is stored in a Block)
   * and must not be released or retained by the caller.
   */
  @Target({ElementType.METHOD})
  @Retention(RetentionPolicy.RUNTIME)
  public @interface Borrowed {}
}
