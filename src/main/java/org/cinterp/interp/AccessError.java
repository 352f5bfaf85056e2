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

import java.util.Optional;

/**
 * The conditions under which an access through a Pointer is not allowed in a constant expression,
 * with a static instance for each. These reflect errors in the program being evaluated; the
 * evaluator is expected to check for them (with {@link #checkLoad}, {@link #checkStore} and {@link
 * #checkComparable}, or the introspection methods of {@link Pointer}) and report a diagnostic,
 * rather than call a Pointer method whose precondition does not hold.
 */
public final class AccessError {

  private final String message;

  private AccessError(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }

  /** Thrown by {@link #unless} and {@link #when} to report an AccessError. */
  public static final class AccessException extends Exception {
    private final AccessError error;

    private AccessException(AccessError error) {
      super(error.message);
      this.error = error;
    }

    public AccessError error() {
      return error;
    }
  }

  /** Returns an AccessException corresponding to this AccessError. */
  public AccessException asException() {
    return new AccessException(this);
  }

  /** Throws {@link #asException} unless {@code check} is true. */
  public void unless(boolean check) throws AccessException {
    if (!check) {
      throw asException();
    }
  }

  /** Throws {@link #asException} if {@code check} is true. */
  public void when(boolean check) throws AccessException {
    if (check) {
      throw asException();
    }
  }

  @Override
  public String toString() {
    return message;
  }

  public static final AccessError NULL_POINTER = new AccessError("Dereference of null pointer");

  public static final AccessError DEAD_OBJECT =
      new AccessError("Read of object outside its lifetime");

  public static final AccessError PAST_END =
      new AccessError("Dereference of one-past-the-end pointer");

  public static final AccessError UNINITIALIZED = new AccessError("Read of uninitialized object");

  public static final AccessError INACTIVE_MEMBER =
      new AccessError("Access of member that is not the active member of its union");

  public static final AccessError EXTERN =
      new AccessError("Access of extern object whose value is not known");

  public static final AccessError DUMMY = new AccessError("Access of object that is not tracked");

  public static final AccessError CONST_MODIFIED = new AccessError("Modification of const object");

  public static final AccessError MUTABLE_READ =
      new AccessError("Read of mutable member of an object not created in this evaluation");

  public static final AccessError UNRELATED_COMPARISON =
      new AccessError("Comparison of pointers to unrelated objects");

  /** Returns the first reason (if any) that a value can't be loaded through {@code ptr}. */
  public static Optional<AccessError> checkLoad(Pointer ptr) {
    if (ptr.isZero()) {
      return Optional.of(NULL_POINTER);
    } else if (!ptr.isLive()) {
      return Optional.of(DEAD_OBJECT);
    } else if (ptr.isDummy()) {
      return Optional.of(DUMMY);
    } else if (ptr.isExtern()) {
      return Optional.of(EXTERN);
    } else if (ptr.isOnePastEnd()) {
      return Optional.of(PAST_END);
    } else if (!ptr.isActive()) {
      return Optional.of(INACTIVE_MEMBER);
    } else if (!ptr.isInitialized()) {
      return Optional.of(UNINITIALIZED);
    } else if (ptr.isMutable() && ptr.isStatic()) {
      // A mutable member of a global may have changed since the global was initialized.
      return Optional.of(MUTABLE_READ);
    }
    return Optional.empty();
  }

  /** Returns the first reason (if any) that a value can't be stored through {@code ptr}. */
  public static Optional<AccessError> checkStore(Pointer ptr) {
    if (ptr.isZero()) {
      return Optional.of(NULL_POINTER);
    } else if (!ptr.isLive()) {
      return Optional.of(DEAD_OBJECT);
    } else if (ptr.isDummy()) {
      return Optional.of(DUMMY);
    } else if (ptr.isExtern()) {
      return Optional.of(EXTERN);
    } else if (ptr.isOnePastEnd()) {
      return Optional.of(PAST_END);
    } else if (ptr.isConst() && !ptr.isMutable()) {
      return Optional.of(CONST_MODIFIED);
    }
    return Optional.empty();
  }

  /** Returns UNRELATED_COMPARISON if the relative order of two Pointers is unspecified. */
  public static Optional<AccessError> checkComparable(Pointer a, Pointer b) {
    return (a.compare(b) == ComparisonResult.UNORDERED)
        ? Optional.of(UNRELATED_COMPARISON)
        : Optional.empty();
  }

  /** Throws the first reason (if any) that a value can't be loaded through {@code ptr}. */
  public static void requireLoadable(Pointer ptr) throws AccessException {
    Optional<AccessError> error = checkLoad(ptr);
    if (error.isPresent()) {
      throw error.get().asException();
    }
  }

  /** Throws the first reason (if any) that a value can't be stored through {@code ptr}. */
  public static void requireStorable(Pointer ptr) throws AccessException {
    Optional<AccessError> error = checkStore(ptr);
    if (error.isPresent()) {
      throw error.get().asException();
    }
  }
}
