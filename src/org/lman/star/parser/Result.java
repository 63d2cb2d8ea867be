// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.star.parser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The outcome of applying a {@link Parser} at a {@link Cursor}: either a value and the cursor after
 * it, or a failure.
 *
 * Successful results also remember the furthest failure that was backtracked over on the way,
 * so that when a parse ultimately fails the error can point at the deepest point reached rather
 * than wherever the last alternative gave up.
 */
public final class Result<T> {
  private final boolean success;
  private final T value;
  private final Cursor next;
  private final Cursor furthest;
  private final Set<String> expected;

  private Result(boolean success, T value, Cursor next, Cursor furthest, Set<String> expected) {
    this.success = success;
    this.value = value;
    this.next = next;
    this.furthest = furthest;
    this.expected = expected;
  }

  public static <T> Result<T> success(T value, Cursor next) {
    return new Result<T>(true, value, next, null, Collections.<String>emptySet());
  }

  public static <T> Result<T> failure(String expected, Cursor at) {
    return new Result<T>(false, null, null, at, Collections.singleton(expected));
  }

  public boolean isSuccess() {
    return success;
  }

  public T getValue() {
    if (!success)
      throw new IllegalStateException("No value in a failed result");
    return value;
  }

  public Cursor getNext() {
    if (!success)
      throw new IllegalStateException("No next cursor in a failed result");
    return next;
  }

  /**
   * Where the furthest failure happened, or null if nothing has failed.
   */
  public Cursor getFurthest() {
    return furthest;
  }

  public Set<String> getExpected() {
    return expected;
  }

  /**
   * Re-types a failure.
   */
  @SuppressWarnings("unchecked")
  public <U> Result<U> asFailure() {
    if (success)
      throw new IllegalStateException("Not a failure");
    return (Result<U>) this;
  }

  /**
   * Merges in the furthest failure of |other|, a result that came before this one.
   */
  public Result<T> aggregate(Result<?> other) {
    if (other == null || other.furthest == null)
      return this;
    if (furthest == null || other.furthest.offset > furthest.offset)
      return new Result<T>(success, value, next, other.furthest, other.expected);
    if (other.furthest.offset < furthest.offset)
      return this;
    Set<String> merged = new LinkedHashSet<String>(other.expected);
    merged.addAll(expected);
    return new Result<T>(success, value, next, furthest, Collections.unmodifiableSet(merged));
  }

  @Override
  public String toString() {
    return success
        ? "Success(" + value + " -> " + next + ")"
        : "Failure(" + expected + " at " + furthest + ")";
  }
}
