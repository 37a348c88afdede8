/*
 * Copyright 2026 Google Inc.
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
package org.ringclip.geometry;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import jsinterop.annotations.JsType;
import org.ringclip.geometry.R2BooleanOperation.OpType;
import org.ringclip.geometry.R2BoundaryClassifier.Classification;
import org.ringclip.geometry.R2BoundaryClassifier.Fragment;

/**
 * Decides, for one boolean operation, which classified fragments become part of the result
 * boundary and in which direction.
 *
 * <p>Fragments of the second polygon that coincide with the first are never kept, so that a shared
 * boundary appears at most once. Which coincident fragments of the first polygon survive depends on
 * the operation: a boundary shared in the same direction separates the union or intersection from
 * the outside, while one shared in the opposite direction remains a boundary of the difference.
 */
@JsType
public final class R2Combinator {
  /** What to do with a fragment. */
  @JsType
  public enum Action {
    SKIP,
    FORWARD,
    REVERSED
  }

  private final OpType opType;

  private R2Combinator(OpType opType) {
    this.opType = opType;
  }

  /** Returns the combinator for the given operation. */
  public static R2Combinator forOp(OpType opType) {
    return new R2Combinator(Preconditions.checkNotNull(opType));
  }

  public OpType opType() {
    return opType;
  }

  /** Returns the action for a fragment of the first polygon. */
  public Action actionA(Classification c) {
    switch (opType) {
      case UNION:
        return c == Classification.OUTSIDE || c == Classification.COINCIDENT_SAME
            ? Action.FORWARD
            : Action.SKIP;
      case INTERSECTION:
        return c == Classification.INSIDE || c == Classification.COINCIDENT_SAME
            ? Action.FORWARD
            : Action.SKIP;
      case DIFFERENCE:
        return c == Classification.OUTSIDE || c == Classification.COINCIDENT_OPPOSITE
            ? Action.FORWARD
            : Action.SKIP;
      case SYMMETRIC_DIFFERENCE:
        if (c == Classification.INSIDE) {
          return Action.REVERSED;
        }
        return c == Classification.OUTSIDE ? Action.FORWARD : Action.SKIP;
    }
    throw new IllegalStateException("Unknown operation: " + opType);
  }

  /** Returns the action for a fragment of the second polygon. */
  public Action actionB(Classification c) {
    switch (opType) {
      case UNION:
        return c == Classification.OUTSIDE ? Action.FORWARD : Action.SKIP;
      case INTERSECTION:
        return c == Classification.INSIDE ? Action.FORWARD : Action.SKIP;
      case DIFFERENCE:
        return c == Classification.INSIDE ? Action.REVERSED : Action.SKIP;
      case SYMMETRIC_DIFFERENCE:
        if (c == Classification.INSIDE) {
          return Action.REVERSED;
        }
        return c == Classification.OUTSIDE ? Action.FORWARD : Action.SKIP;
    }
    throw new IllegalStateException("Unknown operation: " + opType);
  }

  /** Returns true if the result contains all points far from both inputs. */
  public boolean isResultUnbounded(boolean aUnbounded, boolean bUnbounded) {
    switch (opType) {
      case UNION:
        return aUnbounded || bUnbounded;
      case INTERSECTION:
        return aUnbounded && bUnbounded;
      case DIFFERENCE:
        return aUnbounded && !bUnbounded;
      case SYMMETRIC_DIFFERENCE:
        return aUnbounded != bUnbounded;
    }
    throw new IllegalStateException("Unknown operation: " + opType);
  }

  /**
   * Returns the fragments to assemble, fragments of the first polygon first, each oriented so that
   * the result interior is on its left.
   */
  public ImmutableList<Fragment> select(R2BoundaryClassifier.Result classified) {
    ImmutableList.Builder<Fragment> kept = ImmutableList.builder();
    for (Fragment f : classified.fragmentsA()) {
      add(kept, f, actionA(f.classification()));
    }
    for (Fragment f : classified.fragmentsB()) {
      add(kept, f, actionB(f.classification()));
    }
    return kept.build();
  }

  private static void add(ImmutableList.Builder<Fragment> kept, Fragment f, Action action) {
    switch (action) {
      case FORWARD:
        kept.add(f);
        break;
      case REVERSED:
        kept.add(f.reversed());
        break;
      case SKIP:
        break;
    }
  }
}
