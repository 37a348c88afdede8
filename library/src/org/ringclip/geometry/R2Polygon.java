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
import java.io.Serializable;
import java.util.List;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An R2Polygon is an ordered collection of {@link R2Loop loops} describing a planar region. The
 * region is defined by winding: a point is inside if the winding numbers of all loops around it sum
 * to a positive value.
 *
 * <p>A polygon whose loop areas sum to a negative value is unbounded. Its outermost loops are holes
 * cut from the whole plane, so a polygon consisting only of clockwise loops contains every point
 * that is outside all of them. This is what {@link #inverse()} produces from an ordinary polygon.
 *
 * <p>The polygon with no loops is empty. The whole plane has no representation.
 */
@JsType
public final class R2Polygon implements Serializable {
  private static final R2Polygon EMPTY = new R2Polygon(ImmutableList.of());

  private final ImmutableList<R2Loop> loops;

  /** Constructs a polygon from the given loops, in order. */
  public R2Polygon(List<R2Loop> loops) {
    this.loops = ImmutableList.copyOf(loops);
  }

  /** Returns the polygon with no loops, which contains no points. */
  public static R2Polygon empty() {
    return EMPTY;
  }

  /** Returns a polygon with the given loops. */
  @JsIgnore
  public static R2Polygon of(R2Loop... loops) {
    return new R2Polygon(ImmutableList.copyOf(loops));
  }

  public int numLoops() {
    return loops.size();
  }

  public R2Loop loop(int k) {
    return loops.get(k);
  }

  public ImmutableList<R2Loop> loops() {
    return loops;
  }

  public boolean isEmpty() {
    return loops.isEmpty();
  }

  /** Returns the total number of vertices in all loops. */
  public int numVertices() {
    int n = 0;
    for (R2Loop loop : loops) {
      n += loop.numVertices();
    }
    return n;
  }

  /** Returns the sum of the signed areas of the loops. */
  public double getSignedArea() {
    double sum = 0;
    for (R2Loop loop : loops) {
      sum += loop.getSignedArea();
    }
    return sum;
  }

  /**
   * Returns the area of the region for bounded polygons. For unbounded polygons this is the area of
   * the region they exclude.
   */
  public double getArea() {
    return Math.abs(getSignedArea());
  }

  /** Returns true if this polygon contains all points far enough from its loops. */
  public boolean isUnbounded() {
    return getSignedArea() < 0;
  }

  /** Returns the bounding rectangle of all loop vertices. */
  public R2Rect getBound() {
    R2Rect bound = R2Rect.empty();
    for (R2Loop loop : loops) {
      bound = bound.union(loop.getBound());
    }
    return bound;
  }

  /**
   * Returns the sum of the winding numbers of all loops around {@code p}, plus one if this polygon
   * is unbounded.
   */
  public int windingNumber(R2Vector p) {
    int wn = isUnbounded() ? 1 : 0;
    for (R2Loop loop : loops) {
      wn += loop.windingNumber(p);
    }
    return wn;
  }

  /** Returns true if {@code p} is inside the region. Points on the boundary are unspecified. */
  public boolean contains(R2Vector p) {
    return windingNumber(p) > 0;
  }

  /** Returns true if {@code p} lies within {@code tolerance} of the boundary of some loop. */
  public boolean boundaryContains(R2Vector p, double tolerance) {
    for (R2Loop loop : loops) {
      if (loop.boundaryContains(p, tolerance)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the complement of this polygon: every loop inverted, in the same order. Inverting twice
   * returns an equal polygon.
   */
  public R2Polygon inverse() {
    ImmutableList.Builder<R2Loop> inverted = ImmutableList.builder();
    for (R2Loop loop : loops) {
      inverted.add(loop.inverse());
    }
    return new R2Polygon(inverted.build());
  }

  /** Returns the number of loops whose hole flag disagrees with their winding. */
  public int numInconsistentLoops() {
    int count = 0;
    for (R2Loop loop : loops) {
      if (!loop.isHoleConsistentWithWinding()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns true if some loop of this polygon is invalid, in which case {@code error} is set with
   * the loop index prefixed to the text.
   */
  public boolean findValidationError(R2Error error) {
    Preconditions.checkNotNull(error);
    for (int i = 0; i < loops.size(); i++) {
      if (loops.get(i).findValidationError(error)) {
        error.init(error.code(), "Loop %d: %s", i, error.text());
        return true;
      }
    }
    return false;
  }

  /** Returns true if every loop is valid. */
  public boolean isValid() {
    return !findValidationError(new R2Error());
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof R2Polygon && loops.equals(((R2Polygon) other).loops);
  }

  @Override
  public int hashCode() {
    return loops.hashCode();
  }

  @Override
  public String toString() {
    return "R2Polygon" + loops;
  }
}
