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
import com.google.common.collect.Lists;
import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An R2Loop is a closed ring of planar vertices, where the first vertex is implicitly connected to
 * the last. A counter-clockwise loop encloses its interior (a fill), a clockwise loop excludes it
 * (a hole).
 *
 * <p>Each loop also carries a hole flag. The flag is bookkeeping supplied by whoever built the
 * loop; the vertex order is what defines the geometry. {@link #isHoleConsistentWithWinding()}
 * reports whether the two agree.
 *
 * <p>Loops are immutable. The constructor does not validate its input: call {@link
 * #findValidationError(R2Error)} to check that every vertex is finite and that there are at least
 * three distinct vertices.
 */
@JsType
public final class R2Loop implements Serializable {
  private final ImmutableList<R2Vector> vertices;
  private final boolean hole;

  /** Constructs a loop with the given vertices and hole flag. */
  public R2Loop(List<R2Vector> vertices, boolean hole) {
    this.vertices = ImmutableList.copyOf(vertices);
    this.hole = hole;
  }

  /** Constructs a loop with the given vertices, marked as a hole if they are in clockwise order. */
  @JsIgnore
  public R2Loop(List<R2Vector> vertices) {
    this.vertices = ImmutableList.copyOf(vertices);
    this.hole = signedArea(this.vertices) < 0;
  }

  public int numVertices() {
    return vertices.size();
  }

  /**
   * Returns the vertex at index {@code i}, taken modulo the number of vertices so that callers can
   * walk past the end of the loop (or before its start) without wrapping indices themselves.
   */
  public R2Vector vertex(int i) {
    Preconditions.checkState(!vertices.isEmpty(), "Loop has no vertices");
    return vertices.get(Math.floorMod(i, vertices.size()));
  }

  public ImmutableList<R2Vector> vertices() {
    return vertices;
  }

  /** Returns the edge from vertex {@code i} to vertex {@code i + 1}. */
  public R2Edge edge(int i) {
    return new R2Edge(vertex(i), vertex(i + 1));
  }

  /** Returns the number of edges, which equals the number of vertices. */
  public int numEdges() {
    return vertices.size();
  }

  public boolean isHole() {
    return hole;
  }

  /** Returns a copy of this loop with the given hole flag and the same vertices. */
  public R2Loop withHole(boolean hole) {
    return hole == this.hole ? this : new R2Loop(vertices, hole);
  }

  /**
   * Returns the inverse of this loop: the vertices in reverse order with the hole flag flipped.
   * Inverting twice returns an equal loop.
   */
  public R2Loop inverse() {
    return new R2Loop(Lists.reverse(vertices), !hole);
  }

  /**
   * Returns the signed area given by the shoelace formula: positive for counter-clockwise loops and
   * negative for clockwise ones.
   */
  public double getSignedArea() {
    return signedArea(vertices);
  }

  /** Returns the absolute area enclosed by this loop. */
  public double getArea() {
    return Math.abs(getSignedArea());
  }

  public boolean isCounterClockwise() {
    return getSignedArea() > 0;
  }

  /** Returns true if holes wind clockwise and fills counter-clockwise. */
  public boolean isHoleConsistentWithWinding() {
    double area = getSignedArea();
    return hole ? area < 0 : area > 0;
  }

  /** Returns the bounding rectangle of the vertices. */
  public R2Rect getBound() {
    return R2Rect.fromPoints(vertices);
  }

  /**
   * Returns the area-weighted centroid of the region enclosed by this loop. Loops with zero area
   * return the mean of their vertices.
   */
  public R2Vector getCentroid() {
    int n = vertices.size();
    Preconditions.checkState(n > 0, "Loop has no vertices");
    double area2 = 0;
    double cx = 0;
    double cy = 0;
    for (int i = 0; i < n; i++) {
      R2Vector a = vertices.get(i);
      R2Vector b = vertex(i + 1);
      double cross = a.crossProd(b);
      area2 += cross;
      cx += (a.x() + b.x()) * cross;
      cy += (a.y() + b.y()) * cross;
    }
    if (area2 == 0) {
      double sx = 0;
      double sy = 0;
      for (R2Vector v : vertices) {
        sx += v.x();
        sy += v.y();
      }
      return new R2Vector(sx / n, sy / n);
    }
    return new R2Vector(cx / (3 * area2), cy / (3 * area2));
  }

  /**
   * Returns the winding number of this loop around {@code p}: +1 if a counter-clockwise loop
   * encloses p, -1 if a clockwise loop does, and 0 if p is outside. Points on the boundary give an
   * unspecified result.
   */
  public int windingNumber(R2Vector p) {
    int wn = 0;
    int n = vertices.size();
    for (int i = 0; i < n; i++) {
      R2Vector a = vertices.get(i);
      R2Vector b = vertex(i + 1);
      if (a.y() <= p.y()) {
        if (b.y() > p.y() && R2Vector.orientation(a, b, p) > 0) {
          wn++;
        }
      } else if (b.y() <= p.y() && R2Vector.orientation(a, b, p) < 0) {
        wn--;
      }
    }
    return wn;
  }

  /** Returns true if {@code p} is enclosed by this loop, whatever its orientation. */
  public boolean contains(R2Vector p) {
    return windingNumber(p) != 0;
  }

  /** Returns true if {@code p} is within {@code tolerance} of some edge of this loop. */
  public boolean boundaryContains(R2Vector p, double tolerance) {
    for (int i = 0; i < vertices.size(); i++) {
      if (edge(i).getDistance(p) <= tolerance) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if this loop is invalid, in which case {@code error} describes the problem. A loop
   * is valid if every coordinate is finite and it has at least three distinct vertices.
   */
  public boolean findValidationError(R2Error error) {
    for (int i = 0; i < vertices.size(); i++) {
      if (!vertices.get(i).isFinite()) {
        error.init(R2Error.Code.INVALID_VERTEX, "Vertex %d is not finite: %s", i, vertices.get(i));
        return true;
      }
    }
    Set<R2Vector> distinct = new HashSet<>(vertices);
    if (distinct.size() < 3) {
      error.init(
          R2Error.Code.LOOP_NOT_ENOUGH_VERTICES,
          "Loop has %d distinct vertices, at least 3 are required",
          distinct.size());
      return true;
    }
    return false;
  }

  /** Returns true if this loop is valid. */
  public boolean isValid() {
    return !findValidationError(new R2Error());
  }

  private static double signedArea(List<R2Vector> vertices) {
    int n = vertices.size();
    double sum = 0;
    for (int i = 0; i < n; i++) {
      R2Vector a = vertices.get(i);
      R2Vector b = vertices.get(i + 1 == n ? 0 : i + 1);
      sum += a.crossProd(b);
    }
    return 0.5 * sum;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof R2Loop)) {
      return false;
    }
    R2Loop that = (R2Loop) other;
    return hole == that.hole && vertices.equals(that.vertices);
  }

  @Override
  public int hashCode() {
    return 31 * vertices.hashCode() + Boolean.hashCode(hole);
  }

  @Override
  public String toString() {
    return (hole ? "R2Loop(hole) " : "R2Loop ") + vertices;
  }
}
