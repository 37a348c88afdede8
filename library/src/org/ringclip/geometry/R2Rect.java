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

import java.io.Serializable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * An R2Rect represents a closed axis-aligned rectangle in the (x,y) plane, i.e. the minimum
 * bounding rectangle of a set of points. Instances are immutable; {@link #addPoint(R2Vector)} and
 * {@link #union(R2Rect)} return new rectangles.
 */
@JsType
public final class R2Rect implements Serializable {
  private static final R2Rect EMPTY = new R2Rect(R1Interval.empty(), R1Interval.empty());

  private final R1Interval x;
  private final R1Interval y;

  /** Constructs a rectangle from the given lower-left and upper-right points. */
  @JsIgnore
  public R2Rect(R2Vector lo, R2Vector hi) {
    this(new R1Interval(lo.x(), hi.x()), new R1Interval(lo.y(), hi.y()));
  }

  /**
   * Constructs a rectangle from the given intervals in x and y. The two intervals must either be
   * both empty or both non-empty.
   */
  public R2Rect(R1Interval x, R1Interval y) {
    this.x = x;
    this.y = y;
  }

  /**
   * Returns the canonical empty rectangle. Use isEmpty() to test for empty rectangles, since they
   * have more than one representation.
   */
  public static R2Rect empty() {
    return EMPTY;
  }

  /** Returns a rectangle containing a single point. */
  public static R2Rect fromPoint(R2Vector p) {
    return new R2Rect(p, p);
  }

  /**
   * Returns the minimal bounding rectangle containing the two given points. Note that it is
   * different than the R2Rect(lo, hi) constructor, where the first point is always used as the
   * lower-left corner of the resulting rectangle.
   */
  public static R2Rect fromPointPair(R2Vector p1, R2Vector p2) {
    return new R2Rect(
        R1Interval.fromPointPair(p1.x(), p2.x()), R1Interval.fromPointPair(p1.y(), p2.y()));
  }

  /** Returns the minimal bounding rectangle of the given points. */
  public static R2Rect fromPoints(Iterable<R2Vector> points) {
    R2Rect result = EMPTY;
    for (R2Vector p : points) {
      result = result.addPoint(p);
    }
    return result;
  }

  /** Returns the interval along the x-axis. */
  public R1Interval x() {
    return x;
  }

  /** Returns the interval along the y-axis. */
  public R1Interval y() {
    return y;
  }

  /** Returns the point in this rectangle with the minimum x and y values. */
  public R2Vector lo() {
    return new R2Vector(x.lo(), y.lo());
  }

  /** Returns the point in this rectangle with the maximum x and y values. */
  public R2Vector hi() {
    return new R2Vector(x.hi(), y.hi());
  }

  /** Return true if this rectangle is empty, i.e. it contains no points at all. */
  public boolean isEmpty() {
    return x.isEmpty();
  }

  /** Returns the center of the rectangle. For empty rectangles, the result is arbitrary. */
  public R2Vector getCenter() {
    return new R2Vector(x.getCenter(), y.getCenter());
  }

  /** Returns the width and height of this rectangle in (x,y)-space. */
  public R2Vector getSize() {
    return new R2Vector(x.getLength(), y.getLength());
  }

  /** Returns true if the rectangle contains the given point. */
  public boolean contains(R2Vector p) {
    return x.contains(p.x()) && y.contains(p.y());
  }

  /** Returns true if this rectangle and the given other rectangle have any points in common. */
  public boolean intersects(R2Rect other) {
    return x.intersects(other.x) && y.intersects(other.y);
  }

  /** Returns the smallest rectangle containing this rectangle and the given point. */
  public R2Rect addPoint(R2Vector p) {
    return new R2Rect(x.addPoint(p.x()), y.addPoint(p.y()));
  }

  /** Returns the smallest rectangle containing the union of this rectangle and the given one. */
  public R2Rect union(R2Rect other) {
    return new R2Rect(x.union(other.x), y.union(other.y));
  }

  /**
   * Returns a rectangle that has been expanded on each side by the given margin. Expanding an
   * empty rectangle leaves it empty.
   */
  public R2Rect expanded(double margin) {
    if (isEmpty()) {
      return this;
    }
    return new R2Rect(x.expanded(margin), y.expanded(margin));
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof R2Rect)) {
      return false;
    }
    R2Rect that = (R2Rect) other;
    return x.equals(that.x) && y.equals(that.y);
  }

  @Override
  public int hashCode() {
    return 37 * x.hashCode() + y.hashCode();
  }

  @Override
  public String toString() {
    return "[Lo" + lo() + ", Hi" + hi() + "]";
  }
}
