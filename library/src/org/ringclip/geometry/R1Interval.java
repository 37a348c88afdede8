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
import jsinterop.annotations.JsType;

/**
 * An R1Interval represents a closed, bounded interval on the real line. It is capable of
 * representing the empty interval (containing no points) and zero-length intervals (containing a
 * single point). Instances are immutable; methods that grow or shrink an interval return a new one.
 */
@JsType
public final class R1Interval implements Serializable {
  private static final R1Interval EMPTY = new R1Interval(1, 0);

  private final double lo;
  private final double hi;

  /** Interval constructor. If lo > hi, the interval is empty. */
  public R1Interval(double lo, double hi) {
    this.lo = lo;
    this.hi = hi;
  }

  /** Returns an empty interval. (Any interval where lo > hi is considered empty.) */
  public static R1Interval empty() {
    return EMPTY;
  }

  /** Convenience method to construct an interval containing a single point. */
  public static R1Interval fromPoint(double p) {
    return new R1Interval(p, p);
  }

  /** Returns the minimal interval containing the two given points. */
  public static R1Interval fromPointPair(double p1, double p2) {
    return p1 <= p2 ? new R1Interval(p1, p2) : new R1Interval(p2, p1);
  }

  public double lo() {
    return lo;
  }

  public double hi() {
    return hi;
  }

  /** Returns true if the interval is empty, i.e. it contains no points. */
  public boolean isEmpty() {
    return lo > hi;
  }

  /** Returns the center of the interval. For empty intervals, the result is arbitrary. */
  public double getCenter() {
    return 0.5 * (lo + hi);
  }

  /** Returns the length of the interval. The length of an empty interval is negative. */
  public double getLength() {
    return hi - lo;
  }

  public boolean contains(double p) {
    return p >= lo && p <= hi;
  }

  public boolean interiorContains(double p) {
    return p > lo && p < hi;
  }

  /**
   * Returns true if this interval intersects {@code y}, i.e. if they have any points in
   * common.
   */
  public boolean intersects(R1Interval y) {
    if (lo <= y.lo) {
      return y.lo <= hi && y.lo <= y.hi;
    } else {
      return lo <= y.hi && lo <= hi;
    }
  }

  /** Returns the smallest interval that contains this interval and the given point. */
  public R1Interval addPoint(double p) {
    if (isEmpty()) {
      return fromPoint(p);
    }
    if (p < lo) {
      return new R1Interval(p, hi);
    }
    if (p > hi) {
      return new R1Interval(lo, p);
    }
    return this;
  }

  /** Returns the smallest interval that contains this interval and {@code y}. */
  public R1Interval union(R1Interval y) {
    if (isEmpty()) {
      return y;
    }
    if (y.isEmpty()) {
      return this;
    }
    return new R1Interval(Math.min(lo, y.lo), Math.max(hi, y.hi));
  }

  /**
   * Returns an interval that contains all points within a distance "radius" of a point in this
   * interval. Note that the expansion of an empty interval is always empty.
   */
  public R1Interval expanded(double radius) {
    if (isEmpty()) {
      return this;
    }
    return new R1Interval(lo - radius, hi + radius);
  }

  @Override
  public boolean equals(Object that) {
    if (that instanceof R1Interval) {
      R1Interval y = (R1Interval) that;
      // Return true if two intervals contain the same set of points.
      return (lo == y.lo && hi == y.hi) || (isEmpty() && y.isEmpty());
    }
    return false;
  }

  @Override
  public int hashCode() {
    if (isEmpty()) {
      return 17;
    }
    long value = 17;
    value = 37 * value + Double.doubleToLongBits(lo);
    value = 37 * value + Double.doubleToLongBits(hi);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "[" + lo + ", " + hi + "]";
  }
}
