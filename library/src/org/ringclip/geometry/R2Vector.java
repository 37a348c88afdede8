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

import static java.lang.Math.abs;
import static java.lang.Math.sqrt;

import java.io.Serializable;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;

/**
 * R2Vector represents a point or vector in the two-dimensional plane. It defines the basic
 * geometrical operations for 2D vectors, e.g. cross product, addition, norm, comparison, etc.
 *
 * <p>Instances are immutable. Equality is exact: two vectors are equal only if their coordinates
 * are identical doubles, which is how polygon vertices are identified. Tolerance-based comparisons
 * are made explicitly with {@link #approxEquals(R2Vector, double)}.
 */
@JsType
public final class R2Vector implements Serializable {
  private final double x;
  private final double y;

  /** Constructs a vector from its coordinates. */
  public R2Vector(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /** Returns the x coordinate of this R2 vector. */
  public double x() {
    return x;
  }

  /** Returns the y coordinate of this R2 vector. */
  public double y() {
    return y;
  }

  /** Returns the vector result of {@code p1 + p2}. */
  @JsIgnore
  public static R2Vector add(final R2Vector p1, final R2Vector p2) {
    return new R2Vector(p1.x + p2.x, p1.y + p2.y);
  }

  /** Returns add(this, p) */
  public R2Vector add(R2Vector p) {
    return add(this, p);
  }

  /** Returns the vector result of {@code p1 - p2}. */
  @JsIgnore
  public static R2Vector sub(final R2Vector p1, final R2Vector p2) {
    return new R2Vector(p1.x - p2.x, p1.y - p2.y);
  }

  /** Returns sub(this, p) */
  public R2Vector sub(R2Vector p) {
    return sub(this, p);
  }

  /** Returns the vector {@code p} scaled by {@code m}. */
  @JsIgnore
  public static R2Vector mul(final R2Vector p, double m) {
    return new R2Vector(m * p.x, m * p.y);
  }

  /** Returns mul(this, m) */
  public R2Vector mul(double m) {
    return mul(this, m);
  }

  /** Returns the vector magnitude. */
  public double norm() {
    return sqrt(norm2());
  }

  /** Returns the square of the vector magnitude. */
  public double norm2() {
    return (x * x) + (y * y);
  }

  /**
   * Returns a new R2 vector orthogonal to the current one with the same norm and counterclockwise
   * to it.
   */
  public R2Vector ortho() {
    return new R2Vector(-y, x);
  }

  /** Returns the dot product of the given vectors. */
  @JsIgnore
  public static double dotProd(final R2Vector p1, final R2Vector p2) {
    return (p1.x * p2.x) + (p1.y * p2.y);
  }

  /** Returns the dot product of this vector with that vector. */
  public double dotProd(R2Vector that) {
    return dotProd(this, that);
  }

  /** Returns the cross product of this vector with that vector. */
  public double crossProd(final R2Vector that) {
    return this.x * that.y - this.y * that.x;
  }

  /**
   * Returns twice the signed area of the triangle (a, b, c): positive if the three points turn
   * counterclockwise, negative if clockwise, zero if collinear.
   */
  public static double orientation(R2Vector a, R2Vector b, R2Vector c) {
    return (b.x - a.x) * (c.y - a.y) - (b.y - a.y) * (c.x - a.x);
  }

  /** Returns the point at fraction {@code t} of the way from {@code a} to {@code b}. */
  public static R2Vector interpolate(double t, R2Vector a, R2Vector b) {
    if (t == 0) {
      return a;
    }
    if (t == 1) {
      return b;
    }
    return new R2Vector(a.x + t * (b.x - a.x), a.y + t * (b.y - a.y));
  }

  /** Returns the Euclidean distance between this point and {@code p}. */
  public double getDistance(R2Vector p) {
    return sqrt(getDistance2(p));
  }

  /** Returns the squared Euclidean distance between this point and {@code p}. */
  public double getDistance2(R2Vector p) {
    double dx = x - p.x;
    double dy = y - p.y;
    return dx * dx + dy * dy;
  }

  /** Returns true if both coordinates are finite, i.e. neither infinite nor NaN. */
  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y);
  }

  /** Returns true if {@code p} is within distance {@code maxError} of this point. */
  public boolean approxEquals(R2Vector p, double maxError) {
    return getDistance2(p) <= maxError * maxError;
  }

  /**
   * Returns true if this vector is less than that vector, with the x-axis as the primary sort key
   * and the y-axis as the secondary sort key.
   */
  public boolean lessThan(R2Vector that) {
    if (x < that.x) {
      return true;
    }
    if (that.x < x) {
      return false;
    }
    return y < that.y;
  }

  /** Returns true if that object is an R2Vector with exactly the same x and y coordinates. */
  @Override
  public boolean equals(Object that) {
    if (!(that instanceof R2Vector)) {
      return false;
    }
    R2Vector thatPoint = (R2Vector) that;
    return this.x == thatPoint.x && this.y == thatPoint.y;
  }

  /**
   * Calculates hashcode based on stored coordinates. Since we want +0.0 and -0.0 to be treated the
   * same, we ignore the sign of the coordinates.
   */
  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Double.doubleToLongBits(abs(x));
    value += 37 * value + Double.doubleToLongBits(abs(y));
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
