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

import static java.lang.Math.max;
import static java.lang.Math.min;

import java.util.ArrayList;
import java.util.List;
import jsinterop.annotations.JsType;
import org.ringclip.geometry.R2EdgeIntersection.Contact;

/** An R2Edge is an immutable line segment in two-dimensional space, from v0 to v1. */
@JsType
public final class R2Edge {
  private final R2Vector v0;
  private final R2Vector v1;

  /** Creates a new edge with the given endpoints. */
  public R2Edge(R2Vector v0, R2Vector v1) {
    this.v0 = v0;
    this.v1 = v1;
  }

  /** Returns the start vertex of this edge. */
  public R2Vector v0() {
    return v0;
  }

  /** Returns the end vertex of this edge. */
  public R2Vector v1() {
    return v1;
  }

  /** Returns this edge with its endpoints swapped. */
  public R2Edge reversed() {
    return new R2Edge(v1, v0);
  }

  /** Returns the vector from v0 to v1. */
  public R2Vector direction() {
    return R2Vector.sub(v1, v0);
  }

  public double getLength() {
    return v0.getDistance(v1);
  }

  /** Returns the bounding rectangle of this edge. */
  public R2Rect getBound() {
    return R2Rect.fromPointPair(v0, v1);
  }

  /** Returns the point at fraction {@code t} along this edge. */
  public R2Vector interpolate(double t) {
    return R2Vector.interpolate(t, v0, v1);
  }

  /** Returns the midpoint of this edge. */
  public R2Vector getMidpoint() {
    return interpolate(0.5);
  }

  /**
   * Returns the parameter of the orthogonal projection of {@code p} onto the line through this
   * edge, where 0 is v0 and 1 is v1. The result is not clamped. Returns 0 for degenerate edges.
   */
  public double project(R2Vector p) {
    R2Vector d = direction();
    double d2 = d.norm2();
    if (d2 == 0) {
      return 0;
    }
    return R2Vector.sub(p, v0).dotProd(d) / d2;
  }

  /** Returns the point of this edge closest to {@code p}. */
  public R2Vector getClosestPoint(R2Vector p) {
    return interpolate(clamp(project(p)));
  }

  /** Returns the distance from {@code p} to the closest point of this edge. */
  public double getDistance(R2Vector p) {
    return p.getDistance(getClosestPoint(p));
  }

  /**
   * Returns the parameter of {@code p} along this edge, snapped to exactly 0 or 1 if {@code p} is
   * within {@code tolerance} of v0 or v1 respectively, and clamped to [0, 1] otherwise.
   */
  double snappedRatio(R2Vector p, double tolerance) {
    if (p.approxEquals(v0, tolerance)) {
      return 0;
    }
    if (p.approxEquals(v1, tolerance)) {
      return 1;
    }
    return clamp(project(p));
  }

  /**
   * Computes the intersection of edges {@code a} and {@code b}. Points closer than {@code
   * tolerance} are treated as identical, and contacts within the tolerance of an endpoint are
   * snapped to that endpoint: the returned ratio is exactly 0 or 1 and the returned point is the
   * endpoint itself, preferring the vertices of {@code a} over those of {@code b}.
   *
   * <p>Endpoint contacts are found first (each endpoint lying on the other edge). Two distinct
   * endpoint contacts can only occur when the edges are collinear, in which case the result is an
   * {@link R2EdgeIntersection.Kind#OVERLAP} between the extreme contacts. Otherwise a proper
   * crossing is detected from the orientation signs of the endpoints.
   */
  public static R2EdgeIntersection intersect(R2Edge a, R2Edge b, double tolerance) {
    List<Contact> contacts = new ArrayList<>(4);
    for (int i = 0; i < 2; i++) {
      R2Vector p = i == 0 ? a.v0 : a.v1;
      if (b.getDistance(p) <= tolerance) {
        addContact(contacts, new Contact(p, i, b.snappedRatio(p, tolerance)), tolerance);
      }
    }
    for (int i = 0; i < 2; i++) {
      R2Vector q = i == 0 ? b.v0 : b.v1;
      if (a.getDistance(q) <= tolerance) {
        double ratioA = a.snappedRatio(q, tolerance);
        R2Vector point = ratioA == 0 ? a.v0 : ratioA == 1 ? a.v1 : q;
        addContact(contacts, new Contact(point, ratioA, i), tolerance);
      }
    }

    if (contacts.size() == 1) {
      return R2EdgeIntersection.point(contacts.get(0));
    }
    if (contacts.size() > 1) {
      Contact first = contacts.get(0);
      Contact last = contacts.get(0);
      for (Contact c : contacts) {
        if (c.ratioA() < first.ratioA()) {
          first = c;
        }
        if (c.ratioA() > last.ratioA()) {
          last = c;
        }
      }
      if (first.point().approxEquals(last.point(), tolerance)) {
        return R2EdgeIntersection.point(first);
      }
      return R2EdgeIntersection.overlap(first, last);
    }

    // No endpoint touches the other edge, so the edges either cross properly or not at all.
    double d1 = R2Vector.orientation(a.v0, a.v1, b.v0);
    double d2 = R2Vector.orientation(a.v0, a.v1, b.v1);
    double d3 = R2Vector.orientation(b.v0, b.v1, a.v0);
    double d4 = R2Vector.orientation(b.v0, b.v1, a.v1);
    if (!oppositeSigns(d1, d2) || !oppositeSigns(d3, d4)) {
      return R2EdgeIntersection.none();
    }
    double t = d3 / (d3 - d4);
    double u = d1 / (d1 - d2);
    if (!Double.isFinite(t) || !Double.isFinite(u)) {
      return R2EdgeIntersection.unresolved();
    }
    return R2EdgeIntersection.point(new Contact(a.interpolate(t), clamp(t), clamp(u)));
  }

  private static void addContact(List<Contact> contacts, Contact contact, double tolerance) {
    for (Contact c : contacts) {
      if (c.point().approxEquals(contact.point(), tolerance)) {
        return;
      }
    }
    contacts.add(contact);
  }

  private static boolean oppositeSigns(double x, double y) {
    return (x > 0 && y < 0) || (x < 0 && y > 0);
  }

  private static double clamp(double t) {
    return max(0, min(1, t));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof R2Edge)) {
      return false;
    }
    R2Edge that = (R2Edge) o;
    return v0.equals(that.v0) && v1.equals(that.v1);
  }

  @Override
  public int hashCode() {
    return 31 * v0.hashCode() + v1.hashCode();
  }

  @Override
  public String toString() {
    return Platform.formatString("R2Edge(%s, %s)", v0, v1);
  }
}
