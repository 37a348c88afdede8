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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.ringclip.geometry.R2EdgeIntersection.Contact;
import org.ringclip.geometry.R2EdgeIntersection.Kind;

/** Verifies R2Edge and edge-edge intersection. */
@RunWith(JUnit4.class)
public class R2EdgeTest extends GeometryTestCase {
  private static final double TOL = 1e-9;

  private static R2Edge edge(double x0, double y0, double x1, double y1) {
    return new R2Edge(new R2Vector(x0, y0), new R2Vector(x1, y1));
  }

  @Test
  public void testBasics() {
    R2Edge e = edge(0, 0, 4, 0);
    assertExactly(4, e.getLength());
    assertEquals(new R2Vector(2, 0), e.getMidpoint());
    assertEquals(edge(4, 0, 0, 0), e.reversed());
    assertEquals(new R2Vector(4, 0), e.direction());
    assertExactly(0.25, e.project(new R2Vector(1, 3)));
    assertExactly(1.5, e.project(new R2Vector(6, -1)));
    assertEquals(new R2Vector(4, 0), e.getClosestPoint(new R2Vector(6, -1)));
    assertExactly(3, e.getDistance(new R2Vector(1, 3)));
    assertExactly(5, e.getDistance(new R2Vector(7, 4)));
  }

  @Test
  public void testDegenerateEdge() {
    R2Edge e = edge(1, 1, 1, 1);
    assertExactly(0, e.project(new R2Vector(5, 5)));
    assertExactly(5, e.getDistance(new R2Vector(4, 5)));
  }

  @Test
  public void testProperCrossing() {
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 2, 2), edge(0, 2, 2, 0), TOL);
    assertEquals(Kind.POINT, x.kind());
    Contact c = x.contacts().get(0);
    assertTrue(c.point().approxEquals(new R2Vector(1, 1), 1e-15));
    assertDoubleNear(0.5, c.ratioA(), 1e-15);
    assertDoubleNear(0.5, c.ratioB(), 1e-15);
  }

  @Test
  public void testCrossingRatiosAreAlongEachEdge() {
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 4, 0), edge(1, -1, 1, 3), TOL);
    Contact c = x.contacts().get(0);
    assertDoubleNear(0.25, c.ratioA(), 1e-15);
    assertDoubleNear(0.25, c.ratioB(), 1e-15);
  }

  @Test
  public void testDisjoint() {
    assertFalse(R2Edge.intersect(edge(0, 0, 1, 0), edge(0, 1, 1, 1), TOL).intersects());
    assertFalse(R2Edge.intersect(edge(0, 0, 1, 1), edge(2, 0, 1.6, 1), TOL).intersects());
    assertSame(
        R2EdgeIntersection.none(), R2Edge.intersect(edge(0, 0, 1, 0), edge(2, 0, 3, 0), TOL));
  }

  @Test
  public void testSharedEndpoint() {
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 1, 0), edge(1, 0, 1, 1), TOL);
    assertEquals(Kind.POINT, x.kind());
    Contact c = x.contacts().get(0);
    assertEquals(new R2Vector(1, 0), c.point());
    assertExactly(1, c.ratioA());
    assertExactly(0, c.ratioB());
  }

  @Test
  public void testTJunction() {
    // The endpoint of b lies in the interior of a.
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 2, 0), edge(1, 0, 1, 1), TOL);
    assertEquals(Kind.POINT, x.kind());
    Contact c = x.contacts().get(0);
    assertEquals(new R2Vector(1, 0), c.point());
    assertExactly(0.5, c.ratioA());
    assertExactly(0, c.ratioB());
  }

  @Test
  public void testNearbyEndpointSnapsToFirstEdge() {
    R2Vector near = new R2Vector(1 + 1e-12, 1e-12);
    R2EdgeIntersection x =
        R2Edge.intersect(edge(0, 0, 1, 0), new R2Edge(near, new R2Vector(1, 1)), TOL);
    assertEquals(Kind.POINT, x.kind());
    Contact c = x.contacts().get(0);
    assertEquals(new R2Vector(1, 0), c.point());
    assertExactly(1, c.ratioA());
    assertExactly(0, c.ratioB());
  }

  @Test
  public void testNearbyEndpointOutsideTolerance() {
    R2Vector near = new R2Vector(1 + 1e-6, 0.5);
    R2EdgeIntersection x =
        R2Edge.intersect(edge(0, 0, 1, 0), new R2Edge(near, new R2Vector(1, 1)), TOL);
    assertFalse(x.intersects());
  }

  @Test
  public void testCollinearOverlap() {
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 4, 0), edge(3, 0, 1, 0), TOL);
    assertEquals(Kind.OVERLAP, x.kind());
    Contact start = x.contacts().get(0);
    Contact end = x.contacts().get(1);
    assertEquals(new R2Vector(1, 0), start.point());
    assertExactly(0.25, start.ratioA());
    assertExactly(1, start.ratioB());
    assertEquals(new R2Vector(3, 0), end.point());
    assertExactly(0.75, end.ratioA());
    assertExactly(0, end.ratioB());
  }

  @Test
  public void testIdenticalEdgesOverlapCompletely() {
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 1, 1), edge(0, 0, 1, 1), TOL);
    assertEquals(Kind.OVERLAP, x.kind());
    assertExactly(0, x.contacts().get(0).ratioA());
    assertExactly(1, x.contacts().get(1).ratioA());
  }

  @Test
  public void testCollinearTouchingAtOnePoint() {
    R2EdgeIntersection x = R2Edge.intersect(edge(0, 0, 1, 0), edge(1, 0, 2, 0), TOL);
    assertEquals(Kind.POINT, x.kind());
    assertEquals(new R2Vector(1, 0), x.contacts().get(0).point());
  }

  @Test
  public void testUnresolvedCrossing() {
    // The orientation tests overflow, so no crossing parameter can be computed.
    R2EdgeIntersection x =
        R2Edge.intersect(edge(-1e200, 0, 1e200, 0), edge(0, -1e200, 0, 1e200), TOL);
    assertFalse(x.intersects());
    assertTrue(x.isUnresolved());
    assertFalse(R2EdgeIntersection.none().isUnresolved());
  }

  @Test
  public void testOverlapRequiresOrderedContacts() {
    Contact a = new Contact(new R2Vector(0, 0), 0.5, 0);
    Contact b = new Contact(new R2Vector(1, 0), 0.25, 1);
    try {
      R2EdgeIntersection.overlap(a, b);
      throw new AssertionError("Expected IllegalArgumentException");
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }
}
