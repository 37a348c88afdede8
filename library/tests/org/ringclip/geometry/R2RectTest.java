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
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies R1Interval and R2Rect. */
@RunWith(JUnit4.class)
public class R2RectTest extends GeometryTestCase {
  @Test
  public void testIntervalBasics() {
    R1Interval unit = new R1Interval(0, 1);
    R1Interval empty = R1Interval.empty();
    assertTrue(empty.isEmpty());
    assertFalse(unit.isEmpty());
    assertExactly(0.5, unit.getCenter());
    assertExactly(1, unit.getLength());
    assertTrue(unit.contains(0));
    assertFalse(unit.interiorContains(0));
    assertTrue(unit.interiorContains(0.5));
    assertTrue(unit.intersects(new R1Interval(1, 2)));
    assertFalse(unit.intersects(new R1Interval(1.5, 2)));
    assertFalse(unit.intersects(empty));
    assertEquals(unit, empty.union(unit));
    assertEquals(new R1Interval(-1, 1), unit.addPoint(-1));
    assertEquals(new R1Interval(-0.5, 1.5), unit.expanded(0.5));
    assertTrue(empty.expanded(1).isEmpty());
    assertEquals(new R1Interval(2, 5), R1Interval.fromPointPair(5, 2));
  }

  @Test
  public void testEmptyRect() {
    R2Rect empty = R2Rect.empty();
    assertTrue(empty.isEmpty());
    assertFalse(empty.contains(new R2Vector(0, 0)));
    assertTrue(empty.expanded(1).isEmpty());
    R2Rect unit = new R2Rect(new R2Vector(0, 0), new R2Vector(1, 1));
    assertEquals(unit, empty.union(unit));
    assertEquals(unit, unit.union(empty));
  }

  @Test
  public void testFromPoints() {
    R2Rect r =
        R2Rect.fromPoints(
            ImmutableList.of(new R2Vector(1, 5), new R2Vector(-2, 3), new R2Vector(0, 7)));
    assertEquals(new R2Vector(-2, 3), r.lo());
    assertEquals(new R2Vector(1, 7), r.hi());
    assertEquals(new R2Vector(-0.5, 5), r.getCenter());
    assertEquals(new R2Vector(3, 4), r.getSize());
    assertEquals(
        new R2Rect(new R2Vector(0, 1), new R2Vector(3, 4)),
        R2Rect.fromPointPair(new R2Vector(3, 1), new R2Vector(0, 4)));
  }

  @Test
  public void testContainsAndIntersects() {
    R2Rect r = new R2Rect(new R2Vector(0, 0), new R2Vector(2, 1));
    assertTrue(r.contains(new R2Vector(2, 1)));
    assertFalse(r.contains(new R2Vector(2, 1.5)));
    assertTrue(r.intersects(R2Rect.fromPoint(new R2Vector(2, 0))));
    assertFalse(r.intersects(R2Rect.fromPoint(new R2Vector(2 + 1e-12, 0))));
    assertTrue(r.expanded(1e-9).intersects(R2Rect.fromPoint(new R2Vector(2 + 1e-12, 0))));
    assertEquals(
        new R2Rect(new R2Vector(0, 0), new R2Vector(3, 1)), r.addPoint(new R2Vector(3, 0)));
  }
}
