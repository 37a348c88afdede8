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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies R2Polygon. */
@RunWith(JUnit4.class)
public class R2PolygonTest extends GeometryTestCase {
  private final R2Polygon frame = polygon("0:0, 4:0, 4:4, 0:4; 1:1, 1:3, 3:3, 3:1");

  @Test
  public void testEmpty() {
    R2Polygon empty = R2Polygon.empty();
    assertTrue(empty.isEmpty());
    assertFalse(empty.isUnbounded());
    assertEquals(0, empty.numVertices());
    assertExactly(0, empty.getArea());
    assertTrue(empty.getBound().isEmpty());
    assertFalse(empty.contains(new R2Vector(0, 0)));
    assertEquals(empty, polygon("empty"));
    assertTrue(empty.inverse().isEmpty());
  }

  @Test
  public void testMeasures() {
    assertEquals(2, frame.numLoops());
    assertEquals(8, frame.numVertices());
    assertExactly(12, frame.getSignedArea());
    assertExactly(12, frame.getArea());
    assertFalse(frame.isUnbounded());
    assertEquals(new R2Rect(new R2Vector(0, 0), new R2Vector(4, 4)), frame.getBound());
    assertTrue(frame.loop(1).isHole());
  }

  @Test
  public void testContains() {
    assertTrue(frame.contains(new R2Vector(0.5, 0.5)));
    assertFalse(frame.contains(new R2Vector(2, 2)));
    assertFalse(frame.contains(new R2Vector(5, 5)));
    assertEquals(0, frame.windingNumber(new R2Vector(2, 2)));
    assertTrue(frame.boundaryContains(new R2Vector(1, 2), 1e-9));
    assertFalse(frame.boundaryContains(new R2Vector(0.5, 2), 1e-9));
  }

  @Test
  public void testInverseIsUnbounded() {
    R2Polygon inverse = frame.inverse();
    assertTrue(inverse.isUnbounded());
    assertExactly(-12, inverse.getSignedArea());
    assertExactly(12, inverse.getArea());
    assertFalse(inverse.contains(new R2Vector(0.5, 0.5)));
    assertTrue(inverse.contains(new R2Vector(2, 2)));
    assertTrue(inverse.contains(new R2Vector(100, -100)));
    assertEquals(1, inverse.windingNumber(new R2Vector(100, -100)));
    assertEquals(frame, inverse.inverse());
    assertEquals(0, inverse.numInconsistentLoops());
  }

  @Test
  public void testContainmentFollowsWindingNotHoleFlags() {
    // Both loops are flagged as fills, but the inner one still winds clockwise.
    R2Polygon mislabeled =
        R2Polygon.of(
            R2TextFormat.makeLoopOrDie("0:0, 4:0, 4:4, 0:4", false),
            R2TextFormat.makeLoopOrDie("1:1, 1:3, 3:3, 3:1", false));
    assertEquals(1, mislabeled.numInconsistentLoops());
    assertFalse(mislabeled.contains(new R2Vector(2, 2)));
    assertTrue(mislabeled.contains(new R2Vector(0.5, 2)));
  }

  @Test
  public void testOverlappingFills() {
    R2Polygon overlapping = polygon("0:0, 2:0, 2:2, 0:2; 1:1, 3:1, 3:3, 1:3");
    assertEquals(2, overlapping.windingNumber(new R2Vector(1.5, 1.5)));
    assertTrue(overlapping.contains(new R2Vector(1.5, 1.5)));
    assertTrue(overlapping.contains(new R2Vector(2.5, 2.5)));
  }

  @Test
  public void testValidation() {
    assertTrue(frame.isValid());
    R2Polygon bad = polygon("0:0, 1:0, 0:1; 5:5, 6:6");
    R2Error error = new R2Error();
    assertTrue(bad.findValidationError(error));
    assertEquals(R2Error.Code.LOOP_NOT_ENOUGH_VERTICES, error.code());
    assertEquals("Loop 1: Loop has 2 distinct vertices, at least 3 are required", error.text());
    assertFalse(bad.isValid());
  }

  @Test
  public void testEquality() {
    assertEquals(frame, polygon("0:0, 4:0, 4:4, 0:4; 1:1, 1:3, 3:3, 3:1"));
    assertEquals(
        frame.hashCode(), polygon("0:0, 4:0, 4:4, 0:4; 1:1, 1:3, 3:3, 3:1").hashCode());
    assertFalse(frame.equals(polygon("1:1, 1:3, 3:3, 3:1; 0:0, 4:0, 4:4, 0:4")));
  }
}
