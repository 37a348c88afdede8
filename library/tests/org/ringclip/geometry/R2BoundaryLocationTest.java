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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies R2BoundaryLocation. */
@RunWith(JUnit4.class)
public class R2BoundaryLocationTest extends GeometryTestCase {
  @Test
  public void testInvalidArguments() {
    assertInvalid(-1, 0, 0);
    assertInvalid(0, -1, 0);
    assertInvalid(0, 0, -0.1);
    assertInvalid(0, 0, 1.5);
    assertInvalid(0, 0, Double.NaN);
  }

  private static void assertInvalid(int ring, int segment, double ratio) {
    try {
      new R2BoundaryLocation(ring, segment, ratio);
      fail("Expected IllegalArgumentException for " + ring + ":" + segment + ":" + ratio);
    } catch (IllegalArgumentException expected) {
      // expected
    }
  }

  @Test
  public void testOrdering() {
    List<R2BoundaryLocation> locations = new ArrayList<>();
    locations.add(new R2BoundaryLocation(1, 0, 0));
    locations.add(new R2BoundaryLocation(0, 2, 0.5));
    locations.add(new R2BoundaryLocation(0, 2, 0.25));
    locations.add(new R2BoundaryLocation(0, 0, 1));
    Collections.sort(locations);
    assertEquals("[0:0:1.0, 0:2:0.25, 0:2:0.5, 1:0:0.0]", locations.toString());
  }

  @Test
  public void testCanonicalize() {
    R2BoundaryLocation mid = new R2BoundaryLocation(2, 1, 0.5);
    assertSame(mid, mid.canonicalize(4));
    assertEquals(new R2BoundaryLocation(2, 2, 0), new R2BoundaryLocation(2, 1, 1).canonicalize(4));
    // The end of the last edge is the start of the loop.
    assertEquals(new R2BoundaryLocation(2, 0, 0), new R2BoundaryLocation(2, 3, 1).canonicalize(4));
    assertTrue(new R2BoundaryLocation(0, 3, 1).compareTo(new R2BoundaryLocation(0, 3, 0.5)) > 0);
  }

  @Test
  public void testEquality() {
    assertEquals(new R2BoundaryLocation(0, 1, 0.5), new R2BoundaryLocation(0, 1, 0.5));
    assertEquals(
        new R2BoundaryLocation(0, 1, 0.5).hashCode(),
        new R2BoundaryLocation(0, 1, 0.5).hashCode());
    assertNotEquals(new R2BoundaryLocation(0, 1, 0.5), new R2BoundaryLocation(1, 1, 0.5));
    assertEquals(0, new R2BoundaryLocation(3, 1, 0.5).compareTo(new R2BoundaryLocation(3, 1, 0.5)));
  }
}
