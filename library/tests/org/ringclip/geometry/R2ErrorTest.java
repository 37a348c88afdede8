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

import java.util.EnumSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies R2Error and R2Exception. */
@RunWith(JUnit4.class)
public class R2ErrorTest {
  @Test
  public void testBasic() {
    R2Error error = new R2Error();
    error.init(R2Error.Code.INVALID_VERTEX, "Vertex %d is not finite: %s", 23, "(NaN, 0.0)");
    // Prepend additional context to the message.
    error.init(error.code(), "Loop %d: %s", 5, error.text());
    assertEquals(R2Error.Code.INVALID_VERTEX, error.code());
    assertEquals("Loop 5: Vertex 23 is not finite: (NaN, 0.0)", error.text());
    assertFalse(error.ok());
    assertEquals("INVALID_VERTEX: Loop 5: Vertex 23 is not finite: (NaN, 0.0)", error.toString());
  }

  @Test
  public void testClear() {
    R2Error error = new R2Error();
    assertTrue(error.ok());
    assertEquals("OK", error.toString());
    error.init(R2Error.Code.INVALID_ARGUMENT, "Oops");
    error.clear();
    assertTrue(error.ok());
    assertEquals("", error.text());
  }

  @Test
  public void testCodes() {
    assertEquals(0, R2Error.Code.NO_ERROR.code());
    assertEquals(1003, R2Error.Code.INVALID_ARGUMENT.code());
    assertEquals(100, R2Error.Code.LOOP_NOT_ENOUGH_VERTICES.code());
    // Every code other than NO_ERROR is one that validation or a null input can report.
    assertEquals(
        EnumSet.of(
            R2Error.Code.NO_ERROR,
            R2Error.Code.INVALID_ARGUMENT,
            R2Error.Code.INVALID_VERTEX,
            R2Error.Code.LOOP_NOT_ENOUGH_VERTICES),
        EnumSet.allOf(R2Error.Code.class));
  }

  @Test
  public void testException() {
    R2Error error = new R2Error();
    error.init(R2Error.Code.INVALID_ARGUMENT, "The %s polygon is null", "first");
    R2Exception e = new R2Exception(error);
    assertEquals(R2Error.Code.INVALID_ARGUMENT, e.code());
    assertTrue(e.getMessage().contains("The first polygon is null"));
  }
}
