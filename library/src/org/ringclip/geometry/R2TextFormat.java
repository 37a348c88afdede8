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
import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * R2TextFormat contains a collection of functions for converting planar geometry to and from a
 * human-readable format. It is mainly intended for testing and debugging.
 *
 * <p>Points are written as "x:y", lists of points as comma-separated points, and polygons as
 * loops separated by semicolons:
 *
 * <pre>
 *     "0:0, 1:0, 1:1, 0:1"                        // one loop
 *     "0:0, 4:0, 4:4, 0:4; 1:1, 1:2, 2:2, 2:1"   // a square with a square hole
 *     ""                                          // the empty polygon
 *     "empty"                                     // the empty polygon
 * </pre>
 *
 * <p>Unless a hole flag is given explicitly, a loop is marked as a hole if its vertices are in
 * clockwise order.
 */
public class R2TextFormat {
  private static final Splitter POINT_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter LOOP_SPLITTER = Splitter.on(';').trimResults().omitEmptyStrings();
  private static final Splitter COORD_SPLITTER = Splitter.on(':').trimResults();

  private R2TextFormat() {}

  /**
   * Returns an R2Vector parsed from "x:y".
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static R2Vector makePointOrDie(String str) throws IllegalArgumentException {
    R2Vector point = makePoint(str);
    Preconditions.checkArgument(point != null, ": str == \"%s\"", str);
    return point;
  }

  /** As {@link #makePointOrDie(String)}, but returns null on invalid input. */
  public static @Nullable R2Vector makePoint(String str) {
    List<R2Vector> points = parsePoints(str);
    if (points == null || points.size() != 1) {
      return null;
    }
    return points.get(0);
  }

  /**
   * Parses a string of zero or more comma-separated "x:y" points.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static List<R2Vector> parsePointsOrDie(String str) throws IllegalArgumentException {
    List<R2Vector> points = parsePoints(str);
    Preconditions.checkArgument(points != null, ": str == \"%s\"", str);
    return points;
  }

  /** As {@link #parsePointsOrDie(String)}, but returns null on invalid input. */
  public static @Nullable List<R2Vector> parsePoints(String str) {
    List<R2Vector> points = new ArrayList<>();
    for (String pointStr : POINT_SPLITTER.split(str)) {
      List<String> coords = COORD_SPLITTER.splitToList(pointStr);
      if (coords.size() != 2) {
        return null;
      }
      Double x = Doubles.tryParse(coords.get(0));
      Double y = Doubles.tryParse(coords.get(1));
      if (x == null || y == null) {
        return null;
      }
      points.add(new R2Vector(x, y));
    }
    return points;
  }

  /**
   * Returns a loop with the given vertices, marked as a hole if they are in clockwise order.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static R2Loop makeLoopOrDie(String str) throws IllegalArgumentException {
    return new R2Loop(parsePointsOrDie(str));
  }

  /**
   * Returns a loop with the given vertices and hole flag, whatever the vertex order.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static R2Loop makeLoopOrDie(String str, boolean hole) throws IllegalArgumentException {
    return new R2Loop(parsePointsOrDie(str), hole);
  }

  /** As {@link #makeLoopOrDie(String)}, but returns null on invalid input. */
  public static @Nullable R2Loop makeLoop(String str) {
    List<R2Vector> points = parsePoints(str);
    return points == null ? null : new R2Loop(points);
  }

  /**
   * Returns a polygon made of the semicolon-separated loops in {@code str}.
   *
   * @throws IllegalArgumentException on unparsable input.
   */
  public static R2Polygon makePolygonOrDie(String str) throws IllegalArgumentException {
    R2Polygon polygon = makePolygon(str);
    Preconditions.checkArgument(polygon != null, ": str == \"%s\"", str);
    return polygon;
  }

  /** As {@link #makePolygonOrDie(String)}, but returns null on invalid input. */
  public static @Nullable R2Polygon makePolygon(String str) {
    if (str.trim().equals("empty")) {
      return R2Polygon.empty();
    }
    List<R2Loop> loops = new ArrayList<>();
    for (String loopStr : LOOP_SPLITTER.split(str)) {
      R2Loop loop = makeLoop(loopStr);
      if (loop == null) {
        return null;
      }
      loops.add(loop);
    }
    return new R2Polygon(loops);
  }

  /** Convert an R2Vector to the R2TextFormat string representation documented above. */
  public static String toString(R2Vector p) {
    return Platform.formatDouble(p.x()) + ":" + Platform.formatDouble(p.y());
  }

  /** Convert a list of points to a comma-separated string. */
  public static String toString(List<R2Vector> points) {
    StringBuilder out = new StringBuilder();
    appendVertices(points, out);
    return out.toString();
  }

  /** Convert an R2Loop to the R2TextFormat string representation documented above. */
  public static String toString(R2Loop loop) {
    return toString(loop.vertices());
  }

  /**
   * Convert an R2Polygon to the R2TextFormat string representation documented above. The empty
   * polygon is written as "empty".
   */
  public static String toString(R2Polygon polygon) {
    if (polygon.isEmpty()) {
      return "empty";
    }
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < polygon.numLoops(); i++) {
      if (i > 0) {
        out.append("; ");
      }
      appendVertices(polygon.loop(i).vertices(), out);
    }
    return out.toString();
  }

  private static void appendVertices(List<R2Vector> points, StringBuilder out) {
    for (int i = 0; i < points.size(); i++) {
      if (i > 0) {
        out.append(", ");
      }
      out.append(toString(points.get(i)));
    }
  }
}
