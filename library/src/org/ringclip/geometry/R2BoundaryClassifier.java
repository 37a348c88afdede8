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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import jsinterop.annotations.JsType;

/**
 * Splits the loops of two polygons into fragments at their crossing nodes, and classifies each
 * fragment by where it lies relative to the other polygon.
 *
 * <p>A fragment runs from one crossing node to the next along a loop, through the original
 * vertices between them. A loop with no crossings is a single closed fragment. A fragment that is
 * a single straight segment between two nodes, where the other polygon has a single straight
 * segment between the same nodes, is coincident with it; every other fragment is inside or outside
 * the other polygon, decided by a point in the middle of its longest segment.
 */
@JsType
public final class R2BoundaryClassifier {
  private static final Logger logger = Platform.getLoggerForClass(R2BoundaryClassifier.class);

  /** Where a fragment of one polygon lies relative to the other polygon. */
  @JsType
  public enum Classification {
    /** The fragment is in the interior of the other polygon. */
    INSIDE,
    /** The fragment is in the exterior of the other polygon. */
    OUTSIDE,
    /** The fragment is shared with the other polygon, in the same direction. */
    COINCIDENT_SAME,
    /** The fragment is shared with the other polygon, in the opposite direction. */
    COINCIDENT_OPPOSITE
  }

  private final double tolerance;

  public R2BoundaryClassifier(double tolerance) {
    Preconditions.checkArgument(tolerance >= 0, "Negative tolerance: %s", tolerance);
    this.tolerance = tolerance;
  }

  /** Splits and classifies the loops of {@code a} and {@code b}. */
  public Result classify(R2Polygon a, R2Polygon b, R2CrossingFinder.Result crossings) {
    List<RawFragment> rawA = split(a, true, crossings);
    List<RawFragment> rawB = split(b, false, crossings);
    Set<Long> segmentsA = straightSegments(rawA);
    Set<Long> segmentsB = straightSegments(rawB);
    Result result = new Result(classify(rawA, b, segmentsB), classify(rawB, a, segmentsA));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          Platform.formatString(
              "Fragments of A: %s, fragments of B: %s",
              countByClass(result.fragmentsA()),
              countByClass(result.fragmentsB())));
    }
    return result;
  }

  private ImmutableList<Fragment> classify(
      List<RawFragment> raw, R2Polygon other, Set<Long> otherSegments) {
    ImmutableList.Builder<Fragment> fragments = ImmutableList.builder();
    for (RawFragment f : raw) {
      Classification c;
      if (f.points.size() == 2 && otherSegments.contains(key(f.startNode, f.endNode))) {
        c = Classification.COINCIDENT_SAME;
      } else if (f.points.size() == 2 && otherSegments.contains(key(f.endNode, f.startNode))) {
        c = Classification.COINCIDENT_OPPOSITE;
      } else if (other.contains(probe(f.points, f.isClosed()))) {
        c = Classification.INSIDE;
      } else {
        c = Classification.OUTSIDE;
      }
      fragments.add(new Fragment(f.sideA, f.ringIndex, f.startNode, f.endNode, f.points, c));
    }
    return fragments.build();
  }

  /** Returns the midpoint of the first longest segment of the given chain. */
  private static R2Vector probe(List<R2Vector> points, boolean closed) {
    int numSegments = closed ? points.size() : points.size() - 1;
    R2Vector a = points.get(0);
    R2Vector b = points.get(0);
    double longest = -1;
    for (int i = 0; i < numSegments; i++) {
      R2Vector p = points.get(i);
      R2Vector q = points.get((i + 1) % points.size());
      double d2 = p.getDistance2(q);
      if (d2 > longest) {
        longest = d2;
        a = p;
        b = q;
      }
    }
    return R2Vector.interpolate(0.5, a, b);
  }

  /** Returns the node pairs of all fragments that are a single straight segment. */
  private static Set<Long> straightSegments(List<RawFragment> fragments) {
    Set<Long> keys = new HashSet<>();
    for (RawFragment f : fragments) {
      if (!f.isClosed() && f.points.size() == 2) {
        keys.add(key(f.startNode, f.endNode));
      }
    }
    return keys;
  }

  private static long key(int startNode, int endNode) {
    return ((long) startNode << 32) | (endNode & 0xffffffffL);
  }

  private List<RawFragment> split(
      R2Polygon polygon, boolean sideA, R2CrossingFinder.Result crossings) {
    List<RawFragment> fragments = new ArrayList<>();
    for (int ring = 0; ring < polygon.numLoops(); ring++) {
      R2Loop loop = polygon.loop(ring);
      List<R2CrossingFinder.RingCrossing> list = crossings.crossings(sideA, ring);
      if (list.isEmpty()) {
        if (loop.numVertices() > 0) {
          fragments.add(new RawFragment(sideA, ring, -1, -1, loop.vertices()));
        }
        continue;
      }
      int n = loop.numVertices();
      int m = list.size();
      for (int k = 0; k < m; k++) {
        R2CrossingFinder.RingCrossing start = list.get(k);
        R2CrossingFinder.RingCrossing end = list.get((k + 1) % m);
        double startPos = start.location().position();
        double endPos = end.location().position();
        if (m == 1 || endPos < startPos) {
          endPos += n;
        }
        R2Vector startPoint = crossings.node(start.nodeId()).point();
        R2Vector endPoint = crossings.node(end.nodeId()).point();
        List<R2Vector> points = new ArrayList<>();
        points.add(startPoint);
        for (int p = (int) Math.floor(startPos) + 1; p < endPos; p++) {
          points.add(loop.vertex(p));
        }
        points.add(endPoint);
        if (start.nodeId() == end.nodeId() && allWithin(points, startPoint)) {
          continue;
        }
        fragments.add(new RawFragment(sideA, ring, start.nodeId(), end.nodeId(), points));
      }
    }
    return fragments;
  }

  private boolean allWithin(List<R2Vector> points, R2Vector center) {
    for (R2Vector p : points) {
      if (!p.approxEquals(center, tolerance)) {
        return false;
      }
    }
    return true;
  }

  private static Map<Classification, Integer> countByClass(List<Fragment> fragments) {
    Map<Classification, Integer> counts = new EnumMap<>(Classification.class);
    for (Fragment f : fragments) {
      counts.merge(f.classification(), 1, Integer::sum);
    }
    return counts;
  }

  private static final class RawFragment {
    final boolean sideA;
    final int ringIndex;
    final int startNode;
    final int endNode;
    final List<R2Vector> points;

    RawFragment(boolean sideA, int ringIndex, int startNode, int endNode, List<R2Vector> points) {
      this.sideA = sideA;
      this.ringIndex = ringIndex;
      this.startNode = startNode;
      this.endNode = endNode;
      this.points = points;
    }

    boolean isClosed() {
      return startNode < 0;
    }
  }

  /**
   * A piece of a loop's boundary. Open fragments run from the crossing node {@link #startNode()}
   * to {@link #endNode()} and their first and last points are those nodes. A closed fragment is a
   * whole loop that meets no crossing; its node ids are -1 and its last point joins its first.
   */
  @JsType
  public static final class Fragment {
    private final boolean sideA;
    private final int ringIndex;
    private final int startNode;
    private final int endNode;
    private final ImmutableList<R2Vector> points;
    private final Classification classification;

    public Fragment(
        boolean sideA,
        int ringIndex,
        int startNode,
        int endNode,
        List<R2Vector> points,
        Classification classification) {
      this.sideA = sideA;
      this.ringIndex = ringIndex;
      this.startNode = startNode;
      this.endNode = endNode;
      this.points = ImmutableList.copyOf(points);
      this.classification = classification;
    }

    /** Returns true if this fragment belongs to the first polygon. */
    public boolean isSideA() {
      return sideA;
    }

    public int ringIndex() {
      return ringIndex;
    }

    public int startNode() {
      return startNode;
    }

    public int endNode() {
      return endNode;
    }

    public ImmutableList<R2Vector> points() {
      return points;
    }

    public Classification classification() {
      return classification;
    }

    public boolean isClosed() {
      return startNode < 0;
    }

    /** Returns this fragment traversed in the opposite direction. */
    public Fragment reversed() {
      return new Fragment(
          sideA, ringIndex, endNode, startNode, Lists.reverse(points), classification);
    }

    @Override
    public String toString() {
      return Platform.formatString(
          "%s%d %s %d->%d %s",
          sideA ? "A" : "B",
          ringIndex,
          classification,
          startNode,
          endNode,
          points);
    }
  }

  /** The classified fragments of both polygons, in loop order. */
  @JsType
  public static final class Result {
    private final ImmutableList<Fragment> fragmentsA;
    private final ImmutableList<Fragment> fragmentsB;

    Result(ImmutableList<Fragment> fragmentsA, ImmutableList<Fragment> fragmentsB) {
      this.fragmentsA = fragmentsA;
      this.fragmentsB = fragmentsB;
    }

    public ImmutableList<Fragment> fragmentsA() {
      return fragmentsA;
    }

    public ImmutableList<Fragment> fragmentsB() {
      return fragmentsB;
    }
  }
}
