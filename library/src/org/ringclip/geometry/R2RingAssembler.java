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
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;
import org.ringclip.geometry.R2BoundaryClassifier.Fragment;

/**
 * Joins directed boundary fragments into closed loops and assigns each loop its hole flag.
 *
 * <p>Fragments are linked at their crossing nodes. Starting from the lowest-numbered unused
 * fragment, we follow fragments end to start, taking the leftmost turn whenever a node offers more
 * than one unused continuation, until we get back to the node where the loop started. Fragments
 * that are whole loops are emitted as they are.
 *
 * <p>The assembled loops are then cleaned up: repeated vertices are removed, as are crossing nodes
 * that lie on the straight line through their neighbours. Vertices that are not crossing nodes
 * are never removed. Loops left with fewer than three vertices or no area are discarded.
 */
@JsType
public final class R2RingAssembler {
  private static final Logger logger = Platform.getLoggerForClass(R2RingAssembler.class);

  private final double tolerance;
  private int numDeadEnds;
  private int numReversedLoops;

  public R2RingAssembler(double tolerance) {
    Preconditions.checkArgument(tolerance >= 0, "Negative tolerance: %s", tolerance);
    this.tolerance = tolerance;
  }

  /** Returns the number of walks that stopped at a node with no unused continuation. */
  public int numDeadEnds() {
    return numDeadEnds;
  }

  /** Returns the number of assembled loops whose orientation disagreed with their nesting depth. */
  public int numReversedLoops() {
    return numReversedLoops;
  }

  /**
   * Assembles the given fragments into a polygon. {@code resultUnbounded} says whether the region
   * they bound contains all points far away from them, which decides the hole flags of the
   * outermost loops.
   */
  public R2Polygon assemble(List<Fragment> fragments, boolean resultUnbounded) {
    List<Chain> chains = walk(fragments);
    List<R2Loop> loops = new ArrayList<>(chains.size());
    for (Chain chain : chains) {
      List<R2Vector> vertices = cleanUp(chain);
      if (vertices.size() < 3) {
        continue;
      }
      R2Loop loop = new R2Loop(vertices, false);
      if (loop.getArea() <= tolerance * tolerance) {
        continue;
      }
      loops.add(loop);
    }
    if (loops.isEmpty()) {
      if (resultUnbounded) {
        logger.warning("Result covers the whole plane, which has no representation");
      }
      return R2Polygon.empty();
    }
    return new R2Polygon(assignHoles(loops, resultUnbounded));
  }

  /** A sequence of vertices with a marker for those that are crossing nodes. */
  private static final class Chain {
    final List<R2Vector> points = new ArrayList<>();
    final List<Boolean> isNode = new ArrayList<>();

    void add(R2Vector p, boolean node) {
      points.add(p);
      isNode.add(node);
    }

    int size() {
      return points.size();
    }
  }

  private List<Chain> walk(List<Fragment> fragments) {
    int numNodes = 0;
    for (Fragment f : fragments) {
      numNodes = Math.max(numNodes, Math.max(f.startNode(), f.endNode()) + 1);
    }
    IntArrayList[] outgoing = new IntArrayList[numNodes];
    for (int i = 0; i < fragments.size(); i++) {
      Fragment f = fragments.get(i);
      if (f.isClosed()) {
        continue;
      }
      if (outgoing[f.startNode()] == null) {
        outgoing[f.startNode()] = new IntArrayList();
      }
      outgoing[f.startNode()].add(i);
    }

    boolean[] used = new boolean[fragments.size()];
    List<Chain> chains = new ArrayList<>();
    for (int first = 0; first < fragments.size(); first++) {
      if (used[first]) {
        continue;
      }
      used[first] = true;
      Fragment f = fragments.get(first);
      Chain chain = new Chain();
      if (f.isClosed()) {
        for (R2Vector p : f.points()) {
          chain.add(p, false);
        }
        chains.add(chain);
        continue;
      }
      int startNode = f.startNode();
      while (true) {
        appendAllButLast(chain, f);
        int node = f.endNode();
        if (node == startNode) {
          break;
        }
        R2Vector nodePoint = f.points().get(f.points().size() - 1);
        int next = chooseNext(fragments, outgoing[node], used, chain, nodePoint);
        if (next < 0) {
          numDeadEnds++;
          chain.add(nodePoint, true);
          logger.warning(
              Platform.formatString(
                  "Dead end at node %d after %d vertices, loop starting at node %d left open",
                  node,
                  chain.size(),
                  startNode));
          break;
        }
        used[next] = true;
        f = fragments.get(next);
      }
      chains.add(chain);
    }
    return chains;
  }

  private static void appendAllButLast(Chain chain, Fragment f) {
    ImmutableList<R2Vector> points = f.points();
    for (int i = 0; i < points.size() - 1; i++) {
      chain.add(points.get(i), i == 0);
    }
  }

  /**
   * Returns the unused fragment leaving the current node that makes the leftmost turn relative to
   * the direction in which the chain arrived, or -1 if there is none.
   */
  private int chooseNext(
      List<Fragment> fragments,
      @Nullable IntArrayList candidates,
      boolean[] used,
      Chain chain,
      R2Vector node) {
    if (candidates == null) {
      return -1;
    }
    R2Vector back = lastDistinct(chain.points, node);
    int best = -1;
    double bestAngle = Double.POSITIVE_INFINITY;
    for (int i = 0; i < candidates.size(); i++) {
      int candidate = candidates.getInt(i);
      if (used[candidate]) {
        continue;
      }
      R2Vector ahead = firstDistinct(fragments.get(candidate).points(), node);
      double angle = 2 * Math.PI;
      if (back != null && ahead != null) {
        angle = clockwiseAngle(R2Vector.sub(back, node), R2Vector.sub(ahead, node));
      }
      if (angle < bestAngle) {
        bestAngle = angle;
        best = candidate;
      }
    }
    return best;
  }

  /** Returns the clockwise angle from {@code from} to {@code to}, in the range (0, 2*pi]. */
  private static double clockwiseAngle(R2Vector from, R2Vector to) {
    double angle = -Math.atan2(from.crossProd(to), from.dotProd(to));
    return angle <= 0 ? angle + 2 * Math.PI : angle;
  }

  private @Nullable R2Vector lastDistinct(List<R2Vector> points, R2Vector p) {
    for (int i = points.size() - 1; i >= 0; i--) {
      if (!points.get(i).approxEquals(p, tolerance)) {
        return points.get(i);
      }
    }
    return null;
  }

  private @Nullable R2Vector firstDistinct(List<R2Vector> points, R2Vector p) {
    for (R2Vector q : points) {
      if (!q.approxEquals(p, tolerance)) {
        return q;
      }
    }
    return null;
  }

  /** Removes repeated vertices and crossing nodes that are collinear with their neighbours. */
  private List<R2Vector> cleanUp(Chain chain) {
    List<R2Vector> points = new ArrayList<>(chain.size());
    List<Boolean> isNode = new ArrayList<>(chain.size());
    for (int i = 0; i < chain.size(); i++) {
      R2Vector p = chain.points.get(i);
      if (!points.isEmpty() && points.get(points.size() - 1).approxEquals(p, tolerance)) {
        int last = isNode.size() - 1;
        isNode.set(last, isNode.get(last) && chain.isNode.get(i));
        continue;
      }
      points.add(p);
      isNode.add(chain.isNode.get(i));
    }
    while (points.size() > 1
        && points.get(points.size() - 1).approxEquals(points.get(0), tolerance)) {
      int last = points.size() - 1;
      isNode.set(0, isNode.get(0) && isNode.get(last));
      points.remove(last);
      isNode.remove(last);
    }

    boolean changed = true;
    while (changed && points.size() >= 3) {
      changed = false;
      for (int i = 0; i < points.size() && points.size() >= 3; i++) {
        if (!isNode.get(i)) {
          continue;
        }
        int n = points.size();
        R2Vector prev = points.get((i + n - 1) % n);
        R2Vector next = points.get((i + 1) % n);
        if (isCollinear(prev, points.get(i), next)) {
          points.remove(i);
          isNode.remove(i);
          changed = true;
          i--;
        }
      }
    }
    return points;
  }

  /** Returns true if {@code b} is within the tolerance of the line through a and c. */
  private boolean isCollinear(R2Vector a, R2Vector b, R2Vector c) {
    R2Vector ac = R2Vector.sub(c, a);
    double length = ac.norm();
    if (length <= tolerance) {
      // A spike returning to where it started.
      return true;
    }
    return Math.abs(ac.crossProd(R2Vector.sub(b, a))) / length <= tolerance;
  }

  /**
   * Sets each loop's hole flag from its nesting depth, and reverses loops whose orientation
   * disagrees with the flag.
   */
  private List<R2Loop> assignHoles(List<R2Loop> loops, boolean resultUnbounded) {
    List<R2Loop> result = new ArrayList<>(loops.size());
    for (int i = 0; i < loops.size(); i++) {
      R2Loop loop = loops.get(i);
      int depth = 0;
      for (int j = 0; j < loops.size(); j++) {
        if (j != i && encloses(loops.get(j), loop)) {
          depth++;
        }
      }
      boolean hole = (depth % 2 == 1) != resultUnbounded;
      R2Loop flagged = loop.withHole(hole);
      if (!flagged.isHoleConsistentWithWinding()) {
        numReversedLoops++;
        logger.fine(
            Platform.formatString(
                "Loop %d at depth %d has the wrong orientation, reversing it", i, depth));
        flagged = new R2Loop(Lists.reverse(loop.vertices()), hole);
      }
      result.add(flagged);
    }
    return result;
  }

  /**
   * Returns true if {@code outer} encloses {@code inner}, tested at the first vertex of inner that
   * is not on the boundary of outer, or failing that at the first such edge midpoint.
   */
  private boolean encloses(R2Loop outer, R2Loop inner) {
    for (R2Vector v : inner.vertices()) {
      if (!outer.boundaryContains(v, tolerance)) {
        return outer.contains(v);
      }
    }
    for (int i = 0; i < inner.numEdges(); i++) {
      R2Vector mid = inner.edge(i).getMidpoint();
      if (!outer.boundaryContains(mid, tolerance)) {
        return outer.contains(mid);
      }
    }
    return false;
  }
}
