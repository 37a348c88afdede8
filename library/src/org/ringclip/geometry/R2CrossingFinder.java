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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import jsinterop.annotations.JsType;

/**
 * Finds every point where the boundaries of two polygons meet, and records each such point as a
 * {@link CrossingNode} shared by both polygons. For every loop of either polygon the result lists
 * the crossings in the order a walk along the loop meets them.
 *
 * <p>All edge pairs are tested, after a bounding rectangle rejection test, so the cost is
 * proportional to the product of the edge counts. Points within the tolerance of each other are
 * the same node; the first coordinate registered for a node is the one kept. Once all pairs are
 * tested, each node is also recorded on every other loop that passes through it.
 */
@JsType
public final class R2CrossingFinder {
  private static final Logger logger = Platform.getLoggerForClass(R2CrossingFinder.class);

  private final double tolerance;

  /** Creates a crossing finder that merges points closer than {@code tolerance}. */
  public R2CrossingFinder(double tolerance) {
    Preconditions.checkArgument(tolerance >= 0, "Negative tolerance: %s", tolerance);
    this.tolerance = tolerance;
  }

  public double tolerance() {
    return tolerance;
  }

  /** Finds the crossings between the boundaries of {@code a} and {@code b}. */
  public Result find(R2Polygon a, R2Polygon b) {
    NodeRegistry registry = new NodeRegistry();
    List<List<RingCrossing>> crossingsA = newLists(a.numLoops());
    List<List<RingCrossing>> crossingsB = newLists(b.numLoops());

    // Edges and bounds of B are reused for every edge of A.
    List<R2Edge[]> edgesB = new ArrayList<>(b.numLoops());
    List<R2Rect[]> boundsB = new ArrayList<>(b.numLoops());
    for (R2Loop loop : b.loops()) {
      R2Edge[] edges = new R2Edge[loop.numEdges()];
      R2Rect[] bounds = new R2Rect[loop.numEdges()];
      for (int t = 0; t < edges.length; t++) {
        edges[t] = loop.edge(t);
        bounds[t] = edges[t].getBound();
      }
      edgesB.add(edges);
      boundsB.add(bounds);
    }

    int numUnresolved = 0;
    for (int i = 0; i < a.numLoops(); i++) {
      R2Loop loopA = a.loop(i);
      for (int s = 0; s < loopA.numEdges(); s++) {
        R2Edge edgeA = loopA.edge(s);
        R2Rect boundA = edgeA.getBound().expanded(tolerance);
        for (int j = 0; j < b.numLoops(); j++) {
          R2Edge[] edges = edgesB.get(j);
          R2Rect[] bounds = boundsB.get(j);
          for (int t = 0; t < edges.length; t++) {
            if (!boundA.intersects(bounds[t])) {
              continue;
            }
            R2EdgeIntersection x = R2Edge.intersect(edgeA, edges[t], tolerance);
            if (x.isUnresolved()) {
              numUnresolved++;
              logger.fine(
                  Platform.formatString(
                      "Unresolved crossing between A %d:%d and B %d:%d", i, s, j, t));
              continue;
            }
            for (R2EdgeIntersection.Contact contact : x.contacts()) {
              R2BoundaryLocation locA =
                  new R2BoundaryLocation(i, s, contact.ratioA()).canonicalize(loopA.numEdges());
              R2BoundaryLocation locB =
                  new R2BoundaryLocation(j, t, contact.ratioB()).canonicalize(edges.length);
              int id = registry.register(contact.point(), locA, locB);
              crossingsA.get(i).add(new RingCrossing(locA, id));
              crossingsB.get(j).add(new RingCrossing(locB, id));
            }
          }
        }
      }
    }

    addPassingLoops(a, registry.nodes, crossingsA);
    addPassingLoops(b, registry.nodes, crossingsB);

    Result result =
        new Result(
            ImmutableList.copyOf(registry.nodes),
            normalize(crossingsA),
            normalize(crossingsB),
            numUnresolved);
    logger.fine(
        Platform.formatString(
            "Found %d crossing nodes, %d unresolved edge pairs",
            result.numNodes(),
            numUnresolved));
    return result;
  }

  /**
   * Records every node on every loop of {@code polygon} that passes within the tolerance of it.
   * An edge pair only records its node on its own two loops, but a vertex of one loop may touch
   * the interior of an edge of another loop of the same polygon at that point. The repeated
   * locations this adds are removed by {@link #normalize}.
   */
  private void addPassingLoops(
      R2Polygon polygon, List<CrossingNode> nodes, List<List<RingCrossing>> crossings) {
    if (nodes.isEmpty()) {
      return;
    }
    for (int i = 0; i < polygon.numLoops(); i++) {
      R2Loop loop = polygon.loop(i);
      for (int s = 0; s < loop.numEdges(); s++) {
        R2Edge edge = loop.edge(s);
        R2Rect bound = edge.getBound().expanded(tolerance);
        for (CrossingNode node : nodes) {
          if (!bound.contains(node.point) || edge.getDistance(node.point) > tolerance) {
            continue;
          }
          R2BoundaryLocation location =
              new R2BoundaryLocation(i, s, edge.snappedRatio(node.point, tolerance))
                  .canonicalize(loop.numEdges());
          crossings.get(i).add(new RingCrossing(location, node.id));
        }
      }
    }
  }

  private static List<List<RingCrossing>> newLists(int n) {
    List<List<RingCrossing>> lists = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      lists.add(new ArrayList<>());
    }
    return lists;
  }

  /**
   * Sorts the crossings of each loop, removes repeated locations, and collapses consecutive
   * crossings on the same edge that reference the same node.
   */
  private static ImmutableList<ImmutableList<RingCrossing>> normalize(
      List<List<RingCrossing>> lists) {
    ImmutableList.Builder<ImmutableList<RingCrossing>> result = ImmutableList.builder();
    for (List<RingCrossing> list : lists) {
      Collections.sort(list);
      List<RingCrossing> kept = new ArrayList<>(list.size());
      for (RingCrossing c : list) {
        if (!kept.isEmpty()) {
          RingCrossing last = kept.get(kept.size() - 1);
          if (last.location.equals(c.location)) {
            continue;
          }
          if (last.nodeId == c.nodeId
              && last.location.segmentIndex() == c.location.segmentIndex()) {
            continue;
          }
        }
        kept.add(c);
      }
      result.add(ImmutableList.copyOf(kept));
    }
    return result.build();
  }

  /** Assigns node ids to points, merging points within the tolerance. */
  private final class NodeRegistry {
    final List<CrossingNode> nodes = new ArrayList<>();

    int register(R2Vector point, R2BoundaryLocation locA, R2BoundaryLocation locB) {
      for (CrossingNode node : nodes) {
        if (node.point.approxEquals(point, tolerance)) {
          return node.id;
        }
      }
      int id = nodes.size();
      nodes.add(new CrossingNode(id, point, locA, locB));
      return id;
    }
  }

  /**
   * A point where the boundaries of both polygons meet. The locations are those at which the node
   * was first found; a node may occur at further locations on either polygon.
   */
  @JsType
  public static final class CrossingNode {
    private final int id;
    private final R2Vector point;
    private final R2BoundaryLocation locationA;
    private final R2BoundaryLocation locationB;

    CrossingNode(
        int id, R2Vector point, R2BoundaryLocation locationA, R2BoundaryLocation locationB) {
      this.id = id;
      this.point = point;
      this.locationA = locationA;
      this.locationB = locationB;
    }

    public int id() {
      return id;
    }

    public R2Vector point() {
      return point;
    }

    public R2BoundaryLocation locationA() {
      return locationA;
    }

    public R2BoundaryLocation locationB() {
      return locationB;
    }

    @Override
    public String toString() {
      return Platform.formatString("Node %d %s [A %s, B %s]", id, point, locationA, locationB);
    }
  }

  /** A crossing node as seen from one loop: where on the loop it is, and which node it is. */
  @JsType
  public static final class RingCrossing implements Comparable<RingCrossing> {
    private final R2BoundaryLocation location;
    private final int nodeId;

    RingCrossing(R2BoundaryLocation location, int nodeId) {
      this.location = location;
      this.nodeId = nodeId;
    }

    public R2BoundaryLocation location() {
      return location;
    }

    public int nodeId() {
      return nodeId;
    }

    @Override
    public int compareTo(RingCrossing other) {
      int c = location.compareTo(other.location);
      return c != 0 ? c : Integer.compare(nodeId, other.nodeId);
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof RingCrossing)) {
        return false;
      }
      RingCrossing that = (RingCrossing) other;
      return nodeId == that.nodeId && location.equals(that.location);
    }

    @Override
    public int hashCode() {
      return 31 * location.hashCode() + nodeId;
    }

    @Override
    public String toString() {
      return location + "->" + nodeId;
    }
  }

  /** The crossings found between two polygons. */
  @JsType
  public static final class Result {
    private final ImmutableList<CrossingNode> nodes;
    private final ImmutableList<ImmutableList<RingCrossing>> crossingsA;
    private final ImmutableList<ImmutableList<RingCrossing>> crossingsB;
    private final int numUnresolvedPairs;

    Result(
        ImmutableList<CrossingNode> nodes,
        ImmutableList<ImmutableList<RingCrossing>> crossingsA,
        ImmutableList<ImmutableList<RingCrossing>> crossingsB,
        int numUnresolvedPairs) {
      this.nodes = nodes;
      this.crossingsA = crossingsA;
      this.crossingsB = crossingsB;
      this.numUnresolvedPairs = numUnresolvedPairs;
    }

    public ImmutableList<CrossingNode> nodes() {
      return nodes;
    }

    public int numNodes() {
      return nodes.size();
    }

    public CrossingNode node(int id) {
      return nodes.get(id);
    }

    /** Returns the sorted crossings of loop {@code ring} of the first polygon. */
    public ImmutableList<RingCrossing> crossingsA(int ring) {
      return crossingsA.get(ring);
    }

    /** Returns the sorted crossings of loop {@code ring} of the second polygon. */
    public ImmutableList<RingCrossing> crossingsB(int ring) {
      return crossingsB.get(ring);
    }

    /** Returns the sorted crossings of the given loop of the first or second polygon. */
    public ImmutableList<RingCrossing> crossings(boolean sideA, int ring) {
      return sideA ? crossingsA(ring) : crossingsB(ring);
    }

    /**
     * Returns the number of edge pairs that appeared to cross but whose crossing point could not be
     * computed. Such pairs are treated as disjoint.
     */
    public int numUnresolvedPairs() {
      return numUnresolvedPairs;
    }
  }
}
