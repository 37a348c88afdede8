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
import jsinterop.annotations.JsType;

/**
 * A position on the boundary of a polygon: a loop index, an edge index within that loop, and the
 * fraction of the way along that edge. Locations sort by loop, then edge, then ratio, which is the
 * order in which a walk along each loop meets them.
 */
@JsType
public final class R2BoundaryLocation implements Comparable<R2BoundaryLocation> {
  private final int ringIndex;
  private final int segmentIndex;
  private final double segmentRatio;

  /**
   * Creates a location.
   *
   * @throws IllegalArgumentException if an index is negative or the ratio is outside [0, 1]
   */
  public R2BoundaryLocation(int ringIndex, int segmentIndex, double segmentRatio) {
    Preconditions.checkArgument(ringIndex >= 0, "Negative ring index: %s", ringIndex);
    Preconditions.checkArgument(segmentIndex >= 0, "Negative segment index: %s", segmentIndex);
    Preconditions.checkArgument(
        segmentRatio >= 0 && segmentRatio <= 1, "Segment ratio out of range: %s", segmentRatio);
    this.ringIndex = ringIndex;
    this.segmentIndex = segmentIndex;
    this.segmentRatio = segmentRatio;
  }

  public int ringIndex() {
    return ringIndex;
  }

  public int segmentIndex() {
    return segmentIndex;
  }

  public double segmentRatio() {
    return segmentRatio;
  }

  /** Returns the position along the loop as a single number, segment index plus ratio. */
  double position() {
    return segmentIndex + segmentRatio;
  }

  /**
   * Returns the canonical form of this location on a loop with {@code numSegments} edges: the end
   * of an edge is expressed as the start of the next one, so that every vertex has exactly one
   * location.
   */
  public R2BoundaryLocation canonicalize(int numSegments) {
    Preconditions.checkArgument(numSegments > 0, "Loop has no segments");
    if (segmentRatio == 1) {
      return new R2BoundaryLocation(ringIndex, (segmentIndex + 1) % numSegments, 0);
    }
    return this;
  }

  @Override
  public int compareTo(R2BoundaryLocation other) {
    if (ringIndex != other.ringIndex) {
      return Integer.compare(ringIndex, other.ringIndex);
    }
    if (segmentIndex != other.segmentIndex) {
      return Integer.compare(segmentIndex, other.segmentIndex);
    }
    return Double.compare(segmentRatio, other.segmentRatio);
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof R2BoundaryLocation)) {
      return false;
    }
    R2BoundaryLocation that = (R2BoundaryLocation) other;
    return ringIndex == that.ringIndex
        && segmentIndex == that.segmentIndex
        && Double.compare(segmentRatio, that.segmentRatio) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * ringIndex + segmentIndex) + Double.hashCode(segmentRatio);
  }

  @Override
  public String toString() {
    return ringIndex + ":" + segmentIndex + ":" + segmentRatio;
  }
}
