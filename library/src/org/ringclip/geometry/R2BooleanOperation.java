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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.logging.Logger;
import jsinterop.annotations.JsIgnore;
import jsinterop.annotations.JsType;
import org.jspecify.annotations.Nullable;

/**
 * Computes the union, intersection, difference or symmetric difference of two planar polygons.
 *
 * <p>The operation runs in four stages:
 *
 * <ol>
 *   <li>{@link R2CrossingFinder} finds every point where the boundaries of the inputs meet.
 *   <li>{@link R2BoundaryClassifier} splits each input boundary at those points into fragments, and
 *       classifies each fragment as inside, outside, or coincident with the other input.
 *   <li>{@link R2Combinator} picks the fragments that bound the result for the requested operation,
 *       and orients them so that the result interior is on their left.
 *   <li>{@link R2RingAssembler} joins the picked fragments into loops and assigns hole flags.
 * </ol>
 *
 * <p>Points closer than {@link Options#mergeDistance()} are treated as identical throughout. The
 * inputs are not modified, and each call produces a new polygon.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * R2BooleanOperation op = new R2BooleanOperation.Builder()
 *     .setMergeDistance(1e-6)
 *     .build(OpType.INTERSECTION);
 * R2Error error = new R2Error();
 * R2Polygon result = op.build(a, b, error);
 * if (!error.ok()) {
 *   ...
 * }
 * }</pre>
 *
 * <p>The static methods {@link #union}, {@link #intersection}, {@link #difference} and {@link
 * #symmetricDifference} use the default options and throw {@link R2Exception} on invalid input.
 */
@JsType
public class R2BooleanOperation {
  private static final Logger logger = Platform.getLoggerForClass(R2BooleanOperation.class);

  /** The supported operation types. */
  public enum OpType {
    UNION, // Contained by either region.
    INTERSECTION, // Contained by both regions.
    DIFFERENCE, // Contained by the first region but not the second.
    SYMMETRIC_DIFFERENCE // Contained by one region but not the other.
  }

  /** Options for an R2BooleanOperation. Instances are immutable; use a {@link Builder} to vary. */
  public static class Options {
    /** The default value of {@link #mergeDistance()}. */
    public static final double DEFAULT_MERGE_DISTANCE = 1e-9;

    /** An immutable instance of Options with the default values. */
    public static final Options DEFAULT = new Options();

    private double mergeDistance;

    /** The Options constructor initializes the default options. */
    public Options() {
      this.mergeDistance = DEFAULT_MERGE_DISTANCE;
    }

    /** A copy constructor for internal use. */
    Options(Options other) {
      this.mergeDistance = other.mergeDistance;
    }

    /**
     * Returns the distance below which two points are considered the same. Crossing points within
     * this distance of an input vertex are moved onto it, and crossing points within this distance
     * of each other become a single vertex of the result. The default is {@value
     * #DEFAULT_MERGE_DISTANCE}.
     */
    public double mergeDistance() {
      return mergeDistance;
    }

    @Override
    public String toString() {
      return "Options{mergeDistance=" + mergeDistance + "}";
    }
  }

  /** Builder for {@link R2BooleanOperation}. */
  public static class Builder {
    /** These options are mutated by the Builder. */
    private Options options = new Options();

    /** Constructs a Builder with default {@link Options} values. */
    public Builder() {}

    /** Constructor that accepts provided Options. */
    @JsIgnore
    public Builder(Options options) {
      this.options = new Options(options);
    }

    /** Returns a snapshot of the Options currently set on this Builder. */
    public Options options() {
      return new Options(options);
    }

    /**
     * Sets the merge distance. See {@link Options#mergeDistance()}.
     *
     * @throws IllegalArgumentException if the distance is negative or not finite
     */
    @CanIgnoreReturnValue
    public Builder setMergeDistance(double mergeDistance) {
      checkArgument(
          mergeDistance >= 0 && Double.isFinite(mergeDistance),
          "Invalid merge distance: %s",
          mergeDistance);
      options.mergeDistance = mergeDistance;
      return this;
    }

    /**
     * Using a snapshot of the Options currently set for this Builder, constructs and returns an
     * R2BooleanOperation of the given type.
     */
    public R2BooleanOperation build(OpType opType) {
      return new R2BooleanOperation(checkNotNull(opType), options());
    }

    /** For debugging. */
    @Override
    public String toString() {
      return "R2BooleanOperation.Builder{mergeDistance=" + options.mergeDistance() + "}";
    }
  }

  private final OpType opType;
  private final Options options;

  // Diagnostics of the most recent build.
  private int numInconsistentLoops;
  private int numUnresolvedPairs;
  private int numDeadEnds;

  private R2BooleanOperation(OpType opType, Options options) {
    this.opType = opType;
    this.options = options;
  }

  /** Returns the OpType of this R2BooleanOperation. */
  public OpType opType() {
    return opType;
  }

  /** Returns this {@code R2BooleanOperation}'s immutable Options. */
  public Options options() {
    return options;
  }

  /**
   * Returns the number of input loops in the most recent build whose hole flag disagreed with their
   * winding. Such loops are used according to their winding.
   */
  public int numInconsistentLoops() {
    return numInconsistentLoops;
  }

  /**
   * Returns the number of edge pairs in the most recent build that appeared to cross but whose
   * crossing point could not be computed. Such pairs are treated as disjoint.
   */
  public int numUnresolvedPairs() {
    return numUnresolvedPairs;
  }

  /** Returns the number of loops in the most recent build that could not be closed. */
  public int numDeadEnds() {
    return numDeadEnds;
  }

  /**
   * Executes the operation on the provided inputs. Returns the result on success. Otherwise sets
   * "error" appropriately and returns the empty polygon.
   *
   * <p>Both inputs are checked before any geometric work is done. Errors are only reported for
   * invalid inputs: a null polygon ({@link R2Error.Code#INVALID_ARGUMENT}), a loop with a
   * non-finite vertex ({@link R2Error.Code#INVALID_VERTEX}), or a loop with fewer than three
   * distinct vertices ({@link R2Error.Code#LOOP_NOT_ENOUGH_VERTICES}).
   */
  public R2Polygon build(@Nullable R2Polygon a, @Nullable R2Polygon b, R2Error error) {
    error.clear();
    if (!validateInput(a, "first", error) || !validateInput(b, "second", error)) {
      return R2Polygon.empty();
    }
    Impl impl = new Impl(a, b);
    return impl.build();
  }

  /**
   * Executes the operation on the provided inputs. This method wraps {@link #build(R2Polygon,
   * R2Polygon, R2Error)} as a convenience for clients who either do not wish to handle errors, or
   * prefer using exception handling.
   *
   * @throws R2Exception wrapping the underlying {@link R2Error}, if any error occurs.
   */
  public R2Polygon buildUnsafe(@Nullable R2Polygon a, @Nullable R2Polygon b) {
    R2Error error = new R2Error();
    R2Polygon result = build(a, b, error);
    if (!error.ok()) {
      throw new R2Exception(error);
    }
    return result;
  }

  private boolean validateInput(@Nullable R2Polygon polygon, String which, R2Error error) {
    if (polygon == null) {
      error.init(R2Error.Code.INVALID_ARGUMENT, "The %s polygon is null", which);
      return false;
    }
    if (polygon.findValidationError(error)) {
      error.init(error.code(), "In the %s polygon: %s", which, error.text());
      return false;
    }
    return true;
  }

  /** Returns the union of {@code a} and {@code b}, the points in either. */
  public static R2Polygon union(R2Polygon a, R2Polygon b) {
    return new Builder().build(OpType.UNION).buildUnsafe(a, b);
  }

  /** Returns the intersection of {@code a} and {@code b}, the points in both. */
  public static R2Polygon intersection(R2Polygon a, R2Polygon b) {
    return new Builder().build(OpType.INTERSECTION).buildUnsafe(a, b);
  }

  /** Returns {@code a} minus {@code b}, the points in a but not in b. */
  public static R2Polygon difference(R2Polygon a, R2Polygon b) {
    return new Builder().build(OpType.DIFFERENCE).buildUnsafe(a, b);
  }

  /** Returns the points in exactly one of {@code a} and {@code b}. */
  public static R2Polygon symmetricDifference(R2Polygon a, R2Polygon b) {
    return new Builder().build(OpType.SYMMETRIC_DIFFERENCE).buildUnsafe(a, b);
  }

  /** Same as {@link #symmetricDifference}. */
  public static R2Polygon xor(R2Polygon a, R2Polygon b) {
    return symmetricDifference(a, b);
  }

  /**
   * Returns the complement of {@code a}: every loop reversed with its hole flag flipped. This never
   * fails for a non-null polygon, even an invalid one.
   *
   * @throws R2Exception with code {@link R2Error.Code#INVALID_ARGUMENT} if {@code a} is null
   */
  public static R2Polygon invert(@Nullable R2Polygon a) {
    if (a == null) {
      R2Error error = new R2Error();
      error.init(R2Error.Code.INVALID_ARGUMENT, "Cannot invert a null polygon");
      throw new R2Exception(error);
    }
    return a.inverse();
  }

  /** The state of a single build. */
  private class Impl {
    private final R2Polygon a;
    private final R2Polygon b;
    private final double tolerance;

    Impl(R2Polygon a, R2Polygon b) {
      this.a = a;
      this.b = b;
      this.tolerance = options.mergeDistance();
    }

    R2Polygon build() {
      numInconsistentLoops = a.numInconsistentLoops() + b.numInconsistentLoops();
      if (numInconsistentLoops > 0) {
        logger.fine(
            Platform.formatString(
                "%d input loops have a hole flag that disagrees with their winding",
                numInconsistentLoops));
      }

      R2CrossingFinder.Result crossings = new R2CrossingFinder(tolerance).find(a, b);
      numUnresolvedPairs = crossings.numUnresolvedPairs();

      R2BoundaryClassifier.Result classified =
          new R2BoundaryClassifier(tolerance).classify(a, b, crossings);

      R2Combinator combinator = R2Combinator.forOp(opType);
      boolean resultUnbounded = combinator.isResultUnbounded(a.isUnbounded(), b.isUnbounded());

      R2RingAssembler assembler = new R2RingAssembler(tolerance);
      R2Polygon result = assembler.assemble(combinator.select(classified), resultUnbounded);
      numDeadEnds = assembler.numDeadEnds();

      logger.fine(
          Platform.formatString(
              "%s of %d and %d loops: %d crossing nodes, %d result loops",
              opType,
              a.numLoops(),
              b.numLoops(),
              crossings.numNodes(),
              result.numLoops()));
      return result;
    }
  }
}
