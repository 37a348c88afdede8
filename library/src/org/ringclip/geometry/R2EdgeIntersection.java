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
import jsinterop.annotations.JsType;

/**
 * The result of intersecting two {@link R2Edge edges}, as a tagged variant: the {@link Kind} says
 * which shape the intersection has, and {@link #contacts()} holds zero, one or two points where the
 * edges meet, each with its parameter along both edges.
 *
 * <ul>
 *   <li>{@link Kind#NONE}: the edges do not meet; there are no contacts.
 *   <li>{@link Kind#POINT}: the edges meet in a single point, which may be an endpoint of either.
 *   <li>{@link Kind#OVERLAP}: the edges are collinear and share an interval of positive length; the
 *       two contacts are the ends of that interval, ordered along the first edge.
 * </ul>
 */
@JsType
public final class R2EdgeIntersection {
  /** The shape of an edge-edge intersection. */
  public enum Kind {
    NONE,
    POINT,
    OVERLAP
  }

  private static final R2EdgeIntersection NONE =
      new R2EdgeIntersection(Kind.NONE, ImmutableList.of());

  private static final R2EdgeIntersection UNRESOLVED =
      new R2EdgeIntersection(Kind.NONE, ImmutableList.of(), true);

  private final Kind kind;
  private final ImmutableList<Contact> contacts;
  private final boolean unresolved;

  private R2EdgeIntersection(Kind kind, ImmutableList<Contact> contacts) {
    this(kind, contacts, false);
  }

  private R2EdgeIntersection(Kind kind, ImmutableList<Contact> contacts, boolean unresolved) {
    this.kind = kind;
    this.contacts = contacts;
    this.unresolved = unresolved;
  }

  /** Returns the intersection of two edges that do not meet. */
  public static R2EdgeIntersection none() {
    return NONE;
  }

  /**
   * Returns a NONE intersection for an edge pair whose crossing could not be computed in double
   * precision. Callers treat it as non-intersecting but may count it for diagnostics.
   */
  public static R2EdgeIntersection unresolved() {
    return UNRESOLVED;
  }

  /** Returns an intersection consisting of the single given contact. */
  public static R2EdgeIntersection point(Contact contact) {
    return new R2EdgeIntersection(Kind.POINT, ImmutableList.of(contact));
  }

  /**
   * Returns a collinear overlap between the two given contacts, which must be ordered by their
   * parameter along the first edge.
   */
  public static R2EdgeIntersection overlap(Contact start, Contact end) {
    Preconditions.checkArgument(start.ratioA() <= end.ratioA(), "Contacts out of order");
    return new R2EdgeIntersection(Kind.OVERLAP, ImmutableList.of(start, end));
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the contacts: none for NONE, one for POINT, two for OVERLAP. */
  public ImmutableList<Contact> contacts() {
    return contacts;
  }

  /** Returns true if this NONE result was produced by a numerically unresolvable edge pair. */
  public boolean isUnresolved() {
    return unresolved;
  }

  /** Returns true if the edges meet at all. */
  public boolean intersects() {
    return kind != Kind.NONE;
  }

  @Override
  public String toString() {
    return kind + contacts.toString();
  }

  /**
   * A point shared by two edges, with its fractional position along the first edge ("A") and along
   * the second edge ("B"). A ratio of exactly 0 or 1 means the contact is that edge's start or end
   * vertex.
   */
  @JsType
  public static final class Contact {
    private final R2Vector point;
    private final double ratioA;
    private final double ratioB;

    public Contact(R2Vector point, double ratioA, double ratioB) {
      this.point = point;
      this.ratioA = ratioA;
      this.ratioB = ratioB;
    }

    public R2Vector point() {
      return point;
    }

    public double ratioA() {
      return ratioA;
    }

    public double ratioB() {
      return ratioB;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Contact)) {
        return false;
      }
      Contact that = (Contact) other;
      return point.equals(that.point) && ratioA == that.ratioA && ratioB == that.ratioB;
    }

    @Override
    public int hashCode() {
      return 31 * (31 * point.hashCode() + Double.hashCode(ratioA)) + Double.hashCode(ratioB);
    }

    @Override
    public String toString() {
      return point + "@" + ratioA + "/" + ratioB;
    }
  }
}
