/*
 * Copyright 2018 LinkedIn Corp.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package strata.layout.order;

/**
 * A number of crossings split into crossings between a cluster boundary and an edge and
 * crossings between two edges. Ordered lexicographically: fewer cluster crossings always win.
 */
public final class Crossings implements Comparable<Crossings> {

  public static final Crossings ZERO = new Crossings(0, 0);

  /**
   * Larger than any reachable count, used as the starting point of a minimum search.
   */
  public static final Crossings INFINITY = new Crossings(Integer.MAX_VALUE, Integer.MAX_VALUE);

  private final int clusterCrossings;
  private final int edgeCrossings;

  public Crossings(final int clusterCrossings, final int edgeCrossings) {
    this.clusterCrossings = clusterCrossings;
    this.edgeCrossings = edgeCrossings;
  }

  public int getClusterCrossings() {
    return this.clusterCrossings;
  }

  public int getEdgeCrossings() {
    return this.edgeCrossings;
  }

  public Crossings plus(final Crossings other) {
    if (this == INFINITY || other == INFINITY) {
      return INFINITY;
    }
    return new Crossings(this.clusterCrossings + other.clusterCrossings,
        this.edgeCrossings + other.edgeCrossings);
  }

  public Crossings minus(final Crossings other) {
    return new Crossings(this.clusterCrossings - other.clusterCrossings,
        this.edgeCrossings - other.edgeCrossings);
  }

  public boolean isZero() {
    return this.clusterCrossings == 0 && this.edgeCrossings == 0;
  }

  @Override
  public int compareTo(final Crossings other) {
    final int byClusters = Integer.compare(this.clusterCrossings, other.clusterCrossings);
    return byClusters != 0 ? byClusters : Integer.compare(this.edgeCrossings, other.edgeCrossings);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Crossings)) {
      return false;
    }
    final Crossings other = (Crossings) o;
    return this.clusterCrossings == other.clusterCrossings
        && this.edgeCrossings == other.edgeCrossings;
  }

  @Override
  public int hashCode() {
    return 31 * this.clusterCrossings + this.edgeCrossings;
  }

  @Override
  public String toString() {
    return "(" + this.clusterCrossings + "," + this.edgeCrossings + ")";
  }
}
