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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns weighted pairwise preferences into a total order.
 *
 * <p>{@code cost[j][k]} is the number of crossings caused by placing j left of k. For every pair
 * the cheaper direction is preferred. Preferences are inserted into a {@link LevelMap} sorted by
 * ascending margin {@code cost[k][j] - cost[j][k]}; a preference that would close a cycle is
 * overruled and charged its reverse cost. Fixed constraints are inserted before any preference and
 * always hold in the result.
 */
public final class OrderingTournament {

  private OrderingTournament() {
  }

  /**
   * @param cost n x n matrix of crossings, the diagonal is ignored
   * @param constraints pairs {@code {left, right}} that must hold; they must be acyclic
   */
  public static Result resolve(final Crossings[][] cost, final List<int[]> constraints) {
    final int n = cost.length;
    final LevelMap order = new LevelMap(n);
    for (int j = 0; j < n; ++j) {
      order.addNode();
    }

    for (final int[] constraint : constraints) {
      final boolean added = order.tryAdd(constraint[0], constraint[1]);
      checkArgument(added, "Constraint %s -> %s closes a cycle", constraint[0], constraint[1]);
    }

    final List<Preference> preferences = new ArrayList<>(n * (n - 1) / 2);
    for (int j = 0; j < n; ++j) {
      for (int k = j + 1; k < n; ++k) {
        if (cost[j][k].compareTo(cost[k][j]) <= 0) {
          preferences.add(new Preference(j, k, cost[j][k], cost[k][j]));
        } else {
          preferences.add(new Preference(k, j, cost[k][j], cost[j][k]));
        }
      }
    }
    preferences.sort((x, y) -> x.margin().compareTo(y.margin()));

    Crossings total = Crossings.ZERO;
    for (final Preference p : preferences) {
      if (order.insert(p.left, p.right)) {
        total = total.plus(p.cost);
      } else {
        total = total.plus(p.reverseCost);
      }
    }

    return new Result(order.topologicalNumbering(), total);
  }

  private static final class Preference {

    private final int left;
    private final int right;
    private final Crossings cost;
    private final Crossings reverseCost;

    private Preference(final int left, final int right, final Crossings cost,
        final Crossings reverseCost) {
      this.left = left;
      this.right = right;
      this.cost = cost;
      this.reverseCost = reverseCost;
    }

    private Crossings margin() {
      return this.reverseCost.minus(this.cost);
    }
  }

  public static final class Result {

    private final int[] position;
    private final Crossings crossings;

    Result(final int[] position, final Crossings crossings) {
      this.position = position;
      this.crossings = crossings;
    }

    /**
     * @return the new position of every element
     */
    public int[] getPosition() {
      return this.position;
    }

    /**
     * @return the crossings between pairs of elements in the resolved order
     */
    public Crossings getCrossings() {
      return this.crossings;
    }
  }
}
