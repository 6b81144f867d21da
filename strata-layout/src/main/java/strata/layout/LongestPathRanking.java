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

package strata.layout;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.Constants;

/**
 * Default {@link RankingPrimitive}.
 *
 * <p>Starts from the longest path ranking, which puts every node on the highest layer its
 * predecessors allow, and then balances it: a node whose outgoing edges cost more than its
 * incoming edges moves down as far as its successors allow, and the other way round. Every move
 * shortens the total weighted edge length, so balancing terminates; it also stops after a fixed
 * number of passes.
 */
public class LongestPathRanking implements RankingPrimitive {

  private static final Logger logger = LoggerFactory.getLogger(LongestPathRanking.class);

  private final int maxPasses;

  public LongestPathRanking() {
    this(Constants.DEFAULT_RANKING_MAX_PASSES);
  }

  public LongestPathRanking(final int maxPasses) {
    checkArgument(maxPasses >= 0, "maxPasses must be >= 0");
    this.maxPasses = maxPasses;
  }

  @Override
  public int[] rank(final int numberOfNodes, final int[] sources, final int[] targets,
      final int[] lengths, final int[] costs) {
    final List<List<Integer>> out = new ArrayList<>(numberOfNodes);
    final List<List<Integer>> in = new ArrayList<>(numberOfNodes);
    for (int v = 0; v < numberOfNodes; ++v) {
      out.add(new ArrayList<>());
      in.add(new ArrayList<>());
    }
    for (int e = 0; e < sources.length; ++e) {
      out.get(sources[e]).add(e);
      in.get(targets[e]).add(e);
    }

    final int[] order = topologicalOrder(numberOfNodes, sources.length, targets, out, in);

    final int[] rank = new int[numberOfNodes];
    for (final int v : order) {
      for (final int e : in.get(v)) {
        rank[v] = Math.max(rank[v], rank[sources[e]] + lengths[e]);
      }
    }

    int pass = 0;
    boolean moved = true;
    while (moved && pass < this.maxPasses) {
      moved = false;
      ++pass;
      for (int i = order.length - 1; i >= 0; --i) {
        moved |= balance(order[i], rank, sources, targets, lengths, costs, out, in);
      }
    }
    logger.debug(String.format("Balanced ranking of %d nodes in %d passes", numberOfNodes, pass));

    normalize(rank);
    return rank;
  }

  private static int[] topologicalOrder(final int numberOfNodes, final int numberOfEdges,
      final int[] targets, final List<List<Integer>> out, final List<List<Integer>> in) {
    final int[] indegree = new int[numberOfNodes];
    final Deque<Integer> ready = new ArrayDeque<>();
    for (int v = 0; v < numberOfNodes; ++v) {
      indegree[v] = in.get(v).size();
      if (indegree[v] == 0) {
        ready.add(v);
      }
    }

    final int[] order = new int[numberOfNodes];
    int count = 0;
    while (!ready.isEmpty()) {
      final int v = ready.poll();
      order[count++] = v;
      for (final int e : out.get(v)) {
        if (--indegree[targets[e]] == 0) {
          ready.add(targets[e]);
        }
      }
    }

    if (count < numberOfNodes) {
      throw new LayoutException(String.format("Ranking infeasible: %d of %d nodes lie on a cycle "
          + "of %d edges", numberOfNodes - count, numberOfNodes, numberOfEdges));
    }
    return order;
  }

  /**
   * Moves a node to the end of its feasible interval that its heavier side pulls it to.
   *
   * @return true if the node moved
   */
  private static boolean balance(final int v, final int[] rank, final int[] sources,
      final int[] targets, final int[] lengths, final int[] costs, final List<List<Integer>> out,
      final List<List<Integer>> in) {
    int inCost = 0;
    int lowest = Integer.MIN_VALUE;
    for (final int e : in.get(v)) {
      inCost += costs[e];
      lowest = Math.max(lowest, rank[sources[e]] + lengths[e]);
    }
    int outCost = 0;
    int highest = Integer.MAX_VALUE;
    for (final int e : out.get(v)) {
      outCost += costs[e];
      highest = Math.min(highest, rank[targets[e]] - lengths[e]);
    }

    if (inCost > outCost && lowest != Integer.MIN_VALUE && lowest < rank[v]) {
      rank[v] = lowest;
      return true;
    }
    if (outCost > inCost && highest != Integer.MAX_VALUE && highest > rank[v]) {
      rank[v] = highest;
      return true;
    }
    return false;
  }

  private static void normalize(final int[] rank) {
    int min = Integer.MAX_VALUE;
    for (final int r : rank) {
      min = Math.min(min, r);
    }
    for (int v = 0; v < rank.length; ++v) {
      rank[v] -= min;
    }
  }
}
