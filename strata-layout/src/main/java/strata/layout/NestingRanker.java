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

import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.ClusterGraph;

/**
 * Assigns the layers of an {@link ExtendedNestingGraph}.
 *
 * <p>Edges between two nodes or between two markers need a length of two, edges between a node
 * and a marker a length of one, so every cluster keeps an empty layer of margin around its
 * content. Input edges cost twice as much as structural edges. After ranking, the markers of
 * every cluster are pulled as close to its content as the margins allow, all structural edges
 * except the top to bottom span of each cluster are removed, the root markers are deleted and
 * empty layers are squeezed out.
 */
public class NestingRanker {

  private static final Logger logger = LoggerFactory.getLogger(NestingRanker.class);

  private final RankingPrimitive ranking;

  public NestingRanker(final RankingPrimitive ranking) {
    this.ranking = ranking;
  }

  public void rank(final ExtendedNestingGraph graph) {
    final List<Integer> edges = graph.edges();
    final int m = edges.size();
    final int[] sources = new int[m];
    final int[] targets = new int[m];
    final int[] lengths = new int[m];
    final int[] costs = new int[m];
    for (int i = 0; i < m; ++i) {
      final int e = edges.get(i);
      sources[i] = graph.source(e);
      targets[i] = graph.target(e);
      final boolean sourceIsNode = graph.type(sources[i]) == NodeType.NODE;
      final boolean targetIsNode = graph.type(targets[i]) == NodeType.NODE;
      lengths[i] = sourceIsNode == targetIsNode ? 2 : 1;
      costs[i] = graph.origEdge(e) != ExtendedNestingGraph.NONE ? 2 : 1;
    }

    final int[] rank = this.ranking.rank(graph.nodeTableSize(), sources, targets, lengths, costs);
    checkRanking(rank, graph.nodeTableSize(), sources, targets, lengths);
    for (final int v : graph.nodes()) {
      graph.setRank(v, rank[v]);
    }

    tightenClusters(graph);
    removeStructuralEdges(graph);
    compact(graph);
    logger.debug(String.format("Ranked %s", graph));
  }

  private static void checkRanking(final int[] rank, final int numberOfNodes,
      final int[] sources, final int[] targets, final int[] lengths) {
    if (rank == null || rank.length != numberOfNodes) {
      throw new LayoutException(String.format("Ranking returned %s ranks for %d nodes",
          rank == null ? "no" : String.valueOf(rank.length), numberOfNodes));
    }
    for (int i = 0; i < sources.length; ++i) {
      if (rank[targets[i]] - rank[sources[i]] < lengths[i]) {
        throw new LayoutException(String.format("Ranking violates the length %d of edge %d -> %d "
            + "(ranks %d, %d)", lengths[i], sources[i], targets[i], rank[sources[i]],
            rank[targets[i]]));
      }
    }
  }

  /**
   * Moves the markers of every cluster next to its content: one layer around its member nodes and
   * two layers around the markers of its child clusters.
   */
  private static void tightenClusters(final ExtendedNestingGraph graph) {
    final ClusterGraph input = graph.getOriginal();
    for (final int c : input.postOrderClusters()) {
      int top = Integer.MAX_VALUE;
      int bottom = Integer.MIN_VALUE;
      for (final int v : input.nodes(c)) {
        final int r = graph.rank(graph.copy(v));
        top = Math.min(top, r - 1);
        bottom = Math.max(bottom, r + 1);
      }
      for (final int child : input.children(c)) {
        top = Math.min(top, graph.rank(graph.top(child)) - 2);
        bottom = Math.max(bottom, graph.rank(graph.bottom(child)) + 2);
      }

      assert graph.rank(graph.top(c)) <= top;
      assert bottom <= graph.rank(graph.bottom(c));
      if (top < Integer.MAX_VALUE) {
        graph.setRank(graph.top(c), top);
        graph.setRank(graph.bottom(c), bottom);
      }
    }
  }

  private static void removeStructuralEdges(final ExtendedNestingGraph graph) {
    final ClusterGraph input = graph.getOriginal();
    for (final int e : graph.edges()) {
      if (graph.origEdge(e) != ExtendedNestingGraph.NONE) {
        continue;
      }
      final int c = graph.markedCluster(graph.source(e));
      final boolean isSpan = c != ClusterGraph.NO_CLUSTER && graph.source(e) == graph.top(c)
          && graph.target(e) == graph.bottom(c);
      if (!isSpan) {
        graph.delEdge(e);
      }
    }

    final int root = input.rootCluster();
    graph.delNode(graph.top(root));
    graph.delNode(graph.bottom(root));
  }

  /**
   * Renumbers the used layers densely from zero.
   */
  private static void compact(final ExtendedNestingGraph graph) {
    final TreeSet<Integer> used = new TreeSet<>();
    for (final int v : graph.nodes()) {
      used.add(graph.rank(v));
    }
    final int[] dense = new int[used.isEmpty() ? 0 : used.last() - used.first() + 1];
    int layer = 0;
    for (final int r : used) {
      dense[r - used.first()] = layer++;
    }
    for (final int v : graph.nodes()) {
      graph.setRank(v, dense[graph.rank(v) - used.first()]);
    }
    graph.setNumberOfLayers(layer);
  }
}
