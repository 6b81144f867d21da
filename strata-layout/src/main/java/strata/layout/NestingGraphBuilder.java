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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.ClusterGraph;
import strata.layout.order.LevelMap;

/**
 * Builds the {@link ExtendedNestingGraph} of a cluster graph.
 *
 * <p>The containment skeleton links the top marker of every cluster to its members and to the top
 * markers of its child clusters, and symmetrically for the bottom markers. Input edges are added
 * next; an edge that would close a cycle is added reversed. Finally every edge between different
 * clusters is turned into an edge from the bottom of the cluster containing its source to the top
 * of the cluster containing its target, both clusters being children of the lowest common
 * ancestor. Where that is impossible it is relaxed to edges between a node and a cluster.
 *
 * <p>Each edge goes through a {@link LevelMap}, so the graph is acyclic after every insertion.
 */
public class NestingGraphBuilder {

  private static final Logger logger = LoggerFactory.getLogger(NestingGraphBuilder.class);

  private final ClusterGraph input;
  private final ExtendedNestingGraph graph;
  private final LevelMap levels;
  private final ClusterLca lca;

  private int numberOfReversed = 0;
  private int numberOfRelaxed = 0;

  public NestingGraphBuilder(final ClusterGraph input) {
    this.input = input;
    this.graph = new ExtendedNestingGraph(input);
    this.lca = new ClusterLca(input);

    final int[] initialLevel = new int[this.graph.nodeTableSize()];
    assignInitialLevels(input.rootCluster(), initialLevel, new int[]{0});
    this.levels = new LevelMap(initialLevel.length);
    for (final int level : initialLevel) {
      this.levels.addNode(level);
    }
  }

  /**
   * Numbers the skeleton in pre order: top marker, members, child clusters, bottom marker. Every
   * skeleton edge goes from a lower to a higher number.
   */
  private void assignInitialLevels(final int c, final int[] level, final int[] count) {
    level[this.graph.top(c)] = count[0]++;
    for (final int v : this.input.nodes(c)) {
      level[this.graph.copy(v)] = count[0]++;
    }
    for (final int child : this.input.children(c)) {
      assignInitialLevels(child, level, count);
    }
    level[this.graph.bottom(c)] = count[0]++;
  }

  public ExtendedNestingGraph build() {
    addContainmentSkeleton();
    addAdjacencyEdges();
    addClusterRelations();

    logger.debug(String.format("Built %s, reversed edges: %d, relaxed cluster relations: %d",
        this.graph, this.numberOfReversed, this.numberOfRelaxed));
    return this.graph;
  }

  private void addContainmentSkeleton() {
    for (int v = 0; v < this.input.numberOfNodes(); ++v) {
      final int c = this.input.clusterOf(v);
      addSkeletonEdge(this.graph.top(c), this.graph.copy(v));
      addSkeletonEdge(this.graph.copy(v), this.graph.bottom(c));
    }

    for (int c = 0; c < this.input.numberOfClusters(); ++c) {
      if (c == this.input.rootCluster()) {
        continue;
      }
      final int p = this.input.parent(c);
      addSkeletonEdge(this.graph.top(p), this.graph.top(c));
      addSkeletonEdge(this.graph.bottom(c), this.graph.bottom(p));
      addSkeletonEdge(this.graph.top(c), this.graph.bottom(c));
    }
  }

  private void addSkeletonEdge(final int u, final int v) {
    final boolean added = this.levels.tryAdd(u, v);
    assert added : "skeleton edges follow the initial levels";
    this.graph.newEdge(u, v);
  }

  private void addAdjacencyEdges() {
    for (int e = 0; e < this.input.numberOfEdges(); ++e) {
      final int u = this.graph.copy(this.input.source(e));
      final int v = this.graph.copy(this.input.target(e));

      final int eH;
      if (this.levels.insert(u, v)) {
        eH = this.graph.newEdge(u, v);
      } else {
        eH = this.graph.newEdge(v, u);
        this.graph.setReversed(e);
        ++this.numberOfReversed;
      }
      this.graph.appendToChain(e, eH);
    }
  }

  private void addClusterRelations() {
    for (int e = 0; e < this.input.numberOfEdges(); ++e) {
      int u = this.input.source(e);
      int v = this.input.target(e);
      if (this.graph.isReversed(e)) {
        final int swap = u;
        u = v;
        v = swap;
      }

      if (this.input.clusterOf(u) == this.input.clusterOf(v)) {
        continue;
      }

      final int c = this.lca.lcaOfNodes(u, v);
      final int cFrom = this.lca.uChild();
      final int cTo = this.lca.vChild();

      // the clusters shall be drawn above each other
      if (cFrom != c && cTo != c && tryEdge(this.graph.bottom(cFrom), this.graph.top(cTo))) {
        continue;
      }

      // otherwise relate the nodes to the clusters
      ++this.numberOfRelaxed;
      tryEdge(this.graph.copy(u), this.graph.top(cTo));
      tryEdge(this.graph.bottom(cFrom), this.graph.copy(v));
    }
  }

  private boolean tryEdge(final int u, final int v) {
    if (this.levels.tryAdd(u, v)) {
      this.graph.newEdge(u, v);
      return true;
    }
    return false;
  }
}
