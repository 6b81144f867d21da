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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.ClusterGraph;

/**
 * Splits every edge spanning more than one layer into a chain of dummy nodes, one per inner
 * layer, and decides which cluster hosts each dummy.
 *
 * <p>All dummies of an input edge start in the lowest common cluster of its end nodes. The dummies
 * near each end then move into the clusters around that end as long as the layers allow: a dummy
 * next to the source end joins every cluster whose bottom marker is not above it, a dummy next to
 * the target end every cluster whose top marker is not below it.
 *
 * <p>The span edges of the clusters are split as well; their dummies belong to the cluster itself
 * and mark its left or right border on inner layers.
 */
public class DummyNodeInserter {

  private static final Logger logger = LoggerFactory.getLogger(DummyNodeInserter.class);

  private final ExtendedNestingGraph graph;
  private final ClusterGraph input;
  private final ClusterLca lca;

  private int numberOfDummies = 0;

  public DummyNodeInserter(final ExtendedNestingGraph graph) {
    this.graph = graph;
    this.input = graph.getOriginal();
    this.lca = new ClusterLca(this.input);
  }

  public void insertDummies() {
    for (int e = 0; e < this.input.numberOfEdges(); ++e) {
      splitEdge(e);
    }
    final int longEdgeDummies = this.numberOfDummies;

    for (int c = 0; c < this.input.numberOfClusters(); ++c) {
      if (c != this.input.rootCluster()) {
        splitSpan(c);
      }
    }
    logger.debug(String.format("Inserted %d long edge dummies and %d boundary dummies",
        longEdgeDummies, this.numberOfDummies - longEdgeDummies));
  }

  private void splitEdge(final int e) {
    int eH = this.graph.chain(e).get(0);
    final int uH = this.graph.source(eH);
    final int vH = this.graph.target(eH);

    final int span = this.graph.rank(vH) - this.graph.rank(uH);
    assert span >= 1;
    if (span < 2) {
      return;
    }

    final int u = this.graph.origNode(uH);
    final int v = this.graph.origNode(vH);
    final int cTop = this.lca.lcaOfNodes(u, v);
    final ClusterCopy clusters = this.graph.getClusters();

    for (int i = this.graph.rank(uH) + 1; i < this.graph.rank(vH); ++i) {
      eH = this.graph.split(eH);
      this.graph.appendToChain(e, eH);
      this.graph.setRank(this.graph.source(eH), i);
      clusters.setParent(this.graph.source(eH), clusters.copy(cTop));
      ++this.numberOfDummies;
    }

    refineHosts(e, uH, vH, u, v);
  }

  /**
   * Finds the outermost clusters around each end that may still host dummies of the edge and
   * moves the dummies into them.
   */
  private void refineHosts(final int e, final int uH, final int vH, final int u, final int v) {
    final int root = this.input.rootCluster();
    final int rankU = this.graph.rank(uH);
    final int rankV = this.graph.rank(vH);
    int c1 = this.input.clusterOf(u);
    int c2 = this.input.clusterOf(v);

    if (c1 == root || c2 == root || bottomRank(c1) >= topRank(c2)) {
      // only one side may host dummies, the target side is tried first
      if (c2 != root && rankU < topRank(c2)) {
        c1 = ClusterGraph.NO_CLUSTER;
        while (this.input.parent(c2) != root && rankU < topRank(this.input.parent(c2))) {
          c2 = this.input.parent(c2);
        }
      } else if (c1 != root && rankV > bottomRank(c1)) {
        c2 = ClusterGraph.NO_CLUSTER;
        while (this.input.parent(c1) != root && rankV > bottomRank(this.input.parent(c1))) {
          c1 = this.input.parent(c1);
        }
      } else {
        // all dummies stay in the common cluster
        return;
      }
    } else {
      boolean grown;
      do {
        grown = false;
        int parent = this.input.parent(c1);
        if (parent != root && bottomRank(parent) < topRank(c2)) {
          c1 = parent;
          grown = true;
        }
        parent = this.input.parent(c2);
        if (parent != root && bottomRank(c1) < topRank(parent)) {
          c2 = parent;
          grown = true;
        }
      } while (grown);
    }

    final List<Integer> chain = this.graph.chain(e);
    final ClusterCopy clusters = this.graph.getClusters();
    if (c1 != ClusterGraph.NO_CLUSTER) {
      int i = 0;
      final int stop = this.input.parent(c1);
      for (int c = this.input.clusterOf(u); c != stop; c = this.input.parent(c)) {
        while (i < chain.size() - 1 && this.graph.rank(this.graph.target(chain.get(i)))
            <= bottomRank(c)) {
          clusters.setParent(this.graph.target(chain.get(i)), clusters.copy(c));
          ++i;
        }
      }
    }

    if (c2 != ClusterGraph.NO_CLUSTER) {
      int i = chain.size() - 1;
      final int stop = this.input.parent(c2);
      for (int c = this.input.clusterOf(v); c != stop; c = this.input.parent(c)) {
        while (i > 0 && this.graph.rank(this.graph.source(chain.get(i))) >= topRank(c)) {
          clusters.setParent(this.graph.source(chain.get(i)), clusters.copy(c));
          --i;
        }
      }
    }
  }

  private int topRank(final int c) {
    return this.graph.rank(this.graph.top(c));
  }

  private int bottomRank(final int c) {
    return this.graph.rank(this.graph.bottom(c));
  }

  private void splitSpan(final int c) {
    final int top = this.graph.top(c);
    final int bottom = this.graph.bottom(c);
    for (final int e : this.graph.outEdges(top)) {
      if (this.graph.target(e) != bottom) {
        continue;
      }

      final int span = this.graph.rank(bottom) - this.graph.rank(top);
      assert span >= 1;
      int eH = e;
      for (int i = this.graph.rank(top) + 1; i < this.graph.rank(bottom); ++i) {
        eH = this.graph.split(eH);
        final int w = this.graph.source(eH);
        this.graph.setRank(w, i);
        this.graph.setType(w, NodeType.CLUSTER_TOP_BOTTOM);
        this.graph.getClusters().setParent(w, this.graph.getClusters().copy(c));
        ++this.numberOfDummies;
      }
      return;
    }
  }
}
