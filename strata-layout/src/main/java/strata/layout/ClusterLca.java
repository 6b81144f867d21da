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

import strata.graph.ClusterGraph;
import strata.layout.order.MarkBuffer;

/**
 * Lowest common ancestor queries on the cluster tree of a {@link ClusterGraph}.
 *
 * <p>Two walks climb alternately from both clusters and mark every cluster they pass with the
 * child they came from. The first cluster found marked by the other walk is the answer. Besides
 * the ancestor a query yields the children of the ancestor on both paths; a path that starts at
 * the ancestor itself yields the ancestor.
 */
class ClusterLca {

  private final ClusterGraph graph;
  private final MarkBuffer entryChild;

  private int uChild;
  private int vChild;

  ClusterLca(final ClusterGraph graph) {
    this.graph = graph;
    this.entryChild = new MarkBuffer(graph.numberOfClusters());
  }

  /**
   * @return the lowest common ancestor of the clusters of two input nodes
   */
  int lcaOfNodes(final int u, final int v) {
    return lca(this.graph.clusterOf(u), this.graph.clusterOf(v));
  }

  int lca(final int cu, final int cv) {
    this.entryChild.clear();

    int c1 = cu;
    int pred1 = cu;
    int c2 = cv;
    int pred2 = cv;
    while (true) {
      if (c1 != ClusterGraph.NO_CLUSTER) {
        if (this.entryChild.isMarked(c1)) {
          this.uChild = pred1;
          this.vChild = this.entryChild.get(c1);
          return c1;
        }
        this.entryChild.mark(c1, pred1);
        pred1 = c1;
        c1 = this.graph.parent(c1);
      }
      if (c2 != ClusterGraph.NO_CLUSTER) {
        if (this.entryChild.isMarked(c2)) {
          this.uChild = this.entryChild.get(c2);
          this.vChild = pred2;
          return c2;
        }
        this.entryChild.mark(c2, pred2);
        pred2 = c2;
        c2 = this.graph.parent(c2);
      }
    }
  }

  /**
   * @return the child of the last ancestor on the path from the first cluster
   */
  int uChild() {
    return this.uChild;
  }

  /**
   * @return the child of the last ancestor on the path from the second cluster
   */
  int vChild() {
    return this.vChild;
  }
}
