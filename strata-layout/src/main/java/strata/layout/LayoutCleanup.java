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

import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.ClusterGraph;
import strata.layout.TreeNode.ClusterCrossing;

/**
 * Removes the layout aids once the order is final and assigns the final positions.
 *
 * <p>First every input edge segment gets its vertical flag: a segment between two long edge
 * dummies that stays in one cluster, or passes a cluster border through the bottom or top of a
 * cluster, may be drawn vertically unless it crosses a cluster border in the final order. Then
 * the border dummies are deleted from the trees and the graph and every layer is renumbered.
 * Calling {@link #cleanUp()} again changes nothing.
 */
public class LayoutCleanup {

  private static final Logger logger = LoggerFactory.getLogger(LayoutCleanup.class);

  private final LayerHierarchy hierarchy;
  private final ExtendedNestingGraph graph;

  public LayoutCleanup(final LayerHierarchy hierarchy) {
    this.hierarchy = hierarchy;
    this.graph = hierarchy.getGraph();
  }

  public void cleanUp() {
    if (!this.graph.isVerticalComputed()) {
      computeVertical();
      this.graph.markVerticalComputed();
    }

    this.hierarchy.removeAuxNodes();
    int deleted = 0;
    for (final int v : this.graph.nodes()) {
      if (this.graph.type(v) == NodeType.CLUSTER_TOP_BOTTOM) {
        this.graph.delNode(v);
        ++deleted;
      }
    }
    this.hierarchy.assignAllPositions();

    if (deleted > 0) {
      logger.debug(String.format("Deleted %d border dummies", deleted));
    }
  }

  private void computeVertical() {
    for (final int e : this.graph.edges()) {
      if (this.graph.origEdge(e) != ExtendedNestingGraph.NONE) {
        this.graph.setVertical(e, isVerticalCandidate(e));
      }
    }

    for (int i = 1; i < this.hierarchy.numberOfLayers(); ++i) {
      final Deque<TreeNode> stack = new ArrayDeque<>();
      stack.push(this.hierarchy.layer(i).getRoot());
      while (!stack.isEmpty()) {
        final TreeNode cNode = stack.pop();
        cNode.setPos();
        for (final ClusterCrossing cc : cNode.getUpperClusterCrossings()) {
          if (cc.isCrossing(this.graph)) {
            this.graph.setVertical(cc.getEdge(), false);
          }
        }
        for (final TreeNode child : cNode.getChildren()) {
          if (child.isCompound()) {
            stack.push(child);
          }
        }
      }
    }
  }

  private boolean isVerticalCandidate(final int e) {
    final int u = this.graph.source(e);
    final int v = this.graph.target(e);
    if (!this.graph.isLongEdgeDummy(u) || !this.graph.isLongEdgeDummy(v)) {
      return false;
    }

    final ClusterCopy clusters = this.graph.getClusters();
    int cu = this.graph.parentCluster(u);
    while (clusters.isVirtual(cu)) {
      cu = clusters.parent(cu);
    }
    int cv = this.graph.parentCluster(v);
    while (clusters.isVirtual(cv)) {
      cv = clusters.parent(cv);
    }
    if (cu == cv) {
      return true;
    }

    final ClusterGraph input = this.graph.getOriginal();
    final int cuOrig = clusters.original(cu);
    final int cvOrig = clusters.original(cv);
    final int cuOrigParent = input.parent(cuOrig);
    final int cvOrigParent = input.parent(cvOrig);

    // leaving cu through its bottom into the parent
    if (cvOrig == cuOrigParent && this.graph.rank(u) == bottomRank(cuOrig)) {
      return true;
    }
    // entering cv through its top from the parent
    if (cuOrig == cvOrigParent && this.graph.rank(v) == topRank(cvOrig)) {
      return true;
    }
    // from the bottom of cu to the top of its sibling cv
    return cuOrigParent == cvOrigParent && this.graph.rank(u) == bottomRank(cuOrig)
        && this.graph.rank(v) == topRank(cvOrig);
  }

  private int topRank(final int cOrig) {
    return this.graph.rank(this.graph.top(cOrig));
  }

  private int bottomRank(final int cOrig) {
    return this.graph.rank(this.graph.bottom(cOrig));
  }
}
