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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.layout.TreeNode.Adjacency;
import strata.layout.TreeNode.ClusterCrossing;
import strata.layout.order.MarkBuffer;

/**
 * Builds the {@link LayerHierarchy} of a ranked {@link ExtendedNestingGraph} whose edges all span
 * exactly one layer.
 *
 * <p>A cluster is active on every layer between the lowest and the highest rank of its members
 * and descendant members; the root is active everywhere. The tree of a layer has a compound node
 * per active cluster and a leaf per graph node of the layer.
 *
 * <p>Every input edge segment is recorded at every compound ancestor of its ends: as an upper
 * adjacency above its target and as a lower adjacency above its source. Every border segment of a
 * cluster is paired with the input edge segments between the same layers that pass the cluster
 * within an ancestor; each pair is a possible crossing decided by the child order of their lowest
 * common ancestor.
 */
public class LayerTreeBuilder {

  private static final Logger logger = LoggerFactory.getLogger(LayerTreeBuilder.class);

  private final ExtendedNestingGraph graph;
  private final ClusterCopy clusters;
  private final TreeLca lca;

  private TreeNode[] leaves;
  private int numberOfClusterCrossings = 0;

  public LayerTreeBuilder(final ExtendedNestingGraph graph) {
    this.graph = graph;
    this.clusters = graph.getClusters();
    this.lca = new TreeLca(this.clusters.numberOfClusters());
  }

  public LayerHierarchy build() {
    final int numberOfLayers = this.graph.numberOfLayers();
    final List<List<Integer>> layerNodes = this.graph.layers();
    this.leaves = new TreeNode[this.graph.nodeTableSize()];

    final List<LayerTree> trees = buildTrees(numberOfLayers, layerNodes);
    addAdjacencies();
    for (final LayerTree tree : trees) {
      tree.simplifyAdjacencies();
    }
    for (int i = 0; i + 1 < numberOfLayers; ++i) {
      addClusterCrossings(layerNodes.get(i));
    }

    final LayerHierarchy hierarchy = new LayerHierarchy(this.graph, trees, this.leaves);
    if (numberOfLayers > 0) {
      trees.get(0).assignPositions(this.graph);
    }
    logger.debug(String.format("Built %d layer trees with %d cluster crossing pairs",
        numberOfLayers, this.numberOfClusterCrossings));
    return hierarchy;
  }

  private List<LayerTree> buildTrees(final int numberOfLayers,
      final List<List<Integer>> layerNodes) {
    final int numberOfClusters = this.clusters.numberOfClusters();
    final int[] topRank = new int[numberOfClusters];
    final int[] bottomRank = new int[numberOfClusters];
    for (final int c : this.clusters.postOrder()) {
      topRank[c] = numberOfLayers;
      bottomRank[c] = -1;
      for (final int v : this.clusters.members(c)) {
        topRank[c] = Math.min(topRank[c], this.graph.rank(v));
        bottomRank[c] = Math.max(bottomRank[c], this.graph.rank(v));
      }
      for (final int child : this.clusters.children(c)) {
        topRank[c] = Math.min(topRank[c], topRank[child]);
        bottomRank[c] = Math.max(bottomRank[c], bottomRank[child]);
      }
    }

    final List<List<Integer>> clusterBegin = new ArrayList<>();
    final List<List<Integer>> clusterEnd = new ArrayList<>();
    for (int i = 0; i < numberOfLayers; ++i) {
      clusterBegin.add(new ArrayList<>());
      clusterEnd.add(new ArrayList<>());
    }
    final int root = this.clusters.rootCluster();
    for (int c = 0; c < numberOfClusters; ++c) {
      if (c != root && topRank[c] <= bottomRank[c]) {
        clusterBegin.get(topRank[c]).add(c);
        clusterEnd.get(bottomRank[c]).add(c);
      }
    }

    final Set<Integer> active = new LinkedHashSet<>();
    active.add(root);
    final TreeNode[] clusterNode = new TreeNode[numberOfClusters];
    final List<LayerTree> trees = new ArrayList<>(numberOfLayers);

    for (int i = 0; i < numberOfLayers; ++i) {
      active.addAll(clusterBegin.get(i));

      for (final int c : active) {
        clusterNode[c] = TreeNode.compound(c, clusterNode[c]);
      }
      final LayerTree tree = new LayerTree(i, clusterNode[root]);
      for (final int c : active) {
        tree.register(clusterNode[c]);
        if (c != root) {
          clusterNode[this.clusters.parent(c)].addChild(clusterNode[c]);
        }
      }

      for (final int v : layerNodes.get(i)) {
        final TreeNode leaf = TreeNode.leaf(v,
            this.graph.type(v) == NodeType.CLUSTER_TOP_BOTTOM);
        this.leaves[v] = leaf;
        clusterNode[this.graph.parentCluster(v)].addChild(leaf);
        tree.register(leaf);
      }
      trees.add(tree);

      active.removeAll(clusterEnd.get(i));
    }
    return trees;
  }

  private void addAdjacencies() {
    for (final int e : this.graph.edges()) {
      if (this.graph.origEdge(e) == ExtendedNestingGraph.NONE) {
        continue;
      }
      final int u = this.graph.source(e);
      final int v = this.graph.target(e);
      assert this.graph.rank(v) == this.graph.rank(u) + 1;

      TreeNode near = this.leaves[v];
      for (TreeNode p = near.getParent(); p != null; p = p.getParent()) {
        p.upperAdjacencies.add(new Adjacency(u, near, 1));
        near = p;
      }

      near = this.leaves[u];
      for (TreeNode p = near.getParent(); p != null; p = p.getParent()) {
        p.lowerAdjacencies.add(new Adjacency(v, near, 1));
        near = p;
      }
    }
  }

  /**
   * Pairs the border segments leaving a layer with the input edge segments leaving it.
   */
  private void addClusterCrossings(final List<Integer> layer) {
    // cluster of the lowest common compound node -> input edge segments
    final Map<Integer, List<Integer>> edgesAt = new HashMap<>();
    for (final int u : layer) {
      for (final int e : this.graph.outEdges(u)) {
        if (this.graph.origEdge(e) != ExtendedNestingGraph.NONE) {
          final TreeNode c = this.lca.lca(this.leaves[u], this.leaves[this.graph.target(e)]);
          edgesAt.computeIfAbsent(c.getCluster(), k -> new ArrayList<>()).add(e);
        }
      }
    }
    if (edgesAt.isEmpty()) {
      return;
    }

    for (final int u : layer) {
      for (final int e : this.graph.outEdges(u)) {
        if (this.graph.origEdge(e) == ExtendedNestingGraph.NONE) {
          addBorderCrossings(e, edgesAt, true);
          addBorderCrossings(e, edgesAt, false);
        }
      }
    }
  }

  /**
   * @param upper true to record the pairs at the target layer, false at the source layer
   */
  private void addBorderCrossings(final int border, final Map<Integer, List<Integer>> edgesAt,
      final boolean upper) {
    final int near = upper ? this.graph.target(border) : this.graph.source(border);
    final int far = upper ? this.graph.source(border) : this.graph.target(border);
    final TreeNode aNode = this.leaves[near];
    final int borderCluster = aNode.getParent().getCluster();

    for (TreeNode p = aNode.getParent().getParent(); p != null; p = p.getParent()) {
      for (final int e : edgesAt.getOrDefault(p.getCluster(), new ArrayList<>())) {
        final int eNear = upper ? this.graph.target(e) : this.graph.source(e);
        final int eFar = upper ? this.graph.source(e) : this.graph.target(e);

        final TreeNode cNode = this.lca.lca(aNode, this.leaves[eNear]);
        final TreeNode aChild = this.lca.uChild();
        final TreeNode eChild = this.lca.vChild();
        if (cNode == aNode.getParent()
            || this.lca.lca(aNode, this.leaves[eFar]).getCluster() == borderCluster) {
          continue;
        }

        final ClusterCrossing crossing = new ClusterCrossing(far, aChild, eFar, eChild, e);
        if (upper) {
          cNode.upperClusterCrossings.add(crossing);
        } else {
          cNode.lowerClusterCrossings.add(crossing);
        }
        ++this.numberOfClusterCrossings;
      }
    }
  }

  /**
   * Lowest common ancestor of two leaves, possibly on neighboring layers, where compound nodes of
   * the same cluster count as the same ancestor.
   */
  static final class TreeLca {

    private final MarkBuffer entry;
    private final List<TreeNode> entryChildren = new ArrayList<>();
    private TreeNode uChild;
    private TreeNode vChild;

    TreeLca(final int numberOfClusters) {
      this.entry = new MarkBuffer(numberOfClusters);
    }

    TreeNode lca(final TreeNode uNode, final TreeNode vNode) {
      this.entry.clear();
      this.entryChildren.clear();

      TreeNode cu = uNode.getParent();
      TreeNode cv = vNode.getParent();
      TreeNode uPred = uNode;
      TreeNode vPred = vNode;
      while (cu != null || cv != null) {
        if (cu != null) {
          if (this.entry.isMarked(cu.getCluster())) {
            this.uChild = uPred;
            this.vChild = this.entryChildren.get(this.entry.get(cu.getCluster()));
            return cu;
          }
          mark(cu, uPred);
          uPred = cu;
          cu = cu.getParent();
        }
        if (cv != null) {
          if (this.entry.isMarked(cv.getCluster())) {
            this.uChild = this.entryChildren.get(this.entry.get(cv.getCluster()));
            this.vChild = vPred;
            return cv;
          }
          mark(cv, vPred);
          vPred = cv;
          cv = cv.getParent();
        }
      }
      throw new IllegalStateException("Leaves without a common root");
    }

    private void mark(final TreeNode compound, final TreeNode child) {
      this.entry.mark(compound.getCluster(), this.entryChildren.size());
      this.entryChildren.add(child);
    }

    TreeNode uChild() {
      return this.uChild;
    }

    TreeNode vChild() {
      return this.vChild;
    }
  }
}
