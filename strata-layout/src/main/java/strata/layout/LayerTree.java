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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import strata.layout.TreeNode.Adjacency;

/**
 * The hierarchy tree of one layer. Its compound nodes mirror the clusters active on the layer, its
 * leaves are the graph nodes of the layer. The left to right order of the leaves is the order of
 * the layer.
 */
public class LayerTree {

  private static final Comparator<Adjacency> ADJACENCY_ORDER = Comparator
      .comparingInt(Adjacency::getFarNode)
      .thenComparing(Adjacency::getChild, Comparator
          .comparingInt((TreeNode n) -> n.isCompound() ? 0 : 1)
          .thenComparingInt(n -> n.isCompound() ? n.getCluster() : n.getNode()));

  private final int layer;
  private final TreeNode root;
  // every tree node of the layer, compound nodes and leaves
  private final List<TreeNode> nodes = new ArrayList<>();

  LayerTree(final int layer, final TreeNode root) {
    this.layer = layer;
    this.root = root;
  }

  public int getLayer() {
    return this.layer;
  }

  public TreeNode getRoot() {
    return this.root;
  }

  public List<TreeNode> getNodes() {
    return Collections.unmodifiableList(this.nodes);
  }

  void register(final TreeNode treeNode) {
    this.nodes.add(treeNode);
  }

  /**
   * @return the compound nodes in breadth first order
   */
  public List<TreeNode> compounds() {
    final List<TreeNode> compounds = new ArrayList<>();
    final Deque<TreeNode> queue = new ArrayDeque<>();
    queue.add(this.root);
    while (!queue.isEmpty()) {
      final TreeNode p = queue.poll();
      compounds.add(p);
      for (final TreeNode child : p.getChildren()) {
        if (child.isCompound()) {
          queue.add(child);
        }
      }
    }
    return compounds;
  }

  /**
   * @return the graph nodes of the layer from left to right
   */
  public List<Integer> leafOrder() {
    final List<Integer> order = new ArrayList<>();
    collectLeaves(this.root, order);
    return order;
  }

  private static void collectLeaves(final TreeNode treeNode, final List<Integer> order) {
    if (treeNode.isCompound()) {
      for (final TreeNode child : treeNode.getChildren()) {
        collectLeaves(child, order);
      }
    } else {
      order.add(treeNode.getNode());
    }
  }

  /**
   * Writes the left to right index of every leaf into the graph.
   */
  void assignPositions(final ExtendedNestingGraph graph) {
    final List<Integer> order = leafOrder();
    for (int i = 0; i < order.size(); ++i) {
      graph.setPosition(order.get(i), i);
    }
  }

  void store() {
    for (final TreeNode p : compounds()) {
      p.store();
    }
  }

  void restore() {
    for (final TreeNode p : compounds()) {
      p.restore();
    }
  }

  void permute(final Random random) {
    for (final TreeNode p : compounds()) {
      p.permute(random);
    }
  }

  void removeAuxNodes() {
    for (final TreeNode p : compounds()) {
      p.removeAuxChildren();
    }
    this.nodes.removeIf(n -> n.getKind() == TreeNode.Kind.AUX);
  }

  /**
   * Merges adjacencies with the same far node and the same child into one weighted adjacency.
   */
  void simplifyAdjacencies() {
    for (final TreeNode p : compounds()) {
      simplify(p.upperAdjacencies);
      simplify(p.lowerAdjacencies);
    }
  }

  static void simplify(final List<Adjacency> adjacencies) {
    if (adjacencies.size() < 2) {
      return;
    }
    adjacencies.sort(ADJACENCY_ORDER);

    final List<Adjacency> merged = new ArrayList<>(adjacencies.size());
    Adjacency last = null;
    for (final Adjacency adj : adjacencies) {
      if (last != null && last.getFarNode() == adj.getFarNode()
          && last.getChild() == adj.getChild()) {
        last.addWeight(adj.getWeight());
      } else {
        merged.add(adj);
        last = adj;
      }
    }
    adjacencies.clear();
    adjacencies.addAll(merged);
  }

  @Override
  public String toString() {
    return this.layer + ": " + this.root;
  }
}
