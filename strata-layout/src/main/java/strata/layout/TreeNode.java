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
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * A node of a {@link LayerTree}: either a compound node standing for a cluster active on the layer,
 * or a leaf standing for a graph node of the layer.
 *
 * <p>The order of the children of a compound node is the left to right order of the layout.
 * Compound nodes collect the adjacencies of their subtrees to the layers above and below and the
 * crossings between cluster borders and edges that their child order decides.
 */
public class TreeNode {

  public enum Kind {
    COMPOUND,
    NODE,
    // a border dummy of a cluster, removed after crossing reduction
    AUX
  }

  /**
   * An edge between the subtree {@code child} and the graph node {@code farNode} on the
   * neighboring layer, weighted by the number of such edges.
   */
  public static final class Adjacency {

    private final int farNode;
    private final TreeNode child;
    private int weight;

    Adjacency(final int farNode, final TreeNode child, final int weight) {
      this.farNode = farNode;
      this.child = child;
      this.weight = weight;
    }

    public int getFarNode() {
      return this.farNode;
    }

    public TreeNode getChild() {
      return this.child;
    }

    public int getWeight() {
      return this.weight;
    }

    void addWeight(final int w) {
      this.weight += w;
    }
  }

  /**
   * A possible crossing between a cluster border segment and an input edge segment. The border
   * segment runs from {@code clusterFarNode} on the neighboring layer into the subtree
   * {@code clusterChild}, the edge segment from {@code edgeFarNode} into {@code edgeChild}.
   */
  public static final class ClusterCrossing {

    private final int clusterFarNode;
    private final TreeNode clusterChild;
    private final int edgeFarNode;
    private final TreeNode edgeChild;
    private final int edge;

    ClusterCrossing(final int clusterFarNode, final TreeNode clusterChild, final int edgeFarNode,
        final TreeNode edgeChild, final int edge) {
      this.clusterFarNode = clusterFarNode;
      this.clusterChild = clusterChild;
      this.edgeFarNode = edgeFarNode;
      this.edgeChild = edgeChild;
      this.edge = edge;
    }

    public int getClusterFarNode() {
      return this.clusterFarNode;
    }

    public TreeNode getClusterChild() {
      return this.clusterChild;
    }

    public int getEdgeFarNode() {
      return this.edgeFarNode;
    }

    public TreeNode getEdgeChild() {
      return this.edgeChild;
    }

    /**
     * @return the graph edge of the input edge segment
     */
    public int getEdge() {
      return this.edge;
    }

    /**
     * @return true if the current order makes the border cross the edge
     */
    boolean isCrossing(final ExtendedNestingGraph graph) {
      final int j = this.clusterChild.pos;
      final int k = this.edgeChild.pos;
      final int posJ = graph.position(this.clusterFarNode);
      final int posK = graph.position(this.edgeFarNode);
      return (j < k && posJ > posK) || (j > k && posJ < posK);
    }
  }

  private final Kind kind;
  // copy cluster of a compound node
  private final int cluster;
  // graph node of a leaf
  private final int node;

  private TreeNode parent;
  private final List<TreeNode> children = new ArrayList<>();
  // child order saved by store(), null before the first store
  private List<TreeNode> storedChildren;
  private int pos;

  // compound node of the same cluster on the previous and the next layer
  private TreeNode up;
  private TreeNode down;

  final List<Adjacency> upperAdjacencies = new ArrayList<>();
  final List<Adjacency> lowerAdjacencies = new ArrayList<>();
  final List<ClusterCrossing> upperClusterCrossings = new ArrayList<>();
  final List<ClusterCrossing> lowerClusterCrossings = new ArrayList<>();

  private TreeNode(final Kind kind, final int cluster, final int node) {
    this.kind = kind;
    this.cluster = cluster;
    this.node = node;
  }

  static TreeNode compound(final int cluster, final TreeNode up) {
    final TreeNode treeNode = new TreeNode(Kind.COMPOUND, cluster, ExtendedNestingGraph.NONE);
    treeNode.up = up;
    if (up != null) {
      up.down = treeNode;
    }
    return treeNode;
  }

  static TreeNode leaf(final int node, final boolean aux) {
    return new TreeNode(aux ? Kind.AUX : Kind.NODE, -1, node);
  }

  public Kind getKind() {
    return this.kind;
  }

  public boolean isCompound() {
    return this.kind == Kind.COMPOUND;
  }

  public int getCluster() {
    return this.cluster;
  }

  public int getNode() {
    return this.node;
  }

  public TreeNode getParent() {
    return this.parent;
  }

  public List<TreeNode> getChildren() {
    return Collections.unmodifiableList(this.children);
  }

  public int numberOfChildren() {
    return this.children.size();
  }

  public TreeNode child(final int i) {
    return this.children.get(i);
  }

  /**
   * @return the index among the siblings, valid after {@link #setPos()} on the parent
   */
  public int pos() {
    return this.pos;
  }

  public TreeNode up() {
    return this.up;
  }

  public TreeNode down() {
    return this.down;
  }

  public List<Adjacency> getUpperAdjacencies() {
    return Collections.unmodifiableList(this.upperAdjacencies);
  }

  public List<Adjacency> getLowerAdjacencies() {
    return Collections.unmodifiableList(this.lowerAdjacencies);
  }

  public List<ClusterCrossing> getUpperClusterCrossings() {
    return Collections.unmodifiableList(this.upperClusterCrossings);
  }

  public List<ClusterCrossing> getLowerClusterCrossings() {
    return Collections.unmodifiableList(this.lowerClusterCrossings);
  }

  void addChild(final TreeNode child) {
    child.parent = this;
    this.children.add(child);
  }

  /**
   * Numbers the children from left to right.
   */
  void setPos() {
    for (int i = 0; i < this.children.size(); ++i) {
      this.children.get(i).pos = i;
    }
  }

  /**
   * Reorders the children, {@code order[i]} becoming the new index of child i.
   */
  void reorder(final int[] order) {
    final TreeNode[] reordered = new TreeNode[this.children.size()];
    for (int i = 0; i < reordered.length; ++i) {
      reordered[order[i]] = this.children.get(i);
    }
    for (int i = 0; i < reordered.length; ++i) {
      this.children.set(i, reordered[i]);
    }
  }

  void store() {
    this.storedChildren = new ArrayList<>(this.children);
  }

  void restore() {
    if (this.storedChildren == null) {
      return;
    }
    this.children.clear();
    this.children.addAll(this.storedChildren);
  }

  void permute(final Random random) {
    Collections.shuffle(this.children, random);
  }

  /**
   * Drops the border dummy leaves among the children.
   */
  void removeAuxChildren() {
    this.children.removeIf(child -> child.kind == Kind.AUX);
    if (this.storedChildren != null) {
      this.storedChildren.removeIf(child -> child.kind == Kind.AUX);
    }
  }

  @Override
  public String toString() {
    if (!isCompound()) {
      return "N" + this.node;
    }
    final StringBuilder sb = new StringBuilder("C").append(this.cluster).append(" [");
    for (final TreeNode child : this.children) {
      sb.append(' ').append(child);
    }
    return sb.append(" ]").toString();
  }
}
