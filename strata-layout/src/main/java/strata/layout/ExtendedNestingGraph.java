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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import strata.graph.ClusterGraph;

/**
 * The directed acyclic graph the layered layout works on.
 *
 * <p>It holds one node per input node, a top and a bottom marker per cluster, dummy nodes of split
 * edges, and the edges between them. Nodes and edges are int handles into growable tables; a
 * deleted handle stays dead and is never reused. Every input edge is represented by a chain of
 * edges oriented from its drawn source to its drawn target.
 *
 * <p>Instances are created by {@link NestingGraphBuilder} and refined by the later layout phases.
 */
public class ExtendedNestingGraph {

  public static final int NONE = -1;

  private final ClusterGraph original;
  private final ClusterCopy clusters;

  // node tables
  private final List<NodeType> type = new ArrayList<>();
  private final List<Integer> origNode = new ArrayList<>();
  private final List<Integer> origCluster = new ArrayList<>();
  private final List<Integer> rank = new ArrayList<>();
  private final List<Integer> position = new ArrayList<>();
  private final List<Boolean> nodeAlive = new ArrayList<>();
  private final List<List<Integer>> outEdges = new ArrayList<>();
  private final List<List<Integer>> inEdges = new ArrayList<>();

  // edge tables
  private final List<Integer> source = new ArrayList<>();
  private final List<Integer> target = new ArrayList<>();
  private final List<Integer> origEdge = new ArrayList<>();
  private final List<Boolean> edgeAlive = new ArrayList<>();
  private final List<Boolean> vertical = new ArrayList<>();

  // input element -> graph element
  private final int[] copyNode;
  private final int[] topNode;
  private final int[] bottomNode;
  private final List<List<Integer>> chain;
  private final boolean[] reversed;

  private int numberOfLayers;
  private boolean verticalComputed;

  ExtendedNestingGraph(final ClusterGraph original) {
    this.original = original;
    this.copyNode = new int[original.numberOfNodes()];
    this.topNode = new int[original.numberOfClusters()];
    this.bottomNode = new int[original.numberOfClusters()];
    Arrays.fill(this.topNode, NONE);
    Arrays.fill(this.bottomNode, NONE);
    this.chain = new ArrayList<>(original.numberOfEdges());
    for (int e = 0; e < original.numberOfEdges(); ++e) {
      this.chain.add(new ArrayList<>());
    }
    this.reversed = new boolean[original.numberOfEdges()];

    for (int v = 0; v < original.numberOfNodes(); ++v) {
      this.copyNode[v] = newNode(NodeType.NODE);
      this.origNode.set(this.copyNode[v], v);
    }

    this.clusters = new ClusterCopy(original);
    for (int v = 0; v < original.numberOfNodes(); ++v) {
      this.clusters.setParent(this.copyNode[v], this.clusters.copy(original.clusterOf(v)));
    }

    for (int c = 0; c < original.numberOfClusters(); ++c) {
      this.topNode[c] = newNode(NodeType.CLUSTER_TOP);
      this.origCluster.set(this.topNode[c], c);
      this.bottomNode[c] = newNode(NodeType.CLUSTER_BOTTOM);
      this.origCluster.set(this.bottomNode[c], c);
      this.clusters.setParent(this.topNode[c], this.clusters.copy(c));
      this.clusters.setParent(this.bottomNode[c], this.clusters.copy(c));
    }
  }

  public ClusterGraph getOriginal() {
    return this.original;
  }

  public ClusterCopy getClusters() {
    return this.clusters;
  }

  // ----- nodes -----

  int newNode(final NodeType nodeType) {
    final int v = this.type.size();
    this.type.add(nodeType);
    this.origNode.add(NONE);
    this.origCluster.add(ClusterGraph.NO_CLUSTER);
    this.rank.add(0);
    this.position.add(0);
    this.nodeAlive.add(true);
    this.outEdges.add(new ArrayList<>());
    this.inEdges.add(new ArrayList<>());
    return v;
  }

  /**
   * Deletes a node with all its incident edges.
   */
  void delNode(final int v) {
    for (final int e : new ArrayList<>(this.outEdges.get(v))) {
      delEdge(e);
    }
    for (final int e : new ArrayList<>(this.inEdges.get(v))) {
      delEdge(e);
    }
    this.nodeAlive.set(v, false);
    this.clusters.removeNode(v);
    final int c = this.origCluster.get(v);
    if (c != ClusterGraph.NO_CLUSTER) {
      if (this.topNode[c] == v) {
        this.topNode[c] = NONE;
      } else if (this.bottomNode[c] == v) {
        this.bottomNode[c] = NONE;
      }
    }
  }

  /**
   * @return the size of the node table, including deleted nodes
   */
  public int nodeTableSize() {
    return this.type.size();
  }

  public boolean isAlive(final int v) {
    return this.nodeAlive.get(v);
  }

  /**
   * @return all live nodes in ascending order
   */
  public List<Integer> nodes() {
    final List<Integer> nodes = new ArrayList<>();
    for (int v = 0; v < this.type.size(); ++v) {
      if (this.nodeAlive.get(v)) {
        nodes.add(v);
      }
    }
    return nodes;
  }

  public NodeType type(final int v) {
    return this.type.get(v);
  }

  void setType(final int v, final NodeType nodeType) {
    this.type.set(v, nodeType);
  }

  public boolean isLongEdgeDummy(final int v) {
    return this.type.get(v) == NodeType.DUMMY;
  }

  /**
   * @return the input node represented by a graph node, {@link #NONE} for other kinds of nodes
   */
  public int origNode(final int v) {
    return this.origNode.get(v);
  }

  public int rank(final int v) {
    return this.rank.get(v);
  }

  void setRank(final int v, final int r) {
    this.rank.set(v, r);
  }

  /**
   * @return the position of a node within its layer
   */
  public int position(final int v) {
    return this.position.get(v);
  }

  void setPosition(final int v, final int p) {
    this.position.set(v, p);
  }

  /**
   * @return the copy cluster a node is a member of
   */
  public int parentCluster(final int v) {
    return this.clusters.clusterOf(v);
  }

  public List<Integer> outEdges(final int v) {
    return Collections.unmodifiableList(this.outEdges.get(v));
  }

  public List<Integer> inEdges(final int v) {
    return Collections.unmodifiableList(this.inEdges.get(v));
  }

  // ----- edges -----

  int newEdge(final int u, final int v) {
    final int e = this.source.size();
    this.source.add(u);
    this.target.add(v);
    this.origEdge.add(NONE);
    this.edgeAlive.add(true);
    this.vertical.add(false);
    this.outEdges.get(u).add(e);
    this.inEdges.get(v).add(e);
    return e;
  }

  void delEdge(final int e) {
    if (!this.edgeAlive.get(e)) {
      return;
    }
    this.outEdges.get(this.source.get(e)).remove(Integer.valueOf(e));
    this.inEdges.get(this.target.get(e)).remove(Integer.valueOf(e));
    this.edgeAlive.set(e, false);
  }

  /**
   * Splits {@code u -> v} into {@code u -> w} and {@code w -> v} with a new dummy node w. The
   * first part keeps the handle of the split edge.
   *
   * @return the new edge {@code w -> v}
   */
  int split(final int e) {
    final int v = this.target.get(e);
    final int w = newNode(NodeType.DUMMY);
    this.inEdges.get(v).remove(Integer.valueOf(e));
    this.target.set(e, w);
    this.inEdges.get(w).add(e);
    final int e2 = newEdge(w, v);
    this.origEdge.set(e2, this.origEdge.get(e));
    return e2;
  }

  public int edgeTableSize() {
    return this.source.size();
  }

  public boolean isEdgeAlive(final int e) {
    return this.edgeAlive.get(e);
  }

  /**
   * @return all live edges in ascending order
   */
  public List<Integer> edges() {
    final List<Integer> edges = new ArrayList<>();
    for (int e = 0; e < this.source.size(); ++e) {
      if (this.edgeAlive.get(e)) {
        edges.add(e);
      }
    }
    return edges;
  }

  public int source(final int e) {
    return this.source.get(e);
  }

  public int target(final int e) {
    return this.target.get(e);
  }

  /**
   * @return the input edge a graph edge belongs to, {@link #NONE} for structural edges
   */
  public int origEdge(final int e) {
    return this.origEdge.get(e);
  }

  void setOrigEdge(final int e, final int eOrig) {
    this.origEdge.set(e, eOrig);
  }

  public boolean isVertical(final int e) {
    return this.vertical.get(e);
  }

  void setVertical(final int e, final boolean isVertical) {
    this.vertical.set(e, isVertical);
  }

  boolean isVerticalComputed() {
    return this.verticalComputed;
  }

  void markVerticalComputed() {
    this.verticalComputed = true;
  }

  // ----- mappings of the input graph -----

  /**
   * @return the graph node of an input node
   */
  public int copy(final int vOrig) {
    return this.copyNode[vOrig];
  }

  /**
   * @return the top marker of an input cluster, {@link #NONE} once deleted
   */
  public int top(final int cOrig) {
    return this.topNode[cOrig];
  }

  /**
   * @return the bottom marker of an input cluster, {@link #NONE} once deleted
   */
  public int bottom(final int cOrig) {
    return this.bottomNode[cOrig];
  }

  /**
   * @return the input cluster of a top or bottom marker, {@link ClusterGraph#NO_CLUSTER} otherwise
   */
  public int markedCluster(final int v) {
    return this.origCluster.get(v);
  }

  /**
   * @return the edges representing an input edge, from the drawn source to the drawn target
   */
  public List<Integer> chain(final int eOrig) {
    return Collections.unmodifiableList(this.chain.get(eOrig));
  }

  void appendToChain(final int eOrig, final int e) {
    this.chain.get(eOrig).add(e);
    this.origEdge.set(e, eOrig);
  }

  /**
   * @return true if the input edge is drawn from its target to its source
   */
  public boolean isReversed(final int eOrig) {
    return this.reversed[eOrig];
  }

  void setReversed(final int eOrig) {
    this.reversed[eOrig] = true;
  }

  public int numberOfLayers() {
    return this.numberOfLayers;
  }

  void setNumberOfLayers(final int numberOfLayers) {
    this.numberOfLayers = numberOfLayers;
  }

  /**
   * @return the live nodes of every layer
   */
  public List<List<Integer>> layers() {
    final List<List<Integer>> layers = new ArrayList<>(this.numberOfLayers);
    for (int i = 0; i < this.numberOfLayers; ++i) {
      layers.add(new ArrayList<>());
    }
    for (final int v : nodes()) {
      layers.get(rank(v)).add(v);
    }
    return layers;
  }

  @Override
  public String toString() {
    return String.format("ExtendedNestingGraph (%s) nodes: %d, edges: %d, layers: %d",
        this.original.getName(), nodes().size(), edges().size(), this.numberOfLayers);
  }
}
