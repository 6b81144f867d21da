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

package strata.graph;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A directed graph whose nodes are organized in a tree of clusters.
 *
 * <p>Nodes, edges and clusters are identified by their index (0..n-1). The root cluster always
 * has index 0 and no parent. Instances are immutable and only created by the
 * {@link ClusterGraphBuilder}, which guarantees that the cluster links form a tree and that every
 * node belongs to exactly one cluster.
 */
public class ClusterGraph {

  public static final int NO_CLUSTER = -1;

  private final String name;
  private final List<String> nodeNames;
  private final Map<String, Integer> nodeIndex;
  private final int[] edgeSource;
  private final int[] edgeTarget;
  private final List<String> clusterNames;
  private final Map<String, Integer> clusterIndex;
  private final int[] clusterParent;
  private final List<List<Integer>> clusterChildren;
  private final List<List<Integer>> clusterNodes;
  private final int[] nodeCluster;

  ClusterGraph(final String name, final List<String> nodeNames,
      final Map<String, Integer> nodeIndex, final int[] edgeSource, final int[] edgeTarget,
      final List<String> clusterNames, final Map<String, Integer> clusterIndex,
      final int[] clusterParent, final int[] nodeCluster) {
    this.name = name;
    this.nodeNames = ImmutableList.copyOf(nodeNames);
    this.nodeIndex = nodeIndex;
    this.edgeSource = edgeSource;
    this.edgeTarget = edgeTarget;
    this.clusterNames = ImmutableList.copyOf(clusterNames);
    this.clusterIndex = clusterIndex;
    this.clusterParent = clusterParent;
    this.nodeCluster = nodeCluster;

    final List<List<Integer>> children = new ArrayList<>();
    final List<List<Integer>> members = new ArrayList<>();
    for (int c = 0; c < clusterParent.length; ++c) {
      children.add(new ArrayList<>());
      members.add(new ArrayList<>());
    }
    for (int c = 0; c < clusterParent.length; ++c) {
      if (clusterParent[c] != NO_CLUSTER) {
        children.get(clusterParent[c]).add(c);
      }
    }
    for (int v = 0; v < nodeCluster.length; ++v) {
      members.get(nodeCluster[v]).add(v);
    }

    final ImmutableList.Builder<List<Integer>> childrenBuilder = ImmutableList.builder();
    final ImmutableList.Builder<List<Integer>> membersBuilder = ImmutableList.builder();
    for (int c = 0; c < clusterParent.length; ++c) {
      childrenBuilder.add(ImmutableList.copyOf(children.get(c)));
      membersBuilder.add(ImmutableList.copyOf(members.get(c)));
    }
    this.clusterChildren = childrenBuilder.build();
    this.clusterNodes = membersBuilder.build();
  }

  public String getName() {
    return this.name;
  }

  public int numberOfNodes() {
    return this.nodeNames.size();
  }

  public String nodeName(final int v) {
    return this.nodeNames.get(v);
  }

  /**
   * @return the index of the node with the given name or -1 if there is none
   */
  public int nodeIndex(final String nodeName) {
    final Integer index = this.nodeIndex.get(nodeName);
    return index == null ? -1 : index;
  }

  public int numberOfEdges() {
    return this.edgeSource.length;
  }

  public int source(final int e) {
    return this.edgeSource[e];
  }

  public int target(final int e) {
    return this.edgeTarget[e];
  }

  public int numberOfClusters() {
    return this.clusterNames.size();
  }

  public int rootCluster() {
    return 0;
  }

  public String clusterName(final int c) {
    return this.clusterNames.get(c);
  }

  /**
   * @return the index of the cluster with the given name or -1 if there is none
   */
  public int clusterIndex(final String clusterName) {
    final Integer index = this.clusterIndex.get(clusterName);
    return index == null ? -1 : index;
  }

  /**
   * @return the parent of cluster c, {@link #NO_CLUSTER} for the root
   */
  public int parent(final int c) {
    return this.clusterParent[c];
  }

  public List<Integer> children(final int c) {
    return this.clusterChildren.get(c);
  }

  public List<Integer> nodes(final int c) {
    return this.clusterNodes.get(c);
  }

  public int clusterOf(final int v) {
    return this.nodeCluster[v];
  }

  /**
   * Clusters in post order: every cluster comes after all of its descendants.
   */
  public List<Integer> postOrderClusters() {
    final List<Integer> order = new ArrayList<>(numberOfClusters());
    addPostOrder(rootCluster(), order);
    return order;
  }

  private void addPostOrder(final int c, final List<Integer> order) {
    for (final int child : children(c)) {
      addPostOrder(child, order);
    }
    order.add(c);
  }

  @Override
  public String toString() {
    return String.format("ClusterGraph (%s) nodes (%d) edges (%d) clusters (%d)", this.name,
        numberOfNodes(), numberOfEdges(), numberOfClusters());
  }
}
