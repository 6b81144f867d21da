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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import strata.Constants;

/**
 * A builder to build cluster graphs.
 *
 * <p>Create nodes with {@link #createNode(String)} and clusters with
 * {@link #createCluster(String)}. Connect nodes with {@link #addEdge(String, String)}, nest
 * clusters with {@link #setParentCluster(String, String)} and place nodes with
 * {@link #assignNode(String, String)}. Call {@link #build()} to validate the input and get a
 * {@link ClusterGraph}.
 *
 * <p>A root cluster named {@value Constants#ROOT_CLUSTER_NAME} exists from the start. New
 * clusters are children of the root until they are given another parent.
 */
public class ClusterGraphBuilder {

  private final String name;

  private final List<String> nodeNames = new ArrayList<>();
  private final Map<String, Integer> nodeIndex = new HashMap<>();
  private final List<int[]> edges = new ArrayList<>();

  private final List<String> clusterNames = new ArrayList<>();
  private final Map<String, Integer> clusterIndex = new HashMap<>();
  private final List<Integer> clusterParent = new ArrayList<>();

  // node index -> names of the clusters the node was assigned to, in assignment order
  private final Map<Integer, List<String>> assignments = new LinkedHashMap<>();

  // The builder can only be used to build a graph once to prevent modifying an existing graph
  // after it is built.
  private boolean isBuilt = false;

  /**
   * A builder for building a cluster graph.
   *
   * @param name name of the graph
   */
  public ClusterGraphBuilder(final String name) {
    requireNonNull(name, "The name of the ClusterGraphBuilder can't be null");
    this.name = name;
    this.clusterNames.add(Constants.ROOT_CLUSTER_NAME);
    this.clusterIndex.put(Constants.ROOT_CLUSTER_NAME, 0);
    this.clusterParent.add(ClusterGraph.NO_CLUSTER);
  }

  /**
   * Creates a new node.
   *
   * @param nodeName name of the node
   * @return this builder
   * @throws ClusterGraphException if the name is not unique
   */
  public ClusterGraphBuilder createNode(final String nodeName) {
    checkIsBuilt();
    requireNonNull(nodeName, "The node name can't be null");

    if (this.nodeIndex.containsKey(nodeName)) {
      throw new ClusterGraphException(String.format("Node names in %s need to be unique. The name "
          + "(%s) already exists.", this, nodeName));
    }
    this.nodeIndex.put(nodeName, this.nodeNames.size());
    this.nodeNames.add(nodeName);
    return this;
  }

  /**
   * Adds a directed edge. Parallel edges are allowed.
   *
   * @throws ClusterGraphException if one of the nodes is unknown
   */
  public ClusterGraphBuilder addEdge(final String sourceName, final String targetName) {
    checkIsBuilt();
    this.edges.add(new int[]{getNode(sourceName), getNode(targetName)});
    return this;
  }

  /**
   * Creates a new cluster as a child of the root cluster.
   *
   * @throws ClusterGraphException if the name is not unique
   */
  public ClusterGraphBuilder createCluster(final String clusterName) {
    checkIsBuilt();
    requireNonNull(clusterName, "The cluster name can't be null");

    if (this.clusterIndex.containsKey(clusterName)) {
      throw new ClusterGraphException(String.format("Cluster names in %s need to be unique. The "
          + "name (%s) already exists.", this, clusterName));
    }
    this.clusterIndex.put(clusterName, this.clusterNames.size());
    this.clusterNames.add(clusterName);
    this.clusterParent.add(0);
    return this;
  }

  /**
   * Creates a new cluster nested in the given parent cluster.
   */
  public ClusterGraphBuilder createCluster(final String clusterName,
      final String parentClusterName) {
    createCluster(clusterName);
    return setParentCluster(clusterName, parentClusterName);
  }

  /**
   * Nests a cluster in another one.
   *
   * @throws ClusterGraphException if a cluster is unknown or the child is the root
   */
  public ClusterGraphBuilder setParentCluster(final String childClusterName,
      final String parentClusterName) {
    checkIsBuilt();

    final int child = getCluster(childClusterName);
    final int parent = getCluster(parentClusterName);
    if (child == 0) {
      throw new ClusterGraphException(
          String.format("The root cluster (%s) can't have a parent.", childClusterName));
    }
    this.clusterParent.set(child, parent);
    return this;
  }

  /**
   * Places a node in a cluster. Every node must be placed exactly once before the graph is
   * built.
   */
  public ClusterGraphBuilder assignNode(final String nodeName, final String clusterName) {
    checkIsBuilt();

    final int node = getNode(nodeName);
    getCluster(clusterName);
    this.assignments.computeIfAbsent(node, k -> new ArrayList<>()).add(clusterName);
    return this;
  }

  private int getNode(final String nodeName) {
    final Integer node = this.nodeIndex.get(nodeName);
    if (node == null) {
      throw new ClusterGraphException(
          String.format("Unknown node (%s). Did you create the node?", nodeName));
    }
    return node;
  }

  private int getCluster(final String clusterName) {
    final Integer cluster = this.clusterIndex.get(clusterName);
    if (cluster == null) {
      throw new ClusterGraphException(
          String.format("Unknown cluster (%s). Did you create the cluster?", clusterName));
    }
    return cluster;
  }

  /**
   * Throws an exception if the {@link ClusterGraphBuilder#build()} method has been called.
   */
  private void checkIsBuilt() {
    if (this.isBuilt) {
      final String msg = String
          .format("The graph (%s) is built already. Can't modify it.", this);
      throw new ClusterGraphException(msg);
    }
  }

  /**
   * Builds the cluster graph.
   *
   * @return the validated cluster graph
   * @throws ClusterGraphException if the input is malformed
   */
  public ClusterGraph build() {
    checkIsBuilt();
    checkSelfLoops();
    checkCircularClusters();
    final int[] nodeCluster = checkMembership();
    this.isBuilt = true;

    final int[] edgeSource = new int[this.edges.size()];
    final int[] edgeTarget = new int[this.edges.size()];
    for (int e = 0; e < this.edges.size(); ++e) {
      edgeSource[e] = this.edges.get(e)[0];
      edgeTarget[e] = this.edges.get(e)[1];
    }
    final int[] parents = new int[this.clusterParent.size()];
    for (int c = 0; c < parents.length; ++c) {
      parents[c] = this.clusterParent.get(c);
    }

    return new ClusterGraph(this.name, this.nodeNames, new HashMap<>(this.nodeIndex), edgeSource,
        edgeTarget, this.clusterNames, new HashMap<>(this.clusterIndex), parents, nodeCluster);
  }

  /**
   * A self loop can never be drawn downward, so no layering exists for it.
   */
  private void checkSelfLoops() {
    for (final int[] edge : this.edges) {
      if (edge[0] == edge[1]) {
        throw new ClusterGraphException(String.format("Self loop on node (%s) is not supported.",
            this.nodeNames.get(edge[0])));
      }
    }
  }

  private int[] checkMembership() {
    final int[] nodeCluster = new int[this.nodeNames.size()];
    for (int v = 0; v < nodeCluster.length; ++v) {
      final List<String> clusters = this.assignments.get(v);
      if (clusters == null) {
        throw new ClusterGraphException(String.format("Node (%s) is not assigned to any cluster.",
            this.nodeNames.get(v)));
      }
      if (clusters.size() > 1) {
        throw new ClusterGraphException(String.format("Node (%s) is assigned to several "
            + "clusters: %s", this.nodeNames.get(v), clusters));
      }
      nodeCluster[v] = this.clusterIndex.get(clusters.get(0));
    }
    return nodeCluster;
  }

  /**
   * Checks that following the parent links from every cluster ends at the root.
   *
   * @throws ClusterGraphException if some clusters form a ring
   */
  private void checkCircularClusters() {
    class CircularNestingChecker {

      // The clusters known to reach the root
      private final Set<Integer> finished = new HashSet<>();

      // The clusters on the parent chain currently being followed
      private final Set<Integer> ongoing = new LinkedHashSet<>();

      // One sample of clusters that form a ring
      private final List<String> sampleCircularClusters = new ArrayList<>();

      private void check() {
        this.finished.add(0);
        for (int c = 1; c < ClusterGraphBuilder.this.clusterNames.size(); ++c) {
          if (checkCluster(c)) {
            final String msg = String.format("Circular cluster nesting detected. Sample: %s",
                this.sampleCircularClusters);
            throw new ClusterGraphException(msg);
          }
        }
      }

      /**
       * @return true if the parent chain of the cluster runs into a ring
       */
      private boolean checkCluster(final int start) {
        int c = start;
        while (!this.finished.contains(c)) {
          if (!this.ongoing.add(c)) {
            for (final int ring : this.ongoing) {
              this.sampleCircularClusters.add(ClusterGraphBuilder.this.clusterNames.get(ring));
            }
            return true;
          }
          c = ClusterGraphBuilder.this.clusterParent.get(c);
        }
        this.finished.addAll(this.ongoing);
        this.ongoing.clear();
        return false;
      }
    }

    final CircularNestingChecker checker = new CircularNestingChecker();
    checker.check();
  }

  @Override
  public String toString() {
    return String.format("ClusterGraphBuilder (%s)", this.name);
  }
}
