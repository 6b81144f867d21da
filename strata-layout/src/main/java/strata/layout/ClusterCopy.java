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
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import strata.graph.ClusterGraph;

/**
 * Working copy of the cluster tree of a {@link ClusterGraph} whose members are nodes of an
 * {@link ExtendedNestingGraph}.
 *
 * <p>The layout may move nodes between clusters and insert virtual clusters without touching the
 * input graph. Every copy cluster of an input cluster knows its original and vice versa; virtual
 * clusters have no original.
 */
public class ClusterCopy {

  private final ClusterGraph original;

  private final List<Integer> parent = new ArrayList<>();
  private final List<List<Integer>> children = new ArrayList<>();
  // insertion ordered, constant time removal
  private final List<Set<Integer>> members = new ArrayList<>();
  private final List<Integer> originalCluster = new ArrayList<>();
  private final int[] copyCluster;

  // graph node -> copy cluster, NO_CLUSTER for nodes without a cluster
  private final List<Integer> nodeCluster = new ArrayList<>();

  public ClusterCopy(final ClusterGraph original) {
    this.original = original;
    this.copyCluster = new int[original.numberOfClusters()];
    copyTree(original.rootCluster(), ClusterGraph.NO_CLUSTER);
  }

  private void copyTree(final int cOrig, final int parentCopy) {
    final int c = newCluster(parentCopy, cOrig);
    this.copyCluster[cOrig] = c;
    for (final int child : this.original.children(cOrig)) {
      copyTree(child, c);
    }
  }

  private int newCluster(final int parentCopy, final int cOrig) {
    final int c = this.parent.size();
    this.parent.add(parentCopy);
    this.children.add(new ArrayList<>());
    this.members.add(new LinkedHashSet<>());
    this.originalCluster.add(cOrig);
    if (parentCopy != ClusterGraph.NO_CLUSTER) {
      this.children.get(parentCopy).add(c);
    }
    return c;
  }

  public ClusterGraph getOriginal() {
    return this.original;
  }

  public int numberOfClusters() {
    return this.parent.size();
  }

  public int rootCluster() {
    return this.copyCluster[this.original.rootCluster()];
  }

  /**
   * @return the copy of an input cluster
   */
  public int copy(final int cOrig) {
    return this.copyCluster[cOrig];
  }

  /**
   * @return the input cluster of a copy cluster, {@link ClusterGraph#NO_CLUSTER} if virtual
   */
  public int original(final int c) {
    return this.originalCluster.get(c);
  }

  public boolean isVirtual(final int c) {
    return this.originalCluster.get(c) == ClusterGraph.NO_CLUSTER;
  }

  public int parent(final int c) {
    return this.parent.get(c);
  }

  public List<Integer> children(final int c) {
    return Collections.unmodifiableList(this.children.get(c));
  }

  /**
   * @return the graph nodes of a cluster in the order they joined it
   */
  public Set<Integer> members(final int c) {
    return Collections.unmodifiableSet(this.members.get(c));
  }

  /**
   * @return the cluster of a graph node, {@link ClusterGraph#NO_CLUSTER} if it has none
   */
  public int clusterOf(final int v) {
    return v < this.nodeCluster.size() ? this.nodeCluster.get(v) : ClusterGraph.NO_CLUSTER;
  }

  /**
   * Makes a graph node a member of a cluster, removing it from its previous cluster.
   */
  public void setParent(final int v, final int c) {
    while (this.nodeCluster.size() <= v) {
      this.nodeCluster.add(ClusterGraph.NO_CLUSTER);
    }
    final int old = this.nodeCluster.get(v);
    if (old == c) {
      return;
    }
    if (old != ClusterGraph.NO_CLUSTER) {
      this.members.get(old).remove(v);
    }
    this.nodeCluster.set(v, c);
    if (c != ClusterGraph.NO_CLUSTER) {
      this.members.get(c).add(v);
    }
  }

  /**
   * Forgets a deleted graph node.
   */
  public void removeNode(final int v) {
    setParent(v, ClusterGraph.NO_CLUSTER);
  }

  /**
   * Creates a virtual cluster below {@code parentCluster} holding the given nodes.
   *
   * @return the new cluster
   */
  public int createCluster(final List<Integer> nodes, final int parentCluster) {
    final int c = newCluster(parentCluster, ClusterGraph.NO_CLUSTER);
    for (final int v : nodes) {
      setParent(v, c);
    }
    return c;
  }

  /**
   * Moves a cluster with its whole subtree below a new parent.
   */
  public void moveCluster(final int c, final int newParent) {
    final int old = this.parent.get(c);
    this.children.get(old).remove(Integer.valueOf(c));
    this.children.get(newParent).add(c);
    this.parent.set(c, newParent);
  }

  /**
   * @return all clusters, every cluster after its descendants
   */
  public List<Integer> postOrder() {
    final List<Integer> order = new ArrayList<>(numberOfClusters());
    final Deque<Integer> stack = new ArrayDeque<>();
    final Deque<Boolean> expanded = new ArrayDeque<>();
    stack.push(rootCluster());
    expanded.push(false);
    while (!stack.isEmpty()) {
      final int c = stack.pop();
      if (expanded.pop()) {
        order.add(c);
        continue;
      }
      stack.push(c);
      expanded.push(true);
      final List<Integer> childList = this.children.get(c);
      for (int i = childList.size() - 1; i >= 0; --i) {
        stack.push(childList.get(i));
        expanded.push(false);
      }
    }
    return order;
  }
}
