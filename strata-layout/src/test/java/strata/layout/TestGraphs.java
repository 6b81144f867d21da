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

import strata.Constants;
import strata.graph.ClusterGraph;
import strata.graph.ClusterGraphBuilder;

/**
 * Cluster graphs shared by the layout tests.
 */
final class TestGraphs {

  private TestGraphs() {
  }

  /**
   * a -> b, both in cluster c.
   */
  static ClusterGraph twoNodesInCluster() {
    return new ClusterGraphBuilder("two nodes")
        .createNode("a").createNode("b")
        .createCluster("c")
        .assignNode("a", "c").assignNode("b", "c")
        .addEdge("a", "b")
        .build();
  }

  /**
   * The complete bipartite graph between {a, b} and {c, d}, without clusters.
   */
  static ClusterGraph k22() {
    final ClusterGraphBuilder builder = new ClusterGraphBuilder("k22");
    for (final String name : new String[]{"a", "b", "c", "d"}) {
      builder.createNode(name).assignNode(name, Constants.ROOT_CLUSTER_NAME);
    }
    return builder
        .addEdge("a", "c").addEdge("a", "d")
        .addEdge("b", "c").addEdge("b", "d")
        .build();
  }

  /**
   * The complete bipartite graph between {a, b} and {c, d}, all four nodes in cluster C.
   */
  static ClusterGraph k22InCluster() {
    final ClusterGraphBuilder builder = new ClusterGraphBuilder("k22 in cluster").createCluster("C");
    for (final String name : new String[]{"a", "b", "c", "d"}) {
      builder.createNode(name).assignNode(name, "C");
    }
    return builder
        .addEdge("a", "c").addEdge("a", "d")
        .addEdge("b", "c").addEdge("b", "d")
        .build();
  }

  /**
   * Sibling clusters A = {a} and B = {b} joined by the single edge a -> b.
   */
  static ClusterGraph stackedClusters() {
    return new ClusterGraphBuilder("stacked")
        .createNode("a").createNode("b")
        .createCluster("A").createCluster("B")
        .assignNode("a", "A").assignNode("b", "B")
        .addEdge("a", "b")
        .build();
  }

  /**
   * Sibling clusters A = {a1, a2} and B = {b1, b2} with edges inside both and between them.
   */
  static ClusterGraph siblingClusters() {
    return new ClusterGraphBuilder("siblings")
        .createNode("a1").createNode("a2").createNode("b1").createNode("b2")
        .createCluster("A").createCluster("B")
        .assignNode("a1", "A").assignNode("a2", "A")
        .assignNode("b1", "B").assignNode("b2", "B")
        .addEdge("a1", "a2").addEdge("b1", "b2").addEdge("a1", "b2").addEdge("b1", "a2")
        .build();
  }

  /**
   * Clusters L = {l1, l2, l3} and R = {r1, r2} fed by the root node s, so that both clusters share
   * their layers.
   */
  static ClusterGraph sideBySideClusters() {
    return new ClusterGraphBuilder("side by side")
        .createNode("s").createNode("l1").createNode("l2").createNode("l3")
        .createNode("r1").createNode("r2")
        .createCluster("L").createCluster("R")
        .assignNode("s", Constants.ROOT_CLUSTER_NAME)
        .assignNode("l1", "L").assignNode("l2", "L").assignNode("l3", "L")
        .assignNode("r1", "R").assignNode("r2", "R")
        .addEdge("s", "l1").addEdge("s", "r1").addEdge("l1", "l2").addEdge("l1", "l3")
        .addEdge("r1", "r2").addEdge("s", "r2")
        .build();
  }

  /**
   * An edge from a node deep in nested clusters to a node in the root, and a long edge
   * inside the outer cluster.
   */
  static ClusterGraph nestedClusters() {
    return new ClusterGraphBuilder("nested")
        .createNode("a").createNode("x").createNode("y").createNode("b")
        .createCluster("outer").createCluster("inner", "outer")
        .assignNode("a", "inner").assignNode("x", "inner").assignNode("y", "outer")
        .assignNode("b", Constants.ROOT_CLUSTER_NAME)
        .addEdge("a", "x").addEdge("x", "y").addEdge("a", "y").addEdge("a", "b")
        .build();
  }

  /**
   * A graph with a directed cycle a -> b -> c -> a and clusters around parts of it.
   */
  static ClusterGraph cyclic() {
    return new ClusterGraphBuilder("cyclic")
        .createNode("a").createNode("b").createNode("c").createNode("d")
        .createCluster("left").createCluster("right")
        .assignNode("a", "left").assignNode("b", "left")
        .assignNode("c", "right").assignNode("d", Constants.ROOT_CLUSTER_NAME)
        .addEdge("a", "b").addEdge("b", "c").addEdge("c", "a").addEdge("d", "c")
        .addEdge("a", "d")
        .build();
  }

  /**
   * A two level pipeline with several clusters, long edges and a cluster without members.
   */
  static ClusterGraph pipeline() {
    final ClusterGraphBuilder builder = new ClusterGraphBuilder("pipeline");
    for (final String name : new String[]{"src1", "src2", "parse", "check", "merge", "store",
        "index", "report", "notify"}) {
      builder.createNode(name);
    }
    builder.createCluster("ingest").createCluster("process")
        .createCluster("validate", "process").createCluster("output")
        .createCluster("empty", "output");
    builder.assignNode("src1", "ingest").assignNode("src2", "ingest")
        .assignNode("parse", "process").assignNode("check", "validate")
        .assignNode("merge", "process").assignNode("store", "output")
        .assignNode("index", "output").assignNode("report", Constants.ROOT_CLUSTER_NAME)
        .assignNode("notify", Constants.ROOT_CLUSTER_NAME);
    return builder
        .addEdge("src1", "parse").addEdge("src2", "parse").addEdge("src2", "merge")
        .addEdge("parse", "check").addEdge("check", "merge").addEdge("merge", "store")
        .addEdge("merge", "index").addEdge("src1", "report").addEdge("store", "report")
        .addEdge("index", "notify").addEdge("src1", "notify").addEdge("parse", "index")
        .build();
  }
}
