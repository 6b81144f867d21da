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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import org.junit.Test;
import strata.Constants;

public class ClusterGraphBuilderTest {

  private final ClusterGraphBuilder builder = new ClusterGraphBuilder("builder test");

  @Test
  public void build_should_return_expected_graph() {
    // given
    this.builder.createNode("a").createNode("b").createNode("c");
    this.builder.createCluster("outer").createCluster("inner", "outer");
    this.builder.assignNode("a", "outer").assignNode("b", "inner")
        .assignNode("c", Constants.ROOT_CLUSTER_NAME);
    this.builder.addEdge("a", "b").addEdge("b", "c").addEdge("a", "b");

    // when
    final ClusterGraph graph = this.builder.build();

    // then
    assertThat(graph.getName()).isEqualTo("builder test");
    assertThat(graph.numberOfNodes()).isEqualTo(3);
    assertThat(graph.numberOfEdges()).isEqualTo(3);
    assertThat(graph.numberOfClusters()).isEqualTo(3);

    final int outer = graph.clusterIndex("outer");
    final int inner = graph.clusterIndex("inner");
    assertThat(graph.parent(graph.rootCluster())).isEqualTo(ClusterGraph.NO_CLUSTER);
    assertThat(graph.parent(outer)).isEqualTo(graph.rootCluster());
    assertThat(graph.parent(inner)).isEqualTo(outer);
    assertThat(graph.children(outer)).containsExactly(inner);
    assertThat(graph.nodes(inner)).containsExactly(graph.nodeIndex("b"));
    assertThat(graph.clusterOf(graph.nodeIndex("c"))).isEqualTo(graph.rootCluster());
    assertThat(graph.postOrderClusters()).containsExactly(inner, outer, graph.rootCluster());
  }

  @Test
  public void unknown_names_should_return_minus_one() {
    // given
    this.builder.createNode("a").assignNode("a", Constants.ROOT_CLUSTER_NAME);

    // when
    final ClusterGraph graph = this.builder.build();

    // then
    assertThat(graph.nodeIndex("x")).isEqualTo(-1);
    assertThat(graph.clusterIndex("x")).isEqualTo(-1);
  }

  @Test
  public void create_nodes_with_same_name_should_throw_an_exception() {
    // given
    this.builder.createNode("a");

    // when
    final Throwable thrown = catchThrowable(() -> this.builder.createNode("a"));

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class);
  }

  @Test
  public void create_clusters_with_same_name_should_throw_an_exception() {
    // when
    final Throwable thrown = catchThrowable(
        () -> this.builder.createCluster(Constants.ROOT_CLUSTER_NAME));

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class);
  }

  @Test
  public void edge_to_unknown_node_should_throw_an_exception() {
    // given
    this.builder.createNode("a");

    // when
    final Throwable thrown = catchThrowable(() -> this.builder.addEdge("a", "missing"));

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class)
        .hasMessageContaining("missing");
  }

  @Test
  public void root_cluster_can_not_get_a_parent() {
    // given
    this.builder.createCluster("c1");

    // when
    final Throwable thrown = catchThrowable(
        () -> this.builder.setParentCluster(Constants.ROOT_CLUSTER_NAME, "c1"));

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class);
  }

  @Test
  public void build_should_throw_exception_when_circular_nesting_is_detected() {
    // given
    this.builder.createCluster("c1").createCluster("c2").createCluster("c3");
    this.builder.setParentCluster("c2", "c1").setParentCluster("c3", "c2")
        .setParentCluster("c1", "c3");

    // when
    final Throwable thrown = catchThrowable(this.builder::build);

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class)
        .hasMessageContaining("Circular cluster nesting");
  }

  @Test
  public void build_should_throw_exception_for_unassigned_node() {
    // given
    this.builder.createNode("a");

    // when
    final Throwable thrown = catchThrowable(this.builder::build);

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class)
        .hasMessageContaining("not assigned");
  }

  @Test
  public void build_should_throw_exception_for_node_in_two_clusters() {
    // given
    this.builder.createNode("a").createCluster("c1");
    this.builder.assignNode("a", "c1").assignNode("a", Constants.ROOT_CLUSTER_NAME);

    // when
    final Throwable thrown = catchThrowable(this.builder::build);

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class)
        .hasMessageContaining("several clusters");
  }

  @Test
  public void build_should_throw_exception_for_self_loop() {
    // given
    this.builder.createNode("a").assignNode("a", Constants.ROOT_CLUSTER_NAME);
    this.builder.addEdge("a", "a");

    // when
    final Throwable thrown = catchThrowable(this.builder::build);

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class)
        .hasMessageContaining("Self loop");
  }

  @Test
  public void can_not_call_build_after_graph_already_built() {
    // given
    this.builder.build();

    // when
    final Throwable thrown = catchThrowable(this.builder::build);

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class);
  }

  @Test
  public void can_not_call_createNode_after_graph_already_built() {
    // given
    this.builder.build();

    // when
    final Throwable thrown = catchThrowable(() -> this.builder.createNode("a"));

    // then
    assertThat(thrown).isInstanceOf(ClusterGraphException.class);
  }
}
