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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.Test;
import strata.graph.ClusterGraph;

public class NestingRankerTest {

  @Test
  public void two_nodes_in_a_cluster_get_adjacent_layers() {
    // given
    final ClusterGraph input = TestGraphs.twoNodesInCluster();
    final ExtendedNestingGraph graph = new NestingGraphBuilder(input).build();
    final int c = input.clusterIndex("c");

    // when
    new NestingRanker(new LongestPathRanking()).rank(graph);

    // then
    assertThat(graph.numberOfLayers()).isEqualTo(4);
    assertThat(graph.rank(graph.top(c))).isEqualTo(0);
    assertThat(graph.rank(graph.copy(input.nodeIndex("a")))).isEqualTo(1);
    assertThat(graph.rank(graph.copy(input.nodeIndex("b")))).isEqualTo(2);
    assertThat(graph.rank(graph.bottom(c))).isEqualTo(3);
  }

  @Test
  public void only_input_edges_and_cluster_spans_remain() {
    // given
    final ClusterGraph input = TestGraphs.nestedClusters();
    final ExtendedNestingGraph graph = new NestingGraphBuilder(input).build();

    // when
    new NestingRanker(new LongestPathRanking()).rank(graph);

    // then
    final int root = input.rootCluster();
    assertThat(graph.top(root)).isEqualTo(ExtendedNestingGraph.NONE);
    assertThat(graph.bottom(root)).isEqualTo(ExtendedNestingGraph.NONE);
    int spans = 0;
    for (final int e : graph.edges()) {
      if (graph.origEdge(e) == ExtendedNestingGraph.NONE) {
        final int c = graph.markedCluster(graph.source(e));
        assertThat(graph.source(e)).isEqualTo(graph.top(c));
        assertThat(graph.target(e)).isEqualTo(graph.bottom(c));
        ++spans;
      }
    }
    assertThat(spans).isEqualTo(input.numberOfClusters() - 1);
  }

  @Test
  public void clusters_enclose_their_content() {
    // given
    final ClusterGraph input = TestGraphs.pipeline();
    final ExtendedNestingGraph graph = new NestingGraphBuilder(input).build();

    // when
    new NestingRanker(new LongestPathRanking()).rank(graph);

    // then
    for (int c = 1; c < input.numberOfClusters(); ++c) {
      final int top = graph.rank(graph.top(c));
      final int bottom = graph.rank(graph.bottom(c));
      assertThat(top).isLessThan(bottom);
      for (final int v : input.nodes(c)) {
        assertThat(graph.rank(graph.copy(v))).isStrictlyBetween(top, bottom);
      }
      for (final int child : input.children(c)) {
        assertThat(graph.rank(graph.top(child))).isGreaterThan(top);
        assertThat(graph.rank(graph.bottom(child))).isLessThan(bottom);
      }
    }
  }

  @Test
  public void ranking_violating_edge_lengths_should_throw_an_exception() {
    // given
    final ClusterGraph input = TestGraphs.twoNodesInCluster();
    final ExtendedNestingGraph graph = new NestingGraphBuilder(input).build();
    final RankingPrimitive ranking = mock(RankingPrimitive.class);
    when(ranking.rank(anyInt(), any(), any(), any(), any()))
        .thenReturn(new int[graph.nodeTableSize()]);

    // when
    final Throwable thrown = catchThrowable(() -> new NestingRanker(ranking).rank(graph));

    // then
    verify(ranking).rank(anyInt(), any(), any(), any(), any());
    assertThat(thrown).isInstanceOf(LayoutException.class).hasMessageContaining("violates");
  }

  @Test
  public void ranking_with_missing_ranks_should_throw_an_exception() {
    // given
    final ExtendedNestingGraph graph =
        new NestingGraphBuilder(TestGraphs.twoNodesInCluster()).build();
    final RankingPrimitive ranking = mock(RankingPrimitive.class);
    when(ranking.rank(anyInt(), any(), any(), any(), any())).thenReturn(new int[1]);

    // when
    final Throwable thrown = catchThrowable(() -> new NestingRanker(ranking).rank(graph));

    // then
    assertThat(thrown).isInstanceOf(LayoutException.class).hasMessageContaining("ranks");
  }
}
