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

import java.util.List;
import org.junit.Test;
import strata.graph.ClusterGraph;

public class DummyNodeInserterTest {

  private static ExtendedNestingGraph rankedGraph(final ClusterGraph input) {
    final ExtendedNestingGraph graph = new NestingGraphBuilder(input).build();
    new NestingRanker(new LongestPathRanking()).rank(graph);
    return graph;
  }

  @Test
  public void every_chain_is_split_into_single_layer_segments() {
    // given
    final ClusterGraph input = TestGraphs.pipeline();
    final ExtendedNestingGraph graph = rankedGraph(input);

    // when
    new DummyNodeInserter(graph).insertDummies();

    // then
    for (int e = 0; e < input.numberOfEdges(); ++e) {
      final List<Integer> chain = graph.chain(e);
      final int drawnSource = graph.isReversed(e) ? input.target(e) : input.source(e);
      final int drawnTarget = graph.isReversed(e) ? input.source(e) : input.target(e);
      assertThat(graph.source(chain.get(0))).isEqualTo(graph.copy(drawnSource));
      assertThat(graph.target(chain.get(chain.size() - 1))).isEqualTo(graph.copy(drawnTarget));
      for (int i = 0; i < chain.size(); ++i) {
        final int eH = chain.get(i);
        assertThat(graph.origEdge(eH)).isEqualTo(e);
        assertThat(graph.rank(graph.target(eH)) - graph.rank(graph.source(eH))).isEqualTo(1);
        if (i > 0) {
          assertThat(graph.source(eH)).isEqualTo(graph.target(chain.get(i - 1)));
          assertThat(graph.type(graph.source(eH))).isEqualTo(NodeType.DUMMY);
        }
      }
    }
  }

  @Test
  public void cluster_spans_are_split_into_border_dummies() {
    // given
    final ClusterGraph input = TestGraphs.pipeline();
    final ExtendedNestingGraph graph = rankedGraph(input);
    int expected = 0;
    for (int c = 1; c < input.numberOfClusters(); ++c) {
      expected += graph.rank(graph.bottom(c)) - graph.rank(graph.top(c)) - 1;
    }

    // when
    new DummyNodeInserter(graph).insertDummies();

    // then
    int borderDummies = 0;
    for (final int v : graph.nodes()) {
      if (graph.type(v) == NodeType.CLUSTER_TOP_BOTTOM) {
        ++borderDummies;
        final int c = graph.getClusters().original(graph.parentCluster(v));
        assertThat(graph.rank(v)).isStrictlyBetween(graph.rank(graph.top(c)),
            graph.rank(graph.bottom(c)));
      }
    }
    assertThat(borderDummies).isEqualTo(expected);
    for (final int e : graph.edges()) {
      assertThat(graph.rank(graph.target(e)) - graph.rank(graph.source(e))).isEqualTo(1);
    }
  }

  @Test
  public void dummies_leave_the_clusters_of_the_source_layer_by_layer() {
    // given
    final ClusterGraph input = TestGraphs.nestedClusters();
    final ExtendedNestingGraph graph = rankedGraph(input);
    final int inner = input.clusterIndex("inner");
    final int outer = input.clusterIndex("outer");
    int edge = -1;
    for (int e = 0; e < input.numberOfEdges(); ++e) {
      if (input.nodeName(input.target(e)).equals("b")) {
        edge = e;
      }
    }

    // when
    new DummyNodeInserter(graph).insertDummies();

    // then
    final List<Integer> chain = graph.chain(edge);
    assertThat(chain.size()).isGreaterThan(1);
    final ClusterCopy clusters = graph.getClusters();
    for (int i = 1; i < chain.size(); ++i) {
      final int dummy = graph.source(chain.get(i));
      final int host = clusters.original(graph.parentCluster(dummy));
      if (graph.rank(dummy) <= graph.rank(graph.bottom(inner))) {
        assertThat(host).isEqualTo(inner);
      } else if (graph.rank(dummy) <= graph.rank(graph.bottom(outer))) {
        assertThat(host).isEqualTo(outer);
      } else {
        assertThat(host).isEqualTo(input.rootCluster());
      }
    }
  }

  @Test
  public void edge_between_stacked_clusters_leaves_through_both_borders() {
    // given
    final ClusterGraph input = TestGraphs.stackedClusters();
    final ExtendedNestingGraph graph = rankedGraph(input);
    final int clusterA = input.clusterIndex("A");
    final int clusterB = input.clusterIndex("B");

    // when
    new DummyNodeInserter(graph).insertDummies();

    // then
    final int bottomOfA = graph.rank(graph.bottom(clusterA));
    final int topOfB = graph.rank(graph.top(clusterB));
    assertThat(bottomOfA).isLessThan(topOfB);

    final List<Integer> chain = graph.chain(0);
    assertThat(chain).hasSize(3);
    final ClusterCopy clusters = graph.getClusters();
    final int first = graph.source(chain.get(1));
    final int second = graph.source(chain.get(2));
    assertThat(graph.rank(first)).isEqualTo(bottomOfA);
    assertThat(clusters.original(graph.parentCluster(first))).isEqualTo(clusterA);
    assertThat(graph.rank(second)).isEqualTo(topOfB);
    assertThat(clusters.original(graph.parentCluster(second))).isEqualTo(clusterB);
  }
}
