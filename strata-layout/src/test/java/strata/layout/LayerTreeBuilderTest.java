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

import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import strata.layout.TreeNode.Adjacency;

public class LayerTreeBuilderTest {

  private ExtendedNestingGraph graph;

  @Before
  public void setUp() {
    this.graph = new NestingGraphBuilder(TestGraphs.pipeline()).build();
    new NestingRanker(new LongestPathRanking()).rank(this.graph);
    new DummyNodeInserter(this.graph).insertDummies();
  }

  @Test
  public void every_layer_tree_holds_the_nodes_of_its_layer() {
    // when
    final LayerHierarchy hierarchy = new LayerTreeBuilder(this.graph).build();

    // then
    assertThat(hierarchy.numberOfLayers()).isEqualTo(this.graph.numberOfLayers());
    final List<List<Integer>> layers = this.graph.layers();
    for (int i = 0; i < hierarchy.numberOfLayers(); ++i) {
      final LayerTree tree = hierarchy.layer(i);
      assertThat(tree.getLayer()).isEqualTo(i);
      assertThat(tree.leafOrder()).containsExactlyInAnyOrderElementsOf(layers.get(i));
      for (final int v : layers.get(i)) {
        final TreeNode leaf = hierarchy.leaf(v);
        assertThat(leaf.getNode()).isEqualTo(v);
        assertThat(leaf.getParent().getCluster()).isEqualTo(this.graph.parentCluster(v));
        assertThat(leaf.getKind()).isEqualTo(
            this.graph.type(v) == NodeType.CLUSTER_TOP_BOTTOM ? TreeNode.Kind.AUX
                : TreeNode.Kind.NODE);
      }
    }
  }

  @Test
  public void compound_nodes_are_linked_across_layers() {
    // when
    final LayerHierarchy hierarchy = new LayerTreeBuilder(this.graph).build();

    // then
    for (int i = 0; i < hierarchy.numberOfLayers(); ++i) {
      for (final TreeNode p : hierarchy.layer(i).compounds()) {
        if (p.up() != null) {
          assertThat(p.up().getCluster()).isEqualTo(p.getCluster());
          assertThat(p.up().down()).isSameAs(p);
          assertThat(hierarchy.layer(i - 1).compounds()).contains(p.up());
        }
      }
      assertThat(hierarchy.layer(i).getRoot().up() == null).isEqualTo(i == 0);
    }
  }

  @Test
  public void root_sees_every_input_edge_segment() {
    // when
    final LayerHierarchy hierarchy = new LayerTreeBuilder(this.graph).build();

    // then
    for (int i = 0; i < hierarchy.numberOfLayers(); ++i) {
      int entering = 0;
      int leaving = 0;
      for (final int e : this.graph.edges()) {
        if (this.graph.origEdge(e) == ExtendedNestingGraph.NONE) {
          continue;
        }
        if (this.graph.rank(this.graph.target(e)) == i) {
          ++entering;
        }
        if (this.graph.rank(this.graph.source(e)) == i) {
          ++leaving;
        }
      }
      final TreeNode root = hierarchy.layer(i).getRoot();
      assertThat(totalWeight(root.getUpperAdjacencies())).isEqualTo(entering);
      assertThat(totalWeight(root.getLowerAdjacencies())).isEqualTo(leaving);
    }
  }

  @Test
  public void first_layer_positions_are_assigned() {
    // when
    final LayerHierarchy hierarchy = new LayerTreeBuilder(this.graph).build();

    // then
    final List<Integer> order = hierarchy.layer(0).leafOrder();
    for (int p = 0; p < order.size(); ++p) {
      assertThat(this.graph.position(order.get(p))).isEqualTo(p);
    }
  }

  @Test
  public void simplify_merges_parallel_adjacencies() {
    // given
    final TreeNode child = TreeNode.leaf(7, false);
    final List<Adjacency> adjacencies = new ArrayList<>();
    adjacencies.add(new Adjacency(3, child, 1));
    adjacencies.add(new Adjacency(1, child, 1));
    adjacencies.add(new Adjacency(3, child, 2));

    // when
    LayerTree.simplify(adjacencies);

    // then
    assertThat(adjacencies).hasSize(2);
    assertThat(adjacencies.get(0).getFarNode()).isEqualTo(1);
    assertThat(adjacencies.get(1).getWeight()).isEqualTo(3);
  }

  private static int totalWeight(final List<Adjacency> adjacencies) {
    int total = 0;
    for (final Adjacency adj : adjacencies) {
      total += adj.getWeight();
    }
    return total;
  }
}
