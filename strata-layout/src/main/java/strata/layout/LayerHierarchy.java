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

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * The {@link LayerTree}s of all layers of an {@link ExtendedNestingGraph} and the leaf of every
 * graph node.
 */
public class LayerHierarchy {

  private final ExtendedNestingGraph graph;
  private final List<LayerTree> layers;
  private final TreeNode[] leaves;

  LayerHierarchy(final ExtendedNestingGraph graph, final List<LayerTree> layers,
      final TreeNode[] leaves) {
    this.graph = graph;
    this.layers = layers;
    this.leaves = leaves;
  }

  public ExtendedNestingGraph getGraph() {
    return this.graph;
  }

  public int numberOfLayers() {
    return this.layers.size();
  }

  public LayerTree layer(final int i) {
    return this.layers.get(i);
  }

  public List<LayerTree> getLayers() {
    return Collections.unmodifiableList(this.layers);
  }

  /**
   * @return the leaf of a graph node
   */
  public TreeNode leaf(final int v) {
    return this.leaves[v];
  }

  void storeCurrentOrder() {
    for (final LayerTree tree : this.layers) {
      tree.store();
    }
  }

  /**
   * Restores the order saved last and recomputes the positions of all layers.
   */
  void restoreOrder() {
    for (final LayerTree tree : this.layers) {
      tree.restore();
      tree.assignPositions(this.graph);
    }
  }

  /**
   * Shuffles the children of every compound node. Only the positions of the first layer are
   * recomputed, the others follow from the next top down sweep.
   */
  void permute(final Random random) {
    for (final LayerTree tree : this.layers) {
      tree.permute(random);
    }
    if (!this.layers.isEmpty()) {
      this.layers.get(0).assignPositions(this.graph);
    }
  }

  void assignAllPositions() {
    for (final LayerTree tree : this.layers) {
      tree.assignPositions(this.graph);
    }
  }

  void removeAuxNodes() {
    for (final LayerTree tree : this.layers) {
      tree.removeAuxNodes();
    }
  }

  @Override
  public String toString() {
    final StringBuilder sb = new StringBuilder();
    for (final LayerTree tree : this.layers) {
      sb.append(tree).append('\n');
    }
    return sb.toString();
  }
}
