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

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.ClusterGraph;
import strata.layout.order.Crossings;

/**
 * Computes a layered layout of a cluster graph in which every cluster occupies a contiguous
 * region of its layers and crossings are reduced.
 *
 * <p>The phases run in order: the extended nesting graph is built, ranked and split into single
 * layer segments, the layer trees are built, crossings are reduced and the layout aids are removed.
 * Every call works on fresh state, the input graph is never modified.
 */
public class LayeredClusterLayout {

  private static final Logger logger = LoggerFactory.getLogger(LayeredClusterLayout.class);

  private final LayoutConfig config;
  private final RankingPrimitive ranking;

  public LayeredClusterLayout(final LayoutConfig config) {
    this(config, new LongestPathRanking(config.getRankingMaxPasses()));
  }

  public LayeredClusterLayout(final LayoutConfig config, final RankingPrimitive ranking) {
    this.config = requireNonNull(config, "config can't be null");
    this.ranking = requireNonNull(ranking, "ranking can't be null");
  }

  /**
   * @throws LayoutException if the ranking fails
   */
  public LayoutResult call(final ClusterGraph graph) {
    final long startTime = System.currentTimeMillis();
    logger.info("Laying out " + graph + " with " + this.config);

    final ExtendedNestingGraph layout = new NestingGraphBuilder(graph).build();
    new NestingRanker(this.ranking).rank(layout);
    new DummyNodeInserter(layout).insertDummies();
    if (this.config.isVirtualClusters()) {
      new VirtualClusterInserter(layout).insertVirtualClusters();
    }

    final LayerHierarchy hierarchy = new LayerTreeBuilder(layout).build();
    final CrossingReducer reducer = new CrossingReducer(hierarchy, this.config.getRuns(),
        this.config.getFails(), this.config.getRandomSeed());
    final Crossings crossings = reducer.reduce();
    new LayoutCleanup(hierarchy).cleanUp();

    final LayoutResult result = LayoutResult.of(layout, crossings, reducer.getBestHistory());
    logger.info(String.format("Finished layout of (%s) in %d ms: %d layers, crossings %s",
        graph.getName(), System.currentTimeMillis() - startTime, result.getNumberOfLayers(),
        crossings));
    return result;
  }
}
