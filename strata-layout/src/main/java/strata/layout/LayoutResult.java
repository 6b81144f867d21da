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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import strata.graph.ClusterGraph;
import strata.layout.order.Crossings;

/**
 * The layered layout of a {@link ClusterGraph}: the layer and the position within the layer of
 * every node, the dummy points of every edge and the layer band of every cluster.
 *
 * <p>Layers are numbered from the top starting at 0, positions from the left starting at 0. The
 * positions of a layer include the cluster markers and the dummy points on it.
 */
public class LayoutResult {

  private final ClusterGraph graph;
  private final int numberOfLayers;
  private final Crossings crossings;
  private final List<Crossings> bestHistory;
  private final int[] nodeLayer;
  private final int[] nodePosition;
  private final List<List<int[]>> edgePoints;
  private final List<List<Boolean>> edgeVertical;
  private final boolean[] edgeReversed;
  private final int[] clusterTop;
  private final int[] clusterBottom;

  private LayoutResult(final ClusterGraph graph, final int numberOfLayers,
      final Crossings crossings, final List<Crossings> bestHistory, final int[] nodeLayer,
      final int[] nodePosition, final List<List<int[]>> edgePoints,
      final List<List<Boolean>> edgeVertical, final boolean[] edgeReversed,
      final int[] clusterTop, final int[] clusterBottom) {
    this.graph = graph;
    this.numberOfLayers = numberOfLayers;
    this.crossings = crossings;
    this.bestHistory = bestHistory;
    this.nodeLayer = nodeLayer;
    this.nodePosition = nodePosition;
    this.edgePoints = edgePoints;
    this.edgeVertical = edgeVertical;
    this.edgeReversed = edgeReversed;
    this.clusterTop = clusterTop;
    this.clusterBottom = clusterBottom;
  }

  /**
   * Reads the layout off a cleaned up graph.
   */
  static LayoutResult of(final ExtendedNestingGraph layout, final Crossings crossings,
      final List<Crossings> bestHistory) {
    final ClusterGraph input = layout.getOriginal();

    final int[] nodeLayer = new int[input.numberOfNodes()];
    final int[] nodePosition = new int[input.numberOfNodes()];
    for (int v = 0; v < input.numberOfNodes(); ++v) {
      nodeLayer[v] = layout.rank(layout.copy(v));
      nodePosition[v] = layout.position(layout.copy(v));
    }

    final List<List<int[]>> edgePoints = new ArrayList<>(input.numberOfEdges());
    final List<List<Boolean>> edgeVertical = new ArrayList<>(input.numberOfEdges());
    final boolean[] edgeReversed = new boolean[input.numberOfEdges()];
    for (int e = 0; e < input.numberOfEdges(); ++e) {
      final List<Integer> chain = layout.chain(e);
      final List<int[]> points = new ArrayList<>();
      final List<Boolean> vertical = new ArrayList<>();
      for (int i = 0; i < chain.size(); ++i) {
        if (i > 0) {
          final int dummy = layout.source(chain.get(i));
          points.add(new int[]{layout.rank(dummy), layout.position(dummy)});
        }
        vertical.add(layout.isVertical(chain.get(i)));
      }
      edgePoints.add(ImmutableList.copyOf(points));
      edgeVertical.add(ImmutableList.copyOf(vertical));
      edgeReversed[e] = layout.isReversed(e);
    }

    final int[] clusterTop = new int[input.numberOfClusters()];
    final int[] clusterBottom = new int[input.numberOfClusters()];
    for (int c = 0; c < input.numberOfClusters(); ++c) {
      if (c == input.rootCluster()) {
        clusterTop[c] = 0;
        clusterBottom[c] = Math.max(layout.numberOfLayers() - 1, 0);
      } else {
        clusterTop[c] = layout.rank(layout.top(c));
        clusterBottom[c] = layout.rank(layout.bottom(c));
      }
    }

    return new LayoutResult(input, layout.numberOfLayers(), crossings,
        ImmutableList.copyOf(bestHistory), nodeLayer, nodePosition, edgePoints, edgeVertical,
        edgeReversed, clusterTop, clusterBottom);
  }

  public ClusterGraph getGraph() {
    return this.graph;
  }

  public int getNumberOfLayers() {
    return this.numberOfLayers;
  }

  /**
   * @return the crossings of the final order as counted by the last accepted sweep
   */
  public Crossings getCrossings() {
    return this.crossings;
  }

  /**
   * @return the best crossings found during crossing reduction, in the order they were found
   */
  public List<Crossings> getBestHistory() {
    return this.bestHistory;
  }

  public int layer(final int v) {
    return this.nodeLayer[v];
  }

  public int position(final int v) {
    return this.nodePosition[v];
  }

  /**
   * @return the {layer, position} points of the dummies of an edge, from its drawn source to its
   * drawn target
   */
  public List<int[]> points(final int e) {
    return this.edgePoints.get(e);
  }

  /**
   * @return one flag per segment of an edge telling whether it may be drawn vertically
   */
  public List<Boolean> vertical(final int e) {
    return this.edgeVertical.get(e);
  }

  /**
   * @return true if the edge is drawn upward, from its target to its source
   */
  public boolean isReversed(final int e) {
    return this.edgeReversed[e];
  }

  public int topLayer(final int c) {
    return this.clusterTop[c];
  }

  public int bottomLayer(final int c) {
    return this.clusterBottom[c];
  }

  /**
   * @return the layout as nested maps and lists that serialize to JSON
   */
  public Map<String, Object> toMap() {
    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("name", this.graph.getName());
    result.put("layers", this.numberOfLayers);

    final Map<String, Object> crossingMap = new LinkedHashMap<>();
    crossingMap.put("clusters", this.crossings.getClusterCrossings());
    crossingMap.put("edges", this.crossings.getEdgeCrossings());
    result.put("crossings", crossingMap);

    final Map<String, Object> nodes = new LinkedHashMap<>();
    for (int v = 0; v < this.graph.numberOfNodes(); ++v) {
      final Map<String, Object> node = new LinkedHashMap<>();
      node.put("layer", this.nodeLayer[v]);
      node.put("position", this.nodePosition[v]);
      nodes.put(this.graph.nodeName(v), node);
    }
    result.put("nodes", nodes);

    final List<Object> edges = new ArrayList<>();
    for (int e = 0; e < this.graph.numberOfEdges(); ++e) {
      final Map<String, Object> edge = new LinkedHashMap<>();
      edge.put("source", this.graph.nodeName(this.graph.source(e)));
      edge.put("target", this.graph.nodeName(this.graph.target(e)));
      edge.put("reversed", this.edgeReversed[e]);
      final List<Object> points = new ArrayList<>();
      for (final int[] point : this.edgePoints.get(e)) {
        points.add(ImmutableList.of(point[0], point[1]));
      }
      edge.put("points", points);
      edge.put("vertical", new ArrayList<>(this.edgeVertical.get(e)));
      edges.add(edge);
    }
    result.put("edges", edges);

    final Map<String, Object> clusters = new LinkedHashMap<>();
    for (int c = 0; c < this.graph.numberOfClusters(); ++c) {
      if (c == this.graph.rootCluster()) {
        continue;
      }
      final Map<String, Object> cluster = new LinkedHashMap<>();
      cluster.put("top", this.clusterTop[c]);
      cluster.put("bottom", this.clusterBottom[c]);
      clusters.put(this.graph.clusterName(c), cluster);
    }
    result.put("clusters", clusters);
    return result;
  }

  @Override
  public String toString() {
    return String.format("LayoutResult (%s) layers: %d, crossings: %s", this.graph.getName(),
        this.numberOfLayers, this.crossings);
  }
}
