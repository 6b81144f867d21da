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
import java.util.Map;
import org.junit.Test;
import strata.graph.ClusterGraph;
import strata.utils.JSONUtils;

public class LayoutResultTest {

  @Test
  @SuppressWarnings("unchecked")
  public void to_map_describes_the_layout() throws Exception {
    // given
    final ClusterGraph graph = TestGraphs.nestedClusters();
    final LayoutResult result = new LayeredClusterLayout(LayoutConfig.defaults()).call(graph);

    // when
    final Map<String, Object> map =
        (Map<String, Object>) JSONUtils.parseJSONFromString(JSONUtils.toJSON(result.toMap()));

    // then
    assertThat(map.get("name")).isEqualTo("nested");
    assertThat(map.get("layers")).isEqualTo(result.getNumberOfLayers());
    assertThat(map).containsKeys("crossings", "nodes", "edges", "clusters");

    final Map<String, Object> nodes = (Map<String, Object>) map.get("nodes");
    assertThat(nodes).containsOnlyKeys("a", "x", "y", "b");
    final Map<String, Object> b = (Map<String, Object>) nodes.get("b");
    assertThat(b.get("layer")).isEqualTo(result.layer(graph.nodeIndex("b")));
    assertThat(b.get("position")).isEqualTo(result.position(graph.nodeIndex("b")));

    final List<Object> edges = (List<Object>) map.get("edges");
    assertThat(edges).hasSize(graph.numberOfEdges());
    final Map<String, Object> last = (Map<String, Object>) edges.get(3);
    assertThat(last.get("source")).isEqualTo("a");
    assertThat(last.get("target")).isEqualTo("b");
    assertThat(last.get("reversed")).isEqualTo(false);
    assertThat((List<Object>) last.get("points")).hasSize(result.points(3).size());
    assertThat((List<Object>) last.get("vertical")).hasSize(result.points(3).size() + 1);

    final Map<String, Object> clusters = (Map<String, Object>) map.get("clusters");
    assertThat(clusters).containsOnlyKeys("outer", "inner");
    final Map<String, Object> inner = (Map<String, Object>) clusters.get("inner");
    assertThat(inner.get("top")).isEqualTo(result.topLayer(graph.clusterIndex("inner")));
    assertThat(inner.get("bottom")).isEqualTo(result.bottomLayer(graph.clusterIndex("inner")));
  }

  @Test
  public void root_cluster_spans_all_layers() {
    // given
    final ClusterGraph graph = TestGraphs.pipeline();

    // when
    final LayoutResult result = new LayeredClusterLayout(LayoutConfig.defaults()).call(graph);

    // then
    assertThat(result.topLayer(graph.rootCluster())).isZero();
    assertThat(result.bottomLayer(graph.rootCluster()))
        .isEqualTo(result.getNumberOfLayers() - 1);
    assertThat(result.getGraph()).isSameAs(graph);
    assertThat(result.toString()).startsWith("LayoutResult (pipeline)");
  }
}
