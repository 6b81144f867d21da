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

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.Constants;
import strata.utils.JSONUtils;

/**
 * Loads a {@link ClusterGraph} from its JSON description.
 *
 * <pre>
 * {
 *   "name": "example",
 *   "nodes": ["a", "b", "c"],
 *   "edges": [["a", "b"], ["b", "c"]],
 *   "clusters": [
 *     {"name": "outer", "nodes": ["a"]},
 *     {"name": "inner", "parent": "outer", "nodes": ["b"]}
 *   ]
 * }
 * </pre>
 *
 * <p>Clusters without a parent are nested in the root cluster. Nodes not listed by any cluster
 * are placed in the root cluster.
 */
public class ClusterGraphLoader {

  private static final Logger logger = LoggerFactory.getLogger(ClusterGraphLoader.class);

  private static final String NAME = "name";
  private static final String NODES = "nodes";
  private static final String EDGES = "edges";
  private static final String CLUSTERS = "clusters";
  private static final String PARENT = "parent";

  public ClusterGraph load(final File file) throws IOException {
    logger.info("Loading cluster graph from " + file.getPath());
    final Object json = JSONUtils.parseJSONFromFile(file);
    final String defaultName = StringUtils.substringBeforeLast(file.getName(), ".");
    return fromObject(json, defaultName);
  }

  public ClusterGraph loadFromString(final String json) throws IOException {
    return fromObject(JSONUtils.parseJSONFromString(json), "graph");
  }

  private ClusterGraph fromObject(final Object json, final String defaultName) {
    final Map<String, Object> root = asMap(json, "graph");
    final Object nameValue = root.get(NAME);
    final String name = nameValue == null ? defaultName : nameValue.toString();

    final ClusterGraphBuilder builder = new ClusterGraphBuilder(name);
    for (final Object node : asList(root.get(NODES), NODES)) {
      builder.createNode(asName(node, NODES));
    }

    for (final Object edge : asList(root.get(EDGES), EDGES)) {
      final List<Object> endpoints = asList(edge, EDGES);
      if (endpoints.size() != 2) {
        throw new ClusterGraphException(
            String.format("An edge needs exactly two endpoints, got %s", endpoints));
      }
      builder.addEdge(asName(endpoints.get(0), EDGES), asName(endpoints.get(1), EDGES));
    }

    // Create all clusters first, a parent may be listed after its child.
    final List<Object> clusters = asList(root.get(CLUSTERS), CLUSTERS);
    for (final Object cluster : clusters) {
      builder.createCluster(asName(asMap(cluster, CLUSTERS).get(NAME), CLUSTERS));
    }

    final Set<String> placed = new HashSet<>();
    for (final Object cluster : clusters) {
      final Map<String, Object> clusterMap = asMap(cluster, CLUSTERS);
      final String clusterName = asName(clusterMap.get(NAME), CLUSTERS);
      final Object parent = clusterMap.get(PARENT);
      if (parent != null) {
        builder.setParentCluster(clusterName, asName(parent, PARENT));
      }
      for (final Object node : asList(clusterMap.get(NODES), NODES)) {
        final String nodeName = asName(node, NODES);
        builder.assignNode(nodeName, clusterName);
        placed.add(nodeName);
      }
    }

    for (final Object node : asList(root.get(NODES), NODES)) {
      final String nodeName = asName(node, NODES);
      if (!placed.contains(nodeName)) {
        builder.assignNode(nodeName, Constants.ROOT_CLUSTER_NAME);
      }
    }

    final ClusterGraph graph = builder.build();
    logger.debug("Loaded " + graph);
    return graph;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(final Object value, final String field) {
    if (!(value instanceof Map)) {
      throw new ClusterGraphException(
          String.format("Expected a JSON object for (%s), got %s", field, value));
    }
    return (Map<String, Object>) value;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(final Object value, final String field) {
    if (value == null) {
      return Collections.emptyList();
    }
    if (!(value instanceof List)) {
      throw new ClusterGraphException(
          String.format("Expected a JSON array for (%s), got %s", field, value));
    }
    return (List<Object>) value;
  }

  private static String asName(final Object value, final String field) {
    if (value == null || StringUtils.isBlank(value.toString())) {
      throw new ClusterGraphException(String.format("Missing name in (%s)", field));
    }
    return value.toString();
  }
}
