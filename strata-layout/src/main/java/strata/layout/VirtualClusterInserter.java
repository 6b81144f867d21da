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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.graph.ClusterGraph;

/**
 * Groups closely connected parts of a cluster into virtual clusters so that crossing reduction
 * keeps them together.
 *
 * <p>Within a cluster holding both nodes and child clusters, members connected by input edges,
 * together with child clusters entered on their top or bottom layer, form one virtual cluster per
 * connected component. Afterward consecutive dummies of a long edge hosted by the same cluster
 * are grouped as well.
 */
public class VirtualClusterInserter {

  private static final Logger logger = LoggerFactory.getLogger(VirtualClusterInserter.class);

  private final ExtendedNestingGraph graph;
  private final ClusterCopy clusters;
  private int numberOfVirtualClusters = 0;

  public VirtualClusterInserter(final ExtendedNestingGraph graph) {
    this.graph = graph;
    this.clusters = graph.getClusters();
  }

  public void insertVirtualClusters() {
    groupComponents(this.clusters.rootCluster());

    final ClusterGraph input = this.graph.getOriginal();
    for (int e = 0; e < input.numberOfEdges(); ++e) {
      groupDummies(this.graph.chain(e));
    }
    logger.debug(String.format("Created %d virtual clusters", this.numberOfVirtualClusters));
  }

  private void groupComponents(final int c) {
    final List<Integer> members = new ArrayList<>(this.clusters.members(c));
    final List<Integer> children = new ArrayList<>(this.clusters.children(c));

    if (!members.isEmpty() && !children.isEmpty()) {
      // members first, then child clusters
      final Map<Integer, Integer> memberIndex = new HashMap<>();
      for (int i = 0; i < members.size(); ++i) {
        memberIndex.put(members.get(i), i);
      }
      final Map<Integer, Integer> childIndex = new HashMap<>();
      for (int i = 0; i < children.size(); ++i) {
        childIndex.put(children.get(i), members.size() + i);
      }

      final UnionFind components = new UnionFind(members.size() + children.size());
      for (final int v : members) {
        for (final int w : adjacentNodes(v)) {
          final int cw = this.graph.parentCluster(w);
          if (cw == c) {
            components.union(memberIndex.get(v), memberIndex.get(w));
          } else if (cw != ClusterGraph.NO_CLUSTER && this.clusters.parent(cw) == c
              && !this.clusters.isVirtual(cw)) {
            final int cwOrig = this.clusters.original(cw);
            if (this.graph.rank(w) == this.graph.rank(this.graph.top(cwOrig))
                || this.graph.rank(w) == this.graph.rank(this.graph.bottom(cwOrig))) {
              components.union(memberIndex.get(v), childIndex.get(cw));
            }
          }
        }
      }

      if (components.count() > 1) {
        final Map<Integer, List<Integer>> nodesOf = new HashMap<>();
        final Map<Integer, List<Integer>> clustersOf = new HashMap<>();
        for (final int v : members) {
          nodesOf.computeIfAbsent(components.find(memberIndex.get(v)), k -> new ArrayList<>())
              .add(v);
        }
        for (final int child : children) {
          clustersOf.computeIfAbsent(components.find(childIndex.get(child)),
              k -> new ArrayList<>()).add(child);
        }

        for (int i = 0; i < members.size() + children.size(); ++i) {
          if (components.find(i) != i) {
            continue;
          }
          final List<Integer> nodes = nodesOf.getOrDefault(i, new ArrayList<>());
          final List<Integer> childClusters = clustersOf.getOrDefault(i, new ArrayList<>());
          if (nodes.size() + childClusters.size() > 1) {
            final int virtual = this.clusters.createCluster(nodes, c);
            ++this.numberOfVirtualClusters;
            for (final int child : childClusters) {
              this.clusters.moveCluster(child, virtual);
            }
          }
        }
      }
    }

    for (final int child : new ArrayList<>(this.clusters.children(c))) {
      groupComponents(child);
    }
  }

  private List<Integer> adjacentNodes(final int v) {
    final List<Integer> adjacent = new ArrayList<>();
    for (final int e : this.graph.outEdges(v)) {
      if (this.graph.origEdge(e) != ExtendedNestingGraph.NONE) {
        adjacent.add(this.graph.target(e));
      }
    }
    for (final int e : this.graph.inEdges(v)) {
      if (this.graph.origEdge(e) != ExtendedNestingGraph.NONE) {
        adjacent.add(this.graph.source(e));
      }
    }
    return adjacent;
  }

  /**
   * Puts runs of at least two consecutive dummies with the same host into a virtual cluster.
   */
  private void groupDummies(final List<Integer> chain) {
    if (chain.size() < 3) {
      return;
    }

    int host = this.graph.parentCluster(this.graph.source(chain.get(1)));
    final List<Integer> run = new ArrayList<>();
    for (int i = 1; i < chain.size(); ++i) {
      final int w = this.graph.source(chain.get(i));
      final int cw = this.graph.parentCluster(w);
      if (cw != host) {
        closeRun(run, host);
        host = cw;
      }
      run.add(w);
    }
    closeRun(run, host);
  }

  private void closeRun(final List<Integer> run, final int host) {
    if (run.size() > 1) {
      this.clusters.createCluster(new ArrayList<>(run), host);
      ++this.numberOfVirtualClusters;
    }
    run.clear();
  }

  private static final class UnionFind {

    private final int[] parent;
    private int count;

    private UnionFind(final int n) {
      this.parent = new int[n];
      for (int i = 0; i < n; ++i) {
        this.parent[i] = i;
      }
      this.count = n;
    }

    private int find(final int i) {
      int r = i;
      while (this.parent[r] != r) {
        r = this.parent[r];
      }
      int j = i;
      while (this.parent[j] != r) {
        final int next = this.parent[j];
        this.parent[j] = r;
        j = next;
      }
      return r;
    }

    private void union(final int a, final int b) {
      final int ra = find(a);
      final int rb = find(b);
      if (ra != rb) {
        // keep the smaller index as representative
        this.parent[Math.max(ra, rb)] = Math.min(ra, rb);
        --this.count;
      }
    }

    private int count() {
      return this.count;
    }
  }
}
