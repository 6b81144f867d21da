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

package strata.layout.order;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A directed acyclic graph that stays acyclic while edges are inserted one by one.
 *
 * <p>Every node carries a level such that {@code level(x) < level(y)} holds for every edge
 * {@code x -> y}. An insertion that agrees with the levels is accepted at once. Otherwise the
 * nodes reachable from the new target are searched; if the new source is among them the edge
 * would close a cycle and is rejected. If not, the levels of the visited nodes are shifted down so
 * that the invariant holds again. The cost of an insertion is bounded by the part of the graph
 * reachable from its target.
 */
public class LevelMap {

  private final List<List<Integer>> successors = new ArrayList<>();
  private final MarkBuffer visited;
  private int[] level;
  private int numberOfNodes;
  private int numberOfEdges;

  public LevelMap() {
    this(16);
  }

  public LevelMap(final int expectedNodes) {
    this.level = new int[Math.max(expectedNodes, 1)];
    this.visited = new MarkBuffer(expectedNodes);
  }

  /**
   * Adds a node whose level is its index. Nodes added this way are consistent with any edge from
   * an earlier node to a later one.
   *
   * @return the new node
   */
  public int addNode() {
    return addNode(this.numberOfNodes);
  }

  /**
   * Adds a node with a given initial level. The caller is responsible for choosing levels that
   * agree with the edges added afterward without a search, see {@link #tryAdd(int, int)}.
   *
   * @return the new node
   */
  public int addNode(final int initialLevel) {
    final int v = this.numberOfNodes++;
    if (v >= this.level.length) {
      this.level = Arrays.copyOf(this.level, Math.max(v + 1, this.level.length * 2));
    }
    this.level[v] = initialLevel;
    this.successors.add(new ArrayList<>());
    this.visited.ensureCapacity(this.numberOfNodes);
    return v;
  }

  public int numberOfNodes() {
    return this.numberOfNodes;
  }

  public int numberOfEdges() {
    return this.numberOfEdges;
  }

  public int level(final int v) {
    return this.level[v];
  }

  public List<Integer> successors(final int v) {
    return Collections.unmodifiableList(this.successors.get(v));
  }

  /**
   * Adds the edge {@code u -> v} if this keeps the graph acyclic.
   *
   * @return true if the edge was added, false if it would close a cycle
   */
  public boolean tryAdd(final int u, final int v) {
    if (this.level[u] < this.level[v]) {
      addEdge(u, v);
      return true;
    }

    if (reachable(v, u)) {
      this.visited.clear();
      return false;
    }

    repairLevels(this.level[u] - this.level[v] + 1);
    this.visited.clear();
    addEdge(u, v);
    return true;
  }

  /**
   * Adds {@code u -> v}, or {@code v -> u} if the former would close a cycle. The reverse edge is
   * always safe since v then already reaches u.
   *
   * @return true if {@code u -> v} was added, false if {@code v -> u} was added instead
   */
  public boolean insert(final int u, final int v) {
    if (tryAdd(u, v)) {
      return true;
    }
    final boolean added = tryAdd(v, u);
    assert added;
    return false;
  }

  /**
   * Marks every node reachable from {@code from} in the visited buffer.
   *
   * @return true if {@code to} is among them
   */
  @VisibleForTesting
  boolean reachable(final int from, final int to) {
    if (from == to) {
      return true;
    }

    this.visited.mark(from, 1);
    for (int head = 0; head < this.visited.touchedCount(); ++head) {
      final int w = this.visited.touched(head);
      for (final int t : this.successors.get(w)) {
        if (t == to) {
          return true;
        }
        if (!this.visited.isMarked(t)) {
          this.visited.mark(t, 1);
        }
      }
    }
    return false;
  }

  /**
   * Shifts the level of every node in the visited buffer by {@code delta}. Every edge leaving a
   * visited node ends in a visited node, so edges among them keep their level difference and
   * edges entering them only grow it.
   */
  private void repairLevels(final int delta) {
    assert delta > 0;
    for (int i = 0; i < this.visited.touchedCount(); ++i) {
      this.level[this.visited.touched(i)] += delta;
    }
  }

  private void addEdge(final int u, final int v) {
    this.successors.get(u).add(v);
    ++this.numberOfEdges;
  }

  /**
   * Numbers the nodes 0..n-1 consistently with every edge. Nodes with equal levels are not
   * connected and are numbered by index.
   *
   * @return the number of every node
   */
  public int[] topologicalNumbering() {
    final Integer[] nodes = new Integer[this.numberOfNodes];
    for (int v = 0; v < this.numberOfNodes; ++v) {
      nodes[v] = v;
    }
    Arrays.sort(nodes, (a, b) -> {
      final int byLevel = Integer.compare(this.level[a], this.level[b]);
      return byLevel != 0 ? byLevel : Integer.compare(a, b);
    });

    final int[] number = new int[this.numberOfNodes];
    for (int i = 0; i < nodes.length; ++i) {
      number[nodes[i]] = i;
    }
    return number;
  }
}
