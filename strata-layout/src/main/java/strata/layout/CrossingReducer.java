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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.layout.TreeNode.Adjacency;
import strata.layout.TreeNode.ClusterCrossing;
import strata.layout.order.Crossings;
import strata.layout.order.OrderingTournament;

/**
 * Reduces crossings by reordering the children of the compound nodes of a {@link LayerHierarchy}.
 *
 * <p>A top down sweep reorders layers 1 to L-1 against the fixed layer above, a bottom up sweep
 * layers L-2 to 0 against the fixed layer below. The children of a compound node are ordered by an
 * {@link OrderingTournament} over the crossings each pair of children causes, keeping the order of
 * the child clusters that already exist on the fixed neighboring layer.
 *
 * <p>Sweeps alternate in rounds. A round ends once {@code fails + 1} sweeps in a row did not beat
 * the best count of the round. The order with the best count overall is saved. Between rounds all
 * orders are shuffled. The run ends after {@code runs} rounds or once no crossing is left, and
 * the best order is restored.
 */
public class CrossingReducer {

  private static final Logger logger = LoggerFactory.getLogger(CrossingReducer.class);

  private final LayerHierarchy hierarchy;
  private final ExtendedNestingGraph graph;
  private final int runs;
  private final int fails;
  private final Random random;

  private final List<Crossings> bestHistory = new ArrayList<>();
  private Crossings best = Crossings.INFINITY;
  private Crossings roundBest = Crossings.INFINITY;

  public CrossingReducer(final LayerHierarchy hierarchy, final int runs, final int fails,
      final long randomSeed) {
    this.hierarchy = hierarchy;
    this.graph = hierarchy.getGraph();
    this.runs = runs;
    this.fails = fails;
    this.random = new Random(randomSeed);
  }

  /**
   * @return the crossings of the restored best order
   */
  public Crossings reduce() {
    for (int round = 1; ; ++round) {
      this.roundBest = Crossings.INFINITY;
      int remaining = this.fails + 1;
      int sweeps = 0;
      do {
        ++sweeps;
        if (improves(traverseTopDown())) {
          if (this.best.isZero()) {
            break;
          }
          remaining = this.fails + 1;
        } else {
          --remaining;
        }

        if (improves(traverseBottomUp())) {
          if (this.best.isZero()) {
            break;
          }
          remaining = this.fails + 1;
        } else {
          --remaining;
        }
      } while (remaining > 0);

      logger.debug(String.format("Round %d: %d sweeps, best %s", round, sweeps, this.best));
      if (this.best.isZero() || round >= this.runs) {
        break;
      }
      this.hierarchy.permute(this.random);
    }

    this.hierarchy.restoreOrder();
    return this.best;
  }

  /**
   * Compares the crossings of a sweep with the best of the round and saves the order if it is the
   * best overall.
   *
   * @return true if the sweep beat the best of the round
   */
  private boolean improves(final Crossings crossings) {
    if (crossings.compareTo(this.roundBest) >= 0) {
      return false;
    }
    if (crossings.compareTo(this.best) < 0) {
      this.hierarchy.storeCurrentOrder();
      this.best = crossings;
      this.bestHistory.add(crossings);
    }
    this.roundBest = crossings;
    return true;
  }

  /**
   * @return every best count in the order they were reached, never increasing
   */
  public List<Crossings> getBestHistory() {
    return ImmutableList.copyOf(this.bestHistory);
  }

  Crossings traverseTopDown() {
    Crossings crossings = Crossings.ZERO;
    for (int i = 1; i < this.hierarchy.numberOfLayers(); ++i) {
      crossings = crossings.plus(reduceLayer(i, true));
    }
    return crossings;
  }

  Crossings traverseBottomUp() {
    Crossings crossings = Crossings.ZERO;
    for (int i = this.hierarchy.numberOfLayers() - 2; i >= 0; --i) {
      crossings = crossings.plus(reduceLayer(i, false));
    }
    return crossings;
  }

  /**
   * Reorders every compound node of a layer and recomputes the positions of the layer.
   */
  Crossings reduceLayer(final int i, final boolean topDown) {
    final LayerTree tree = this.hierarchy.layer(i);
    final Deque<TreeNode> stack = new ArrayDeque<>();
    stack.push(tree.getRoot());

    Crossings crossings = Crossings.ZERO;
    while (!stack.isEmpty()) {
      final TreeNode cNode = stack.pop();
      crossings = crossings.plus(reduceCompound(cNode, topDown));
      for (final TreeNode child : cNode.getChildren()) {
        if (child.isCompound()) {
          stack.push(child);
        }
      }
    }

    tree.assignPositions(this.graph);
    return crossings;
  }

  private Crossings reduceCompound(final TreeNode cNode, final boolean topDown) {
    final int n = cNode.numberOfChildren();
    if (n < 2) {
      return Crossings.ZERO;
    }
    cNode.setPos();

    final int[][] clusterCount = new int[n][n];
    final int[][] edgeCount = new int[n][n];
    countEdgeCrossings(cNode, topDown, edgeCount);
    countClusterCrossings(cNode, topDown, clusterCount);

    final Crossings[][] cost = new Crossings[n][n];
    for (int j = 0; j < n; ++j) {
      for (int k = 0; k < n; ++k) {
        cost[j][k] = new Crossings(clusterCount[j][k], edgeCount[j][k]);
      }
    }

    final OrderingTournament.Result result =
        OrderingTournament.resolve(cost, neighborConstraints(cNode, topDown));
    cNode.reorder(result.getPosition());
    return result.getCrossings();
  }

  /**
   * {@code count[j][k]} gets the weighted number of edge crossings between the subtrees j and k
   * when j is placed left of k.
   */
  private void countEdgeCrossings(final TreeNode cNode, final boolean topDown,
      final int[][] count) {
    final int n = cNode.numberOfChildren();
    final List<List<Adjacency>> byChild = new ArrayList<>(n);
    for (int j = 0; j < n; ++j) {
      byChild.add(new ArrayList<>());
    }
    for (final Adjacency adj : topDown ? cNode.getUpperAdjacencies()
        : cNode.getLowerAdjacencies()) {
      byChild.get(adj.getChild().pos()).add(adj);
    }

    for (int j = 0; j < n; ++j) {
      for (final Adjacency adjJ : byChild.get(j)) {
        final int posJ = this.graph.position(adjJ.getFarNode());
        for (int k = j + 1; k < n; ++k) {
          for (final Adjacency adjK : byChild.get(k)) {
            final int posK = this.graph.position(adjK.getFarNode());
            final int weight = adjJ.getWeight() * adjK.getWeight();
            if (posJ > posK) {
              count[j][k] += weight;
            }
            if (posK > posJ) {
              count[k][j] += weight;
            }
          }
        }
      }
    }
  }

  private void countClusterCrossings(final TreeNode cNode, final boolean topDown,
      final int[][] count) {
    for (final ClusterCrossing cc : topDown ? cNode.getUpperClusterCrossings()
        : cNode.getLowerClusterCrossings()) {
      final int j = cc.getClusterChild().pos();
      final int k = cc.getEdgeChild().pos();
      final int posJ = this.graph.position(cc.getClusterFarNode());
      final int posK = this.graph.position(cc.getEdgeFarNode());
      assert j != k;
      assert posJ != posK;
      if (posJ > posK) {
        ++count[j][k];
      } else {
        ++count[k][j];
      }
    }
  }

  /**
   * Child clusters that also exist on the fixed neighboring layer keep their order from there.
   */
  private List<int[]> neighborConstraints(final TreeNode cNode, final boolean topDown) {
    final List<int[]> constraints = new ArrayList<>();
    final TreeNode neighbor = topDown ? cNode.up() : cNode.down();
    if (neighbor == null) {
      return constraints;
    }

    int left = -1;
    for (final TreeNode child : neighbor.getChildren()) {
      final TreeNode same = topDown ? child.down() : child.up();
      if (same != null) {
        assert same.getParent() == cNode;
        if (left != -1) {
          constraints.add(new int[]{left, same.pos()});
        }
        left = same.pos();
      }
    }
    return constraints;
  }
}
