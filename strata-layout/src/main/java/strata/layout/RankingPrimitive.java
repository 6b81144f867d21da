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

/**
 * Assigns layers to the nodes of a plain directed graph.
 *
 * <p>Edge i goes from {@code sources[i]} to {@code targets[i]}. The returned ranks must satisfy
 * {@code rank[targets[i]] - rank[sources[i]] >= lengths[i]} for every edge. Among the rankings
 * with a small total weighted edge length, edges with a higher cost are kept shorter.
 */
public interface RankingPrimitive {

  /**
   * @return the rank of every node
   * @throws LayoutException if the edges contain a cycle
   */
  int[] rank(int numberOfNodes, int[] sources, int[] targets, int[] lengths, int[] costs);
}
