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
 * Kinds of nodes in an {@link ExtendedNestingGraph}.
 */
public enum NodeType {
  // A node of the input graph
  NODE,
  // Upper boundary marker of a cluster
  CLUSTER_TOP,
  // Lower boundary marker of a cluster
  CLUSTER_BOTTOM,
  // Inner node of a split adjacency edge
  DUMMY,
  // Inner node of a split top to bottom span edge of a cluster
  CLUSTER_TOP_BOTTOM
}
