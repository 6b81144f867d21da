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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class OrderingTournamentTest {

  private static Crossings[][] edgeCosts(final int[][] costs) {
    final Crossings[][] matrix = new Crossings[costs.length][costs.length];
    for (int j = 0; j < costs.length; ++j) {
      for (int k = 0; k < costs.length; ++k) {
        matrix[j][k] = new Crossings(0, costs[j][k]);
      }
    }
    return matrix;
  }

  private static Crossings realized(final Crossings[][] cost, final int[] position) {
    Crossings total = Crossings.ZERO;
    for (int j = 0; j < cost.length; ++j) {
      for (int k = 0; k < cost.length; ++k) {
        if (j != k && position[j] < position[k]) {
          total = total.plus(cost[j][k]);
        }
      }
    }
    return total;
  }

  @Test
  public void consistent_preferences_give_zero_crossings() {
    // given element 2 wants to be left of 0, and 0 left of 1
    final Crossings[][] cost = edgeCosts(new int[][]{
        {0, 0, 3},
        {2, 0, 4},
        {0, 0, 0}});

    // when
    final OrderingTournament.Result result =
        OrderingTournament.resolve(cost, Collections.emptyList());

    // then
    assertThat(result.getPosition()).containsExactly(1, 2, 0);
    assertThat(result.getCrossings().isZero()).isTrue();
  }

  @Test
  public void reported_crossings_match_the_order() {
    // given a cyclic preference 0 < 1 < 2 < 0
    final Crossings[][] cost = edgeCosts(new int[][]{
        {0, 1, 5},
        {5, 0, 1},
        {2, 5, 0}});

    // when
    final OrderingTournament.Result result =
        OrderingTournament.resolve(cost, Collections.emptyList());

    // then
    assertThat(result.getPosition()).containsExactlyInAnyOrder(0, 1, 2);
    assertThat(result.getCrossings()).isEqualTo(realized(cost, result.getPosition()));
  }

  @Test
  public void constraints_always_hold() {
    // given a strong preference for 1 left of 0
    final Crossings[][] cost = edgeCosts(new int[][]{
        {0, 10, 0},
        {0, 0, 0},
        {0, 0, 0}});
    final List<int[]> constraints = Collections.singletonList(new int[]{0, 1});

    // when
    final OrderingTournament.Result result = OrderingTournament.resolve(cost, constraints);

    // then
    assertThat(result.getPosition()[0]).isLessThan(result.getPosition()[1]);
    assertThat(result.getCrossings()).isEqualTo(new Crossings(0, 10));
  }

  @Test
  public void cyclic_constraints_are_rejected() {
    // given
    final Crossings[][] cost = edgeCosts(new int[2][2]);
    final List<int[]> constraints = Arrays.asList(new int[]{0, 1}, new int[]{1, 0});

    // when
    final Throwable thrown = catchThrowable(() -> OrderingTournament.resolve(cost, constraints));

    // then
    assertThat(thrown).isInstanceOf(IllegalArgumentException.class);
  }
}
