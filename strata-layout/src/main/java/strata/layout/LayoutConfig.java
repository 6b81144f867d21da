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

import strata.Constants;
import strata.Constants.ConfigurationKeys;
import strata.utils.Props;

/**
 * Settings of a {@link LayeredClusterLayout} run.
 */
public class LayoutConfig {

  private final int runs;
  private final int fails;
  private final long randomSeed;
  private final boolean virtualClusters;
  private final int rankingMaxPasses;

  public LayoutConfig(final int runs, final int fails, final long randomSeed,
      final boolean virtualClusters, final int rankingMaxPasses) {
    this.runs = runs;
    this.fails = fails;
    this.randomSeed = randomSeed;
    this.virtualClusters = virtualClusters;
    this.rankingMaxPasses = rankingMaxPasses;
  }

  public static LayoutConfig defaults() {
    return new LayoutConfig(Constants.DEFAULT_LAYOUT_RUNS, Constants.DEFAULT_LAYOUT_FAILS,
        Constants.DEFAULT_LAYOUT_RANDOM_SEED, false, Constants.DEFAULT_RANKING_MAX_PASSES);
  }

  /**
   * Reads the settings, falling back to the defaults for missing keys.
   *
   * @throws strata.InvalidStrataConfigException if a value is malformed or out of range
   */
  public static LayoutConfig fromProps(final Props props) {
    new LayoutConfigValidator(props).validate();
    return new LayoutConfig(
        props.getInt(ConfigurationKeys.LAYOUT_RUNS, Constants.DEFAULT_LAYOUT_RUNS),
        props.getInt(ConfigurationKeys.LAYOUT_FAILS, Constants.DEFAULT_LAYOUT_FAILS),
        props.getLong(ConfigurationKeys.LAYOUT_RANDOM_SEED, Constants.DEFAULT_LAYOUT_RANDOM_SEED),
        props.getBoolean(ConfigurationKeys.LAYOUT_VIRTUAL_CLUSTERS, false),
        props.getInt(ConfigurationKeys.RANKING_MAX_PASSES, Constants.DEFAULT_RANKING_MAX_PASSES));
  }

  /**
   * @return the maximum number of crossing reduction rounds
   */
  public int getRuns() {
    return this.runs;
  }

  /**
   * @return the number of sweeps without improvement tolerated in a round, minus one
   */
  public int getFails() {
    return this.fails;
  }

  public long getRandomSeed() {
    return this.randomSeed;
  }

  public boolean isVirtualClusters() {
    return this.virtualClusters;
  }

  public int getRankingMaxPasses() {
    return this.rankingMaxPasses;
  }

  @Override
  public String toString() {
    return String.format("LayoutConfig runs: %d, fails: %d, seed: %d, virtual clusters: %s",
        this.runs, this.fails, this.randomSeed, this.virtualClusters);
  }
}
