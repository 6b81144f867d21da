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

package strata;

/**
 * Constants used in configuration files or shared among classes.
 *
 * <p>Conventions:
 *
 * <p>Internal constants to be put in the {@link Constants} class
 *
 * <p>Configuration keys to be put in the {@link ConfigurationKeys} class
 *
 * <p>Use '.' to separate name spaces and '_" to separate words in the same namespace. e.g.
 * strata.layout.some_key</p>
 */
public class Constants {

  // Name of the implicit root cluster of every cluster graph
  public static final String ROOT_CLUSTER_NAME = "root";

  // Names and paths of various file names to configure Strata
  public static final String STRATA_PROPERTIES_FILE = "strata.properties";
  public static final String DEFAULT_CONF_PATH = "conf";

  // Defaults of the crossing reduction sweep control. A round ends after this many consecutive
  // sweeps without improvement (plus one).
  public static final int DEFAULT_LAYOUT_FAILS = 4;
  // Number of restart rounds with randomly permuted sibling orders.
  public static final int DEFAULT_LAYOUT_RUNS = 15;
  public static final long DEFAULT_LAYOUT_RANDOM_SEED = 1L;

  // Upper bound of balancing passes of the default ranking primitive
  public static final int DEFAULT_RANKING_MAX_PASSES = 64;

  public static class ConfigurationKeys {

    public static final String LAYOUT_RUNS = "strata.layout.runs";
    public static final String LAYOUT_FAILS = "strata.layout.fails";
    public static final String LAYOUT_RANDOM_SEED = "strata.layout.random_seed";
    public static final String LAYOUT_VIRTUAL_CLUSTERS = "strata.layout.virtual_clusters";
    public static final String RANKING_MAX_PASSES = "strata.ranking.max_passes";
  }
}
