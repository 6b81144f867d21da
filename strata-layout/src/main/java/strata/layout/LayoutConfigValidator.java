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

import strata.ConfigValidator;
import strata.Constants;
import strata.Constants.ConfigurationKeys;
import strata.utils.Props;

/**
 * Validator of the layout configuration
 */
public class LayoutConfigValidator extends ConfigValidator {

  public LayoutConfigValidator(final Props strataProps) {
    super(strataProps);
  }

  /**
   * Validate the layout configuration
   *
   * @throws strata.InvalidStrataConfigException if configuration is invalid
   */
  @Override
  public void validate() {
    final int runs = getInt(ConfigurationKeys.LAYOUT_RUNS, Constants.DEFAULT_LAYOUT_RUNS);
    final int fails = getInt(ConfigurationKeys.LAYOUT_FAILS, Constants.DEFAULT_LAYOUT_FAILS);
    getLong(ConfigurationKeys.LAYOUT_RANDOM_SEED, Constants.DEFAULT_LAYOUT_RANDOM_SEED);
    final int maxPasses = getInt(ConfigurationKeys.RANKING_MAX_PASSES,
        Constants.DEFAULT_RANKING_MAX_PASSES);

    check(runs >= 1, ConfigurationKeys.LAYOUT_RUNS + " must >= 1");
    check(fails >= 0, ConfigurationKeys.LAYOUT_FAILS + " must >= 0");
    check(maxPasses >= 0, ConfigurationKeys.RANKING_MAX_PASSES + " must >= 0");
  }
}
