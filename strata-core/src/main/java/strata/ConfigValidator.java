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

import static java.util.Objects.requireNonNull;

import strata.utils.Props;

/**
 * Validator of Strata configuration.
 * Inheriting class will need to implement its own validation logic.
 * E.g: the layout will need to validate its sweep budget.
 */
public abstract class ConfigValidator {

  protected final Props props;

  public ConfigValidator(final Props strataProps) {
    this.props = requireNonNull(strataProps, "strataProps cannot be null");
  }

  /**
   * Same contract as Guava's Preconditions.checkArgument, with a configuration error instead.
   *
   * Ensures the truth of an expression involving one or more parameters to the calling method.
   *
   * @param expression a boolean expression
   * @param errorMessage the exception message to use if the check fails;
   * @throws InvalidStrataConfigException if {@code expression} is false
   */
  protected final void check(final boolean expression, final String errorMessage) {
    if (!expression) {
      throw new InvalidStrataConfigException(errorMessage);
    }
  }

  /**
   * Returns int representation of the value.
   *
   * @param configKey the config key
   * @param defaultValue default value to return if value is null;
   * @return the value of the {@param configKey}
   * @throws InvalidStrataConfigException if value is non-int.
   */
  protected final int getInt(final String configKey, final int defaultValue) {
    try {
      return this.props.getInt(configKey, defaultValue);
    } catch (final NumberFormatException e) {
      throw new InvalidStrataConfigException(String.format("Invalid strata config value for key"
          + " : %s", configKey));
    }
  }

  /**
   * Returns long representation of the value.
   *
   * @param configKey the config key
   * @param defaultValue default value to return if value is null;
   * @return the value of the {@param configKey}
   * @throws InvalidStrataConfigException if value is non-long.
   */
  protected final long getLong(final String configKey, final long defaultValue) {
    try {
      return this.props.getLong(configKey, defaultValue);
    } catch (final NumberFormatException e) {
      throw new InvalidStrataConfigException(String.format("Invalid strata config value for key"
          + " : %s", configKey));
    }
  }

  /**
   * Validate the configuration
   *
   * @throws InvalidStrataConfigException if configuration is invalid
   */
  abstract public void validate();
}
