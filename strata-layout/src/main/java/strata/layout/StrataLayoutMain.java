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

import static strata.Constants.DEFAULT_CONF_PATH;
import static strata.Constants.STRATA_PROPERTIES_FILE;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.InvalidStrataConfigException;
import strata.graph.ClusterGraph;
import strata.graph.ClusterGraphException;
import strata.graph.ClusterGraphLoader;
import strata.utils.JSONUtils;
import strata.utils.Props;

/**
 * Command line entry point: lays out a cluster graph read from a JSON file and writes the layout
 * as JSON.
 *
 * <pre>
 * StrataLayoutMain --graph graph.json [--conf conf] [--output layout.json]
 * </pre>
 */
public class StrataLayoutMain {

  private static final Logger logger = LoggerFactory.getLogger(StrataLayoutMain.class);

  public static void main(final String[] args) throws Exception {
    final int status = run(args, System.out);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * @return the exit status, 0 on success
   */
  static int run(final String[] args, final PrintStream out) throws IOException {
    final OptionParser parser = new OptionParser();
    final OptionSpec<String> graphOption = parser
        .acceptsAll(Arrays.asList("g", "graph"), "The cluster graph JSON file.")
        .withRequiredArg()
        .describedAs("graph")
        .ofType(String.class);
    final OptionSpec<String> confOption = parser
        .acceptsAll(Arrays.asList("c", "conf"), "The conf directory for Strata.")
        .withRequiredArg()
        .describedAs("conf")
        .ofType(String.class);
    final OptionSpec<String> outputOption = parser
        .acceptsAll(Arrays.asList("o", "output"), "The layout JSON file. Defaults to stdout.")
        .withRequiredArg()
        .describedAs("output")
        .ofType(String.class);

    final OptionSet options;
    try {
      options = parser.parse(args);
    } catch (final OptionException e) {
      logger.error("Invalid arguments: " + e.getMessage());
      parser.printHelpOn(out);
      return 1;
    }
    if (!options.has(graphOption)) {
      logger.error("Missing required option --graph");
      parser.printHelpOn(out);
      return 1;
    }

    final Props props = options.has(confOption)
        ? loadConfigurationFromDirectory(new File(options.valueOf(confOption)))
        : loadConfigurationFromDirectory(new File(DEFAULT_CONF_PATH));

    final LayoutResult result;
    try {
      final LayoutConfig config = LayoutConfig.fromProps(props);
      final ClusterGraph graph = new ClusterGraphLoader()
          .load(new File(options.valueOf(graphOption)));
      result = new LayeredClusterLayout(config).call(graph);
    } catch (final InvalidStrataConfigException | ClusterGraphException | LayoutException
        | IOException e) {
      logger.error("Layout failed: " + e.getMessage(), e);
      return 1;
    }

    if (options.has(outputOption)) {
      final File output = new File(options.valueOf(outputOption));
      JSONUtils.toJSON(result.toMap(), output, true);
      logger.info("Wrote layout to " + output.getPath());
    } else {
      out.println(JSONUtils.toJSON(result.toMap(), true));
    }
    return 0;
  }

  /**
   * Loads {@value strata.Constants#STRATA_PROPERTIES_FILE} from the directory if it exists.
   *
   * @return the loaded settings, empty settings if there are none
   */
  static Props loadConfigurationFromDirectory(final File dir) throws IOException {
    final File propsFile = new File(dir, STRATA_PROPERTIES_FILE);
    if (propsFile.isFile()) {
      logger.info("Loading strata properties file " + propsFile.getPath());
      return new Props(null, propsFile);
    }
    logger.info("No " + STRATA_PROPERTIES_FILE + " in " + dir.getPath() + ", using defaults");
    return new Props();
  }
}
