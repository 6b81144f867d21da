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

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import strata.Constants;
import strata.Constants.ConfigurationKeys;
import strata.utils.JSONUtils;
import strata.utils.Props;

public class StrataLayoutMainTest {

  @Rule
  public final TemporaryFolder temp = new TemporaryFolder();

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private PrintStream out;
  private File graphFile;

  @Before
  public void setUp() throws Exception {
    this.out = new PrintStream(this.bytes, true, StandardCharsets.UTF_8.name());
    this.graphFile = this.temp.newFile("graph.json");
    Files.write(this.graphFile.toPath(), ("{\"name\": \"cli\", \"nodes\": [\"a\", \"b\"],"
        + " \"edges\": [[\"a\", \"b\"]], \"clusters\": [{\"name\": \"c\", \"nodes\": [\"a\"]}]}")
        .getBytes(StandardCharsets.UTF_8));
  }

  private String output() throws Exception {
    return this.bytes.toString(StandardCharsets.UTF_8.name());
  }

  @Test
  @SuppressWarnings("unchecked")
  public void layout_is_printed_as_json() throws Exception {
    // given
    final File conf = this.temp.newFolder("conf");

    // when
    final int status = StrataLayoutMain.run(
        new String[]{"--graph", this.graphFile.getPath(), "--conf", conf.getPath()}, this.out);

    // then
    assertThat(status).isZero();
    final Map<String, Object> layout =
        (Map<String, Object>) JSONUtils.parseJSONFromString(output());
    assertThat(layout.get("name")).isEqualTo("cli");
    assertThat((Map<String, Object>) layout.get("nodes")).containsOnlyKeys("a", "b");
  }

  @Test
  public void layout_is_written_to_the_output_file() throws Exception {
    // given
    final File conf = this.temp.newFolder("conf");
    final File output = new File(this.temp.getRoot(), "layout.json");

    // when
    final int status = StrataLayoutMain.run(new String[]{"-g", this.graphFile.getPath(), "-c",
        conf.getPath(), "-o", output.getPath()}, this.out);

    // then
    assertThat(status).isZero();
    assertThat(output).exists();
    assertThat(JSONUtils.parseJSONFromFile(output)).isInstanceOf(Map.class);
    assertThat(output()).isEmpty();
  }

  @Test
  public void missing_graph_option_prints_help() throws Exception {
    // when
    final int status = StrataLayoutMain.run(new String[0], this.out);

    // then
    assertThat(status).isEqualTo(1);
    assertThat(output()).contains("--graph");
  }

  @Test
  public void unknown_option_prints_help() throws Exception {
    // when
    final int status = StrataLayoutMain.run(new String[]{"--bogus"}, this.out);

    // then
    assertThat(status).isEqualTo(1);
    assertThat(output()).contains("--graph");
  }

  @Test
  public void invalid_configuration_fails() throws Exception {
    // given
    final File conf = this.temp.newFolder("conf");
    Files.write(new File(conf, Constants.STRATA_PROPERTIES_FILE).toPath(),
        (ConfigurationKeys.LAYOUT_RUNS + "=0\n").getBytes(StandardCharsets.UTF_8));

    // when
    final int status = StrataLayoutMain.run(
        new String[]{"--graph", this.graphFile.getPath(), "--conf", conf.getPath()}, this.out);

    // then
    assertThat(status).isEqualTo(1);
  }

  @Test
  public void malformed_graph_fails() throws Exception {
    // given
    final File conf = this.temp.newFolder("conf");
    final File broken = this.temp.newFile("broken.json");
    Files.write(broken.toPath(), "{\"nodes\": [\"a\"], \"edges\": [[\"a\", \"a\"]]}"
        .getBytes(StandardCharsets.UTF_8));

    // when
    final int status = StrataLayoutMain.run(
        new String[]{"--graph", broken.getPath(), "--conf", conf.getPath()}, this.out);

    // then
    assertThat(status).isEqualTo(1);
  }

  @Test
  public void configuration_is_loaded_from_the_directory() throws Exception {
    // given
    final File conf = this.temp.newFolder("conf");
    Files.write(new File(conf, Constants.STRATA_PROPERTIES_FILE).toPath(),
        (ConfigurationKeys.LAYOUT_RUNS + "=3\n").getBytes(StandardCharsets.UTF_8));

    // when
    final Props props = StrataLayoutMain.loadConfigurationFromDirectory(conf);
    final Props empty = StrataLayoutMain.loadConfigurationFromDirectory(
        new File(this.temp.getRoot(), "missing"));

    // then
    assertThat(props.getInt(ConfigurationKeys.LAYOUT_RUNS)).isEqualTo(3);
    assertThat(empty.localKeySet()).isEmpty();
  }
}
