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
package strata.utils;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.codehaus.jackson.JsonFactory;
import org.codehaus.jackson.JsonNode;
import org.codehaus.jackson.JsonParser;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.map.ObjectWriter;

public class JSONUtils {

  /**
   * The constructor. Cannot construct this class.
   */
  private JSONUtils() {
  }

  public static String toJSON(final Object obj) {
    return toJSON(obj, false);
  }

  public static String toJSON(final Object obj, final boolean prettyPrint) {
    final ObjectMapper mapper = new ObjectMapper();

    try {
      if (prettyPrint) {
        final ObjectWriter writer = mapper.writerWithDefaultPrettyPrinter();
        return writer.writeValueAsString(obj);
      }
      return mapper.writeValueAsString(obj);
    } catch (final Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static void toJSON(final Object obj, final OutputStream stream,
      final boolean prettyPrint) {
    final ObjectMapper mapper = new ObjectMapper();
    try {
      if (prettyPrint) {
        final ObjectWriter writer = mapper.writerWithDefaultPrettyPrinter();
        writer.writeValue(stream, obj);
        return;
      }
      mapper.writeValue(stream, obj);
    } catch (final Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static void toJSON(final Object obj, final File file, final boolean prettyPrint)
      throws IOException {
    try (final BufferedOutputStream stream =
        new BufferedOutputStream(new FileOutputStream(file))) {
      toJSON(obj, stream, prettyPrint);
    }
  }

  public static Object parseJSONFromString(final String json) throws IOException {
    final ObjectMapper mapper = new ObjectMapper();
    final JsonFactory factory = new JsonFactory();
    final JsonParser parser = factory.createJsonParser(json);
    final JsonNode node = mapper.readTree(parser);

    return toObjectFromJSONNode(node);
  }

  public static Object parseJSONFromFile(final File file) throws IOException {
    final ObjectMapper mapper = new ObjectMapper();
    final JsonFactory factory = new JsonFactory();
    final JsonParser parser = factory.createJsonParser(file);
    final JsonNode node = mapper.readTree(parser);

    return toObjectFromJSONNode(node);
  }

  /**
   * Objects keep the field order of the document, which the graph loader relies on to create
   * nodes and clusters in a stable order.
   */
  private static Object toObjectFromJSONNode(final JsonNode node) {
    if (node.isObject()) {
      final Map<String, Object> obj = new LinkedHashMap<>();
      final Iterator<String> iter = node.getFieldNames();
      while (iter.hasNext()) {
        final String fieldName = iter.next();
        final JsonNode subNode = node.get(fieldName);
        final Object subObj = toObjectFromJSONNode(subNode);
        obj.put(fieldName, subObj);
      }

      return obj;
    } else if (node.isArray()) {
      final List<Object> array = new ArrayList<>();
      final Iterator<JsonNode> iter = node.getElements();
      while (iter.hasNext()) {
        final JsonNode element = iter.next();
        final Object subObject = toObjectFromJSONNode(element);
        array.add(subObject);
      }
      return array;
    } else if (node.isTextual()) {
      return node.asText();
    } else if (node.isNumber()) {
      if (node.isInt()) {
        return node.asInt();
      } else if (node.isLong()) {
        return node.asLong();
      } else {
        return node.asDouble();
      }
    } else if (node.isBoolean()) {
      return node.asBoolean();
    } else {
      return null;
    }
  }
}
