/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.onet;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

/**
 * Utility methods for reading YAML or JSON configuration documents.
 *
 * <p>YAML is parsed with SnakeYAML so anchors and aliases are resolved, then
 * converted to a Jackson {@link JsonNode}. JSON documents go straight through
 * Jackson.
 */
public class YamlUtils {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private YamlUtils() {
  }

  /**
   * Parses a YAML or JSON stream.
   *
   * @param stream InputStream containing YAML or JSON data
   * @param resourceName Name of resource (used to determine format by extension)
   * @return JsonNode with all YAML anchors/aliases resolved
   * @throws IOException if the stream cannot be read or parsed
   */
  public static JsonNode parseYamlOrJson(InputStream stream, String resourceName)
      throws IOException {
    if (resourceName.endsWith(".yaml") || resourceName.endsWith(".yml")) {
      Yaml yaml = new Yaml(new LoaderOptions());
      Object parsedYaml;
      try {
        parsedYaml = yaml.load(stream);
      } catch (RuntimeException e) {
        throw new IOException("Malformed YAML in " + resourceName + ": " + e.getMessage(), e);
      }
      return JSON_MAPPER.convertValue(parsedYaml, JsonNode.class);
    }
    return JSON_MAPPER.readTree(stream);
  }

  /**
   * Parses a YAML or JSON stream into a plain map.
   *
   * @return the top-level mapping, or an empty map for an empty document
   * @throws IOException if the stream cannot be read or the top level is not a mapping
   */
  public static Map<String, Object> parseToMap(InputStream stream, String resourceName)
      throws IOException {
    JsonNode node = parseYamlOrJson(stream, resourceName);
    if (node == null || node.isNull() || node.isMissingNode()) {
      return Collections.emptyMap();
    }
    if (!node.isObject()) {
      throw new IOException("Expected a mapping at the top of " + resourceName
          + ", got " + node.getNodeType());
    }
    return JSON_MAPPER.convertValue(node, new TypeReference<Map<String, Object>>() { });
  }
}
