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

import org.apache.calcite.adapter.onet.etl.Domain;
import org.apache.calcite.adapter.onet.etl.LookupRegistries;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TransformConfig.
 */
@Tag("unit")
public class TransformConfigTest {

  private static InputStream resource(String name) {
    InputStream stream = TransformConfigTest.class.getClassLoader().getResourceAsStream(name);
    assertNotNull(stream, "Missing test resource " + name);
    return stream;
  }

  @Test void testDefaults() {
    TransformConfig config = TransformConfig.defaults();
    assertTrue(config.isCollapseWhitespace());
    assertEquals(TransformConfig.DEFAULT_DATE_FORMATS, config.getDateFormats());
    assertNull(config.getLookups());
  }

  @Test void testFromNullMap() {
    assertTrue(TransformConfig.fromMap(null).isCollapseWhitespace());
  }

  @Test void testBundledDefaultResource() {
    TransformConfig config = TransformConfig.loadDefault();
    assertTrue(config.isCollapseWhitespace());
    assertEquals(ImmutableList.of("yyyy-MM-dd", "MM/dd/yyyy", "yyyy/MM/dd"),
        config.getDateFormats());
    assertNull(config.getLookups());
  }

  @Test void testLoadYamlWithLookups() throws IOException {
    TransformConfig config;
    try (InputStream in = resource("test-transform.yaml")) {
      config = TransformConfig.load(in, "test-transform.yaml");
    }

    assertEquals(ImmutableList.of("yyyy-MM-dd", "MM/dd/yyyy"), config.getDateFormats());
    LookupRegistries lookups = config.getLookups();
    assertNotNull(lookups);
    assertThat(lookups.getElements(),
        containsInAnyOrder("2.A.1.a", "2.A.1.b", "2.C.3.b", "1.A.1.a.1"));
    assertThat(lookups.getScales(), containsInAnyOrder("IM", "LV"));
    assertThat(lookups.getDomains(),
        containsInAnyOrder(Domain.SKILL, Domain.KNOWLEDGE, Domain.ABILITY));
  }

  @Test void testLoadJson() throws IOException {
    TransformConfig config;
    try (InputStream in = resource("test-transform.json")) {
      config = TransformConfig.load(in, "test-transform.json");
    }

    assertFalse(config.isCollapseWhitespace());
    assertEquals(TransformConfig.DEFAULT_DATE_FORMATS, config.getDateFormats());
    assertTrue(config.getLookups().isKnownElement("2.A.1.a"));
    assertTrue(config.getLookups().isSupportedScale("IM"));
    assertTrue(config.getLookups().isKnownDomain(Domain.ABILITY));
  }

  @Test void testCollapseFlagAsString() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("collapseWhitespace", "false");
    assertFalse(TransformConfig.fromMap(map).isCollapseWhitespace());
  }

  @Test void testRejectsMalformedSections() {
    assertThrows(OnetDataException.class,
        () -> TransformConfig.fromMap(ImmutableMap.<String, Object>of("dateFormats", "yyyy")));
    assertThrows(OnetDataException.class,
        () -> TransformConfig.fromMap(ImmutableMap.<String, Object>of("lookups", "none")));
    assertThrows(OnetDataException.class,
        () -> TransformConfig.fromMap(ImmutableMap.<String, Object>of("lookups",
            ImmutableMap.of("domains", ImmutableList.of("occupation")))));
  }

  @Test void testMalformedYaml() {
    InputStream in = new ByteArrayInputStream(
        "lookups: [unclosed".getBytes(StandardCharsets.UTF_8));
    assertThrows(IOException.class, () -> TransformConfig.load(in, "broken.yaml"));
  }

  @Test void testTopLevelMustBeMapping() {
    InputStream in = new ByteArrayInputStream(
        "- a\n- b\n".getBytes(StandardCharsets.UTF_8));
    assertThrows(IOException.class, () -> TransformConfig.load(in, "list.yml"));
  }

  @Test void testEmptyDocumentGivesDefaults() throws IOException {
    InputStream in = new ByteArrayInputStream(new byte[0]);
    TransformConfig config = TransformConfig.load(in, "empty.yaml");
    assertTrue(config.isCollapseWhitespace());
  }
}
