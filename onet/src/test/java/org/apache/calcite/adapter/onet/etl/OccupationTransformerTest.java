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
package org.apache.calcite.adapter.onet.etl;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for OccupationTransformer.
 */
@Tag("unit")
public class OccupationTransformerTest {

  private final OccupationTransformer transformer =
      new OccupationTransformer(new FieldNormalizer());

  @Test void testFirstOccurrenceWins() {
    OccupationResult result = transformer.transform(ImmutableList.of(
        new RawOccupationRecord("11-1011.00", "Chief Executives", "Plan and direct."),
        new RawOccupationRecord("11-1011.00 ", "CEO (duplicate)", "Other text."),
        new RawOccupationRecord("15-1252.00", "Software Developers", "Build software.")));

    assertEquals(2, result.getOccupations().size());
    NormalizedOccupation first = result.getOccupations().get(0);
    assertEquals("11-1011.00", first.getOnetsocCode());
    assertEquals("Chief Executives", first.getTitle());
    assertEquals("Plan and direct.", first.getDescription().toStagingValue());
    assertThat(result.getDuplicateCodes(), contains("11-1011.00"));
  }

  @Test void testMajorGroupAndTrimming() {
    OccupationResult result = transformer.transform(ImmutableList.of(
        new RawOccupationRecord("  29-1141.00 ", "  Registered   Nurses ", null)));

    NormalizedOccupation nurse = result.getOccupations().get(0);
    assertEquals("29-1141.00", nurse.getOnetsocCode());
    assertEquals("Registered Nurses", nurse.getTitle());
    assertEquals("29", nurse.getMajorGroupCode().toStagingValue());
    Map<String, Object> row = nurse.toRow();
    assertEquals("unavailable", row.get("description"));
    assertEquals("29", row.get("major_group_code"));
  }

  @Test void testMajorGroupDerivation() {
    assertEquals("11", OccupationTransformer.majorGroupCode("11-1011.00").toStagingValue());
    assertEquals("12", OccupationTransformer.majorGroupCode("123-45").toStagingValue());
    assertEquals("7", OccupationTransformer.majorGroupCode("7-1").toStagingValue());
    assertFalse(OccupationTransformer.majorGroupCode("1110110").isAvailable());
    assertFalse(OccupationTransformer.majorGroupCode("-1011.00").isAvailable());
  }

  @Test void testMalformedCodesPropagate() {
    OccupationResult result = transformer.transform(ImmutableList.of(
        new RawOccupationRecord("ab-cdef", "Odd Code", "kept as-is")));

    assertEquals(1, result.getOccupations().size());
    assertEquals("ab", result.getOccupations().get(0).getMajorGroupCode().toStagingValue());
    assertThat(result.getMalformedCodes(), contains("ab-cdef"));
  }

  @Test void testBlankCodeOrTitleSkipped() {
    OccupationResult result = transformer.transform(ImmutableList.of(
        new RawOccupationRecord("  ", "No Code", "x"),
        new RawOccupationRecord("11-1011.00", null, "No title"),
        new RawOccupationRecord("11-1011.00", "Chief Executives", "")));

    assertEquals(2, result.getSkippedBlank());
    assertEquals(1, result.getOccupations().size());
    assertEquals("Chief Executives", result.getOccupations().get(0).getTitle());
    assertTrue(result.getDuplicateCodes().isEmpty());
  }
}
