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

import org.apache.calcite.adapter.onet.OnetDataException;
import org.apache.calcite.adapter.onet.TransformConfig;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RowPartitioner.
 */
@Tag("unit")
public class RowPartitionerTest {

  private static final LookupRegistries REGISTRIES = LookupRegistries.builder()
      .elements(ImmutableSet.of("2.A.1.a", "2.A.1.b", "2.C.3.b"))
      .build();

  private final RowPartitioner partitioner =
      new RowPartitioner(REGISTRIES, TransformConfig.defaults());

  private static RawSkaRecord.Builder validRow() {
    return RawSkaRecord.builder()
        .onetsocCode("11-1011.00")
        .elementId("2.A.1.a")
        .scaleId("IM")
        .dataValue("3.5");
  }

  @Test void testValidRowIsNormalized() {
    PartitionResult result = partitioner.partition(Domain.SKILL,
        ImmutableList.of(validRow().build()));

    assertEquals(1, result.getValidCount());
    assertEquals(0, result.getInvalidCount());
    NormalizedSkaRow row = result.getValid().get(0);
    assertEquals(Domain.SKILL, row.getDomain());
    assertEquals("11-1011.00", row.getOnetsocCode());
    assertEquals("2.A.1.a", row.getElementId());
    assertEquals("IM", row.getScaleId());
    assertEquals(3.5, row.getDataValue(), 0.0);
  }

  @Test void testBadSocCodeKeepsOriginalValues() {
    RawSkaRecord raw = validRow()
        .onetsocCode("bad-code")
        .dataValue(" 3.5 ")
        .notRelevant("")
        .build();

    PartitionResult result = partitioner.partition(Domain.SKILL, ImmutableList.of(raw));

    assertEquals(0, result.getValidCount());
    InvalidSkaRow invalid = result.getInvalid().get(0);
    assertEquals(RejectionReason.INVALID_SOC_FORMAT, invalid.getReason());
    assertSame(raw, invalid.getOriginal());
    Map<String, String> row = invalid.toRow();
    assertEquals("SKILL", row.get("domain"));
    assertEquals("bad-code", row.get("onetsoc_code"));
    assertEquals(" 3.5 ", row.get("data_value"));
    assertEquals("", row.get("not_relevant"));
    assertNull(row.get("n"));
    assertEquals("invalid_soc_format", row.get("error_reason"));
  }

  @Test void testUnparsableDataValueIsQuarantined() {
    PartitionResult result = partitioner.partition(Domain.KNOWLEDGE,
        ImmutableList.of(validRow().dataValue("N/A").build()));

    assertEquals(0, result.getValidCount());
    assertEquals(RejectionReason.INVALID_NUMERIC_DATA_VALUE,
        result.getInvalid().get(0).getReason());
  }

  @Test void testKeyReasonTakesPrecedenceOverDataValue() {
    PartitionResult result = partitioner.partition(Domain.KNOWLEDGE,
        ImmutableList.of(validRow().scaleId("XX").dataValue("N/A").build()));

    assertEquals(RejectionReason.INVALID_SCALE_ID, result.getInvalid().get(0).getReason());
  }

  @Test void testInvertedIntervalIsSwapped() {
    PartitionResult result = partitioner.partition(Domain.ABILITY,
        ImmutableList.of(validRow().lowerCiBound("4.2").upperCiBound("1.1").build()));

    assertEquals(1, result.getValidCount());
    assertEquals(1, result.getRepairedIntervals());
    RatingMeasures measures = result.getValid().get(0).getMeasures();
    assertEquals(1.1, measures.getLowerCiBound(), 0.0);
    assertEquals(4.2, measures.getUpperCiBound(), 0.0);
  }

  @Test void testMissingMeasuresStayAbsent() {
    PartitionResult result = partitioner.partition(Domain.SKILL,
        ImmutableList.of(validRow().n("").standardError("n/a").build()));

    NormalizedSkaRow row = result.getValid().get(0);
    assertNull(row.getMeasures().getN());
    assertNull(row.getMeasures().getStandardError());
    assertTrue(row.toStagingRow().containsKey("n"));
    assertNull(row.toStagingRow().get("n"));
  }

  @Test void testMetadataNormalization() {
    PartitionResult result = partitioner.partition(Domain.SKILL, ImmutableList.of(
        validRow()
            .scaleId(" lv ")
            .recommendSuppress("n")
            .notRelevant("")
            .dateUpdated("08/01/2023")
            .domainSource("  Analyst ")
            .build()));

    Map<String, Object> staging = result.getValid().get(0).toStagingRow();
    assertEquals("LV", staging.get("scale_id"));
    assertEquals("N", staging.get("recommend_suppress"));
    assertEquals("unavailable", staging.get("not_relevant"));
    assertEquals("2023-08-01", staging.get("date_updated"));
    assertEquals("Analyst", staging.get("domain_source"));

    Map<String, Object> fact = result.getValid().get(0).toFactRow();
    assertEquals("N", fact.get("recommend_suppress"));
    assertNull(fact.get("not_relevant"));
    assertEquals("2023-08-01", fact.get("date_updated"));
  }

  @Test void testConservationAndStableOrder() {
    List<RawSkaRecord> input = ImmutableList.of(
        validRow().elementId("2.A.1.a").build(),
        validRow().onetsocCode("bad").build(),
        validRow().elementId("2.A.1.b").build(),
        validRow().elementId("unknown").build(),
        validRow().elementId("2.C.3.b").build(),
        validRow().scaleId("ZZ").build(),
        validRow().dataValue("").build());

    PartitionResult result = partitioner.partition(Domain.SKILL, input);

    assertEquals(input.size(), result.getValidCount() + result.getInvalidCount());
    assertEquals(input.size(), result.getInputCount());
    List<String> elements = new ArrayList<String>();
    for (NormalizedSkaRow row : result.getValid()) {
      elements.add(row.getElementId());
    }
    assertThat(elements, contains("2.A.1.a", "2.A.1.b", "2.C.3.b"));
    List<RejectionReason> reasons = new ArrayList<RejectionReason>();
    for (InvalidSkaRow row : result.getInvalid()) {
      reasons.add(row.getReason());
    }
    assertThat(reasons, contains(RejectionReason.INVALID_SOC_FORMAT,
        RejectionReason.MISSING_ELEMENT_ID, RejectionReason.INVALID_SCALE_ID,
        RejectionReason.INVALID_NUMERIC_DATA_VALUE));
    assertEquals(1, result.getReasonCount(RejectionReason.INVALID_SCALE_ID));
    assertEquals(4, result.getReasonCounts().size());
  }

  @Test void testNormalizedOutputIsAFixedPoint() {
    List<RawSkaRecord> input = ImmutableList.of(
        validRow().lowerCiBound("4.2").upperCiBound("1.1").n("25").build(),
        validRow().elementId("2.A.1.b").scaleId("lv").recommendSuppress("true")
            .dateUpdated("2023/08/01").domainSource("Incumbent").build(),
        validRow().elementId("missing").build());
    PartitionResult first = partitioner.partition(Domain.SKILL, input);

    List<RawSkaRecord> again = new ArrayList<RawSkaRecord>();
    for (NormalizedSkaRow row : first.getValid()) {
      again.add(row.toRawRecord());
    }
    PartitionResult second = partitioner.partition(Domain.SKILL, again);

    assertEquals(first.getValid(), second.getValid());
    assertEquals(0, second.getInvalidCount());
    assertEquals(0, second.getRepairedIntervals());
  }

  @Test void testDeterministic() {
    List<RawSkaRecord> input = ImmutableList.of(
        validRow().build(),
        validRow().onetsocCode("x").build(),
        validRow().lowerCiBound("9").upperCiBound("1").build());

    PartitionResult first = partitioner.partition(Domain.SKILL, input);
    PartitionResult second = partitioner.partition(Domain.SKILL, input);

    assertEquals(first.getValid(), second.getValid());
    assertEquals(first.getInvalid(), second.getInvalid());
  }

  @Test void testDomainOutsideRegistryIsACallerError() {
    RowPartitioner skillsOnly = new RowPartitioner(LookupRegistries.builder()
        .elements(ImmutableSet.of("2.A.1.a"))
        .domains(ImmutableSet.of(Domain.SKILL))
        .build(), TransformConfig.defaults());

    assertThrows(OnetDataException.class,
        () -> skillsOnly.partition(Domain.ABILITY, ImmutableList.of(validRow().build())));
  }

  @Test void testEmptyInput() {
    PartitionResult result = partitioner.partition(Domain.SKILL,
        ImmutableList.<RawSkaRecord>of());
    assertEquals(0, result.getInputCount());
    assertTrue(result.getReasonCounts().isEmpty());
  }
}
