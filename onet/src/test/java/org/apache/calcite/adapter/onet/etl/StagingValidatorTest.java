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

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for StagingValidator.
 */
@Tag("unit")
public class StagingValidatorTest {

  private final StagingValidator validator = new StagingValidator();

  private static NormalizedSkaRow row(String code, String element, String scale) {
    return NormalizedSkaRow.builder()
        .domain(Domain.KNOWLEDGE)
        .onetsocCode(code)
        .elementId(element)
        .scaleId(scale)
        .measures(new RatingMeasures(2.0, null, null, null, null))
        .build();
  }

  private static PartitionResult partition(NormalizedSkaRow... rows) {
    return new PartitionResult(Domain.KNOWLEDGE, ImmutableList.copyOf(rows),
        ImmutableList.<InvalidSkaRow>of(), 0);
  }

  @Test void testCleanBatch() {
    List<String> errors = validator.validate(partition(
        row("11-1011.00", "2.C.1.a", "IM"),
        row("11-1011.00", "2.C.1.a", "LV")));
    assertTrue(errors.isEmpty());
  }

  @Test void testDuplicateGrain() {
    List<String> errors = validator.validate(partition(
        row("11-1011.00", "2.C.1.a", "IM"),
        row("11-1011.00", "2.C.1.a", "IM")));
    assertEquals(1, errors.size());
    assertTrue(errors.get(0).contains("stg_knowledge"));
    assertTrue(errors.get(0).startsWith("Duplicate"));
  }

  @Test void testMarkerInKeysAndBadSoc() {
    List<String> errors = validator.validate(partition(
        row("unavailable", "2.C.1.a", "IM")));
    assertEquals(2, errors.size());
    assertTrue(errors.get(0).contains("'unavailable' in key columns"));
    assertTrue(errors.get(1).contains("invalid SOC format"));
  }
}
