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

import java.util.List;

/**
 * Output of {@link OccupationTransformer}: the deduplicated occupations plus
 * pre-load diagnostics. Occupations have no quarantine stream, so the
 * diagnostics are informational only.
 */
public final class OccupationResult {

  private final ImmutableList<NormalizedOccupation> occupations;
  private final ImmutableList<String> duplicateCodes;
  private final ImmutableList<String> malformedCodes;
  private final int skippedBlank;

  OccupationResult(List<NormalizedOccupation> occupations, List<String> duplicateCodes,
      List<String> malformedCodes, int skippedBlank) {
    this.occupations = ImmutableList.copyOf(occupations);
    this.duplicateCodes = ImmutableList.copyOf(duplicateCodes);
    this.malformedCodes = ImmutableList.copyOf(malformedCodes);
    this.skippedBlank = skippedBlank;
  }

  /**
   * Returns one occupation per code, in first-occurrence order.
   */
  public List<NormalizedOccupation> getOccupations() {
    return occupations;
  }

  /**
   * Returns each code whose later occurrences were discarded, once per
   * discarded record.
   */
  public List<String> getDuplicateCodes() {
    return duplicateCodes;
  }

  /**
   * Returns emitted codes that do not have the SOC shape. They are kept as-is
   * and their major group may not resolve at load time.
   */
  public List<String> getMalformedCodes() {
    return malformedCodes;
  }

  /**
   * Returns how many records were skipped for a blank code or title.
   */
  public int getSkippedBlank() {
    return skippedBlank;
  }

  @Override public String toString() {
    return "OccupationResult{occupations=" + occupations.size()
        + ", duplicates=" + duplicateCodes.size()
        + ", malformed=" + malformedCodes.size()
        + ", skippedBlank=" + skippedBlank + "}";
  }
}
