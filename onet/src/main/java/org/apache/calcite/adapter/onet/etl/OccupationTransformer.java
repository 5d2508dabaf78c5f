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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Cleans occupation master records.
 *
 * <p>Fields are cleaned with {@link FieldNormalizer}; records with a blank
 * code or title are skipped; later records repeating a code are discarded
 * without error; {@code major_group_code} is the first two characters before
 * the hyphen of the code; a missing description becomes
 * {@value StagingField#UNAVAILABLE}.
 *
 * <p>Codes that do not have the SOC shape are <em>not</em> rejected. They are
 * emitted as-is, with whatever major group their prefix yields, and listed in
 * {@link OccupationResult#getMalformedCodes()}. Such a major group will fail
 * the {@code dim_major_group} foreign key at load time.
 */
public class OccupationTransformer {

  private static final Logger LOGGER = LoggerFactory.getLogger(OccupationTransformer.class);

  private final FieldNormalizer normalizer;

  public OccupationTransformer(FieldNormalizer normalizer) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  public OccupationResult transform(List<RawOccupationRecord> records) {
    Set<String> seen = new HashSet<String>();
    List<NormalizedOccupation> out = new ArrayList<NormalizedOccupation>();
    List<String> duplicates = new ArrayList<String>();
    List<String> malformed = new ArrayList<String>();
    int skippedBlank = 0;

    for (RawOccupationRecord raw : records) {
      RawOccupationRecord record = normalizer.normalize(raw);
      String code = record.getOnetsocCode();
      String title = record.getTitle();
      if (code.isEmpty() || title.isEmpty()) {
        skippedBlank++;
        continue;
      }
      if (!seen.add(code)) {
        duplicates.add(code);
        continue;
      }
      if (!KeyValidator.isValidSocCode(code)) {
        malformed.add(code);
      }
      out.add(new NormalizedOccupation(code, title,
          StagingField.of(record.getDescription()), majorGroupCode(code)));
    }

    if (!duplicates.isEmpty()) {
      LOGGER.debug("Discarded {} duplicate occupation records", duplicates.size());
    }
    if (!malformed.isEmpty()) {
      LOGGER.debug("{} occupation codes do not match the SOC pattern: {}",
          malformed.size(), malformed);
    }
    return new OccupationResult(out, duplicates, malformed, skippedBlank);
  }

  /**
   * Returns the two-character major group of a code, taken from the part
   * before the first hyphen; unavailable if the code has no hyphen.
   */
  static StagingField majorGroupCode(String code) {
    int hyphen = code.indexOf('-');
    if (hyphen < 0) {
      return StagingField.unavailable();
    }
    String prefix = code.substring(0, hyphen);
    return StagingField.of(prefix.length() > 2 ? prefix.substring(0, 2) : prefix);
  }
}
