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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Batch-level checks over one domain's normalized rows, run before they are
 * handed to the loader.
 *
 * <p>Findings are returned as messages rather than thrown; the fact build
 * enforces grain uniqueness itself, so a duplicate here is a warning.
 */
public class StagingValidator {

  /**
   * Checks that no key column holds the staging marker, every code has the
   * SOC shape, and each {@code (onetsoc_code, element_id, scale_id)} triple
   * occurs at most once.
   *
   * @return one message per failed check, empty if all pass
   */
  public List<String> validate(PartitionResult result) {
    String table = result.getDomain().getStagingTable();
    int unavailableKeys = 0;
    int badSoc = 0;
    Set<String> grains = new HashSet<String>();
    Set<String> duplicateGrains = new HashSet<String>();

    for (NormalizedSkaRow row : result.getValid()) {
      if (StagingField.UNAVAILABLE.equals(row.getOnetsocCode())
          || StagingField.UNAVAILABLE.equals(row.getElementId())
          || StagingField.UNAVAILABLE.equals(row.getScaleId())) {
        unavailableKeys++;
      }
      if (!KeyValidator.isValidSocCode(row.getOnetsocCode())) {
        badSoc++;
      }
      String grain = row.getOnetsocCode() + '|' + row.getElementId() + '|' + row.getScaleId();
      if (!grains.add(grain)) {
        duplicateGrains.add(grain);
      }
    }

    List<String> errors = new ArrayList<String>();
    if (unavailableKeys > 0) {
      errors.add("'" + table + "' has '" + StagingField.UNAVAILABLE + "' in key columns ("
          + unavailableKeys + " rows)");
    }
    if (badSoc > 0) {
      errors.add("'" + table + "' has invalid SOC format in onetsoc_code (" + badSoc + " rows)");
    }
    if (!duplicateGrains.isEmpty()) {
      errors.add("Duplicate (onetsoc_code, element_id, scale_id) rows in " + table + " ("
          + duplicateGrains.size() + " keys)");
    }
    return errors;
  }
}
