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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks the join keys of a rating row.
 *
 * <p>Three predicates run in a fixed order and the first failure wins:
 * <ol>
 *   <li>{@code onetsoc_code} has the SOC shape {@code NN-NNNN.NN}, else
 *       {@link RejectionReason#INVALID_SOC_FORMAT}</li>
 *   <li>{@code element_id} is non-empty and a known element, else
 *       {@link RejectionReason#MISSING_ELEMENT_ID}</li>
 *   <li>{@code scale_id} is a supported scale, else
 *       {@link RejectionReason#INVALID_SCALE_ID}</li>
 * </ol>
 * The order is part of the contract; reason counts downstream depend on it.
 */
public class KeyValidator implements Validator {

  /** O*NET-SOC code, e.g. {@code 11-1011.00}. Fixed, not configurable. */
  public static final Pattern SOC_CODE_PATTERN = Pattern.compile("^\\d{2}-\\d{4}\\.\\d{2}$");

  private final LookupRegistries registries;

  public KeyValidator(LookupRegistries registries) {
    this.registries = Objects.requireNonNull(registries, "registries");
  }

  public static boolean isValidSocCode(@Nullable String code) {
    return code != null && SOC_CODE_PATTERN.matcher(code).matches();
  }

  @Override public ValidationResult validate(RawSkaRecord row) {
    if (!isValidSocCode(row.getOnetsocCode())) {
      return ValidationResult.quarantine(RejectionReason.INVALID_SOC_FORMAT);
    }
    String elementId = row.getElementId();
    if (elementId == null || elementId.isEmpty() || !registries.isKnownElement(elementId)) {
      return ValidationResult.quarantine(RejectionReason.MISSING_ELEMENT_ID);
    }
    if (!registries.isSupportedScale(row.getScaleId())) {
      return ValidationResult.quarantine(RejectionReason.INVALID_SCALE_ID);
    }
    return ValidationResult.valid();
  }
}
