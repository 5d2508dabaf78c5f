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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of row validation by a {@link Validator}.
 *
 * <p>A row is either valid, or quarantined with exactly one
 * {@link RejectionReason}. There is no "fail the batch" outcome: a bad row
 * never stops the rest of the batch.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * ValidationResult result = validator.validate(row);
 * if (result.isValid()) {
 *   valid.add(normalize(row));
 * } else {
 *   invalid.add(new InvalidSkaRow(domain, original, result.getReason()));
 * }
 * }</pre>
 *
 * @see Validator
 */
public final class ValidationResult {

  /**
   * Actions that can be taken for a validated row.
   */
  public enum Action {
    /** Row is valid, route to the normalized output. */
    VALID,
    /** Row is invalid, route to quarantine with its reason. */
    QUARANTINE
  }

  private static final ValidationResult VALID_RESULT =
      new ValidationResult(Action.VALID, null);

  private static final Map<RejectionReason, ValidationResult> QUARANTINE_RESULTS =
      new EnumMap<RejectionReason, ValidationResult>(RejectionReason.class);

  static {
    for (RejectionReason reason : RejectionReason.values()) {
      QUARANTINE_RESULTS.put(reason, new ValidationResult(Action.QUARANTINE, reason));
    }
  }

  private final Action action;
  private final @Nullable RejectionReason reason;

  private ValidationResult(Action action, @Nullable RejectionReason reason) {
    this.action = action;
    this.reason = reason;
  }

  /**
   * Returns a valid result indicating the row passes validation.
   */
  public static ValidationResult valid() {
    return VALID_RESULT;
  }

  /**
   * Returns a result routing the row to quarantine.
   *
   * @param reason why the row is invalid
   */
  public static ValidationResult quarantine(RejectionReason reason) {
    return QUARANTINE_RESULTS.get(Objects.requireNonNull(reason, "reason"));
  }

  public Action getAction() {
    return action;
  }

  /**
   * Returns the rejection reason.
   *
   * @return The reason, or null for valid results
   */
  public @Nullable RejectionReason getReason() {
    return reason;
  }

  public boolean isValid() {
    return action == Action.VALID;
  }

  @Override public String toString() {
    if (action == Action.VALID) {
      return "ValidationResult{VALID}";
    }
    return "ValidationResult{" + action + ", reason='" + reason + "'}";
  }
}
