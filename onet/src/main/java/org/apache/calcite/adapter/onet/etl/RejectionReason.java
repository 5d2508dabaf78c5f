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

/**
 * Stable reason codes persisted with quarantined rating rows.
 *
 * <p>Declaration order is the precedence order: when a row fails several checks
 * only the first failing one in this order is reported.
 */
public enum RejectionReason {
  /** {@code onetsoc_code} is not of the form {@code 11-1011.00}. */
  INVALID_SOC_FORMAT("invalid_soc_format"),
  /** {@code element_id} is empty or not a known element. */
  MISSING_ELEMENT_ID("missing_element_id"),
  /** {@code scale_id} is not a supported scale. */
  INVALID_SCALE_ID("invalid_scale_id"),
  /** {@code data_value} is not a decimal number. */
  INVALID_NUMERIC_DATA_VALUE("invalid_numeric_data_value");

  private final String code;

  RejectionReason(String code) {
    this.code = code;
  }

  /**
   * Returns the code written to the {@code error_reason} column.
   */
  public String getCode() {
    return code;
  }

  @Override public String toString() {
    return code;
  }
}
