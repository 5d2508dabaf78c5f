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

import java.util.regex.Pattern;

/**
 * Converts the textual measures of a rating row to numbers.
 *
 * <p>Text that is not a plain decimal number (empty, {@code NaN}, {@code N/A},
 * hex floats, {@code Infinity}, Java type suffixes) is absent: the result is
 * null, never zero or a negative sentinel. Only {@code data_value} is
 * mandatory; {@link #validate(RawSkaRecord)} rejects rows where it is absent.
 */
public class NumericCoercer implements Validator {

  private static final Pattern DECIMAL =
      Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

  /**
   * Parses a decimal number.
   *
   * @return the value, or null if the text is not a finite decimal number
   */
  public @Nullable Double coerce(@Nullable String text) {
    if (text == null) {
      return null;
    }
    String s = text.trim();
    if (s.isEmpty() || !DECIMAL.matcher(s).matches()) {
      return null;
    }
    double value = Double.parseDouble(s);
    return Double.isInfinite(value) ? null : value;
  }

  /**
   * Coerces all five measures of a row.
   */
  public RatingMeasures coerceRow(RawSkaRecord row) {
    return new RatingMeasures(
        coerce(row.getDataValue()),
        coerce(row.getN()),
        coerce(row.getStandardError()),
        coerce(row.getLowerCiBound()),
        coerce(row.getUpperCiBound()));
  }

  @Override public ValidationResult validate(RawSkaRecord row) {
    return coerce(row.getDataValue()) == null
        ? ValidationResult.quarantine(RejectionReason.INVALID_NUMERIC_DATA_VALUE)
        : ValidationResult.valid();
  }
}
