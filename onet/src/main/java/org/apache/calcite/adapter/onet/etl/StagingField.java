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

/**
 * A staging text column: either a value or the {@value #UNAVAILABLE} marker.
 *
 * <p>The marker exists only so staging columns never hold empty strings. It must
 * not reach the fact table; use {@link #toFactField()} there, which turns the
 * marker back into a true absence.
 *
 * @see FactField
 */
public final class StagingField {

  /** Text written to staging in place of a missing value. */
  public static final String UNAVAILABLE = "unavailable";

  private static final StagingField UNAVAILABLE_FIELD = new StagingField(null);

  private final @Nullable String value;

  private StagingField(@Nullable String value) {
    this.value = value;
  }

  /**
   * Wraps a value; null, empty, or the marker text itself yield the
   * unavailable field.
   */
  public static StagingField of(@Nullable String value) {
    if (value == null || value.isEmpty() || UNAVAILABLE.equals(value)) {
      return UNAVAILABLE_FIELD;
    }
    return new StagingField(value);
  }

  public static StagingField unavailable() {
    return UNAVAILABLE_FIELD;
  }

  public boolean isAvailable() {
    return value != null;
  }

  /**
   * Returns the text for a staging column, never empty.
   */
  public String toStagingValue() {
    return value != null ? value : UNAVAILABLE;
  }

  public FactField<String> toFactField() {
    return FactField.ofNullable(value);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StagingField)) {
      return false;
    }
    return Objects.equals(value, ((StagingField) o).value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override public String toString() {
    return toStagingValue();
  }
}
