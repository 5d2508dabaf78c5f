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
 * A fact-table column value: present, or absent (SQL NULL).
 *
 * <p>Unlike {@link StagingField} there is no substitute text for absence.
 *
 * @param <T> value type
 */
public final class FactField<T> {

  private static final FactField<?> ABSENT = new FactField<Object>(null);

  private final @Nullable T value;

  private FactField(@Nullable T value) {
    this.value = value;
  }

  @SuppressWarnings("unchecked")
  public static <T> FactField<T> absent() {
    return (FactField<T>) ABSENT;
  }

  public static <T> FactField<T> of(T value) {
    return new FactField<T>(Objects.requireNonNull(value, "value"));
  }

  public static <T> FactField<T> ofNullable(@Nullable T value) {
    return value == null ? FactField.<T>absent() : new FactField<T>(value);
  }

  public boolean isPresent() {
    return value != null;
  }

  /**
   * Returns the value, or null when absent; this is what gets bound to the
   * fact-table column.
   */
  public @Nullable T orNull() {
    return value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FactField)) {
      return false;
    }
    return Objects.equals(value, ((FactField<?>) o).value);
  }

  @Override public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override public String toString() {
    return value != null ? "FactField{" + value + "}" : "FactField{absent}";
  }
}
