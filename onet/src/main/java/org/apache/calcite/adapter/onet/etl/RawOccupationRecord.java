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

import java.util.Map;
import java.util.Objects;

/**
 * An occupation master row as extracted, before any cleanup.
 */
public final class RawOccupationRecord {

  private final @Nullable String onetsocCode;
  private final @Nullable String title;
  private final @Nullable String description;

  public RawOccupationRecord(@Nullable String onetsocCode, @Nullable String title,
      @Nullable String description) {
    this.onetsocCode = onetsocCode;
    this.title = title;
    this.description = description;
  }

  /**
   * Creates a record from an extractor row with keys {@code onetsoc_code},
   * {@code title} and {@code description}.
   */
  public static RawOccupationRecord fromMap(Map<String, ?> row) {
    return new RawOccupationRecord(
        text(row.get("onetsoc_code")),
        text(row.get("title")),
        text(row.get("description")));
  }

  private static @Nullable String text(@Nullable Object value) {
    return value == null ? null : String.valueOf(value);
  }

  public @Nullable String getOnetsocCode() {
    return onetsocCode;
  }

  public @Nullable String getTitle() {
    return title;
  }

  public @Nullable String getDescription() {
    return description;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawOccupationRecord)) {
      return false;
    }
    RawOccupationRecord that = (RawOccupationRecord) o;
    return Objects.equals(onetsocCode, that.onetsocCode)
        && Objects.equals(title, that.title)
        && Objects.equals(description, that.description);
  }

  @Override public int hashCode() {
    return Objects.hash(onetsocCode, title, description);
  }

  @Override public String toString() {
    return "RawOccupationRecord{onetsoc_code='" + onetsocCode + "', title='" + title + "'}";
  }
}
