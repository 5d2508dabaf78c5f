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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A cleaned occupation row ready for {@code stg_occupation_data} and
 * {@code dim_occupation}.
 */
public final class NormalizedOccupation {

  private final String onetsocCode;
  private final String title;
  private final StagingField description;
  private final StagingField majorGroupCode;

  public NormalizedOccupation(String onetsocCode, String title,
      StagingField description, StagingField majorGroupCode) {
    this.onetsocCode = Objects.requireNonNull(onetsocCode, "onetsocCode");
    this.title = Objects.requireNonNull(title, "title");
    this.description = Objects.requireNonNull(description, "description");
    this.majorGroupCode = Objects.requireNonNull(majorGroupCode, "majorGroupCode");
  }

  public String getOnetsocCode() {
    return onetsocCode;
  }

  public String getTitle() {
    return title;
  }

  public StagingField getDescription() {
    return description;
  }

  public StagingField getMajorGroupCode() {
    return majorGroupCode;
  }

  /**
   * Returns the row keyed by warehouse column name. Text columns are never
   * empty; a missing description is written as {@value StagingField#UNAVAILABLE}.
   */
  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("onetsoc_code", onetsocCode);
    row.put("title", title);
    row.put("description", description.toStagingValue());
    row.put("major_group_code", majorGroupCode.toStagingValue());
    return row;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NormalizedOccupation)) {
      return false;
    }
    NormalizedOccupation that = (NormalizedOccupation) o;
    return onetsocCode.equals(that.onetsocCode)
        && title.equals(that.title)
        && description.equals(that.description)
        && majorGroupCode.equals(that.majorGroupCode);
  }

  @Override public int hashCode() {
    return Objects.hash(onetsocCode, title, description, majorGroupCode);
  }

  @Override public String toString() {
    return "NormalizedOccupation" + toRow();
  }
}
