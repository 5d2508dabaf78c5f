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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A Skills, Knowledge or Abilities rating row as extracted, before any cleanup.
 *
 * <p>Every field is text exactly as the extractor produced it and may be null.
 * Instances are never modified; the quarantine stream relies on them to report
 * the original values of a rejected row.
 */
public final class RawSkaRecord {

  public static final String ONETSOC_CODE = "onetsoc_code";
  public static final String ELEMENT_ID = "element_id";
  public static final String SCALE_ID = "scale_id";
  public static final String DATA_VALUE = "data_value";
  public static final String N = "n";
  public static final String STANDARD_ERROR = "standard_error";
  public static final String LOWER_CI_BOUND = "lower_ci_bound";
  public static final String UPPER_CI_BOUND = "upper_ci_bound";
  public static final String RECOMMEND_SUPPRESS = "recommend_suppress";
  public static final String NOT_RELEVANT = "not_relevant";
  public static final String DATE_UPDATED = "date_updated";
  public static final String DOMAIN_SOURCE = "domain_source";

  /** Column names in warehouse order. */
  public static final List<String> COLUMNS = ImmutableList.of(
      ONETSOC_CODE, ELEMENT_ID, SCALE_ID, DATA_VALUE, N, STANDARD_ERROR,
      LOWER_CI_BOUND, UPPER_CI_BOUND, RECOMMEND_SUPPRESS, NOT_RELEVANT,
      DATE_UPDATED, DOMAIN_SOURCE);

  private final @Nullable String onetsocCode;
  private final @Nullable String elementId;
  private final @Nullable String scaleId;
  private final @Nullable String dataValue;
  private final @Nullable String n;
  private final @Nullable String standardError;
  private final @Nullable String lowerCiBound;
  private final @Nullable String upperCiBound;
  private final @Nullable String recommendSuppress;
  private final @Nullable String notRelevant;
  private final @Nullable String dateUpdated;
  private final @Nullable String domainSource;

  private RawSkaRecord(Builder builder) {
    this.onetsocCode = builder.onetsocCode;
    this.elementId = builder.elementId;
    this.scaleId = builder.scaleId;
    this.dataValue = builder.dataValue;
    this.n = builder.n;
    this.standardError = builder.standardError;
    this.lowerCiBound = builder.lowerCiBound;
    this.upperCiBound = builder.upperCiBound;
    this.recommendSuppress = builder.recommendSuppress;
    this.notRelevant = builder.notRelevant;
    this.dateUpdated = builder.dateUpdated;
    this.domainSource = builder.domainSource;
  }

  public @Nullable String getOnetsocCode() {
    return onetsocCode;
  }

  public @Nullable String getElementId() {
    return elementId;
  }

  public @Nullable String getScaleId() {
    return scaleId;
  }

  public @Nullable String getDataValue() {
    return dataValue;
  }

  public @Nullable String getN() {
    return n;
  }

  public @Nullable String getStandardError() {
    return standardError;
  }

  public @Nullable String getLowerCiBound() {
    return lowerCiBound;
  }

  public @Nullable String getUpperCiBound() {
    return upperCiBound;
  }

  public @Nullable String getRecommendSuppress() {
    return recommendSuppress;
  }

  public @Nullable String getNotRelevant() {
    return notRelevant;
  }

  public @Nullable String getDateUpdated() {
    return dateUpdated;
  }

  public @Nullable String getDomainSource() {
    return domainSource;
  }

  /**
   * Returns the fields keyed by column name, in {@link #COLUMNS} order.
   * Null fields are kept as null entries.
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<String, String>();
    map.put(ONETSOC_CODE, onetsocCode);
    map.put(ELEMENT_ID, elementId);
    map.put(SCALE_ID, scaleId);
    map.put(DATA_VALUE, dataValue);
    map.put(N, n);
    map.put(STANDARD_ERROR, standardError);
    map.put(LOWER_CI_BOUND, lowerCiBound);
    map.put(UPPER_CI_BOUND, upperCiBound);
    map.put(RECOMMEND_SUPPRESS, recommendSuppress);
    map.put(NOT_RELEVANT, notRelevant);
    map.put(DATE_UPDATED, dateUpdated);
    map.put(DOMAIN_SOURCE, domainSource);
    return map;
  }

  /**
   * Creates a record from an extractor row. Values are rendered with
   * {@link String#valueOf(Object)}; nulls stay null and unknown keys are ignored.
   */
  public static RawSkaRecord fromMap(Map<String, ?> row) {
    return builder()
        .onetsocCode(text(row.get(ONETSOC_CODE)))
        .elementId(text(row.get(ELEMENT_ID)))
        .scaleId(text(row.get(SCALE_ID)))
        .dataValue(text(row.get(DATA_VALUE)))
        .n(text(row.get(N)))
        .standardError(text(row.get(STANDARD_ERROR)))
        .lowerCiBound(text(row.get(LOWER_CI_BOUND)))
        .upperCiBound(text(row.get(UPPER_CI_BOUND)))
        .recommendSuppress(text(row.get(RECOMMEND_SUPPRESS)))
        .notRelevant(text(row.get(NOT_RELEVANT)))
        .dateUpdated(text(row.get(DATE_UPDATED)))
        .domainSource(text(row.get(DOMAIN_SOURCE)))
        .build();
  }

  private static @Nullable String text(@Nullable Object value) {
    return value == null ? null : String.valueOf(value);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder initialized with this record's fields.
   */
  public Builder toBuilder() {
    return builder()
        .onetsocCode(onetsocCode)
        .elementId(elementId)
        .scaleId(scaleId)
        .dataValue(dataValue)
        .n(n)
        .standardError(standardError)
        .lowerCiBound(lowerCiBound)
        .upperCiBound(upperCiBound)
        .recommendSuppress(recommendSuppress)
        .notRelevant(notRelevant)
        .dateUpdated(dateUpdated)
        .domainSource(domainSource);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawSkaRecord)) {
      return false;
    }
    return toMap().equals(((RawSkaRecord) o).toMap());
  }

  @Override public int hashCode() {
    return Objects.hash(onetsocCode, elementId, scaleId, dataValue);
  }

  @Override public String toString() {
    return "RawSkaRecord" + toMap();
  }

  /**
   * Builder for RawSkaRecord.
   */
  public static class Builder {
    private String onetsocCode;
    private String elementId;
    private String scaleId;
    private String dataValue;
    private String n;
    private String standardError;
    private String lowerCiBound;
    private String upperCiBound;
    private String recommendSuppress;
    private String notRelevant;
    private String dateUpdated;
    private String domainSource;

    public Builder onetsocCode(String onetsocCode) {
      this.onetsocCode = onetsocCode;
      return this;
    }

    public Builder elementId(String elementId) {
      this.elementId = elementId;
      return this;
    }

    public Builder scaleId(String scaleId) {
      this.scaleId = scaleId;
      return this;
    }

    public Builder dataValue(String dataValue) {
      this.dataValue = dataValue;
      return this;
    }

    public Builder n(String n) {
      this.n = n;
      return this;
    }

    public Builder standardError(String standardError) {
      this.standardError = standardError;
      return this;
    }

    public Builder lowerCiBound(String lowerCiBound) {
      this.lowerCiBound = lowerCiBound;
      return this;
    }

    public Builder upperCiBound(String upperCiBound) {
      this.upperCiBound = upperCiBound;
      return this;
    }

    public Builder recommendSuppress(String recommendSuppress) {
      this.recommendSuppress = recommendSuppress;
      return this;
    }

    public Builder notRelevant(String notRelevant) {
      this.notRelevant = notRelevant;
      return this;
    }

    public Builder dateUpdated(String dateUpdated) {
      this.dateUpdated = dateUpdated;
      return this;
    }

    public Builder domainSource(String domainSource) {
      this.domainSource = domainSource;
      return this;
    }

    public RawSkaRecord build() {
      return new RawSkaRecord(this);
    }
  }
}
