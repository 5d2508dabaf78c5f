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
 * A rating row that passed every check, ready for the domain's staging table.
 *
 * <p>Keys are validated, {@code data_value} is always present, the other
 * measures are present or absent but never defaulted, and when both interval
 * bounds are present {@code lower_ci_bound <= upper_ci_bound}.
 *
 * <p>There are two renderings. {@link #toStagingRow()} writes the marker
 * {@value StagingField#UNAVAILABLE} for missing metadata text, as the staging
 * tables expect. {@link #toFactRow()} writes SQL NULL for the same columns, as
 * the fact table expects.
 */
public final class NormalizedSkaRow {

  private final Domain domain;
  private final String onetsocCode;
  private final String elementId;
  private final String scaleId;
  private final RatingMeasures measures;
  private final StagingField recommendSuppress;
  private final StagingField notRelevant;
  private final StagingField dateUpdated;
  private final StagingField domainSource;

  private NormalizedSkaRow(Builder builder) {
    this.domain = Objects.requireNonNull(builder.domain, "domain");
    this.onetsocCode = Objects.requireNonNull(builder.onetsocCode, "onetsocCode");
    this.elementId = Objects.requireNonNull(builder.elementId, "elementId");
    this.scaleId = Objects.requireNonNull(builder.scaleId, "scaleId");
    this.measures = Objects.requireNonNull(builder.measures, "measures");
    if (!measures.hasDataValue()) {
      throw new IllegalArgumentException("data_value is mandatory for " + onetsocCode
          + "/" + elementId + "/" + scaleId);
    }
    this.recommendSuppress = orUnavailable(builder.recommendSuppress);
    this.notRelevant = orUnavailable(builder.notRelevant);
    this.dateUpdated = orUnavailable(builder.dateUpdated);
    this.domainSource = orUnavailable(builder.domainSource);
  }

  private static StagingField orUnavailable(StagingField field) {
    return field != null ? field : StagingField.unavailable();
  }

  public Domain getDomain() {
    return domain;
  }

  public String getOnetsocCode() {
    return onetsocCode;
  }

  public String getElementId() {
    return elementId;
  }

  public String getScaleId() {
    return scaleId;
  }

  public RatingMeasures getMeasures() {
    return measures;
  }

  public double getDataValue() {
    return measures.getDataValue();
  }

  public StagingField getRecommendSuppress() {
    return recommendSuppress;
  }

  public StagingField getNotRelevant() {
    return notRelevant;
  }

  public StagingField getDateUpdated() {
    return dateUpdated;
  }

  public StagingField getDomainSource() {
    return domainSource;
  }

  /**
   * Returns the staging representation keyed by column name.
   */
  public Map<String, Object> toStagingRow() {
    Map<String, Object> row = keyAndMeasureColumns();
    row.put(RawSkaRecord.RECOMMEND_SUPPRESS, recommendSuppress.toStagingValue());
    row.put(RawSkaRecord.NOT_RELEVANT, notRelevant.toStagingValue());
    row.put(RawSkaRecord.DATE_UPDATED, dateUpdated.toStagingValue());
    row.put(RawSkaRecord.DOMAIN_SOURCE, domainSource.toStagingValue());
    return row;
  }

  /**
   * Returns the fact-level representation keyed by column name. Metadata that
   * was unavailable in staging is null here.
   */
  public Map<String, Object> toFactRow() {
    Map<String, Object> row = keyAndMeasureColumns();
    row.put(RawSkaRecord.RECOMMEND_SUPPRESS, recommendSuppress.toFactField().orNull());
    row.put(RawSkaRecord.NOT_RELEVANT, notRelevant.toFactField().orNull());
    row.put(RawSkaRecord.DATE_UPDATED, dateUpdated.toFactField().orNull());
    row.put(RawSkaRecord.DOMAIN_SOURCE, domainSource.toFactField().orNull());
    return row;
  }

  private Map<String, Object> keyAndMeasureColumns() {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put(RawSkaRecord.ONETSOC_CODE, onetsocCode);
    row.put(RawSkaRecord.ELEMENT_ID, elementId);
    row.put(RawSkaRecord.SCALE_ID, scaleId);
    row.put(RawSkaRecord.DATA_VALUE, measures.getDataValue());
    row.put(RawSkaRecord.N, measures.getN());
    row.put(RawSkaRecord.STANDARD_ERROR, measures.getStandardError());
    row.put(RawSkaRecord.LOWER_CI_BOUND, measures.getLowerCiBound());
    row.put(RawSkaRecord.UPPER_CI_BOUND, measures.getUpperCiBound());
    return row;
  }

  /**
   * Renders this row as extractor input again, for re-running the transform
   * over its own output.
   */
  public RawSkaRecord toRawRecord() {
    return RawSkaRecord.fromMap(toStagingRow());
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NormalizedSkaRow)) {
      return false;
    }
    NormalizedSkaRow that = (NormalizedSkaRow) o;
    return domain == that.domain && toStagingRow().equals(that.toStagingRow());
  }

  @Override public int hashCode() {
    return Objects.hash(domain, onetsocCode, elementId, scaleId, measures);
  }

  @Override public String toString() {
    return "NormalizedSkaRow{domain=" + domain + ", " + toStagingRow() + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for NormalizedSkaRow.
   */
  public static class Builder {
    private Domain domain;
    private String onetsocCode;
    private String elementId;
    private String scaleId;
    private RatingMeasures measures;
    private StagingField recommendSuppress;
    private StagingField notRelevant;
    private StagingField dateUpdated;
    private StagingField domainSource;

    public Builder domain(Domain domain) {
      this.domain = domain;
      return this;
    }

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

    public Builder measures(RatingMeasures measures) {
      this.measures = measures;
      return this;
    }

    public Builder recommendSuppress(StagingField recommendSuppress) {
      this.recommendSuppress = recommendSuppress;
      return this;
    }

    public Builder notRelevant(StagingField notRelevant) {
      this.notRelevant = notRelevant;
      return this;
    }

    public Builder dateUpdated(StagingField dateUpdated) {
      this.dateUpdated = dateUpdated;
      return this;
    }

    public Builder domainSource(StagingField domainSource) {
      this.domainSource = domainSource;
      return this;
    }

    public NormalizedSkaRow build() {
      return new NormalizedSkaRow(this);
    }
  }
}
