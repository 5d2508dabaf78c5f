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
 * The numeric columns of a rating row after coercion. A null field means the
 * source text was missing or not a number; nothing is ever imputed.
 */
public final class RatingMeasures {

  private final @Nullable Double dataValue;
  private final @Nullable Double n;
  private final @Nullable Double standardError;
  private final @Nullable Double lowerCiBound;
  private final @Nullable Double upperCiBound;

  public RatingMeasures(@Nullable Double dataValue, @Nullable Double n,
      @Nullable Double standardError, @Nullable Double lowerCiBound,
      @Nullable Double upperCiBound) {
    this.dataValue = dataValue;
    this.n = n;
    this.standardError = standardError;
    this.lowerCiBound = lowerCiBound;
    this.upperCiBound = upperCiBound;
  }

  public @Nullable Double getDataValue() {
    return dataValue;
  }

  public @Nullable Double getN() {
    return n;
  }

  public @Nullable Double getStandardError() {
    return standardError;
  }

  public @Nullable Double getLowerCiBound() {
    return lowerCiBound;
  }

  public @Nullable Double getUpperCiBound() {
    return upperCiBound;
  }

  public boolean hasDataValue() {
    return dataValue != null;
  }

  /**
   * Returns a copy with the given interval bounds.
   */
  public RatingMeasures withInterval(@Nullable Double lower, @Nullable Double upper) {
    return new RatingMeasures(dataValue, n, standardError, lower, upper);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RatingMeasures)) {
      return false;
    }
    RatingMeasures that = (RatingMeasures) o;
    return Objects.equals(dataValue, that.dataValue)
        && Objects.equals(n, that.n)
        && Objects.equals(standardError, that.standardError)
        && Objects.equals(lowerCiBound, that.lowerCiBound)
        && Objects.equals(upperCiBound, that.upperCiBound);
  }

  @Override public int hashCode() {
    return Objects.hash(dataValue, n, standardError, lowerCiBound, upperCiBound);
  }

  @Override public String toString() {
    return "RatingMeasures{data_value=" + dataValue + ", n=" + n
        + ", standard_error=" + standardError
        + ", ci=[" + lowerCiBound + ", " + upperCiBound + "]}";
  }
}
