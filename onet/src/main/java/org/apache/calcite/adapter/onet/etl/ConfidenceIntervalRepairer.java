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
 * Swaps inverted confidence-interval bounds.
 *
 * <p>Inversion is repaired silently and never quarantines a row. If either
 * bound is absent the measures are returned unchanged.
 */
public class ConfidenceIntervalRepairer {

  public boolean isInverted(RatingMeasures measures) {
    Double lower = measures.getLowerCiBound();
    Double upper = measures.getUpperCiBound();
    return lower != null && upper != null && lower > upper;
  }

  /**
   * Returns measures with {@code lower_ci_bound <= upper_ci_bound} whenever
   * both are present.
   */
  public RatingMeasures repair(RatingMeasures measures) {
    if (!isInverted(measures)) {
      return measures;
    }
    return measures.withInterval(measures.getUpperCiBound(), measures.getLowerCiBound());
  }
}
