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
/**
 * Transform-and-validate stage for O*NET occupation and rating extracts.
 *
 * <p>Input comes from the extractor as loosely-typed records; output goes to
 * the loader as normalized staging rows plus a quarantine stream.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.FieldNormalizer} - Trims text and
 *       applies staging-only defaults</li>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.KeyValidator} - SOC shape, element and
 *       scale checks, in that order</li>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.NumericCoercer} - Text to number with
 *       no imputation</li>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.ConfidenceIntervalRepairer} - Swaps
 *       inverted interval bounds</li>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.RowPartitioner} - Routes rows to the
 *       normalized or quarantine stream</li>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.OccupationTransformer} - Deduplicates
 *       occupations and derives major groups</li>
 *   <li>{@link org.apache.calcite.adapter.onet.etl.OnetTransformPipeline} - Runs all of
 *       the above for one batch</li>
 * </ul>
 *
 * <h2>Staging vs. Fact Values</h2>
 * <p>{@link org.apache.calcite.adapter.onet.etl.StagingField} carries the
 * {@code "unavailable"} marker used in staging tables;
 * {@link org.apache.calcite.adapter.onet.etl.FactField} carries true absence for the
 * fact table.
 */
package org.apache.calcite.adapter.onet.etl;
