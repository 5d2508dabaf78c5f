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

import org.apache.calcite.adapter.onet.OnetDataException;
import org.apache.calcite.adapter.onet.TransformConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the transform-and-validate stage for one extracted batch.
 *
 * <p>The pipeline sits between the extractor and the loader:
 * <ol>
 *   <li>Occupations - clean, deduplicate, derive major groups</li>
 *   <li>Ratings - partition each domain into normalized and quarantined rows</li>
 *   <li>Staging checks - key shape and grain uniqueness per domain</li>
 * </ol>
 *
 * <p>The pipeline does no I/O and keeps no state between runs; identical
 * input gives identical output, order included.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TransformConfig config = TransformConfig.loadDefault();
 * OnetTransformPipeline pipeline = new OnetTransformPipeline(registries, config);
 *
 * Map<Domain, List<RawSkaRecord>> ratings = new EnumMap<>(Domain.class);
 * ratings.put(Domain.SKILL, skills);
 * ratings.put(Domain.KNOWLEDGE, knowledge);
 *
 * TransformResult result = pipeline.execute(occupations, ratings);
 * }</pre>
 *
 * @see TransformResult
 */
public class OnetTransformPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(OnetTransformPipeline.class);

  private final OccupationTransformer occupationTransformer;
  private final RowPartitioner partitioner;
  private final StagingValidator stagingValidator;

  /**
   * Creates a pipeline with the given registries and configuration.
   */
  public OnetTransformPipeline(LookupRegistries registries, TransformConfig config) {
    FieldNormalizer normalizer = new FieldNormalizer(config);
    this.occupationTransformer = new OccupationTransformer(normalizer);
    this.partitioner = new RowPartitioner(registries, normalizer,
        new KeyValidator(registries), new NumericCoercer(), new ConfidenceIntervalRepairer());
    this.stagingValidator = new StagingValidator();
  }

  /**
   * Creates a pipeline using the registries configured inline in
   * {@code config}.
   *
   * @throws OnetDataException if the configuration has no lookups section
   */
  public static OnetTransformPipeline fromConfig(TransformConfig config) {
    LookupRegistries registries = config.getLookups();
    if (registries == null) {
      throw new OnetDataException("Configuration has no lookups; pass registries explicitly");
    }
    return new OnetTransformPipeline(registries, config);
  }

  /**
   * Transforms one batch.
   *
   * @param occupations occupation records in extraction order
   * @param ratings rating rows per domain; domains without input may be omitted
   * @return normalized and quarantined rows with run statistics
   */
  public TransformResult execute(List<RawOccupationRecord> occupations,
      Map<Domain, List<RawSkaRecord>> ratings) {
    Objects.requireNonNull(occupations, "occupations");
    Objects.requireNonNull(ratings, "ratings");
    long startTime = System.currentTimeMillis();
    TransformResult.Builder builder = TransformResult.builder();

    LOGGER.info("Occupation rows extracted: {}", occupations.size());
    OccupationResult occupationResult = occupationTransformer.transform(occupations);
    builder.occupations(occupationResult);
    LOGGER.info("Occupation rows cleaned: {} ({} duplicates, {} blank skipped)",
        occupationResult.getOccupations().size(),
        occupationResult.getDuplicateCodes().size(),
        occupationResult.getSkippedBlank());
    if (!occupationResult.getMalformedCodes().isEmpty()) {
      LOGGER.warn("{} occupation codes do not match the SOC pattern and are loaded as-is;"
          + " their major group may fail the foreign key",
          occupationResult.getMalformedCodes().size());
    }

    // EnumMap gives a fixed domain order regardless of the caller's map
    Map<Domain, List<RawSkaRecord>> ordered = new EnumMap<Domain, List<RawSkaRecord>>(Domain.class);
    ordered.putAll(ratings);
    for (Map.Entry<Domain, List<RawSkaRecord>> entry : ordered.entrySet()) {
      Domain domain = entry.getKey();
      List<RawSkaRecord> rows = entry.getValue();
      if (rows == null || rows.isEmpty()) {
        continue;
      }
      LOGGER.info("{} rows extracted: {}", domain, rows.size());
      PartitionResult partition = partitioner.partition(domain, rows);
      builder.partition(partition);
      LOGGER.info("{} rows normalized: {} ({} intervals repaired)", domain,
          partition.getValidCount(), partition.getRepairedIntervals());
      if (partition.getInvalidCount() > 0) {
        LOGGER.warn("{} rows quarantined: {} {}", domain, partition.getInvalidCount(),
            partition.getReasonCounts());
      }
      List<String> errors = stagingValidator.validate(partition);
      for (String error : errors) {
        LOGGER.warn("Staging check: {}", error);
      }
      builder.stagingErrors(errors);
    }

    TransformResult result = builder.elapsedMs(System.currentTimeMillis() - startTime).build();
    LOGGER.info("Transform complete: {}", result);
    return result;
  }
}
