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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Routes the rating rows of one domain to the normalized stream or to
 * quarantine.
 *
 * <p>For each row, in input order:
 * <ol>
 *   <li>{@link FieldNormalizer} cleans the text fields</li>
 *   <li>the validators run in order ({@link KeyValidator}, then the
 *       {@code data_value} check of {@link NumericCoercer}); the first failure
 *       quarantines the row with the <em>original</em> extracted values</li>
 *   <li>otherwise the measures are coerced, {@link ConfidenceIntervalRepairer}
 *       fixes inverted bounds, and the normalized row is emitted</li>
 * </ol>
 *
 * <p>No state is kept between calls and no row-level step mutates shared
 * state, so one partitioner may serve several threads.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RowPartitioner partitioner = new RowPartitioner(registries, TransformConfig.defaults());
 * PartitionResult skills = partitioner.partition(Domain.SKILL, rawSkillRows);
 * loader.loadStaging(skills.getValid());
 * loader.loadInvalid(skills.getInvalid());
 * }</pre>
 */
public class RowPartitioner {

  private static final Logger LOGGER = LoggerFactory.getLogger(RowPartitioner.class);

  private final LookupRegistries registries;
  private final FieldNormalizer normalizer;
  private final NumericCoercer coercer;
  private final ConfidenceIntervalRepairer repairer;
  private final ImmutableList<Validator> validators;

  public RowPartitioner(LookupRegistries registries, TransformConfig config) {
    this(registries, new FieldNormalizer(config), new KeyValidator(registries),
        new NumericCoercer(), new ConfidenceIntervalRepairer());
  }

  public RowPartitioner(LookupRegistries registries, FieldNormalizer normalizer,
      KeyValidator keyValidator, NumericCoercer coercer,
      ConfidenceIntervalRepairer repairer) {
    this.registries = Objects.requireNonNull(registries, "registries");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.coercer = Objects.requireNonNull(coercer, "coercer");
    this.repairer = Objects.requireNonNull(repairer, "repairer");
    this.validators = ImmutableList.<Validator>of(
        Objects.requireNonNull(keyValidator, "keyValidator"), coercer);
  }

  /**
   * Partitions one domain's rows.
   *
   * @param domain domain of every row, taken from the source file
   * @param rows extracted rows in file order
   * @throws OnetDataException if the domain is not in the registries' DomainSet
   */
  public PartitionResult partition(Domain domain, List<RawSkaRecord> rows) {
    Objects.requireNonNull(domain, "domain");
    if (!registries.isKnownDomain(domain)) {
      throw new OnetDataException("Domain " + domain + " is not in the domain registry "
          + registries.getDomains());
    }
    List<NormalizedSkaRow> valid = new ArrayList<NormalizedSkaRow>();
    List<InvalidSkaRow> invalid = new ArrayList<InvalidSkaRow>();
    int repaired = 0;
    long rowNumber = 0;

    for (RawSkaRecord raw : rows) {
      rowNumber++;
      RawSkaRecord cleaned = normalizer.normalize(raw);
      ValidationResult result = validate(cleaned);
      if (!result.isValid()) {
        LOGGER.debug("{} row {} quarantined: {} ({})", domain, rowNumber,
            result.getReason(), raw);
        invalid.add(new InvalidSkaRow(domain, raw, result.getReason()));
        continue;
      }
      RatingMeasures measures = coercer.coerceRow(cleaned);
      if (repairer.isInverted(measures)) {
        LOGGER.debug("{} row {} has inverted interval {}, swapping", domain, rowNumber,
            measures);
        measures = repairer.repair(measures);
        repaired++;
      }
      valid.add(toNormalized(domain, cleaned, measures));
    }
    return new PartitionResult(domain, valid, invalid, repaired);
  }

  private ValidationResult validate(RawSkaRecord cleaned) {
    for (Validator validator : validators) {
      ValidationResult result = validator.validate(cleaned);
      if (!result.isValid()) {
        return result;
      }
    }
    return ValidationResult.valid();
  }

  private NormalizedSkaRow toNormalized(Domain domain, RawSkaRecord cleaned,
      RatingMeasures measures) {
    return NormalizedSkaRow.builder()
        .domain(domain)
        .onetsocCode(cleaned.getOnetsocCode())
        .elementId(cleaned.getElementId())
        .scaleId(cleaned.getScaleId())
        .measures(measures)
        .recommendSuppress(normalizer.flag(cleaned.getRecommendSuppress()))
        .notRelevant(normalizer.flag(cleaned.getNotRelevant()))
        .dateUpdated(normalizer.date(cleaned.getDateUpdated()))
        .domainSource(normalizer.stagingText(cleaned.getDomainSource()))
        .build();
  }
}
