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
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one {@link OnetTransformPipeline} run.
 *
 * <p>Holds the normalized occupations, both output streams for every domain
 * that had input, and the staging findings. A result never carries an
 * exception: row-level problems are in the invalid streams.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * TransformResult result = pipeline.execute(occupations, ratingsByDomain);
 * for (PartitionResult partition : result.getPartitions().values()) {
 *   loader.loadStaging(partition.getDomain(), partition.getValid());
 *   loader.loadInvalid(partition.getInvalid());
 * }
 * }</pre>
 *
 * @see OnetTransformPipeline
 */
public class TransformResult {

  private final OccupationResult occupations;
  private final ImmutableMap<Domain, PartitionResult> partitions;
  private final ImmutableList<String> stagingErrors;
  private final long elapsedMs;

  private TransformResult(Builder builder) {
    this.occupations = builder.occupations;
    this.partitions = ImmutableMap.copyOf(builder.partitions);
    this.stagingErrors = ImmutableList.copyOf(builder.stagingErrors);
    this.elapsedMs = builder.elapsedMs;
  }

  public OccupationResult getOccupations() {
    return occupations;
  }

  /**
   * Returns the partition of each domain that was present in the input, in
   * domain declaration order.
   */
  public Map<Domain, PartitionResult> getPartitions() {
    return partitions;
  }

  public @Nullable PartitionResult getPartition(Domain domain) {
    return partitions.get(domain);
  }

  /**
   * Returns every quarantined row of the run, domain by domain, ready for
   * {@code stg_invalid_ska}.
   */
  public List<InvalidSkaRow> getAllInvalid() {
    ImmutableList.Builder<InvalidSkaRow> all = ImmutableList.builder();
    for (PartitionResult partition : partitions.values()) {
      all.addAll(partition.getInvalid());
    }
    return all.build();
  }

  public int getTotalValid() {
    int total = 0;
    for (PartitionResult partition : partitions.values()) {
      total += partition.getValidCount();
    }
    return total;
  }

  public int getTotalInvalid() {
    int total = 0;
    for (PartitionResult partition : partitions.values()) {
      total += partition.getInvalidCount();
    }
    return total;
  }

  /**
   * Returns findings of the batch-level staging checks.
   */
  public List<String> getStagingErrors() {
    return stagingErrors;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns whether every rating row was valid and the staging checks passed.
   */
  public boolean isClean() {
    return getTotalInvalid() == 0 && stagingErrors.isEmpty();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("TransformResult{occupations=").append(occupations.getOccupations().size());
    for (PartitionResult partition : partitions.values()) {
      sb.append(", ").append(partition.getDomain()).append("=")
          .append(partition.getValidCount()).append("/").append(partition.getInputCount());
    }
    if (!stagingErrors.isEmpty()) {
      sb.append(", stagingErrors=").append(stagingErrors.size());
    }
    sb.append(", elapsed=").append(elapsedMs).append("ms}");
    return sb.toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for TransformResult.
   */
  public static class Builder {
    private OccupationResult occupations;
    private final Map<Domain, PartitionResult> partitions =
        new EnumMap<Domain, PartitionResult>(Domain.class);
    private final List<String> stagingErrors = new ArrayList<String>();
    private long elapsedMs;

    public Builder occupations(OccupationResult occupations) {
      this.occupations = occupations;
      return this;
    }

    public Builder partition(PartitionResult partition) {
      this.partitions.put(partition.getDomain(), partition);
      return this;
    }

    public Builder stagingErrors(List<String> errors) {
      this.stagingErrors.addAll(errors);
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public TransformResult build() {
      if (occupations == null) {
        occupations = new OccupationResult(ImmutableList.<NormalizedOccupation>of(),
            ImmutableList.<String>of(), ImmutableList.<String>of(), 0);
      }
      return new TransformResult(this);
    }
  }
}
