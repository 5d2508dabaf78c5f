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

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The two output streams of one domain, with the counts a caller reports
 * after a run.
 *
 * <p>Both lists keep the relative input order. Every input row is in exactly
 * one of them, so {@code getInputCount() == getValidCount() + getInvalidCount()}.
 */
public final class PartitionResult {

  private final Domain domain;
  private final ImmutableList<NormalizedSkaRow> valid;
  private final ImmutableList<InvalidSkaRow> invalid;
  private final ImmutableMap<RejectionReason, Integer> reasonCounts;
  private final int repairedIntervals;

  PartitionResult(Domain domain, List<NormalizedSkaRow> valid,
      List<InvalidSkaRow> invalid, int repairedIntervals) {
    this.domain = domain;
    this.valid = ImmutableList.copyOf(valid);
    this.invalid = ImmutableList.copyOf(invalid);
    this.repairedIntervals = repairedIntervals;
    Map<RejectionReason, Integer> counts =
        new EnumMap<RejectionReason, Integer>(RejectionReason.class);
    for (InvalidSkaRow row : invalid) {
      counts.merge(row.getReason(), 1, Integer::sum);
    }
    this.reasonCounts = ImmutableMap.copyOf(counts);
  }

  public Domain getDomain() {
    return domain;
  }

  public List<NormalizedSkaRow> getValid() {
    return valid;
  }

  public List<InvalidSkaRow> getInvalid() {
    return invalid;
  }

  public int getInputCount() {
    return valid.size() + invalid.size();
  }

  public int getValidCount() {
    return valid.size();
  }

  public int getInvalidCount() {
    return invalid.size();
  }

  /**
   * Returns quarantined row counts by reason, in reason precedence order.
   * Reasons that did not occur are absent.
   */
  public Map<RejectionReason, Integer> getReasonCounts() {
    return reasonCounts;
  }

  public int getReasonCount(RejectionReason reason) {
    Integer count = reasonCounts.get(reason);
    return count != null ? count : 0;
  }

  /**
   * Returns how many valid rows had their interval bounds swapped.
   */
  public int getRepairedIntervals() {
    return repairedIntervals;
  }

  @Override public String toString() {
    return "PartitionResult{domain=" + domain
        + ", valid=" + valid.size()
        + ", invalid=" + invalid.size()
        + (reasonCounts.isEmpty() ? "" : " " + reasonCounts)
        + ", repairedIntervals=" + repairedIntervals + "}";
  }
}
