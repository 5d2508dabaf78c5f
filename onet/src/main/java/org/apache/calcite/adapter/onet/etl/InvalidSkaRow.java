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
 * A quarantined rating row: the record exactly as extracted, plus its domain
 * and the single reason it was rejected. Diagnostic only; never joined.
 */
public final class InvalidSkaRow {

  private final Domain domain;
  private final RawSkaRecord original;
  private final RejectionReason reason;

  public InvalidSkaRow(Domain domain, RawSkaRecord original, RejectionReason reason) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.original = Objects.requireNonNull(original, "original");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public Domain getDomain() {
    return domain;
  }

  public RawSkaRecord getOriginal() {
    return original;
  }

  public RejectionReason getReason() {
    return reason;
  }

  /**
   * Returns the row for {@code stg_invalid_ska}: domain, the original text
   * values, then {@code error_reason}.
   */
  public Map<String, String> toRow() {
    Map<String, String> row = new LinkedHashMap<String, String>();
    row.put("domain", domain.name());
    row.putAll(original.toMap());
    row.put("error_reason", reason.getCode());
    return row;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof InvalidSkaRow)) {
      return false;
    }
    InvalidSkaRow that = (InvalidSkaRow) o;
    return domain == that.domain
        && reason == that.reason
        && original.equals(that.original);
  }

  @Override public int hashCode() {
    return Objects.hash(domain, original, reason);
  }

  @Override public String toString() {
    return "InvalidSkaRow" + toRow();
  }
}
