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

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only reference sets consulted when validating rating rows.
 *
 * <p>Registries are supplied once per pipeline run by the reference staging
 * loader and are never mutated afterwards, so a single instance may be shared
 * by any number of row-processing threads.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * LookupRegistries registries = LookupRegistries.builder()
 *     .elements(elementIdsFromReferenceStaging)
 *     .build();
 * KeyValidator validator = new KeyValidator(registries);
 * }</pre>
 */
public final class LookupRegistries {

  /** Scales supported by the warehouse today. */
  public static final Set<String> DEFAULT_SCALES = ImmutableSet.of("IM", "LV");

  private final ImmutableSet<String> elements;
  private final ImmutableSet<String> scales;
  private final ImmutableSet<Domain> domains;

  private LookupRegistries(Builder builder) {
    this.elements = ImmutableSet.copyOf(builder.elements);
    this.scales = builder.scales != null
        ? upperCase(builder.scales)
        : ImmutableSet.copyOf(DEFAULT_SCALES);
    this.domains = builder.domains != null
        ? ImmutableSet.copyOf(builder.domains)
        : ImmutableSet.copyOf(Domain.values());
  }

  // scale_id is upper-cased during normalization
  private static ImmutableSet<String> upperCase(Collection<String> scales) {
    ImmutableSet.Builder<String> out = ImmutableSet.builder();
    for (String scale : scales) {
      out.add(scale.toUpperCase(Locale.ROOT));
    }
    return out.build();
  }

  public Set<String> getElements() {
    return elements;
  }

  public Set<String> getScales() {
    return scales;
  }

  public Set<Domain> getDomains() {
    return domains;
  }

  public boolean isKnownElement(String elementId) {
    return elementId != null && elements.contains(elementId);
  }

  public boolean isSupportedScale(String scaleId) {
    return scaleId != null && scales.contains(scaleId);
  }

  public boolean isKnownDomain(Domain domain) {
    return domains.contains(domain);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates registries from a YAML/JSON map with keys {@code elements},
   * {@code scales} and {@code domains}. Missing scales and domains take their
   * defaults; missing elements yield an empty element set.
   */
  public static LookupRegistries fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    builder.elements(stringList(map, "elements"));
    if (map.containsKey("scales")) {
      builder.scales(stringList(map, "scales"));
    }
    if (map.containsKey("domains")) {
      ImmutableSet.Builder<Domain> domains = ImmutableSet.builder();
      for (String tag : stringList(map, "domains")) {
        domains.add(Domain.fromTag(tag));
      }
      builder.domains(domains.build());
    }
    return builder.build();
  }

  private static ImmutableSet<String> stringList(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null) {
      return ImmutableSet.of();
    }
    if (!(value instanceof List)) {
      throw new OnetDataException("lookups." + key + " must be a list, got: " + value);
    }
    ImmutableSet.Builder<String> out = ImmutableSet.builder();
    for (Object item : (List<?>) value) {
      if (item != null) {
        out.add(item.toString().trim());
      }
    }
    return out.build();
  }

  @Override public String toString() {
    return "LookupRegistries{elements=" + elements.size()
        + ", scales=" + scales
        + ", domains=" + domains + "}";
  }

  /**
   * Builder for LookupRegistries.
   */
  public static class Builder {
    private Collection<String> elements = ImmutableSet.of();
    private Collection<String> scales;
    private Collection<Domain> domains;

    public Builder elements(Collection<String> elements) {
      this.elements = elements;
      return this;
    }

    public Builder scales(Collection<String> scales) {
      this.scales = scales;
      return this;
    }

    public Builder domains(Collection<Domain> domains) {
      this.domains = domains;
      return this;
    }

    public LookupRegistries build() {
      return new LookupRegistries(this);
    }
  }
}
