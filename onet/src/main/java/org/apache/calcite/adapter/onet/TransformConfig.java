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
package org.apache.calcite.adapter.onet;

import org.apache.calcite.adapter.onet.etl.LookupRegistries;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the O*NET transform-and-validate pipeline.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * collapseWhitespace: true
 * dateFormats:
 *   - "yyyy-MM-dd"
 *   - "MM/dd/yyyy"
 * lookups:
 *   elements: ["2.A.1.a", "2.A.1.b"]
 *   scales: ["IM", "LV"]
 *   domains: ["SKILL", "KNOWLEDGE", "ABILITY"]
 * }</pre>
 *
 * <p>The {@code lookups} section is optional. Production runs normally receive
 * their registries from the reference staging loader; the section exists so
 * tests and ad-hoc runs can supply synthetic registries.
 *
 * @see LookupRegistries
 */
public class TransformConfig {

  /** Classpath location of the bundled default configuration. */
  public static final String DEFAULT_RESOURCE = "onet-transform.yaml";

  /** Date patterns accepted for {@code date_updated} when none are configured. */
  public static final List<String> DEFAULT_DATE_FORMATS =
      ImmutableList.of("yyyy-MM-dd", "MM/dd/yyyy", "yyyy/MM/dd");

  private final boolean collapseWhitespace;
  private final ImmutableList<String> dateFormats;
  private final @Nullable LookupRegistries lookups;

  private TransformConfig(Builder builder) {
    this.collapseWhitespace = builder.collapseWhitespace;
    this.dateFormats = builder.dateFormats != null && !builder.dateFormats.isEmpty()
        ? ImmutableList.copyOf(builder.dateFormats)
        : ImmutableList.copyOf(DEFAULT_DATE_FORMATS);
    this.lookups = builder.lookups;
  }

  /**
   * Returns whether internal whitespace runs are collapsed to one space.
   */
  public boolean isCollapseWhitespace() {
    return collapseWhitespace;
  }

  /**
   * Returns the accepted input patterns for dates, tried in order.
   */
  public List<String> getDateFormats() {
    return dateFormats;
  }

  /**
   * Returns the lookup registries configured inline, or null if none.
   */
  public @Nullable LookupRegistries getLookups() {
    return lookups;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a configuration with every option at its default.
   */
  public static TransformConfig defaults() {
    return new Builder().build();
  }

  /**
   * Creates a TransformConfig from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return TransformConfig instance, or the defaults if map is null
   */
  @SuppressWarnings("unchecked")
  public static TransformConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder builder = builder();

    Object collapseObj = map.get("collapseWhitespace");
    if (collapseObj instanceof Boolean) {
      builder.collapseWhitespace((Boolean) collapseObj);
    } else if (collapseObj instanceof String) {
      builder.collapseWhitespace(Boolean.parseBoolean((String) collapseObj));
    }

    Object formatsObj = map.get("dateFormats");
    if (formatsObj instanceof List) {
      ImmutableList.Builder<String> formats = ImmutableList.builder();
      for (Object format : (List<Object>) formatsObj) {
        if (format != null) {
          formats.add(format.toString());
        }
      }
      builder.dateFormats(formats.build());
    } else if (formatsObj != null) {
      throw new OnetDataException("dateFormats must be a list, got: " + formatsObj);
    }

    Object lookupsObj = map.get("lookups");
    if (lookupsObj instanceof Map) {
      builder.lookups(LookupRegistries.fromMap((Map<String, Object>) lookupsObj));
    } else if (lookupsObj != null) {
      throw new OnetDataException("lookups must be a mapping, got: " + lookupsObj);
    }

    return builder.build();
  }

  /**
   * Reads a configuration document.
   *
   * @param stream YAML or JSON content
   * @param resourceName name used to pick the parser by extension
   * @throws IOException if the document cannot be read or parsed
   */
  public static TransformConfig load(InputStream stream, String resourceName)
      throws IOException {
    return fromMap(YamlUtils.parseToMap(stream, resourceName));
  }

  /**
   * Reads the bundled {@value #DEFAULT_RESOURCE}.
   */
  public static TransformConfig loadDefault() {
    InputStream stream = TransformConfig.class.getClassLoader()
        .getResourceAsStream(DEFAULT_RESOURCE);
    if (stream == null) {
      return defaults();
    }
    try (InputStream in = stream) {
      return load(in, DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new OnetDataException("Failed to read " + DEFAULT_RESOURCE, e);
    }
  }

  @Override public String toString() {
    return "TransformConfig{collapseWhitespace=" + collapseWhitespace
        + ", dateFormats=" + dateFormats
        + (lookups != null ? ", lookups=" + lookups : "")
        + "}";
  }

  /**
   * Builder for TransformConfig.
   */
  public static class Builder {
    private boolean collapseWhitespace = true;
    private List<String> dateFormats;
    private LookupRegistries lookups;

    public Builder collapseWhitespace(boolean collapseWhitespace) {
      this.collapseWhitespace = collapseWhitespace;
      return this;
    }

    public Builder dateFormats(List<String> dateFormats) {
      this.dateFormats = dateFormats;
      return this;
    }

    public Builder lookups(LookupRegistries lookups) {
      this.lookups = lookups;
      return this;
    }

    public TransformConfig build() {
      return new TransformConfig(this);
    }
  }
}
