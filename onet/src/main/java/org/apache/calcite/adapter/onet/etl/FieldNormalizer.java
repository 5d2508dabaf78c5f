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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans the text fields of extracted records.
 *
 * <p>Every text field is trimmed and, unless disabled in
 * {@link TransformConfig#isCollapseWhitespace()}, internal whitespace runs
 * become a single space. The staging-only metadata columns of rating rows
 * ({@code recommend_suppress}, {@code not_relevant}, {@code date_updated},
 * {@code domain_source}) are returned as {@link StagingField}s, so an empty
 * value turns into {@value StagingField#UNAVAILABLE} here and nowhere else.
 *
 * <p>Instances hold only immutable configuration and are safe to share.
 */
public class FieldNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final boolean collapseWhitespace;
  private final ImmutableList<DateTimeFormatter> dateFormatters;

  public FieldNormalizer() {
    this(TransformConfig.defaults());
  }

  public FieldNormalizer(TransformConfig config) {
    this.collapseWhitespace = config.isCollapseWhitespace();
    ImmutableList.Builder<DateTimeFormatter> formatters = ImmutableList.builder();
    for (String pattern : config.getDateFormats()) {
      try {
        formatters.add(strictFormatter(pattern));
        String relaxed = relaxMonthAndDay(pattern);
        if (!relaxed.equals(pattern)) {
          formatters.add(strictFormatter(relaxed));
        }
      } catch (IllegalArgumentException e) {
        throw new OnetDataException("Invalid date format '" + pattern + "'", e);
      }
    }
    this.dateFormatters = formatters.build();
  }

  private static DateTimeFormatter strictFormatter(String pattern) {
    // STRICT needs an era to resolve year-of-era ('yyyy')
    return new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.ERA, 1)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  /**
   * Rewrites {@code MM} and {@code dd} to {@code M} and {@code d} outside
   * quoted literals, so that {@code 8/1/2023} matches {@code MM/dd/yyyy}.
   */
  static String relaxMonthAndDay(String pattern) {
    StringBuilder sb = new StringBuilder(pattern.length());
    boolean quoted = false;
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c == '\'') {
        quoted = !quoted;
        sb.append(c);
        i++;
        continue;
      }
      if (quoted) {
        sb.append(c);
        i++;
        continue;
      }
      int end = i;
      while (end < pattern.length() && pattern.charAt(end) == c) {
        end++;
      }
      if ((c == 'M' || c == 'd') && end - i == 2) {
        sb.append(c);
      } else {
        sb.append(pattern, i, end);
      }
      i = end;
    }
    return sb.toString();
  }

  /**
   * Trims a value and collapses internal whitespace; null becomes empty.
   */
  public String clean(@Nullable String value) {
    if (value == null) {
      return "";
    }
    String trimmed = value.trim();
    return collapseWhitespace ? WHITESPACE.matcher(trimmed).replaceAll(" ") : trimmed;
  }

  /**
   * Returns the occupation with every field cleaned. Missing fields become
   * empty strings; defaulting of the description is left to
   * {@link #stagingText(String)}.
   */
  public RawOccupationRecord normalize(RawOccupationRecord record) {
    return new RawOccupationRecord(
        clean(record.getOnetsocCode()),
        clean(record.getTitle()),
        clean(record.getDescription()));
  }

  /**
   * Returns the rating row with every field cleaned and {@code scale_id}
   * upper-cased. The input record is not modified.
   */
  public RawSkaRecord normalize(RawSkaRecord record) {
    return RawSkaRecord.builder()
        .onetsocCode(clean(record.getOnetsocCode()))
        .elementId(clean(record.getElementId()))
        .scaleId(clean(record.getScaleId()).toUpperCase(Locale.ROOT))
        .dataValue(clean(record.getDataValue()))
        .n(clean(record.getN()))
        .standardError(clean(record.getStandardError()))
        .lowerCiBound(clean(record.getLowerCiBound()))
        .upperCiBound(clean(record.getUpperCiBound()))
        .recommendSuppress(clean(record.getRecommendSuppress()))
        .notRelevant(clean(record.getNotRelevant()))
        .dateUpdated(clean(record.getDateUpdated()))
        .domainSource(clean(record.getDomainSource()))
        .build();
  }

  /**
   * Cleans free text for a staging column.
   */
  public StagingField stagingText(@Nullable String value) {
    return StagingField.of(clean(value));
  }

  /**
   * Normalizes a yes/no flag to {@code Y} or {@code N}. Accepts Y/N, T/F,
   * TRUE/FALSE and 1/0 in any case; anything else is unavailable.
   */
  public StagingField flag(@Nullable String value) {
    String s = clean(value).toUpperCase(Locale.ROOT);
    switch (s) {
    case "Y":
    case "T":
    case "TRUE":
    case "1":
      return StagingField.of("Y");
    case "N":
    case "F":
    case "FALSE":
    case "0":
      return StagingField.of("N");
    default:
      return StagingField.unavailable();
    }
  }

  /**
   * Normalizes a date to ISO {@code yyyy-MM-dd} using the configured input
   * patterns in order; unparsable or empty input is unavailable.
   */
  public StagingField date(@Nullable String value) {
    String s = clean(value);
    if (s.isEmpty()) {
      return StagingField.unavailable();
    }
    for (DateTimeFormatter formatter : dateFormatters) {
      try {
        return StagingField.of(LocalDate.parse(s, formatter).toString());
      } catch (DateTimeParseException e) {
        // try the next pattern
        continue;
      }
    }
    return StagingField.unavailable();
  }
}
