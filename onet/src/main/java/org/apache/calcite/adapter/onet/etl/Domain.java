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

import java.util.Locale;

/**
 * Rated element domains. The domain of a rating row comes from the file it was
 * extracted from, never from the row itself.
 */
public enum Domain {
  SKILL("stg_skills"),
  KNOWLEDGE("stg_knowledge"),
  ABILITY("stg_abilities");

  private final String stagingTable;

  Domain(String stagingTable) {
    this.stagingTable = stagingTable;
  }

  /**
   * Returns the staging table that receives this domain's normalized rows.
   */
  public String getStagingTable() {
    return stagingTable;
  }

  /**
   * Resolves a domain from a tag such as {@code "skill"}, {@code "SKILLS"} or
   * {@code "abilities"}.
   *
   * @throws OnetDataException if the tag names no domain
   */
  public static Domain fromTag(String tag) {
    if (tag == null) {
      throw new OnetDataException("Domain tag is null");
    }
    String upper = tag.trim().toUpperCase(Locale.ROOT);
    switch (upper) {
    case "SKILL":
    case "SKILLS":
      return SKILL;
    case "KNOWLEDGE":
      return KNOWLEDGE;
    case "ABILITY":
    case "ABILITIES":
      return ABILITY;
    default:
      throw new OnetDataException("Unknown domain tag: " + tag);
    }
  }
}
