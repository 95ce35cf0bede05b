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
package org.menapiai.pipeline.etl;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives directory-safe partition values from category labels.
 *
 * <p>Examples:
 * <pre>
 * "Condo/Co-op"                          → condo_co_op
 * "Single Family Residential"            → single_family_residential
 * "Portland-Vancouver-Hillsboro, OR-WA"  → portland_vancouver_hillsboro_or_wa
 * </pre>
 */
public final class PartitionSlugs {
  /** Slug used when a label has no alphanumeric characters at all. */
  public static final String UNKNOWN = "unknown";

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

  private PartitionSlugs() {
  }

  /**
   * Lower-cases the label and collapses every run of non-alphanumeric
   * characters into a single underscore, trimming underscores at both ends.
   *
   * @param label Category label, may be null
   * @return Slug, never empty
   */
  public static String slugify(@Nullable String label) {
    if (label == null) {
      return UNKNOWN;
    }
    String slug = NON_ALPHANUMERIC.matcher(label.toLowerCase(Locale.ROOT)).replaceAll("_");
    int start = 0;
    int end = slug.length();
    while (start < end && slug.charAt(start) == '_') {
      start++;
    }
    while (end > start && slug.charAt(end - 1) == '_') {
      end--;
    }
    return start == end ? UNKNOWN : slug.substring(start, end);
  }
}
