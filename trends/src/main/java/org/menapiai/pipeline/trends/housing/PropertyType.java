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
package org.menapiai.pipeline.trends.housing;

import org.menapiai.pipeline.etl.PartitionSlugs;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Redfin property type: one of the known labels, or any other label passed
 * through verbatim so new provider categories are kept.
 */
public final class PropertyType implements Comparable<PropertyType> {
  public static final PropertyType ALL_RESIDENTIAL = new PropertyType("All Residential", true);
  public static final PropertyType SINGLE_FAMILY =
      new PropertyType("Single Family Residential", true);
  public static final PropertyType TOWNHOUSE = new PropertyType("Townhouse", true);
  public static final PropertyType CONDO_CO_OP = new PropertyType("Condo/Co-op", true);
  public static final PropertyType MULTI_FAMILY =
      new PropertyType("Multi-Family (2-4 Unit)", true);

  public static final ImmutableList<PropertyType> KNOWN = ImmutableList.of(
      ALL_RESIDENTIAL, SINGLE_FAMILY, TOWNHOUSE, CONDO_CO_OP, MULTI_FAMILY);

  private final String label;
  private final boolean known;

  private PropertyType(String label, boolean known) {
    this.label = label;
    this.known = known;
  }

  /**
   * Returns the property type for a raw label, compared and kept verbatim.
   * A null label, meaning the source has no property type column, is
   * "All Residential".
   */
  public static PropertyType of(@Nullable String label) {
    if (label == null) {
      return ALL_RESIDENTIAL;
    }
    for (PropertyType type : KNOWN) {
      if (type.label.equals(label)) {
        return type;
      }
    }
    return new PropertyType(label, false);
  }

  public String getLabel() {
    return label;
  }

  /** Whether the label is one of the known Redfin categories. */
  public boolean isKnown() {
    return known;
  }

  /** Partition directory value, e.g. "condo_co_op". */
  public String slug() {
    return PartitionSlugs.slugify(label);
  }

  @Override public int compareTo(PropertyType o) {
    return label.compareTo(o.label);
  }

  @Override public boolean equals(Object o) {
    return this == o || o instanceof PropertyType && label.equals(((PropertyType) o).label);
  }

  @Override public int hashCode() {
    return Objects.hashCode(label);
  }

  @Override public String toString() {
    return label;
  }
}
