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

import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * Describes how a canonical table is laid out on disk.
 *
 * <p>A dataset is partitioned by two hive-style directory levels:
 * <pre>
 * &lt;datasetRoot&gt;/&lt;partitionColumn&gt;=&lt;slug of categoryColumn&gt;/
 *     year=&lt;year of periodColumn&gt;/
 * </pre>
 *
 * <p>The merge key names the columns that identify a row. When a write
 * touches a partition that already holds data, existing rows whose merge key
 * matches an incoming row are replaced and all other existing rows are kept.
 * It defaults to the category and period columns.
 */
public final class PartitionSpec {
  /** Name of the derived year partition column. */
  public static final String YEAR_COLUMN = "year";

  private final String categoryColumn;
  private final String partitionColumn;
  private final String periodColumn;
  private final ImmutableList<String> mergeKey;

  private PartitionSpec(String categoryColumn, String partitionColumn, String periodColumn,
      ImmutableList<String> mergeKey) {
    this.categoryColumn = Objects.requireNonNull(categoryColumn, "categoryColumn");
    this.partitionColumn = Objects.requireNonNull(partitionColumn, "partitionColumn");
    this.periodColumn = Objects.requireNonNull(periodColumn, "periodColumn");
    this.mergeKey = mergeKey;
    if (partitionColumn.equals(YEAR_COLUMN)) {
      throw new IllegalArgumentException("partition column cannot be named '" + YEAR_COLUMN + "'");
    }
    if (mergeKey.isEmpty()) {
      throw new IllegalArgumentException("merge key must name at least one column");
    }
  }

  /**
   * Creates a spec.
   *
   * @param categoryColumn Column whose slugged value names the first partition level
   * @param partitionColumn Name of the first partition level (e.g. "region_partition")
   * @param periodColumn DATE column the year partition is derived from
   */
  public static PartitionSpec of(String categoryColumn, String partitionColumn,
      String periodColumn) {
    return new PartitionSpec(categoryColumn, partitionColumn, periodColumn,
        ImmutableList.of(categoryColumn, periodColumn));
  }

  /**
   * Returns a copy of this spec with a different merge key.
   *
   * @param columns Columns that together identify a row
   */
  public PartitionSpec withMergeKey(String... columns) {
    return new PartitionSpec(categoryColumn, partitionColumn, periodColumn,
        ImmutableList.copyOf(columns));
  }

  public String getCategoryColumn() {
    return categoryColumn;
  }

  public String getPartitionColumn() {
    return partitionColumn;
  }

  public String getPeriodColumn() {
    return periodColumn;
  }

  public ImmutableList<String> getMergeKey() {
    return mergeKey;
  }

  @Override public String toString() {
    return "PartitionSpec{" + partitionColumn + "<-" + categoryColumn
        + ", " + YEAR_COLUMN + "<-" + periodColumn + ", key=" + mergeKey + "}";
  }
}
