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
package org.menapiai.pipeline.trends.employment;

import org.menapiai.pipeline.etl.ColumnType;
import org.menapiai.pipeline.etl.PartitionSpec;
import org.menapiai.pipeline.etl.TableColumn;

import com.google.common.collect.ImmutableList;

/**
 * Column names and schema of the canonical employment dataset.
 */
public final class EmploymentColumns {
  public static final String REGION_ID = "region_id";
  public static final String REGION_NAME = "region_name";
  public static final String REGION_TYPE = "region_type";
  public static final String PERIOD = "period";
  public static final String PERIOD_MONTH = "period_month";
  public static final String YEAR = "year";
  public static final String MONTH = "month";
  public static final String LABOR_FORCE = "labor_force";
  public static final String EMPLOYED = "employed";
  public static final String UNEMPLOYED = "unemployed";
  public static final String UNEMPLOYMENT_RATE = "unemployment_rate";
  public static final String DATA_SOURCE = "data_source";
  public static final String LAST_UPDATED = "last_updated";

  public static final String REGION_PARTITION = "region_partition";

  /** Columns in canonical order. */
  public static final ImmutableList<TableColumn> SCHEMA = ImmutableList.of(
      TableColumn.of(REGION_ID, ColumnType.VARCHAR),
      TableColumn.of(REGION_NAME, ColumnType.VARCHAR),
      TableColumn.of(REGION_TYPE, ColumnType.VARCHAR),
      TableColumn.of(PERIOD, ColumnType.VARCHAR),
      TableColumn.of(PERIOD_MONTH, ColumnType.DATE),
      TableColumn.of(YEAR, ColumnType.INTEGER),
      TableColumn.of(MONTH, ColumnType.INTEGER),
      TableColumn.of(LABOR_FORCE, ColumnType.DOUBLE),
      TableColumn.of(EMPLOYED, ColumnType.DOUBLE),
      TableColumn.of(UNEMPLOYED, ColumnType.DOUBLE),
      TableColumn.of(UNEMPLOYMENT_RATE, ColumnType.DOUBLE),
      TableColumn.of(DATA_SOURCE, ColumnType.VARCHAR),
      TableColumn.of(LAST_UPDATED, ColumnType.TIMESTAMP));

  public static final PartitionSpec PARTITION =
      PartitionSpec.of(REGION_NAME, REGION_PARTITION, PERIOD_MONTH)
          .withMergeKey(REGION_ID, PERIOD_MONTH);

  public static final ImmutableList<String> KEY_COLUMNS = ImmutableList.of(REGION_ID, PERIOD_MONTH);

  private EmploymentColumns() {
  }
}
