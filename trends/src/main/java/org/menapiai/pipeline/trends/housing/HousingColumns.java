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

import org.menapiai.pipeline.etl.ColumnType;
import org.menapiai.pipeline.etl.PartitionSpec;
import org.menapiai.pipeline.etl.TableColumn;

import com.google.common.collect.ImmutableList;

/**
 * Column names and schema of the canonical housing dataset.
 */
public final class HousingColumns {
  public static final String REGION_ID = "region_id";
  public static final String PERIOD_BEGIN = "period_begin";
  public static final String PERIOD_END = "period_end";
  public static final String MEDIAN_SALE_PRICE = "median_sale_price";
  public static final String HOMES_SOLD = "homes_sold";
  public static final String INVENTORY = "inventory";
  public static final String MEDIAN_DAYS_ON_MARKET = "median_days_on_market";
  public static final String PROPERTY_TYPE = "property_type";
  public static final String PERIOD_MONTH = "period_month";
  public static final String LAST_UPDATED = "last_updated";

  public static final String PROPERTY_TYPE_PARTITION = "property_type_partition";

  /** Columns in canonical order. */
  public static final ImmutableList<TableColumn> SCHEMA = ImmutableList.of(
      TableColumn.of(REGION_ID, ColumnType.VARCHAR),
      TableColumn.of(PERIOD_BEGIN, ColumnType.DATE),
      TableColumn.of(PERIOD_END, ColumnType.DATE),
      TableColumn.of(MEDIAN_SALE_PRICE, ColumnType.DOUBLE),
      TableColumn.of(HOMES_SOLD, ColumnType.INTEGER),
      TableColumn.of(INVENTORY, ColumnType.INTEGER),
      TableColumn.of(MEDIAN_DAYS_ON_MARKET, ColumnType.DOUBLE),
      TableColumn.of(PROPERTY_TYPE, ColumnType.VARCHAR),
      TableColumn.of(PERIOD_MONTH, ColumnType.DATE),
      TableColumn.of(LAST_UPDATED, ColumnType.TIMESTAMP));

  /** One row per region, property type and period. */
  public static final PartitionSpec PARTITION =
      PartitionSpec.of(PROPERTY_TYPE, PROPERTY_TYPE_PARTITION, PERIOD_BEGIN)
          .withMergeKey(REGION_ID, PROPERTY_TYPE, PERIOD_BEGIN, PERIOD_END);

  public static final ImmutableList<String> KEY_COLUMNS = ImmutableList.of(REGION_ID, PERIOD_MONTH);

  private HousingColumns() {
  }
}
