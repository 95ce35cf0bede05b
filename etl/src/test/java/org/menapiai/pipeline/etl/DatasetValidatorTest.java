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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DatasetValidator}.
 */
@Tag("integration")
public class DatasetValidatorTest {

  private static final List<TableColumn> COLUMNS = ImmutableList.of(
      TableColumn.of("region_id", ColumnType.VARCHAR),
      TableColumn.of("property_type", ColumnType.VARCHAR),
      TableColumn.of("period_begin", ColumnType.DATE),
      TableColumn.of("period_month", ColumnType.DATE));

  @TempDir
  Path tempDir;

  private Path write(String regionId) throws IOException {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("region_id", regionId);
    row.put("property_type", "All Residential");
    row.put("period_begin", "2020-06-01");
    row.put("period_month", "2020-06-01");
    Path root = tempDir.resolve("housing_trends");
    new PartitionedParquetWriter(WriterOptions.defaults()).write(
        CanonicalTable.of("housing", COLUMNS, ImmutableList.of(row)),
        PartitionSpec.of("property_type", "property_type_partition", "period_begin"), root);
    return root;
  }

  @Test void testValidDataset() throws IOException {
    Path root = write("4138900");

    ValidationResult result = new DatasetValidator().validate(root,
        ImmutableList.of("region_id", "period_month", "property_type"),
        ImmutableList.of("region_id", "period_month"));

    assertTrue(result.isValid(), String.valueOf(result.getMessage()));
  }

  @Test void testNullKeyReported() throws IOException {
    Path root = write(null);

    ValidationResult result = new DatasetValidator().validate(root,
        ImmutableList.of("region_id"), ImmutableList.of("region_id", "period_month"));

    assertEquals(ValidationResult.Action.FAIL, result.getAction());
    assertTrue(result.getMessage().contains("region_id contains 1 nulls"));
  }

  @Test void testMissingColumnReported() throws IOException {
    Path root = write("4138900");

    ValidationResult result = new DatasetValidator().validate(root,
        ImmutableList.of("region_id", "median_sale_price"), ImmutableList.of());

    assertEquals(ValidationResult.Action.FAIL, result.getAction());
    assertTrue(result.getMessage().contains("median_sale_price"));
  }

  @Test void testNoFilesIsFailure() throws IOException {
    Path root = Files.createDirectories(tempDir.resolve("nothing"));

    ValidationResult result = new DatasetValidator().validate(root,
        ImmutableList.of("region_id"), ImmutableList.of("region_id"));

    assertEquals(ValidationResult.Action.FAIL, result.getAction());
    assertTrue(result.getMessage().startsWith("No parquet files found"));
  }
}
