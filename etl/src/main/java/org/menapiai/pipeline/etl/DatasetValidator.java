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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Checks the schema and key columns of a written dataset.
 *
 * <p>A dataset passes when it has at least one Parquet file, every required
 * column is present and no key column holds a null.
 */
public class DatasetValidator {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetValidator.class);

  /**
   * Validates a dataset.
   *
   * @param datasetRoot Dataset root directory
   * @param requiredColumns Columns that must exist
   * @param keyColumns Columns that must never be null
   * @return {@link ValidationResult#valid()} or a FAIL result listing every problem
   * @throws IOException if DuckDB cannot read the dataset
   */
  public ValidationResult validate(Path datasetRoot, Collection<String> requiredColumns,
      Collection<String> keyColumns) throws IOException {
    if (!Files.isDirectory(datasetRoot)
        || DatasetInspector.parquetFiles(datasetRoot).isEmpty()) {
      return ValidationResult.fail("No parquet files found in " + datasetRoot);
    }

    String source = DuckDBSupport.readDataset(datasetRoot);
    List<String> problems = new ArrayList<>();
    try (Connection conn = DuckDBSupport.openConnection();
         Statement stmt = conn.createStatement()) {
      Map<String, String> columns = DatasetInspector.describe(stmt, source);

      TreeSet<String> missing = new TreeSet<>(requiredColumns);
      missing.removeAll(columns.keySet());
      if (!missing.isEmpty()) {
        problems.add("Missing columns " + missing);
      }

      for (String key : keyColumns) {
        if (!columns.containsKey(key)) {
          continue;
        }
        try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + source
            + " WHERE " + DuckDBSupport.quoteIdentifier(key) + " IS NULL")) {
          rs.next();
          long nulls = rs.getLong(1);
          if (nulls > 0) {
            problems.add(key + " contains " + nulls + " nulls");
          }
        }
      }
    } catch (SQLException e) {
      String errorMsg = String.format("Failed to validate %s: %s", datasetRoot, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    }

    if (problems.isEmpty()) {
      LOGGER.info("Dataset {} passed validation", datasetRoot);
      return ValidationResult.valid();
    }
    String message = datasetRoot + ": " + String.join("; ", problems);
    LOGGER.warn("Dataset validation failed: {}", message);
    return ValidationResult.fail(message);
  }
}
