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

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Shared DuckDB helpers for writing and reading datasets.
 */
public final class DuckDBSupport {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBSupport.class);

  private DuckDBSupport() {
  }

  /**
   * Opens an in-memory DuckDB connection with the Parquet extension loaded.
   */
  public static Connection openConnection() throws SQLException {
    Connection conn = DriverManager.getConnection("jdbc:duckdb:");
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("INSTALL parquet");
      stmt.execute("LOAD parquet");
    } catch (SQLException e) {
      // Parquet is built into the bundled DuckDB; INSTALL fails offline
      LOGGER.debug("Parquet extension already loaded or built-in: {}", e.getMessage());
    }
    return conn;
  }

  /**
   * Applies writer settings to a connection.
   */
  public static void applySettings(Connection conn, WriterOptions options) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("SET threads=" + options.getThreads());
      stmt.execute("SET preserve_insertion_order=" + options.isPreserveInsertionOrder());
      LOGGER.debug("Applied DuckDB settings: threads={}, preserve_insertion_order={}",
          options.getThreads(), options.isPreserveInsertionOrder());
    }
  }

  /**
   * Quotes a string literal for SQL.
   */
  public static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }

  /**
   * Quotes an identifier for SQL.
   */
  public static String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  /**
   * Returns a DuckDB path string for a local path, using forward slashes.
   */
  public static String sqlPath(Path path) {
    return path.toAbsolutePath().normalize().toString().replace('\\', '/');
  }

  /**
   * Returns the {@code read_parquet} expression covering every file of a
   * hive-partitioned dataset.
   */
  public static String readDataset(Path datasetRoot) {
    return "read_parquet(" + quoteLiteral(sqlPath(datasetRoot) + "/**/*.parquet")
        + ", hive_partitioning=true, union_by_name=true)";
  }

  /**
   * Returns the COPY compression clause for a codec name, or an empty string
   * when compression is disabled.
   */
  static String compressionClause(String compression) {
    if (compression == null || compression.isEmpty() || "none".equalsIgnoreCase(compression)) {
      return "";
    }
    return ", COMPRESSION " + compression.toUpperCase(Locale.ROOT);
  }
}
