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
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads back a written dataset, or a single Parquet file, for inspection.
 */
public class DatasetInspector {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatasetInspector.class);

  /**
   * Summarizes a dataset.
   *
   * @param target Dataset root directory or a single {@code .parquet} file
   * @param headRows Number of leading rows to return
   * @return Summary with row count, schema, partitions and the first rows
   * @throws NoSuchFileException if the target does not exist
   * @throws IOException if the target holds no Parquet files or DuckDB fails
   */
  public DatasetSummary inspect(Path target, int headRows) throws IOException {
    if (!Files.exists(target)) {
      throw new NoSuchFileException(target.toString());
    }
    List<String> partitions = listPartitions(target);
    String source = Files.isDirectory(target)
        ? DuckDBSupport.readDataset(target)
        : "read_parquet(" + DuckDBSupport.quoteLiteral(DuckDBSupport.sqlPath(target)) + ")";

    try (Connection conn = DuckDBSupport.openConnection();
         Statement stmt = conn.createStatement()) {
      Map<String, String> columns = describe(stmt, source);

      long rowCount;
      try (ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + source)) {
        rs.next();
        rowCount = rs.getLong(1);
      }

      List<Map<String, Object>> head = new ArrayList<>();
      try (ResultSet rs = stmt.executeQuery("SELECT * FROM " + source
          + " LIMIT " + Math.max(0, headRows))) {
        ResultSetMetaData meta = rs.getMetaData();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnName(i), rs.getObject(i));
          }
          head.add(row);
        }
      }
      LOGGER.debug("Inspected {}: {} rows, {} partitions", target, rowCount, partitions.size());
      return new DatasetSummary(target, rowCount, columns, partitions, head);
    } catch (SQLException e) {
      String errorMsg = String.format("Failed to inspect %s: %s", target, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    }
  }

  /**
   * Returns column name to DuckDB type for a {@code read_parquet} source.
   */
  static Map<String, String> describe(Statement stmt, String source) throws SQLException {
    Map<String, String> columns = new LinkedHashMap<>();
    try (ResultSet rs = stmt.executeQuery("DESCRIBE SELECT * FROM " + source)) {
      while (rs.next()) {
        columns.put(rs.getString("column_name"), rs.getString("column_type"));
      }
    }
    return columns;
  }

  /**
   * Lists the partition directories holding Parquet files, relative to the
   * dataset root and sorted.
   */
  static List<String> listPartitions(Path target) throws IOException {
    if (!Files.isDirectory(target)) {
      return ImmutableList.of();
    }
    List<Path> files = parquetFiles(target);
    if (files.isEmpty()) {
      throw new IOException("No parquet files found under " + target);
    }
    TreeSet<String> partitions = new TreeSet<>();
    for (Path file : files) {
      Path parent = target.relativize(file.getParent());
      if (!parent.toString().isEmpty()) {
        partitions.add(parent.toString().replace('\\', '/'));
      }
    }
    return ImmutableList.copyOf(partitions);
  }

  static List<Path> parquetFiles(Path root) throws IOException {
    try (Stream<Path> paths = Files.walk(root)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(".parquet"))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  /**
   * Result of {@link #inspect}.
   */
  public static final class DatasetSummary {
    private final Path target;
    private final long rowCount;
    private final ImmutableMap<String, String> columns;
    private final ImmutableList<String> partitions;
    private final List<Map<String, Object>> head;

    DatasetSummary(Path target, long rowCount, Map<String, String> columns,
        List<String> partitions, List<Map<String, Object>> head) {
      this.target = target;
      this.rowCount = rowCount;
      this.columns = ImmutableMap.copyOf(columns);
      this.partitions = ImmutableList.copyOf(partitions);
      this.head = head;
    }

    public Path getTarget() {
      return target;
    }

    public long getRowCount() {
      return rowCount;
    }

    /** Column name to DuckDB type, in file order. */
    public ImmutableMap<String, String> getColumns() {
      return columns;
    }

    /** Relative partition directories, e.g. {@code region_partition=x/year=2020}. */
    public ImmutableList<String> getPartitions() {
      return partitions;
    }

    public List<Map<String, Object>> getHead() {
      return head;
    }

    /**
     * Renders the summary as plain text for console output.
     */
    public String format() {
      StringBuilder sb = new StringBuilder();
      sb.append("Loaded ").append(rowCount).append(" rows from ").append(target).append('\n');
      sb.append("Columns:\n");
      columns.forEach((name, type) ->
          sb.append("  ").append(name).append(' ').append(type).append('\n'));
      if (!partitions.isEmpty()) {
        sb.append("Partitions (").append(partitions.size()).append("):\n");
        for (String partition : partitions) {
          sb.append("  ").append(partition).append('\n');
        }
      }
      sb.append("First ").append(head.size()).append(" rows:\n");
      for (Map<String, Object> row : head) {
        sb.append("  ").append(row).append('\n');
      }
      return sb.toString();
    }
  }
}
