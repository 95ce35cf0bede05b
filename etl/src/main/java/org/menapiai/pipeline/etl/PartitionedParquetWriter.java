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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Writes canonical tables to hive-partitioned Parquet datasets using DuckDB.
 *
 * <p>Each row is assigned to a partition directory
 * {@code <partitionColumn>=<slug>/year=<YYYY>} where the slug comes from
 * {@link PartitionSlugs#slugify} of the category column and the year from the
 * period column. Writes merge into existing partitions: a row already on disk
 * is replaced when an incoming row has the same {@link PartitionSpec#getMergeKey
 * merge key} and kept otherwise. Writing the same table twice leaves the
 * dataset unchanged, and partitions the table does not touch are left alone.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PartitionedParquetWriter writer = new PartitionedParquetWriter(WriterOptions.defaults());
 * writer.write(table,
 *     PartitionSpec.of("property_type", "property_type_partition", "period_begin")
 *         .withMergeKey("region_id", "property_type", "period_begin"),
 *     Paths.get("data/clean/housing_trends"));
 * }</pre>
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>Derive the partition key of every row and run the row validators</li>
 *   <li>Load the rows into a temporary DuckDB table with the declared column types</li>
 *   <li>Add the rows of the touched partitions whose merge key is not re-supplied</li>
 *   <li>Delete the touched partition directories</li>
 *   <li>{@code COPY ... PARTITION_BY (...) OVERWRITE_OR_IGNORE} to the dataset root</li>
 * </ol>
 */
public class PartitionedParquetWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(PartitionedParquetWriter.class);

  private static final String STAGING_TABLE = "staging_rows";
  private static final String INCOMING_KEYS_TABLE = "incoming_keys";

  private final WriterOptions options;
  private final ImmutableList<RowValidator> validators;

  public PartitionedParquetWriter(WriterOptions options) {
    this(options, ImmutableList.of());
  }

  /**
   * Creates a writer that checks rows before writing.
   *
   * @param options DuckDB settings
   * @param validators Row validators, applied in order
   */
  public PartitionedParquetWriter(WriterOptions options, List<RowValidator> validators) {
    this.options = options;
    this.validators = ImmutableList.copyOf(validators);
  }

  /**
   * Writes a table into a partitioned dataset.
   *
   * @param table Rows to write, must not be empty
   * @param spec Partition layout
   * @param datasetRoot Dataset root directory, created when missing
   * @return The dataset root
   * @throws IllegalArgumentException if the table is empty, a partition
   *     column is not declared, or a row has no period value
   * @throws IllegalStateException if a row validator fails
   * @throws IOException if deleting partitions or the DuckDB write fails
   */
  public Path write(CanonicalTable table, PartitionSpec spec, Path datasetRoot)
      throws IOException {
    if (table.isEmpty()) {
      throw new IllegalArgumentException("Cannot write empty table " + table.getName()
          + " to " + datasetRoot);
    }
    checkSpec(table, spec);

    List<TableColumn> columns = stagingColumns(table, spec);
    List<Map<String, Object>> rows = new ArrayList<>(table.size());
    SortedSet<PartitionKey> touched = new TreeSet<>();
    int dropped = 0;
    for (Map<String, Object> source : table.getRows()) {
      Map<String, Object> row = new LinkedHashMap<>(source);
      PartitionKey key = partitionKey(row, spec);
      row.put(spec.getPartitionColumn(), key.getSlug());
      row.put(PartitionSpec.YEAR_COLUMN, key.getYear());
      if (!accept(row)) {
        dropped++;
        continue;
      }
      rows.add(row);
      touched.add(key);
    }
    if (rows.isEmpty()) {
      throw new IllegalArgumentException("All " + table.size() + " rows of table "
          + table.getName() + " were dropped by validation");
    }
    if (dropped > 0) {
      LOGGER.info("Dropped {} of {} rows of table {} during validation",
          dropped, table.size(), table.getName());
    }

    Files.createDirectories(datasetRoot);
    List<Path> existing = existingPartitions(datasetRoot, spec, touched);

    long startTime = System.currentTimeMillis();
    int kept = 0;
    try (Connection conn = DuckDBSupport.openConnection()) {
      DuckDBSupport.applySettings(conn, options);
      createStagingTable(conn, columns);
      insertRows(conn, columns, rows);
      if (!existing.isEmpty()) {
        kept = mergeExisting(conn, columns, spec, existing);
        for (Path partitionDir : existing) {
          LOGGER.debug("Rewriting existing partition {}", partitionDir);
          deleteRecursively(partitionDir);
        }
      }
      try (Statement stmt = conn.createStatement()) {
        String sql = buildCopySql(datasetRoot, spec);
        LOGGER.debug("Partitioned write SQL:\n{}", sql);
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      String errorMsg = String.format("DuckDB partitioned write failed for table '%s' to %s: %s",
          table.getName(), datasetRoot, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    }

    if (kept > 0) {
      LOGGER.info("Kept {} existing rows from {} partitions under {}",
          kept, existing.size(), datasetRoot);
    }
    LOGGER.info("Wrote {} rows of table {} into {} partitions under {} in {}ms",
        rows.size() + kept, table.getName(), touched.size(), datasetRoot,
        System.currentTimeMillis() - startTime);
    return datasetRoot;
  }

  private static void checkSpec(CanonicalTable table, PartitionSpec spec) {
    if (!table.column(spec.getCategoryColumn()).isPresent()) {
      throw new IllegalArgumentException("Category column '" + spec.getCategoryColumn()
          + "' is not declared by table " + table.getName());
    }
    TableColumn period = table.column(spec.getPeriodColumn()).orElseThrow(() ->
        new IllegalArgumentException("Period column '" + spec.getPeriodColumn()
            + "' is not declared by table " + table.getName()));
    if (period.getType() != ColumnType.DATE) {
      throw new IllegalArgumentException("Period column '" + spec.getPeriodColumn()
          + "' must be DATE but is " + period.getType());
    }
    if (table.column(spec.getPartitionColumn()).isPresent()) {
      throw new IllegalArgumentException("Partition column '" + spec.getPartitionColumn()
          + "' collides with a declared column of table " + table.getName());
    }
    for (String keyColumn : spec.getMergeKey()) {
      if (!table.column(keyColumn).isPresent()) {
        throw new IllegalArgumentException("Merge key column '" + keyColumn
            + "' is not declared by table " + table.getName());
      }
    }
  }

  /** Touched partition directories that already hold Parquet files. */
  private static List<Path> existingPartitions(Path datasetRoot, PartitionSpec spec,
      SortedSet<PartitionKey> touched) throws IOException {
    List<Path> existing = new ArrayList<>();
    for (PartitionKey key : touched) {
      Path partitionDir = key.resolve(datasetRoot, spec.getPartitionColumn());
      if (!Files.isDirectory(partitionDir)) {
        continue;
      }
      try (Stream<Path> files = Files.list(partitionDir)) {
        if (files.anyMatch(f -> f.getFileName().toString().endsWith(".parquet"))) {
          existing.add(partitionDir);
        }
      }
    }
    return existing;
  }

  /**
   * Copies the rows of existing partitions into the staging table unless an
   * incoming row has the same merge key.
   *
   * @return Number of existing rows kept
   */
  private static int mergeExisting(Connection conn, List<TableColumn> columns,
      PartitionSpec spec, List<Path> partitionDirs) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(buildIncomingKeysSql(spec));
      String sql = buildMergeSql(columns, spec, partitionDirs);
      LOGGER.debug("Partition merge SQL:\n{}", sql);
      return stmt.executeUpdate(sql);
    }
  }

  static String buildIncomingKeysSql(PartitionSpec spec) {
    StringBuilder sql = new StringBuilder("CREATE TEMPORARY TABLE ")
        .append(INCOMING_KEYS_TABLE).append(" AS SELECT DISTINCT ");
    for (int i = 0; i < spec.getMergeKey().size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(DuckDBSupport.quoteIdentifier(spec.getMergeKey().get(i)));
    }
    return sql.append(" FROM ").append(STAGING_TABLE).toString();
  }

  /**
   * Builds the INSERT that carries existing rows forward. Partition values
   * come from the directory names and are read as text, then cast to the
   * staging column types.
   */
  static String buildMergeSql(List<TableColumn> columns, PartitionSpec spec,
      List<Path> partitionDirs) {
    StringBuilder sql = new StringBuilder("INSERT INTO ").append(STAGING_TABLE).append(" (");
    StringBuilder select = new StringBuilder("SELECT ");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sql.append(", ");
        select.append(", ");
      }
      TableColumn column = columns.get(i);
      String name = DuckDBSupport.quoteIdentifier(column.getName());
      sql.append(name);
      select.append("CAST(e.").append(name).append(" AS ")
          .append(column.getType().getSqlType()).append(")");
    }
    sql.append(")\n").append(select).append("\nFROM read_parquet([");
    for (int i = 0; i < partitionDirs.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(DuckDBSupport.quoteLiteral(DuckDBSupport.sqlPath(partitionDirs.get(i))
          + "/*.parquet"));
    }
    sql.append("], hive_partitioning=true, hive_types_autocast=false, union_by_name=true) AS e")
        .append("\nWHERE NOT EXISTS (SELECT 1 FROM ").append(INCOMING_KEYS_TABLE)
        .append(" AS i WHERE ");
    for (int i = 0; i < spec.getMergeKey().size(); i++) {
      if (i > 0) {
        sql.append(" AND ");
      }
      String key = DuckDBSupport.quoteIdentifier(spec.getMergeKey().get(i));
      sql.append("i.").append(key).append(" IS NOT DISTINCT FROM e.").append(key);
    }
    return sql.append(")").toString();
  }

  /**
   * Declared columns followed by the derived partition columns. A declared
   * {@code year} column is reused and overwritten with the derived year.
   */
  private static List<TableColumn> stagingColumns(CanonicalTable table, PartitionSpec spec) {
    List<TableColumn> columns = new ArrayList<>(table.getColumns());
    columns.add(TableColumn.of(spec.getPartitionColumn(), ColumnType.VARCHAR));
    if (!table.column(PartitionSpec.YEAR_COLUMN).isPresent()) {
      columns.add(TableColumn.of(PartitionSpec.YEAR_COLUMN, ColumnType.INTEGER));
    }
    return columns;
  }

  private static PartitionKey partitionKey(Map<String, Object> row, PartitionSpec spec) {
    Object period = row.get(spec.getPeriodColumn());
    if (period == null) {
      throw new IllegalArgumentException("Row has no value for period column '"
          + spec.getPeriodColumn() + "': " + row);
    }
    Object category = row.get(spec.getCategoryColumn());
    int year = LocalDate.parse((String) ColumnType.DATE.normalize(period)).getYear();
    return new PartitionKey(PartitionSlugs.slugify(category == null ? null : category.toString()),
        year);
  }

  private boolean accept(Map<String, Object> row) {
    for (RowValidator validator : validators) {
      ValidationResult result = validator.validate(row);
      switch (result.getAction()) {
      case FAIL:
        throw new IllegalStateException("Row validation failed: " + result.getMessage());
      case DROP:
        LOGGER.debug("Dropping row: {}", result.getMessage());
        return false;
      default:
        break;
      }
    }
    return true;
  }

  private static void createStagingTable(Connection conn, List<TableColumn> columns)
      throws SQLException {
    StringBuilder sql = new StringBuilder("CREATE TEMPORARY TABLE ")
        .append(STAGING_TABLE).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sql.append(", ");
      }
      TableColumn column = columns.get(i);
      sql.append(DuckDBSupport.quoteIdentifier(column.getName()))
          .append(' ').append(column.getType().getSqlType());
    }
    sql.append(")");
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(sql.toString());
    }
  }

  private void insertRows(Connection conn, List<TableColumn> columns,
      List<Map<String, Object>> rows) throws SQLException {
    try (PreparedStatement pstmt = conn.prepareStatement(buildInsertStatement(columns))) {
      int batchCount = 0;
      for (Map<String, Object> row : rows) {
        for (int i = 0; i < columns.size(); i++) {
          TableColumn column = columns.get(i);
          Object value = column.getType().normalize(row.get(column.getName()));
          if (value == null) {
            pstmt.setNull(i + 1, jdbcType(column.getType()));
          } else {
            pstmt.setObject(i + 1, value);
          }
        }
        pstmt.addBatch();
        batchCount++;
        if (batchCount >= options.getInsertBatchSize()) {
          pstmt.executeBatch();
          batchCount = 0;
        }
      }
      if (batchCount > 0) {
        pstmt.executeBatch();
      }
    }
  }

  /**
   * Builds the INSERT statement. Dates and timestamps are bound as text and
   * cast by DuckDB.
   */
  static String buildInsertStatement(List<TableColumn> columns) {
    StringBuilder sb = new StringBuilder("INSERT INTO ").append(STAGING_TABLE).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(DuckDBSupport.quoteIdentifier(columns.get(i).getName()));
    }
    sb.append(") VALUES (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      ColumnType type = columns.get(i).getType();
      if (type == ColumnType.DATE || type == ColumnType.TIMESTAMP) {
        sb.append("CAST(? AS ").append(type.getSqlType()).append(")");
      } else {
        sb.append("?");
      }
    }
    sb.append(")");
    return sb.toString();
  }

  private String buildCopySql(Path datasetRoot, PartitionSpec spec) {
    return "COPY (SELECT * FROM " + STAGING_TABLE + ") TO "
        + DuckDBSupport.quoteLiteral(DuckDBSupport.sqlPath(datasetRoot))
        + " (FORMAT PARQUET"
        + ", PARTITION_BY (" + DuckDBSupport.quoteIdentifier(spec.getPartitionColumn())
        + ", " + DuckDBSupport.quoteIdentifier(PartitionSpec.YEAR_COLUMN) + ")"
        + DuckDBSupport.compressionClause(options.getCompression())
        + ", ROW_GROUP_SIZE " + options.getRowGroupSize()
        + ", OVERWRITE_OR_IGNORE)";
  }

  private static int jdbcType(ColumnType type) {
    switch (type) {
    case INTEGER:
      return Types.INTEGER;
    case BIGINT:
      return Types.BIGINT;
    case DOUBLE:
      return Types.DOUBLE;
    default:
      return Types.VARCHAR;
    }
  }

  private static void deleteRecursively(Path dir) throws IOException {
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> {
        try {
          Files.delete(path);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }
}
