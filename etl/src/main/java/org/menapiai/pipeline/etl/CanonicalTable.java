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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory table of canonical rows with a declared column schema.
 *
 * <p>Rows are maps of column name to value. Row maps may omit columns (written
 * as null) but may not carry columns outside the schema. The declared column
 * order is the order of the written Parquet files.
 */
public final class CanonicalTable {
  private final String name;
  private final ImmutableList<TableColumn> columns;
  private final List<Map<String, Object>> rows;

  private CanonicalTable(String name, List<TableColumn> columns,
      List<Map<String, Object>> rows) {
    this.name = name;
    this.columns = ImmutableList.copyOf(columns);
    this.rows = Collections.unmodifiableList(rows);
  }

  /**
   * Creates a table, validating that no row carries an undeclared column.
   *
   * @param name Table name (used for logging)
   * @param columns Declared columns
   * @param rows Row maps keyed by column name
   * @return The table
   * @throws IllegalArgumentException if a row has a column outside the schema
   */
  public static CanonicalTable of(String name, List<TableColumn> columns,
      List<? extends Map<String, ?>> rows) {
    Set<String> declared = new HashSet<>();
    for (TableColumn column : columns) {
      if (!declared.add(column.getName())) {
        throw new IllegalArgumentException("Duplicate column '" + column.getName()
            + "' in table " + name);
      }
    }
    List<Map<String, Object>> copy = new ArrayList<>(rows.size());
    for (Map<String, ?> row : rows) {
      for (String key : row.keySet()) {
        if (!declared.contains(key)) {
          throw new IllegalArgumentException("Row of table " + name
              + " has undeclared column '" + key + "'");
        }
      }
      copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
    return new CanonicalTable(name, columns, copy);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<TableColumn> getColumns() {
    return columns;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Looks up a declared column by name.
   */
  public Optional<TableColumn> column(String columnName) {
    for (TableColumn column : columns) {
      if (column.getName().equals(columnName)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  @Override public String toString() {
    return "CanonicalTable{" + name + ", " + columns.size() + " columns, "
        + rows.size() + " rows}";
  }
}
