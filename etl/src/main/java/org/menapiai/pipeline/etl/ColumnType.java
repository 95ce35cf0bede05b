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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Storage types of canonical table columns.
 *
 * <p>Every column written to a dataset carries one of these types. Values are
 * normalized to a single representation per type before they are bound to
 * DuckDB, so that every partition file of a dataset ends up with the same
 * physical Parquet schema:
 * <ul>
 *   <li>{@link #VARCHAR} - any value, written through {@code toString()}</li>
 *   <li>{@link #INTEGER} / {@link #BIGINT} / {@link #DOUBLE} - numbers or numeric strings</li>
 *   <li>{@link #DATE} - {@link LocalDate} or ISO-8601 date strings</li>
 *   <li>{@link #TIMESTAMP} - {@link LocalDateTime} or ISO-8601 timestamp strings</li>
 * </ul>
 */
public enum ColumnType {
  VARCHAR("VARCHAR"),
  INTEGER("INTEGER"),
  BIGINT("BIGINT"),
  DOUBLE("DOUBLE"),
  DATE("DATE"),
  TIMESTAMP("TIMESTAMP");

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

  private final String sqlType;

  ColumnType(String sqlType) {
    this.sqlType = sqlType;
  }

  /**
   * Returns the DuckDB type name used in {@code CREATE TABLE} statements.
   */
  public String getSqlType() {
    return sqlType;
  }

  /**
   * Normalizes a Java value to the representation bound for this type.
   *
   * <p>Dates and timestamps are rendered as strings and cast by DuckDB on
   * insert; numbers are widened or narrowed to the exact boxed type.
   *
   * @param value Value from a table row, may be null
   * @return Normalized value, or null
   * @throws IllegalArgumentException if the value cannot represent this type
   */
  public @Nullable Object normalize(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
    case VARCHAR:
      return value.toString();
    case INTEGER:
      return value instanceof Number
          ? Integer.valueOf(((Number) value).intValue())
          : Integer.valueOf(value.toString().trim());
    case BIGINT:
      return value instanceof Number
          ? Long.valueOf(((Number) value).longValue())
          : Long.valueOf(value.toString().trim());
    case DOUBLE:
      return value instanceof Number
          ? Double.valueOf(((Number) value).doubleValue())
          : Double.valueOf(value.toString().trim());
    case DATE:
      if (value instanceof LocalDate) {
        return value.toString();
      }
      if (value instanceof LocalDateTime) {
        return ((LocalDateTime) value).toLocalDate().toString();
      }
      return LocalDate.parse(value.toString().trim()).toString();
    case TIMESTAMP:
      if (value instanceof LocalDateTime) {
        return TIMESTAMP_FORMAT.format((LocalDateTime) value);
      }
      if (value instanceof LocalDate) {
        return TIMESTAMP_FORMAT.format(((LocalDate) value).atStartOfDay());
      }
      return TIMESTAMP_FORMAT.format(LocalDateTime.parse(value.toString().trim()));
    default:
      throw new IllegalArgumentException("Unsupported column type: " + this);
    }
  }
}
