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

import java.util.Map;

/**
 * Checks one canonical row before it is written.
 *
 * <p>Validators run after the partition values have been derived and before
 * the row is inserted into DuckDB. A validator sees the row exactly as the
 * writer received it and must not modify it.
 *
 * <pre>{@code
 * RowValidator regionRequired = row -> row.get("region_id") == null
 *     ? ValidationResult.fail("region_id is null")
 *     : ValidationResult.valid();
 * }</pre>
 *
 * @see ValidationResult
 * @see PartitionedParquetWriter
 */
@FunctionalInterface
public interface RowValidator {

  /**
   * Validates a row.
   *
   * @param row Map of column name to value (should not be modified)
   * @return ValidationResult indicating what the writer does with the row
   */
  ValidationResult validate(Map<String, Object> row);

  /**
   * Returns a validator that fails any row where {@code column} is null.
   *
   * @param column Column that must be present on every row
   */
  static RowValidator notNull(String column) {
    return row -> row.get(column) == null
        ? ValidationResult.fail("Missing required value for column '" + column + "'")
        : ValidationResult.valid();
  }
}
