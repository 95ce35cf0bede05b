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

import java.util.Optional;

/**
 * LAUS measures collected per metro, keyed by the 2-digit measure code at
 * the end of a series ID.
 */
public enum LausMeasure {
  UNEMPLOYMENT_RATE("03", EmploymentColumns.UNEMPLOYMENT_RATE),
  UNEMPLOYED("04", EmploymentColumns.UNEMPLOYED),
  EMPLOYED("05", EmploymentColumns.EMPLOYED),
  LABOR_FORCE("06", EmploymentColumns.LABOR_FORCE);

  private final String code;
  private final String column;

  LausMeasure(String code, String column) {
    this.code = code;
    this.column = column;
  }

  public String getCode() {
    return code;
  }

  /** Canonical column the measure is pivoted into. */
  public String getColumn() {
    return column;
  }

  public static Optional<LausMeasure> fromCode(String code) {
    for (LausMeasure measure : values()) {
      if (measure.code.equals(code)) {
        return Optional.of(measure);
      }
    }
    return Optional.empty();
  }
}
