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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One metro-month of the canonical employment dataset. The four LAUS
 * measures are columns; any of them may be null.
 */
public final class CanonicalEmploymentRecord {
  public static final String REGION_TYPE_METRO = "metro";
  public static final String DATA_SOURCE_LAUS = "BLS LAUS";

  private final String regionId;
  private final String regionName;
  private final YearMonth month;
  private final EnumMap<LausMeasure, Double> measures;
  private final LocalDateTime lastUpdated;

  CanonicalEmploymentRecord(String regionId, String regionName, YearMonth month,
      Map<LausMeasure, Double> measures, LocalDateTime lastUpdated) {
    this.regionId = Objects.requireNonNull(regionId, "regionId");
    this.regionName = Objects.requireNonNull(regionName, "regionName");
    this.month = Objects.requireNonNull(month, "month");
    this.measures = measures.isEmpty()
        ? new EnumMap<>(LausMeasure.class) : new EnumMap<>(measures);
    this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
  }

  public String getRegionId() {
    return regionId;
  }

  public String getRegionName() {
    return regionName;
  }

  public String getRegionType() {
    return REGION_TYPE_METRO;
  }

  /** "YYYY-MM". */
  public String getPeriod() {
    return month.toString();
  }

  public LocalDate getPeriodMonth() {
    return month.atDay(1);
  }

  public int getYear() {
    return month.getYear();
  }

  public int getMonth() {
    return month.getMonthValue();
  }

  public YearMonth getYearMonth() {
    return month;
  }

  public @Nullable Double get(LausMeasure measure) {
    return measures.get(measure);
  }

  public @Nullable Double getLaborForce() {
    return measures.get(LausMeasure.LABOR_FORCE);
  }

  public @Nullable Double getEmployed() {
    return measures.get(LausMeasure.EMPLOYED);
  }

  public @Nullable Double getUnemployed() {
    return measures.get(LausMeasure.UNEMPLOYED);
  }

  public @Nullable Double getUnemploymentRate() {
    return measures.get(LausMeasure.UNEMPLOYMENT_RATE);
  }

  public String getDataSource() {
    return DATA_SOURCE_LAUS;
  }

  public LocalDateTime getLastUpdated() {
    return lastUpdated;
  }

  /**
   * Returns the record as a row keyed by canonical column, every column
   * present.
   */
  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(EmploymentColumns.REGION_ID, regionId);
    row.put(EmploymentColumns.REGION_NAME, regionName);
    row.put(EmploymentColumns.REGION_TYPE, REGION_TYPE_METRO);
    row.put(EmploymentColumns.PERIOD, getPeriod());
    row.put(EmploymentColumns.PERIOD_MONTH, getPeriodMonth());
    row.put(EmploymentColumns.YEAR, getYear());
    row.put(EmploymentColumns.MONTH, getMonth());
    row.put(EmploymentColumns.LABOR_FORCE, getLaborForce());
    row.put(EmploymentColumns.EMPLOYED, getEmployed());
    row.put(EmploymentColumns.UNEMPLOYED, getUnemployed());
    row.put(EmploymentColumns.UNEMPLOYMENT_RATE, getUnemploymentRate());
    row.put(EmploymentColumns.DATA_SOURCE, DATA_SOURCE_LAUS);
    row.put(EmploymentColumns.LAST_UPDATED, lastUpdated);
    return row;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalEmploymentRecord)) {
      return false;
    }
    CanonicalEmploymentRecord that = (CanonicalEmploymentRecord) o;
    return regionId.equals(that.regionId)
        && regionName.equals(that.regionName)
        && month.equals(that.month)
        && measures.equals(that.measures)
        && lastUpdated.equals(that.lastUpdated);
  }

  @Override public int hashCode() {
    return Objects.hash(regionId, regionName, month, measures, lastUpdated);
  }

  @Override public String toString() {
    return "CanonicalEmploymentRecord{" + regionId + ", " + getPeriod() + ", " + measures + "}";
  }
}
