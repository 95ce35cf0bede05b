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

import org.menapiai.pipeline.etl.CanonicalTable;
import org.menapiai.pipeline.trends.ConfigurationException;
import org.menapiai.pipeline.trends.DateWindow;
import org.menapiai.pipeline.trends.EmptyResultException;
import org.menapiai.pipeline.trends.MalformedRecordException;
import org.menapiai.pipeline.trends.PipelineConfig;
import org.menapiai.pipeline.trends.UpstreamFailureException;
import org.menapiai.pipeline.trends.region.MetroArea;
import org.menapiai.pipeline.trends.region.RegionCatalog;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a raw BLS LAUS response into canonical employment records for one
 * metro area.
 *
 * <p>The response carries one series per (metro, measure). Data points of
 * the requested metro are pivoted into one record per month with the four
 * measures as columns. Records are keyed by {@link YearMonth}, so the
 * result does not depend on the order of series in the response; when the
 * same measure appears twice for a month, the later value wins.
 *
 * <p>Unparsable series IDs and values are skipped with a warning. An unknown
 * metro, a failed response or an empty result are fatal.
 */
public class EmploymentNormalizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(EmploymentNormalizer.class);

  private final RegionCatalog catalog;
  private final Clock clock;

  public EmploymentNormalizer(RegionCatalog catalog, Clock clock) {
    this.catalog = catalog;
    this.clock = clock;
  }

  /**
   * Normalizes a response.
   *
   * @param response Raw BLS response
   * @param metroAreaName Configured metro name, e.g. "Seattle-Tacoma-Bellevue, WA"
   * @param window Inclusive window on the first day of each month
   * @return Records sorted by (year, month)
   * @throws ConfigurationException if the metro is not configured
   * @throws UpstreamFailureException if the response status is not success
   * @throws EmptyResultException if no record falls in the window
   */
  public List<CanonicalEmploymentRecord> normalize(BlsResponse response, String metroAreaName,
      DateWindow window) {
    MetroArea metro = catalog.findMetro(metroAreaName).orElseThrow(() ->
        new ConfigurationException("Metro area '" + metroAreaName + "' not found. Available: "
            + catalog.getMetroNames()));
    if (!response.isSucceeded()) {
      throw new UpstreamFailureException("BLS API request failed (status " + response.status
          + "): " + response.joinedMessage());
    }

    TreeMap<YearMonth, EnumMap<LausMeasure, Double>> pivot = new TreeMap<>();
    int skipped = 0;
    for (BlsResponse.Series series : response.series()) {
      LausSeriesId id;
      try {
        id = LausSeriesId.parse(series.seriesId);
      } catch (MalformedRecordException e) {
        LOGGER.warn("Skipping series: {}", e.getMessage());
        skipped++;
        continue;
      }
      if (!id.getMetroCode().equals(metro.getCode())) {
        continue;
      }
      LausMeasure measure = LausMeasure.fromCode(id.getMeasureCode()).orElse(null);
      if (measure == null) {
        LOGGER.warn("Skipping series {}: unknown measure code {}", series.seriesId,
            id.getMeasureCode());
        skipped++;
        continue;
      }
      if (series.data == null) {
        continue;
      }
      for (BlsResponse.DataPoint point : series.data) {
        try {
          YearMonth month = parseMonth(point);
          if (month == null) {
            // annual average (M13) or non-monthly period
            continue;
          }
          double value = parseValue(point.value);
          pivot.computeIfAbsent(month, k -> new EnumMap<>(LausMeasure.class))
              .put(measure, value);
        } catch (MalformedRecordException e) {
          LOGGER.warn("Skipping data point of {}: {}", series.seriesId, e.getMessage());
          skipped++;
        }
      }
    }

    LocalDateTime lastUpdated = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    List<CanonicalEmploymentRecord> records = new ArrayList<>();
    for (Map.Entry<YearMonth, EnumMap<LausMeasure, Double>> entry : pivot.entrySet()) {
      if (!window.contains(entry.getKey().atDay(1))) {
        continue;
      }
      records.add(new CanonicalEmploymentRecord(metro.getCode(), metro.getName(),
          entry.getKey(), entry.getValue(), lastUpdated));
    }
    if (records.isEmpty()) {
      throw new EmptyResultException("No employment data found for metro_area="
          + metroAreaName + ", window " + window);
    }
    LOGGER.info("Normalized {} months for {} in window {} ({} malformed records skipped)",
        records.size(), metroAreaName, window, skipped);
    return records;
  }

  /**
   * Returns the records as a canonical table.
   */
  public static CanonicalTable toTable(List<CanonicalEmploymentRecord> records) {
    List<Map<String, Object>> rows = new ArrayList<>(records.size());
    for (CanonicalEmploymentRecord record : records) {
      rows.add(record.toRow());
    }
    return CanonicalTable.of(PipelineConfig.EMPLOYMENT_DATASET, EmploymentColumns.SCHEMA, rows);
  }

  /**
   * Parses the month of a data point; null for non-monthly periods.
   */
  static @Nullable YearMonth parseMonth(BlsResponse.DataPoint point)
      throws MalformedRecordException {
    String period = point.period;
    if (period == null || !period.startsWith("M") || "M13".equals(period)) {
      return null;
    }
    int year;
    int month;
    try {
      year = Integer.parseInt(point.year == null ? "" : point.year.trim());
      month = Integer.parseInt(period.substring(1));
    } catch (NumberFormatException e) {
      throw new MalformedRecordException("Invalid year/period '" + point.year + "/"
          + period + "'", e);
    }
    if (month < 1 || month > 12) {
      throw new MalformedRecordException("Invalid month in period '" + period + "'");
    }
    return YearMonth.of(year, month);
  }

  /**
   * Parses a value, stripping thousands separators.
   */
  static double parseValue(String value) throws MalformedRecordException {
    if (value == null) {
      throw new MalformedRecordException("Missing value");
    }
    double parsed;
    try {
      parsed = Double.parseDouble(value.replace(",", "").trim());
    } catch (NumberFormatException e) {
      throw new MalformedRecordException("Invalid value '" + value + "'", e);
    }
    if (!Double.isFinite(parsed)) {
      throw new MalformedRecordException("Invalid value '" + value + "'");
    }
    return parsed;
  }
}
