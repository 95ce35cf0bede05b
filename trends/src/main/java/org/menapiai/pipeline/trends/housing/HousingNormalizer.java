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
package org.menapiai.pipeline.trends.housing;

import org.menapiai.pipeline.etl.CanonicalTable;
import org.menapiai.pipeline.trends.DateWindow;
import org.menapiai.pipeline.trends.EmptyResultException;
import org.menapiai.pipeline.trends.MalformedRecordException;
import org.menapiai.pipeline.trends.PipelineConfig;
import org.menapiai.pipeline.trends.region.RegionCatalog;
import org.menapiai.pipeline.trends.region.RegionResolver;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Maps raw Redfin rows of one city to canonical housing records, grouped by
 * property type.
 *
 * <ol>
 *   <li>A 2-letter state is expanded to its full name</li>
 *   <li>Rows are kept on an exact (city, state) match</li>
 *   <li>Rows are kept when their period intersects the window</li>
 *   <li>Rows are grouped by property type; unknown types pass through</li>
 *   <li>Each group is sorted by period begin</li>
 * </ol>
 *
 * <p>Rows with unparsable dates or numbers are skipped with a warning. Two
 * rows for the same property type and period keep the later one.
 */
public class HousingNormalizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(HousingNormalizer.class);

  private static final ImmutableSet<String> MISSING_VALUES =
      ImmutableSet.of("", "NA", "N/A", "NAN", "NULL", "NONE");

  private final RegionCatalog catalog;
  private final RegionResolver resolver;
  private final Clock clock;

  public HousingNormalizer(RegionCatalog catalog, Clock clock) {
    this.catalog = catalog;
    this.resolver = new RegionResolver(catalog);
    this.clock = clock;
  }

  /**
   * Normalizes every property type.
   *
   * @see #normalize(Iterable, String, String, DateWindow, Collection)
   */
  public SortedMap<PropertyType, List<CanonicalHousingRecord>> normalize(
      Iterable<RawHousingRow> rows, String city, String state, DateWindow window) {
    return normalize(rows, city, state, window, ImmutableList.of());
  }

  /**
   * Normalizes the rows of one city.
   *
   * @param rows Raw rows, read once
   * @param city City name, matched exactly
   * @param state Full state name or 2-letter abbreviation
   * @param window Inclusive date window
   * @param propertyTypes Property types to keep; empty keeps all
   * @return Records per property type, each list sorted by period begin
   * @throws EmptyResultException if no row matches
   */
  public SortedMap<PropertyType, List<CanonicalHousingRecord>> normalize(
      Iterable<RawHousingRow> rows, String city, String state, DateWindow window,
      Collection<PropertyType> propertyTypes) {
    String stateFull = catalog.canonicalStateName(state);
    String regionId = resolver.resolveOrFallback(city, stateFull);
    if (!resolver.resolve(city, stateFull).isPresent()) {
      LOGGER.info("No metro code for ({}, {}), using region_id {}", city, stateFull, regionId);
    }
    LocalDateTime lastUpdated = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);

    Map<PropertyType, Map<Period, CanonicalHousingRecord>> byType = new TreeMap<>();
    int matched = 0;
    int skipped = 0;
    for (RawHousingRow row : rows) {
      if (!city.equals(row.getCity()) || !stateFull.equals(row.getState())) {
        continue;
      }
      PropertyType propertyType = PropertyType.of(row.getPropertyType());
      if (!propertyTypes.isEmpty() && !propertyTypes.contains(propertyType)) {
        continue;
      }
      CanonicalHousingRecord record;
      try {
        LocalDate periodBegin = parseDate("PERIOD_BEGIN", row.getPeriodBegin());
        LocalDate periodEnd = isMissing(row.getPeriodEnd())
            ? null : parseDate("PERIOD_END", row.getPeriodEnd());
        if (!window.overlaps(periodBegin, periodEnd)) {
          continue;
        }
        record = CanonicalHousingRecord.builder()
            .regionId(regionId)
            .periodBegin(periodBegin)
            .periodEnd(periodEnd)
            .propertyType(propertyType)
            .medianSalePrice(parseDouble("MEDIAN_SALE_PRICE", row.getMedianSalePrice()))
            .homesSold(parseCount("HOMES_SOLD", row.getHomesSold()))
            .inventory(parseCount("INVENTORY", row.getInventory()))
            .medianDaysOnMarket(parseDouble("MEDIAN_DOM", row.getMedianDom()))
            .lastUpdated(lastUpdated)
            .build();
      } catch (MalformedRecordException e) {
        LOGGER.warn("Skipping Redfin row at line {}: {}", row.getLineNumber(), e.getMessage());
        skipped++;
        continue;
      }
      matched++;
      CanonicalHousingRecord previous = byType
          .computeIfAbsent(propertyType, k -> new LinkedHashMap<>())
          .put(new Period(record.getPeriodBegin(), record.getPeriodEnd()), record);
      if (previous != null) {
        LOGGER.warn("Duplicate Redfin row for {} {} {}..{}, keeping line {}", regionId,
            propertyType, record.getPeriodBegin(), record.getPeriodEnd(), row.getLineNumber());
      }
    }

    if (byType.isEmpty()) {
      throw new EmptyResultException("No housing rows for city=" + city + ", state=" + stateFull
          + (propertyTypes.isEmpty() ? "" : ", property types " + propertyTypes)
          + ", window " + window);
    }

    SortedMap<PropertyType, List<CanonicalHousingRecord>> result = new TreeMap<>();
    for (Map.Entry<PropertyType, Map<Period, CanonicalHousingRecord>> entry
        : byType.entrySet()) {
      List<CanonicalHousingRecord> records = new ArrayList<>(entry.getValue().values());
      records.sort(Comparator.comparing(CanonicalHousingRecord::getPeriodBegin)
          .thenComparing(CanonicalHousingRecord::getPeriodEnd,
              Comparator.nullsFirst(Comparator.naturalOrder())));
      result.put(entry.getKey(), Collections.unmodifiableList(records));
    }
    LOGGER.info("Normalized {} Redfin rows for {}, {} into {} property types"
        + " ({} malformed rows skipped)", matched, city, stateFull, result.size(), skipped);
    return Collections.unmodifiableSortedMap(result);
  }

  /**
   * Flattens normalized records into one canonical table.
   */
  public static CanonicalTable toTable(
      Map<PropertyType, List<CanonicalHousingRecord>> recordsByType) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (List<CanonicalHousingRecord> records : recordsByType.values()) {
      for (CanonicalHousingRecord record : records) {
        rows.add(record.toRow());
      }
    }
    return CanonicalTable.of(PipelineConfig.HOUSING_DATASET, HousingColumns.SCHEMA, rows);
  }

  private static boolean isMissing(@Nullable String value) {
    return value == null || MISSING_VALUES.contains(value.trim().toUpperCase(Locale.ROOT));
  }

  /** Parses an ISO date, allowing a trailing time part. */
  static LocalDate parseDate(String column, String value) throws MalformedRecordException {
    if (isMissing(value)) {
      throw new MalformedRecordException(column + " is empty");
    }
    String trimmed = value.trim();
    try {
      return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
    } catch (DateTimeParseException e) {
      throw new MalformedRecordException("Invalid " + column + " '" + value + "'", e);
    }
  }

  static @Nullable Double parseDouble(String column, String value)
      throws MalformedRecordException {
    if (isMissing(value)) {
      return null;
    }
    try {
      double parsed = Double.parseDouble(value.replace(",", "").trim());
      if (!Double.isFinite(parsed)) {
        throw new MalformedRecordException("Invalid " + column + " '" + value + "'");
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new MalformedRecordException("Invalid " + column + " '" + value + "'", e);
    }
  }

  /** Parses a whole count; Redfin writes counts such as "12.0". */
  static @Nullable Integer parseCount(String column, String value)
      throws MalformedRecordException {
    if (isMissing(value)) {
      return null;
    }
    try {
      BigDecimal parsed = new BigDecimal(value.replace(",", "").trim());
      return parsed.stripTrailingZeros().intValueExact();
    } catch (NumberFormatException | ArithmeticException e) {
      throw new MalformedRecordException("Invalid " + column + " '" + value + "'", e);
    }
  }

  /** Reporting period of a row; period end may be absent. */
  private static final class Period {
    private final LocalDate begin;
    private final @Nullable LocalDate end;

    Period(LocalDate begin, @Nullable LocalDate end) {
      this.begin = begin;
      this.end = end;
    }

    @Override public boolean equals(@Nullable Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Period)) {
        return false;
      }
      Period that = (Period) o;
      return begin.equals(that.begin) && Objects.equals(end, that.end);
    }

    @Override public int hashCode() {
      return Objects.hash(begin, end);
    }
  }
}
