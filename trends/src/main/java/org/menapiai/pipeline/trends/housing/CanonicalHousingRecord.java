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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One region, property type and period of the canonical housing dataset.
 * Market measures may be null when Redfin has no value for the period.
 */
public final class CanonicalHousingRecord {
  private final String regionId;
  private final LocalDate periodBegin;
  private final @Nullable LocalDate periodEnd;
  private final PropertyType propertyType;
  private final @Nullable Double medianSalePrice;
  private final @Nullable Integer homesSold;
  private final @Nullable Integer inventory;
  private final @Nullable Double medianDaysOnMarket;
  private final LocalDateTime lastUpdated;

  private CanonicalHousingRecord(Builder builder) {
    this.regionId = Objects.requireNonNull(builder.regionId, "regionId");
    this.periodBegin = Objects.requireNonNull(builder.periodBegin, "periodBegin");
    this.periodEnd = builder.periodEnd;
    this.propertyType = Objects.requireNonNull(builder.propertyType, "propertyType");
    this.medianSalePrice = builder.medianSalePrice;
    this.homesSold = builder.homesSold;
    this.inventory = builder.inventory;
    this.medianDaysOnMarket = builder.medianDaysOnMarket;
    this.lastUpdated = Objects.requireNonNull(builder.lastUpdated, "lastUpdated");
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getRegionId() {
    return regionId;
  }

  public LocalDate getPeriodBegin() {
    return periodBegin;
  }

  public @Nullable LocalDate getPeriodEnd() {
    return periodEnd;
  }

  public PropertyType getPropertyType() {
    return propertyType;
  }

  public @Nullable Double getMedianSalePrice() {
    return medianSalePrice;
  }

  public @Nullable Integer getHomesSold() {
    return homesSold;
  }

  public @Nullable Integer getInventory() {
    return inventory;
  }

  public @Nullable Double getMedianDaysOnMarket() {
    return medianDaysOnMarket;
  }

  /** First day of the month of {@link #getPeriodBegin()}. */
  public LocalDate getPeriodMonth() {
    return periodBegin.withDayOfMonth(1);
  }

  public LocalDateTime getLastUpdated() {
    return lastUpdated;
  }

  /**
   * Returns the record as a row keyed by canonical column.
   */
  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(HousingColumns.REGION_ID, regionId);
    row.put(HousingColumns.PERIOD_BEGIN, periodBegin);
    row.put(HousingColumns.PERIOD_END, periodEnd);
    row.put(HousingColumns.MEDIAN_SALE_PRICE, medianSalePrice);
    row.put(HousingColumns.HOMES_SOLD, homesSold);
    row.put(HousingColumns.INVENTORY, inventory);
    row.put(HousingColumns.MEDIAN_DAYS_ON_MARKET, medianDaysOnMarket);
    row.put(HousingColumns.PROPERTY_TYPE, propertyType.getLabel());
    row.put(HousingColumns.PERIOD_MONTH, getPeriodMonth());
    row.put(HousingColumns.LAST_UPDATED, lastUpdated);
    return row;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalHousingRecord)) {
      return false;
    }
    CanonicalHousingRecord that = (CanonicalHousingRecord) o;
    return regionId.equals(that.regionId)
        && periodBegin.equals(that.periodBegin)
        && Objects.equals(periodEnd, that.periodEnd)
        && propertyType.equals(that.propertyType)
        && Objects.equals(medianSalePrice, that.medianSalePrice)
        && Objects.equals(homesSold, that.homesSold)
        && Objects.equals(inventory, that.inventory)
        && Objects.equals(medianDaysOnMarket, that.medianDaysOnMarket)
        && lastUpdated.equals(that.lastUpdated);
  }

  @Override public int hashCode() {
    return Objects.hash(regionId, periodBegin, periodEnd, propertyType, medianSalePrice,
        homesSold, inventory, medianDaysOnMarket, lastUpdated);
  }

  @Override public String toString() {
    return "CanonicalHousingRecord{" + regionId + ", " + propertyType + ", " + periodBegin
        + ", price=" + medianSalePrice + "}";
  }

  /**
   * Builder for CanonicalHousingRecord.
   */
  public static class Builder {
    private String regionId;
    private LocalDate periodBegin;
    private LocalDate periodEnd;
    private PropertyType propertyType;
    private Double medianSalePrice;
    private Integer homesSold;
    private Integer inventory;
    private Double medianDaysOnMarket;
    private LocalDateTime lastUpdated;

    public Builder regionId(String regionId) {
      this.regionId = regionId;
      return this;
    }

    public Builder periodBegin(LocalDate periodBegin) {
      this.periodBegin = periodBegin;
      return this;
    }

    public Builder periodEnd(@Nullable LocalDate periodEnd) {
      this.periodEnd = periodEnd;
      return this;
    }

    public Builder propertyType(PropertyType propertyType) {
      this.propertyType = propertyType;
      return this;
    }

    public Builder medianSalePrice(@Nullable Double medianSalePrice) {
      this.medianSalePrice = medianSalePrice;
      return this;
    }

    public Builder homesSold(@Nullable Integer homesSold) {
      this.homesSold = homesSold;
      return this;
    }

    public Builder inventory(@Nullable Integer inventory) {
      this.inventory = inventory;
      return this;
    }

    public Builder medianDaysOnMarket(@Nullable Double medianDaysOnMarket) {
      this.medianDaysOnMarket = medianDaysOnMarket;
      return this;
    }

    public Builder lastUpdated(LocalDateTime lastUpdated) {
      this.lastUpdated = lastUpdated;
      return this;
    }

    public CanonicalHousingRecord build() {
      return new CanonicalHousingRecord(this);
    }
  }
}
