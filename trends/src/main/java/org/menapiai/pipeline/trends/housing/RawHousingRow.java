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

/**
 * One unparsed row of the Redfin TSV. Values are the raw cell strings;
 * optional columns absent from the file are null.
 */
public final class RawHousingRow {
  private final long lineNumber;
  private final String city;
  private final String state;
  private final String periodBegin;
  private final @Nullable String periodEnd;
  private final String medianSalePrice;
  private final String homesSold;
  private final String inventory;
  private final String medianDom;
  private final @Nullable String propertyType;

  private RawHousingRow(Builder builder) {
    this.lineNumber = builder.lineNumber;
    this.city = nullToEmpty(builder.city);
    this.state = nullToEmpty(builder.state);
    this.periodBegin = nullToEmpty(builder.periodBegin);
    this.periodEnd = builder.periodEnd;
    this.medianSalePrice = nullToEmpty(builder.medianSalePrice);
    this.homesSold = nullToEmpty(builder.homesSold);
    this.inventory = nullToEmpty(builder.inventory);
    this.medianDom = nullToEmpty(builder.medianDom);
    this.propertyType = builder.propertyType;
  }

  private static String nullToEmpty(@Nullable String s) {
    return s == null ? "" : s;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** 1-based line in the source file, 0 when not read from a file. */
  public long getLineNumber() {
    return lineNumber;
  }

  public String getCity() {
    return city;
  }

  public String getState() {
    return state;
  }

  public String getPeriodBegin() {
    return periodBegin;
  }

  public @Nullable String getPeriodEnd() {
    return periodEnd;
  }

  public String getMedianSalePrice() {
    return medianSalePrice;
  }

  public String getHomesSold() {
    return homesSold;
  }

  public String getInventory() {
    return inventory;
  }

  public String getMedianDom() {
    return medianDom;
  }

  public @Nullable String getPropertyType() {
    return propertyType;
  }

  @Override public String toString() {
    return "RawHousingRow{line=" + lineNumber + ", " + city + ", " + state + ", "
        + periodBegin + ", " + propertyType + "}";
  }

  /**
   * Builder for RawHousingRow.
   */
  public static class Builder {
    private long lineNumber;
    private String city;
    private String state;
    private String periodBegin;
    private String periodEnd;
    private String medianSalePrice;
    private String homesSold;
    private String inventory;
    private String medianDom;
    private String propertyType;

    public Builder lineNumber(long lineNumber) {
      this.lineNumber = lineNumber;
      return this;
    }

    public Builder city(String city) {
      this.city = city;
      return this;
    }

    public Builder state(String state) {
      this.state = state;
      return this;
    }

    public Builder periodBegin(String periodBegin) {
      this.periodBegin = periodBegin;
      return this;
    }

    public Builder periodEnd(String periodEnd) {
      this.periodEnd = periodEnd;
      return this;
    }

    public Builder medianSalePrice(String medianSalePrice) {
      this.medianSalePrice = medianSalePrice;
      return this;
    }

    public Builder homesSold(String homesSold) {
      this.homesSold = homesSold;
      return this;
    }

    public Builder inventory(String inventory) {
      this.inventory = inventory;
      return this;
    }

    public Builder medianDom(String medianDom) {
      this.medianDom = medianDom;
      return this;
    }

    public Builder propertyType(String propertyType) {
      this.propertyType = propertyType;
      return this;
    }

    public RawHousingRow build() {
      return new RawHousingRow(this);
    }
  }
}
