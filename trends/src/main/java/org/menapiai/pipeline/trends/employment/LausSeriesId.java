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

import org.menapiai.pipeline.trends.MalformedRecordException;

import java.util.Objects;

/**
 * Decomposed metro-area LAUS series identifier.
 *
 * <p>Format: {@code LAUMT} + 7-digit metro code + {@code 000000} + 2-digit
 * measure code, e.g. {@code LAUMT413890000000003} is the unemployment rate
 * of metro 4138900.
 */
public final class LausSeriesId {
  public static final String PREFIX = "LAUMT";
  private static final String FILLER = "000000";
  private static final int LENGTH = PREFIX.length() + 7 + FILLER.length() + 2;

  private final String metroCode;
  private final String measureCode;

  private LausSeriesId(String metroCode, String measureCode) {
    this.metroCode = metroCode;
    this.measureCode = measureCode;
  }

  /**
   * Builds the series ID of a measure for a metro.
   *
   * @param metroCode 7-digit metro code
   */
  public static LausSeriesId of(String metroCode, LausMeasure measure) {
    if (metroCode.length() != 7 || !isDigits(metroCode)) {
      throw new IllegalArgumentException("Metro code must be 7 digits: " + metroCode);
    }
    return new LausSeriesId(metroCode, measure.getCode());
  }

  /**
   * Parses a series identifier.
   *
   * @throws MalformedRecordException if the prefix, length or digit groups do not match
   */
  public static LausSeriesId parse(String seriesId) throws MalformedRecordException {
    if (seriesId == null || !seriesId.startsWith(PREFIX)) {
      throw new MalformedRecordException("Series ID does not start with " + PREFIX
          + ": " + seriesId);
    }
    if (seriesId.length() != LENGTH) {
      throw new MalformedRecordException("Series ID must have " + LENGTH
          + " characters: " + seriesId);
    }
    String digits = seriesId.substring(PREFIX.length());
    if (!isDigits(digits)) {
      throw new MalformedRecordException("Series ID has non-digit code part: " + seriesId);
    }
    return new LausSeriesId(digits.substring(0, 7), digits.substring(digits.length() - 2));
  }

  private static boolean isDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return !s.isEmpty();
  }

  public String getMetroCode() {
    return metroCode;
  }

  public String getMeasureCode() {
    return measureCode;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LausSeriesId)) {
      return false;
    }
    LausSeriesId that = (LausSeriesId) o;
    return metroCode.equals(that.metroCode) && measureCode.equals(that.measureCode);
  }

  @Override public int hashCode() {
    return Objects.hash(metroCode, measureCode);
  }

  @Override public String toString() {
    return PREFIX + metroCode + FILLER + measureCode;
  }
}
