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
package org.menapiai.pipeline.trends;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Inclusive date interval used to filter raw periods. Either bound may be
 * open.
 */
public final class DateWindow {
  private static final DateWindow UNBOUNDED = new DateWindow(null, null);

  private final @Nullable LocalDate start;
  private final @Nullable LocalDate end;

  private DateWindow(@Nullable LocalDate start, @Nullable LocalDate end) {
    this.start = start;
    this.end = end;
  }

  /**
   * Creates a window.
   *
   * @throws ConfigurationException if start is after end
   */
  public static DateWindow of(@Nullable LocalDate start, @Nullable LocalDate end) {
    if (start != null && end != null && start.isAfter(end)) {
      throw new ConfigurationException("Window start " + start + " is after end " + end);
    }
    if (start == null && end == null) {
      return UNBOUNDED;
    }
    return new DateWindow(start, end);
  }

  /**
   * Parses a window from ISO-8601 dates; null or blank strings leave the side open.
   *
   * @throws ConfigurationException if a date is not ISO-8601 or start is after end
   */
  public static DateWindow parse(@Nullable String start, @Nullable String end) {
    return of(parseDate("start", start), parseDate("end", end));
  }

  public static DateWindow unbounded() {
    return UNBOUNDED;
  }

  private static @Nullable LocalDate parseDate(String side, @Nullable String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new ConfigurationException("Invalid window " + side + " date '" + value
          + "', expected YYYY-MM-DD", e);
    }
  }

  public @Nullable LocalDate getStart() {
    return start;
  }

  public @Nullable LocalDate getEnd() {
    return end;
  }

  /** Whether {@code date} falls inside the window, bounds included. */
  public boolean contains(LocalDate date) {
    return (start == null || !date.isBefore(start))
        && (end == null || !date.isAfter(end));
  }

  /**
   * Whether the period [begin, end] intersects the window. Without a period
   * end only {@code begin} is tested.
   */
  public boolean overlaps(LocalDate begin, @Nullable LocalDate periodEnd) {
    if (periodEnd == null) {
      return contains(begin);
    }
    return (end == null || !begin.isAfter(end))
        && (start == null || !periodEnd.isBefore(start));
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DateWindow)) {
      return false;
    }
    DateWindow that = (DateWindow) o;
    return Objects.equals(start, that.start) && Objects.equals(end, that.end);
  }

  @Override public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override public String toString() {
    return "[" + (start == null ? "-inf" : start) + ", " + (end == null ? "+inf" : end) + "]";
  }
}
