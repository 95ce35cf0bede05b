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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ColumnType} value normalization and {@link CanonicalTable}
 * schema checks.
 */
@Tag("unit")
public class ColumnTypeTest {

  @Test void testNumbersNormalizedToDeclaredType() {
    assertEquals(12, ColumnType.INTEGER.normalize(12L));
    assertEquals(12, ColumnType.INTEGER.normalize(" 12 "));
    assertEquals(7L, ColumnType.BIGINT.normalize(7));
    assertEquals(4.5d, ColumnType.DOUBLE.normalize("4.5"));
    assertEquals(3.0d, ColumnType.DOUBLE.normalize(3));
  }

  @Test void testVarcharUsesToString() {
    assertEquals("42", ColumnType.VARCHAR.normalize(42));
    assertNull(ColumnType.VARCHAR.normalize(null));
  }

  @Test void testDatesRenderedAsIsoText() {
    assertEquals("2020-06-01", ColumnType.DATE.normalize(LocalDate.of(2020, 6, 1)));
    assertEquals("2020-06-01", ColumnType.DATE.normalize("2020-06-01"));
    assertEquals("2020-06-01",
        ColumnType.DATE.normalize(LocalDateTime.of(2020, 6, 1, 13, 5)));
  }

  @Test void testTimestampRenderedWithMicros() {
    assertEquals("2024-03-05 10:15:30.000000",
        ColumnType.TIMESTAMP.normalize(LocalDateTime.of(2024, 3, 5, 10, 15, 30)));
    assertEquals("2024-03-05 00:00:00.000000",
        ColumnType.TIMESTAMP.normalize(LocalDate.of(2024, 3, 5)));
  }

  @Test void testUnparsableNumberRejected() {
    assertThrows(NumberFormatException.class, () -> ColumnType.INTEGER.normalize("n/a"));
  }

  @Test void testTableRejectsUndeclaredColumn() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () ->
        CanonicalTable.of("t",
            ImmutableList.of(TableColumn.of("a", ColumnType.VARCHAR)),
            ImmutableList.of(ImmutableMap.of("a", "x", "b", "y"))));
    assertTrue(e.getMessage().contains("'b'"));
  }

  @Test void testTableRejectsDuplicateColumn() {
    assertThrows(IllegalArgumentException.class, () ->
        CanonicalTable.of("t",
            ImmutableList.of(TableColumn.of("a", ColumnType.VARCHAR),
                TableColumn.of("a", ColumnType.INTEGER)),
            ImmutableList.of()));
  }
}
