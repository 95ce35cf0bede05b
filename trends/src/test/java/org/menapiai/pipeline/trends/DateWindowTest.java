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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DateWindow}.
 */
@Tag("unit")
public class DateWindowTest {
  private static final LocalDate JUNE_1 = LocalDate.of(2020, 6, 1);
  private static final LocalDate JUNE_30 = LocalDate.of(2020, 6, 30);

  @Test void testBoundsAreInclusive() {
    DateWindow window = DateWindow.of(JUNE_1, JUNE_30);

    assertTrue(window.contains(JUNE_1));
    assertTrue(window.contains(JUNE_30));
    assertFalse(window.contains(JUNE_30.plusDays(1)));
    assertFalse(window.contains(JUNE_1.minusDays(1)));
  }

  @Test void testOverlapUsesPeriodEnd() {
    DateWindow window = DateWindow.of(LocalDate.of(2020, 6, 15), LocalDate.of(2020, 7, 15));

    assertTrue(window.overlaps(JUNE_1, JUNE_30));
    assertFalse(window.overlaps(JUNE_1, null));
    assertFalse(window.overlaps(LocalDate.of(2020, 5, 1), LocalDate.of(2020, 5, 31)));
    assertTrue(window.overlaps(LocalDate.of(2020, 7, 15), LocalDate.of(2020, 7, 31)));
  }

  @Test void testOpenSides() {
    assertTrue(DateWindow.unbounded().contains(LocalDate.of(1900, 1, 1)));
    assertTrue(DateWindow.of(null, JUNE_30).contains(LocalDate.of(1900, 1, 1)));
    assertFalse(DateWindow.of(JUNE_30, null).contains(JUNE_1));
  }

  @Test void testParse() {
    DateWindow window = DateWindow.parse("2020-06-01", "");
    assertEquals(JUNE_1, window.getStart());
    assertNull(window.getEnd());
    assertEquals(DateWindow.unbounded(), DateWindow.parse(null, " "));
    assertEquals("[2020-06-01, +inf]", window.toString());
  }

  @Test void testInvalidWindows() {
    assertThrows(ConfigurationException.class, () -> DateWindow.of(JUNE_30, JUNE_1));
    assertThrows(ConfigurationException.class, () -> DateWindow.parse("2020/06/01", null));
  }
}
