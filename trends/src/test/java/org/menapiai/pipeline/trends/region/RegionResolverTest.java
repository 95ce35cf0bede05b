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
package org.menapiai.pipeline.trends.region;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RegionResolver} and {@link RegionCatalog}.
 */
@Tag("unit")
public class RegionResolverTest {
  private final RegionCatalog catalog = RegionCatalog.getInstance();
  private final RegionResolver resolver = new RegionResolver(catalog);

  @Test void testKnownCityResolvesToMetroCode() {
    assertEquals(Optional.of("4138900"), resolver.resolve("Portland", "Oregon"));
    assertEquals(Optional.of("5342660"), resolver.resolve("Seattle", "Washington"));
  }

  @Test void testLookupIsExact() {
    assertFalse(resolver.resolve("portland", "Oregon").isPresent());
    assertFalse(resolver.resolve("Portland", "OR").isPresent());
    assertFalse(resolver.resolve("Portland", "Maine").isPresent());
  }

  @Test void testFallbackId() {
    assertEquals("4138900", resolver.resolveOrFallback("Portland", "Oregon"));
    assertEquals("Portland_Maine", resolver.resolveOrFallback("Portland", "Maine"));
    assertEquals("Bend_Oregon", RegionResolver.fallbackId("Bend", "Oregon"));
  }

  @Test void testStateAbbreviations() {
    assertEquals("Oregon", catalog.canonicalStateName("OR"));
    assertEquals("District of Columbia", catalog.canonicalStateName("DC"));
    assertEquals("Oregon", catalog.canonicalStateName("Oregon"));
    assertEquals("ZZ", catalog.canonicalStateName("ZZ"));
  }

  @Test void testMetros() {
    assertEquals(5, catalog.getMetros().size());
    MetroArea portland = catalog.findMetro("Portland-Vancouver-Hillsboro, OR-WA").get();
    assertEquals("4138900", portland.getCode());
    assertTrue(catalog.getMetroNames().contains("Seattle-Tacoma-Bellevue, WA"));
    assertFalse(catalog.findMetro("Springfield, IL").isPresent());
  }
}
