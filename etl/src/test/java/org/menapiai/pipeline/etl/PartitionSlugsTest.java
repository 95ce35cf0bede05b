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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link PartitionSlugs}.
 */
@Tag("unit")
public class PartitionSlugsTest {

  @Test void testPropertyTypeLabels() {
    assertEquals("condo_co_op", PartitionSlugs.slugify("Condo/Co-op"));
    assertEquals("single_family_residential",
        PartitionSlugs.slugify("Single Family Residential"));
    assertEquals("multi_family_2_4_unit", PartitionSlugs.slugify("Multi-Family (2-4 Unit)"));
    assertEquals("all_residential", PartitionSlugs.slugify("All Residential"));
  }

  @Test void testMetroName() {
    assertEquals("portland_vancouver_hillsboro_or_wa",
        PartitionSlugs.slugify("Portland-Vancouver-Hillsboro, OR-WA"));
  }

  @Test void testLeadingAndTrailingSeparatorsTrimmed() {
    assertEquals("townhouse", PartitionSlugs.slugify("  --Townhouse!! "));
  }

  @Test void testAlreadySlugged() {
    assertEquals("condo_co_op", PartitionSlugs.slugify("condo_co_op"));
  }

  @Test void testNoAlphanumericCharacters() {
    assertEquals(PartitionSlugs.UNKNOWN, PartitionSlugs.slugify("/ - ()"));
    assertEquals(PartitionSlugs.UNKNOWN, PartitionSlugs.slugify(""));
    assertEquals(PartitionSlugs.UNKNOWN, PartitionSlugs.slugify(null));
  }
}
