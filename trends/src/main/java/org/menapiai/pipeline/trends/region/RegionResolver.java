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

import java.util.Optional;

/**
 * Maps (city, full state name) pairs to the metro code shared by the housing
 * and employment datasets.
 *
 * <p>Matching is exact and case-sensitive; no normalization is applied.
 */
public class RegionResolver {
  private final RegionCatalog catalog;

  public RegionResolver(RegionCatalog catalog) {
    this.catalog = catalog;
  }

  /**
   * Looks up the metro code of a city.
   *
   * @param city City name, e.g. "Portland"
   * @param stateFull Full state name, e.g. "Oregon"
   * @return Metro code, or empty when the pair is not in the catalog
   */
  public Optional<String> resolve(String city, String stateFull) {
    return Optional.ofNullable(catalog.metroCodeFor(city, stateFull));
  }

  /**
   * Returns the metro code, or the synthetic {@code "<city>_<state>"} key for
   * unknown pairs, so a region id is always available.
   */
  public String resolveOrFallback(String city, String stateFull) {
    return resolve(city, stateFull).orElseGet(() -> fallbackId(city, stateFull));
  }

  public static String fallbackId(String city, String stateFull) {
    return city + "_" + stateFull;
  }
}
