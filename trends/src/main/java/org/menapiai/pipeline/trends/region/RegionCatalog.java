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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed geographic reference tables: the configured BLS metro areas, the
 * (city, state) to metro code mapping and the state postal abbreviations.
 *
 * <p>Loaded from the {@code /regions.json} classpath resource. Extend that
 * file to support more cities or metros.
 */
public final class RegionCatalog {
  public static final String RESOURCE = "/regions.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static volatile RegionCatalog instance;

  private final ImmutableMap<String, MetroArea> metrosByName;
  private final ImmutableMap<CityKey, String> cityToMetro;
  private final ImmutableMap<String, String> stateAbbreviations;

  RegionCatalog(List<MetroArea> metros, Map<CityKey, String> cityToMetro,
      Map<String, String> stateAbbreviations) {
    ImmutableMap.Builder<String, MetroArea> builder = ImmutableMap.builder();
    for (MetroArea metro : metros) {
      builder.put(metro.getName(), metro);
    }
    this.metrosByName = builder.build();
    this.cityToMetro = ImmutableMap.copyOf(cityToMetro);
    this.stateAbbreviations = ImmutableMap.copyOf(stateAbbreviations);
  }

  /**
   * Returns the catalog loaded from the classpath resource.
   */
  public static RegionCatalog getInstance() {
    if (instance == null) {
      synchronized (RegionCatalog.class) {
        if (instance == null) {
          instance = loadFromResource();
        }
      }
    }
    return instance;
  }

  private static RegionCatalog loadFromResource() {
    try (InputStream is = RegionCatalog.class.getResourceAsStream(RESOURCE)) {
      if (is == null) {
        throw new IOException("Region catalog resource not found: " + RESOURCE);
      }
      return fromFile(MAPPER.readValue(is, CatalogFile.class));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load region catalog from " + RESOURCE, e);
    }
  }

  static RegionCatalog fromFile(CatalogFile file) {
    ImmutableList.Builder<MetroArea> metros = ImmutableList.builder();
    if (file.metros != null) {
      for (MetroEntry entry : file.metros) {
        metros.add(new MetroArea(entry.name, entry.stateFips, entry.areaCode));
      }
    }
    ImmutableMap.Builder<CityKey, String> cities = ImmutableMap.builder();
    if (file.cities != null) {
      for (CityEntry entry : file.cities) {
        cities.put(new CityKey(entry.city, entry.state), entry.metroCode);
      }
    }
    return new RegionCatalog(metros.build(), cities.build(),
        file.stateAbbreviations == null ? ImmutableMap.of() : file.stateAbbreviations);
  }

  /** Configured metros in catalog order. */
  public ImmutableList<MetroArea> getMetros() {
    return metrosByName.values().asList();
  }

  public ImmutableList<String> getMetroNames() {
    return metrosByName.keySet().asList();
  }

  public Optional<MetroArea> findMetro(String name) {
    return Optional.ofNullable(metrosByName.get(name));
  }

  /** Exact, case-sensitive lookup of the metro code for a city. */
  @Nullable String metroCodeFor(String city, String stateFull) {
    return cityToMetro.get(new CityKey(city, stateFull));
  }

  /**
   * Expands a 2-letter postal abbreviation to the full state name. Any other
   * input is returned unchanged.
   */
  public String canonicalStateName(String state) {
    String trimmed = state.trim();
    if (trimmed.length() == 2) {
      String full = stateAbbreviations.get(trimmed.toUpperCase(Locale.ROOT));
      if (full != null) {
        return full;
      }
    }
    return state;
  }

  /** (city, full state name) pair. */
  static final class CityKey {
    final String city;
    final String state;

    CityKey(String city, String state) {
      this.city = city;
      this.state = state;
    }

    @Override public boolean equals(Object o) {
      if (!(o instanceof CityKey)) {
        return false;
      }
      CityKey that = (CityKey) o;
      return city.equals(that.city) && state.equals(that.state);
    }

    @Override public int hashCode() {
      return city.hashCode() * 31 + state.hashCode();
    }
  }

  /** JSON layout of {@code regions.json}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  static class CatalogFile {
    public List<MetroEntry> metros;
    public List<CityEntry> cities;
    public Map<String, String> stateAbbreviations;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class MetroEntry {
    public String name;
    public String stateFips;
    public String areaCode;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static class CityEntry {
    public String city;
    public String state;
    public String metroCode;
  }
}
