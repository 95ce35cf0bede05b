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
package org.menapiai.pipeline.trends.cache;

import org.menapiai.pipeline.trends.PipelineConfig;
import org.menapiai.pipeline.trends.UpstreamFailureException;
import org.menapiai.pipeline.trends.employment.BlsResponse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Downloads LAUS time series from the BLS public data API v2.
 *
 * <p>The API caps a single request at 50 series and at 20 years (10 years
 * without a registration key), so the requested range is split into
 * contiguous year windows and the series list into batches. All responses
 * are merged into one JSON document of the same shape as a single API
 * response, with the data points of each series concatenated.
 */
public class BlsApiFetcher extends AbstractHttpFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(BlsApiFetcher.class);

  static final int MAX_SERIES_PER_REQUEST = 50;
  static final int MAX_YEARS_WITH_KEY = 20;
  static final int MAX_YEARS_WITHOUT_KEY = 10;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final URI apiUrl;
  private final @Nullable String apiKey;
  private final int startYear;
  private final Clock clock;
  private final ImmutableList<String> seriesIds;

  public BlsApiFetcher(PipelineConfig config, List<String> seriesIds) {
    super(config);
    if (seriesIds.isEmpty()) {
      throw new IllegalArgumentException("At least one series id is required");
    }
    this.apiUrl = config.getBlsApiUrl();
    this.apiKey = config.getBlsApiKey();
    this.startYear = config.getBlsStartYear();
    this.clock = config.getClock();
    this.seriesIds = ImmutableList.copyOf(seriesIds);
  }

  @Override public void fetch(Path target) throws IOException {
    int endYear = LocalDate.now(clock).getYear();
    boolean hasKey = apiKey != null && !apiKey.isEmpty();
    if (!hasKey) {
      LOGGER.warn("No BLS API key configured, requests are limited to {} years each",
          MAX_YEARS_WITHOUT_KEY);
    }
    List<int[]> yearRanges = yearRanges(startYear, endYear,
        hasKey ? MAX_YEARS_WITH_KEY : MAX_YEARS_WITHOUT_KEY);
    LOGGER.info("Fetching {} BLS series for {}-{} in {} year batches",
        seriesIds.size(), startYear, endYear, yearRanges.size());

    Map<String, ObjectNode> seriesById = new LinkedHashMap<>();
    Set<String> messages = new LinkedHashSet<>();
    for (int offset = 0; offset < seriesIds.size(); offset += MAX_SERIES_PER_REQUEST) {
      List<String> batch =
          seriesIds.subList(offset, Math.min(offset + MAX_SERIES_PER_REQUEST, seriesIds.size()));
      for (int[] range : yearRanges) {
        LOGGER.debug("Fetching series {}-{} for years {}-{}",
            offset + 1, offset + batch.size(), range[0], range[1]);
        JsonNode response = MAPPER.readTree(post(requestBody(batch, range[0], range[1])));
        String status = response.path("status").asText("UNKNOWN");
        List<String> responseMessages = new ArrayList<>();
        for (JsonNode message : response.path("message")) {
          responseMessages.add(message.asText());
        }
        if (!BlsResponse.STATUS_SUCCEEDED.equals(status)) {
          throw new UpstreamFailureException("BLS API returned " + status + " for years "
              + range[0] + "-" + range[1] + ": "
              + (responseMessages.isEmpty()
                  ? "Unknown error" : String.join("; ", responseMessages)));
        }
        messages.addAll(responseMessages);
        mergeSeries(seriesById, response.path("Results").path("series"));
      }
    }

    ObjectNode merged = MAPPER.createObjectNode();
    merged.put("status", BlsResponse.STATUS_SUCCEEDED);
    ArrayNode messageArray = merged.putArray("message");
    messages.forEach(messageArray::add);
    ArrayNode seriesArray = merged.putObject("Results").putArray("series");
    seriesById.values().forEach(seriesArray::add);
    MAPPER.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), merged);
    LOGGER.info("Saved {} BLS series to {}", seriesById.size(), target);
  }

  /**
   * Splits an inclusive year range into contiguous windows of at most
   * {@code maxYears} years.
   */
  static List<int[]> yearRanges(int startYear, int endYear, int maxYears) {
    List<int[]> ranges = new ArrayList<>();
    for (int from = startYear; from <= endYear; from += maxYears) {
      ranges.add(new int[] {from, Math.min(from + maxYears - 1, endYear)});
    }
    return ranges;
  }

  ObjectNode requestBody(List<String> batch, int fromYear, int toYear) {
    ObjectNode body = MAPPER.createObjectNode();
    ArrayNode ids = body.putArray("seriesid");
    batch.forEach(ids::add);
    body.put("startyear", String.valueOf(fromYear));
    body.put("endyear", String.valueOf(toYear));
    body.put("catalog", true);
    body.put("calculations", false);
    body.put("annualaverage", false);
    if (apiKey != null && !apiKey.isEmpty()) {
      body.put("registrationkey", apiKey);
    }
    return body;
  }

  private String post(ObjectNode body) throws IOException {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(apiUrl)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
        .timeout(requestTimeout)
        .build();
    return send(request, HttpResponse.BodyHandlers.ofString()).body();
  }

  private static void mergeSeries(Map<String, ObjectNode> seriesById, JsonNode seriesArray) {
    for (JsonNode series : seriesArray) {
      if (!series.isObject()) {
        continue;
      }
      String seriesId = series.path("seriesID").asText();
      ObjectNode existing = seriesById.get(seriesId);
      if (existing == null) {
        seriesById.put(seriesId, ((ObjectNode) series).deepCopy());
        continue;
      }
      ArrayNode data = existing.has("data") && existing.get("data").isArray()
          ? (ArrayNode) existing.get("data") : existing.putArray("data");
      for (JsonNode point : series.path("data")) {
        data.add(point);
      }
    }
  }
}
