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
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link BlsApiFetcher} and {@link RedfinTsvFetcher} against a
 * local HTTP server.
 */
@Tag("integration")
public class BlsApiFetcherTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
  private static final List<String> SERIES = ImmutableList.of(
      "LAUMT413890000000003", "LAUMT413890000000006");

  @TempDir
  Path tempDir;

  private HttpServer server;
  private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
  private volatile String failStatus;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/bls", exchange -> {
      JsonNode request;
      try (InputStream in = exchange.getRequestBody()) {
        request = MAPPER.readTree(in);
      }
      requests.add(request);
      byte[] body = MAPPER.writeValueAsBytes(answer(request));
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.createContext("/redfin.tsv.gz", exchange -> {
      byte[] body = "CITY\tSTATE\n".getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.createContext("/missing", exchange -> {
      exchange.sendResponseHeaders(404, -1);
      exchange.close();
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  /** One January point per requested series and year. */
  private ObjectNode answer(JsonNode request) {
    ObjectNode response = MAPPER.createObjectNode();
    if (failStatus != null) {
      response.put("status", failStatus);
      response.putArray("message").add("Series does not exist");
      return response;
    }
    response.put("status", BlsResponse.STATUS_SUCCEEDED);
    response.putArray("message");
    ArrayNode series = response.putObject("Results").putArray("series");
    int start = Integer.parseInt(request.get("startyear").asText());
    int end = Integer.parseInt(request.get("endyear").asText());
    for (JsonNode id : request.get("seriesid")) {
      ObjectNode node = series.addObject();
      node.put("seriesID", id.asText());
      ArrayNode data = node.putArray("data");
      for (int year = end; year >= start; year--) {
        data.addObject()
            .put("year", String.valueOf(year))
            .put("period", "M01")
            .put("periodName", "January")
            .put("value", "1,000");
      }
    }
    return response;
  }

  private PipelineConfig config(String apiKey) {
    return PipelineConfig.builder()
        .dataDir(tempDir)
        .clock(CLOCK)
        .blsApiKey(apiKey)
        .blsApiUrl(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/bls"))
        .redfinUrl(URI.create("http://127.0.0.1:" + server.getAddress().getPort()
            + "/redfin.tsv.gz"))
        .build();
  }

  @Test void testYearRanges() {
    List<int[]> ranges = BlsApiFetcher.yearRanges(2000, 2024, 10);

    assertEquals(3, ranges.size());
    assertEquals(2009, ranges.get(0)[1]);
    assertEquals(2020, ranges.get(2)[0]);
    assertEquals(2024, ranges.get(2)[1]);
    assertEquals(1, BlsApiFetcher.yearRanges(2024, 2024, 20).size());
  }

  @Test void testWithoutKeyUsesTenYearWindows() throws IOException {
    Path target = tempDir.resolve("bls.json");

    new BlsApiFetcher(config(null), SERIES).fetch(target);

    assertEquals(3, requests.size());
    assertFalse(requests.get(0).has("registrationkey"));
    assertEquals("2000", requests.get(0).get("startyear").asText());
    assertEquals("2009", requests.get(0).get("endyear").asText());
    assertTrue(requests.get(0).get("catalog").asBoolean());
    assertFalse(requests.get(0).get("calculations").asBoolean());
    assertFalse(requests.get(0).get("annualaverage").asBoolean());

    BlsResponse merged = BlsResponse.read(target);
    assertTrue(merged.isSucceeded());
    assertEquals(2, merged.series().size());
    assertEquals("LAUMT413890000000003", merged.series().get(0).seriesId);
    assertEquals(25, merged.series().get(0).data.size());
  }

  @Test void testWithKeyUsesTwentyYearWindows() throws IOException {
    Path target = tempDir.resolve("bls.json");

    new BlsApiFetcher(config("abc123"), SERIES).fetch(target);

    assertEquals(2, requests.size());
    assertEquals("abc123", requests.get(0).get("registrationkey").asText());
    assertEquals("2019", requests.get(0).get("endyear").asText());
    assertEquals(25, BlsResponse.read(target).series().get(1).data.size());
  }

  @Test void testSeriesBatchedByFifty() throws IOException {
    ImmutableList.Builder<String> ids = ImmutableList.builder();
    for (int i = 0; i < 60; i++) {
      ids.add(String.format("LAUMT41389000000%04d", i));
    }

    new BlsApiFetcher(config("abc123"), ids.build()).fetch(tempDir.resolve("bls.json"));

    assertEquals(4, requests.size());
    assertEquals(50, requests.get(0).get("seriesid").size());
    assertEquals(10, requests.get(3).get("seriesid").size());
  }

  @Test void testFailedStatusRaises() {
    failStatus = "REQUEST_NOT_PROCESSED";
    Path target = tempDir.resolve("bls.json");

    UpstreamFailureException e = assertThrows(UpstreamFailureException.class,
        () -> new BlsApiFetcher(config(null), SERIES).fetch(target));

    assertTrue(e.getMessage().contains("Series does not exist"), e.getMessage());
    assertFalse(Files.exists(target));
  }

  @Test void testRedfinDownload() throws IOException {
    Path target = tempDir.resolve("redfin.tsv.gz");

    new RedfinTsvFetcher(config(null)).fetch(target);

    assertEquals("CITY\tSTATE\n", new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
  }

  @Test void testHttpErrorRaises() {
    PipelineConfig config = PipelineConfig.builder()
        .dataDir(tempDir)
        .redfinUrl(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/missing"))
        .build();

    IOException e = assertThrows(IOException.class,
        () -> new RedfinTsvFetcher(config).fetch(tempDir.resolve("redfin.tsv.gz")));
    assertTrue(e.getMessage().contains("404"), e.getMessage());
  }
}
