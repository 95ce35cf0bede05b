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

import org.menapiai.pipeline.trends.MissingArtifactException;
import org.menapiai.pipeline.trends.PipelineConfig;
import org.menapiai.pipeline.trends.UpstreamFailureException;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link RawArtifactCache}.
 */
@Tag("unit")
public class RawArtifactCacheTest {
  private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

  @TempDir
  Path tempDir;

  private final AtomicInteger fetches = new AtomicInteger();
  private RawArtifactCache cache;
  private Path rawDir;

  @BeforeEach
  void setUp() {
    rawDir = tempDir.resolve("raw");
    PipelineConfig config = PipelineConfig.builder()
        .dataDir(tempDir)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
    ArtifactFetcher fetcher = target -> {
      int n = fetches.incrementAndGet();
      Files.write(target, ("download " + n).getBytes(StandardCharsets.UTF_8));
    };
    cache = new RawArtifactCache(config, ImmutableMap.of(
        RawSource.REDFIN_HOUSING, fetcher,
        RawSource.BLS_EMPLOYMENT, fetcher));
  }

  private static String read(Path file) throws IOException {
    return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
  }

  @Test void testCacheFileNames() {
    LocalDate day = LocalDate.of(2024, 1, 5);
    assertEquals("redfin_housing_20240105.tsv.gz", RawSource.REDFIN_HOUSING.fileName(day));
    assertEquals("bls_employment_20240105.json", RawSource.BLS_EMPLOYMENT.fileName(day));
    assertEquals(rawDir.resolve("bls_employment_20240315.json"),
        cache.cachePath(RawSource.BLS_EMPLOYMENT));
  }

  @Test void testExplicitLocalPathReturned() throws IOException {
    Path local = Files.createFile(tempDir.resolve("my.tsv"));

    assertEquals(local, cache.resolve(RawSource.REDFIN_HOUSING, local, true));
    assertEquals(0, fetches.get());
  }

  @Test void testMissingLocalPathFails() {
    Path local = tempDir.resolve("missing.tsv");

    MissingArtifactException e = assertThrows(MissingArtifactException.class,
        () -> cache.resolve(RawSource.REDFIN_HOUSING, local, false));
    assertEquals(local, e.getPath());
  }

  @Test void testDownloadsWhenAbsent() throws IOException {
    Path path = cache.resolve(RawSource.REDFIN_HOUSING, null, false);

    assertEquals(rawDir.resolve("redfin_housing_20240315.tsv.gz"), path);
    assertEquals("download 1", read(path));
  }

  @Test void testFreshCacheReused() throws IOException {
    Path path = cache.resolve(RawSource.REDFIN_HOUSING, null, false);
    Files.setLastModifiedTime(path, FileTime.from(NOW.minus(Duration.ofHours(23))));

    cache.resolve(RawSource.REDFIN_HOUSING, null, false);

    assertEquals(1, fetches.get());
    assertEquals("download 1", read(path));
  }

  @Test void testStaleCacheRefreshed() throws IOException {
    Path path = cache.resolve(RawSource.REDFIN_HOUSING, null, false);
    Files.setLastModifiedTime(path, FileTime.from(NOW.minus(Duration.ofHours(25))));

    cache.resolve(RawSource.REDFIN_HOUSING, null, false);

    assertEquals(2, fetches.get());
    assertEquals("download 2", read(path));
  }

  @Test void testForceRefresh() throws IOException {
    Path path = cache.resolve(RawSource.BLS_EMPLOYMENT, null, false);
    Files.setLastModifiedTime(path, FileTime.from(NOW));

    cache.resolve(RawSource.BLS_EMPLOYMENT, null, true);

    assertEquals("download 2", read(path));
  }

  @Test void testFailedDownloadLeavesNoFile() throws IOException {
    PipelineConfig config = PipelineConfig.builder()
        .dataDir(tempDir)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
    RawArtifactCache failing = new RawArtifactCache(config, ImmutableMap.of(
        RawSource.REDFIN_HOUSING, target -> {
          Files.write(target, "partial".getBytes(StandardCharsets.UTF_8));
          throw new IOException("connection reset");
        }));

    UpstreamFailureException e = assertThrows(UpstreamFailureException.class,
        () -> failing.resolve(RawSource.REDFIN_HOUSING, null, false));

    assertTrue(e.getMessage().contains("connection reset"), e.getMessage());
    assertFalse(Files.exists(failing.cachePath(RawSource.REDFIN_HOUSING)));
    try (Stream<Path> files = Files.list(rawDir)) {
      assertEquals(0, files.count());
    }
  }
}
