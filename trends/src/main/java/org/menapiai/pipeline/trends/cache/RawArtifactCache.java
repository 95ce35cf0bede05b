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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Resolves raw upstream artifacts to local files, downloading them at most
 * once per TTL.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>An explicit local path is returned as is; it must exist</li>
 *   <li>Today's cache file is reused when younger than the TTL</li>
 *   <li>Otherwise the artifact is fetched to a temporary file in the raw
 *       directory and moved into place</li>
 * </ol>
 *
 * <p>A failed download never leaves a partial file at the cache path.
 */
public class RawArtifactCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(RawArtifactCache.class);

  private final Path rawDir;
  private final Duration ttl;
  private final Clock clock;
  private final ImmutableMap<RawSource, ArtifactFetcher> fetchers;

  public RawArtifactCache(PipelineConfig config, Map<RawSource, ArtifactFetcher> fetchers) {
    this.rawDir = config.getRawDataDir();
    this.ttl = config.getCacheTtl();
    this.clock = config.getClock();
    this.fetchers = ImmutableMap.copyOf(fetchers);
  }

  /**
   * Creates a cache downloading over HTTP.
   *
   * @param config Pipeline configuration
   * @param blsSeriesIds Series requested from the BLS API
   */
  public static RawArtifactCache http(PipelineConfig config, List<String> blsSeriesIds) {
    return new RawArtifactCache(config, ImmutableMap.of(
        RawSource.REDFIN_HOUSING, new RedfinTsvFetcher(config),
        RawSource.BLS_EMPLOYMENT, new BlsApiFetcher(config, blsSeriesIds)));
  }

  /**
   * Returns a local file holding the raw artifact.
   *
   * @param source Artifact to resolve
   * @param localPath Explicit local file, bypassing the cache
   * @param forceRefresh Download even if a fresh cache file exists
   * @return Path of the artifact
   * @throws MissingArtifactException if {@code localPath} does not exist
   * @throws UpstreamFailureException if the download fails
   */
  public Path resolve(RawSource source, @Nullable Path localPath, boolean forceRefresh) {
    if (localPath != null) {
      if (!Files.isRegularFile(localPath)) {
        throw new MissingArtifactException(localPath);
      }
      LOGGER.info("Using local {} file {}", source, localPath);
      return localPath;
    }

    Path cached = cachePath(source);
    if (!forceRefresh && isFresh(cached)) {
      LOGGER.info("Using cached {} file {}", source, cached);
      return cached;
    }

    ArtifactFetcher fetcher = fetchers.get(source);
    if (fetcher == null) {
      throw new IllegalStateException("No fetcher registered for " + source);
    }
    try {
      Files.createDirectories(rawDir);
      fetchAtomically(fetcher, cached);
    } catch (IOException e) {
      String errorMsg = "Failed to download " + source + ": " + e.getMessage();
      LOGGER.error(errorMsg, e);
      throw new UpstreamFailureException(errorMsg, e);
    }
    return cached;
  }

  /** Returns today's cache file for a source; it may not exist yet. */
  public Path cachePath(RawSource source) {
    return rawDir.resolve(source.fileName(LocalDate.now(clock)));
  }

  private boolean isFresh(Path cached) {
    if (!Files.isRegularFile(cached)) {
      return false;
    }
    try {
      Instant modified = Files.getLastModifiedTime(cached).toInstant();
      Duration age = Duration.between(modified, clock.instant());
      return age.compareTo(ttl) < 0;
    } catch (IOException e) {
      LOGGER.warn("Cannot read modification time of {}: {}", cached, e.getMessage());
      return false;
    }
  }

  private static void fetchAtomically(ArtifactFetcher fetcher, Path target) throws IOException {
    Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".part");
    try {
      fetcher.fetch(temp);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}
