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

import org.menapiai.pipeline.etl.WriterOptions;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings passed to every pipeline component.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * dataDir: data
 * rawDataDir: data/raw
 * outputDir: data/clean
 * cacheTtl: PT24H
 * redfinUrl: https://redfin-public-data.s3.us-west-2.amazonaws.com/...
 * blsApiUrl: https://api.bls.gov/publicAPI/v2/timeseries/data/
 * blsApiKey: ...            # falls back to the BLS_API_KEY environment variable
 * blsStartYear: 2000
 * httpTimeout: PT30S
 * duckdbThreads: 1
 * writer:                   # see WriterOptions; threads defaults to duckdbThreads
 *   compression: zstd
 *   rowGroupSize: 100000
 * }</pre>
 *
 * <p>Relative raw and output directories are taken as given; they are not
 * resolved against {@code dataDir}.
 */
public final class PipelineConfig {
  public static final String BLS_API_KEY_ENV = "BLS_API_KEY";

  public static final URI DEFAULT_REDFIN_URL = URI.create(
      "https://redfin-public-data.s3.us-west-2.amazonaws.com/"
          + "redfin_market_tracker/city_market_tracker.tsv000.gz");
  public static final URI DEFAULT_BLS_API_URL =
      URI.create("https://api.bls.gov/publicAPI/v2/timeseries/data/");

  public static final String HOUSING_DATASET = "housing_trends";
  public static final String EMPLOYMENT_DATASET = "employment_trends";

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private final Path dataDir;
  private final Path rawDataDir;
  private final Path outputDir;
  private final Duration cacheTtl;
  private final URI redfinUrl;
  private final URI blsApiUrl;
  private final @Nullable String blsApiKey;
  private final int blsStartYear;
  private final Duration httpTimeout;
  private final WriterOptions writerOptions;
  private final Clock clock;

  private PipelineConfig(Builder builder) {
    this.dataDir = builder.dataDir;
    this.rawDataDir = builder.rawDataDir != null
        ? builder.rawDataDir : builder.dataDir.resolve("raw");
    this.outputDir = builder.outputDir != null
        ? builder.outputDir : builder.dataDir.resolve("clean");
    this.cacheTtl = builder.cacheTtl;
    this.redfinUrl = builder.redfinUrl;
    this.blsApiUrl = builder.blsApiUrl;
    this.blsApiKey = builder.blsApiKey == null || builder.blsApiKey.isEmpty()
        ? null : builder.blsApiKey;
    this.blsStartYear = builder.blsStartYear;
    this.httpTimeout = builder.httpTimeout;
    this.writerOptions = builder.writerOptions != null
        ? builder.writerOptions
        : WriterOptions.builder().threads(builder.duckdbThreads).build();
    this.clock = builder.clock;
    if (cacheTtl.isNegative()) {
      throw new ConfigurationException("cacheTtl cannot be negative: " + cacheTtl);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Defaults, with the BLS key taken from the environment.
   */
  public static PipelineConfig defaults() {
    return builder().blsApiKey(System.getenv(BLS_API_KEY_ENV)).build();
  }

  /**
   * Loads a YAML configuration file.
   *
   * @param file YAML file
   * @return Configuration, with unset keys at their defaults
   * @throws ConfigurationException if the file cannot be read or a value is invalid
   */
  public static PipelineConfig fromYaml(Path file) {
    return fromYaml(file, System.getenv());
  }

  /**
   * Loads a YAML configuration file against an explicit environment.
   */
  static PipelineConfig fromYaml(Path file, Map<String, String> env) {
    if (!Files.exists(file)) {
      throw new ConfigurationException("Configuration file not found: " + file);
    }
    try (InputStream in = Files.newInputStream(file)) {
      JsonNode root = YAML_MAPPER.readTree(in);
      return fromNode(root, env);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration " + file
          + ": " + e.getMessage(), e);
    }
  }

  static PipelineConfig fromNode(@Nullable JsonNode root, Map<String, String> env) {
    Builder builder = builder();
    if (root != null && !root.isMissingNode() && !root.isNull()) {
      if (!root.isObject()) {
        throw new ConfigurationException("Configuration root must be a mapping");
      }
      if (root.hasNonNull("dataDir")) {
        builder.dataDir(Paths.get(root.get("dataDir").asText()));
      }
      if (root.hasNonNull("rawDataDir")) {
        builder.rawDataDir(Paths.get(root.get("rawDataDir").asText()));
      }
      if (root.hasNonNull("outputDir")) {
        builder.outputDir(Paths.get(root.get("outputDir").asText()));
      }
      if (root.hasNonNull("cacheTtl")) {
        builder.cacheTtl(parseDuration("cacheTtl", root.get("cacheTtl").asText()));
      }
      if (root.hasNonNull("redfinUrl")) {
        builder.redfinUrl(URI.create(root.get("redfinUrl").asText()));
      }
      if (root.hasNonNull("blsApiUrl")) {
        builder.blsApiUrl(URI.create(root.get("blsApiUrl").asText()));
      }
      if (root.hasNonNull("blsApiKey")) {
        builder.blsApiKey(root.get("blsApiKey").asText());
      }
      if (root.hasNonNull("blsStartYear")) {
        builder.blsStartYear(root.get("blsStartYear").asInt());
      }
      if (root.hasNonNull("httpTimeout")) {
        builder.httpTimeout(parseDuration("httpTimeout", root.get("httpTimeout").asText()));
      }
      if (root.hasNonNull("duckdbThreads")) {
        builder.duckdbThreads(root.get("duckdbThreads").asInt());
      }
      if (root.hasNonNull("writer")) {
        builder.writerOptions(parseWriterOptions(root.get("writer"), builder.duckdbThreads));
      }
    }
    if (builder.blsApiKey == null || builder.blsApiKey.isEmpty()) {
      builder.blsApiKey(env.get(BLS_API_KEY_ENV));
    }
    return builder.build();
  }

  private static WriterOptions parseWriterOptions(JsonNode node, int duckdbThreads) {
    if (!node.isObject()) {
      throw new ConfigurationException("writer must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>(
        YAML_MAPPER.convertValue(node, new TypeReference<Map<String, Object>>() { }));
    map.putIfAbsent("threads", duckdbThreads);
    return WriterOptions.fromMap(map);
  }

  private static Duration parseDuration(String key, String value) {
    try {
      return Duration.parse(value);
    } catch (DateTimeParseException e) {
      throw new ConfigurationException("Invalid " + key + " '" + value
          + "', expected an ISO-8601 duration such as PT24H", e);
    }
  }

  public Path getDataDir() {
    return dataDir;
  }

  public Path getRawDataDir() {
    return rawDataDir;
  }

  public Path getOutputDir() {
    return outputDir;
  }

  public Duration getCacheTtl() {
    return cacheTtl;
  }

  public URI getRedfinUrl() {
    return redfinUrl;
  }

  public URI getBlsApiUrl() {
    return blsApiUrl;
  }

  public @Nullable String getBlsApiKey() {
    return blsApiKey;
  }

  public int getBlsStartYear() {
    return blsStartYear;
  }

  public Duration getHttpTimeout() {
    return httpTimeout;
  }

  public WriterOptions getWriterOptions() {
    return writerOptions;
  }

  public Clock getClock() {
    return clock;
  }

  public Path housingDatasetDir() {
    return outputDir.resolve(HOUSING_DATASET);
  }

  public Path employmentDatasetDir() {
    return outputDir.resolve(EMPLOYMENT_DATASET);
  }

  @Override public String toString() {
    return "PipelineConfig{rawDataDir=" + rawDataDir + ", outputDir=" + outputDir
        + ", cacheTtl=" + cacheTtl + ", blsApiKey=" + (blsApiKey == null ? "<none>" : "<set>")
        + ", blsStartYear=" + blsStartYear + ", " + writerOptions + "}";
  }

  /**
   * Builder for PipelineConfig.
   */
  public static class Builder {
    private Path dataDir = Paths.get("data");
    private @Nullable Path rawDataDir;
    private @Nullable Path outputDir;
    private Duration cacheTtl = Duration.ofHours(24);
    private URI redfinUrl = DEFAULT_REDFIN_URL;
    private URI blsApiUrl = DEFAULT_BLS_API_URL;
    private @Nullable String blsApiKey;
    private int blsStartYear = 2000;
    private Duration httpTimeout = Duration.ofSeconds(30);
    private int duckdbThreads = 1;
    private @Nullable WriterOptions writerOptions;
    private Clock clock = Clock.systemDefaultZone();

    public Builder dataDir(Path dataDir) {
      this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
      return this;
    }

    public Builder rawDataDir(Path rawDataDir) {
      this.rawDataDir = rawDataDir;
      return this;
    }

    public Builder outputDir(Path outputDir) {
      this.outputDir = outputDir;
      return this;
    }

    public Builder cacheTtl(Duration cacheTtl) {
      this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
      return this;
    }

    public Builder redfinUrl(URI redfinUrl) {
      this.redfinUrl = Objects.requireNonNull(redfinUrl, "redfinUrl");
      return this;
    }

    public Builder blsApiUrl(URI blsApiUrl) {
      this.blsApiUrl = Objects.requireNonNull(blsApiUrl, "blsApiUrl");
      return this;
    }

    public Builder blsApiKey(@Nullable String blsApiKey) {
      this.blsApiKey = blsApiKey;
      return this;
    }

    public Builder blsStartYear(int blsStartYear) {
      this.blsStartYear = blsStartYear;
      return this;
    }

    public Builder httpTimeout(Duration httpTimeout) {
      this.httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout");
      return this;
    }

    public Builder duckdbThreads(int duckdbThreads) {
      this.duckdbThreads = duckdbThreads;
      return this;
    }

    /** Overrides every writer setting, including {@link #duckdbThreads}. */
    public Builder writerOptions(WriterOptions writerOptions) {
      this.writerOptions = Objects.requireNonNull(writerOptions, "writerOptions");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public PipelineConfig build() {
      return new PipelineConfig(this);
    }
  }
}
