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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link PipelineConfig}.
 */
@Tag("unit")
public class PipelineConfigTest {

  @TempDir
  Path tempDir;

  private Path yaml(String content) throws IOException {
    Path file = tempDir.resolve("pipeline.yaml");
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test void testDefaults() {
    PipelineConfig config = PipelineConfig.builder().build();

    assertEquals(Paths.get("data", "raw"), config.getRawDataDir());
    assertEquals(Paths.get("data", "clean"), config.getOutputDir());
    assertEquals(Duration.ofHours(24), config.getCacheTtl());
    assertEquals(2000, config.getBlsStartYear());
    assertEquals(PipelineConfig.DEFAULT_REDFIN_URL, config.getRedfinUrl());
    assertEquals(Paths.get("data", "clean", "housing_trends"), config.housingDatasetDir());
    assertEquals(Paths.get("data", "clean", "employment_trends"),
        config.employmentDatasetDir());
    assertEquals(1, config.getWriterOptions().getThreads());
  }

  @Test void testYamlOverrides() throws IOException {
    Path file = yaml("dataDir: " + tempDir.resolve("data") + "\n"
        + "cacheTtl: PT6H\n"
        + "blsStartYear: 2015\n"
        + "duckdbThreads: 2\n"
        + "blsApiKey: from-file\n");

    PipelineConfig config =
        PipelineConfig.fromYaml(file, ImmutableMap.of(PipelineConfig.BLS_API_KEY_ENV, "env"));

    assertEquals(tempDir.resolve("data").resolve("raw"), config.getRawDataDir());
    assertEquals(tempDir.resolve("data").resolve("clean"), config.getOutputDir());
    assertEquals(Duration.ofHours(6), config.getCacheTtl());
    assertEquals(2015, config.getBlsStartYear());
    assertEquals(2, config.getWriterOptions().getThreads());
    assertEquals("from-file", config.getBlsApiKey());
  }

  @Test void testWriterBlock() throws IOException {
    Path file = yaml("duckdbThreads: 3\n"
        + "writer:\n"
        + "  compression: zstd\n"
        + "  rowGroupSize: 5000\n"
        + "  insertBatchSize: 250\n"
        + "  preserveInsertionOrder: false\n");

    WriterOptions options = PipelineConfig.fromYaml(file, ImmutableMap.of()).getWriterOptions();

    assertEquals(3, options.getThreads());
    assertEquals("zstd", options.getCompression());
    assertEquals(5000, options.getRowGroupSize());
    assertEquals(250, options.getInsertBatchSize());
    assertFalse(options.isPreserveInsertionOrder());

    Path override = yaml("duckdbThreads: 3\nwriter:\n  threads: 4\n");
    assertEquals(4,
        PipelineConfig.fromYaml(override, ImmutableMap.of()).getWriterOptions().getThreads());
  }

  @Test void testApiKeyFromEnvironment() throws IOException {
    Path file = yaml("blsStartYear: 2010\n");

    assertEquals("secret", PipelineConfig.fromYaml(file,
        ImmutableMap.of(PipelineConfig.BLS_API_KEY_ENV, "secret")).getBlsApiKey());
    assertNull(PipelineConfig.fromYaml(file, ImmutableMap.of()).getBlsApiKey());
  }

  @Test void testInvalidConfiguration() throws IOException {
    assertThrows(ConfigurationException.class,
        () -> PipelineConfig.fromYaml(tempDir.resolve("missing.yaml")));
    Path file = yaml("cacheTtl: one day\n");
    assertThrows(ConfigurationException.class,
        () -> PipelineConfig.fromYaml(file, ImmutableMap.of()));
    Path writer = yaml("writer: fast\n");
    assertThrows(ConfigurationException.class,
        () -> PipelineConfig.fromYaml(writer, ImmutableMap.of()));
  }
}
