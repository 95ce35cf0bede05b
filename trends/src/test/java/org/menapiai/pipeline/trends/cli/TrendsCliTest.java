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
package org.menapiai.pipeline.trends.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TrendsCli} and {@link CliArguments}.
 */
@Tag("integration")
public class TrendsCliTest {

  @TempDir
  Path tempDir;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private Path config;
  private String redfinSample;
  private String blsSample;

  @BeforeEach
  void setUp() throws Exception {
    config = tempDir.resolve("pipeline.yaml");
    Files.write(config, ("dataDir: " + tempDir.resolve("data") + "\n")
        .getBytes(StandardCharsets.UTF_8));
    redfinSample = Paths.get(TrendsCliTest.class.getResource("/redfin_sample.tsv").toURI())
        .toString();
    blsSample = Paths.get(TrendsCliTest.class.getResource("/bls_sample.json").toURI())
        .toString();
  }

  private int run(String... args) {
    TrendsCli cli = new TrendsCli(new PrintStream(out, true), new PrintStream(err, true));
    return cli.run(args);
  }

  private String stdout() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  private String stderr() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test void testUsageErrors() {
    assertEquals(TrendsCli.EXIT_USAGE, run());
    assertEquals(TrendsCli.EXIT_USAGE, run("explode"));
    assertEquals(TrendsCli.EXIT_USAGE, run("inspect", "--bogus"));
    assertEquals(TrendsCli.EXIT_USAGE, run("transform-housing", "--config", config.toString(),
        "--state", "OR"));
    assertTrue(stderr().contains("requires --city"), stderr());
    assertEquals(TrendsCli.EXIT_USAGE, run("transform-housing", "--config", config.toString(),
        "--city", "Portland", "--state", "OR", "--start-date", "01/01/2020"));
  }

  @Test void testHelp() {
    assertEquals(TrendsCli.EXIT_OK, run("validate", "--help"));
    assertTrue(stdout().startsWith("Usage:"));
  }

  @Test void testTransformInspectValidateHousing() {
    assertEquals(TrendsCli.EXIT_OK, run("transform-housing", "--config", config.toString(),
        "--local-path", redfinSample, "--city", "Portland", "--state", "OR",
        "--start-date", "2020-01-01", "--end-date", "2024-12-31"));
    assertTrue(stdout().contains("Wrote housing dataset to"), stdout());

    out.reset();
    assertEquals(TrendsCli.EXIT_OK, run("inspect", "--config", config.toString(),
        "--dataset", "housing", "--head", "2"));
    assertTrue(stdout().startsWith("Loaded 6 rows from"), stdout());
    assertTrue(stdout().contains("First 2 rows:"), stdout());

    out.reset();
    assertEquals(TrendsCli.EXIT_OK, run("validate", "--config", config.toString(),
        "--dataset", "housing"));
    assertTrue(stdout().contains("housing: OK"), stdout());

    out.reset();
    assertEquals(TrendsCli.EXIT_FAILURE, run("validate", "--config", config.toString()));
    assertTrue(stdout().contains("employment: FAILED"), stdout());
  }

  @Test void testBothDatasetsValidate() {
    assertEquals(TrendsCli.EXIT_OK, run("transform-employment", "--config", config.toString(),
        "--local-path", blsSample, "--metro", "Portland-Vancouver-Hillsboro, OR-WA"));
    assertEquals(TrendsCli.EXIT_OK, run("transform-housing", "--config", config.toString(),
        "--local-path", redfinSample, "--city", "Portland", "--state", "Oregon",
        "--property-type", "Condo/Co-op", "--property-type", "Townhouse"));

    out.reset();
    assertEquals(TrendsCli.EXIT_OK, run("validate", "--config", config.toString()));
    assertTrue(stdout().contains("employment: OK"), stdout());
  }

  @Test void testPipelineFailures() throws IOException {
    assertEquals(TrendsCli.EXIT_FAILURE, run("transform-employment",
        "--config", config.toString(), "--local-path", blsSample, "--metro", "Springfield, IL"));
    assertTrue(stderr().contains("Springfield, IL"), stderr());

    assertEquals(TrendsCli.EXIT_FAILURE, run("transform-housing",
        "--config", tempDir.resolve("missing.yaml").toString(),
        "--city", "Portland", "--state", "OR"));

    assertEquals(TrendsCli.EXIT_FAILURE, run("transform-housing", "--config", config.toString(),
        "--local-path", tempDir.resolve("absent.tsv").toString(),
        "--city", "Portland", "--state", "OR"));
  }

  @Test void testArgumentParsing() throws CliArguments.UsageException {
    CliArguments arguments = CliArguments.parse(new String[] {
        "run-housing", "--force-refresh", "--property-type", "Townhouse",
        "--property-type", "Condo/Co-op", "--head", "3"});

    assertEquals("run-housing", arguments.getCommand());
    assertTrue(arguments.hasFlag("--force-refresh"));
    assertEquals(2, arguments.values("--property-type").size());
    assertEquals(3, arguments.intOption("--head", 5));
    assertEquals(5, CliArguments.parse(new String[] {"inspect"}).intOption("--head", 5));
    assertThrows(CliArguments.UsageException.class,
        () -> CliArguments.parse(new String[] {"inspect", "--city", "a", "--city", "b"}));
    assertThrows(CliArguments.UsageException.class,
        () -> CliArguments.parse(new String[] {"inspect", "--path"}));
  }
}
