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

import org.menapiai.pipeline.etl.DatasetInspector;
import org.menapiai.pipeline.etl.ValidationResult;
import org.menapiai.pipeline.trends.ConfigurationException;
import org.menapiai.pipeline.trends.DateWindow;
import org.menapiai.pipeline.trends.PipelineConfig;
import org.menapiai.pipeline.trends.PipelineException;
import org.menapiai.pipeline.trends.TrendsPipeline;
import org.menapiai.pipeline.trends.housing.PropertyType;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 *
 * <pre>
 * java -jar menapiai-trends.jar run-housing --city Portland --state OR \
 *     --start-date 2020-01-01 --end-date 2024-12-31 --property-type "Single Family Residential"
 * java -jar menapiai-trends.jar run-employment --metro "Portland-Vancouver-Hillsboro, OR-WA"
 * java -jar menapiai-trends.jar inspect --dataset housing --head 5
 * java -jar menapiai-trends.jar validate
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when the pipeline fails or a dataset is
 * invalid, 2 on a usage error.
 */
public final class TrendsCli {
  private static final Logger LOGGER = LoggerFactory.getLogger(TrendsCli.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  static final String USAGE = String.join(System.lineSeparator(),
      "Usage: trends <command> [options]",
      "",
      "Commands:",
      "  ingest-housing        Download or reuse the cached Redfin TSV",
      "  transform-housing     Normalize the Redfin TSV of one city into housing_trends",
      "  run-housing           ingest-housing followed by transform-housing",
      "  ingest-employment     Download or reuse the cached BLS LAUS response",
      "  transform-employment  Normalize the BLS response of one metro into employment_trends",
      "  run-employment        ingest-employment followed by transform-employment",
      "  inspect               Print row count, schema, partitions and first rows of a dataset",
      "  validate              Check required columns and non-null keys of the datasets",
      "",
      "Options:",
      "  --config <yaml>          Pipeline configuration file",
      "  --local-path <file>      Use this raw file instead of the cache",
      "  --force-refresh          Download even if the cache is fresh",
      "  --city <name>            City (housing)",
      "  --state <name|abbr>      State (housing)",
      "  --property-type <label>  Keep only this property type (repeatable)",
      "  --metro <name>           Metro area name (employment)",
      "  --start-date <yyyy-MM-dd>, --end-date <yyyy-MM-dd>  Inclusive window",
      "  --dataset <housing|employment>  Dataset to inspect or validate",
      "  --path <dir|file>        Dataset directory or Parquet file to inspect",
      "  --head <n>               Rows shown by inspect (default 5)");

  private final PrintStream out;
  private final PrintStream err;

  TrendsCli(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new TrendsCli(System.out, System.err).run(args));
  }

  /**
   * Runs one command.
   *
   * @return Process exit code
   */
  int run(String[] args) {
    CliArguments arguments;
    PipelineConfig config;
    try {
      arguments = CliArguments.parse(args);
      if (arguments.hasFlag("--help")) {
        out.println(USAGE);
        return EXIT_OK;
      }
      config = loadConfig(arguments.optionOrNull("--config"));
      return execute(arguments, new TrendsPipeline(config));
    } catch (CliArguments.UsageException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return EXIT_USAGE;
    } catch (PipelineException e) {
      LOGGER.error("{} failed: {}", args.length > 0 ? args[0] : "pipeline", e.getMessage(), e);
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  private static PipelineConfig loadConfig(@Nullable String configPath) {
    return configPath == null
        ? PipelineConfig.defaults()
        : PipelineConfig.fromYaml(Paths.get(configPath));
  }

  private int execute(CliArguments arguments, TrendsPipeline pipeline)
      throws CliArguments.UsageException {
    @Nullable Path localPath = pathOption(arguments, "--local-path");
    boolean forceRefresh = arguments.hasFlag("--force-refresh");
    switch (arguments.getCommand()) {
      case "ingest-housing":
        out.println(pipeline.ingestHousing(localPath, forceRefresh));
        return EXIT_OK;
      case "transform-housing":
        report("housing", pipeline.transformHousing(
            localPath != null ? localPath : pipeline.cachedHousingPath(),
            arguments.required("--city"), arguments.required("--state"),
            window(arguments), propertyTypes(arguments)));
        return EXIT_OK;
      case "run-housing":
        report("housing", pipeline.runHousing(localPath, forceRefresh,
            arguments.required("--city"), arguments.required("--state"),
            window(arguments), propertyTypes(arguments)));
        return EXIT_OK;
      case "ingest-employment":
        out.println(pipeline.ingestEmployment(localPath, forceRefresh));
        return EXIT_OK;
      case "transform-employment":
        report("employment", pipeline.transformEmployment(
            localPath != null ? localPath : pipeline.cachedEmploymentPath(),
            arguments.required("--metro"), window(arguments)));
        return EXIT_OK;
      case "run-employment":
        report("employment", pipeline.runEmployment(localPath, forceRefresh,
            arguments.required("--metro"), window(arguments)));
        return EXIT_OK;
      case "inspect":
        return inspect(arguments, pipeline);
      case "validate":
        return validate(arguments, pipeline);
      default:
        throw new CliArguments.UsageException("Unknown command '" + arguments.getCommand() + "'");
    }
  }

  private int inspect(CliArguments arguments, TrendsPipeline pipeline)
      throws CliArguments.UsageException {
    Path target = pathOption(arguments, "--path");
    if (target == null) {
      String dataset = arguments.option("--dataset").orElse("housing");
      target = datasetDir(pipeline.getConfig(), dataset);
    }
    int head = arguments.intOption("--head", 5);
    if (head < 0) {
      throw new CliArguments.UsageException("--head must not be negative");
    }
    DatasetInspector.DatasetSummary summary = pipeline.inspect(target, head);
    out.println(summary.format());
    return EXIT_OK;
  }

  private int validate(CliArguments arguments, TrendsPipeline pipeline)
      throws CliArguments.UsageException {
    List<String> datasets = arguments.option("--dataset")
        .<List<String>>map(ImmutableList::of)
        .orElse(ImmutableList.of("housing", "employment"));
    Map<String, ValidationResult> results = new LinkedHashMap<>();
    for (String dataset : datasets) {
      datasetDir(pipeline.getConfig(), dataset);
      results.put(dataset, "housing".equals(dataset)
          ? pipeline.validateHousing() : pipeline.validateEmployment());
    }
    boolean allValid = true;
    for (Map.Entry<String, ValidationResult> entry : results.entrySet()) {
      ValidationResult result = entry.getValue();
      if (result.isValid()) {
        out.println(entry.getKey() + ": OK");
      } else {
        allValid = false;
        out.println(entry.getKey() + ": FAILED " + result.getMessage());
      }
    }
    return allValid ? EXIT_OK : EXIT_FAILURE;
  }

  private void report(String dataset, Path root) {
    out.println("Wrote " + dataset + " dataset to " + root);
  }

  private static Path datasetDir(PipelineConfig config, String dataset)
      throws CliArguments.UsageException {
    switch (dataset) {
      case "housing":
        return config.housingDatasetDir();
      case "employment":
        return config.employmentDatasetDir();
      default:
        throw new CliArguments.UsageException("Unknown dataset '" + dataset
            + "', expected housing or employment");
    }
  }

  private static @Nullable Path pathOption(CliArguments arguments, String name) {
    String value = arguments.optionOrNull(name);
    return value == null ? null : Paths.get(value);
  }

  private static DateWindow window(CliArguments arguments) throws CliArguments.UsageException {
    try {
      return DateWindow.parse(arguments.optionOrNull("--start-date"),
          arguments.optionOrNull("--end-date"));
    } catch (ConfigurationException e) {
      throw new CliArguments.UsageException(e.getMessage());
    }
  }

  private static List<PropertyType> propertyTypes(CliArguments arguments) {
    List<PropertyType> types = new ArrayList<>();
    for (String label : arguments.values("--property-type")) {
      types.add(PropertyType.of(label));
    }
    return types;
  }
}
