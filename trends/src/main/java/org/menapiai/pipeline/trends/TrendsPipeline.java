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

import org.menapiai.pipeline.etl.CanonicalTable;
import org.menapiai.pipeline.etl.DatasetInspector;
import org.menapiai.pipeline.etl.DatasetValidator;
import org.menapiai.pipeline.etl.PartitionSpec;
import org.menapiai.pipeline.etl.PartitionedParquetWriter;
import org.menapiai.pipeline.etl.RowValidator;
import org.menapiai.pipeline.etl.TableColumn;
import org.menapiai.pipeline.etl.ValidationResult;
import org.menapiai.pipeline.trends.cache.RawArtifactCache;
import org.menapiai.pipeline.trends.cache.RawSource;
import org.menapiai.pipeline.trends.employment.BlsResponse;
import org.menapiai.pipeline.trends.employment.CanonicalEmploymentRecord;
import org.menapiai.pipeline.trends.employment.EmploymentColumns;
import org.menapiai.pipeline.trends.employment.EmploymentNormalizer;
import org.menapiai.pipeline.trends.employment.LausMeasure;
import org.menapiai.pipeline.trends.employment.LausSeriesId;
import org.menapiai.pipeline.trends.housing.CanonicalHousingRecord;
import org.menapiai.pipeline.trends.housing.HousingColumns;
import org.menapiai.pipeline.trends.housing.HousingNormalizer;
import org.menapiai.pipeline.trends.housing.PropertyType;
import org.menapiai.pipeline.trends.housing.RedfinTsvReader;
import org.menapiai.pipeline.trends.region.MetroArea;
import org.menapiai.pipeline.trends.region.RegionCatalog;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;

/**
 * Runs the ingest and transform steps of both datasets.
 *
 * <p>Ingest resolves a raw artifact through the {@link RawArtifactCache}.
 * Transform normalizes a raw artifact for one region and window and writes
 * the canonical rows into the partitioned dataset under the output
 * directory. The {@code run*} methods chain both.
 *
 * <p>All failures surface as {@link PipelineException} subclasses.
 */
public class TrendsPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(TrendsPipeline.class);

  private final PipelineConfig config;
  private final RawArtifactCache cache;
  private final HousingNormalizer housingNormalizer;
  private final EmploymentNormalizer employmentNormalizer;

  public TrendsPipeline(PipelineConfig config) {
    this(config, RegionCatalog.getInstance());
  }

  private TrendsPipeline(PipelineConfig config, RegionCatalog catalog) {
    this(config, catalog, RawArtifactCache.http(config, blsSeriesIds(catalog)));
  }

  public TrendsPipeline(PipelineConfig config, RegionCatalog catalog, RawArtifactCache cache) {
    this.config = config;
    this.cache = cache;
    this.housingNormalizer = new HousingNormalizer(catalog, config.getClock());
    this.employmentNormalizer = new EmploymentNormalizer(catalog, config.getClock());
  }

  /**
   * Builds the LAUS series IDs of every configured metro and measure.
   */
  public static List<String> blsSeriesIds(RegionCatalog catalog) {
    List<String> ids = new ArrayList<>();
    for (MetroArea metro : catalog.getMetros()) {
      for (LausMeasure measure : LausMeasure.values()) {
        ids.add(LausSeriesId.of(metro.getCode(), measure).toString());
      }
    }
    return ids;
  }

  public PipelineConfig getConfig() {
    return config;
  }

  // Housing

  /** Today's cache file of the Redfin TSV; it may not exist yet. */
  public Path cachedHousingPath() {
    return cache.cachePath(RawSource.REDFIN_HOUSING);
  }

  public Path ingestHousing(@Nullable Path localPath, boolean forceRefresh) {
    return cache.resolve(RawSource.REDFIN_HOUSING, localPath, forceRefresh);
  }

  /**
   * Normalizes a Redfin TSV for one city and writes it to the housing dataset.
   *
   * @param rawFile Redfin TSV, gzip-compressed when named {@code *.gz}
   * @param city City name as written by Redfin
   * @param state Full state name or 2-letter abbreviation
   * @param window Inclusive date window
   * @param propertyTypes Property types to keep; empty keeps all
   * @return Housing dataset root
   */
  public Path transformHousing(Path rawFile, String city, String state, DateWindow window,
      Collection<PropertyType> propertyTypes) {
    requireArtifact(rawFile);
    SortedMap<PropertyType, List<CanonicalHousingRecord>> records;
    try (RedfinTsvReader reader = RedfinTsvReader.open(rawFile)) {
      records = housingNormalizer.normalize(reader, city, state, window, propertyTypes);
    } catch (IOException | UncheckedIOException e) {
      throw new PipelineException("Failed to read Redfin data from " + rawFile + ": "
          + e.getMessage(), e);
    }
    CanonicalTable table = HousingNormalizer.toTable(records);
    Path root = write(table, HousingColumns.PARTITION, config.housingDatasetDir(),
        HousingColumns.KEY_COLUMNS);
    LOGGER.info("Housing dataset for {}, {} written to {} ({} property types)",
        city, state, root, records.size());
    return root;
  }

  public Path runHousing(@Nullable Path localPath, boolean forceRefresh, String city,
      String state, DateWindow window, Collection<PropertyType> propertyTypes) {
    Path raw = ingestHousing(localPath, forceRefresh);
    return transformHousing(raw, city, state, window, propertyTypes);
  }

  // Employment

  /** Today's cache file of the BLS response; it may not exist yet. */
  public Path cachedEmploymentPath() {
    return cache.cachePath(RawSource.BLS_EMPLOYMENT);
  }

  public Path ingestEmployment(@Nullable Path localPath, boolean forceRefresh) {
    return cache.resolve(RawSource.BLS_EMPLOYMENT, localPath, forceRefresh);
  }

  /**
   * Normalizes a cached BLS response for one metro and writes it to the
   * employment dataset.
   *
   * @param rawFile BLS API response JSON
   * @param metroAreaName Configured metro name
   * @param window Inclusive window on the first day of each month
   * @return Employment dataset root
   */
  public Path transformEmployment(Path rawFile, String metroAreaName, DateWindow window) {
    requireArtifact(rawFile);
    BlsResponse response;
    try {
      response = BlsResponse.read(rawFile);
    } catch (IOException e) {
      throw new PipelineException("Failed to read BLS response from " + rawFile + ": "
          + e.getMessage(), e);
    }
    List<CanonicalEmploymentRecord> records =
        employmentNormalizer.normalize(response, metroAreaName, window);
    CanonicalTable table = EmploymentNormalizer.toTable(records);
    Path root = write(table, EmploymentColumns.PARTITION, config.employmentDatasetDir(),
        EmploymentColumns.KEY_COLUMNS);
    LOGGER.info("Employment dataset for {} written to {} ({} months)",
        metroAreaName, root, records.size());
    return root;
  }

  public Path runEmployment(@Nullable Path localPath, boolean forceRefresh,
      String metroAreaName, DateWindow window) {
    Path raw = ingestEmployment(localPath, forceRefresh);
    return transformEmployment(raw, metroAreaName, window);
  }

  // Datasets

  /**
   * Summarizes a dataset directory or a single Parquet file.
   */
  public DatasetInspector.DatasetSummary inspect(Path target, int headRows) {
    try {
      return new DatasetInspector().inspect(target, headRows);
    } catch (IOException e) {
      throw new PipelineException("Failed to inspect " + target + ": " + e.getMessage(), e);
    }
  }

  public ValidationResult validateHousing() {
    return validate(config.housingDatasetDir(), HousingColumns.SCHEMA,
        HousingColumns.KEY_COLUMNS);
  }

  public ValidationResult validateEmployment() {
    return validate(config.employmentDatasetDir(), EmploymentColumns.SCHEMA,
        EmploymentColumns.KEY_COLUMNS);
  }

  private static ValidationResult validate(Path root, List<TableColumn> schema,
      List<String> keyColumns) {
    List<String> required = new ArrayList<>();
    for (TableColumn column : schema) {
      required.add(column.getName());
    }
    try {
      return new DatasetValidator().validate(root, required, keyColumns);
    } catch (IOException e) {
      throw new PipelineException("Failed to validate " + root + ": " + e.getMessage(), e);
    }
  }

  private Path write(CanonicalTable table, PartitionSpec spec, Path root,
      List<String> keyColumns) {
    ImmutableList.Builder<RowValidator> validators = ImmutableList.builder();
    for (String column : keyColumns) {
      validators.add(RowValidator.notNull(column));
    }
    PartitionedParquetWriter writer =
        new PartitionedParquetWriter(config.getWriterOptions(), validators.build());
    try {
      return writer.write(table, spec, root);
    } catch (IOException | IllegalStateException e) {
      throw new PipelineException("Failed to write " + table.getName() + " to " + root + ": "
          + e.getMessage(), e);
    }
  }

  private static void requireArtifact(Path rawFile) {
    if (!Files.isRegularFile(rawFile)) {
      throw new MissingArtifactException(rawFile);
    }
  }
}
