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
package org.menapiai.pipeline.trends.housing;

import org.menapiai.pipeline.trends.ConfigurationException;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

/**
 * Streams {@link RawHousingRow}s from a Redfin city market tracker file.
 *
 * <p>Files ending in {@code .gz} are decompressed on the fly. The header is
 * read when the reader is opened and checked for the required
 * {@link RedfinColumn}s. Rows are read lazily; the reader can be iterated
 * once.
 *
 * <pre>{@code
 * try (RedfinTsvReader reader = RedfinTsvReader.open(path)) {
 *   for (RawHousingRow row : reader) {
 *     ...
 *   }
 * }
 * }</pre>
 */
public class RedfinTsvReader implements Iterable<RawHousingRow>, Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedfinTsvReader.class);

  private final Path path;
  private final CSVReader csvReader;
  private final EnumMap<RedfinColumn, Integer> columnIndex;
  private boolean iterated;
  private long lineNumber = 1;

  private RedfinTsvReader(Path path, CSVReader csvReader,
      EnumMap<RedfinColumn, Integer> columnIndex) {
    this.path = path;
    this.csvReader = csvReader;
    this.columnIndex = columnIndex;
  }

  /**
   * Opens a Redfin TSV (optionally gzip-compressed) and validates its header.
   *
   * @throws ConfigurationException if a required column is missing
   * @throws IOException if the file cannot be read
   */
  public static RedfinTsvReader open(Path path) throws IOException {
    InputStream in = Files.newInputStream(path);
    try {
      if (path.getFileName().toString().endsWith(".gz")) {
        in = new GZIPInputStream(in);
      }
      CSVReader csvReader = new CSVReaderBuilder(
          new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)))
          .withCSVParser(new CSVParserBuilder().withSeparator('\t').build())
          .build();
      String[] header = readLine(csvReader, path);
      if (header == null) {
        csvReader.close();
        throw new ConfigurationException("Redfin file " + path + " is empty");
      }
      return new RedfinTsvReader(path, csvReader, indexHeader(header, path));
    } catch (IOException | RuntimeException e) {
      in.close();
      throw e;
    }
  }

  static EnumMap<RedfinColumn, Integer> indexHeader(String[] header, Path path) {
    EnumMap<RedfinColumn, Integer> index = new EnumMap<>(RedfinColumn.class);
    for (int i = 0; i < header.length; i++) {
      for (RedfinColumn column : RedfinColumn.values()) {
        if (column.matches(header[i]) && !index.containsKey(column)) {
          index.put(column, i);
        }
      }
    }
    List<String> missing = new ArrayList<>();
    for (RedfinColumn column : RedfinColumn.values()) {
      if (column.isRequired() && !index.containsKey(column)) {
        missing.add(column.headerName());
      }
    }
    if (!missing.isEmpty()) {
      throw new ConfigurationException("Redfin file " + path + " is missing required columns "
          + missing);
    }
    for (RedfinColumn column : RedfinColumn.values()) {
      if (!column.isRequired() && !index.containsKey(column)) {
        LOGGER.info("Redfin file {} has no optional column {}", path, column.headerName());
      }
    }
    return index;
  }

  private static String[] readLine(CSVReader reader, Path path) throws IOException {
    try {
      return reader.readNext();
    } catch (CsvValidationException e) {
      throw new IOException("Invalid TSV line in " + path + ": " + e.getMessage(), e);
    }
  }

  /** Whether the file has the given column. */
  public boolean hasColumn(RedfinColumn column) {
    return columnIndex.containsKey(column);
  }

  /**
   * Returns an iterator over the remaining rows. Read failures surface as
   * {@link UncheckedIOException}.
   *
   * @throws IllegalStateException if called twice
   */
  @Override public Iterator<RawHousingRow> iterator() {
    if (iterated) {
      throw new IllegalStateException("RedfinTsvReader can only be iterated once");
    }
    iterated = true;
    return new Iterator<RawHousingRow>() {
      private @Nullable RawHousingRow next = advance();

      @Override public boolean hasNext() {
        return next != null;
      }

      @Override public RawHousingRow next() {
        if (next == null) {
          throw new NoSuchElementException();
        }
        RawHousingRow current = next;
        next = advance();
        return current;
      }
    };
  }

  private @Nullable RawHousingRow advance() {
    try {
      String[] line;
      while ((line = readLine(csvReader, path)) != null) {
        lineNumber++;
        if (line.length == 1 && line[0].trim().isEmpty()) {
          continue;
        }
        return toRow(line);
      }
      return null;
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private RawHousingRow toRow(String[] line) {
    return RawHousingRow.builder()
        .lineNumber(lineNumber)
        .city(cell(line, RedfinColumn.CITY))
        .state(cell(line, RedfinColumn.STATE))
        .periodBegin(cell(line, RedfinColumn.PERIOD_BEGIN))
        .periodEnd(cell(line, RedfinColumn.PERIOD_END))
        .medianSalePrice(cell(line, RedfinColumn.MEDIAN_SALE_PRICE))
        .homesSold(cell(line, RedfinColumn.HOMES_SOLD))
        .inventory(cell(line, RedfinColumn.INVENTORY))
        .medianDom(cell(line, RedfinColumn.MEDIAN_DOM))
        .propertyType(cell(line, RedfinColumn.PROPERTY_TYPE))
        .build();
  }

  private @Nullable String cell(String[] line, RedfinColumn column) {
    Integer i = columnIndex.get(column);
    if (i == null) {
      return null;
    }
    return i < line.length ? line[i] : "";
  }

  @Override public void close() throws IOException {
    csvReader.close();
  }
}
