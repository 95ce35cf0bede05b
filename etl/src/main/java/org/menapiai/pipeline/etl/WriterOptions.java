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
package org.menapiai.pipeline.etl;

import java.util.Map;

/**
 * DuckDB settings used when writing a dataset.
 *
 * <h3>YAML Configuration</h3>
 * <pre>{@code
 * writer:
 *   threads: 1
 *   compression: snappy
 *   rowGroupSize: 100000
 *   preserveInsertionOrder: true
 * }</pre>
 *
 * <p>One thread with insertion order preserved keeps the files of a rerun
 * identical to the previous run.
 */
public final class WriterOptions {
  private static final int DEFAULT_THREADS = 1;
  private static final int DEFAULT_ROW_GROUP_SIZE = 100000;
  private static final int DEFAULT_BATCH_SIZE = 1000;
  private static final String DEFAULT_COMPRESSION = "snappy";

  private final int threads;
  private final int rowGroupSize;
  private final int insertBatchSize;
  private final String compression;
  private final boolean preserveInsertionOrder;

  private WriterOptions(Builder builder) {
    this.threads = builder.threads > 0 ? builder.threads : DEFAULT_THREADS;
    this.rowGroupSize = builder.rowGroupSize > 0 ? builder.rowGroupSize : DEFAULT_ROW_GROUP_SIZE;
    this.insertBatchSize = builder.insertBatchSize > 0
        ? builder.insertBatchSize : DEFAULT_BATCH_SIZE;
    this.compression = builder.compression != null && !builder.compression.isEmpty()
        ? builder.compression : DEFAULT_COMPRESSION;
    this.preserveInsertionOrder = builder.preserveInsertionOrder != null
        ? builder.preserveInsertionOrder : true;
  }

  /** Number of DuckDB worker threads. */
  public int getThreads() {
    return threads;
  }

  public int getRowGroupSize() {
    return rowGroupSize;
  }

  /** Rows per JDBC batch when loading the staging table. */
  public int getInsertBatchSize() {
    return insertBatchSize;
  }

  /** Parquet codec name, or "none". */
  public String getCompression() {
    return compression;
  }

  public boolean isPreserveInsertionOrder() {
    return preserveInsertionOrder;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static WriterOptions defaults() {
    return builder().build();
  }

  /**
   * Creates options from a YAML/JSON map.
   *
   * @param map Map with keys threads, rowGroupSize, insertBatchSize,
   *     compression, preserveInsertionOrder; may be null
   */
  public static WriterOptions fromMap(Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder builder = builder();
    Object threadsObj = map.get("threads");
    if (threadsObj instanceof Number) {
      builder.threads(((Number) threadsObj).intValue());
    }
    Object rowGroupSizeObj = map.get("rowGroupSize");
    if (rowGroupSizeObj instanceof Number) {
      builder.rowGroupSize(((Number) rowGroupSizeObj).intValue());
    }
    Object batchObj = map.get("insertBatchSize");
    if (batchObj instanceof Number) {
      builder.insertBatchSize(((Number) batchObj).intValue());
    }
    Object compressionObj = map.get("compression");
    if (compressionObj instanceof String) {
      builder.compression((String) compressionObj);
    }
    Object preserveOrderObj = map.get("preserveInsertionOrder");
    if (preserveOrderObj instanceof Boolean) {
      builder.preserveInsertionOrder((Boolean) preserveOrderObj);
    }
    return builder.build();
  }

  @Override public String toString() {
    return "WriterOptions{threads=" + threads + ", compression=" + compression
        + ", rowGroupSize=" + rowGroupSize + ", preserveInsertionOrder="
        + preserveInsertionOrder + "}";
  }

  /**
   * Builder for WriterOptions.
   */
  public static class Builder {
    private int threads;
    private int rowGroupSize;
    private int insertBatchSize;
    private String compression;
    private Boolean preserveInsertionOrder;

    public Builder threads(int threads) {
      this.threads = threads;
      return this;
    }

    public Builder rowGroupSize(int rowGroupSize) {
      this.rowGroupSize = rowGroupSize;
      return this;
    }

    public Builder insertBatchSize(int insertBatchSize) {
      this.insertBatchSize = insertBatchSize;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public Builder preserveInsertionOrder(boolean preserveInsertionOrder) {
      this.preserveInsertionOrder = preserveInsertionOrder;
      return this;
    }

    public WriterOptions build() {
      return new WriterOptions(this);
    }
  }
}
