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

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Upstream raw artifacts and their dated cache file names.
 */
public enum RawSource {
  REDFIN_HOUSING("redfin_housing", "tsv.gz"),
  BLS_EMPLOYMENT("bls_employment", "json");

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

  private final String prefix;
  private final String extension;

  RawSource(String prefix, String extension) {
    this.prefix = prefix;
    this.extension = extension;
  }

  /** Returns the cache file name for a given day, e.g. {@code redfin_housing_20240115.tsv.gz}. */
  public String fileName(LocalDate day) {
    return prefix + "_" + DATE_FORMAT.format(day) + "." + extension;
  }
}
