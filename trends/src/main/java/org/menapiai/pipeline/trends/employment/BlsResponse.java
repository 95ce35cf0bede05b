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
package org.menapiai.pipeline.trends.employment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Raw BLS timeseries API response, as cached on disk.
 *
 * <pre>{@code
 * {
 *   "status": "REQUEST_SUCCEEDED",
 *   "message": [],
 *   "Results": {
 *     "series": [
 *       {"seriesID": "LAUMT413890000000003",
 *        "data": [{"year": "2020", "period": "M01", "periodName": "January", "value": "3.4"}]}
 *     ]
 *   }
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlsResponse {
  public static final String STATUS_SUCCEEDED = "REQUEST_SUCCEEDED";
  public static final String STATUS_FAILED = "REQUEST_FAILED";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public String status;
  public List<String> message = new ArrayList<>();

  @JsonProperty("Results")
  public Results results;

  /**
   * Reads a cached response file.
   */
  public static BlsResponse read(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return MAPPER.readValue(in, BlsResponse.class);
    }
  }

  public boolean isSucceeded() {
    return STATUS_SUCCEEDED.equals(status);
  }

  /** Messages joined with "; ", or "Unknown error" when there are none. */
  public String joinedMessage() {
    if (message == null || message.isEmpty()) {
      return "Unknown error";
    }
    return String.join("; ", message);
  }

  /** Series of the response, never null. */
  public List<Series> series() {
    if (results == null || results.series == null) {
      return new ArrayList<>();
    }
    return results.series;
  }

  /** {@code Results} object. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Results {
    public List<Series> series = new ArrayList<>();
  }

  /** One series with its data points. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Series {
    @JsonProperty("seriesID")
    public String seriesId;
    public List<DataPoint> data = new ArrayList<>();

    public Series() {
    }

    public Series(String seriesId, List<DataPoint> data) {
      this.seriesId = seriesId;
      this.data = data;
    }
  }

  /** One observation of a series. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DataPoint {
    public String year;
    public String period;
    public String periodName;
    public String value;

    public DataPoint() {
    }

    public DataPoint(String year, String period, String value) {
      this.year = year;
      this.period = period;
      this.value = value;
    }
  }
}
