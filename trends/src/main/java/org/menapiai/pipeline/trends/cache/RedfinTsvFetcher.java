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

import org.menapiai.pipeline.trends.PipelineConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Streams the gzipped Redfin city market tracker TSV to disk.
 *
 * <p>The file is several hundred megabytes, so the body is written directly
 * to the target without being decompressed or buffered in memory.
 */
public class RedfinTsvFetcher extends AbstractHttpFetcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(RedfinTsvFetcher.class);

  private static final Duration DOWNLOAD_TIMEOUT = Duration.ofMinutes(10);

  private final URI url;

  public RedfinTsvFetcher(PipelineConfig config) {
    super(config);
    this.url = config.getRedfinUrl();
  }

  @Override public void fetch(Path target) throws IOException {
    LOGGER.info("Downloading Redfin housing data from {}", url);
    HttpRequest request = HttpRequest.newBuilder()
        .uri(url)
        .timeout(requestTimeout.compareTo(DOWNLOAD_TIMEOUT) > 0 ? requestTimeout : DOWNLOAD_TIMEOUT)
        .GET()
        .build();
    send(request, HttpResponse.BodyHandlers.ofFile(target));
    LOGGER.info("Downloaded {} bytes to {}", Files.size(target), target);
  }
}
