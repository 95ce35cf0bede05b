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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Base class for fetchers talking HTTP.
 */
public abstract class AbstractHttpFetcher implements ArtifactFetcher {
  protected final HttpClient httpClient;
  protected final Duration requestTimeout;

  protected AbstractHttpFetcher(PipelineConfig config) {
    this.requestTimeout = config.getHttpTimeout();
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(requestTimeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  /**
   * Sends a request, converting interruption into an {@link InterruptedIOException}
   * and any non-2xx status into an {@link IOException}.
   */
  protected <T> HttpResponse<T> send(HttpRequest request,
      HttpResponse.BodyHandler<T> bodyHandler) throws IOException {
    HttpResponse<T> response;
    try {
      response = httpClient.send(request, bodyHandler);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException ioe =
          new InterruptedIOException("Request to " + request.uri() + " interrupted");
      ioe.initCause(e);
      throw ioe;
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new IOException("HTTP request to " + request.uri() + " failed with status: " + status);
    }
    return response;
  }
}
