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

import java.util.Locale;

/**
 * Columns read from the Redfin city market tracker TSV.
 *
 * <p>Required columns must be present in the header or the file is
 * rejected. Optional columns may be absent: a missing {@code PERIOD_END}
 * means periods are tested by their begin date only, a missing
 * {@code PROPERTY_TYPE} means every row is "All Residential".
 */
public enum RedfinColumn {
  CITY(true),
  STATE(true),
  PERIOD_BEGIN(true),
  PERIOD_END(false),
  MEDIAN_SALE_PRICE(true),
  HOMES_SOLD(true),
  INVENTORY(true),
  MEDIAN_DOM(true),
  PROPERTY_TYPE(false);

  private final boolean required;

  RedfinColumn(boolean required) {
    this.required = required;
  }

  public boolean isRequired() {
    return required;
  }

  /** Header name as it appears in the file, matched case-insensitively. */
  public String headerName() {
    return name();
  }

  boolean matches(String header) {
    return header != null && header.trim().toUpperCase(Locale.ROOT).equals(name());
  }
}
