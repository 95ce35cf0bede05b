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
package org.menapiai.pipeline.trends.region;

import java.util.Objects;

/**
 * A metropolitan statistical area known to the BLS LAUS program.
 */
public final class MetroArea {
  private final String name;
  private final String stateFips;
  private final String areaCode;

  public MetroArea(String name, String stateFips, String areaCode) {
    this.name = Objects.requireNonNull(name, "name");
    this.stateFips = Objects.requireNonNull(stateFips, "stateFips");
    this.areaCode = Objects.requireNonNull(areaCode, "areaCode");
    if (stateFips.length() != 2 || areaCode.length() != 5) {
      throw new IllegalArgumentException("Metro " + name + " must have a 2-digit state FIPS"
          + " and a 5-digit area code, got " + stateFips + "/" + areaCode);
    }
  }

  /** Display name, e.g. "Portland-Vancouver-Hillsboro, OR-WA". */
  public String getName() {
    return name;
  }

  public String getStateFips() {
    return stateFips;
  }

  public String getAreaCode() {
    return areaCode;
  }

  /** The 7-digit metro code (state FIPS + area code) used as region_id. */
  public String getCode() {
    return stateFips + areaCode;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetroArea)) {
      return false;
    }
    MetroArea that = (MetroArea) o;
    return name.equals(that.name) && getCode().equals(that.getCode());
  }

  @Override public int hashCode() {
    return Objects.hash(name, stateFips, areaCode);
  }

  @Override public String toString() {
    return name + " (" + getCode() + ")";
  }
}
