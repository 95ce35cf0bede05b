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

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable (category slug, year) pair identifying one partition directory.
 */
public final class PartitionKey implements Comparable<PartitionKey> {
  private static final Comparator<PartitionKey> ORDER =
      Comparator.comparing(PartitionKey::getSlug).thenComparingInt(PartitionKey::getYear);

  private final String slug;
  private final int year;

  public PartitionKey(String slug, int year) {
    this.slug = Objects.requireNonNull(slug, "slug");
    this.year = year;
  }

  public String getSlug() {
    return slug;
  }

  public int getYear() {
    return year;
  }

  /**
   * Resolves the directory of this partition below a dataset root.
   *
   * @param datasetRoot Dataset root directory
   * @param partitionColumn Name of the category partition level
   * @return {@code <root>/<partitionColumn>=<slug>/year=<year>}
   */
  public Path resolve(Path datasetRoot, String partitionColumn) {
    return datasetRoot
        .resolve(partitionColumn + "=" + slug)
        .resolve(PartitionSpec.YEAR_COLUMN + "=" + year);
  }

  @Override public int compareTo(PartitionKey o) {
    return ORDER.compare(this, o);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PartitionKey)) {
      return false;
    }
    PartitionKey that = (PartitionKey) o;
    return year == that.year && slug.equals(that.slug);
  }

  @Override public int hashCode() {
    return Objects.hash(slug, year);
  }

  @Override public String toString() {
    return slug + "/" + year;
  }
}
