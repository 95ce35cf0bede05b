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

import java.util.Objects;

/**
 * Name and storage type of one canonical table column.
 */
public final class TableColumn {
  private final String name;
  private final ColumnType type;

  public TableColumn(String name, ColumnType type) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("column name cannot be null or empty");
    }
    this.name = name;
    this.type = Objects.requireNonNull(type, "type");
  }

  public static TableColumn of(String name, ColumnType type) {
    return new TableColumn(name, type);
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableColumn)) {
      return false;
    }
    TableColumn that = (TableColumn) o;
    return name.equals(that.name) && type == that.type;
  }

  @Override public int hashCode() {
    return Objects.hash(name, type);
  }

  @Override public String toString() {
    return name + " " + type.getSqlType();
  }
}
