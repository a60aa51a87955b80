/*
 * Copyright (c) 2024 Hopsworks AB
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.logicalclocks.hsdq;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, fully materialized table of records. Every record carries the same column set.
 *
 * <p>Supported values are {@link Number}, {@link String}, {@link Boolean} and null.
 */
public class Dataset {

  private static final Dataset EMPTY = new Dataset(Collections.emptyList(), Collections.emptyList());

  @Getter
  private final List<String> columns;

  @Getter
  private final List<Map<String, Object>> records;

  private Dataset(List<String> columns, List<Map<String, Object>> records) {
    this.columns = columns;
    this.records = records;
  }

  public static Dataset empty() {
    return EMPTY;
  }

  /**
   * Materialize a dataset from records. Column order follows the first record.
   *
   * @param records records keyed by column name
   * @return immutable dataset
   * @throws DataLoadException if the records do not share one column set or hold unsupported values
   */
  public static Dataset of(List<? extends Map<String, ?>> records) throws DataLoadException {
    if (records == null) {
      throw new DataLoadException("No records supplied");
    }
    if (records.isEmpty()) {
      return EMPTY;
    }

    Set<String> columnSet = new LinkedHashSet<>(records.get(0).keySet());
    List<Map<String, Object>> copies = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      Map<String, ?> record = records.get(i);
      if (record == null) {
        throw new DataLoadException("Record " + i + " is null");
      }
      if (!columnSet.equals(record.keySet())) {
        throw new DataLoadException("Record " + i + " has columns " + record.keySet()
            + " but the dataset has columns " + columnSet);
      }
      Map<String, Object> copy = new LinkedHashMap<>();
      for (String column : columnSet) {
        Object value = record.get(column);
        if (value != null && !(value instanceof Number || value instanceof String || value instanceof Boolean)) {
          throw new DataLoadException("Unsupported value of type " + value.getClass().getName()
              + " in record " + i + ", column `" + column + "`");
        }
        copy.put(column, value);
      }
      copies.add(Collections.unmodifiableMap(copy));
    }
    return new Dataset(Collections.unmodifiableList(new ArrayList<>(columnSet)),
        Collections.unmodifiableList(copies));
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Values of one column in record order, nulls included.
   */
  public List<Object> column(String column) {
    if (!hasColumn(column)) {
      throw new IllegalArgumentException("Column `" + column + "` does not exist in the dataset");
    }
    List<Object> values = new ArrayList<>(records.size());
    for (Map<String, Object> record : records) {
      values.add(record.get(column));
    }
    return values;
  }

  /**
   * Whether every non-null value of the column is a number and at least one such value exists.
   */
  public boolean isNumeric(String column) {
    boolean seen = false;
    for (Object value : column(column)) {
      if (value == null) {
        continue;
      }
      if (!(value instanceof Number)) {
        return false;
      }
      seen = true;
    }
    return seen;
  }

  @Override
  public String toString() {
    return "Dataset{"
      + "columns=" + columns
      + ", size=" + records.size()
      + '}';
  }
}
