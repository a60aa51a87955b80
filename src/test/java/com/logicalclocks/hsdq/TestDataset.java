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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

class TestDataset {

  @Test
  void testOfKeepsColumnOrderOfFirstRecord() throws Exception {
    // Arrange
    List<Map<String, Object>> records = Arrays.asList(
        Records.record("age", 19, "sex", "female", "charges", 16884.92),
        Records.record("charges", 1725.55, "age", 18, "sex", "male"));

    // Act
    Dataset dataset = Dataset.of(records);

    // Assert
    Assertions.assertEquals(Arrays.asList("age", "sex", "charges"), dataset.getColumns());
    Assertions.assertEquals(2, dataset.size());
    Assertions.assertEquals(Arrays.asList(19, 18), dataset.column("age"));
  }

  @Test
  void testOfNonUniformRecords() {
    // Arrange
    List<Map<String, Object>> records = Arrays.asList(
        Records.record("age", 19, "sex", "female"),
        Records.record("age", 18));

    // Act
    DataLoadException exception = Assertions.assertThrows(DataLoadException.class, () -> Dataset.of(records));

    // Assert
    Assertions.assertTrue(exception.getMessage().startsWith("Record 1 has columns"));
  }

  @Test
  void testOfUnsupportedValue() {
    // Arrange
    List<Map<String, Object>> records = Collections.singletonList(Records.record("tags", Arrays.asList("a", "b")));

    // Act
    // Assert
    Assertions.assertThrows(DataLoadException.class, () -> Dataset.of(records));
  }

  @Test
  void testOfEmpty() throws Exception {
    // Act
    Dataset dataset = Dataset.of(Collections.emptyList());

    // Assert
    Assertions.assertTrue(dataset.isEmpty());
    Assertions.assertTrue(dataset.getColumns().isEmpty());
  }

  @Test
  void testColumnMissing() throws Exception {
    // Arrange
    Dataset dataset = Records.insurance();

    // Act
    // Assert
    Assertions.assertThrows(IllegalArgumentException.class, () -> dataset.column("height"));
  }

  @Test
  void testIsNumeric() throws Exception {
    // Arrange
    Dataset dataset = Dataset.of(Arrays.asList(
        Records.record("bmi", 27.9, "sex", "male", "blank", null),
        Records.record("bmi", null, "sex", "female", "blank", null)));

    // Act
    // Assert
    Assertions.assertTrue(dataset.isNumeric("bmi"));
    Assertions.assertFalse(dataset.isNumeric("sex"));
    Assertions.assertFalse(dataset.isNumeric("blank"));
  }
}
