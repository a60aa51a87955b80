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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

class TestThresholdConfig {

  @Test
  void testDefaults() {
    // Act
    ThresholdConfig config = ThresholdConfig.defaults();

    // Assert
    Assertions.assertEquals(5.0, config.getNullPctMax());
    Assertions.assertEquals(3.0, config.getZscoreMax());
    Assertions.assertEquals(1.1, config.getBiasThreshold());
    Assertions.assertEquals(30, config.getMinGroupSize());
    Assertions.assertNull(config.getRmseThreshold());
    Assertions.assertNull(config.getRegulatoryMinR2());
    Assertions.assertEquals(ValueRange.of(10, 70), config.getValidRange("bmi"));
    Assertions.assertEquals(DistributionReference.of(13000, 5000), config.getReference("charges"));
    Assertions.assertNull(config.getBinWidth("age"));
  }

  @Test
  void testIsAllowedValueIgnoresCase() {
    // Arrange
    ThresholdConfig config = ThresholdConfig.builder()
        .allowedValues(ImmutableMap.of("sex", ImmutableSet.of("Male", "Female")))
        .build();

    // Act
    // Assert
    Assertions.assertTrue(config.isAllowedValue("sex", "MALE"));
    Assertions.assertTrue(config.isAllowedValue("sex", "female"));
    Assertions.assertFalse(config.isAllowedValue("sex", "unknown"));
    Assertions.assertTrue(config.isAllowedValue("region", "anything"));
  }

  @Test
  void testFromProperties() throws Exception {
    // Arrange
    Properties properties = new Properties();
    properties.setProperty("null_pct_max", "10");
    properties.setProperty("rmse_threshold", "2500.5");
    properties.setProperty("min_group_size", "50");
    properties.setProperty("valid_range.bmi", "15, 60");
    properties.setProperty("allowed_values.smoker", "yes,no,former");
    properties.setProperty("bin_width.age", "10");
    properties.setProperty("reference.bmi", "30.6,6.1");

    // Act
    ThresholdConfig config = ThresholdConfig.fromProperties(properties);

    // Assert
    Assertions.assertEquals(10.0, config.getNullPctMax());
    Assertions.assertEquals(2500.5, config.getRmseThreshold());
    Assertions.assertEquals(50, config.getMinGroupSize());
    Assertions.assertEquals(ValueRange.of(15, 60), config.getValidRange("bmi"));
    Assertions.assertEquals(ValueRange.of(0, 120), config.getValidRange("age"));
    Assertions.assertTrue(config.isAllowedValue("smoker", "former"));
    Assertions.assertEquals(10.0, config.getBinWidth("age"));
    Assertions.assertEquals(DistributionReference.of(30.6, 6.1), config.getReference("bmi"));
    Assertions.assertEquals(DistributionReference.of(13000, 5000), config.getReference("charges"));
  }

  @Test
  void testFromPropertiesMalformedValue() {
    // Arrange
    Properties properties = new Properties();
    properties.setProperty("zscore_max", "three");

    // Act
    DataQualityException exception =
        Assertions.assertThrows(DataQualityException.class, () -> ThresholdConfig.fromProperties(properties));

    // Assert
    Assertions.assertEquals("Invalid value for `zscore_max`: three", exception.getMessage());
  }

  @Test
  void testFromPropertiesInvalidRange() {
    // Arrange
    Properties properties = new Properties();
    properties.setProperty("valid_range.age", "120,0");

    // Act
    // Assert
    Assertions.assertThrows(DataQualityException.class, () -> ThresholdConfig.fromProperties(properties));
  }

  @Test
  void testNonPositiveZscoreMax() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> ThresholdConfig.builder().zscoreMax(0.0).build());
  }
}
