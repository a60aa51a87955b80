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

package com.logicalclocks.hsdq.engine;

import com.logicalclocks.hsdq.DataQualityException;
import com.logicalclocks.hsdq.DimensionMismatchException;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.metadata.CheckStatus;
import com.logicalclocks.hsdq.metadata.MetricCheck;
import com.logicalclocks.hsdq.metadata.ModelMetrics;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TestModelMetricsEvaluator {

  @Test
  void testPerfectPredictions() throws Exception {
    // Arrange
    ModelMetricsEvaluator evaluator = new ModelMetricsEvaluator(ThresholdConfig.defaults());

    // Act
    ModelMetrics metrics = evaluator.evaluate(new double[] {100, 200, 300}, new double[] {100, 200, 300});

    // Assert
    Assertions.assertEquals(0.0, metrics.getMse());
    Assertions.assertEquals(0.0, metrics.getRmse());
    Assertions.assertEquals(0.0, metrics.getMae());
    Assertions.assertEquals(1.0, metrics.getR2());
    Assertions.assertEquals(3, metrics.getSampleSize());
    Assertions.assertTrue(metrics.getChecks().isEmpty());
    Assertions.assertEquals(CheckStatus.PASSED, metrics.getStatus());
  }

  @Test
  void testErrorsAndThresholds() throws Exception {
    // Arrange
    ThresholdConfig config = ThresholdConfig.builder()
        .rmseThreshold(0.5)
        .maeThreshold(2.0)
        .r2Threshold(0.0)
        .build();
    ModelMetricsEvaluator evaluator = new ModelMetricsEvaluator(config);

    // Act
    ModelMetrics metrics = evaluator.evaluate(new double[] {1, 2, 3}, new double[] {2, 3, 4});

    // Assert
    Assertions.assertEquals(1.0, metrics.getMse(), 1e-9);
    Assertions.assertEquals(1.0, metrics.getRmse(), 1e-9);
    Assertions.assertEquals(1.0, metrics.getMae(), 1e-9);
    Assertions.assertEquals(-0.5, metrics.getR2(), 1e-9);
    Assertions.assertEquals(3, metrics.getChecks().size());
    MetricCheck rmse = metrics.getChecks().get(0);
    Assertions.assertEquals("rmse", rmse.getMetric());
    Assertions.assertEquals(MetricCheck.Bound.MAX, rmse.getBound());
    Assertions.assertFalse(rmse.isPassed());
    Assertions.assertTrue(metrics.getChecks().get(1).isPassed());
    Assertions.assertFalse(metrics.getChecks().get(2).isPassed());
    Assertions.assertEquals(CheckStatus.FAILED, metrics.getStatus());
  }

  @Test
  void testConstantGroundTruthHasNoR2() throws Exception {
    // Arrange
    ThresholdConfig config = ThresholdConfig.builder().r2Threshold(0.5).build();
    ModelMetricsEvaluator evaluator = new ModelMetricsEvaluator(config);

    // Act
    ModelMetrics metrics = evaluator.evaluate(new double[] {9, 10, 11}, new double[] {10, 10, 10});

    // Assert
    Assertions.assertNull(metrics.getR2());
    Assertions.assertFalse(metrics.asMap().containsKey("r2"));
    Assertions.assertFalse(metrics.getChecks().get(0).isPassed());
    Assertions.assertEquals(CheckStatus.FAILED, metrics.getStatus());
  }

  @Test
  void testLengthMismatch() {
    // Arrange
    ModelMetricsEvaluator evaluator = new ModelMetricsEvaluator(ThresholdConfig.defaults());

    // Act
    DimensionMismatchException exception = Assertions.assertThrows(DimensionMismatchException.class,
        () -> evaluator.evaluate(new double[] {1, 2, 3}, new double[] {1, 2}));

    // Assert
    Assertions.assertEquals("actual", exception.getSequence());
    Assertions.assertEquals(3, exception.getExpected());
    Assertions.assertEquals(2, exception.getActual());
  }

  @Test
  void testEmptyInput() {
    // Arrange
    ModelMetricsEvaluator evaluator = new ModelMetricsEvaluator(ThresholdConfig.defaults());

    // Act
    // Assert
    Assertions.assertThrows(DataQualityException.class, () -> evaluator.evaluate(new double[0], new double[0]));
  }
}
