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
import com.logicalclocks.hsdq.util.Constants;
import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes regression accuracy metrics of predictions against ground truth and compares them with the
 * configured thresholds.
 */
public class ModelMetricsEvaluator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelMetricsEvaluator.class);

  @Getter
  private final ThresholdConfig config;

  public ModelMetricsEvaluator(@NonNull ThresholdConfig config) {
    this.config = config;
  }

  /**
   * Compute mse, rmse, mae and r2.
   *
   * @param predictions predicted values
   * @param actual ground truth aligned with the predictions
   * @return metrics and their threshold checks
   * @throws DimensionMismatchException if the sequences differ in length
   * @throws DataQualityException if there are no predictions
   */
  public ModelMetrics evaluate(@NonNull double[] predictions, @NonNull double[] actual)
      throws DataQualityException {
    if (predictions.length != actual.length) {
      throw new DimensionMismatchException("actual", predictions.length, actual.length);
    }
    if (predictions.length == 0) {
      throw new DataQualityException("There are no predictions to evaluate");
    }

    double squaredErrors = 0;
    double absoluteErrors = 0;
    for (int i = 0; i < predictions.length; i++) {
      double error = predictions[i] - actual[i];
      squaredErrors += error * error;
      absoluteErrors += Math.abs(error);
    }
    double mse = squaredErrors / predictions.length;
    double mae = absoluteErrors / predictions.length;

    double actualMean = StatUtils.mean(actual);
    double totalSumOfSquares = 0;
    for (double value : actual) {
      totalSumOfSquares += (value - actualMean) * (value - actualMean);
    }
    // r2 is undefined for a constant ground truth
    Double r2 = totalSumOfSquares == 0 ? null : 1 - squaredErrors / totalSumOfSquares;

    ModelMetrics metrics = ModelMetrics.builder()
        .mse(mse)
        .rmse(Math.sqrt(mse))
        .mae(mae)
        .r2(r2)
        .sampleSize(predictions.length)
        .build();
    List<MetricCheck> checks = checkThresholds(metrics);
    metrics.setChecks(checks);
    metrics.setStatus(checks.stream().allMatch(MetricCheck::isPassed) ? CheckStatus.PASSED : CheckStatus.FAILED);

    LOGGER.info("Evaluated {} predictions: rmse={}, mae={}, r2={}", predictions.length, metrics.getRmse(),
        metrics.getMae(), r2);
    return metrics;
  }

  private List<MetricCheck> checkThresholds(ModelMetrics metrics) {
    List<MetricCheck> checks = new ArrayList<>();
    if (config.getRmseThreshold() != null) {
      checks.add(atMost(Constants.RMSE, metrics.getRmse(), config.getRmseThreshold()));
    }
    if (config.getMaeThreshold() != null) {
      checks.add(atMost(Constants.MAE, metrics.getMae(), config.getMaeThreshold()));
    }
    if (config.getR2Threshold() != null) {
      Double r2 = metrics.getR2();
      checks.add(MetricCheck.builder()
          .metric(Constants.R2)
          .value(r2)
          .threshold(config.getR2Threshold())
          .bound(MetricCheck.Bound.MIN)
          .passed(r2 != null && r2 >= config.getR2Threshold())
          .build());
    }
    return checks;
  }

  private static MetricCheck atMost(String metric, double value, double threshold) {
    return MetricCheck.builder()
        .metric(metric)
        .value(value)
        .threshold(threshold)
        .bound(MetricCheck.Bound.MAX)
        .passed(value <= threshold)
        .build();
  }
}
