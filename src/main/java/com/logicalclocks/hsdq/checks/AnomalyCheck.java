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

package com.logicalclocks.hsdq.checks;

import com.google.common.collect.ImmutableList;
import com.logicalclocks.hsdq.Dataset;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.ValueRange;
import com.logicalclocks.hsdq.metadata.CheckResult;
import com.logicalclocks.hsdq.metadata.Issue;
import com.logicalclocks.hsdq.metadata.IssueType;
import com.logicalclocks.hsdq.util.Constants;
import lombok.Getter;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Detects statistical outliers and physically impossible values in numeric columns.
 *
 * <p>A value is a soft anomaly when its population z-score exceeds {@code zscore_max}; a constant column
 * has no anomalies. Independently, a value outside the column's valid range is a hard bound violation.
 * Hard bound violations fail the check, soft anomalies alone only raise a warning.
 */
public class AnomalyCheck implements Check {

  // null means every numeric column
  @Getter
  private final List<String> columns;

  public AnomalyCheck() {
    this.columns = null;
  }

  public AnomalyCheck(List<String> columns) {
    this.columns = columns != null ? ImmutableList.copyOf(columns) : null;
  }

  @Override
  public String getName() {
    return Constants.ANOMALY_CHECK;
  }

  @Override
  public CheckResult run(Dataset dataset, ThresholdConfig config) {
    if (dataset.isEmpty()) {
      return emptyDatasetResult();
    }

    List<Issue> issues = new ArrayList<>();
    for (String column : columnsToCheck(dataset)) {
      double[] values = numericValues(dataset, column);
      if (values.length == 0) {
        continue;
      }

      double mean = new Mean().evaluate(values);
      double std = new StandardDeviation(false).evaluate(values);
      long anomalies = countAnomalies(values, mean, std, config.getZscoreMax());
      if (anomalies > 0) {
        issues.add(Issue.builder()
            .type(IssueType.ZSCORE_ANOMALY)
            .column(column)
            .count(anomalies)
            .details(String.format(Locale.ROOT,
                "Found %d values (%.2f%%) in column %s with |z| > %.2f (mean=%.4f, std=%.4f)",
                anomalies, 100.0 * anomalies / values.length, column, config.getZscoreMax(), mean, std))
            .build());
      }

      ValueRange range = config.getValidRange(column);
      if (range != null) {
        long outOfRange = 0;
        for (double value : values) {
          if (!range.contains(value)) {
            outOfRange++;
          }
        }
        if (outOfRange > 0) {
          issues.add(Issue.builder()
              .type(IssueType.OUT_OF_RANGE)
              .column(column)
              .count(outOfRange)
              .details("Found " + outOfRange + " values outside range " + range + " in column " + column)
              .build());
        }
      }
    }

    return CheckResult.builder()
        .checkName(getName())
        .status(CheckResult.statusOf(issues))
        .issues(issues)
        .build();
  }

  /**
   * Number of values whose absolute z-score exceeds the threshold. Zero when the standard deviation is zero.
   */
  public static long countAnomalies(double[] values, double mean, double std, double zscoreMax) {
    if (std == 0 || Double.isNaN(std)) {
      return 0;
    }
    long anomalies = 0;
    for (double value : values) {
      if (Math.abs((value - mean) / std) > zscoreMax) {
        anomalies++;
      }
    }
    return anomalies;
  }

  private List<String> columnsToCheck(Dataset dataset) {
    List<String> selected = new ArrayList<>();
    if (columns == null) {
      for (String column : dataset.getColumns()) {
        if (dataset.isNumeric(column)) {
          selected.add(column);
        }
      }
    } else {
      for (String column : columns) {
        if (dataset.hasColumn(column)) {
          selected.add(column);
        }
      }
    }
    return selected;
  }

  private static double[] numericValues(Dataset dataset, String column) {
    List<Object> raw = dataset.column(column);
    List<Double> values = new ArrayList<>(raw.size());
    for (int i = 0; i < raw.size(); i++) {
      Object value = raw.get(i);
      if (value == null) {
        continue;
      }
      if (!(value instanceof Number)) {
        throw new IllegalStateException("Column `" + column + "` holds non-numeric value '" + value
            + "' in record " + i);
      }
      values.add(((Number) value).doubleValue());
    }
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }
}
