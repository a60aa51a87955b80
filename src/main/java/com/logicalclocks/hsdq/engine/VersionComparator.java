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

import com.logicalclocks.hsdq.metadata.ModelMetrics;
import com.logicalclocks.hsdq.metadata.ModelValidationReport;
import com.logicalclocks.hsdq.metadata.VersionComparison;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares the metrics of two validated model versions.
 */
public class VersionComparator {

  private static final Logger LOGGER = LoggerFactory.getLogger(VersionComparator.class);

  // relative changes in percent
  public static final double SIGNIFICANT_CHANGE = 5.0;
  public static final double HIGH_CHANGE = 10.0;

  /**
   * Per metric deltas {@code base - other}, as a percentage of the {@code other} value. Only metrics defined
   * in both reports are compared. A change above {@link #SIGNIFICANT_CHANGE} percent is significant, above
   * {@link #HIGH_CHANGE} percent it is high severity.
   */
  public VersionComparison compare(@NonNull ModelValidationReport base, @NonNull ModelValidationReport other) {
    Map<String, Double> baseMetrics = metricsOf(base);
    Map<String, Double> otherMetrics = metricsOf(other);

    Map<String, VersionComparison.MetricDelta> deltas = new LinkedHashMap<>();
    List<VersionComparison.SignificantChange> significantChanges = new ArrayList<>();
    for (Map.Entry<String, Double> entry : baseMetrics.entrySet()) {
      Double compared = otherMetrics.get(entry.getKey());
      if (compared == null) {
        continue;
      }
      double absoluteChange = entry.getValue() - compared;
      Double percentageChange = compared != 0.0 ? absoluteChange / compared * 100.0 : null;
      deltas.put(entry.getKey(), new VersionComparison.MetricDelta(absoluteChange, percentageChange));

      if (percentageChange != null && Math.abs(percentageChange) > SIGNIFICANT_CHANGE) {
        significantChanges.add(VersionComparison.SignificantChange.builder()
            .metric(entry.getKey())
            .change(percentageChange)
            .severity(Math.abs(percentageChange) > HIGH_CHANGE
                ? VersionComparison.Severity.HIGH : VersionComparison.Severity.MEDIUM)
            .build());
      }
    }

    if (!significantChanges.isEmpty()) {
      LOGGER.warn("{} significant metric changes between versions {} and {}", significantChanges.size(),
          base.getModelVersion(), other.getModelVersion());
    }
    return VersionComparison.builder()
        .timestamp(Instant.now().toString())
        .baseVersion(base.getModelVersion())
        .compareVersion(other.getModelVersion())
        .metricDeltas(deltas)
        .significantChanges(significantChanges)
        .build();
  }

  private static Map<String, Double> metricsOf(ModelValidationReport report) {
    ModelMetrics metrics = report.getMetrics();
    return metrics != null ? metrics.asMap() : new LinkedHashMap<>();
  }
}
