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

package com.logicalclocks.hsdq.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VersionComparison {

  @Getter @Setter
  private String timestamp;
  @Getter @Setter
  private String baseVersion;
  @Getter @Setter
  private String compareVersion;
  @Getter @Setter
  private Map<String, MetricDelta> metricDeltas;
  @Getter @Setter
  private List<SignificantChange> significantChanges;

  @NoArgsConstructor
  @AllArgsConstructor
  @Builder
  public static class MetricDelta {
    @Getter @Setter
    private double absoluteChange;
    // null when the compared value is zero
    @Getter @Setter
    private Double percentageChange;
  }

  @NoArgsConstructor
  @AllArgsConstructor
  @Builder
  public static class SignificantChange {
    @Getter @Setter
    private String metric;
    @Getter @Setter
    private double change;
    @Getter @Setter
    private Severity severity;
  }

  public enum Severity {
    MEDIUM,
    HIGH
  }

  @Override
  public String toString() {
    return "VersionComparison{"
      + "baseVersion='" + baseVersion + '\''
      + ", compareVersion='" + compareVersion + '\''
      + ", metricDeltas=" + metricDeltas
      + ", significantChanges=" + significantChanges
      + '}';
  }
}
