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

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttributeBiasAnalysis {

  @Getter @Setter
  private String attributeName;
  @Getter @Setter
  private Double binWidth;
  @Getter @Setter
  private Map<String, GroupStatistics> groups;
  @Getter @Setter
  private Map<String, DisparityMetric> disparityMetrics;
  @Getter @Setter
  private boolean flagged;

  public DisparityMetric getDisparity(String metric) {
    return disparityMetrics != null ? disparityMetrics.get(metric) : null;
  }

  @Override
  public String toString() {
    return "AttributeBiasAnalysis{"
      + "attributeName='" + attributeName + '\''
      + ", groups=" + groups
      + ", disparityMetrics=" + disparityMetrics
      + ", flagged=" + flagged
      + '}';
  }
}
