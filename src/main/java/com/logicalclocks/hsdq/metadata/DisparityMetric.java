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

/**
 * Gap between the groups with the highest and the lowest value of a statistic.
 * The ratio is null when the lowest value is zero or negative.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DisparityMetric {

  @Getter @Setter
  private Double ratio;
  @Getter @Setter
  private double difference;
  @Getter @Setter
  private String maxGroup;
  @Getter @Setter
  private String minGroup;

  @Override
  public String toString() {
    return "DisparityMetric{"
      + "ratio=" + ratio
      + ", difference=" + difference
      + ", maxGroup='" + maxGroup + '\''
      + ", minGroup='" + minGroup + '\''
      + '}';
  }
}
