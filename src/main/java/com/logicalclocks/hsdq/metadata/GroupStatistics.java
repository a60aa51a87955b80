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
 * Prediction statistics of one group of a protected attribute.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GroupStatistics {

  @Getter @Setter
  private String attributeName;
  @Getter @Setter
  private String groupValue;
  @Getter @Setter
  private int size;
  @Getter @Setter
  private double meanPrediction;
  @Getter @Setter
  private double stdPrediction;
  @Getter @Setter
  private double outcomeRate;
  @Getter @Setter
  private double predictionRate;
  @Getter @Setter
  private double falsePositiveRate;
  // group smaller than the configured minimum, its statistics are noisy
  @Getter @Setter
  private boolean lowConfidence;

  @Override
  public String toString() {
    return "GroupStatistics{"
      + "attributeName='" + attributeName + '\''
      + ", groupValue='" + groupValue + '\''
      + ", size=" + size
      + ", meanPrediction=" + meanPrediction
      + ", stdPrediction=" + stdPrediction
      + ", outcomeRate=" + outcomeRate
      + ", falsePositiveRate=" + falsePositiveRate
      + ", lowConfidence=" + lowConfidence
      + '}';
  }
}
