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
import com.logicalclocks.hsdq.util.Constants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Regression accuracy of a model. {@code r2} is null when the ground truth is constant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelMetrics {

  @Getter @Setter
  private double mse;
  @Getter @Setter
  private double rmse;
  @Getter @Setter
  private double mae;
  @Getter @Setter
  private Double r2;
  @Getter @Setter
  private int sampleSize;
  @Getter @Setter
  private List<MetricCheck> checks;
  @Getter @Setter
  private CheckStatus status;

  /**
   * Named metric values, skipping undefined ones.
   */
  public Map<String, Double> asMap() {
    Map<String, Double> values = new LinkedHashMap<>();
    values.put(Constants.MSE, mse);
    values.put(Constants.RMSE, rmse);
    values.put(Constants.MAE, mae);
    if (r2 != null) {
      values.put(Constants.R2, r2);
    }
    return values;
  }

  @Override
  public String toString() {
    return "ModelMetrics{"
      + "mse=" + mse
      + ", rmse=" + rmse
      + ", mae=" + mae
      + ", r2=" + r2
      + ", status=" + status
      + '}';
  }
}
