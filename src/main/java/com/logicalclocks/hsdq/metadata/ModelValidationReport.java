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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"model_name", "model_version", "timestamp", "metrics", "bias_analysis", "healthcare_validation",
    "compliance_status"})
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelValidationReport {

  @Getter @Setter
  private String modelName;
  @Getter @Setter
  private String modelVersion;
  @Getter @Setter
  private String timestamp;
  @Getter @Setter
  private ModelMetrics metrics;
  @Getter @Setter
  private Map<String, AttributeBiasAnalysis> biasAnalysis;
  @Getter @Setter
  private HealthcareValidation healthcareValidation;
  @Getter @Setter
  private ComplianceStatus complianceStatus;

  @Override
  public String toString() {
    return "ModelValidationReport{"
      + "modelName='" + modelName + '\''
      + ", modelVersion='" + modelVersion + '\''
      + ", timestamp='" + timestamp + '\''
      + ", metrics=" + metrics
      + ", complianceStatus=" + complianceStatus
      + '}';
  }
}
