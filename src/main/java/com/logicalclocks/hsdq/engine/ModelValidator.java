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
import com.logicalclocks.hsdq.ModelValidationInput;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.metadata.AttributeBiasAnalysis;
import com.logicalclocks.hsdq.metadata.HealthcareValidation;
import com.logicalclocks.hsdq.metadata.ModelMetrics;
import com.logicalclocks.hsdq.metadata.ModelValidationReport;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Validates one model version end to end: accuracy metrics, bias across protected attributes and, when the
 * output type is known, the healthcare domain rules.
 */
public class ModelValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelValidator.class);

  @Getter
  private final String modelName;
  @Getter
  private final String modelVersion;
  @Getter
  private final ThresholdConfig config;

  private final ModelMetricsEvaluator metricsEvaluator;
  private final BiasAnalyzer biasAnalyzer;
  private final HealthcareRuleValidator healthcareRuleValidator;

  @Builder
  public ModelValidator(@NonNull String modelName, @NonNull String modelVersion, ThresholdConfig config) {
    this.modelName = modelName;
    this.modelVersion = modelVersion;
    this.config = config != null ? config : ThresholdConfig.defaults();
    this.metricsEvaluator = new ModelMetricsEvaluator(this.config);
    this.biasAnalyzer = new BiasAnalyzer(this.config);
    this.healthcareRuleValidator = new HealthcareRuleValidator(this.config);
  }

  public ModelValidationReport validate(@NonNull ModelValidationInput input) throws DataQualityException {
    LOGGER.info("Validating model {} version {} on {} predictions", modelName, modelVersion,
        input.getPredictions().length);

    ModelMetrics metrics = metricsEvaluator.evaluate(input.getPredictions(), input.getActual());

    Map<String, AttributeBiasAnalysis> biasAnalysis = Collections.emptyMap();
    if (input.getProtectedAttributes() != null && !input.getProtectedAttributes().isEmpty()) {
      biasAnalysis = biasAnalyzer.analyze(input.getPredictions(), input.getActual(),
          input.getProtectedAttributes());
    } else {
      LOGGER.debug("No protected attributes supplied, skipping bias analysis");
    }

    HealthcareValidation healthcareValidation = null;
    if (input.getOutputType() != null) {
      healthcareValidation = healthcareRuleValidator.validate(input.getPredictions(), input.getOutputType(),
          biasAnalysis, metrics, input.getClinicalContext());
    }

    ModelValidationReport report = ModelValidationReport.builder()
        .modelName(modelName)
        .modelVersion(modelVersion)
        .timestamp(Instant.now().toString())
        .metrics(metrics)
        .biasAnalysis(biasAnalysis)
        .healthcareValidation(healthcareValidation)
        .complianceStatus(BiasAnalyzer.complianceStatus(biasAnalysis))
        .build();
    LOGGER.info("Model {} version {}: metrics {}, compliance {}", modelName, modelVersion, metrics.getStatus(),
        report.getComplianceStatus());
    return report;
  }
}
