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

import com.logicalclocks.hsdq.ClinicalContext;
import com.logicalclocks.hsdq.DataQualityException;
import com.logicalclocks.hsdq.DistributionReference;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.ValueRange;
import com.logicalclocks.hsdq.metadata.AttributeBiasAnalysis;
import com.logicalclocks.hsdq.metadata.DisparityMetric;
import com.logicalclocks.hsdq.metadata.HealthcareValidation;
import com.logicalclocks.hsdq.metadata.ModelMetrics;
import com.logicalclocks.hsdq.metadata.RuleResult;
import com.logicalclocks.hsdq.util.Constants;
import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Healthcare domain rules on model outputs, independent of the statistical data checks.
 *
 * <ul>
 *   <li>distribution: output mean and std against the reference of the output type</li>
 *   <li>clinical: outputs within the valid range of the output type, plus context specific limits</li>
 *   <li>regulatory: bias limits against a hard ceiling, and optionally a minimum r2</li>
 * </ul>
 */
public class HealthcareRuleValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(HealthcareRuleValidator.class);

  public static final String UNSUPPORTED_OUTPUT_TYPE = "unsupported_output_type";
  public static final String EMERGENCY_COST_CHECK = "emergency_cost_check";
  public static final String PEDIATRIC_BMI_CHECK = "pediatric_bmi_check";
  public static final String BIAS_THRESHOLD_CEILING = "bias_threshold_ceiling";
  public static final String MAXIMUM_BIAS = "maximum_bias";
  public static final String MINIMUM_R2 = "minimum_r2";

  @Getter
  private final ThresholdConfig config;

  public HealthcareRuleValidator(@NonNull ThresholdConfig config) {
    this.config = config;
  }

  public static String distributionRuleName(String outputType) {
    return outputType + "_distribution_check";
  }

  public static String rangeRuleName(String outputType) {
    return outputType + "_range_check";
  }

  /**
   * Apply every rule that fits the output type and the supplied context.
   *
   * @param outputs model outputs
   * @param outputType kind of output, e.g. {@code charges} or {@code bmi}
   * @param biasAnalysis bias analysis of the same predictions, may be null
   * @param metrics accuracy metrics of the same predictions, may be null
   * @param context clinical context, may be null
   * @return rule results
   * @throws DataQualityException if there are no outputs
   */
  public HealthcareValidation validate(@NonNull double[] outputs, @NonNull String outputType,
                                       Map<String, AttributeBiasAnalysis> biasAnalysis, ModelMetrics metrics,
                                       ClinicalContext context) throws DataQualityException {
    if (outputs.length == 0) {
      throw new DataQualityException("Empty outputs array provided");
    }

    List<RuleResult> rules = new ArrayList<>();
    DistributionReference reference = config.getReference(outputType);
    ValueRange range = config.getValidRange(outputType);
    if (reference != null) {
      rules.add(distributionRule(outputs, outputType, reference));
    }
    if (range != null) {
      rules.add(rangeRule(outputs, outputType, range));
    }
    if (reference == null && range == null) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("output_type", outputType);
      rules.add(RuleResult.builder()
          .name(UNSUPPORTED_OUTPUT_TYPE)
          .description("No valid range or reference distribution is configured for the output type")
          .category(RuleResult.Category.CLINICAL)
          .passed(false)
          .details(details)
          .build());
    }
    if (context != null) {
      rules.addAll(contextRules(outputs, outputType, context));
    }
    rules.addAll(regulatoryRules(biasAnalysis, metrics));

    boolean clinicallyValid = allPassed(rules, RuleResult.Category.CLINICAL);
    boolean regulatoryCompliant = allPassed(rules, RuleResult.Category.REGULATORY);
    HealthcareValidation validation = HealthcareValidation.builder()
        .outputType(outputType)
        .timestamp(Instant.now().toString())
        .rules(rules)
        .clinicallyValid(clinicallyValid)
        .regulatoryCompliant(regulatoryCompliant)
        .passed(rules.stream().allMatch(RuleResult::isPassed))
        .build();
    LOGGER.info("Healthcare validation of {} outputs of type {}: clinically valid={}, regulatory compliant={}",
        outputs.length, outputType, clinicallyValid, regulatoryCompliant);
    return validation;
  }

  private RuleResult distributionRule(double[] outputs, String outputType, DistributionReference reference) {
    double actualMean = StatUtils.mean(outputs);
    double actualStd = new StandardDeviation(false).evaluate(outputs);
    double meanDifference = Math.abs(actualMean - reference.getExpectedMean());
    double stdDifference = Math.abs(actualStd - reference.getExpectedStd());
    double tolerance = config.getDistributionTolerance() * reference.getExpectedStd();

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("expected_mean", reference.getExpectedMean());
    details.put("actual_mean", actualMean);
    details.put("expected_std", reference.getExpectedStd());
    details.put("actual_std", actualStd);
    details.put("mean_difference", meanDifference);
    details.put("std_difference", stdDifference);
    details.put("tolerance", tolerance);
    return RuleResult.builder()
        .name(distributionRuleName(outputType))
        .description("Output mean and standard deviation stay within " + config.getDistributionTolerance()
            + " expected standard deviations of the reference")
        .category(RuleResult.Category.DISTRIBUTION)
        .passed(meanDifference <= tolerance && stdDifference <= tolerance)
        .details(details)
        .build();
  }

  private RuleResult rangeRule(double[] outputs, String outputType, ValueRange range) {
    long outOfRange = 0;
    for (double output : outputs) {
      if (!range.contains(output)) {
        outOfRange++;
      }
    }

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("min", range.getMin());
    details.put("max", range.getMax());
    details.put("observed_min", StatUtils.min(outputs));
    details.put("observed_max", StatUtils.max(outputs));
    details.put("out_of_range_count", outOfRange);
    details.put("within_range_percentage", 100.0 * (outputs.length - outOfRange) / outputs.length);
    return RuleResult.builder()
        .name(rangeRuleName(outputType))
        .description("Outputs are within the clinically valid range " + range)
        .category(RuleResult.Category.CLINICAL)
        .passed(outOfRange == 0)
        .details(details)
        .build();
  }

  private List<RuleResult> contextRules(double[] outputs, String outputType, ClinicalContext context) {
    List<RuleResult> rules = new ArrayList<>();
    if (Constants.SETTING_EMERGENCY.equalsIgnoreCase(context.getSetting())
        && Constants.CHARGES.equals(outputType)) {
      rules.add(limitRule(EMERGENCY_COST_CHECK, "Cost predictions stay under the emergency cost threshold",
          outputs, config.getEmergencyCostThreshold()));
    } else if (Constants.POPULATION_PEDIATRIC.equalsIgnoreCase(context.getPopulation())
        && Constants.BMI.equals(outputType)) {
      rules.add(limitRule(PEDIATRIC_BMI_CHECK, "BMI predictions stay under the pediatric maximum",
          outputs, config.getPediatricBmiMax()));
    }
    return rules;
  }

  private static RuleResult limitRule(String name, String description, double[] outputs, double limit) {
    long above = 0;
    for (double output : outputs) {
      if (output > limit) {
        above++;
      }
    }
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("limit", limit);
    details.put("above_limit_count", above);
    details.put("observed_max", StatUtils.max(outputs));
    return RuleResult.builder()
        .name(name)
        .description(description)
        .category(RuleResult.Category.CLINICAL)
        .passed(above == 0)
        .details(details)
        .build();
  }

  private List<RuleResult> regulatoryRules(Map<String, AttributeBiasAnalysis> biasAnalysis, ModelMetrics metrics) {
    List<RuleResult> rules = new ArrayList<>();
    double ceiling = config.getRegulatoryBiasCeiling();

    Map<String, Object> thresholdDetails = new LinkedHashMap<>();
    thresholdDetails.put("bias_threshold", config.getBiasThreshold());
    thresholdDetails.put("ceiling", ceiling);
    rules.add(RuleResult.builder()
        .name(BIAS_THRESHOLD_CEILING)
        .description("The configured bias threshold does not exceed the regulatory ceiling")
        .category(RuleResult.Category.REGULATORY)
        .passed(config.getBiasThreshold() <= ceiling)
        .details(thresholdDetails)
        .build());

    if (biasAnalysis != null && !biasAnalysis.isEmpty()) {
      Double maxRatio = null;
      String maxAttribute = null;
      boolean unbounded = false;
      for (AttributeBiasAnalysis analysis : biasAnalysis.values()) {
        DisparityMetric disparity = analysis.getDisparity(Constants.MEAN_PREDICTION);
        if (disparity == null) {
          continue;
        }
        if (disparity.getRatio() == null) {
          unbounded |= disparity.getDifference() > 0;
        } else if (maxRatio == null || disparity.getRatio() > maxRatio) {
          maxRatio = disparity.getRatio();
          maxAttribute = analysis.getAttributeName();
        }
      }
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("max_ratio", maxRatio);
      details.put("attribute", maxAttribute);
      details.put("undefined_ratio_with_gap", unbounded);
      details.put("ceiling", ceiling);
      rules.add(RuleResult.builder()
          .name(MAXIMUM_BIAS)
          .description("The largest mean prediction disparity ratio does not exceed the regulatory ceiling")
          .category(RuleResult.Category.REGULATORY)
          .passed(!unbounded && (maxRatio == null || maxRatio <= ceiling))
          .details(details)
          .build());
    }

    if (config.getRegulatoryMinR2() != null && metrics != null) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("r2", metrics.getR2());
      details.put("threshold", config.getRegulatoryMinR2());
      rules.add(RuleResult.builder()
          .name(MINIMUM_R2)
          .description("Variance explained meets the regulatory minimum")
          .category(RuleResult.Category.REGULATORY)
          .passed(metrics.getR2() != null && metrics.getR2() >= config.getRegulatoryMinR2())
          .details(details)
          .build());
    }
    return rules;
  }

  private static boolean allPassed(List<RuleResult> rules, RuleResult.Category category) {
    return rules.stream().filter(rule -> rule.getCategory() == category).allMatch(RuleResult::isPassed);
  }
}
