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

import com.google.common.annotations.VisibleForTesting;
import com.logicalclocks.hsdq.DimensionMismatchException;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.metadata.AttributeBiasAnalysis;
import com.logicalclocks.hsdq.metadata.ComplianceStatus;
import com.logicalclocks.hsdq.metadata.DisparityMetric;
import com.logicalclocks.hsdq.metadata.GroupStatistics;
import com.logicalclocks.hsdq.util.Constants;
import lombok.Getter;
import lombok.NonNull;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Measures how predictions differ between the groups of protected attributes such as sex or age.
 *
 * <p>Records are grouped by the exact attribute value unless a bin width is configured for the attribute.
 * Grouping a continuous attribute by exact value yields many small groups; groups smaller than
 * {@code min_group_size} are marked low confidence. The analyzer only reports magnitudes: an attribute is
 * flagged when its mean prediction ratio exceeds {@code bias_threshold}.
 */
public class BiasAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BiasAnalyzer.class);

  @Getter
  private final ThresholdConfig config;

  public BiasAnalyzer(@NonNull ThresholdConfig config) {
    this.config = config;
  }

  /**
   * Analyze every protected attribute independently.
   *
   * @param predictions model predictions
   * @param actual ground truth aligned with the predictions
   * @param protectedAttributes attribute name to values aligned with the predictions
   * @return analysis per attribute, in the order of {@code protectedAttributes}
   * @throws DimensionMismatchException if any sequence differs in length from the predictions
   */
  public Map<String, AttributeBiasAnalysis> analyze(@NonNull double[] predictions, @NonNull double[] actual,
                                                    @NonNull Map<String, ? extends List<?>> protectedAttributes)
      throws DimensionMismatchException {
    if (actual.length != predictions.length) {
      throw new DimensionMismatchException("actual", predictions.length, actual.length);
    }
    for (Map.Entry<String, ? extends List<?>> attribute : protectedAttributes.entrySet()) {
      if (attribute.getValue().size() != predictions.length) {
        throw new DimensionMismatchException(attribute.getKey(), predictions.length, attribute.getValue().size());
      }
    }

    boolean binary = isBinary(predictions) && isBinary(actual);
    Map<String, AttributeBiasAnalysis> analyses = new LinkedHashMap<>();
    for (Map.Entry<String, ? extends List<?>> attribute : protectedAttributes.entrySet()) {
      analyses.put(attribute.getKey(),
          analyzeAttribute(attribute.getKey(), attribute.getValue(), predictions, actual, binary));
    }
    return analyses;
  }

  public static boolean isCompliant(Map<String, AttributeBiasAnalysis> analyses) {
    return analyses.values().stream().noneMatch(AttributeBiasAnalysis::isFlagged);
  }

  public static ComplianceStatus complianceStatus(Map<String, AttributeBiasAnalysis> analyses) {
    return isCompliant(analyses) ? ComplianceStatus.COMPLIANT : ComplianceStatus.NON_COMPLIANT;
  }

  private AttributeBiasAnalysis analyzeAttribute(String attribute, List<?> values, double[] predictions,
                                                 double[] actual, boolean binary) {
    Double binWidth = config.getBinWidth(attribute);
    Map<String, List<Integer>> members = new LinkedHashMap<>();
    for (int i = 0; i < values.size(); i++) {
      members.computeIfAbsent(groupKey(values.get(i), binWidth), key -> new ArrayList<>()).add(i);
    }

    Map<String, GroupStatistics> groups = new LinkedHashMap<>();
    for (Map.Entry<String, List<Integer>> group : members.entrySet()) {
      groups.put(group.getKey(), groupStatistics(attribute, group.getKey(), group.getValue(), predictions, actual,
          binary));
    }

    Map<String, DisparityMetric> disparities = new LinkedHashMap<>();
    if (groups.size() > 1) {
      disparities.put(Constants.MEAN_PREDICTION, disparity(groups, GroupStatistics::getMeanPrediction));
      disparities.put(Constants.PREDICTION_RATE, disparity(groups, GroupStatistics::getPredictionRate));
      if (binary) {
        disparities.put(Constants.FALSE_POSITIVE_RATE, disparity(groups, GroupStatistics::getFalsePositiveRate));
      }
    }

    DisparityMetric meanDisparity = disparities.get(Constants.MEAN_PREDICTION);
    boolean flagged = meanDisparity != null && exceeds(meanDisparity, config.getBiasThreshold());
    LOGGER.info("Bias analysis of {}: {} groups, mean prediction disparity {}, flagged={}", attribute,
        groups.size(), meanDisparity, flagged);

    return AttributeBiasAnalysis.builder()
        .attributeName(attribute)
        .binWidth(binWidth)
        .groups(groups)
        .disparityMetrics(disparities)
        .flagged(flagged)
        .build();
  }

  private GroupStatistics groupStatistics(String attribute, String key, List<Integer> indices, double[] predictions,
                                          double[] actual, boolean binary) {
    double[] groupPredictions = new double[indices.size()];
    double[] groupActual = new double[indices.size()];
    for (int i = 0; i < indices.size(); i++) {
      groupPredictions[i] = predictions[indices.get(i)];
      groupActual[i] = actual[indices.get(i)];
    }

    double meanPrediction = StatUtils.mean(groupPredictions);
    if (indices.size() < config.getMinGroupSize()) {
      LOGGER.debug("Group {}={} has only {} records", attribute, key, indices.size());
    }
    return GroupStatistics.builder()
        .attributeName(attribute)
        .groupValue(key)
        .size(indices.size())
        .meanPrediction(meanPrediction)
        .stdPrediction(new StandardDeviation(false).evaluate(groupPredictions))
        .outcomeRate(StatUtils.mean(groupActual))
        .predictionRate(meanPrediction)
        .falsePositiveRate(binary ? falsePositiveRate(groupPredictions, groupActual) : 0)
        .lowConfidence(indices.size() < config.getMinGroupSize())
        .build();
  }

  /**
   * Disparity between the groups with the highest and the lowest statistic. On ties the first group wins.
   */
  private static DisparityMetric disparity(Map<String, GroupStatistics> groups,
                                          ToDoubleFunction<GroupStatistics> statistic) {
    String maxGroup = null;
    String minGroup = null;
    double max = 0;
    double min = 0;
    for (Map.Entry<String, GroupStatistics> group : groups.entrySet()) {
      double value = statistic.applyAsDouble(group.getValue());
      if (maxGroup == null || value > max) {
        max = value;
        maxGroup = group.getKey();
      }
      if (minGroup == null || value < min) {
        min = value;
        minGroup = group.getKey();
      }
    }
    return DisparityMetric.builder()
        .ratio(min <= 0 ? null : max / min)
        .difference(max - min)
        .maxGroup(maxGroup)
        .minGroup(minGroup)
        .build();
  }

  // an undefined ratio with a real gap means the lowest group is at or below zero, which always exceeds the threshold
  private static boolean exceeds(DisparityMetric disparity, double threshold) {
    if (disparity.getRatio() == null) {
      return disparity.getDifference() > 0;
    }
    return disparity.getRatio() > threshold;
  }

  private static double falsePositiveRate(double[] predictions, double[] actual) {
    int negatives = 0;
    int falsePositives = 0;
    for (int i = 0; i < actual.length; i++) {
      if (actual[i] == 0) {
        negatives++;
        if (predictions[i] == 1) {
          falsePositives++;
        }
      }
    }
    return negatives == 0 ? 0 : (double) falsePositives / negatives;
  }

  private static boolean isBinary(double[] values) {
    for (double value : values) {
      if (value != 0 && value != 1) {
        return false;
      }
    }
    return true;
  }

  @VisibleForTesting
  static String groupKey(Object value, Double binWidth) {
    if (value == null) {
      return Constants.NULL_GROUP;
    }
    if (binWidth != null && value instanceof Number) {
      double lower = Math.floor(((Number) value).doubleValue() / binWidth) * binWidth;
      return "[" + formatNumber(lower) + ", " + formatNumber(lower + binWidth) + ")";
    }
    return String.valueOf(value);
  }

  private static String formatNumber(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
