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

package com.logicalclocks.hsdq;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.logicalclocks.hsdq.util.Constants;
import lombok.Builder;
import lombok.Getter;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable set of thresholds shared by every check and validator of a run.
 *
 * <p>Options left unset on the builder take their default value. Metric thresholds ({@code rmseThreshold},
 * {@code maeThreshold}, {@code r2Threshold}) and {@code regulatoryMinR2} have no default and are skipped when null.
 */
public final class ThresholdConfig {

  public static final Map<String, ValueRange> DEFAULT_VALID_RANGES = ImmutableMap.of(
      Constants.AGE, ValueRange.of(0, 120),
      Constants.BMI, ValueRange.of(10, 70),
      Constants.CHILDREN, ValueRange.of(0, 10),
      Constants.CHARGES, ValueRange.of(0, 100000));

  public static final Map<String, Set<String>> DEFAULT_ALLOWED_VALUES = ImmutableMap.of(
      Constants.SEX, ImmutableSet.of("male", "female"),
      Constants.SMOKER, ImmutableSet.of("yes", "no"),
      Constants.REGION, ImmutableSet.of("northeast", "northwest", "southeast", "southwest"));

  public static final Map<String, DistributionReference> DEFAULT_REFERENCES = ImmutableMap.of(
      Constants.CHARGES, DistributionReference.of(13000, 5000));

  @Getter
  private final double nullPctMax;
  @Getter
  private final double zscoreMax;
  @Getter
  private final Double rmseThreshold;
  @Getter
  private final Double maeThreshold;
  @Getter
  private final Double r2Threshold;
  @Getter
  private final double biasThreshold;
  @Getter
  private final int minGroupSize;
  @Getter
  private final double distributionTolerance;
  @Getter
  private final double regulatoryBiasCeiling;
  @Getter
  private final Double regulatoryMinR2;
  @Getter
  private final double emergencyCostThreshold;
  @Getter
  private final double pediatricBmiMax;
  @Getter
  private final Map<String, ValueRange> validRanges;
  @Getter
  private final Map<String, Set<String>> allowedValues;
  @Getter
  private final Map<String, Double> binWidths;
  @Getter
  private final Map<String, DistributionReference> references;

  @Builder
  public ThresholdConfig(Double nullPctMax, Double zscoreMax, Double rmseThreshold, Double maeThreshold,
                         Double r2Threshold, Double biasThreshold, Integer minGroupSize, Double distributionTolerance,
                         Double regulatoryBiasCeiling, Double regulatoryMinR2, Double emergencyCostThreshold,
                         Double pediatricBmiMax, Map<String, ValueRange> validRanges,
                         Map<String, ? extends Set<String>> allowedValues, Map<String, Double> binWidths,
                         Map<String, DistributionReference> references) {
    this.nullPctMax = nullPctMax != null ? nullPctMax : Constants.DEFAULT_NULL_PCT_MAX;
    this.zscoreMax = zscoreMax != null ? zscoreMax : Constants.DEFAULT_ZSCORE_MAX;
    this.rmseThreshold = rmseThreshold;
    this.maeThreshold = maeThreshold;
    this.r2Threshold = r2Threshold;
    this.biasThreshold = biasThreshold != null ? biasThreshold : Constants.DEFAULT_BIAS_THRESHOLD;
    this.minGroupSize = minGroupSize != null ? minGroupSize : Constants.DEFAULT_MIN_GROUP_SIZE;
    this.distributionTolerance =
        distributionTolerance != null ? distributionTolerance : Constants.DEFAULT_DISTRIBUTION_TOLERANCE;
    this.regulatoryBiasCeiling =
        regulatoryBiasCeiling != null ? regulatoryBiasCeiling : Constants.DEFAULT_REGULATORY_BIAS_CEILING;
    this.regulatoryMinR2 = regulatoryMinR2;
    this.emergencyCostThreshold =
        emergencyCostThreshold != null ? emergencyCostThreshold : Constants.DEFAULT_EMERGENCY_COST_THRESHOLD;
    this.pediatricBmiMax = pediatricBmiMax != null ? pediatricBmiMax : Constants.DEFAULT_PEDIATRIC_BMI_MAX;
    this.validRanges = validRanges != null ? ImmutableMap.copyOf(validRanges) : DEFAULT_VALID_RANGES;
    this.allowedValues = allowedValues != null ? lowerCase(allowedValues) : DEFAULT_ALLOWED_VALUES;
    this.binWidths = binWidths != null ? ImmutableMap.copyOf(binWidths) : ImmutableMap.of();
    this.references = references != null ? ImmutableMap.copyOf(references) : DEFAULT_REFERENCES;

    if (this.zscoreMax <= 0) {
      throw new IllegalArgumentException("zscore_max must be positive: " + this.zscoreMax);
    }
    for (Map.Entry<String, Double> binWidth : this.binWidths.entrySet()) {
      if (binWidth.getValue() == null || binWidth.getValue() <= 0) {
        throw new IllegalArgumentException("Bin width of `" + binWidth.getKey() + "` must be positive");
      }
    }
  }

  public static ThresholdConfig defaults() {
    return ThresholdConfig.builder().build();
  }

  public ValueRange getValidRange(String column) {
    return validRanges.get(column);
  }

  /**
   * Case-insensitive membership test against the allowed values of a categorical column.
   */
  public boolean isAllowedValue(String column, Object value) {
    Set<String> allowed = allowedValues.get(column);
    return allowed == null || allowed.contains(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
  }

  public Double getBinWidth(String attribute) {
    return binWidths.get(attribute);
  }

  public DistributionReference getReference(String outputType) {
    return references.get(outputType);
  }

  /**
   * Build a config from flat properties, e.g. {@code null_pct_max=10} or {@code valid_range.age=0,120}.
   * Per-column maps that appear in the properties replace the defaults entry by entry.
   *
   * @param properties threshold options
   * @return the config
   * @throws DataQualityException if a value cannot be parsed
   */
  public static ThresholdConfig fromProperties(Properties properties) throws DataQualityException {
    ThresholdConfigBuilder builder = ThresholdConfig.builder()
        .nullPctMax(parseDouble(properties, Constants.NULL_PCT_MAX))
        .zscoreMax(parseDouble(properties, Constants.ZSCORE_MAX))
        .rmseThreshold(parseDouble(properties, Constants.RMSE_THRESHOLD))
        .maeThreshold(parseDouble(properties, Constants.MAE_THRESHOLD))
        .r2Threshold(parseDouble(properties, Constants.R2_THRESHOLD))
        .biasThreshold(parseDouble(properties, Constants.BIAS_THRESHOLD))
        .distributionTolerance(parseDouble(properties, Constants.DISTRIBUTION_TOLERANCE))
        .regulatoryBiasCeiling(parseDouble(properties, Constants.REGULATORY_BIAS_CEILING))
        .regulatoryMinR2(parseDouble(properties, Constants.REGULATORY_MIN_R2))
        .emergencyCostThreshold(parseDouble(properties, Constants.EMERGENCY_COST_THRESHOLD))
        .pediatricBmiMax(parseDouble(properties, Constants.PEDIATRIC_BMI_MAX));

    String minGroupSize = properties.getProperty(Constants.MIN_GROUP_SIZE);
    if (!Strings.isNullOrEmpty(minGroupSize)) {
      try {
        builder.minGroupSize(Integer.parseInt(minGroupSize.trim()));
      } catch (NumberFormatException e) {
        throw new DataQualityException("Invalid value for `" + Constants.MIN_GROUP_SIZE + "`: " + minGroupSize, e);
      }
    }

    Map<String, ValueRange> validRanges = new HashMap<>(DEFAULT_VALID_RANGES);
    Map<String, Set<String>> allowedValues = new HashMap<>(DEFAULT_ALLOWED_VALUES);
    Map<String, Double> binWidths = new HashMap<>();
    Map<String, DistributionReference> references = new HashMap<>(DEFAULT_REFERENCES);
    for (String key : properties.stringPropertyNames()) {
      String value = properties.getProperty(key);
      if (key.startsWith(Constants.VALID_RANGE_PREFIX)) {
        List<Double> bounds = parsePair(key, value);
        try {
          validRanges.put(key.substring(Constants.VALID_RANGE_PREFIX.length()),
              ValueRange.of(bounds.get(0), bounds.get(1)));
        } catch (IllegalArgumentException e) {
          throw new DataQualityException("Invalid value for `" + key + "`: " + value, e);
        }
      } else if (key.startsWith(Constants.ALLOWED_VALUES_PREFIX)) {
        allowedValues.put(key.substring(Constants.ALLOWED_VALUES_PREFIX.length()),
            ImmutableSet.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(value)));
      } else if (key.startsWith(Constants.BIN_WIDTH_PREFIX)) {
        Double width = parseDouble(properties, key);
        if (width == null || width <= 0) {
          throw new DataQualityException("Invalid value for `" + key + "`: " + value);
        }
        binWidths.put(key.substring(Constants.BIN_WIDTH_PREFIX.length()), width);
      } else if (key.startsWith(Constants.REFERENCE_PREFIX)) {
        List<Double> reference = parsePair(key, value);
        try {
          references.put(key.substring(Constants.REFERENCE_PREFIX.length()),
              DistributionReference.of(reference.get(0), reference.get(1)));
        } catch (IllegalArgumentException e) {
          throw new DataQualityException("Invalid value for `" + key + "`: " + value, e);
        }
      }
    }

    try {
      return builder
          .validRanges(validRanges)
          .allowedValues(allowedValues)
          .binWidths(binWidths)
          .references(references)
          .build();
    } catch (IllegalArgumentException e) {
      throw new DataQualityException("Invalid threshold configuration: " + e.getMessage(), e);
    }
  }

  private static Double parseDouble(Properties properties, String key) throws DataQualityException {
    String value = properties.getProperty(key);
    if (Strings.isNullOrEmpty(value)) {
      return null;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new DataQualityException("Invalid value for `" + key + "`: " + value, e);
    }
  }

  private static List<Double> parsePair(String key, String value) throws DataQualityException {
    List<String> parts = Splitter.on(',').trimResults().splitToList(Strings.nullToEmpty(value));
    if (parts.size() != 2) {
      throw new DataQualityException("Expected two comma separated numbers for `" + key + "`: " + value);
    }
    try {
      return ImmutableList.of(Double.parseDouble(parts.get(0)), Double.parseDouble(parts.get(1)));
    } catch (NumberFormatException e) {
      throw new DataQualityException("Invalid value for `" + key + "`: " + value, e);
    }
  }

  private static Map<String, Set<String>> lowerCase(Map<String, ? extends Set<String>> allowedValues) {
    ImmutableMap.Builder<String, Set<String>> copy = ImmutableMap.builder();
    for (Map.Entry<String, ? extends Set<String>> entry : allowedValues.entrySet()) {
      ImmutableSet.Builder<String> values = ImmutableSet.builder();
      for (String value : entry.getValue()) {
        values.add(value.trim().toLowerCase(Locale.ROOT));
      }
      copy.put(entry.getKey(), values.build());
    }
    return copy.build();
  }

  @Override
  public String toString() {
    return "ThresholdConfig{"
      + "nullPctMax=" + nullPctMax
      + ", zscoreMax=" + zscoreMax
      + ", rmseThreshold=" + rmseThreshold
      + ", maeThreshold=" + maeThreshold
      + ", r2Threshold=" + r2Threshold
      + ", biasThreshold=" + biasThreshold
      + ", minGroupSize=" + minGroupSize
      + ", validRanges=" + validRanges
      + ", allowedValues=" + allowedValues
      + ", binWidths=" + binWidths
      + '}';
  }
}
