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

package com.logicalclocks.hsdq.util;

public class Constants {

  // check names
  public static final String NULL_CHECK = "Null Value Check";
  public static final String SCHEMA_CHECK = "Schema Check";
  public static final String ANOMALY_CHECK = "Anomaly Check";
  public static final String REFERENTIAL_INTEGRITY_CHECK = "Data Consistency Check";

  // threshold option keys
  public static final String NULL_PCT_MAX = "null_pct_max";
  public static final String ZSCORE_MAX = "zscore_max";
  public static final String RMSE_THRESHOLD = "rmse_threshold";
  public static final String MAE_THRESHOLD = "mae_threshold";
  public static final String R2_THRESHOLD = "r2_threshold";
  public static final String BIAS_THRESHOLD = "bias_threshold";
  public static final String MIN_GROUP_SIZE = "min_group_size";
  public static final String DISTRIBUTION_TOLERANCE = "distribution_tolerance";
  public static final String REGULATORY_BIAS_CEILING = "regulatory_bias_ceiling";
  public static final String REGULATORY_MIN_R2 = "regulatory_min_r2";
  public static final String EMERGENCY_COST_THRESHOLD = "emergency_cost_threshold";
  public static final String PEDIATRIC_BMI_MAX = "pediatric_bmi_max";
  public static final String VALID_RANGE_PREFIX = "valid_range.";
  public static final String ALLOWED_VALUES_PREFIX = "allowed_values.";
  public static final String BIN_WIDTH_PREFIX = "bin_width.";
  public static final String REFERENCE_PREFIX = "reference.";

  // defaults
  public static final double DEFAULT_NULL_PCT_MAX = 5.0;
  public static final double DEFAULT_ZSCORE_MAX = 3.0;
  public static final double DEFAULT_BIAS_THRESHOLD = 1.1;
  public static final int DEFAULT_MIN_GROUP_SIZE = 30;
  public static final double DEFAULT_DISTRIBUTION_TOLERANCE = 0.1;
  public static final double DEFAULT_REGULATORY_BIAS_CEILING = 1.1;
  public static final double DEFAULT_EMERGENCY_COST_THRESHOLD = 50000;
  public static final double DEFAULT_PEDIATRIC_BMI_MAX = 40;

  // healthcare columns and output types
  public static final String AGE = "age";
  public static final String BMI = "bmi";
  public static final String CHILDREN = "children";
  public static final String CHARGES = "charges";
  public static final String SEX = "sex";
  public static final String SMOKER = "smoker";
  public static final String REGION = "region";

  // clinical contexts
  public static final String SETTING_EMERGENCY = "emergency";
  public static final String POPULATION_PEDIATRIC = "pediatric";

  // metric names
  public static final String MSE = "mse";
  public static final String RMSE = "rmse";
  public static final String MAE = "mae";
  public static final String R2 = "r2";

  // disparity metric names
  public static final String MEAN_PREDICTION = "mean_prediction";
  public static final String PREDICTION_RATE = "prediction_rate";
  public static final String FALSE_POSITIVE_RATE = "false_positive_rate";

  public static final String NULL_GROUP = "null";

  private Constants() {
  }
}
