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

package com.logicalclocks.hsdq.checks;

import com.logicalclocks.hsdq.Dataset;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.metadata.CheckResult;
import com.logicalclocks.hsdq.metadata.CheckStatus;
import com.logicalclocks.hsdq.metadata.Issue;
import com.logicalclocks.hsdq.metadata.IssueType;

/**
 * A data quality check over a dataset.
 *
 * <p>Implementations must not mutate the dataset and must not keep state between invocations, so that
 * a {@link com.logicalclocks.hsdq.engine.CheckRunner} may execute them concurrently. Every check must
 * accept an empty dataset and report it as passed.
 */
public interface Check {

  /**
   * Name reported as {@code check_name} in results.
   */
  String getName();

  /**
   * Run the check.
   *
   * @param dataset the data to validate, possibly empty
   * @param config thresholds of the current run
   * @return the result of the check
   */
  CheckResult run(Dataset dataset, ThresholdConfig config);

  /**
   * Passed result explaining that there was nothing to check.
   */
  default CheckResult emptyDatasetResult() {
    return CheckResult.builder()
        .checkName(getName())
        .status(CheckStatus.PASSED)
        .issue(Issue.builder()
            .type(IssueType.EMPTY_DATASET)
            .count(0L)
            .details("Dataset has no records, nothing to check")
            .build())
        .build();
  }
}
