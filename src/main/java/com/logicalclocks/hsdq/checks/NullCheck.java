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
import com.logicalclocks.hsdq.util.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reports the share of null values per column. A column whose null percentage exceeds
 * {@code null_pct_max} fails the check, any other column with nulls makes it a warning.
 */
public class NullCheck implements Check {

  @Override
  public String getName() {
    return Constants.NULL_CHECK;
  }

  @Override
  public CheckResult run(Dataset dataset, ThresholdConfig config) {
    if (dataset.isEmpty()) {
      return emptyDatasetResult();
    }

    List<Issue> issues = new ArrayList<>();
    CheckStatus status = CheckStatus.PASSED;
    for (String column : dataset.getColumns()) {
      long nullCount = dataset.column(column).stream().filter(value -> value == null).count();
      if (nullCount == 0) {
        continue;
      }
      double nullPct = nullPercentage(nullCount, dataset.size());
      boolean exceeded = nullPct > config.getNullPctMax();
      status = status.worse(exceeded ? CheckStatus.FAILED : CheckStatus.WARNING);
      issues.add(Issue.builder()
          .type(IssueType.NULL_VALUES)
          .column(column)
          .count(nullCount)
          .details(String.format(Locale.ROOT, "Found %d null values (%.2f%%) in column %s, threshold is %.2f%%",
              nullCount, nullPct, column, config.getNullPctMax()))
          .build());
    }

    return CheckResult.builder()
        .checkName(getName())
        .status(status)
        .issues(issues)
        .build();
  }

  public static double nullPercentage(long nullCount, int totalRecords) {
    return 100.0 * nullCount / totalRecords;
  }
}
