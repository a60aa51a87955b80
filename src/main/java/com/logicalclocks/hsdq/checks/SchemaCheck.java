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

import com.google.common.collect.ImmutableMap;
import com.logicalclocks.hsdq.ColumnType;
import com.logicalclocks.hsdq.Dataset;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.metadata.CheckResult;
import com.logicalclocks.hsdq.metadata.Issue;
import com.logicalclocks.hsdq.metadata.IssueType;
import com.logicalclocks.hsdq.util.Constants;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the column set and value types of a dataset against an expected schema, and the values of
 * categorical columns against the allowed values of the {@link ThresholdConfig}.
 *
 * <p>Missing columns, type mismatches and invalid categories fail the check. Undeclared columns only
 * raise a warning. Nulls are left to the {@link NullCheck}.
 */
public class SchemaCheck implements Check {

  @Getter
  private final Map<String, ColumnType> expectedSchema;

  public SchemaCheck(@NonNull Map<String, ColumnType> expectedSchema) {
    this.expectedSchema = ImmutableMap.copyOf(expectedSchema);
  }

  @Override
  public String getName() {
    return Constants.SCHEMA_CHECK;
  }

  @Override
  public CheckResult run(Dataset dataset, ThresholdConfig config) {
    if (dataset.isEmpty()) {
      return emptyDatasetResult();
    }

    List<Issue> issues = new ArrayList<>();
    for (String column : expectedSchema.keySet()) {
      if (!dataset.hasColumn(column)) {
        issues.add(Issue.builder()
            .type(IssueType.MISSING_COLUMN)
            .column(column)
            .details("Expected column " + column + " of type " + expectedSchema.get(column) + " is missing")
            .build());
      }
    }

    for (String column : dataset.getColumns()) {
      if (!expectedSchema.containsKey(column)) {
        issues.add(Issue.builder()
            .type(IssueType.UNEXPECTED_COLUMN)
            .column(column)
            .details("Column " + column + " is not declared in the schema")
            .build());
      }
    }

    for (Map.Entry<String, ColumnType> declared : expectedSchema.entrySet()) {
      String column = declared.getKey();
      if (!dataset.hasColumn(column)) {
        continue;
      }
      long mismatches = dataset.column(column).stream()
          .filter(value -> value != null && !declared.getValue().isCoercible(value))
          .count();
      if (mismatches > 0) {
        issues.add(Issue.builder()
            .type(IssueType.TYPE_MISMATCH)
            .column(column)
            .count(mismatches)
            .details("Found " + mismatches + " values in column " + column + " that cannot be read as "
                + declared.getValue())
            .build());
      }
    }

    for (Map.Entry<String, Set<String>> categorical : config.getAllowedValues().entrySet()) {
      String column = categorical.getKey();
      if (!dataset.hasColumn(column)) {
        continue;
      }
      long invalid = dataset.column(column).stream()
          .filter(value -> value != null && !config.isAllowedValue(column, value))
          .count();
      if (invalid > 0) {
        issues.add(Issue.builder()
            .type(IssueType.INVALID_CATEGORY)
            .column(column)
            .count(invalid)
            .details("Found " + invalid + " values in column " + column + " outside of "
                + categorical.getValue())
            .build());
      }
    }

    return CheckResult.builder()
        .checkName(getName())
        .status(CheckResult.statusOf(issues))
        .issues(issues)
        .build();
  }
}
