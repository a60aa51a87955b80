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
import com.logicalclocks.hsdq.metadata.Issue;
import com.logicalclocks.hsdq.metadata.IssueType;
import com.logicalclocks.hsdq.util.Constants;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks that every foreign key of the dataset references a record of a parent dataset, e.g. that every
 * insurance charge belongs to a known patient.
 *
 * <p>Dangling foreign keys fail the check. Parent records that nothing references only raise a warning.
 */
public class ReferentialIntegrityCheck implements Check {

  @Getter
  private final String foreignKey;
  @Getter
  private final Dataset referenced;
  @Getter
  private final String referencedKey;

  public ReferentialIntegrityCheck(@NonNull String foreignKey, @NonNull Dataset referenced,
                                   @NonNull String referencedKey) {
    this.foreignKey = foreignKey;
    this.referenced = referenced;
    this.referencedKey = referencedKey;
  }

  @Override
  public String getName() {
    return Constants.REFERENTIAL_INTEGRITY_CHECK;
  }

  @Override
  public CheckResult run(Dataset dataset, ThresholdConfig config) {
    if (dataset.isEmpty()) {
      return emptyDatasetResult();
    }

    Set<String> foreignKeys = keys(dataset, foreignKey);
    Set<String> referencedKeys = referenced.isEmpty() ? new LinkedHashSet<>() : keys(referenced, referencedKey);

    Set<String> missing = new LinkedHashSet<>(foreignKeys);
    missing.removeAll(referencedKeys);
    Set<String> orphaned = new LinkedHashSet<>(referencedKeys);
    orphaned.removeAll(foreignKeys);

    List<Issue> issues = new ArrayList<>();
    if (!missing.isEmpty()) {
      issues.add(Issue.builder()
          .type(IssueType.MISSING_REFERENCE)
          .column(foreignKey)
          .count((long) missing.size())
          .details("Found " + missing.size() + " values of " + foreignKey + " without a matching "
              + referencedKey)
          .build());
    }
    if (!orphaned.isEmpty()) {
      issues.add(Issue.builder()
          .type(IssueType.ORPHANED_RECORD)
          .column(referencedKey)
          .count((long) orphaned.size())
          .details("Found " + orphaned.size() + " referenced records that no " + foreignKey + " points to")
          .build());
    }

    return CheckResult.builder()
        .checkName(getName())
        .status(CheckResult.statusOf(issues))
        .issues(issues)
        .build();
  }

  private static Set<String> keys(Dataset dataset, String column) {
    Set<String> keys = new LinkedHashSet<>();
    for (Object value : dataset.column(column)) {
      if (value != null) {
        keys.add(normalize(value));
      }
    }
    return keys;
  }

  // 7, 7L and 7.0 must be the same key
  private static String normalize(Object value) {
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return Long.toString((long) d);
      }
      return Double.toString(d);
    }
    return value.toString();
  }
}
