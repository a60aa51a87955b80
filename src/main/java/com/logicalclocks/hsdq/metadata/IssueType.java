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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of findings a check can report, each with the severity it contributes to its check's status.
 */
public enum IssueType {
  NULL_VALUES(null),
  MISSING_COLUMN(CheckStatus.FAILED),
  TYPE_MISMATCH(CheckStatus.FAILED),
  UNEXPECTED_COLUMN(CheckStatus.WARNING),
  INVALID_CATEGORY(CheckStatus.FAILED),
  ZSCORE_ANOMALY(CheckStatus.WARNING),
  OUT_OF_RANGE(CheckStatus.FAILED),
  MISSING_REFERENCE(CheckStatus.FAILED),
  ORPHANED_RECORD(CheckStatus.WARNING),
  EMPTY_DATASET(CheckStatus.PASSED),
  CHECK_ERROR(CheckStatus.FAILED);

  // null when the severity depends on a threshold and is decided by the check
  private final CheckStatus severity;

  IssueType(CheckStatus severity) {
    this.severity = severity;
  }

  public CheckStatus getSeverity() {
    return severity;
  }

  @JsonValue
  public String getName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static IssueType fromString(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }

  @Override
  public String toString() {
    return getName();
  }
}
