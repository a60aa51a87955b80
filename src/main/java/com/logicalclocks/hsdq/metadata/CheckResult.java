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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one check invocation.
 */
@Builder(toBuilder = true)
@JsonPropertyOrder({"check_name", "table", "status", "issues", "timestamp"})
public final class CheckResult {

  @Getter
  @NonNull
  private final String checkName;
  @Getter
  private final String table;
  @Getter
  @NonNull
  private final CheckStatus status;
  @Getter
  @Singular
  private final List<Issue> issues;
  @Getter
  @NonNull
  @Builder.Default
  private final String timestamp = Instant.now().toString();

  @JsonIgnore
  public boolean isPassed() {
    return status == CheckStatus.PASSED;
  }

  public List<Issue> getIssues(IssueType type) {
    return issues.stream().filter(issue -> issue.getType() == type).collect(Collectors.toList());
  }

  /**
   * Status implied by the issues' own severities. Issues without a fixed severity are ignored.
   */
  public static CheckStatus statusOf(List<Issue> issues) {
    CheckStatus status = CheckStatus.PASSED;
    for (Issue issue : issues) {
      status = status.worse(issue.getType().getSeverity());
    }
    return status;
  }

  @Override
  public String toString() {
    return "CheckResult{"
      + "checkName='" + checkName + '\''
      + ", table='" + table + '\''
      + ", status=" + status
      + ", issues=" + issues
      + ", timestamp='" + timestamp + '\''
      + '}';
  }
}
