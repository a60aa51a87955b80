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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered results of a check run. The overall status and generation time are fixed at construction.
 */
@JsonPropertyOrder({"results", "overall_status", "generated_at"})
public final class Report {

  @Getter
  private final List<CheckResult> results;
  @Getter
  private final CheckStatus overallStatus;
  @Getter
  private final String generatedAt;

  public Report(List<CheckResult> results) {
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
    this.overallStatus = CheckStatus.worst(
        this.results.stream().map(CheckResult::getStatus).collect(Collectors.toList()));
    this.generatedAt = Instant.now().toString();
  }

  public CheckResult getResult(String checkName) {
    return results.stream()
        .filter(result -> result.getCheckName().equals(checkName))
        .findFirst()
        .orElse(null);
  }

  @Override
  public String toString() {
    return "Report{"
      + "overallStatus=" + overallStatus
      + ", generatedAt='" + generatedAt + '\''
      + ", results=" + results
      + '}';
  }
}
