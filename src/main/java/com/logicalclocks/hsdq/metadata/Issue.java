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
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * A single finding of a check. Immutable once built.
 */
@Builder
@EqualsAndHashCode
@JsonPropertyOrder({"type", "column", "count", "details"})
public final class Issue {

  @Getter
  @NonNull
  private final IssueType type;
  @Getter
  private final String column;
  @Getter
  private final Long count;
  @Getter
  @NonNull
  private final String details;

  @Override
  public String toString() {
    return "Issue{"
      + "type=" + type
      + ", column='" + column + '\''
      + ", count=" + count
      + ", details='" + details + '\''
      + '}';
  }
}
