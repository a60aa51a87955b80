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

import java.util.Collection;
import java.util.Locale;

public enum CheckStatus {
  PASSED("passed", 0),
  WARNING("warning", 1),
  FAILED("failed", 2);

  private final String name;
  private final int severity;

  CheckStatus(String name, int severity) {
    this.name = name;
    this.severity = severity;
  }

  public int getSeverity() {
    return severity;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  @JsonCreator
  public static CheckStatus fromString(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }

  public CheckStatus worse(CheckStatus other) {
    return other != null && other.severity > severity ? other : this;
  }

  /**
   * Worst status of the collection, ordered failed &gt; warning &gt; passed. An empty collection is passed.
   */
  public static CheckStatus worst(Collection<CheckStatus> statuses) {
    CheckStatus worst = PASSED;
    for (CheckStatus status : statuses) {
      worst = worst.worse(status);
    }
    return worst;
  }

  @Override
  public String toString() {
    return name;
  }
}
