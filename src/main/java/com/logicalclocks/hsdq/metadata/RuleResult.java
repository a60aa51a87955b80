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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

/**
 * Outcome of one healthcare domain rule. {@code details} carries the compared numbers.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleResult {

  @Getter @Setter
  private String name;
  @Getter @Setter
  private String description;
  @Getter @Setter
  private Category category;
  @Getter @Setter
  private boolean passed;
  @Getter @Setter
  private Map<String, Object> details;

  public enum Category {
    DISTRIBUTION,
    CLINICAL,
    REGULATORY
  }

  @Override
  public String toString() {
    return "RuleResult{"
      + "name='" + name + '\''
      + ", category=" + category
      + ", passed=" + passed
      + ", details=" + details
      + '}';
  }
}
