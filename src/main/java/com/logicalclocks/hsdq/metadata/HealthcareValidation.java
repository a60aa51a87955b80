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

import java.util.List;
import java.util.stream.Collectors;

@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HealthcareValidation {

  @Getter @Setter
  private String outputType;
  @Getter @Setter
  private String timestamp;
  @Getter @Setter
  private List<RuleResult> rules;
  @Getter @Setter
  private boolean clinicallyValid;
  @Getter @Setter
  private boolean regulatoryCompliant;
  @Getter @Setter
  private boolean passed;

  public List<RuleResult> getRules(RuleResult.Category category) {
    return rules.stream().filter(rule -> rule.getCategory() == category).collect(Collectors.toList());
  }

  public RuleResult getRule(String name) {
    return rules.stream().filter(rule -> rule.getName().equals(name)).findFirst().orElse(null);
  }

  @Override
  public String toString() {
    return "HealthcareValidation{"
      + "outputType='" + outputType + '\''
      + ", rules=" + rules
      + ", passed=" + passed
      + '}';
  }
}
