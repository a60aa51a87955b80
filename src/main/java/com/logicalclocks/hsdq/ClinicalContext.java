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

package com.logicalclocks.hsdq;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Clinical setting in which model outputs are used, e.g. {@code setting=emergency} or
 * {@code population=pediatric}. Enables stricter context specific rules.
 */
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClinicalContext {

  @Getter @Setter
  private String setting;
  @Getter @Setter
  private String population;

  @Override
  public String toString() {
    return "ClinicalContext{"
      + "setting='" + setting + '\''
      + ", population='" + population + '\''
      + '}';
  }
}
