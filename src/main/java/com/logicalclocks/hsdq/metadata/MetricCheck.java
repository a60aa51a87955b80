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

@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MetricCheck {

  @Getter @Setter
  private String metric;
  @Getter @Setter
  private Double value;
  @Getter @Setter
  private double threshold;
  @Getter @Setter
  private Bound bound;
  @Getter @Setter
  private boolean passed;

  public enum Bound {
    // value must not exceed the threshold
    MAX,
    // value must be at least the threshold
    MIN
  }

  @Override
  public String toString() {
    return "MetricCheck{"
      + "metric='" + metric + '\''
      + ", value=" + value
      + ", threshold=" + threshold
      + ", bound=" + bound
      + ", passed=" + passed
      + '}';
  }
}
