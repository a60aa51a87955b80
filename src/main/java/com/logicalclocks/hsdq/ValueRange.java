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

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Closed interval of valid values for a column. Values outside it are physically or clinically impossible.
 */
@EqualsAndHashCode
public final class ValueRange {

  @Getter
  private final double min;
  @Getter
  private final double max;

  private ValueRange(double min, double max) {
    this.min = min;
    this.max = max;
  }

  public static ValueRange of(double min, double max) {
    if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
      throw new IllegalArgumentException("Invalid range [" + min + ", " + max + "]");
    }
    return new ValueRange(min, max);
  }

  public boolean contains(double value) {
    return value >= min && value <= max;
  }

  @Override
  public String toString() {
    return "[" + min + ", " + max + "]";
  }
}
