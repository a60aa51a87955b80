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
 * Expected mean and standard deviation of a model output.
 */
@EqualsAndHashCode
public final class DistributionReference {

  @Getter
  private final double expectedMean;
  @Getter
  private final double expectedStd;

  private DistributionReference(double expectedMean, double expectedStd) {
    this.expectedMean = expectedMean;
    this.expectedStd = expectedStd;
  }

  public static DistributionReference of(double expectedMean, double expectedStd) {
    if (expectedStd < 0) {
      throw new IllegalArgumentException("Expected standard deviation must not be negative: " + expectedStd);
    }
    return new DistributionReference(expectedMean, expectedStd);
  }

  @Override
  public String toString() {
    return "DistributionReference{"
      + "expectedMean=" + expectedMean
      + ", expectedStd=" + expectedStd
      + '}';
  }
}
