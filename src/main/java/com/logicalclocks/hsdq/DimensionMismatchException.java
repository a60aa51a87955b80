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

import lombok.Getter;

/**
 * Thrown when prediction, ground truth or protected attribute sequences are not aligned.
 */
public class DimensionMismatchException extends DataQualityException {

  @Getter
  private final String sequence;
  @Getter
  private final int expected;
  @Getter
  private final int actual;

  public DimensionMismatchException(String sequence, int expected, int actual) {
    super("Length of `" + sequence + "` is " + actual + " but " + expected + " predictions were supplied");
    this.sequence = sequence;
    this.expected = expected;
    this.actual = actual;
  }
}
