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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

class TestCheckStatus {

  @Test
  void testWorst() {
    Assertions.assertEquals(CheckStatus.FAILED,
        CheckStatus.worst(Arrays.asList(CheckStatus.PASSED, CheckStatus.WARNING, CheckStatus.FAILED)));
    Assertions.assertEquals(CheckStatus.WARNING,
        CheckStatus.worst(Arrays.asList(CheckStatus.PASSED, CheckStatus.WARNING)));
    Assertions.assertEquals(CheckStatus.PASSED,
        CheckStatus.worst(Arrays.asList(CheckStatus.PASSED, CheckStatus.PASSED)));
    Assertions.assertEquals(CheckStatus.PASSED, CheckStatus.worst(Collections.emptyList()));
  }

  @Test
  void testWorseIgnoresNull() {
    Assertions.assertEquals(CheckStatus.WARNING, CheckStatus.WARNING.worse(null));
    Assertions.assertEquals(CheckStatus.FAILED, CheckStatus.WARNING.worse(CheckStatus.FAILED));
    Assertions.assertEquals(CheckStatus.WARNING, CheckStatus.WARNING.worse(CheckStatus.PASSED));
  }

  @Test
  void testFromString() {
    Assertions.assertEquals(CheckStatus.WARNING, CheckStatus.fromString("warning"));
    Assertions.assertEquals("failed", CheckStatus.FAILED.getName());
  }
}
