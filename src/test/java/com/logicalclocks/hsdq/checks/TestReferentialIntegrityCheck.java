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

package com.logicalclocks.hsdq.checks;

import com.logicalclocks.hsdq.Dataset;
import com.logicalclocks.hsdq.Records;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.metadata.CheckResult;
import com.logicalclocks.hsdq.metadata.CheckStatus;
import com.logicalclocks.hsdq.metadata.IssueType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TestReferentialIntegrityCheck {

  @Test
  void testAllKeysResolve() throws Exception {
    // Arrange
    Dataset claims = Records.column("patient_id", 1, 2, 2);
    Dataset patients = Records.column("id", 1L, 2.0);

    // Act
    CheckResult result = new ReferentialIntegrityCheck("patient_id", patients, "id")
        .run(claims, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals("Data Consistency Check", result.getCheckName());
    Assertions.assertEquals(CheckStatus.PASSED, result.getStatus());
  }

  @Test
  void testMissingAndOrphanedKeys() throws Exception {
    // Arrange
    Dataset claims = Records.column("patient_id", 1, 2, 3, null);
    Dataset patients = Records.column("id", 1L, 2.0, 4);

    // Act
    CheckResult result = new ReferentialIntegrityCheck("patient_id", patients, "id")
        .run(claims, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.FAILED, result.getStatus());
    Assertions.assertEquals(1L, result.getIssues(IssueType.MISSING_REFERENCE).get(0).getCount());
    Assertions.assertEquals(1L, result.getIssues(IssueType.ORPHANED_RECORD).get(0).getCount());
  }

  @Test
  void testEmptyDataset() throws Exception {
    // Arrange
    Dataset patients = Records.column("id", 1, 2);

    // Act
    CheckResult result = new ReferentialIntegrityCheck("patient_id", patients, "id")
        .run(Dataset.empty(), ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.PASSED, result.getStatus());
    Assertions.assertEquals(1, result.getIssues(IssueType.EMPTY_DATASET).size());
  }

  @Test
  void testOrphanedOnlyIsAWarning() throws Exception {
    // Arrange
    Dataset claims = Records.column("patient_id", "p1");
    Dataset patients = Records.column("id", "p1", "p2");

    // Act
    CheckResult result = new ReferentialIntegrityCheck("patient_id", patients, "id")
        .run(claims, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.WARNING, result.getStatus());
  }
}
