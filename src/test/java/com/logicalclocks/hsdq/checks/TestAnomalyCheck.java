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
import com.logicalclocks.hsdq.metadata.Issue;
import com.logicalclocks.hsdq.metadata.IssueType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

class TestAnomalyCheck {

  @Test
  void testConstantColumnHasNoAnomalies() throws Exception {
    // Arrange
    Dataset dataset = Records.column("visits", 4, 4, 4, 4, 4);

    // Act
    CheckResult result = new AnomalyCheck().run(dataset, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.PASSED, result.getStatus());
    Assertions.assertTrue(result.getIssues().isEmpty());
    Assertions.assertEquals(0, AnomalyCheck.countAnomalies(new double[] {4, 4, 4}, 4, 0, 3.0));
  }

  @Test
  void testZscoreOutlierIsAWarning() throws Exception {
    // Arrange
    List<Map<String, Object>> records = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      records.add(Records.record("visits", 50.0));
    }
    records.add(Records.record("visits", 1000.0));
    Dataset dataset = Dataset.of(records);

    // Act
    CheckResult result = new AnomalyCheck().run(dataset, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.WARNING, result.getStatus());
    Assertions.assertEquals(1, result.getIssues().size());
    Issue issue = result.getIssues().get(0);
    Assertions.assertEquals(IssueType.ZSCORE_ANOMALY, issue.getType());
    Assertions.assertEquals("visits", issue.getColumn());
    Assertions.assertEquals(1L, issue.getCount());
  }

  @Test
  void testAnomalyShareIgnoresNulls() throws Exception {
    // Arrange
    List<Map<String, Object>> records = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      records.add(Records.record("visits", 50.0));
    }
    records.add(Records.record("visits", 1000.0));
    for (int i = 0; i < 21; i++) {
      records.add(Records.record("visits", null));
    }

    // Act
    CheckResult result = new AnomalyCheck().run(Dataset.of(records), ThresholdConfig.defaults());

    // Assert
    Issue issue = result.getIssues(IssueType.ZSCORE_ANOMALY).get(0);
    Assertions.assertEquals(1L, issue.getCount());
    Assertions.assertTrue(issue.getDetails().startsWith("Found 1 values (4.76%) in column visits"));
  }

  @Test
  void testEmptyDataset() {
    // Act
    CheckResult result = new AnomalyCheck().run(Dataset.empty(), ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.PASSED, result.getStatus());
    Assertions.assertEquals(1, result.getIssues(IssueType.EMPTY_DATASET).size());
  }

  @Test
  void testOutOfRangeFails() throws Exception {
    // Arrange
    Dataset dataset = Records.column("age", 30, 40, -5, 55);

    // Act
    CheckResult result = new AnomalyCheck().run(dataset, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.FAILED, result.getStatus());
    List<Issue> outOfRange = result.getIssues(IssueType.OUT_OF_RANGE);
    Assertions.assertEquals(1, outOfRange.size());
    Assertions.assertEquals(1L, outOfRange.get(0).getCount());
  }

  @Test
  void testSkipsNonNumericColumns() throws Exception {
    // Act
    CheckResult result = new AnomalyCheck().run(Records.insurance(), ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.PASSED, result.getStatus());
  }

  @Test
  void testExplicitColumns() throws Exception {
    // Arrange
    Dataset dataset = Dataset.of(Arrays.asList(
        Records.record("age", 30, "bmi", 95.0),
        Records.record("age", 40, "bmi", 28.0)));

    // Act
    CheckResult result = new AnomalyCheck(Arrays.asList("age", "height")).run(dataset, ThresholdConfig.defaults());

    // Assert
    Assertions.assertEquals(CheckStatus.PASSED, result.getStatus());
  }

  @Test
  void testExplicitNonNumericColumn() throws Exception {
    // Arrange
    AnomalyCheck check = new AnomalyCheck(Collections.singletonList("sex"));
    Dataset dataset = Records.insurance();

    // Act
    // Assert
    Assertions.assertThrows(IllegalStateException.class, () -> check.run(dataset, ThresholdConfig.defaults()));
  }
}
