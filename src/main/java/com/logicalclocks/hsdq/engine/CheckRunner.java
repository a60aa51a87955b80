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

package com.logicalclocks.hsdq.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.logicalclocks.hsdq.Dataset;
import com.logicalclocks.hsdq.ThresholdConfig;
import com.logicalclocks.hsdq.checks.Check;
import com.logicalclocks.hsdq.metadata.CheckResult;
import com.logicalclocks.hsdq.metadata.CheckStatus;
import com.logicalclocks.hsdq.metadata.Issue;
import com.logicalclocks.hsdq.metadata.IssueType;
import com.logicalclocks.hsdq.metadata.Report;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Executes an ordered list of checks against a dataset and aggregates their results into a {@link Report}.
 *
 * <p>A check that throws does not abort the run: its result becomes {@code failed} with a {@code check_error}
 * issue. Results are always reported in the order the checks were registered, also when the checks run in
 * parallel.
 */
public class CheckRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(CheckRunner.class);

  @Getter
  private final List<Check> checks;
  @Getter
  private final ThresholdConfig config;
  @Getter
  private final int parallelism;

  @Builder
  public CheckRunner(@Singular List<Check> checks, ThresholdConfig config, Integer parallelism) {
    this.checks = ImmutableList.copyOf(checks);
    this.config = config != null ? config : ThresholdConfig.defaults();
    this.parallelism = parallelism != null ? parallelism : 1;
    if (this.parallelism < 1) {
      throw new IllegalArgumentException("Parallelism must be at least 1: " + this.parallelism);
    }
  }

  public Report run(Dataset dataset) {
    return run(null, dataset);
  }

  /**
   * Run every check against the dataset.
   *
   * @param table optional name of the table the dataset was loaded from, copied into every result
   * @param dataset the data to validate
   * @return report with one result per check, in registration order
   */
  public Report run(String table, Dataset dataset) {
    List<CheckResult> results = runChecks(table, dataset);
    Report report = aggregate(results);
    LOGGER.info("Ran {} checks on {}: {}", results.size(), table != null ? table : dataset,
        report.getOverallStatus());
    return report;
  }

  /**
   * Run every check against the dataset without building a report, e.g. to merge results of several tables.
   */
  public List<CheckResult> runChecks(String table, Dataset dataset) {
    if (parallelism == 1 || checks.size() < 2) {
      List<CheckResult> results = new ArrayList<>(checks.size());
      for (Check check : checks) {
        results.add(withTable(runIsolated(check, dataset), table));
      }
      return results;
    }
    return runParallel(table, dataset);
  }

  public static Report aggregate(List<CheckResult> results) {
    return new Report(results);
  }

  private List<CheckResult> runParallel(String table, Dataset dataset) {
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, checks.size()),
        new ThreadFactoryBuilder().setNameFormat("hsdq-check-%d").setDaemon(true).build());
    try {
      List<Future<CheckResult>> futures = new ArrayList<>(checks.size());
      for (Check check : checks) {
        futures.add(executor.submit(() -> runIsolated(check, dataset)));
      }

      List<CheckResult> results = new ArrayList<>(checks.size());
      for (int i = 0; i < futures.size(); i++) {
        Check check = checks.get(i);
        try {
          results.add(withTable(futures.get(i).get(), table));
        } catch (ExecutionException e) {
          results.add(withTable(errorResult(check, e.getCause()), table));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          results.add(withTable(errorResult(check, e), table));
        }
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private CheckResult runIsolated(Check check, Dataset dataset) {
    try {
      LOGGER.debug("Running check {}", check.getName());
      CheckResult result = check.run(dataset, config);
      if (result == null) {
        throw new IllegalStateException("Check returned no result");
      }
      return result;
    } catch (VirtualMachineError e) {
      throw e;
    } catch (Exception | Error e) {
      LOGGER.warn("Check " + check.getName() + " failed with an internal error", e);
      return errorResult(check, e);
    }
  }

  private static CheckResult errorResult(Check check, Throwable cause) {
    return CheckResult.builder()
        .checkName(check.getName())
        .status(CheckStatus.FAILED)
        .issue(Issue.builder()
            .type(IssueType.CHECK_ERROR)
            .details("Check could not be executed: " + cause.getClass().getSimpleName()
                + (cause.getMessage() != null ? ": " + cause.getMessage() : ""))
            .build())
        .build();
  }

  private static CheckResult withTable(CheckResult result, String table) {
    return table == null ? result : result.toBuilder().table(table).build();
  }
}
