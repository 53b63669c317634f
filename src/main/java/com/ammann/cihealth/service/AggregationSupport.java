/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.dto.FailingTestJobResultDTO;
import com.ammann.cihealth.dto.FailingTestResultDTO;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregation primitives shared by every rollup of the report.
 */
public final class AggregationSupport
{
    private AggregationSupport() {}

    /** Test results, lowest pass percentage first, ties by name. */
    public static final Comparator<TestResultDTO> TEST_RESULTS_WORST_FIRST =
            Comparator.comparingDouble(TestResultDTO::passPercentage).thenComparing(TestResultDTO::name);

    /** Per-job results of a test, lowest pass percentage first, ties by job name. */
    public static final Comparator<FailingTestJobResultDTO> TEST_JOB_RESULTS_WORST_FIRST =
            Comparator.comparingDouble(FailingTestJobResultDTO::passPercentage)
                    .thenComparing(FailingTestJobResultDTO::name);

    /** Tests across all jobs, lowest combined pass percentage first, ties by name. */
    public static final Comparator<FailingTestResultDTO> FAILING_TESTS_WORST_FIRST =
            Comparator.comparingDouble((FailingTestResultDTO f) -> f.testResultAcrossAllJobs().passPercentage())
                    .thenComparing(FailingTestResultDTO::testName);

    /** Jobs, lowest pass percentage first, ties by name. */
    public static final Comparator<JobResultDTO> JOBS_WORST_FIRST =
            Comparator.comparingDouble(JobResultDTO::passPercentage).thenComparing(JobResultDTO::name);

    /**
     * Pass percentage of a counter pair.
     *
     * @return 0 when nothing ran, otherwise {@code successes * 100 / (successes + failures)}
     */
    public static double percent(int successes, int failures) {
        int runs = successes + failures;
        if (runs == 0) {
            return 0.0;
        }
        return (double) successes / runs * 100.0;
    }

    /**
     * Sums two results of the same test. Bug lists are concatenated; consumers that need
     * distinct bugs de-duplicate by URL.
     *
     * @throws IllegalArgumentException if the results belong to different tests
     */
    public static TestResultDTO combineTestResult(TestResultDTO lhs, TestResultDTO rhs) {
        if (!lhs.name().equals(rhs.name())) {
            throw new IllegalArgumentException(
                    String.format("Cannot combine results of different tests: '%s' and '%s'", lhs.name(), rhs.name()));
        }
        return TestResultDTO.of(
                lhs.name(),
                lhs.successes() + rhs.successes(),
                lhs.failures() + rhs.failures(),
                lhs.flakes() + rhs.flakes(),
                concat(lhs.bugList(), rhs.bugList()),
                concat(lhs.associatedBugList(), rhs.associatedBugList()));
    }

    /**
     * Merges {@code results} into {@code accumulator} by test name. The first accumulator
     * entry of a name is the merge target; names not yet present are appended. The result is
     * a new list and is not sorted.
     */
    public static List<TestResultDTO> combineTestResults(List<TestResultDTO> results, List<TestResultDTO> accumulator) {
        List<TestResultDTO> combined = new ArrayList<>(accumulator);
        Map<String, Integer> positionByName = new HashMap<>();
        for (int i = 0; i < combined.size(); i++) {
            positionByName.putIfAbsent(combined.get(i).name(), i);
        }

        for (TestResultDTO result : results) {
            Integer position = positionByName.get(result.name());
            if (position == null) {
                positionByName.put(result.name(), combined.size());
                combined.add(result);
            } else {
                combined.set(position, combineTestResult(combined.get(position), result));
            }
        }
        return combined;
    }

    /**
     * Drops bugs with a URL already seen earlier in the list.
     */
    public static List<Bug> distinctByUrl(List<Bug> bugs) {
        Map<String, Bug> byUrl = new LinkedHashMap<>();
        for (Bug bug : bugs) {
            byUrl.putIfAbsent(bug.url(), bug);
        }
        return List.copyOf(byUrl.values());
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        if (second.isEmpty()) {
            return first;
        }
        List<T> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}
