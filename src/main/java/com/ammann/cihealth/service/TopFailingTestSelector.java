/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.dto.FailingTestJobResultDTO;
import com.ammann.cihealth.dto.FailingTestResultDTO;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.identification.TestIdentification;
import com.ammann.cihealth.identification.VariantManager;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Builds the per-test views across all jobs: every test, the worst tests with and without
 * a bug, and the curated tests of a release.
 */
@ApplicationScoped
public class TopFailingTestSelector
{
    static final int MAX_RESULTS = 50;

    /** Tests with fewer combined runs are noise. */
    static final int MIN_COMBINED_RUNS = 10;

    /**
     * Every test across all jobs, with one entry per job that ran it.
     *
     * @return tests, lowest combined pass percentage first
     */
    public List<FailingTestResultDTO> testsAcrossJobs(List<JobResultDTO> jobs)
    {
        List<JobResultDTO> ordered = sortedByName(jobs);
        Map<String, List<JobTestResult>> resultsByTest = new TreeMap<>();
        for (JobResultDTO job : ordered) {
            for (TestResultDTO testResult : distinctByName(job.testResults())) {
                // jobs that did not run the test are left out
                if (testResult.runs() == 0) {
                    continue;
                }
                resultsByTest.computeIfAbsent(testResult.name(), name -> new ArrayList<>())
                        .add(new JobTestResult(job, testResult));
            }
        }

        List<FailingTestResultDTO> byTest = new ArrayList<>(resultsByTest.size());
        resultsByTest.forEach((testName, jobResults) -> byTest.add(failingTestResult(testName, jobResults, r -> true)));
        byTest.sort(AggregationSupport.FAILING_TESTS_WORST_FIRST);
        return byTest;
    }

    public List<FailingTestResultDTO> topFailingTestsWithBug(List<JobResultDTO> jobs)
    {
        return topFailingTests(jobs, TestResultDTO::hasBugs);
    }

    public List<FailingTestResultDTO> topFailingTestsWithoutBug(List<JobResultDTO> jobs)
    {
        return topFailingTests(jobs, testResult -> !testResult.hasBugs());
    }

    public List<FailingTestResultDTO> curatedTests(List<JobResultDTO> jobs, String release)
    {
        return topFailingTests(jobs, testResult -> TestIdentification.isCuratedTest(release, testResult.name()));
    }

    /**
     * Selects up to {@value #MAX_RESULTS} failing tests, worst first.
     *
     * <p>Tests without failures or with fewer than {@value #MIN_COMBINED_RUNS} combined runs
     * are dropped before ranking. Each selected test lists only the jobs where it failed.
     *
     * @param include applied to the test's result merged across all jobs
     */
    List<FailingTestResultDTO> topFailingTests(List<JobResultDTO> jobs, Predicate<TestResultDTO> include)
    {
        List<JobResultDTO> ordered = sortedByName(jobs);
        Map<String, TestResultDTO> totals = new TreeMap<>();
        Map<String, List<JobTestResult>> resultsByTest = new HashMap<>();
        for (JobResultDTO job : ordered) {
            for (TestResultDTO testResult : distinctByName(job.testResults())) {
                totals.merge(testResult.name(), testResult, AggregationSupport::combineTestResult);
                resultsByTest.computeIfAbsent(testResult.name(), name -> new ArrayList<>())
                        .add(new JobTestResult(job, testResult));
            }
        }

        List<TestResultDTO> candidates = new ArrayList<>();
        for (TestResultDTO total : totals.values()) {
            if (total.failures() > 0 && total.runs() >= MIN_COMBINED_RUNS) {
                candidates.add(total);
            }
        }
        candidates.sort(AggregationSupport.TEST_RESULTS_WORST_FIRST);

        List<FailingTestResultDTO> selected = new ArrayList<>();
        for (TestResultDTO candidate : candidates) {
            if (selected.size() >= MAX_RESULTS) {
                break;
            }
            if (!include.test(candidate)) {
                continue;
            }
            FailingTestResultDTO failing = failingTestResult(
                    candidate.name(),
                    resultsByTest.get(candidate.name()),
                    r -> r.testResult().failures() > 0);
            selected.add(new FailingTestResultDTO(candidate.name(), candidate, failing.jobResults()));
        }
        return selected;
    }

    /**
     * Restricts a test's view to jobs that are not never-stable and recomputes its totals.
     *
     * @param byTestName     tests across all jobs, keyed by name
     * @param testName       test to report; an empty result is returned if it never ran
     * @param variantManager decides which jobs are never-stable
     */
    public FailingTestResultDTO excludeNeverStableJobs(
            Map<String, FailingTestResultDTO> byTestName,
            String testName,
            VariantManager variantManager)
    {
        FailingTestResultDTO in = byTestName.get(testName);
        if (in == null) {
            return FailingTestResultDTO.empty(testName);
        }

        List<FailingTestJobResultDTO> kept = new ArrayList<>();
        int successes = 0;
        int failures = 0;
        for (FailingTestJobResultDTO jobResult : in.jobResults()) {
            if (variantManager.isJobNeverStable(jobResult.name())) {
                continue;
            }
            kept.add(jobResult);
            successes += jobResult.testSuccesses();
            failures += jobResult.testFailures();
        }
        kept.sort(AggregationSupport.TEST_JOB_RESULTS_WORST_FIRST);

        TestResultDTO across = TestResultDTO.of(
                testName,
                successes,
                failures,
                0,
                in.testResultAcrossAllJobs().bugList(),
                in.testResultAcrossAllJobs().associatedBugList());
        return new FailingTestResultDTO(testName, across, kept);
    }

    private static FailingTestResultDTO failingTestResult(
            String testName,
            List<JobTestResult> jobResults,
            Predicate<JobTestResult> listJob)
    {
        TestResultDTO across = TestResultDTO.empty(testName);
        List<FailingTestJobResultDTO> entries = new ArrayList<>();
        for (JobTestResult jobResult : jobResults) {
            across = AggregationSupport.combineTestResult(across, jobResult.testResult());
            if (listJob.test(jobResult)) {
                entries.add(new FailingTestJobResultDTO(
                        jobResult.job().name(),
                        jobResult.testResult().failures(),
                        jobResult.testResult().successes(),
                        jobResult.testResult().passPercentage(),
                        jobResult.job().testGridUrl()));
            }
        }
        entries.sort(AggregationSupport.TEST_JOB_RESULTS_WORST_FIRST);
        return new FailingTestResultDTO(testName, across, entries);
    }

    private static List<JobResultDTO> sortedByName(List<JobResultDTO> jobs)
    {
        List<JobResultDTO> ordered = new ArrayList<>(jobs);
        ordered.sort(Comparator.comparing(JobResultDTO::name));
        return ordered;
    }

    // a job reports each test once; keep the first if the input says otherwise
    private static List<TestResultDTO> distinctByName(List<TestResultDTO> testResults)
    {
        Map<String, TestResultDTO> byName = new TreeMap<>();
        for (TestResultDTO testResult : testResults) {
            byName.putIfAbsent(testResult.name(), testResult);
        }
        return new ArrayList<>(byName.values());
    }

    private record JobTestResult(JobResultDTO job, TestResultDTO testResult) {}
}
