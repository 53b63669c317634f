/* (C)2026 */
package com.ammann.cihealth.model;

import java.util.Map;

/**
 * Raw results of every run of a single CI job.
 *
 * @param jobName        name of the CI job
 * @param testGridJobUrl link to the job's test grid dashboard
 * @param testResults    per-test results aggregated over all runs, keyed by test name
 * @param jobRunResults  individual runs, keyed by run URL
 */
public record RawJobResult(
        String jobName,
        String testGridJobUrl,
        Map<String, RawTestResult> testResults,
        Map<String, RawJobRunResult> jobRunResults
) {
    public RawJobResult {
        testResults = testResults == null ? Map.of() : Map.copyOf(testResults);
        jobRunResults = jobRunResults == null ? Map.of() : Map.copyOf(jobRunResults);
    }
}
