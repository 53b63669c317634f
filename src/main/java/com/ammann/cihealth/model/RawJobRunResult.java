/* (C)2026 */
package com.ammann.cihealth.model;

import com.ammann.cihealth.enumeration.JobOverallResult;
import com.ammann.cihealth.enumeration.StageOutcome;
import java.util.List;

/**
 * A single invocation of a CI job.
 *
 * @param job                    job name
 * @param jobRunUrl              URL of this run, unique within the job
 * @param testFailures           number of failed tests in the run
 * @param failedTestNames        names of the failed tests
 * @param failed                 true if the run failed
 * @param succeeded              true if the run succeeded
 * @param setupStatus            outcome of the install/setup phase
 * @param overallResult          test grid overall result code
 * @param timestamp              start time in milliseconds since epoch
 * @param stepRegistryItemStates multistage step outcomes of this run
 */
public record RawJobRunResult(
        String job,
        String jobRunUrl,
        int testFailures,
        List<String> failedTestNames,
        boolean failed,
        boolean succeeded,
        StageOutcome setupStatus,
        JobOverallResult overallResult,
        long timestamp,
        StepRegistryItemStates stepRegistryItemStates
) {
    public RawJobRunResult {
        failedTestNames = failedTestNames == null ? List.of() : List.copyOf(failedTestNames);
        setupStatus = setupStatus == null ? StageOutcome.UNKNOWN : setupStatus;
        overallResult = overallResult == null ? JobOverallResult.UNKNOWN : overallResult;
        stepRegistryItemStates = stepRegistryItemStates == null
                ? StepRegistryItemStates.none()
                : stepRegistryItemStates;
    }
}
