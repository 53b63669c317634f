/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Processed results of one CI job.
 *
 * @param variants                                    variants the job was classified into
 * @param knownFailures                               failed runs whose every failed test has a bug
 * @param infrastructureFailures                      failed runs whose setup phase did not succeed
 * @param passPercentageWithKnownFailures             pass percentage counting known failures as passes
 * @param passPercentageWithoutInfrastructureFailures pass percentage ignoring infrastructure failures,
 *                                                    -1 when the infrastructure count is inconsistent
 * @param allRuns                                     all runs, most recent first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResultDTO(
        String name,
        String release,
        List<String> variants,
        String testGridUrl,
        int successes,
        int failures,
        int knownFailures,
        int infrastructureFailures,
        double passPercentage,
        double passPercentageWithKnownFailures,
        double passPercentageWithoutInfrastructureFailures,
        List<TestResultDTO> testResults,
        StepRegistryMetricsDTO stepRegistryMetrics,
        List<JobRunResultDTO> allRuns
) {
    public JobResultDTO {
        variants = variants == null ? List.of() : List.copyOf(variants);
        testResults = testResults == null ? List.of() : List.copyOf(testResults);
        stepRegistryMetrics = stepRegistryMetrics == null ? StepRegistryMetricsDTO.empty() : stepRegistryMetrics;
        allRuns = allRuns == null ? List.of() : List.copyOf(allRuns);
    }

    public int runs() {
        return successes + failures;
    }

    public JobResultDTO withTestResults(List<TestResultDTO> filtered) {
        return new JobResultDTO(
                name,
                release,
                variants,
                testGridUrl,
                successes,
                failures,
                knownFailures,
                infrastructureFailures,
                passPercentage,
                passPercentageWithKnownFailures,
                passPercentageWithoutInfrastructureFailures,
                filtered,
                stepRegistryMetrics,
                allRuns);
    }
}
