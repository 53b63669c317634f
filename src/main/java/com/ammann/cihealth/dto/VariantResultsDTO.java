/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Job and test results of every job classified into one variant or platform.
 *
 * @param jobResults     member jobs, worst pass percentage first
 * @param allTestResults test results merged across member jobs, then filtered
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariantResultsDTO(
        String variantName,
        int jobRunSuccesses,
        int jobRunFailures,
        int jobRunKnownFailures,
        int jobRunInfrastructureFailures,
        double jobRunPassPercentage,
        double jobRunPassPercentageWithKnownFailures,
        double jobRunPassPercentageWithoutInfrastructureFailures,
        List<JobResultDTO> jobResults,
        List<TestResultDTO> allTestResults
) {
    public VariantResultsDTO {
        jobResults = jobResults == null ? List.of() : List.copyOf(jobResults);
        allTestResults = allTestResults == null ? List.of() : List.copyOf(allTestResults);
    }

    public int jobRuns() {
        return jobRunSuccesses + jobRunFailures;
    }
}
