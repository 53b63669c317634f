/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One test across all jobs.
 *
 * @param testResultAcrossAllJobs the test's results merged over every contributing job
 * @param jobResults              per-job results, lowest pass percentage first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailingTestResultDTO(
        String testName,
        @JsonProperty("results") TestResultDTO testResultAcrossAllJobs,
        List<FailingTestJobResultDTO> jobResults
) {
    public FailingTestResultDTO {
        jobResults = jobResults == null ? List.of() : List.copyOf(jobResults);
    }

    public static FailingTestResultDTO empty(String testName) {
        return new FailingTestResultDTO(testName, TestResultDTO.empty(testName), List.of());
    }
}
