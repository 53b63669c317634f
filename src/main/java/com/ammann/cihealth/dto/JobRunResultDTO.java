/* (C)2026 */
package com.ammann.cihealth.dto;

import com.ammann.cihealth.enumeration.JobOverallResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A single invocation of a job and its failed tests.
 *
 * @param prowId    numeric id taken from the last segment of the run URL, 0 if not numeric
 * @param timestamp start time in milliseconds since epoch
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunResultDTO(
        long prowId,
        String job,
        String url,
        int testFailures,
        List<String> failedTestNames,
        boolean failed,
        boolean succeeded,
        long timestamp,
        JobOverallResult overallResult
) {
    public JobRunResultDTO {
        failedTestNames = failedTestNames == null ? List.of() : List.copyOf(failedTestNames);
    }
}
