/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Failures of one job attributed to one bug tracker component.
 *
 * @param numberOfJobRunsFailed distinct runs with at least one failure attributed to the component
 * @param failPercentage        {@code numberOfJobRunsFailed * 100 / totalRuns}
 * @param failures              the attributed tests, restricted to the component's bugs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BugzillaJobResultDTO(
        String jobName,
        String bugzillaComponent,
        int numberOfJobRunsFailed,
        double failPercentage,
        int totalRuns,
        List<TestResultDTO> failures
) {
    public BugzillaJobResultDTO {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
