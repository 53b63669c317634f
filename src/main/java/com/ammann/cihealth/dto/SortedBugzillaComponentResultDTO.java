/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Jobs impacted by one bug tracker component, worst job first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SortedBugzillaComponentResultDTO(String name, List<BugzillaJobResultDTO> jobsFailed)
{
    public SortedBugzillaComponentResultDTO {
        jobsFailed = jobsFailed == null ? List.of() : List.copyOf(jobsFailed);
    }

    /**
     * Fail percentage of the component's worst job, or 0 when no job is impacted.
     */
    @JsonIgnore
    public double worstFailPercentage() {
        return jobsFailed.isEmpty() ? 0.0 : jobsFailed.get(0).failPercentage();
    }
}
