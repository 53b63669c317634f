/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Results of one test inside one job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailingTestJobResultDTO(
        String name,
        int testFailures,
        int testSuccesses,
        double passPercentage,
        String testGridUrl
) {}
