/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Step registry results of a single job, not merged with other jobs using the same template.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ByJobNameDTO(String jobName, StepRegistryMetricsDTO stepRegistryMetrics) {}
