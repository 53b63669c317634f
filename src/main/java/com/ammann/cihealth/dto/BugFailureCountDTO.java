/* (C)2026 */
package com.ammann.cihealth.dto;

import com.ammann.cihealth.bug.Bug;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Failures and flakes of every test that references a bug, summed per bug.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BugFailureCountDTO(Bug bug, int failureCount, int flakeCount) {}
