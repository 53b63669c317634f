/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Number of variants per health status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VariantHealthDTO(int success, int unstable, int failed) {}
