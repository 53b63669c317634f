/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Release-wide health indicators, computed without never-stable jobs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TopLevelIndicatorsDTO(
        FailingTestResultDTO infrastructure,
        FailingTestResultDTO install,
        FailingTestResultDTO upgrade,
        FailingTestResultDTO tests,
        FailingTestResultDTO finalOperatorHealth,
        VariantHealthDTO variant
) {}
