/* (C)2026 */
package com.ammann.cihealth.dto;

import com.ammann.cihealth.service.AggregationSupport;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Counters for one step registry stage, or for a whole multistage template.
 *
 * @param originalTestName test grid name of the stage before aliasing; empty for aggregates
 * @param runs             successes plus failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResultDTO(
        String name,
        int successes,
        int failures,
        int flakes,
        double passPercentage,
        String originalTestName,
        int runs
) {
    public StageResultDTO {
        originalTestName = originalTestName == null ? "" : originalTestName;
    }

    public static StageResultDTO of(String name, String originalTestName, int successes, int failures) {
        return new StageResultDTO(
                name,
                successes,
                failures,
                0,
                AggregationSupport.percent(successes, failures),
                originalTestName,
                successes + failures);
    }

    public static StageResultDTO empty(String name, String originalTestName) {
        return of(name, originalTestName, 0, 0);
    }

    public StageResultDTO withOriginalTestName(String testName) {
        return new StageResultDTO(name, successes, failures, flakes, passPercentage, testName, runs);
    }
}
