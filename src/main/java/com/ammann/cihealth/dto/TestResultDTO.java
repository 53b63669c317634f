/* (C)2026 */
package com.ammann.cihealth.dto;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.service.AggregationSupport;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Complete view of one test within a context (a job, a variant, or all jobs).
 *
 * <p>{@code passPercentage} is always {@code successes * 100 / (successes + failures)}, or 0
 * when the test never ran, so results can be sorted without NaN handling.
 *
 * @param bugList           bugs for the test that target the report's release
 * @param associatedBugList bugs that match the test but target another release
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestResultDTO(
        String name,
        int successes,
        int failures,
        int flakes,
        double passPercentage,
        List<Bug> bugList,
        List<Bug> associatedBugList
) {
    public TestResultDTO {
        bugList = bugList == null ? List.of() : List.copyOf(bugList);
        associatedBugList = associatedBugList == null ? List.of() : List.copyOf(associatedBugList);
    }

    /**
     * Creates a result with the pass percentage derived from the counts.
     */
    public static TestResultDTO of(
            String name,
            int successes,
            int failures,
            int flakes,
            List<Bug> bugList,
            List<Bug> associatedBugList) {
        return new TestResultDTO(
                name,
                successes,
                failures,
                flakes,
                AggregationSupport.percent(successes, failures),
                bugList,
                associatedBugList);
    }

    /**
     * Creates an empty result that merges can start from.
     */
    public static TestResultDTO empty(String name) {
        return new TestResultDTO(name, 0, 0, 0, 0.0, List.of(), List.of());
    }

    public boolean hasBugs() {
        return !bugList.isEmpty();
    }

    public int runs() {
        return successes + failures;
    }

    public TestResultDTO withBugList(List<Bug> bugs) {
        return new TestResultDTO(name, successes, failures, flakes, passPercentage, bugs, associatedBugList);
    }
}
