/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.dto.TestResultDTO;

/**
 * Outcome of looking up a failed test name among a job's processed test results.
 *
 * <p>A failed test name is expected to have a processed result. When it does not, the lookup
 * is {@link Status#NOT_FOUND} and carries a display result whose name starts with
 * {@value #NOT_FOUND_PREFIX}; its counters are empty and must not be aggregated.
 */
public record TestResultLookup(Status status, String testName, TestResultDTO result)
{
    public static final String NOT_FOUND_PREFIX = "if-seen-report-bug---";

    public enum Status { FOUND, NOT_FOUND }

    public static TestResultLookup found(TestResultDTO result) {
        return new TestResultLookup(Status.FOUND, result.name(), result);
    }

    public static TestResultLookup notFound(String testName) {
        return new TestResultLookup(Status.NOT_FOUND, testName, TestResultDTO.empty(NOT_FOUND_PREFIX + testName));
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }
}
