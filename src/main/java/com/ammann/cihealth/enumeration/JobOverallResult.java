/* (C)2026 */
package com.ammann.cihealth.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall result of a job run, serialized with the single-letter codes used by the test grid.
 */
public enum JobOverallResult
{
    SUCCEEDED("S"),
    RUNNING("R"),
    INFRASTRUCTURE_FAILURE("N"),
    INSTALL_FAILURE("I"),
    UPGRADE_FAILURE("U"),
    TEST_FAILURE("F"),
    FAILURE_BEFORE_SETUP("n"),
    ABORTED("A"),
    UNKNOWN("f");

    private final String code;

    JobOverallResult(String code) {
        this.code = code;
    }

    /** Single-letter code; case-sensitive ({@code "N"} and {@code "n"} differ). */
    @JsonValue
    public String getCode() { return code; }
}
