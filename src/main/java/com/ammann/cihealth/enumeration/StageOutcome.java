/* (C)2026 */
package com.ammann.cihealth.enumeration;

/**
 * Outcome of a single multistage step, or of the setup phase of a job run.
 *
 * <p>Only {@link #SUCCESS} and {@link #FAILURE} move counters. {@link #UNKNOWN} means the job
 * has no step of that kind, {@link #MISSING} means the step was expected but never reported.
 */
public enum StageOutcome
{
    SUCCESS,
    FAILURE,
    UNKNOWN,
    MISSING;

    public boolean isSuccess() { return this == SUCCESS; }

    public boolean isFailure() { return this == FAILURE; }
}
