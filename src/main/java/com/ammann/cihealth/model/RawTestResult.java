/* (C)2026 */
package com.ammann.cihealth.model;

/**
 * Counts for one test inside one job, summed over all of the job's runs.
 *
 * @param name      test name
 * @param successes number of passing runs
 * @param failures  number of failing runs
 * @param flakes    number of runs where the test failed and then passed on retry
 */
public record RawTestResult(String name, int successes, int failures, int flakes)
{
    public RawTestResult(String name, int successes, int failures) {
        this(name, successes, failures, 0);
    }
}
