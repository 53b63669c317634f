/* (C)2026 */
package com.ammann.cihealth.model;

import java.util.Map;

/**
 * Snapshot of everything collected from the test grid for one release.
 *
 * @param jobResults results for all runs of a job, keyed by job name
 */
public record RawData(Map<String, RawJobResult> jobResults)
{
    public RawData {
        jobResults = jobResults == null ? Map.of() : Map.copyOf(jobResults);
    }
}
