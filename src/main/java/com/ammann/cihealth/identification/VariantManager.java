/* (C)2026 */
package com.ammann.cihealth.identification;

import java.util.List;
import java.util.SortedSet;

/**
 * Classifies CI jobs into variants (cloud platform, network type, upgrade, ...).
 *
 * <p>A job may belong to several variants. Implementations must be stateless so a single
 * instance can classify jobs from concurrently running report builds.
 */
public interface VariantManager
{
    /** Variant name used for jobs excluded from every other variant. */
    String NEVER_STABLE = "never-stable";

    /** Variant name for tech preview jobs, also excluded from every other variant. */
    String TECH_PREVIEW = "techpreview";

    /** Variant name for release promotion jobs. */
    String PROMOTE = "promote";

    /**
     * All variant values this manager can produce, in iteration order of the report.
     */
    SortedSet<String> allVariants();

    /**
     * Returns the variants of a job. Jobs that match no rule get a single placeholder value
     * that is not part of {@link #allVariants()}.
     */
    List<String> identifyVariants(String jobName);

    /**
     * Whether the job is known to have never been stable and is kept out of variant health.
     */
    boolean isJobNeverStable(String jobName);
}
