/* (C)2026 */
package com.ammann.cihealth.properties;

/**
 * Centralized registry of configuration keys and defaults used by the report build.
 */
public final class ReportProperties {

    private ReportProperties() {}

    /** Common prefix of all report keys. */
    public static final String PREFIX = "report";

    /** Release the report is built for; also scopes bug lookups and curated tests. */
    public static final String RELEASE = PREFIX + ".release";

    /** Minimum runs a test needs in a frequent job to be listed. */
    public static final String MIN_RUNS = PREFIX + ".min-runs";
    public static final String MIN_RUNS_DEFAULT = "10";

    /** Tests passing above this percentage are dropped from filtered views. */
    public static final String SUCCESS_THRESHOLD = PREFIX + ".success-threshold";
    public static final String SUCCESS_THRESHOLD_DEFAULT = "98.0";

    /** Days of data in the snapshot; decides frequent vs infrequent jobs. */
    public static final String NUMBER_OF_DAYS = PREFIX + ".number-of-days";
    public static final String NUMBER_OF_DAYS_DEFAULT = "7";

    /** Minimum failed tests for a run to be listed as a failure group, -1 disables. */
    public static final String FAILURE_CLUSTER_THRESHOLD = PREFIX + ".failure-cluster-threshold";
    public static final String FAILURE_CLUSTER_THRESHOLD_DEFAULT = "10";

    /**
     * Aggregation executor settings
     */
    public static final class Aggregation {
        private Aggregation() {}

        public static final String EXECUTOR = "report-aggregation-executor";
        public static final String MAX_ASYNC = PREFIX + ".aggregation.max-async";
        public static final String MAX_ASYNC_DEFAULT = "4";
    }

    /**
     * Micrometer meter names
     */
    public static final class Metrics {
        private Metrics() {}

        public static final String REPORT_BUILD = "ci.report.build";
        public static final String UNMATCHED_FAILED_TESTS = "ci.report.failed-tests.unmatched";
    }
}
