/* (C)2026 */
package com.ammann.cihealth.config;

import com.ammann.cihealth.enumeration.ReportType;
import com.ammann.cihealth.exception.ValidationException;
import java.time.Instant;
import java.util.List;

/**
 * Parameters of one report build.
 *
 * @param release                 release the report is named after
 * @param bugRelease              release used to scope bug lookups and curated tests
 * @param reportType              which time window the snapshot covers
 * @param minRuns                 minimum runs for a test in a frequent job to be listed
 * @param successThreshold        tests passing above this percentage are dropped from filtered views
 * @param numberOfDays            days of data in the snapshot
 * @param failureClusterThreshold minimum failed tests per run for failure groups, negative disables
 * @param timestamp               report timestamp; the only time source the build uses
 * @param analysisWarnings        warnings collected while loading the raw data
 * @throws ValidationException if a value is out of range
 */
public record ReportOptions(
        String release,
        String bugRelease,
        ReportType reportType,
        int minRuns,
        double successThreshold,
        int numberOfDays,
        int failureClusterThreshold,
        Instant timestamp,
        List<String> analysisWarnings
) {
    public ReportOptions {
        if (release == null || release.isBlank()) {
            throw ValidationException.invalidParameter("release", release, "a non-blank release name");
        }
        if (bugRelease == null || bugRelease.isBlank()) {
            bugRelease = release;
        }
        if (reportType == null) {
            reportType = ReportType.CURRENT;
        }
        if (minRuns < 0) {
            throw ValidationException.invalidParameter("minRuns", minRuns, ">= 0");
        }
        if (Double.isNaN(successThreshold) || successThreshold < 0.0 || successThreshold > 100.0) {
            throw ValidationException.invalidParameter("successThreshold", successThreshold, "a value in [0, 100]");
        }
        if (numberOfDays < 1) {
            throw ValidationException.insufficientData("days of data", 1, numberOfDays);
        }
        if (timestamp == null) {
            throw ValidationException.invalidParameter("timestamp", null, "a report timestamp");
        }
        analysisWarnings = analysisWarnings == null ? List.of() : List.copyOf(analysisWarnings);
    }

    public ReportOptions withTimestamp(Instant newTimestamp) {
        return new ReportOptions(release, bugRelease, reportType, minRuns, successThreshold, numberOfDays,
                failureClusterThreshold, newTimestamp, analysisWarnings);
    }

    public ReportOptions withReportType(ReportType newReportType) {
        return new ReportOptions(release, bugRelease, newReportType, minRuns, successThreshold, numberOfDays,
                failureClusterThreshold, timestamp, analysisWarnings);
    }

    public ReportOptions withAnalysisWarnings(List<String> warnings) {
        return new ReportOptions(release, bugRelease, reportType, minRuns, successThreshold, numberOfDays,
                failureClusterThreshold, timestamp, warnings);
    }
}
