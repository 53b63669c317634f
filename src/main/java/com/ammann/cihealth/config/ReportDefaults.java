/* (C)2026 */
package com.ammann.cihealth.config;

import com.ammann.cihealth.enumeration.ReportType;
import com.ammann.cihealth.properties.ReportProperties;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Report options read from application.properties.
 */
@ApplicationScoped
public class ReportDefaults
{
    @ConfigProperty(name = ReportProperties.RELEASE)
    String release;

    @ConfigProperty(name = ReportProperties.MIN_RUNS, defaultValue = ReportProperties.MIN_RUNS_DEFAULT)
    int minRuns;

    @ConfigProperty(name = ReportProperties.SUCCESS_THRESHOLD,
            defaultValue = ReportProperties.SUCCESS_THRESHOLD_DEFAULT)
    double successThreshold;

    @ConfigProperty(name = ReportProperties.NUMBER_OF_DAYS, defaultValue = ReportProperties.NUMBER_OF_DAYS_DEFAULT)
    int numberOfDays;

    @ConfigProperty(name = ReportProperties.FAILURE_CLUSTER_THRESHOLD,
            defaultValue = ReportProperties.FAILURE_CLUSTER_THRESHOLD_DEFAULT)
    int failureClusterThreshold;

    /**
     * Builds options for a report of the given type at the given time.
     *
     * @throws com.ammann.cihealth.exception.ValidationException if the configured values are invalid
     */
    public ReportOptions toOptions(ReportType reportType, Instant timestamp) {
        return new ReportOptions(
                release,
                release,
                reportType,
                minRuns,
                successThreshold,
                numberOfDays,
                failureClusterThreshold,
                timestamp,
                List.of());
    }
}
