/* (C)2026 */
package com.ammann.cihealth.dto;

import com.ammann.cihealth.enumeration.ReportType;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Complete health report for one release, built from a single raw data snapshot.
 *
 * <p>The report is immutable and holds no reference to the raw input.
 *
 * @param byTest                         every test across all jobs, worst first
 * @param byVariant                      variant buckets, worst first
 * @param byPlatform                     platform buckets, worst first
 * @param failureGroups                  runs with at least the configured number of failed tests
 * @param byJob                          every job with all of its test results
 * @param frequentJobResults             jobs that ran more than 1.5 times per day, tests filtered
 * @param infrequentJobResults           the remaining jobs, tests filtered
 * @param bugsByFailureCount             bugs ranked by the failures of their tests
 * @param jobFailuresByBugzillaComponent components ranked by their worst job
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestReportDTO(
        ReportType reportType,
        String release,
        Instant timestamp,
        JobStatisticsDTO jobStatistics,
        TopLevelIndicatorsDTO topLevelIndicators,
        List<FailingTestResultDTO> byTest,
        List<VariantResultsDTO> byVariant,
        List<VariantResultsDTO> byPlatform,
        List<JobRunResultDTO> failureGroups,
        List<JobResultDTO> byJob,
        List<JobResultDTO> frequentJobResults,
        List<JobResultDTO> infrequentJobResults,
        List<BugFailureCountDTO> bugsByFailureCount,
        List<SortedBugzillaComponentResultDTO> jobFailuresByBugzillaComponent,
        List<FailingTestResultDTO> topFailingTestsWithBug,
        List<FailingTestResultDTO> topFailingTestsWithoutBug,
        List<FailingTestResultDTO> curatedTests,
        TopLevelStepRegistryMetricsDTO topLevelStepRegistryMetrics,
        List<String> analysisWarnings
) {
    public TestReportDTO {
        byTest = copy(byTest);
        byVariant = copy(byVariant);
        byPlatform = copy(byPlatform);
        failureGroups = copy(failureGroups);
        byJob = copy(byJob);
        frequentJobResults = copy(frequentJobResults);
        infrequentJobResults = copy(infrequentJobResults);
        bugsByFailureCount = copy(bugsByFailureCount);
        jobFailuresByBugzillaComponent = copy(jobFailuresByBugzillaComponent);
        topFailingTestsWithBug = copy(topFailingTestsWithBug);
        topFailingTestsWithoutBug = copy(topFailingTestsWithoutBug);
        curatedTests = copy(curatedTests);
        analysisWarnings = copy(analysisWarnings);
    }

    private static <T> List<T> copy(List<T> source) {
        return source == null ? List.of() : List.copyOf(source);
    }
}
