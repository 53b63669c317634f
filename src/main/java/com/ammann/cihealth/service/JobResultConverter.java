/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.bug.BugCache;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.JobRunResultDTO;
import com.ammann.cihealth.dto.StepRegistryMetricsDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.enumeration.StageOutcome;
import com.ammann.cihealth.identification.VariantManager;
import com.ammann.cihealth.model.RawJobResult;
import com.ammann.cihealth.model.RawJobRunResult;
import com.ammann.cihealth.model.RawTestResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Converts the raw run history of one job into a processed job result.
 *
 * <p>The conversion performs no filtering. Runs are visited in run URL order so the result
 * does not depend on the iteration order of the raw maps.
 */
@ApplicationScoped
public class JobResultConverter
{
    private static final Logger LOG = Logger.getLogger(JobResultConverter.class);

    private final StepRegistryAggregator stepRegistryAggregator;

    @Inject
    public JobResultConverter(StepRegistryAggregator stepRegistryAggregator)
    {
        this.stepRegistryAggregator = stepRegistryAggregator;
    }

    /**
     * Converts one raw job.
     *
     * @param rawJobResult   raw runs and test results of the job
     * @param bugCache       bug lookup; failures are treated as "no bugs"
     * @param release        release the report is named after
     * @param bugRelease     release used to scope bug lookups
     * @param variantManager classifier for the job's variants
     * @return the processed job, test results worst first and runs most recent first
     */
    public JobResultDTO convert(
            RawJobResult rawJobResult,
            BugCache bugCache,
            String release,
            String bugRelease,
            VariantManager variantManager)
    {
        List<TestResultDTO> testResults = convertTestResults(rawJobResult, bugCache, bugRelease);
        Map<String, TestResultDTO> testResultsByName = new HashMap<>();
        for (TestResultDTO testResult : testResults) {
            testResultsByName.put(testResult.name(), testResult);
        }

        List<RawJobRunResult> runs = new ArrayList<>(new TreeMap<>(rawJobResult.jobRunResults()).values());

        int successes = 0;
        int failures = 0;
        int knownFailures = 0;
        int infrastructureFailures = 0;
        List<JobRunResultDTO> allRuns = new ArrayList<>(runs.size());

        for (RawJobRunResult run : runs) {
            allRuns.add(toJobRunResult(run));

            if (run.failed()) {
                failures++;
            } else if (run.succeeded()) {
                successes++;
            }
            if (run.failed() && areAllFailuresKnown(run, testResultsByName, bugCache, bugRelease)) {
                knownFailures++;
            }
            // UNKNOWN means the job has no setup phase we can see, so the failure is probably not infra
            if (run.setupStatus() != StageOutcome.SUCCESS && run.setupStatus() != StageOutcome.UNKNOWN) {
                infrastructureFailures++;
            }
        }

        allRuns.sort(Comparator.comparingLong(JobRunResultDTO::timestamp).reversed());

        double passPercentageWithoutInfrastructure =
                AggregationSupport.percent(successes, failures - infrastructureFailures);
        if (infrastructureFailures > failures) {
            LOG.debugf("Job %s has %d infrastructure failures but only %d failures",
                    rawJobResult.jobName(), infrastructureFailures, failures);
            passPercentageWithoutInfrastructure = -1;
        }

        StepRegistryMetricsDTO stepRegistryMetrics = stepRegistryAggregator.jobMetrics(runs);

        return new JobResultDTO(
                rawJobResult.jobName(),
                release,
                variantManager.identifyVariants(rawJobResult.jobName()),
                rawJobResult.testGridJobUrl(),
                successes,
                failures,
                knownFailures,
                infrastructureFailures,
                AggregationSupport.percent(successes, failures),
                AggregationSupport.percent(successes + knownFailures, failures - knownFailures),
                passPercentageWithoutInfrastructure,
                testResults,
                stepRegistryMetrics,
                allRuns);
    }

    List<TestResultDTO> convertTestResults(RawJobResult rawJobResult, BugCache bugCache, String bugRelease)
    {
        List<TestResultDTO> testResults = new ArrayList<>(rawJobResult.testResults().size());
        for (RawTestResult raw : new TreeMap<>(rawJobResult.testResults()).values()) {
            testResults.add(TestResultDTO.of(
                    raw.name(),
                    raw.successes(),
                    raw.failures(),
                    raw.flakes(),
                    listBugs(bugCache, bugRelease, raw.name()),
                    listAssociatedBugs(bugCache, bugRelease, raw.name())));
        }
        testResults.sort(AggregationSupport.TEST_RESULTS_WORST_FIRST);
        return testResults;
    }

    /**
     * A failed run is a known failure only if it names at least one failed test and every
     * failed test has a bug for the release.
     */
    boolean areAllFailuresKnown(
            RawJobRunResult run,
            Map<String, TestResultDTO> testResultsByName,
            BugCache bugCache,
            String bugRelease)
    {
        if (run.failedTestNames().isEmpty()) {
            return false;
        }
        for (String testName : run.failedTestNames()) {
            TestResultDTO testResult = testResultsByName.get(testName);
            boolean hasBug = testResult != null
                    ? testResult.hasBugs()
                    : !listBugs(bugCache, bugRelease, testName).isEmpty();
            if (!hasBug) {
                return false;
            }
        }
        return true;
    }

    static JobRunResultDTO toJobRunResult(RawJobRunResult run)
    {
        return new JobRunResultDTO(
                prowId(run.jobRunUrl()),
                run.job(),
                run.jobRunUrl(),
                run.testFailures(),
                run.failedTestNames(),
                run.failed(),
                run.succeeded(),
                run.timestamp(),
                run.overallResult());
    }

    /**
     * Parses the numeric run id from the last path segment of a run URL.
     *
     * @return the id, or 0 if the segment is not a number
     */
    static long prowId(String jobRunUrl)
    {
        if (jobRunUrl == null || jobRunUrl.isEmpty()) {
            return 0L;
        }
        String segment = jobRunUrl.substring(jobRunUrl.lastIndexOf('/') + 1);
        try {
            return Long.parseLong(segment);
        } catch (NumberFormatException e) {
            LOG.debugf("Run URL %s does not end in a numeric id", jobRunUrl);
            return 0L;
        }
    }

    private static List<Bug> listBugs(BugCache bugCache, String release, String testName)
    {
        try {
            List<Bug> bugs = bugCache.listBugs(release, "", testName);
            return bugs == null ? List.of() : bugs;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Bug lookup failed for test '%s' in release %s, treating as no bugs", testName, release);
            return List.of();
        }
    }

    private static List<Bug> listAssociatedBugs(BugCache bugCache, String release, String testName)
    {
        try {
            List<Bug> bugs = bugCache.listAssociatedBugs(release, "", testName);
            return bugs == null ? List.of() : bugs;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Associated bug lookup failed for test '%s' in release %s, treating as no bugs",
                    testName, release);
            return List.of();
        }
    }
}
