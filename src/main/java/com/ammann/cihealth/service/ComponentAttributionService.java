/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.dto.BugzillaJobResultDTO;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.SortedBugzillaComponentResultDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.identification.ComponentIdentification;
import com.ammann.cihealth.model.RawJobResult;
import com.ammann.cihealth.model.RawJobRunResult;
import com.ammann.cihealth.properties.ReportProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jboss.logging.Logger;

/**
 * Attributes failed job runs to bug tracker components.
 *
 * <p>A test belongs to the components of its bugs. Tests without bugs are attributed by
 * name: operator install and upgrade tests through the operator table, everything else
 * through its sig tag.
 */
@ApplicationScoped
public class ComponentAttributionService
{
    private static final Logger LOG = Logger.getLogger(ComponentAttributionService.class);

    static final Comparator<BugzillaJobResultDTO> JOBS_MOST_FAILED_FIRST =
            Comparator.comparingDouble(BugzillaJobResultDTO::failPercentage).reversed()
                    .thenComparing(BugzillaJobResultDTO::jobName);

    static final Comparator<SortedBugzillaComponentResultDTO> COMPONENTS_WORST_FIRST =
            Comparator.comparingDouble(SortedBugzillaComponentResultDTO::worstFailPercentage).reversed()
                    .thenComparing(SortedBugzillaComponentResultDTO::name, String.CASE_INSENSITIVE_ORDER);

    private final MeterRegistry meterRegistry;
    private Counter unmatchedCounter;

    @Inject
    public ComponentAttributionService(Instance<MeterRegistry> meterRegistries)
    {
        this(meterRegistries.isResolvable() ? meterRegistries.get() : null);
    }

    public ComponentAttributionService(MeterRegistry meterRegistry)
    {
        this.meterRegistry = meterRegistry;
    }

    void initMetrics()
    {
        if (meterRegistry != null && unmatchedCounter == null) {
            unmatchedCounter = Counter.builder(ReportProperties.Metrics.UNMATCHED_FAILED_TESTS)
                    .description("Failed test names without a processed test result")
                    .register(meterRegistry);
        }
    }

    /**
     * Ranks components by the failure percentage of their worst job.
     *
     * @param rawJobs       raw jobs keyed by job name, source of the failed test names
     * @param processedJobs processed jobs with unfiltered test results
     * @return components, worst first; ties by case-insensitive name
     */
    public List<SortedBugzillaComponentResultDTO> jobFailuresByComponent(
            Map<String, RawJobResult> rawJobs,
            List<JobResultDTO> processedJobs)
    {
        initMetrics();

        Map<String, JobResultDTO> processedByName = new HashMap<>();
        for (JobResultDTO job : processedJobs) {
            processedByName.put(job.name(), job);
        }

        Map<String, List<BugzillaJobResultDTO>> jobsByComponent = new TreeMap<>();
        for (RawJobResult rawJob : new TreeMap<>(rawJobs).values()) {
            JobResultDTO processed = processedByName.get(rawJob.jobName());
            if (processed == null) {
                continue;
            }
            // each job is distinct, so appending is enough
            jobFailuresByComponent(rawJob, processed).forEach((component, jobResult) ->
                    jobsByComponent.computeIfAbsent(component, c -> new ArrayList<>()).add(jobResult));
        }

        List<SortedBugzillaComponentResultDTO> ranked = new ArrayList<>();
        jobsByComponent.forEach((component, jobs) -> {
            jobs.sort(JOBS_MOST_FAILED_FIRST);
            ranked.add(new SortedBugzillaComponentResultDTO(component, jobs));
        });
        ranked.sort(COMPONENTS_WORST_FIRST);
        return ranked;
    }

    /**
     * Attributes the failed runs of one job, keyed by component.
     */
    Map<String, BugzillaJobResultDTO> jobFailuresByComponent(RawJobResult rawJob, JobResultDTO processed)
    {
        Map<String, TestResultDTO> testResultsByName = new HashMap<>();
        for (TestResultDTO testResult : processed.testResults()) {
            testResultsByName.putIfAbsent(testResult.name(), testResult);
        }

        Map<String, Set<String>> failedRunsByComponent = new TreeMap<>();
        Map<String, Map<String, TestResultDTO>> testsByComponent = new TreeMap<>();
        int unmatched = 0;

        for (RawJobRunResult run : new TreeMap<>(rawJob.jobRunResults()).values()) {
            for (String testName : run.failedTestNames()) {
                TestResultLookup lookup = lookup(testResultsByName, testName);
                if (!lookup.isFound()) {
                    unmatched++;
                    LOG.debugf("Failed test %s of run %s has no test result in job %s, shown as %s",
                            testName, run.jobRunUrl(), rawJob.jobName(), lookup.result().name());
                    continue;
                }
                for (String component : componentsOf(lookup.result())) {
                    failedRunsByComponent.computeIfAbsent(component, c -> new TreeSet<>()).add(run.jobRunUrl());
                    testsByComponent.computeIfAbsent(component, c -> new TreeMap<>())
                            .put(testName, filterByComponent(lookup.result(), component));
                }
            }
        }

        if (unmatched > 0 && unmatchedCounter != null) {
            unmatchedCounter.increment(unmatched);
        }

        int totalRuns = rawJob.jobRunResults().size();
        Map<String, BugzillaJobResultDTO> result = new TreeMap<>();
        failedRunsByComponent.forEach((component, failedRuns) -> {
            List<TestResultDTO> failures = new ArrayList<>(testsByComponent.get(component).values());
            failures.sort(AggregationSupport.TEST_RESULTS_WORST_FIRST);
            result.put(component, new BugzillaJobResultDTO(
                    rawJob.jobName(),
                    component,
                    failedRuns.size(),
                    failedRuns.size() * 100.0 / totalRuns,
                    totalRuns,
                    failures));
        });
        return result;
    }

    static TestResultLookup lookup(Map<String, TestResultDTO> testResultsByName, String testName)
    {
        TestResultDTO testResult = testResultsByName.get(testName);
        return testResult == null ? TestResultLookup.notFound(testName) : TestResultLookup.found(testResult);
    }

    /**
     * Components owning a test: those of its bugs, or the name heuristic when it has none.
     */
    static List<String> componentsOf(TestResultDTO testResult)
    {
        Set<String> components = new TreeSet<>();
        for (Bug bug : testResult.bugList()) {
            components.add(bug.primaryComponent());
        }
        if (!components.isEmpty()) {
            return List.copyOf(components);
        }
        return List.of(ComponentIdentification.componentForTest(testResult.name()));
    }

    /**
     * Restricts a test's bugs to those owned by the component.
     */
    static TestResultDTO filterByComponent(TestResultDTO testResult, String component)
    {
        List<Bug> bugs = new ArrayList<>();
        for (Bug bug : testResult.bugList()) {
            if (bug.primaryComponent().equals(component)) {
                bugs.add(bug);
            }
        }
        return testResult.withBugList(bugs);
    }
}
