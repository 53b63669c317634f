/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.bug.BugCache;
import com.ammann.cihealth.bug.NoOpBugCache;
import com.ammann.cihealth.config.ReportDefaults;
import com.ammann.cihealth.config.ReportOptions;
import com.ammann.cihealth.dto.BugFailureCountDTO;
import com.ammann.cihealth.dto.FailingTestResultDTO;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.JobRunResultDTO;
import com.ammann.cihealth.dto.JobStatisticsDTO;
import com.ammann.cihealth.dto.SortedBugzillaComponentResultDTO;
import com.ammann.cihealth.dto.TestReportDTO;
import com.ammann.cihealth.dto.TopLevelIndicatorsDTO;
import com.ammann.cihealth.dto.TopLevelStepRegistryMetricsDTO;
import com.ammann.cihealth.dto.VariantHealthDTO;
import com.ammann.cihealth.dto.VariantResultsDTO;
import com.ammann.cihealth.enumeration.JobOverallResult;
import com.ammann.cihealth.enumeration.ReportType;
import com.ammann.cihealth.enumeration.VariantHealthStatus;
import com.ammann.cihealth.exception.ReportException;
import com.ammann.cihealth.exception.ValidationException;
import com.ammann.cihealth.identification.OpenshiftVariantManager;
import com.ammann.cihealth.identification.PlatformVariantManager;
import com.ammann.cihealth.identification.TestIdentification;
import com.ammann.cihealth.identification.VariantManager;
import com.ammann.cihealth.model.RawData;
import com.ammann.cihealth.model.RawJobResult;
import com.ammann.cihealth.model.RawJobRunResult;
import com.ammann.cihealth.properties.ReportProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Assembles the complete health report of a release from one raw data snapshot.
 *
 * <p>Jobs are converted first. The rollups that only read the converted jobs are
 * independent and run concurrently on the report aggregation executor; each of them is
 * sequential internally. The report timestamp from the options is the only time source,
 * so identical input yields an identical report.
 */
@ApplicationScoped
public class TestReportService
{
    private static final Logger LOG = Logger.getLogger(TestReportService.class);

    static final Duration PROMOTION_STALE_AFTER = Duration.ofHours(12);
    static final int PROMOTION_FAILED_RUNS = 3;

    /** Synthetic infrequent jobs run too rarely for a minimum run count. */
    static final int INFREQUENT_JOB_MIN_RUNS = 1;

    private final JobResultConverter jobResultConverter;
    private final StepRegistryAggregator stepRegistryAggregator;
    private final VariantAggregator variantAggregator;
    private final ComponentAttributionService componentAttributionService;
    private final TopFailingTestSelector topFailingTestSelector;
    private final JobStatisticsService jobStatisticsService;
    private final VariantManager variantManager;
    private final BugCache bugCache;
    private final ReportDefaults reportDefaults;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    @Inject
    public TestReportService(JobResultConverter jobResultConverter,
                             StepRegistryAggregator stepRegistryAggregator,
                             VariantAggregator variantAggregator,
                             ComponentAttributionService componentAttributionService,
                             TopFailingTestSelector topFailingTestSelector,
                             JobStatisticsService jobStatisticsService,
                             VariantManager variantManager,
                             BugCache bugCache,
                             ReportDefaults reportDefaults,
                             @Named(ReportProperties.Aggregation.EXECUTOR) ManagedExecutor executor,
                             Instance<MeterRegistry> meterRegistries)
    {
        this.jobResultConverter = jobResultConverter;
        this.stepRegistryAggregator = stepRegistryAggregator;
        this.variantAggregator = variantAggregator;
        this.componentAttributionService = componentAttributionService;
        this.topFailingTestSelector = topFailingTestSelector;
        this.jobStatisticsService = jobStatisticsService;
        this.variantManager = variantManager;
        this.bugCache = bugCache;
        this.reportDefaults = reportDefaults;
        this.executor = executor;
        this.meterRegistry = meterRegistries.isResolvable() ? meterRegistries.get() : null;
    }

    /**
     * Creates a service outside of CDI with default collaborators. Options must be passed
     * explicitly to {@link #prepareTestReport(RawData, VariantManager, BugCache, ReportOptions)}.
     *
     * @param executor      runs the independent rollups, e.g. {@code Runnable::run}
     * @param meterRegistry registry for the build timer, may be {@code null}
     */
    public TestReportService(Executor executor, MeterRegistry meterRegistry)
    {
        this.stepRegistryAggregator = new StepRegistryAggregator();
        this.jobResultConverter = new JobResultConverter(stepRegistryAggregator);
        this.variantAggregator = new VariantAggregator();
        this.componentAttributionService = new ComponentAttributionService(meterRegistry);
        this.topFailingTestSelector = new TopFailingTestSelector();
        this.jobStatisticsService = new JobStatisticsService();
        this.variantManager = new OpenshiftVariantManager();
        this.bugCache = new NoOpBugCache();
        this.reportDefaults = null;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Builds a report with the injected classifier and bug cache and the configured defaults.
     *
     * @throws ValidationException if the configured options are invalid
     */
    public TestReportDTO prepareTestReport(RawData rawData, ReportType reportType, Instant timestamp)
    {
        if (reportDefaults == null) {
            throw new ReportException("No configured report defaults; pass ReportOptions explicitly");
        }
        return prepareTestReport(rawData, variantManager, bugCache, reportDefaults.toOptions(reportType, timestamp));
    }

    /**
     * Builds a report.
     *
     * @param rawData        the snapshot; it is not retained by the report
     * @param variantManager classifier for variants; platforms are derived from it
     * @param bugCache       bug lookup; lookup failures degrade to "no bugs"
     * @param options        thresholds, release and timestamp of the report
     * @return the immutable report
     * @throws ValidationException if {@code rawData} or {@code options} is missing
     * @throws ReportException     if a rollup fails
     */
    public TestReportDTO prepareTestReport(
            RawData rawData,
            VariantManager variantManager,
            BugCache bugCache,
            ReportOptions options)
    {
        if (rawData == null) {
            throw ValidationException.invalidParameter("rawData", null, "a raw data snapshot");
        }
        if (options == null) {
            throw ValidationException.invalidParameter("options", null, "report options");
        }
        long startNanos = System.nanoTime();

        List<JobResultDTO> allJobs = convertJobs(rawData, variantManager, bugCache, options);

        TestResultFilter standardFilter = TestResultFilter.standard(options.minRuns(), options.successThreshold());
        TestResultFilter infrequentFilter =
                TestResultFilter.standard(INFREQUENT_JOB_MIN_RUNS, options.successThreshold());
        VariantManager platformManager = new PlatformVariantManager(variantManager);

        CompletableFuture<JobStatisticsDTO> statistics = async(() -> jobStatisticsService.calculate(allJobs));
        CompletableFuture<List<VariantResultsDTO>> byVariant =
                async(() -> variantAggregator.aggregate(allJobs, variantManager, standardFilter));
        CompletableFuture<List<VariantResultsDTO>> byPlatform =
                async(() -> variantAggregator.aggregate(allJobs, platformManager, standardFilter));
        CompletableFuture<TopLevelStepRegistryMetricsDTO> stepRegistryMetrics =
                async(() -> stepRegistryAggregator.topLevel(allJobs));
        CompletableFuture<List<SortedBugzillaComponentResultDTO>> byComponent =
                async(() -> componentAttributionService.jobFailuresByComponent(rawData.jobResults(), allJobs));
        CompletableFuture<List<FailingTestResultDTO>> byTest =
                async(() -> topFailingTestSelector.testsAcrossJobs(allJobs));
        CompletableFuture<List<FailingTestResultDTO>> withBug =
                async(() -> topFailingTestSelector.topFailingTestsWithBug(allJobs));
        CompletableFuture<List<FailingTestResultDTO>> withoutBug =
                async(() -> topFailingTestSelector.topFailingTestsWithoutBug(allJobs));
        CompletableFuture<List<FailingTestResultDTO>> curated =
                async(() -> topFailingTestSelector.curatedTests(allJobs, options.bugRelease()));

        List<VariantResultsDTO> variants = await(byVariant, "variant aggregation");
        List<FailingTestResultDTO> tests = await(byTest, "test aggregation");

        List<String> analysisWarnings = new ArrayList<>(options.analysisWarnings());
        if (options.reportType() == ReportType.CURRENT) {
            analysisWarnings.addAll(promotionWarnings(variants, options.timestamp()));
        }

        TestReportDTO report = new TestReportDTO(
                options.reportType(),
                options.release(),
                options.timestamp(),
                await(statistics, "job statistics"),
                topLevelIndicators(tests, variants, variantManager),
                tests,
                variants,
                await(byPlatform, "platform aggregation"),
                failureGroups(rawData, options.failureClusterThreshold()),
                allJobs,
                frequentJobs(allJobs, options.numberOfDays(), standardFilter),
                infrequentJobs(allJobs, options.numberOfDays(), infrequentFilter),
                bugFailureCounts(tests),
                await(byComponent, "component attribution"),
                await(withBug, "top failing tests with bug"),
                await(withoutBug, "top failing tests without bug"),
                await(curated, "curated tests"),
                await(stepRegistryMetrics, "step registry aggregation"),
                analysisWarnings);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        recordBuild(options, elapsed);
        LOG.infof("Built %s report for release %s: %d jobs, %d tests, %d variants, %d warnings in %d ms",
                options.reportType(), options.release(), allJobs.size(), tests.size(), variants.size(),
                analysisWarnings.size(), elapsed.toMillis());
        return report;
    }

    /**
     * Converts every raw job, worst pass percentage first.
     */
    List<JobResultDTO> convertJobs(RawData rawData, VariantManager variantManager, BugCache bugCache,
                                   ReportOptions options)
    {
        List<JobResultDTO> jobs = new ArrayList<>(rawData.jobResults().size());
        for (RawJobResult rawJobResult : new TreeMap<>(rawData.jobResults()).values()) {
            jobs.add(jobResultConverter.convert(
                    rawJobResult, bugCache, options.release(), options.bugRelease(), variantManager));
        }
        jobs.sort(AggregationSupport.JOBS_WORST_FIRST);
        return jobs;
    }

    static boolean isFrequent(JobResultDTO job, int numberOfDays)
    {
        return job.runs() > numberOfDays * 1.5;
    }

    static List<JobResultDTO> frequentJobs(List<JobResultDTO> jobs, int numberOfDays, TestResultFilter filter)
    {
        List<JobResultDTO> frequent = new ArrayList<>();
        for (JobResultDTO job : jobs) {
            if (isFrequent(job, numberOfDays)) {
                frequent.add(job.withTestResults(filter.filter(job.testResults())));
            }
        }
        return frequent;
    }

    static List<JobResultDTO> infrequentJobs(List<JobResultDTO> jobs, int numberOfDays, TestResultFilter filter)
    {
        List<JobResultDTO> infrequent = new ArrayList<>();
        for (JobResultDTO job : jobs) {
            if (!isFrequent(job, numberOfDays)) {
                infrequent.add(job.withTestResults(filter.filter(job.testResults())));
            }
        }
        return infrequent;
    }

    /**
     * Runs with at least {@code threshold} failed tests, most failures first, ties by URL.
     * A negative threshold disables the list.
     */
    static List<JobRunResultDTO> failureGroups(RawData rawData, int threshold)
    {
        List<JobRunResultDTO> groups = new ArrayList<>();
        if (threshold < 0) {
            return groups;
        }
        for (RawJobResult rawJobResult : rawData.jobResults().values()) {
            for (RawJobRunResult run : rawJobResult.jobRunResults().values()) {
                if (run.testFailures() >= threshold) {
                    groups.add(JobResultConverter.toJobRunResult(run));
                }
            }
        }
        groups.sort(Comparator.comparingInt(JobRunResultDTO::testFailures).reversed()
                .thenComparing(JobRunResultDTO::url));
        return groups;
    }

    /**
     * Sums the failures and flakes of every test referencing a bug, per bug URL.
     *
     * @return bugs, most failures first, ties by URL
     */
    static List<BugFailureCountDTO> bugFailureCounts(List<FailingTestResultDTO> tests)
    {
        Map<String, Bug> bugsByUrl = new HashMap<>();
        Map<String, int[]> countsByUrl = new HashMap<>();
        for (FailingTestResultDTO test : tests) {
            var across = test.testResultAcrossAllJobs();
            for (Bug bug : AggregationSupport.distinctByUrl(across.bugList())) {
                bugsByUrl.putIfAbsent(bug.url(), bug);
                int[] counts = countsByUrl.computeIfAbsent(bug.url(), url -> new int[2]);
                counts[0] += across.failures();
                counts[1] += across.flakes();
            }
        }

        List<BugFailureCountDTO> result = new ArrayList<>(bugsByUrl.size());
        bugsByUrl.forEach((url, bug) ->
                result.add(new BugFailureCountDTO(bug, countsByUrl.get(url)[0], countsByUrl.get(url)[1])));
        result.sort(Comparator.comparingInt(BugFailureCountDTO::failureCount).reversed()
                .thenComparing(count -> count.bug().url()));
        return result;
    }

    TopLevelIndicatorsDTO topLevelIndicators(
            List<FailingTestResultDTO> tests,
            List<VariantResultsDTO> variants,
            VariantManager variantManager)
    {
        Map<String, FailingTestResultDTO> byName = new LinkedHashMap<>();
        for (FailingTestResultDTO test : tests) {
            byName.put(test.testName(), test);
        }
        return new TopLevelIndicatorsDTO(
                topFailingTestSelector.excludeNeverStableJobs(
                        byName, TestIdentification.INFRASTRUCTURE_TEST_NAME, variantManager),
                topFailingTestSelector.excludeNeverStableJobs(
                        byName, TestIdentification.INSTALL_TEST_NAME, variantManager),
                topFailingTestSelector.excludeNeverStableJobs(
                        byName, TestIdentification.UPGRADE_TEST_NAME, variantManager),
                topFailingTestSelector.excludeNeverStableJobs(
                        byName, TestIdentification.OPENSHIFT_TESTS_NAME, variantManager),
                topFailingTestSelector.excludeNeverStableJobs(
                        byName, TestIdentification.FINAL_OPERATOR_HEALTH_TEST_NAME, variantManager),
                variantHealth(variants));
    }

    /**
     * Counts variants per health status. Never-stable and buckets without runs are skipped.
     */
    static VariantHealthDTO variantHealth(List<VariantResultsDTO> variants)
    {
        int success = 0;
        int unstable = 0;
        int failed = 0;
        for (VariantResultsDTO variant : variants) {
            if (VariantManager.NEVER_STABLE.equals(variant.variantName()) || variant.jobRuns() == 0) {
                continue;
            }
            switch (VariantHealthStatus.fromPassPercentage(variant.jobRunPassPercentage())) {
                case SUCCESS -> success++;
                case UNSTABLE -> unstable++;
                case FAILED -> failed++;
            }
        }
        return new VariantHealthDTO(success, unstable, failed);
    }

    /**
     * Warns about promotion jobs that have not run for twelve hours before the report
     * timestamp, or whose last three runs did not succeed.
     */
    static List<String> promotionWarnings(List<VariantResultsDTO> variants, Instant reportTimestamp)
    {
        List<String> warnings = new ArrayList<>();
        long staleBefore = reportTimestamp.minus(PROMOTION_STALE_AFTER).toEpochMilli();

        for (VariantResultsDTO variant : variants) {
            if (!VariantManager.PROMOTE.equals(variant.variantName())) {
                continue;
            }
            for (JobResultDTO job : variant.jobResults()) {
                List<JobRunResultDTO> runs = job.allRuns();
                if (!runs.isEmpty() && runs.get(0).timestamp() < staleBefore) {
                    warnings.add(String.format("The last run of %s (%s) was more than 12 hours ago.",
                            job.name(), runs.get(0).url()));
                }
                if (runs.size() < PROMOTION_FAILED_RUNS) {
                    continue;
                }
                List<String> failedUrls = new ArrayList<>();
                for (JobRunResultDTO run : runs.subList(0, PROMOTION_FAILED_RUNS)) {
                    if (run.overallResult() != JobOverallResult.SUCCEEDED) {
                        failedUrls.add(run.url());
                    }
                }
                if (failedUrls.size() == PROMOTION_FAILED_RUNS) {
                    warnings.add(String.format("The last three promotion jobs for %s failed: %s",
                            job.name(), String.join(", ", failedUrls)));
                }
            }
            break;
        }
        return warnings;
    }

    private <T> CompletableFuture<T> async(Supplier<T> step)
    {
        return CompletableFuture.supplyAsync(step, executor);
    }

    private static <T> T await(CompletableFuture<T> future, String step)
    {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ReportException("Report " + step + " failed: " + cause.getMessage(), cause);
        }
    }

    private void recordBuild(ReportOptions options, Duration elapsed)
    {
        if (meterRegistry == null) {
            return;
        }
        Timer.builder(ReportProperties.Metrics.REPORT_BUILD)
                .description("Time to assemble a CI health report")
                .tag("release", options.release())
                .tag("type", options.reportType().name())
                .register(meterRegistry)
                .record(elapsed);
    }
}
