/* (C)2026 */
package com.ammann.cihealth.support;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.enumeration.JobOverallResult;
import com.ammann.cihealth.enumeration.StageOutcome;
import com.ammann.cihealth.model.RawData;
import com.ammann.cihealth.model.RawJobResult;
import com.ammann.cihealth.model.RawJobRunResult;
import com.ammann.cihealth.model.RawTestResult;
import com.ammann.cihealth.model.StageState;
import com.ammann.cihealth.model.StepRegistryItemStates;
import com.ammann.cihealth.service.AggregationSupport;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RawDataFixtures {

    private RawDataFixtures() {}

    public static final String RELEASE = "4.9";
    public static final long BASE_TIME = 1_630_000_000_000L;
    public static final List<String> PLATFORMS = List.of("aws", "azure", "gcp");
    public static final String NON_MULTISTAGE_JOB = "non-multistage-job";
    public static final String IPI_INSTALL = "ipi-install";
    public static final String OPENSHIFT_E2E_TEST = "openshift-e2e-test";
    public static final String MOST_RUN_STAGE = "most-run-stage";

    public static String e2eJobName(String stream, String platform) {
        return "periodic-ci-openshift-release-master-" + stream + "-4.9-e2e-" + platform;
    }

    public static String runUrl(String job, long id) {
        return "https://prow.ci.openshift.org/view/gs/origin-ci-test/logs/" + job + "/" + id;
    }

    public static String platformStage(String platform) {
        return platform + "-specific-stage";
    }

    public static RawJobRunResult run(
            String job, long id, boolean failed, long timestamp, String... failedTestNames) {
        return new RawJobRunResult(
                job,
                runUrl(job, id),
                failedTestNames.length,
                Arrays.asList(failedTestNames),
                failed,
                !failed,
                StageOutcome.SUCCESS,
                failed ? JobOverallResult.TEST_FAILURE : JobOverallResult.SUCCEEDED,
                timestamp,
                StepRegistryItemStates.none());
    }

    public static RawJobRunResult run(
            String job,
            long id,
            boolean failed,
            StageOutcome setupStatus,
            JobOverallResult overallResult,
            long timestamp,
            StepRegistryItemStates states,
            String... failedTestNames) {
        return new RawJobRunResult(
                job,
                runUrl(job, id),
                failedTestNames.length,
                Arrays.asList(failedTestNames),
                failed,
                !failed,
                setupStatus,
                overallResult,
                timestamp,
                states);
    }

    public static RawJobResult job(String name, List<RawTestResult> tests, RawJobRunResult... runs) {
        Map<String, RawTestResult> testResults = new LinkedHashMap<>();
        for (RawTestResult test : tests) {
            testResults.put(test.name(), test);
        }
        Map<String, RawJobRunResult> jobRunResults = new LinkedHashMap<>();
        for (RawJobRunResult run : runs) {
            jobRunResults.put(run.jobRunUrl(), run);
        }
        return new RawJobResult(name, "https://testgrid.k8s.io/redhat-openshift#" + name, testResults, jobRunResults);
    }

    public static RawData rawData(RawJobResult... jobs) {
        Map<String, RawJobResult> jobResults = new LinkedHashMap<>();
        for (RawJobResult job : jobs) {
            jobResults.put(job.jobName(), job);
        }
        return new RawData(jobResults);
    }

    public static StepRegistryItemStates stepStates(String multistageName, StageOutcome overall, Map<String, StageOutcome> stages) {
        List<StageState> states = new ArrayList<>();
        stages.forEach((stage, outcome) -> states.add(new StageState(
                stage,
                "operator.Run multi-stage test " + multistageName + " - " + multistageName + "-" + stage + " container test",
                outcome)));
        return new StepRegistryItemStates(
                multistageName,
                new StageState(multistageName, "operator.Run multi-stage test " + multistageName + " container test", overall),
                states);
    }

    /**
     * Multistage e2e jobs, one per stream and platform, plus one job without step data.
     *
     * <p>Every multistage job has a passing run and a run where every stage failed. With
     * {@code includePartialRun} a third run reports only {@value #MOST_RUN_STAGE}, failed.
     */
    public static RawData stepRegistryData(List<String> streams, boolean includePartialRun) {
        List<RawJobResult> jobs = new ArrayList<>();
        long id = 1000;
        for (String stream : streams) {
            for (String platform : PLATFORMS) {
                String job = e2eJobName(stream, platform);
                String template = "e2e-" + platform;
                List<RawJobRunResult> runs = new ArrayList<>();
                runs.add(run(job, ++id, false, StageOutcome.SUCCESS, JobOverallResult.SUCCEEDED, BASE_TIME + id,
                        stepStates(template, StageOutcome.SUCCESS, allStages(platform, StageOutcome.SUCCESS))));
                runs.add(run(job, ++id, true, StageOutcome.SUCCESS, JobOverallResult.TEST_FAILURE, BASE_TIME + id,
                        stepStates(template, StageOutcome.FAILURE, allStages(platform, StageOutcome.FAILURE))));
                if (includePartialRun) {
                    runs.add(run(job, ++id, true, StageOutcome.SUCCESS, JobOverallResult.TEST_FAILURE, BASE_TIME + id,
                            stepStates(template, StageOutcome.FAILURE, Map.of(MOST_RUN_STAGE, StageOutcome.FAILURE))));
                }
                jobs.add(job(job, List.of(), runs.toArray(new RawJobRunResult[0])));
            }
        }
        jobs.add(job(NON_MULTISTAGE_JOB, List.of(),
                run(NON_MULTISTAGE_JOB, ++id, false, BASE_TIME + id),
                run(NON_MULTISTAGE_JOB, ++id, true, BASE_TIME + id)));
        return rawData(jobs.toArray(new RawJobResult[0]));
    }

    private static Map<String, StageOutcome> allStages(String platform, StageOutcome outcome) {
        Map<String, StageOutcome> stages = new LinkedHashMap<>();
        stages.put(platformStage(platform), outcome);
        stages.put(IPI_INSTALL, outcome);
        stages.put(OPENSHIFT_E2E_TEST, outcome);
        stages.put(MOST_RUN_STAGE, outcome);
        return stages;
    }

    public static Bug bug(long id, String component) {
        return new Bug(id, "OCPBUGS-" + id, "bug " + id, "NEW",
                component == null ? List.of() : List.of(component),
                "https://bugzilla.redhat.com/show_bug.cgi?id=" + id);
    }

    public static TestResultDTO testResult(String name, int successes, int failures, Bug... bugs) {
        return TestResultDTO.of(name, successes, failures, 0, List.of(bugs), List.of());
    }

    public static JobResultDTO jobResult(String name, int successes, int failures, TestResultDTO... tests) {
        return jobResult(name, List.of(), successes, failures, 0, tests);
    }

    public static JobResultDTO jobResult(
            String name, List<String> variants, int successes, int failures, int infrastructureFailures,
            TestResultDTO... tests) {
        return new JobResultDTO(
                name,
                RELEASE,
                variants,
                "https://testgrid.k8s.io/redhat-openshift#" + name,
                successes,
                failures,
                0,
                infrastructureFailures,
                AggregationSupport.percent(successes, failures),
                AggregationSupport.percent(successes, failures),
                AggregationSupport.percent(successes, failures - infrastructureFailures),
                List.of(tests),
                null,
                null);
    }
}
