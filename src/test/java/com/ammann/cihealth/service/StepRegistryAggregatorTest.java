/* (C)2026 */
package com.ammann.cihealth.service;

import static com.ammann.cihealth.support.RawDataFixtures.IPI_INSTALL;
import static com.ammann.cihealth.support.RawDataFixtures.MOST_RUN_STAGE;
import static com.ammann.cihealth.support.RawDataFixtures.NON_MULTISTAGE_JOB;
import static com.ammann.cihealth.support.RawDataFixtures.OPENSHIFT_E2E_TEST;
import static com.ammann.cihealth.support.RawDataFixtures.RELEASE;
import static com.ammann.cihealth.support.RawDataFixtures.e2eJobName;
import static com.ammann.cihealth.support.RawDataFixtures.platformStage;
import static com.ammann.cihealth.support.RawDataFixtures.stepRegistryData;
import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.cihealth.bug.NoOpBugCache;
import com.ammann.cihealth.dto.ByStageNameDTO;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.StageResultDTO;
import com.ammann.cihealth.dto.StepRegistryMetricsDTO;
import com.ammann.cihealth.dto.TopLevelStepRegistryMetricsDTO;
import com.ammann.cihealth.identification.OpenshiftVariantManager;
import com.ammann.cihealth.model.RawData;
import com.ammann.cihealth.model.RawJobResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link StepRegistryAggregator}.
 *
 * <p>Uses ci and nightly e2e jobs on three platforms. Both streams run the same template,
 * so every template sees each stage twice as often as a single job does.
 */
class StepRegistryAggregatorTest
{

    private final StepRegistryAggregator aggregator = new StepRegistryAggregator();
    private final JobResultConverter converter = new JobResultConverter(aggregator);

    @Test
    void jobMetricsCountsEachStageOfOneJob()
    {
        List<JobResultDTO> jobs = convert(stepRegistryData(List.of("ci"), true));
        StepRegistryMetricsDTO metrics = find(jobs, e2eJobName("ci", "aws")).stepRegistryMetrics();

        assertThat(metrics.multistageName()).isEqualTo("e2e-aws");
        assertThat(metrics.stageResults()).containsOnlyKeys(
                platformStage("aws"), IPI_INSTALL, OPENSHIFT_E2E_TEST, MOST_RUN_STAGE);
        assertCounts(metrics.stageResults().get(IPI_INSTALL), 1, 1);
        assertCounts(metrics.stageResults().get(MOST_RUN_STAGE), 1, 2);
        assertCounts(metrics.aggregated(), 1, 2);
        assertThat(metrics.stageResults().get(IPI_INSTALL).originalTestName())
                .isEqualTo("operator.Run multi-stage test e2e-aws - e2e-aws-ipi-install container test");
    }

    @Test
    void byMultistageNameSumsJobsSharingATemplate()
    {
        TopLevelStepRegistryMetricsDTO topLevel =
                aggregator.topLevel(convert(stepRegistryData(List.of("ci", "nightly"), true)));

        assertThat(topLevel.byMultistageName()).containsOnlyKeys("e2e-aws", "e2e-azure", "e2e-gcp");
        StepRegistryMetricsDTO aws = topLevel.byMultistageName().get("e2e-aws");
        assertCounts(aws.stageResults().get(platformStage("aws")), 2, 2);
        assertCounts(aws.stageResults().get(IPI_INSTALL), 2, 2);
        assertCounts(aws.stageResults().get(OPENSHIFT_E2E_TEST), 2, 2);
        assertCounts(aws.stageResults().get(MOST_RUN_STAGE), 2, 4);
        assertCounts(aws.aggregated(), 2, 4);
        assertThat(aws.aggregated().name()).isEqualTo("e2e-aws");
    }

    @Test
    void byStageNameAggregatesAcrossTemplates()
    {
        TopLevelStepRegistryMetricsDTO topLevel =
                aggregator.topLevel(convert(stepRegistryData(List.of("ci", "nightly"), true)));

        ByStageNameDTO ipiInstall = topLevel.byStageName().get(IPI_INSTALL);
        assertCounts(ipiInstall.aggregated(), 6, 6);
        assertThat(ipiInstall.aggregated().originalTestName()).isEmpty();
        assertThat(ipiInstall.byMultistageName()).containsOnlyKeys("e2e-aws", "e2e-azure", "e2e-gcp");
        assertCounts(ipiInstall.byMultistageName().get("e2e-gcp"), 2, 2);

        assertCounts(topLevel.byStageName().get(MOST_RUN_STAGE).aggregated(), 6, 12);

        ByStageNameDTO awsOnly = topLevel.byStageName().get(platformStage("aws"));
        assertCounts(awsOnly.aggregated(), 2, 2);
        assertThat(awsOnly.byMultistageName()).containsOnlyKeys("e2e-aws");
    }

    @Test
    void singleStreamScenarioCountsOneRunPerOutcome()
    {
        TopLevelStepRegistryMetricsDTO topLevel = aggregator.topLevel(convert(stepRegistryData(List.of("ci"), false)));

        assertCounts(topLevel.byStageName().get(IPI_INSTALL).aggregated(), 3, 3);
        for (String platform : List.of("aws", "azure", "gcp")) {
            assertCounts(topLevel.byStageName().get(platformStage(platform)).aggregated(), 1, 1);
        }
    }

    @Test
    void byJobNameSkipsJobsWithoutMultistageData()
    {
        TopLevelStepRegistryMetricsDTO topLevel =
                aggregator.topLevel(convert(stepRegistryData(List.of("ci", "nightly"), true)));

        assertThat(topLevel.byJobName()).hasSize(6).doesNotContainKey(NON_MULTISTAGE_JOB);
        assertThat(topLevel.byJobName().get(e2eJobName("nightly", "azure")).stepRegistryMetrics().multistageName())
                .isEqualTo("e2e-azure");
    }

    @Test
    void aggregateTakesMaximaIndependently()
    {
        StageResultDTO aggregated = StepRegistryAggregator.aggregate("e2e-aws", List.of(
                StageResultDTO.of("a", "", 3, 1),
                StageResultDTO.of("b", "", 2, 2)));

        assertCounts(aggregated, 3, 2);
        assertThat(aggregated.runs()).isEqualTo(5);
    }

    @Test
    void templateIsNotCountedOncePerStage()
    {
        List<StageResultDTO> stages = new ArrayList<>();
        for (String stage : List.of("s1", "s2", "s3", "s4", "s5")) {
            stages.add(StageResultDTO.of(stage, "", 2, 1));
        }

        assertCounts(StepRegistryAggregator.aggregate("e2e-aws", stages), 2, 1);
    }

    @Test
    void combineKeepsStagesOfBothSides()
    {
        StepRegistryMetricsDTO existing = new StepRegistryMetricsDTO("e2e-aws", null,
                Map.of("a", StageResultDTO.of("a", "first name", 1, 0)));
        StepRegistryMetricsDTO incoming = new StepRegistryMetricsDTO("e2e-aws", null,
                Map.of("a", StageResultDTO.of("a", "second name", 0, 1),
                        "b", StageResultDTO.of("b", "b name", 0, 1)));

        StepRegistryMetricsDTO combined = StepRegistryAggregator.combine(existing, incoming);

        assertThat(combined.stageResults()).containsOnlyKeys("a", "b");
        assertCounts(combined.stageResults().get("a"), 1, 1);
        assertThat(combined.stageResults().get("a").originalTestName()).isEqualTo("first name");
        assertCounts(combined.aggregated(), 1, 1);
    }

    @Test
    void topLevelIsIndependentOfJobOrder()
    {
        List<JobResultDTO> jobs = convert(stepRegistryData(List.of("ci", "nightly"), true));
        List<JobResultDTO> reversed = new ArrayList<>(jobs);
        java.util.Collections.reverse(reversed);

        assertThat(aggregator.topLevel(reversed)).isEqualTo(aggregator.topLevel(jobs));
    }

    private List<JobResultDTO> convert(RawData rawData)
    {
        OpenshiftVariantManager variantManager = new OpenshiftVariantManager();
        List<JobResultDTO> jobs = new ArrayList<>();
        for (RawJobResult raw : rawData.jobResults().values()) {
            jobs.add(converter.convert(raw, new NoOpBugCache(), RELEASE, RELEASE, variantManager));
        }
        return jobs;
    }

    private static JobResultDTO find(List<JobResultDTO> jobs, String name)
    {
        return jobs.stream().filter(job -> job.name().equals(name)).findFirst().orElseThrow();
    }

    private static void assertCounts(StageResultDTO result, int successes, int failures)
    {
        assertThat(result.successes()).as("successes of %s", result.name()).isEqualTo(successes);
        assertThat(result.failures()).as("failures of %s", result.name()).isEqualTo(failures);
    }
}
