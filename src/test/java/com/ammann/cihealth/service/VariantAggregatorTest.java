/* (C)2026 */
package com.ammann.cihealth.service;

import static com.ammann.cihealth.support.RawDataFixtures.jobResult;
import static com.ammann.cihealth.support.RawDataFixtures.testResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.dto.VariantResultsDTO;
import com.ammann.cihealth.identification.OpenshiftVariantManager;
import com.ammann.cihealth.identification.VariantManager;
import java.util.List;
import org.junit.jupiter.api.Test;

class VariantAggregatorTest
{

    private static final String AWS = "periodic-ci-openshift-release-master-ci-4.9-e2e-aws";
    private static final String AWS_SERIAL = "periodic-ci-openshift-release-master-nightly-4.9-e2e-aws-serial";
    private static final String GCP = "periodic-ci-openshift-release-master-ci-4.9-e2e-gcp";

    private final VariantAggregator aggregator = new VariantAggregator();
    private final VariantManager variantManager = new OpenshiftVariantManager();
    private final TestResultFilter standard = TestResultFilter.standard(10, 98.0);

    @Test
    void buildsOneBucketPerVariantIncludingEmptyOnes()
    {
        List<VariantResultsDTO> buckets = aggregator.aggregate(
                List.of(jobResult(AWS, 8, 2)), variantManager, standard);

        assertThat(buckets).extracting(VariantResultsDTO::variantName)
                .containsExactlyInAnyOrderElementsOf(variantManager.allVariants());
        VariantResultsDTO ovirt = bucket(buckets, "ovirt");
        assertThat(ovirt.jobRuns()).isZero();
        assertThat(ovirt.jobResults()).isEmpty();
        assertThat(ovirt.jobRunPassPercentage()).isZero();
    }

    @Test
    void sumsRunsOfMemberJobsAndSortsMembersWorstFirst()
    {
        List<VariantResultsDTO> buckets = aggregator.aggregate(
                List.of(jobResult(AWS, 8, 2), jobResult(AWS_SERIAL, 2, 8), jobResult(GCP, 5, 5)),
                variantManager, standard);

        VariantResultsDTO aws = bucket(buckets, "aws");
        assertThat(aws.jobRunSuccesses()).isEqualTo(10);
        assertThat(aws.jobRunFailures()).isEqualTo(10);
        assertThat(aws.jobRunPassPercentage()).isCloseTo(50.0, within(1e-9));
        assertThat(aws.jobResults()).extracting(JobResultDTO::name).containsExactly(AWS_SERIAL, AWS);

        assertThat(bucket(buckets, "serial").jobResults()).extracting(JobResultDTO::name).containsExactly(AWS_SERIAL);
    }

    @Test
    void mergesTestResultsBeforeFiltering()
    {
        List<VariantResultsDTO> buckets = aggregator.aggregate(
                List.of(jobResult(AWS, 8, 2, testResult("[sig-a] t", 3, 2)),
                        jobResult(AWS_SERIAL, 2, 8, testResult("[sig-a] t", 0, 5))),
                variantManager, standard);

        assertThat(bucket(buckets, "aws").allTestResults()).singleElement().satisfies(test -> {
            assertThat(test.successes()).isEqualTo(3);
            assertThat(test.failures()).isEqualTo(7);
        });
        assertThat(bucket(buckets, "serial").allTestResults()).isEmpty();
    }

    @Test
    void sortsFilteredTestsWorstFirst()
    {
        List<VariantResultsDTO> buckets = aggregator.aggregate(
                List.of(jobResult(GCP, 5, 5,
                        testResult("[sig-a] better", 8, 2),
                        testResult("[sig-a] worse", 2, 8),
                        testResult("[sig-a] passing", 10, 0))),
                variantManager, standard);

        assertThat(bucket(buckets, "gcp").allTestResults()).extracting(TestResultDTO::name)
                .containsExactly("[sig-a] worse", "[sig-a] better");
    }

    @Test
    void ignoresInfrastructureCountsOfInconsistentJobs()
    {
        List<VariantResultsDTO> buckets = aggregator.aggregate(
                List.of(jobResult(AWS, List.of(), 5, 1, 3), jobResult(AWS_SERIAL, List.of(), 5, 2, 1)),
                variantManager, standard);

        VariantResultsDTO aws = bucket(buckets, "aws");
        assertThat(aws.jobRunInfrastructureFailures()).isEqualTo(1);
        assertThat(aws.jobRunPassPercentageWithoutInfrastructureFailures())
                .isCloseTo(AggregationSupport.percent(10, 2), within(1e-9));
    }

    @Test
    void ordersBucketsByPassPercentageKeepingVariantOrderForTies()
    {
        List<VariantResultsDTO> buckets = aggregator.aggregate(
                List.of(jobResult(AWS, 9, 1), jobResult(GCP, 3, 7)), variantManager, standard);

        assertThat(buckets.get(buckets.size() - 1).variantName()).isEqualTo("aws");
        assertThat(buckets.get(buckets.size() - 2).variantName()).isEqualTo("gcp");
        assertThat(buckets.get(0).variantName()).isEqualTo(variantManager.allVariants().first());
        for (int i = 1; i < buckets.size(); i++) {
            assertThat(buckets.get(i).jobRunPassPercentage())
                    .isGreaterThanOrEqualTo(buckets.get(i - 1).jobRunPassPercentage());
        }
    }

    private static VariantResultsDTO bucket(List<VariantResultsDTO> buckets, String variant)
    {
        return buckets.stream().filter(b -> b.variantName().equals(variant)).findFirst().orElseThrow();
    }
}
