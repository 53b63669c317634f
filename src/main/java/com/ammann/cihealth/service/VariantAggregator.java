/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.dto.VariantResultsDTO;
import com.ammann.cihealth.identification.VariantManager;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups jobs into variant (or platform) buckets and aggregates their runs and tests.
 */
@ApplicationScoped
public class VariantAggregator
{
    /**
     * Builds one bucket per value of {@link VariantManager#allVariants()}, including buckets
     * without member jobs.
     *
     * @param jobs           processed jobs with unfiltered test results
     * @param variantManager classifier deciding bucket membership
     * @param filter         applied to each bucket's merged test results
     * @return buckets, lowest job run pass percentage first; equal buckets keep variant order
     */
    public List<VariantResultsDTO> aggregate(
            List<JobResultDTO> jobs,
            VariantManager variantManager,
            TestResultFilter filter)
    {
        List<VariantResultsDTO> buckets = new ArrayList<>();
        for (String variant : variantManager.allVariants()) {
            buckets.add(aggregateVariant(variant, jobs, variantManager, filter));
        }
        buckets.sort(Comparator.comparingDouble(VariantResultsDTO::jobRunPassPercentage));
        return buckets;
    }

    VariantResultsDTO aggregateVariant(
            String variant,
            List<JobResultDTO> jobs,
            VariantManager variantManager,
            TestResultFilter filter)
    {
        int successes = 0;
        int failures = 0;
        int knownFailures = 0;
        int infrastructureFailures = 0;
        List<TestResultDTO> variantTestResults = new ArrayList<>();
        List<JobResultDTO> members = new ArrayList<>();

        for (JobResultDTO job : jobs) {
            if (!variantManager.identifyVariants(job.name()).contains(variant)) {
                continue;
            }
            successes += job.successes();
            failures += job.failures();
            knownFailures += job.knownFailures();
            // a job reporting more infrastructure failures than failures has broken accounting
            if (job.infrastructureFailures() <= job.failures()) {
                infrastructureFailures += job.infrastructureFailures();
            }
            // merge before filtering so thresholds apply to the variant's totals
            variantTestResults = AggregationSupport.combineTestResults(job.testResults(), variantTestResults);
            members.add(job);
        }

        List<TestResultDTO> filtered = filter.filter(variantTestResults);
        filtered.sort(AggregationSupport.TEST_RESULTS_WORST_FIRST);
        members.sort(AggregationSupport.JOBS_WORST_FIRST);

        return new VariantResultsDTO(
                variant,
                successes,
                failures,
                knownFailures,
                infrastructureFailures,
                AggregationSupport.percent(successes, failures),
                AggregationSupport.percent(successes + knownFailures, failures - knownFailures),
                AggregationSupport.percent(successes, failures - infrastructureFailures),
                members,
                filtered);
    }
}
