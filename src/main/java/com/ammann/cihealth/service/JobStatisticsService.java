/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.JobStatisticsDTO;
import com.ammann.cihealth.identification.VariantManager;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Descriptive statistics over the pass percentages of all jobs.
 *
 * <p>Never-stable and tech preview jobs are left out. Empty input yields zeros everywhere.
 */
@ApplicationScoped
public class JobStatisticsService
{
    static final int HISTOGRAM_BUCKETS = 10;

    public JobStatisticsDTO calculate(List<JobResultDTO> jobs)
    {
        Integer[] histogram = new Integer[HISTOGRAM_BUCKETS];
        Arrays.fill(histogram, 0);
        List<Double> percentages = new ArrayList<>();

        for (JobResultDTO job : jobs) {
            if (isNeverStableOrTechPreview(job)) {
                continue;
            }
            // 100% shares the last bucket with 90-99%
            int index = Math.min((int) Math.floor(job.passPercentage() / 10.0), HISTOGRAM_BUCKETS - 1);
            histogram[Math.max(index, 0)]++;
            percentages.add(job.passPercentage());
        }
        Collections.sort(percentages);

        return new JobStatisticsDTO(
                mean(percentages),
                standardDeviation(percentages),
                List.of(histogram),
                quartiles(percentages),
                percentile(percentages, 95.0));
    }

    static boolean isNeverStableOrTechPreview(JobResultDTO job)
    {
        return job.variants().contains(VariantManager.NEVER_STABLE)
                || job.variants().contains(VariantManager.TECH_PREVIEW);
    }

    static double mean(List<Double> values)
    {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation.
     */
    static double standardDeviation(List<Double> values)
    {
        if (values.isEmpty()) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.size());
    }

    /**
     * Q1, Q2 and Q3 as the medians of the lower half, the whole set and the upper half.
     * The middle element of an odd-sized set belongs to neither half.
     *
     * @param sorted values in ascending order
     */
    static List<Double> quartiles(List<Double> sorted)
    {
        int size = sorted.size();
        if (size == 0) {
            return List.of(0.0, 0.0, 0.0);
        }
        int lowerEnd = size / 2;
        int upperStart = size % 2 == 0 ? size / 2 : size / 2 + 1;
        return List.of(
                median(sorted.subList(0, lowerEnd)),
                median(sorted),
                median(sorted.subList(upperStart, size)));
    }

    static double median(List<Double> sorted)
    {
        int size = sorted.size();
        if (size == 0) {
            return 0.0;
        }
        if (size % 2 == 1) {
            return sorted.get(size / 2);
        }
        return (sorted.get(size / 2 - 1) + sorted.get(size / 2)) / 2.0;
    }

    /**
     * Percentile by rank {@code percent / 100 * n}: a whole rank selects that element,
     * a fractional rank averages the elements around it.
     *
     * @param sorted values in ascending order
     */
    static double percentile(List<Double> sorted, double percent)
    {
        int size = sorted.size();
        if (size == 0) {
            return 0.0;
        }
        if (size == 1) {
            return sorted.get(0);
        }
        double rank = percent / 100.0 * size;
        int whole = (int) rank;
        if (rank == whole) {
            return sorted.get(Math.max(whole - 1, 0));
        }
        if (rank > 1.0) {
            return (sorted.get(whole - 1) + sorted.get(whole)) / 2.0;
        }
        return sorted.get(0);
    }
}
