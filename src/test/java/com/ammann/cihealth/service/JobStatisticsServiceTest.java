/* (C)2026 */
package com.ammann.cihealth.service;

import static com.ammann.cihealth.support.RawDataFixtures.jobResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.cihealth.dto.JobStatisticsDTO;
import com.ammann.cihealth.identification.VariantManager;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class JobStatisticsServiceTest
{

    private final JobStatisticsService service = new JobStatisticsService();

    @Test
    void emptyInputYieldsZeros()
    {
        JobStatisticsDTO statistics = service.calculate(List.of());

        assertThat(statistics.mean()).isZero();
        assertThat(statistics.standardDeviation()).isZero();
        assertThat(statistics.histogram()).hasSize(10).containsOnly(0);
        assertThat(statistics.quartiles()).containsExactly(0.0, 0.0, 0.0);
        assertThat(statistics.p95()).isZero();
    }

    @Test
    void describesJobPassPercentages()
    {
        JobStatisticsDTO statistics = service.calculate(List.of(
                jobResult("job-100", 10, 0),
                jobResult("job-30", 3, 7),
                jobResult("job-10", 1, 9),
                jobResult("job-40", 4, 6),
                jobResult("job-20", 2, 8)));

        assertThat(statistics.mean()).isCloseTo(40.0, within(1e-9));
        assertThat(statistics.standardDeviation()).isCloseTo(Math.sqrt(1000.0), within(1e-9));
        assertThat(statistics.histogram()).containsExactly(0, 1, 1, 1, 1, 0, 0, 0, 0, 1);
        assertThat(statistics.quartiles().get(0)).isCloseTo(15.0, within(1e-9));
        assertThat(statistics.quartiles().get(1)).isCloseTo(30.0, within(1e-9));
        assertThat(statistics.quartiles().get(2)).isCloseTo(70.0, within(1e-9));
        assertThat(statistics.p95()).isCloseTo(70.0, within(1e-9));
    }

    @Test
    void skipsNeverStableAndTechPreviewJobs()
    {
        JobStatisticsDTO statistics = service.calculate(List.of(
                jobResult("stable", List.of("aws"), 8, 2, 0),
                jobResult("never", List.of(VariantManager.NEVER_STABLE), 0, 10, 0),
                jobResult("preview", List.of(VariantManager.TECH_PREVIEW), 0, 10, 0)));

        assertThat(statistics.mean()).isCloseTo(80.0, within(1e-9));
        assertThat(statistics.histogram().stream().mapToInt(Integer::intValue).sum()).isEqualTo(1);
    }

    @Test
    void percentileSelectsTheElementAtAWholeRank()
    {
        List<Double> sorted = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            sorted.add((double) i);
        }

        assertThat(JobStatisticsService.percentile(sorted, 95.0)).isEqualTo(19.0);
        assertThat(JobStatisticsService.percentile(List.of(42.0), 95.0)).isEqualTo(42.0);
    }

    @Test
    void percentileAveragesAroundAFractionalRank()
    {
        assertThat(JobStatisticsService.percentile(List.of(1.0, 2.0, 3.0), 95.0)).isEqualTo(2.5);
    }

    @Test
    void quartilesLeaveTheMiddleElementOutOfBothHalves()
    {
        assertThat(JobStatisticsService.quartiles(List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0)))
                .containsExactly(2.0, 4.0, 6.0);
        assertThat(JobStatisticsService.quartiles(List.of(1.0, 2.0, 3.0, 4.0)))
                .containsExactly(1.5, 2.5, 3.5);
    }
}
