/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Descriptive statistics over job pass percentages.
 *
 * @param histogram ten buckets of width 10; a 100% job falls into the last bucket
 * @param quartiles Q1, Q2 and Q3
 * @param p95       95th percentile
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatisticsDTO(
        double mean,
        double standardDeviation,
        List<Integer> histogram,
        List<Double> quartiles,
        double p95
) {
    public JobStatisticsDTO {
        histogram = histogram == null ? List.of() : List.copyOf(histogram);
        quartiles = quartiles == null ? List.of() : List.copyOf(quartiles);
    }
}
