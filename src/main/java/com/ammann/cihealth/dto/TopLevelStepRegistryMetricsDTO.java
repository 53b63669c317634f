/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Step registry rollups by template, by stage and by job. All maps are sorted by key.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TopLevelStepRegistryMetricsDTO(
        Map<String, StepRegistryMetricsDTO> byMultistageName,
        Map<String, ByStageNameDTO> byStageName,
        Map<String, ByJobNameDTO> byJobName
) {
    public TopLevelStepRegistryMetricsDTO {
        byMultistageName = sorted(byMultistageName);
        byStageName = sorted(byStageName);
        byJobName = sorted(byJobName);
    }

    private static <V> Map<String, V> sorted(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(source));
    }
}
