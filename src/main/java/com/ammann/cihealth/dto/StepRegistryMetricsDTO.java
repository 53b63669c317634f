/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Step registry results of a multistage template.
 *
 * @param multistageName template name, empty when the job does not use multistage
 * @param aggregated     approximate result of the template as a whole
 * @param stageResults   per-stage results keyed by stage name, sorted by key
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepRegistryMetricsDTO(
        String multistageName,
        StageResultDTO aggregated,
        Map<String, StageResultDTO> stageResults
) {
    public StepRegistryMetricsDTO {
        multistageName = multistageName == null ? "" : multistageName;
        stageResults = stageResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(stageResults));
    }

    public static StepRegistryMetricsDTO empty() {
        return new StepRegistryMetricsDTO("", StageResultDTO.empty("", ""), Map.of());
    }

    /**
     * A job counts as multistage only if it names a template and reported at least one stage.
     */
    @JsonIgnore
    public boolean isMultistage() {
        return !multistageName.isEmpty() && !stageResults.isEmpty();
    }
}
