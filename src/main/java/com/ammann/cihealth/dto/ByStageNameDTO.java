/* (C)2026 */
package com.ammann.cihealth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Results of one stage name across every multistage template that runs it.
 *
 * @param aggregated       sum over all templates
 * @param byMultistageName per-template results, sorted by template name
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ByStageNameDTO(StageResultDTO aggregated, Map<String, StageResultDTO> byMultistageName)
{
    public ByStageNameDTO {
        byMultistageName = byMultistageName == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(byMultistageName));
    }
}
