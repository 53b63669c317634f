/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.dto.ByJobNameDTO;
import com.ammann.cihealth.dto.ByStageNameDTO;
import com.ammann.cihealth.dto.JobResultDTO;
import com.ammann.cihealth.dto.StageResultDTO;
import com.ammann.cihealth.dto.StepRegistryMetricsDTO;
import com.ammann.cihealth.dto.TopLevelStepRegistryMetricsDTO;
import com.ammann.cihealth.model.RawJobRunResult;
import com.ammann.cihealth.model.StageState;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rolls up multistage step outcomes per job, per template, per stage name and per job name.
 *
 * <p>Several jobs may run the same template (for example the ci and nightly e2e-aws jobs).
 * Their stage results are summed per stage, while the template's aggregate takes the
 * maximum successes and the maximum failures over its stages, so that a template with
 * {@code n} stages is not counted {@code n} times per run.
 */
@ApplicationScoped
public class StepRegistryAggregator
{
    /**
     * Builds the step registry metrics of a single job.
     *
     * @param runs the job's runs; the first non-empty template name is used
     */
    public StepRegistryMetricsDTO jobMetrics(List<RawJobRunResult> runs)
    {
        String multistageName = "";
        Map<String, StageResultDTO> stageResults = new TreeMap<>();

        for (RawJobRunResult run : runs) {
            if (multistageName.isEmpty()) {
                multistageName = run.stepRegistryItemStates().multistageName();
            }
            for (StageState state : run.stepRegistryItemStates().states()) {
                StageResultDTO observed = StageResultDTO.of(
                        state.name(),
                        state.originalTestName(),
                        state.outcome().isSuccess() ? 1 : 0,
                        state.outcome().isFailure() ? 1 : 0);
                stageResults.merge(state.name(), observed, StepRegistryAggregator::addStageResult);
            }
        }

        return new StepRegistryMetricsDTO(
                multistageName,
                aggregate(multistageName, stageResults.values()),
                stageResults);
    }

    /**
     * Builds the release-wide rollups. Jobs that are not multistage are skipped.
     */
    public TopLevelStepRegistryMetricsDTO topLevel(List<JobResultDTO> jobs)
    {
        Map<String, StepRegistryMetricsDTO> byMultistageName = new TreeMap<>();
        Map<String, ByJobNameDTO> byJobName = new TreeMap<>();

        List<JobResultDTO> ordered = new ArrayList<>(jobs);
        ordered.sort(Comparator.comparing(JobResultDTO::name));

        for (JobResultDTO job : ordered) {
            StepRegistryMetricsDTO metrics = job.stepRegistryMetrics();
            if (!metrics.isMultistage()) {
                continue;
            }
            byMultistageName.merge(metrics.multistageName(), metrics, StepRegistryAggregator::combine);
            byJobName.put(job.name(), new ByJobNameDTO(job.name(), metrics));
        }

        return new TopLevelStepRegistryMetricsDTO(byMultistageName, byStageName(byMultistageName), byJobName);
    }

    /**
     * Re-aggregates template results by stage name, with a breakdown by template.
     */
    Map<String, ByStageNameDTO> byStageName(Map<String, StepRegistryMetricsDTO> byMultistageName)
    {
        Map<String, StageResultDTO> aggregatedByStage = new TreeMap<>();
        Map<String, Map<String, StageResultDTO>> breakdownByStage = new TreeMap<>();

        for (StepRegistryMetricsDTO metrics : byMultistageName.values()) {
            for (StageResultDTO stageResult : metrics.stageResults().values()) {
                aggregatedByStage.merge(
                        stageResult.name(),
                        stageResult.withOriginalTestName(""),
                        StepRegistryAggregator::addStageResult);
                breakdownByStage
                        .computeIfAbsent(stageResult.name(), name -> new TreeMap<>())
                        .put(metrics.multistageName(), stageResult);
            }
        }

        Map<String, ByStageNameDTO> result = new TreeMap<>();
        aggregatedByStage.forEach((stageName, aggregated) ->
                result.put(stageName, new ByStageNameDTO(aggregated, breakdownByStage.get(stageName))));
        return result;
    }

    /**
     * Merges the metrics of another job using the same template. Stage names of both sides
     * are kept; an existing stage keeps its original test name.
     */
    static StepRegistryMetricsDTO combine(StepRegistryMetricsDTO existing, StepRegistryMetricsDTO incoming)
    {
        Map<String, StageResultDTO> stageResults = new TreeMap<>(existing.stageResults());
        incoming.stageResults().forEach((stageName, stageResult) ->
                stageResults.merge(stageName, stageResult, StepRegistryAggregator::addStageResult));

        return new StepRegistryMetricsDTO(
                existing.multistageName(),
                aggregate(existing.multistageName(), stageResults.values()),
                stageResults);
    }

    /**
     * Approximates the template's own run counts: the maximum successes and the maximum
     * failures over its stages, taken independently.
     */
    static StageResultDTO aggregate(String multistageName, Collection<StageResultDTO> stageResults)
    {
        int successes = 0;
        int failures = 0;
        for (StageResultDTO stageResult : stageResults) {
            successes = Math.max(successes, stageResult.successes());
            failures = Math.max(failures, stageResult.failures());
        }
        return StageResultDTO.of(multistageName, "", successes, failures);
    }

    static StageResultDTO addStageResult(StageResultDTO lhs, StageResultDTO rhs)
    {
        return StageResultDTO.of(
                lhs.name(),
                lhs.originalTestName(),
                lhs.successes() + rhs.successes(),
                lhs.failures() + rhs.failures());
    }
}
