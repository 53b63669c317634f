/* (C)2026 */
package com.ammann.cihealth.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.cihealth.bug.Bug;
import com.ammann.cihealth.enumeration.JobOverallResult;
import com.ammann.cihealth.enumeration.ReportType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Checks the JSON shape of report DTOs as consumers see it.
 */
class ReportJsonTest
{

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void failingTestResultExposesMergedResultAsResults()
    {
        JsonNode json = mapper.valueToTree(FailingTestResultDTO.empty("[sig-a] t"));

        assertThat(json.has("results")).isTrue();
        assertThat(json.has("testResultAcrossAllJobs")).isFalse();
        assertThat(json.get("results").get("name").asText()).isEqualTo("[sig-a] t");
    }

    @Test
    void runResultUsesTestGridCodes()
    {
        JobRunResultDTO run = new JobRunResultDTO(42L, "job", "https://prow/job/42", 1, List.of("t"), true, false,
                1_000L, JobOverallResult.FAILURE_BEFORE_SETUP);

        JsonNode json = mapper.valueToTree(run);

        assertThat(json.get("overallResult").asText()).isEqualTo("n");
        assertThat(json.get("prowId").asLong()).isEqualTo(42L);
    }

    @Test
    void omitsNullsAndDerivedValues()
    {
        Bug bug = new Bug(1, null, "summary", "NEW", List.of("Etcd"), "https://bugs/1");
        SortedBugzillaComponentResultDTO component = new SortedBugzillaComponentResultDTO("Etcd", List.of(
                new BugzillaJobResultDTO("job", "Etcd", 1, 50.0, 2, List.of())));

        assertThat(mapper.valueToTree(bug).has("key")).isFalse();
        assertThat(mapper.valueToTree(component).has("worstFailPercentage")).isFalse();
    }

    @Test
    void serializesCompleteReport()
    {
        TestReportDTO report = new TestReportDTO(ReportType.CURRENT, "4.9", Instant.parse("2021-09-01T12:00:00Z"),
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);

        JsonNode json = mapper.valueToTree(report);

        assertThat(json.get("reportType").asText()).isEqualTo("CURRENT");
        assertThat(json.get("timestamp").asText()).isEqualTo("2021-09-01T12:00:00Z");
        assertThat(json.get("byJob").isArray()).isTrue();
        assertThat(json.has("topLevelIndicators")).isFalse();
    }
}
