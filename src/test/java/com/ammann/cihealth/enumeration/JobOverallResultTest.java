/* (C)2026 */
package com.ammann.cihealth.enumeration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class JobOverallResultTest
{

    private final ObjectMapper mapper = new ObjectMapper();

    @ParameterizedTest
    @CsvSource({
            "S,SUCCEEDED",
            "R,RUNNING",
            "N,INFRASTRUCTURE_FAILURE",
            "n,FAILURE_BEFORE_SETUP",
            "I,INSTALL_FAILURE",
            "U,UPGRADE_FAILURE",
            "F,TEST_FAILURE",
            "A,ABORTED",
            "f,UNKNOWN"
    })
    void usesCaseSensitiveTestGridCodesInJson(String code, JobOverallResult result) throws Exception
    {
        assertThat(mapper.writeValueAsString(result)).isEqualTo("\"" + code + "\"");
        assertThat(mapper.readValue("\"" + code + "\"", JobOverallResult.class)).isEqualTo(result);
    }
}
