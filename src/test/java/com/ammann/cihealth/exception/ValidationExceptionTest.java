/* (C)2026 */
package com.ammann.cihealth.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

class ValidationExceptionTest
{

    @ParameterizedTest
    @MethodSource("insufficientDataSamples")
    void buildsInsufficientDataMessages(String resource, int required, int actual, String expected)
    {
        ValidationException ex = ValidationException.insufficientData(resource, required, actual);
        assertThat(ex.getMessage()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "minRuns,-1,>= 0",
            "release,null,a non-blank release name"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        ValidationException ex = ValidationException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
    }

    @Test
    void isAReportException()
    {
        assertThat(ValidationException.invalidParameter("x", 1, "2")).isInstanceOf(ReportException.class);
    }

    private static Stream<Arguments> insufficientDataSamples()
    {
        return Stream.of(
                Arguments.of("days of data", 1, 0, "Insufficient days of data: need at least 1, but got 0"),
                Arguments.of("job runs", 5, 2, "Insufficient job runs: need at least 5, but got 2"));
    }
}
