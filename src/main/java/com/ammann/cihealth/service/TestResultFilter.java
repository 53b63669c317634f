/* (C)2026 */
package com.ammann.cihealth.service;

import com.ammann.cihealth.dto.TestResultDTO;
import com.ammann.cihealth.identification.TestIdentification;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a test result is listed in a filtered view.
 */
@FunctionalInterface
public interface TestResultFilter
{
    boolean accept(TestResultDTO testResult);

    /**
     * Returns the accepted results, keeping their order.
     */
    default List<TestResultDTO> filter(List<TestResultDTO> testResults) {
        List<TestResultDTO> accepted = new ArrayList<>();
        for (TestResultDTO testResult : testResults) {
            if (accept(testResult)) {
                accepted.add(testResult);
            }
        }
        return accepted;
    }

    default TestResultFilter and(TestResultFilter other) {
        return testResult -> accept(testResult) && other.accept(testResult);
    }

    static TestResultFilter acceptAll() {
        return testResult -> true;
    }

    /**
     * Drops tests with fewer than {@code minRuns} successes plus failures.
     */
    static TestResultFilter tooFewRuns(int minRuns) {
        return testResult -> testResult.runs() >= minRuns;
    }

    /**
     * Drops tests passing above {@code successThreshold} percent; they are not actionable.
     */
    static TestResultFilter successThreshold(double successThreshold) {
        return testResult -> testResult.passPercentage() <= successThreshold;
    }

    /**
     * Drops the whole-job pseudo test and tests that only report environment setup.
     */
    static TestResultFilter lowValueTestNames() {
        return testResult -> !TestIdentification.OVERALL_TEST_NAME.equals(testResult.name())
                && !TestIdentification.isSetupContainerEquivalent(testResult.name());
    }

    static TestResultFilter standard(int minRuns, double successThreshold) {
        return lowValueTestNames()
                .and(tooFewRuns(minRuns))
                .and(successThreshold(successThreshold));
    }
}
