/* (C)2026 */
package com.ammann.cihealth.model;

import com.ammann.cihealth.enumeration.StageOutcome;

/**
 * Outcome of one stage of a multistage run.
 *
 * @param name             stage name with the template prefix stripped (e.g. {@code ipi-install})
 * @param originalTestName test name as it appeared in the test grid, before aliasing
 * @param outcome          stage outcome
 */
public record StageState(String name, String originalTestName, StageOutcome outcome)
{
    public StageState {
        outcome = outcome == null ? StageOutcome.UNKNOWN : outcome;
    }
}
