/* (C)2026 */
package com.ammann.cihealth.model;

import java.util.List;

/**
 * Step registry outcomes captured for one run of a multistage job.
 *
 * @param multistageName  name of the reusable multistage template (e.g. {@code e2e-aws}), empty if none
 * @param multistageState outcome of the multistage run as a whole
 * @param states          per-stage outcomes in execution order
 */
public record StepRegistryItemStates(
        String multistageName,
        StageState multistageState,
        List<StageState> states
) {
    public StepRegistryItemStates {
        multistageName = multistageName == null ? "" : multistageName;
        states = states == null ? List.of() : List.copyOf(states);
    }

    public static StepRegistryItemStates none() {
        return new StepRegistryItemStates("", null, List.of());
    }
}
