package com.neuroshield.domain;

/**
 * Result of settling a proposal. Recorded on the proposal and carried by the settlement event.
 */
public enum ProposalOutcome {
    PASSED,
    REJECTED;

    /** Whether a vote with the given support flag agrees with this outcome. */
    public boolean matches(boolean support) {
        return (this == PASSED) == support;
    }
}
