package com.neuroshield.domain;

/**
 * Proposal lifecycle. Transitions only move forward: ACTIVE → PASSED | REJECTED → EXECUTED.
 * PASSED and REJECTED are decided at settlement, before the settlement side effects are applied.
 */
public enum ProposalStatus {
    ACTIVE,
    PASSED,
    REJECTED,
    EXECUTED;

    public boolean canTransitionTo(ProposalStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case ACTIVE -> next == PASSED || next == REJECTED;
            case PASSED, REJECTED -> next == EXECUTED;
            case EXECUTED -> false;
        };
    }
}
