package com.neuroshield.domain;

import java.util.List;

/**
 * Application event: a proposal was settled. Carries everything the ledger mirror needs to upsert
 * without reading the ledger back. newScamScore is the target's score after settlement (unchanged on reject).
 */
public record ProposalSettledEvent(
        long proposalId,
        ProposalOutcome outcome,
        String targetAddress,
        int newScamScore,
        boolean confirmedScam,
        List<String> affectedVoters
) {

    public ProposalSettledEvent {
        affectedVoters = affectedVoters == null ? List.of() : List.copyOf(affectedVoters);
    }
}
