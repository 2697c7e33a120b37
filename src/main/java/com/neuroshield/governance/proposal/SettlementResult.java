package com.neuroshield.governance.proposal;

import com.neuroshield.domain.ProposalOutcome;

import java.util.List;

/**
 * What executeProposal did: outcome, final tallies, the target's score afterwards and the escrow returned.
 */
public record SettlementResult(
        long proposalId,
        ProposalOutcome outcome,
        String targetAddress,
        long forPower,
        long againstPower,
        int newScamScore,
        boolean trustUpdated,
        List<String> affectedVoters,
        long tokensReturned
) {
}
