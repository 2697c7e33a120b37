package com.neuroshield.api.dto;

import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalOutcome;
import com.neuroshield.domain.ProposalStatus;

import java.time.Instant;

public record ProposalResponse(
        long id,
        String targetAddress,
        String description,
        String evidenceRef,
        String proposerAddress,
        Instant createdAt,
        Instant deadline,
        long forPower,
        long againstPower,
        ProposalStatus status,
        ProposalOutcome outcome,
        Instant executedAt,
        String executedBy
) {

    public static ProposalResponse from(Proposal p) {
        return new ProposalResponse(p.getId(), p.getTargetAddress(), p.getDescription(), p.getEvidenceRef(),
                p.getProposerAddress(), p.getCreatedAt(), p.getDeadline(), p.getForPower(), p.getAgainstPower(),
                p.getStatus(), p.getOutcome(), p.getExecutedAt(), p.getExecutedBy());
    }
}
