package com.neuroshield.api.dto;

import com.neuroshield.domain.Vote;

import java.time.Instant;

public record VoteResponse(
        long proposalId,
        String voterAddress,
        boolean support,
        long tokensStaked,
        long power,
        Instant castAt,
        boolean refunded
) {

    public static VoteResponse from(Vote v) {
        return new VoteResponse(v.getProposalId(), v.getVoterAddress(), v.isSupport(), v.getTokensStaked(),
                v.getPower(), v.getCastAt(), v.isRefunded());
    }
}
