package com.neuroshield.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CastVoteRequest(
        @NotNull(message = "INVALID_VOTE") Boolean support,
        @Positive(message = "INVALID_STAKE") long tokensStaked
) {
}
