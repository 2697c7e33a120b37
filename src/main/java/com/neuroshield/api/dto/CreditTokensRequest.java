package com.neuroshield.api.dto;

import jakarta.validation.constraints.Positive;

public record CreditTokensRequest(@Positive(message = "INVALID_STAKE") long amount) {
}
