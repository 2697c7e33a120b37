package com.neuroshield.api.dto;

import com.neuroshield.api.validation.WalletAddress;
import jakarta.validation.constraints.NotBlank;

public record SubmitProposalRequest(
        @WalletAddress(message = "INVALID_TARGET") String targetAddress,
        @NotBlank(message = "INVALID_DESCRIPTION") String description,
        String evidenceRef
) {
}
