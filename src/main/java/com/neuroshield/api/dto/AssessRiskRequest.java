package com.neuroshield.api.dto;

import com.neuroshield.api.validation.WalletAddress;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.util.List;

/**
 * POST /risk/assess body. Labels use the classifier's names (Fraud, Suspicious, Non-Fraud).
 * balance and transactionCount describe the destination; omit them when unknown.
 */
public record AssessRiskRequest(
        @WalletAddress String address,
        @Pattern(regexp = LABEL_PATTERN, message = "INVALID_LABEL") String mlLabel,
        List<Object> features,
        @PositiveOrZero(message = "INVALID_ACTIVITY") BigInteger balance,
        @PositiveOrZero(message = "INVALID_ACTIVITY") Long transactionCount,
        boolean allowListed,
        @Pattern(regexp = LABEL_PATTERN, message = "INVALID_LABEL") String fallbackLabel
) {

    static final String LABEL_PATTERN = "(?i)fraud|suspicious|non[-_]fraud|safe";
}
