package com.neuroshield.governance;

import lombok.Getter;

/**
 * Thrown by ledger write operations when a request is rejected. Always raised before any state change.
 */
@Getter
public class GovernanceException extends RuntimeException {

    private final GovernanceError error;

    public GovernanceException(GovernanceError error, String message) {
        super(message);
        this.error = error;
    }
}
