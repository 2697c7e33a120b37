package com.neuroshield.governance;

/**
 * Distinguishable rejection reasons for ledger write operations. The API layer maps
 * VALIDATION to 400, FORBIDDEN to 403, NOT_FOUND to 404 and STATE_CONFLICT to 409.
 */
public enum GovernanceError {

    INVALID_TARGET(Category.VALIDATION),
    INVALID_DESCRIPTION(Category.VALIDATION),
    INVALID_STAKE(Category.VALIDATION),
    INVALID_CALLER(Category.VALIDATION),
    INSUFFICIENT_TOKENS(Category.VALIDATION),
    UNAUTHORIZED_CALLER(Category.FORBIDDEN),
    PROPOSAL_NOT_FOUND(Category.NOT_FOUND),
    PROPOSAL_CLOSED(Category.STATE_CONFLICT),
    DUPLICATE_VOTE(Category.STATE_CONFLICT),
    VOTING_STILL_OPEN(Category.STATE_CONFLICT),
    ALREADY_EXECUTED(Category.STATE_CONFLICT);

    /** Validation: caller can correct and resubmit. State conflict: caller's view was stale, re-read first. */
    public enum Category {
        VALIDATION,
        FORBIDDEN,
        NOT_FOUND,
        STATE_CONFLICT
    }

    private final Category category;

    GovernanceError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}
