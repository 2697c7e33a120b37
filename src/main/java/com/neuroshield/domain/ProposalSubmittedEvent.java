package com.neuroshield.domain;

import java.time.Instant;

/**
 * Application event: a proposal was created and is open for votes. Consumed by the ledger mirror
 * to mark the target address as under review.
 */
public record ProposalSubmittedEvent(long proposalId, String targetAddress, Instant deadline) {
}
