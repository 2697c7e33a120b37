package com.neuroshield.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Scam report under community vote. Permanent history: never deleted.
 * Deadline is fixed at creation; power accumulators change only on vote, status only on settlement.
 */
@Document(collection = "proposals")
@CompoundIndex(name = "target_status", def = "{'targetAddress': 1, 'status': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Proposal {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String targetAddress;
    private String description;
    private String evidenceRef;
    private String proposerAddress;
    private Instant createdAt;
    private Instant deadline;
    private long forPower;
    private long againstPower;
    private ProposalStatus status;
    /** Set at settlement. */
    private ProposalOutcome outcome;
    private Instant executedAt;
    private String executedBy;

    public long totalPower() {
        return forPower + againstPower;
    }

    /** Voting is open strictly before the deadline. */
    public boolean isOpenAt(Instant now) {
        return status == ProposalStatus.ACTIVE && now.isBefore(deadline);
    }

    /**
     * Moves the proposal forward in its lifecycle.
     *
     * @throws IllegalStateException if the transition would move backwards or skip a step
     */
    public void transitionTo(ProposalStatus next) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal proposal transition " + status + " -> " + next + " for " + id);
        }
        this.status = next;
    }
}
