package com.neuroshield.mirror;

import com.neuroshield.domain.TrustSnapshot;

import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cached trust state for one address. Immutable; merges return a new value.
 * <p>
 * Every merge is monotone (score by max, confirmed by OR, settled ids only grow) so applying the
 * same event twice yields an equal value.
 */
public record MirroredTrust(
        String address,
        boolean hasRecord,
        int scamScore,
        boolean confirmed,
        Set<Long> openProposalIds,
        Set<Long> settledProposalIds,
        Instant syncedAt
) {

    public MirroredTrust {
        openProposalIds = Set.copyOf(openProposalIds);
        settledProposalIds = Set.copyOf(settledProposalIds);
    }

    static MirroredTrust fromLedger(TrustSnapshot snapshot, Iterable<Long> activeProposalIds, Instant syncedAt) {
        Set<Long> open = new TreeSet<>();
        activeProposalIds.forEach(open::add);
        return new MirroredTrust(snapshot.address(), snapshot.hasRecord(), snapshot.scamScore(),
                snapshot.confirmedScam(), open, Set.of(), syncedAt);
    }

    MirroredTrust withSubmitted(long proposalId) {
        if (settledProposalIds.contains(proposalId) || openProposalIds.contains(proposalId)) {
            return this;
        }
        Set<Long> open = new TreeSet<>(openProposalIds);
        open.add(proposalId);
        return new MirroredTrust(address, hasRecord, scamScore, confirmed, open, settledProposalIds, syncedAt);
    }

    MirroredTrust withSettled(long proposalId, int eventScore, boolean eventConfirmed) {
        Set<Long> open = new TreeSet<>(openProposalIds);
        open.remove(proposalId);
        Set<Long> settled = new TreeSet<>(settledProposalIds);
        settled.add(proposalId);
        boolean record = hasRecord || eventConfirmed || eventScore > 0;
        return new MirroredTrust(address, record, Math.max(scamScore, eventScore), confirmed || eventConfirmed,
                open, settled, syncedAt);
    }

    MirroredTrust syncedAt(Instant at) {
        return new MirroredTrust(address, hasRecord, scamScore, confirmed, openProposalIds, settledProposalIds, at);
    }

    /** Same content, ignoring when it was synced. */
    boolean sameStateAs(MirroredTrust other) {
        return other != null && syncedAt(other.syncedAt).equals(other);
    }

    public TrustSnapshot toSnapshot() {
        return new TrustSnapshot(address, hasRecord, scamScore, confirmed, !openProposalIds.isEmpty());
    }
}
