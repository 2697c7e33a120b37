package com.neuroshield.mirror;

import com.github.benmanes.caffeine.cache.Cache;
import com.neuroshield.common.Addresses;
import com.neuroshield.domain.ProposalSettledEvent;
import com.neuroshield.domain.ProposalSubmittedEvent;
import com.neuroshield.domain.TrustSnapshot;
import com.neuroshield.governance.trust.TrustRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Eventually consistent read model of the trust registry, kept in a Caffeine cache.
 * <p>
 * Entries are refreshed by governance events and expire one staleness window after they were read
 * from the ledger (see {@link LedgerReadExpiry}); merging an event does not extend that. A missing or
 * expired entry is read through again. Ledger read failures propagate to the caller.
 */
@Service
@Slf4j
public class LedgerMirror {

    private final Cache<String, MirroredTrust> cache;
    private final TrustRegistry trustRegistry;
    private final Clock clock;

    public LedgerMirror(Cache<String, MirroredTrust> ledgerMirrorCache, TrustRegistry trustRegistry, Clock clock) {
        this.cache = ledgerMirrorCache;
        this.trustRegistry = trustRegistry;
        this.clock = clock;
    }

    public TrustSnapshot snapshot(String address) {
        String key = Addresses.normalize(address);
        return cache.get(key, this::load).toSnapshot();
    }

    public void onSubmitted(ProposalSubmittedEvent event) {
        merge(event.targetAddress(), entry -> entry.withSubmitted(event.proposalId()));
    }

    public void onSettled(ProposalSettledEvent event) {
        merge(event.targetAddress(),
                entry -> entry.withSettled(event.proposalId(), event.newScamScore(), event.confirmedScam()));
    }

    public void invalidate(String address) {
        cache.invalidate(Addresses.normalize(address));
    }

    private void merge(String address, UnaryOperator<MirroredTrust> change) {
        String key = Addresses.normalize(address);
        cache.asMap().compute(key, (k, existing) -> {
            MirroredTrust base = existing != null ? existing : load(k);
            MirroredTrust merged = change.apply(base);
            if (existing != null && merged.sameStateAs(existing)) {
                log.debug("Mirror entry {} unchanged by replayed event", k);
                return existing;
            }
            log.debug("Mirror upsert {}: score={} confirmed={} open={}",
                    k, merged.scamScore(), merged.confirmed(), merged.openProposalIds());
            return merged.syncedAt(Instant.now(clock));
        });
    }

    private MirroredTrust load(String address) {
        log.debug("Mirror read-through for {}", address);
        TrustSnapshot snapshot = TrustSnapshot.of(address, trustRegistry.find(address).orElse(null), false);
        return MirroredTrust.fromLedger(snapshot, trustRegistry.activeProposalIds(address), Instant.now(clock));
    }
}
