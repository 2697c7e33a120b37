package com.neuroshield.mirror;

import com.neuroshield.domain.ProposalSettledEvent;
import com.neuroshield.domain.ProposalSubmittedEvent;
import com.neuroshield.governance.proposal.ProposalQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Feeds governance events into the ledger mirror on a single consumer thread, in publication order.
 * Events are applied only once the publishing transaction has committed; a rolled-back write never
 * reaches the mirror or the DAO confidence cache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MirrorEventListener {

    public static final String MIRROR_EXECUTOR = "mirror-executor";

    private final LedgerMirror ledgerMirror;
    private final CacheManager cacheManager;

    @Async(MIRROR_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onProposalSubmitted(ProposalSubmittedEvent event) {
        ledgerMirror.onSubmitted(event);
    }

    @Async(MIRROR_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onProposalSettled(ProposalSettledEvent event) {
        ledgerMirror.onSettled(event);
        Cache confidence = cacheManager.getCache(ProposalQueryService.DAO_CONFIDENCE_CACHE);
        if (confidence != null) {
            confidence.evict(event.targetAddress());
        }
        log.debug("Mirror applied settlement of proposal {} ({})", event.proposalId(), event.outcome());
    }
}
