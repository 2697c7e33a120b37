package com.neuroshield.governance.trust;

import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalRepository;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.domain.TrustRecord;
import com.neuroshield.domain.TrustRecordRepository;
import com.neuroshield.domain.TrustSnapshot;
import com.neuroshield.governance.GovernanceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-address scam verdicts. Single producer (settlement of a passed proposal), many readers.
 * Scores rise by the configured step and saturate at 100; there is no path that lowers a score or clears the flag.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrustRegistry {

    private final TrustRecordRepository trustRecordRepository;
    private final ProposalRepository proposalRepository;
    private final GovernanceProperties governanceProperties;
    private final Clock clock;

    public Optional<TrustRecord> find(String address) {
        return trustRecordRepository.findById(address);
    }

    public int threatScore(String address) {
        return find(address).map(TrustRecord::getScamScore).orElse(0);
    }

    public boolean isConfirmedScam(String address) {
        return find(address).map(TrustRecord::isConfirmedScam).orElse(false);
    }

    /**
     * Ledger-consistent snapshot, including whether an ACTIVE proposal currently targets the address.
     */
    public TrustSnapshot snapshot(String address) {
        TrustRecord record = find(address).orElse(null);
        boolean underReview = proposalRepository.existsByTargetAddressAndStatus(address, ProposalStatus.ACTIVE);
        return TrustSnapshot.of(address, record, underReview);
    }

    /**
     * Ids of the ACTIVE proposals targeting the address, oldest first.
     */
    public List<Long> activeProposalIds(String address) {
        return proposalRepository.findByTargetAddressAndStatus(address, ProposalStatus.ACTIVE).stream()
                .map(Proposal::getId)
                .sorted()
                .toList();
    }

    /**
     * Applies one passed proposal to the target's record: score += step (max 100), confirmed = true.
     */
    public TrustRecord recordConfirmation(String address, long proposalId) {
        TrustRecord record = find(address).orElseGet(() -> {
            TrustRecord created = new TrustRecord();
            created.setAddress(address);
            return created;
        });
        record.setScamScore(nextScore(record.getScamScore(), governanceProperties.getScoreStep()));
        record.setConfirmedScam(true);
        record.setConfirmations(record.getConfirmations() + 1);
        record.setLastProposalId(proposalId);
        record.setUpdatedAt(Instant.now(clock));
        TrustRecord saved = trustRecordRepository.save(record);
        log.info("Trust record {} confirmed by proposal {}: scamScore={}", address, proposalId, saved.getScamScore());
        return saved;
    }

    static int nextScore(int current, int step) {
        return Math.min(TrustRecord.MAX_SCAM_SCORE, current + step);
    }
}
