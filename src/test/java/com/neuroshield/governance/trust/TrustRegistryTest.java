package com.neuroshield.governance.trust;

import com.neuroshield.domain.ProposalRepository;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.domain.TrustRecord;
import com.neuroshield.domain.TrustRecordRepository;
import com.neuroshield.domain.TrustSnapshot;
import com.neuroshield.governance.GovernanceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrustRegistryTest {

    private static final String TARGET = "0x3333333333333333333333333333333333333333";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    TrustRecordRepository trustRecordRepository;
    @Mock
    ProposalRepository proposalRepository;

    private final Map<String, TrustRecord> store = new HashMap<>();
    private TrustRegistry trustRegistry;

    @BeforeEach
    void setUp() {
        lenient().when(trustRecordRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        lenient().when(trustRecordRepository.save(any(TrustRecord.class))).thenAnswer(inv -> {
            TrustRecord r = inv.getArgument(0);
            store.put(r.getAddress(), r);
            return r;
        });
        trustRegistry = new TrustRegistry(trustRecordRepository, proposalRepository, new GovernanceProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("sequential confirmations score 25, 50, 75, 100, 100 and never decrease")
    void saturatingScore() {
        List<Integer> scores = new ArrayList<>();
        for (long id = 1; id <= 5; id++) {
            scores.add(trustRegistry.recordConfirmation(TARGET, id).getScamScore());
        }

        assertThat(scores).containsExactly(25, 50, 75, 100, 100);
        TrustRecord record = store.get(TARGET);
        assertThat(record.isConfirmedScam()).isTrue();
        assertThat(record.getConfirmations()).isEqualTo(5);
        assertThat(record.getLastProposalId()).isEqualTo(5L);
        assertThat(record.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("unknown address reads as score 0, not confirmed, blank snapshot")
    void unknownAddress() {
        when(proposalRepository.existsByTargetAddressAndStatus(TARGET, ProposalStatus.ACTIVE)).thenReturn(false);

        assertThat(trustRegistry.threatScore(TARGET)).isZero();
        assertThat(trustRegistry.isConfirmedScam(TARGET)).isFalse();
        TrustSnapshot snapshot = trustRegistry.snapshot(TARGET);
        assertThat(snapshot.isBlank()).isTrue();
    }

    @Test
    @DisplayName("snapshot reports an open proposal even without a record")
    void snapshotUnderReview() {
        when(proposalRepository.existsByTargetAddressAndStatus(TARGET, ProposalStatus.ACTIVE)).thenReturn(true);

        TrustSnapshot snapshot = trustRegistry.snapshot(TARGET);

        assertThat(snapshot.hasRecord()).isFalse();
        assertThat(snapshot.hasActiveProposal()).isTrue();
        assertThat(snapshot.isBlank()).isFalse();
    }

    @Test
    @DisplayName("nextScore saturates at 100 for any step")
    void nextScore() {
        assertThat(TrustRegistry.nextScore(90, 25)).isEqualTo(100);
        assertThat(TrustRegistry.nextScore(100, 25)).isEqualTo(100);
        assertThat(TrustRegistry.nextScore(0, 25)).isEqualTo(25);
    }
}
