package com.neuroshield.governance.keeper;

import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalRepository;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.GovernanceProperties;
import com.neuroshield.governance.command.LedgerCommand;
import com.neuroshield.governance.command.LedgerCommandGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SettlementKeeperJobTest {

    private static final Instant NOW = Instant.parse("2026-03-04T10:00:00Z");

    @Mock
    ProposalRepository proposalRepository;
    @Mock
    LedgerCommandGateway ledgerCommandGateway;

    private GovernanceProperties properties;
    private SettlementKeeperJob job;

    @BeforeEach
    void setUp() {
        properties = new GovernanceProperties();
        job = new SettlementKeeperJob(proposalRepository, ledgerCommandGateway, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("settles every expired proposal as the keeper and tolerates ALREADY_EXECUTED races")
    void settlesExpired() {
        when(proposalRepository.findByStatusAndDeadlineLessThanEqualOrderByIdAsc(ProposalStatus.ACTIVE, NOW))
                .thenReturn(List.of(proposal(1), proposal(2), proposal(3)));
        lenient().when(ledgerCommandGateway.dispatch(new LedgerCommand.ExecuteProposal(2, SettlementKeeperJob.KEEPER_CALLER)))
                .thenThrow(new GovernanceException(GovernanceError.ALREADY_EXECUTED, "already"));

        int settled = job.settleExpired();

        assertThat(settled).isEqualTo(2);
        verify(ledgerCommandGateway).dispatch(new LedgerCommand.ExecuteProposal(1, "keeper"));
        verify(ledgerCommandGateway).dispatch(new LedgerCommand.ExecuteProposal(3, "keeper"));
    }

    @Test
    @DisplayName("one failing proposal does not stop the run")
    void continuesAfterFailure() {
        when(proposalRepository.findByStatusAndDeadlineLessThanEqualOrderByIdAsc(ProposalStatus.ACTIVE, NOW))
                .thenReturn(List.of(proposal(1), proposal(2)));
        lenient().when(ledgerCommandGateway.dispatch(new LedgerCommand.ExecuteProposal(1, "keeper")))
                .thenThrow(new IllegalStateException("store unavailable"));

        assertThat(job.settleExpired()).isEqualTo(1);
    }

    @Test
    @DisplayName("disabled keeper does nothing on schedule")
    void disabled() {
        properties.getKeeper().setEnabled(false);

        job.runScheduled();

        verify(proposalRepository, never()).findByStatusAndDeadlineLessThanEqualOrderByIdAsc(any(), any());
    }

    private static Proposal proposal(long id) {
        Proposal p = new Proposal();
        p.setId(id);
        p.setStatus(ProposalStatus.ACTIVE);
        return p;
    }
}
