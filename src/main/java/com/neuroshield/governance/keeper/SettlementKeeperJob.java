package com.neuroshield.governance.keeper;

import com.neuroshield.domain.Proposal;
import com.neuroshield.domain.ProposalRepository;
import com.neuroshield.domain.ProposalStatus;
import com.neuroshield.governance.GovernanceError;
import com.neuroshield.governance.GovernanceException;
import com.neuroshield.governance.GovernanceProperties;
import com.neuroshield.governance.command.LedgerCommand;
import com.neuroshield.governance.command.LedgerCommandGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Settles ACTIVE proposals whose deadline has passed. Goes through the command gateway like any other caller,
 * so a concurrent manual execute simply wins and the keeper sees ALREADY_EXECUTED.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementKeeperJob {

    public static final String KEEPER_CALLER = "keeper";

    private final ProposalRepository proposalRepository;
    private final LedgerCommandGateway ledgerCommandGateway;
    private final GovernanceProperties governanceProperties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${neuroshield.governance.keeper.interval-ms:60000}",
            initialDelayString = "${neuroshield.governance.keeper.interval-ms:60000}")
    public void runScheduled() {
        if (!governanceProperties.getKeeper().isEnabled()) {
            return;
        }
        settleExpired();
    }

    /**
     * @return number of proposals this run settled
     */
    public int settleExpired() {
        List<Proposal> expired = proposalRepository.findByStatusAndDeadlineLessThanEqualOrderByIdAsc(
                ProposalStatus.ACTIVE, Instant.now(clock));
        int settled = 0;
        for (Proposal proposal : expired) {
            try {
                ledgerCommandGateway.dispatch(new LedgerCommand.ExecuteProposal(proposal.getId(), KEEPER_CALLER));
                settled++;
            } catch (GovernanceException e) {
                if (e.getError() == GovernanceError.ALREADY_EXECUTED) {
                    log.debug("Proposal {} already settled by another caller", proposal.getId());
                } else {
                    log.warn("Keeper could not settle proposal {}: {} {}", proposal.getId(), e.getError(), e.getMessage());
                }
            } catch (RuntimeException e) {
                log.warn("Keeper failed on proposal {}", proposal.getId(), e);
            }
        }
        if (settled > 0) {
            log.info("Keeper settled {} of {} expired proposals", settled, expired.size());
        }
        return settled;
    }
}
